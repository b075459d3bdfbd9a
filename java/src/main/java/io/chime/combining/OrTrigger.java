package io.chime.combining;

import com.fasterxml.jackson.databind.JsonNode;
import io.chime.Trigger;
import io.chime.TriggerException;
import io.chime.config.TriggerConfig;
import io.chime.jitter.Jitter;
import io.chime.registry.TriggerRegistry;
import io.chime.registry.TriggerType;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Fires at the earliest next fire time produced by any member trigger. The combination is
 * finished only when every member is finished.
 *
 * <p>Trigger alias: {@code or}
 *
 * <p>Note: members that depend on the previous fire time, such as {@link
 * io.chime.trigger.IntervalTrigger}, are always passed the previous fire time of the combination,
 * which may have come from a different member. Their schedule may therefore look irregular when
 * viewed on its own.
 */
public final class OrTrigger extends CombiningTrigger {

  /** Registry entry for this trigger type. */
  public static final TriggerType TYPE =
      TriggerType.of("or", OrTrigger.class, OrTrigger::fromState, OrTrigger::fromConfig);

  /**
   * Creates an OR combination without jitter.
   *
   * @param triggers the member triggers
   */
  public OrTrigger(List<? extends Trigger> triggers) {
    this(triggers, null);
  }

  /**
   * Creates an OR combination.
   *
   * @param triggers the member triggers
   * @param jitter the jitter bound, or null for none
   */
  public OrTrigger(List<? extends Trigger> triggers, Duration jitter) {
    this(triggers, jitter, defaultJitter());
  }

  /**
   * Creates an OR combination with an explicit jitter strategy.
   *
   * @param triggers the member triggers
   * @param jitter the jitter bound, or null for none
   * @param jitterStrategy how jitter is drawn
   */
  public OrTrigger(List<? extends Trigger> triggers, Duration jitter, Jitter jitterStrategy) {
    super(triggers, jitter, jitterStrategy);
  }

  /**
   * Creates an OR combination of the given triggers without jitter.
   *
   * @param triggers the member triggers
   * @return a new OR trigger
   */
  public static OrTrigger of(Trigger... triggers) {
    return new OrTrigger(List.of(triggers));
  }

  @Override
  public Optional<ZonedDateTime> nextFireTime(ZonedDateTime previousFireTime, ZonedDateTime now)
      throws TriggerException {
    ZonedDateTime earliest = null;
    for (Trigger trigger : triggers()) {
      Optional<ZonedDateTime> next = trigger.nextFireTime(previousFireTime, now);
      if (next.isPresent() && (earliest == null || next.get().isBefore(earliest))) {
        earliest = next.get();
      }
    }
    if (earliest == null) {
      return Optional.empty();
    }
    return Optional.of(applyJitter(earliest, now));
  }

  @Override
  protected String operator() {
    return "or";
  }

  /**
   * Restores an OR trigger from its serialized state.
   *
   * @param state the serialized state
   * @param registry resolves member type references
   * @return the restored trigger
   * @throws TriggerException if the state is unsupported or malformed
   */
  public static OrTrigger fromState(JsonNode state, TriggerRegistry registry)
      throws TriggerException {
    Restored restored = readState(state, registry, OrTrigger.class);
    return new OrTrigger(restored.triggers(), restored.jitter());
  }

  /**
   * Builds an OR trigger from configuration: {@code {"type": "or", "triggers": [...], "jitter":
   * seconds}}.
   *
   * @param config the configuration node
   * @param context the build in progress, used to build the members
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public static OrTrigger fromConfig(JsonNode config, TriggerConfig context)
      throws TriggerException {
    return new OrTrigger(context.triggers(config.get("triggers")), TriggerConfig.jitter(config));
  }
}
