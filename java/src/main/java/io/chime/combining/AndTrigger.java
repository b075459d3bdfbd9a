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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fires at the earliest instant, at or after {@code now}, that every member trigger accepts for
 * the same previous fire time. The combination is finished as soon as any member is finished.
 *
 * <p>Trigger alias: {@code and}
 *
 * <h2>Rendezvous search</h2>
 *
 * <p>Starting from {@code candidate = now}, every member is asked for its next fire time at the
 * candidate. If any member is finished the result is empty. If all members answer with the same
 * instant, that instant is the result. Otherwise the candidate moves to the latest answer and the
 * members are asked again. Since members treat {@code now} as an inclusive lower bound, the
 * candidate only ever moves forward, and a member that accepts the candidate hands it back
 * unchanged.
 *
 * <p>The search is bounded by {@link #DEFAULT_MAX_ITERATIONS}. Schedules that never line up, or a
 * member that proposes an instant earlier than the candidate so that the search stops moving,
 * raise a {@link io.chime.ErrorKind#RENDEZVOUS_NOT_FOUND} error. That is distinct from an empty
 * result, which only ever means a member has ended its schedule.
 *
 * <p>Example: intervals of 2 and 3 seconds starting at the same instant meet 6 seconds later.
 */
public final class AndTrigger extends CombiningTrigger {
  private static final Logger logger = LoggerFactory.getLogger(AndTrigger.class);

  /** Maximum number of search steps before giving up on a rendezvous. */
  public static final int DEFAULT_MAX_ITERATIONS = 1000;

  /** Registry entry for this trigger type. */
  public static final TriggerType TYPE =
      TriggerType.of("and", AndTrigger.class, AndTrigger::fromState, AndTrigger::fromConfig);

  private final int maxIterations;

  /**
   * Creates an AND combination without jitter.
   *
   * @param triggers the member triggers
   */
  public AndTrigger(List<? extends Trigger> triggers) {
    this(triggers, null);
  }

  /**
   * Creates an AND combination.
   *
   * @param triggers the member triggers
   * @param jitter the jitter bound, or null for none
   */
  public AndTrigger(List<? extends Trigger> triggers, Duration jitter) {
    this(triggers, jitter, defaultJitter());
  }

  /**
   * Creates an AND combination with an explicit jitter strategy.
   *
   * @param triggers the member triggers
   * @param jitter the jitter bound, or null for none
   * @param jitterStrategy how jitter is drawn
   */
  public AndTrigger(List<? extends Trigger> triggers, Duration jitter, Jitter jitterStrategy) {
    this(triggers, jitter, jitterStrategy, DEFAULT_MAX_ITERATIONS);
  }

  /**
   * Creates an AND combination with an explicit jitter strategy and search bound.
   *
   * @param triggers the member triggers
   * @param jitter the jitter bound, or null for none
   * @param jitterStrategy how jitter is drawn
   * @param maxIterations the maximum number of rendezvous search steps
   * @throws IllegalArgumentException if {@code maxIterations} is not positive
   */
  public AndTrigger(
      List<? extends Trigger> triggers, Duration jitter, Jitter jitterStrategy, int maxIterations) {
    super(triggers, jitter, jitterStrategy);
    if (maxIterations < 1) {
      throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
    }
    this.maxIterations = maxIterations;
  }

  /**
   * Creates an AND combination of the given triggers without jitter.
   *
   * @param triggers the member triggers
   * @return a new AND trigger
   */
  public static AndTrigger of(Trigger... triggers) {
    return new AndTrigger(List.of(triggers));
  }

  @Override
  public Optional<ZonedDateTime> nextFireTime(ZonedDateTime previousFireTime, ZonedDateTime now)
      throws TriggerException {
    List<Trigger> triggers = triggers();
    if (triggers.isEmpty()) {
      return Optional.empty();
    }
    if (triggers.size() == 1) {
      return triggers.get(0).nextFireTime(previousFireTime, now).map(t -> applyJitter(t, now));
    }

    ZonedDateTime candidate = now;
    for (int i = 0; i < maxIterations; i++) {
      ZonedDateTime earliest = null;
      ZonedDateTime latest = null;
      for (Trigger trigger : triggers) {
        Optional<ZonedDateTime> next = trigger.nextFireTime(previousFireTime, candidate);
        if (next.isEmpty()) {
          logger.debug("{} finished: {} has no fire time at or after {}", this, trigger, candidate);
          return Optional.empty();
        }
        ZonedDateTime t = next.get();
        if (earliest == null || t.isBefore(earliest)) {
          earliest = t;
        }
        if (latest == null || t.isAfter(latest)) {
          latest = t;
        }
      }

      if (earliest.isEqual(latest)) {
        logger.debug("{} converged on {} after {} iteration(s)", this, latest, i + 1);
        return Optional.of(applyJitter(latest, now));
      }
      if (!latest.isAfter(candidate)) {
        throw TriggerException.rendezvousNotFound(
            String.format(
                "%s stalled at %s: a member proposed %s, earlier than the candidate",
                this, candidate, earliest));
      }
      logger.trace("{} advancing candidate from {} to {}", this, candidate, latest);
      candidate = latest;
    }

    throw TriggerException.rendezvousNotFound(
        String.format(
            "%s found no fire time all %d triggers agree on within %d iterations (last candidate"
                + " %s)",
            this, triggers.size(), maxIterations, candidate));
  }

  /**
   * Returns the maximum number of rendezvous search steps.
   *
   * @return the search bound
   */
  public int maxIterations() {
    return maxIterations;
  }

  @Override
  protected String operator() {
    return "and";
  }

  /**
   * Restores an AND trigger from its serialized state.
   *
   * @param state the serialized state
   * @param registry resolves member type references
   * @return the restored trigger
   * @throws TriggerException if the state is unsupported or malformed
   */
  public static AndTrigger fromState(JsonNode state, TriggerRegistry registry)
      throws TriggerException {
    Restored restored = readState(state, registry, AndTrigger.class);
    return new AndTrigger(restored.triggers(), restored.jitter());
  }

  /**
   * Builds an AND trigger from configuration: {@code {"type": "and", "triggers": [...], "jitter":
   * seconds}}.
   *
   * @param config the configuration node
   * @param context the build in progress, used to build the members
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public static AndTrigger fromConfig(JsonNode config, TriggerConfig context)
      throws TriggerException {
    return new AndTrigger(context.triggers(config.get("triggers")), TriggerConfig.jitter(config));
  }
}
