package io.chime.combining;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chime.Trigger;
import io.chime.TriggerException;
import io.chime.jitter.Jitter;
import io.chime.jitter.UniformJitter;
import io.chime.registry.States;
import io.chime.registry.TriggerRegistry;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Base class for triggers that combine other triggers with a logical operator.
 *
 * <p>Holds an immutable ordered list of member triggers and an optional jitter bound. Member
 * order only affects rendering and serialization, never the combined schedule. Jitter is applied
 * once, to the combined result.
 *
 * <p>Serialized state, version 1:
 *
 * <pre>
 * {"version": 1, "triggers": [[typeReference, innerState], ...], "jitter": seconds | null}
 * </pre>
 */
public abstract class CombiningTrigger implements Trigger {
  /** The highest state version this class reads and the version it writes. */
  public static final int STATE_VERSION = 1;

  private final List<Trigger> triggers;
  private final Duration jitter;
  private final Jitter jitterStrategy;

  /**
   * Creates a combining trigger.
   *
   * @param triggers the member triggers, in display order
   * @param jitter the jitter bound, or null for none
   * @param jitterStrategy how jitter is drawn
   * @throws IllegalArgumentException if the jitter bound is negative or not a whole number of
   *     seconds
   */
  protected CombiningTrigger(
      List<? extends Trigger> triggers, Duration jitter, Jitter jitterStrategy) {
    this.triggers = List.copyOf(Objects.requireNonNull(triggers, "triggers"));
    if (jitter != null && jitter.isNegative()) {
      throw new IllegalArgumentException("Jitter must be non-negative: " + jitter);
    }
    if (jitter != null && jitter.getNano() != 0) {
      throw new IllegalArgumentException("Jitter must be a whole number of seconds: " + jitter);
    }
    this.jitter = jitter;
    this.jitterStrategy = Objects.requireNonNull(jitterStrategy, "jitterStrategy");
  }

  /**
   * Returns the member triggers in display order.
   *
   * @return an unmodifiable list of the members
   */
  public List<Trigger> triggers() {
    return triggers;
  }

  /**
   * Returns the jitter bound, if set.
   *
   * @return the jitter bound
   */
  public Optional<Duration> jitter() {
    return Optional.ofNullable(jitter);
  }

  /**
   * Applies this trigger's jitter to a combined fire time.
   *
   * @param time the combined fire time
   * @param now the current instant
   * @return the jittered fire time, never earlier than {@code now}
   */
  protected ZonedDateTime applyJitter(ZonedDateTime time, ZonedDateTime now) {
    if (jitter == null) {
      return time;
    }
    return jitterStrategy.apply(time, jitter, now);
  }

  /**
   * Returns the operator name used in the compact rendering, such as {@code "and"}.
   *
   * @return the operator name
   */
  protected abstract String operator();

  /** Writes the versioned state; the jitter bound is stored in whole seconds. */
  @Override
  public JsonNode toState() {
    ObjectNode state = States.newState(STATE_VERSION);
    ArrayNode members = state.putArray("triggers");
    for (Trigger trigger : triggers) {
      ArrayNode pair = members.addArray();
      pair.add(TriggerRegistry.typeReference(trigger.getClass()));
      pair.add(trigger.toState());
    }
    if (jitter == null) {
      state.putNull("jitter");
    } else {
      state.put("jitter", jitter.toSeconds());
    }
    return state;
  }

  /**
   * Reads the members and jitter bound from a combining trigger's state. Nothing is constructed
   * until the whole state has been read, so a failure leaves no partial trigger behind.
   *
   * @param state the serialized state
   * @param registry resolves the stored type references
   * @param type the combining trigger class being restored
   * @return the restored members and jitter
   * @throws TriggerException if the version is unsupported, a reference cannot be resolved, or the
   *     state is malformed
   */
  protected static Restored readState(
      JsonNode state, TriggerRegistry registry, Class<? extends CombiningTrigger> type)
      throws TriggerException {
    States.checkVersion(state, STATE_VERSION, type);

    JsonNode members = States.require(state, "triggers");
    if (!members.isArray()) {
      throw TriggerException.invalidState("Field 'triggers' must be an array");
    }
    List<Trigger> triggers = new ArrayList<>(members.size());
    for (JsonNode pair : members) {
      if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isTextual()) {
        throw TriggerException.invalidState(
            "Each entry of 'triggers' must be a [typeReference, state] pair, got: " + pair);
      }
      triggers.add(registry.fromState(pair.get(0).asText(), pair.get(1)));
    }

    return new Restored(triggers, readJitter(state, "jitter"));
  }

  /**
   * Reads a jitter bound given in whole seconds.
   *
   * @param node the state or configuration node
   * @param field the field name
   * @return the jitter bound, or null if absent
   * @throws TriggerException if the value is not a non-negative integer
   */
  protected static Duration readJitter(JsonNode node, String field) throws TriggerException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isIntegralNumber() || !value.canConvertToLong() || value.asLong() < 0) {
      throw TriggerException.invalidState(
          "Field '" + field + "' must be a non-negative number of seconds, got: " + value);
    }
    return Duration.ofSeconds(value.asLong());
  }

  /**
   * Renders as {@code <ClassName([m1, m2][, jitter=N])>} using each member's own diagnostic form.
   */
  @Override
  public String describe() {
    String members = triggers.stream().map(Trigger::describe).collect(Collectors.joining(", "));
    String suffix =
        jitter != null && !jitter.isZero() ? ", jitter=" + jitter.toSeconds() : "";
    return "<" + getClass().getSimpleName() + "([" + members + "]" + suffix + ")>";
  }

  /** Renders as {@code op[t1, t2]}. */
  @Override
  public String toString() {
    return triggers.stream()
        .map(Trigger::toString)
        .collect(Collectors.joining(", ", operator() + "[", "]"));
  }

  /** Returns the jitter used when none is given explicitly. */
  static Jitter defaultJitter() {
    return UniformJitter.threadLocal();
  }

  /**
   * Members and jitter bound read back from serialized state.
   *
   * @param triggers the restored members
   * @param jitter the jitter bound, may be null
   */
  protected record Restored(List<Trigger> triggers, Duration jitter) {}
}
