package io.chime;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * A firing-schedule policy: given the previous fire time and the current instant, computes when
 * the next occurrence should happen.
 *
 * <p>An empty result means the trigger is finished and will never fire again. Implementations
 * must be deterministic for a given pair of inputs and must treat {@code now} as an inclusive
 * lower bound, so that an instant the trigger accepts is returned unchanged when passed as {@code
 * now}. Combinators such as {@link io.chime.combining.AndTrigger} rely on this to probe a
 * candidate instant.
 *
 * <p>Built-in implementations:
 *
 * <ul>
 *   <li>{@link io.chime.trigger.IntervalTrigger} - "every 30 seconds"
 *   <li>{@link io.chime.trigger.CronTrigger} - "0 0/5 * * * ?"
 *   <li>{@link io.chime.trigger.DateTrigger} - once, at a fixed instant
 *   <li>{@link io.chime.combining.AndTrigger} - when all members agree
 *   <li>{@link io.chime.combining.OrTrigger} - whenever any member fires
 * </ul>
 */
public interface Trigger {

  /**
   * Computes the next fire time.
   *
   * @param previousFireTime the previous fire time, or null if the trigger has never fired
   * @param now the current instant
   * @return the next fire time, or empty if the trigger is finished
   * @throws TriggerException if the next fire time cannot be computed
   */
  Optional<ZonedDateTime> nextFireTime(ZonedDateTime previousFireTime, ZonedDateTime now)
      throws TriggerException;

  /**
   * Returns the earliest instant this trigger may fire at, if bounded.
   *
   * @return the start date, or empty if unbounded
   */
  default Optional<ZonedDateTime> startDate() {
    return Optional.empty();
  }

  /**
   * Returns the latest instant this trigger may fire at, if bounded.
   *
   * @return the end date, or empty if unbounded
   */
  default Optional<ZonedDateTime> endDate() {
    return Optional.empty();
  }

  /**
   * Returns the serialized state of this trigger. The state carries a {@code version} field and
   * is read back by the matching {@link io.chime.registry.TriggerType}.
   *
   * @return the state as a JSON tree
   */
  JsonNode toState();

  /**
   * Returns a verbose rendering for diagnostics. {@link #toString()} returns the compact form.
   *
   * @return the diagnostic rendering
   */
  default String describe() {
    return toString();
  }
}
