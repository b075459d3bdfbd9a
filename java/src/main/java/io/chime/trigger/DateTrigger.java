package io.chime.trigger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chime.Trigger;
import io.chime.TriggerException;
import io.chime.config.TriggerConfig;
import io.chime.registry.States;
import io.chime.registry.TriggerType;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires exactly once, at a fixed instant. Finished once it has fired.
 *
 * <p>Trigger alias: {@code date}
 */
public final class DateTrigger implements Trigger {
  /** The highest state version this class reads and the version it writes. */
  public static final int STATE_VERSION = 1;

  /** Registry entry for this trigger type. */
  public static final TriggerType TYPE =
      TriggerType.of(
          "date",
          DateTrigger.class,
          (state, registry) -> fromState(state),
          (config, context) -> fromConfig(config));

  private final ZonedDateTime runDate;

  /**
   * Creates a one-shot trigger.
   *
   * @param runDate the instant to fire at
   */
  public DateTrigger(ZonedDateTime runDate) {
    this.runDate = Objects.requireNonNull(runDate, "runDate");
  }

  @Override
  public Optional<ZonedDateTime> nextFireTime(ZonedDateTime previousFireTime, ZonedDateTime now) {
    return previousFireTime == null ? Optional.of(runDate) : Optional.empty();
  }

  /**
   * Returns the instant this trigger fires at.
   *
   * @return the run date
   */
  public ZonedDateTime runDate() {
    return runDate;
  }

  @Override
  public JsonNode toState() {
    ObjectNode state = States.newState(STATE_VERSION);
    States.writeDateTime(state, "run_date", runDate);
    return state;
  }

  /**
   * Restores a date trigger from its serialized state.
   *
   * @param state the serialized state
   * @return the restored trigger
   * @throws TriggerException if the state is unsupported or malformed
   */
  public static DateTrigger fromState(JsonNode state) throws TriggerException {
    States.checkVersion(state, STATE_VERSION, DateTrigger.class);
    ZonedDateTime runDate = States.readDateTime(state, "run_date");
    if (runDate == null) {
      throw TriggerException.invalidState("State is missing required field 'run_date'");
    }
    return new DateTrigger(runDate);
  }

  /**
   * Builds a date trigger from configuration: {@code {"type": "date", "run_date": "..."}}.
   *
   * @param config the configuration node
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public static DateTrigger fromConfig(JsonNode config) throws TriggerException {
    ZonedDateTime runDate = TriggerConfig.dateTime(config, "run_date");
    if (runDate == null) {
      throw TriggerException.invalidConfig("Date trigger requires 'run_date'");
    }
    return new DateTrigger(runDate);
  }

  @Override
  public String describe() {
    return "<DateTrigger (run_date='" + States.formatDateTime(runDate) + "')>";
  }

  @Override
  public String toString() {
    return "date[" + States.formatDateTime(runDate) + "]";
  }
}
