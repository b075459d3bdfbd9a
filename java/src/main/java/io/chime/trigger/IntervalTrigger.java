package io.chime.trigger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chime.Trigger;
import io.chime.TriggerException;
import io.chime.config.TriggerConfig;
import io.chime.registry.States;
import io.chime.registry.TriggerType;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires on a fixed grid: {@code startDate + k * interval} for {@code k >= 0}, up to an optional end
 * date.
 *
 * <p>The next fire time is the first grid point at or after the latest of {@code now}, {@code
 * previousFireTime + interval} and the start date.
 *
 * <p>Trigger alias: {@code interval}
 */
public final class IntervalTrigger implements Trigger {
  /** The highest state version this class reads and the version it writes. */
  public static final int STATE_VERSION = 1;

  /** Registry entry for this trigger type. */
  public static final TriggerType TYPE =
      TriggerType.of(
          "interval",
          IntervalTrigger.class,
          (state, registry) -> fromState(state),
          (config, context) -> fromConfig(config, context.clock()));

  private final Duration interval;
  private final ZonedDateTime startDate;
  private final ZonedDateTime endDate;

  private IntervalTrigger(Duration interval, ZonedDateTime startDate, ZonedDateTime endDate) {
    Objects.requireNonNull(interval, "interval");
    Objects.requireNonNull(startDate, "startDate");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Interval must be positive: " + interval);
    }
    if (endDate != null && endDate.isBefore(startDate)) {
      throw new IllegalArgumentException(
          "End date " + endDate + " is before start date " + startDate);
    }
    this.interval = interval;
    this.startDate = startDate;
    this.endDate = endDate;
  }

  /**
   * Creates a trigger firing every {@code interval}, starting one interval after the current whole
   * second of the system UTC clock.
   *
   * @param interval the interval between fire times
   * @return a new interval trigger
   */
  public static IntervalTrigger every(Duration interval) {
    return every(interval, Clock.systemUTC());
  }

  /**
   * Creates a trigger firing every {@code interval}, starting one interval after the clock's
   * current instant truncated to whole seconds. Triggers created from the same clock reading share
   * a grid origin, so they meet at common multiples of their intervals.
   *
   * @param interval the interval between fire times
   * @param clock the clock supplying the current instant
   * @return a new interval trigger
   */
  public static IntervalTrigger every(Duration interval, Clock clock) {
    Objects.requireNonNull(interval, "interval");
    ZonedDateTime origin = ZonedDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    return new IntervalTrigger(interval, origin.plus(interval), null);
  }

  /**
   * Creates a trigger firing every {@code interval} from {@code startDate}.
   *
   * @param interval the interval between fire times
   * @param startDate the first fire time of the grid
   * @return a new interval trigger
   */
  public static IntervalTrigger of(Duration interval, ZonedDateTime startDate) {
    return new IntervalTrigger(interval, startDate, null);
  }

  /**
   * Returns a copy that stops firing after the given instant.
   *
   * @param endDate the last instant a fire time may fall on, or null for no end
   * @return a new interval trigger with the updated end date
   */
  public IntervalTrigger withEndDate(ZonedDateTime endDate) {
    return new IntervalTrigger(interval, startDate, endDate);
  }

  @Override
  public Optional<ZonedDateTime> nextFireTime(ZonedDateTime previousFireTime, ZonedDateTime now) {
    ZonedDateTime lowerBound = now;
    if (previousFireTime != null) {
      ZonedDateTime following = previousFireTime.plus(interval);
      if (following.isAfter(lowerBound)) {
        lowerBound = following;
      }
    }

    ZonedDateTime next = startDate;
    if (lowerBound.isAfter(startDate)) {
      long steps = Duration.between(startDate, lowerBound).dividedBy(interval);
      next = startDate.plus(interval.multipliedBy(steps));
      if (next.isBefore(lowerBound)) {
        next = next.plus(interval);
      }
    }

    if (endDate != null && next.isAfter(endDate)) {
      return Optional.empty();
    }
    return Optional.of(next);
  }

  /**
   * Returns the interval between fire times.
   *
   * @return the interval
   */
  public Duration interval() {
    return interval;
  }

  @Override
  public Optional<ZonedDateTime> startDate() {
    return Optional.of(startDate);
  }

  @Override
  public Optional<ZonedDateTime> endDate() {
    return Optional.ofNullable(endDate);
  }

  @Override
  public JsonNode toState() {
    ObjectNode state = States.newState(STATE_VERSION);
    state.put("interval", interval.getSeconds());
    state.put("interval_nanos", interval.getNano());
    States.writeDateTime(state, "start_date", startDate);
    States.writeDateTime(state, "end_date", endDate);
    return state;
  }

  /**
   * Restores an interval trigger from its serialized state.
   *
   * @param state the serialized state
   * @return the restored trigger
   * @throws TriggerException if the state is unsupported or malformed
   */
  public static IntervalTrigger fromState(JsonNode state) throws TriggerException {
    States.checkVersion(state, STATE_VERSION, IntervalTrigger.class);
    long seconds = States.require(state, "interval").asLong();
    long nanos = state.path("interval_nanos").asLong(0);
    ZonedDateTime start = States.readDateTime(state, "start_date");
    if (start == null) {
      throw TriggerException.invalidState("State is missing required field 'start_date'");
    }
    try {
      return new IntervalTrigger(
          Duration.ofSeconds(seconds, nanos), start, States.readDateTime(state, "end_date"));
    } catch (IllegalArgumentException e) {
      throw TriggerException.invalidState(e.getMessage());
    }
  }

  /**
   * Builds an interval trigger from configuration. The {@code weeks}, {@code days}, {@code hours},
   * {@code minutes} and {@code seconds} fields are summed; {@code start_date} defaults to one
   * interval after the current second of the system UTC clock and {@code end_date} is optional.
   *
   * @param config the configuration node
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public static IntervalTrigger fromConfig(JsonNode config) throws TriggerException {
    return fromConfig(config, Clock.systemUTC());
  }

  /**
   * Builds an interval trigger from configuration, taking the default start date from the given
   * clock as {@link #every(Duration, Clock)} does.
   *
   * @param config the configuration node
   * @param clock supplies the grid origin when {@code start_date} is absent
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public static IntervalTrigger fromConfig(JsonNode config, Clock clock) throws TriggerException {
    Duration interval =
        Duration.ofDays(7 * TriggerConfig.number(config, "weeks"))
            .plusDays(TriggerConfig.number(config, "days"))
            .plusHours(TriggerConfig.number(config, "hours"))
            .plusMinutes(TriggerConfig.number(config, "minutes"))
            .plusSeconds(TriggerConfig.number(config, "seconds"));
    ZonedDateTime start = TriggerConfig.dateTime(config, "start_date");
    try {
      IntervalTrigger trigger = start == null ? every(interval, clock) : of(interval, start);
      return trigger.withEndDate(TriggerConfig.dateTime(config, "end_date"));
    } catch (IllegalArgumentException e) {
      throw TriggerException.invalidConfig(e.getMessage(), e);
    }
  }

  @Override
  public String describe() {
    return String.format(
        "<IntervalTrigger (interval=%s, start_date='%s'%s)>",
        interval,
        States.formatDateTime(startDate),
        endDate == null ? "" : ", end_date='" + States.formatDateTime(endDate) + "'");
  }

  @Override
  public String toString() {
    return "interval[" + interval + "]";
  }
}
