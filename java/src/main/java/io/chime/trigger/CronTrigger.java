package io.chime.trigger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chime.Trigger;
import io.chime.TriggerException;
import io.chime.config.TriggerConfig;
import io.chime.registry.States;
import io.chime.registry.TriggerType;
import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;
import org.quartz.CronExpression;

/**
 * Fires on the instants matched by a Quartz cron expression in a given time zone, optionally
 * bounded by start and end dates.
 *
 * <p>Cron expressions have second resolution and six or seven fields, for example {@code "0 0/5 *
 * * * ?"} for every five minutes. The next fire time is the first matching instant at or after the
 * latest of {@code now}, just after {@code previousFireTime}, and the start date.
 *
 * <p>Trigger alias: {@code cron}
 */
public final class CronTrigger implements Trigger {
  /** The highest state version this class reads and the version it writes. */
  public static final int STATE_VERSION = 1;

  /** Registry entry for this trigger type. */
  public static final TriggerType TYPE =
      TriggerType.of(
          "cron",
          CronTrigger.class,
          (state, registry) -> fromState(state),
          (config, context) -> fromConfig(config));

  private final CronExpression expression;
  private final ZoneId zone;
  private final ZonedDateTime startDate;
  private final ZonedDateTime endDate;

  private CronTrigger(
      CronExpression expression, ZoneId zone, ZonedDateTime startDate, ZonedDateTime endDate) {
    this.expression = expression;
    this.zone = zone;
    this.startDate = startDate;
    this.endDate = endDate;
  }

  /**
   * Creates a cron trigger evaluated in the given zone.
   *
   * @param expression the Quartz cron expression
   * @param zone the time zone the expression is evaluated in
   * @return a new cron trigger
   * @throws TriggerException if the expression is invalid
   */
  public static CronTrigger of(String expression, ZoneId zone) throws TriggerException {
    Objects.requireNonNull(zone, "zone");
    return new CronTrigger(compile(expression, zone), zone, null, null);
  }

  /**
   * Returns a copy that does not fire before the given instant.
   *
   * @param startDate the earliest fire time, or null for none
   * @return a new cron trigger with the updated start date
   */
  public CronTrigger withStartDate(ZonedDateTime startDate) {
    return new CronTrigger(expression, zone, startDate, endDate);
  }

  /**
   * Returns a copy that stops firing after the given instant.
   *
   * @param endDate the last instant a fire time may fall on, or null for no end
   * @return a new cron trigger with the updated end date
   */
  public CronTrigger withEndDate(ZonedDateTime endDate) {
    return new CronTrigger(expression, zone, startDate, endDate);
  }

  @Override
  public Optional<ZonedDateTime> nextFireTime(ZonedDateTime previousFireTime, ZonedDateTime now) {
    Instant lowerBound = now.toInstant();
    if (previousFireTime != null) {
      Instant following = previousFireTime.toInstant().plusNanos(1);
      if (following.isAfter(lowerBound)) {
        lowerBound = following;
      }
    }
    if (startDate != null && startDate.toInstant().isAfter(lowerBound)) {
      lowerBound = startDate.toInstant();
    }

    // CronExpression answers strictly after a whole second, so probe one second before the
    // lower bound rounded up.
    Instant probe = ceilToSecond(lowerBound).minusSeconds(1);
    Date next = expression.getNextValidTimeAfter(Date.from(probe));
    if (next == null) {
      return Optional.empty();
    }

    ZonedDateTime fireTime = next.toInstant().atZone(zone);
    if (endDate != null && fireTime.isAfter(endDate)) {
      return Optional.empty();
    }
    return Optional.of(fireTime);
  }

  /**
   * Returns the cron expression.
   *
   * @return the expression string
   */
  public String expression() {
    return expression.getCronExpression();
  }

  /**
   * Returns the time zone the expression is evaluated in.
   *
   * @return the zone
   */
  public ZoneId zone() {
    return zone;
  }

  @Override
  public Optional<ZonedDateTime> startDate() {
    return Optional.ofNullable(startDate);
  }

  @Override
  public Optional<ZonedDateTime> endDate() {
    return Optional.ofNullable(endDate);
  }

  @Override
  public JsonNode toState() {
    ObjectNode state = States.newState(STATE_VERSION);
    state.put("expression", expression());
    state.put("timezone", zone.getId());
    States.writeDateTime(state, "start_date", startDate);
    States.writeDateTime(state, "end_date", endDate);
    return state;
  }

  /**
   * Restores a cron trigger from its serialized state.
   *
   * @param state the serialized state
   * @return the restored trigger
   * @throws TriggerException if the state is unsupported or malformed
   */
  public static CronTrigger fromState(JsonNode state) throws TriggerException {
    States.checkVersion(state, STATE_VERSION, CronTrigger.class);
    String text = States.require(state, "expression").asText();
    ZoneId zone;
    try {
      zone = ZoneId.of(States.require(state, "timezone").asText());
    } catch (DateTimeException e) {
      throw TriggerException.invalidState("Invalid time zone in state: " + e.getMessage());
    }
    CronExpression expression;
    try {
      expression = compile(text, zone);
    } catch (TriggerException e) {
      throw TriggerException.invalidState(e.getMessage());
    }
    return new CronTrigger(
        expression,
        zone,
        States.readDateTime(state, "start_date"),
        States.readDateTime(state, "end_date"));
  }

  /**
   * Builds a cron trigger from configuration: {@code {"type": "cron", "expression": "...",
   * "timezone": "UTC", "start_date": ..., "end_date": ...}}. The zone defaults to UTC.
   *
   * @param config the configuration node
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public static CronTrigger fromConfig(JsonNode config) throws TriggerException {
    return of(TriggerConfig.text(config, "expression"), TriggerConfig.zone(config, "timezone"))
        .withStartDate(TriggerConfig.dateTime(config, "start_date"))
        .withEndDate(TriggerConfig.dateTime(config, "end_date"));
  }

  @Override
  public String describe() {
    return String.format(
        "<CronTrigger (expression='%s', timezone='%s'%s%s)>",
        expression(),
        zone.getId(),
        startDate == null ? "" : ", start_date='" + States.formatDateTime(startDate) + "'",
        endDate == null ? "" : ", end_date='" + States.formatDateTime(endDate) + "'");
  }

  @Override
  public String toString() {
    return "cron[" + expression() + "]";
  }

  private static CronExpression compile(String expression, ZoneId zone) throws TriggerException {
    if (expression == null) {
      throw TriggerException.invalidConfig("Cron expression must not be null");
    }
    try {
      CronExpression compiled = new CronExpression(expression);
      compiled.setTimeZone(TimeZone.getTimeZone(zone));
      return compiled;
    } catch (ParseException e) {
      throw TriggerException.invalidConfig(
          "Invalid cron expression '" + expression + "': " + e.getMessage(), e);
    }
  }

  private static Instant ceilToSecond(Instant instant) {
    if (instant.getNano() == 0) {
      return instant;
    }
    return Instant.ofEpochSecond(instant.getEpochSecond() + 1);
  }
}
