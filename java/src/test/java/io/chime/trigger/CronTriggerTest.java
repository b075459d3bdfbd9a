package io.chime.trigger;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chime.ErrorKind;
import io.chime.TriggerException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CronTriggerTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final ZonedDateTime T0 = ZonedDateTime.of(2026, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

  private static Optional<ZonedDateTime> next(
      CronTrigger trigger, ZonedDateTime previous, ZonedDateTime now) {
    return trigger.nextFireTime(previous, now).map(t -> t.withZoneSameInstant(ZoneOffset.UTC));
  }

  @Test
  void testMatchingNowIsInclusive() throws TriggerException {
    CronTrigger trigger = CronTrigger.of("0/5 * * * * ?", ZoneOffset.UTC);

    assertEquals(Optional.of(T0), next(trigger, null, T0));
  }

  @Test
  void testSubSecondNowRoundsUp() throws TriggerException {
    CronTrigger trigger = CronTrigger.of("0/5 * * * * ?", ZoneOffset.UTC);

    assertEquals(Optional.of(T0.plusSeconds(5)), next(trigger, null, T0.plusNanos(1)));
    assertEquals(Optional.of(T0.plusSeconds(5)), next(trigger, null, T0.plusSeconds(4)));
  }

  @Test
  void testPreviousFireTimeIsExclusive() throws TriggerException {
    CronTrigger trigger = CronTrigger.of("0/5 * * * * ?", ZoneOffset.UTC);

    assertEquals(Optional.of(T0.plusSeconds(5)), next(trigger, T0, T0));
  }

  @Test
  void testStartAndEndDates() throws TriggerException {
    CronTrigger trigger =
        CronTrigger.of("0/5 * * * * ?", ZoneOffset.UTC)
            .withStartDate(T0.plusSeconds(12))
            .withEndDate(T0.plusSeconds(20));

    assertEquals(Optional.of(T0.plusSeconds(15)), next(trigger, null, T0));
    assertEquals(Optional.of(T0.plusSeconds(20)), next(trigger, T0.plusSeconds(15), T0));
    assertTrue(next(trigger, null, T0.plusSeconds(21)).isEmpty());
  }

  @Test
  void testEvaluatedInZone() throws TriggerException {
    CronTrigger trigger = CronTrigger.of("0 0 9 * * ?", ZoneId.of("America/New_York"));

    Optional<ZonedDateTime> next = trigger.nextFireTime(null, T0);

    assertTrue(next.isPresent());
    assertEquals(ZoneId.of("America/New_York"), next.get().getZone());
    assertEquals(T0.withHour(14), next.get().withZoneSameInstant(ZoneOffset.UTC));
  }

  @Test
  void testNoFutureMatchFinishes() throws TriggerException {
    CronTrigger trigger = CronTrigger.of("0 0 0 1 1 ? 2020", ZoneOffset.UTC);

    assertTrue(trigger.nextFireTime(null, T0).isEmpty());
  }

  @Test
  void testInvalidExpression() {
    TriggerException e =
        assertThrows(TriggerException.class, () -> CronTrigger.of("not a cron", ZoneOffset.UTC));

    assertEquals(ErrorKind.INVALID_CONFIG, e.kind());
  }

  @Test
  void testStateRoundTrip() throws TriggerException {
    CronTrigger trigger =
        CronTrigger.of("0 0/15 * * * ?", ZoneId.of("Europe/Paris"))
            .withStartDate(T0)
            .withEndDate(T0.plusDays(2));

    CronTrigger restored = CronTrigger.fromState(trigger.toState());

    assertEquals("0 0/15 * * * ?", restored.expression());
    assertEquals(ZoneId.of("Europe/Paris"), restored.zone());
    assertEquals(trigger.startDate(), restored.startDate());
    assertEquals(trigger.endDate(), restored.endDate());
    assertEquals(trigger.toState(), restored.toState());
  }

  @Test
  void testStateWithBadExpression() throws TriggerException {
    ObjectNode state = (ObjectNode) CronTrigger.of("0 * * * * ?", ZoneOffset.UTC).toState();
    state.put("expression", "garbage");

    TriggerException e = assertThrows(TriggerException.class, () -> CronTrigger.fromState(state));

    assertEquals(ErrorKind.INVALID_STATE, e.kind());
  }

  @Test
  void testDescribeIncludesDates() throws TriggerException {
    CronTrigger trigger = CronTrigger.of("0 0 * * * ?", ZoneOffset.UTC);

    assertEquals("<CronTrigger (expression='0 0 * * * ?', timezone='Z')>", trigger.describe());
    assertEquals(
        "<CronTrigger (expression='0 0 * * * ?', timezone='Z',"
            + " start_date='2026-01-01T00:00:00Z', end_date='2026-01-02T00:00:00Z')>",
        trigger.withStartDate(T0).withEndDate(T0.plusDays(1)).describe());
  }

  @Test
  void testFromConfigDefaultsToUtc() throws Exception {
    CronTrigger trigger =
        CronTrigger.fromConfig(
            MAPPER.readTree("{\"type\": \"cron\", \"expression\": \"0 * * * * ?\"}"));

    assertEquals(ZoneOffset.UTC, trigger.zone());
    assertEquals("cron[0 * * * * ?]", trigger.toString());
  }

  @Test
  void testFromConfigRequiresExpression() throws Exception {
    TriggerException e =
        assertThrows(
            TriggerException.class,
            () -> CronTrigger.fromConfig(MAPPER.readTree("{\"type\": \"cron\"}")));

    assertEquals(ErrorKind.INVALID_CONFIG, e.kind());
  }
}
