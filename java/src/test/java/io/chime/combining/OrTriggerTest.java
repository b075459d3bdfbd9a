package io.chime.combining;

import static org.junit.jupiter.api.Assertions.*;

import io.chime.ScriptedTrigger;
import io.chime.Trigger;
import io.chime.TriggerException;
import io.chime.jitter.Jitter;
import io.chime.jitter.UniformJitter;
import io.chime.trigger.DateTrigger;
import io.chime.trigger.IntervalTrigger;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class OrTriggerTest {
  private static final ZonedDateTime T0 = ZonedDateTime.of(2026, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

  @Test
  void testEarliestMemberWins() throws TriggerException {
    OrTrigger or =
        OrTrigger.of(
            ScriptedTrigger.fixed(T0.plusSeconds(5)), ScriptedTrigger.fixed(T0.plusSeconds(2)));

    assertEquals(Optional.of(T0.plusSeconds(2)), or.nextFireTime(null, T0));
  }

  @Test
  void testFinishedMembersAreIgnored() throws TriggerException {
    OrTrigger or =
        OrTrigger.of(ScriptedTrigger.finished(), ScriptedTrigger.fixed(T0.plusSeconds(7)));

    assertEquals(Optional.of(T0.plusSeconds(7)), or.nextFireTime(null, T0));
  }

  @Test
  void testFinishedOnlyWhenAllMembersFinished() throws TriggerException {
    OrTrigger or = OrTrigger.of(ScriptedTrigger.finished(), ScriptedTrigger.finished());

    assertTrue(or.nextFireTime(null, T0).isEmpty());
  }

  @Test
  void testNoMembersNeverFires() throws TriggerException {
    assertTrue(new OrTrigger(List.of()).nextFireTime(null, T0).isEmpty());
  }

  @Test
  void testMembersSeeSamePreviousFireTimeAndNow() throws TriggerException {
    ScriptedTrigger a = ScriptedTrigger.fixed(T0.plusSeconds(5));
    ScriptedTrigger b = ScriptedTrigger.fixed(T0.plusSeconds(9));
    ZonedDateTime previous = T0.minusSeconds(3);

    OrTrigger.of(a, b).nextFireTime(previous, T0);

    assertEquals(List.of(new ScriptedTrigger.Call(previous, T0)), a.calls());
    assertEquals(List.of(new ScriptedTrigger.Call(previous, T0)), b.calls());
  }

  @Test
  void testMinimumOfMixedResults() throws TriggerException {
    List<Trigger> members =
        List.of(
            ScriptedTrigger.fixed(T0.plusMinutes(10)),
            ScriptedTrigger.finished(),
            ScriptedTrigger.fixed(T0.plusMinutes(3)),
            ScriptedTrigger.finished(),
            ScriptedTrigger.fixed(T0.plusMinutes(4)));

    assertEquals(Optional.of(T0.plusMinutes(3)), new OrTrigger(members).nextFireTime(null, T0));
  }

  @Test
  void testPreviousFireTimeMayComeFromAnotherMember() throws TriggerException {
    OrTrigger or =
        OrTrigger.of(
            IntervalTrigger.of(Duration.ofSeconds(4), T0),
            IntervalTrigger.of(Duration.ofSeconds(6), T0));

    assertEquals(Optional.of(T0.plusSeconds(4)), or.nextFireTime(null, T0.plusNanos(1)));
    // The 6 second member is handed the 4 second member's fire time and skips T0+6s.
    assertEquals(
        Optional.of(T0.plusSeconds(8)), or.nextFireTime(T0.plusSeconds(4), T0.plusSeconds(4)));
  }

  @Test
  void testJitterAppliedOnceToMergedResult() throws TriggerException {
    AtomicInteger applied = new AtomicInteger();
    Jitter plusBound =
        (time, bound, now) -> {
          applied.incrementAndGet();
          return time.plus(bound);
        };
    OrTrigger or =
        new OrTrigger(
            List.of(
                ScriptedTrigger.fixed(T0.plusSeconds(5)), ScriptedTrigger.fixed(T0.plusSeconds(2))),
            Duration.ofSeconds(1),
            plusBound);

    assertEquals(Optional.of(T0.plusSeconds(3)), or.nextFireTime(null, T0));
    assertEquals(1, applied.get());
  }

  @Test
  void testJitterNotAppliedWhenFinished() throws TriggerException {
    AtomicInteger applied = new AtomicInteger();
    OrTrigger or =
        new OrTrigger(
            List.of(ScriptedTrigger.finished()),
            Duration.ofSeconds(1),
            (time, bound, now) -> {
              applied.incrementAndGet();
              return time;
            });

    assertTrue(or.nextFireTime(null, T0).isEmpty());
    assertEquals(0, applied.get());
  }

  @Test
  void testJitterNeverEarlierThanNow() throws TriggerException {
    OrTrigger or =
        new OrTrigger(
            List.of(new DateTrigger(T0)), Duration.ofSeconds(30), UniformJitter.seeded(7));

    for (int i = 0; i < 500; i++) {
      ZonedDateTime next = or.nextFireTime(null, T0).orElseThrow();
      assertFalse(next.isBefore(T0), "jittered " + next + " is before " + T0);
      assertFalse(next.isAfter(T0.plusSeconds(30)), "jittered " + next + " exceeds bound");
    }
  }

  @Test
  void testMemberErrorPropagatesUnchanged() {
    TriggerException error = TriggerException.invalidState("boom");
    OrTrigger or = OrTrigger.of(ScriptedTrigger.fixed(T0), ScriptedTrigger.failing(error));

    TriggerException thrown = assertThrows(TriggerException.class, () -> or.nextFireTime(null, T0));
    assertSame(error, thrown);
  }

  @Test
  void testNegativeJitterRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new OrTrigger(List.of(), Duration.ofSeconds(-1)));
  }

  @Test
  void testToString() {
    OrTrigger or =
        OrTrigger.of(
            IntervalTrigger.of(Duration.ofSeconds(2), T0), new DateTrigger(T0.plusDays(1)));

    assertEquals("or[interval[PT2S], date[2026-01-02T00:00:00Z]]", or.toString());
    assertEquals("or[]", new OrTrigger(List.of()).toString());
  }

  @Test
  void testDescribe() {
    OrTrigger or =
        new OrTrigger(List.of(new DateTrigger(T0)), Duration.ofSeconds(5), Jitter.none());

    assertEquals(
        "<OrTrigger([<DateTrigger (run_date='2026-01-01T00:00:00Z')>], jitter=5)>",
        or.describe());
    assertEquals("<OrTrigger([])>", new OrTrigger(List.of()).describe());
  }
}
