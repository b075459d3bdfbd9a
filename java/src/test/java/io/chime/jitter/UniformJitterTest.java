package io.chime.jitter;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class UniformJitterTest {
  private static final ZonedDateTime T0 = ZonedDateTime.of(2026, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

  @Test
  void testNoBoundLeavesTimeUnchanged() {
    UniformJitter jitter = UniformJitter.seeded(1);

    assertSame(T0, jitter.apply(T0, null, T0.minusHours(1)));
    assertSame(T0, jitter.apply(T0, Duration.ZERO, T0.minusHours(1)));
  }

  @Test
  void testNegativeBoundRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> UniformJitter.seeded(1).apply(T0, Duration.ofSeconds(-1), T0));
  }

  @Test
  void testOffsetStaysWithinBound() {
    UniformJitter jitter = UniformJitter.seeded(42);
    Duration bound = Duration.ofSeconds(10);
    ZonedDateTime now = T0.minusHours(1);
    boolean sawEarlier = false;
    boolean sawLater = false;

    for (int i = 0; i < 1000; i++) {
      ZonedDateTime jittered = jitter.apply(T0, bound, now);
      assertFalse(jittered.isBefore(T0.minus(bound)), jittered.toString());
      assertFalse(jittered.isAfter(T0.plus(bound)), jittered.toString());
      sawEarlier |= jittered.isBefore(T0);
      sawLater |= jittered.isAfter(T0);
    }

    assertTrue(sawEarlier);
    assertTrue(sawLater);
  }

  @Test
  void testNeverEarlierThanNow() {
    UniformJitter jitter = UniformJitter.threadLocal();

    for (long seconds : new long[] {0, 1, 5, 60, 3600}) {
      Duration bound = Duration.ofSeconds(seconds);
      for (int i = 0; i < 500; i++) {
        ZonedDateTime jittered = jitter.apply(T0, bound, T0);
        assertFalse(jittered.isBefore(T0), "bound " + bound + " gave " + jittered);
      }
    }
  }

  @Test
  void testClampKeepsZoneOfFireTime() {
    ZonedDateTime now = T0.withZoneSameInstant(ZoneOffset.ofHours(9));

    for (int i = 0; i < 100; i++) {
      ZonedDateTime jittered = UniformJitter.threadLocal().apply(T0, Duration.ofSeconds(5), now);
      assertEquals(ZoneOffset.UTC, jittered.getZone());
    }
  }

  @Test
  void testSeededSequenceIsReproducible() {
    UniformJitter first = UniformJitter.seeded(99);
    UniformJitter second = UniformJitter.seeded(99);
    List<ZonedDateTime> a = new ArrayList<>();
    List<ZonedDateTime> b = new ArrayList<>();

    for (int i = 0; i < 20; i++) {
      a.add(first.apply(T0, Duration.ofMinutes(1), T0.minusHours(1)));
      b.add(second.apply(T0, Duration.ofMinutes(1), T0.minusHours(1)));
    }

    assertEquals(a, b);
  }

  @Test
  void testNoneJitter() {
    assertSame(T0, Jitter.none().apply(T0, Duration.ofHours(1), T0.minusDays(1)));
  }
}
