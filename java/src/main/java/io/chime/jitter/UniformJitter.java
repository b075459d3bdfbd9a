package io.chime.jitter;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Shifts a fire time by a uniformly distributed offset in {@code [-bound, +bound]}, at millisecond
 * resolution, and clamps the result so it is never earlier than {@code now}.
 *
 * <p>Instances are safe for concurrent use: {@link #threadLocal()} draws from {@link
 * ThreadLocalRandom} and {@link #seeded(long)} from a {@link Random}, which synchronizes
 * internally.
 */
public final class UniformJitter implements Jitter {
  private static final UniformJitter THREAD_LOCAL = new UniformJitter(ThreadLocalRandom::current);

  private final Supplier<? extends Random> random;

  private UniformJitter(Supplier<? extends Random> random) {
    this.random = random;
  }

  /**
   * Returns a jitter drawing from the calling thread's {@link ThreadLocalRandom}.
   *
   * @return the shared thread-local jitter
   */
  public static UniformJitter threadLocal() {
    return THREAD_LOCAL;
  }

  /**
   * Returns a jitter with a reproducible sequence of offsets.
   *
   * @param seed the random seed
   * @return a new seeded jitter
   */
  public static UniformJitter seeded(long seed) {
    return using(new Random(seed));
  }

  /**
   * Returns a jitter drawing from the given random source.
   *
   * @param random the random source
   * @return a new jitter
   */
  public static UniformJitter using(Random random) {
    Objects.requireNonNull(random, "random");
    return new UniformJitter(() -> random);
  }

  @Override
  public ZonedDateTime apply(ZonedDateTime time, Duration bound, ZonedDateTime now) {
    if (bound == null || bound.isZero()) {
      return time;
    }
    if (bound.isNegative()) {
      throw new IllegalArgumentException("Jitter bound must be non-negative: " + bound);
    }

    long boundMillis = bound.toMillis();
    long offset = random.get().nextLong(-boundMillis, boundMillis + 1);
    ZonedDateTime jittered = time.plus(Duration.ofMillis(offset));
    if (jittered.isBefore(now)) {
      return now.withZoneSameInstant(time.getZone());
    }
    return jittered;
  }
}
