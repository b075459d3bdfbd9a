package io.chime.jitter;

import java.time.Duration;
import java.time.ZonedDateTime;

/** Perturbs a computed fire time by a bounded random offset. */
@FunctionalInterface
public interface Jitter {

  /**
   * Applies jitter to a fire time.
   *
   * @param time the computed fire time
   * @param bound the largest offset in either direction, or null for no jitter
   * @param now the current instant; the result is never earlier than this
   * @return the jittered fire time
   */
  ZonedDateTime apply(ZonedDateTime time, Duration bound, ZonedDateTime now);

  /**
   * Returns a jitter that leaves every fire time unchanged.
   *
   * @return the no-op jitter
   */
  static Jitter none() {
    return (time, bound, now) -> time;
  }
}
