package io.chime;

import io.chime.combining.AndTrigger;
import io.chime.combining.OrTrigger;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Static helpers for combining triggers and walking their fire times.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Trigger trigger = Triggers.and(
 *     IntervalTrigger.of(Duration.ofSeconds(2), start),
 *     IntervalTrigger.of(Duration.ofSeconds(3), start));
 * List<ZonedDateTime> next = Triggers.nextN(trigger, start, 3);
 * }</pre>
 */
public final class Triggers {
  private Triggers() {}

  /**
   * Combines triggers so they fire only when all of them agree.
   *
   * @param triggers the member triggers
   * @return a new AND trigger
   */
  public static AndTrigger and(Trigger... triggers) {
    return AndTrigger.of(triggers);
  }

  /**
   * Combines triggers so they fire whenever any of them would.
   *
   * @param triggers the member triggers
   * @return a new OR trigger
   */
  public static OrTrigger or(Trigger... triggers) {
    return OrTrigger.of(triggers);
  }

  /**
   * Computes the next {@code n} fire times from the given instant, feeding each fire time back as
   * the previous one.
   *
   * @param trigger the trigger
   * @param from the instant to start from (inclusive)
   * @param n the number of fire times to compute
   * @return up to {@code n} fire times; fewer if the trigger finishes
   * @throws TriggerException if a fire time cannot be computed
   */
  public static List<ZonedDateTime> nextN(Trigger trigger, ZonedDateTime from, int n)
      throws TriggerException {
    List<ZonedDateTime> results = new ArrayList<>(n);
    ZonedDateTime previous = null;
    ZonedDateTime now = from;

    for (int i = 0; i < n; i++) {
      Optional<ZonedDateTime> next = trigger.nextFireTime(previous, now);
      if (next.isEmpty()) {
        break;
      }
      results.add(next.get());
      previous = next.get();
      if (previous.isAfter(now)) {
        now = previous;
      }
    }

    return results;
  }

  /**
   * Returns a lazy stream of fire times starting at the given instant, the way a scheduler loop
   * drives a trigger: each fire time is passed back as the previous fire time, and the current
   * instant advances to it. The stream ends when the trigger finishes.
   *
   * <p>A {@link TriggerException} raised while the stream is consumed is rethrown as {@link
   * UncheckedTriggerException}.
   *
   * @param trigger the trigger
   * @param from the instant to start from (inclusive)
   * @return a stream of fire times
   */
  public static Stream<ZonedDateTime> fireTimes(Trigger trigger, ZonedDateTime from) {
    Iterator<ZonedDateTime> iterator =
        new Iterator<>() {
          private ZonedDateTime previous = null;
          private ZonedDateTime now = from;
          private ZonedDateTime next = null;
          private boolean hasNext = false;
          private boolean computed = false;

          private void computeNext() {
            if (!computed) {
              Optional<ZonedDateTime> result;
              try {
                result = trigger.nextFireTime(previous, now);
              } catch (TriggerException e) {
                throw new UncheckedTriggerException(e);
              }
              if (result.isPresent()) {
                next = result.get();
                previous = next;
                if (next.isAfter(now)) {
                  now = next;
                }
                hasNext = true;
              } else {
                hasNext = false;
              }
              computed = true;
            }
          }

          @Override
          public boolean hasNext() {
            computeNext();
            return hasNext;
          }

          @Override
          public ZonedDateTime next() {
            computeNext();
            if (!hasNext) {
              throw new NoSuchElementException();
            }
            computed = false;
            return next;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Returns a lazy stream of fire times where {@code from <= fireTime <= to}.
   *
   * @param trigger the trigger
   * @param from the instant to start from (inclusive)
   * @param to the end of the range (inclusive)
   * @return a stream of fire times in the range
   */
  public static Stream<ZonedDateTime> between(
      Trigger trigger, ZonedDateTime from, ZonedDateTime to) {
    return fireTimes(trigger, from).takeWhile(t -> !t.isAfter(to));
  }
}
