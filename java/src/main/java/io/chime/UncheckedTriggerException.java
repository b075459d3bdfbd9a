package io.chime;

import java.util.Objects;

/** Wraps a {@link TriggerException} where a checked exception cannot be thrown, as in streams. */
public final class UncheckedTriggerException extends RuntimeException {

  /**
   * Creates a new unchecked wrapper.
   *
   * @param cause the trigger failure
   */
  public UncheckedTriggerException(TriggerException cause) {
    super(Objects.requireNonNull(cause, "cause").getMessage(), cause);
  }

  @Override
  public synchronized TriggerException getCause() {
    return (TriggerException) super.getCause();
  }
}
