package io.chime;

import java.util.Optional;

/** Exception thrown when a trigger cannot be evaluated, restored from state, or configured. */
public final class TriggerException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The type reference or alias involved in the error, if any. */
  private final String reference;

  private TriggerException(ErrorKind kind, String message, String reference, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.reference = reference;
  }

  /**
   * Creates an error for state serialized by a newer format.
   *
   * @param typeName the simple name of the trigger type being restored
   * @param version the version found in the state, as written
   * @param supported the highest version this library can read
   * @return a new TriggerException for an unsupported version
   */
  public static TriggerException unsupportedVersion(
      String typeName, String version, int supported) {
    return new TriggerException(
        ErrorKind.UNSUPPORTED_VERSION,
        String.format(
            "Got serialized data for version %s of %s, but only versions up to %d can be handled",
            version, typeName, supported),
        null,
        null);
  }

  /**
   * Creates an error for a type reference or alias that cannot be resolved.
   *
   * @param message the error message
   * @param reference the unresolved reference
   * @return a new TriggerException for a type resolution failure
   */
  public static TriggerException typeResolution(String message, String reference) {
    return new TriggerException(ErrorKind.TYPE_RESOLUTION, message, reference, null);
  }

  /**
   * Creates an error for an AND combination whose triggers never agree.
   *
   * @param message the error message
   * @return a new TriggerException for a failed rendezvous
   */
  public static TriggerException rendezvousNotFound(String message) {
    return new TriggerException(ErrorKind.RENDEZVOUS_NOT_FOUND, message, null, null);
  }

  /**
   * Creates an error for malformed serialized state.
   *
   * @param message the error message
   * @return a new TriggerException for invalid state
   */
  public static TriggerException invalidState(String message) {
    return new TriggerException(ErrorKind.INVALID_STATE, message, null, null);
  }

  /**
   * Creates an error for malformed trigger configuration.
   *
   * @param message the error message
   * @return a new TriggerException for invalid configuration
   */
  public static TriggerException invalidConfig(String message) {
    return new TriggerException(ErrorKind.INVALID_CONFIG, message, null, null);
  }

  /**
   * Creates an error for malformed trigger configuration caused by another exception.
   *
   * @param message the error message
   * @param cause the underlying parse or I/O failure
   * @return a new TriggerException for invalid configuration
   */
  public static TriggerException invalidConfig(String message, Throwable cause) {
    return new TriggerException(ErrorKind.INVALID_CONFIG, message, null, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the type reference or alias that could not be resolved, if available.
   *
   * @return the reference, or empty if not available
   */
  public Optional<String> reference() {
    return Optional.ofNullable(reference);
  }
}
