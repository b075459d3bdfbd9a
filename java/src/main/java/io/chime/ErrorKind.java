package io.chime;

/** The type of error raised while evaluating, restoring or configuring a trigger. */
public enum ErrorKind {
  /** Serialized state was written by a newer format than this library understands. */
  UNSUPPORTED_VERSION("unsupported_version"),
  /** A stored type reference or config alias does not name a registered trigger type. */
  TYPE_RESOLUTION("type_resolution"),
  /** An AND combination could not find an instant all of its triggers agree on. */
  RENDEZVOUS_NOT_FOUND("rendezvous_not_found"),
  /** Serialized state is missing fields or has the wrong shape. */
  INVALID_STATE("invalid_state"),
  /** Trigger configuration is malformed or names an invalid schedule. */
  INVALID_CONFIG("invalid_config");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
