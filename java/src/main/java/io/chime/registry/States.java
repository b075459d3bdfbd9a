package io.chime.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chime.TriggerException;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/** Helpers for reading and writing versioned trigger state. */
public final class States {
  /** Name of the version field carried by every state object. */
  public static final String VERSION = "version";

  private States() {}

  /**
   * Creates an empty state object stamped with the given version.
   *
   * @param version the state format version
   * @return a new state object
   */
  public static ObjectNode newState(int version) {
    ObjectNode state = JsonNodeFactory.instance.objectNode();
    state.put(VERSION, version);
    return state;
  }

  /**
   * Checks that the state is an object whose version, defaulting to 1 when absent, is readable.
   *
   * @param state the serialized state
   * @param supported the highest version the caller understands
   * @param type the trigger type being restored
   * @throws TriggerException if the state is not an object or its version is too new
   */
  public static void checkVersion(JsonNode state, int supported, Class<?> type)
      throws TriggerException {
    if (state == null || !state.isObject()) {
      throw TriggerException.invalidState(
          "State for " + type.getSimpleName() + " must be an object, got: " + state);
    }
    JsonNode version = state.get(VERSION);
    if (version == null || version.isNull()) {
      return;
    }
    if (!version.isIntegralNumber()) {
      throw TriggerException.invalidState(
          "State for " + type.getSimpleName() + " has a non-integer version: " + version);
    }
    if (!version.canConvertToLong() || version.asLong() > supported) {
      throw TriggerException.unsupportedVersion(type.getSimpleName(), version.asText(), supported);
    }
  }

  /**
   * Returns a required field of a state object.
   *
   * @param state the serialized state
   * @param field the field name
   * @return the field value
   * @throws TriggerException if the field is missing or null
   */
  public static JsonNode require(JsonNode state, String field) throws TriggerException {
    JsonNode value = state.get(field);
    if (value == null || value.isNull()) {
      throw TriggerException.invalidState("State is missing required field '" + field + "'");
    }
    return value;
  }

  /**
   * Reads an optional date-time field.
   *
   * @param state the serialized state
   * @param field the field name
   * @return the parsed date-time, or null if the field is absent or null
   * @throws TriggerException if the value is not an ISO zoned date-time
   */
  public static ZonedDateTime readDateTime(JsonNode state, String field) throws TriggerException {
    JsonNode value = state.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    try {
      return ZonedDateTime.parse(value.asText());
    } catch (DateTimeParseException e) {
      throw TriggerException.invalidState(
          "Field '" + field + "' is not a zoned date-time: " + value.asText());
    }
  }

  /**
   * Writes a date-time field, or a JSON null when the value is absent.
   *
   * @param state the state object to write to
   * @param field the field name
   * @param value the date-time, may be null
   */
  public static void writeDateTime(ObjectNode state, String field, ZonedDateTime value) {
    if (value == null) {
      state.putNull(field);
    } else {
      state.put(field, formatDateTime(value));
    }
  }

  /**
   * Formats a date-time the way state and diagnostics render it.
   *
   * @param value the date-time
   * @return the ISO zoned rendering
   */
  public static String formatDateTime(ZonedDateTime value) {
    return DateTimeFormatter.ISO_ZONED_DATE_TIME.format(value);
  }
}
