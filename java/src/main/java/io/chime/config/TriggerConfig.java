package io.chime.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chime.Trigger;
import io.chime.TriggerException;
import io.chime.registry.TriggerRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds trigger trees from alias-keyed JSON configuration.
 *
 * <p>Example:
 *
 * <pre>{@code
 * Trigger trigger = TriggerConfig.parse("""
 *     {"type": "and", "jitter": 5, "triggers": [
 *       {"type": "interval", "seconds": 2, "start_date": "2026-01-01T00:00:00Z"},
 *       {"type": "cron", "expression": "0 0/3 * * * ?", "timezone": "UTC"}]}
 *     """);
 * }</pre>
 *
 * <p>Every node carries a {@code type} naming a registered alias. The remaining fields are read by
 * that type's {@link io.chime.registry.TriggerType#fromConfig} and by the field helpers below.
 *
 * <p>An instance is one build in progress. It carries the registry and a clock fixed at the
 * whole second the build started, so every interval without a {@code start_date} in the same
 * configuration shares one grid origin.
 */
public final class TriggerConfig {
  private static final Logger logger = LoggerFactory.getLogger(TriggerConfig.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final TriggerRegistry registry;
  private final Clock clock;

  private TriggerConfig(TriggerRegistry registry, Clock clock) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.clock = clock;
  }

  /**
   * Parses a JSON configuration using the built-in trigger types.
   *
   * @param json the configuration text
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public static Trigger parse(String json) throws TriggerException {
    return parse(json, TriggerRegistry.standard());
  }

  /**
   * Parses a JSON configuration.
   *
   * @param json the configuration text
   * @param registry resolves trigger aliases
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public static Trigger parse(String json, TriggerRegistry registry) throws TriggerException {
    JsonNode config;
    try {
      config = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw TriggerException.invalidConfig(
          "Malformed trigger configuration: " + e.getOriginalMessage(), e);
    }
    return build(config, registry);
  }

  /**
   * Loads a JSON configuration file.
   *
   * @param path the configuration file
   * @param registry resolves trigger aliases
   * @return the configured trigger
   * @throws TriggerException if the file cannot be read or the configuration is invalid
   */
  public static Trigger load(Path path, TriggerRegistry registry) throws TriggerException {
    String json;
    try {
      json = Files.readString(path);
    } catch (IOException e) {
      throw TriggerException.invalidConfig("Cannot read trigger configuration " + path, e);
    }
    logger.debug("Loading trigger configuration from {}", path);
    return parse(json, registry);
  }

  /**
   * Builds a trigger from a configuration node, anchoring default start dates on the system UTC
   * clock.
   *
   * @param config the configuration node
   * @param registry resolves trigger aliases
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public static Trigger build(JsonNode config, TriggerRegistry registry) throws TriggerException {
    return build(config, registry, Clock.systemUTC());
  }

  /**
   * Builds a trigger from a configuration node. The clock is read once and truncated to whole
   * seconds; that instant is the origin of every interval without a {@code start_date}.
   *
   * @param config the configuration node
   * @param registry resolves trigger aliases
   * @param clock supplies the build instant
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public static Trigger build(JsonNode config, TriggerRegistry registry, Clock clock)
      throws TriggerException {
    Instant anchor = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    return new TriggerConfig(registry, Clock.fixed(anchor, ZoneOffset.UTC)).trigger(config);
  }

  /**
   * Returns the registry this build resolves aliases with.
   *
   * @return the registry
   */
  public TriggerRegistry registry() {
    return registry;
  }

  /**
   * Returns the clock fixed at the start of this build.
   *
   * @return the build clock
   */
  public Clock clock() {
    return clock;
  }

  /**
   * Builds one trigger of this configuration.
   *
   * @param config the configuration node
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  public Trigger trigger(JsonNode config) throws TriggerException {
    if (config == null || !config.isObject()) {
      throw TriggerException.invalidConfig(
          "Trigger configuration must be an object, got: " + config);
    }
    String alias = text(config, "type");
    Trigger trigger = registry.forAlias(alias).fromConfig(config, this);
    logger.debug("Configured {} trigger: {}", alias, trigger);
    return trigger;
  }

  /**
   * Builds every trigger of a configuration array.
   *
   * @param configs the array of configuration nodes
   * @return the configured triggers, in order
   * @throws TriggerException if the node is not an array or an element is invalid
   */
  public List<Trigger> triggers(JsonNode configs) throws TriggerException {
    if (configs == null || !configs.isArray()) {
      throw TriggerException.invalidConfig("Field 'triggers' must be an array");
    }
    List<Trigger> triggers = new ArrayList<>(configs.size());
    for (JsonNode config : configs) {
      triggers.add(trigger(config));
    }
    return triggers;
  }

  /**
   * Reads a required text field.
   *
   * @param config the configuration node
   * @param field the field name
   * @return the field text
   * @throws TriggerException if the field is missing or not text
   */
  public static String text(JsonNode config, String field) throws TriggerException {
    JsonNode value = config.get(field);
    if (value == null || !value.isTextual()) {
      throw TriggerException.invalidConfig("Missing or non-text field '" + field + "'");
    }
    return value.asText();
  }

  /**
   * Reads an optional non-negative integer field.
   *
   * @param config the configuration node
   * @param field the field name
   * @return the value, or 0 if absent
   * @throws TriggerException if the value is not a non-negative integer
   */
  public static long number(JsonNode config, String field) throws TriggerException {
    JsonNode value = config.get(field);
    if (value == null || value.isNull()) {
      return 0;
    }
    if (!value.isIntegralNumber() || value.asLong() < 0) {
      throw TriggerException.invalidConfig(
          "Field '" + field + "' must be a non-negative integer, got: " + value);
    }
    return value.asLong();
  }

  /**
   * Reads an optional jitter bound given in whole seconds.
   *
   * @param config the configuration node
   * @return the jitter bound, or null if absent
   * @throws TriggerException if the value is not a non-negative integer
   */
  public static Duration jitter(JsonNode config) throws TriggerException {
    JsonNode value = config.get("jitter");
    if (value == null || value.isNull()) {
      return null;
    }
    return Duration.ofSeconds(number(config, "jitter"));
  }

  /**
   * Reads an optional ISO date-time field. Values without a zone or offset are read as UTC.
   *
   * @param config the configuration node
   * @param field the field name
   * @return the date-time, or null if absent
   * @throws TriggerException if the value is not an ISO date-time
   */
  public static ZonedDateTime dateTime(JsonNode config, String field) throws TriggerException {
    JsonNode value = config.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    String text = value.asText();
    try {
      return ZonedDateTime.parse(text);
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(text).atZone(ZoneOffset.UTC);
      } catch (DateTimeParseException notLocal) {
        throw TriggerException.invalidConfig(
            "Field '" + field + "' is not an ISO date-time: " + text, e);
      }
    }
  }

  /**
   * Reads an optional time zone field, defaulting to UTC.
   *
   * @param config the configuration node
   * @param field the field name
   * @return the zone
   * @throws TriggerException if the value is not a valid zone id
   */
  public static ZoneId zone(JsonNode config, String field) throws TriggerException {
    JsonNode value = config.get(field);
    if (value == null || value.isNull()) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(value.asText());
    } catch (DateTimeException e) {
      throw TriggerException.invalidConfig("Invalid time zone '" + value.asText() + "'", e);
    }
  }
}
