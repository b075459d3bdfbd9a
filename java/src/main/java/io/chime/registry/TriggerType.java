package io.chime.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.chime.Trigger;
import io.chime.TriggerException;
import io.chime.config.TriggerConfig;

/**
 * Describes a constructible trigger type: its configuration alias, its class, and how to build an
 * instance from serialized state or from configuration.
 */
public interface TriggerType {

  /**
   * Returns the alias used for this type in configuration, such as {@code "and"}.
   *
   * @return the configuration alias
   */
  String alias();

  /**
   * Returns the trigger class this type constructs.
   *
   * @return the trigger class
   */
  Class<? extends Trigger> triggerClass();

  /**
   * Rebuilds a trigger from the state produced by {@link Trigger#toState()}.
   *
   * @param state the serialized state
   * @param registry the registry used to resolve nested trigger types
   * @return the restored trigger
   * @throws TriggerException if the state is unsupported or malformed
   */
  Trigger fromState(JsonNode state, TriggerRegistry registry) throws TriggerException;

  /**
   * Builds a trigger from an alias-keyed configuration node.
   *
   * @param config the configuration node
   * @param context the build in progress, used to build nested triggers
   * @return the configured trigger
   * @throws TriggerException if the configuration is invalid
   */
  Trigger fromConfig(JsonNode config, TriggerConfig context) throws TriggerException;

  /**
   * Returns the stored type reference for this type.
   *
   * @return the fully qualified class name
   */
  default String reference() {
    return TriggerRegistry.typeReference(triggerClass());
  }

  /**
   * Creates a trigger type from factory functions.
   *
   * @param alias the configuration alias
   * @param triggerClass the trigger class
   * @param fromState builds an instance from serialized state
   * @param fromConfig builds an instance from configuration
   * @return a new trigger type
   */
  static TriggerType of(
      String alias,
      Class<? extends Trigger> triggerClass,
      Factory fromState,
      ConfigFactory fromConfig) {
    return new SimpleTriggerType(alias, triggerClass, fromState, fromConfig);
  }

  /** Builds a trigger from serialized state. */
  @FunctionalInterface
  interface Factory {
    Trigger create(JsonNode node, TriggerRegistry registry) throws TriggerException;
  }

  /** Builds a trigger from a configuration node. */
  @FunctionalInterface
  interface ConfigFactory {
    Trigger create(JsonNode node, TriggerConfig context) throws TriggerException;
  }
}
