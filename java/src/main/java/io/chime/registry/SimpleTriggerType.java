package io.chime.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.chime.Trigger;
import io.chime.TriggerException;
import io.chime.config.TriggerConfig;
import java.util.Objects;

/**
 * A {@link TriggerType} backed by factory functions.
 *
 * @param alias the configuration alias
 * @param triggerClass the trigger class
 * @param stateFactory builds an instance from serialized state
 * @param configFactory builds an instance from configuration
 */
record SimpleTriggerType(
    String alias,
    Class<? extends Trigger> triggerClass,
    TriggerType.Factory stateFactory,
    TriggerType.ConfigFactory configFactory)
    implements TriggerType {

  SimpleTriggerType {
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(triggerClass, "triggerClass");
    Objects.requireNonNull(stateFactory, "stateFactory");
    Objects.requireNonNull(configFactory, "configFactory");
  }

  @Override
  public Trigger fromState(JsonNode state, TriggerRegistry registry) throws TriggerException {
    return stateFactory.create(state, registry);
  }

  @Override
  public Trigger fromConfig(JsonNode config, TriggerConfig context) throws TriggerException {
    return configFactory.create(config, context);
  }
}
