package io.chime.registry;

import com.fasterxml.jackson.databind.JsonNode;
import io.chime.Trigger;
import io.chime.TriggerException;
import io.chime.combining.AndTrigger;
import io.chime.combining.OrTrigger;
import io.chime.trigger.CronTrigger;
import io.chime.trigger.DateTrigger;
import io.chime.trigger.IntervalTrigger;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps stored type references and configuration aliases to {@link TriggerType}s.
 *
 * <p>This is the only name-keyed lookup in the library. It is consulted when restoring state and
 * when loading configuration; trigger evaluation never goes through it.
 *
 * <p>A type reference is the fully qualified name of the trigger class. Aliases are matched
 * case-insensitively.
 */
public final class TriggerRegistry {
  private static final Logger logger = LoggerFactory.getLogger(TriggerRegistry.class);

  private final Map<String, TriggerType> byReference = new ConcurrentHashMap<>();
  private final Map<String, TriggerType> byAlias = new ConcurrentHashMap<>();

  /** Creates an empty registry. */
  public TriggerRegistry() {}

  /**
   * Creates a registry holding the built-in types: {@code interval}, {@code cron}, {@code date},
   * {@code and} and {@code or}.
   *
   * @return a new registry with the built-in types
   */
  public static TriggerRegistry standard() {
    TriggerRegistry registry = new TriggerRegistry();
    return registry
        .register(IntervalTrigger.TYPE)
        .register(CronTrigger.TYPE)
        .register(DateTrigger.TYPE)
        .register(AndTrigger.TYPE)
        .register(OrTrigger.TYPE);
  }

  /**
   * Returns the type reference stored for a trigger class.
   *
   * @param type the trigger class
   * @return the fully qualified class name
   */
  public static String typeReference(Class<?> type) {
    return type.getName();
  }

  /**
   * Registers a trigger type.
   *
   * @param type the type to register
   * @return this registry
   * @throws IllegalArgumentException if the alias or class is already registered
   */
  public synchronized TriggerRegistry register(TriggerType type) {
    Objects.requireNonNull(type, "type");
    String alias = normalize(type.alias());
    String reference = type.reference();
    if (byAlias.containsKey(alias)) {
      throw new IllegalArgumentException("Trigger alias '" + alias + "' is already registered");
    }
    if (byReference.containsKey(reference)) {
      throw new IllegalArgumentException("Trigger type " + reference + " is already registered");
    }
    byAlias.put(alias, type);
    byReference.put(reference, type);
    logger.debug("Registered trigger type {} as '{}'", reference, alias);
    return this;
  }

  /**
   * Resolves a stored type reference.
   *
   * @param reference the type reference
   * @return the registered type
   * @throws TriggerException if no type is registered under the reference
   */
  public TriggerType resolve(String reference) throws TriggerException {
    TriggerType type = reference == null ? null : byReference.get(reference);
    if (type == null) {
      throw TriggerException.typeResolution(
          "Cannot resolve trigger type reference: " + reference, reference);
    }
    return type;
  }

  /**
   * Resolves a configuration alias such as {@code "and"}.
   *
   * @param alias the alias
   * @return the registered type
   * @throws TriggerException if no type is registered under the alias
   */
  public TriggerType forAlias(String alias) throws TriggerException {
    TriggerType type = alias == null ? null : byAlias.get(normalize(alias));
    if (type == null) {
      throw TriggerException.typeResolution("Unknown trigger alias: " + alias, alias);
    }
    return type;
  }

  /**
   * Returns the type reference for a trigger, checking that its type is registered.
   *
   * @param trigger the trigger
   * @return the type reference
   * @throws TriggerException if the trigger's class is not registered
   */
  public String referenceOf(Trigger trigger) throws TriggerException {
    String reference = typeReference(trigger.getClass());
    if (!byReference.containsKey(reference)) {
      throw TriggerException.typeResolution(
          "Trigger type " + reference + " is not registered", reference);
    }
    return reference;
  }

  /**
   * Restores a trigger from a stored type reference and its inner state.
   *
   * @param reference the type reference
   * @param state the inner state
   * @return the restored trigger
   * @throws TriggerException if the reference cannot be resolved or the state is invalid
   */
  public Trigger fromState(String reference, JsonNode state) throws TriggerException {
    return resolve(reference).fromState(state, this);
  }

  /**
   * Returns the registered types.
   *
   * @return an unmodifiable view of the registered types
   */
  public Collection<TriggerType> types() {
    return List.copyOf(byReference.values());
  }

  private static String normalize(String alias) {
    return alias.trim().toLowerCase(Locale.ROOT);
  }
}
