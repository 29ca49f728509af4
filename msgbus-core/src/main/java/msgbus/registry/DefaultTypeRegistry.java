package msgbus.registry;

import msgbus.DuplicateTypeException;
import msgbus.TypeNotRegisteredException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe {@link TypeRegistry} backed by two {@link ConcurrentHashMap}s.
 *
 * <p>Lookups are lock-free. Registrations are serialized so that the code and name maps
 * are always updated together.
 *
 * <pre>{@code
 * TypeRegistry types = new DefaultTypeRegistry()
 *     .with(42, "OrderPlaced")
 *     .with(OrderMessages.ORDER_CANCELLED);
 * }</pre>
 */
public final class DefaultTypeRegistry implements TypeRegistry {

  private final Map<Integer, String> namesByCode = new ConcurrentHashMap<>();
  private final Map<String, Integer> codesByName = new ConcurrentHashMap<>();

  /**
   * Registers a type and returns this registry for chaining.
   *
   * @param code the type code
   * @param name the unique type name
   * @return this registry
   */
  public DefaultTypeRegistry with(int code, String name) {
    register(code, name);
    return this;
  }

  /**
   * Registers a type-safe message type and returns this registry for chaining.
   *
   * @param type the message type
   * @return this registry
   */
  public DefaultTypeRegistry with(msgbus.MessageType type) {
    register(type);
    return this;
  }

  @Override
  public synchronized void register(int code, String name) {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Type name cannot be empty");
    }
    String existingName = namesByCode.get(code);
    Integer existingCode = codesByName.get(name);
    if (name.equals(existingName) && existingCode != null && existingCode == code) {
      return;
    }
    if (existingName != null) {
      throw new DuplicateTypeException(code, name,
          "Type code " + code + " is already registered as '" + existingName + "'");
    }
    if (existingCode != null) {
      throw new DuplicateTypeException(code, name,
          "Type name '" + name + "' is already registered with code " + existingCode);
    }
    codesByName.put(name, code);
    namesByCode.put(code, name);
  }

  @Override
  public String lookup(int code) {
    String name = namesByCode.get(code);
    if (name == null) {
      throw new TypeNotRegisteredException(code);
    }
    return name;
  }

  @Override
  public boolean isRegistered(int code) {
    return namesByCode.containsKey(code);
  }

  @Override
  public OptionalInt codeOf(String name) {
    Integer code = codesByName.get(name);
    return code == null ? OptionalInt.empty() : OptionalInt.of(code);
  }

  @Override
  public Map<Integer, String> registeredTypes() {
    return Collections.unmodifiableMap(new TreeMap<>(namesByCode));
  }
}
