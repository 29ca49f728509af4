package msgbus.registry;

import msgbus.DuplicateTypeException;
import msgbus.MessageType;
import msgbus.TypeNotRegisteredException;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Maps numeric message type codes to unique type names.
 *
 * <p>Registration normally happens at startup; afterwards the registry is read-mostly and
 * lookups must not contend on a lock.
 *
 * @see DefaultTypeRegistry
 */
public interface TypeRegistry {

  /**
   * Registers a type. Registering an identical {@code (code, name)} pair again is a no-op.
   *
   * @param code the type code
   * @param name the unique type name
   * @throws DuplicateTypeException if the code or the name is already mapped to a different entry
   * @throws IllegalArgumentException if the name is empty
   */
  void register(int code, String name);

  /**
   * Registers a type-safe message type.
   *
   * @param type the message type
   * @throws DuplicateTypeException if the code or the name is already mapped to a different entry
   */
  default void register(MessageType type) {
    register(type.code(), type.name());
  }

  /**
   * Returns the name registered for {@code code}.
   *
   * @param code the type code
   * @return the registered name
   * @throws TypeNotRegisteredException if the code is unknown
   */
  String lookup(int code);

  boolean isRegistered(int code);

  /**
   * Reverse lookup by name.
   *
   * @param name the type name
   * @return the type code, or empty if the name is unknown
   */
  OptionalInt codeOf(String name);

  /**
   * Returns an immutable snapshot of all registrations, ordered by code.
   *
   * @return code-to-name snapshot
   */
  Map<Integer, String> registeredTypes();
}
