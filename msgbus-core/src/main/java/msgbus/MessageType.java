package msgbus;

/**
 * Identifies a message payload schema for routing.
 *
 * <p>The numeric {@linkplain #code() code} is the routing key; the {@linkplain #name() name}
 * is a human-readable label that must be unique within a
 * {@linkplain msgbus.registry.TypeRegistry type registry}.
 *
 * <p>Implementations can be enums:
 * <pre>{@code
 * public enum OrderMessages implements MessageType {
 *   ORDER_PLACED(42),
 *   ORDER_CANCELLED(43);
 *
 *   private final int code;
 *
 *   OrderMessages(int code) { this.code = code; }
 *
 *   public int code() { return code; }
 * }
 * }</pre>
 *
 * <p>Or use {@link SimpleMessageType} for types known only at runtime.
 */
public interface MessageType {

  /**
   * Returns the stable numeric type code used for routing.
   *
   * @return the type code
   */
  int code();

  /**
   * Returns the unique type name.
   *
   * @return the type name, never null
   */
  String name();
}
