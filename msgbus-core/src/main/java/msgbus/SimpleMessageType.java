package msgbus;

import java.util.Objects;

/**
 * A value-based {@link MessageType} for dynamic scenarios.
 *
 * <pre>{@code
 * MessageType orderPlaced = SimpleMessageType.of(42, "OrderPlaced");
 * }</pre>
 */
public final class SimpleMessageType implements MessageType {

  private final int code;
  private final String name;

  private SimpleMessageType(int code, String name) {
    this.code = code;
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Message type name cannot be empty");
    }
  }

  /**
   * Creates a message type.
   *
   * @param code the type code
   * @param name the type name
   * @return the message type
   * @throws NullPointerException if name is null
   * @throws IllegalArgumentException if name is empty
   */
  public static SimpleMessageType of(int code, String name) {
    return new SimpleMessageType(code, name);
  }

  @Override
  public int code() {
    return code;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SimpleMessageType)) return false;
    SimpleMessageType that = (SimpleMessageType) o;
    return code == that.code && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return 31 * code + name.hashCode();
  }

  @Override
  public String toString() {
    return name + "(" + code + ")";
  }
}
