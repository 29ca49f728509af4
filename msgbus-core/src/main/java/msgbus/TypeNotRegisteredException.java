package msgbus;

/**
 * Thrown when a type code has no entry in the type registry.
 *
 * <p>Recoverable: register the type and retry the call.
 */
public class TypeNotRegisteredException extends MessageBusException {

  private final int typeCode;

  public TypeNotRegisteredException(int typeCode) {
    super("Message type not registered: " + typeCode);
    this.typeCode = typeCode;
  }

  public int typeCode() {
    return typeCode;
  }
}
