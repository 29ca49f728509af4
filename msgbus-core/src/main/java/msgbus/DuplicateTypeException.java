package msgbus;

/**
 * Thrown when registering a type code or name that is already mapped to a different entry.
 */
public class DuplicateTypeException extends MessageBusException {

  private final int typeCode;
  private final String typeName;

  public DuplicateTypeException(int typeCode, String typeName, String message) {
    super(message);
    this.typeCode = typeCode;
    this.typeName = typeName;
  }

  public int typeCode() {
    return typeCode;
  }

  public String typeName() {
    return typeName;
  }
}
