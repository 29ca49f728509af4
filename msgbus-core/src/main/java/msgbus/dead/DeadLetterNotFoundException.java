package msgbus.dead;

import msgbus.MessageBusException;

/**
 * Thrown when replaying a message id that is not in the dead-letter store.
 */
public class DeadLetterNotFoundException extends MessageBusException {

  private final int typeCode;
  private final String messageId;

  public DeadLetterNotFoundException(int typeCode, String messageId) {
    super("No dead letter with messageId=" + messageId + " for message type " + typeCode);
    this.typeCode = typeCode;
    this.messageId = messageId;
  }

  public int typeCode() {
    return typeCode;
  }

  public String messageId() {
    return messageId;
  }
}
