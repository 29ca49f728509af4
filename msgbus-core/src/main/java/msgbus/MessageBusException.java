package msgbus;

/**
 * Base class for all exceptions raised by the message bus.
 */
public class MessageBusException extends RuntimeException {

  public MessageBusException(String message) {
    super(message);
  }

  public MessageBusException(String message, Throwable cause) {
    super(message, cause);
  }
}
