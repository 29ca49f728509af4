package msgbus;

/**
 * Failure of a single subscriber's delivery, after all retry attempts.
 *
 * <p>Reported through {@link PublishResult#failures()}; never thrown by
 * {@link MessageBus#publish(Message)}.
 */
public class SubscriberHandlerException extends MessageBusException {

  private final long subscriptionId;
  private final int typeCode;
  private final String messageId;
  private final int attempts;

  public SubscriberHandlerException(long subscriptionId, int typeCode, String messageId,
      int attempts, Throwable cause) {
    super("Subscriber " + subscriptionId + " failed for message " + messageId
        + " (type " + typeCode + ") after " + attempts + " attempt(s)", cause);
    this.subscriptionId = subscriptionId;
    this.typeCode = typeCode;
    this.messageId = messageId;
    this.attempts = attempts;
  }

  public long subscriptionId() {
    return subscriptionId;
  }

  public int typeCode() {
    return typeCode;
  }

  public String messageId() {
    return messageId;
  }

  public int attempts() {
    return attempts;
  }
}
