package msgbus;

/**
 * Summary error thrown by {@link MessageBus#publishOrThrow(Message)} when every subscriber
 * attempted for the call failed.
 *
 * <p>Individual failures are attached as suppressed exceptions.
 */
public class PublishFailedException extends MessageBusException {

  private final PublishResult result;

  public PublishFailedException(PublishResult result) {
    super("All " + result.failed() + " subscriber(s) failed for message " + result.messageId());
    this.result = result;
    for (SubscriberHandlerException failure : result.failures()) {
      addSuppressed(failure);
    }
  }

  public PublishResult result() {
    return result;
  }
}
