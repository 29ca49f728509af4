package msgbus;

/**
 * Synchronous subscriber callback.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers run inline on the publishing thread for {@link MessageBus#publish(Message)}
 * and on a bus worker thread for {@link MessageBus#publishAsync(Message)}. Subscribers of
 * one message type are invoked in subscription order.
 *
 * <h2>Error Handling</h2>
 * <p>If a handler throws:
 * <ul>
 *   <li>the attempt is recorded against the type's circuit breaker</li>
 *   <li>the delivery is retried according to the type's retry policy</li>
 *   <li>after the last attempt the message is moved to the dead-letter store</li>
 * </ul>
 * <p>A failing handler never prevents delivery to the other subscribers and never
 * propagates to the publisher.
 *
 * @see AsyncMessageHandler
 * @see MessageBus#subscribe(int, MessageHandler)
 */
@FunctionalInterface
public interface MessageHandler {

  /**
   * Processes a message.
   *
   * @param message the published message
   * @throws Exception if processing fails; triggers retry or dead-letter handling
   */
  void onMessage(Message message) throws Exception;
}
