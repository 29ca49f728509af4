package msgbus;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous subscriber callback.
 *
 * <p>The returned stage signals completion of the delivery. A stage completed
 * exceptionally (or a handler that throws before returning one) counts as a failed
 * attempt, exactly like a {@link MessageHandler} throwing.
 *
 * <p>{@link MessageBus#publish(Message)} starts asynchronous handlers and does not wait
 * for them; their outcome is recorded in statistics when the stage completes.
 * {@link MessageBus#publishAsync(Message)} awaits each stage before moving on to the
 * next subscriber.
 */
@FunctionalInterface
public interface AsyncMessageHandler {

  /**
   * Starts processing a message.
   *
   * @param message the published message
   * @return a stage completing when processing has finished
   */
  CompletionStage<?> onMessage(Message message);
}
