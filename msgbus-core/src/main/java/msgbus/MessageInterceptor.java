package msgbus;

import msgbus.registry.Subscription;

/**
 * Cross-cutting hook around each delivery attempt.
 *
 * <p>Interceptors run around every handler invocation, retries included:
 * <ol>
 *   <li>{@link #beforeDelivery} in registration order</li>
 *   <li>handler execution</li>
 *   <li>{@link #afterDelivery} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDelivery} throws, the attempt fails as if the handler had thrown.
 * {@code afterDelivery} exceptions are logged and ignored.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * MessageBus.builder()
 *     .interceptor(MessageInterceptor.before((message, subscription) ->
 *         MDC.put("correlationId", message.correlationId())))
 *     .interceptor(MessageInterceptor.after((message, subscription, error) -> {
 *         if (error != null) audit.failed(message.messageId(), subscription.id());
 *     }))
 *     .build();
 * }</pre>
 */
public interface MessageInterceptor {

  /**
   * Called before the handler is invoked.
   *
   * @param message      the message about to be delivered
   * @param subscription the receiving subscription
   * @throws Exception to fail the attempt
   */
  default void beforeDelivery(Message message, Subscription subscription) throws Exception {
  }

  /**
   * Called after the handler returned or failed, or after a {@code beforeDelivery} failure.
   *
   * @param message      the delivered message
   * @param subscription the receiving subscription
   * @param error        {@code null} on success, the failure otherwise
   */
  default void afterDelivery(Message message, Subscription subscription, Exception error) {
  }

  /**
   * Creates an interceptor with only a {@code beforeDelivery} hook.
   */
  static MessageInterceptor before(BeforeHook hook) {
    return new MessageInterceptor() {
      @Override
      public void beforeDelivery(Message message, Subscription subscription) throws Exception {
        hook.accept(message, subscription);
      }
    };
  }

  /**
   * Creates an interceptor with only an {@code afterDelivery} hook.
   */
  static MessageInterceptor after(AfterHook hook) {
    return new MessageInterceptor() {
      @Override
      public void afterDelivery(Message message, Subscription subscription, Exception error) {
        hook.accept(message, subscription, error);
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook {
    void accept(Message message, Subscription subscription) throws Exception;
  }

  @FunctionalInterface
  interface AfterHook {
    void accept(Message message, Subscription subscription, Exception error);
  }
}
