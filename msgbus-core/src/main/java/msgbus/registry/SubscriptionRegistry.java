package msgbus.registry;

import msgbus.AsyncMessageHandler;
import msgbus.Message;
import msgbus.MessageHandler;
import msgbus.Priority;

import java.util.List;
import java.util.function.Predicate;

/**
 * Per-type ordered table of subscribers with scoped bulk cancellation.
 *
 * <p>The {@code filter} and {@code minPriority} arguments are optional and may be
 * {@code null}.
 *
 * @see DefaultSubscriptionRegistry
 */
public interface SubscriptionRegistry {

  Subscription subscribe(int typeCode, MessageHandler handler, Predicate<Message> filter,
      Priority minPriority);

  Subscription subscribeAsync(int typeCode, AsyncMessageHandler handler,
      Predicate<Message> filter, Priority minPriority);

  /**
   * Subscribes a handler owned by {@code scope}.
   *
   * @throws IllegalStateException if the scope has been disposed
   */
  Subscription subscribeInScope(SubscriptionScope scope, int typeCode, MessageHandler handler,
      Predicate<Message> filter, Priority minPriority);

  /**
   * Subscribes an asynchronous handler owned by {@code scope}.
   *
   * @throws IllegalStateException if the scope has been disposed
   */
  Subscription subscribeAsyncInScope(SubscriptionScope scope, int typeCode,
      AsyncMessageHandler handler, Predicate<Message> filter, Priority minPriority);

  /**
   * Removes a subscription. Unsubscribing an already removed handle is a no-op.
   *
   * @param subscription the handle returned by a {@code subscribe} call
   * @return {@code true} if this call removed the subscription
   */
  boolean unsubscribe(Subscription subscription);

  SubscriptionScope createScope(String name);

  /**
   * Cancels every subscription owned by {@code scope}. Safe to call more than once.
   *
   * @param scope the scope to dispose
   */
  void disposeScope(SubscriptionScope scope);

  /**
   * Returns an immutable snapshot of the live subscriptions for a type, in subscription
   * order. Later subscribe or unsubscribe calls do not affect the returned list.
   *
   * @param typeCode the message type code
   * @return subscriber snapshot, possibly empty
   */
  List<Subscription> subscribersFor(int typeCode);

  int subscriberCount(int typeCode);

  int totalSubscriptions();
}
