package msgbus.registry;

import msgbus.AsyncMessageHandler;
import msgbus.Message;
import msgbus.MessageHandler;
import msgbus.Priority;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Handle for one handler's interest in one message type.
 *
 * <p>Returned by every {@code subscribe} call and passed back to
 * {@link SubscriptionRegistry#unsubscribe(Subscription)}. Closing the handle is idempotent.
 * Exactly one of {@link #handler()} and {@link #asyncHandler()} is non-null.
 */
public final class Subscription implements AutoCloseable {

  private final long id;
  private final int typeCode;
  private final SubscriptionScope scope;
  private final MessageHandler handler;
  private final AsyncMessageHandler asyncHandler;
  private final Predicate<Message> filter;
  private final Priority minPriority;
  private final Consumer<Subscription> canceller;
  private final AtomicBoolean active = new AtomicBoolean(true);
  private volatile boolean enabled = true;

  Subscription(long id, int typeCode, SubscriptionScope scope, MessageHandler handler,
      AsyncMessageHandler asyncHandler, Predicate<Message> filter, Priority minPriority,
      Consumer<Subscription> canceller) {
    if ((handler == null) == (asyncHandler == null)) {
      throw new IllegalArgumentException("Exactly one of handler and asyncHandler is required");
    }
    this.id = id;
    this.typeCode = typeCode;
    this.scope = scope;
    this.handler = handler;
    this.asyncHandler = asyncHandler;
    this.filter = filter;
    this.minPriority = minPriority;
    this.canceller = canceller;
  }

  /**
   * Returns the creation sequence number. Subscribers of a type are delivered in ascending
   * id order.
   *
   * @return the subscription id
   */
  public long id() {
    return id;
  }

  public int typeCode() {
    return typeCode;
  }

  /**
   * Returns the id of the owning scope, or {@code null} for an unscoped subscription.
   *
   * @return the scope id, or {@code null}
   */
  public String scopeId() {
    return scope == null ? null : scope.id();
  }

  public MessageHandler handler() {
    return handler;
  }

  public AsyncMessageHandler asyncHandler() {
    return asyncHandler;
  }

  public boolean isAsync() {
    return asyncHandler != null;
  }

  public Priority minPriority() {
    return minPriority;
  }

  public boolean hasFilter() {
    return filter != null;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Pauses or resumes delivery without removing the subscription. Disabled subscriptions are
   * counted as filtered.
   *
   * @param enabled whether the subscription receives messages
   */
  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  /**
   * Returns {@code false} once the subscription has been unsubscribed or its scope disposed.
   *
   * @return whether the subscription is live
   */
  public boolean isActive() {
    return active.get();
  }

  /**
   * Tests whether {@code message} passes this subscription's enabled flag, priority
   * threshold and filter, in that order.
   *
   * @param message the message being delivered
   * @return {@code true} if the handler should be invoked
   * @throws RuntimeException if the filter predicate throws
   */
  public boolean matches(Message message) {
    if (!enabled) {
      return false;
    }
    if (!message.priority().isAtLeast(minPriority)) {
      return false;
    }
    return filter == null || filter.test(message);
  }

  /** Unsubscribes. Subsequent calls have no effect. */
  @Override
  public void close() {
    canceller.accept(this);
  }

  SubscriptionScope scope() {
    return scope;
  }

  boolean deactivate() {
    return active.compareAndSet(true, false);
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id
        + ", typeCode=" + typeCode
        + (scope == null ? "" : ", scope=" + scope.id())
        + (isAsync() ? ", async" : "")
        + ", active=" + active.get()
        + '}';
  }
}
