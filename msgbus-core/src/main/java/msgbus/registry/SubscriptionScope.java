package msgbus.registry;

import msgbus.AsyncMessageHandler;
import msgbus.Message;
import msgbus.MessageHandler;
import msgbus.Priority;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Named group of subscriptions that are cancelled together.
 *
 * <p>Typical use is one scope per plugin or per request-lifetime component:
 *
 * <pre>{@code
 * try (SubscriptionScope scope = bus.createScope("inventory")) {
 *   scope.subscribe(ORDER_PLACED, inventory::reserve);
 *   scope.subscribe(ORDER_CANCELLED, inventory::release);
 *   ...
 * } // both subscriptions are gone here
 * }</pre>
 *
 * <p>Closing a scope is idempotent. Subscribing through a closed scope throws
 * {@link IllegalStateException}.
 */
public final class SubscriptionScope implements AutoCloseable {

  private final String id;
  private final String name;
  private final SubscriptionRegistry registry;
  private final AtomicBoolean active = new AtomicBoolean(true);
  private final Set<Subscription> owned = ConcurrentHashMap.newKeySet();

  SubscriptionScope(String id, String name, SubscriptionRegistry registry) {
    this.id = id;
    this.name = name;
    this.registry = registry;
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public boolean isActive() {
    return active.get();
  }

  /**
   * Returns the number of live subscriptions owned by this scope.
   *
   * @return live subscription count, zero once the scope is closed
   */
  public int subscriptionCount() {
    return owned.size();
  }

  public Subscription subscribe(int typeCode, MessageHandler handler) {
    return registry.subscribeInScope(this, typeCode, handler, null, null);
  }

  public Subscription subscribe(int typeCode, MessageHandler handler,
      Predicate<Message> filter) {
    return registry.subscribeInScope(this, typeCode, handler, filter, null);
  }

  public Subscription subscribe(int typeCode, MessageHandler handler,
      Predicate<Message> filter, Priority minPriority) {
    return registry.subscribeInScope(this, typeCode, handler, filter, minPriority);
  }

  public Subscription subscribe(msgbus.MessageType type, MessageHandler handler) {
    return subscribe(type.code(), handler);
  }

  public Subscription subscribeAsync(int typeCode, AsyncMessageHandler handler) {
    return registry.subscribeAsyncInScope(this, typeCode, handler, null, null);
  }

  public Subscription subscribeAsync(int typeCode, AsyncMessageHandler handler,
      Predicate<Message> filter, Priority minPriority) {
    return registry.subscribeAsyncInScope(this, typeCode, handler, filter, minPriority);
  }

  /** Cancels every subscription created through this scope. */
  @Override
  public void close() {
    registry.disposeScope(this);
  }

  void checkActive() {
    if (!active.get()) {
      throw new IllegalStateException("Subscription scope '" + name + "' (" + id
          + ") has been disposed");
    }
  }

  void adopt(Subscription subscription) {
    owned.add(subscription);
  }

  void release(Subscription subscription) {
    owned.remove(subscription);
  }

  /**
   * Marks the scope inactive and drains its subscriptions. Only the first caller receives
   * a non-empty list.
   */
  List<Subscription> deactivate() {
    if (!active.compareAndSet(true, false)) {
      return List.of();
    }
    List<Subscription> drained = new ArrayList<>(owned);
    owned.clear();
    return drained;
  }

  @Override
  public String toString() {
    return "SubscriptionScope{id=" + id + ", name=" + name + ", active=" + active.get()
        + ", subscriptions=" + owned.size() + '}';
  }
}
