package msgbus.registry;

import com.github.f4b6a3.ulid.UlidCreator;
import msgbus.AsyncMessageHandler;
import msgbus.Message;
import msgbus.MessageHandler;
import msgbus.Priority;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntConsumer;
import java.util.function.Predicate;

/**
 * Thread-safe subscription table backed by one {@link CopyOnWriteArrayList} per type.
 *
 * <p>Iteration over {@link #subscribersFor(int)} never blocks writers, so handlers may
 * subscribe or unsubscribe while a message is being delivered.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SubscriptionRegistry subscriptions = new DefaultSubscriptionRegistry();
 * Subscription audit = subscriptions.subscribe(42, msg -> audit.record(msg), null, null);
 * Subscription urgent = subscriptions.subscribe(42, pager::notify, null, Priority.HIGH);
 * ...
 * audit.close();
 * }</pre>
 */
public final class DefaultSubscriptionRegistry implements SubscriptionRegistry {

  private static final String DEFAULT_SCOPE_NAME = "scope";

  private final Map<Integer, CopyOnWriteArrayList<Subscription>> subscriptions =
      new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final AtomicInteger total = new AtomicInteger();
  private final IntConsumer typeValidator;

  public DefaultSubscriptionRegistry() {
    this(code -> { });
  }

  /**
   * @param typeValidator invoked with the type code before every subscription is created;
   *                      throws to reject the subscription
   */
  public DefaultSubscriptionRegistry(IntConsumer typeValidator) {
    this.typeValidator = Objects.requireNonNull(typeValidator, "typeValidator");
  }

  @Override
  public Subscription subscribe(int typeCode, MessageHandler handler, Predicate<Message> filter,
      Priority minPriority) {
    Objects.requireNonNull(handler, "handler");
    return add(null, typeCode, handler, null, filter, minPriority);
  }

  @Override
  public Subscription subscribeAsync(int typeCode, AsyncMessageHandler handler,
      Predicate<Message> filter, Priority minPriority) {
    Objects.requireNonNull(handler, "handler");
    return add(null, typeCode, null, handler, filter, minPriority);
  }

  @Override
  public Subscription subscribeInScope(SubscriptionScope scope, int typeCode,
      MessageHandler handler, Predicate<Message> filter, Priority minPriority) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(handler, "handler");
    return add(scope, typeCode, handler, null, filter, minPriority);
  }

  @Override
  public Subscription subscribeAsyncInScope(SubscriptionScope scope, int typeCode,
      AsyncMessageHandler handler, Predicate<Message> filter, Priority minPriority) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(handler, "handler");
    return add(scope, typeCode, null, handler, filter, minPriority);
  }

  private Subscription add(SubscriptionScope scope, int typeCode, MessageHandler handler,
      AsyncMessageHandler asyncHandler, Predicate<Message> filter, Priority minPriority) {
    typeValidator.accept(typeCode);
    if (scope != null) {
      scope.checkActive();
    }
    Subscription subscription = new Subscription(sequence.incrementAndGet(), typeCode, scope,
        handler, asyncHandler, filter, minPriority, this::unsubscribe);
    subscriptions.computeIfAbsent(typeCode, ignored -> new CopyOnWriteArrayList<>())
        .add(subscription);
    total.incrementAndGet();
    if (scope != null) {
      scope.adopt(subscription);
      // Lost a race with disposeScope; the drain may not have seen this subscription.
      if (!scope.isActive()) {
        unsubscribe(subscription);
        scope.checkActive();
      }
    }
    return subscription;
  }

  @Override
  public boolean unsubscribe(Subscription subscription) {
    if (subscription == null || !subscription.deactivate()) {
      return false;
    }
    CopyOnWriteArrayList<Subscription> list = subscriptions.get(subscription.typeCode());
    if (list != null && list.remove(subscription)) {
      total.decrementAndGet();
    }
    if (subscription.scope() != null) {
      subscription.scope().release(subscription);
    }
    return true;
  }

  @Override
  public SubscriptionScope createScope(String name) {
    return new SubscriptionScope(UlidCreator.getMonotonicUlid().toString(),
        name == null ? DEFAULT_SCOPE_NAME : name, this);
  }

  @Override
  public void disposeScope(SubscriptionScope scope) {
    if (scope == null) {
      return;
    }
    for (Subscription subscription : scope.deactivate()) {
      unsubscribe(subscription);
    }
  }

  @Override
  public List<Subscription> subscribersFor(int typeCode) {
    CopyOnWriteArrayList<Subscription> list = subscriptions.get(typeCode);
    return list == null ? List.of() : List.copyOf(list);
  }

  @Override
  public int subscriberCount(int typeCode) {
    CopyOnWriteArrayList<Subscription> list = subscriptions.get(typeCode);
    return list == null ? 0 : list.size();
  }

  @Override
  public int totalSubscriptions() {
    return total.get();
  }
}
