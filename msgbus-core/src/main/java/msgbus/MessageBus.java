package msgbus;

import msgbus.circuit.CircuitBreakerConfig;
import msgbus.circuit.CircuitBreakerRegistry;
import msgbus.circuit.CircuitBreakerSnapshot;
import msgbus.circuit.CircuitBreakerState;
import msgbus.circuit.CircuitTransition;
import msgbus.dead.DeadLetterStore;
import msgbus.health.HealthAggregator;
import msgbus.health.HealthReport;
import msgbus.health.HealthStatus;
import msgbus.health.HealthThresholds;
import msgbus.health.HealthTransition;
import msgbus.registry.DefaultSubscriptionRegistry;
import msgbus.registry.DefaultTypeRegistry;
import msgbus.registry.Subscription;
import msgbus.registry.SubscriptionRegistry;
import msgbus.registry.SubscriptionScope;
import msgbus.registry.TypeRegistry;
import msgbus.retry.RetryCoordinator;
import msgbus.retry.RetryOutcome;
import msgbus.retry.RetryPolicy;
import msgbus.retry.Sleeper;
import msgbus.spi.MetricNames;
import msgbus.spi.MetricsExporter;
import msgbus.stats.BusStatistics;
import msgbus.stats.StatisticsCollector;
import msgbus.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe bus with per-type circuit breakers, retries and a
 * dead-letter store.
 *
 * <h2>Delivery</h2>
 * <p>A publish call takes a snapshot of the type's subscribers and visits them in
 * subscription order. Each subscriber is isolated: its failure is retried under the type's
 * {@link RetryPolicy}, reported to the type's circuit breaker attempt by attempt, and finally
 * moved to the {@link DeadLetterStore}. Nothing a handler throws reaches the publisher.
 * While the type's circuit is open, delivery is skipped entirely and the call returns a
 * {@link PublishResult.Status#CIRCUIT_OPEN} result.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (MessageBus bus = MessageBus.builder()
 *     .retryPolicy(RetryPolicy.builder().maxAttempts(3).build())
 *     .build()) {
 *   bus.registerType(42, "OrderPlaced");
 *   bus.subscribe(42, message -> inventory.reserve(message.payload(Order.class)));
 *   bus.subscribe(42, pager::notify, null, Priority.HIGH);
 *
 *   PublishResult result = bus.publish(Message.builder(42)
 *       .priority(Priority.CRITICAL)
 *       .payload(order)
 *       .build());
 * }
 * }</pre>
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe. {@link #close()}
 * stops the health scheduler and the owned async executor.
 *
 * @see MessageBus.Builder
 * @see MessageHandler
 * @see AsyncMessageHandler
 */
public final class MessageBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MessageBus.class.getName());

  private final TypeRegistry types;
  private final SubscriptionRegistry subscriptions;
  private final CircuitBreakerRegistry breakers;
  private final RetryCoordinator retry;
  private final DeadLetterStore deadLetters;
  private final StatisticsCollector stats;
  private final HealthAggregator health;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final List<MessageInterceptor> interceptors;
  private final boolean requireRegisteredTypes;
  private final Executor asyncExecutor;
  private final ExecutorService ownedExecutor;
  private final long drainTimeoutMs;
  private volatile boolean closed;

  private MessageBus(Builder builder) {
    this.types = builder.typeRegistry != null ? builder.typeRegistry : new DefaultTypeRegistry();
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.requireRegisteredTypes = builder.requireRegisteredTypes;
    if (builder.asyncThreads < 1) {
      throw new IllegalArgumentException("asyncThreads must be >= 1, got: " + builder.asyncThreads);
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0, got: " + builder.drainTimeoutMs);
    }
    this.drainTimeoutMs = builder.drainTimeoutMs;

    this.subscriptions = new DefaultSubscriptionRegistry(this::checkType);

    CircuitBreakerRegistry.Builder breakerBuilder = CircuitBreakerRegistry.builder()
        .defaultConfig(builder.circuitBreakerConfig)
        .clock(clock)
        .metrics(metrics);
    builder.typeCircuitBreakerConfigs.forEach(breakerBuilder::config);
    this.breakers = breakerBuilder.build();

    RetryCoordinator.Builder retryBuilder = RetryCoordinator.builder()
        .circuitBreakers(breakers)
        .defaultPolicy(builder.retryPolicy)
        .sleeper(builder.sleeper);
    builder.typeRetryPolicies.forEach(retryBuilder::policy);
    this.retry = retryBuilder.build();

    this.deadLetters = new DeadLetterStore(builder.deadLetterCapacity, clock, metrics);
    this.stats = new StatisticsCollector(clock, subscriptions::subscriberCount,
        subscriptions::totalSubscriptions);
    this.health = HealthAggregator.builder()
        .statistics(this::statisticsForHealth)
        .thresholds(builder.healthThresholds)
        .clock(clock)
        .metrics(metrics)
        .interval(builder.healthCheckInterval)
        .build();

    if (builder.asyncExecutor != null) {
      this.asyncExecutor = builder.asyncExecutor;
      this.ownedExecutor = null;
    } else {
      this.ownedExecutor = Executors.newFixedThreadPool(builder.asyncThreads,
          new DaemonThreadFactory("msgbus-async-"));
      this.asyncExecutor = ownedExecutor;
    }
    health.start();
  }

  public static Builder builder() {
    return new Builder();
  }

  // --- types -------------------------------------------------------------------------------

  /**
   * Registers a message type.
   *
   * @param code the type code
   * @param name the unique type name
   * @throws DuplicateTypeException if the code or the name is already mapped differently
   */
  public void registerType(int code, String name) {
    types.register(code, name);
  }

  public void registerType(MessageType type) {
    types.register(type);
  }

  public TypeRegistry types() {
    return types;
  }

  // --- subscriptions -----------------------------------------------------------------------

  public Subscription subscribe(int typeCode, MessageHandler handler) {
    return subscriptions.subscribe(typeCode, handler, null, null);
  }

  public Subscription subscribe(int typeCode, MessageHandler handler,
      Predicate<Message> filter) {
    return subscriptions.subscribe(typeCode, handler, filter, null);
  }

  /**
   * Subscribes a synchronous handler.
   *
   * @param typeCode    the message type code
   * @param handler     the handler
   * @param filter      optional predicate, {@code null} to accept every message
   * @param minPriority optional minimum priority, {@code null} to accept every priority
   * @return the subscription handle
   * @throws TypeNotRegisteredException if registered types are required and the type is unknown
   */
  public Subscription subscribe(int typeCode, MessageHandler handler, Predicate<Message> filter,
      Priority minPriority) {
    return subscriptions.subscribe(typeCode, handler, filter, minPriority);
  }

  public Subscription subscribe(MessageType type, MessageHandler handler) {
    return subscribe(type.code(), handler);
  }

  public Subscription subscribeAsync(int typeCode, AsyncMessageHandler handler) {
    return subscriptions.subscribeAsync(typeCode, handler, null, null);
  }

  public Subscription subscribeAsync(int typeCode, AsyncMessageHandler handler,
      Predicate<Message> filter, Priority minPriority) {
    return subscriptions.subscribeAsync(typeCode, handler, filter, minPriority);
  }

  /**
   * Removes a subscription. Idempotent.
   *
   * @param subscription the handle
   * @return {@code true} if this call removed it
   */
  public boolean unsubscribe(Subscription subscription) {
    return subscriptions.unsubscribe(subscription);
  }

  public SubscriptionScope createScope() {
    return subscriptions.createScope(null);
  }

  public SubscriptionScope createScope(String name) {
    return subscriptions.createScope(name);
  }

  public Subscription subscribeInScope(SubscriptionScope scope, int typeCode,
      MessageHandler handler, Predicate<Message> filter, Priority minPriority) {
    return subscriptions.subscribeInScope(scope, typeCode, handler, filter, minPriority);
  }

  /**
   * Cancels every subscription created through {@code scope}. Safe to call more than once.
   *
   * @param scope the scope
   */
  public void disposeScope(SubscriptionScope scope) {
    subscriptions.disposeScope(scope);
  }

  public int subscriberCount(int typeCode) {
    return subscriptions.subscriberCount(typeCode);
  }

  // --- publishing --------------------------------------------------------------------------

  /**
   * Delivers a message to every current subscriber of its type on the calling thread.
   *
   * <p>Asynchronous subscribers are started but not awaited; they are reported as
   * {@linkplain PublishResult#pending() pending}.
   *
   * @param message the message
   * @return the delivery outcome
   * @throws TypeNotRegisteredException if registered types are required and the type is unknown
   * @throws IllegalStateException      if the bus has been closed
   */
  public PublishResult publish(Message message) {
    return publish(message, CancellationToken.none());
  }

  /**
   * Synchronous publish that stops visiting subscribers once {@code token} is cancelled.
   *
   * @param message the message
   * @param token   cancellation signal, checked between subscribers
   * @return the delivery outcome
   */
  public PublishResult publish(Message message, CancellationToken token) {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(token, "token");
    checkOpen();
    checkType(message.typeCode());
    Route route = route(message);
    if (route.finished != null) {
      return route.finished;
    }
    PublishResult.Builder result = new PublishResult.Builder(message, route.subscribers.size());
    List<Subscription> subscribers = route.subscribers;
    for (int i = 0; i < subscribers.size(); i++) {
      if (token.isCancelled()) {
        cancelRemaining(result, subscribers.size() - i);
        break;
      }
      Subscription subscription = subscribers.get(i);
      if (!accepts(message, subscription, result)) {
        continue;
      }
      if (subscription.isAsync()) {
        startDetached(message, subscription, result);
      } else {
        record(message, subscription, executeTimed(message, subscription), result);
      }
    }
    return result.build();
  }

  public CompletableFuture<PublishResult> publishAsync(Message message) {
    return publishAsync(message, CancellationToken.none());
  }

  /**
   * Delivers a message on the bus's async executor. Subscribers are still visited one at a
   * time in subscription order; asynchronous handlers are awaited before the next subscriber
   * starts. Synchronous handlers run on the executor one attempt at a time, and waits between
   * retries hold no thread.
   *
   * @param message the message
   * @param token   cancellation signal, checked between subscribers
   * @return a future completing with the delivery outcome
   * @throws TypeNotRegisteredException if registered types are required and the type is unknown
   * @throws IllegalStateException      if the bus has been closed
   */
  public CompletableFuture<PublishResult> publishAsync(Message message, CancellationToken token) {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(token, "token");
    checkOpen();
    checkType(message.typeCode());
    return CompletableFuture.supplyAsync(() -> route(message), asyncExecutor)
        .thenComposeAsync(route -> {
          if (route.finished != null) {
            return CompletableFuture.completedFuture(route.finished);
          }
          PublishResult.Builder result =
              new PublishResult.Builder(message, route.subscribers.size());
          return deliverFrom(message, route.subscribers, 0, result, token);
        }, asyncExecutor);
  }

  /**
   * Publishes each message synchronously, in order. All type codes are validated before the
   * first message is published.
   *
   * @param messages the messages
   * @return one result per message, in input order
   * @throws TypeNotRegisteredException if registered types are required and any type is unknown
   */
  public List<PublishResult> publishBatch(List<Message> messages) {
    Objects.requireNonNull(messages, "messages");
    checkOpen();
    for (Message message : messages) {
      Objects.requireNonNull(message, "messages must not contain null");
      checkType(message.typeCode());
    }
    List<PublishResult> results = new ArrayList<>(messages.size());
    for (Message message : messages) {
      results.add(publish(message));
    }
    return Collections.unmodifiableList(results);
  }

  public CompletableFuture<List<PublishResult>> publishBatchAsync(List<Message> messages) {
    return publishBatchAsync(messages, CancellationToken.none());
  }

  /**
   * Publishes each message with {@link #publishAsync(Message, CancellationToken)}, one after
   * the other. All type codes are validated before the first message is published.
   *
   * <p>{@code token} is checked before each message. Messages not yet started when it is
   * cancelled are not published; their results have status
   * {@link PublishResult.Status#CANCELLED} and no subscribers.
   *
   * @param messages the messages
   * @param token    cancellation signal, checked between messages and between subscribers
   * @return a future completing with one result per message, in input order
   * @throws TypeNotRegisteredException if registered types are required and any type is unknown
   * @throws IllegalStateException      if the bus has been closed
   */
  public CompletableFuture<List<PublishResult>> publishBatchAsync(List<Message> messages,
      CancellationToken token) {
    Objects.requireNonNull(messages, "messages");
    Objects.requireNonNull(token, "token");
    checkOpen();
    for (Message message : messages) {
      Objects.requireNonNull(message, "messages must not contain null");
      checkType(message.typeCode());
    }
    List<Message> batch = List.copyOf(messages);
    List<PublishResult> results = Collections.synchronizedList(new ArrayList<>(batch.size()));
    return publishBatchFrom(batch, 0, results, token)
        .thenApply(ignored -> List.copyOf(results));
  }

  private CompletableFuture<Void> publishBatchFrom(List<Message> batch, int index,
      List<PublishResult> results, CancellationToken token) {
    if (index >= batch.size()) {
      return CompletableFuture.completedFuture(null);
    }
    if (token.isCancelled()) {
      for (int i = index; i < batch.size(); i++) {
        results.add(PublishResult.notPublished(batch.get(i)));
      }
      return CompletableFuture.completedFuture(null);
    }
    return publishAsync(batch.get(index), token).thenCompose(result -> {
      results.add(result);
      return publishBatchFrom(batch, index + 1, results, token);
    });
  }

  /**
   * Like {@link #publish(Message)}, but turns an open circuit or a total failure into an
   * exception.
   *
   * @param message the message
   * @return the delivery outcome
   * @throws CircuitOpenException   if delivery was skipped by an open circuit
   * @throws PublishFailedException if every attempted subscriber failed
   */
  public PublishResult publishOrThrow(Message message) {
    PublishResult result = publish(message);
    if (result.status() == PublishResult.Status.CIRCUIT_OPEN) {
      throw new CircuitOpenException(message.typeCode(), breakers.getState(message.typeCode()));
    }
    if (result.allFailed()) {
      throw new PublishFailedException(result);
    }
    return result;
  }

  /**
   * Removes a message from the dead-letter store and publishes it again to all current
   * subscribers.
   *
   * @param typeCode  the message type code
   * @param messageId the dead-lettered message id
   * @return the outcome of the new publish
   * @throws msgbus.dead.DeadLetterNotFoundException if no such entry exists
   */
  public PublishResult replayDeadLetter(int typeCode, String messageId) {
    return publish(deadLetters.replay(typeCode, messageId));
  }

  // --- delivery internals ------------------------------------------------------------------

  private static final class Route {
    final List<Subscription> subscribers;
    final PublishResult finished;

    Route(List<Subscription> subscribers, PublishResult finished) {
      this.subscribers = subscribers;
      this.finished = finished;
    }
  }

  private Route route(Message message) {
    int typeCode = message.typeCode();
    stats.recordPublished(typeCode);
    metrics.recordCounter(MetricNames.PUBLISHED, 1);
    List<Subscription> subscribers = subscriptions.subscribersFor(typeCode);
    if (subscribers.isEmpty()) {
      stats.recordNoSubscribers(typeCode);
      metrics.recordCounter(MetricNames.UNROUTED, 1);
      logger.log(Level.FINE, "No subscribers for messageId={0} type={1}",
          new Object[]{message.messageId(), typeCode});
      return new Route(subscribers, PublishResult.noSubscribers(message));
    }
    if (!breakers.allowsDelivery(typeCode)) {
      stats.recordCircuitRejected(typeCode, subscribers.size());
      metrics.recordCounter(MetricNames.REJECTED, subscribers.size());
      logger.log(Level.FINE, "Circuit open, skipped messageId={0} type={1}",
          new Object[]{message.messageId(), typeCode});
      return new Route(subscribers, PublishResult.circuitOpen(message, subscribers.size()));
    }
    return new Route(subscribers, null);
  }

  private CompletableFuture<PublishResult> deliverFrom(Message message,
      List<Subscription> subscribers, int index, PublishResult.Builder result,
      CancellationToken token) {
    for (int i = index; i < subscribers.size(); i++) {
      if (token.isCancelled()) {
        cancelRemaining(result, subscribers.size() - i);
        break;
      }
      Subscription subscription = subscribers.get(i);
      if (!accepts(message, subscription, result)) {
        continue;
      }
      int next = i + 1;
      return executeAsyncTimed(message, subscription).thenComposeAsync(o -> {
        record(message, subscription, o, result);
        return deliverFrom(message, subscribers, next, result, token);
      }, asyncExecutor);
    }
    return CompletableFuture.completedFuture(result.build());
  }

  private boolean accepts(Message message, Subscription subscription,
      PublishResult.Builder result) {
    boolean matches;
    if (!subscription.isActive()) {
      matches = false;
    } else {
      try {
        matches = subscription.matches(message);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Filter of subscription " + subscription.id()
            + " failed for messageId=" + message.messageId() + "; skipping", e);
        matches = false;
      }
    }
    if (!matches) {
      result.filtered();
      stats.recordFiltered(message.typeCode());
      metrics.recordCounter(MetricNames.FILTERED, 1);
    }
    return matches;
  }

  /** Runs the retry sequence on the calling thread; latency covers the last attempt only. */
  private RetryOutcome executeTimed(Message message, Subscription subscription) {
    long[] lastAttemptMs = {0L};
    RetryOutcome outcome = retry.execute(message.typeCode(), attempt -> {
      long start = clock.millis();
      try {
        invoke(message, subscription);
      } finally {
        lastAttemptMs[0] = clock.millis() - start;
      }
    });
    recordLatency(message, outcome, lastAttemptMs[0]);
    return outcome;
  }

  /**
   * Runs the retry sequence without blocking a thread between attempts. Synchronous handlers
   * run on the async executor one attempt at a time, so a backoff never parks a pool thread.
   */
  private CompletableFuture<RetryOutcome> executeAsyncTimed(Message message,
      Subscription subscription) {
    AtomicLong lastAttemptMs = new AtomicLong();
    RetryCoordinator.AsyncAttempt attempt = subscription.isAsync()
        ? n -> {
          long start = clock.millis();
          return invokeAsync(message, subscription).whenComplete((ignored, error) ->
              lastAttemptMs.set(clock.millis() - start));
        }
        : n -> CompletableFuture.runAsync(() -> {
          long start = clock.millis();
          try {
            invoke(message, subscription);
          } catch (Exception e) {
            throw new CompletionException(e);
          } finally {
            lastAttemptMs.set(clock.millis() - start);
          }
        }, asyncExecutor);
    return retry.executeAsync(message.typeCode(), attempt, asyncExecutor)
        .thenApply(outcome -> {
          recordLatency(message, outcome, lastAttemptMs.get());
          return outcome;
        });
  }

  private void recordLatency(Message message, RetryOutcome outcome, long lastAttemptMs) {
    if (outcome.attempts() > 0) {
      stats.recordLatency(message.typeCode(), lastAttemptMs);
    }
  }

  private void startDetached(Message message, Subscription subscription,
      PublishResult.Builder result) {
    CompletableFuture<RetryOutcome> outcome;
    try {
      outcome = CompletableFuture.supplyAsync(
          () -> executeAsyncTimed(message, subscription), asyncExecutor)
          .thenCompose(stage -> stage);
    } catch (RejectedExecutionException e) {
      fail(message, subscription, e, 0, result);
      return;
    }
    result.pending();
    outcome.whenComplete((o, error) -> {
      if (o != null) {
        record(message, subscription, o, null);
      } else {
        logger.log(Level.SEVERE, "Async delivery of messageId=" + message.messageId()
            + " to subscription " + subscription.id() + " did not complete", error);
      }
    });
  }

  private void invoke(Message message, Subscription subscription) throws Exception {
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDelivery(message, subscription);
        completedBefore = i + 1;
      }
      subscription.handler().onMessage(message);
      runAfterDelivery(message, subscription, null, completedBefore);
    } catch (Exception e) {
      runAfterDelivery(message, subscription, e, completedBefore);
      throw e;
    }
  }

  private CompletionStage<?> invokeAsync(Message message, Subscription subscription) {
    int completedBefore = 0;
    CompletionStage<?> stage;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDelivery(message, subscription);
        completedBefore = i + 1;
      }
      stage = Objects.requireNonNull(subscription.asyncHandler().onMessage(message),
          "async handler returned null");
    } catch (Exception e) {
      runAfterDelivery(message, subscription, e, completedBefore);
      return CompletableFuture.failedFuture(e);
    }
    int before = completedBefore;
    return stage.whenComplete((ignored, error) ->
        runAfterDelivery(message, subscription, asException(error), before));
  }

  private void runAfterDelivery(Message message, Subscription subscription, Exception error,
      int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDelivery(message, subscription, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDelivery failed", ex);
      }
    }
  }

  /** Records one subscriber's outcome; {@code result} is {@code null} for detached deliveries. */
  private void record(Message message, Subscription subscription, RetryOutcome outcome,
      PublishResult.Builder result) {
    int typeCode = message.typeCode();
    int retries = Math.max(0, outcome.attempts() - 1);
    if (retries > 0) {
      stats.recordRetries(typeCode, retries);
      metrics.recordCounter(MetricNames.RETRIES, retries);
    }
    if (outcome instanceof RetryOutcome.Succeeded) {
      stats.recordDelivered(typeCode);
      metrics.recordCounter(MetricNames.DELIVERED, 1);
      if (result != null) {
        result.delivered();
      }
    } else if (outcome instanceof RetryOutcome.RetriesExhausted exhausted) {
      fail(message, subscription, exhausted.lastError(), exhausted.attempts(), result);
    } else if (outcome instanceof RetryOutcome.Rejected rejected) {
      if (rejected.attempts() > 0) {
        fail(message, subscription, rejected.lastError(), rejected.attempts(), result);
      } else {
        stats.recordCircuitRejected(typeCode, 1);
        metrics.recordCounter(MetricNames.REJECTED, 1);
        if (result != null) {
          result.rejected();
        }
      }
    }
  }

  private void fail(Message message, Subscription subscription, Throwable error, int attempts,
      PublishResult.Builder result) {
    int typeCode = message.typeCode();
    stats.recordFailed(typeCode);
    metrics.recordCounter(MetricNames.FAILED, 1);
    SubscriberHandlerException failure = new SubscriberHandlerException(subscription.id(),
        typeCode, message.messageId(), attempts, error);
    logger.log(Level.WARNING, failure.getMessage() + correlation(message), error);
    deadLetters.add(typeCode, message, subscription.id(), error, attempts);
    stats.recordDeadLettered(typeCode);
    if (result != null) {
      result.failed(failure);
    }
  }

  private static void cancelRemaining(PublishResult.Builder result, int remaining) {
    for (int i = 0; i < remaining; i++) {
      result.cancelled();
    }
  }

  private static Exception asException(Throwable error) {
    if (error == null) {
      return null;
    }
    Throwable cause = error instanceof CompletionException && error.getCause() != null
        ? error.getCause() : error;
    return cause instanceof Exception ? (Exception) cause : new CompletionException(cause);
  }

  private static String correlation(Message message) {
    return message.correlationId() == null ? "" : " correlationId=" + message.correlationId();
  }

  private void checkType(int typeCode) {
    if (requireRegisteredTypes && !types.isRegistered(typeCode)) {
      throw new TypeNotRegisteredException(typeCode);
    }
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("MessageBus has been closed");
    }
  }

  // --- reliability and observability -------------------------------------------------------

  public BusStatistics statistics() {
    return stats.snapshot();
  }

  /**
   * Zeroes all delivery counters and restarts the health window from the cleared state.
   * Subscriptions, circuit breakers and dead letters are left untouched.
   */
  public void clearStatistics() {
    checkOpen();
    health.resetWindow(stats::reset);
    logger.info("Cleared message bus statistics");
  }

  private BusStatistics statisticsForHealth() {
    BusStatistics snapshot = stats.snapshot();
    metrics.recordGauge(MetricNames.ACTIVE_SUBSCRIPTIONS, snapshot.activeSubscriptions());
    return snapshot;
  }

  /**
   * Returns the status of the most recent health evaluation without evaluating again.
   *
   * @return the current health status
   */
  public HealthStatus healthStatus() {
    return health.currentStatus();
  }

  public HealthReport healthReport() {
    return health.lastReport();
  }

  /**
   * Evaluates health over the activity since the previous evaluation.
   *
   * @return the new status
   */
  public HealthStatus checkHealth() {
    return health.checkHealth();
  }

  public CircuitBreakerState circuitState(int typeCode) {
    return breakers.getState(typeCode);
  }

  public Map<Integer, CircuitBreakerSnapshot> circuitBreakers() {
    return breakers.snapshot();
  }

  public void resetCircuit(int typeCode) {
    breakers.reset(typeCode);
  }

  public DeadLetterStore deadLetters() {
    return deadLetters;
  }

  /**
   * Registers a circuit transition listener. Listeners run on the thread that caused the
   * transition.
   *
   * @param listener the callback
   * @return a handle that removes the listener when run
   */
  public Runnable onCircuitTransition(Consumer<? super CircuitTransition> listener) {
    return breakers.onTransition(listener);
  }

  /**
   * Registers a health transition listener.
   *
   * @param listener the callback
   * @return a handle that removes the listener when run
   */
  public Runnable onHealthTransition(Consumer<? super HealthTransition> listener) {
    return health.onTransition(listener);
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Stops accepting publishes, stops the health scheduler and shuts down the owned async
   * executor, waiting up to the drain timeout for running deliveries.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
    }
    health.close();
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdown();
    try {
      if (!ownedExecutor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing async executor shutdown");
        ownedExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      ownedExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link MessageBus}. */
  public static final class Builder {
    private TypeRegistry typeRegistry;
    private Clock clock = Clock.systemUTC();
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy = RetryPolicy.defaults();
    private final Map<Integer, RetryPolicy> typeRetryPolicies = new HashMap<>();
    private CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.defaults();
    private final Map<Integer, CircuitBreakerConfig> typeCircuitBreakerConfigs = new HashMap<>();
    private int deadLetterCapacity = DeadLetterStore.DEFAULT_CAPACITY_PER_TYPE;
    private HealthThresholds healthThresholds = HealthThresholds.defaults();
    private Duration healthCheckInterval = Duration.ofSeconds(30);
    private Executor asyncExecutor;
    private int asyncThreads = 4;
    private long drainTimeoutMs = 5000;
    private Sleeper sleeper = Sleeper.THREAD;
    private final List<MessageInterceptor> interceptors = new ArrayList<>();
    private boolean requireRegisteredTypes = true;

    private Builder() {
    }

    /**
     * Sets the type registry.
     *
     * <p>Optional. Defaults to an empty {@link DefaultTypeRegistry}.
     *
     * @param typeRegistry the type registry
     * @return this builder
     */
    public Builder typeRegistry(TypeRegistry typeRegistry) {
      this.typeRegistry = typeRegistry;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the retry policy for types without a specific one.
     *
     * <p>Optional. Defaults to {@link RetryPolicy#defaults()}: 3 attempts, 200 ms initial
     * delay, multiplier 2, 60 s cap.
     *
     * @param retryPolicy the default policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
      return this;
    }

    public Builder retryPolicy(int typeCode, RetryPolicy retryPolicy) {
      typeRetryPolicies.put(typeCode, Objects.requireNonNull(retryPolicy, "retryPolicy"));
      return this;
    }

    public Builder circuitBreakerConfig(CircuitBreakerConfig config) {
      this.circuitBreakerConfig = Objects.requireNonNull(config, "config");
      return this;
    }

    public Builder circuitBreakerConfig(int typeCode, CircuitBreakerConfig config) {
      typeCircuitBreakerConfigs.put(typeCode, Objects.requireNonNull(config, "config"));
      return this;
    }

    /**
     * Sets the dead-letter capacity per message type.
     *
     * <p>Optional. Defaults to {@code 1000}.
     *
     * @param deadLetterCapacity maximum entries per type
     * @return this builder
     */
    public Builder deadLetterCapacity(int deadLetterCapacity) {
      this.deadLetterCapacity = deadLetterCapacity;
      return this;
    }

    public Builder healthThresholds(HealthThresholds healthThresholds) {
      this.healthThresholds = Objects.requireNonNull(healthThresholds, "healthThresholds");
      return this;
    }

    /**
     * Sets the period of the background health evaluation.
     *
     * <p>Optional. Defaults to 30 seconds. {@link Duration#ZERO} disables the scheduler;
     * {@link MessageBus#checkHealth()} still works on demand.
     *
     * @param healthCheckInterval evaluation period
     * @return this builder
     */
    public Builder healthCheckInterval(Duration healthCheckInterval) {
      this.healthCheckInterval = Objects.requireNonNull(healthCheckInterval, "healthCheckInterval");
      return this;
    }

    /**
     * Sets an externally managed executor for async publishes, async handlers and retry
     * continuations. The bus does not shut it down.
     *
     * <p>Optional. By default the bus owns a fixed pool of {@link #asyncThreads} daemon threads.
     *
     * @param asyncExecutor the executor
     * @return this builder
     */
    public Builder asyncExecutor(Executor asyncExecutor) {
      this.asyncExecutor = asyncExecutor;
      return this;
    }

    public Builder asyncThreads(int asyncThreads) {
      this.asyncThreads = asyncThreads;
      return this;
    }

    /**
     * Sets how long {@link MessageBus#close()} waits for running async deliveries.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the blocking wait between synchronous retry attempts.
     *
     * <p>Optional. Defaults to {@link Sleeper#THREAD}.
     *
     * @param sleeper the wait strategy
     * @return this builder
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
      return this;
    }

    /**
     * Appends a delivery interceptor.
     *
     * <p>Optional. Interceptors are invoked in registration order before delivery, and in
     * reverse order after delivery.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(MessageInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<MessageInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    /**
     * Controls whether publishing or subscribing to an unregistered type code is rejected.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param requireRegisteredTypes whether type codes must be registered
     * @return this builder
     */
    public Builder requireRegisteredTypes(boolean requireRegisteredTypes) {
      this.requireRegisteredTypes = requireRegisteredTypes;
      return this;
    }

    /**
     * Builds the bus and starts its health scheduler.
     *
     * @return a new bus
     * @throws IllegalArgumentException if any setting is invalid
     */
    public MessageBus build() {
      return new MessageBus(this);
    }
  }
}
