package msgbus.dead;

import msgbus.Message;
import msgbus.spi.MetricNames;
import msgbus.spi.MetricsExporter;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded in-memory store of permanently failed deliveries, partitioned by message type.
 *
 * <p>Each type holds at most {@code capacityPerType} entries; adding to a full type evicts
 * its oldest entry. A message that failed for several subscribers has one entry per
 * subscriber, and {@link #replay(int, String)} removes all of them.
 *
 * <p>Each type's bucket is guarded by its own lock. Nothing survives a restart.
 */
public final class DeadLetterStore {
  private static final Logger logger = Logger.getLogger(DeadLetterStore.class.getName());

  public static final int DEFAULT_CAPACITY_PER_TYPE = 1000;

  private final int capacityPerType;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final Map<Integer, Deque<FailedMessage>> buckets = new ConcurrentHashMap<>();
  private final AtomicLong totalSize = new AtomicLong();
  private final AtomicLong evicted = new AtomicLong();

  public DeadLetterStore() {
    this(DEFAULT_CAPACITY_PER_TYPE, Clock.systemUTC(), MetricsExporter.NOOP);
  }

  /**
   * @param capacityPerType maximum entries kept per message type
   * @param clock           source of {@link FailedMessage#failedAt()}
   * @param metrics         metrics exporter, or {@code null} for none
   */
  public DeadLetterStore(int capacityPerType, Clock clock, MetricsExporter metrics) {
    if (capacityPerType < 1) {
      throw new IllegalArgumentException("capacityPerType must be >= 1, got: " + capacityPerType);
    }
    this.capacityPerType = capacityPerType;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  public int capacityPerType() {
    return capacityPerType;
  }

  public FailedMessage add(int typeCode, Message message, Throwable error, int attemptCount) {
    return add(typeCode, message, 0L, error, attemptCount);
  }

  /**
   * Records a permanently failed delivery.
   *
   * @param typeCode       the message type code
   * @param message        the original message
   * @param subscriptionId the failing subscription, or {@code 0}
   * @param error          the last failure, may be {@code null}
   * @param attemptCount   attempts made
   * @return the stored entry
   */
  public FailedMessage add(int typeCode, Message message, long subscriptionId, Throwable error,
      int attemptCount) {
    Objects.requireNonNull(message, "message");
    FailedMessage entry = new FailedMessage(message, subscriptionId, describe(error),
        error == null ? null : error.getClass().getName(), attemptCount, clock.instant());
    Deque<FailedMessage> bucket = bucket(typeCode);
    FailedMessage dropped = null;
    synchronized (bucket) {
      if (bucket.size() >= capacityPerType) {
        dropped = bucket.pollFirst();
      }
      bucket.addLast(entry);
    }
    if (dropped == null) {
      totalSize.incrementAndGet();
    } else {
      evicted.incrementAndGet();
      metrics.recordCounter(MetricNames.DEAD_LETTER_EVICTED, 1);
      logger.log(Level.FINE, "Dead-letter store full for type {0}; evicted messageId={1}",
          new Object[]{typeCode, dropped.messageId()});
    }
    metrics.recordCounter(MetricNames.DEAD_LETTERED, 1);
    metrics.recordGauge(MetricNames.DEAD_LETTER_SIZE, totalSize.get());
    logger.log(Level.INFO, "Dead-lettered messageId={0} type={1} subscription={2}"
            + " after {3} attempt(s){4}: {5}",
        new Object[]{message.messageId(), typeCode, subscriptionId, attemptCount,
            correlationSuffix(message), entry.error()});
    return entry;
  }

  /**
   * Lists entries for one type, newest first.
   *
   * @param typeCode the message type code
   * @param limit    maximum entries to return
   * @return up to {@code limit} entries
   */
  public List<FailedMessage> list(int typeCode, int limit) {
    checkLimit(limit);
    Deque<FailedMessage> bucket = buckets.get(typeCode);
    if (bucket == null) {
      return List.of();
    }
    List<FailedMessage> result = new ArrayList<>(Math.min(limit, capacityPerType));
    synchronized (bucket) {
      Iterator<FailedMessage> it = bucket.descendingIterator();
      while (it.hasNext() && result.size() < limit) {
        result.add(it.next());
      }
    }
    return List.copyOf(result);
  }

  /**
   * Lists entries across all types, newest first.
   *
   * @param limit maximum entries to return
   * @return up to {@code limit} entries
   */
  public List<FailedMessage> listAll(int limit) {
    checkLimit(limit);
    List<FailedMessage> all = new ArrayList<>();
    for (Integer typeCode : buckets.keySet()) {
      all.addAll(list(typeCode, limit));
    }
    all.sort(Comparator.comparing(FailedMessage::failedAt).reversed());
    return List.copyOf(all.subList(0, Math.min(limit, all.size())));
  }

  /**
   * Removes every entry for {@code messageId} and returns the original message for
   * republishing.
   *
   * @param typeCode  the message type code
   * @param messageId the message identifier
   * @return the original message
   * @throws DeadLetterNotFoundException if no entry matches
   */
  public Message replay(int typeCode, String messageId) {
    List<FailedMessage> removed = removeMatching(typeCode, messageId);
    if (removed.isEmpty()) {
      throw new DeadLetterNotFoundException(typeCode, messageId);
    }
    logger.log(Level.INFO, "Replaying dead-lettered messageId={0} type={1}",
        new Object[]{messageId, typeCode});
    return removed.get(0).message();
  }

  /**
   * Removes every entry for {@code messageId} without replaying it.
   *
   * @param typeCode  the message type code
   * @param messageId the message identifier
   * @return {@code true} if at least one entry was removed
   */
  public boolean remove(int typeCode, String messageId) {
    return !removeMatching(typeCode, messageId).isEmpty();
  }

  /**
   * Drains a type and returns its distinct messages, oldest first.
   *
   * @param typeCode the message type code
   * @return the messages to republish
   */
  public List<Message> replayAll(int typeCode) {
    Deque<FailedMessage> bucket = buckets.get(typeCode);
    if (bucket == null) {
      return List.of();
    }
    List<FailedMessage> drained;
    synchronized (bucket) {
      drained = new ArrayList<>(bucket);
      bucket.clear();
    }
    afterRemoval(drained.size());
    Map<String, Message> distinct = new LinkedHashMap<>();
    for (FailedMessage entry : drained) {
      distinct.putIfAbsent(entry.messageId(), entry.message());
    }
    return List.copyOf(distinct.values());
  }

  public void clear(int typeCode) {
    Deque<FailedMessage> bucket = buckets.get(typeCode);
    if (bucket == null) {
      return;
    }
    int removed;
    synchronized (bucket) {
      removed = bucket.size();
      bucket.clear();
    }
    afterRemoval(removed);
  }

  public int size(int typeCode) {
    Deque<FailedMessage> bucket = buckets.get(typeCode);
    if (bucket == null) {
      return 0;
    }
    synchronized (bucket) {
      return bucket.size();
    }
  }

  public long totalSize() {
    return totalSize.get();
  }

  /**
   * Returns the number of entries dropped because a type was at capacity.
   *
   * @return lifetime eviction count
   */
  public long evictedCount() {
    return evicted.get();
  }

  private List<FailedMessage> removeMatching(int typeCode, String messageId) {
    Objects.requireNonNull(messageId, "messageId");
    Deque<FailedMessage> bucket = buckets.get(typeCode);
    if (bucket == null) {
      return List.of();
    }
    List<FailedMessage> removed = new ArrayList<>();
    synchronized (bucket) {
      Iterator<FailedMessage> it = bucket.iterator();
      while (it.hasNext()) {
        FailedMessage entry = it.next();
        if (entry.messageId().equals(messageId)) {
          removed.add(entry);
          it.remove();
        }
      }
    }
    afterRemoval(removed.size());
    return removed;
  }

  private void afterRemoval(int count) {
    if (count > 0) {
      metrics.recordGauge(MetricNames.DEAD_LETTER_SIZE, totalSize.addAndGet(-count));
    }
  }

  private Deque<FailedMessage> bucket(int typeCode) {
    return buckets.computeIfAbsent(typeCode, ignored -> new ArrayDeque<>());
  }

  private static void checkLimit(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
    }
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    String message = error.getMessage();
    return message == null ? error.getClass().getSimpleName() : message;
  }

  private static String correlationSuffix(Message message) {
    return message.correlationId() == null ? "" : " correlationId=" + message.correlationId();
  }
}
