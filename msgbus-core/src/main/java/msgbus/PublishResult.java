package msgbus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one publish call.
 *
 * <p>Each subscriber in the delivery snapshot is counted exactly once, in one of
 * {@code delivered}, {@code failed}, {@code filtered}, {@code rejected} (circuit opened
 * before its first attempt), {@code pending} (asynchronous handler still running) or
 * {@code cancelled} (not invoked because the caller cancelled).
 */
public final class PublishResult {

  /** Overall disposition of the publish call. */
  public enum Status {
    /** Every subscriber in the snapshot was considered; see the counters for details. */
    COMPLETED,
    /** No subscriber was registered for the message type. */
    NO_SUBSCRIBERS,
    /** Delivery was skipped entirely because the type's circuit breaker is open. */
    CIRCUIT_OPEN,
    /** The caller cancelled before every subscriber was considered. */
    CANCELLED
  }

  private final String messageId;
  private final int typeCode;
  private final Status status;
  private final int subscriberCount;
  private final int delivered;
  private final int failed;
  private final int filtered;
  private final int rejected;
  private final int pending;
  private final int cancelled;
  private final List<SubscriberHandlerException> failures;

  private PublishResult(Builder b, Status status) {
    this.messageId = b.messageId;
    this.typeCode = b.typeCode;
    this.status = status;
    this.subscriberCount = b.subscriberCount;
    this.delivered = b.delivered;
    this.failed = b.failed;
    this.filtered = b.filtered;
    this.rejected = b.rejected;
    this.pending = b.pending;
    this.cancelled = b.cancelled;
    this.failures = Collections.unmodifiableList(new ArrayList<>(b.failures));
  }

  static PublishResult noSubscribers(Message message) {
    return new Builder(message, 0).build(Status.NO_SUBSCRIBERS);
  }

  /** A batch entry skipped because the batch was cancelled before it started. */
  static PublishResult notPublished(Message message) {
    return new Builder(message, 0).build(Status.CANCELLED);
  }

  static PublishResult circuitOpen(Message message, int subscriberCount) {
    Builder b = new Builder(message, subscriberCount);
    b.rejected = subscriberCount;
    return b.build(Status.CIRCUIT_OPEN);
  }

  public String messageId() {
    return messageId;
  }

  public int typeCode() {
    return typeCode;
  }

  public Status status() {
    return status;
  }

  /**
   * Returns the size of the subscriber snapshot taken when the publish started.
   *
   * @return number of subscribers considered
   */
  public int subscriberCount() {
    return subscriberCount;
  }

  public int delivered() {
    return delivered;
  }

  public int failed() {
    return failed;
  }

  public int filtered() {
    return filtered;
  }

  public int rejected() {
    return rejected;
  }

  public int pending() {
    return pending;
  }

  public int cancelled() {
    return cancelled;
  }

  public List<SubscriberHandlerException> failures() {
    return failures;
  }

  /**
   * Returns {@code true} if at least one subscriber was attempted and none succeeded
   * or is still pending.
   *
   * @return whether every attempted subscriber failed
   */
  public boolean allFailed() {
    return failed > 0 && delivered == 0 && pending == 0;
  }

  @Override
  public String toString() {
    return "PublishResult{messageId=" + messageId
        + ", typeCode=" + typeCode
        + ", status=" + status
        + ", subscribers=" + subscriberCount
        + ", delivered=" + delivered
        + ", failed=" + failed
        + ", filtered=" + filtered
        + ", rejected=" + rejected
        + ", pending=" + pending
        + ", cancelled=" + cancelled
        + '}';
  }

  /** Accumulates per-subscriber outcomes during a publish call. */
  static final class Builder {
    private final String messageId;
    private final int typeCode;
    private final int subscriberCount;
    private int delivered;
    private int failed;
    private int filtered;
    private int rejected;
    private int pending;
    private int cancelled;
    private final List<SubscriberHandlerException> failures = new ArrayList<>();

    Builder(Message message, int subscriberCount) {
      this.messageId = message.messageId();
      this.typeCode = message.typeCode();
      this.subscriberCount = subscriberCount;
    }

    synchronized void delivered() {
      delivered++;
    }

    synchronized void failed(SubscriberHandlerException failure) {
      failed++;
      failures.add(failure);
    }

    synchronized void filtered() {
      filtered++;
    }

    synchronized void rejected() {
      rejected++;
    }

    synchronized void pending() {
      pending++;
    }

    synchronized void cancelled() {
      cancelled++;
    }

    synchronized PublishResult build() {
      return build(cancelled > 0 ? Status.CANCELLED : Status.COMPLETED);
    }

    private PublishResult build(Status status) {
      return new PublishResult(this, status);
    }
  }
}
