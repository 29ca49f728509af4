package msgbus.retry;

/**
 * Result of a retry sequence.
 *
 * @see RetryCoordinator
 */
public sealed interface RetryOutcome
    permits RetryOutcome.Succeeded, RetryOutcome.RetriesExhausted, RetryOutcome.Rejected {

  /**
   * Number of attempts actually made.
   *
   * @return attempts, zero only for a {@link Rejected} sequence that never started
   */
  int attempts();

  /** An attempt succeeded. */
  record Succeeded(int attempts) implements RetryOutcome {
  }

  /** Every permitted attempt failed; {@code lastError} is the final attempt's failure. */
  record RetriesExhausted(Throwable lastError, int attempts) implements RetryOutcome {
  }

  /**
   * The circuit breaker refused an attempt. {@code lastError} is {@code null} when no attempt
   * was made.
   */
  record Rejected(int attempts, Throwable lastError) implements RetryOutcome {
  }
}
