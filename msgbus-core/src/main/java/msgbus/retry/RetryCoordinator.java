package msgbus.retry;

import msgbus.circuit.CircuitBreakerRegistry;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs a delivery attempt under the message type's retry policy and circuit breaker.
 *
 * <p>Before every attempt the breaker is asked for a permit; if it refuses, the sequence
 * ends as {@link RetryOutcome.Rejected}. Each attempt's result is reported to the breaker
 * individually, so a retry sequence can itself open the circuit.
 */
public final class RetryCoordinator {

  /** One synchronous attempt. */
  @FunctionalInterface
  public interface Attempt {
    /**
     * @param attemptNumber 1-based attempt number
     * @throws Exception to mark the attempt failed
     */
    void run(int attemptNumber) throws Exception;
  }

  /** One asynchronous attempt; the returned stage completing exceptionally marks it failed. */
  @FunctionalInterface
  public interface AsyncAttempt {
    CompletionStage<?> run(int attemptNumber);
  }

  private final CircuitBreakerRegistry breakers;
  private final RetryPolicy defaultPolicy;
  private final Map<Integer, RetryPolicy> typePolicies;
  private final Sleeper sleeper;

  private RetryCoordinator(Builder builder) {
    this.breakers = Objects.requireNonNull(builder.breakers, "breakers");
    this.defaultPolicy = Objects.requireNonNull(builder.defaultPolicy, "defaultPolicy");
    this.typePolicies = Map.copyOf(builder.typePolicies);
    this.sleeper = Objects.requireNonNull(builder.sleeper, "sleeper");
  }

  public static Builder builder() {
    return new Builder();
  }

  public RetryPolicy policyFor(int typeCode) {
    return typePolicies.getOrDefault(typeCode, defaultPolicy);
  }

  /**
   * Runs {@code attempt} on the calling thread, sleeping between attempts.
   *
   * <p>If the calling thread is interrupted while waiting, the interrupt flag is restored
   * and the sequence ends as {@link RetryOutcome.RetriesExhausted} with the attempts made.
   *
   * @param typeCode the message type code
   * @param attempt  the delivery attempt
   * @return the outcome, never {@code null}
   */
  public RetryOutcome execute(int typeCode, Attempt attempt) {
    RetryPolicy policy = policyFor(typeCode);
    Throwable lastError = null;
    for (int n = 1; n <= policy.maxAttempts(); n++) {
      if (n > 1) {
        try {
          sleeper.sleep(policy.delayBeforeRetry(n - 1));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return new RetryOutcome.RetriesExhausted(lastError, n - 1);
        }
      }
      if (!breakers.tryAcquire(typeCode)) {
        return new RetryOutcome.Rejected(n - 1, lastError);
      }
      try {
        attempt.run(n);
        breakers.recordSuccess(typeCode);
        return new RetryOutcome.Succeeded(n);
      } catch (Exception e) {
        lastError = e;
        breakers.recordFailure(typeCode, e);
      }
    }
    return new RetryOutcome.RetriesExhausted(lastError, policy.maxAttempts());
  }

  /**
   * Runs {@code attempt} asynchronously. Waits between attempts are scheduled with
   * {@link CompletableFuture#delayedExecutor} and do not block a thread.
   *
   * @param typeCode the message type code
   * @param attempt  the delivery attempt
   * @param executor runs retries after their delay
   * @return a future completing with the outcome; it never completes exceptionally
   */
  public CompletableFuture<RetryOutcome> executeAsync(int typeCode, AsyncAttempt attempt,
      Executor executor) {
    Objects.requireNonNull(attempt, "attempt");
    Objects.requireNonNull(executor, "executor");
    CompletableFuture<RetryOutcome> result = new CompletableFuture<>();
    runAsync(typeCode, policyFor(typeCode), attempt, executor, 1, null, result);
    return result;
  }

  private void runAsync(int typeCode, RetryPolicy policy, AsyncAttempt attempt,
      Executor executor, int n, Throwable lastError, CompletableFuture<RetryOutcome> result) {
    if (!breakers.tryAcquire(typeCode)) {
      result.complete(new RetryOutcome.Rejected(n - 1, lastError));
      return;
    }
    CompletionStage<?> stage;
    try {
      stage = Objects.requireNonNull(attempt.run(n), "async handler returned null");
    } catch (RuntimeException e) {
      stage = CompletableFuture.failedFuture(e);
    }
    stage.whenComplete((ignored, error) -> {
      if (error == null) {
        breakers.recordSuccess(typeCode);
        result.complete(new RetryOutcome.Succeeded(n));
        return;
      }
      Throwable cause = unwrap(error);
      breakers.recordFailure(typeCode, cause);
      if (n >= policy.maxAttempts()) {
        result.complete(new RetryOutcome.RetriesExhausted(cause, n));
        return;
      }
      Executor guarded = task -> {
        try {
          executor.execute(task);
        } catch (RejectedExecutionException e) {
          result.complete(new RetryOutcome.RetriesExhausted(cause, n));
        }
      };
      CompletableFuture.delayedExecutor(policy.delayBeforeRetry(n), TimeUnit.MILLISECONDS, guarded)
          .execute(() -> runAsync(typeCode, policy, attempt, executor, n + 1, cause, result));
    });
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  public static final class Builder {
    private CircuitBreakerRegistry breakers;
    private RetryPolicy defaultPolicy = RetryPolicy.defaults();
    private final Map<Integer, RetryPolicy> typePolicies = new HashMap<>();
    private Sleeper sleeper = Sleeper.THREAD;

    private Builder() {
    }

    public Builder circuitBreakers(CircuitBreakerRegistry breakers) {
      this.breakers = breakers;
      return this;
    }

    public Builder defaultPolicy(RetryPolicy defaultPolicy) {
      this.defaultPolicy = defaultPolicy;
      return this;
    }

    public Builder policy(int typeCode, RetryPolicy policy) {
      typePolicies.put(typeCode, Objects.requireNonNull(policy, "policy"));
      return this;
    }

    /**
     * Sets the blocking wait used by {@link RetryCoordinator#execute}.
     *
     * <p>Optional. Defaults to {@link Sleeper#THREAD}.
     *
     * @param sleeper the wait strategy
     * @return this builder
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public RetryCoordinator build() {
      return new RetryCoordinator(this);
    }
  }
}
