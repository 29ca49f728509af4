package msgbus.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

  @Test
  void delayGrowsExponentially() {
    RetryPolicy policy = RetryPolicy.builder()
        .initialDelay(Duration.ofMillis(100))
        .multiplier(2.0)
        .maxDelay(Duration.ofSeconds(10))
        .build();

    assertEquals(100, policy.delayBeforeRetry(1));
    assertEquals(200, policy.delayBeforeRetry(2));
    assertEquals(400, policy.delayBeforeRetry(3));
    assertEquals(800, policy.delayBeforeRetry(4));
  }

  @Test
  void delayIsCappedAtMax() {
    RetryPolicy policy = RetryPolicy.builder()
        .initialDelay(Duration.ofMillis(100))
        .multiplier(3.0)
        .maxDelay(Duration.ofMillis(500))
        .build();

    assertEquals(300, policy.delayBeforeRetry(2));
    assertEquals(500, policy.delayBeforeRetry(3));
    assertEquals(500, policy.delayBeforeRetry(1000));
  }

  @Test
  void zeroOrNegativeAttemptHasNoDelay() {
    assertEquals(0, RetryPolicy.defaults().delayBeforeRetry(0));
    assertEquals(0, RetryPolicy.defaults().delayBeforeRetry(-1));
  }

  @Test
  void jitterStaysWithinBoundsAndCap() {
    RetryPolicy policy = RetryPolicy.builder()
        .initialDelay(Duration.ofMillis(1000))
        .maxDelay(Duration.ofMillis(1100))
        .jitter(0.5)
        .build();

    for (int i = 0; i < 200; i++) {
      long delay = policy.delayBeforeRetry(1);
      assertTrue(delay >= 500 && delay <= 1100, "delay out of range: " + delay);
    }
  }

  @Test
  void defaults() {
    RetryPolicy policy = RetryPolicy.defaults();

    assertEquals(3, policy.maxAttempts());
    assertEquals(Duration.ofMillis(200), policy.initialDelay());
    assertEquals(2.0, policy.multiplier());
    assertEquals(Duration.ofSeconds(60), policy.maxDelay());
    assertEquals(0.0, policy.jitter());
    assertEquals(1, RetryPolicy.none().maxAttempts());
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> RetryPolicy.builder().maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> RetryPolicy.builder().initialDelay(Duration.ofMillis(-1)).build());
    assertThrows(IllegalArgumentException.class,
        () -> RetryPolicy.builder().multiplier(0.5).build());
    assertThrows(IllegalArgumentException.class,
        () -> RetryPolicy.builder().multiplier(Double.NaN).build());
    assertThrows(IllegalArgumentException.class,
        () -> RetryPolicy.builder().initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(1)).build());
    assertThrows(IllegalArgumentException.class,
        () -> RetryPolicy.builder().jitter(1.0).build());
    assertThrows(NullPointerException.class,
        () -> RetryPolicy.builder().maxDelay(null).build());
  }
}
