package msgbus;

import msgbus.retry.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Sleeper that records requested waits and optionally advances a {@link MutableClock}. */
public final class RecordingSleeper implements Sleeper {
  private final List<Long> sleeps = new CopyOnWriteArrayList<>();
  private final MutableClock clock;

  public RecordingSleeper() {
    this(null);
  }

  public RecordingSleeper(MutableClock clock) {
    this.clock = clock;
  }

  @Override
  public void sleep(long millis) {
    sleeps.add(millis);
    if (clock != null) {
      clock.advance(Duration.ofMillis(millis));
    }
  }

  public List<Long> sleeps() {
    return List.copyOf(sleeps);
  }
}
