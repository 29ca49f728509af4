package msgbus.retry;

/**
 * Blocking wait between synchronous retry attempts. Tests substitute a recording sleeper.
 */
@FunctionalInterface
public interface Sleeper {

  /** Sleeps on the calling thread with {@link Thread#sleep(long)}. */
  Sleeper THREAD = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
