package msgbus.util;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Callback list for state-transition events.
 *
 * <p>Listeners are notified in registration order on the thread that caused the transition.
 * A listener that throws is logged and skipped; the remaining listeners still run.
 *
 * @param <T> the transition event type
 */
public final class TransitionListeners<T> {
  private static final Logger logger = Logger.getLogger(TransitionListeners.class.getName());

  private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

  /**
   * Registers a listener.
   *
   * @param listener the callback
   * @return a handle that removes the listener when run
   */
  public Runnable add(Consumer<? super T> listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  public boolean isEmpty() {
    return listeners.isEmpty();
  }

  /**
   * Delivers {@code event} to every registered listener.
   *
   * @param event the transition event
   */
  public void fire(T event) {
    for (Consumer<? super T> listener : listeners) {
      try {
        listener.accept(event);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Transition listener failed for " + event, e);
      }
    }
  }
}
