package msgbus;

/**
 * Cooperative cancellation signal for {@link MessageBus#publishAsync(Message, CancellationToken)}.
 *
 * <p>The bus checks the token between subscriber invocations. Once cancelled, no further
 * subscribers are invoked for that publish call; handlers already running are not aborted.
 */
public final class CancellationToken {

  private static final CancellationToken NONE = new CancellationToken();

  private volatile boolean cancelled;

  /**
   * Returns a shared token that is never cancelled.
   *
   * @return the no-op token
   */
  public static CancellationToken none() {
    return NONE;
  }

  public void cancel() {
    if (this == NONE) {
      throw new UnsupportedOperationException("The shared none() token cannot be cancelled");
    }
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }
}
