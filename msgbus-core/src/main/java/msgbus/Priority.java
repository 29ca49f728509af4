package msgbus;

/**
 * Ordered delivery priority of a {@link Message}.
 *
 * <p>Declaration order is significant: {@code LOW < NORMAL < HIGH < CRITICAL}.
 * Subscriptions may declare a minimum priority; messages below it are filtered.
 */
public enum Priority {
  LOW,
  NORMAL,
  HIGH,
  CRITICAL;

  /**
   * Returns {@code true} if this priority is equal to or above {@code threshold}.
   *
   * @param threshold the minimum priority, {@code null} meaning no threshold
   * @return whether this priority satisfies the threshold
   */
  public boolean isAtLeast(Priority threshold) {
    return threshold == null || compareTo(threshold) >= 0;
  }
}
