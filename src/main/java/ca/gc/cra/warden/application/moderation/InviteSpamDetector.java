package ca.gc.cra.warden.application.moderation;

import ca.gc.cra.warden.validation.Numbers;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> Per-account sliding window of invite-link post timestamps.
 * <p><strong>Why:</strong> Flags accounts that post invite links faster than the configured rate so the router
 * can escalate to a timeout.</p>
 * <p><strong>Role:</strong> Application service owned by the event router.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append post timestamps (most recent last) and evict entries older than the window from the front.</li>
 *   <li>Bound each window to a fixed capacity, dropping the oldest entries first.</li>
 *   <li>Report whether the purged window holds at least the threshold number of posts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Windows live in a {@link ConcurrentHashMap} and are only touched inside
 * {@code compute} callbacks, so updates for one account are serialized while different accounts proceed in
 * parallel.</p>
 * <p><strong>Performance:</strong> Amortized O(1) per post; purge is lazy (on the account's next post) with an
 * optional periodic {@link #sweep(long)} reclaiming idle accounts.</p>
 *
 * @implNote A timestamp older than the newest entry is clamped to it so each window stays non-decreasing.
 * @since 0.1.0
 */
public final class InviteSpamDetector {
  private final long windowMillis;
  private final int threshold;
  private final int capacity;
  private final ConcurrentMap<Long, Deque<Long>> windows = new ConcurrentHashMap<>();

  /**
   * Creates a detector.
   *
   * @param window detection window length; must be positive
   * @param threshold posts within the window that cross the limit; must be positive
   * @param capacity per-account entry bound; must be at least {@code threshold}
   */
  public InviteSpamDetector(Duration window, int threshold, int capacity) {
    if (window == null || window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be positive");
    }
    this.windowMillis = window.toMillis();
    this.threshold = (int) Numbers.requireRange("threshold", threshold, 1, Integer.MAX_VALUE);
    this.capacity = (int) Numbers.requireRange("capacity", capacity, threshold, Integer.MAX_VALUE);
  }

  /**
   * Records an invite post for the account.
   *
   * @param accountId posting account
   * @param nowMillis post time in epoch milliseconds
   */
  public void recordPost(long accountId, long nowMillis) {
    windows.compute(accountId, (id, window) -> append(window, nowMillis));
  }

  /**
   * Checks whether the account's purged window is at or above the threshold.
   *
   * @param accountId account to check
   * @return {@code true} when the posting rate crossed the limit
   */
  public boolean isOverThreshold(long accountId) {
    int[] size = new int[1];
    windows.computeIfPresent(accountId, (id, window) -> {
      size[0] = window.size();
      return window;
    });
    return size[0] >= threshold;
  }

  /**
   * Records a post and evaluates the threshold in one atomic step for the account.
   *
   * @param accountId posting account
   * @param nowMillis post time in epoch milliseconds
   * @return {@code true} when this post leaves the account at or above the threshold
   */
  public boolean recordPostAndCheck(long accountId, long nowMillis) {
    int[] size = new int[1];
    windows.compute(accountId, (id, window) -> {
      Deque<Long> updated = append(window, nowMillis);
      size[0] = updated.size();
      return updated;
    });
    return size[0] >= threshold;
  }

  /**
   * Purges every window against {@code nowMillis} and drops accounts left with no entries.
   *
   * @param nowMillis reference epoch milliseconds
   * @return number of accounts removed
   */
  public int sweep(long nowMillis) {
    int[] removed = new int[1];
    for (Long accountId : windows.keySet()) {
      windows.computeIfPresent(accountId, (id, window) -> {
        purge(window, nowMillis);
        if (window.isEmpty()) {
          removed[0]++;
          return null;
        }
        return window;
      });
    }
    return removed[0];
  }

  /**
   * Returns the number of accounts with a live window.
   *
   * @return tracked account count
   */
  public int trackedAccounts() {
    return windows.size();
  }

  private Deque<Long> append(Deque<Long> window, long nowMillis) {
    Deque<Long> target = window == null ? new ArrayDeque<>() : window;
    Long newest = target.peekLast();
    long stamp = newest != null && newest > nowMillis ? newest : nowMillis;
    target.addLast(stamp);
    purge(target, stamp);
    while (target.size() > capacity) {
      target.removeFirst();
    }
    return target;
  }

  private void purge(Deque<Long> window, long nowMillis) {
    while (!window.isEmpty() && nowMillis - window.peekFirst() > windowMillis) {
      window.removeFirst();
    }
  }
}
