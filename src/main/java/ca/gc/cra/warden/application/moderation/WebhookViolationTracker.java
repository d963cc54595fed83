package ca.gc.cra.warden.application.moderation;

import ca.gc.cra.warden.validation.Numbers;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-account count of disallowed webhook creations driving escalation to a kick.
 *
 * <p>Counts are updated atomically per account. Resetting releases the account: counting starts again from
 * one on the next violation. {@link #recordViolationAndRelease(long)} releases in the same update that reaches
 * the threshold, so violations recorded while the resulting kick is in flight are kept. The tracker never
 * deletes or kicks anything itself.</p>
 *
 * @since 0.1.0
 */
public final class WebhookViolationTracker {
  private final int threshold;
  private final ConcurrentMap<Long, Integer> attempts = new ConcurrentHashMap<>();

  /**
   * Creates a tracker.
   *
   * @param threshold violation count at which the account should be kicked; must be positive
   */
  public WebhookViolationTracker(int threshold) {
    this.threshold = (int) Numbers.requireRange("threshold", threshold, 1, Integer.MAX_VALUE);
  }

  /**
   * Records one violation.
   *
   * @param accountId offending account
   * @return count after the increment
   */
  public int recordViolation(long accountId) {
    return attempts.merge(accountId, 1, Integer::sum);
  }

  /**
   * Records one violation and, when the count reaches the threshold, releases the account in the same atomic
   * update.
   *
   * @param accountId offending account
   * @return count after the increment; {@link #shouldKick(int)} tells the caller whether it owns the kick
   */
  public int recordViolationAndRelease(long accountId) {
    int[] reached = new int[1];
    attempts.compute(accountId, (id, current) -> {
      int next = current == null ? 1 : current + 1;
      reached[0] = next;
      return next >= threshold ? null : next;
    });
    return reached[0];
  }

  /**
   * Checks whether a count has reached the escalation threshold.
   *
   * @param count count returned by {@link #recordViolation(long)}
   * @return {@code true} at or above the threshold
   */
  public boolean shouldKick(int count) {
    return count >= threshold;
  }

  /**
   * Clears the account's count.
   *
   * @param accountId account to release
   */
  public void reset(long accountId) {
    attempts.remove(accountId);
  }

  /**
   * Returns the current count.
   *
   * @param accountId account to inspect
   * @return current count; 0 when none recorded
   */
  public int count(long accountId) {
    return attempts.getOrDefault(accountId, 0);
  }
}
