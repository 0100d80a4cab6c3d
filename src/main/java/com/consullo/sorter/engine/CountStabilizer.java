package com.consullo.sorter.engine;

/**
 * Keeps the displayed total constant for the life of a session.
 *
 * <p>Every classification lowers the store's unclassified count by one and raises the session's
 * classified count by one, so their sum is constant in theory. Writes land asynchronously, which
 * makes the raw sum jitter; the first non-zero sum is latched and returned until {@link #reset()}.
 */
public final class CountStabilizer {

  private int stableTotal;

  /**
   * Observe the current raw counts.
   *
   * @param unclassifiedCount unclassified count reported by the store
   * @param sessionClassifiedCount records classified in this session
   * @return total to display
   */
  public int observe(int unclassifiedCount, int sessionClassifiedCount) {
    if (stableTotal > 0) {
      return stableTotal;
    }
    int sum = Math.max(0, unclassifiedCount) + Math.max(0, sessionClassifiedCount);
    if (sum > 0) {
      stableTotal = sum;
    }
    return sum;
  }

  public boolean isLatched() {
    return stableTotal > 0;
  }

  public void reset() {
    stableTotal = 0;
  }
}
