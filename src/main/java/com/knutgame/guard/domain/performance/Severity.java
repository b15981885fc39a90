package com.knutgame.guard.domain.performance;

/**
 * Severity attached to a {@link PerformanceIssue}.
 *
 * @since 0.1.0
 */
public enum Severity {
  LOW(1),
  MEDIUM(2),
  HIGH(3);

  private final int weight;

  Severity(int weight) {
    this.weight = weight;
  }

  /**
   * Relative weight used when summing issue load.
   *
   * @return 1 for {@link #LOW}, 2 for {@link #MEDIUM}, 3 for {@link #HIGH}
   */
  public int weight() {
    return weight;
  }
}
