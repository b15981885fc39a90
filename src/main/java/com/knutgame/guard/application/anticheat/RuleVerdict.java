package com.knutgame.guard.application.anticheat;

import com.knutgame.guard.domain.verdict.RejectionReason;
import java.util.Objects;

/**
 * Outcome of a single rule validator.
 *
 * @param reason rejection reason, or {@code null} when the rule passed
 * @since 0.1.0
 */
public record RuleVerdict(RejectionReason reason) {
  private static final RuleVerdict PASS = new RuleVerdict(null);

  /**
   * Verdict for a rule that found nothing wrong.
   *
   * @return passing verdict
   */
  public static RuleVerdict pass() {
    return PASS;
  }

  /**
   * Verdict for a rule that found an offending event.
   *
   * @param reason why the rule failed; must not be {@code null}
   * @return failing verdict
   */
  public static RuleVerdict fail(RejectionReason reason) {
    return new RuleVerdict(Objects.requireNonNull(reason, "reason"));
  }

  public boolean passed() {
    return reason == null;
  }
}
