package com.knutgame.guard.application.port;

import com.knutgame.guard.config.AntiCheatOptions;
import com.knutgame.guard.domain.performance.PerformanceContext;
import com.knutgame.guard.domain.session.SubmitSessionRequest;
import com.knutgame.guard.domain.verdict.ValidationResult;

/**
 * <strong>What:</strong> Performance-aware anti-cheat port used by the session-submission endpoint.
 * <p><strong>Why:</strong> Separates the decision of whether a session is plausible from HTTP handling and persistence.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Judge movement and pickups of a submitted session.</li>
 *   <li>Relax thresholds for clients whose performance report shows genuine degradation.</li>
 *   <li>Expose the current threshold snapshot for inspection and replacement.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent validations alongside threshold replacement.</p>
 *
 * @since 0.1.0
 */
public interface SmartAntiCheat {
  /**
   * Validates a session without any performance report. Baseline thresholds apply and no confidence gate is used.
   *
   * @param request submitted session; must not be {@code null}
   * @return verdict; never {@code null}
   */
  ValidationResult validate(SubmitSessionRequest request);

  /**
   * Validates a session, relaxing thresholds according to the client's performance report and gating the
   * result on the report's confidence.
   *
   * @param request submitted session; must not be {@code null}
   * @param context aggregated performance report for the same session; must not be {@code null}
   * @return verdict; never {@code null}
   */
  ValidationResult validateWithContext(SubmitSessionRequest request, PerformanceContext context);

  /**
   * Returns the threshold snapshot in effect.
   *
   * @return current options
   */
  AntiCheatOptions getPerformanceThresholds();

  /**
   * Replaces the threshold snapshot wholesale. Validations already running keep the snapshot they started with.
   *
   * @param options new options; must not be {@code null}
   */
  void setPerformanceThresholds(AntiCheatOptions options);
}
