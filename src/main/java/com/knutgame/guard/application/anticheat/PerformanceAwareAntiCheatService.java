package com.knutgame.guard.application.anticheat;

import com.knutgame.guard.application.port.MetricsPort;
import com.knutgame.guard.application.port.SmartAntiCheat;
import com.knutgame.guard.config.AntiCheatOptions;
import com.knutgame.guard.domain.performance.PerformanceContext;
import com.knutgame.guard.domain.performance.PerformanceIssue;
import com.knutgame.guard.domain.session.SubmitSessionRequest;
import com.knutgame.guard.domain.verdict.PerformanceAdjustment;
import com.knutgame.guard.domain.verdict.RejectionReason;
import com.knutgame.guard.domain.verdict.ValidationResult;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Performance-aware anti-cheat service sequencing the adjustment, rule, and confidence stages.
 * <p><strong>Why:</strong> Gives the submission endpoint one call that returns a typed verdict for every input.</p>
 * <p><strong>Role:</strong> Application-layer implementation of {@link SmartAntiCheat}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Compute one {@link PerformanceAdjustment} per validation.</li>
 *   <li>Run {@link SpeedValidator} then {@link ProximityValidator}, returning the first failure.</li>
 *   <li>Reject rule-passing sessions whose report confidence is below the threshold.</li>
 *   <li>Publish threshold snapshots atomically.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Each validation reads the options snapshot once, so it
 * sees either the old or the new snapshot in full.</p>
 * <p><strong>Performance:</strong> One sort of the move stream, then linear scans; no I/O.</p>
 * <p><strong>Observability:</strong> Counts {@code anticheat.session.accepted}, {@code anticheat.session.rejected},
 * {@code anticheat.session.rejected.<code>}, {@code anticheat.session.adjusted}; records
 * {@code anticheat.validate.latencyNanos}. Rejections log at DEBUG with {@code sessionId} in MDC.</p>
 *
 * @since 0.1.0
 */
public final class PerformanceAwareAntiCheatService implements SmartAntiCheat {
  private static final Logger log = LoggerFactory.getLogger(PerformanceAwareAntiCheatService.class);
  private static final String MDC_SESSION_ID = "sessionId";
  private static final double UNGATED_CONFIDENCE = 1.0;

  private final AtomicReference<AntiCheatOptions> options;
  private final PerformanceAdjustmentCalculator adjustmentCalculator;
  private final SpeedValidator speedValidator;
  private final ProximityValidator proximityValidator;
  private final ConfidenceCalculator confidenceCalculator;
  private final MetricsPort metrics;

  /** Creates a service with {@link AntiCheatOptions#defaults()} and no metrics. */
  public PerformanceAwareAntiCheatService() {
    this(AntiCheatOptions.defaults());
  }

  /**
   * Creates a service with the given thresholds and no metrics.
   *
   * @param options initial thresholds; must not be {@code null}
   */
  public PerformanceAwareAntiCheatService(AntiCheatOptions options) {
    this(options, MetricsPort.NO_OP);
  }

  /**
   * Creates a service with the given thresholds and metrics sink.
   *
   * @param options initial thresholds; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public PerformanceAwareAntiCheatService(AntiCheatOptions options, MetricsPort metrics) {
    this(options,
        new PerformanceAdjustmentCalculator(),
        new SpeedValidator(),
        new ProximityValidator(),
        new ConfidenceCalculator(),
        metrics);
  }

  PerformanceAwareAntiCheatService(
      AntiCheatOptions options,
      PerformanceAdjustmentCalculator adjustmentCalculator,
      SpeedValidator speedValidator,
      ProximityValidator proximityValidator,
      ConfidenceCalculator confidenceCalculator,
      MetricsPort metrics) {
    this.options = new AtomicReference<>(Objects.requireNonNull(options, "options"));
    this.adjustmentCalculator = Objects.requireNonNull(adjustmentCalculator, "adjustmentCalculator");
    this.speedValidator = Objects.requireNonNull(speedValidator, "speedValidator");
    this.proximityValidator = Objects.requireNonNull(proximityValidator, "proximityValidator");
    this.confidenceCalculator = Objects.requireNonNull(confidenceCalculator, "confidenceCalculator");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public ValidationResult validate(SubmitSessionRequest request) {
    return evaluate(request, null);
  }

  @Override
  public ValidationResult validateWithContext(SubmitSessionRequest request, PerformanceContext context) {
    return evaluate(request, Objects.requireNonNull(context, "context"));
  }

  @Override
  public AntiCheatOptions getPerformanceThresholds() {
    return options.get();
  }

  @Override
  public void setPerformanceThresholds(AntiCheatOptions options) {
    AntiCheatOptions replacement = Objects.requireNonNull(options, "options");
    AntiCheatOptions previous = this.options.getAndSet(replacement);
    log.info("Anti-cheat thresholds replaced (adjustmentEnabled {} -> {}, confidenceThreshold {} -> {})",
        previous.performanceAdjustmentEnabled(), replacement.performanceAdjustmentEnabled(),
        previous.confidenceThreshold(), replacement.confidenceThreshold());
  }

  /**
   * Adjustment the current thresholds would derive from {@code context}. Side-effect free.
   *
   * @param context performance report; must not be {@code null}
   * @return adjustment under the current snapshot
   */
  public PerformanceAdjustment getPerformanceAdjustment(PerformanceContext context) {
    return adjustmentCalculator.calculate(context, options.get());
  }

  /**
   * Confidence of {@code context}. Side-effect free.
   *
   * @param context performance report; must not be {@code null}
   * @return confidence in {@code [0, 1]}
   */
  public double calculateConfidence(PerformanceContext context) {
    return confidenceCalculator.calculate(context);
  }

  private ValidationResult evaluate(SubmitSessionRequest request, PerformanceContext context) {
    Objects.requireNonNull(request, "request");
    AntiCheatOptions snapshot = options.get();
    long startNanos = System.nanoTime();
    String previousSessionId = MDC.get(MDC_SESSION_ID);
    try {
      MDC.put(MDC_SESSION_ID, request.sessionId().toString());
      ValidationResult result = decide(request, context, snapshot);
      recordOutcome(result);
      return result;
    } finally {
      metrics.observe("anticheat.validate.latencyNanos", System.nanoTime() - startNanos);
      if (previousSessionId == null) {
        MDC.remove(MDC_SESSION_ID);
      } else {
        MDC.put(MDC_SESSION_ID, previousSessionId);
      }
    }
  }

  private ValidationResult decide(
      SubmitSessionRequest request, PerformanceContext context, AntiCheatOptions snapshot) {
    PerformanceAdjustment adjustment;
    double confidence;
    List<StutterWindow> stutterWindows;
    List<PerformanceIssue> issues;
    if (context == null) {
      adjustment = PerformanceAdjustment.neutral();
      confidence = UNGATED_CONFIDENCE;
      stutterWindows = List.of();
      issues = List.of();
    } else {
      adjustment = adjustmentCalculator.calculate(context, snapshot);
      confidence = confidenceCalculator.calculate(context);
      stutterWindows = StutterWindow.from(context, adjustment);
      issues = context.issues();
    }

    MoveTimeline timeline = MoveTimeline.of(request.events().moves());
    RuleVerdict speed = speedValidator.validate(timeline, adjustment, stutterWindows, snapshot);
    if (!speed.passed()) {
      return reject(speed.reason(), confidence, adjustment);
    }
    RuleVerdict proximity =
        proximityValidator.validate(timeline, request.events().items(), adjustment, issues, snapshot);
    if (!proximity.passed()) {
      return reject(proximity.reason(), confidence, adjustment);
    }
    if (context != null && confidence < snapshot.confidenceThreshold()) {
      return reject(RejectionReason.LOW_CONFIDENCE, confidence, adjustment);
    }
    return ValidationResult.accepted(confidence, adjustment);
  }

  private static ValidationResult reject(
      RejectionReason reason, double confidence, PerformanceAdjustment adjustment) {
    if (log.isDebugEnabled()) {
      log.debug("Session rejected: {} (confidence {}, adjustment {})",
          reason.code(), String.format("%.3f", confidence), adjustment);
    }
    return ValidationResult.rejected(reason, confidence, adjustment);
  }

  private void recordOutcome(ValidationResult result) {
    if (result.valid()) {
      metrics.increment("anticheat.session.accepted");
    } else {
      metrics.increment("anticheat.session.rejected");
      metrics.increment("anticheat.session.rejected." + result.reason().code());
    }
    if (result.performanceAdjusted()) {
      metrics.increment("anticheat.session.adjusted");
    }
  }
}
