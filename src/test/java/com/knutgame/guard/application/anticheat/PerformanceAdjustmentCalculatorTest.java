package com.knutgame.guard.application.anticheat;

import static com.knutgame.guard.testutil.Sessions.extremeContext;
import static com.knutgame.guard.testutil.Sessions.goodContext;
import static com.knutgame.guard.testutil.Sessions.issue;
import static com.knutgame.guard.testutil.Sessions.poorContext;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.knutgame.guard.config.AntiCheatOptions;
import com.knutgame.guard.domain.performance.IssueKind;
import com.knutgame.guard.domain.performance.PerformanceContext;
import com.knutgame.guard.domain.performance.Severity;
import com.knutgame.guard.domain.verdict.PerformanceAdjustment;
import java.util.List;
import org.junit.jupiter.api.Test;

class PerformanceAdjustmentCalculatorTest {
  private final PerformanceAdjustmentCalculator calculator = new PerformanceAdjustmentCalculator();
  private final AntiCheatOptions options = AntiCheatOptions.defaults();

  @Test
  void goodPerformanceStaysCloseToNeutral() {
    PerformanceAdjustment adjustment = calculator.calculate(goodContext(), options);

    assertEquals(1.0, adjustment.speedToleranceMultiplier(), 0.05);
    assertEquals(1.0, adjustment.proximityToleranceMultiplier(), 0.05);
    assertEquals(0.0, adjustment.timeWindowExtensionMs(), 1e-9);
    assertEquals(options.stutterToleranceMs(), adjustment.stutterToleranceMs(), 1e-9);
  }

  @Test
  void neutralContextYieldsNeutralAdjustment() {
    PerformanceAdjustment adjustment = calculator.calculate(PerformanceContext.neutral(), options);

    assertFalse(adjustment.deviatesFromNeutral());
  }

  @Test
  void poorPerformanceRelaxesEveryThreshold() {
    PerformanceAdjustment adjustment = calculator.calculate(poorContext(), options);

    assertTrue(adjustment.speedToleranceMultiplier() > 1.2, "speed " + adjustment);
    assertTrue(adjustment.proximityToleranceMultiplier() > 1.1, "proximity " + adjustment);
    assertTrue(adjustment.timeWindowExtensionMs() > 50, "extension " + adjustment);
    assertTrue(adjustment.stutterToleranceMs() > 100, "stutter " + adjustment);
    assertEquals(1.575, adjustment.speedToleranceMultiplier(), 1e-9);
    assertEquals(1.345, adjustment.proximityToleranceMultiplier(), 1e-9);
    assertEquals(137.5, adjustment.timeWindowExtensionMs(), 1e-9);
    assertEquals(160.0, adjustment.stutterToleranceMs(), 1e-9);
  }

  @Test
  void extremePerformanceSaturatesAtCaps() {
    PerformanceAdjustment adjustment = calculator.calculate(extremeContext(), options);

    assertEquals(options.maxSpeedMultiplier(), adjustment.speedToleranceMultiplier(), 1e-9);
    assertEquals(options.maxProximityMultiplier(), adjustment.proximityToleranceMultiplier(), 1e-9);
    assertEquals(options.maxTimeWindowExtensionMs(), adjustment.timeWindowExtensionMs(), 1e-9);
    assertEquals(options.stutterToleranceMs() + options.maxTimeWindowExtensionMs(),
        adjustment.stutterToleranceMs(), 1e-9);
  }

  @Test
  void capsFollowConfiguredLimits() {
    AntiCheatOptions tight = new AntiCheatOptions(1.2, 48.0, 100.0, 30.0, 0.8, true, 1.3, 1.1, 40.0);

    PerformanceAdjustment adjustment = calculator.calculate(extremeContext(), tight);

    assertEquals(1.3, adjustment.speedToleranceMultiplier(), 1e-9);
    assertEquals(1.1, adjustment.proximityToleranceMultiplier(), 1e-9);
    assertEquals(40.0, adjustment.timeWindowExtensionMs(), 1e-9);
  }

  @Test
  void disabledAdjustmentIgnoresContext() {
    AntiCheatOptions disabled = options.withPerformanceAdjustmentEnabled(false);

    for (PerformanceContext context : List.of(goodContext(), poorContext(), extremeContext())) {
      assertEquals(PerformanceAdjustment.neutral(), calculator.calculate(context, disabled));
    }
  }

  @Test
  void memoryPressureBoostsProximityOnly() {
    PerformanceContext calm = new PerformanceContext(List.of(), 60.0, 0, 90, 3_000L, List.of());
    PerformanceContext pressured = new PerformanceContext(
        List.of(issue(IssueKind.MEMORY_PRESSURE, Severity.HIGH, 1_000L, 0L)), 60.0, 4, 90, 3_000L, List.of());

    PerformanceAdjustment before = calculator.calculate(calm, options);
    PerformanceAdjustment after = calculator.calculate(pressured, options);

    double speedGain = after.speedToleranceMultiplier() - before.speedToleranceMultiplier();
    double proximityGain = after.proximityToleranceMultiplier() - before.proximityToleranceMultiplier();
    assertTrue(proximityGain > speedGain, "memory pressure should favour proximity: " + before + " -> " + after);
  }

  @Test
  void worseContextNeverLowersAdjustment() {
    List<PerformanceContext> worsening = List.of(
        PerformanceContext.neutral(),
        goodContext(),
        new PerformanceContext(
            List.of(issue(IssueKind.STUTTER, Severity.LOW, 1_000L, 50L)), 45.0, 0, 80, 3_000L, List.of()),
        poorContext(),
        new PerformanceContext(
            List.of(
                issue(IssueKind.STUTTER, Severity.HIGH, 1_000L, 150L),
                issue(IssueKind.LOW_FPS, Severity.HIGH, 1_500L, 300L),
                issue(IssueKind.MEMORY_PRESSURE, Severity.MEDIUM, 2_000L, 0L)),
            15.0, 3, 20, 3_000L, List.of(1_000L)),
        extremeContext());

    PerformanceAdjustment previous = null;
    for (PerformanceContext context : worsening) {
      PerformanceAdjustment current = calculator.calculate(context, options);
      if (previous != null) {
        assertTrue(current.speedToleranceMultiplier() >= previous.speedToleranceMultiplier());
        assertTrue(current.proximityToleranceMultiplier() >= previous.proximityToleranceMultiplier());
        assertTrue(current.timeWindowExtensionMs() >= previous.timeWindowExtensionMs());
        assertTrue(current.stutterToleranceMs() >= previous.stutterToleranceMs());
      }
      previous = current;
    }
  }

  @Test
  void calculationIsIdempotent() {
    PerformanceContext context = poorContext();

    assertEquals(calculator.calculate(context, options), calculator.calculate(context, options));
  }

  @Test
  void everyIssueKindHasAWeight() {
    for (IssueKind kind : IssueKind.values()) {
      double factor = PerformanceAdjustmentCalculator.kindFactor(kind);
      assertTrue(factor > 0 && factor <= 1.0, kind + " -> " + factor);
    }
  }
}
