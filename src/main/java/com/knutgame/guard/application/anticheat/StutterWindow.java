package com.knutgame.guard.application.anticheat;

import com.knutgame.guard.domain.performance.IssueKind;
import com.knutgame.guard.domain.performance.PerformanceContext;
import com.knutgame.guard.domain.performance.PerformanceIssue;
import com.knutgame.guard.domain.performance.Severity;
import com.knutgame.guard.domain.verdict.PerformanceAdjustment;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Time span around a recorded stutter during which lateral movement is judged more leniently.
 *
 * @param startMs inclusive start in milliseconds since session start
 * @param endMs inclusive end in milliseconds since session start
 * @param severity severity of the stutter behind the window
 * @since 0.1.0
 */
public record StutterWindow(double startMs, double endMs, Severity severity) {

  public StutterWindow {
    Objects.requireNonNull(severity, "severity");
    if (endMs < startMs) {
      throw new IllegalArgumentException("endMs must not precede startMs");
    }
  }

  /**
   * Derives stutter windows from a performance report.
   *
   * <p>Each {@link IssueKind#STUTTER} issue yields
   * {@code [t - extension, t + max(duration, stutterTolerance) + extension]}. Timestamps in
   * {@link PerformanceContext#stutterTimestamps()} without a matching issue yield
   * {@code [t - extension, t + stutterTolerance + extension]} at {@link Severity#LOW}. A neutral adjustment yields no
   * windows, so disabled or healthy reports never widen the speed limit.</p>
   *
   * @param context performance report; must not be {@code null}
   * @param adjustment adjustment computed from the same report; must not be {@code null}
   * @return windows in report order
   */
  public static List<StutterWindow> from(PerformanceContext context, PerformanceAdjustment adjustment) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(adjustment, "adjustment");
    if (!adjustment.deviatesFromNeutral()) {
      return List.of();
    }
    double extension = adjustment.timeWindowExtensionMs();
    double tolerance = adjustment.stutterToleranceMs();
    List<StutterWindow> windows = new ArrayList<>();
    Set<Long> reported = new HashSet<>();
    for (PerformanceIssue issue : context.issues()) {
      if (issue.kind() != IssueKind.STUTTER) {
        continue;
      }
      reported.add(issue.timestampMs());
      double length = Math.max(issue.durationMs(), tolerance);
      windows.add(new StutterWindow(
          issue.timestampMs() - extension, issue.timestampMs() + length + extension, issue.severity()));
    }
    for (Long timestamp : context.stutterTimestamps()) {
      if (reported.contains(timestamp)) {
        continue;
      }
      windows.add(new StutterWindow(timestamp - extension, timestamp + tolerance + extension, Severity.LOW));
    }
    return List.copyOf(windows);
  }

  /**
   * Returns whether the interval {@code [fromMs, toMs]} intersects this window.
   *
   * @param fromMs interval start
   * @param toMs interval end, not before {@code fromMs}
   * @return {@code true} on any overlap, including touching endpoints
   */
  public boolean overlaps(long fromMs, long toMs) {
    return fromMs <= endMs && toMs >= startMs;
  }
}
