package com.knutgame.guard.config;

import com.knutgame.guard.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable anti-cheat thresholds shared by every validation.
 * <p><strong>Why:</strong> Keeps tolerances and caps in one snapshot that can be replaced atomically at runtime.</p>
 * <p><strong>Role:</strong> Configuration record read by the validators and published through
 * {@link com.knutgame.guard.application.port.SmartAntiCheat#setPerformanceThresholds(AntiCheatOptions)}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param baseSpeedTolerance factor over the nominal maximum speed tolerated without any context
 * @param baseProximityTolerancePx pickup distance in pixels tolerated without any context
 * @param stutterToleranceMs minimum length of a stutter window in milliseconds
 * @param lowFpsThreshold frame rate below which the client counts as struggling
 * @param confidenceThreshold minimum confidence required to accept a session validated with context
 * @param performanceAdjustmentEnabled whether performance context may relax thresholds
 * @param maxSpeedMultiplier cap on the speed tolerance multiplier
 * @param maxProximityMultiplier cap on the proximity tolerance multiplier
 * @param maxTimeWindowExtensionMs cap on issue window widening in milliseconds
 * @since 0.1.0
 */
public record AntiCheatOptions(
    double baseSpeedTolerance,
    double baseProximityTolerancePx,
    double stutterToleranceMs,
    double lowFpsThreshold,
    double confidenceThreshold,
    boolean performanceAdjustmentEnabled,
    double maxSpeedMultiplier,
    double maxProximityMultiplier,
    double maxTimeWindowExtensionMs) {

  private static final String PREFIX = "anticheat.";

  public AntiCheatOptions {
    Numbers.requireAtLeast("baseSpeedTolerance", baseSpeedTolerance, Double.MIN_VALUE);
    Numbers.requireAtLeast("baseProximityTolerancePx", baseProximityTolerancePx, 0.0);
    Numbers.requireAtLeast("stutterToleranceMs", stutterToleranceMs, 0.0);
    Numbers.requireAtLeast("lowFpsThreshold", lowFpsThreshold, Double.MIN_VALUE);
    Numbers.requireRange("confidenceThreshold", confidenceThreshold, 0.0, 1.0);
    Numbers.requireAtLeast("maxSpeedMultiplier", maxSpeedMultiplier, 1.0);
    Numbers.requireAtLeast("maxProximityMultiplier", maxProximityMultiplier, 1.0);
    Numbers.requireAtLeast("maxTimeWindowExtensionMs", maxTimeWindowExtensionMs, 0.0);
  }

  /**
   * Default thresholds tuned for the shipped game build.
   *
   * @return default options
   */
  public static AntiCheatOptions defaults() {
    return new AntiCheatOptions(1.2, 48.0, 100.0, 30.0, 0.8, true, 2.0, 1.8, 500.0);
  }

  /**
   * Builds options from a flattened configuration map, falling back to {@link #defaults()} per key.
   * Keys are read under the {@code anticheat.} prefix, e.g. {@code anticheat.baseSpeedTolerance}.
   *
   * @param settings flattened key/value settings; must not be {@code null}
   * @return options populated from {@code settings}
   * @throws IllegalArgumentException when a value is not a number or boolean, or lies out of range
   */
  public static AntiCheatOptions fromMap(Map<String, String> settings) {
    Objects.requireNonNull(settings, "settings");
    AntiCheatOptions d = defaults();
    return new AntiCheatOptions(
        number(settings, "baseSpeedTolerance", d.baseSpeedTolerance()),
        number(settings, "baseProximityTolerancePx", d.baseProximityTolerancePx()),
        number(settings, "stutterToleranceMs", d.stutterToleranceMs()),
        number(settings, "lowFpsThreshold", d.lowFpsThreshold()),
        number(settings, "confidenceThreshold", d.confidenceThreshold()),
        bool(settings, "performanceAdjustmentEnabled", d.performanceAdjustmentEnabled()),
        number(settings, "maxSpeedMultiplier", d.maxSpeedMultiplier()),
        number(settings, "maxProximityMultiplier", d.maxProximityMultiplier()),
        number(settings, "maxTimeWindowExtensionMs", d.maxTimeWindowExtensionMs()));
  }

  /**
   * Returns a copy with performance adjustment switched on or off.
   *
   * @param enabled new flag value
   * @return updated options
   */
  public AntiCheatOptions withPerformanceAdjustmentEnabled(boolean enabled) {
    return new AntiCheatOptions(
        baseSpeedTolerance,
        baseProximityTolerancePx,
        stutterToleranceMs,
        lowFpsThreshold,
        confidenceThreshold,
        enabled,
        maxSpeedMultiplier,
        maxProximityMultiplier,
        maxTimeWindowExtensionMs);
  }

  /**
   * Returns a copy with a different confidence threshold.
   *
   * @param threshold new threshold in {@code [0, 1]}
   * @return updated options
   */
  public AntiCheatOptions withConfidenceThreshold(double threshold) {
    return new AntiCheatOptions(
        baseSpeedTolerance,
        baseProximityTolerancePx,
        stutterToleranceMs,
        lowFpsThreshold,
        threshold,
        performanceAdjustmentEnabled,
        maxSpeedMultiplier,
        maxProximityMultiplier,
        maxTimeWindowExtensionMs);
  }

  private static double number(Map<String, String> settings, String name, double fallback) {
    String raw = settings.get(PREFIX + name);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(PREFIX + name + " must be numeric (was '" + raw + "')", ex);
    }
  }

  private static boolean bool(Map<String, String> settings, String name, boolean fallback) {
    String raw = settings.get(PREFIX + name);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String trimmed = raw.trim();
    if ("true".equalsIgnoreCase(trimmed)) {
      return true;
    }
    if ("false".equalsIgnoreCase(trimmed)) {
      return false;
    }
    throw new IllegalArgumentException(PREFIX + name + " must be true or false (was '" + raw + "')");
  }
}
