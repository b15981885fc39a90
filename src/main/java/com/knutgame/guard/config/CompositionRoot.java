package com.knutgame.guard.config;

import com.knutgame.guard.application.anticheat.PerformanceAwareAntiCheatService;
import com.knutgame.guard.application.anticheat.SessionIntegrityChecker;
import com.knutgame.guard.application.port.MetricsPort;
import com.knutgame.guard.application.port.SmartAntiCheat;
import com.knutgame.guard.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import com.knutgame.guard.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the anti-cheat service, integrity checker, and metrics adapter from flat settings.
 * <p><strong>Why:</strong> Gives the hosting endpoint a single place to translate configuration into ready services.</p>
 * <p><strong>Recognised keys:</strong> {@code anticheat.*} (see {@link AntiCheatOptions#fromMap(Map)}),
 * {@code metrics.exporter} ({@code otlp} or {@code none}, default {@code none}), {@code logging.verbose}.</p>
 * <p><strong>Thread-safety:</strong> Construct once at startup; the exposed services are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final AntiCheatOptions options;
  private final MetricsPort metrics;
  private final PerformanceAwareAntiCheatService antiCheat;
  private final SessionIntegrityChecker integrityChecker = new SessionIntegrityChecker();

  /**
   * Builds services from flattened settings.
   *
   * @param settings flat key/value settings; must not be {@code null}
   * @throws IllegalArgumentException when a setting is malformed
   */
  public CompositionRoot(Map<String, String> settings) {
    Objects.requireNonNull(settings, "settings");
    if (Boolean.parseBoolean(settings.getOrDefault("logging.verbose", "false").trim())) {
      LoggingConfigurator.enableVerboseLogging();
    }
    this.options = AntiCheatOptions.fromMap(settings);
    this.metrics = metricsFor(settings.getOrDefault("metrics.exporter", "none"));
    this.antiCheat = new PerformanceAwareAntiCheatService(options, metrics);
    log.info("Anti-cheat configured (adjustmentEnabled={}, confidenceThreshold={})",
        options.performanceAdjustmentEnabled(), options.confidenceThreshold());
  }

  /**
   * Builds services from a YAML file; a missing file yields default settings.
   *
   * @param path YAML configuration file
   * @param profile profile section merged over {@code common}
   * @return wired composition root
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the YAML or a setting is malformed
   */
  public static CompositionRoot fromYaml(Path path, String profile) throws IOException {
    Map<String, String> settings = YamlConfigLoader.load(path, profile).orElseGet(() -> {
      log.info("No anti-cheat configuration at {}; using defaults", path);
      return Map.of();
    });
    return new CompositionRoot(settings);
  }

  public AntiCheatOptions options() {
    return options;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public SmartAntiCheat antiCheat() {
    return antiCheat;
  }

  /**
   * Concrete service, exposing the side-effect free adjustment and confidence entry points.
   *
   * @return anti-cheat service
   */
  public PerformanceAwareAntiCheatService antiCheatService() {
    return antiCheat;
  }

  public SessionIntegrityChecker integrityChecker() {
    return integrityChecker;
  }

  private static MetricsPort metricsFor(String exporter) {
    String normalized = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    if (normalized.isEmpty() || normalized.equals("none")) {
      return MetricsPort.NO_OP;
    }
    return new OpenTelemetryMetricsAdapter(normalized);
  }
}
