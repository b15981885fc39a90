package com.knutgame.guard.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @Test
  void noneExporterYieldsNoopMeter() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize("NONE");

    assertTrue(result.isNoop());
    assertDoesNotThrow(() -> result.meter().counterBuilder("anticheat.session.accepted").build().add(1));
    assertDoesNotThrow(result::forceFlush);
    assertDoesNotThrow(result::close);
  }

  @Test
  void exporterModeParsing() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(" none "));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from("otlp"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(null));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
  }

  @Test
  void adapterOverNoopBootstrapAcceptsUpdates() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter("none")) {
      assertDoesNotThrow(() -> {
        adapter.increment("anticheat.session.rejected");
        adapter.observe("anticheat.validate.latencyNanos", 42L);
      });
    }
  }
}
