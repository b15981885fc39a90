package com.knutgame.guard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void profileOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("guard.yaml");
    Files.writeString(yaml, """
        common:
          metrics:
            exporter: none
          anticheat:
            confidenceThreshold: 0.8
            maxSpeedMultiplier: 2.0
        staging:
          anticheat:
            confidenceThreshold: 0.5
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "staging").orElseThrow();

    assertEquals("none", map.get("metrics.exporter"));
    assertEquals("0.5", map.get("anticheat.confidenceThreshold"));
    assertEquals("2.0", map.get("anticheat.maxSpeedMultiplier"));
  }

  @Test
  void profileMatchIsCaseInsensitive() throws IOException {
    Path yaml = tempDir.resolve("case.yaml");
    Files.writeString(yaml, """
        Production:
          anticheat:
            performanceAdjustmentEnabled: false
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "PRODUCTION").orElseThrow();

    assertEquals("false", map.get("anticheat.performanceAdjustmentEnabled"));
  }

  @Test
  void unknownProfileKeepsCommonOnly() throws IOException {
    Path yaml = tempDir.resolve("common.yaml");
    Files.writeString(yaml, """
        common:
          logging:
            verbose: true
        production:
          anticheat:
            lowFpsThreshold: 25
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "staging").orElseThrow();

    assertEquals(Map.of("logging.verbose", "true"), map);
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "production");

    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptySettings() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "production");

    assertTrue(result.isPresent());
    assertTrue(result.orElseThrow().isEmpty());
  }

  @Test
  void listsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        common:
          anticheat:
            thresholds: [1, 2, 3]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "production"));
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - production:
            anticheat: {}
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "production"));
  }

  @Test
  void malformedYamlThrows() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "common: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "production"));
  }
}
