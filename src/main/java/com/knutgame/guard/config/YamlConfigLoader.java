package com.knutgame.guard.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads anti-cheat settings from YAML, overlaying a deployment profile on the {@code common} section and
 * flattening nested mappings into dotted keys such as {@code anticheat.confidenceThreshold}.
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges the {@code common} section with the {@code profile} section; profile values win.
   *
   * @param path location of the YAML document
   * @param profile deployment profile such as {@code production} or {@code staging}; matched case-insensitively
   * @return flat settings, or empty when {@code path} does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document is not a mapping of mappings or contains lists
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String wanted = normalize(profile);
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Malformed YAML in " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> root = mapping(document, "document root");
    Map<String, String> settings = new LinkedHashMap<>();
    for (String section : new String[] {COMMON_SECTION, wanted}) {
      Object node = section(root, section);
      if (node != null) {
        flatten(mapping(node, section), "", settings);
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Object section(Map<String, Object> root, String name) {
    return root.entrySet().stream()
        .filter(entry -> normalize(entry.getKey()).equals(name))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a YAML mapping");
    }
    Map<String, Object> result = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(where + " contains a blank or non-string key");
      }
      result.put(name, value);
    });
    return result;
  }

  private static void flatten(Map<String, Object> node, String prefix, Map<String, String> out) {
    node.forEach((key, value) -> {
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> child) {
        flatten(mapping(child, dotted), dotted, out);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Lists are not supported (key " + dotted + ")");
      } else {
        out.put(dotted, value == null ? "" : value.toString());
      }
    });
  }

  private static String normalize(String name) {
    return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
  }
}
