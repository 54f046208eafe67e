package ca.gc.cra.loganalyzer.config;

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
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads search configuration from a YAML document and flattens it into a key/value map.
 *
 * <p>The {@code common} section is applied first, then the section named after the mode
 * ({@code search}), so mode keys win. Nested mappings become dotted keys; sequences are rejected.</p>
 *
 * <pre>{@code
 * common:
 *   metricsExporter: none
 * search:
 *   in: /var/log/app.log
 *   term: ERROR
 *   workers: 4
 * }</pre>
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode whose section should be applied
   * @return flat map of settings; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or structurally invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String section = mode.trim().toLowerCase(Locale.ROOT);
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    for (String name : new String[] {COMMON_SECTION, section}) {
      Object node = findSection(root, name);
      if (node != null) {
        flatten(asMap(node, name), "", flattened);
      }
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key.trim() : prefix + '.' + key.trim();
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML sequences are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
