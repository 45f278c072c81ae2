package ca.gc.cra.safestream.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
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
 * Reads a YAML document and flattens the {@code common} section plus one named section into dotted keys.
 * <p>Keys from the named section override {@code common}. Section names match case-insensitively.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads and flattens {@code path}.
   *
   * @param path YAML file
   * @param section section merged over {@code common}
   * @return flattened map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or not a mapping of mappings
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, section, path.toString()));
    }
  }

  /**
   * Loads and flattens a classpath resource.
   *
   * @param resource resource name, resolved against the class loader of this class
   * @param section section merged over {@code common}
   * @return flattened map, or empty when the resource is absent
   * @throws IOException when the resource cannot be read
   */
  public static Optional<Map<String, String>> loadResource(String resource, String section) throws IOException {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(section, "section");
    InputStream in = YamlConfigLoader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      return Optional.empty();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, section, resource));
    }
  }

  private static Map<String, String> parse(Reader reader, String section, String origin) {
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + origin, ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    String wanted = section.trim().toLowerCase(Locale.ROOT);
    flattenSection(root, COMMON_SECTION, flattened);
    if (!wanted.equals(COMMON_SECTION)) {
      flattenSection(root, wanted, flattened);
    }
    return Map.copyOf(flattened);
  }

  private static void flattenSection(Map<String, Object> root, String name, Map<String, String> target) {
    root.entrySet().stream()
        .filter(entry -> entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name))
        .map(Map.Entry::getValue)
        .filter(Objects::nonNull)
        .findFirst()
        .ifPresent(node -> flatten(asMap(node, name), "", target));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(name, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML sequences are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    });
  }
}
