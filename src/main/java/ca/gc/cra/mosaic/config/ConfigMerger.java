package ca.gc.cra.mosaic.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Merges configuration layers with precedence CLI &gt; YAML &gt; defaults.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Overlay the layers and report CLI keys that shadow YAML keys.</li>
 *   <li>Reject combinations no single command accepts, such as two passphrase sources.</li>
 *   <li>Keep passphrases out of configuration files.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ConfigMerger {
  private ConfigMerger() {}

  /**
   * Builds the effective option map for a command.
   *
   * @param mode {@code encode} or {@code decode}; must not be {@code null}
   * @param yaml flattened YAML options, if a config file was given; must not be {@code null}
   * @param cli CLI options; may be {@code null}
   * @param defaults defaults for the mode; may be {@code null}
   * @param warn sink for override warnings; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException if the merged options are contradictory
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlOptions = yaml.orElse(Map.of());
    Map<String, String> cliOptions = cli == null ? Map.of() : cli;

    if (yamlOptions.containsKey("passphrase")) {
      throw new IllegalArgumentException(
          "passphrase must not be stored in a configuration file; use passphraseEnv instead");
    }

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlOptions);
    for (Map.Entry<String, String> entry : cliOptions.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlOptions.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }
    // A CLI passphrase source replaces whichever source the file chose.
    if (cliOptions.containsKey("passphrase") && !cliOptions.containsKey("passphraseEnv")) {
      merged.remove("passphraseEnv");
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (isSet(effective, "passphrase") && isSet(effective, "passphraseEnv")) {
      throw new IllegalArgumentException("passphrase and passphraseEnv are mutually exclusive");
    }
    if ("encode".equalsIgnoreCase(mode.trim()) && isSet(effective, "text") && isSet(effective, "in")) {
      throw new IllegalArgumentException("text and in are mutually exclusive for encode");
    }
  }

  private static boolean isSet(Map<String, String> map, String key) {
    String value = map.get(key);
    return value != null && !value.isBlank();
  }
}
