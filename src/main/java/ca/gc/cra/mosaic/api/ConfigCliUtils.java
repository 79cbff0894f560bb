package ca.gc.cra.mosaic.api;

import ca.gc.cra.mosaic.config.ConfigMerger;
import ca.gc.cra.mosaic.config.DefaultsForMode;
import ca.gc.cra.mosaic.config.YamlConfigLoader;
import ca.gc.cra.mosaic.validation.Paths;
import ca.gc.cra.mosaic.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Helpers shared by the encode and decode commands for configuration and secrets.
 *
 * @since 0.1.0
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} (or {@code --config}) entry.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Loads the optional YAML file named by {@code config=}.
   *
   * @param mode command name selecting the YAML section
   * @param cli mutable CLI map; the {@code config} entry is consumed
   * @return flattened file options, or empty when no file was named
   * @throws IllegalArgumentException if the file is missing or malformed
   * @throws IOException if the file cannot be read
   */
  static Optional<Map<String, String>> loadConfigFile(String mode, Map<String, String> cli) throws IOException {
    String configPath = extractConfigPath(cli);
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Paths.requireReadableFile("config", Path.of(configPath));
    return YamlConfigLoader.load(yamlPath, mode);
  }

  /**
   * Merges file options with the CLI map and the mode defaults.
   *
   * @param mode command name
   * @param yaml options from {@link #loadConfigFile(String, Map)}
   * @param cli CLI options
   * @param warn sink for override warnings
   * @return mutable effective options
   * @throws IllegalArgumentException if the merged options are contradictory
   */
  static Map<String, String> effectiveConfig(
      String mode, Optional<Map<String, String>> yaml, Map<String, String> cli, Consumer<String> warn) {
    return new LinkedHashMap<>(
        ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), warn));
  }

  /**
   * Resolves the passphrase from {@code passphrase=} or the variable named by {@code passphraseEnv=}.
   *
   * @param effective merged options
   * @param env environment lookup, usually {@code System::getenv}
   * @return passphrase, or {@code null} when none was configured
   * @throws IllegalArgumentException if {@code passphraseEnv} names a variable that is unset or blank
   */
  static String resolvePassphrase(Map<String, String> effective, Function<String, String> env) {
    String direct = Strings.trimToNull(effective.get("passphrase"));
    if (direct != null) {
      return direct;
    }
    String envName = Strings.trimToNull(effective.get("passphraseEnv"));
    if (envName == null) {
      return null;
    }
    String value = env.apply(Strings.requireEnvName("passphraseEnv", envName));
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("environment variable " + envName + " is not set");
    }
    return value;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    return parseBoolean(map, key, false);
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
