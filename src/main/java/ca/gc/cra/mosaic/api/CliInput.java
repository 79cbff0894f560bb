package ca.gc.cra.mosaic.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw command-line arguments into {@code key=value} pairs and bare flags.
 *
 * <p>{@code --help}, {@code -h} and {@code help} request usage; {@code --verbose}, {@code -v} and
 * {@code --debug} request DEBUG logging. Any other argument starting with {@code -} and lacking {@code =}
 * is kept as a lower-cased flag such as {@code --dry-run}.</p>
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.flags = Set.copyOf(flags);
  }

  /**
   * Parses arguments; {@code null} and blank entries are skipped.
   *
   * @param args raw arguments, possibly {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv, flags);
  }

  /** @return copy of the non-flag arguments in order */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /** @return {@code true} when usage was requested */
  public boolean help() {
    return flags.contains("--help");
  }

  /** @return {@code true} when DEBUG logging was requested */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Tests for a flag, case-insensitively.
   *
   * @param flag flag including its dashes, e.g. {@code --dry-run}
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /** @return all flags seen */
  public Set<String> flags() {
    return flags;
  }

  @Override
  public String toString() {
    return "CliInput{args=" + keyValueArgs.stream().map(CliInput::maskSecret).toList() + ", flags=" + flags + "}";
  }

  private static String maskSecret(String arg) {
    return arg.toLowerCase(Locale.ROOT).startsWith("passphrase=") ? "passphrase=[REDACTED]" : arg;
  }
}
