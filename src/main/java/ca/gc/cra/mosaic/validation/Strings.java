package ca.gc.cra.mosaic.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String guards for CLI and configuration input.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank values and values carrying control characters.</li>
 *   <li>Validate environment variable names used for passphrase lookup.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern ENV_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    if (containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates an environment variable name such as {@code MOSAIC_PASSPHRASE}.
   *
   * @param name parameter name for diagnostics
   * @param value candidate variable name
   * @return trimmed name
   * @throws IllegalArgumentException if the name is blank or not of the form {@code [A-Za-z_][A-Za-z0-9_]*}
   */
  public static String requireEnvName(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!ENV_NAME.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(label(name) + " must be a valid environment variable name");
    }
    return trimmed;
  }

  /**
   * Returns {@code null} for blank input, otherwise the trimmed value.
   *
   * @param value candidate text, possibly {@code null}
   * @return trimmed value or {@code null}
   */
  public static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
