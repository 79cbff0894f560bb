package ca.gc.cra.mosaic.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> File path guards for CLI input and output files.
 * <p><strong>Why:</strong> Bad paths should fail before any encoding work starts, with a message naming
 * the argument.</p>
 * <p><strong>Thread-safety:</strong> Stateless; results reflect the filesystem at call time only.</p>
 *
 * @implNote Paths are normalized to absolute form; symbolic links are resolved only for existing files.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures {@code path} names an existing, readable regular file.
   *
   * @param name argument name for diagnostics
   * @param path candidate path
   * @return real path of the file
   * @throws IllegalArgumentException if the path is {@code null}, malformed, missing, not a regular file,
   *     or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Ensures {@code path} can be written as a file.
   *
   * @param name argument name for diagnostics
   * @param path candidate path
   * @param allowOverwrite whether an existing file may be replaced
   * @param createParents whether missing parent directories are created
   * @return normalized absolute path
   * @throws IllegalArgumentException if the path is malformed, names a directory, exists without
   *     {@code allowOverwrite}, or its parent is missing or not writable
   */
  public static Path requireWritableFile(String name, Path path, boolean allowOverwrite, boolean createParents) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            name + " " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException(name + " is not writable: " + normalized);
      }
      return normalized;
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException(name + " has no parent directory: " + normalized);
    }
    if (!Files.exists(parent)) {
      if (!createParents) {
        throw new IllegalArgumentException(name + " parent directory does not exist: " + parent);
      }
      try {
        Files.createDirectories(parent);
      } catch (IOException ex) {
        throw new IllegalArgumentException("unable to create " + parent + ": " + ex.getMessage(), ex);
      }
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent is not a directory: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
