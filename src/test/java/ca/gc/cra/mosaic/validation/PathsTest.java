package ca.gc.cra.mosaic.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void readableFileResolvesToRealPath() throws Exception {
    Path file = Files.writeString(tempDir.resolve("in.png"), "x");

    assertEquals(file.toRealPath(), Paths.requireReadableFile("in", file));
  }

  @Test
  void readableFileRejectsMissingAndDirectories() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("in", tempDir.resolve("missing.png")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("in", tempDir));
  }

  @Test
  void writableFileRefusesOverwriteUnlessAllowed() throws Exception {
    Path existing = Files.writeString(tempDir.resolve("out.png"), "old");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.requireWritableFile("out", existing, false, true));

    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(existing.toAbsolutePath().normalize(), Paths.requireWritableFile("out", existing, true, true));
  }

  @Test
  void writableFileCreatesParentsOnlyWhenAsked() {
    Path nested = tempDir.resolve("a/b/out.png");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.requireWritableFile("out", nested, false, false));
    assertTrue(ex.getMessage().contains("parent directory does not exist"));

    Paths.requireWritableFile("out", nested, false, true);
    assertTrue(Files.isDirectory(tempDir.resolve("a/b")));
  }
}
