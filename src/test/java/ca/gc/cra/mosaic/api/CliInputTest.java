package ca.gc.cra.mosaic.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"text=hi", "--DRY-RUN", "-v", "out=m.png", "help"});

    assertArrayEquals(new String[] {"text=hi", "out=m.png"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertTrue(input.help());
    assertFalse(input.hasFlag("--allow-overwrite"));
  }

  @Test
  void toStringMasksPassphrase() {
    String rendered = CliInput.parse(new String[] {"passphrase=hunter2", "text=hi"}).toString();

    assertFalse(rendered.contains("hunter2"));
    assertTrue(rendered.contains("passphrase=[REDACTED]"));
    assertTrue(rendered.contains("text=hi"));
  }
}
