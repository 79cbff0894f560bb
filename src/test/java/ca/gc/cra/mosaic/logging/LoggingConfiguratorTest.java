package ca.gc.cra.mosaic.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  @Test
  void setRootLevelAppliesToLogback() {
    Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    Level original = root.getLevel();
    try {
      assertTrue(LoggingConfigurator.setRootLevel(Level.DEBUG));
      assertEquals(Level.DEBUG, root.getLevel());
    } finally {
      root.setLevel(original);
    }
  }
}
