package com.leyline.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and to apply log levels from application.yaml. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply logging levels from configuration.
   *
   * <p>Expected YAML structure: {@code logging.level.root: INFO}, {@code
   * logging.level.com.leyline: DEBUG}. Unknown level names are ignored with a warning.
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.debug("SLF4J is not bound to logback; skipping level configuration");
      return;
    }
    try {
      String rootLvl = cfg.getString("logging.level.root", null);
      if (rootLvl != null && !rootLvl.isBlank()) {
        setLevel(ctx.getLogger(Logger.ROOT_LOGGER_NAME), rootLvl);
      }

      Configuration levels = cfg.subset("logging.level");
      Iterator<String> it = levels.getKeys();
      while (it.hasNext()) {
        String key = it.next();
        if ("root".equalsIgnoreCase(key)) continue;
        String lvl = levels.getString(key, null);
        if (lvl == null || lvl.isBlank()) continue;
        // Logger names contain dots, which the expression engine escapes as "..".
        setLevel(ctx.getLogger(key.replace("..", ".")), lvl);
      }
    } catch (Exception e) {
      log.warn("Failed to apply logging configuration; keeping logback.xml settings", e);
    }
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    Level level = Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }
}
