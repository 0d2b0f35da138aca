package io.github.panghy.nodename.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers shared by the naming library and the nodes built on it.
 * Records are only created when the logger's JUL level permits, and each record is
 * attributed to the calling class and method rather than to this helper.
 */
public final class LoggingUtil {

  private LoggingUtil() {
    // Utility class should not be instantiated
  }

  /**
   * Gets the caller information from the stack trace.
   * Skips LoggingUtil frames to find the actual caller.
   */
  private static StackTraceElement getCaller() {
    StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // Skip: 0=getStackTrace, 1=getCaller, 2=log
    for (int i = 3; i < stack.length; i++) {
      StackTraceElement element = stack[i];
      if (!element.getClassName().equals(LoggingUtil.class.getName())) {
        return element;
      }
    }
    return stack.length > 3 ? stack[3] : stack[stack.length - 1];
  }

  private static void log(Logger logger, Level level, String message, Throwable throwable) {
    if (logger.isLoggable(level)) {
      StackTraceElement caller = getCaller();
      if (throwable == null) {
        logger.logp(level, caller.getClassName(), caller.getMethodName(), message);
      } else {
        logger.logp(level, caller.getClassName(), caller.getMethodName(), message, throwable);
      }
    }
  }

  /**
   * Logs a debug message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void debug(Logger logger, String message) {
    log(logger, Level.FINE, message, null);
  }

  /**
   * Logs an exception at the debug level with full stack trace.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void debug(Logger logger, String message, Throwable throwable) {
    log(logger, Level.FINE, message, throwable);
  }

  /**
   * Logs an info message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, message, null);
  }
}
