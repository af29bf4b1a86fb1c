/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.pinverse.common.log;

import java.util.Collection;
import java.util.List;
import java.util.Queue;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import com.google.common.collect.Lists;

/**
 * Simple {@link Handler} that records recent log lines in memory. Used to capture iteration traces
 * and to give command line tools a sensible one-line log format.
 */
public final class MemoryHandler extends Handler {

  private static final int NUM_LINES = 1000;
  private static final String LOG_FORMAT_PROP = "java.util.logging.SimpleFormatter.format";

  private static final Collection<Logger> DEBUG_LOGGERS = Lists.newArrayList();

  private final Queue<String> logLines;

  public MemoryHandler() {
    logLines = Lists.newLinkedList();
    setFormatter(new SimpleFormatter());
    setLevel(Level.FINE);
  }

  /**
   * @return a snapshot of recent log lines, oldest first
   */
  public List<String> getLogLines() {
    synchronized (logLines) {
      return Lists.newArrayList(logLines);
    }
  }

  @Override
  public void publish(LogRecord logRecord) {
    if (!isLoggable(logRecord)) {
      return;
    }
    String line = getFormatter().formatMessage(logRecord);
    synchronized (logLines) {
      logLines.add(line);
      while (logLines.size() > NUM_LINES) {
        logLines.remove();
      }
    }
  }

  @Override
  public void flush() {
  }

  @Override
  public void close() {
    synchronized (logLines) {
      logLines.clear();
    }
  }

  /**
   * Attaches a new handler to the named {@code java.util.logging} logger, and lowers that logger's level
   * so that messages at {@code level} reach it.
   *
   * @param loggerName logger to listen to, usually a class name
   * @param level lowest level to record
   * @return the attached handler; remove it with {@link #detach(String)}
   */
  public static MemoryHandler attachTo(String loggerName, Level level) {
    MemoryHandler handler = new MemoryHandler();
    handler.setLevel(level);
    Logger julLogger = Logger.getLogger(loggerName);
    julLogger.setLevel(level);
    julLogger.addHandler(handler);
    return handler;
  }

  /**
   * Removes all {@link MemoryHandler}s from the named logger.
   */
  public static void detach(String loggerName) {
    Logger julLogger = Logger.getLogger(loggerName);
    for (Handler handler : julLogger.getHandlers()) {
      if (handler instanceof MemoryHandler) {
        julLogger.removeHandler(handler);
        handler.close();
      }
    }
  }

  /**
   * <p>Sets the {@code java.util.logging} default output format to something more sensible than the 2-line default.
   * This can be overridden further on the command line. The format is like:</p>
   *
   * <p><pre>
   * Mon Nov 26 23:16:09 GMT 2012 INFO Converged after 7 iterations
   * </pre></p>
   */
  public static void setSensibleLogFormat() {
    if (System.getProperty(LOG_FORMAT_PROP) == null) {
      System.setProperty(LOG_FORMAT_PROP, "%1$tc %4$s %5$s%6$s%n");
    }
  }

  /**
   * Lowers the {@code java.util.logging} level of the named loggers, and so of every logger beneath
   * them, and of the handlers up their parent chain, to {@link Level#FINE}. A package name enables
   * the whole package.
   */
  public static void enableDebugLoggingIn(String... loggerNames) {
    for (String loggerName : loggerNames) {
      Logger julLogger = Logger.getLogger(loggerName);
      julLogger.setLevel(Level.FINE);
      // LogManager only holds loggers weakly; a collected logger would lose its level
      synchronized (DEBUG_LOGGERS) {
        DEBUG_LOGGERS.add(julLogger);
      }
      while (julLogger != null) {
        for (Handler handler : julLogger.getHandlers()) {
          handler.setLevel(Level.FINE);
        }
        julLogger = julLogger.getParent();
      }
    }
  }

}
