/*
 * Copyright (C) 2018 The Android Open Source Project
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
package dev.mediakeys.common.util;

import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.net.UnknownHostException;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.dataflow.qual.Pure;

/**
 * Logging facade with a settable log level and a pluggable output.
 *
 * <p>By default messages go to {@code java.util.logging}, with the tag as the logger name.
 */
public final class Log {

  /** Log level to log all messages. */
  public static final int LOG_LEVEL_ALL = 0;

  /** Log level to only log informative, warning and error messages. */
  public static final int LOG_LEVEL_INFO = 1;

  /** Log level to only log warning and error messages. */
  public static final int LOG_LEVEL_WARNING = 2;

  /** Log level to only log error messages. */
  public static final int LOG_LEVEL_ERROR = 3;

  /** Log level to disable all logging. */
  public static final int LOG_LEVEL_OFF = Integer.MAX_VALUE;

  /** Output of tagged log messages. */
  public interface Logger {

    /** Writes to {@code java.util.logging}, appending the throwable string to the message. */
    Logger DEFAULT =
        (level, tag, message, throwable) ->
            java.util.logging.Logger.getLogger(tag)
                .log(toJulLevel(level), appendThrowableString(message, throwable));

    /**
     * Outputs a message.
     *
     * @param level The level of the message. One of {@link #LOG_LEVEL_ALL} (debug), {@link
     *     #LOG_LEVEL_INFO}, {@link #LOG_LEVEL_WARNING} or {@link #LOG_LEVEL_ERROR}.
     * @param tag The tag of the message.
     * @param message The message.
     * @param throwable The {@link Throwable} associated with the message, or null.
     */
    void log(int level, String tag, String message, @Nullable Throwable throwable);
  }

  private static final Object lock = new Object();

  @GuardedBy("lock")
  private static int logLevel = LOG_LEVEL_ALL;

  @GuardedBy("lock")
  private static boolean logStackTraces = true;

  @GuardedBy("lock")
  private static Logger logger = Logger.DEFAULT;

  private Log() {}

  /**
   * Sets the log level. Messages below it are dropped.
   *
   * @param logLevel One of {@link #LOG_LEVEL_ALL}, {@link #LOG_LEVEL_INFO}, {@link
   *     #LOG_LEVEL_WARNING}, {@link #LOG_LEVEL_ERROR} or {@link #LOG_LEVEL_OFF}.
   */
  public static void setLogLevel(int logLevel) {
    synchronized (lock) {
      Log.logLevel = logLevel;
    }
  }

  /** Sets whether stack traces of {@link Throwable}s are logged. Enabled by default. */
  public static void setLogStackTraces(boolean logStackTraces) {
    synchronized (lock) {
      Log.logStackTraces = logStackTraces;
    }
  }

  /** Sets the output of log messages. */
  public static void setLogger(Logger logger) {
    synchronized (lock) {
      Log.logger = logger;
    }
  }

  /** Logs a debug message. */
  @Pure
  public static void d(String tag, String message) {
    log(LOG_LEVEL_ALL, tag, message, /* throwable= */ null);
  }

  /** Logs an informative message. */
  @Pure
  public static void i(String tag, String message) {
    log(LOG_LEVEL_INFO, tag, message, /* throwable= */ null);
  }

  /** Logs a warning. */
  @Pure
  public static void w(String tag, String message) {
    log(LOG_LEVEL_WARNING, tag, message, /* throwable= */ null);
  }

  /** Logs a warning with the {@link Throwable} that caused it. */
  @Pure
  public static void w(String tag, String message, @Nullable Throwable throwable) {
    log(LOG_LEVEL_WARNING, tag, message, throwable);
  }

  /** Logs an error. */
  @Pure
  public static void e(String tag, String message) {
    log(LOG_LEVEL_ERROR, tag, message, /* throwable= */ null);
  }

  /** Logs an error with the {@link Throwable} that caused it. */
  @Pure
  public static void e(String tag, String message, @Nullable Throwable throwable) {
    log(LOG_LEVEL_ERROR, tag, message, throwable);
  }

  /**
   * Returns a string representation of a {@link Throwable} for logging. This is the stack trace
   * unless {@link #setLogStackTraces stack traces are disabled}, in which case it is the message.
   *
   * <p>Failures caused by an {@link UnknownHostException} are shortened to a fixed string, as they
   * are expected whenever the license or certificate server cannot be resolved.
   *
   * @return The string representation, or null if {@code throwable} is null.
   */
  @Nullable
  @Pure
  public static String getThrowableString(@Nullable Throwable throwable) {
    if (throwable == null) {
      return null;
    }
    synchronized (lock) {
      if (isCausedByUnknownHostException(throwable)) {
        return "UnknownHostException (no network)";
      } else if (!logStackTraces) {
        return throwable.getMessage();
      } else {
        return Throwables.getStackTraceAsString(throwable).trim().replace("\t", "    ");
      }
    }
  }

  /** Appends the non-empty {@link #getThrowableString(Throwable)} to {@code message}. */
  @Pure
  public static String appendThrowableString(String message, @Nullable Throwable throwable) {
    @Nullable String throwableString = getThrowableString(throwable);
    if (!Strings.isNullOrEmpty(throwableString)) {
      message += "\n  " + throwableString.replace("\n", "\n  ") + '\n';
    }
    return message;
  }

  private static void log(int level, String tag, String message, @Nullable Throwable throwable) {
    synchronized (lock) {
      if (level >= logLevel) {
        logger.log(level, tag, message, throwable);
      }
    }
  }

  private static Level toJulLevel(int level) {
    switch (level) {
      case LOG_LEVEL_ALL:
        return Level.FINE;
      case LOG_LEVEL_INFO:
        return Level.INFO;
      case LOG_LEVEL_WARNING:
        return Level.WARNING;
      default:
        return Level.SEVERE;
    }
  }

  @Pure
  private static boolean isCausedByUnknownHostException(@Nullable Throwable throwable) {
    while (throwable != null) {
      if (throwable instanceof UnknownHostException) {
        return true;
      }
      throwable = throwable.getCause();
    }
    return false;
  }
}
