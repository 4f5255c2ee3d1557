/*
 * Copyright (C) 2024 The Android Open Source Project
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

import static com.google.common.truth.Truth.assertThat;

import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Log}. */
@RunWith(JUnit4.class)
public final class LogTest {

  private RecordingLogger logger;

  @Before
  public void setUp() {
    logger = new RecordingLogger();
    Log.setLogger(logger);
  }

  @After
  public void tearDown() {
    Log.setLogger(Log.Logger.DEFAULT);
    Log.setLogLevel(Log.LOG_LEVEL_ALL);
    Log.setLogStackTraces(true);
  }

  @Test
  public void logLevelWarning_dropsDebugAndInfo() {
    Log.setLogLevel(Log.LOG_LEVEL_WARNING);

    Log.d("Tag", "debug");
    Log.i("Tag", "info");
    Log.w("Tag", "warning");
    Log.e("Tag", "error");

    assertThat(logger.lines).containsExactly("W/Tag: warning", "E/Tag: error").inOrder();
  }

  @Test
  public void logLevelAll_passesThrowableToLogger() {
    IllegalStateException exception = new IllegalStateException("boom");

    Log.d("Tag", "debug");
    Log.e("Tag", "error", exception);

    assertThat(logger.lines).containsExactly("D/Tag: debug", "E/Tag: error").inOrder();
    assertThat(logger.throwables).containsExactly(null, exception).inOrder();
  }

  @Test
  public void defaultLogger_writesToPlatformLoggerNamedAfterTag() {
    java.util.logging.Logger platformLogger = java.util.logging.Logger.getLogger("LogTestTag");
    List<LogRecord> records = new ArrayList<>();
    Handler handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    platformLogger.addHandler(handler);
    Log.setLogger(Log.Logger.DEFAULT);
    Log.setLogStackTraces(false);
    try {
      Log.w("LogTestTag", "retrying", new IllegalStateException("boom"));
    } finally {
      platformLogger.removeHandler(handler);
    }

    assertThat(records).hasSize(1);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(0).getMessage()).isEqualTo("retrying\n  boom\n");
  }

  @Test
  public void logLevelOff_dropsEverything() {
    Log.setLogLevel(Log.LOG_LEVEL_OFF);

    Log.e("Tag", "error");

    assertThat(logger.lines).isEmpty();
  }

  @Test
  public void getThrowableString_withoutStackTraces_returnsMessage() {
    Log.setLogStackTraces(false);

    assertThat(Log.getThrowableString(new IllegalStateException("boom"))).isEqualTo("boom");
  }

  @Test
  public void getThrowableString_unknownHostCause_omitsStackTrace() {
    Exception exception = new IllegalStateException(new UnknownHostException("host"));

    assertThat(Log.getThrowableString(exception)).isEqualTo("UnknownHostException (no network)");
  }

  @Test
  public void appendThrowableString_withStackTraces_appendsIndentedTrace() {
    String message = Log.appendThrowableString("failed", new IllegalStateException("boom"));

    assertThat(message).startsWith("failed\n  java.lang.IllegalStateException: boom");
  }

  @Test
  public void appendThrowableString_withoutThrowable_returnsMessage() {
    assertThat(Log.appendThrowableString("message", /* throwable= */ null)).isEqualTo("message");
  }

  private static final class RecordingLogger implements Log.Logger {

    private final List<String> lines = new ArrayList<>();
    private final List<@Nullable Throwable> throwables = new ArrayList<>();

    @Override
    public void log(int level, String tag, String message, @Nullable Throwable throwable) {
      lines.add("DIWE".charAt(level) + "/" + tag + ": " + message);
      throwables.add(throwable);
    }
  }
}
