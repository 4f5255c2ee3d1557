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
package dev.mediakeys.datasource;

import static dev.mediakeys.common.util.Assertions.checkStateNotNull;

import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.io.ByteStreams;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.mediakeys.common.util.Util;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLConnection;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An {@link HttpTransport} that uses {@link HttpURLConnection}.
 *
 * <p>Requests run on an {@link ExecutorService}. If none is passed, all requests run on a daemon
 * thread named {@link #DEFAULT_THREAD_NAME} that is shared between instances of this class.
 *
 * <p>{@link HttpRequest#withCredentials} is not interpreted, as {@link HttpURLConnection} only
 * sends cookies if a process-wide {@link java.net.CookieHandler} is installed.
 */
public final class DefaultHttpTransport implements HttpTransport {

  /** The default connect timeout, in milliseconds. */
  public static final int DEFAULT_CONNECT_TIMEOUT_MILLIS = 8 * 1000;

  /** The default read timeout, in milliseconds. */
  public static final int DEFAULT_READ_TIMEOUT_MILLIS = 8 * 1000;

  /** The default user agent. */
  public static final String DEFAULT_USER_AGENT = "Mediakeys";

  private static final String CONTENT_TYPE = "Content-Type";
  private static final String DEFAULT_BODY_CONTENT_TYPE = "application/octet-stream";

  /** The name of the thread that runs requests if no executor service is passed. */
  public static final String DEFAULT_THREAD_NAME = "DefaultHttpTransport:request";

  private static final Supplier<ListeningExecutorService> DEFAULT_EXECUTOR_SERVICE =
      Suppliers.memoize(
          () ->
              MoreExecutors.listeningDecorator(
                  Executors.newSingleThreadExecutor(
                      new ThreadFactoryBuilder()
                          .setNameFormat(DEFAULT_THREAD_NAME)
                          .setDaemon(true)
                          .build())));

  private final ListeningExecutorService executorService;
  private final String userAgent;
  private final int connectTimeoutMillis;
  private final int readTimeoutMillis;

  /** Creates an instance that runs requests on an executor service shared between instances. */
  public DefaultHttpTransport() {
    this(checkStateNotNull(DEFAULT_EXECUTOR_SERVICE.get()));
  }

  /** Creates an instance that runs requests on {@code executorService}. */
  public DefaultHttpTransport(ExecutorService executorService) {
    this(
        executorService,
        DEFAULT_USER_AGENT,
        DEFAULT_CONNECT_TIMEOUT_MILLIS,
        DEFAULT_READ_TIMEOUT_MILLIS);
  }

  /**
   * @param executorService The executor service on which requests run.
   * @param userAgent The User-Agent string that should be used.
   * @param connectTimeoutMillis The connection timeout, in milliseconds. A timeout of zero is
   *     interpreted as an infinite timeout.
   * @param readTimeoutMillis The read timeout, in milliseconds. A timeout of zero is interpreted as
   *     an infinite timeout.
   */
  public DefaultHttpTransport(
      ExecutorService executorService,
      String userAgent,
      int connectTimeoutMillis,
      int readTimeoutMillis) {
    this.executorService = MoreExecutors.listeningDecorator(executorService);
    this.userAgent = userAgent;
    this.connectTimeoutMillis = connectTimeoutMillis;
    this.readTimeoutMillis = readTimeoutMillis;
  }

  @Override
  public ListenableFuture<HttpResponse> execute(HttpRequest request) {
    return executorService.submit(() -> executeBlocking(request));
  }

  private HttpResponse executeBlocking(HttpRequest request) throws IOException {
    HttpURLConnection connection = makeConnection(request);
    try {
      byte @Nullable [] body = request.body;
      if (body != null) {
        connection.setDoOutput(true);
        connection.setFixedLengthStreamingMode(body.length);
        try (OutputStream outputStream = connection.getOutputStream()) {
          outputStream.write(body);
        }
      }
      int statusCode = connection.getResponseCode();
      String statusMessage = Strings.nullToEmpty(connection.getResponseMessage());
      return new HttpResponse(statusCode, statusMessage, readResponseBody(connection, statusCode));
    } finally {
      connection.disconnect();
    }
  }

  /** Configures a connection, but does not open it. */
  private HttpURLConnection makeConnection(HttpRequest request) throws IOException {
    URLConnection urlConnection = new URL(request.url).openConnection();
    if (!(urlConnection instanceof HttpURLConnection)) {
      throw new IOException("Unsupported URL: " + request.url);
    }
    HttpURLConnection connection = (HttpURLConnection) urlConnection;
    connection.setConnectTimeout(connectTimeoutMillis);
    connection.setReadTimeout(readTimeoutMillis);
    connection.setRequestMethod(request.method);
    connection.setDoOutput(false);
    connection.setRequestProperty("User-Agent", userAgent);
    if (request.body != null && !request.headers.containsKey(CONTENT_TYPE)) {
      connection.setRequestProperty(CONTENT_TYPE, DEFAULT_BODY_CONTENT_TYPE);
    }
    for (Map.Entry<String, String> header : request.headers.entrySet()) {
      connection.setRequestProperty(header.getKey(), header.getValue());
    }
    return connection;
  }

  private static byte[] readResponseBody(HttpURLConnection connection, int statusCode)
      throws IOException {
    @Nullable
    InputStream inputStream =
        statusCode >= 400 ? connection.getErrorStream() : connection.getInputStream();
    if (inputStream == null) {
      return Util.EMPTY_BYTE_ARRAY;
    }
    try (InputStream stream = inputStream) {
      return ByteStreams.toByteArray(stream);
    }
  }
}
