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

import static dev.mediakeys.common.util.Assertions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.mediakeys.common.util.Util;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An immutable HTTP request handed to an {@link HttpTransport}. */
public final class HttpRequest {

  /** The GET request method. */
  public static final String METHOD_GET = "GET";

  /** The POST request method. */
  public static final String METHOD_POST = "POST";

  /** Builds {@link HttpRequest} instances. */
  public static final class Builder {

    private final Map<String, String> headers;

    @Nullable private String url;
    private String method;
    private byte @Nullable [] body;
    private boolean withCredentials;

    /** Creates a new instance for a GET request without headers or body. */
    public Builder() {
      headers = new LinkedHashMap<>();
      method = METHOD_GET;
    }

    /**
     * Sets the request URL. Must be called before {@link #build()}.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setUrl(String url) {
      this.url = url;
      return this;
    }

    /**
     * Sets the request method. The default is {@link #METHOD_GET}.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setMethod(String method) {
      this.method = method;
      return this;
    }

    /**
     * Sets a request header, replacing any previous value of the same name.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setHeader(String name, String value) {
      headers.put(checkNotNull(name), checkNotNull(value));
      return this;
    }

    /**
     * Sets all entries of {@code headers} as request headers.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setHeaders(Map<String, String> headers) {
      for (Map.Entry<String, String> header : headers.entrySet()) {
        setHeader(header.getKey(), header.getValue());
      }
      return this;
    }

    /**
     * Sets the request body, or null for a request without a body.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setBody(byte @Nullable [] body) {
      this.body = body;
      return this;
    }

    /**
     * Sets whether credentials such as cookies should accompany a cross-origin request.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setWithCredentials(boolean withCredentials) {
      this.withCredentials = withCredentials;
      return this;
    }

    /** Returns a new {@link HttpRequest}. */
    public HttpRequest build() {
      return new HttpRequest(this);
    }
  }

  /** The request URL. */
  public final String url;

  /** The request method. */
  public final String method;

  /** The request headers, in insertion order. */
  public final ImmutableMap<String, String> headers;

  /** The request body, or null if the request has no body. */
  public final byte @Nullable [] body;

  /** Whether credentials should accompany a cross-origin request. */
  public final boolean withCredentials;

  private HttpRequest(Builder builder) {
    url = checkNotNull(builder.url, "url");
    method = builder.method;
    headers = ImmutableMap.copyOf(builder.headers);
    body = Util.nullSafeArrayCopy(builder.body);
    withCredentials = builder.withCredentials;
  }

  @Override
  public String toString() {
    return method + " " + url;
  }
}
