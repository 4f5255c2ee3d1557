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
package dev.mediakeys.eme;

import static dev.mediakeys.common.util.Assertions.checkState;
import static dev.mediakeys.common.util.Assertions.checkStateNotNull;

import dev.mediakeys.datasource.HttpRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A license request under construction, passed to a {@link LicenseRequestSetup} so that the
 * application can choose the method and URL and add headers.
 *
 * <p>Headers can only be set after {@link #open}. Opening the request again discards the headers
 * set so far.
 */
public final class LicenseRequest {

  private final Map<String, String> headers;

  @Nullable private String method;
  @Nullable private String url;
  private boolean withCredentials;

  /* package */ LicenseRequest() {
    headers = new LinkedHashMap<>();
  }

  /**
   * Opens the request.
   *
   * @param method The HTTP method, for example {@link HttpRequest#METHOD_POST}.
   * @param url The URL to send the request to.
   */
  public void open(String method, String url) {
    this.method = method;
    this.url = url;
    headers.clear();
  }

  /** Returns whether {@link #open} was called. */
  public boolean isOpened() {
    return method != null;
  }

  /**
   * Sets a request header, replacing any previous value.
   *
   * @throws IllegalStateException If the request is not opened.
   */
  public void setRequestHeader(String name, String value) {
    checkState(isOpened(), "Request headers can only be set on an opened request");
    headers.put(name, value);
  }

  /** Sets whether credentials such as cookies are sent with the request. */
  public void setWithCredentials(boolean withCredentials) {
    this.withCredentials = withCredentials;
  }

  /** Returns the method, or null if the request is not opened. */
  @Nullable
  public String getMethod() {
    return method;
  }

  /** Returns the URL, or null if the request is not opened. */
  @Nullable
  public String getUrl() {
    return url;
  }

  /** Returns whether credentials are sent with the request. */
  public boolean getWithCredentials() {
    return withCredentials;
  }

  /** Builds the {@link HttpRequest} that sends {@code body}. */
  /* package */ HttpRequest toHttpRequest(byte[] body) {
    return new HttpRequest.Builder()
        .setMethod(checkStateNotNull(method))
        .setUrl(checkStateNotNull(url))
        .setHeaders(headers)
        .setWithCredentials(withCredentials)
        .setBody(body)
        .build();
  }
}
