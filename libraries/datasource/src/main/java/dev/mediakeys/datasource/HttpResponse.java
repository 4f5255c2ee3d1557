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

/** The response to an {@link HttpRequest}. */
public final class HttpResponse {

  /** The status code of a successful response. */
  public static final int STATUS_OK = 200;

  /** The HTTP status code. */
  public final int statusCode;

  /** The HTTP status message, or an empty string if the server did not send one. */
  public final String statusMessage;

  /** The response body. Empty if the response had none. */
  public final byte[] body;

  public HttpResponse(int statusCode, String statusMessage, byte[] body) {
    this.statusCode = statusCode;
    this.statusMessage = statusMessage;
    this.body = body;
  }

  /** Returns whether the status code is {@link #STATUS_OK}. */
  public boolean isOk() {
    return statusCode == STATUS_OK;
  }
}
