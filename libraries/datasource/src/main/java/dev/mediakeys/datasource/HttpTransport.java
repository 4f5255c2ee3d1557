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

import com.google.common.util.concurrent.ListenableFuture;

/** Executes {@link HttpRequest HttpRequests} asynchronously. */
public interface HttpTransport {

  /**
   * Executes a request.
   *
   * <p>The returned future completes with a response for every HTTP status the server answers
   * with, including error statuses. It fails only if no response could be obtained, for example
   * because the connection could not be established.
   *
   * @param request The request to execute.
   * @return A future for the response. Cancelling it abandons the request.
   */
  ListenableFuture<HttpResponse> execute(HttpRequest request);
}
