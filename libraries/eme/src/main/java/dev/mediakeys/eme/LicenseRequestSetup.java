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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Customizes license requests before they are sent. */
public interface LicenseRequestSetup {

  /**
   * Sets up a license request.
   *
   * <p>The request is usually not opened yet. Implementations that only add headers may throw
   * when called with an unopened request, in which case they are called again after the request
   * was opened with {@code POST} to {@code url}. A request left unopened is opened that way too.
   *
   * @param request The request to set up.
   * @param url The license server URL of the active key system.
   * @param keyId The key id extracted from the init data, or null if none is known.
   * @throws Exception If the request cannot be set up.
   */
  void setUp(LicenseRequest request, String url, @Nullable String keyId) throws Exception;
}
