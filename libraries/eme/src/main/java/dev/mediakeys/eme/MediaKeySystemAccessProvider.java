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

import com.google.common.util.concurrent.ListenableFuture;
import java.util.List;

/**
 * Queries the platform for access to a key system. Implementations wrap the platform API and may
 * be substituted in tests.
 */
public interface MediaKeySystemAccessProvider {

  /**
   * Requests access to a key system.
   *
   * @param keySystem The identifier of the key system.
   * @param supportedConfigurations The acceptable configurations, in order of preference.
   * @return A future that completes with the access handle, or fails if the platform cannot
   *     satisfy any of {@code supportedConfigurations}.
   */
  ListenableFuture<MediaKeySystemAccess> requestMediaKeySystemAccess(
      String keySystem, List<MediaKeySystemConfiguration> supportedConfigurations);
}
