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

/** Granted access to a key system, from which the {@link MediaKeys} of a CDM are created. */
public interface MediaKeySystemAccess {

  /** Returns the identifier of the key system access was granted for. */
  String getKeySystem();

  /** Creates the {@link MediaKeys} of the CDM. */
  ListenableFuture<MediaKeys> createMediaKeys();
}
