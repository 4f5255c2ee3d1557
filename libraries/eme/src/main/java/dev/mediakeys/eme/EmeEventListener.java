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

/** Listener of {@link EmeController} events. */
public interface EmeEventListener {

  /**
   * Called when a key-system error occurs. Errors are reported on the callback executor of the
   * {@link EmeConfiguration}.
   *
   * @param error The error. {@link KeySystemException#fatal} tells whether playback of the current
   *     content can proceed.
   */
  void onKeySystemError(KeySystemException error);
}
