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

/** The content protection key declared by a loaded level. */
public final class LevelKey {

  /**
   * The key format, or null if the playlist does not declare one. Selects the key system, see
   * {@link KeySystem#forKeyFormat}.
   */
  @Nullable public final String keyFormat;

  public LevelKey(@Nullable String keyFormat) {
    this.keyFormat = keyFormat;
  }
}
