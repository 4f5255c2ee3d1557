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

/** A rendition of the content, as listed by the parsed manifest. */
public final class Level {

  /** The audio codec, or null if unknown. */
  @Nullable public final String audioCodec;

  /** The video codec, or null if unknown. */
  @Nullable public final String videoCodec;

  public Level(@Nullable String audioCodec, @Nullable String videoCodec) {
    this.audioCodec = audioCodec;
    this.videoCodec = videoCodec;
  }
}
