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

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A set of capabilities that the platform must satisfy for a key system to be usable.
 *
 * @see <a href="https://www.w3.org/TR/encrypted-media/#mediakeysystemconfiguration-dictionary">
 *     MediaKeySystemConfiguration</a>
 */
public final class MediaKeySystemConfiguration {

  /** A content type that must be decodable and decryptable. */
  public static final class MediaCapability {

    /** The MIME type including its codecs parameter, for example {@code video/mp4; codecs="..."}. */
    public final String contentType;

    public MediaCapability(String contentType) {
      this.contentType = contentType;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
      if (this == obj) {
        return true;
      }
      if (obj == null || getClass() != obj.getClass()) {
        return false;
      }
      return contentType.equals(((MediaCapability) obj).contentType);
    }

    @Override
    public int hashCode() {
      return contentType.hashCode();
    }

    @Override
    public String toString() {
      return contentType;
    }
  }

  /** The init data types that must be supported. Empty if any type is acceptable. */
  public final ImmutableList<String> initDataTypes;

  /** The video content types that must be supported. */
  public final ImmutableList<MediaCapability> videoCapabilities;

  public MediaKeySystemConfiguration(
      ImmutableList<String> initDataTypes, ImmutableList<MediaCapability> videoCapabilities) {
    this.initDataTypes = initDataTypes;
    this.videoCapabilities = videoCapabilities;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    MediaKeySystemConfiguration other = (MediaKeySystemConfiguration) obj;
    return initDataTypes.equals(other.initDataTypes)
        && videoCapabilities.equals(other.videoCapabilities);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(initDataTypes, videoCapabilities);
  }

  @Override
  public String toString() {
    return "MediaKeySystemConfiguration(initDataTypes="
        + initDataTypes
        + ", videoCapabilities="
        + videoCapabilities
        + ")";
  }
}
