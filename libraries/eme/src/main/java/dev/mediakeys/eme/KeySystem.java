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

/** The key systems that can be negotiated with the platform. */
public enum KeySystem {

  /** Widevine. Init data is passed to the CDM as is. */
  WIDEVINE("com.widevine.alpha", /* usesServerCertificate= */ false),

  /**
   * FairPlay Streaming. Key delivery is in-band through {@code sinf} init data, and a server
   * certificate is set on the media keys before use.
   */
  FAIRPLAY("com.apple.fps.1_0", /* usesServerCertificate= */ true);

  /** The key format of playlist keys that are delivered through FairPlay Streaming. */
  public static final String KEY_FORMAT_FAIRPLAY = "com.apple.streamingkeydelivery";

  /** The identifier passed to the platform when requesting access. */
  public final String identifier;

  /** Whether a server certificate is set on the media keys of this key system. */
  public final boolean usesServerCertificate;

  KeySystem(String identifier, boolean usesServerCertificate) {
    this.identifier = identifier;
    this.usesServerCertificate = usesServerCertificate;
  }

  /**
   * Returns the key system with the given identifier, or null if the identifier is not supported.
   */
  @Nullable
  public static KeySystem forIdentifier(String identifier) {
    for (KeySystem keySystem : values()) {
      if (keySystem.identifier.equals(identifier)) {
        return keySystem;
      }
    }
    return null;
  }

  /**
   * Returns the key system that serves keys of the given playlist key format. Formats other than
   * {@link #KEY_FORMAT_FAIRPLAY} map to {@link #WIDEVINE}.
   */
  public static KeySystem forKeyFormat(@Nullable String keyFormat) {
    return KEY_FORMAT_FAIRPLAY.equals(keyFormat) ? FAIRPLAY : WIDEVINE;
  }
}
