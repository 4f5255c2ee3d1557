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

import com.google.common.collect.ImmutableList;
import dev.mediakeys.eme.MediaKeySystemConfiguration.MediaCapability;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds the {@link MediaKeySystemConfiguration configurations} offered to the platform when
 * requesting access to a key system.
 */
public final class KeySystemConfigurations {

  /** The init data type of FairPlay Streaming key delivery. */
  public static final String INIT_DATA_TYPE_SINF = "sinf";

  private KeySystemConfigurations() {}

  /**
   * Returns the configurations to offer when requesting access to {@code keySystem}.
   *
   * <p>Audio codecs are accepted so callers can pass the full codec set of the content, but they
   * are not declared as capabilities.
   *
   * @param keySystem The identifier of the key system, see {@link KeySystem#identifier}.
   * @param audioCodecs The audio codecs the content requires.
   * @param videoCodecs The video codecs the content requires. Each codec becomes one video
   *     capability.
   * @return A non-empty list of configurations, in order of preference.
   * @throws UnsupportedKeySystemException If {@code keySystem} is not a {@link KeySystem}.
   */
  public static ImmutableList<MediaKeySystemConfiguration> getSupportedConfigurations(
      String keySystem, List<String> audioCodecs, List<String> videoCodecs)
      throws UnsupportedKeySystemException {
    @Nullable KeySystem resolvedKeySystem = KeySystem.forIdentifier(keySystem);
    if (resolvedKeySystem == null) {
      throw new UnsupportedKeySystemException(keySystem);
    }
    return getSupportedConfigurations(resolvedKeySystem, audioCodecs, videoCodecs);
  }

  /**
   * Returns the configurations to offer when requesting access to a known {@code keySystem}. See
   * {@link #getSupportedConfigurations(String, List, List)}.
   */
  public static ImmutableList<MediaKeySystemConfiguration> getSupportedConfigurations(
      KeySystem keySystem, List<String> audioCodecs, List<String> videoCodecs) {
    ImmutableList<String> initDataTypes =
        keySystem == KeySystem.FAIRPLAY
            ? ImmutableList.of(INIT_DATA_TYPE_SINF)
            : ImmutableList.of();
    return createConfigurations(initDataTypes, videoCodecs);
  }

  private static ImmutableList<MediaKeySystemConfiguration> createConfigurations(
      ImmutableList<String> initDataTypes, List<String> videoCodecs) {
    ImmutableList.Builder<MediaCapability> videoCapabilities = ImmutableList.builder();
    for (String codec : videoCodecs) {
      videoCapabilities.add(new MediaCapability("video/mp4; codecs=\"" + codec + "\""));
    }
    return ImmutableList.of(
        new MediaKeySystemConfiguration(initDataTypes, videoCapabilities.build()));
  }
}
