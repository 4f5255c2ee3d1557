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
import org.checkerframework.checker.nullness.qual.Nullable;

/** The media element that plays encrypted content and needs keys to decrypt it. */
public interface EncryptedMediaSink {

  /** Receives encrypted notifications. */
  interface EncryptedListener {

    /**
     * Called when the sink encounters init data in the media.
     *
     * @param initDataType The type of {@code initData}.
     * @param initData The init data, or null if it is not available, for example because the media
     *     is not same-origin.
     */
    void onEncrypted(String initDataType, byte @Nullable [] initData);
  }

  /** Adds a listener of encrypted notifications. */
  void addEncryptedListener(EncryptedListener listener);

  /** Removes a listener of encrypted notifications. */
  void removeEncryptedListener(EncryptedListener listener);

  /**
   * Sets the {@link MediaKeys} used to decrypt media.
   *
   * @param mediaKeys The keys, or null to remove the current keys.
   * @return A future that completes once the keys are in use.
   */
  ListenableFuture<Void> setMediaKeys(@Nullable MediaKeys mediaKeys);
}
