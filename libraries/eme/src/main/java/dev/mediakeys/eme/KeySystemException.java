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

/** A key-system error reported to {@link EmeEventListener#onKeySystemError}. */
public final class KeySystemException extends Exception {

  /** Identifies the step that failed. */
  public enum Detail {
    /** No key-system access has been obtained. */
    NO_KEY_SYSTEM_ACCESS,
    /** No media keys were requested or obtained, or the keys could not be used. */
    NO_KEYS,
    /** No key session exists, or generating its license request failed. */
    NO_SESSION,
    /** The encrypted media did not provide init data. */
    NO_INIT_DATA,
    /** The server certificate could not be fetched. */
    CERTIFICATE_REQUEST_FAILED,
    /** The license could not be requested, or the request kept failing. */
    LICENSE_REQUEST_FAILED
  }

  /** The failed step. */
  public final Detail detail;

  /** Whether playback of the current content cannot proceed. */
  public final boolean fatal;

  /**
   * @param detail The failed step.
   * @param fatal Whether playback of the current content cannot proceed.
   * @param message The detail message.
   * @param cause The cause, or null if there is none.
   */
  public KeySystemException(
      Detail detail, boolean fatal, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.detail = detail;
    this.fatal = fatal;
  }
}
