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

/** Thrown when a key system other than those listed in {@link KeySystem} is requested. */
public final class UnsupportedKeySystemException extends Exception {

  /** The identifier of the requested key system. */
  public final String keySystem;

  /**
   * @param keySystem The identifier of the requested key system.
   */
  public UnsupportedKeySystemException(String keySystem) {
    super("Unknown key-system: " + keySystem);
    this.keySystem = keySystem;
  }
}
