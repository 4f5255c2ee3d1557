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

/** A key session of a CDM. */
public interface MediaKeySession {

  /** Receives messages the CDM wants delivered to a license server. */
  interface MessageListener {

    /**
     * Called when the CDM issues a message.
     *
     * @param session The session that issued the message.
     * @param message The message, for example a license challenge.
     */
    void onMessage(MediaKeySession session, byte[] message);
  }

  /** Returns the session id, or an empty string if the CDM has not assigned one yet. */
  String getSessionId();

  /**
   * Sets the listener that receives the messages of this session, replacing any previous one.
   *
   * @param listener The listener, or null to stop receiving messages.
   */
  void setMessageListener(@Nullable MessageListener listener);

  /**
   * Generates a license request from init data. The request is delivered as a message.
   *
   * @param initDataType The type of {@code initData}, for example {@code cenc} or {@code sinf}.
   * @param initData The init data.
   * @return A future that completes once the request was generated.
   */
  ListenableFuture<Void> generateRequest(String initDataType, byte[] initData);

  /**
   * Provides a license server response to the CDM.
   *
   * @param response The response.
   * @return A future that completes once the response was processed.
   */
  ListenableFuture<Void> update(byte[] response);

  /** Closes the session and releases its keys. */
  ListenableFuture<Void> close();
}
