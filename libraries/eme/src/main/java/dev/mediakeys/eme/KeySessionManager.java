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

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import dev.mediakeys.common.util.Log;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.json.JSONException;

/**
 * Creates the key sessions of the negotiated key systems, generates their license requests and
 * forwards their messages to the {@link LicenseRequester}.
 */
/* package */ final class KeySessionManager {

  private static final String TAG = "KeySessionManager";

  private final NegotiationState state;
  private final LicenseRequester licenseRequester;
  private final EmeEventListener eventListener;
  private final Executor callbackExecutor;

  public KeySessionManager(
      NegotiationState state,
      LicenseRequester licenseRequester,
      EmeEventListener eventListener,
      Executor callbackExecutor) {
    this.state = state;
    this.licenseRequester = licenseRequester;
    this.eventListener = eventListener;
    this.callbackExecutor = callbackExecutor;
  }

  /** Creates a session for every entry that has media keys but no session yet. */
  public void onMediaKeysCreated() {
    if (state.isReleased()) {
      return;
    }
    for (KeySystemEntry entry : state.getEntries()) {
      @Nullable MediaKeys mediaKeys = entry.getMediaKeys();
      if (mediaKeys != null && entry.getSession() == null) {
        MediaKeySession session = mediaKeys.createSession();
        entry.setSession(session);
        onNewMediaKeySession(session);
      }
    }
  }

  /**
   * Generates the license request of the active entry's session. Only the first call per entry
   * generates a request; later calls are ignored.
   *
   * @param initDataType The type of {@code initData}.
   * @param initData The init data, or null if the media did not provide any.
   */
  public void generateRequest(String initDataType, byte @Nullable [] initData) {
    if (state.isReleased()) {
      return;
    }
    @Nullable KeySystemEntry entry = state.getActiveEntry();
    if (entry == null) {
      Log.e(TAG, "Fatal: Media is encrypted but no key-system access has been obtained yet");
      reportError(
          KeySystemException.Detail.NO_KEY_SYSTEM_ACCESS,
          /* fatal= */ true,
          "No key-system access obtained",
          /* cause= */ null);
      return;
    }
    if (entry.isSessionInitialized()) {
      Log.w(TAG, "Key session already initialized but requested again");
      return;
    }
    @Nullable MediaKeySession session = entry.getSession();
    if (session == null) {
      Log.e(TAG, "Fatal: Media is encrypted but no key session exists");
      reportError(
          KeySystemException.Detail.NO_SESSION,
          /* fatal= */ true,
          "No key session",
          /* cause= */ null);
      return;
    }
    if (initData == null || initData.length == 0) {
      Log.w(TAG, "Fatal: init data required for generating a key session request is missing");
      reportError(
          KeySystemException.Detail.NO_INIT_DATA,
          /* fatal= */ true,
          "No init data",
          /* cause= */ null);
      return;
    }

    Log.i(TAG, "Generating key session request for \"" + initDataType + "\" init data type");
    entry.markSessionInitialized();
    if (KeySystemConfigurations.INIT_DATA_TYPE_SINF.equals(initDataType)) {
      entry.setKeyId(findKeyIdInSinf(initData));
    }

    ListenableFuture<Void> requestFuture;
    try {
      requestFuture = session.generateRequest(initDataType, initData);
    } catch (RuntimeException e) {
      requestFuture = Futures.immediateFailedFuture(e);
    }
    Futures.addCallback(
        state.track(requestFuture),
        new FutureCallback<Void>() {
          @Override
          public void onSuccess(@Nullable Void result) {
            entry.onRequestGenerated();
            Log.d(TAG, "Key session request generated");
          }

          @Override
          public void onFailure(Throwable t) {
            if (t instanceof CancellationException || state.isReleased()) {
              return;
            }
            entry.onRequestFailed();
            Log.e(TAG, "Error generating key session request", t);
            reportError(
                KeySystemException.Detail.NO_SESSION,
                /* fatal= */ false,
                "Failed to generate key session request",
                t);
          }
        },
        callbackExecutor);
  }

  /* package */ void onKeySessionMessage(MediaKeySession session, byte[] message) {
    if (state.isReleased()) {
      return;
    }
    Log.i(TAG, "Got key session message, creating license request");
    licenseRequester.requestLicense(message, license -> updateSession(session, license));
  }

  private void onNewMediaKeySession(MediaKeySession session) {
    Log.d(TAG, "New key-system session " + session.getSessionId());
    session.setMessageListener(
        (messageSession, message) ->
            callbackExecutor.execute(() -> onKeySessionMessage(messageSession, message)));
  }

  private void updateSession(MediaKeySession session, byte[] license) {
    Log.i(TAG, "Received license data (length: " + license.length + "), updating key session");
    Futures.addCallback(
        state.track(session.update(license)),
        new FutureCallback<Void>() {
          @Override
          public void onSuccess(@Nullable Void result) {
            Log.d(TAG, "Key session " + session.getSessionId() + " updated");
          }

          @Override
          public void onFailure(Throwable t) {
            if (t instanceof CancellationException || state.isReleased()) {
              return;
            }
            Log.e(TAG, "Failed to update key session " + session.getSessionId(), t);
            reportError(
                KeySystemException.Detail.NO_KEYS,
                /* fatal= */ false,
                "Failed to apply license to key session",
                t);
          }
        },
        callbackExecutor);
  }

  @Nullable
  private static String findKeyIdInSinf(byte[] initData) {
    try {
      return SinfKeyIdExtractor.findKeyId(initData);
    } catch (JSONException | IllegalArgumentException e) {
      Log.w(TAG, "Failed to extract key id from sinf init data", e);
      return null;
    }
  }

  private void reportError(
      KeySystemException.Detail detail,
      boolean fatal,
      String message,
      @Nullable Throwable cause) {
    eventListener.onKeySystemError(new KeySystemException(detail, fatal, message, cause));
  }
}
