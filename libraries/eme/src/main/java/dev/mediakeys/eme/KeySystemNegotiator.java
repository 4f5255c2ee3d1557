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

import static dev.mediakeys.common.util.Assertions.checkNotNull;
import static dev.mediakeys.common.util.Assertions.checkStateNotNull;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.mediakeys.common.util.Log;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Requests access to a key system and creates its media keys, provisioning a server certificate
 * where the key system needs one.
 */
/* package */ final class KeySystemNegotiator {

  private static final String TAG = "KeySystemNegotiator";

  @Nullable private final MediaKeySystemAccessProvider accessProvider;
  @Nullable private final ServerCertificateProvider certificateProvider;
  private final NegotiationState state;
  private final KeySessionManager sessionManager;
  private final EmeEventListener eventListener;
  private final Executor callbackExecutor;

  public KeySystemNegotiator(
      @Nullable MediaKeySystemAccessProvider accessProvider,
      @Nullable ServerCertificateProvider certificateProvider,
      NegotiationState state,
      KeySessionManager sessionManager,
      EmeEventListener eventListener,
      Executor callbackExecutor) {
    this.accessProvider = accessProvider;
    this.certificateProvider = certificateProvider;
    this.state = state;
    this.sessionManager = sessionManager;
    this.eventListener = eventListener;
    this.callbackExecutor = callbackExecutor;
  }

  /**
   * Requests access to a key system and the creation of its media keys. Only the first call per
   * attach lifecycle starts a request. Later calls return the pending media keys.
   *
   * @param keySystemId The identifier of the key system.
   * @param audioCodecs The audio codecs of the content.
   * @param videoCodecs The video codecs of the content.
   * @return The pending media keys.
   * @throws UnsupportedKeySystemException If {@code keySystemId} is not supported.
   */
  @CanIgnoreReturnValue
  public ListenableFuture<MediaKeys> requestAccess(
      String keySystemId, List<String> audioCodecs, List<String> videoCodecs)
      throws UnsupportedKeySystemException {
    List<MediaKeySystemConfiguration> configurations =
        KeySystemConfigurations.getSupportedConfigurations(keySystemId, audioCodecs, videoCodecs);
    return requestAccess(checkNotNull(KeySystem.forIdentifier(keySystemId)), configurations);
  }

  /**
   * Requests access to a known key system. See {@link #requestAccess(String, List, List)}.
   *
   * <p>The returned future is also recorded as the pending media keys of the lifecycle, so callers
   * may ignore it.
   */
  @CanIgnoreReturnValue
  public ListenableFuture<MediaKeys> requestAccess(
      KeySystem keySystem, List<String> audioCodecs, List<String> videoCodecs) {
    return requestAccess(
        keySystem,
        KeySystemConfigurations.getSupportedConfigurations(keySystem, audioCodecs, videoCodecs));
  }

  private ListenableFuture<MediaKeys> requestAccess(
      KeySystem keySystem, List<MediaKeySystemConfiguration> configurations) {
    String keySystemId = keySystem.identifier;
    @Nullable ListenableFuture<MediaKeys> pendingMediaKeys = state.getMediaKeysFuture();
    if (pendingMediaKeys != null) {
      Log.d(TAG, "Media keys already requested");
      return pendingMediaKeys;
    }

    MediaKeySystemAccessProvider accessProvider =
        checkStateNotNull(
            this.accessProvider, "No media key-system access provider configured");
    Log.i(TAG, "Requesting encrypted media key-system access for \"" + keySystemId + "\"");
    ListenableFuture<MediaKeySystemAccess> accessFuture;
    try {
      accessFuture = accessProvider.requestMediaKeySystemAccess(keySystemId, configurations);
    } catch (RuntimeException e) {
      accessFuture = Futures.immediateFailedFuture(e);
    }
    Futures.addCallback(
        accessFuture,
        new FutureCallback<MediaKeySystemAccess>() {
          @Override
          public void onSuccess(MediaKeySystemAccess access) {
            // Handled by onAccessObtained.
          }

          @Override
          public void onFailure(Throwable t) {
            if (!(t instanceof CancellationException)) {
              Log.e(TAG, "Failed to obtain key-system \"" + keySystemId + "\" access", t);
            }
          }
        },
        callbackExecutor);

    ListenableFuture<MediaKeys> mediaKeysFuture =
        state.track(
            Futures.transformAsync(
                state.track(accessFuture),
                access -> onAccessObtained(keySystem, access),
                callbackExecutor));
    state.setMediaKeysFuture(mediaKeysFuture);
    return mediaKeysFuture;
  }

  private ListenableFuture<MediaKeys> onAccessObtained(
      KeySystem keySystem, MediaKeySystemAccess access) {
    if (state.isReleased()) {
      return Futures.immediateCancelledFuture();
    }
    Log.i(TAG, "Access for key-system \"" + keySystem.identifier + "\" obtained");
    KeySystemEntry entry = new KeySystemEntry(keySystem, access);
    state.addEntry(entry);

    ListenableFuture<MediaKeys> mediaKeysFuture =
        Futures.transformAsync(
            state.track(access.createMediaKeys()),
            mediaKeys -> onMediaKeysCreated(entry, mediaKeys),
            callbackExecutor);
    mediaKeysFuture =
        Futures.transform(
            mediaKeysFuture,
            mediaKeys -> {
              sessionManager.onMediaKeysCreated();
              return mediaKeys;
            },
            callbackExecutor);
    Futures.addCallback(
        mediaKeysFuture,
        new FutureCallback<MediaKeys>() {
          @Override
          public void onSuccess(MediaKeys mediaKeys) {}

          @Override
          public void onFailure(Throwable t) {
            if (!(t instanceof CancellationException)) {
              Log.e(TAG, "Failed to create media keys", t);
            }
          }
        },
        callbackExecutor);
    return mediaKeysFuture;
  }

  private ListenableFuture<MediaKeys> onMediaKeysCreated(
      KeySystemEntry entry, MediaKeys mediaKeys) {
    if (state.isReleased()) {
      return Futures.immediateCancelledFuture();
    }
    entry.setMediaKeys(mediaKeys);
    Log.i(TAG, "Media keys created for key-system \"" + entry.keySystem.identifier + "\"");
    if (!entry.keySystem.usesServerCertificate || certificateProvider == null) {
      return Futures.immediateFuture(mediaKeys);
    }
    return provisionServerCertificate(certificateProvider, mediaKeys);
  }

  private ListenableFuture<MediaKeys> provisionServerCertificate(
      ServerCertificateProvider certificateProvider, MediaKeys mediaKeys) {
    ListenableFuture<Boolean> certificateFuture =
        Futures.transformAsync(
            state.track(certificateProvider.getCertificate()),
            certificate -> state.track(mediaKeys.setServerCertificate(certificate)),
            callbackExecutor);
    ListenableFuture<MediaKeys> mediaKeysFuture =
        Futures.transform(
            certificateFuture,
            supported -> {
              if (!Boolean.TRUE.equals(supported)) {
                Log.w(TAG, "Key system does not use server certificates");
              }
              return mediaKeys;
            },
            callbackExecutor);
    return Futures.catchingAsync(
        mediaKeysFuture,
        Exception.class,
        e -> {
          if (e instanceof CancellationException || state.isReleased()) {
            return Futures.immediateCancelledFuture();
          }
          Log.e(TAG, "Failed to provision server certificate", e);
          eventListener.onKeySystemError(
              new KeySystemException(
                  KeySystemException.Detail.CERTIFICATE_REQUEST_FAILED,
                  /* fatal= */ true,
                  "Failed to provision server certificate",
                  e));
          return Futures.immediateFuture(mediaKeys);
        },
        callbackExecutor);
  }
}
