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

import static dev.mediakeys.common.util.Assertions.checkArgument;
import static dev.mediakeys.common.util.Assertions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import dev.mediakeys.common.util.Log;
import java.util.List;
import java.util.concurrent.CancellationException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Handles encrypted media: negotiates a key system once a level with a content protection key is
 * loaded, applies the media keys to the attached {@link EncryptedMediaSink} and drives the license
 * exchange of its key session.
 *
 * <p>The controller is driven by the notifications of its host. They may be called from any thread
 * and are handled in order on the {@link EmeConfiguration#callbackExecutor callback executor},
 * as are the encrypted notifications of the attached media. All state of the controller is
 * confined to that executor. Errors are reported to the {@link EmeEventListener} as {@link
 * KeySystemException KeySystemExceptions}.
 *
 * <p>Detaching media ends the current lifecycle. Pending work is cancelled, key sessions are
 * closed and the next level-loaded notification negotiates again.
 */
public final class EmeController {

  private static final String TAG = "EmeController";

  private final EmeConfiguration configuration;
  private final EmeEventListener eventListener;
  @Nullable private final ServerCertificateProvider certificateProvider;
  private final EncryptedMediaSink.EncryptedListener encryptedListener;

  private ImmutableList<Level> levels;
  @Nullable private EncryptedMediaSink media;
  private NegotiationState state;
  private LicenseRequester licenseRequester;
  private KeySessionManager sessionManager;
  private KeySystemNegotiator negotiator;

  /**
   * @param configuration The configuration.
   * @param eventListener The listener of key-system errors.
   * @throws IllegalArgumentException If EME is enabled but no {@link
   *     MediaKeySystemAccessProvider} is configured.
   */
  public EmeController(EmeConfiguration configuration, EmeEventListener eventListener) {
    checkArgument(
        !configuration.emeEnabled || configuration.mediaKeySystemAccessProvider != null,
        "No media key-system access provider configured");
    this.configuration = configuration;
    this.eventListener = eventListener;
    certificateProvider = configuration.getFairplayCertificateProvider();
    encryptedListener =
        (initDataType, initData) ->
            configuration.callbackExecutor.execute(() -> onMediaEncrypted(initDataType, initData));
    levels = ImmutableList.of();
    startLifecycle();
  }

  /**
   * Called when media is attached. Starts listening for encrypted notifications of {@code media}.
   * Does nothing if EME is disabled.
   */
  public void onMediaAttached(EncryptedMediaSink media) {
    configuration.callbackExecutor.execute(() -> attachMedia(media));
  }

  /**
   * Called when media is detached. Stops listening for encrypted notifications, cancels pending
   * work, closes the key sessions and resets the negotiation state.
   */
  public void onMediaDetached() {
    configuration.callbackExecutor.execute(this::detachMedia);
  }

  /** Called when the manifest was parsed. */
  public void onManifestParsed(List<Level> levels) {
    ImmutableList<Level> parsedLevels = ImmutableList.copyOf(levels);
    configuration.callbackExecutor.execute(() -> this.levels = parsedLevels);
  }

  /**
   * Called when a level was loaded. Negotiates a key system for the level if it declares a key.
   *
   * @param levelIndex The index of the level in the parsed manifest.
   * @param key The key declared by the loaded level, or null if the level is not encrypted.
   */
  public void onLevelLoaded(int levelIndex, @Nullable LevelKey key) {
    configuration.callbackExecutor.execute(() -> loadLevel(levelIndex, key));
  }

  /**
   * Releases the controller. Equivalent to {@link #onMediaDetached()}; the controller can be
   * attached again afterwards.
   */
  public void release() {
    onMediaDetached();
  }

  /**
   * Returns the entry whose keys and session are in use, or null if none was negotiated. Must be
   * called on the callback executor.
   */
  @Nullable
  public KeySystemEntry getActiveEntry() {
    return state.getActiveEntry();
  }

  /** Returns the license server URL of a key system. */
  public String getLicenseServerUrl(KeySystem keySystem) {
    return licenseRequester.getLicenseServerUrl(keySystem);
  }

  private void attachMedia(EncryptedMediaSink media) {
    if (!configuration.emeEnabled) {
      return;
    }
    if (this.media != null) {
      this.media.removeEncryptedListener(encryptedListener);
    }
    this.media = media;
    media.addEncryptedListener(encryptedListener);
  }

  private void detachMedia() {
    if (media != null) {
      media.removeEncryptedListener(encryptedListener);
      media = null;
    }
    resetLifecycle();
  }

  private void loadLevel(int levelIndex, @Nullable LevelKey key) {
    if (!configuration.emeEnabled
        || key == null
        || levelIndex < 0
        || levelIndex >= levels.size()) {
      return;
    }
    Level level = levels.get(levelIndex);
    KeySystem keySystem = KeySystem.forKeyFormat(key.keyFormat);
    ImmutableList.Builder<String> audioCodecs = ImmutableList.builder();
    ImmutableList.Builder<String> videoCodecs = ImmutableList.builder();
    if (level.audioCodec != null) {
      audioCodecs.add(level.audioCodec);
    }
    if (level.videoCodec != null) {
      videoCodecs.add(level.videoCodec);
    }
    negotiator.requestAccess(keySystem, audioCodecs.build(), videoCodecs.build());
  }

  /* package */ void onMediaEncrypted(String initDataType, byte @Nullable [] initData) {
    Log.i(TAG, "Media is encrypted using \"" + initDataType + "\" init data type");
    NegotiationState state = this.state;
    KeySessionManager sessionManager = this.sessionManager;
    @Nullable ListenableFuture<MediaKeys> mediaKeysFuture = state.getMediaKeysFuture();
    if (mediaKeysFuture == null) {
      Log.e(TAG, "Fatal: Media is encrypted but no CDM access or no keys have been requested");
      eventListener.onKeySystemError(
          new KeySystemException(
              KeySystemException.Detail.NO_KEYS,
              /* fatal= */ true,
              "Media is encrypted but no keys have been requested",
              /* cause= */ null));
      return;
    }
    mediaKeysFuture.addListener(
        () -> {
          if (state.isReleased() || media == null) {
            return;
          }
          if (attemptSetMediaKeys(state)) {
            sessionManager.generateRequest(initDataType, initData);
          }
        },
        configuration.callbackExecutor);
  }

  /**
   * Applies the media keys of the active entry to the attached media, unless already done.
   *
   * @return Whether keys are applied, or being applied.
   */
  private boolean attemptSetMediaKeys(NegotiationState state) {
    EncryptedMediaSink media = this.media;
    checkState(media != null, "Attempted to set media keys without first attaching media");
    if (state.areKeysApplied()) {
      return true;
    }
    @Nullable KeySystemEntry entry = state.getActiveEntry();
    @Nullable MediaKeys mediaKeys = entry != null ? entry.getMediaKeys() : null;
    if (mediaKeys == null) {
      Log.e(TAG, "Fatal: Media is encrypted but no CDM access or no keys have been obtained yet");
      eventListener.onKeySystemError(
          new KeySystemException(
              KeySystemException.Detail.NO_KEYS,
              /* fatal= */ true,
              "Media is encrypted but no keys have been obtained",
              /* cause= */ null));
      return false;
    }

    Log.i(TAG, "Setting keys for encrypted media");
    state.setKeysApplied();
    Futures.addCallback(
        state.track(media.setMediaKeys(mediaKeys)),
        new FutureCallback<Void>() {
          @Override
          public void onSuccess(@Nullable Void result) {
            Log.d(TAG, "Media keys set");
          }

          @Override
          public void onFailure(Throwable t) {
            if (t instanceof CancellationException || state.isReleased()) {
              return;
            }
            Log.e(TAG, "Failed to set media keys", t);
            eventListener.onKeySystemError(
                new KeySystemException(
                    KeySystemException.Detail.NO_KEYS,
                    /* fatal= */ true,
                    "Failed to set media keys",
                    t));
          }
        },
        configuration.callbackExecutor);
    return true;
  }

  private void resetLifecycle() {
    state.release();
    startLifecycle();
  }

  private void startLifecycle() {
    state = new NegotiationState();
    licenseRequester = new LicenseRequester(configuration, state, eventListener);
    sessionManager =
        new KeySessionManager(
            state, licenseRequester, eventListener, configuration.callbackExecutor);
    negotiator =
        new KeySystemNegotiator(
            configuration.mediaKeySystemAccessProvider,
            certificateProvider,
            state,
            sessionManager,
            eventListener,
            configuration.callbackExecutor);
  }
}
