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
import dev.mediakeys.datasource.HttpRequest;
import dev.mediakeys.datasource.HttpResponse;
import dev.mediakeys.datasource.HttpTransport;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sends the messages of key sessions to the license server of the active key system and retries
 * failed requests.
 *
 * <p>Failures are counted per attach lifecycle, across all requests. A successful response resets
 * the count. Once the count exceeds {@link #MAX_LICENSE_REQUEST_FAILURES}, a fatal {@link
 * KeySystemException.Detail#LICENSE_REQUEST_FAILED} error is reported and the request is dropped.
 */
/* package */ final class LicenseRequester {

  /** Receives the license obtained for a message. */
  public interface Callback {

    /** Called with the body of a successful license response. */
    void onLicense(byte[] license);
  }

  /** The number of failed license requests that are retried. */
  public static final int MAX_LICENSE_REQUEST_FAILURES = 3;

  private static final String TAG = "LicenseRequester";

  private final EmeConfiguration configuration;
  private final HttpTransport transport;
  private final NegotiationState state;
  private final EmeEventListener eventListener;
  private final Executor callbackExecutor;

  public LicenseRequester(
      EmeConfiguration configuration, NegotiationState state, EmeEventListener eventListener) {
    this.configuration = configuration;
    this.state = state;
    this.eventListener = eventListener;
    transport = configuration.httpTransport;
    callbackExecutor = configuration.callbackExecutor;
  }

  /**
   * Returns the license server URL of a key system.
   *
   * @throws IllegalStateException If no URL is configured for {@code keySystem}.
   */
  public String getLicenseServerUrl(KeySystem keySystem) {
    @Nullable String url;
    switch (keySystem) {
      case WIDEVINE:
        url = configuration.widevineLicenseUrl;
        break;
      case FAIRPLAY:
        url = configuration.fairplayLicenseUrl;
        break;
      default:
        url = null;
    }
    if (url == null || url.isEmpty()) {
      throw new IllegalStateException(
          "no license server URL configured for key-system \"" + keySystem.identifier + "\"");
    }
    return url;
  }

  /**
   * Requests the license for a key session message.
   *
   * @param message The message issued by the key session.
   * @param callback Called with the license once a request succeeds.
   */
  public void requestLicense(byte[] message, Callback callback) {
    if (state.isReleased()) {
      return;
    }
    Log.i(TAG, "Requesting content license for key-system");
    @Nullable KeySystemEntry entry = state.getActiveEntry();
    if (entry == null) {
      Log.e(TAG, "Fatal: Media is encrypted but no key-system access has been obtained yet");
      reportError(
          KeySystemException.Detail.NO_KEY_SYSTEM_ACCESS,
          "No key-system access obtained",
          /* cause= */ null);
      return;
    }

    String url;
    HttpRequest request;
    try {
      url = getLicenseServerUrl(entry.keySystem);
      request = createLicenseRequest(entry, url, message);
    } catch (Exception e) {
      Log.e(TAG, "Failure requesting DRM license", e);
      reportError(
          KeySystemException.Detail.LICENSE_REQUEST_FAILED,
          "Failed to set up license request",
          e);
      return;
    }

    Log.i(TAG, "Sending license request to URL: " + url);
    Futures.addCallback(
        state.track(transport.execute(request)),
        new FutureCallback<HttpResponse>() {
          @Override
          public void onSuccess(HttpResponse response) {
            onLicenseResponse(
                url, response.statusCode, response.statusMessage, response.body, message, callback);
          }

          @Override
          public void onFailure(Throwable t) {
            if (t instanceof CancellationException || state.isReleased()) {
              Log.d(TAG, "License request cancelled");
              return;
            }
            Log.e(TAG, "License request to " + url + " failed", t);
            onLicenseResponse(
                url, /* statusCode= */ 0, String.valueOf(t.getMessage()), null, message, callback);
          }
        },
        callbackExecutor);
  }

  private HttpRequest createLicenseRequest(KeySystemEntry entry, String url, byte[] message)
      throws Exception {
    LicenseRequest licenseRequest = new LicenseRequest();
    @Nullable LicenseRequestSetup setup = configuration.licenseRequestSetup;
    @Nullable String keyId = entry.getKeyId();
    if (setup != null) {
      try {
        setup.setUp(licenseRequest, url, keyId);
      } catch (Exception e) {
        Log.w(TAG, "License request setup failed on unopened request, retrying after open", e);
        licenseRequest.open(HttpRequest.METHOD_POST, url);
        setup.setUp(licenseRequest, url, keyId);
      }
    }
    if (!licenseRequest.isOpened()) {
      licenseRequest.open(HttpRequest.METHOD_POST, url);
    }
    return licenseRequest.toHttpRequest(generateChallenge(entry.keySystem, message));
  }

  private static byte[] generateChallenge(KeySystem keySystem, byte[] message) {
    switch (keySystem) {
      case WIDEVINE:
      case FAIRPLAY:
        // The challenge is the message itself.
        return message;
      default:
        throw new IllegalArgumentException("Unsupported key-system: " + keySystem.identifier);
    }
  }

  private void onLicenseResponse(
      String url,
      int statusCode,
      String statusMessage,
      byte @Nullable [] body,
      byte[] message,
      Callback callback) {
    if (state.isReleased()) {
      return;
    }
    if (statusCode == HttpResponse.STATUS_OK && body != null) {
      state.resetLicenseFailureCount();
      Log.i(TAG, "License request succeeded");
      callback.onLicense(body);
      return;
    }

    Log.e(
        TAG,
        "License request failed (" + url + "). Status: " + statusCode + " (" + statusMessage + ")");
    int failureCount = state.incrementLicenseFailureCount();
    if (failureCount > MAX_LICENSE_REQUEST_FAILURES) {
      reportError(
          KeySystemException.Detail.LICENSE_REQUEST_FAILED,
          "License request failed " + failureCount + " times. Last status: " + statusCode,
          /* cause= */ null);
      return;
    }
    int attemptsLeft = MAX_LICENSE_REQUEST_FAILURES - failureCount + 1;
    Log.w(TAG, "Retrying license request, " + attemptsLeft + " attempts left");
    requestLicense(message, callback);
  }

  private void reportError(
      KeySystemException.Detail detail, String message, @Nullable Throwable cause) {
    eventListener.onKeySystemError(
        new KeySystemException(detail, /* fatal= */ true, message, cause));
  }
}
