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

import static com.google.common.truth.Truth.assertThat;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import dev.mediakeys.datasource.HttpRequest;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;

/** Tests for {@link LicenseRequester}. */
@RunWith(JUnit4.class)
public final class LicenseRequesterTest {

  private static final String LICENSE_URL = "https://license.example.test/widevine";
  private static final byte[] MESSAGE = new byte[] {1, 2, 3};
  private static final byte[] LICENSE = new byte[] {7, 8};

  private FakeHttpTransport transport;
  private EmeEventListener eventListener;
  private NegotiationState state;
  private KeySystemEntry entry;
  private List<byte[]> licenses;

  @Before
  public void setUp() {
    transport = new FakeHttpTransport();
    eventListener = mock(EmeEventListener.class);
    state = new NegotiationState();
    entry = new KeySystemEntry(KeySystem.WIDEVINE, mock(MediaKeySystemAccess.class));
    state.addEntry(entry);
    licenses = new ArrayList<>();
  }

  @Test
  public void requestLicense_success_postsMessageAndDeliversLicense() {
    transport.addResponse(200, LICENSE);
    LicenseRequester requester = createRequester(/* licenseRequestSetup= */ null);

    requester.requestLicense(MESSAGE, licenses::add);

    assertThat(licenses).containsExactly(LICENSE);
    assertThat(transport.requests).hasSize(1);
    HttpRequest request = transport.requests.get(0);
    assertThat(request.method).isEqualTo(HttpRequest.METHOD_POST);
    assertThat(request.url).isEqualTo(LICENSE_URL);
    assertThat(request.body).isEqualTo(MESSAGE);
    verifyNoInteractions(eventListener);
  }

  @Test
  public void requestLicense_defaultConfiguration_deliversLicenseOnCallbackThread()
      throws Exception {
    MockWebServer mockWebServer = new MockWebServer();
    mockWebServer.enqueue(
        new MockResponse().setResponseCode(200).setBody(new Buffer().write(LICENSE)));
    mockWebServer.start();
    try {
      EmeConfiguration configuration =
          new EmeConfiguration.Builder()
              .setEmeEnabled(true)
              .setWidevineLicenseUrl(mockWebServer.url("/license").toString())
              .build();
      LicenseRequester requester = new LicenseRequester(configuration, state, eventListener);
      SettableFuture<Thread> licenseThread = SettableFuture.create();
      SettableFuture<byte[]> license = SettableFuture.create();

      configuration.callbackExecutor.execute(
          () ->
              requester.requestLicense(
                  MESSAGE,
                  response -> {
                    licenseThread.set(Thread.currentThread());
                    license.set(response);
                  }));

      assertThat(license.get(10, SECONDS)).isEqualTo(LICENSE);
      assertThat(licenseThread.get().getName())
          .isEqualTo(EmeConfiguration.DEFAULT_CALLBACK_THREAD_NAME);
      assertThat(mockWebServer.takeRequest().getBody().readByteArray()).isEqualTo(MESSAGE);
      verifyNoInteractions(eventListener);
    } finally {
      mockWebServer.shutdown();
    }
  }

  @Test
  public void requestLicense_fourFailures_retriesThreeTimesThenReportsFatalError() {
    transport.addResponses(500, 4).addResponse(200, LICENSE);
    LicenseRequester requester = createRequester(/* licenseRequestSetup= */ null);

    requester.requestLicense(MESSAGE, licenses::add);

    assertThat(transport.requests).hasSize(LicenseRequester.MAX_LICENSE_REQUEST_FAILURES + 1);
    assertThat(licenses).isEmpty();
    KeySystemException error = captureSingleError();
    assertThat(error.detail).isEqualTo(KeySystemException.Detail.LICENSE_REQUEST_FAILED);
    assertThat(error.fatal).isTrue();
  }

  @Test
  public void requestLicense_threeFailuresThenSuccess_deliversLicense() {
    transport.addResponses(503, 3).addResponse(200, LICENSE);
    LicenseRequester requester = createRequester(/* licenseRequestSetup= */ null);

    requester.requestLicense(MESSAGE, licenses::add);

    assertThat(transport.requests).hasSize(4);
    assertThat(licenses).containsExactly(LICENSE);
    assertThat(state.getLicenseFailureCount()).isEqualTo(0);
    verifyNoInteractions(eventListener);
  }

  @Test
  public void requestLicense_successAfterFailures_resetsFailureCount() {
    transport.addResponses(500, 2).addResponse(200, LICENSE);
    LicenseRequester requester = createRequester(/* licenseRequestSetup= */ null);
    requester.requestLicense(MESSAGE, licenses::add);
    assertThat(state.getLicenseFailureCount()).isEqualTo(0);

    transport.addResponses(500, 4);
    requester.requestLicense(MESSAGE, licenses::add);

    // Three requests for the first message, then a full budget of three retries for the second.
    assertThat(transport.requests).hasSize(3 + 4);
    assertThat(licenses).hasSize(1);
    assertThat(captureSingleError().detail)
        .isEqualTo(KeySystemException.Detail.LICENSE_REQUEST_FAILED);
  }

  @Test
  public void requestLicense_failureCountIsSharedAcrossMessages() {
    transport.addResponses(500, 2).addResponse(200, LICENSE);
    LicenseRequester requester = createRequester(/* licenseRequestSetup= */ null);
    state.incrementLicenseFailureCount();
    state.incrementLicenseFailureCount();

    requester.requestLicense(MESSAGE, licenses::add);

    // Two earlier failures leave one retry after the first failure of this message.
    assertThat(transport.requests).hasSize(2);
    assertThat(licenses).isEmpty();
    assertThat(captureSingleError().detail)
        .isEqualTo(KeySystemException.Detail.LICENSE_REQUEST_FAILED);
  }

  @Test
  public void requestLicense_transportFailures_countAsFailedRequests() {
    for (int i = 0; i < 4; i++) {
      transport.addFailure(new IOException("connection reset"));
    }
    LicenseRequester requester = createRequester(/* licenseRequestSetup= */ null);

    requester.requestLicense(MESSAGE, licenses::add);

    assertThat(transport.requests).hasSize(4);
    assertThat(captureSingleError().detail)
        .isEqualTo(KeySystemException.Detail.LICENSE_REQUEST_FAILED);
  }

  @Test
  public void requestLicense_noEntry_reportsNoKeySystemAccess() {
    state = new NegotiationState();
    LicenseRequester requester = createRequester(/* licenseRequestSetup= */ null);

    requester.requestLicense(MESSAGE, licenses::add);

    assertThat(transport.requests).isEmpty();
    KeySystemException error = captureSingleError();
    assertThat(error.detail).isEqualTo(KeySystemException.Detail.NO_KEY_SYSTEM_ACCESS);
    assertThat(error.fatal).isTrue();
  }

  @Test
  public void requestLicense_noLicenseUrl_reportsFatalErrorWithoutRequest() {
    LicenseRequester requester =
        new LicenseRequester(
            new EmeConfiguration.Builder()
                .setHttpTransport(transport)
                .setCallbackExecutor(MoreExecutors.directExecutor())
                .build(),
            state,
            eventListener);

    requester.requestLicense(MESSAGE, licenses::add);

    assertThat(transport.requests).isEmpty();
    KeySystemException error = captureSingleError();
    assertThat(error.detail).isEqualTo(KeySystemException.Detail.LICENSE_REQUEST_FAILED);
    assertThat(error.fatal).isTrue();
    assertThat(error).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void getLicenseServerUrl_notConfigured_throws() {
    LicenseRequester requester = createRequester(/* licenseRequestSetup= */ null);

    IllegalStateException exception =
        assertThrows(
            IllegalStateException.class,
            () -> requester.getLicenseServerUrl(KeySystem.FAIRPLAY));

    assertThat(exception)
        .hasMessageThat()
        .isEqualTo("no license server URL configured for key-system \"com.apple.fps.1_0\"");
    assertThat(requester.getLicenseServerUrl(KeySystem.WIDEVINE)).isEqualTo(LICENSE_URL);
  }

  @Test
  public void requestLicense_setupAddingHeaders_isCalledAgainAfterOpen() {
    transport.addResponse(200, LICENSE);
    entry.setKeyId("00112233");
    List<@Nullable String> keyIds = new ArrayList<>();
    LicenseRequestSetup setup =
        (request, url, keyId) -> {
          keyIds.add(keyId);
          request.setRequestHeader("Authorization", "Bearer token");
        };
    LicenseRequester requester = createRequester(setup);

    requester.requestLicense(MESSAGE, licenses::add);

    assertThat(keyIds).containsExactly("00112233", "00112233");
    HttpRequest request = transport.requests.get(0);
    assertThat(request.method).isEqualTo(HttpRequest.METHOD_POST);
    assertThat(request.headers).containsEntry("Authorization", "Bearer token");
    assertThat(licenses).containsExactly(LICENSE);
  }

  @Test
  public void requestLicense_setupOpeningRequest_usesItsMethodAndUrl() {
    transport.addResponse(200, LICENSE);
    LicenseRequestSetup setup =
        (request, url, keyId) -> {
          request.open("PUT", url + "?token=abc");
          request.setWithCredentials(true);
        };
    LicenseRequester requester = createRequester(setup);

    requester.requestLicense(MESSAGE, licenses::add);

    HttpRequest request = transport.requests.get(0);
    assertThat(request.method).isEqualTo("PUT");
    assertThat(request.url).isEqualTo(LICENSE_URL + "?token=abc");
    assertThat(request.withCredentials).isTrue();
  }

  @Test
  public void requestLicense_setupAlwaysThrowing_reportsFatalErrorWithoutRetry() {
    transport.addResponse(200, LICENSE);
    LicenseRequestSetup setup =
        (request, url, keyId) -> {
          throw new IOException("cannot sign request");
        };
    LicenseRequester requester = createRequester(setup);

    requester.requestLicense(MESSAGE, licenses::add);

    assertThat(transport.requests).isEmpty();
    assertThat(state.getLicenseFailureCount()).isEqualTo(0);
    KeySystemException error = captureSingleError();
    assertThat(error.detail).isEqualTo(KeySystemException.Detail.LICENSE_REQUEST_FAILED);
    assertThat(error).hasCauseThat().hasMessageThat().isEqualTo("cannot sign request");
  }

  @Test
  public void release_cancelsPendingRequestWithoutReportingError() {
    LicenseRequester requester = createRequester(/* licenseRequestSetup= */ null);
    requester.requestLicense(MESSAGE, licenses::add);

    state.release();

    assertThat(transport.pendingResponses).hasSize(1);
    assertThat(transport.pendingResponses.get(0).isCancelled()).isTrue();
    assertThat(licenses).isEmpty();
    verifyNoInteractions(eventListener);
  }

  private LicenseRequester createRequester(@Nullable LicenseRequestSetup licenseRequestSetup) {
    EmeConfiguration configuration =
        new EmeConfiguration.Builder()
            .setCallbackExecutor(MoreExecutors.directExecutor())
            .setEmeEnabled(true)
            .setWidevineLicenseUrl(LICENSE_URL)
            .setLicenseRequestSetup(licenseRequestSetup)
            .setHttpTransport(transport)
            .build();
    return new LicenseRequester(configuration, state, eventListener);
  }

  private KeySystemException captureSingleError() {
    ArgumentCaptor<KeySystemException> captor = ArgumentCaptor.forClass(KeySystemException.class);
    verify(eventListener).onKeySystemError(captor.capture());
    return captor.getValue();
  }
}
