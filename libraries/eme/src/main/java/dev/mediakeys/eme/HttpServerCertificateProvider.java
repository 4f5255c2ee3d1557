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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import dev.mediakeys.common.util.Util;
import dev.mediakeys.datasource.HttpRequest;
import dev.mediakeys.datasource.HttpResponse;
import dev.mediakeys.datasource.HttpTransport;
import java.io.IOException;

/** A {@link ServerCertificateProvider} that fetches the certificate with an HTTP GET. */
public final class HttpServerCertificateProvider implements ServerCertificateProvider {

  private final String certificateUrl;
  private final HttpTransport transport;

  /**
   * @param certificateUrl The URL of the certificate.
   * @param transport The transport used to fetch the certificate.
   */
  public HttpServerCertificateProvider(String certificateUrl, HttpTransport transport) {
    this.certificateUrl = certificateUrl;
    this.transport = transport;
  }

  @Override
  public ListenableFuture<byte[]> getCertificate() {
    HttpRequest request =
        new HttpRequest.Builder()
            .setUrl(certificateUrl)
            .setMethod(HttpRequest.METHOD_GET)
            .build();
    ListenableFuture<HttpResponse> responseFuture =
        Futures.catchingAsync(
            transport.execute(request),
            IOException.class,
            e ->
                Futures.immediateFailedFuture(
                    new CertificateRequestException(
                        "Certificate request to " + certificateUrl + " failed", 0, e)),
            MoreExecutors.directExecutor());
    return Futures.transformAsync(
        responseFuture,
        response -> {
          if (!response.isOk()) {
            return Futures.immediateFailedFuture(
                new CertificateRequestException(
                    "Certificate request to "
                        + certificateUrl
                        + " failed. Status: "
                        + response.statusCode
                        + ": "
                        + Util.fromUtf8Bytes(response.body),
                    response.statusCode,
                    /* cause= */ null));
          }
          return Futures.immediateFuture(response.body);
        },
        MoreExecutors.directExecutor());
  }
}
