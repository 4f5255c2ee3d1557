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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

/** A {@link ServerCertificateProvider} that provides a fixed certificate. */
public final class LocalServerCertificateProvider implements ServerCertificateProvider {

  private final byte[] certificate;

  /**
   * @param certificate The certificate to provide. Must not be empty.
   */
  public LocalServerCertificateProvider(byte[] certificate) {
    checkArgument(certificate.length > 0);
    this.certificate = certificate.clone();
  }

  @Override
  public ListenableFuture<byte[]> getCertificate() {
    return Futures.immediateFuture(certificate.clone());
  }
}
