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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.mediakeys.common.util.Util;
import dev.mediakeys.datasource.DefaultHttpTransport;
import dev.mediakeys.datasource.HttpTransport;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Configuration of an {@link EmeController}. */
public final class EmeConfiguration {

  /** The name of the thread that runs the default {@link #callbackExecutor}. */
  public static final String DEFAULT_CALLBACK_THREAD_NAME = "EmeController:callback";

  private static final Supplier<Executor> DEFAULT_CALLBACK_EXECUTOR =
      Suppliers.memoize(
          () ->
              Executors.newSingleThreadExecutor(
                  new ThreadFactoryBuilder()
                      .setNameFormat(DEFAULT_CALLBACK_THREAD_NAME)
                      .setDaemon(true)
                      .build()));

  /** Builds {@link EmeConfiguration} instances. */
  public static final class Builder {

    private boolean emeEnabled;
    @Nullable private String widevineLicenseUrl;
    @Nullable private String fairplayLicenseUrl;
    @Nullable private String fairplayCertificateUrl;
    private byte @Nullable [] fairplayCertificateData;
    @Nullable private LicenseRequestSetup licenseRequestSetup;
    @Nullable private MediaKeySystemAccessProvider mediaKeySystemAccessProvider;
    @Nullable private HttpTransport httpTransport;
    @Nullable private Executor callbackExecutor;

    /** Creates a builder with EME disabled. */
    public Builder() {}

    /**
     * Sets whether encrypted media is handled. The default value is {@code false}.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setEmeEnabled(boolean emeEnabled) {
      this.emeEnabled = emeEnabled;
      return this;
    }

    /**
     * Sets the Widevine license server URL.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setWidevineLicenseUrl(@Nullable String widevineLicenseUrl) {
      this.widevineLicenseUrl = widevineLicenseUrl;
      return this;
    }

    /**
     * Sets the FairPlay license server URL.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setFairplayLicenseUrl(@Nullable String fairplayLicenseUrl) {
      this.fairplayLicenseUrl = fairplayLicenseUrl;
      return this;
    }

    /**
     * Sets the URL the FairPlay server certificate is fetched from. Ignored if {@link
     * #setFairplayCertificateData certificate data} is set.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setFairplayCertificateUrl(@Nullable String fairplayCertificateUrl) {
      this.fairplayCertificateUrl = fairplayCertificateUrl;
      return this;
    }

    /**
     * Sets the FairPlay server certificate.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setFairplayCertificateData(byte @Nullable [] fairplayCertificateData) {
      this.fairplayCertificateData = Util.nullSafeArrayCopy(fairplayCertificateData);
      return this;
    }

    /**
     * Sets the hook that customizes license requests.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setLicenseRequestSetup(@Nullable LicenseRequestSetup licenseRequestSetup) {
      this.licenseRequestSetup = licenseRequestSetup;
      return this;
    }

    /**
     * Sets the provider of key-system access. Required if EME is enabled.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setMediaKeySystemAccessProvider(
        @Nullable MediaKeySystemAccessProvider mediaKeySystemAccessProvider) {
      this.mediaKeySystemAccessProvider = mediaKeySystemAccessProvider;
      return this;
    }

    /**
     * Sets the transport used for license and certificate requests. The default is a {@link
     * DefaultHttpTransport}.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setHttpTransport(@Nullable HttpTransport httpTransport) {
      this.httpTransport = httpTransport;
      return this;
    }

    /**
     * Sets the executor that runs continuations and delivers events. It must run tasks one at a
     * time and in order. The default is a single daemon thread named {@link
     * #DEFAULT_CALLBACK_THREAD_NAME} that is shared between configurations.
     *
     * @return This builder.
     */
    @CanIgnoreReturnValue
    public Builder setCallbackExecutor(@Nullable Executor callbackExecutor) {
      this.callbackExecutor = callbackExecutor;
      return this;
    }

    public EmeConfiguration build() {
      return new EmeConfiguration(this);
    }
  }

  /** Whether encrypted media is handled. */
  public final boolean emeEnabled;

  /** The Widevine license server URL, or null if not configured. */
  @Nullable public final String widevineLicenseUrl;

  /** The FairPlay license server URL, or null if not configured. */
  @Nullable public final String fairplayLicenseUrl;

  /** The FairPlay server certificate URL, or null if not configured. */
  @Nullable public final String fairplayCertificateUrl;

  private final byte @Nullable [] fairplayCertificateData;

  /** The license request hook, or null if requests are not customized. */
  @Nullable public final LicenseRequestSetup licenseRequestSetup;

  /** The key-system access provider, or null if none is configured. */
  @Nullable public final MediaKeySystemAccessProvider mediaKeySystemAccessProvider;

  /** The transport for license and certificate requests. */
  public final HttpTransport httpTransport;

  /**
   * The executor that runs continuations and delivers events. All state of an {@link EmeController}
   * is confined to it.
   */
  public final Executor callbackExecutor;

  private EmeConfiguration(Builder builder) {
    emeEnabled = builder.emeEnabled;
    widevineLicenseUrl = builder.widevineLicenseUrl;
    fairplayLicenseUrl = builder.fairplayLicenseUrl;
    fairplayCertificateUrl = builder.fairplayCertificateUrl;
    fairplayCertificateData = builder.fairplayCertificateData;
    licenseRequestSetup = builder.licenseRequestSetup;
    mediaKeySystemAccessProvider = builder.mediaKeySystemAccessProvider;
    httpTransport =
        builder.httpTransport != null ? builder.httpTransport : new DefaultHttpTransport();
    callbackExecutor =
        builder.callbackExecutor != null
            ? builder.callbackExecutor
            : DEFAULT_CALLBACK_EXECUTOR.get();
  }

  /**
   * Returns the provider of the FairPlay server certificate, or null if neither certificate data
   * nor a certificate URL is configured.
   */
  @Nullable
  public ServerCertificateProvider getFairplayCertificateProvider() {
    if (fairplayCertificateData != null && fairplayCertificateData.length > 0) {
      return new LocalServerCertificateProvider(fairplayCertificateData);
    } else if (fairplayCertificateUrl != null) {
      return new HttpServerCertificateProvider(fairplayCertificateUrl, httpTransport);
    }
    return null;
  }
}
