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
import static org.junit.Assert.assertThrows;

import dev.mediakeys.datasource.HttpRequest;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LicenseRequest}. */
@RunWith(JUnit4.class)
public final class LicenseRequestTest {

  @Test
  public void setRequestHeader_beforeOpen_throws() {
    LicenseRequest request = new LicenseRequest();

    assertThrows(IllegalStateException.class, () -> request.setRequestHeader("a", "b"));
    assertThat(request.isOpened()).isFalse();
  }

  @Test
  public void open_again_discardsHeaders() {
    LicenseRequest request = new LicenseRequest();
    request.open(HttpRequest.METHOD_POST, "https://example.test/a");
    request.setRequestHeader("X-First", "1");

    request.open(HttpRequest.METHOD_POST, "https://example.test/b");
    request.setRequestHeader("X-Second", "2");
    HttpRequest httpRequest = request.toHttpRequest(new byte[] {1});

    assertThat(httpRequest.url).isEqualTo("https://example.test/b");
    assertThat(httpRequest.headers).containsExactly("X-Second", "2");
    assertThat(httpRequest.body).isEqualTo(new byte[] {1});
  }

  @Test
  public void toHttpRequest_notOpened_throws() {
    LicenseRequest request = new LicenseRequest();

    assertThrows(IllegalStateException.class, () -> request.toHttpRequest(new byte[0]));
  }
}
