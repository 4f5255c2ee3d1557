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
package dev.mediakeys.common.util;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit test for {@link Util}. */
@RunWith(JUnit4.class)
public class UtilTest {

  @Test
  public void toHexString_returnsHexString() {
    byte[] bytes = createByteArray(0x12, 0xFC, 0x06);

    assertThat(Util.toHexString(bytes)).isEqualTo("12fc06");
  }

  @Test
  public void toHexString_emptyArray_returnsEmptyString() {
    assertThat(Util.toHexString(Util.EMPTY_BYTE_ARRAY)).isEmpty();
  }

  @Test
  public void fromUtf8Bytes_decodesNonAsciiText() {
    String text = "cléé中";

    assertThat(Util.fromUtf8Bytes(text.getBytes(UTF_8))).isEqualTo(text);
    assertThat(Util.fromUtf8Bytes(createByteArray(0xC3, 0xA9))).isEqualTo("é");
  }

  @Test
  public void nullSafeArrayCopy_withNull_returnsNull() {
    assertThat(Util.nullSafeArrayCopy(null)).isNull();
  }

  @Test
  public void nullSafeArrayCopy_returnsIndependentCopy() {
    byte[] bytes = createByteArray(1, 2, 3);

    byte[] copy = Util.nullSafeArrayCopy(bytes);
    bytes[0] = 9;

    assertThat(copy).isEqualTo(createByteArray(1, 2, 3));
  }

  private static byte[] createByteArray(int... bytes) {
    byte[] array = new byte[bytes.length];
    for (int i = 0; i < array.length; i++) {
      array[i] = (byte) bytes[i];
    }
    return array;
  }
}
