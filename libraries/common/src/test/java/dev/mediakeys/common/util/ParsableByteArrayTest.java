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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ParsableByteArray}. */
@RunWith(JUnit4.class)
public final class ParsableByteArrayTest {

  private static final byte[] TEST_DATA =
      new byte[] {0x0F, (byte) 0xFF, 0x42, 0x0F, (byte) 0xFF, 0x00, 0x00, 0x01};

  @Test
  public void readUnsignedInt_topBitSet_returnsPositiveValue() {
    ParsableByteArray data = new ParsableByteArray(TEST_DATA, TEST_DATA.length);
    data.setPosition(4);

    assertThat(data.readUnsignedInt()).isEqualTo(0xFF000001L);
  }

  @Test
  public void readInt_topBitSet_returnsNegativeValue() {
    ParsableByteArray data = new ParsableByteArray(TEST_DATA, TEST_DATA.length);
    data.setPosition(4);

    assertThat(data.readInt()).isEqualTo(0xFF000001);
  }

  @Test
  public void readInt_advancesPosition() {
    ParsableByteArray data = new ParsableByteArray(TEST_DATA, TEST_DATA.length);

    assertThat(data.readInt()).isEqualTo(0x0FFF420F);
    assertThat(data.readInt()).isEqualTo(0xFF000001);
  }

  @Test
  public void setPosition_pastLimit_throws() {
    ParsableByteArray data = new ParsableByteArray(TEST_DATA, /* limit= */ 3);

    assertThrows(IllegalArgumentException.class, () -> data.setPosition(4));
  }

  @Test
  public void constructor_limitPastEnd_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ParsableByteArray(TEST_DATA, TEST_DATA.length + 1));
  }
}
