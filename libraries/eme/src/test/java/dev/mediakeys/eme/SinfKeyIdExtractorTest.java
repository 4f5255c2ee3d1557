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
import static dev.mediakeys.eme.TestBoxes.box;
import static dev.mediakeys.eme.TestBoxes.createSinfChildren;
import static dev.mediakeys.eme.TestBoxes.createSinfInitData;
import static dev.mediakeys.eme.TestBoxes.createTencPayload;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.util.Arrays;
import org.json.JSONException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link SinfKeyIdExtractor}. */
@RunWith(JUnit4.class)
public final class SinfKeyIdExtractorTest {

  @Test
  public void findKeyId_sinfChildren_returnsHexOfTencBytes8To24() throws Exception {
    byte[] initData = createSinfInitData(createSinfChildren(createTencPayload()));

    assertThat(SinfKeyIdExtractor.findKeyId(initData)).isEqualTo(TestBoxes.KEY_ID_HEX);
  }

  @Test
  public void findKeyId_completeSinfBox_returnsKeyId() throws Exception {
    byte[] initData =
        createSinfInitData(box("sinf", createSinfChildren(createTencPayload())));

    assertThat(SinfKeyIdExtractor.findKeyId(initData)).isEqualTo(TestBoxes.KEY_ID_HEX);
  }

  @Test
  public void findKeyId_longerTencPayload_readsOnlyKeyIdBytes() throws Exception {
    byte[] tenc = Arrays.copyOf(createTencPayload(), 41);
    tenc[24] = 16;

    byte[] initData = createSinfInitData(createSinfChildren(tenc));

    assertThat(SinfKeyIdExtractor.findKeyId(initData)).isEqualTo(TestBoxes.KEY_ID_HEX);
  }

  @Test
  public void findKeyId_noTencBox_returnsNull() throws Exception {
    byte[] initData =
        createSinfInitData(box("frma", new byte[] {'a', 'v', 'c', '1'}));

    assertThat(SinfKeyIdExtractor.findKeyId(initData)).isNull();
  }

  @Test
  public void findKeyId_tencWithoutSchi_returnsNull() throws Exception {
    byte[] initData = createSinfInitData(box("tenc", createTencPayload()));

    assertThat(SinfKeyIdExtractor.findKeyId(initData)).isNull();
  }

  @Test
  public void findKeyId_truncatedTencPayload_returnsNull() throws Exception {
    byte[] initData =
        createSinfInitData(createSinfChildren(Arrays.copyOf(createTencPayload(), 23)));

    assertThat(SinfKeyIdExtractor.findKeyId(initData)).isNull();
  }

  @Test
  public void findKeyId_notJson_throwsJsonException() {
    assertThrows(
        JSONException.class, () -> SinfKeyIdExtractor.findKeyId("sinf".getBytes(UTF_8)));
  }

  @Test
  public void findKeyId_invalidBase64_throwsIllegalArgumentException() {
    byte[] initData = "{\"sinf\":[\"not base64!\"]}".getBytes(UTF_8);

    assertThrows(IllegalArgumentException.class, () -> SinfKeyIdExtractor.findKeyId(initData));
  }
}
