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

import com.google.common.io.BaseEncoding;
import dev.mediakeys.common.util.Util;
import dev.mediakeys.extractor.mp4.Atom;
import dev.mediakeys.extractor.mp4.AtomFinder;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Extracts the default key id from {@code sinf} init data.
 *
 * <p>The init data is a UTF-8 JSON document whose {@code sinf} array holds a base64 encoded
 * protection scheme information box. The key id is read from the {@code tenc} box it contains.
 */
public final class SinfKeyIdExtractor {

  /** The JSON field holding the base64 encoded box. */
  public static final String SINF_FIELD = "sinf";

  private static final int TENC_KEY_ID_OFFSET = 8;
  private static final int KEY_ID_LENGTH = 16;

  private SinfKeyIdExtractor() {}

  /**
   * Returns the key id carried by {@code sinf} init data.
   *
   * @param initData The init data.
   * @return The key id as a lowercase hex string, or null if the data contains no {@code tenc}
   *     box or its payload is too short.
   * @throws JSONException If the init data is not a JSON document with a {@code sinf} array.
   * @throws IllegalArgumentException If the {@code sinf} entry is not valid base64.
   */
  public static @Nullable String findKeyId(byte[] initData) throws JSONException {
    JSONObject json = new JSONObject(Util.fromUtf8Bytes(initData));
    String sinfData = json.getJSONArray(SINF_FIELD).getString(0);
    byte[] sinf = BaseEncoding.base64().decode(sinfData);
    return findKeyIdInBoxes(sinf);
  }

  /**
   * Returns the key id in the {@code tenc} box of a decoded {@code sinf} payload.
   *
   * @param sinf Either the children of a {@code sinf} box or a complete {@code sinf} box.
   * @return The key id as a lowercase hex string, or null if none was found.
   */
  public static @Nullable String findKeyIdInBoxes(byte[] sinf) {
    List<AtomFinder.Location> tencBoxes = AtomFinder.findAtoms(sinf, Atom.TYPE_schi, Atom.TYPE_tenc);
    if (tencBoxes.isEmpty()) {
      tencBoxes = AtomFinder.findAtoms(sinf, Atom.TYPE_sinf, Atom.TYPE_schi, Atom.TYPE_tenc);
    }
    if (tencBoxes.isEmpty()) {
      return null;
    }
    byte @Nullable [] keyId = tencBoxes.get(0).copyPayload(TENC_KEY_ID_OFFSET, KEY_ID_LENGTH);
    return keyId == null ? null : Util.toHexString(keyId);
  }
}
