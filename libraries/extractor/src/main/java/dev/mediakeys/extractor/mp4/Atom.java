/*
 * Copyright (C) 2014 The Android Open Source Project
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
package dev.mediakeys.extractor.mp4;

import dev.mediakeys.common.util.Assertions;

/** Box types and header constants of the ISO base media file format. */
public final class Atom {

  /** Size of an atom header, in bytes. */
  public static final int HEADER_SIZE = 8;

  /** Value for the size field in an atom that defines its size in the largesize field. */
  public static final int DEFINES_LARGE_SIZE = 1;

  public static final int TYPE_sinf = getAtomTypeInteger("sinf");
  public static final int TYPE_schi = getAtomTypeInteger("schi");
  public static final int TYPE_tenc = getAtomTypeInteger("tenc");

  private Atom() {}

  /**
   * Converts a four character atom type to the corresponding integer.
   *
   * @param typeName The four character type.
   * @return The numeric atom type.
   */
  public static int getAtomTypeInteger(String typeName) {
    Assertions.checkArgument(typeName.length() == 4);
    int result = 0;
    for (int i = 0; i < 4; i++) {
      result <<= 8;
      result |= typeName.charAt(i);
    }
    return result;
  }
}
