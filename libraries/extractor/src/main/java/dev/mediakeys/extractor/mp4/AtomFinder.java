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
package dev.mediakeys.extractor.mp4;

import static dev.mediakeys.common.util.Assertions.checkArgument;

import dev.mediakeys.common.util.ParsableByteArray;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Locates atoms by type path in a buffer of concatenated, length-prefixed atoms.
 *
 * <p>The scan never throws on malformed input. Declared sizes that run past the enclosing atom are
 * clamped to it, and a truncated header ends the scan at that level.
 */
public final class AtomFinder {

  /** The payload range of a located atom within a buffer. */
  public static final class Location {

    /** The buffer containing the atom. */
    public final byte[] data;

    /** The offset of the first payload byte, directly after the atom header. */
    public final int start;

    /** The exclusive end offset of the atom's payload. */
    public final int end;

    /* package */ Location(byte[] data, int start, int end) {
      this.data = data;
      this.start = start;
      this.end = end;
    }

    /**
     * Returns a copy of {@code length} payload bytes starting {@code offset} bytes into the
     * payload, or null if the payload is too short.
     */
    public byte @Nullable [] copyPayload(int offset, int length) {
      checkArgument(offset >= 0 && length >= 0);
      if (start + offset + length > end) {
        return null;
      }
      return Arrays.copyOfRange(data, start + offset, start + offset + length);
    }
  }

  private AtomFinder() {}

  /**
   * Returns the payload locations of every atom reached by following {@code path} from the top
   * level of {@code data}, in the order they appear.
   *
   * @param data The buffer to scan.
   * @param path The atom types to descend through. The last entry is the type of the atoms
   *     returned.
   * @return The matching locations. Empty if there are none.
   */
  public static List<Location> findAtoms(byte[] data, int... path) {
    return findAtomsInRange(data, /* start= */ 0, data.length, path);
  }

  private static List<Location> findAtomsInRange(byte[] data, int start, int end, int[] path) {
    if (path.length == 0) {
      return Collections.emptyList();
    }
    List<Location> results = new ArrayList<>();
    ParsableByteArray atomData = new ParsableByteArray(data, end);
    int position = start;
    while (end - position >= Atom.HEADER_SIZE) {
      atomData.setPosition(position);
      long atomSize = atomData.readUnsignedInt();
      int atomType = atomData.readInt();
      int atomEnd =
          atomSize > Atom.DEFINES_LARGE_SIZE ? (int) Math.min(position + atomSize, end) : end;
      if (atomEnd < position + Atom.HEADER_SIZE) {
        // Too small to hold its own header.
        break;
      }
      if (atomType == path[0]) {
        int payloadStart = position + Atom.HEADER_SIZE;
        if (path.length == 1) {
          results.add(new Location(data, payloadStart, atomEnd));
        } else {
          results.addAll(
              findAtomsInRange(
                  data, payloadStart, atomEnd, Arrays.copyOfRange(path, 1, path.length)));
        }
      }
      position = atomEnd;
    }
    return results;
  }
}
