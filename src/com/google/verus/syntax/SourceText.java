/*
 * Copyright 2026 The Verus Syntax Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.verus.syntax;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;

/**
 * The text of one input, with conversions from character offsets to UTF-8 byte offsets and to
 * line and column numbers.
 *
 * <p>All positions used by the parser are offsets into the UTF-16 text held here. Line numbers
 * are one-based; column numbers are zero-based character counts from the start of the line.
 */
public final class SourceText {

  private final String name;
  private final String text;
  private final int[] lineStarts;
  // Lazily computed; byteOffsets[i] is the UTF-8 length of text.substring(0, i).
  private int[] byteOffsets;

  private SourceText(String name, String text) {
    this.name = checkNotNull(name);
    this.text = checkNotNull(text);
    this.lineStarts = computeLineStarts(text);
  }

  public static SourceText of(String name, String text) {
    return new SourceText(name, text);
  }

  private static int[] computeLineStarts(String text) {
    int[] starts = new int[16];
    int count = 1;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        if (count == starts.length) {
          starts = Arrays.copyOf(starts, count * 2);
        }
        starts[count++] = i + 1;
      }
    }
    return Arrays.copyOf(starts, count);
  }

  public String getName() {
    return name;
  }

  public String getText() {
    return text;
  }

  public int length() {
    return text.length();
  }

  public String substring(int start, int end) {
    return text.substring(start, end);
  }

  /** Returns the one-based line containing {@code offset}. */
  public int getLineno(int offset) {
    checkOffset(offset);
    int index = Arrays.binarySearch(lineStarts, offset);
    return index >= 0 ? index + 1 : -index - 1;
  }

  /** Returns the zero-based column of {@code offset} within its line. */
  public int getCharno(int offset) {
    return offset - lineStarts[getLineno(offset) - 1];
  }

  /** Returns the number of UTF-8 bytes that precede {@code offset}. */
  public int getByteOffset(int offset) {
    checkOffset(offset);
    if (byteOffsets == null) {
      byteOffsets = computeByteOffsets(text);
    }
    return byteOffsets[offset];
  }

  private static int[] computeByteOffsets(String text) {
    int[] offsets = new int[text.length() + 1];
    int bytes = 0;
    for (int i = 0; i < text.length(); i++) {
      offsets[i] = bytes;
      char c = text.charAt(i);
      if (c < 0x80) {
        bytes += 1;
      } else if (c < 0x800) {
        bytes += 2;
      } else if (Character.isSurrogate(c)) {
        // A surrogate pair encodes to four bytes.
        bytes += 2;
      } else {
        bytes += 3;
      }
    }
    offsets[text.length()] = bytes;
    return offsets;
  }

  private void checkOffset(int offset) {
    checkArgument(
        offset >= 0 && offset <= text.length(), "offset %s outside [0, %s]", offset, text.length());
  }

  @Override
  public String toString() {
    return name;
  }
}
