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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SourceTextTest {

  @Test
  public void testLineAndColumn() {
    SourceText source = SourceText.of("test.rs", "ab\ncd\n");
    assertThat(source.getLineno(0)).isEqualTo(1);
    assertThat(source.getCharno(1)).isEqualTo(1);
    assertThat(source.getLineno(2)).isEqualTo(1);
    assertThat(source.getLineno(3)).isEqualTo(2);
    assertThat(source.getCharno(3)).isEqualTo(0);
    assertThat(source.getCharno(4)).isEqualTo(1);
    assertThat(source.getLineno(6)).isEqualTo(3);
    assertThat(source.getCharno(6)).isEqualTo(0);
  }

  @Test
  public void testByteOffsets() {
    // a: 1 byte, é: 2 bytes, €: 3 bytes, 😀: a surrogate pair of 4 bytes.
    SourceText source = SourceText.of("test.rs", "aé€😀b");
    assertThat(source.length()).isEqualTo(6);
    assertThat(source.getByteOffset(0)).isEqualTo(0);
    assertThat(source.getByteOffset(1)).isEqualTo(1);
    assertThat(source.getByteOffset(2)).isEqualTo(3);
    assertThat(source.getByteOffset(3)).isEqualTo(6);
    assertThat(source.getByteOffset(5)).isEqualTo(10);
    assertThat(source.getByteOffset(6)).isEqualTo(11);
  }

  @Test
  public void testOffsetOutOfRange() {
    SourceText source = SourceText.of("test.rs", "abc");
    assertThrows(IllegalArgumentException.class, () -> source.getByteOffset(4));
    assertThrows(IllegalArgumentException.class, () -> source.getLineno(-1));
  }

  @Test
  public void testSubstring() {
    SourceText source = SourceText.of("test.rs", "fn main() {}");
    assertThat(source.substring(3, 7)).isEqualTo("main");
    assertThat(source.getName()).isEqualTo("test.rs");
    assertThat(source.toString()).isEqualTo("test.rs");
  }
}
