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

/** A lexical token: its kind, its exact text, and the range of source it covers. */
public record Token(TokenKind kind, String text, int start, int end) implements SyntaxElement {

  public Token {
    checkNotNull(kind);
    checkNotNull(text);
    checkArgument(
        end - start == text.length(), "text %s does not cover [%s, %s)", text, start, end);
  }

  public boolean isComment() {
    return kind.isComment();
  }

  public boolean isKeyword(String keyword) {
    return kind == TokenKind.KEYWORD && text.equals(keyword);
  }

  public boolean isPunctuation(String punctuation) {
    return kind == TokenKind.PUNCTUATION && text.equals(punctuation);
  }

  /** Whether this is an identifier spelled {@code word}, as used for contextual keywords. */
  public boolean isWord(String word) {
    return kind == TokenKind.IDENTIFIER && text.equals(word);
  }

  public boolean isEof() {
    return kind == TokenKind.EOF;
  }

  @Override
  public String toString() {
    return kind + " '" + text + "' [" + start + "," + end + ")";
  }
}
