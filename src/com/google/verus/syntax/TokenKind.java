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

/** Classification of lexical tokens. */
public enum TokenKind {
  IDENTIFIER,
  /** A reserved word. Contextual words such as {@code open} lex as identifiers. */
  KEYWORD,
  LIFETIME,
  INT_LITERAL,
  FLOAT_LITERAL,
  CHAR_LITERAL,
  BYTE_LITERAL,
  STRING_LITERAL,
  BYTE_STRING_LITERAL,
  RAW_STRING_LITERAL,
  RAW_BYTE_STRING_LITERAL,
  PUNCTUATION,
  LINE_COMMENT,
  BLOCK_COMMENT,
  DOC_COMMENT,
  EOF;

  public boolean isComment() {
    return this == LINE_COMMENT || this == BLOCK_COMMENT || this == DOC_COMMENT;
  }

  public boolean isLiteral() {
    switch (this) {
      case INT_LITERAL:
      case FLOAT_LITERAL:
      case CHAR_LITERAL:
      case BYTE_LITERAL:
      case STRING_LITERAL:
      case BYTE_STRING_LITERAL:
      case RAW_STRING_LITERAL:
      case RAW_BYTE_STRING_LITERAL:
        return true;
      default:
        return false;
    }
  }
}
