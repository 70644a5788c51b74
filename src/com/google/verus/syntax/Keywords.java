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

import com.google.common.collect.ImmutableSet;

/**
 * Reserved words of the language. Reserved words lex as {@link TokenKind#KEYWORD} and can never
 * be used as identifiers; contextual words lex as identifiers and are recognized by the grammar
 * only where they have a meaning.
 */
public final class Keywords {

  private static final ImmutableSet<String> RUST_KEYWORDS =
      ImmutableSet.of(
          "as", "async", "await", "break", "const", "continue", "crate", "dyn", "else", "enum",
          "extern", "false", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod",
          "move", "mut", "pub", "ref", "return", "self", "Self", "static", "struct", "super",
          "trait", "true", "type", "unsafe", "use", "where", "while");

  private static final ImmutableSet<String> VERUS_KEYWORDS =
      ImmutableSet.of(
          "assert", "assume", "choose", "decreases", "ensures", "exists", "forall", "ghost",
          "invariant", "proof", "recommends", "requires", "spec", "tracked");

  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.<String>builder().addAll(RUST_KEYWORDS).addAll(VERUS_KEYWORDS).build();

  private static final ImmutableSet<String> CONTEXTUAL =
      ImmutableSet.of(
          "auto", "box", "by", "checked", "closed", "default", "exec", "has", "implies",
          "invariant_except_break", "is", "macro", "macro_rules", "open", "trigger", "union", "via",
          "when");

  private Keywords() {}

  public static boolean isReserved(String word) {
    return RESERVED.contains(word);
  }

  public static boolean isVerusKeyword(String word) {
    return VERUS_KEYWORDS.contains(word);
  }

  public static boolean isContextual(String word) {
    return CONTEXTUAL.contains(word);
  }

  /** Keywords that may start a path segment in place of an identifier. */
  public static boolean isPathSegmentKeyword(String word) {
    switch (word) {
      case "self":
      case "Self":
      case "super":
      case "crate":
        return true;
      default:
        return false;
    }
  }

  public static ImmutableSet<String> reservedWords() {
    return RESERVED;
  }
}
