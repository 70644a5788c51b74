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

package com.google.verus.parse;

import com.google.common.collect.ImmutableList;
import com.google.verus.parse.TypeGrammar.PathStyle;
import com.google.verus.syntax.Node;
import com.google.verus.syntax.NodeKind;
import com.google.verus.syntax.Tag;
import com.google.verus.syntax.Token;
import com.google.verus.syntax.TokenKind;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Patterns. Range patterns and {@code |} alternatives are only accepted at the top level; the
 * restricted form without them is what function and closure parameters use.
 */
final class PatternGrammar extends AbstractGrammar {

  private final ImmutableList<Supplier<@Nullable Node>> alternatives =
      ImmutableList.of(
          this::parseLiteralPattern,
          this::parseWildcardPattern,
          this::parseRestPattern,
          this::parseBoxPattern,
          this::parseReferencePattern,
          this::parseSlicePattern,
          this::parseTuplePattern,
          this::parseConstBlockPattern,
          () -> items().parseMacroCall(),
          this::parseRecordPattern,
          this::parseTupleStructPattern,
          this::parseIdentPattern,
          () -> types().parsePath(NodeKind.PATH_PAT, PathStyle.EXPRESSION));

  PatternGrammar(ParseContext ctx) {
    super(ctx);
  }

  /** A full pattern: alternatives of possibly ranged primary patterns. */
  @Nullable Node parsePattern() {
    return memoized(ParseContext.MEMO_PATTERN, false, () -> rule("pattern", this::parseTopAlt));
  }

  /** A pattern without top-level ranges or alternatives. */
  @Nullable Node parsePatternNoTopAlt() {
    return memoized(
        ParseContext.MEMO_PATTERN_NO_TOP_ALT, false, () -> rule("pattern", this::parsePrimary));
  }

  private @Nullable Node parseTopAlt() {
    int start = pos();
    Node.Builder b = node(NodeKind.OR_PAT);
    boolean leadingBar = at("|");
    if (leadingBar) {
      eat(b, "|");
    }
    Node first = parseRangePattern();
    if (first == null) {
      return fail(start);
    }
    b.add(Tag.ELEMENT, first);
    while (at("|")) {
      int mark = pos();
      int size = b.size();
      eat(b, "|");
      Node next = parseRangePattern();
      if (next == null) {
        restore(b, mark, size);
        break;
      }
      b.add(Tag.ELEMENT, next);
    }
    return b.size() == 1 && !leadingBar ? first : b.build();
  }

  /** A primary pattern with an optional range tail, or a {@code ..=hi} range. */
  private @Nullable Node parseRangePattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.RANGE_PAT);
    if (at("..=")) {
      eat(b, "..=");
      Node high = parseRangeBound();
      return high != null ? b.add(Tag.RHS, high).build() : fail(start);
    }
    Node low = parsePrimary();
    if (low == null) {
      return fail(start);
    }
    if (!at("..") && !at("..=") && !at("...")) {
      return low;
    }
    b.add(Tag.LHS, low);
    if (at("..")) {
      eat(b, Tag.OPERATOR, "..");
      Node high = parseRangeBound();
      if (high != null) {
        b.add(Tag.RHS, high);
      }
      return b.build();
    }
    if (!eat(b, Tag.OPERATOR, at("...") ? "..." : "..=")) {
      return fail(start);
    }
    Node high = parseRangeBound();
    return high != null ? b.add(Tag.RHS, high).build() : fail(start);
  }

  private @Nullable Node parseRangeBound() {
    Node bound = parseLiteralPattern();
    if (bound == null) {
      bound = types().parsePath(NodeKind.PATH_PAT, PathStyle.EXPRESSION);
    }
    return bound;
  }

  private @Nullable Node parsePrimary() {
    for (Supplier<@Nullable Node> alternative : alternatives) {
      Node pattern = alternative.get();
      if (pattern != null) {
        return pattern;
      }
    }
    return null;
  }

  private @Nullable Node parseLiteralPattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.LITERAL_PAT);
    if (at("-")) {
      eat(b, "-");
    }
    return eatLiteral(b, Tag.VALUE) != null ? b.build() : fail(start);
  }

  private @Nullable Node parseWildcardPattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.WILDCARD_PAT);
    return eat(b, "_") ? b.build() : fail(start);
  }

  private @Nullable Node parseRestPattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.REST_PAT);
    return eat(b, "..") ? b.build() : fail(start);
  }

  private @Nullable Node parseBoxPattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.BOX_PAT);
    if (!eatWord(b, "box")) {
      return fail(start);
    }
    Node inner = parsePatternNoTopAlt();
    return inner != null ? b.add(Tag.PATTERN, inner).build() : fail(start);
  }

  private @Nullable Node parseReferencePattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.REF_PAT);
    if (!eatSplit(b, null, '&')) {
      return fail(start);
    }
    if (at("mut")) {
      eat(b, "mut");
    }
    Node inner = parsePatternNoTopAlt();
    return inner != null ? b.add(Tag.PATTERN, inner).build() : fail(start);
  }

  private @Nullable Node parseSlicePattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.SLICE_PAT);
    if (!eat(b, "[") || !delimited(b, "]", Tag.ELEMENT, this::parsePattern)) {
      return fail(start);
    }
    return b.build();
  }

  /** {@code ()}, {@code (p)} and {@code (p, q)}. */
  private @Nullable Node parseTuplePattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.TUPLE_PAT);
    if (!eat(b, "(")) {
      return fail(start);
    }
    if (eat(b, ")")) {
      return b.build();
    }
    Node first = parsePattern();
    if (first == null) {
      return fail(start);
    }
    b.add(Tag.ELEMENT, first);
    if (at(")")) {
      eat(b, ")");
      // (..) is a tuple with a rest element, not a parenthesized pattern.
      return first.isKind(NodeKind.REST_PAT) ? b.build() : b.setKind(NodeKind.PAREN_PAT).build();
    }
    if (!eat(b, ",") || !delimited(b, ")", Tag.ELEMENT, this::parsePattern)) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseConstBlockPattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.CONST_BLOCK_PAT);
    if (!eat(b, "const")) {
      return fail(start);
    }
    Node block = expressions().parseBlock();
    return block != null ? b.add(Tag.BODY, block).build() : fail(start);
  }

  /** {@code Point { x, y: 0, .. }} */
  private @Nullable Node parseRecordPattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.RECORD_PAT);
    Node path = types().parsePath(NodeKind.PATH, PathStyle.EXPRESSION);
    if (path == null || !eat(b.add(Tag.PATH, path), "{")) {
      return fail(start);
    }
    while (true) {
      if (eat(b, "}")) {
        return b.build();
      }
      if (at("..")) {
        eat(b, "..");
        return eat(b, "}") ? b.build() : fail(start);
      }
      Node field = parseRecordPatternField();
      if (field == null) {
        return fail(start);
      }
      b.add(Tag.FIELD, field);
      if (!eat(b, ",")) {
        return eat(b, "}") ? b.build() : fail(start);
      }
    }
  }

  private @Nullable Node parseRecordPatternField() {
    int start = pos();
    Node.Builder b = node(NodeKind.RECORD_PAT_FIELD);
    items().parseOuterAttributes(b);
    int mark = pos();
    int size = b.size();
    Token name = peek();
    boolean explicit =
        (name.kind() == TokenKind.INT_LITERAL
                ? eatKind(b, Tag.NAME, TokenKind.INT_LITERAL, "field index") != null
                : eatIdentifier(b, Tag.NAME) != null)
            && at(":")
            && eat(b, ":");
    if (explicit) {
      Node pattern = parsePattern();
      return pattern != null ? b.add(Tag.PATTERN, pattern).build() : fail(start);
    }
    restore(b, mark, size);
    // Shorthand binding.
    if (atWord("box")) {
      eatWord(b, "box");
    }
    if (at("ref")) {
      eat(b, "ref");
    }
    if (at("mut")) {
      eat(b, "mut");
    }
    return eatIdentifier(b, Tag.NAME) != null ? b.build() : fail(start);
  }

  /** {@code Some(x)} */
  private @Nullable Node parseTupleStructPattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.TUPLE_STRUCT_PAT);
    Node path = types().parsePath(NodeKind.PATH, PathStyle.EXPRESSION);
    if (path == null || !eat(b.add(Tag.PATH, path), "(")) {
      return fail(start);
    }
    return delimited(b, ")", Tag.ELEMENT, this::parsePattern) ? b.build() : fail(start);
  }

  /**
   * {@code ref mut x @ subpattern}. A name followed by {@code ::}, {@code (}, <code>{</code> or
   * {@code !} starts a path, a tuple struct, a record or a macro and is not a binding.
   */
  private @Nullable Node parseIdentPattern() {
    int start = pos();
    Node.Builder b = node(NodeKind.IDENT_PAT);
    if (at("ref")) {
      eat(b, "ref");
    }
    if (at("mut")) {
      eat(b, "mut");
    }
    if (eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    if (at("::") || at("(") || at("{") || at("!")) {
      return fail(start);
    }
    if (at("@")) {
      eat(b, "@");
      Node sub = parsePatternNoTopAlt();
      if (sub == null) {
        return fail(start);
      }
      b.add(Tag.PATTERN, sub);
    }
    return b.build();
  }
}
