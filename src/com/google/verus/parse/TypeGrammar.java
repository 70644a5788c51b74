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
import com.google.common.collect.ImmutableSet;
import com.google.verus.syntax.Keywords;
import com.google.verus.syntax.Node;
import com.google.verus.syntax.NodeKind;
import com.google.verus.syntax.Tag;
import com.google.verus.syntax.Token;
import com.google.verus.syntax.TokenKind;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/** Types, paths, generic parameters and arguments, trait bounds and where clauses. */
final class TypeGrammar extends AbstractGrammar {

  /** Where generic arguments may appear in a path. */
  enum PathStyle {
    /** {@code Vec<T>} and {@code Vec::<T>}. */
    TYPE,
    /** Only the turbofish {@code Vec::<T>}, since {@code <} is an operator. */
    EXPRESSION,
    /** No generic arguments: module paths, attributes, macros. */
    SIMPLE
  }

  private static final ImmutableSet<String> FN_TRAITS =
      ImmutableSet.of("Fn", "FnMut", "FnOnce", "FnSpec");

  private final ImmutableList<Supplier<@Nullable Node>> alternatives =
      ImmutableList.of(
          this::parseArrayType,
          this::parseDynTraitType,
          this::parseFnPointerType,
          this::parseFnTraitType,
          this::parseForType,
          this::parseImplTraitType,
          this::parseInferType,
          () -> items().parseMacroCall(),
          this::parseNeverType,
          this::parseParenType,
          () -> parsePath(NodeKind.PATH_TYPE, PathStyle.TYPE),
          this::parsePointerType,
          this::parseReferenceType,
          this::parseSliceType,
          this::parseTupleType);

  TypeGrammar(ParseContext ctx) {
    super(ctx);
  }

  @Nullable Node parseType() {
    return memoized(ParseContext.MEMO_TYPE, false, () -> rule("type", this::parseTypeChoice));
  }

  private @Nullable Node parseTypeChoice() {
    for (Supplier<@Nullable Node> alternative : alternatives) {
      Node type = alternative.get();
      if (type != null) {
        return type;
      }
    }
    return null;
  }

  private @Nullable Node parseArrayType() {
    int start = pos();
    Node.Builder b = node(NodeKind.ARRAY_TYPE);
    if (!eat(b, "[") || !addType(b, Tag.TYPE) || !eat(b, ";")) {
      return fail(start);
    }
    Node length = expressions().parseExpression();
    if (length == null) {
      return fail(start);
    }
    b.add(Tag.LENGTH, length);
    return eat(b, "]") ? b.build() : fail(start);
  }

  private @Nullable Node parseSliceType() {
    int start = pos();
    Node.Builder b = node(NodeKind.SLICE_TYPE);
    if (!eat(b, "[") || !addType(b, Tag.TYPE) || !eat(b, "]")) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseDynTraitType() {
    int start = pos();
    Node.Builder b = node(NodeKind.DYN_TRAIT_TYPE);
    if (!eat(b, "dyn")) {
      return fail(start);
    }
    Node bounds = parseBounds();
    if (bounds == null) {
      return fail(start);
    }
    return b.add(Tag.BOUND, bounds).build();
  }

  private @Nullable Node parseImplTraitType() {
    int start = pos();
    Node.Builder b = node(NodeKind.IMPL_TRAIT_TYPE);
    if (!eat(b, "impl")) {
      return fail(start);
    }
    Node bounds = parseBounds();
    if (bounds == null) {
      return fail(start);
    }
    return b.add(Tag.BOUND, bounds).build();
  }

  /** {@code unsafe extern "C" fn(i32, ...) -> i32} */
  private @Nullable Node parseFnPointerType() {
    int start = pos();
    Node.Builder b = node(NodeKind.FN_PTR_TYPE);
    if (at("unsafe")) {
      eat(b, "unsafe");
    }
    if (at("extern")) {
      eat(b, "extern");
      if (peek().kind() == TokenKind.STRING_LITERAL) {
        eatLiteral(b, null);
      }
    }
    if (!eat(b, "fn") || !eat(b, "(")) {
      return fail(start);
    }
    if (!delimited(b, ")", Tag.PARAMS, this::parseFnPointerParam)) {
      return fail(start);
    }
    if (!parseOptionalReturnType(b)) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseFnPointerParam() {
    int start = pos();
    Node.Builder b = node(NodeKind.FN_PTR_PARAM);
    items().parseOuterAttributes(b);
    if (eat(b, "...")) {
      return b.build();
    }
    int mark = pos();
    int size = b.size();
    boolean named = (eatIdentifier(b, Tag.NAME) != null || eat(b, "_")) && eat(b, ":");
    if (!named) {
      restore(b, mark, size);
    }
    return addType(b, Tag.TYPE) ? b.build() : fail(start);
  }

  /** {@code Fn(A, B) -> C} and the Verus {@code FnSpec} form. */
  @Nullable Node parseFnTraitType() {
    int start = pos();
    Node.Builder b = node(NodeKind.FN_TRAIT_TYPE);
    Token name = peek();
    if (name.kind() != TokenKind.IDENTIFIER || !FN_TRAITS.contains(name.text())) {
      ctx.expected(name.start(), "Fn trait");
      return fail(start);
    }
    eatIdentifier(b, Tag.NAME);
    if (!eat(b, "(") || !delimited(b, ")", Tag.PARAMS, this::parseType)) {
      return fail(start);
    }
    if (!parseOptionalReturnType(b)) {
      return fail(start);
    }
    return b.build();
  }

  private boolean parseOptionalReturnType(Node.Builder b) {
    if (!at("->")) {
      return true;
    }
    return eat(b, "->") && addType(b, Tag.RETURN_TYPE);
  }

  private @Nullable Node parseForType() {
    int start = pos();
    Node.Builder b = node(NodeKind.FOR_TYPE);
    if (!eat(b, "for")) {
      return fail(start);
    }
    Node params = parseGenericParams();
    if (params == null || !addType(b.add(Tag.GENERIC_PARAMS, params), Tag.TYPE)) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseInferType() {
    int start = pos();
    Node.Builder b = node(NodeKind.INFER_TYPE);
    return eat(b, "_") ? b.build() : fail(start);
  }

  private @Nullable Node parseNeverType() {
    int start = pos();
    Node.Builder b = node(NodeKind.NEVER_TYPE);
    return eat(b, "!") ? b.build() : fail(start);
  }

  private @Nullable Node parseParenType() {
    int start = pos();
    Node.Builder b = node(NodeKind.PAREN_TYPE);
    if (!eat(b, "(") || !addType(b, Tag.TYPE) || !eat(b, ")")) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseTupleType() {
    int start = pos();
    Node.Builder b = node(NodeKind.TUPLE_TYPE);
    if (!eat(b, "(")) {
      return fail(start);
    }
    if (eat(b, ")")) {
      return b.build();
    }
    // A one-element tuple needs its trailing comma.
    if (!addType(b, Tag.ELEMENT) || !eat(b, ",")) {
      return fail(start);
    }
    return delimited(b, ")", Tag.ELEMENT, this::parseType) ? b.build() : fail(start);
  }

  private @Nullable Node parsePointerType() {
    int start = pos();
    Node.Builder b = node(NodeKind.PTR_TYPE);
    if (!eat(b, "*")) {
      return fail(start);
    }
    if (!eat(b, "const") && !eat(b, "mut")) {
      return fail(start);
    }
    return addType(b, Tag.TYPE) ? b.build() : fail(start);
  }

  private @Nullable Node parseReferenceType() {
    int start = pos();
    Node.Builder b = node(NodeKind.REF_TYPE);
    if (!eatSplit(b, null, '&')) {
      return fail(start);
    }
    if (peek().kind() == TokenKind.LIFETIME) {
      eatKind(b, Tag.BOUND, TokenKind.LIFETIME, "lifetime");
    }
    if (at("mut")) {
      eat(b, "mut");
    }
    return addType(b, Tag.TYPE) ? b.build() : fail(start);
  }

  /** Parses a type and adds it to {@code b}; returns false if there is none. */
  boolean addType(Node.Builder b, Tag tag) {
    Node type = parseType();
    if (type == null) {
      return false;
    }
    b.add(tag, type);
    return true;
  }

  // Paths

  /**
   * Parses a path such as {@code a::b::<T>::c}, {@code ::std::vec::Vec<T>} or
   * {@code <T as Trait>::Item} into a node of the given kind.
   */
  @Nullable Node parsePath(NodeKind kind, PathStyle style) {
    int start = pos();
    Node.Builder b = node(kind);
    if (style != PathStyle.SIMPLE && peekSplits('<')) {
      Node qualifier = parseQualifiedSelf();
      if (qualifier == null || !eat(b.add(Tag.QUALIFIER, qualifier), "::")) {
        return fail(start);
      }
    } else if (at("::")) {
      eat(b, "::");
    }
    Node segment = parsePathSegment(style);
    if (segment == null) {
      return fail(start);
    }
    b.add(Tag.SEGMENT, segment);
    while (true) {
      int mark = pos();
      int size = b.size();
      if (!at("::") || !eat(b, "::")) {
        break;
      }
      segment = parsePathSegment(style);
      if (segment == null) {
        restore(b, mark, size);
        break;
      }
      b.add(Tag.SEGMENT, segment);
    }
    return b.build();
  }

  private boolean peekSplits(char c) {
    return ctx.lexer.split(ctx.lexer.skipTrivia(pos()), c) != null;
  }

  /** {@code <Type as Trait>} */
  private @Nullable Node parseQualifiedSelf() {
    int start = pos();
    Node.Builder b = node(NodeKind.QUALIFIED_SELF);
    if (!eatSplit(b, null, '<') || !addType(b, Tag.SELF_TYPE)) {
      return fail(start);
    }
    if (at("as") && (!eat(b, "as") || !addType(b, Tag.TRAIT))) {
      return fail(start);
    }
    return eatSplit(b, null, '>') ? b.build() : fail(start);
  }

  private @Nullable Node parsePathSegment(PathStyle style) {
    int start = pos();
    Node.Builder b = node(NodeKind.PATH_SEGMENT);
    Token name = peek();
    if (name.kind() == TokenKind.KEYWORD && Keywords.isPathSegmentKeyword(name.text())) {
      eat(b, Tag.NAME, name.text());
    } else if (eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    if (style == PathStyle.SIMPLE) {
      return b.build();
    }
    Node args = parseGenericArgs(true);
    if (args == null && style == PathStyle.TYPE) {
      args = parseGenericArgs(false);
    }
    if (args != null) {
      b.add(Tag.GENERIC_ARGS, args);
    }
    return b.build();
  }

  /** {@code <T, 'a, N, Item = U>}, preceded by {@code ::} when {@code turbofish} is set. */
  @Nullable Node parseGenericArgs(boolean turbofish) {
    return rule("generic_args", () -> parseGenericArgsBody(turbofish));
  }

  private @Nullable Node parseGenericArgsBody(boolean turbofish) {
    int start = pos();
    Node.Builder b = node(NodeKind.GENERIC_ARGS);
    if (turbofish && !eat(b, "::")) {
      return fail(start);
    }
    if (!eatSplit(b, null, '<')) {
      return fail(start);
    }
    while (true) {
      if (eatSplit(b, null, '>')) {
        return b.build();
      }
      if (!parseGenericArg(b)) {
        return fail(start);
      }
      if (!eat(b, ",")) {
        return eatSplit(b, null, '>') ? b.build() : fail(start);
      }
    }
  }

  private boolean parseGenericArg(Node.Builder b) {
    if (peek().kind() == TokenKind.LIFETIME) {
      return eatKind(b, Tag.ARGUMENT, TokenKind.LIFETIME, "lifetime") != null;
    }
    int start = pos();
    Node arg = parseType();
    if (arg != null && (at("=") || at(":"))) {
      arg = parseAssocTypeBinding(arg);
      if (arg == null) {
        fail(start);
        return false;
      }
    }
    if (arg == null) {
      arg = parseConstArg();
    }
    if (arg == null) {
      return false;
    }
    b.add(Tag.ARGUMENT, arg);
    return true;
  }

  /**
   * Finishes {@code Item = T} or {@code Item: Bound} once the name, with its generic arguments,
   * has been parsed as the path type {@code name}.
   */
  private @Nullable Node parseAssocTypeBinding(Node name) {
    Node segment = bindingName(name);
    if (segment == null) {
      return null;
    }
    Node.Builder b = prefixed(NodeKind.ASSOC_TYPE_BINDING, segment);
    if (at("=")) {
      return eat(b, "=") && addType(b, Tag.TYPE) ? b.build() : null;
    }
    if (!eat(b, ":")) {
      return null;
    }
    Node bounds = parseBounds();
    return bounds != null ? b.add(Tag.BOUND, bounds).build() : null;
  }

  /** The single segment of {@code type} if it can name an associated type, or null. */
  private static @Nullable Node bindingName(Node type) {
    if (!type.isKind(NodeKind.PATH_TYPE) || type.getChildCount() != 1) {
      return null;
    }
    Node segment = type.getFirstNode(Tag.SEGMENT);
    if (segment == null) {
      return null;
    }
    Token name = segment.getFirstToken(Tag.NAME);
    if (name == null || name.kind() != TokenKind.IDENTIFIER) {
      return null;
    }
    Node args = segment.getFirstNode(Tag.GENERIC_ARGS);
    return args == null || !args.getFirstSignificantToken().text().equals("::") ? segment : null;
  }

  /** A const generic argument: a literal, a negated literal or a block. */
  @Nullable Node parseConstArg() {
    int start = pos();
    Node.Builder b = node(NodeKind.CONST_ARG);
    if (at("{")) {
      Node block = expressions().parseBlock();
      return block != null ? b.add(Tag.VALUE, block).build() : fail(start);
    }
    if (at("-")) {
      eat(b, "-");
    }
    return eatLiteral(b, Tag.VALUE) != null ? b.build() : fail(start);
  }

  // Generic parameters, bounds and where clauses

  /** {@code <'a, T: Bound = Default, const N: usize>} */
  @Nullable Node parseGenericParams() {
    int start = pos();
    Node.Builder b = node(NodeKind.GENERIC_PARAMS);
    if (!eatSplit(b, null, '<')) {
      return fail(start);
    }
    while (true) {
      if (eatSplit(b, null, '>')) {
        return b.build();
      }
      Node param = parseGenericParam();
      if (param == null) {
        return fail(start);
      }
      b.add(Tag.ELEMENT, param);
      if (!eat(b, ",")) {
        return eatSplit(b, null, '>') ? b.build() : fail(start);
      }
    }
  }

  private @Nullable Node parseGenericParam() {
    int start = pos();
    Node.Builder b = node(NodeKind.TYPE_PARAM);
    items().parseOuterAttributes(b);
    if (peek().kind() == TokenKind.LIFETIME) {
      b.setKind(NodeKind.LIFETIME_PARAM);
      eatKind(b, Tag.NAME, TokenKind.LIFETIME, "lifetime");
      if (at(":")) {
        eat(b, ":");
        if (!parseLifetimeBounds(b)) {
          return fail(start);
        }
      }
      return b.build();
    }
    if (at("const")) {
      b.setKind(NodeKind.CONST_PARAM);
      if (!eat(b, "const") || eatIdentifier(b, Tag.NAME) == null || !eat(b, ":")
          || !addType(b, Tag.TYPE)) {
        return fail(start);
      }
      if (at("=")) {
        eat(b, "=");
        Node value = parseConstArg();
        if (value == null) {
          return fail(start);
        }
        b.add(Tag.VALUE, value);
      }
      return b.build();
    }
    if (eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    if (at(":")) {
      eat(b, ":");
      Node bounds = parseBounds();
      if (bounds != null) {
        b.add(Tag.BOUND, bounds);
      }
    }
    if (at("=") && (!eat(b, "=") || !addType(b, Tag.TYPE))) {
      return fail(start);
    }
    return b.build();
  }

  private boolean parseLifetimeBounds(Node.Builder b) {
    if (eatKind(b, Tag.BOUND, TokenKind.LIFETIME, "lifetime") == null) {
      return false;
    }
    while (at("+")) {
      eat(b, "+");
      if (eatKind(b, Tag.BOUND, TokenKind.LIFETIME, "lifetime") == null) {
        return false;
      }
    }
    return true;
  }

  /** {@code Trait + 'a + ?Sized}; a trailing {@code +} is allowed. */
  @Nullable Node parseBounds() {
    int start = pos();
    Node.Builder b = node(NodeKind.TYPE_BOUND_LIST);
    Node bound = parseBound();
    if (bound == null) {
      return fail(start);
    }
    b.add(Tag.BOUND, bound);
    while (at("+")) {
      eat(b, "+");
      bound = parseBound();
      if (bound == null) {
        break;
      }
      b.add(Tag.BOUND, bound);
    }
    return b.build();
  }

  private @Nullable Node parseBound() {
    int start = pos();
    Node.Builder b = node(NodeKind.TYPE_BOUND);
    if (peek().kind() == TokenKind.LIFETIME) {
      eatKind(b, Tag.BOUND, TokenKind.LIFETIME, "lifetime");
      return b.build();
    }
    if (at("(")) {
      eat(b, "(");
      Node inner = parseBound();
      return inner != null && eat(b.add(Tag.BOUND, inner), ")") ? b.build() : fail(start);
    }
    if (at("?")) {
      eat(b, "?");
    }
    if (at("for")) {
      eat(b, "for");
      Node params = parseGenericParams();
      if (params == null) {
        return fail(start);
      }
      b.add(Tag.GENERIC_PARAMS, params);
    }
    Node trait = parseFnTraitType();
    if (trait == null) {
      trait = parsePath(NodeKind.PATH_TYPE, PathStyle.TYPE);
    }
    return trait != null ? b.add(Tag.TRAIT, trait).build() : fail(start);
  }

  /** {@code where T: Bound, 'a: 'b,} */
  @Nullable Node parseWhereClause() {
    int start = pos();
    Node.Builder b = node(NodeKind.WHERE_CLAUSE);
    if (!eat(b, "where")) {
      return fail(start);
    }
    while (true) {
      Node predicate = parseWherePredicate();
      if (predicate == null) {
        break;
      }
      b.add(Tag.PREDICATE, predicate);
      if (!at(",")) {
        break;
      }
      eat(b, ",");
    }
    return b.build();
  }

  private @Nullable Node parseWherePredicate() {
    int start = pos();
    Node.Builder b = node(NodeKind.WHERE_PREDICATE);
    if (peek().kind() == TokenKind.LIFETIME) {
      eatKind(b, Tag.TYPE, TokenKind.LIFETIME, "lifetime");
      return eat(b, ":") && parseLifetimeBounds(b) ? b.build() : fail(start);
    }
    if (at("for")) {
      eat(b, "for");
      Node params = parseGenericParams();
      if (params == null) {
        return fail(start);
      }
      b.add(Tag.GENERIC_PARAMS, params);
    }
    if (!addType(b, Tag.TYPE) || !eat(b, ":")) {
      return fail(start);
    }
    Node bounds = parseBounds();
    if (bounds != null) {
      b.add(Tag.BOUND, bounds);
    }
    return b.build();
  }
}
