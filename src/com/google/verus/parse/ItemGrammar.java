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
import java.util.function.Function;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Items and their parts: attributes, visibility, functions and parameters, data types, traits and
 * impls, modules, uses, macros and token trees.
 */
final class ItemGrammar extends AbstractGrammar {

  /** One alternative of the item choice; receives the attributes and visibility already parsed. */
  private record ItemRule(String name, Function<Node, @Nullable Node> parser) {}

  private final ImmutableList<ItemRule> alternatives =
      ImmutableList.of(
          new ItemRule("const", this::parseConst),
          new ItemRule("enum", this::parseEnum),
          new ItemRule("extern_block", this::parseExternBlock),
          new ItemRule("extern_crate", this::parseExternCrate),
          new ItemRule("fn", this::parseFn),
          new ItemRule("impl", this::parseImpl),
          new ItemRule("macro_rules", this::parseMacroRules),
          new ItemRule("macro_invocation", this::parseMacroInvocation),
          new ItemRule("macro_definition", this::parseMacroDefinition),
          new ItemRule("mod", this::parseModule),
          new ItemRule("static", this::parseStatic),
          new ItemRule("struct", this::parseStruct),
          new ItemRule("trait", this::parseTrait),
          new ItemRule("trait_alias", this::parseTraitAlias),
          new ItemRule("type_alias", this::parseTypeAlias),
          new ItemRule("union", this::parseUnion),
          new ItemRule("use", this::parseUse));

  ItemGrammar(ParseContext ctx) {
    super(ctx);
  }

  /** {@code verus! { items }} */
  @Nullable Node parseVerusMacro() {
    return rule(
        "verus_block",
        () -> {
          int start = pos();
          Node.Builder b = node(NodeKind.VERUS_MACRO);
          if (!eatWord(b, "verus") || !eat(b, "!")) {
            return fail(start);
          }
          return parseItemBody(b) ? b.build() : fail(start);
        });
  }

  /** Parses items until none applies. */
  Node parseItemList() {
    Node.Builder b = node(NodeKind.ITEM_LIST);
    parseInnerAttributes(b);
    parseItems(b);
    return b.build();
  }

  private void parseItems(Node.Builder b) {
    while (true) {
      Node item = parseItem();
      if (item == null) {
        return;
      }
      b.add(Tag.ITEM, item);
    }
  }

  /** <code>{ inner-attributes items }</code> */
  private boolean parseItemBody(Node.Builder b) {
    if (!eat(b, "{")) {
      return false;
    }
    parseInnerAttributes(b);
    parseItems(b);
    return eat(b, "}");
  }

  @Nullable Node parseItem() {
    return rule("item", this::parseItemChoice);
  }

  private @Nullable Node parseItemChoice() {
    int start = pos();
    Node.Builder prefixBuilder = node(NodeKind.ITEM_LIST);
    parseOuterAttributes(prefixBuilder);
    Node visibility = parseVisibility();
    if (visibility != null) {
      prefixBuilder.add(Tag.VISIBILITY, visibility);
    }
    Node prefix = prefixBuilder.build();
    int afterPrefix = pos();
    for (ItemRule alternative : alternatives) {
      Node item = rule(alternative.name(), () -> alternative.parser().apply(prefix));
      if (item != null) {
        return item;
      }
      ctx.pos = afterPrefix;
    }
    return fail(start);
  }

  // Attributes and visibility

  void parseOuterAttributes(Node.Builder b) {
    parseAttributes(b, false);
  }

  void parseInnerAttributes(Node.Builder b) {
    parseAttributes(b, true);
  }

  private void parseAttributes(Node.Builder b, boolean inner) {
    while (at("#")) {
      Node attribute = parseAttribute(inner);
      if (attribute == null) {
        return;
      }
      b.add(Tag.ATTRIBUTE, attribute);
    }
  }

  /** {@code #[path]}, {@code #[path = value]}, {@code #[path(tokens)]} and the inner forms. */
  private @Nullable Node parseAttribute(boolean inner) {
    Node trigger = clauses().parseTriggerAttribute(inner);
    if (trigger != null) {
      return trigger;
    }
    int start = pos();
    Node.Builder b = node(NodeKind.ATTRIBUTE);
    if (!eat(b, "#") || (inner && !eat(b, "!")) || !eat(b, "[")) {
      return fail(start);
    }
    Node path = parseAttributePath();
    if (path == null) {
      return fail(start);
    }
    b.add(Tag.PATH, path);
    if (at("=")) {
      eat(b, "=");
      Node value = expressions().parseExpression();
      if (value == null) {
        return fail(start);
      }
      b.add(Tag.VALUE, value);
    } else if (at("(") || at("[") || at("{")) {
      Node value = parseTokenTree();
      if (value == null) {
        return fail(start);
      }
      b.add(Tag.VALUE, value);
    }
    return eat(b, "]") ? b.build() : fail(start);
  }

  /** Attribute paths such as {@code verifier::spec} may use reserved words as segments. */
  private @Nullable Node parseAttributePath() {
    int start = pos();
    Node.Builder b = node(NodeKind.PATH);
    do {
      Node.Builder segment = node(NodeKind.PATH_SEGMENT);
      Token name = peek();
      if (name.kind() == TokenKind.KEYWORD) {
        eat(segment, Tag.NAME, name.text());
      } else if (eatIdentifier(segment, Tag.NAME) == null) {
        return fail(start);
      }
      b.add(Tag.SEGMENT, segment.build());
    } while (at("::") && eat(b, "::"));
    return b.build();
  }

  /** {@code pub}, {@code pub(crate)}, {@code pub(self)}, {@code pub(super)} or {@code pub(in p)} */
  @Nullable Node parseVisibility() {
    int start = pos();
    Node.Builder b = node(NodeKind.VISIBILITY);
    if (!eat(b, "pub")) {
      return fail(start);
    }
    if (!at("(")) {
      return b.build();
    }
    int mark = pos();
    int size = b.size();
    eat(b, "(");
    boolean restricted;
    if (at("in")) {
      eat(b, "in");
      Node path = types().parsePath(NodeKind.PATH, PathStyle.SIMPLE);
      restricted = path != null && eat(b.add(Tag.PATH, path), ")");
    } else {
      restricted = (eat(b, "crate") || eat(b, "self") || eat(b, "super")) && eat(b, ")");
    }
    if (!restricted) {
      // pub (A, B) in a tuple struct field list: the parenthesis belongs to the type.
      restore(b, mark, size);
    }
    return b.build();
  }

  // Macros

  /** A delimited group of arbitrary tokens whose delimiters must balance. */
  @Nullable Node parseTokenTree() {
    return rule("token_tree", this::parseTokenTreeBody);
  }

  private @Nullable Node parseTokenTreeBody() {
    int start = pos();
    Node.Builder b = node(NodeKind.TOKEN_TREE);
    Token open = peek();
    String close = closerOf(open);
    if (close == null) {
      ctx.expected(open.start(), "delimiter");
      return fail(start);
    }
    eat(b, open.text());
    while (true) {
      Token next = peek();
      if (next.kind() == TokenKind.PUNCTUATION) {
        if (next.text().equals(close)) {
          eat(b, close);
          return b.build();
        }
        if (next.text().equals(")") || next.text().equals("]") || next.text().equals("}")) {
          ctx.noteFailure(next.start(), ParseErrors.UNBALANCED_DELIMITER, "`" + close + "`");
          return fail(start);
        }
        if (closerOf(next) != null) {
          Node inner = parseTokenTree();
          if (inner == null) {
            return fail(start);
          }
          b.add(inner);
          continue;
        }
      }
      if (next.isEof()) {
        ctx.noteFailure(next.start(), ParseErrors.UNBALANCED_DELIMITER, "`" + close + "`");
        return fail(start);
      }
      eatAny(b);
    }
  }

  private static @Nullable String closerOf(Token token) {
    if (token.kind() != TokenKind.PUNCTUATION) {
      return null;
    }
    switch (token.text()) {
      case "(":
        return ")";
      case "[":
        return "]";
      case "{":
        return "}";
      default:
        return null;
    }
  }

  /** {@code path!(tokens)}, usable as an expression, type, pattern or statement. */
  @Nullable Node parseMacroCall() {
    int start = pos();
    Node.Builder b = node(NodeKind.MACRO_CALL);
    return parseMacroCallParts(b) ? b.build() : fail(start);
  }

  private boolean parseMacroCallParts(Node.Builder b) {
    Node path = types().parsePath(NodeKind.PATH, PathStyle.SIMPLE);
    if (path == null || !eat(b.add(Tag.PATH, path), "!")) {
      return false;
    }
    Node body = parseTokenTree();
    if (body == null) {
      return false;
    }
    b.add(Tag.BODY, body);
    return true;
  }

  /** A macro invocation item; brace-delimited bodies need no semicolon. */
  private @Nullable Node parseMacroInvocation(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.MACRO_CALL, prefix);
    if (!parseMacroCallParts(b)) {
      return fail(start);
    }
    Node body = b.build().getFirstNode(Tag.BODY);
    if (body.getFirstSignificantToken().isPunctuation("{")) {
      if (at(";")) {
        eat(b, ";");
      }
      return b.build();
    }
    return eat(b, ";") ? b.build() : fail(start);
  }

  private @Nullable Node parseMacroRules(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.MACRO_RULES, prefix);
    if (!eatWord(b, "macro_rules") || !eat(b, "!") || eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    Node body = parseTokenTree();
    if (body == null) {
      return fail(start);
    }
    b.add(Tag.BODY, body);
    if (at(";")) {
      eat(b, ";");
    }
    return b.build();
  }

  /** {@code macro name(args) { body }} or {@code macro name { rules }} */
  private @Nullable Node parseMacroDefinition(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.MACRO_DEF, prefix);
    if (!eatWord(b, "macro") || eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    if (at("(")) {
      Node params = parseTokenTree();
      if (params == null) {
        return fail(start);
      }
      b.add(Tag.PARAMS, params);
    }
    if (!at("{")) {
      ctx.expected(peek().start(), "`{`");
      return fail(start);
    }
    Node body = parseTokenTree();
    return body != null ? b.add(Tag.BODY, body).build() : fail(start);
  }

  // Functions

  private @Nullable Node parseFn(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.FN, prefix);
    Node publish = clauses().parsePublish();
    if (publish != null) {
      b.add(Tag.PUBLISH, publish);
    }
    if (atWord("default")) {
      eatWord(b, "default");
    }
    for (String qualifier : new String[] {"const", "async", "unsafe"}) {
      if (at(qualifier)) {
        eat(b, qualifier);
      }
    }
    if (at("extern")) {
      eat(b, "extern");
      if (peek().kind() == TokenKind.STRING_LITERAL) {
        eatLiteral(b, null);
      }
    }
    Node mode = clauses().parseFnMode();
    if (mode != null) {
      b.add(Tag.MODE, mode);
    }
    if (!eat(b, "fn") || eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    Node generics = types().parseGenericParams();
    if (generics != null) {
      b.add(Tag.GENERIC_PARAMS, generics);
    }
    Node params = parseParamList();
    if (params == null) {
      return fail(start);
    }
    b.add(Tag.PARAMS, params);
    Node returnType = parseReturnType();
    if (returnType != null) {
      b.add(Tag.RETURN_TYPE, returnType);
    }
    parseFnQualifiers(b);
    if (at(";")) {
      eat(b, ";");
      return b.build();
    }
    Node body = expressions().parseBlock();
    return body != null ? b.add(Tag.BODY, body).build() : fail(start);
  }

  /** The where clause and the specification clauses, in any order. */
  private void parseFnQualifiers(Node.Builder b) {
    boolean sawWhere = false;
    while (true) {
      if (!sawWhere && at("where")) {
        Node where = types().parseWhereClause();
        if (where == null) {
          return;
        }
        b.add(Tag.WHERE, where);
        sawWhere = true;
        continue;
      }
      Node clause = clauses().parseFnClause();
      if (clause == null) {
        return;
      }
      b.add(Tag.CLAUSE, clause);
    }
  }

  @Nullable Node parseParamList() {
    int start = pos();
    Node.Builder b = node(NodeKind.PARAM_LIST);
    if (!eat(b, "(") || !delimited(b, ")", Tag.ELEMENT, this::parseParam)) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseParam() {
    int start = pos();
    Node.Builder b = node(NodeKind.PARAM);
    parseOuterAttributes(b);
    int afterAttributes = pos();
    int size = b.size();
    if (parseSelfParam(b)) {
      return b.setKind(NodeKind.SELF_PARAM).build();
    }
    restore(b, afterAttributes, size);
    if (at("...")) {
      eat(b, "...");
      return b.setKind(NodeKind.VARIADIC_PARAM).build();
    }
    Node mode = clauses().parseDataMode();
    if (mode != null) {
      b.add(Tag.DATA_MODE, mode);
    }
    Node pattern = patterns().parsePatternNoTopAlt();
    if (pattern == null || !eat(b.add(Tag.PATTERN, pattern), ":")) {
      return fail(start);
    }
    return types().addType(b, Tag.TYPE) ? b.build() : fail(start);
  }

  /** {@code self}, {@code mut self}, {@code &'a mut self}, {@code self: Box<Self>} */
  private boolean parseSelfParam(Node.Builder b) {
    Node mode = clauses().parseDataMode();
    if (mode != null) {
      b.add(Tag.DATA_MODE, mode);
    }
    if (at("&") || at("&&")) {
      eatSplit(b, null, '&');
      if (peek().kind() == TokenKind.LIFETIME) {
        eatKind(b, null, TokenKind.LIFETIME, "lifetime");
      }
      if (at("mut")) {
        eat(b, "mut");
      }
      return eat(b, Tag.NAME, "self");
    }
    if (at("mut")) {
      eat(b, "mut");
    }
    if (!eat(b, Tag.NAME, "self")) {
      return false;
    }
    if (at(":")) {
      return eat(b, ":") && types().addType(b, Tag.TYPE);
    }
    return true;
  }

  /** {@code -> T}, {@code -> tracked T} or the named form {@code -> (tracked r: T)} */
  @Nullable Node parseReturnType() {
    int start = pos();
    Node.Builder b = node(NodeKind.RET_TYPE);
    if (!eat(b, "->")) {
      return fail(start);
    }
    Node named = parseNamedReturn();
    if (named != null) {
      return b.add(Tag.TYPE, named).build();
    }
    Node mode = clauses().parseDataMode();
    if (mode != null) {
      b.add(Tag.DATA_MODE, mode);
    }
    return types().addType(b, Tag.TYPE) ? b.build() : fail(start);
  }

  private @Nullable Node parseNamedReturn() {
    int start = pos();
    Node.Builder b = node(NodeKind.NAMED_RETURN);
    if (!eat(b, "(")) {
      return fail(start);
    }
    Node mode = clauses().parseDataMode();
    if (mode != null) {
      b.add(Tag.DATA_MODE, mode);
    }
    Node pattern = patterns().parsePatternNoTopAlt();
    if (pattern == null || !eat(b.add(Tag.PATTERN, pattern), ":")) {
      return fail(start);
    }
    if (!types().addType(b, Tag.TYPE) || !eat(b, ")")) {
      return fail(start);
    }
    return b.build();
  }

  // Data types

  private @Nullable Node parseStruct(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.STRUCT, prefix);
    if (!eat(b, "struct") || eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    addOptional(b, Tag.GENERIC_PARAMS, types()::parseGenericParams);
    boolean hasWhere = addOptional(b, Tag.WHERE, types()::parseWhereClause);
    if (at("{")) {
      Node fields = parseRecordFields();
      return fields != null ? b.add(Tag.FIELDS, fields).build() : fail(start);
    }
    if (!hasWhere && at("(")) {
      Node fields = parseTupleFields();
      if (fields == null) {
        return fail(start);
      }
      b.add(Tag.FIELDS, fields);
      addOptional(b, Tag.WHERE, types()::parseWhereClause);
    }
    return eat(b, ";") ? b.build() : fail(start);
  }

  private @Nullable Node parseUnion(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.UNION, prefix);
    if (!eatWord(b, "union") || eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    addOptional(b, Tag.GENERIC_PARAMS, types()::parseGenericParams);
    addOptional(b, Tag.WHERE, types()::parseWhereClause);
    Node fields = parseRecordFields();
    return fields != null ? b.add(Tag.FIELDS, fields).build() : fail(start);
  }

  private @Nullable Node parseEnum(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.ENUM, prefix);
    if (!eat(b, "enum") || eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    addOptional(b, Tag.GENERIC_PARAMS, types()::parseGenericParams);
    addOptional(b, Tag.WHERE, types()::parseWhereClause);
    if (!eat(b, "{") || !delimited(b, "}", Tag.VARIANT, this::parseVariant)) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseVariant() {
    int start = pos();
    Node.Builder b = node(NodeKind.VARIANT);
    parseOuterAttributes(b);
    addOptional(b, Tag.VISIBILITY, this::parseVisibility);
    if (eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    if (at("{")) {
      if (!addOptional(b, Tag.FIELDS, this::parseRecordFields)) {
        return fail(start);
      }
    } else if (at("(")) {
      if (!addOptional(b, Tag.FIELDS, this::parseTupleFields)) {
        return fail(start);
      }
    }
    if (at("=")) {
      eat(b, "=");
      Node discriminant = expressions().parseExpression();
      if (discriminant == null) {
        return fail(start);
      }
      b.add(Tag.VALUE, discriminant);
    }
    return b.build();
  }

  private @Nullable Node parseRecordFields() {
    int start = pos();
    Node.Builder b = node(NodeKind.RECORD_FIELDS);
    if (!eat(b, "{") || !delimited(b, "}", Tag.FIELD, this::parseRecordField)) {
      return fail(start);
    }
    return b.build();
  }

  /** {@code pub ghost name: Type} */
  private @Nullable Node parseRecordField() {
    int start = pos();
    Node.Builder b = node(NodeKind.RECORD_FIELD);
    parseOuterAttributes(b);
    addOptional(b, Tag.VISIBILITY, this::parseVisibility);
    addOptional(b, Tag.DATA_MODE, clauses()::parseDataMode);
    if (eatIdentifier(b, Tag.NAME) == null || !eat(b, ":")) {
      return fail(start);
    }
    return types().addType(b, Tag.TYPE) ? b.build() : fail(start);
  }

  private @Nullable Node parseTupleFields() {
    int start = pos();
    Node.Builder b = node(NodeKind.TUPLE_FIELDS);
    if (!eat(b, "(") || !delimited(b, ")", Tag.FIELD, this::parseTupleField)) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseTupleField() {
    int start = pos();
    Node.Builder b = node(NodeKind.TUPLE_FIELD);
    parseOuterAttributes(b);
    addOptional(b, Tag.VISIBILITY, this::parseVisibility);
    addOptional(b, Tag.DATA_MODE, clauses()::parseDataMode);
    return types().addType(b, Tag.TYPE) ? b.build() : fail(start);
  }

  private @Nullable Node parseConst(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.CONST, prefix);
    addOptional(b, Tag.MODE, clauses()::parseFnMode);
    if (!eat(b, "const")) {
      return fail(start);
    }
    if (!eat(b, "_") && eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    if (at(":") && (!eat(b, ":") || !types().addType(b, Tag.TYPE))) {
      return fail(start);
    }
    return parseInitializerAndSemicolon(b) ? b.build() : fail(start);
  }

  private @Nullable Node parseStatic(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.STATIC, prefix);
    if (!eat(b, "static")) {
      return fail(start);
    }
    if (at("mut")) {
      eat(b, "mut");
    }
    if (eatIdentifier(b, Tag.NAME) == null || !eat(b, ":") || !types().addType(b, Tag.TYPE)) {
      return fail(start);
    }
    return parseInitializerAndSemicolon(b) ? b.build() : fail(start);
  }

  private boolean parseInitializerAndSemicolon(Node.Builder b) {
    if (at("=")) {
      eat(b, "=");
      Node value = expressions().parseExpression();
      if (value == null) {
        return false;
      }
      b.add(Tag.VALUE, value);
    }
    return eat(b, ";");
  }

  private @Nullable Node parseTypeAlias(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.TYPE_ALIAS, prefix);
    if (!eat(b, "type") || eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    addOptional(b, Tag.GENERIC_PARAMS, types()::parseGenericParams);
    if (at(":")) {
      eat(b, ":");
      addOptional(b, Tag.BOUND, types()::parseBounds);
    }
    addOptional(b, Tag.WHERE, types()::parseWhereClause);
    if (at("=") && (!eat(b, "=") || !types().addType(b, Tag.TYPE))) {
      return fail(start);
    }
    addOptional(b, Tag.WHERE, types()::parseWhereClause);
    return eat(b, ";") ? b.build() : fail(start);
  }

  // Traits and impls

  private @Nullable Node parseTrait(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.TRAIT, prefix);
    if (at("unsafe")) {
      eat(b, "unsafe");
    }
    if (atWord("auto")) {
      eatWord(b, "auto");
    }
    if (!eat(b, "trait") || eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    addOptional(b, Tag.GENERIC_PARAMS, types()::parseGenericParams);
    if (at(":")) {
      eat(b, ":");
      addOptional(b, Tag.BOUND, types()::parseBounds);
    }
    addOptional(b, Tag.WHERE, types()::parseWhereClause);
    return parseItemBody(b) ? b.build() : fail(start);
  }

  /** {@code trait Name<T> = Bound + Other;} */
  private @Nullable Node parseTraitAlias(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.TRAIT_ALIAS, prefix);
    if (!eat(b, "trait") || eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    addOptional(b, Tag.GENERIC_PARAMS, types()::parseGenericParams);
    if (!eat(b, "=")) {
      return fail(start);
    }
    addOptional(b, Tag.BOUND, types()::parseBounds);
    addOptional(b, Tag.WHERE, types()::parseWhereClause);
    return eat(b, ";") ? b.build() : fail(start);
  }

  private @Nullable Node parseImpl(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.IMPL, prefix);
    if (at("unsafe")) {
      eat(b, "unsafe");
    }
    if (!eat(b, "impl")) {
      return fail(start);
    }
    addOptional(b, Tag.GENERIC_PARAMS, types()::parseGenericParams);
    if (at("const")) {
      eat(b, "const");
    }
    int mark = pos();
    int size = b.size();
    if (at("!")) {
      eat(b, "!");
    }
    boolean traitImpl = types().addType(b, Tag.TRAIT) && at("for") && eat(b, "for");
    if (!traitImpl) {
      restore(b, mark, size);
    }
    if (!types().addType(b, Tag.SELF_TYPE)) {
      return fail(start);
    }
    addOptional(b, Tag.WHERE, types()::parseWhereClause);
    return parseItemBody(b) ? b.build() : fail(start);
  }

  // Modules, crates and uses

  private @Nullable Node parseModule(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.MODULE, prefix);
    if (at("unsafe")) {
      eat(b, "unsafe");
    }
    if (!eat(b, "mod") || eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    if (at(";")) {
      eat(b, ";");
      return b.build();
    }
    return parseItemBody(b) ? b.build() : fail(start);
  }

  private @Nullable Node parseExternCrate(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.EXTERN_CRATE, prefix);
    if (!eat(b, "extern") || !eat(b, "crate")) {
      return fail(start);
    }
    if (!eat(b, Tag.NAME, "self") && eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    if (at("as")) {
      eat(b, "as");
      if (!eat(b, Tag.ALIAS, "_") && eatIdentifier(b, Tag.ALIAS) == null) {
        return fail(start);
      }
    }
    return eat(b, ";") ? b.build() : fail(start);
  }

  /** {@code unsafe extern "C" { items }} */
  private @Nullable Node parseExternBlock(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.EXTERN_BLOCK, prefix);
    if (at("unsafe")) {
      eat(b, "unsafe");
    }
    if (!eat(b, "extern")) {
      return fail(start);
    }
    if (peek().kind() == TokenKind.STRING_LITERAL) {
      eatLiteral(b, null);
    }
    return parseItemBody(b) ? b.build() : fail(start);
  }

  private @Nullable Node parseUse(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.USE, prefix);
    if (!eat(b, "use")) {
      return fail(start);
    }
    Node tree = parseUseTree();
    if (tree == null || !eat(b.add(Tag.USE_TREE, tree), ";")) {
      return fail(start);
    }
    return b.build();
  }

  /** {@code a::b as c}, {@code a::*}, {@code a::{b, c::d}} */
  private @Nullable Node parseUseTree() {
    int start = pos();
    Node.Builder b = node(NodeKind.USE_TREE);
    Node path = types().parsePath(NodeKind.PATH, PathStyle.SIMPLE);
    if (path != null) {
      b.add(Tag.PATH, path);
      if (!at("::")) {
        if (at("as")) {
          eat(b, "as");
          if (!eat(b, Tag.ALIAS, "_") && eatIdentifier(b, Tag.ALIAS) == null) {
            return fail(start);
          }
        }
        return b.build();
      }
      eat(b, "::");
    } else if (at("::")) {
      eat(b, "::");
    }
    if (at("*")) {
      eat(b, "*");
      return b.build();
    }
    if (!eat(b, "{") || !delimited(b, "}", Tag.USE_TREE, this::parseUseTree)) {
      return fail(start);
    }
    return b.build();
  }

  /** Adds the result of an optional rule; returns whether it matched. */
  private static boolean addOptional(Node.Builder b, Tag tag, Supplier<@Nullable Node> rule) {
    Node node = rule.get();
    if (node == null) {
      return false;
    }
    b.add(tag, node);
    return true;
  }
}
