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
import com.google.verus.syntax.SyntaxElement;
import com.google.verus.syntax.Tag;
import com.google.verus.syntax.Token;
import com.google.verus.syntax.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Blocks, statements and expressions.
 *
 * <p>Binary operators get no precedence here. An expression is parsed as a flat
 * {@link NodeKind#BIN_CHAIN} of operands separated by operators, and {@link PrecedencePass}
 * later rebuilds it into nested binary nodes. An operand is a primary expression with its
 * prefix operators, its postfix extensions (calls, fields, indexing, {@code ?} and the {@code @}
 * view) and any trailing {@code as}, {@code is} or {@code has}.
 */
final class ExpressionGrammar extends AbstractGrammar {

  private final ImmutableList<Function<ExprMode, @Nullable Node>> primaries =
      ImmutableList.of(
          mode -> parseLiteral(),
          mode -> parseParenOrTuple(),
          mode -> parseArray(),
          this::parseBlockExpression,
          mode -> parseUnsafeBlock(),
          mode -> parseConstBlock(),
          mode -> parseAsyncBlock(),
          mode -> parseLabeledBlock(),
          mode -> parseIf(),
          this::parseLetCondition,
          mode -> parseWhile(),
          mode -> parseFor(),
          mode -> parseLoop(),
          mode -> parseMatch(),
          this::parseClosure,
          mode -> clauses().parseQuantifier(),
          mode -> clauses().parseAssert(),
          mode -> clauses().parseAssume(),
          this::parseReturn,
          this::parseBreak,
          mode -> parseContinue(),
          this::parsePrefixRange,
          mode -> items().parseMacroCall(),
          this::parseStructLiteral,
          mode -> types().parsePath(NodeKind.PATH_EXPR, PathStyle.EXPRESSION));

  /** Expressions that end in a block and may stand as statements without a semicolon. */
  private final ImmutableList<Supplier<@Nullable Node>> blockLikes =
      ImmutableList.of(
          () -> parseBlockExpression(ExprMode.NORMAL),
          this::parseUnsafeBlock,
          this::parseConstBlock,
          this::parseAsyncBlock,
          this::parseLabeledBlock,
          this::parseIf,
          this::parseWhile,
          this::parseFor,
          this::parseLoop,
          this::parseMatch,
          this::parseAssertWithProof);

  ExpressionGrammar(ParseContext ctx) {
    super(ctx);
  }

  // Blocks and statements

  /** {@code { inner-attributes statements tail }} */
  @Nullable Node parseBlock() {
    return rule("block", this::parseBlockBody);
  }

  private @Nullable Node parseBlockBody() {
    int start = pos();
    Node.Builder b = node(NodeKind.BLOCK);
    if (!eat(b, "{")) {
      return fail(start);
    }
    items().parseInnerAttributes(b);
    while (!at("}")) {
      Node statement = parseStatement();
      if (statement == null) {
        break;
      }
      b.add(Tag.STATEMENT, statement);
    }
    if (!at("}")) {
      Node tail = parseExpression();
      if (tail != null) {
        b.add(Tag.TAIL, tail);
      }
    }
    return eat(b, "}") ? b.build() : fail(start);
  }

  @Nullable Node parseStatement() {
    return rule("statement", this::parseStatementChoice);
  }

  private @Nullable Node parseStatementChoice() {
    int start = pos();
    Node.Builder prefixBuilder = node(NodeKind.EXPR_STMT);
    items().parseOuterAttributes(prefixBuilder);
    Node prefix = prefixBuilder.build();
    if (at(";")) {
      Node.Builder b = prefixed(NodeKind.EMPTY_STMT, prefix);
      eat(b, ";");
      return b.build();
    }
    Node statement = clauses().parseProofBlock(prefix);
    if (statement == null) {
      statement = parseLet(prefix);
    }
    if (statement == null) {
      statement = parseAssignmentStatement(prefix);
    }
    if (statement == null) {
      statement = parseExpressionStatement(prefix);
    }
    if (statement != null) {
      return statement;
    }
    // Items read their own attributes.
    ctx.pos = start;
    Node item = items().parseItem();
    return item != null ? item : fail(start);
  }

  /** {@code let ghost pattern: T = value else { diverge };} */
  private @Nullable Node parseLet(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.LET_STMT, prefix);
    if (!eat(b, "let")) {
      return fail(start);
    }
    Node mode = clauses().parseDataMode();
    if (mode != null) {
      b.add(Tag.DATA_MODE, mode);
    }
    Node pattern = patterns().parsePattern();
    if (pattern == null) {
      return fail(start);
    }
    b.add(Tag.PATTERN, pattern);
    if (at(":") && (!eat(b, ":") || !types().addType(b, Tag.TYPE))) {
      return fail(start);
    }
    if (at("=")) {
      eat(b, "=");
      Node value = parseExpression();
      if (value == null) {
        return fail(start);
      }
      b.add(Tag.VALUE, value);
      if (at("else")) {
        eat(b, "else");
        Node diverge = parseBlock();
        if (diverge == null) {
          return fail(start);
        }
        b.add(Tag.ELSE, diverge);
      }
    }
    return eat(b, ";") ? b.build() : fail(start);
  }

  /** {@code path op= value;} */
  private @Nullable Node parseAssignmentStatement(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.ASSIGN_STMT, prefix);
    Node target = types().parsePath(NodeKind.PATH_EXPR, PathStyle.EXPRESSION);
    if (target == null) {
      return fail(start);
    }
    b.add(Tag.LHS, target);
    Token operator = peek();
    if (operator.kind() != TokenKind.PUNCTUATION
        || OperatorPrecedence.of(operator.text()) != OperatorPrecedence.ASSIGNMENT) {
      ctx.expected(operator.start(), "assignment operator");
      return fail(start);
    }
    eat(b, Tag.OPERATOR, operator.text());
    Node value = parseExpression();
    if (value == null) {
      return fail(start);
    }
    b.add(Tag.RHS, value);
    return eat(b, ";") ? b.build() : fail(start);
  }

  /**
   * An expression ending in a block, with an optional semicolon, or any other expression followed
   * by a semicolon. A block-like expression right before the closing brace is left for the tail.
   */
  private @Nullable Node parseExpressionStatement(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.EXPR_STMT, prefix);
    Node blockLike = parseBlockLike();
    if (blockLike != null) {
      if (at(";")) {
        eat(b.add(Tag.VALUE, blockLike), ";");
        return b.build();
      }
      if (!at("}") && !continuesPostfix()) {
        return b.add(Tag.VALUE, blockLike).build();
      }
      ctx.pos = start;
    }
    Node expression = parseExpression();
    if (expression == null || !eat(b.add(Tag.VALUE, expression), ";")) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseBlockLike() {
    for (Supplier<@Nullable Node> alternative : blockLikes) {
      Node expression = alternative.get();
      if (expression != null) {
        return expression;
      }
    }
    return null;
  }

  /** Whether the next token extends the preceding expression as a method call or a try. */
  private boolean continuesPostfix() {
    return at(".") || at("?");
  }

  /** An assert form that ends in a proof block. */
  private @Nullable Node parseAssertWithProof() {
    int start = pos();
    Node assertion = clauses().parseAssert();
    if (assertion == null) {
      return null;
    }
    SyntaxElement last = assertion.getChild(assertion.getChildCount() - 1);
    return last instanceof Node && ((Node) last).isKind(NodeKind.BLOCK) ? assertion : fail(start);
  }

  // Binary chains and operands

  @Nullable Node parseExpression() {
    return parseExpression(ExprMode.NORMAL);
  }

  @Nullable Node parseExpression(ExprMode mode) {
    return memoized(
        ParseContext.MEMO_EXPRESSION,
        !mode.allowsStruct(),
        () -> rule("expression", () -> parseBinaryChain(mode)));
  }

  /**
   * {@code operand (operator operand)*}, optionally led by a {@code &&&} or {@code |||} bullet. A
   * lone operand is returned as is. A range operator may end the chain without a right operand.
   */
  private @Nullable Node parseBinaryChain(ExprMode mode) {
    return parseBinaryChain(mode, null);
  }

  /**
   * As above, but when {@code floor} is set the chain only takes operators that bind tighter than
   * {@code floor}, and no bullet.
   */
  private @Nullable Node parseBinaryChain(ExprMode mode, @Nullable OperatorPrecedence floor) {
    int start = pos();
    Node.Builder b = node(NodeKind.BIN_CHAIN);
    if (floor == null && (at("&&&") || at("|||"))) {
      eat(b, Tag.BULLET, peek().text());
    }
    Node first = parseOperand(mode);
    if (first == null) {
      return fail(start);
    }
    b.add(Tag.OPERAND, first);
    while (true) {
      Token operator = peek();
      if (operator.kind() != TokenKind.PUNCTUATION
          || !OperatorPrecedence.isBinaryOperator(operator.text())
          || (floor != null && !OperatorPrecedence.of(operator.text()).isTighterThan(floor))) {
        break;
      }
      int mark = pos();
      int size = b.size();
      eat(b, Tag.OPERATOR, operator.text());
      Node operand = parseOperand(mode);
      if (operand != null) {
        b.add(Tag.OPERAND, operand);
      } else if (operator.text().equals("..")) {
        break;
      } else {
        restore(b, mark, size);
        break;
      }
    }
    return b.size() == 1 ? first : b.build();
  }

  /** A unary expression followed by any number of {@code as T}, {@code is V} and {@code has e}. */
  private @Nullable Node parseOperand(ExprMode mode) {
    int start = pos();
    if (at("#")) {
      Node.Builder b = node(NodeKind.ATTRIBUTED_EXPR);
      items().parseOuterAttributes(b);
      Node operand = b.isEmpty() ? null : parseOperand(mode);
      return operand != null ? b.add(Tag.OPERAND, operand).build() : fail(start);
    }
    Node operand = parseUnary(mode);
    if (operand == null) {
      return fail(start);
    }
    while (true) {
      int mark = pos();
      Node.Builder b;
      Node right;
      Tag tag = Tag.TYPE;
      if (at("as")) {
        b = node(NodeKind.CAST_EXPR).add(Tag.OPERAND, operand);
        eat(b, Tag.OPERATOR, "as");
        right = types().parseType();
      } else if (atWord("is")) {
        b = node(NodeKind.IS_EXPR).add(Tag.OPERAND, operand);
        eatWord(b, "is");
        right = types().parseType();
      } else if (atWord("has")) {
        b = node(NodeKind.HAS_EXPR).add(Tag.OPERAND, operand);
        eatWord(b, "has");
        right = parseUnary(mode);
        tag = Tag.RHS;
      } else {
        return operand;
      }
      if (right == null) {
        ctx.pos = mark;
        return operand;
      }
      operand = b.add(tag, right).build();
    }
  }

  /** Prefix operators {@code - ! * & &mut}, applied to a postfix expression. */
  private @Nullable Node parseUnary(ExprMode mode) {
    int start = pos();
    List<Node.Builder> prefixes = new ArrayList<>();
    while (true) {
      Node.Builder b;
      if (at("-") || at("!") || at("*")) {
        b = node(NodeKind.UNARY_EXPR);
        eat(b, Tag.OPERATOR, peek().text());
      } else if (at("&") || at("&&")) {
        b = node(NodeKind.REF_EXPR);
        eatSplit(b, Tag.OPERATOR, '&');
        if (at("mut")) {
          eat(b, "mut");
        }
      } else {
        break;
      }
      prefixes.add(b);
    }
    Node operand = parsePostfix(mode);
    if (operand == null) {
      return fail(start);
    }
    for (int i = prefixes.size() - 1; i >= 0; i--) {
      operand = prefixes.get(i).add(Tag.OPERAND, operand).build();
    }
    return operand;
  }

  private @Nullable Node parsePostfix(ExprMode mode) {
    Node expression = parsePrimary(mode);
    if (expression == null) {
      return null;
    }
    while (true) {
      Node extended;
      if (at("?")) {
        extended = parseSuffix(NodeKind.TRY_EXPR, expression, "?");
      } else if (at("@")) {
        extended = parseSuffix(NodeKind.VIEW_EXPR, expression, "@");
      } else if (at("(")) {
        extended = parseCall(expression);
      } else if (at("[")) {
        extended = parseIndex(expression);
      } else if (at(".")) {
        extended = parseDotSuffix(expression);
      } else {
        extended = null;
      }
      if (extended == null) {
        return expression;
      }
      expression = extended;
    }
  }

  private @Nullable Node parsePrimary(ExprMode mode) {
    for (Function<ExprMode, @Nullable Node> alternative : primaries) {
      Node expression = alternative.apply(mode);
      if (expression != null) {
        return expression;
      }
    }
    return null;
  }

  private Node parseSuffix(NodeKind kind, Node operand, String suffix) {
    Node.Builder b = node(kind).add(Tag.OPERAND, operand);
    eat(b, Tag.OPERATOR, suffix);
    return b.build();
  }

  private @Nullable Node parseCall(Node callee) {
    Node.Builder b = node(NodeKind.CALL_EXPR).add(Tag.CALLEE, callee);
    Node arguments = parseArgumentList();
    return arguments != null ? b.add(Tag.ARGUMENT, arguments).build() : null;
  }

  private @Nullable Node parseArgumentList() {
    int start = pos();
    Node.Builder b = node(NodeKind.ARG_LIST);
    if (!eat(b, "(") || !delimited(b, ")", Tag.ARGUMENT, this::parseExpression)) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseIndex(Node receiver) {
    int start = pos();
    Node.Builder b = node(NodeKind.INDEX_EXPR).add(Tag.RECEIVER, receiver);
    if (!eat(b, "[")) {
      return fail(start);
    }
    Node index = parseExpression();
    if (index == null || !eat(b.add(Tag.INDEX, index), "]")) {
      return fail(start);
    }
    return b.build();
  }

  /** {@code .0}, {@code .await}, {@code .field} and {@code .method::<T>(args)} */
  private @Nullable Node parseDotSuffix(Node receiver) {
    int start = pos();
    Node.Builder b = node(NodeKind.FIELD_EXPR).add(Tag.RECEIVER, receiver);
    if (!eat(b, ".")) {
      return fail(start);
    }
    if (eatTupleIndex(b, Tag.NAME) != null) {
      return b.build();
    }
    if (at("await")) {
      eat(b, "await");
      return b.setKind(NodeKind.AWAIT_EXPR).build();
    }
    if (eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    }
    Node generics = types().parseGenericArgs(true);
    if (generics != null) {
      b.add(Tag.GENERIC_ARGS, generics);
    }
    if (at("(")) {
      Node arguments = parseArgumentList();
      if (arguments == null) {
        return fail(start);
      }
      return b.setKind(NodeKind.METHOD_CALL_EXPR).add(Tag.ARGUMENT, arguments).build();
    }
    return generics == null ? b.build() : fail(start);
  }

  // Primaries

  private @Nullable Node parseLiteral() {
    int start = pos();
    Node.Builder b = node(NodeKind.LITERAL);
    return eatLiteral(b, Tag.VALUE) != null ? b.build() : fail(start);
  }

  /** {@code ()}, {@code (e)}, {@code (e,)} and {@code (a, b)} */
  private @Nullable Node parseParenOrTuple() {
    int start = pos();
    Node.Builder b = node(NodeKind.TUPLE_EXPR);
    if (!eat(b, "(")) {
      return fail(start);
    }
    if (at(")")) {
      eat(b, ")");
      return b.build();
    }
    Node first = parseExpression();
    if (first == null) {
      return fail(start);
    }
    if (at(")")) {
      eat(b.add(Tag.OPERAND, first), ")");
      return b.setKind(NodeKind.PAREN_EXPR).build();
    }
    b.add(Tag.ELEMENT, first);
    if (!eat(b, ",") || !delimited(b, ")", Tag.ELEMENT, this::parseExpression)) {
      return fail(start);
    }
    return b.build();
  }

  /** {@code [a, b]} and {@code [value; length]} */
  private @Nullable Node parseArray() {
    int start = pos();
    Node.Builder b = node(NodeKind.ARRAY_EXPR);
    if (!eat(b, "[")) {
      return fail(start);
    }
    if (at("]")) {
      eat(b, "]");
      return b.build();
    }
    Node first = parseExpression();
    if (first == null) {
      return fail(start);
    }
    if (at(";")) {
      b.setKind(NodeKind.ARRAY_REPEAT_EXPR).add(Tag.VALUE, first);
      eat(b, ";");
      Node length = parseExpression();
      if (length == null || !eat(b.add(Tag.LENGTH, length), "]")) {
        return fail(start);
      }
      return b.build();
    }
    b.add(Tag.ELEMENT, first);
    if (at("]")) {
      eat(b, "]");
      return b.build();
    }
    if (!eat(b, ",") || !delimited(b, "]", Tag.ELEMENT, this::parseExpression)) {
      return fail(start);
    }
    return b.build();
  }

  /** A bare block. Not an operand where a block must follow the expression. */
  private @Nullable Node parseBlockExpression(ExprMode mode) {
    if (!mode.allowsStruct()) {
      return null;
    }
    return parseBlock();
  }

  private @Nullable Node parseUnsafeBlock() {
    return parseKeywordBlock(NodeKind.UNSAFE_BLOCK_EXPR, "unsafe");
  }

  private @Nullable Node parseConstBlock() {
    return parseKeywordBlock(NodeKind.CONST_BLOCK_EXPR, "const");
  }

  private @Nullable Node parseKeywordBlock(NodeKind kind, String keyword) {
    int start = pos();
    Node.Builder b = node(kind);
    if (!eat(b, keyword)) {
      return fail(start);
    }
    Node body = parseBlock();
    return body != null ? b.add(Tag.BODY, body).build() : fail(start);
  }

  private @Nullable Node parseAsyncBlock() {
    int start = pos();
    Node.Builder b = node(NodeKind.ASYNC_BLOCK_EXPR);
    if (!eat(b, "async")) {
      return fail(start);
    }
    if (at("move")) {
      eat(b, "move");
    }
    Node body = parseBlock();
    return body != null ? b.add(Tag.BODY, body).build() : fail(start);
  }

  /** {@code 'label: { ... }} */
  private @Nullable Node parseLabeledBlock() {
    int start = pos();
    Node.Builder b = node(NodeKind.LABELED_BLOCK_EXPR);
    if (!parseLabel(b)) {
      return fail(start);
    }
    Node body = parseBlock();
    return body != null ? b.add(Tag.BODY, body).build() : fail(start);
  }

  /** Consumes a label such as {@code 'outer:} if there is one. */
  private boolean parseLabel(Node.Builder b) {
    if (peek().kind() != TokenKind.LIFETIME) {
      return false;
    }
    int mark = pos();
    int size = b.size();
    eatKind(b, Tag.LABEL, TokenKind.LIFETIME, "label");
    if (!eat(b, ":")) {
      restore(b, mark, size);
      return false;
    }
    return true;
  }

  /** {@code if c { ... } else if c { ... } else { ... }} */
  private @Nullable Node parseIf() {
    return rule("if", this::parseIfBody);
  }

  private @Nullable Node parseIfBody() {
    int start = pos();
    Node.Builder b = node(NodeKind.IF_EXPR);
    if (!eat(b, "if")) {
      return fail(start);
    }
    Node condition = parseExpression(ExprMode.NO_STRUCT);
    if (condition == null) {
      return fail(start);
    }
    b.add(Tag.CONDITION, condition);
    Node then = parseBlock();
    if (then == null) {
      return fail(start);
    }
    b.add(Tag.THEN, then);
    if (at("else")) {
      eat(b, "else");
      Node otherwise = at("if") ? parseIf() : parseBlock();
      if (otherwise == null) {
        return fail(start);
      }
      b.add(Tag.ELSE, otherwise);
    }
    return b.build();
  }

  /**
   * {@code let pattern = value} inside an {@code if} or {@code while} condition. The value stops
   * at the first operator that binds no tighter than {@code &&}, which joins further conditions.
   */
  private @Nullable Node parseLetCondition(ExprMode mode) {
    if (mode.allowsStruct()) {
      return null;
    }
    int start = pos();
    Node.Builder b = node(NodeKind.LET_EXPR);
    if (!eat(b, "let")) {
      return fail(start);
    }
    Node pattern = patterns().parsePattern();
    if (pattern == null || !eat(b.add(Tag.PATTERN, pattern), "=")) {
      return fail(start);
    }
    Node value = parseBinaryChain(mode, OperatorPrecedence.AND);
    return value != null ? b.add(Tag.VALUE, value).build() : fail(start);
  }

  private @Nullable Node parseWhile() {
    int start = pos();
    Node.Builder b = node(NodeKind.WHILE_EXPR);
    parseLabel(b);
    if (!eat(b, "while")) {
      return fail(start);
    }
    Node condition = parseExpression(ExprMode.NO_STRUCT);
    if (condition == null) {
      return fail(start);
    }
    b.add(Tag.CONDITION, condition);
    return parseLoopClausesAndBody(b) ? b.build() : fail(start);
  }

  private @Nullable Node parseFor() {
    int start = pos();
    Node.Builder b = node(NodeKind.FOR_EXPR);
    parseLabel(b);
    if (!eat(b, "for")) {
      return fail(start);
    }
    Node pattern = patterns().parsePattern();
    if (pattern == null || !eat(b.add(Tag.PATTERN, pattern), "in")) {
      return fail(start);
    }
    Node iterable = parseExpression(ExprMode.NO_STRUCT);
    if (iterable == null) {
      return fail(start);
    }
    b.add(Tag.ITERABLE, iterable);
    return parseLoopClausesAndBody(b) ? b.build() : fail(start);
  }

  private @Nullable Node parseLoop() {
    int start = pos();
    Node.Builder b = node(NodeKind.LOOP_EXPR);
    parseLabel(b);
    if (!eat(b, "loop")) {
      return fail(start);
    }
    return parseLoopClausesAndBody(b) ? b.build() : fail(start);
  }

  private boolean parseLoopClausesAndBody(Node.Builder b) {
    while (!at("{")) {
      Node clause = clauses().parseLoopClause();
      if (clause == null) {
        return false;
      }
      b.add(Tag.CLAUSE, clause);
    }
    Node body = parseBlock();
    if (body == null) {
      return false;
    }
    b.add(Tag.BODY, body);
    return true;
  }

  /** {@code match scrutinee { arms }} */
  private @Nullable Node parseMatch() {
    int start = pos();
    Node.Builder b = node(NodeKind.MATCH_EXPR);
    if (!eat(b, "match")) {
      return fail(start);
    }
    Node scrutinee = parseExpression(ExprMode.NO_STRUCT);
    if (scrutinee == null || !eat(b.add(Tag.SCRUTINEE, scrutinee), "{")) {
      return fail(start);
    }
    items().parseInnerAttributes(b);
    while (!at("}")) {
      Node arm = parseMatchArm();
      if (arm == null) {
        break;
      }
      b.add(Tag.ARM, arm);
    }
    return eat(b, "}") ? b.build() : fail(start);
  }

  /**
   * {@code pattern if guard => body,}. The comma may be left out after a block body and after the
   * last arm.
   */
  private @Nullable Node parseMatchArm() {
    int start = pos();
    Node.Builder b = node(NodeKind.MATCH_ARM);
    items().parseOuterAttributes(b);
    Node pattern = patterns().parsePattern();
    if (pattern == null) {
      return fail(start);
    }
    b.add(Tag.PATTERN, pattern);
    if (at("if")) {
      eat(b, "if");
      Node guard = parseExpression();
      if (guard == null) {
        return fail(start);
      }
      b.add(Tag.GUARD, guard);
    }
    if (!eat(b, "=>")) {
      return fail(start);
    }
    int bodyStart = pos();
    Node body = parseBlockLike();
    if (body != null && !continuesPostfix()) {
      b.add(Tag.BODY, body);
      if (at(",")) {
        eat(b, ",");
      }
      return b.build();
    }
    ctx.pos = bodyStart;
    body = parseExpression();
    if (body == null) {
      return fail(start);
    }
    b.add(Tag.BODY, body);
    if (at("}")) {
      return b.build();
    }
    return eat(b, ",") ? b.build() : fail(start);
  }

  /** {@code move |params| -> R ensures e { body }} or {@code |params| body} */
  private @Nullable Node parseClosure(ExprMode mode) {
    int start = pos();
    Node.Builder b = node(NodeKind.CLOSURE_EXPR);
    if (at("move")) {
      eat(b, "move");
    }
    if (!parseClosureParams(b)) {
      return fail(start);
    }
    Node returnType = items().parseReturnType();
    if (returnType != null) {
      b.add(Tag.RETURN_TYPE, returnType);
      while (true) {
        Node clause = clauses().parseFnClause();
        if (clause == null) {
          break;
        }
        b.add(Tag.CLAUSE, clause);
      }
      Node body = parseBlock();
      return body != null ? b.add(Tag.BODY, body).build() : fail(start);
    }
    Node body = parseExpression(mode);
    return body != null ? b.add(Tag.BODY, body).build() : fail(start);
  }

  /**
   * Adds the {@code |x: T, tracked y|} parameters of a closure or quantifier to {@code b}. An
   * empty list may be written {@code ||}.
   */
  boolean parseClosureParams(Node.Builder b) {
    int mark = pos();
    int size = b.size();
    if (!eatSplit(b, null, '|')) {
      return false;
    }
    while (!at("|") && !at("||")) {
      Node param = parseClosureParam();
      if (param == null) {
        restore(b, mark, size);
        return false;
      }
      b.add(Tag.PARAMS, param);
      if (!at(",")) {
        break;
      }
      eat(b, ",");
    }
    if (!eatSplit(b, null, '|')) {
      restore(b, mark, size);
      return false;
    }
    return true;
  }

  private @Nullable Node parseClosureParam() {
    int start = pos();
    Node.Builder b = node(NodeKind.CLOSURE_PARAM);
    items().parseOuterAttributes(b);
    Node mode = clauses().parseDataMode();
    if (mode != null) {
      b.add(Tag.DATA_MODE, mode);
    }
    Node pattern = patterns().parsePatternNoTopAlt();
    if (pattern == null) {
      return fail(start);
    }
    b.add(Tag.PATTERN, pattern);
    if (at(":") && (!eat(b, ":") || !types().addType(b, Tag.TYPE))) {
      return fail(start);
    }
    return b.build();
  }

  private @Nullable Node parseReturn(ExprMode mode) {
    int start = pos();
    Node.Builder b = node(NodeKind.RETURN_EXPR);
    if (!eat(b, "return")) {
      return fail(start);
    }
    addOptionalValue(b, mode);
    return b.build();
  }

  /** {@code break 'label value} with both parts optional. */
  private @Nullable Node parseBreak(ExprMode mode) {
    int start = pos();
    Node.Builder b = node(NodeKind.BREAK_EXPR);
    if (!eat(b, "break")) {
      return fail(start);
    }
    if (peek().kind() == TokenKind.LIFETIME) {
      eatKind(b, Tag.LABEL, TokenKind.LIFETIME, "label");
    }
    addOptionalValue(b, mode);
    return b.build();
  }

  private @Nullable Node parseContinue() {
    int start = pos();
    Node.Builder b = node(NodeKind.CONTINUE_EXPR);
    if (!eat(b, "continue")) {
      return fail(start);
    }
    if (peek().kind() == TokenKind.LIFETIME) {
      eatKind(b, Tag.LABEL, TokenKind.LIFETIME, "label");
    }
    return b.build();
  }

  private void addOptionalValue(Node.Builder b, ExprMode mode) {
    Node value = parseExpression(mode);
    if (value != null) {
      b.add(Tag.VALUE, value);
    }
  }

  /** {@code ..}, {@code ..end} and {@code ..=end} */
  private @Nullable Node parsePrefixRange(ExprMode mode) {
    int start = pos();
    Node.Builder b = node(NodeKind.RANGE_EXPR);
    boolean inclusive = at("..=");
    if (!inclusive && !at("..")) {
      ctx.expected(peek().start(), "`..`");
      return fail(start);
    }
    eat(b, Tag.OPERATOR, peek().text());
    Node end = parseExpression(mode);
    if (end != null) {
      b.add(Tag.RHS, end);
    } else if (inclusive) {
      return fail(start);
    }
    return b.build();
  }

  /** {@code Path { field: value, shorthand, 0: value, ..base }} */
  private @Nullable Node parseStructLiteral(ExprMode mode) {
    if (!mode.allowsStruct()) {
      return null;
    }
    int start = pos();
    Node.Builder b = node(NodeKind.STRUCT_EXPR);
    Node path = types().parsePath(NodeKind.PATH, PathStyle.EXPRESSION);
    if (path == null || !eat(b.add(Tag.PATH, path), "{")) {
      return fail(start);
    }
    while (!at("}")) {
      if (at("..")) {
        eat(b, "..");
        Node base = parseExpression();
        if (base == null) {
          return fail(start);
        }
        b.add(Tag.BASE, base);
        break;
      }
      Node field = parseStructLiteralField();
      if (field == null) {
        return fail(start);
      }
      b.add(Tag.FIELD, field);
      if (!at(",")) {
        break;
      }
      eat(b, ",");
    }
    return eat(b, "}") ? b.build() : fail(start);
  }

  private @Nullable Node parseStructLiteralField() {
    int start = pos();
    Node.Builder b = node(NodeKind.STRUCT_EXPR_FIELD);
    items().parseOuterAttributes(b);
    if (peek().kind() == TokenKind.INT_LITERAL) {
      eatKind(b, Tag.NAME, TokenKind.INT_LITERAL, "field index");
      if (!eat(b, ":")) {
        return fail(start);
      }
    } else if (eatIdentifier(b, Tag.NAME) == null) {
      return fail(start);
    } else if (!at(":")) {
      return b.build();
    } else {
      eat(b, ":");
    }
    Node value = parseExpression();
    return value != null ? b.add(Tag.VALUE, value).build() : fail(start);
  }
}
