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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.verus.syntax.Node;
import com.google.verus.syntax.SourceText;
import com.google.verus.syntax.Token;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Mutable state of one parse: the cursor, the furthest failure seen so far, the stack of active
 * rules and the memo table. Owns the grammars, which share it. A context is used by a single
 * thread for a single parse.
 */
final class ParseContext {

  /** Memo table slots, one per memoized rule. */
  static final int MEMO_EXPRESSION = 0;
  static final int MEMO_TYPE = 1;
  static final int MEMO_PATTERN = 2;
  static final int MEMO_PATTERN_NO_TOP_ALT = 3;

  final SourceText source;
  final Lexer lexer;
  final ParserOptions options;

  /** Offset of the next unconsumed character. Trivia before the next token is not consumed. */
  int pos;

  private int furthestPos = -1;
  private DiagnosticType furthestType = ParseErrors.EXPECTED_TOKEN;
  private final Set<String> expected = new LinkedHashSet<>();
  private ImmutableList<String> furthestRules = ImmutableList.of();

  private final List<String> rules = new ArrayList<>();
  private final Map<Long, MemoEntry> memo = new HashMap<>();

  final ItemGrammar items;
  final ExpressionGrammar expressions;
  final TypeGrammar types;
  final PatternGrammar patterns;
  final ClauseGrammar clauses;

  ParseContext(Lexer lexer, ParserOptions options, int start) {
    this.source = lexer.getSource();
    this.lexer = lexer;
    this.options = options;
    this.pos = start;
    this.items = new ItemGrammar(this);
    this.expressions = new ExpressionGrammar(this);
    this.types = new TypeGrammar(this);
    this.patterns = new PatternGrammar(this);
    this.clauses = new ClauseGrammar(this);
  }

  /** Returns the next significant token after the cursor without consuming it. */
  Token peek() {
    try {
      return lexer.lex(lexer.skipTrivia(pos));
    } catch (LexicalException e) {
      throw e.withRuleStack(ruleStack());
    }
  }

  /** Whether only trivia remains after the cursor. */
  boolean atEnd() {
    return peek().isEof();
  }

  void enter(String rule) {
    if (rules.size() >= options.getMaxRecursionDepth()) {
      throw new SyntaxException(
          VerusError.make(
              ParseErrors.RECURSION_LIMIT,
              source,
              lexer.skipTrivia(pos),
              ruleStack(),
              options.getMaxRecursionDepth()));
    }
    rules.add(rule);
  }

  void exit() {
    rules.remove(rules.size() - 1);
  }

  ImmutableList<String> ruleStack() {
    return ImmutableList.copyOf(rules);
  }

  /** Records that {@code what} was expected at {@code at}. */
  void expected(int at, String what) {
    noteFailure(at, ParseErrors.EXPECTED_TOKEN, what);
  }

  /**
   * Records a failed match. Only failures at the furthest position reached so far are kept;
   * at that position the expectations accumulate, and a specific diagnostic type takes the
   * place of the generic {@link ParseErrors#EXPECTED_TOKEN}.
   */
  void noteFailure(int at, DiagnosticType type, String what) {
    if (at < furthestPos) {
      return;
    }
    if (at > furthestPos) {
      furthestPos = at;
      furthestType = type;
      furthestRules = ruleStack();
      expected.clear();
    } else if (type != ParseErrors.EXPECTED_TOKEN && furthestType == ParseErrors.EXPECTED_TOKEN) {
      furthestType = type;
      furthestRules = ruleStack();
    }
    expected.add(what);
  }

  int getFurthestPosition() {
    return furthestPos;
  }

  /** Builds the error for the furthest failure recorded so far. */
  SyntaxException syntaxError() {
    int at = furthestPos < 0 ? lexer.skipTrivia(pos) : furthestPos;
    Token found = lexer.lex(at);
    String expectation =
        expected.size() == 1
            ? expected.iterator().next()
            : "one of " + Joiner.on(", ").join(expected);
    Object foundText =
        furthestType == ParseErrors.RESERVED_KEYWORD ? found.text() : describe(found);
    return new SyntaxException(
        VerusError.make(furthestType, source, at, furthestRules, expectation, foundText));
  }

  /** Builds an error of the given type at {@code at} under the current rule stack. */
  SyntaxException syntaxError(DiagnosticType type, int at, Object... arguments) {
    return new SyntaxException(VerusError.make(type, source, at, ruleStack(), arguments));
  }

  static String describe(Token token) {
    return token.isEof() ? "end of input" : "`" + token.text() + "`";
  }

  @Nullable MemoEntry lookup(int rule, boolean flag, int at) {
    return memo.get(memoKey(rule, flag, at));
  }

  void remember(int rule, boolean flag, int at, @Nullable Node node, int end) {
    memo.put(memoKey(rule, flag, at), new MemoEntry(node, end));
  }

  private static long memoKey(int rule, boolean flag, int at) {
    return ((long) at << 8) | (rule << 1) | (flag ? 1 : 0);
  }

  /** The outcome of a memoized rule at one position: the node, or null, and where it ended. */
  record MemoEntry(@Nullable Node node, int end) {}
}
