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

import com.google.verus.parse.TypeGrammar.PathStyle;
import com.google.verus.syntax.Node;
import com.google.verus.syntax.NodeKind;
import com.google.verus.syntax.Tag;
import com.google.verus.syntax.Token;
import org.jspecify.annotations.Nullable;

/**
 * Verification annotations: function, data and publish modes, specification clauses, trigger
 * attributes, proof blocks, quantifiers and the {@code assert} and {@code assume} forms.
 *
 * <p>Clause expressions are parsed without struct literals so that the brace opening a function
 * or loop body is never mistaken for a struct literal body.
 */
final class ClauseGrammar extends AbstractGrammar {

  ClauseGrammar(ParseContext ctx) {
    super(ctx);
  }

  /** {@code open} or {@code closed} */
  @Nullable Node parsePublish() {
    int start = pos();
    Node.Builder b = node(NodeKind.PUBLISH);
    return eatWord(b, "open") || eatWord(b, "closed") ? b.build() : fail(start);
  }

  /** {@code spec}, {@code spec(checked)}, {@code proof} or {@code exec} */
  @Nullable Node parseFnMode() {
    int start = pos();
    Node.Builder b = node(NodeKind.FN_MODE);
    if (at("spec")) {
      eat(b, "spec");
      if (at("(")) {
        int mark = pos();
        int size = b.size();
        if (!eat(b, "(") || !eatWord(b, "checked") || !eat(b, ")")) {
          restore(b, mark, size);
        }
      }
      return b.build();
    }
    return eat(b, "proof") || eatWord(b, "exec") ? b.build() : fail(start);
  }

  /** {@code ghost} or {@code tracked} */
  @Nullable Node parseDataMode() {
    int start = pos();
    Node.Builder b = node(NodeKind.DATA_MODE);
    return eat(b, "ghost") || eat(b, "tracked") ? b.build() : fail(start);
  }

  /** One of {@code requires}, {@code recommends}, {@code ensures} and {@code decreases}. */
  @Nullable Node parseFnClause() {
    Token next = peek();
    switch (next.text()) {
      case "requires":
        return parseClause(NodeKind.REQUIRES_CLAUSE, "requires");
      case "recommends":
        return parseClause(NodeKind.RECOMMENDS_CLAUSE, "recommends");
      case "ensures":
        return parseClause(NodeKind.ENSURES_CLAUSE, "ensures");
      case "decreases":
        return parseDecreases();
      default:
        ctx.expected(next.start(), "specification clause");
        return null;
    }
  }

  /**
   * A loop clause: {@code invariant}, {@code invariant_except_break}, {@code ensures} or
   * {@code decreases}.
   */
  @Nullable Node parseLoopClause() {
    Token next = peek();
    switch (next.text()) {
      case "invariant":
        return parseClause(NodeKind.INVARIANT_CLAUSE, "invariant");
      case "invariant_except_break":
        return parseClause(NodeKind.INVARIANT_EXCEPT_BREAK_CLAUSE, "invariant_except_break");
      case "ensures":
        return parseClause(NodeKind.ENSURES_CLAUSE, "ensures");
      case "decreases":
        return parseDecreases();
      default:
        ctx.expected(next.start(), "loop clause");
        return null;
    }
  }

  private @Nullable Node parseClause(NodeKind kind, String keyword) {
    int start = pos();
    Node.Builder b = node(kind);
    boolean introduced =
        kind == NodeKind.INVARIANT_EXCEPT_BREAK_CLAUSE ? eatWord(b, keyword) : eat(b, keyword);
    if (!introduced || !parseClauseExpressions(b)) {
      return fail(start);
    }
    return b.build();
  }

  /** {@code decreases e1, e2 when cond via proof_fn} */
  private @Nullable Node parseDecreases() {
    int start = pos();
    Node.Builder b = node(NodeKind.DECREASES_CLAUSE);
    if (!eat(b, "decreases") || !parseClauseExpressions(b)) {
      return fail(start);
    }
    if (atWord("when")) {
      eatWord(b, "when");
      Node condition = expressions().parseExpression(ExprMode.NO_STRUCT);
      if (condition == null) {
        return fail(start);
      }
      b.add(Tag.CONDITION, condition);
    }
    if (atWord("via")) {
      eatWord(b, "via");
      Node path = types().parsePath(NodeKind.PATH_EXPR, PathStyle.EXPRESSION);
      if (path == null) {
        return fail(start);
      }
      b.add(Tag.PATH, path);
    }
    return b.build();
  }

  /**
   * A comma separated list of at least one expression. A trailing comma is allowed; the list ends
   * at the first token that cannot start an expression.
   */
  private boolean parseClauseExpressions(Node.Builder b) {
    Node first = expressions().parseExpression(ExprMode.NO_STRUCT);
    if (first == null) {
      return false;
    }
    b.add(Tag.CLAUSE_EXPR, first);
    while (at(",")) {
      eat(b, ",");
      Node next = expressions().parseExpression(ExprMode.NO_STRUCT);
      if (next == null) {
        break;
      }
      b.add(Tag.CLAUSE_EXPR, next);
    }
    return true;
  }

  /** {@code #[trigger]} on an expression, or {@code #![trigger e1, e2]} in a quantifier body. */
  @Nullable Node parseTriggerAttribute(boolean inner) {
    int start = pos();
    Node.Builder b = node(NodeKind.TRIGGER_ATTRIBUTE);
    if (!eat(b, "#") || (inner && !eat(b, "!")) || !eat(b, "[") || !eatWord(b, "trigger")) {
      return fail(start);
    }
    if (!at("]")) {
      Node first = expressions().parseExpression();
      if (first == null) {
        return fail(start);
      }
      b.add(Tag.TRIGGER, first);
      while (at(",")) {
        eat(b, ",");
        Node next = expressions().parseExpression();
        if (next == null) {
          break;
        }
        b.add(Tag.TRIGGER, next);
      }
    }
    return eat(b, "]") ? b.build() : fail(start);
  }

  /** {@code proof { ... }} */
  @Nullable Node parseProofBlock(Node prefix) {
    int start = pos();
    Node.Builder b = prefixed(NodeKind.PROOF_BLOCK, prefix);
    if (!eat(b, "proof")) {
      return fail(start);
    }
    Node body = expressions().parseBlock();
    return body != null ? b.add(Tag.BODY, body).build() : fail(start);
  }

  /** {@code forall|x: int| #![trigger f(x)] body}; also {@code exists} and {@code choose}. */
  @Nullable Node parseQuantifier() {
    int start = pos();
    Node.Builder b = node(NodeKind.QUANTIFIER_EXPR);
    if (!eat(b, Tag.OPERATOR, "forall")
        && !eat(b, Tag.OPERATOR, "exists")
        && !eat(b, Tag.OPERATOR, "choose")) {
      return fail(start);
    }
    if (!expressions().parseClosureParams(b)) {
      return fail(start);
    }
    items().parseInnerAttributes(b);
    Node body = expressions().parseExpression(ExprMode.NO_STRUCT);
    return body != null ? b.add(Tag.BODY, body).build() : fail(start);
  }

  /**
   * The assert forms: {@code assert(e)}, {@code assert(e) by(prover)}, {@code assert(e) by {
   * proof }}, {@code assert(e) by(prover) requires r { proof }} and {@code assert forall|x| p
   * implies q by { proof }}.
   */
  @Nullable Node parseAssert() {
    int start = pos();
    Node.Builder b = node(NodeKind.ASSERT_EXPR);
    if (!eat(b, "assert")) {
      return fail(start);
    }
    if (at("forall")) {
      return parseAssertForall(b) ? b.setKind(NodeKind.ASSERT_FORALL_EXPR).build() : fail(start);
    }
    if (!eat(b, "(")) {
      return fail(start);
    }
    Node condition = expressions().parseExpression();
    if (condition == null || !eat(b.add(Tag.CONDITION, condition), ")")) {
      return fail(start);
    }
    if (!atWord("by")) {
      return b.build();
    }
    eatWord(b, "by");
    boolean prover = false;
    if (at("(")) {
      if (!eat(b, "(") || eatIdentifier(b, Tag.PROVER) == null || !eat(b, ")")) {
        return fail(start);
      }
      prover = true;
      if (at("requires")) {
        Node requires = parseClause(NodeKind.REQUIRES_CLAUSE, "requires");
        if (requires == null) {
          return fail(start);
        }
        b.add(Tag.CLAUSE, requires);
      }
    }
    if (at("{")) {
      Node proof = expressions().parseBlock();
      if (proof == null) {
        return fail(start);
      }
      return b.add(Tag.BODY, proof).build();
    }
    // "by" needs a prover, a proof block or both.
    if (!prover) {
      ctx.expected(peek().start(), "`(` or `{`");
      return fail(start);
    }
    return b.build();
  }

  private boolean parseAssertForall(Node.Builder b) {
    if (!eat(b, Tag.OPERATOR, "forall") || !expressions().parseClosureParams(b)) {
      return false;
    }
    items().parseInnerAttributes(b);
    Node condition = expressions().parseExpression(ExprMode.NO_STRUCT);
    if (condition == null) {
      return false;
    }
    b.add(Tag.CONDITION, condition);
    if (atWord("implies")) {
      eatWord(b, "implies");
      Node consequent = expressions().parseExpression(ExprMode.NO_STRUCT);
      if (consequent == null) {
        return false;
      }
      b.add(Tag.CONSEQUENT, consequent);
    }
    if (!eatWord(b, "by")) {
      return false;
    }
    Node proof = expressions().parseBlock();
    if (proof == null) {
      return false;
    }
    b.add(Tag.BODY, proof);
    return true;
  }

  /** {@code assume(e)} */
  @Nullable Node parseAssume() {
    int start = pos();
    Node.Builder b = node(NodeKind.ASSUME_EXPR);
    if (!eat(b, "assume") || !eat(b, "(")) {
      return fail(start);
    }
    Node condition = expressions().parseExpression();
    if (condition == null || !eat(b.add(Tag.CONDITION, condition), ")")) {
      return fail(start);
    }
    return b.build();
  }
}
