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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.verus.syntax.Node;
import com.google.verus.syntax.NodeKind;
import com.google.verus.syntax.Tag;
import com.google.verus.syntax.TokenKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for expressions, statements and blocks. */
@RunWith(JUnit4.class)
public final class ExpressionGrammarTest {

  private final VerusParser parser = new VerusParser();
  private String source;

  private Node parse(String text) {
    source = text;
    return parser.parseExpression(text);
  }

  private String text(Node node) {
    return source.substring(node.start(), node.end());
  }

  private void assertKind(String text, NodeKind kind) {
    assertThat(parse(text).getKind()).isEqualTo(kind);
  }

  @Test
  public void testLiteralsAndPaths() {
    assertKind("42", NodeKind.LITERAL);
    assertKind("true", NodeKind.LITERAL);
    assertKind("\"s\"", NodeKind.LITERAL);
    assertKind("x", NodeKind.PATH_EXPR);
    assertKind("Vec::<u8>::new", NodeKind.PATH_EXPR);
    assertKind("self", NodeKind.PATH_EXPR);
  }

  @Test
  public void testParenthesesAndTuples() {
    assertKind("(a)", NodeKind.PAREN_EXPR);
    assertKind("()", NodeKind.TUPLE_EXPR);
    Node single = parse("(a,)");
    assertThat(single.getKind()).isEqualTo(NodeKind.TUPLE_EXPR);
    assertThat(single.getNodes(Tag.ELEMENT)).hasSize(1);
    assertThat(parse("(a, b, c)").getNodes(Tag.ELEMENT)).hasSize(3);
  }

  @Test
  public void testArrays() {
    assertThat(parse("[1, 2, 3]").getNodes(Tag.ELEMENT)).hasSize(3);
    assertKind("[]", NodeKind.ARRAY_EXPR);
    Node repeat = parse("[0; 4]");
    assertThat(repeat.getKind()).isEqualTo(NodeKind.ARRAY_REPEAT_EXPR);
    assertThat(text(repeat.getFirstNode(Tag.VALUE))).isEqualTo("0");
    assertThat(text(repeat.getFirstNode(Tag.LENGTH))).isEqualTo("4");
  }

  @Test
  public void testFlatChainWithoutReassociation() {
    ParserOptions options = new ParserOptions();
    options.setReassociateBinaryChains(false);
    Node chain = new VerusParser(options).parseExpression("a + b * c");
    assertThat(chain.getKind()).isEqualTo(NodeKind.BIN_CHAIN);
    assertThat(chain.getNodes(Tag.OPERAND)).hasSize(3);
    assertThat(chain.getChildren(Tag.OPERATOR)).hasSize(2);
  }

  @Test
  public void testPrecedence() {
    Node sum = parse("a + b * c");
    assertThat(sum.getKind()).isEqualTo(NodeKind.BIN_EXPR);
    assertThat(sum.getFirstToken(Tag.OPERATOR).text()).isEqualTo("+");
    assertThat(text(sum.getFirstNode(Tag.RHS))).isEqualTo("b * c");

    Node product = parse("a * b + c");
    assertThat(product.getFirstToken(Tag.OPERATOR).text()).isEqualTo("+");
    assertThat(text(product.getFirstNode(Tag.LHS))).isEqualTo("a * b");
  }

  @Test
  public void testLeftAssociativity() {
    Node node = parse("a - b - c");
    assertThat(text(node.getFirstNode(Tag.LHS))).isEqualTo("a - b");
    assertThat(text(node.getFirstNode(Tag.RHS))).isEqualTo("c");
  }

  @Test
  public void testImplicationIsRightAssociative() {
    Node node = parse("a ==> b ==> c");
    assertThat(node.getFirstToken(Tag.OPERATOR).text()).isEqualTo("==>");
    assertThat(text(node.getFirstNode(Tag.LHS))).isEqualTo("a");
    assertThat(text(node.getFirstNode(Tag.RHS))).isEqualTo("b ==> c");
  }

  @Test
  public void testLogicalOperatorsBindTighterThanImplication() {
    Node node = parse("a && b ==> c || d");
    assertThat(node.getFirstToken(Tag.OPERATOR).text()).isEqualTo("==>");
    assertThat(text(node.getFirstNode(Tag.LHS))).isEqualTo("a && b");
    assertThat(text(node.getFirstNode(Tag.RHS))).isEqualTo("c || d");

    Node equivalence = parse("p ==> q <==> r");
    assertThat(equivalence.getFirstToken(Tag.OPERATOR).text()).isEqualTo("<==>");
    assertThat(text(equivalence.getFirstNode(Tag.LHS))).isEqualTo("p ==> q");
  }

  @Test
  public void testAssignmentIsRightAssociative() {
    Node node = parse("x = y = z");
    assertThat(node.getKind()).isEqualTo(NodeKind.ASSIGN_EXPR);
    assertThat(text(node.getFirstNode(Tag.LHS))).isEqualTo("x");
    assertThat(node.getFirstNode(Tag.RHS).getKind()).isEqualTo(NodeKind.ASSIGN_EXPR);

    Node compound = parse("x += 1 << 2");
    assertThat(compound.getKind()).isEqualTo(NodeKind.ASSIGN_EXPR);
    assertThat(compound.getFirstToken(Tag.OPERATOR).text()).isEqualTo("+=");
  }

  @Test
  public void testChainedComparison() {
    Node node = parse("0 <= i < n");
    assertThat(node.getKind()).isEqualTo(NodeKind.CHAINED_COMPARISON_EXPR);
    assertThat(node.getNodes(Tag.OPERAND)).hasSize(3);
    assertThat(node.getChildren(Tag.OPERATOR)).hasSize(2);

    Node single = parse("a < b && c");
    assertThat(single.getFirstToken(Tag.OPERATOR).text()).isEqualTo("&&");
    Node comparison = single.getFirstNode(Tag.LHS);
    assertThat(comparison.getKind()).isEqualTo(NodeKind.BIN_EXPR);
    assertThat(comparison.getFirstToken(Tag.OPERATOR).text()).isEqualTo("<");
    assertThat(text(comparison.getFirstNode(Tag.RHS))).isEqualTo("b");
  }

  @Test
  public void testBullets() {
    Node conjunction = parse("&&& a &&& b");
    assertThat(conjunction.getKind()).isEqualTo(NodeKind.BIN_EXPR);
    assertThat(conjunction.getFirstToken(Tag.BULLET).text()).isEqualTo("&&&");
    assertThat(text(conjunction.getFirstNode(Tag.LHS))).isEqualTo("a");
    assertThat(text(conjunction.getFirstNode(Tag.RHS))).isEqualTo("b");

    Node lone = parse("||| a");
    assertThat(lone.getKind()).isEqualTo(NodeKind.BULLET_EXPR);
    assertThat(text(lone.getFirstNode(Tag.OPERAND))).isEqualTo("a");

    Node mixed = parse("||| a &&& b");
    assertThat(mixed.getKind()).isEqualTo(NodeKind.BULLET_EXPR);
    assertThat(mixed.getFirstNode(Tag.OPERAND).getFirstToken(Tag.OPERATOR).text())
        .isEqualTo("&&&");
  }

  @Test
  public void testRanges() {
    Node closed = parse("a..b");
    assertThat(closed.getKind()).isEqualTo(NodeKind.RANGE_EXPR);
    assertThat(text(closed.getFirstNode(Tag.LHS))).isEqualTo("a");
    assertThat(text(closed.getFirstNode(Tag.RHS))).isEqualTo("b");

    Node open = parse("a..");
    assertThat(open.getKind()).isEqualTo(NodeKind.RANGE_EXPR);
    assertThat(open.getFirstNode(Tag.RHS)).isNull();

    Node prefix = parse("..=b");
    assertThat(prefix.getKind()).isEqualTo(NodeKind.RANGE_EXPR);
    assertThat(prefix.getFirstNode(Tag.LHS)).isNull();
    assertThat(prefix.getFirstToken(Tag.OPERATOR).text()).isEqualTo("..=");

    assertKind("..", NodeKind.RANGE_EXPR);
    assertThrows(SyntaxException.class, () -> parse("..="));
  }

  @Test
  public void testUnaryOperators() {
    Node node = parse("-!*x");
    assertThat(node.getKind()).isEqualTo(NodeKind.UNARY_EXPR);
    assertThat(node.getFirstToken(Tag.OPERATOR).text()).isEqualTo("-");
    Node not = node.getFirstNode(Tag.OPERAND);
    assertThat(not.getFirstToken(Tag.OPERATOR).text()).isEqualTo("!");
    assertThat(not.getFirstNode(Tag.OPERAND).getFirstToken(Tag.OPERATOR).text()).isEqualTo("*");

    Node reference = parse("&mut v");
    assertThat(reference.getKind()).isEqualTo(NodeKind.REF_EXPR);
    assertThat(reference.hasToken("mut")).isTrue();

    Node twice = parse("&&x");
    assertThat(twice.getKind()).isEqualTo(NodeKind.REF_EXPR);
    assertThat(twice.getFirstNode(Tag.OPERAND).getKind()).isEqualTo(NodeKind.REF_EXPR);
  }

  @Test
  public void testUnaryBindsTighterThanBinary() {
    Node node = parse("-a * b");
    assertThat(node.getKind()).isEqualTo(NodeKind.BIN_EXPR);
    assertThat(node.getFirstNode(Tag.LHS).getKind()).isEqualTo(NodeKind.UNARY_EXPR);
  }

  @Test
  public void testPostfixOperators() {
    Node length = parse("s@.len()");
    assertThat(length.getKind()).isEqualTo(NodeKind.METHOD_CALL_EXPR);
    assertThat(length.getFirstToken(Tag.NAME).text()).isEqualTo("len");
    assertThat(length.getFirstNode(Tag.RECEIVER).getKind()).isEqualTo(NodeKind.VIEW_EXPR);

    Node field = parse("t.0.1");
    assertThat(field.getKind()).isEqualTo(NodeKind.FIELD_EXPR);
    assertThat(field.getFirstToken(Tag.NAME).text()).isEqualTo("1");
    assertThat(field.getFirstNode(Tag.RECEIVER).getFirstToken(Tag.NAME).text()).isEqualTo("0");

    Node tried = parse("f::<u8>(x, y)?");
    assertThat(tried.getKind()).isEqualTo(NodeKind.TRY_EXPR);
    Node call = tried.getFirstNode(Tag.OPERAND);
    assertThat(call.getKind()).isEqualTo(NodeKind.CALL_EXPR);
    assertThat(call.getFirstNode(Tag.ARGUMENT).getNodes(Tag.ARGUMENT)).hasSize(2);

    Node index = parse("a[i + 1]");
    assertThat(index.getKind()).isEqualTo(NodeKind.INDEX_EXPR);
    assertThat(text(index.getFirstNode(Tag.INDEX))).isEqualTo("i + 1");

    assertKind("fut.await", NodeKind.AWAIT_EXPR);
    Node generic = parse("v.iter::<u8>()");
    assertThat(generic.getFirstNode(Tag.GENERIC_ARGS)).isNotNull();
  }

  @Test
  public void testCastIsAndHas() {
    Node sum = parse("x as u64 + 1");
    assertThat(sum.getFirstNode(Tag.LHS).getKind()).isEqualTo(NodeKind.CAST_EXPR);

    Node is = parse("x is Some");
    assertThat(is.getKind()).isEqualTo(NodeKind.IS_EXPR);
    assertThat(is.getFirstNode(Tag.TYPE).getKind()).isEqualTo(NodeKind.PATH_TYPE);

    Node has = parse("s has 1 && b");
    assertThat(has.getFirstToken(Tag.OPERATOR).text()).isEqualTo("&&");
    Node lhs = has.getFirstNode(Tag.LHS);
    assertThat(lhs.getKind()).isEqualTo(NodeKind.HAS_EXPR);
    assertThat(text(lhs.getFirstNode(Tag.RHS))).isEqualTo("1");
  }

  @Test
  public void testStructLiteral() {
    Node node = parse("Foo { a: 1, b, ..base }");
    assertThat(node.getKind()).isEqualTo(NodeKind.STRUCT_EXPR);
    assertThat(node.getNodes(Tag.FIELD)).hasSize(2);
    assertThat(text(node.getFirstNode(Tag.BASE))).isEqualTo("base");
    assertThat(node.getNodes(Tag.FIELD).get(1).getFirstNode(Tag.VALUE)).isNull();

    Node tuple = parse("Pair { 0: x, 1: y }");
    assertThat(tuple.getNodes(Tag.FIELD)).hasSize(2);
  }

  @Test
  public void testIfElse() {
    Node node = parse("if x { 1 } else if y { 2 } else { 3 }");
    assertThat(node.getKind()).isEqualTo(NodeKind.IF_EXPR);
    assertThat(text(node.getFirstNode(Tag.CONDITION))).isEqualTo("x");
    assertThat(node.getFirstNode(Tag.THEN).getKind()).isEqualTo(NodeKind.BLOCK);
    Node otherwise = node.getFirstNode(Tag.ELSE);
    assertThat(otherwise.getKind()).isEqualTo(NodeKind.IF_EXPR);
    assertThat(otherwise.getFirstNode(Tag.ELSE).getKind()).isEqualTo(NodeKind.BLOCK);
  }

  @Test
  public void testNoStructLiteralInCondition() {
    assertThrows(SyntaxException.class, () -> parse("if S { x: 1 } == s { }"));
    Node node = parse("if (S { x: 1 }) == s { }");
    Node condition = node.getFirstNode(Tag.CONDITION);
    Node lhs = condition.getFirstNode(Tag.LHS);
    assertThat(lhs.getKind()).isEqualTo(NodeKind.PAREN_EXPR);
    assertThat(lhs.getFirstNode(Tag.OPERAND).getKind()).isEqualTo(NodeKind.STRUCT_EXPR);
  }

  @Test
  public void testIfLet() {
    Node node = parse("if let Some(x) = y { x } else { 0 }");
    Node condition = node.getFirstNode(Tag.CONDITION);
    assertThat(condition.getKind()).isEqualTo(NodeKind.LET_EXPR);
    assertThat(condition.getFirstNode(Tag.PATTERN).getKind())
        .isEqualTo(NodeKind.TUPLE_STRUCT_PAT);
    assertThat(text(condition.getFirstNode(Tag.VALUE))).isEqualTo("y");

    Node chained = parse("if let Some(x) = y && x > 0 { }");
    assertThat(chained.getFirstNode(Tag.CONDITION).getFirstToken(Tag.OPERATOR).text())
        .isEqualTo("&&");
  }

  @Test
  public void testLetConditionValueTakesTighterOperators() {
    Node node = parse("if let Some(x) = a + b { x } else { 0 }");
    Node condition = node.getFirstNode(Tag.CONDITION);
    assertThat(condition.getKind()).isEqualTo(NodeKind.LET_EXPR);
    assertThat(text(condition.getFirstNode(Tag.VALUE))).isEqualTo("a + b");

    Node chained = parse("if let Some(x) = v.len() == 3 && c { }");
    Node and = chained.getFirstNode(Tag.CONDITION);
    assertThat(and.getFirstToken(Tag.OPERATOR).text()).isEqualTo("&&");
    Node let = and.getFirstNode(Tag.LHS);
    assertThat(let.getKind()).isEqualTo(NodeKind.LET_EXPR);
    assertThat(text(let.getFirstNode(Tag.VALUE))).isEqualTo("v.len() == 3");
    assertThat(text(and.getFirstNode(Tag.RHS))).isEqualTo("c");

    Node or = parse("while let Some(x) = it.next() || done { }").getFirstNode(Tag.CONDITION);
    assertThat(or.getFirstToken(Tag.OPERATOR).text()).isEqualTo("||");
    assertThat(text(or.getFirstNode(Tag.LHS).getFirstNode(Tag.VALUE))).isEqualTo("it.next()");
  }

  @Test
  public void testLoops() {
    Node loop = parse("while x < n invariant x <= n, decreases n - x { x = x + 1; }");
    assertThat(loop.getKind()).isEqualTo(NodeKind.WHILE_EXPR);
    assertThat(loop.getNodes(Tag.CLAUSE)).hasSize(2);
    assertThat(loop.getNodes(Tag.CLAUSE).get(0).getKind()).isEqualTo(NodeKind.INVARIANT_CLAUSE);
    Node statement = loop.getFirstNode(Tag.BODY).getFirstNode(Tag.STATEMENT);
    assertThat(statement.getKind()).isEqualTo(NodeKind.ASSIGN_STMT);

    Node forLoop = parse("for i in 0..n { }");
    assertThat(forLoop.getKind()).isEqualTo(NodeKind.FOR_EXPR);
    assertThat(forLoop.getFirstNode(Tag.ITERABLE).getKind()).isEqualTo(NodeKind.RANGE_EXPR);

    Node open = parse("for i in 0.. { }");
    assertThat(open.getFirstNode(Tag.ITERABLE).getFirstNode(Tag.RHS)).isNull();
  }

  @Test
  public void testLabels() {
    Node loop = parse("'outer: loop { break 'outer; }");
    assertThat(loop.getKind()).isEqualTo(NodeKind.LOOP_EXPR);
    assertThat(loop.getFirstToken(Tag.LABEL).text()).isEqualTo("'outer");
    Node statement = loop.getFirstNode(Tag.BODY).getFirstNode(Tag.STATEMENT);
    Node jump = statement.getFirstNode(Tag.VALUE);
    assertThat(jump.getKind()).isEqualTo(NodeKind.BREAK_EXPR);
    assertThat(jump.getFirstToken(Tag.LABEL).kind()).isEqualTo(TokenKind.LIFETIME);
    assertThat(jump.getFirstNode(Tag.VALUE)).isNull();

    assertKind("'b: { 1 }", NodeKind.LABELED_BLOCK_EXPR);
  }

  @Test
  public void testMatch() {
    Node node = parse("match x { Some(y) if y > 0 => y, None => { 0 } _ => 1 }");
    assertThat(node.getKind()).isEqualTo(NodeKind.MATCH_EXPR);
    assertThat(node.getNodes(Tag.ARM)).hasSize(3);
    Node first = node.getNodes(Tag.ARM).get(0);
    assertThat(first.getFirstNode(Tag.GUARD)).isNotNull();
    assertThat(node.getNodes(Tag.ARM).get(1).getFirstNode(Tag.BODY).getKind())
        .isEqualTo(NodeKind.BLOCK);
  }

  @Test
  public void testMatchArmBlockFollowedByMethodCall() {
    Node node = parse("match x { A => { v }.len(), B => 0 }");
    Node body = node.getNodes(Tag.ARM).get(0).getFirstNode(Tag.BODY);
    assertThat(body.getKind()).isEqualTo(NodeKind.METHOD_CALL_EXPR);
  }

  @Test
  public void testClosures() {
    Node closure = parse("|x: int| x + 1");
    assertThat(closure.getKind()).isEqualTo(NodeKind.CLOSURE_EXPR);
    assertThat(closure.getNodes(Tag.PARAMS)).hasSize(1);
    assertThat(closure.getFirstNode(Tag.BODY).getKind()).isEqualTo(NodeKind.BIN_EXPR);

    Node empty = parse("|| 0");
    assertThat(empty.getNodes(Tag.PARAMS)).isEmpty();

    Node specified = parse("move |a: int| -> (r: int) ensures r == a { a }");
    assertThat(specified.hasToken("move")).isTrue();
    assertThat(specified.getFirstNode(Tag.RETURN_TYPE)).isNotNull();
    assertThat(specified.getFirstNode(Tag.CLAUSE).getKind()).isEqualTo(NodeKind.ENSURES_CLAUSE);
    assertThat(specified.getFirstNode(Tag.BODY).getKind()).isEqualTo(NodeKind.BLOCK);
  }

  @Test
  public void testQuantifiers() {
    Node node = parse("forall|i: int| 0 <= i < n ==> #[trigger] a[i] > 0");
    assertThat(node.getKind()).isEqualTo(NodeKind.QUANTIFIER_EXPR);
    assertThat(node.getFirstToken(Tag.OPERATOR).text()).isEqualTo("forall");
    assertThat(node.getNodes(Tag.PARAMS)).hasSize(1);
    Node body = node.getFirstNode(Tag.BODY);
    assertThat(body.getFirstToken(Tag.OPERATOR).text()).isEqualTo("==>");
    assertThat(body.getFirstNode(Tag.LHS).getKind())
        .isEqualTo(NodeKind.CHAINED_COMPARISON_EXPR);
    Node triggered = body.getFirstNode(Tag.RHS).getFirstNode(Tag.LHS);
    assertThat(triggered.getKind()).isEqualTo(NodeKind.ATTRIBUTED_EXPR);
    assertThat(triggered.getFirstNode(Tag.ATTRIBUTE).getKind())
        .isEqualTo(NodeKind.TRIGGER_ATTRIBUTE);
    assertThat(triggered.getFirstNode(Tag.OPERAND).getKind()).isEqualTo(NodeKind.INDEX_EXPR);
  }

  @Test
  public void testQuantifierWithInnerTrigger() {
    Node node = parse("exists|x: int, y: int| #![trigger f(x), g(y)] f(x) > g(y)");
    assertThat(node.getNodes(Tag.PARAMS)).hasSize(2);
    Node trigger = node.getFirstNode(Tag.ATTRIBUTE);
    assertThat(trigger.getKind()).isEqualTo(NodeKind.TRIGGER_ATTRIBUTE);
    assertThat(trigger.getNodes(Tag.TRIGGER)).hasSize(2);

    assertThat(parse("choose|x: int| x > 0").getFirstToken(Tag.OPERATOR).text())
        .isEqualTo("choose");
  }

  @Test
  public void testAssertForms() {
    Node plain = parse("assert(x > 0)");
    assertThat(plain.getKind()).isEqualTo(NodeKind.ASSERT_EXPR);
    assertThat(text(plain.getFirstNode(Tag.CONDITION))).isEqualTo("x > 0");

    Node prover = parse("assert(x * y >= 0) by(nonlinear_arith)");
    assertThat(prover.getFirstToken(Tag.PROVER).text()).isEqualTo("nonlinear_arith");
    assertThat(prover.getFirstNode(Tag.BODY)).isNull();

    Node proof = parse("assert(x) by { lemma(); }");
    assertThat(proof.getFirstNode(Tag.BODY).getKind()).isEqualTo(NodeKind.BLOCK);

    Node both = parse("assert(x & 1 == 0) by(bit_vector) requires y == 2 { }");
    assertThat(both.getFirstNode(Tag.CLAUSE).getKind()).isEqualTo(NodeKind.REQUIRES_CLAUSE);
    assertThat(both.getFirstNode(Tag.BODY)).isNotNull();

    Node forall = parse("assert forall|i: int| 0 <= i implies f(i) by { lemma(i); }");
    assertThat(forall.getKind()).isEqualTo(NodeKind.ASSERT_FORALL_EXPR);
    assertThat(text(forall.getFirstNode(Tag.CONDITION))).isEqualTo("0 <= i");
    assertThat(text(forall.getFirstNode(Tag.CONSEQUENT))).isEqualTo("f(i)");

    assertThrows(SyntaxException.class, () -> parse("assert(x) by"));
  }

  @Test
  public void testAssume() {
    Node node = parse("assume(false)");
    assertThat(node.getKind()).isEqualTo(NodeKind.ASSUME_EXPR);
    assertThat(node.getFirstNode(Tag.CONDITION).getKind()).isEqualTo(NodeKind.LITERAL);
  }

  @Test
  public void testJumps() {
    assertThat(parse("return x + 1").getFirstNode(Tag.VALUE).getKind())
        .isEqualTo(NodeKind.BIN_EXPR);
    assertThat(parse("return").getFirstNode(Tag.VALUE)).isNull();
    assertKind("continue", NodeKind.CONTINUE_EXPR);
  }

  @Test
  public void testMacroCall() {
    Node node = parse("vec![1, 2]");
    assertThat(node.getKind()).isEqualTo(NodeKind.MACRO_CALL);
    assertThat(node.getFirstNode(Tag.BODY).getKind()).isEqualTo(NodeKind.TOKEN_TREE);
  }

  @Test
  public void testKeywordBlocks() {
    assertKind("unsafe { f() }", NodeKind.UNSAFE_BLOCK_EXPR);
    assertKind("const { 1 }", NodeKind.CONST_BLOCK_EXPR);
    assertKind("async move { 1 }", NodeKind.ASYNC_BLOCK_EXPR);
  }

  @Test
  public void testBlockStatements() {
    Node block =
        parse("{ let ghost x: int = 1; proof { assert(x == 1); } ; y = x; g(); x }");
    assertThat(block.getKind()).isEqualTo(NodeKind.BLOCK);
    assertThat(block.getNodes(Tag.STATEMENT)).hasSize(5);
    Node let = block.getNodes(Tag.STATEMENT).get(0);
    assertThat(let.getKind()).isEqualTo(NodeKind.LET_STMT);
    assertThat(let.getFirstNode(Tag.DATA_MODE)).isNotNull();
    assertThat(let.getFirstNode(Tag.TYPE)).isNotNull();
    assertThat(block.getNodes(Tag.STATEMENT).get(1).getKind()).isEqualTo(NodeKind.PROOF_BLOCK);
    assertThat(block.getNodes(Tag.STATEMENT).get(2).getKind()).isEqualTo(NodeKind.EMPTY_STMT);
    assertThat(block.getNodes(Tag.STATEMENT).get(3).getKind()).isEqualTo(NodeKind.ASSIGN_STMT);
    assertThat(block.getNodes(Tag.STATEMENT).get(4).getKind()).isEqualTo(NodeKind.EXPR_STMT);
    assertThat(text(block.getFirstNode(Tag.TAIL))).isEqualTo("x");
  }

  @Test
  public void testLetElse() {
    Node block = parse("{ let Some(x) = y else { return; }; x }");
    Node let = block.getFirstNode(Tag.STATEMENT);
    assertThat(let.getKind()).isEqualTo(NodeKind.LET_STMT);
    assertThat(let.getFirstNode(Tag.ELSE).getKind()).isEqualTo(NodeKind.BLOCK);
  }

  @Test
  public void testBlockLikeTail() {
    Node block = parse("{ if a { 1 } else { 2 } }");
    assertThat(block.getNodes(Tag.STATEMENT)).isEmpty();
    assertThat(block.getFirstNode(Tag.TAIL).getKind()).isEqualTo(NodeKind.IF_EXPR);

    Node statements = parse("{ if a { f(); } g() }");
    assertThat(statements.getNodes(Tag.STATEMENT)).hasSize(1);
    assertThat(statements.getFirstNode(Tag.TAIL).getKind()).isEqualTo(NodeKind.CALL_EXPR);
  }

  @Test
  public void testItemInBlock() {
    Node block = parse("{ fn helper() {} helper() }");
    assertThat(block.getFirstNode(Tag.STATEMENT).getKind()).isEqualTo(NodeKind.FN);
    assertThat(block.getFirstNode(Tag.TAIL).getKind()).isEqualTo(NodeKind.CALL_EXPR);
  }

  @Test
  public void testCommentBeforeOperatorIsKept() {
    Node node = parse("a /* why */ + b");
    assertThat(node.getKind()).isEqualTo(NodeKind.BIN_EXPR);
    assertThat(node.getChildren()).hasSize(4);
    assertThat(node.getChildren().get(1).getLength()).isEqualTo(9);
    assertThat(node.getAllTokens().get(1).kind()).isEqualTo(TokenKind.BLOCK_COMMENT);
    assertThat(node.getTag(1)).isNull();
  }
}
