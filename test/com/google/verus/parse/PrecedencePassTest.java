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

import com.google.verus.syntax.Node;
import com.google.verus.syntax.NodeKind;
import com.google.verus.syntax.Tag;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PrecedencePassTest {

  private VerusParser flatParser;
  private final PrecedencePass pass = new PrecedencePass();
  private String source;

  @Before
  public void setUp() {
    ParserOptions options = new ParserOptions();
    options.setReassociateBinaryChains(false);
    flatParser = new VerusParser(options);
  }

  private Node flat(String text) {
    source = text;
    return flatParser.parseExpression(text);
  }

  private Node process(String text) {
    return pass.process(flat(text));
  }

  private String text(Node node) {
    return source.substring(node.start(), node.end());
  }

  private static String operator(Node node) {
    return node.getFirstToken(Tag.OPERATOR).text();
  }

  @Test
  public void testNodesWithoutChainsAreReturnedAsIs() {
    Node call = flat("f(x, y.z)");
    assertThat(pass.process(call)).isSameInstanceAs(call);
  }

  @Test
  public void testTighterOperatorNests() {
    Node node = process("a + b * c");
    assertThat(node.getKind()).isEqualTo(NodeKind.BIN_EXPR);
    assertThat(operator(node)).isEqualTo("+");
    assertThat(text(node.getFirstNode(Tag.RHS))).isEqualTo("b * c");

    Node logic = process("a && b || c");
    assertThat(operator(logic)).isEqualTo("||");
    assertThat(text(logic.getFirstNode(Tag.LHS))).isEqualTo("a && b");
  }

  @Test
  public void testLeftAssociativity() {
    Node node = process("a - b - c");
    assertThat(text(node.getFirstNode(Tag.LHS))).isEqualTo("a - b");
    assertThat(text(node.getFirstNode(Tag.RHS))).isEqualTo("c");
  }

  @Test
  public void testRightAssociativity() {
    Node implication = process("a ==> b ==> c");
    assertThat(text(implication.getFirstNode(Tag.LHS))).isEqualTo("a");
    assertThat(text(implication.getFirstNode(Tag.RHS))).isEqualTo("b ==> c");

    Node assignment = process("x = y = z");
    assertThat(assignment.getKind()).isEqualTo(NodeKind.ASSIGN_EXPR);
    assertThat(assignment.getFirstNode(Tag.RHS).getKind()).isEqualTo(NodeKind.ASSIGN_EXPR);
  }

  @Test
  public void testComparisonRuns() {
    Node chained = process("0 <= i + 1 < n");
    assertThat(chained.getKind()).isEqualTo(NodeKind.CHAINED_COMPARISON_EXPR);
    assertThat(chained.getNodes(Tag.OPERAND)).hasSize(3);
    assertThat(text(chained.getNodes(Tag.OPERAND).get(1))).isEqualTo("i + 1");

    Node single = process("a < b && c");
    assertThat(operator(single)).isEqualTo("&&");
    Node comparison = single.getFirstNode(Tag.LHS);
    assertThat(comparison.getKind()).isEqualTo(NodeKind.BIN_EXPR);
    assertThat(comparison.getFirstNode(Tag.LHS)).isNotNull();
    assertThat(comparison.getFirstNode(Tag.RHS)).isNotNull();
    assertThat(comparison.getNodes(Tag.OPERAND)).isEmpty();
  }

  @Test
  public void testRanges() {
    Node closed = process("a + 1..b");
    assertThat(closed.getKind()).isEqualTo(NodeKind.RANGE_EXPR);
    assertThat(text(closed.getFirstNode(Tag.LHS))).isEqualTo("a + 1");

    Node open = process("a..");
    assertThat(open.getKind()).isEqualTo(NodeKind.RANGE_EXPR);
    assertThat(open.getFirstNode(Tag.RHS)).isNull();
  }

  @Test
  public void testBullets() {
    Node same = process("&&& a &&& b");
    assertThat(same.getKind()).isEqualTo(NodeKind.BIN_EXPR);
    assertThat(same.getFirstToken(Tag.BULLET).text()).isEqualTo("&&&");
    assertThat(same.start()).isEqualTo(0);

    Node other = process("&&& a ==> b");
    assertThat(other.getKind()).isEqualTo(NodeKind.BULLET_EXPR);
    assertThat(operator(other.getFirstNode(Tag.OPERAND))).isEqualTo("==>");

    Node lone = process("||| a");
    assertThat(lone.getKind()).isEqualTo(NodeKind.BULLET_EXPR);
    assertThat(lone.getFirstNode(Tag.OPERAND).getKind()).isEqualTo(NodeKind.PATH_EXPR);
  }

  @Test
  public void testNestedChains() {
    Node arguments = process("f(a + b * c)").getFirstNode(Tag.ARGUMENT);
    assertThat(arguments.getNodes(NodeKind.BIN_CHAIN)).isEmpty();
    Node argument = arguments.getFirstNode(Tag.ARGUMENT);
    assertThat(argument.getKind()).isEqualTo(NodeKind.BIN_EXPR);
    assertThat(text(argument.getFirstNode(Tag.RHS))).isEqualTo("b * c");
  }

  @Test
  public void testMatchesParserWithPass() {
    String text = "x == 0 ==> (a * b + c <= d || e) && f(g - h)";
    Node expected = new VerusParser().parseExpression(text);
    assertThat(process(text).isEquivalentTo(expected)).isTrue();
  }

  @Test
  public void testOperatorLevels() {
    assertThat(OperatorPrecedence.of("+")).isEqualTo(OperatorPrecedence.ADDITIVE);
    assertThat(OperatorPrecedence.of("=~=")).isEqualTo(OperatorPrecedence.COMPARISON);
    assertThat(OperatorPrecedence.of("=>")).isNull();
    assertThat(OperatorPrecedence.isBinaryOperator("|||")).isTrue();
    assertThat(OperatorPrecedence.MULTIPLICATIVE.isTighterThan(OperatorPrecedence.ADDITIVE))
        .isTrue();
    assertThat(OperatorPrecedence.BIG_OR.isTighterThan(OperatorPrecedence.BIG_AND)).isFalse();
  }
}
