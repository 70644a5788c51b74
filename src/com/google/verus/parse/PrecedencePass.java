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

import static com.google.common.base.Preconditions.checkState;

import com.google.verus.parse.OperatorPrecedence.Associativity;
import com.google.verus.syntax.Node;
import com.google.verus.syntax.NodeKind;
import com.google.verus.syntax.SyntaxElement;
import com.google.verus.syntax.Tag;
import com.google.verus.syntax.Token;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Rebuilds every {@link NodeKind#BIN_CHAIN} into nested binary nodes using the levels of
 * {@link OperatorPrecedence}.
 *
 * <p>A chain {@code a + b * c} becomes {@code BIN_EXPR(a, +, BIN_EXPR(b, *, c))}. Assignments
 * become {@link NodeKind#ASSIGN_EXPR} and ranges {@link NodeKind#RANGE_EXPR}; a run of
 * comparisons such as {@code 0 <= i < n} becomes one {@link NodeKind#CHAINED_COMPARISON_EXPR}. A
 * leading bullet ({@code &&& a &&& b}) is kept on the outermost node of the same operator, or
 * wraps the result in a {@link NodeKind#BULLET_EXPR} otherwise. Comments in front of an operator
 * stay in front of it in the node that owns the operator.
 */
final class PrecedencePass implements TreePass {

  @Override
  public Node process(Node root) {
    Node.Builder b = Node.builder(root.getKind(), root.start());
    boolean changed = false;
    for (int i = 0; i < root.getChildCount(); i++) {
      SyntaxElement child = root.getChild(i);
      if (child instanceof Node) {
        Node rewritten = process((Node) child);
        changed |= rewritten != child;
        child = rewritten;
      }
      b.add(root.getTag(i), child);
    }
    Node result = changed ? b.build() : root;
    return result.isKind(NodeKind.BIN_CHAIN) ? new Chain(result).reassociate() : result;
  }

  /** One binary operator of a chain with the comments written in front of it. */
  private static final class Operator {
    final List<SyntaxElement> elements = new ArrayList<>();
    @Nullable Token token;

    OperatorPrecedence level() {
      return OperatorPrecedence.of(token.text());
    }
  }

  /** Cursor over the operands and operators of one chain. */
  private static final class Chain {
    private final List<SyntaxElement> leading = new ArrayList<>();
    private @Nullable Token bullet;
    private final List<Node> operands = new ArrayList<>();
    private final List<Operator> operators = new ArrayList<>();
    private int nextOperand;
    private int nextOperator;

    Chain(Node chain) {
      Operator pending = new Operator();
      for (int i = 0; i < chain.getChildCount(); i++) {
        SyntaxElement child = chain.getChild(i);
        Tag tag = chain.getTag(i);
        if (tag == Tag.BULLET) {
          bullet = (Token) child;
          leading.addAll(pending.elements);
          leading.add(child);
          pending = new Operator();
        } else if (tag == Tag.OPERAND) {
          operands.add((Node) child);
        } else if (tag == Tag.OPERATOR) {
          pending.elements.add(child);
          pending.token = (Token) child;
          operators.add(pending);
          pending = new Operator();
        } else {
          pending.elements.add(child);
        }
      }
      checkState(pending.elements.isEmpty(), "Dangling comments in %s", chain);
      checkState(!operands.isEmpty(), "Chain without operands: %s", chain);
    }

    Node reassociate() {
      Node result = parseLevel(0);
      checkState(nextOperator == operators.size(), "Operators left over");
      if (bullet == null) {
        return result;
      }
      Token top = result.getFirstToken(Tag.OPERATOR);
      if (result.isKind(NodeKind.BIN_EXPR) && top != null && top.text().equals(bullet.text())) {
        Node.Builder b = Node.builder(NodeKind.BIN_EXPR, leading.get(0).start());
        b.addAll(leading.subList(0, leading.size() - 1));
        b.add(Tag.BULLET, bullet);
        for (int i = 0; i < result.getChildCount(); i++) {
          b.add(result.getTag(i), result.getChild(i));
        }
        return b.build();
      }
      Node.Builder b = Node.builder(NodeKind.BULLET_EXPR, leading.get(0).start());
      b.addAll(leading.subList(0, leading.size() - 1));
      b.add(Tag.BULLET, bullet);
      return b.add(Tag.OPERAND, result).build();
    }

    /** Builds the longest expression whose operators are all at least as loose as {@code min}. */
    private Node parseLevel(int min) {
      Node left = operands.get(nextOperand++);
      while (nextOperator < operators.size()) {
        Operator operator = operators.get(nextOperator);
        OperatorPrecedence level = operator.level();
        if (level.ordinal() < min) {
          break;
        }
        if (level.getAssociativity() == Associativity.CHAIN) {
          left = parseComparisons(left);
          continue;
        }
        nextOperator++;
        if (nextOperand == operands.size()) {
          // An open range such as a.. ends the chain.
          left = binary(NodeKind.RANGE_EXPR, left, operator, null);
          continue;
        }
        int rightMin =
            level.getAssociativity() == Associativity.RIGHT ? level.ordinal() : level.ordinal() + 1;
        Node right = parseLevel(rightMin);
        left = binary(kindOf(level), left, operator, right);
      }
      return left;
    }

    private Node parseComparisons(Node first) {
      Node.Builder b = Node.builder(NodeKind.CHAINED_COMPARISON_EXPR, first.start());
      b.add(Tag.OPERAND, first);
      int count = 0;
      while (nextOperator < operators.size()
          && operators.get(nextOperator).level() == OperatorPrecedence.COMPARISON) {
        Operator operator = operators.get(nextOperator++);
        for (SyntaxElement element : operator.elements) {
          b.add(element == operator.token ? Tag.OPERATOR : null, element);
        }
        b.add(Tag.OPERAND, parseLevel(OperatorPrecedence.COMPARISON.ordinal() + 1));
        count++;
      }
      return count > 1 ? b.build() : relabel(b.build());
    }

    /** Turns a single comparison into an ordinary binary node. */
    private static Node relabel(Node comparison) {
      Node.Builder b = Node.builder(NodeKind.BIN_EXPR, comparison.start());
      int operands = 0;
      for (int i = 0; i < comparison.getChildCount(); i++) {
        Tag tag = comparison.getTag(i);
        if (tag == Tag.OPERAND) {
          tag = operands++ == 0 ? Tag.LHS : Tag.RHS;
        }
        b.add(tag, comparison.getChild(i));
      }
      return b.build();
    }

    private static NodeKind kindOf(OperatorPrecedence level) {
      switch (level) {
        case ASSIGNMENT:
          return NodeKind.ASSIGN_EXPR;
        case RANGE:
          return NodeKind.RANGE_EXPR;
        default:
          return NodeKind.BIN_EXPR;
      }
    }

    private static Node binary(
        NodeKind kind, Node left, Operator operator, @Nullable Node right) {
      Node.Builder b = Node.builder(kind, left.start());
      b.add(Tag.LHS, left);
      for (SyntaxElement element : operator.elements) {
        b.add(element == operator.token ? Tag.OPERATOR : null, element);
      }
      if (right != null) {
        b.add(Tag.RHS, right);
      }
      return b.build();
    }
  }
}
