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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * Binding strength of the binary operators, loosest first:
 *
 * <pre>
 *   |||
 *   &amp;&amp;&amp;
 *   =  +=  -=  *=  /=  %=  ^=  &amp;=  |=  &lt;&lt;=  &gt;&gt;=     right associative
 *   ..  ..=
 *   &lt;==&gt;
 *   &lt;==
 *   ==&gt;                                          right associative
 *   ||
 *   &amp;&amp;
 *   ==  !=  &lt;  &gt;  &lt;=  &gt;=  ===  =~=  =~~=          chainable
 *   |
 *   ^
 *   &amp;
 *   &lt;&lt;  &gt;&gt;
 *   +  -
 *   *  /  %
 * </pre>
 *
 * <p>Casts, {@code is} and {@code has} and the prefix operators bind tighter than all of these and
 * are handled by the grammar.
 */
enum OperatorPrecedence {
  BIG_OR(Associativity.LEFT),
  BIG_AND(Associativity.LEFT),
  ASSIGNMENT(Associativity.RIGHT),
  RANGE(Associativity.LEFT),
  EQUIVALENCE(Associativity.LEFT),
  EXPLICATION(Associativity.LEFT),
  IMPLICATION(Associativity.RIGHT),
  OR(Associativity.LEFT),
  AND(Associativity.LEFT),
  COMPARISON(Associativity.CHAIN),
  BIT_OR(Associativity.LEFT),
  BIT_XOR(Associativity.LEFT),
  BIT_AND(Associativity.LEFT),
  SHIFT(Associativity.LEFT),
  ADDITIVE(Associativity.LEFT),
  MULTIPLICATIVE(Associativity.LEFT);

  enum Associativity {
    LEFT,
    RIGHT,
    /** A run of operators at this level forms a single chained node, as in {@code a < b <= c}. */
    CHAIN
  }

  private static final ImmutableMap<String, OperatorPrecedence> OPERATORS =
      ImmutableMap.<String, OperatorPrecedence>builder()
          .put("|||", BIG_OR)
          .put("&&&", BIG_AND)
          .put("=", ASSIGNMENT)
          .put("+=", ASSIGNMENT)
          .put("-=", ASSIGNMENT)
          .put("*=", ASSIGNMENT)
          .put("/=", ASSIGNMENT)
          .put("%=", ASSIGNMENT)
          .put("^=", ASSIGNMENT)
          .put("&=", ASSIGNMENT)
          .put("|=", ASSIGNMENT)
          .put("<<=", ASSIGNMENT)
          .put(">>=", ASSIGNMENT)
          .put("..", RANGE)
          .put("..=", RANGE)
          .put("<==>", EQUIVALENCE)
          .put("<==", EXPLICATION)
          .put("==>", IMPLICATION)
          .put("||", OR)
          .put("&&", AND)
          .put("==", COMPARISON)
          .put("!=", COMPARISON)
          .put("<", COMPARISON)
          .put(">", COMPARISON)
          .put("<=", COMPARISON)
          .put(">=", COMPARISON)
          .put("===", COMPARISON)
          .put("=~=", COMPARISON)
          .put("=~~=", COMPARISON)
          .put("|", BIT_OR)
          .put("^", BIT_XOR)
          .put("&", BIT_AND)
          .put("<<", SHIFT)
          .put(">>", SHIFT)
          .put("+", ADDITIVE)
          .put("-", ADDITIVE)
          .put("*", MULTIPLICATIVE)
          .put("/", MULTIPLICATIVE)
          .put("%", MULTIPLICATIVE)
          .buildOrThrow();

  private final Associativity associativity;

  OperatorPrecedence(Associativity associativity) {
    this.associativity = associativity;
  }

  Associativity getAssociativity() {
    return associativity;
  }

  /** Returns the level of a binary operator, or null if {@code operator} is not one. */
  static @Nullable OperatorPrecedence of(String operator) {
    return OPERATORS.get(operator);
  }

  static boolean isBinaryOperator(String operator) {
    return OPERATORS.containsKey(operator);
  }

  boolean isTighterThan(OperatorPrecedence other) {
    return ordinal() > other.ordinal();
  }
}
