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

package com.google.verus.syntax;

/** The role a child plays in its parent node. */
public enum Tag {
  ALIAS,
  ARGUMENT,
  ARM,
  ATTRIBUTE,
  BASE,
  BODY,
  BOUND,
  BULLET,
  CALLEE,
  CLAUSE,
  CLAUSE_EXPR,
  CONDITION,
  CONSEQUENT,
  DATA_MODE,
  ELEMENT,
  ELSE,
  FIELD,
  FIELDS,
  GENERIC_ARGS,
  GENERIC_PARAMS,
  GUARD,
  INDEX,
  ITEM,
  ITERABLE,
  LABEL,
  LENGTH,
  LHS,
  MODE,
  NAME,
  OPERAND,
  OPERATOR,
  PARAMS,
  PATH,
  PATTERN,
  PREDICATE,
  PROVER,
  PUBLISH,
  QUALIFIER,
  RECEIVER,
  RETURN_TYPE,
  RHS,
  SCRUTINEE,
  SEGMENT,
  SELF_TYPE,
  STATEMENT,
  TAIL,
  THEN,
  TRAIT,
  TRIGGER,
  TYPE,
  USE_TREE,
  VALUE,
  VARIANT,
  VISIBILITY,
  WHERE,
}
