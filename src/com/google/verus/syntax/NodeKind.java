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

/** Kinds of syntax tree nodes. */
public enum NodeKind {
  // Containers
  VERUS_MACRO,
  ITEM_LIST,
  TOKEN_TREE,
  ATTRIBUTE,
  TRIGGER_ATTRIBUTE,
  VISIBILITY,

  // Items
  CONST,
  ENUM,
  VARIANT,
  EXTERN_BLOCK,
  EXTERN_CRATE,
  FN,
  PARAM_LIST,
  PARAM,
  SELF_PARAM,
  VARIADIC_PARAM,
  RET_TYPE,
  NAMED_RETURN,
  IMPL,
  MACRO_RULES,
  MACRO_CALL,
  MACRO_DEF,
  MODULE,
  STATIC,
  STRUCT,
  RECORD_FIELDS,
  RECORD_FIELD,
  TUPLE_FIELDS,
  TUPLE_FIELD,
  TRAIT,
  TRAIT_ALIAS,
  TYPE_ALIAS,
  UNION,
  USE,
  USE_TREE,

  // Verus annotations
  FN_MODE,
  PUBLISH,
  DATA_MODE,
  REQUIRES_CLAUSE,
  RECOMMENDS_CLAUSE,
  ENSURES_CLAUSE,
  DECREASES_CLAUSE,
  INVARIANT_CLAUSE,
  INVARIANT_EXCEPT_BREAK_CLAUSE,
  PROOF_BLOCK,
  ASSERT_EXPR,
  ASSERT_FORALL_EXPR,
  ASSUME_EXPR,
  QUANTIFIER_EXPR,

  // Statements
  BLOCK,
  EMPTY_STMT,
  LET_STMT,
  ASSIGN_STMT,
  EXPR_STMT,

  // Expressions
  LITERAL,
  PATH_EXPR,
  PAREN_EXPR,
  TUPLE_EXPR,
  ARRAY_EXPR,
  ARRAY_REPEAT_EXPR,
  UNSAFE_BLOCK_EXPR,
  CONST_BLOCK_EXPR,
  ASYNC_BLOCK_EXPR,
  LABELED_BLOCK_EXPR,
  IF_EXPR,
  LET_EXPR,
  WHILE_EXPR,
  FOR_EXPR,
  LOOP_EXPR,
  MATCH_EXPR,
  MATCH_ARM,
  CLOSURE_EXPR,
  CLOSURE_PARAM,
  RETURN_EXPR,
  BREAK_EXPR,
  CONTINUE_EXPR,
  RANGE_EXPR,
  STRUCT_EXPR,
  STRUCT_EXPR_FIELD,
  UNARY_EXPR,
  REF_EXPR,
  CAST_EXPR,
  IS_EXPR,
  HAS_EXPR,
  ATTRIBUTED_EXPR,
  TRY_EXPR,
  VIEW_EXPR,
  CALL_EXPR,
  ARG_LIST,
  INDEX_EXPR,
  FIELD_EXPR,
  METHOD_CALL_EXPR,
  AWAIT_EXPR,
  /** An operand/operator sequence that has not been reassociated by precedence. */
  BIN_CHAIN,
  BIN_EXPR,
  ASSIGN_EXPR,
  CHAINED_COMPARISON_EXPR,
  /** A {@code &&&} or {@code |||} chain written with a leading operator. */
  BULLET_EXPR,

  // Types and paths
  ARRAY_TYPE,
  DYN_TRAIT_TYPE,
  FN_PTR_TYPE,
  FN_PTR_PARAM,
  FN_TRAIT_TYPE,
  FOR_TYPE,
  IMPL_TRAIT_TYPE,
  INFER_TYPE,
  NEVER_TYPE,
  PAREN_TYPE,
  PATH_TYPE,
  PTR_TYPE,
  REF_TYPE,
  SLICE_TYPE,
  TUPLE_TYPE,
  TYPE_BOUND_LIST,
  TYPE_BOUND,
  GENERIC_ARGS,
  ASSOC_TYPE_BINDING,
  CONST_ARG,
  GENERIC_PARAMS,
  TYPE_PARAM,
  LIFETIME_PARAM,
  CONST_PARAM,
  WHERE_CLAUSE,
  WHERE_PREDICATE,
  PATH,
  PATH_SEGMENT,
  QUALIFIED_SELF,

  // Patterns
  LITERAL_PAT,
  WILDCARD_PAT,
  REST_PAT,
  BOX_PAT,
  REF_PAT,
  SLICE_PAT,
  TUPLE_PAT,
  PAREN_PAT,
  CONST_BLOCK_PAT,
  RECORD_PAT,
  RECORD_PAT_FIELD,
  TUPLE_STRUCT_PAT,
  IDENT_PAT,
  PATH_PAT,
  RANGE_PAT,
  OR_PAT;

  /** Whether an expression of this kind ends in a block and may stand as a statement alone. */
  public boolean isBlockLike() {
    switch (this) {
      case BLOCK:
      case UNSAFE_BLOCK_EXPR:
      case CONST_BLOCK_EXPR:
      case ASYNC_BLOCK_EXPR:
      case LABELED_BLOCK_EXPR:
      case IF_EXPR:
      case WHILE_EXPR:
      case FOR_EXPR:
      case LOOP_EXPR:
      case MATCH_EXPR:
      case PROOF_BLOCK:
        return true;
      default:
        return false;
    }
  }
}
