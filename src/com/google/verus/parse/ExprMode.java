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

/** Whether an expression may be a struct literal at its top level. */
enum ExprMode {
  NORMAL,
  /**
   * The expression is followed by a block, as in an {@code if} condition: an opening brace after
   * a path opens that block, not a struct literal, and the expression may not start with a block.
   */
  NO_STRUCT;

  boolean allowsStruct() {
    return this == NORMAL;
  }
}
