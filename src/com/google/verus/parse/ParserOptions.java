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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/** Options that control parsing. */
public class ParserOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** The default limit on nested grammar rules. */
  public static final int DEFAULT_MAX_RECURSION_DEPTH = 256;

  /**
   * Maximum number of nested expression, type, pattern, statement and item rules. Deeper input
   * fails with {@link ParseErrors#RECURSION_LIMIT} instead of exhausting the call stack.
   */
  private int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;

  /** Whether results of the expression, type and pattern rules are cached per position. */
  private boolean memoize = true;

  /**
   * Whether flat operator chains are rebuilt into nested binary nodes according to operator
   * precedence. When false, the tree keeps {@code BIN_CHAIN} nodes exactly as the grammar
   * produced them.
   */
  private boolean reassociateBinaryChains = true;

  /** Whether a {@code // verus!} comment right after a block's closing brace belongs to it. */
  private boolean absorbTrailingVerusComment = true;

  public int getMaxRecursionDepth() {
    return maxRecursionDepth;
  }

  public void setMaxRecursionDepth(int maxRecursionDepth) {
    checkArgument(
        maxRecursionDepth > 0, "maxRecursionDepth must be positive: %s", maxRecursionDepth);
    this.maxRecursionDepth = maxRecursionDepth;
  }

  public boolean isMemoize() {
    return memoize;
  }

  public void setMemoize(boolean memoize) {
    this.memoize = memoize;
  }

  public boolean isReassociateBinaryChains() {
    return reassociateBinaryChains;
  }

  public void setReassociateBinaryChains(boolean reassociateBinaryChains) {
    this.reassociateBinaryChains = reassociateBinaryChains;
  }

  public boolean isAbsorbTrailingVerusComment() {
    return absorbTrailingVerusComment;
  }

  public void setAbsorbTrailingVerusComment(boolean absorbTrailingVerusComment) {
    this.absorbTrailingVerusComment = absorbTrailingVerusComment;
  }
}
