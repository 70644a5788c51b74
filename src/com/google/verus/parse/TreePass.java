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

import com.google.verus.syntax.Node;

/**
 * A rewrite applied to a parsed tree. Trees are immutable, so a pass returns the rewritten root,
 * or the same root if nothing changed.
 */
interface TreePass {

  /**
   * Processes the tree under {@code root}.
   *
   * @param root top of a parsed tree
   * @return the rewritten tree
   */
  Node process(Node root);
}
