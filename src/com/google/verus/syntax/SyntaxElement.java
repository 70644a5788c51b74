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

/** A token or a node: anything that covers a range of the source text. */
public interface SyntaxElement {

  /** Offset of the first character covered. */
  int start();

  /** Offset just past the last character covered. */
  int end();

  default int getLength() {
    return end() - start();
  }

  default boolean isNode() {
    return this instanceof Node;
  }
}
