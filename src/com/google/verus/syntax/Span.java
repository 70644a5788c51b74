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

/**
 * A region of a source file: either ordinary code, kept verbatim, or a parsed {@code verus!}
 * block. Character offsets index the file text; byte offsets index its UTF-8 encoding.
 */
public interface Span {

  /** The verbatim text of the region. */
  String text();

  int start();

  int end();

  int byteStart();

  int byteEnd();
}
