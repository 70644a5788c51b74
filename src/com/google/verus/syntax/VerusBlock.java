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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A {@code verus! { ... }} invocation and its parsed contents. The region ends at the closing
 * brace, or after a trailing {@code // verus!} comment on the same line when one was absorbed.
 */
public record VerusBlock(
    String text,
    int start,
    int end,
    int byteStart,
    int byteEnd,
    Node macro,
    @Nullable Token trailingComment)
    implements Span {

  public VerusBlock {
    checkArgument(macro.isKind(NodeKind.VERUS_MACRO), "Not a verus! invocation: %s", macro);
  }

  public static VerusBlock of(SourceText source, Node macro, @Nullable Token trailingComment) {
    int start = macro.start();
    int end = trailingComment != null ? trailingComment.end() : macro.end();
    return new VerusBlock(
        source.substring(start, end),
        start,
        end,
        source.getByteOffset(start),
        source.getByteOffset(end),
        macro,
        trailingComment);
  }

  /** The items declared in the block, in order. */
  public ImmutableList<Node> getItems() {
    return macro.getNodes(Tag.ITEM);
  }
}
