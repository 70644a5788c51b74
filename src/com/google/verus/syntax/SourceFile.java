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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;

/**
 * A partitioned source file: ordinary code and {@code verus!} blocks, in order and covering the
 * whole text without gaps.
 */
public final class SourceFile {

  private final SourceText source;
  private final ImmutableList<Span> spans;

  private SourceFile(SourceText source, ImmutableList<Span> spans) {
    this.source = source;
    this.spans = spans;
  }

  public String getName() {
    return source.getName();
  }

  public SourceText getSource() {
    return source;
  }

  public ImmutableList<Span> getSpans() {
    return spans;
  }

  /** Reassembles the file text from the spans. */
  public String toSource() {
    StringBuilder sb = new StringBuilder(source.length());
    for (Span span : spans) {
      sb.append(span.text());
    }
    return sb.toString();
  }

  public ImmutableList<VerusBlock> getVerusBlocks() {
    ImmutableList.Builder<VerusBlock> blocks = ImmutableList.builder();
    for (Span span : spans) {
      if (span instanceof VerusBlock) {
        blocks.add((VerusBlock) span);
      }
    }
    return blocks.build();
  }

  public ImmutableList<OrdinaryCode> getOrdinaryCode() {
    ImmutableList.Builder<OrdinaryCode> code = ImmutableList.builder();
    for (Span span : spans) {
      if (span instanceof OrdinaryCode) {
        code.add((OrdinaryCode) span);
      }
    }
    return code.build();
  }

  /** Returns the source text covered by a node or token of this file. */
  public String getText(SyntaxElement element) {
    return source.substring(element.start(), element.end());
  }

  /** Dumps every span, with the full tree of each verus block. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    for (Span span : spans) {
      if (span instanceof VerusBlock) {
        VerusBlock block = (VerusBlock) span;
        sb.append("VERUS_BLOCK [").append(block.start()).append(',').append(block.end());
        sb.append(")\n").append(block.macro().toStringTree());
        if (block.trailingComment() != null) {
          sb.append(block.trailingComment().kind())
              .append(" '")
              .append(block.trailingComment().text())
              .append("'\n");
        }
      } else {
        sb.append("ORDINARY_CODE [").append(span.start()).append(',').append(span.end());
        sb.append(")\n");
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "SourceFile " + source.getName() + " " + spans.size() + " spans";
  }

  public static Builder builder(SourceText source) {
    return new Builder(source);
  }

  /** Collects spans in order; gaps between them become ordinary code. */
  public static final class Builder {
    private final SourceText source;
    private final List<Span> spans = new ArrayList<>();
    private int end;

    private Builder(SourceText source) {
      this.source = source;
    }

    @CanIgnoreReturnValue
    public Builder addVerusBlock(VerusBlock block) {
      checkArgument(block.start() >= end, "Block at %s overlaps the previous span", block.start());
      addOrdinaryCode(block.start());
      spans.add(block);
      end = block.end();
      return this;
    }

    public SourceFile build() {
      addOrdinaryCode(source.length());
      return new SourceFile(source, ImmutableList.copyOf(spans));
    }

    private void addOrdinaryCode(int until) {
      if (until > end) {
        spans.add(OrdinaryCode.of(source, end, until));
        end = until;
      }
    }
  }
}
