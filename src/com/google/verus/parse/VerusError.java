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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.verus.syntax.SourceText;

/**
 * A lexical or syntax error: its type, formatted description and position, and the stack of
 * grammar rules that were active when it was detected (outermost first).
 */
public record VerusError(
    DiagnosticType type,
    String description,
    String sourceName,
    int offset,
    int byteOffset,
    int lineno,
    int charno,
    ImmutableList<String> ruleStack) {

  /** The innermost rules printed by {@link #toString}; the full stack stays in the record. */
  static final int MAX_RULES_SHOWN = 8;

  public VerusError {
    checkNotNull(type);
    checkNotNull(description);
    checkNotNull(sourceName);
    checkNotNull(ruleStack);
  }

  /** Creates an error at {@code offset} in {@code source}, formatting the type's description. */
  public static VerusError make(
      DiagnosticType type,
      SourceText source,
      int offset,
      ImmutableList<String> ruleStack,
      Object... arguments) {
    return new VerusError(
        type,
        type.format(arguments),
        source.getName(),
        offset,
        source.getByteOffset(offset),
        source.getLineno(offset),
        source.getCharno(offset),
        ruleStack);
  }

  /** Returns a copy of this error reported under a different rule stack. */
  VerusError withRuleStack(ImmutableList<String> rules) {
    return new VerusError(
        type, description, sourceName, offset, byteOffset, lineno, charno, rules);
  }

  @Override
  public String toString() {
    StringBuilder sb =
        new StringBuilder()
            .append(type.key)
            .append(". ")
            .append(description)
            .append(" at ")
            .append(sourceName.isEmpty() ? "(unknown source)" : sourceName)
            .append(" line ")
            .append(lineno)
            .append(" : ")
            .append(charno);
    if (!ruleStack.isEmpty()) {
      sb.append(" [in ");
      ImmutableList<String> shown = ruleStack;
      if (ruleStack.size() > MAX_RULES_SHOWN) {
        shown = ruleStack.subList(ruleStack.size() - MAX_RULES_SHOWN, ruleStack.size());
        sb.append("... > ");
      }
      sb.append(Joiner.on(" > ").join(shown)).append(']');
    }
    return sb.toString();
  }
}
