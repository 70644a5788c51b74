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

import java.io.Serializable;
import java.text.MessageFormat;

/**
 * The type of a parse diagnostic: a stable key and a {@link MessageFormat} description.
 * Instances are declared as constants in {@link ParseErrors}.
 */
public final class DiagnosticType implements Comparable<DiagnosticType>, Serializable {
  private static final long serialVersionUID = 1;

  /** The error kind, in upper snake case. Stable across releases. */
  public final String key;

  /** The message template; arguments are substituted with {@link MessageFormat}. */
  public final String format;

  /** Whether the diagnostic comes from the lexer rather than the grammar. */
  public final boolean lexical;

  public static DiagnosticType lexical(String name, String descriptionFormat) {
    return new DiagnosticType(name, descriptionFormat, true);
  }

  public static DiagnosticType syntax(String name, String descriptionFormat) {
    return new DiagnosticType(name, descriptionFormat, false);
  }

  private DiagnosticType(String key, String format, boolean lexical) {
    this.key = checkNotNull(key);
    this.format = checkNotNull(format);
    this.lexical = lexical;
  }

  String format(Object... arguments) {
    return MessageFormat.format(format, arguments);
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType diagnosticType) {
    return key.compareTo(diagnosticType.key);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
