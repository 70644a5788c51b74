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

/** Diagnostic types reported by the lexer and the grammars. */
public final class ParseErrors {

  // Lexical errors.

  public static final DiagnosticType UNTERMINATED_STRING =
      DiagnosticType.lexical("UNTERMINATED_STRING", "Unterminated string literal.");

  public static final DiagnosticType UNTERMINATED_CHAR =
      DiagnosticType.lexical("UNTERMINATED_CHAR", "Unterminated or empty character literal.");

  public static final DiagnosticType UNTERMINATED_BLOCK_COMMENT =
      DiagnosticType.lexical("UNTERMINATED_BLOCK_COMMENT", "Unterminated block comment.");

  public static final DiagnosticType RAW_STRING_DELIMITER =
      DiagnosticType.lexical(
          "RAW_STRING_DELIMITER",
          "Raw string is not closed by a quote followed by exactly {0} hash characters.");

  public static final DiagnosticType INVALID_NUMERIC_SUFFIX =
      DiagnosticType.lexical("INVALID_NUMERIC_SUFFIX", "Invalid suffix `{0}` on {1} literal.");

  public static final DiagnosticType UNEXPECTED_CHARACTER =
      DiagnosticType.lexical("UNEXPECTED_CHARACTER", "Unexpected character `{0}`.");

  // Syntax errors.

  public static final DiagnosticType EXPECTED_TOKEN =
      DiagnosticType.syntax("EXPECTED_TOKEN", "Expected {0}, found {1}.");

  public static final DiagnosticType UNBALANCED_DELIMITER =
      DiagnosticType.syntax(
          "UNBALANCED_DELIMITER", "Unbalanced delimiter: expected {0}, found {1}.");

  public static final DiagnosticType RESERVED_KEYWORD =
      DiagnosticType.syntax(
          "RESERVED_KEYWORD", "Reserved keyword `{1}` used where {0} is required.");

  public static final DiagnosticType UNTERMINATED_VERUS_BLOCK =
      DiagnosticType.syntax(
          "UNTERMINATED_VERUS_BLOCK", "verus! block is not closed before the end of input.");

  public static final DiagnosticType TRAILING_INPUT =
      DiagnosticType.syntax("TRAILING_INPUT", "Unexpected input after the end of the {0}: {1}.");

  public static final DiagnosticType RECURSION_LIMIT =
      DiagnosticType.syntax("RECURSION_LIMIT", "Input is nested more than {0} levels deep.");

  private ParseErrors() {}
}
