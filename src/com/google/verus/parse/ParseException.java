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

/** Thrown when a parse fails. Parsing does not recover: the first error aborts the input. */
public abstract class ParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final VerusError error;

  protected ParseException(VerusError error) {
    super(error.toString());
    this.error = checkNotNull(error);
  }

  public VerusError getError() {
    return error;
  }

  public DiagnosticType getType() {
    return error.type();
  }

  /** The character offset of the error in the source text. */
  public int getOffset() {
    return error.offset();
  }
}
