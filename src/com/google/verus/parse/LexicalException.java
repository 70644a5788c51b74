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

import com.google.common.collect.ImmutableList;

/** A malformed token: an unterminated literal or comment, a bad suffix or a stray character. */
public final class LexicalException extends ParseException {
  private static final long serialVersionUID = 1L;

  public LexicalException(VerusError error) {
    super(error);
  }

  LexicalException withRuleStack(ImmutableList<String> rules) {
    return new LexicalException(getError().withRuleStack(rules));
  }
}
