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
import com.google.verus.syntax.Node;
import com.google.verus.syntax.SourceFile;
import com.google.verus.syntax.SourceText;
import com.google.verus.syntax.Token;
import com.google.verus.syntax.TokenKind;
import com.google.verus.syntax.VerusBlock;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Splits a file into ordinary code and {@code verus!} blocks.
 *
 * <p>Blocks are found by a plain text search for {@code verus!} followed by optional whitespace
 * and an opening brace. The search does not know about strings or comments, so the marker inside
 * a string literal or a comment of ordinary code starts a block too. Each block is parsed to its
 * balancing closing brace by the item grammar; everything else is kept verbatim.
 */
final class SourcePartitioner {

  private static final Logger logger = Logger.getLogger(SourcePartitioner.class.getName());

  static final String MARKER = "verus!";

  private final ParserOptions options;
  private final ImmutableList<TreePass> passes;

  SourcePartitioner(ParserOptions options, ImmutableList<TreePass> passes) {
    this.options = options;
    this.passes = passes;
  }

  /**
   * Partitions {@code source}.
   *
   * @throws LexicalException if a block contains a malformed token
   * @throws SyntaxException if a block does not parse or is not closed
   */
  SourceFile partition(SourceText source) {
    String text = source.getText();
    Lexer lexer = new Lexer(source);
    SourceFile.Builder file = SourceFile.builder(source);
    int from = 0;
    while (true) {
      int start = findBlock(text, from);
      if (start < 0) {
        return file.build();
      }
      VerusBlock block = parseBlock(lexer, start);
      logger.log(
          Level.FINER,
          "Found verus! block at {0}:{1}",
          new Object[] {source.getName(), source.getLineno(start)});
      file.addVerusBlock(block);
      from = block.end();
    }
  }

  /** Returns the offset of the next block marker at or after {@code from}, or -1. */
  private static int findBlock(String text, int from) {
    int start = text.indexOf(MARKER, from);
    while (start >= 0) {
      int brace = start + MARKER.length();
      while (brace < text.length() && Character.isWhitespace(text.charAt(brace))) {
        brace++;
      }
      if (brace < text.length() && text.charAt(brace) == '{') {
        return start;
      }
      start = text.indexOf(MARKER, start + MARKER.length());
    }
    return -1;
  }

  private VerusBlock parseBlock(Lexer lexer, int start) {
    ParseContext ctx = new ParseContext(lexer, options, start);
    Node macro = ctx.items.parseVerusMacro();
    if (macro == null) {
      if (ctx.getFurthestPosition() >= lexer.getSource().length()) {
        throw ctx.syntaxError(ParseErrors.UNTERMINATED_VERUS_BLOCK, start);
      }
      throw ctx.syntaxError();
    }
    for (TreePass pass : passes) {
      macro = pass.process(macro);
    }
    return VerusBlock.of(lexer.getSource(), macro, trailingComment(lexer, macro.end()));
  }

  /** Returns a {@code // verus!} comment on the same line after {@code end}, if there is one. */
  private @Nullable Token trailingComment(Lexer lexer, int end) {
    if (!options.isAbsorbTrailingVerusComment()) {
      return null;
    }
    String text = lexer.getSource().getText();
    int offset = end;
    while (offset < text.length() && (text.charAt(offset) == ' ' || text.charAt(offset) == '\t')) {
      offset++;
    }
    if (!text.startsWith("//", offset)) {
      return null;
    }
    Token comment = lexer.lex(offset);
    if (comment.kind() != TokenKind.LINE_COMMENT
        || !comment.text().substring(2).trim().equals(MARKER)) {
      return null;
    }
    return comment;
  }
}
