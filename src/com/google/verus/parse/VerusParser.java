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

import com.google.common.collect.ImmutableList;
import com.google.verus.syntax.Node;
import com.google.verus.syntax.SourceFile;
import com.google.verus.syntax.SourceText;
import com.google.verus.syntax.Tag;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Entry point of the Verus front end. Parses whole files into a {@link SourceFile} of ordinary
 * code and {@code verus!} blocks, and standalone expressions, types, patterns and item lists.
 *
 * <p>A parser holds only its options; each call is independent and a parser may be shared
 * between threads.
 */
public final class VerusParser {

  private static final Logger logger = Logger.getLogger(VerusParser.class.getName());

  /** Source name reported for standalone fragments. */
  public static final String FRAGMENT_NAME = "fragment";

  private final ParserOptions options;
  private final ImmutableList<TreePass> passes;

  public VerusParser() {
    this(new ParserOptions());
  }

  public VerusParser(ParserOptions options) {
    this.options = checkNotNull(options);
    this.passes = createPasses(options);
  }

  private static ImmutableList<TreePass> createPasses(ParserOptions options) {
    ImmutableList.Builder<TreePass> passes = ImmutableList.builder();
    if (options.isReassociateBinaryChains()) {
      passes.add(new PrecedencePass());
    }
    return passes.build();
  }

  /**
   * Partitions a file and parses every {@code verus!} block in it.
   *
   * @throws LexicalException if a block contains a malformed token
   * @throws SyntaxException if a block does not parse
   */
  public SourceFile parse(String sourceName, String text) {
    SourceText source = SourceText.of(sourceName, text);
    try {
      SourceFile file = new SourcePartitioner(options, passes).partition(source);
      logger.log(
          Level.FINE,
          "Parsed {0}: {1} verus! blocks, {2} spans",
          new Object[] {sourceName, file.getVerusBlocks().size(), file.getSpans().size()});
      return file;
    } catch (ParseException e) {
      logger.log(Level.FINE, "Failed to parse " + sourceName, e);
      throw e;
    }
  }

  /** Parses {@code text}, which must consist of exactly one expression. */
  public Node parseExpression(String text) {
    return parseFragment(text, "expression", ctx -> ctx.expressions.parseExpression());
  }

  /** Parses {@code text}, which must consist of exactly one type. */
  public Node parseType(String text) {
    return parseFragment(text, "type", ctx -> ctx.types.parseType());
  }

  /** Parses {@code text}, which must consist of exactly one pattern. */
  public Node parsePattern(String text) {
    return parseFragment(text, "pattern", ctx -> ctx.patterns.parsePattern());
  }

  /** Parses {@code text} as the contents of a module or {@code verus!} block. */
  public ImmutableList<Node> parseItems(String text) {
    return parseFragment(text, "item list", ctx -> ctx.items.parseItemList()).getNodes(Tag.ITEM);
  }

  private Node parseFragment(
      String text, String what, Function<ParseContext, @Nullable Node> rule) {
    SourceText source = SourceText.of(FRAGMENT_NAME, text);
    ParseContext ctx = new ParseContext(new Lexer(source), options, 0);
    try {
      Node node = rule.apply(ctx);
      if (node == null) {
        throw ctx.syntaxError();
      }
      int trailing = ctx.lexer.skipTrivia(ctx.pos);
      if (trailing < text.length()) {
        if (ctx.getFurthestPosition() > trailing) {
          throw ctx.syntaxError();
        }
        throw ctx.syntaxError(
            ParseErrors.TRAILING_INPUT,
            trailing,
            what,
            ParseContext.describe(ctx.lexer.lex(trailing)));
      }
      for (TreePass pass : passes) {
        node = pass.process(node);
      }
      return node;
    } catch (ParseException e) {
      logger.log(Level.FINE, "Failed to parse " + what, e);
      throw e;
    }
  }
}
