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

import com.google.verus.syntax.Node;
import com.google.verus.syntax.NodeKind;
import com.google.verus.syntax.Tag;
import com.google.verus.syntax.Token;
import com.google.verus.syntax.TokenKind;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Base class of the grammars. Rules are methods that either return a node and leave the cursor
 * after it, or return null and leave the cursor where the rule started. Each rule collects its
 * children in its own {@link Node.Builder}, so a failed alternative has nothing to undo beyond
 * the cursor.
 *
 * <p>Comments between tokens are attached to the builder that consumes the next token.
 */
abstract class AbstractGrammar {

  protected final ParseContext ctx;

  AbstractGrammar(ParseContext ctx) {
    this.ctx = ctx;
  }

  ItemGrammar items() {
    return ctx.items;
  }

  ExpressionGrammar expressions() {
    return ctx.expressions;
  }

  TypeGrammar types() {
    return ctx.types;
  }

  PatternGrammar patterns() {
    return ctx.patterns;
  }

  ClauseGrammar clauses() {
    return ctx.clauses;
  }

  protected final int pos() {
    return ctx.pos;
  }

  protected final Node.Builder node(NodeKind kind) {
    return Node.builder(kind, ctx.pos);
  }

  /**
   * Starts a node that carries children parsed before its kind was known, such as the
   * attributes and visibility in front of an item.
   */
  protected static Node.Builder prefixed(NodeKind kind, Node prefix) {
    Node.Builder b = Node.builder(kind, prefix.start());
    for (int i = 0; i < prefix.getChildCount(); i++) {
      b.add(prefix.getTag(i), prefix.getChild(i));
    }
    return b;
  }

  /** Resets the cursor to {@code start} and reports failure. */
  protected final @Nullable Node fail(int start) {
    ctx.pos = start;
    return null;
  }

  /** Undoes an optional sequence: resets the cursor and drops children added after {@code size}. */
  protected final void restore(Node.Builder b, int mark, int size) {
    ctx.pos = mark;
    b.truncate(size);
  }

  protected final Token peek() {
    return ctx.peek();
  }

  /** Whether the next token is the given punctuation or keyword. */
  protected final boolean at(String text) {
    return matches(peek(), text);
  }

  protected final boolean atWord(String word) {
    return peek().isWord(word);
  }

  private static boolean matches(Token token, String text) {
    return (token.kind() == TokenKind.PUNCTUATION || token.kind() == TokenKind.KEYWORD)
        && token.text().equals(text);
  }

  private void consume(Node.Builder b, @Nullable Tag tag, Token token) {
    if (ctx.lexer.skipWhitespace(ctx.pos) < token.start()) {
      b.addAll(ctx.lexer.commentsAt(ctx.pos));
    }
    b.add(tag, token);
    ctx.pos = token.end();
  }

  protected final boolean eat(Node.Builder b, String text) {
    return eat(b, null, text);
  }

  /** Consumes the given punctuation or keyword. */
  protected final boolean eat(Node.Builder b, @Nullable Tag tag, String text) {
    Token token = peek();
    if (matches(token, text)) {
      consume(b, tag, token);
      return true;
    }
    ctx.expected(token.start(), "`" + text + "`");
    return false;
  }

  /** Consumes a contextual keyword, which lexes as an identifier. */
  protected final boolean eatWord(Node.Builder b, String word) {
    Token token = peek();
    if (token.isWord(word)) {
      consume(b, null, token);
      return true;
    }
    ctx.expected(token.start(), "`" + word + "`");
    return false;
  }

  /** Consumes an identifier; a reserved word in its place is reported as such. */
  protected final @Nullable Token eatIdentifier(Node.Builder b, @Nullable Tag tag) {
    Token token = peek();
    if (token.kind() == TokenKind.IDENTIFIER) {
      consume(b, tag, token);
      return token;
    }
    if (token.kind() == TokenKind.KEYWORD) {
      ctx.noteFailure(token.start(), ParseErrors.RESERVED_KEYWORD, "an identifier");
    } else {
      ctx.expected(token.start(), "identifier");
    }
    return null;
  }

  protected final @Nullable Token eatKind(
      Node.Builder b, @Nullable Tag tag, TokenKind kind, String description) {
    Token token = peek();
    if (token.kind() == kind) {
      consume(b, tag, token);
      return token;
    }
    ctx.expected(token.start(), description);
    return null;
  }

  /** Consumes a literal token, including {@code true} and {@code false}. */
  protected final @Nullable Token eatLiteral(Node.Builder b, @Nullable Tag tag) {
    Token token = peek();
    if (token.kind().isLiteral() || token.isKeyword("true") || token.isKeyword("false")) {
      consume(b, tag, token);
      return token;
    }
    ctx.expected(token.start(), "literal");
    return null;
  }

  /** Consumes whatever token comes next; fails only at end of input. */
  protected final @Nullable Token eatAny(Node.Builder b) {
    Token token = peek();
    if (token.isEof()) {
      ctx.expected(token.start(), "token");
      return null;
    }
    consume(b, null, token);
    return token;
  }

  /**
   * Consumes the single character {@code c} at the start of the next punctuation token, splitting
   * compound tokens such as {@code >>} or {@code &&}.
   */
  protected final boolean eatSplit(Node.Builder b, @Nullable Tag tag, char c) {
    int at = ctx.lexer.skipTrivia(ctx.pos);
    Token token = ctx.lexer.split(at, c);
    if (token == null) {
      ctx.expected(at, "`" + c + "`");
      return false;
    }
    consume(b, tag, token);
    return true;
  }

  /** Consumes the digits of a tuple index after a {@code .}. */
  protected final @Nullable Token eatTupleIndex(Node.Builder b, @Nullable Tag tag) {
    int at = ctx.lexer.skipTrivia(ctx.pos);
    Token token = ctx.lexer.lexTupleIndex(at);
    if (token == null) {
      ctx.expected(at, "tuple index");
      return null;
    }
    consume(b, tag, token);
    return token;
  }

  /**
   * Parses {@code element} repeatedly, separated by commas and allowing a trailing comma, up to
   * and including {@code close}.
   */
  protected final boolean delimited(
      Node.Builder b, String close, @Nullable Tag tag, Supplier<@Nullable Node> element) {
    while (true) {
      if (eat(b, close)) {
        return true;
      }
      Node child = element.get();
      if (child == null) {
        return false;
      }
      b.add(tag, child);
      if (!eat(b, ",")) {
        return eat(b, close);
      }
    }
  }

  /** Runs {@code body} as the named rule: tracked on the rule stack and the depth limit. */
  protected final @Nullable Node rule(String name, Supplier<@Nullable Node> body) {
    ctx.enter(name);
    try {
      return body.get();
    } finally {
      ctx.exit();
    }
  }

  /** Runs {@code body} once per position and flag, replaying the result on later calls. */
  protected final @Nullable Node memoized(int slot, boolean flag, Supplier<@Nullable Node> body) {
    if (!ctx.options.isMemoize()) {
      return body.get();
    }
    int start = ctx.pos;
    ParseContext.MemoEntry entry = ctx.lookup(slot, flag, start);
    if (entry != null) {
      ctx.pos = entry.end();
      return entry.node();
    }
    Node result = body.get();
    ctx.remember(slot, flag, start, result, ctx.pos);
    return result;
  }
}
