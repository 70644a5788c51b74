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
import com.google.common.collect.ImmutableSet;
import com.google.verus.syntax.Keywords;
import com.google.verus.syntax.SourceText;
import com.google.verus.syntax.Token;
import com.google.verus.syntax.TokenKind;
import org.jspecify.annotations.Nullable;

/**
 * Produces tokens on demand at arbitrary offsets of a source text. The grammars drive the lexer
 * directly: they skip trivia at the cursor, ask for the token at the resulting offset, and
 * decide from context whether a compound token must be split (see {@link #split}). Tokens are
 * cached per offset so that backtracking never lexes the same text twice.
 */
public final class Lexer {

  /** Punctuation, longest first so that the first prefix match is the longest one. */
  private static final ImmutableList<String> PUNCTUATION =
      ImmutableList.of(
          "<==>", "=~~=",
          "<<=", ">>=", "...", "..=", "==>", "<==", "===", "=~=", "&&&", "|||",
          "::", "->", "=>", "==", "!=", "<=", ">=", "&&", "||", "+=", "-=", "*=", "/=", "%=",
          "^=", "&=", "|=", "<<", ">>", "..",
          "+", "-", "*", "/", "%", "^", "!", "&", "|", "=", "<", ">", "@", ".", ",", ";", ":",
          "#", "$", "?", "~", "{", "}", "[", "]", "(", ")");

  private static final ImmutableSet<String> INTEGER_SUFFIXES =
      ImmutableSet.of(
          "u8", "u16", "u32", "u64", "u128", "usize", "i8", "i16", "i32", "i64", "i128", "isize",
          "int", "nat");

  private static final ImmutableSet<String> FLOAT_SUFFIXES = ImmutableSet.of("f32", "f64");

  private final SourceText source;
  private final String text;
  private final Token[] cache;

  public Lexer(SourceText source) {
    this.source = source;
    this.text = source.getText();
    this.cache = new Token[text.length() + 1];
  }

  public SourceText getSource() {
    return source;
  }

  /**
   * Lexes every token of {@code source}, comments included, up to and including the end-of-file
   * token.
   */
  public static ImmutableList<Token> tokenize(SourceText source) {
    Lexer lexer = new Lexer(source);
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int offset = 0;
    while (true) {
      offset = lexer.skipWhitespace(offset);
      Token token = lexer.lex(offset);
      tokens.add(token);
      if (token.isEof()) {
        return tokens.build();
      }
      offset = token.end();
    }
  }

  /** Returns the first offset at or after {@code offset} that does not hold whitespace. */
  public int skipWhitespace(int offset) {
    while (offset < text.length() && Character.isWhitespace(text.charAt(offset))) {
      offset++;
    }
    return offset;
  }

  /** Returns the offset of the first token at or after {@code offset} that is not a comment. */
  public int skipTrivia(int offset) {
    while (true) {
      offset = skipWhitespace(offset);
      if (!startsComment(offset)) {
        return offset;
      }
      offset = lex(offset).end();
    }
  }

  /** Returns the comment tokens between {@code from} and the next significant token. */
  public ImmutableList<Token> commentsAt(int from) {
    ImmutableList.Builder<Token> comments = ImmutableList.builder();
    int offset = skipWhitespace(from);
    while (startsComment(offset)) {
      Token comment = lex(offset);
      comments.add(comment);
      offset = skipWhitespace(comment.end());
    }
    return comments.build();
  }

  private boolean startsComment(int offset) {
    return offset + 1 < text.length()
        && text.charAt(offset) == '/'
        && (text.charAt(offset + 1) == '/' || text.charAt(offset + 1) == '*');
  }

  /** Returns the token that starts exactly at {@code offset}. */
  public Token lex(int offset) {
    Token token = cache[offset];
    if (token == null) {
      token = scan(offset);
      cache[offset] = token;
    }
    return token;
  }

  /**
   * Returns a one-character punctuation token for the first character of the punctuation token
   * at {@code offset}, or null if that token does not start with {@code c}. Used where the
   * grammar needs {@code >} out of {@code >>}, {@code &} out of {@code &&} and the like.
   */
  public @Nullable Token split(int offset, char c) {
    Token token = lex(offset);
    if (token.kind() != TokenKind.PUNCTUATION || token.text().charAt(0) != c) {
      return null;
    }
    if (token.getLength() == 1) {
      return token;
    }
    return new Token(TokenKind.PUNCTUATION, String.valueOf(c), offset, offset + 1);
  }

  /** Lexes the decimal digits of a tuple index such as the {@code 0} in {@code t.0}. */
  public @Nullable Token lexTupleIndex(int offset) {
    int end = offset;
    while (end < text.length() && isDecimalDigit(text.charAt(end))) {
      end++;
    }
    if (end == offset || (end < text.length() && isIdentifierPart(text.charAt(end)))) {
      return null;
    }
    return token(TokenKind.INT_LITERAL, offset, end);
  }

  private Token scan(int offset) {
    if (offset >= text.length()) {
      return new Token(TokenKind.EOF, "", text.length(), text.length());
    }
    char c = text.charAt(offset);
    if (c == '/' && offset + 1 < text.length()) {
      char next = text.charAt(offset + 1);
      if (next == '/') {
        return lineComment(offset);
      }
      if (next == '*') {
        return blockComment(offset);
      }
    }
    if (c == 'r' || c == 'b') {
      Token prefixed = prefixedLiteral(offset);
      if (prefixed != null) {
        return prefixed;
      }
    }
    if (c == '_' && !isIdentifierPart(charAt(offset + 1))) {
      return token(TokenKind.PUNCTUATION, offset, offset + 1);
    }
    if (isIdentifierStart(c)) {
      return identifier(offset);
    }
    if (isDecimalDigit(c)) {
      return number(offset);
    }
    if (c == '\'') {
      return charOrLifetime(offset);
    }
    if (c == '"') {
      return token(TokenKind.STRING_LITERAL, offset, quoted(offset, offset + 1, '"'));
    }
    for (String punctuation : PUNCTUATION) {
      if (text.startsWith(punctuation, offset)) {
        return token(TokenKind.PUNCTUATION, offset, offset + punctuation.length());
      }
    }
    throw error(
        ParseErrors.UNEXPECTED_CHARACTER,
        offset,
        new String(Character.toChars(text.codePointAt(offset))));
  }

  private Token lineComment(int offset) {
    int end = text.indexOf('\n', offset);
    if (end < 0) {
      end = text.length();
    }
    String comment = text.substring(offset, end);
    boolean doc =
        (comment.startsWith("///") && !comment.startsWith("////")) || comment.startsWith("//!");
    return new Token(doc ? TokenKind.DOC_COMMENT : TokenKind.LINE_COMMENT, comment, offset, end);
  }

  private Token blockComment(int offset) {
    int depth = 0;
    int i = offset;
    while (i + 1 < text.length()) {
      char c = text.charAt(i);
      char next = text.charAt(i + 1);
      if (c == '/' && next == '*') {
        depth++;
        i += 2;
      } else if (c == '*' && next == '/') {
        depth--;
        i += 2;
        if (depth == 0) {
          String comment = text.substring(offset, i);
          boolean doc =
              (comment.startsWith("/**") && !comment.startsWith("/***") && !comment.equals("/**/"))
                  || comment.startsWith("/*!");
          return new Token(
              doc ? TokenKind.DOC_COMMENT : TokenKind.BLOCK_COMMENT, comment, offset, i);
        }
      } else {
        i++;
      }
    }
    throw error(ParseErrors.UNTERMINATED_BLOCK_COMMENT, offset);
  }

  /** Raw identifiers, raw strings, byte literals and byte strings; null for a plain identifier. */
  private @Nullable Token prefixedLiteral(int offset) {
    boolean bytes = text.charAt(offset) == 'b';
    int i = offset + 1;
    if (bytes) {
      if (charAt(i) == '\'') {
        return token(TokenKind.BYTE_LITERAL, offset, charLiteralEnd(offset, i));
      }
      if (charAt(i) == '"') {
        return token(TokenKind.BYTE_STRING_LITERAL, offset, quoted(offset, i + 1, '"'));
      }
      if (charAt(i) != 'r') {
        return null;
      }
      i++;
    }
    if (charAt(i) != '"' && charAt(i) != '#') {
      return null;
    }
    int hashes = 0;
    while (charAt(i + hashes) == '#') {
      hashes++;
    }
    if (charAt(i + hashes) != '"') {
      if (!bytes && hashes == 1 && isIdentifierStart(charAt(i + 1))) {
        Token raw = identifier(i + 1);
        return token(TokenKind.IDENTIFIER, offset, raw.end());
      }
      throw error(ParseErrors.RAW_STRING_DELIMITER, offset, hashes);
    }
    int end = rawStringEnd(i + hashes + 1, hashes);
    if (end < 0) {
      throw error(ParseErrors.RAW_STRING_DELIMITER, offset, hashes);
    }
    return token(
        bytes ? TokenKind.RAW_BYTE_STRING_LITERAL : TokenKind.RAW_STRING_LITERAL, offset, end);
  }

  /**
   * Returns the offset just past the closing delimiter of a raw string whose content starts at
   * {@code from}, or -1. Only a quote followed by exactly {@code hashes} hash characters closes
   * the literal; a longer or shorter run is content.
   */
  private int rawStringEnd(int from, int hashes) {
    int i = from;
    while (i < text.length()) {
      int quote = text.indexOf('"', i);
      if (quote < 0) {
        return -1;
      }
      int run = 0;
      while (charAt(quote + 1 + run) == '#') {
        run++;
      }
      if (run == hashes) {
        return quote + 1 + hashes;
      }
      i = quote + 1;
    }
    return -1;
  }

  private Token identifier(int offset) {
    int end = offset + 1;
    while (end < text.length() && isIdentifierPart(text.charAt(end))) {
      end++;
    }
    String word = text.substring(offset, end);
    return new Token(
        Keywords.isReserved(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, word, offset, end);
  }

  private Token number(int offset) {
    int i = offset;
    boolean isFloat = false;
    if (text.charAt(i) == '0'
        && isRadixPrefix(charAt(i + 1))
        && isRadixDigit(charAt(i + 1), charAt(i + 2))) {
      char radix = charAt(i + 1);
      i += 2;
      while (isRadixDigit(radix, charAt(i))) {
        i++;
      }
    } else {
      i = decimalDigits(i);
      // A '.' begins a fraction unless it starts a range or a field or method access.
      if (charAt(i) == '.' && charAt(i + 1) != '.' && !isIdentifierStart(charAt(i + 1))) {
        isFloat = true;
        i++;
        if (isDecimalDigit(charAt(i))) {
          i = decimalDigits(i);
        }
      }
      if (charAt(i) == 'e' || charAt(i) == 'E') {
        int exponent = i + 1;
        if (charAt(exponent) == '+' || charAt(exponent) == '-') {
          exponent++;
        }
        int digits = exponent;
        while (charAt(digits) == '_') {
          digits++;
        }
        if (isDecimalDigit(charAt(digits))) {
          isFloat = true;
          i = decimalDigits(digits);
        }
      }
    }
    if (isIdentifierStart(charAt(i))) {
      int suffixStart = i;
      while (i < text.length() && isIdentifierPart(text.charAt(i))) {
        i++;
      }
      String suffix = text.substring(suffixStart, i);
      if (FLOAT_SUFFIXES.contains(suffix)) {
        isFloat = true;
      } else if (isFloat || !INTEGER_SUFFIXES.contains(suffix)) {
        throw error(
            ParseErrors.INVALID_NUMERIC_SUFFIX, suffixStart, suffix, isFloat ? "float" : "integer");
      }
    }
    return token(isFloat ? TokenKind.FLOAT_LITERAL : TokenKind.INT_LITERAL, offset, i);
  }

  private int decimalDigits(int i) {
    while (isDecimalDigit(charAt(i)) || charAt(i) == '_') {
      i++;
    }
    return i;
  }

  private Token charOrLifetime(int offset) {
    char first = charAt(offset + 1);
    if (first == '\\') {
      return token(TokenKind.CHAR_LITERAL, offset, charLiteralEnd(offset, offset));
    }
    int codePoint = offset + 1 < text.length() ? text.codePointAt(offset + 1) : -1;
    if (codePoint >= 0 && first != '\'' && first != '\n'
        && charAt(offset + 1 + Character.charCount(codePoint)) == '\'') {
      return token(TokenKind.CHAR_LITERAL, offset, offset + 2 + Character.charCount(codePoint));
    }
    if (isIdentifierStart(first)) {
      int end = offset + 2;
      while (end < text.length() && isIdentifierPart(text.charAt(end))) {
        end++;
      }
      return token(TokenKind.LIFETIME, offset, end);
    }
    throw error(ParseErrors.UNTERMINATED_CHAR, offset);
  }

  /** Scans a character literal whose opening quote is at {@code quote}. */
  private int charLiteralEnd(int tokenStart, int quote) {
    int i = quote + 1;
    if (charAt(i) == '\'') {
      throw error(ParseErrors.UNTERMINATED_CHAR, tokenStart);
    }
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == '\'') {
        return i + 1;
      } else if (c == '\n') {
        break;
      } else {
        i++;
      }
    }
    throw error(ParseErrors.UNTERMINATED_CHAR, tokenStart);
  }

  /** Scans an escaped string body starting at {@code from}; returns the offset past the quote. */
  private int quoted(int tokenStart, int from, char quote) {
    int i = from;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == quote) {
        return i + 1;
      } else {
        i++;
      }
    }
    throw error(ParseErrors.UNTERMINATED_STRING, tokenStart);
  }

  private Token token(TokenKind kind, int start, int end) {
    return new Token(kind, text.substring(start, end), start, end);
  }

  /** Returns the character at {@code i}, or 0 past the end of the text. */
  private char charAt(int i) {
    return i < text.length() ? text.charAt(i) : 0;
  }

  private LexicalException error(DiagnosticType type, int offset, Object... arguments) {
    return new LexicalException(
        VerusError.make(type, source, offset, ImmutableList.of(), arguments));
  }

  static boolean isIdentifierStart(char c) {
    return c == '_' || Character.isLetter(c);
  }

  static boolean isIdentifierPart(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }

  private static boolean isDecimalDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isRadixPrefix(char c) {
    return c == 'x' || c == 'o' || c == 'b';
  }

  private static boolean isRadixDigit(char radix, char c) {
    if (c == '_') {
      return true;
    }
    switch (radix) {
      case 'x':
        return isDecimalDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
      case 'o':
        return c >= '0' && c <= '7';
      case 'b':
        return c == '0' || c == '1';
      default:
        return false;
    }
  }
}
