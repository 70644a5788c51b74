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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.verus.syntax.SourceText;
import com.google.verus.syntax.Token;
import com.google.verus.syntax.TokenKind;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LexerTest {

  private static ImmutableList<Token> lex(String text) {
    return Lexer.tokenize(SourceText.of("test.rs", text));
  }

  private static List<TokenKind> kinds(String text) {
    List<TokenKind> kinds = new ArrayList<>();
    for (Token token : lex(text)) {
      kinds.add(token.kind());
    }
    return kinds;
  }

  private static List<String> texts(String text) {
    List<String> texts = new ArrayList<>();
    for (Token token : lex(text)) {
      if (!token.isEof()) {
        texts.add(token.text());
      }
    }
    return texts;
  }

  private static Token single(String text) {
    ImmutableList<Token> tokens = lex(text);
    assertThat(tokens).hasSize(2);
    assertThat(tokens.get(1).isEof()).isTrue();
    return tokens.get(0);
  }

  private static LexicalException lexError(String text) {
    return assertThrows(LexicalException.class, () -> lex(text));
  }

  @Test
  public void testEmptyInput() {
    ImmutableList<Token> tokens = lex("");
    assertThat(tokens).hasSize(1);
    assertThat(tokens.get(0).isEof()).isTrue();
    assertThat(tokens.get(0).text()).isEmpty();
  }

  @Test
  public void testKeywordsAndContextualWords() {
    assertThat(kinds("fn requires open spec exec by"))
        .containsExactly(
            TokenKind.KEYWORD,
            TokenKind.KEYWORD,
            TokenKind.IDENTIFIER,
            TokenKind.KEYWORD,
            TokenKind.IDENTIFIER,
            TokenKind.IDENTIFIER,
            TokenKind.EOF)
        .inOrder();
    assertThat(single("true").kind()).isEqualTo(TokenKind.KEYWORD);
    assertThat(single("Self").kind()).isEqualTo(TokenKind.KEYWORD);
  }

  @Test
  public void testUnderscore() {
    assertThat(single("_").kind()).isEqualTo(TokenKind.PUNCTUATION);
    assertThat(single("_x").kind()).isEqualTo(TokenKind.IDENTIFIER);
    assertThat(single("__").kind()).isEqualTo(TokenKind.IDENTIFIER);
  }

  @Test
  public void testRawIdentifier() {
    Token token = single("r#type");
    assertThat(token.kind()).isEqualTo(TokenKind.IDENTIFIER);
    assertThat(token.text()).isEqualTo("r#type");
  }

  @Test
  public void testLongestPunctuation() {
    assertThat(texts("a <==> b ==> c <== d &&& e ||| f"))
        .containsExactly("a", "<==>", "b", "==>", "c", "<==", "d", "&&&", "e", "|||", "f")
        .inOrder();
    assertThat(texts("x..=y ..z a::b -> c => d >>= e"))
        .containsExactly(
            "x", "..=", "y", "..", "z", "a", "::", "b", "->", "c", "=>", "d", ">>=", "e")
        .inOrder();
  }

  @Test
  public void testIntegerLiterals() {
    assertThat(single("42").kind()).isEqualTo(TokenKind.INT_LITERAL);
    assertThat(single("1_000_000").kind()).isEqualTo(TokenKind.INT_LITERAL);
    assertThat(single("0xff_u8").kind()).isEqualTo(TokenKind.INT_LITERAL);
    assertThat(single("0b1010").kind()).isEqualTo(TokenKind.INT_LITERAL);
    assertThat(single("0o777usize").kind()).isEqualTo(TokenKind.INT_LITERAL);
    assertThat(single("7u64").text()).isEqualTo("7u64");
  }

  @Test
  public void testFloatLiterals() {
    assertThat(single("1.5").kind()).isEqualTo(TokenKind.FLOAT_LITERAL);
    assertThat(single("1e10").kind()).isEqualTo(TokenKind.FLOAT_LITERAL);
    assertThat(single("2.5E-3").kind()).isEqualTo(TokenKind.FLOAT_LITERAL);
    assertThat(single("3f32").kind()).isEqualTo(TokenKind.FLOAT_LITERAL);
    assertThat(single("1.").kind()).isEqualTo(TokenKind.FLOAT_LITERAL);
  }

  @Test
  public void testNumberBeforeRangeOrField() {
    assertThat(texts("1..2")).containsExactly("1", "..", "2").inOrder();
    assertThat(kinds("1..2").get(0)).isEqualTo(TokenKind.INT_LITERAL);
    assertThat(texts("1.max(2)")).containsExactly("1", ".", "max", "(", "2", ")").inOrder();
  }

  @Test
  public void testInvalidNumericSuffix() {
    LexicalException e = lexError("let x = 12abc;");
    assertThat(e.getType()).isEqualTo(ParseErrors.INVALID_NUMERIC_SUFFIX);
    assertThat(e.getOffset()).isEqualTo(10);
    assertThat(e.getError().description()).isEqualTo("Invalid suffix `abc` on integer literal.");

    e = lexError("1.5u8");
    assertThat(e.getError().description()).isEqualTo("Invalid suffix `u8` on float literal.");
  }

  @Test
  public void testCharactersAndLifetimes() {
    assertThat(single("'a'").kind()).isEqualTo(TokenKind.CHAR_LITERAL);
    assertThat(single("'\\n'").kind()).isEqualTo(TokenKind.CHAR_LITERAL);
    assertThat(single("'\\''").kind()).isEqualTo(TokenKind.CHAR_LITERAL);
    assertThat(single("'é'").kind()).isEqualTo(TokenKind.CHAR_LITERAL);
    assertThat(single("'a").kind()).isEqualTo(TokenKind.LIFETIME);
    assertThat(single("'static").kind()).isEqualTo(TokenKind.LIFETIME);
    assertThat(single("'_").kind()).isEqualTo(TokenKind.LIFETIME);
    assertThat(kinds("&'a T"))
        .containsExactly(
            TokenKind.PUNCTUATION, TokenKind.LIFETIME, TokenKind.IDENTIFIER, TokenKind.EOF)
        .inOrder();
  }

  @Test
  public void testStrings() {
    assertThat(single("\"a \\\" b\"").kind()).isEqualTo(TokenKind.STRING_LITERAL);
    assertThat(single("\"multi\nline\"").kind()).isEqualTo(TokenKind.STRING_LITERAL);
    assertThat(single("b'x'").kind()).isEqualTo(TokenKind.BYTE_LITERAL);
    assertThat(single("b\"bytes\"").kind()).isEqualTo(TokenKind.BYTE_STRING_LITERAL);
    assertThat(single("br#\"raw\"#").kind()).isEqualTo(TokenKind.RAW_BYTE_STRING_LITERAL);
  }

  @Test
  public void testRawStrings() {
    assertThat(single("r\"a\\b\"").kind()).isEqualTo(TokenKind.RAW_STRING_LITERAL);
    Token token = single("r#\"say \"hi\"\"#");
    assertThat(token.kind()).isEqualTo(TokenKind.RAW_STRING_LITERAL);
    assertThat(token.text()).isEqualTo("r#\"say \"hi\"\"#");
    // A quote followed by more hashes than the opener does not close the literal.
    token = single("r#\"a\"##b\"#");
    assertThat(token.text()).isEqualTo("r#\"a\"##b\"#");
    token = single("r##\"a\"#b\"##");
    assertThat(token.text()).isEqualTo("r##\"a\"#b\"##");
  }

  @Test
  public void testRawStringDelimiterMismatch() {
    LexicalException e = lexError("r##\"abc\"#");
    assertThat(e.getType()).isEqualTo(ParseErrors.RAW_STRING_DELIMITER);
    assertThat(e.getOffset()).isEqualTo(0);
  }

  @Test
  public void testComments() {
    assertThat(kinds("// line\n/// doc\n//// not doc\n//! inner\n"))
        .containsExactly(
            TokenKind.LINE_COMMENT,
            TokenKind.DOC_COMMENT,
            TokenKind.LINE_COMMENT,
            TokenKind.DOC_COMMENT,
            TokenKind.EOF)
        .inOrder();
    assertThat(kinds("/* a */ /** b */ /*! c */ /**/"))
        .containsExactly(
            TokenKind.BLOCK_COMMENT,
            TokenKind.DOC_COMMENT,
            TokenKind.DOC_COMMENT,
            TokenKind.BLOCK_COMMENT,
            TokenKind.EOF)
        .inOrder();
  }

  @Test
  public void testNestedBlockComment() {
    Token token = lex("/* a /* b */ c */ x").get(0);
    assertThat(token.kind()).isEqualTo(TokenKind.BLOCK_COMMENT);
    assertThat(token.text()).isEqualTo("/* a /* b */ c */");
  }

  @Test
  public void testUnterminatedBlockComment() {
    LexicalException e = lexError("x /* a /* b */");
    assertThat(e.getType()).isEqualTo(ParseErrors.UNTERMINATED_BLOCK_COMMENT);
    assertThat(e.getOffset()).isEqualTo(2);
  }

  @Test
  public void testUnterminatedString() {
    LexicalException e = lexError("let s = \"abc");
    assertThat(e.getType()).isEqualTo(ParseErrors.UNTERMINATED_STRING);
    assertThat(e.getOffset()).isEqualTo(8);
    assertThat(e.getError().lineno()).isEqualTo(1);
    assertThat(e.getError().charno()).isEqualTo(8);
  }

  @Test
  public void testUnexpectedCharacter() {
    LexicalException e = lexError("a `b`");
    assertThat(e.getType()).isEqualTo(ParseErrors.UNEXPECTED_CHARACTER);
    assertThat(e.getOffset()).isEqualTo(2);
    assertThat(e.getError().description()).isEqualTo("Unexpected character ```.");
  }

  @Test
  public void testPositions() {
    ImmutableList<Token> tokens = lex("  ab\n cd");
    assertThat(tokens.get(0).start()).isEqualTo(2);
    assertThat(tokens.get(0).end()).isEqualTo(4);
    assertThat(tokens.get(1).start()).isEqualTo(6);
    assertThat(tokens.get(2).start()).isEqualTo(8);
  }

  @Test
  public void testSplit() {
    Lexer lexer = new Lexer(SourceText.of("test.rs", "Vec<Vec<u8>>"));
    Token shift = lexer.lex(10);
    assertThat(shift.text()).isEqualTo(">>");
    Token first = lexer.split(10, '>');
    assertThat(first.text()).isEqualTo(">");
    assertThat(first.start()).isEqualTo(10);
    assertThat(first.end()).isEqualTo(11);
    assertThat(lexer.split(10, '<')).isNull();
    assertThat(lexer.split(0, 'V')).isNull();
  }

  @Test
  public void testTupleIndex() {
    Lexer lexer = new Lexer(SourceText.of("test.rs", "t.0.1"));
    // The whole "0.1" would lex as a float; a tuple index takes only the digits.
    assertThat(lexer.lex(2).kind()).isEqualTo(TokenKind.FLOAT_LITERAL);
    assertThat(lexer.lexTupleIndex(2).text()).isEqualTo("0");
    assertThat(lexer.lexTupleIndex(0)).isNull();
  }

  @Test
  public void testCommentsAt() {
    Lexer lexer = new Lexer(SourceText.of("test.rs", "a /* x */ // y\n b"));
    assertThat(lexer.commentsAt(1)).hasSize(2);
    assertThat(lexer.skipTrivia(1)).isEqualTo(16);
    assertThat(lexer.commentsAt(16)).isEmpty();
  }
}
