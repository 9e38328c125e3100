/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.mdsl.parse;

import net.hydromatic.mdsl.ast.Pos;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static net.hydromatic.mdsl.Matchers.describedAs;
import static net.hydromatic.mdsl.Matchers.throwsA;
import static net.hydromatic.mdsl.Mdsl.assertError;
import static net.hydromatic.mdsl.Mdsl.readResource;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;

/** Tests the lexer. */
public class LexerTest {
  /** Returns the kinds of the tokens of a source string, including the
   * trailing EOF. */
  private static List<TokenKind> kinds(String source) {
    final List<TokenKind> kinds = new ArrayList<>();
    for (Token token : Lexer.tokenize(source)) {
      kinds.add(token.kind);
    }
    return kinds;
  }

  @Test void testEmpty() {
    final List<Token> tokens = Lexer.tokenize("");
    assertThat(tokens, hasSize(1));
    assertThat(tokens.get(0).kind, is(TokenKind.EOF));
    assertThat(tokens.get(0).pos.lineCol(), is("1:1"));
  }

  @Test void testUnitHeader() {
    final List<Token> tokens = Lexer.tokenize("UNIT MediaOutlet {");
    assertThat(tokens, hasSize(4));
    assertThat(tokens.get(0).is(Keyword.UNIT), is(true));
    assertThat(tokens.get(1).kind, is(TokenKind.IDENTIFIER));
    assertThat(tokens.get(1).stringValue(), is("MediaOutlet"));
    assertThat(tokens.get(1).pos.lineCol(), is("1:6"));
    assertThat(tokens.get(2).kind, is(TokenKind.LEFT_BRACE));
    assertThat(tokens.get(3).kind, is(TokenKind.EOF));
  }

  @Test void testKeywordsIgnoreCase() {
    for (String s : new String[] {"family", "Family", "FAMILY", "fAmIlY"}) {
      final Token token = Lexer.tokenize(s).get(0);
      assertThat(s, token.is(Keyword.FAMILY), is(true));
      assertThat(token.text, is(s));
    }
    assertThat(Lexer.tokenize("group").get(0).is(Keyword.GROUP), is(true));
    assertThat(Lexer.tokenize("familyName").get(0).kind,
        is(TokenKind.IDENTIFIER));
  }

  @Test void testSpecialValues() {
    assertThat(Lexer.tokenize("n.v.").get(0).is(Keyword.NOT_AVAILABLE),
        is(true));
    assertThat(Lexer.tokenize("N.A.").get(0).is(Keyword.NOT_APPLICABLE),
        is(true));
    // an identifier may contain dots
    final Token token = Lexer.tokenize("derStandard.at").get(0);
    assertThat(token.kind, is(TokenKind.IDENTIFIER));
    assertThat(token.stringValue(), is("derStandard.at"));
  }

  @Test void testBooleans() {
    final List<Token> tokens = Lexer.tokenize("true FALSE");
    assertThat(tokens.get(0).kind, is(TokenKind.BOOLEAN));
    assertThat(tokens.get(0).value, is(Boolean.TRUE));
    assertThat(tokens.get(1).kind, is(TokenKind.BOOLEAN));
    assertThat(tokens.get(1).value, is(Boolean.FALSE));
  }

  @Test void testNumbers() {
    final List<Token> tokens = Lexer.tokenize("42 3.25 7.x");
    assertThat(tokens.get(0).doubleValue(), is(42d));
    assertThat(tokens.get(1).doubleValue(), is(3.25d));
    assertThat(tokens.get(1).text, is("3.25"));
    // a dot not followed by a digit is not part of the number
    assertThat(tokens.get(2).doubleValue(), is(7d));
    assertThat(tokens.get(3).kind, is(TokenKind.DOT));
    assertThat(tokens.get(4).stringValue(), is("x"));
  }

  @Test void testStrings() {
    final Token token =
        Lexer.tokenize("\"a \\\"quoted\\\" word\\n\\ttab\\\\\"").get(0);
    assertThat(token.kind, is(TokenKind.STRING));
    assertThat(token.stringValue(), is("a \"quoted\" word\n\ttab\\"));
    assertThat(token.text, is("\"a \\\"quoted\\\" word\\n\\ttab\\\\\""));
  }

  @Test void testPunctuation() {
    assertThat(kinds("= ; : , . $ { } ( ) [ ] < >").toString(),
        is("[ASSIGN, SEMICOLON, COLON, COMMA, DOT, DOLLAR, LEFT_BRACE, "
            + "RIGHT_BRACE, LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, "
            + "RIGHT_BRACKET, LEFT_ANGLE, RIGHT_ANGLE, EOF]"));
  }

  @Test void testComments() {
    final List<Token> tokens =
        Lexer.tokenize("// line one\n# line two\n/* multi\nline */ x");
    assertThat(tokens.get(0).kind, is(TokenKind.COMMENT));
    assertThat(tokens.get(0).stringValue(), is("line one"));
    assertThat(tokens.get(1).kind, is(TokenKind.NEWLINE));
    assertThat(tokens.get(2).kind, is(TokenKind.COMMENT));
    assertThat(tokens.get(2).stringValue(), is("line two"));
    assertThat(tokens.get(3).kind, is(TokenKind.NEWLINE));
    assertThat(tokens.get(4).kind, is(TokenKind.MULTI_LINE_COMMENT));
    assertThat(tokens.get(4).stringValue(), is(" multi\nline "));
    assertThat(tokens.get(4).isComment(), is(true));
    assertThat(tokens.get(5).stringValue(), is("x"));
    assertThat(tokens.get(5).pos.lineCol(), is("4:9"));
  }

  @Test void testAnnotation() {
    final Token token = Lexer.tokenize("@deprecated").get(0);
    assertThat(token.kind, is(TokenKind.ANNOTATION));
    assertThat(token.stringValue(), is("deprecated"));
  }

  @Test void testPositions() {
    final List<Token> tokens = Lexer.tokenize("LET x = \"ä\"\n  y");
    assertThat(tokens.get(3).pos.lineCol(), is("1:9"));
    assertThat(tokens.get(3).pos.offset, is(8));
    assertThat(tokens.get(4).kind, is(TokenKind.NEWLINE));
    final Pos pos = tokens.get(5).pos;
    assertThat(pos.lineCol(), is("2:3"));
    // offsets count UTF-8 bytes; "ä" is 2 bytes
    assertThat(pos.offset, is(15));
  }

  /** Joining the texts of the tokens, one per line, and lexing the result
   * gives the same kinds of token. */
  @Test void testTokenTextsLexTheSame() {
    final String snippet = "/* multi\n line */ UNIT U { # hash\n"
        + "  @doc \"x\" id: ID PRIMARY KEY, n: TEXT(12) }\n"
        + "LET s = \"tab\\t \\\"quoted\\\"\"; LET n = 4.5;\n";
    for (String source : new String[] {snippet, readResource("media.mdsl")}) {
      final List<Token> tokens = Lexer.tokenize(source);
      final StringBuilder b = new StringBuilder();
      for (Token token : tokens) {
        b.append(token.text).append('\n');
      }
      assertThat(kinds(b.toString()), is(kinds(source)));
      assertThat(tokens.size(), greaterThan(10));
    }
  }

  @Test void testFileName() {
    final Token token = new Lexer("media.mdsl", "x").tokenize().get(0);
    assertThat(token.pos.toString(), is("media.mdsl:1:1"));
  }

  @Test void testUnexpectedCharacter() {
    assertError(() -> Lexer.tokenize("LET x = 1 ~"),
        throwsA("Unexpected character '~' at 1:11"));
    assertError(() -> Lexer.tokenize("a / b"),
        throwsA("Unexpected character '/' at 1:3"));
    assertError(() -> Lexer.tokenize("x\n  %"),
        describedAs("Lexer error: Unexpected character '%' at 2:3"));
  }

  @Test void testUnterminatedString() {
    assertError(() -> Lexer.tokenize("LET x = \"abc"),
        throwsA("Unterminated string literal at 1:9"));
    assertError(() -> Lexer.tokenize("\"abc\ndef\""),
        throwsA("Unterminated string literal at 1:1"));
    assertError(() -> Lexer.tokenize("x /* never closed"),
        throwsA("Unterminated string literal at 1:3"));
  }

  @Test void testInvalidEscape() {
    assertError(() -> Lexer.tokenize("\"ab\\qc\""),
        throwsA("Invalid escape sequence '\\q' at 1:5"));
  }
}

// End LexerTest.java
