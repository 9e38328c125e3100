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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/** Converts source text into a list of {@link Token}s.
 *
 * <p>Blanks other than newline are discarded; newlines, comments and
 * annotations become tokens. The list always ends with a token of kind
 * {@link TokenKind#EOF}.
 *
 * <p>Each token's position starts at the token's first character and ends
 * just after its last character. Lines and columns count from 1; columns
 * count code points. The offset counts bytes of UTF-8.
 */
public class Lexer {
  private final String file;
  private final String source;

  /** Index of the next char in {@link #source}. */
  private int i = 0;
  private int line = 1;
  private int column = 1;
  private int offset = 0;

  /** Creates a Lexer. */
  public Lexer(String file, String source) {
    this.file = requireNonNull(file);
    this.source = requireNonNull(source);
  }

  /** Converts a source string into tokens. */
  public static ImmutableList<Token> tokenize(String source) {
    return new Lexer("", source).tokenize();
  }

  /** Reads all remaining tokens, up to and including end-of-input.
   *
   * @throws LexerException if the source is malformed
   */
  public ImmutableList<Token> tokenize() {
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    for (;;) {
      final Token token = next();
      tokens.add(token);
      if (token.kind == TokenKind.EOF) {
        return tokens.build();
      }
    }
  }

  /** Reads the next token. */
  public Token next() {
    skipBlanks();
    final int start = i;
    final Pos pos = pos();
    if (atEnd()) {
      return new Token(TokenKind.EOF, "", null, pos);
    }
    final int c = peek();
    switch (c) {
    case '\n':
      advance();
      return token(TokenKind.NEWLINE, start, pos, null);
    case '"':
      return string(start, pos);
    case '/':
      return slash(start, pos);
    case '#':
      return lineComment(start, pos, 1);
    case '@':
      return annotation(start, pos);
    default:
      break;
    }
    final TokenKind punctuation = TokenKind.punctuation(c);
    if (punctuation != null) {
      advance();
      return token(punctuation, start, pos, null);
    }
    if (isDigit(c)) {
      return number(start, pos);
    }
    if (isIdentifierStart(c)) {
      return word(start, pos);
    }
    throw LexerException.unexpectedCharacter(c, pos);
  }

  private Token slash(int start, Pos pos) {
    switch (peek(1)) {
    case '/':
      return lineComment(start, pos, 2);
    case '*':
      advance();
      advance();
      final int contentStart = i;
      for (;;) {
        if (atEnd()) {
          throw LexerException.unterminatedString(pos);
        }
        if (peek() == '*' && peek(1) == '/') {
          final String content = source.substring(contentStart, i);
          advance();
          advance();
          return token(TokenKind.MULTI_LINE_COMMENT, start, pos, content);
        }
        advance();
      }
    default:
      throw LexerException.unexpectedCharacter('/', pos);
    }
  }

  /** Reads a comment that ends at the end of the line; the newline is not
   * part of the comment. */
  private Token lineComment(int start, Pos pos, int prefixLength) {
    for (int k = 0; k < prefixLength; k++) {
      advance();
    }
    final int contentStart = i;
    while (!atEnd() && peek() != '\n') {
      advance();
    }
    final String content = source.substring(contentStart, i).trim();
    return token(TokenKind.COMMENT, start, pos, content);
  }

  private Token annotation(int start, Pos pos) {
    advance();
    final int nameStart = i;
    while (!atEnd() && (isAsciiAlphanumeric(peek()) || peek() == '_')) {
      advance();
    }
    if (i == nameStart) {
      throw LexerException.unexpectedCharacter('@', pos);
    }
    return token(TokenKind.ANNOTATION, start, pos,
        source.substring(nameStart, i));
  }

  private Token string(int start, Pos pos) {
    advance();
    final StringBuilder b = new StringBuilder();
    for (;;) {
      if (atEnd() || peek() == '\n') {
        throw LexerException.unterminatedString(pos);
      }
      final int c = peek();
      if (c == '"') {
        advance();
        return token(TokenKind.STRING, start, pos, b.toString());
      }
      if (c == '\\') {
        advance();
        if (atEnd()) {
          throw LexerException.unterminatedString(pos);
        }
        final Pos escapePos = pos();
        final int e = peek();
        final int unescaped = Parsers.unescape(e);
        if (unescaped < 0) {
          throw LexerException.invalidEscape(
              "\\" + new String(Character.toChars(e)), escapePos);
        }
        b.append((char) unescaped);
        advance();
        continue;
      }
      b.appendCodePoint(c);
      advance();
    }
  }

  private Token number(int start, Pos pos) {
    while (!atEnd() && isDigit(peek())) {
      advance();
    }
    if (peek() == '.' && isDigit(peek(1))) {
      advance();
      while (!atEnd() && isDigit(peek())) {
        advance();
      }
    }
    final String text = source.substring(start, i);
    final double value;
    try {
      value = Double.parseDouble(text);
    } catch (NumberFormatException e) {
      throw LexerException.invalidNumber(text, pos);
    }
    return token(TokenKind.NUMBER, start, pos, value);
  }

  /** Reads an identifier, keyword or boolean literal. */
  private Token word(int start, Pos pos) {
    while (!atEnd() && isIdentifierPart(peek())) {
      advance();
    }
    final String text = source.substring(start, i);
    if (text.equalsIgnoreCase("true")) {
      return token(TokenKind.BOOLEAN, start, pos, Boolean.TRUE);
    }
    if (text.equalsIgnoreCase("false")) {
      return token(TokenKind.BOOLEAN, start, pos, Boolean.FALSE);
    }
    final Keyword keyword = Keyword.lookup(text);
    if (keyword != null) {
      return token(TokenKind.KEYWORD, start, pos, keyword);
    }
    return token(TokenKind.IDENTIFIER, start, pos, text);
  }

  private void skipBlanks() {
    while (!atEnd()) {
      final int c = peek();
      if (c == '\n' || !Character.isWhitespace(c)) {
        return;
      }
      advance();
    }
  }

  /** Creates a token whose text runs from {@code start} to the current
   * point. */
  private Token token(TokenKind kind, int start, Pos pos,
      @Nullable Object value) {
    final Pos span =
        new Pos(file, pos.startLine, pos.startColumn, pos.offset, line,
            column);
    return new Token(kind, source.substring(start, i), value, span);
  }

  private Pos pos() {
    return Pos.of(file, line, column, offset);
  }

  private boolean atEnd() {
    return i >= source.length();
  }

  /** Returns the code point at the current point, or -1 at end. */
  private int peek() {
    return atEnd() ? -1 : source.codePointAt(i);
  }

  /** Returns the code point {@code n} code points ahead, or -1. */
  private int peek(int n) {
    int j = i;
    for (int k = 0; k < n && j < source.length(); k++) {
      j += Character.charCount(source.codePointAt(j));
    }
    return j < source.length() ? source.codePointAt(j) : -1;
  }

  /** Moves past the current code point. */
  private void advance() {
    final int c = source.codePointAt(i);
    i += Character.charCount(c);
    offset += utf8Length(c);
    if (c == '\n') {
      ++line;
      column = 1;
    } else {
      ++column;
    }
  }

  private static int utf8Length(int c) {
    return c < 0x80 ? 1
        : c < 0x800 ? 2
        : c < 0x10000 ? 3
        : 4;
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAsciiAlphanumeric(int c) {
    return isDigit(c) || c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
  }

  private static boolean isIdentifierStart(int c) {
    return c == '_' || c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
  }

  private static boolean isIdentifierPart(int c) {
    return isAsciiAlphanumeric(c) || c == '_' || c == '.';
  }
}

// End Lexer.java
