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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/** Lexical token.
 *
 * <p>The {@link #text} is the slice of source that the token was read from;
 * the {@link #value} is its meaning. For a string literal, the text includes
 * the quotes and escapes, and the value is the unescaped string. */
public class Token {
  public final TokenKind kind;
  public final String text;
  /** Value: a {@link Keyword} for keywords, a {@link Double} for numbers, a
   * {@link Boolean} for booleans, a {@link String} for identifiers, strings,
   * comments (their trimmed content) and annotations (their name); null for
   * punctuation, newline and end-of-input. */
  public final @Nullable Object value;
  public final Pos pos;

  Token(TokenKind kind, String text, @Nullable Object value, Pos pos) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.value = value;
    this.pos = requireNonNull(pos);
  }

  /** Whether this token is a given keyword. */
  public boolean is(Keyword keyword) {
    return kind == TokenKind.KEYWORD && value == keyword;
  }

  /** Whether this token is a given kind. */
  public boolean is(TokenKind kind) {
    return this.kind == kind;
  }

  /** Whether this token is a comment. */
  public boolean isComment() {
    return kind == TokenKind.COMMENT || kind == TokenKind.MULTI_LINE_COMMENT;
  }

  /** Returns the keyword of a keyword token. */
  public Keyword keyword() {
    return (Keyword) requireNonNull(value);
  }

  /** Returns the value of an identifier, string, comment or annotation. */
  public String stringValue() {
    return (String) requireNonNull(value);
  }

  /** Returns the value of a number token. */
  public double doubleValue() {
    return (Double) requireNonNull(value);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, text, pos);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Token
        && kind == ((Token) o).kind
        && text.equals(((Token) o).text)
        && Objects.equals(value, ((Token) o).value)
        && pos.equals(((Token) o).pos);
  }

  @Override public String toString() {
    return kind + "(" + text + ") at " + pos.lineCol();
  }
}

// End Token.java
