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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Kind of a {@link Token}. */
public enum TokenKind {
  KEYWORD,
  IDENTIFIER,
  STRING,
  NUMBER,
  BOOLEAN,

  // punctuation
  ASSIGN("="),
  SEMICOLON(";"),
  COLON(":"),
  COMMA(","),
  DOT("."),
  DOLLAR("$"),
  LEFT_BRACE("{"),
  RIGHT_BRACE("}"),
  LEFT_PAREN("("),
  RIGHT_PAREN(")"),
  LEFT_BRACKET("["),
  RIGHT_BRACKET("]"),
  LEFT_ANGLE("<"),
  RIGHT_ANGLE(">"),

  // trivia
  COMMENT,
  MULTI_LINE_COMMENT,
  ANNOTATION,
  NEWLINE,

  EOF;

  /** Text of a punctuation token; null for other kinds. */
  public final @Nullable String symbol;

  TokenKind() {
    this(null);
  }

  TokenKind(@Nullable String symbol) {
    this.symbol = symbol;
  }

  /** Returns the punctuation kind for a character, or null. */
  static @Nullable TokenKind punctuation(int c) {
    switch (c) {
    case '=':
      return ASSIGN;
    case ';':
      return SEMICOLON;
    case ':':
      return COLON;
    case ',':
      return COMMA;
    case '.':
      return DOT;
    case '$':
      return DOLLAR;
    case '{':
      return LEFT_BRACE;
    case '}':
      return RIGHT_BRACE;
    case '(':
      return LEFT_PAREN;
    case ')':
      return RIGHT_PAREN;
    case '[':
      return LEFT_BRACKET;
    case ']':
      return RIGHT_BRACKET;
    case '<':
      return LEFT_ANGLE;
    case '>':
      return RIGHT_ANGLE;
    default:
      return null;
    }
  }
}

// End TokenKind.java
