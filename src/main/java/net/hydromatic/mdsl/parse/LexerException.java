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
import net.hydromatic.mdsl.util.MdslException;

import static java.util.Objects.requireNonNull;

/** Exception caused by malformed source text. */
public class LexerException extends RuntimeException
    implements MdslException {
  public final Kind kind;
  private final Pos pos;

  LexerException(Kind kind, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  static LexerException unexpectedCharacter(int c, Pos pos) {
    return new LexerException(Kind.UNEXPECTED_CHARACTER,
        "Unexpected character '" + new String(Character.toChars(c))
            + "' at " + pos.lineCol(), pos);
  }

  static LexerException unterminatedString(Pos pos) {
    return new LexerException(Kind.UNTERMINATED_STRING,
        "Unterminated string literal at " + pos.lineCol(), pos);
  }

  static LexerException invalidNumber(String text, Pos pos) {
    return new LexerException(Kind.INVALID_NUMBER,
        "Invalid number '" + text + "' at " + pos.lineCol(), pos);
  }

  static LexerException invalidEscape(String sequence, Pos pos) {
    return new LexerException(Kind.INVALID_ESCAPE,
        "Invalid escape sequence '" + sequence + "' at " + pos.lineCol(),
        pos);
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Lexer error: ").append(getMessage());
  }

  /** What went wrong. */
  public enum Kind {
    UNEXPECTED_CHARACTER,
    /** An unterminated string literal, or an unterminated block comment. */
    UNTERMINATED_STRING,
    INVALID_NUMBER,
    INVALID_ESCAPE
  }
}

// End LexerException.java
