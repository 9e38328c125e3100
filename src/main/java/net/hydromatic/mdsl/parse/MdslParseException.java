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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Exception caused by a parse error. */
public class MdslParseException extends RuntimeException
    implements MdslException {
  public final Kind kind;
  /** Text of the offending token; null if not applicable. */
  public final @Nullable String found;
  /** Descriptions of the tokens that would have been valid. */
  public final ImmutableList<String> expected;
  private final Pos pos;

  MdslParseException(Kind kind, String message, @Nullable String found,
      List<String> expected, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.found = found;
    this.expected = ImmutableList.copyOf(expected);
    this.pos = requireNonNull(pos);
  }

  static MdslParseException unexpectedToken(String found,
      List<String> expected, Pos pos) {
    return new MdslParseException(Kind.UNEXPECTED_TOKEN,
        "Unexpected token '" + found + "' at " + pos.lineCol()
            + ", expected " + String.join(" or ", expected),
        found, expected, pos);
  }

  static MdslParseException missingClosingDelimiter(String delimiter,
      Pos pos) {
    return new MdslParseException(Kind.MISSING_CLOSING_DELIMITER,
        "Missing closing '" + delimiter + "' at " + pos.lineCol(),
        null, ImmutableList.of("'" + delimiter + "'"), pos);
  }

  static MdslParseException invalidSyntax(String message, Pos pos) {
    return new MdslParseException(Kind.INVALID_SYNTAX,
        "Invalid syntax at " + pos.lineCol() + ": " + message,
        null, ImmutableList.of(), pos);
  }

  static MdslParseException unexpectedEof(List<String> expected, Pos pos) {
    return new MdslParseException(Kind.UNEXPECTED_EOF,
        "Unexpected end of input at " + pos.lineCol() + ", expected "
            + String.join(" or ", expected),
        null, expected, pos);
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Parser error: ").append(getMessage());
  }

  /** What went wrong. */
  public enum Kind {
    UNEXPECTED_TOKEN,
    /** Input ended inside a brace, bracket or parenthesis; the position is
     * that of the opening delimiter. */
    MISSING_CLOSING_DELIMITER,
    INVALID_SYNTAX,
    UNEXPECTED_EOF
  }
}

// End MdslParseException.java
