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
package net.hydromatic.mdsl.codegen;

import net.hydromatic.mdsl.ast.Pos;
import net.hydromatic.mdsl.util.MdslException;

import static java.util.Objects.requireNonNull;

/** Exception thrown when code cannot be generated from a program.
 *
 * <p>Generators do not validate; they assume that the program has passed
 * validation. Errors that have no source location use
 * {@link Pos#PLACEHOLDER}. */
public class CodeGenException extends RuntimeException
    implements MdslException {
  public final Kind kind;
  private final Pos pos;

  CodeGenException(Kind kind, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  static CodeGenException invalidTarget(String target, String message) {
    return new CodeGenException(Kind.INVALID_TARGET,
        "Invalid target '" + target + "': " + message, Pos.PLACEHOLDER);
  }

  static CodeGenException generationFailure(String message, Pos pos) {
    return new CodeGenException(Kind.GENERATION_FAILURE,
        "Generation failure at " + pos.lineCol() + ": " + message, pos);
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Code generation error: ").append(getMessage());
  }

  /** What went wrong. */
  public enum Kind {
    UNSUPPORTED_FEATURE,
    INVALID_TARGET,
    GENERATION_FAILURE
  }
}

// End CodeGenException.java
