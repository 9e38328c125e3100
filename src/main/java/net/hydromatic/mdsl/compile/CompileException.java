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
package net.hydromatic.mdsl.compile;

import net.hydromatic.mdsl.ast.Pos;
import net.hydromatic.mdsl.util.MdslException;

import static java.util.Objects.requireNonNull;

/** An error occurred during semantic analysis.
 *
 * <p>The validator does not throw; it collects {@link ValidationIssue}s.
 * A CompileException is created from the first error of a failed
 * {@link ValidationResult} when a caller needs the pipeline to stop. */
public class CompileException extends RuntimeException
    implements MdslException {
  public final Kind kind;
  /** Code of the validation issue, e.g. "OUTLET_ID_DUPLICATE". */
  public final String code;
  private final Pos pos;

  public CompileException(Kind kind, String code, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.code = requireNonNull(code);
    this.pos = requireNonNull(pos);
  }

  /** Creates an exception from an error issue. */
  public static CompileException of(ValidationIssue issue) {
    return new CompileException(Kind.of(issue.code), issue.code,
        issue.message, issue.pos);
  }

  @Override public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override public Pos pos() {
    return pos;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Semantic error: ")
        .append(getMessage())
        .append(" at ")
        .append(pos.lineCol());
  }

  /** Category of semantic error. */
  public enum Kind {
    UNDEFINED_VARIABLE,
    DUPLICATE_DEFINITION,
    TYPE_MISMATCH,
    INVALID_FIELD,
    CIRCULAR_DEPENDENCY,
    IMPORT_ERROR;

    /** Returns the kind of error that a validation code denotes. */
    static Kind of(String code) {
      if (code.endsWith("_REDECLARED") || code.endsWith("_DUPLICATE")) {
        return DUPLICATE_DEFINITION;
      }
      if (code.equals("VARIABLE_NOT_FOUND")) {
        return UNDEFINED_VARIABLE;
      }
      if (code.startsWith("IMPORT_")) {
        return IMPORT_ERROR;
      }
      if (code.startsWith("FIELD_") || code.startsWith("UNIT_")) {
        return TYPE_MISMATCH;
      }
      return INVALID_FIELD;
    }
  }
}

// End CompileException.java
