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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/** A problem found by the {@link Validator}. */
public class ValidationIssue {
  public final Severity severity;
  /** Machine-readable code, e.g. "IDENTITY_NO_ID". */
  public final String code;
  public final String message;
  public final Pos pos;
  public final @Nullable String suggestion;
  /** Path of the constructs enclosing the issue, e.g.
   * "Program > Family(F) > Outlet(O) > Identity". */
  public final String contextPath;

  public ValidationIssue(Severity severity, String code, String message,
      Pos pos, @Nullable String suggestion, String contextPath) {
    this.severity = requireNonNull(severity);
    this.code = requireNonNull(code);
    this.message = requireNonNull(message);
    this.pos = requireNonNull(pos);
    this.suggestion = suggestion;
    this.contextPath = requireNonNull(contextPath);
  }

  @Override public int hashCode() {
    return Objects.hash(severity, code, message, pos);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof ValidationIssue
        && severity == ((ValidationIssue) o).severity
        && code.equals(((ValidationIssue) o).code)
        && message.equals(((ValidationIssue) o).message)
        && pos.equals(((ValidationIssue) o).pos)
        && Objects.equals(suggestion, ((ValidationIssue) o).suggestion)
        && contextPath.equals(((ValidationIssue) o).contextPath);
  }

  @Override public String toString() {
    return ValidationReporter.formatIssue(this);
  }
}

// End ValidationIssue.java
