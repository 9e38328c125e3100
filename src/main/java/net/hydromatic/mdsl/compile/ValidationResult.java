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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.function.Predicate;

import static net.hydromatic.mdsl.util.Static.filterEager;

/** Issues found by validating a program, and a summary of them. */
public class ValidationResult {
  public final ImmutableList<ValidationIssue> issues;
  public final int errors;
  public final int warnings;
  public final int info;
  /** Number of templates, units, vocabularies and families. */
  public final int totalConstructs;

  public ValidationResult(List<ValidationIssue> issues,
      int totalConstructs) {
    this.issues = ImmutableList.copyOf(issues);
    this.totalConstructs = totalConstructs;
    this.errors = count(Severity.ERROR);
    this.warnings = count(Severity.WARNING);
    this.info = count(Severity.INFO);
  }

  private int count(Severity severity) {
    int n = 0;
    for (ValidationIssue issue : issues) {
      if (issue.severity == severity) {
        ++n;
      }
    }
    return n;
  }

  /** Returns whether validation passed; that is, there are no errors.
   * Warnings and info do not cause failure. */
  public boolean passed() {
    return errors == 0;
  }

  /** Returns the issues that have a given code. */
  public List<ValidationIssue> issues(String code) {
    return filter(issue -> issue.code.equals(code));
  }

  /** Returns the issues that have a given severity. */
  public List<ValidationIssue> issues(Severity severity) {
    return filter(issue -> issue.severity == severity);
  }

  private List<ValidationIssue> filter(Predicate<ValidationIssue> p) {
    return filterEager(issues, ValidationIssue.class, p);
  }

  /** Throws a {@link CompileException} describing the first error, if
   * there is one. */
  public ValidationResult checkPassed() {
    for (ValidationIssue issue : issues) {
      if (issue.severity == Severity.ERROR) {
        throw CompileException.of(issue);
      }
    }
    return this;
  }

  @Override public String toString() {
    return ValidationReporter.formatReport(this, null);
  }
}

// End ValidationResult.java
