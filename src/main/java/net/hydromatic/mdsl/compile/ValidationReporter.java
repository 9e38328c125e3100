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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Formats a {@link ValidationResult} for people and for tools.
 *
 * <p>All methods are pure functions of the result. */
public class ValidationReporter {
  private static final String RED = "\u001b[31m";
  private static final String GREEN = "\u001b[32m";
  private static final String YELLOW = "\u001b[33m";
  private static final String CYAN = "\u001b[36m";
  private static final String GRAY = "\u001b[90m";
  private static final String RESET = "\u001b[0m";

  private ValidationReporter() {}

  /** Formats a result as a plain-text report.
   *
   * <p>For example,
   *
   * <blockquote><pre>
   * Validation Report for: media.mdsl
   * ==================================================
   * Status: FAILED
   * Total Constructs: 1
   * Errors: 1
   * Warnings: 0
   * Info: 0
   *
   * Issues Found:
   * ------------------------------
   * 1. [ERROR] IDENTITY_NO_ID (3:5): Identity block missing required 'id'
   * field
   *    Suggestion: Add 'id = &lt;number&gt;' to identity block
   *    Context: Program &gt; Family(F) &gt; Outlet(O) &gt; Identity
   * </pre></blockquote>
   *
   * @param result Validation result
   * @param fileName Name of the source file, or null
   */
  public static String formatReport(ValidationResult result,
      @Nullable String fileName) {
    return report(result, fileName, false);
  }

  /** Formats a result as a report for a terminal, coloring each issue
   * red, yellow or cyan according to its severity. */
  public static String formatColored(ValidationResult result,
      @Nullable String fileName) {
    return report(result, fileName, true);
  }

  private static String report(ValidationResult result,
      @Nullable String fileName, boolean colored) {
    final StringBuilder buf = new StringBuilder();
    if (fileName != null) {
      buf.append("Validation Report for: ").append(fileName).append('\n');
    } else {
      buf.append("Validation Report\n");
    }
    buf.append(Strings.repeat("=", 50)).append('\n');
    buf.append("Status: ")
        .append(result.passed()
            ? color(colored, GREEN, "PASSED")
            : color(colored, RED, "FAILED"))
        .append('\n');
    buf.append("Total Constructs: ").append(result.totalConstructs)
        .append('\n');
    buf.append("Errors: ").append(count(colored, RED, result.errors))
        .append('\n');
    buf.append("Warnings: ").append(count(colored, YELLOW, result.warnings))
        .append('\n');
    buf.append("Info: ").append(count(colored, CYAN, result.info))
        .append('\n');
    buf.append('\n');
    if (result.issues.isEmpty()) {
      buf.append(color(colored, GREEN, "No issues found!")).append('\n');
      return buf.toString();
    }
    buf.append("Issues Found:\n");
    buf.append(Strings.repeat("-", 30)).append('\n');
    for (int i = 0; i < result.issues.size(); i++) {
      buf.append(i + 1).append(". ");
      issue(buf, result.issues.get(i), colored).append('\n');
    }
    return buf.toString();
  }

  /** Formats a single issue, on up to three lines. */
  public static String formatIssue(ValidationIssue issue) {
    return issue(new StringBuilder(), issue, false).toString();
  }

  private static StringBuilder issue(StringBuilder buf,
      ValidationIssue issue, boolean colored) {
    buf.append(color(colored, severityColor(issue.severity),
            "[" + issue.severity.name() + "]"))
        .append(' ')
        .append(issue.code)
        .append(" (")
        .append(issue.pos.lineCol())
        .append("): ")
        .append(issue.message);
    if (issue.suggestion != null) {
      buf.append("\n   ")
          .append(color(colored, GREEN, "Suggestion:"))
          .append(' ')
          .append(issue.suggestion);
    }
    if (!issue.contextPath.isEmpty()) {
      buf.append("\n   ")
          .append(color(colored, GRAY, "Context:"))
          .append(' ')
          .append(issue.contextPath);
    }
    return buf;
  }

  private static String severityColor(Severity severity) {
    switch (severity) {
    case ERROR:
      return RED;
    case WARNING:
      return YELLOW;
    default:
      return CYAN;
    }
  }

  private static String color(boolean colored, String color, String s) {
    return colored ? color + s + RESET : s;
  }

  /** Formats a count; non-zero counts are colored. */
  private static String count(boolean colored, String color, int n) {
    return color(colored && n > 0, color, Integer.toString(n));
  }

  /** Formats a result as a JSON document. */
  public static String formatJson(ValidationResult result) {
    final JsonNodeFactory factory = JsonNodeFactory.instance;
    final ObjectNode root = factory.objectNode();
    root.put("passed", result.passed());
    final ObjectNode summary = root.putObject("summary");
    summary.put("errors", result.errors);
    summary.put("warnings", result.warnings);
    summary.put("info", result.info);
    summary.put("total_constructs", result.totalConstructs);
    final ArrayNode issues = root.putArray("issues");
    for (ValidationIssue issue : result.issues) {
      final ObjectNode node = issues.addObject();
      node.put("severity", issue.severity.displayName);
      node.put("code", issue.code);
      node.put("message", issue.message);
      final ObjectNode position = node.putObject("position");
      position.put("line", issue.pos.startLine);
      position.put("column", issue.pos.startColumn);
      if (issue.suggestion != null) {
        node.put("suggestion", issue.suggestion);
      }
      node.put("context", issue.contextPath);
    }
    return root.toPrettyString();
  }

  /** Formats a result as comma-separated values, with a header row.
   *
   * <p>Message, suggestion and context are always quoted, and a quote
   * inside them is doubled. */
  public static String formatCsv(ValidationResult result) {
    final StringBuilder buf = new StringBuilder();
    buf.append("Severity,Code,Line,Column,Message,Suggestion,Context\n");
    for (ValidationIssue issue : result.issues) {
      buf.append(issue.severity.displayName).append(',')
          .append(issue.code).append(',')
          .append(issue.pos.startLine).append(',')
          .append(issue.pos.startColumn).append(',');
      quote(buf, issue.message).append(',');
      quote(buf, Strings.nullToEmpty(issue.suggestion)).append(',');
      quote(buf, issue.contextPath).append('\n');
    }
    return buf.toString();
  }

  private static StringBuilder quote(StringBuilder buf, String s) {
    return buf.append('"').append(s.replace("\"", "\"\"")).append('"');
  }
}

// End ValidationReporter.java
