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

import net.hydromatic.mdsl.ast.Ir;
import net.hydromatic.mdsl.compile.Resolver;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.regex.Pattern;

import static net.hydromatic.mdsl.util.Static.formatNumber;

/** Utilities shared by the generators. */
abstract class Generators {
  /** Date that stands for an open-ended {@code CURRENT} date in graph
   * output. */
  static final String FAR_FUTURE = "9999-01-01";

  private static final Pattern LINE_BREAK =
      Pattern.compile("\r\n|[\r\n\u0085\u2028\u2029]");

  private Generators() {}

  /** Escapes a string for use inside a single-quoted SQL literal. */
  static String escapeSql(String s) {
    return s.replace("'", "''");
  }

  /** Converts a string to a SQL literal, or {@code NULL}. */
  static String sqlString(@Nullable String s) {
    return s == null ? "NULL" : "'" + escapeSql(s) + "'";
  }

  /** Converts a date to a SQL literal. An absent or {@code CURRENT} date
   * becomes {@code NULL}. */
  static String sqlDate(@Nullable String date) {
    return isCurrent(date) ? "NULL" : sqlString(date);
  }

  /** Converts a number to a SQL literal, or {@code NULL}. */
  static String sqlNumber(@Nullable Double d) {
    return d == null ? "NULL" : formatNumber(d);
  }

  /** Escapes a string for use inside a single-quoted Cypher literal.
   * Line breaks are escaped too, so that each statement stays on its own
   * lines. */
  static String escapeCypher(String s) {
    return s.replace("\\", "\\\\").replace("'", "\\'")
        .replace("\n", "\\n").replace("\r", "\\r");
  }

  /** Converts a string to a Cypher literal, or {@code null}. */
  static String cypherString(@Nullable String s) {
    return s == null ? "null" : "'" + escapeCypher(s) + "'";
  }

  /** Converts a date to a Cypher {@code date} call, or {@code null}.
   * {@code CURRENT} becomes the far future. */
  static String cypherDate(@Nullable String date) {
    if (date == null) {
      return "null";
    }
    return "date('"
        + escapeCypher(isCurrent(date) ? FAR_FUTURE : date) + "')";
  }

  static boolean isCurrent(@Nullable String date) {
    return Resolver.CURRENT.equals(date);
  }

  /** Returns the value of an expression as text, as stored in a value
   * column. */
  static String text(Ir.Expr expr) {
    switch (expr.kind) {
    case STRING:
    case NUMBER:
    case BOOLEAN:
      return ((Ir.Literal) expr).asText();
    case VARIABLE:
      return "$" + ((Ir.VarRef) expr).name;
    case OBJECT:
      return "{}";
    case ARRAY:
      return "[]";
    default:
      throw new AssertionError(expr.kind);
    }
  }

  /** Converts text so that it stays inside a single-line comment. Each
   * line break becomes the two characters {@code \n}. */
  static String comment(String s) {
    return LINE_BREAK.matcher(s).replaceAll("\\\\n");
  }

  /** Returns an expression as text for a comment; strings are
   * double-quoted, composite values are summarized. */
  static String comment(Ir.Expr expr) {
    switch (expr.kind) {
    case STRING:
      return "\"" + comment(((Ir.Literal) expr).asText()) + "\"";
    case OBJECT:
      return "object";
    case ARRAY:
      return "array";
    default:
      return comment(text(expr));
    }
  }

  /** Returns an expression as a Cypher property value. Strings and
   * references are quoted; numbers and booleans are not. */
  static String cypherValue(Ir.Expr expr) {
    switch (expr.kind) {
    case NUMBER:
    case BOOLEAN:
      return text(expr);
    default:
      return cypherString(text(expr));
    }
  }

  /** Appends a {@code CREATE TABLE} statement followed by a blank
   * line. */
  static StringBuilder createTable(StringBuilder buf, String prefix,
      String table, String... columns) {
    buf.append("CREATE TABLE ").append(prefix).append(table).append(" (\n");
    for (int i = 0; i < columns.length; i++) {
      buf.append("    ").append(columns[i])
          .append(i < columns.length - 1 ? ",\n" : "\n");
    }
    return buf.append(");\n\n");
  }
}

// End Generators.java
