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
package net.hydromatic.mdsl.ast;

import java.util.List;

import static net.hydromatic.mdsl.parse.Parsers.quoteString;
import static net.hydromatic.mdsl.util.Static.formatNumber;

/** Context for writing an AST out as DSL text. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public AstWriter append(AstNode node) {
    return node.unparse(this);
  }

  /** Appends an identifier. */
  public AstWriter id(String name) {
    return append(name);
  }

  /** Appends a quoted string literal, escaping as the lexer expects. */
  public AstWriter string(String s) {
    return append(quoteString(s));
  }

  /** Appends a number literal; integral values have no fraction. */
  public AstWriter number(double d) {
    return append(formatNumber(d));
  }

  /** Appends a comment. A line comment is terminated by a newline, so that
   * whatever follows it is not swallowed. */
  public AstWriter comment(String text, boolean multiline) {
    if (multiline) {
      return append("/*").append(text).append("*/");
    }
    return append("// ").append(text).append("\n");
  }

  /** Starts a new line, unless the output is empty or already at the start
   * of a line. */
  public AstWriter newline() {
    if (b.length() > 0 && b.charAt(b.length() - 1) != '\n') {
      b.append('\n');
    }
    return this;
  }

  /** Appends a brace-delimited body, each element terminated by a
   * semicolon. Comments are not terminated. */
  public AstWriter body(List<? extends AstNode> nodes) {
    append("{");
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(" ");
      }
      final AstNode node = nodes.get(i);
      node.unparse(this);
      if (node.op != Op.COMMENT && node.op != Op.FIELD_COMMENT) {
        append(";");
      }
    }
    return append("}");
  }

  /** Appends a list of nodes separated by a given string. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      nodes.get(i).unparse(this);
    }
    return this;
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
