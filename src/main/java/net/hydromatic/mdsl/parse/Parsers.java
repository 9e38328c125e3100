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

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /** Returns the character that an escape sequence "\c" stands for, or -1
   * if "\c" is not a valid escape. */
  public static int unescape(int c) {
    switch (c) {
    case 'n':
      return '\n';
    case 't':
      return '\t';
    case 'r':
      return '\r';
    case '\\':
      return '\\';
    case '"':
      return '"';
    default:
      return -1;
    }
  }

  /** Converts a string to a double-quoted literal, escaping the characters
   * that {@link #unescape} restores. */
  public static String quoteString(String s) {
    final StringBuilder b = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
      case '"':
        b.append("\\\"");
        break;
      case '\\':
        b.append("\\\\");
        break;
      case '\n':
        b.append("\\n");
        break;
      case '\t':
        b.append("\\t");
        break;
      case '\r':
        b.append("\\r");
        break;
      default:
        b.append(c);
      }
    }
    return b.append('"').toString();
  }
}

// End Parsers.java
