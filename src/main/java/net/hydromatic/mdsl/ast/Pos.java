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

import java.util.Objects;

/**
 * Position of a token or parse-tree node.
 *
 * <p>Lines and columns are 1-based. The offset is the 0-based byte offset of
 * the start of the construct in the UTF-8 encoding of the source.
 */
public class Pos {
  /** Position "1:1", used by errors that have no better location. */
  public static final Pos PLACEHOLDER = new Pos("", 1, 1, 0, 1, 1);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int offset;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(
      String file,
      int startLine,
      int startColumn,
      int offset,
      int endLine,
      int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.offset = offset;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos that starts and ends at the same point. */
  public static Pos of(String file, int line, int column, int offset) {
    return new Pos(file, line, column, offset, line, column);
  }

  @Override public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && this.startLine == ((Pos) o).startLine
        && this.startColumn == ((Pos) o).startColumn
        && this.endLine == ((Pos) o).endLine
        && this.endColumn == ((Pos) o).endColumn;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    if (!file.isEmpty()) {
      buf.append(file).append(':');
    }
    return buf.append(startLine).append(':').append(startColumn);
  }

  /** Returns "line:column" of the start of this position. */
  public String lineCol() {
    return startLine + ":" + startColumn;
  }

  /** Returns the smallest position that covers this and another
   * position. */
  public Pos plus(Pos pos) {
    final boolean startsFirst = offset <= pos.offset;
    final boolean endsLast = endLine > pos.endLine
        || endLine == pos.endLine && endColumn >= pos.endColumn;
    final Pos start = startsFirst ? this : pos;
    final Pos end = endsLast ? this : pos;
    return new Pos(file, start.startLine, start.startColumn, start.offset,
        end.endLine, end.endColumn);
  }
}

// End Pos.java
