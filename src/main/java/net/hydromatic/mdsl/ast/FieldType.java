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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Type of a field in a {@code UNIT} declaration.
 *
 * <p>Immutable; shared between {@link Ast.FieldDecl} and {@link Ir.Field}.
 */
public class FieldType {
  public static final FieldType ID = new FieldType(Kind.ID, null, null);
  public static final FieldType NUMBER =
      new FieldType(Kind.NUMBER, null, null);
  public static final FieldType BOOLEAN =
      new FieldType(Kind.BOOLEAN, null, null);

  public final Kind kind;
  /** Length of a {@code TEXT(n)} field; null for {@code TEXT} and others. */
  public final @Nullable Integer length;
  /** Values of a {@code CATEGORY}; empty for other kinds. */
  public final ImmutableList<String> values;

  private FieldType(
      Kind kind, @Nullable Integer length, @Nullable List<String> values) {
    this.kind = requireNonNull(kind);
    this.length = length;
    this.values =
        values == null ? ImmutableList.of() : ImmutableList.copyOf(values);
    checkArgument(length == null || kind == Kind.TEXT);
    checkArgument(values == null || kind == Kind.CATEGORY);
  }

  /** Creates a TEXT type, optionally with a length. */
  public static FieldType text(@Nullable Integer length) {
    return new FieldType(Kind.TEXT, length, null);
  }

  /** Creates a CATEGORY type. The values may contain duplicates. */
  public static FieldType category(List<String> values) {
    return new FieldType(Kind.CATEGORY, null, values);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, length, values);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FieldType
        && kind == ((FieldType) o).kind
        && Objects.equals(length, ((FieldType) o).length)
        && values.equals(((FieldType) o).values);
  }

  @Override public String toString() {
    return unparse(new AstWriter()).toString();
  }

  AstWriter unparse(AstWriter w) {
    w.append(kind.name());
    if (length != null) {
      w.append("(").append(length.toString()).append(")");
    }
    if (kind == Kind.CATEGORY) {
      w.append("(");
      for (int i = 0; i < values.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.string(values.get(i));
      }
      w.append(")");
    }
    return w;
  }

  /** Kind of field type. */
  public enum Kind {
    ID,
    TEXT,
    NUMBER,
    BOOLEAN,
    CATEGORY
  }
}

// End FieldType.java
