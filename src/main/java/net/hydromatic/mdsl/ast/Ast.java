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

import static net.hydromatic.mdsl.util.Static.find;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Returns the first assignment with a given name in a list of fields,
   * or null. */
  public static @Nullable Assign assign(List<? extends Field> fields,
      String name) {
    return find(fields, Assign.class, f -> f.name.equals(name));
  }

  /** Returns the first date assignment with a given name in a list of
   * fields, or null. */
  public static @Nullable DateAssign dateAssign(List<? extends Field> fields,
      String name) {
    return find(fields, DateAssign.class, f -> f.name.equals(name));
  }

  /** Returns the first annotation with a given name in a list of fields,
   * or null. */
  public static @Nullable Annotation annotation(List<? extends Field> fields,
      String name) {
    return find(fields, Annotation.class, f -> f.name.equals(name));
  }

  /** Parse tree of a whole source document. */
  public static class Program extends AstNode {
    public final List<Decl> decls;

    Program(Pos pos, ImmutableList<Decl> decls) {
      super(pos, Op.PROGRAM);
      this.decls = requireNonNull(decls);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      for (Decl decl : decls) {
        w.newline();
        decl.unparse(w);
      }
      return w;
    }
  }

  /** Base class for a top-level declaration or a member of a family. */
  public abstract static class Decl extends AstNode {
    Decl(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Comment that is recorded as a declaration.
   *
   * <p>Annotations that sit directly inside a family are recorded as
   * comments whose text is "@name: value". */
  public static class Comment extends Decl {
    public final String text;
    public final boolean multiline;

    Comment(Pos pos, String text, boolean multiline) {
      super(pos, Op.COMMENT);
      this.text = requireNonNull(text);
      this.multiline = multiline;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.comment(text, multiline);
    }
  }

  /** Parse tree node of an {@code IMPORT} declaration. */
  public static class Import extends Decl {
    public final String path;

    Import(Pos pos, String path) {
      super(pos, Op.IMPORT);
      this.path = requireNonNull(path);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("import ").string(path).append(";");
    }
  }

  /** Parse tree node of a {@code LET} declaration.
   *
   * <p>For example, "{@code let x = 5;}". */
  public static class VarDecl extends Decl {
    public final String name;
    public final Exp exp;

    VarDecl(Pos pos, String name, Exp exp) {
      super(pos, Op.LET);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("let ").id(name).append(" = ").append(exp).append(";");
    }
  }

  /** Parse tree node of a {@code UNIT} declaration, a table schema. */
  public static class UnitDecl extends Decl {
    public final String name;
    public final List<FieldDecl> fields;

    UnitDecl(Pos pos, String name, ImmutableList<FieldDecl> fields) {
      super(pos, Op.UNIT);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("unit ").id(name).append(" {")
          .appendAll(fields, ", ")
          .append("}");
    }
  }

  /** Field in a {@link UnitDecl}.
   *
   * <p>For example, "{@code id: ID PRIMARY KEY}". */
  public static class FieldDecl extends AstNode {
    public final String name;
    public final FieldType type;
    public final boolean primaryKey;

    FieldDecl(Pos pos, String name, FieldType type, boolean primaryKey) {
      super(pos, Op.FIELD_DECL);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.primaryKey = primaryKey;
    }

    @Override public int hashCode() {
      return Objects.hash(name, type, primaryKey);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FieldDecl
          && name.equals(((FieldDecl) o).name)
          && type.equals(((FieldDecl) o).type)
          && primaryKey == ((FieldDecl) o).primaryKey;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.id(name).append(": ");
      type.unparse(w);
      return primaryKey ? w.append(" PRIMARY KEY") : w;
    }
  }

  /** Parse tree node of a {@code VOCABULARY} declaration.
   *
   * <p>The bare form "{@code name { entry, ... }}" produces a vocabulary
   * with a single body of the same name. */
  public static class VocabularyDecl extends Decl {
    public final String name;
    public final List<VocabBody> bodies;

    VocabularyDecl(Pos pos, String name, ImmutableList<VocabBody> bodies) {
      super(pos, Op.VOCABULARY);
      this.name = requireNonNull(name);
      this.bodies = requireNonNull(bodies);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("vocabulary ").id(name).append(" {")
          .appendAll(bodies, " ")
          .append("}");
    }
  }

  /** Named group of entries inside a {@link VocabularyDecl}. */
  public static class VocabBody extends AstNode {
    public final String name;
    public final List<VocabEntry> entries;

    VocabBody(Pos pos, String name, ImmutableList<VocabEntry> entries) {
      super(pos, Op.VOCAB_BODY);
      this.name = requireNonNull(name);
      this.entries = requireNonNull(entries);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.id(name).append(" {")
          .appendAll(entries, ", ")
          .append("}");
    }
  }

  /** Entry in a {@link VocabBody}; the key is a number or string literal.
   *
   * <p>For example, "{@code 1: "Public"}". */
  public static class VocabEntry extends AstNode {
    public final Literal key;
    public final String value;

    VocabEntry(Pos pos, Literal key, String value) {
      super(pos, Op.VOCAB_ENTRY);
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
      checkArgument(key.op == Op.NUMBER_LITERAL
          || key.op == Op.STRING_LITERAL);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(key).append(": ").string(value);
    }
  }

  /** Parse tree node of a {@code TEMPLATE} declaration. */
  public static class TemplateDecl extends Decl {
    /** Keyword between {@code TEMPLATE} and the name, for example
     * "outlet"; null if absent. */
    public final @Nullable String kind;
    public final String name;
    public final List<Field> blocks;

    TemplateDecl(Pos pos, @Nullable String kind, String name,
        ImmutableList<Field> blocks) {
      super(pos, Op.TEMPLATE);
      this.kind = kind;
      this.name = requireNonNull(name);
      this.blocks = requireNonNull(blocks);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("template ");
      if (kind != null) {
        w.append(kind).append(" ");
      }
      return w.string(name).append(" ").body(blocks);
    }
  }

  /** Parse tree node of a {@code FAMILY} (or {@code GROUP}) declaration. */
  public static class FamilyDecl extends Decl {
    public final String name;
    public final List<Decl> members;

    FamilyDecl(Pos pos, String name, ImmutableList<Decl> members) {
      super(pos, Op.FAMILY);
      this.name = requireNonNull(name);
      this.members = requireNonNull(members);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("family ").string(name).append(" ").body(members);
    }
  }

  /** Parse tree node of an {@code OUTLET} declaration. */
  public static class OutletDecl extends Decl {
    public final String name;
    public final @Nullable Inheritance inheritance;
    public final List<Field> blocks;

    OutletDecl(Pos pos, String name, @Nullable Inheritance inheritance,
        ImmutableList<Field> blocks) {
      super(pos, Op.OUTLET);
      this.name = requireNonNull(name);
      this.inheritance = inheritance;
      this.blocks = requireNonNull(blocks);
    }

    /** Returns the blocks of a given kind, in declaration order. */
    public List<Block> blocks(Op op) {
      final ImmutableList.Builder<Block> b = ImmutableList.builder();
      for (Field block : blocks) {
        if (block.op == op) {
          b.add((Block) block);
        }
      }
      return b.build();
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("outlet ").string(name).append(" ");
      if (inheritance != null) {
        w.append(inheritance).append(" ");
      }
      return w.body(blocks);
    }
  }

  /** Parse tree node of an {@code OUTLET_REF} family member, a reference
   * to an outlet that is declared elsewhere. */
  public static class OutletRef extends Decl {
    public final int id;
    public final String name;

    OutletRef(Pos pos, int id, String name) {
      super(pos, Op.OUTLET_REF);
      this.id = id;
      this.name = requireNonNull(name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("outlet_ref ").append(Integer.toString(id))
          .append(" ").string(name);
    }
  }

  /** Parse tree node of a {@code DATA FOR} declaration.
   *
   * <p>Items are {@code aggregation} blocks, {@link Year} blocks,
   * annotations and comments. */
  public static class DataDecl extends Decl {
    public final int targetId;
    public final List<Field> items;

    DataDecl(Pos pos, int targetId, ImmutableList<Field> items) {
      super(pos, Op.DATA);
      this.targetId = targetId;
      this.items = requireNonNull(items);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("data for ").append(Integer.toString(targetId))
          .append(" ").body(items);
    }
  }

  /** Base class of diachronic and synchronous links. */
  public abstract static class Relationship extends Decl {
    public final String name;
    public final List<Field> fields;

    Relationship(Pos pos, Op op, String name, ImmutableList<Field> fields) {
      super(pos, op);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(op.keyword).append(" ").string(name).append(" ")
          .body(fields);
    }
  }

  /** Parse tree node of a {@code DIACHRONIC_LINK}, a temporal link from a
   * predecessor outlet to a successor outlet. */
  public static class DiachronicLink extends Relationship {
    DiachronicLink(Pos pos, String name, ImmutableList<Field> fields) {
      super(pos, Op.DIACHRONIC_LINK, name, fields);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Parse tree node of a {@code SYNCHRONOUS_LINK}, a contemporaneous link
   * between two outlets. */
  public static class SynchronousLink extends Relationship {
    SynchronousLink(Pos pos, String name, ImmutableList<Field> fields) {
      super(pos, Op.SYNCHRONOUS_LINK, name, fields);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Parse tree node of an {@code EVENT} declaration. */
  public static class EventDecl extends Decl {
    public final String name;
    public final List<Field> fields;

    EventDecl(Pos pos, String name, ImmutableList<Field> fields) {
      super(pos, Op.EVENT);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("event ").id(name).append(" ").body(fields);
    }
  }

  /** Parse tree node of a {@code CATALOG} declaration, a list of data
   * sources. */
  public static class CatalogDecl extends Decl {
    public final String name;
    public final List<Source> sources;

    CatalogDecl(Pos pos, String name, ImmutableList<Source> sources) {
      super(pos, Op.CATALOG);
      this.name = requireNonNull(name);
      this.sources = requireNonNull(sources);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("catalog ").id(name).append(" {")
          .appendAll(sources, " ")
          .append("}");
    }
  }

  /** Inheritance clause of an outlet. */
  public abstract static class Inheritance extends AstNode {
    Inheritance(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** "{@code extends template "name"}" clause. */
  public static class ExtendsTemplate extends Inheritance {
    public final String templateName;

    ExtendsTemplate(Pos pos, String templateName) {
      super(pos, Op.EXTENDS_TEMPLATE);
      this.templateName = requireNonNull(templateName);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("extends template ").string(templateName);
    }
  }

  /** "{@code based_on id}" clause. */
  public static class BasedOn extends Inheritance {
    public final int id;

    BasedOn(Pos pos, int id) {
      super(pos, Op.BASED_ON);
      this.id = id;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("based_on ").append(Integer.toString(id));
    }
  }

  /** Base class of everything that can appear inside a brace-delimited
   * body. */
  public abstract static class Field extends AstNode {
    Field(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Keyword-introduced block of fields, such as
   * "{@code identity { id = 1; }}".
   *
   * <p>Op is one of {@link Op#IDENTITY}, {@link Op#LIFECYCLE},
   * {@link Op#CHARACTERISTICS}, {@link Op#METADATA}, {@link Op#AGGREGATION}
   * and {@link Op#METRICS}. */
  public static class Block extends Field {
    public final List<Field> fields;

    Block(Pos pos, Op op, ImmutableList<Field> fields) {
      super(pos, op);
      this.fields = requireNonNull(fields);
      checkArgument(op.isBlock(), op);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(op.keyword).append(" ").body(fields);
    }
  }

  /** Entry of a lifecycle block.
   *
   * <p>For example,
   * "{@code status "active" from "1959-01-01" to current { }}". */
  public static class LifecycleEntry extends Field {
    public final String status;
    public final DateExp from;
    public final @Nullable DateExp to;
    public final List<Field> attributes;

    LifecycleEntry(Pos pos, String status, DateExp from, @Nullable DateExp to,
        ImmutableList<Field> attributes) {
      super(pos, Op.LIFECYCLE_ENTRY);
      this.status = requireNonNull(status);
      this.from = requireNonNull(from);
      this.to = to;
      this.attributes = requireNonNull(attributes);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("status ").string(status).append(" from ").append(from);
      if (to != null) {
        w.append(" to ").append(to);
      }
      return w.append(" ").body(attributes);
    }
  }

  /** {@code YEAR} block inside a {@link DataDecl}. */
  public static class Year extends Field {
    public final int year;
    public final List<Field> fields;

    Year(Pos pos, int year, ImmutableList<Field> fields) {
      super(pos, Op.YEAR);
      this.year = year;
      this.fields = requireNonNull(fields);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("year ").append(Integer.toString(year)).append(" ")
          .body(fields);
    }
  }

  /** {@code SOURCE} inside a {@link CatalogDecl}. */
  public static class Source extends Field {
    public final String name;
    public final List<Field> fields;

    Source(Pos pos, String name, ImmutableList<Field> fields) {
      super(pos, Op.SOURCE);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("source ").string(name).append(" ").body(fields);
    }
  }

  /** Assignment "{@code name = exp}". */
  public static class Assign extends Field {
    public final String name;
    public final Exp exp;

    Assign(Pos pos, String name, Exp exp) {
      super(pos, Op.ASSIGN);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
    }

    @Override public int hashCode() {
      return Objects.hash(name, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assign
          && name.equals(((Assign) o).name)
          && exp.equals(((Assign) o).exp);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.id(name).append(" = ").append(exp);
    }
  }

  /** Assignment of an array of objects, "{@code name = [{...}, {...}]}". */
  public static class ArrayAssign extends Field {
    public final String name;
    public final List<ObjectExp> elements;

    ArrayAssign(Pos pos, String name, ImmutableList<ObjectExp> elements) {
      super(pos, Op.ARRAY_ASSIGN);
      this.name = requireNonNull(name);
      this.elements = requireNonNull(elements);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.id(name).append(" = [")
          .appendAll(elements, ", ")
          .append("]");
    }
  }

  /** Assignment of a date or a date range,
   * "{@code name = "2001-01-01" to current}". */
  public static class DateAssign extends Field {
    public final String name;
    public final DateExp from;
    public final @Nullable DateExp to;

    DateAssign(Pos pos, String name, DateExp from, @Nullable DateExp to) {
      super(pos, Op.DATE_ASSIGN);
      this.name = requireNonNull(name);
      this.from = requireNonNull(from);
      this.to = to;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.id(name).append(" = ").append(from);
      return to == null ? w : w.append(" to ").append(to);
    }
  }

  /** Nested group of fields without an equals sign,
   * "{@code name { field; ... }}". */
  public static class NestedAssign extends Field {
    public final String name;
    public final List<Field> fields;

    NestedAssign(Pos pos, String name, ImmutableList<Field> fields) {
      super(pos, Op.NESTED_ASSIGN);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.id(name).append(" ").body(fields);
    }
  }

  /** Annotation, "{@code @name "value"}". */
  public static class Annotation extends Field {
    public final String name;
    public final @Nullable String value;

    Annotation(Pos pos, String name, @Nullable String value) {
      super(pos, Op.ANNOTATION);
      this.name = requireNonNull(name);
      this.value = value;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("@").id(name);
      return value == null ? w : w.append(" ").string(value);
    }
  }

  /** Comment inside a body. */
  public static class FieldComment extends Field {
    public final String text;
    public final boolean multiline;

    FieldComment(Pos pos, String text, boolean multiline) {
      super(pos, Op.FIELD_COMMENT);
      this.text = requireNonNull(text);
      this.multiline = multiline;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.comment(text, multiline);
    }
  }

  /** Base class of expressions. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Literal: a string, number or boolean. */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
      checkArgument(op == Op.STRING_LITERAL && value instanceof String
          || op == Op.NUMBER_LITERAL && value instanceof Double
          || op == Op.BOOL_LITERAL && value instanceof Boolean);
    }

    /** Returns the value of a number literal. */
    public double doubleValue() {
      return (Double) value;
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && this.value.equals(((Literal) o).value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      switch (op) {
      case STRING_LITERAL:
        return w.string((String) value);
      case NUMBER_LITERAL:
        return w.number((Double) value);
      default:
        return w.append(value.toString());
      }
    }
  }

  /** Reference to a variable, "{@code $name}". */
  public static class VarRef extends Exp {
    public final String name;

    VarRef(Pos pos, String name) {
      super(pos, Op.VARIABLE);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VarRef
          && this.name.equals(((VarRef) o).name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("$").id(name);
    }
  }

  /** Bare identifier used as a value, such as the event in
   * "{@code triggered_by_event = merger_1972}". */
  public static class Identifier extends Exp {
    public final String name;

    Identifier(Pos pos, String name) {
      super(pos, Op.IDENTIFIER);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Identifier
          && this.name.equals(((Identifier) o).name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.id(name);
    }
  }

  /** Object literal, "{@code { name = exp; ... }}".
   *
   * <p>Fields are {@link Assign} and, where the right-hand side is a date
   * range, {@link DateAssign}. */
  public static class ObjectExp extends Exp {
    public final List<Field> fields;

    ObjectExp(Pos pos, ImmutableList<Field> fields) {
      super(pos, Op.OBJECT);
      this.fields = requireNonNull(fields);
    }

    @Override public int hashCode() {
      return fields.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ObjectExp
          && this.fields.equals(((ObjectExp) o).fields);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.body(fields);
    }
  }

  /** Date: a literal string, or the {@code CURRENT} sentinel. */
  public static class DateExp extends AstNode {
    /** The literal; null means {@code CURRENT}. */
    public final @Nullable String literal;

    DateExp(Pos pos, @Nullable String literal) {
      super(pos, Op.DATE);
      this.literal = literal;
    }

    public boolean isCurrent() {
      return literal == null;
    }

    @Override public int hashCode() {
      return Objects.hashCode(literal);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof DateExp
          && Objects.equals(literal, ((DateExp) o).literal);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w) {
      return literal == null ? w.append("current") : w.string(literal);
    }
  }
}

// End Ast.java
