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

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  public Ast.Program program(Pos pos, Iterable<? extends Ast.Decl> decls) {
    return new Ast.Program(pos, ImmutableList.copyOf(decls));
  }

  // declarations

  public Ast.Comment comment(Pos pos, String text, boolean multiline) {
    return new Ast.Comment(pos, text, multiline);
  }

  public Ast.Import importDecl(Pos pos, String path) {
    return new Ast.Import(pos, path);
  }

  public Ast.VarDecl varDecl(Pos pos, String name, Ast.Exp exp) {
    return new Ast.VarDecl(pos, name, exp);
  }

  public Ast.UnitDecl unitDecl(Pos pos, String name,
      Iterable<Ast.FieldDecl> fields) {
    return new Ast.UnitDecl(pos, name, ImmutableList.copyOf(fields));
  }

  public Ast.FieldDecl fieldDecl(Pos pos, String name, FieldType type,
      boolean primaryKey) {
    return new Ast.FieldDecl(pos, name, type, primaryKey);
  }

  public Ast.VocabularyDecl vocabularyDecl(Pos pos, String name,
      Iterable<Ast.VocabBody> bodies) {
    return new Ast.VocabularyDecl(pos, name, ImmutableList.copyOf(bodies));
  }

  public Ast.VocabBody vocabBody(Pos pos, String name,
      Iterable<Ast.VocabEntry> entries) {
    return new Ast.VocabBody(pos, name, ImmutableList.copyOf(entries));
  }

  public Ast.VocabEntry vocabEntry(Pos pos, Ast.Literal key, String value) {
    return new Ast.VocabEntry(pos, key, value);
  }

  public Ast.TemplateDecl templateDecl(Pos pos, @Nullable String kind,
      String name, Iterable<? extends Ast.Field> blocks) {
    return new Ast.TemplateDecl(pos, kind, name, ImmutableList.copyOf(blocks));
  }

  public Ast.FamilyDecl familyDecl(Pos pos, String name,
      Iterable<? extends Ast.Decl> members) {
    return new Ast.FamilyDecl(pos, name, ImmutableList.copyOf(members));
  }

  public Ast.OutletDecl outletDecl(Pos pos, String name,
      Ast.@Nullable Inheritance inheritance,
      Iterable<? extends Ast.Field> blocks) {
    return new Ast.OutletDecl(pos, name, inheritance,
        ImmutableList.copyOf(blocks));
  }

  public Ast.OutletRef outletRef(Pos pos, int id, String name) {
    return new Ast.OutletRef(pos, id, name);
  }

  public Ast.DataDecl dataDecl(Pos pos, int targetId,
      Iterable<? extends Ast.Field> items) {
    return new Ast.DataDecl(pos, targetId, ImmutableList.copyOf(items));
  }

  public Ast.DiachronicLink diachronicLink(Pos pos, String name,
      Iterable<? extends Ast.Field> fields) {
    return new Ast.DiachronicLink(pos, name, ImmutableList.copyOf(fields));
  }

  public Ast.SynchronousLink synchronousLink(Pos pos, String name,
      Iterable<? extends Ast.Field> fields) {
    return new Ast.SynchronousLink(pos, name, ImmutableList.copyOf(fields));
  }

  public Ast.EventDecl eventDecl(Pos pos, String name,
      Iterable<? extends Ast.Field> fields) {
    return new Ast.EventDecl(pos, name, ImmutableList.copyOf(fields));
  }

  public Ast.CatalogDecl catalogDecl(Pos pos, String name,
      Iterable<Ast.Source> sources) {
    return new Ast.CatalogDecl(pos, name, ImmutableList.copyOf(sources));
  }

  // inheritance

  public Ast.ExtendsTemplate extendsTemplate(Pos pos, String templateName) {
    return new Ast.ExtendsTemplate(pos, templateName);
  }

  public Ast.BasedOn basedOn(Pos pos, int id) {
    return new Ast.BasedOn(pos, id);
  }

  // fields

  public Ast.Block block(Pos pos, Op op,
      Iterable<? extends Ast.Field> fields) {
    return new Ast.Block(pos, op, ImmutableList.copyOf(fields));
  }

  public Ast.LifecycleEntry lifecycleEntry(Pos pos, String status,
      Ast.DateExp from, Ast.@Nullable DateExp to,
      Iterable<? extends Ast.Field> attributes) {
    return new Ast.LifecycleEntry(pos, status, from, to,
        ImmutableList.copyOf(attributes));
  }

  public Ast.Year year(Pos pos, int year,
      Iterable<? extends Ast.Field> fields) {
    return new Ast.Year(pos, year, ImmutableList.copyOf(fields));
  }

  public Ast.Source source(Pos pos, String name,
      Iterable<? extends Ast.Field> fields) {
    return new Ast.Source(pos, name, ImmutableList.copyOf(fields));
  }

  public Ast.Assign assign(Pos pos, String name, Ast.Exp exp) {
    return new Ast.Assign(pos, name, exp);
  }

  public Ast.ArrayAssign arrayAssign(Pos pos, String name,
      Iterable<Ast.ObjectExp> elements) {
    return new Ast.ArrayAssign(pos, name, ImmutableList.copyOf(elements));
  }

  public Ast.DateAssign dateAssign(Pos pos, String name, Ast.DateExp from,
      Ast.@Nullable DateExp to) {
    return new Ast.DateAssign(pos, name, from, to);
  }

  public Ast.NestedAssign nestedAssign(Pos pos, String name,
      Iterable<? extends Ast.Field> fields) {
    return new Ast.NestedAssign(pos, name, ImmutableList.copyOf(fields));
  }

  public Ast.Annotation annotation(Pos pos, String name,
      @Nullable String value) {
    return new Ast.Annotation(pos, name, value);
  }

  public Ast.FieldComment fieldComment(Pos pos, String text,
      boolean multiline) {
    return new Ast.FieldComment(pos, text, multiline);
  }

  // expressions

  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  public Ast.Literal numberLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.NUMBER_LITERAL, value);
  }

  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, value);
  }

  public Ast.VarRef varRef(Pos pos, String name) {
    return new Ast.VarRef(pos, name);
  }

  public Ast.Identifier identifier(Pos pos, String name) {
    return new Ast.Identifier(pos, name);
  }

  public Ast.ObjectExp object(Pos pos, Iterable<? extends Ast.Field> fields) {
    return new Ast.ObjectExp(pos, ImmutableList.copyOf(fields));
  }

  public Ast.DateExp date(Pos pos, String literal) {
    return new Ast.DateExp(pos, literal);
  }

  public Ast.DateExp current(Pos pos) {
    return new Ast.DateExp(pos, null);
  }
}

// End AstBuilder.java
