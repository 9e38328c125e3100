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

/** Visits syntax trees.
 *
 * <p>Each method visits the children of its node; sub-classes override the
 * methods for the nodes they are interested in, and call {@code super} to
 * keep descending. */
public class Visitor {

  /** Visits a child node. Every child is reached through this method, so
   * overriding it sees each node of the tree. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  protected void visit(Ast.Program program) {
    program.decls.forEach(this::accept);
  }

  // declarations

  protected void visit(Ast.Comment comment) {}

  protected void visit(Ast.Import anImport) {}

  protected void visit(Ast.VarDecl varDecl) {
    accept(varDecl.exp);
  }

  protected void visit(Ast.UnitDecl unitDecl) {
    unitDecl.fields.forEach(this::accept);
  }

  protected void visit(Ast.FieldDecl fieldDecl) {}

  protected void visit(Ast.VocabularyDecl vocabularyDecl) {
    vocabularyDecl.bodies.forEach(this::accept);
  }

  protected void visit(Ast.VocabBody vocabBody) {
    vocabBody.entries.forEach(this::accept);
  }

  protected void visit(Ast.VocabEntry vocabEntry) {
    accept(vocabEntry.key);
  }

  protected void visit(Ast.TemplateDecl templateDecl) {
    templateDecl.blocks.forEach(this::accept);
  }

  protected void visit(Ast.FamilyDecl familyDecl) {
    familyDecl.members.forEach(this::accept);
  }

  protected void visit(Ast.OutletDecl outletDecl) {
    if (outletDecl.inheritance != null) {
      accept(outletDecl.inheritance);
    }
    outletDecl.blocks.forEach(this::accept);
  }

  protected void visit(Ast.OutletRef outletRef) {}

  protected void visit(Ast.DataDecl dataDecl) {
    dataDecl.items.forEach(this::accept);
  }

  protected void visit(Ast.DiachronicLink diachronicLink) {
    diachronicLink.fields.forEach(this::accept);
  }

  protected void visit(Ast.SynchronousLink synchronousLink) {
    synchronousLink.fields.forEach(this::accept);
  }

  protected void visit(Ast.EventDecl eventDecl) {
    eventDecl.fields.forEach(this::accept);
  }

  protected void visit(Ast.CatalogDecl catalogDecl) {
    catalogDecl.sources.forEach(this::accept);
  }

  // inheritance

  protected void visit(Ast.ExtendsTemplate extendsTemplate) {}

  protected void visit(Ast.BasedOn basedOn) {}

  // fields

  protected void visit(Ast.Block block) {
    block.fields.forEach(this::accept);
  }

  protected void visit(Ast.LifecycleEntry lifecycleEntry) {
    accept(lifecycleEntry.from);
    if (lifecycleEntry.to != null) {
      accept(lifecycleEntry.to);
    }
    lifecycleEntry.attributes.forEach(this::accept);
  }

  protected void visit(Ast.Year year) {
    year.fields.forEach(this::accept);
  }

  protected void visit(Ast.Source source) {
    source.fields.forEach(this::accept);
  }

  protected void visit(Ast.Assign assign) {
    accept(assign.exp);
  }

  protected void visit(Ast.ArrayAssign arrayAssign) {
    arrayAssign.elements.forEach(this::accept);
  }

  protected void visit(Ast.DateAssign dateAssign) {
    accept(dateAssign.from);
    if (dateAssign.to != null) {
      accept(dateAssign.to);
    }
  }

  protected void visit(Ast.NestedAssign nestedAssign) {
    nestedAssign.fields.forEach(this::accept);
  }

  protected void visit(Ast.Annotation annotation) {}

  protected void visit(Ast.FieldComment fieldComment) {}

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.VarRef varRef) {}

  protected void visit(Ast.Identifier identifier) {}

  protected void visit(Ast.ObjectExp objectExp) {
    objectExp.fields.forEach(this::accept);
  }

  protected void visit(Ast.DateExp dateExp) {}
}

// End Visitor.java
