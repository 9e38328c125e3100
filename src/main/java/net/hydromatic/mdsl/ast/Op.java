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

/** Sub-types of {@link AstNode}. */
public enum Op {
  PROGRAM,
  COMMENT,

  // declarations
  IMPORT("import"),
  LET("let"),
  UNIT("unit"),
  FIELD_DECL,
  VOCABULARY("vocabulary"),
  VOCAB_BODY,
  VOCAB_ENTRY,
  TEMPLATE("template"),
  FAMILY("family"),
  OUTLET("outlet"),
  OUTLET_REF("outlet_ref"),
  DATA("data for"),
  DIACHRONIC_LINK("diachronic_link"),
  SYNCHRONOUS_LINK("synchronous_link"),
  EVENT("event"),
  CATALOG("catalog"),

  // inheritance clauses
  EXTENDS_TEMPLATE("extends template"),
  BASED_ON("based_on"),

  // blocks; their keyword is printed before the brace
  IDENTITY("identity"),
  LIFECYCLE("lifecycle"),
  CHARACTERISTICS("characteristics"),
  METADATA("metadata"),
  AGGREGATION("aggregation"),
  METRICS("metrics"),

  // fields
  ASSIGN,
  ARRAY_ASSIGN,
  DATE_ASSIGN,
  NESTED_ASSIGN,
  ANNOTATION,
  FIELD_COMMENT,
  LIFECYCLE_ENTRY("status"),
  YEAR("year"),
  SOURCE("source"),

  // expressions
  STRING_LITERAL,
  NUMBER_LITERAL,
  BOOL_LITERAL,
  VARIABLE,
  IDENTIFIER,
  OBJECT,
  DATE;

  /** Keyword that introduces the construct in source text, or null. */
  public final String keyword;

  Op() {
    this(null);
  }

  Op(String keyword) {
    this.keyword = keyword;
  }

  /** Whether this is one of the block operators. */
  public boolean isBlock() {
    switch (this) {
    case IDENTITY:
    case LIFECYCLE:
    case CHARACTERISTICS:
    case METADATA:
    case AGGREGATION:
    case METRICS:
      return true;
    default:
      return false;
    }
  }
}

// End Op.java
