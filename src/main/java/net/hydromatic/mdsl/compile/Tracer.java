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

import net.hydromatic.mdsl.ast.Ast;
import net.hydromatic.mdsl.ast.Ir;
import net.hydromatic.mdsl.parse.MdslParseException;
import net.hydromatic.mdsl.parse.Token;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when the source has been split into tokens. */
  void onTokens(List<Token> tokens);

  /** Called when the source has been parsed. */
  void onAst(Ast.Program program);

  /** Called when the program has been converted to IR. */
  void onIr(Ir.Program program);

  /** Called with the result of validation. */
  void onValidation(ValidationResult result);

  /** Called when code has been generated for a target. */
  void onOutput(Prop.Target target, String output);

  /**
   * Called with the exception thrown during parsing, or null if no exception
   * was thrown. Returns whether a handler was found.
   */
  boolean handleParseException(@Nullable MdslParseException e);
}

// End Tracer.java
