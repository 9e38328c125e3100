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

import net.hydromatic.mdsl.ast.Ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Result of a lenient parse: the declarations that could be parsed, and the
 * errors that were recovered from, in the order they occurred. */
public class ParseResult {
  public final Ast.Program program;
  public final ImmutableList<MdslParseException> errors;

  ParseResult(Ast.Program program, List<MdslParseException> errors) {
    this.program = requireNonNull(program);
    this.errors = ImmutableList.copyOf(errors);
  }

  /** Whether the source parsed without errors. */
  public boolean isValid() {
    return errors.isEmpty();
  }
}

// End ParseResult.java
