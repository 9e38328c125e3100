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
package net.hydromatic.mdsl.codegen;

import net.hydromatic.mdsl.ast.Ir;
import net.hydromatic.mdsl.compile.Prop;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/** Converts the IR of a program into a script in a target language.
 *
 * <p>A generator is a pure function of its input: it holds no state
 * between calls, and the same IR always yields the same text. */
public interface Generator {
  /** Generates a script. */
  String generate(Ir.Program program);

  /** Returns the generator for a given target. */
  static Generator of(Prop.Target target) {
    switch (target) {
    case SQL:
      return new SqlGenerator();
    case SQL_ANMI:
      return new AnmiSqlGenerator();
    case CYPHER:
      return new CypherGenerator();
    default:
      throw CodeGenException.invalidTarget(target.name(),
          "no generator");
    }
  }

  /** Returns the generator for a target given by name, such as "sql",
   * "sql-anmi" or "cypher".
   *
   * @throws CodeGenException if there is no such target */
  static Generator lookup(@Nullable String targetName) {
    if (targetName == null || targetName.isEmpty()) {
      throw CodeGenException.invalidTarget(String.valueOf(targetName),
          "target name is required");
    }
    final String name =
        targetName.toUpperCase(Locale.ROOT).replace('-', '_');
    for (Prop.Target target : Prop.Target.values()) {
      if (target.name().equals(name)) {
        return of(target);
      }
    }
    throw CodeGenException.invalidTarget(targetName,
        "expected one of sql, sql-anmi, cypher");
  }
}

// End Generator.java
