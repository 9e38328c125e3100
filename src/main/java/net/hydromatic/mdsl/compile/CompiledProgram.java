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
import net.hydromatic.mdsl.codegen.Generator;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/** Result of compiling a program: its parse tree, its IR, and the result
 * of validating it.
 *
 * @see Compiles#compile(String, Map, Tracer) */
public class CompiledProgram {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(CompiledProgram.class);

  public final Ast.Program program;
  public final Ir.Program ir;
  public final ValidationResult validation;
  public final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;

  CompiledProgram(Ast.Program program, Ir.Program ir,
      ValidationResult validation, Map<Prop, Object> propMap,
      Tracer tracer) {
    this.program = requireNonNull(program);
    this.ir = requireNonNull(ir);
    this.validation = requireNonNull(validation);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Throws {@link CompileException} if validation found errors. */
  public CompiledProgram checkValid() {
    validation.checkPassed();
    return this;
  }

  /** Generates code for the target given by {@link Prop#TARGET}. */
  public String generate() {
    return generate(Prop.TARGET.enumValue(propMap, Prop.Target.class));
  }

  /** Generates code for a given target.
   *
   * <p>If {@link Prop#VALIDATE_BEFORE_GENERATE} is set (the default), first
   * throws {@link CompileException} if the program is not valid. */
  public String generate(Prop.Target target) {
    if (Prop.VALIDATE_BEFORE_GENERATE.booleanValue(propMap)) {
      checkValid();
    }
    final String output = Generator.of(target).generate(ir);
    LOGGER.debug("Generated {} characters of {}", output.length(), target);
    tracer.onOutput(target, output);
    return output;
  }

  /** Formats the validation result in the format given by
   * {@link Prop#REPORT_FORMAT}. */
  public String report() {
    final String file = Prop.FILE.stringValue(propMap);
    switch (Prop.REPORT_FORMAT.enumValue(propMap, Prop.ReportFormat.class)) {
    case COLORED:
      return ValidationReporter.formatColored(validation, nullIfEmpty(file));
    case JSON:
      return ValidationReporter.formatJson(validation);
    case CSV:
      return ValidationReporter.formatCsv(validation);
    default:
      return ValidationReporter.formatReport(validation, nullIfEmpty(file));
    }
  }

  private static @Nullable String nullIfEmpty(String s) {
    return s.isEmpty() ? null : s;
  }
}

// End CompiledProgram.java
