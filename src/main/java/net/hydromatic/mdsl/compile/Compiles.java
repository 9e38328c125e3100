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
import net.hydromatic.mdsl.parse.Lexer;
import net.hydromatic.mdsl.parse.MdslParseException;
import net.hydromatic.mdsl.parse.MdslParser;
import net.hydromatic.mdsl.parse.ParseResult;
import net.hydromatic.mdsl.parse.Token;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/** Entry points to the phases of compilation: tokenize, parse, lower and
 * validate. */
public abstract class Compiles {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Compiles.class);

  private Compiles() {}

  /** Splits source text into tokens, ending with an EOF token.
   *
   * @throws net.hydromatic.mdsl.parse.LexerException if the source contains
   * an invalid token */
  public static List<Token> tokenize(String source) {
    return Lexer.tokenize(source);
  }

  /** Parses source text.
   *
   * @throws MdslParseException on the first syntax error */
  public static Ast.Program parse(String source) {
    return MdslParser.create(source).parse();
  }

  /** Converts a parse tree to IR. */
  public static Ir.Program lower(Ast.Program program) {
    return Resolver.create().toIr(program);
  }

  /** Validates a parse tree. */
  public static ValidationResult validate(Ast.Program program) {
    return Validator.create().validate(program);
  }

  /** Compiles source text with default properties. */
  public static CompiledProgram compile(String source) {
    return compile(source, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Tokenizes, parses, lowers and validates source text.
   *
   * <p>If parsing fails and the tracer handles the exception, compilation
   * continues with the declarations that the parser was able to recover;
   * otherwise the exception is thrown.
   *
   * <p>The result is returned even if validation finds errors; call
   * {@link CompiledProgram#checkValid()} to fail in that case.
   */
  public static CompiledProgram compile(String source,
      Map<Prop, Object> propMap, Tracer tracer) {
    final String file = Prop.FILE.stringValue(propMap);
    final List<Token> tokens = new Lexer(file, source).tokenize();
    LOGGER.debug("Tokenized {}: {} tokens", describe(file), tokens.size());
    tracer.onTokens(tokens);

    final Ast.Program program = parse(tokens, tracer);
    tracer.onAst(program);

    final Ir.Program ir = Resolver.of(propMap).toIr(program);
    LOGGER.debug("Lowered {}: {} families", describe(file),
        ir.families.size());
    tracer.onIr(ir);

    final ValidationResult result = Validator.of(propMap).validate(program);
    tracer.onValidation(result);
    return new CompiledProgram(program, ir, result, propMap, tracer);
  }

  private static Ast.Program parse(List<Token> tokens, Tracer tracer) {
    try {
      final Ast.Program program = new MdslParser(tokens).parse();
      tracer.handleParseException(null);
      return program;
    } catch (MdslParseException e) {
      if (!tracer.handleParseException(e)) {
        throw e;
      }
      final ParseResult result = new MdslParser(tokens).parseLenient();
      LOGGER.debug("Recovered from {} parse errors", result.errors.size());
      return result.program;
    }
  }

  private static String describe(String file) {
    return file.isEmpty() ? "<input>" : file;
  }
}

// End Compiles.java
