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

import net.hydromatic.mdsl.ast.Ir;
import net.hydromatic.mdsl.ast.Op;
import net.hydromatic.mdsl.parse.MdslParseException;
import net.hydromatic.mdsl.parse.Token;
import net.hydromatic.mdsl.parse.TokenKind;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static net.hydromatic.mdsl.Matchers.hasCounts;
import static net.hydromatic.mdsl.Matchers.throwsA;
import static net.hydromatic.mdsl.Mdsl.assertError;
import static net.hydromatic.mdsl.Mdsl.mdsl;
import static net.hydromatic.mdsl.Mdsl.readResource;
import static net.hydromatic.mdsl.Mdsl.resource;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

/** Tests {@link Compiles} and {@link CompiledProgram}. */
public class CompilesTest {
  /** A family whose relationship refers to a missing outlet. */
  private static final String MISSING_SUCCESSOR =
      "FAMILY \"F\" {\n"
          + "  OUTLET \"A\" {\n"
          + "    identity { id = 100; title = \"A\"; }\n"
          + "    characteristics { sector = 1; }\n"
          + "  }\n"
          + "  OUTLET \"B\" {\n"
          + "    identity { id = 200; title = \"B\"; }\n"
          + "    characteristics { sector = 1; }\n"
          + "  }\n"
          + "  DIACHRONIC_LINK l {\n"
          + "    predecessor = 100;\n"
          + "    successor = 300;\n"
          + "    relationship_type = \"succession\";\n"
          + "  }\n"
          + "}\n";

  @Test void testTokenize() {
    final List<Token> tokens = Compiles.tokenize("UNIT U {}");
    assertThat(tokens, hasSize(5));
    assertThat(tokens.get(4).kind, is(TokenKind.EOF));
  }

  @Test void testCompileEmpty() {
    final CompiledProgram compiled = Compiles.compile("");
    assertThat(compiled.program.decls, hasSize(0));
    assertThat(compiled.ir.families, hasSize(0));
    assertThat(compiled.validation.passed(), is(true));
    assertThat(compiled.validation.totalConstructs, is(0));
  }

  @Test void testCompileFixture() {
    final CompiledProgram compiled = resource("media.mdsl").compile();
    assertThat(compiled.validation.passed(), is(true));
    assertThat(compiled.ir.outlets(), hasSize(2));
    assertThat(compiled.ir.relationships(), hasSize(2));
    assertThat(compiled.checkValid(), is(compiled));
  }

  /** The tracer sees each phase in order. */
  @Test void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnTokens(tracer, tokens ->
        events.add("tokens " + tokens.size()));
    tracer = Tracers.withOnAst(tracer, program ->
        events.add("ast " + program.decls.size()));
    tracer = Tracers.withOnIr(tracer, program ->
        events.add("ir " + program.units.size()));
    tracer = Tracers.withOnValidation(tracer, result ->
        events.add("validation " + result.passed()));
    tracer = Tracers.withOnOutput(tracer, (target, output) ->
        events.add("output " + target));
    mdsl("UNIT U { id: ID PRIMARY KEY }")
        .withTracer(tracer)
        .compile()
        .generate(Prop.Target.CYPHER);
    assertThat(events.toString(),
        is("[tokens 10, ast 1, ir 1, validation true, output CYPHER]"));
  }

  @Test void testParseErrorWithoutHandler() {
    assertError(() -> Compiles.compile("UNIT U { id ID }"),
        throwsA(MdslParseException.class,
            containsString("Unexpected token 'ID' at 1:13, expected ':'")));
  }

  /** A tracer that handles the parse exception lets compilation continue
   * with the declarations that could be recovered. */
  @Test void testParseErrorHandled() {
    final List<MdslParseException> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnParseException(Tracers.empty(), e -> {
          if (e != null) {
            exceptions.add(e);
          }
        });
    final CompiledProgram compiled =
        mdsl("LET = 1;\n"
            + "UNIT U { id: ID PRIMARY KEY }\n")
            .withTracer(tracer)
            .compile();
    assertThat(exceptions, hasSize(1));
    assertThat(exceptions.get(0).getMessage(),
        is("Unexpected token '=' at 1:5, expected identifier"));
    assertThat(compiled.program.decls, hasSize(1));
    assertThat(compiled.program.decls.get(0).op, is(Op.UNIT));
    assertThat(compiled.ir.units, hasSize(1));
  }

  @Test void testParseSucceedsTracerSeesNull() {
    final AtomicReference<String> ref = new AtomicReference<>("unset");
    final Tracer tracer =
        Tracers.withOnParseException(Tracers.empty(), e ->
            ref.set(e == null ? "null" : e.getMessage()));
    mdsl("UNIT U { id: ID PRIMARY KEY }").withTracer(tracer).compile();
    assertThat(ref.get(), is("null"));
  }

  @Test void testGenerateUsesTargetProperty() {
    final CompiledProgram compiled =
        mdsl("UNIT U { id: ID PRIMARY KEY }")
            .withProp(Prop.TARGET, Prop.Target.CYPHER)
            .compile();
    assertThat(compiled.generate(), startsWith("// Generated Cypher"));
    assertThat(compiled.generate(Prop.Target.SQL),
        startsWith("-- Generated SQL from MediaLanguage DSL\n"));
  }

  /** By default, an invalid program cannot be generated. */
  @Test void testGenerateInvalid() {
    final CompiledProgram compiled = Compiles.compile(MISSING_SUCCESSOR);
    assertThat(compiled.validation, hasCounts(1, 0));
    assertError(() -> compiled.generate(Prop.Target.SQL),
        throwsA(CompileException.class,
            containsString("Successor outlet 300 not found")));
  }

  /** Generators do not re-check references; with validation switched
   * off, the relationship is emitted even though its successor is
   * missing. */
  @Test void testGenerateWithoutValidation() {
    final String sql = mdsl(MISSING_SUCCESSOR).generate(Prop.Target.SQL);
    assertThat(sql,
        containsString("INSERT INTO diachronic_relationships "
            + "(relationship_id, predecessor_id, successor_id, "
            + "event_start_date, event_end_date, relationship_subtype, "
            + "comment, maps_to) VALUES ("
            + "(SELECT id FROM relationships WHERE relationship_name = 'l'), "
            + "100, 300, NULL, NULL, 'succession', NULL, NULL);\n"));
    final String cypher =
        mdsl(MISSING_SUCCESSOR).generate(Prop.Target.CYPHER);
    assertThat(cypher, containsString("300"));
  }

  @Test void testReportText() {
    final String report =
        mdsl(MISSING_SUCCESSOR)
            .withProp(Prop.FILE, "f.mdsl")
            .compile()
            .report();
    assertThat(report,
        startsWith("Validation Report for: f.mdsl\n"));
    assertThat(report, containsString("Status: FAILED\n"));
    assertThat(report, not(containsString("\u001b[")));
  }

  @Test void testReportFormats() throws IOException {
    final CompiledProgram colored =
        mdsl(MISSING_SUCCESSOR)
            .withProp(Prop.REPORT_FORMAT, Prop.ReportFormat.COLORED)
            .compile();
    assertThat(colored.report(), containsString("\u001b[31m"));

    final CompiledProgram json =
        mdsl(MISSING_SUCCESSOR)
            .withProp(Prop.REPORT_FORMAT, Prop.ReportFormat.JSON)
            .compile();
    final JsonNode node = new ObjectMapper().readTree(json.report());
    assertThat(node.get("passed").asBoolean(), is(false));
    assertThat(node.get("issues").get(0).get("code").asText(),
        is("RELATIONSHIP_SUCCESSOR_NOT_FOUND"));

    final CompiledProgram csv =
        mdsl(MISSING_SUCCESSOR)
            .withProp(Prop.REPORT_FORMAT, Prop.ReportFormat.CSV)
            .compile();
    assertThat(csv.report(),
        startsWith("Severity,Code,Line,Column,Message,Suggestion,Context\n"
            + "Error,RELATIONSHIP_SUCCESSOR_NOT_FOUND,"));
  }

  /** Properties given by name, as a command line would supply them. */
  @Test void testLenientProperties() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.lookup("reportFormat").setLenient(map, "json");
    Prop.lookup("TARGET").setLenient(map, "sql_anmi");
    final CompiledProgram compiled =
        Compiles.compile(readResource("media.mdsl"), map, Tracers.empty());
    assertThat(compiled.report(), startsWith("{"));
    assertThat(compiled.generate(), startsWith("-- "));
    assertThat(compiled.propMap.get(Prop.FILE), nullValue());
  }

  @Test void testPropMapIsCopied() {
    final CompiledProgram compiled =
        Compiles.compile("", ImmutableMap.of(Prop.FILE, "x.mdsl"),
            Tracers.empty());
    assertThat(compiled.propMap, is(ImmutableMap.of(Prop.FILE, "x.mdsl")));
  }

  @Test void testLower() {
    final Ir.Program ir =
        Compiles.lower(Compiles.parse("UNIT U { id: ID PRIMARY KEY }"));
    assertThat(ir.units, hasSize(1));
    assertThat(Compiles.validate(Compiles.parse("")).passed(), is(true));
  }
}

// End CompilesTest.java
