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

import org.junit.jupiter.api.Test;

import java.util.List;

import static net.hydromatic.mdsl.Matchers.hasCounts;
import static net.hydromatic.mdsl.Matchers.hasIssue;
import static net.hydromatic.mdsl.Matchers.hasNoIssue;
import static net.hydromatic.mdsl.Matchers.throwsA;
import static net.hydromatic.mdsl.Mdsl.assertError;
import static net.hydromatic.mdsl.Mdsl.mdsl;
import static net.hydromatic.mdsl.Mdsl.resource;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

/** Tests {@link Validator}. */
public class ValidatorTest {
  /** Outlet "A" with ID 1, and outlet "B" with ID 2; each is valid. */
  private static final String TWO_OUTLETS =
      "  OUTLET \"A\" {\n"
          + "    identity { id = 1; title = \"A\"; }\n"
          + "    characteristics { sector = 1; }\n"
          + "  }\n"
          + "  OUTLET \"B\" {\n"
          + "    identity { id = 2; title = \"B\"; }\n"
          + "    characteristics { sector = 1; }\n"
          + "  }\n";

  private static ValidationResult validate(String source) {
    return mdsl(source).validate();
  }

  /** Returns the only issue that has a given code. */
  private static ValidationIssue issue(ValidationResult result,
      String code) {
    final List<ValidationIssue> issues = result.issues(code);
    assertThat(result.toString(), issues, hasSize(1));
    return issues.get(0);
  }

  @Test void testEmptyProgram() {
    final ValidationResult result = validate("");
    assertThat(result.passed(), is(true));
    assertThat(result.issues, hasSize(0));
    assertThat(result.totalConstructs, is(0));
  }

  @Test void testValidUnit() {
    final ValidationResult result =
        validate("UNIT MediaOutlet {\n"
            + "  id: ID PRIMARY KEY,\n"
            + "  name: TEXT(120),\n"
            + "  sector: NUMBER\n"
            + "}");
    assertThat(result, hasCounts(0, 0));
    assertThat(result.totalConstructs, is(1));
  }

  @Test void testMissingId() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + "  OUTLET \"O\" {\n"
            + "    identity { title = \"X\"; }\n"
            + "    characteristics { sector = 1; }\n"
            + "  }\n"
            + "}");
    assertThat(result, hasCounts(1, 0));
    assertThat(result.passed(), is(false));
    final ValidationIssue issue = issue(result, "IDENTITY_NO_ID");
    assertThat(issue.severity, is(Severity.ERROR));
    assertThat(issue.message, is("Identity block missing required 'id' field"));
    assertThat(issue.pos.lineCol(), is("3:5"));
    assertThat(issue.suggestion, is("Add 'id = <number>' to identity block"));
    assertThat(issue.contextPath,
        is("Program > Family(F) > Outlet(O) > Identity"));
  }

  @Test void testMissingTitle() {
    mdsl("FAMILY \"F\" {\n"
            + "  OUTLET \"O\" {\n"
            + "    identity { id = 1; }\n"
            + "    characteristics { sector = 1; }\n"
            + "  }\n"
            + "}")
        .assertValid()
        .assertValidation(hasIssue(Severity.WARNING, "IDENTITY_NO_TITLE"));
  }

  @Test void testDuplicateOutletId() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + "  OUTLET \"A\" {\n"
            + "    identity { id = 1; title = \"A\"; }\n"
            + "    characteristics { sector = 1; }\n"
            + "  }\n"
            + "  OUTLET \"B\" {\n"
            + "    identity { id = 1; title = \"B\"; }\n"
            + "    characteristics { sector = 1; }\n"
            + "  }\n"
            + "}");
    assertThat(result, hasCounts(1, 0));
    final ValidationIssue issue = issue(result, "OUTLET_ID_DUPLICATE");
    assertThat(issue.message, is("Outlet ID 1 is already used"));
    assertThat(issue.pos.lineCol(), is("6:3"));
    assertThat(issue.suggestion, is("Previous outlet at 2:3"));
  }

  @Test void testDuplicateOutletIdAcrossFamilies() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n" + TWO_OUTLETS + "}\n"
            + "FAMILY \"G\" {\n" + TWO_OUTLETS + "}\n");
    // each repeat is reported, against the first declaration
    assertThat(result.issues("OUTLET_ID_DUPLICATE"), hasSize(2));
    assertThat(result.errors, is(2));
  }

  @Test void testUnknownSuccessor() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + TWO_OUTLETS
            + "  DIACHRONIC_LINK l {\n"
            + "    predecessor = 1;\n"
            + "    successor = 99;\n"
            + "    relationship_type = \"succession\";\n"
            + "  }\n"
            + "}");
    assertThat(result, hasCounts(1, 0));
    final ValidationIssue issue =
        issue(result, "RELATIONSHIP_SUCCESSOR_NOT_FOUND");
    assertThat(issue.message, is("Successor outlet 99 not found"));
    assertThat(issue.contextPath,
        is("Program > Family(F) > DiachronicRel(l)"));
    assertThat(result, hasNoIssue("RELATIONSHIP_PREDECESSOR_NOT_FOUND"));
  }

  @Test void testUnknownPredecessorAndSelfReference() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + TWO_OUTLETS
            + "  DIACHRONIC_LINK a { predecessor = 7; successor = 1; }\n"
            + "  DIACHRONIC_LINK b { predecessor = 2; successor = 2; }\n"
            + "}");
    assertThat(result,
        hasIssue(Severity.ERROR, "RELATIONSHIP_PREDECESSOR_NOT_FOUND"));
    assertThat(result,
        hasIssue(Severity.WARNING, "RELATIONSHIP_SELF_REFERENCE"));
  }

  @Test void testSynchronousOutletsNotFound() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + TWO_OUTLETS
            + "  SYNCHRONOUS_LINK s {\n"
            + "    outlet_1 = { id = 8; role = \"parent\"; };\n"
            + "    outlet_2 = { id = 9; role = \"child\"; };\n"
            + "  }\n"
            + "}");
    assertThat(result, hasCounts(2, 0));
    assertThat(issue(result, "RELATIONSHIP_OUTLET1_NOT_FOUND").message,
        is("Outlet 1 with ID 8 not found"));
    assertThat(issue(result, "RELATIONSHIP_OUTLET2_NOT_FOUND").message,
        is("Outlet 2 with ID 9 not found"));
  }

  /** An outlet ID must be a whole number that fits in an INTEGER. An
   * invalid ID is reported, and does not clash with a valid one. */
  @Test void testInvalidOutletId() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + "  OUTLET \"A\" {\n"
            + "    identity { id = 1.5; title = \"A\"; }\n"
            + "    characteristics { sector = 1; }\n"
            + "  }\n"
            + "  OUTLET \"B\" {\n"
            + "    identity { id = 1; title = \"B\"; }\n"
            + "    characteristics { sector = 1; }\n"
            + "  }\n"
            + "  DIACHRONIC_LINK l { predecessor = 1; "
            + "successor = 3000000000; }\n"
            + "}");
    assertThat(result, hasCounts(2, 0));
    final List<ValidationIssue> issues = result.issues("OUTLET_ID_INVALID");
    assertThat(issues, hasSize(2));
    assertThat(issues.get(0).message,
        is("Outlet ID 1.5 in 'id' is not a whole number in INTEGER range"));
    assertThat(issues.get(0).pos.lineCol(), is("3:21"));
    assertThat(issues.get(0).suggestion,
        is("Use a whole number between -2147483648 and 2147483647"));
    assertThat(issues.get(0).contextPath,
        is("Program > Family(F) > Outlet(A) > Identity"));
    assertThat(issues.get(1).message,
        is("Outlet ID 3000000000 in 'successor' is not a whole number "
            + "in INTEGER range"));
    assertThat(result, hasNoIssue("OUTLET_ID_DUPLICATE"));
    assertThat(result, hasNoIssue("RELATIONSHIP_SUCCESSOR_NOT_FOUND"));

    final ValidationResult result2 =
        validate("FAMILY \"F\" {\n"
            + TWO_OUTLETS
            + "  SYNCHRONOUS_LINK s {\n"
            + "    outlet_1 = { id = 1; role = \"parent\"; };\n"
            + "    outlet_2 = { id = 2.25; role = \"child\"; };\n"
            + "  }\n"
            + "}\n"
            + "EVENT e { entities = { buyer = { id = 0.5; }; }; }");
    assertThat(result2.issues("OUTLET_ID_INVALID"), hasSize(2));
    assertThat(result2, hasNoIssue("RELATIONSHIP_OUTLET2_NOT_FOUND"));
  }

  @Test void testOutletRefDeclaresId() {
    mdsl("FAMILY \"F\" {\n"
            + TWO_OUTLETS
            + "  OUTLET_REF 300 \"Elsewhere\"\n"
            + "  DIACHRONIC_LINK l { predecessor = 300; successor = 1; }\n"
            + "}")
        .assertValidation(hasCounts(0, 0));
  }

  @Test void testReferenceBeforeDeclaration() {
    // declarations are collected before references are checked
    mdsl("FAMILY \"F\" {\n"
            + "  DIACHRONIC_LINK l { predecessor = 1; successor = 2; }\n"
            + "}\n"
            + "FAMILY \"G\" {\n"
            + TWO_OUTLETS
            + "}\n")
        .assertValid()
        .assertValidation(hasIssue(Severity.WARNING, "FAMILY_NO_OUTLETS"))
        .assertValidation(
            hasIssue(Severity.WARNING, "FAMILY_SINGLE_OUTLET_RELATIONSHIPS"));
  }

  @Test void testOutletWithoutIdentity() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + "  OUTLET \"O\" { lifecycle { } }\n"
            + "}");
    assertThat(result, hasIssue(Severity.ERROR, "OUTLET_NO_IDENTITY"));
    assertThat(result,
        hasIssue(Severity.WARNING, "OUTLET_NO_CHARACTERISTICS"));
    assertThat(result, hasIssue(Severity.WARNING, "LIFECYCLE_EMPTY"));
  }

  @Test void testEmptyFamily() {
    final ValidationResult result = validate("FAMILY \"E\" {\n}");
    assertThat(result, hasCounts(0, 2));
    assertThat(result, hasIssue(Severity.WARNING, "FAMILY_EMPTY"));
    assertThat(result, hasIssue(Severity.WARNING, "FAMILY_NO_OUTLETS"));

    // comments are not members
    assertThat(validate("FAMILY \"E\" {\n  // nothing yet\n}"),
        hasIssue(Severity.WARNING, "FAMILY_EMPTY"));
  }

  @Test void testUnitChecks() {
    final ValidationResult result =
        validate("UNIT U {\n"
            + "  a: TEXT(0),\n"
            + "  b: TEXT(70000),\n"
            + "  a: NUMBER,\n"
            + "  c: CATEGORY(),\n"
            + "  d: CATEGORY(\"x\", \"y\", \"x\")\n"
            + "}\n"
            + "UNIT Empty { }");
    assertThat(result, hasIssue(Severity.WARNING, "FIELD_TEXT_LARGE"));
    assertThat(result, hasIssue(Severity.ERROR, "FIELD_TEXT_ZERO_LENGTH"));
    assertThat(result, hasIssue(Severity.ERROR, "UNIT_FIELD_DUPLICATE"));
    assertThat(result, hasIssue(Severity.ERROR, "FIELD_CATEGORY_EMPTY"));
    assertThat(result, hasIssue(Severity.ERROR, "FIELD_CATEGORY_DUPLICATE"));
    assertThat(result, hasIssue(Severity.ERROR, "UNIT_EMPTY"));
    assertThat(result.issues("UNIT_NO_PRIMARY_KEY"), hasSize(2));
    assertThat(issue(result, "FIELD_TEXT_LARGE").contextPath,
        is("Program > Unit(U) > Field(b)"));
  }

  @Test void testMaxTextLength() {
    final String source = "UNIT U { id: ID PRIMARY KEY, n: TEXT(120) }";
    mdsl(source).assertValidation(hasNoIssue("FIELD_TEXT_LARGE"));
    mdsl(source).withProp(Prop.MAX_TEXT_LENGTH, 100)
        .assertValidation(hasIssue(Severity.WARNING, "FIELD_TEXT_LARGE"));
  }

  @Test void testVocabularyDuplicateKey() {
    final ValidationResult result =
        validate("VOCABULARY V {\n"
            + "  1: \"A\",\n"
            + "  1: \"B\",\n"
            + "  \"x\": \"C\"\n"
            + "}\n"
            + "VOCABULARY W { empty { } }");
    final ValidationIssue issue = issue(result, "VOCAB_DUPLICATE_KEY");
    assertThat(issue.message,
        is("Vocabulary body 'V' has duplicate key '1'"));
    assertThat(issue.pos.lineCol(), is("3:3"));
    assertThat(result, hasIssue(Severity.WARNING, "VOCAB_BODY_EMPTY"));
  }

  @Test void testRedeclared() {
    final ValidationResult result =
        validate("TEMPLATE OUTLET \"T\" { metadata { a = 1; } }\n"
            + "TEMPLATE OUTLET \"T\" { metadata { a = 1; } }\n"
            + "LET x = 1\n"
            + "LET x = 2\n");
    final ValidationIssue issue = issue(result, "TEMPLATE_REDECLARED");
    assertThat(issue.message, is("Template 'T' is already declared"));
    assertThat(issue.suggestion, is("Previous declaration at 1:1"));
    assertThat(result, hasIssue(Severity.ERROR, "VAR_REDECLARED"));
  }

  @Test void testUndeclaredReferences() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + "  OUTLET \"A\" EXTENDS TEMPLATE \"Nope\" {\n"
            + "    identity { id = 1; title = \"A\"; }\n"
            + "    characteristics { language = $lang; }\n"
            + "  }\n"
            + "  OUTLET \"B\" BASED_ON 42 {\n"
            + "    identity { id = 2; title = \"B\"; }\n"
            + "    characteristics { sector = 1; }\n"
            + "  }\n"
            + "}");
    assertThat(result, hasCounts(3, 0));
    final ValidationIssue variable = issue(result, "VARIABLE_NOT_FOUND");
    assertThat(variable.message, is("Variable 'lang' not found"));
    assertThat(variable.pos.lineCol(), is("4:34"));
    assertThat(variable.contextPath,
        is("Program > References > Family(F) > Outlet(A)"));
    assertThat(issue(result, "TEMPLATE_NOT_FOUND").message,
        is("Template 'Nope' not found"));
    assertThat(issue(result, "OUTLET_NOT_FOUND").message,
        is("Outlet with ID 42 not found"));
  }

  @Test void testDeclaredReferences() {
    mdsl("TEMPLATE OUTLET \"T\" { characteristics { sector = 1; } }\n"
            + "FAMILY \"F\" {\n"
            + "  OUTLET \"A\" EXTENDS TEMPLATE \"T\" {\n"
            + "    identity { id = 1; title = \"A\"; }\n"
            + "    characteristics { language = $lang; }\n"
            + "  }\n"
            + "  OUTLET \"B\" BASED_ON 1 {\n"
            + "    identity { id = 2; title = \"B\"; }\n"
            + "    characteristics { sector = 1; }\n"
            + "  }\n"
            + "}\n"
            + "LET lang = \"de\"\n")
        .assertValidation(hasCounts(0, 0));
  }

  @Test void testImports() {
    final ValidationResult result =
        validate("IMPORT \"vocab.txt\"\n"
            + "IMPORT \"../shared/base.mdsl\"\n"
            + "IMPORT \"shared/ok.mdsl\"\n");
    assertThat(result.passed(), is(true));
    final ValidationIssue warning = issue(result, "IMPORT_NO_EXTENSION");
    assertThat(warning.severity, is(Severity.WARNING));
    assertThat(warning.message,
        is("Import path 'vocab.txt' should end with '.mdsl'"));
    assertThat(result, hasIssue(Severity.INFO, "IMPORT_RELATIVE_PATH"));
    assertThat(result.info, is(1));
  }

  @Test void testEmptyMetadataIgnoresComments() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + "  OUTLET \"O\" {\n"
            + "    identity { id = 1; title = \"O\"; }\n"
            + "    characteristics { /* to do */ }\n"
            + "    metadata { // nothing\n"
            + "    }\n"
            + "  }\n"
            + "}");
    assertThat(result, hasIssue(Severity.INFO, "METADATA_EMPTY"));
    assertThat(result, hasIssue(Severity.WARNING, "CHARACTERISTICS_EMPTY"));
    assertThat(result.issues(Severity.INFO), hasSize(1));
  }

  @Test void testData() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + TWO_OUTLETS
            + "  DATA FOR 5 { year 2020 { } }\n"
            + "  DATA FOR 1 { }\n"
            + "}");
    assertThat(result, hasIssue(Severity.ERROR, "DATA_OUTLET_NOT_FOUND"));
    assertThat(result, hasIssue(Severity.WARNING, "DATA_EMPTY"));
  }

  @Test void testEventEntityNotFound() {
    final ValidationResult result =
        validate("EVENT e {\n"
            + "  type = \"merger\";\n"
            + "  entities = { target = { id = 77; role = \"target\"; }; };\n"
            + "}");
    final ValidationIssue issue = issue(result, "EVENT_ENTITY_NOT_FOUND");
    assertThat(issue.severity, is(Severity.WARNING));
    assertThat(issue.message,
        is("Event entity 'target' references unknown outlet 77"));
  }

  @Test void testCheckPassed() {
    final ValidationResult result =
        validate("FAMILY \"F\" {\n"
            + "  OUTLET \"O\" { identity { title = \"X\"; } }\n"
            + "}");
    assertError(result::checkPassed,
        throwsA("Identity block missing required 'id' field"));
    try {
      result.checkPassed();
    } catch (CompileException e) {
      assertThat(e.code, is("IDENTITY_NO_ID"));
      assertThat(e.kind, is(CompileException.Kind.INVALID_FIELD));
      assertThat(e.describeTo(new StringBuilder()).toString(),
          is("Semantic error: Identity block missing required 'id' field "
              + "at 2:16"));
    }
  }

  @Test void testValidatorIsReusable() {
    final Ast.Program program =
        Compiles.parse("FAMILY \"F\" {\n" + TWO_OUTLETS + "}");
    final Validator validator = Validator.create();
    final ValidationResult result1 = validator.validate(program);
    final ValidationResult result2 = validator.validate(program);
    assertThat(result1.issues, is(result2.issues));
    assertThat(result2.totalConstructs, is(1));
  }

  @Test void testBusinessRules() {
    final Validator validator =
        new Validator(Integer.MAX_VALUE) {
          @Override protected void checkBusinessRules(Ast.Program program) {
            for (Ast.Decl decl : program.decls) {
              if (decl instanceof Ast.FamilyDecl
                  && ((Ast.FamilyDecl) decl).name.isEmpty()) {
                warning("FAMILY_UNNAMED", "Family has no name", decl.pos,
                    null);
              }
            }
          }
        };
    final ValidationResult result =
        validator.validate(Compiles.parse("FAMILY \"\" { }"));
    final ValidationIssue issue = issue(result, "FAMILY_UNNAMED");
    assertThat(issue.contextPath, is("Program > BusinessRules"));
    assertThat(issue.suggestion, nullValue());
  }

  @Test void testMediaFixture() {
    final ValidationResult result = resource("media.mdsl").validate();
    assertThat(result.toString(), result.issues, hasSize(0));
    assertThat(result.totalConstructs, is(5));
  }
}

// End ValidatorTest.java
