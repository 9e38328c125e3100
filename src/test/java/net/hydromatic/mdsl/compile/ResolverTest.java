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

import org.junit.jupiter.api.Test;

import static net.hydromatic.mdsl.Mdsl.mdsl;
import static net.hydromatic.mdsl.Mdsl.resource;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

/** Tests {@link Resolver}, which converts a parse tree to IR. */
public class ResolverTest {
  @Test void testLifecycleCurrent() {
    final Ir.Program ir =
        mdsl("FAMILY \"F\" {\n"
            + "  OUTLET \"O\" {\n"
            + "    identity { id = 1; title = \"O\"; }\n"
            + "    lifecycle {\n"
            + "      status \"active\" from \"1959-01-01\" to current {\n"
            + "        precision_start = \"known\";\n"
            + "        comment = \"still running\";\n"
            + "      }\n"
            + "      status \"planned\" from \"1958-06-01\"\n"
            + "    }\n"
            + "  }\n"
            + "}").ir();
    final Ir.Outlet outlet = ir.outlets().get(0);
    assertThat(outlet.statuses(), hasSize(2));
    final Ir.LifecycleStatus active = outlet.statuses().get(0);
    assertThat(active.status, is("active"));
    assertThat(active.startDate, is("1959-01-01"));
    assertThat(active.endDate, is("CURRENT"));
    assertThat(active.endDate, is(Resolver.CURRENT));
    assertThat(active.precisionStart, is("known"));
    assertThat(active.precisionEnd, nullValue());
    assertThat(active.comment, is("still running"));
    assertThat(outlet.statuses().get(1).endDate, nullValue());
  }

  /** A number that is not a valid outlet ID is not truncated. */
  @Test void testInvalidOutletId() {
    final Ir.Program ir =
        mdsl("FAMILY \"F\" {\n"
            + "  OUTLET \"O\" { identity { id = 7.9; } }\n"
            + "  DIACHRONIC_LINK l { predecessor = 7.9; "
            + "successor = 10000000000; }\n"
            + "}").ir();
    assertThat(ir.outlets().get(0).id, nullValue());
    final Ir.Diachronic link = (Ir.Diachronic) ir.relationships().get(0);
    assertThat(link.predecessor, is(0));
    assertThat(link.successor, is(0));
  }

  @Test void testOutlet() {
    final Ir.Program ir =
        mdsl("FAMILY \"F\" {\n"
            + "  // the first comment\n"
            + "  // the second comment\n"
            + "  OUTLET \"A\" EXTENDS TEMPLATE \"T\" {\n"
            + "    identity { id = 7; title = \"A\"; }\n"
            + "    characteristics { language = $lang; sector = 10; }\n"
            + "  }\n"
            + "  OUTLET \"B\" BASED_ON 7 { id = 8; }\n"
            + "  OUTLET \"C\" { characteristics { sector = 1; } }\n"
            + "  OUTLET_REF 9 \"D\"\n"
            + "}").ir();
    assertThat(ir.families, hasSize(1));
    final Ir.Family family = ir.families.get(0);
    assertThat(family.comment, is("the first comment"));
    assertThat(family.outlets, hasSize(3));

    final Ir.Outlet a = family.outlets.get(0);
    assertThat(a.id, is(7));
    assertThat(a.templateRef, is("T"));
    assertThat(a.baseRef, nullValue());
    final Ir.FieldBlock characteristics =
        a.fieldBlocks(Ir.BlockKind.CHARACTERISTICS).get(0);
    assertThat(Ir.find(characteristics.fields, "language"),
        instanceOf(Ir.VarRef.class));
    assertThat(
        Ir.findText(a.fieldBlocks(Ir.BlockKind.CHARACTERISTICS), "sector"),
        is("10"));

    final Ir.Outlet b = family.outlets.get(1);
    assertThat(b.id, is(8));
    assertThat(b.baseRef, is(7));
    assertThat(b.templateRef, nullValue());

    // an outlet without identity has no ID
    final Ir.Outlet c = family.outlets.get(2);
    assertThat(c.id, nullValue());
    assertThat(c.idOrZero(), is(0));
  }

  @Test void testDateRangeAndArray() {
    final Ir.Outlet outlet =
        mdsl("FAMILY \"F\" {\n"
            + "  OUTLET \"O\" {\n"
            + "    identity { id = 1; valid = \"2000-01-01\" TO CURRENT; }\n"
            + "    metadata {\n"
            + "      editors = [{ name = \"A\"; }, { name = \"B\"; }];\n"
            + "      founded = \"1900-01-01\";\n"
            + "    }\n"
            + "  }\n"
            + "}").ir().outlets().get(0);
    final Ir.Expr valid =
        Ir.find(outlet.fieldBlocks(Ir.BlockKind.IDENTITY).get(0).fields,
            "valid");
    assertThat(valid, instanceOf(Ir.ObjectExpr.class));
    final Ir.ObjectExpr range = (Ir.ObjectExpr) valid;
    assertThat(range.fields, hasSize(2));
    assertThat(((Ir.Literal) Ir.find(range.fields, "from")).value,
        is((Object) "2000-01-01"));
    assertThat(((Ir.Literal) Ir.find(range.fields, "to")).value,
        is((Object) "CURRENT"));

    final Ir.FieldBlock metadata =
        outlet.fieldBlocks(Ir.BlockKind.METADATA).get(0);
    final Ir.Expr editors = Ir.find(metadata.fields, "editors");
    assertThat(editors.kind, is(Ir.ExprKind.ARRAY));
    assertThat(((Ir.ArrayExpr) editors).elements, hasSize(2));
    assertThat(Ir.find(metadata.fields, "founded").kind,
        is(Ir.ExprKind.STRING));
  }

  @Test void testVocabulary() {
    final Ir.Program ir =
        mdsl("VOCABULARY SECTOR {\n"
            + "  sectors { 10: \"Daily\", 20: \"Radio\" }\n"
            + "  more { \"x\": \"Other\" }\n"
            + "}\n"
            + "VOCABULARY AREA { 1: \"National\" }").ir();
    assertThat(ir.vocabularies, hasSize(2));
    final Ir.Vocabulary sector = ir.vocabularies.get(0);
    assertThat(sector.bodyName, is("sectors"));
    assertThat(sector.entries, hasSize(3));
    assertThat(sector.entries.get(0).isNumericKey(), is(true));
    assertThat(sector.entries.get(0).keyString(), is("10"));
    assertThat(sector.entries.get(2).isNumericKey(), is(false));
    assertThat(sector.entries.get(2).keyString(), is("x"));
    assertThat(ir.vocabularies.get(1).bodyName, is("AREA"));
  }

  @Test void testTemplate() {
    final Ir.Program ir =
        mdsl("TEMPLATE OUTLET \"Daily\" {\n"
            + "  characteristics { sector = 10; }\n"
            + "  metadata { steward = \"archive\"; }\n"
            + "}\n"
            + "TEMPLATE \"Bare\" { }\n"
            + "TEMPLATE station \"Radio\" { }").ir();
    assertThat(ir.templates, hasSize(3));
    assertThat(ir.templates.get(0).templateType, is("OUTLET"));
    assertThat(ir.templates.get(0).blocks, hasSize(2));
    assertThat(ir.templates.get(1).templateType, is("OUTLET"));
    assertThat(ir.templates.get(2).templateType, is("STATION"));
  }

  @Test void testUnit() {
    final Ir.Unit unit =
        mdsl("UNIT U { id: ID PRIMARY KEY, n: TEXT(10) }").ir().units.get(0);
    assertThat(unit.name, is("U"));
    assertThat(unit.fields, hasSize(2));
    assertThat(unit.fields.get(0).primaryKey, is(true));
    assertThat(unit.fields.get(1).type.length, is(10));
  }

  @Test void testGlobalFamily() {
    final String source = "DIACHRONIC_LINK l {\n"
        + "  predecessor = 1;\n"
        + "  successor = 2;\n"
        + "  relationship_type = \"succession\";\n"
        + "}\n"
        + "DATA FOR 1 { year 2000 { } }";
    final Ir.Program ir = mdsl(source).ir();
    assertThat(ir.families, hasSize(1));
    final Ir.Family family = ir.families.get(0);
    assertThat(family.name, is("Global Relationships"));
    assertThat(family.comment, is(Resolver.GLOBAL_FAMILY_COMMENT));
    assertThat(family.outlets, hasSize(0));
    assertThat(family.relationships, hasSize(1));
    assertThat(family.dataBlocks, hasSize(1));

    final Ir.Program ir2 =
        mdsl(source).withProp(Prop.GLOBAL_FAMILY_NAME, "Loose").ir();
    assertThat(ir2.families.get(0).name, is("Loose"));
  }

  @Test void testTopLevelRelationshipJoinsFirstFamily() {
    final Ir.Program ir =
        mdsl("FAMILY \"F\" {\n"
            + "  OUTLET \"A\" { id = 1; }\n"
            + "  DIACHRONIC_LINK inner { predecessor = 1; successor = 1; }\n"
            + "}\n"
            + "FAMILY \"G\" { }\n"
            + "DIACHRONIC_LINK outer { predecessor = 1; successor = 1; }\n")
            .ir();
    assertThat(ir.families, hasSize(2));
    final Ir.Family first = ir.families.get(0);
    assertThat(first.name, is("F"));
    assertThat(first.relationships, hasSize(2));
    assertThat(first.relationships.get(0).name, is("inner"));
    assertThat(first.relationships.get(1).name, is("outer"));
    assertThat(first.outlets, hasSize(1));
    assertThat(ir.families.get(1).relationships, hasSize(0));
  }

  @Test void testSynchronousPeriod() {
    final Ir.Program ir =
        mdsl("SYNCHRONOUS_LINK s {\n"
            + "  outlet_1 = { id = 1; role = \"parent\"; };\n"
            + "  relationship_type = \"umbrella\";\n"
            + "  period_start = \"2001-01-01\";\n"
            + "  period_end = current;\n"
            + "}").ir();
    final Ir.Synchronous s = (Ir.Synchronous) ir.relationships().get(0);
    assertThat(s.outlet1.id, is(1));
    assertThat(s.outlet1.role, is("parent"));
    // a missing outlet lowers to ID 0 with an empty role
    assertThat(s.outlet2.id, is(0));
    assertThat(s.outlet2.role, is(""));
    assertThat(s.periodStart, is("2001-01-01"));
    assertThat(s.periodEnd, is("CURRENT"));
    assertThat(s.details, nullValue());
  }

  @Test void testAnnotations() {
    final Ir.Program ir =
        mdsl("DATA FOR 1 {\n"
            + "  @maps_to \"mo_year\"\n"
            + "  year 2000 { }\n"
            + "}\n"
            + "DIACHRONIC_LINK l {\n"
            + "  @maps_to = \"11_succession\"\n"
            + "  @comment \"verified\"\n"
            + "  predecessor = 1;\n"
            + "  successor = 2;\n"
            + "}").ir();
    assertThat(ir.dataBlocks().get(0).mapsTo, is("mo_year"));
    final Ir.Diachronic d = (Ir.Diachronic) ir.relationships().get(0);
    assertThat(d.mapsTo, is("11_succession"));
    assertThat(d.comment, is("verified"));
    assertThat(d.relationshipType, is(""));
    assertThat(d.eventStartDate, nullValue());
  }

  @Test void testMediaFixture() {
    final Ir.Program ir = resource("media.mdsl").ir();
    assertThat(ir.imports, hasSize(1));
    assertThat(ir.imports.get(0).path, is("shared/vocabularies.mdsl"));
    assertThat(ir.variables, hasSize(1));
    assertThat(ir.variables.get(0).name, is("default_language"));
    assertThat(((Ir.Literal) ir.variables.get(0).value).asText(), is("de"));
    assertThat(ir.units.get(0).fields, hasSize(5));
    assertThat(ir.vocabularies, hasSize(2));
    assertThat(ir.templates, hasSize(1));

    final Ir.Family family = ir.families.get(0);
    assertThat(family.name, is("Standard Group"));
    assertThat(family.comment, is("Austrian quality press"));
    assertThat(family.outlets, hasSize(2));
    assertThat(family.outlets.get(0).id, is(200001));
    assertThat(family.outlets.get(0).templateRef, is("Daily Newspaper"));
    assertThat(family.outlets.get(1).baseRef, is(200001));

    final Ir.Diachronic diachronic =
        (Ir.Diachronic) family.relationships.get(0);
    assertThat(diachronic.predecessor, is(200001));
    assertThat(diachronic.successor, is(200002));
    assertThat(diachronic.relationshipType, is("offshoot"));
    assertThat(diachronic.eventStartDate, is("1995-02-02"));
    assertThat(diachronic.eventEndDate, is("1995-02-02"));

    final Ir.Synchronous synchronous =
        (Ir.Synchronous) family.relationships.get(1);
    assertThat(synchronous.outlet2.role, is("child"));
    assertThat(synchronous.periodEnd, is("CURRENT"));
    assertThat(synchronous.details, is("Same newsroom"));

    final Ir.DataBlock data = family.dataBlocks.get(0);
    assertThat(data.outletId, is(200001));
    assertThat(data.aggregations.get(0).name, is("circulation"));
    assertThat(data.aggregations.get(0).value, is("yearly"));
    final Ir.DataYear year = data.years.get(0);
    assertThat(year.year, is(2019));
    assertThat(year.comment, is("audited"));
    assertThat(year.metrics, hasSize(3));
    final Ir.Metric reach = year.metrics.get(1);
    assertThat(reach.name, is("reach_national"));
    assertThat(reach.value, is(4.5d));
    assertThat(reach.unit, is("percent"));
    assertThat(reach.source, is("MA"));

    final Ir.Event event = ir.events.get(0);
    assertThat(event.name, is("acquisition"));
    assertThat(event.eventType, is("acquisition"));
    assertThat(event.date, is("2020-01-01"));
    assertThat(event.status, is("completed"));
    assertThat(event.entities, hasSize(1));
    final Ir.EventEntity buyer = event.entities.get(0);
    assertThat(buyer.name, is("buyer"));
    assertThat(buyer.id, is(200001));
    assertThat(buyer.role, is("acquirer"));
    assertThat(buyer.stakeBefore, nullValue());
    assertThat(buyer.stakeAfter, is(51d));
    assertThat(event.impact.get(0).name, is("employees"));
  }
}

// End ResolverTest.java
