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

import net.hydromatic.mdsl.compile.Prop;

import org.junit.jupiter.api.Test;

import static net.hydromatic.mdsl.Matchers.containsTimes;
import static net.hydromatic.mdsl.Mdsl.mdsl;
import static net.hydromatic.mdsl.Mdsl.resource;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests {@link CypherGenerator}. */
public class CypherGeneratorTest {
  private static String cypher(String source) {
    return mdsl(source).generate(Prop.Target.CYPHER);
  }

  private static String fixture() {
    return resource("media.mdsl").generate(Prop.Target.CYPHER);
  }

  @Test void testHeaderAndConstraints() {
    final String cypher = cypher("");
    assertThat(cypher,
        startsWith("// Generated Cypher from MediaLanguage DSL\n"
            + "// This file contains CREATE statements for a property "
            + "graph database\n"));
    assertThat(cypher,
        containsString("// CONSTRAINTS AND INDEXES\n\n"
            + "CREATE CONSTRAINT outlet_id_unique IF NOT EXISTS "
            + "FOR (o:Outlet) REQUIRE o.id IS UNIQUE;\n"));
    assertThat(cypher,
        containsString("CREATE INDEX family_name_index IF NOT EXISTS "
            + "FOR (f:Family) ON (f.name);\n"));
    assertThat(cypher, containsTimes("CREATE CONSTRAINT ", 4));
    assertThat(cypher, containsTimes("CREATE INDEX ", 4));
    assertThat(cypher, not(containsString("// RELATIONSHIPS")));
    assertThat(cypher, not(containsString("// MARKET DATA")));
  }

  @Test void testProps() {
    assertThat(CypherGenerator.props(), is("{}"));
    assertThat(CypherGenerator.props("a", "1", "b", "'x'"),
        is("{a: 1, b: 'x'}"));
  }

  /** CURRENT becomes a date far in the future. */
  @Test void testLifecycleCurrent() {
    final String cypher =
        cypher("FAMILY \"F\" {\n"
            + "  OUTLET \"O\" {\n"
            + "    identity { id = 1; }\n"
            + "    lifecycle {\n"
            + "      status \"active\" from \"1959-01-01\" to current {\n"
            + "        precision_start = \"known\";\n"
            + "      }\n"
            + "    }\n"
            + "  }\n"
            + "}");
    assertThat(cypher,
        containsString("MATCH (o:Outlet {id: 1}) "
            + "CREATE (o)-[:HAS_LIFECYCLE]->(:Lifecycle "
            + "{status: 'active', start_date: date('1959-01-01'), "
            + "end_date: date('9999-01-01'), precision_start: 'known', "
            + "precision_end: null, comment: null});\n"));
  }

  /** Every key becomes a string, whether it was a number or a
   * string. */
  @Test void testVocabulary() {
    final String cypher = cypher("VOCABULARY V { 1: \"A\", \"x\": \"B\" }");
    assertThat(cypher,
        containsString("// Vocabulary: V\n"
            + "CREATE (v:Vocabulary {name: 'V', body_name: 'V'});\n"
            + "MATCH (v:Vocabulary {name: 'V'}) "
            + "CREATE (v)-[:HAS_ENTRY]->"
            + "(:VocabularyEntry {key: '1', value: 'A'});\n"
            + "MATCH (v:Vocabulary {name: 'V'}) "
            + "CREATE (v)-[:HAS_ENTRY]->"
            + "(:VocabularyEntry {key: 'x', value: 'B'});\n"));
    assertThat(cypher, containsTimes(":VocabularyEntry ", 2));
  }

  @Test void testEscape() {
    final String cypher =
        cypher("FAMILY \"O'Brien\" {\n"
            + "  OUTLET \"a\\\\b\" { identity { id = 1; } }\n"
            + "}");
    assertThat(cypher,
        containsString("CREATE (f:Family {name: 'O\\'Brien', "
            + "comment: null});\n"));
    assertThat(cypher,
        containsString("CREATE (o:Outlet {id: 1, name: 'a\\\\b'});\n"));
  }

  /** Each outlet node is created once; everything else refers to it. */
  @Test void testFixtureOutlets() {
    final String cypher = fixture();
    assertThat(cypher, containsTimes("CREATE (o:Outlet ", 2));
    assertThat(cypher,
        containsString("CREATE (f:Family {name: 'Standard Group', "
            + "comment: 'Austrian quality press'});\n"));
    assertThat(cypher,
        containsString("// Outlet: Der Standard\n"
            + "CREATE (o:Outlet {id: 200001, name: 'Der Standard'});\n"
            + "MATCH (f:Family {name: 'Standard Group'}), "
            + "(o:Outlet {id: 200001}) CREATE (f)-[:HAS_OUTLET]->(o);\n"));
    assertThat(cypher,
        containsString("MATCH (o:Outlet {id: 200001}) "
            + "CREATE (o)-[:HAS_CHARACTERISTIC]->(:Characteristic "
            + "{name: 'language', value: '$default_language'});\n"));
    assertThat(cypher,
        containsString("MATCH (o:Outlet {id: 200001}) "
            + "CREATE (o)-[:HAS_CHARACTERISTIC]->(:Characteristic "
            + "{name: 'local', value: 0});\n"));
    assertThat(cypher,
        containsString("MATCH (o:Outlet {id: 200001}), "
            + "(t:Template {name: 'Daily Newspaper'}) "
            + "CREATE (o)-[:EXTENDS_TEMPLATE]->(t);\n"));
    assertThat(cypher,
        containsString("MATCH (o:Outlet {id: 200002}), "
            + "(b:Outlet {id: 200001}) CREATE (o)-[:BASED_ON]->(b);\n"));
    assertThat(cypher,
        containsString("CREATE (t:Template {name: 'Daily Newspaper', "
            + "template_type: 'OUTLET'});\n"
            + "MATCH (t:Template {name: 'Daily Newspaper'}) "
            + "CREATE (t)-[:HAS_CHARACTERISTIC]->(:Characteristic "
            + "{name: 'sector', value: 10});\n"));
  }

  @Test void testFixtureRelationships() {
    final String cypher = fixture();
    assertThat(cypher,
        containsString("// RELATIONSHIPS\n"
            + "MATCH (pred:Outlet {id: 200001}), "
            + "(succ:Outlet {id: 200002}) "
            + "CREATE (pred)-[:DIACHRONIC_LINK {name: 'online_offshoot', "
            + "relationship_type: 'offshoot', "
            + "event_start_date: date('1995-02-02'), "
            + "event_end_date: date('1995-02-02'), comment: null, "
            + "maps_to: null}]->(succ);\n"));
    assertThat(cypher,
        containsString("MATCH (o1:Outlet {id: 200001}), "
            + "(o2:Outlet {id: 200002}) "
            + "CREATE (o1)-[:SYNCHRONOUS_LINK {name: 'umbrella', "
            + "relationship_type: 'umbrella', outlet_1_role: 'parent', "
            + "outlet_2_role: 'child', period_start: date('1995-02-02'), "
            + "period_end: date('9999-01-01'), details: 'Same newsroom', "
            + "maps_to: null}]->(o2);\n"));
  }

  @Test void testFixtureData() {
    final String cypher = fixture();
    assertThat(cypher,
        containsString("MATCH (o:Outlet {id: 200001}) "
            + "CREATE (o)-[:HAS_AGGREGATION]->(:DataAggregation "
            + "{name: 'circulation', value: 'yearly'});\n"));
    assertThat(cypher,
        containsString("MATCH (o:Outlet {id: 200001}) "
            + "CREATE (o)-[:HAS_DATA]->(d:MarketData {year: 2019, "
            + "outlet_id: 200001, comment: 'audited', maps_to: null})\n"
            + "CREATE (d)-[:HAS_METRIC]->(:Metric {name: 'circulation', "
            + "value: 65000, unit: 'copies', source: 'OAK', comment: null})\n"
            + "CREATE (d)-[:HAS_METRIC]->(:Metric {name: 'reach_national', "
            + "value: 4.5, unit: 'percent', source: 'MA', comment: null})\n"
            + "CREATE (d)-[:HAS_METRIC]->(:Metric {name: 'page_views', "
            + "value: 12, unit: 'millions', source: 'OWA', "
            + "comment: null});\n"));
    assertThat(cypher, containsTimes(":Metric {", 3));
    assertThat(cypher, not(containsString("MATCH (d:MarketData")));
  }

  /** Two data blocks for the same outlet and year each get their own
   * MarketData node, and each node gets only its own metrics. */
  @Test void testDataSameYearTwice() {
    final String block = "DATA FOR 1 {\n"
        + "  year 2020 {\n"
        + "    metrics {\n"
        + "      circulation = { value = 10; unit = \"copies\"; "
        + "source = \"X\"; };\n"
        + "    }\n"
        + "  }\n"
        + "}\n";
    final String cypher = cypher("FAMILY \"F\" {\n"
        + "  OUTLET \"O\" { identity { id = 1; } }\n"
        + "}\n" + block + block);
    final String statement = "MATCH (o:Outlet {id: 1}) "
        + "CREATE (o)-[:HAS_DATA]->(d:MarketData {year: 2020, "
        + "outlet_id: 1, comment: null, maps_to: null})\n"
        + "CREATE (d)-[:HAS_METRIC]->(:Metric {name: 'circulation', "
        + "value: 10, unit: 'copies', source: 'X', comment: null});\n";
    assertThat(cypher, containsString(statement + statement));
    assertThat(cypher, containsTimes(":Metric {", 2));
  }

  @Test void testFixtureEvents() {
    final String cypher = fixture();
    assertThat(cypher,
        containsString("// EVENTS\n"
            + "CREATE (e:Event {name: 'acquisition', "
            + "event_type: 'acquisition', date: date('2020-01-01'), "
            + "status: 'completed'})\n"
            + "CREATE (e)-[:HAS_ENTITY]->(:EventEntity {name: 'buyer', "
            + "id: 200001, role: 'acquirer', stake_before: null, "
            + "stake_after: 51})\n"
            + "CREATE (e)-[:HAS_IMPACT]->(:EventImpact "
            + "{name: 'employees', value: 450})\n"
            + "CALL { WITH e MATCH (o:Outlet {id: 200001}) "
            + "CREATE (e)-[:INVOLVES {role: 'acquirer'}]->(o) };\n"));
    assertThat(cypher, not(containsString("MATCH (e:Event")));
  }

  /** Text that is copied into a comment cannot end the comment. */
  @Test void testLineBreakInComment() {
    final String cypher =
        cypher("LET note = \"line1\\nMATCH (n) DETACH DELETE n;\";\n"
            + "FAMILY \"F\\r\\nMATCH (n) DELETE n;\" {\n"
            + "  OUTLET \"O\\nX\" { identity { id = 1; } }\n"
            + "}\n");
    assertThat(cypher,
        containsString("// LET note = "
            + "\"line1\\nMATCH (n) DETACH DELETE n;\"\n"));
    assertThat(cypher,
        containsString("// Family: F\\nMATCH (n) DELETE n;\n"));
    assertThat(cypher, containsString("// Outlet: O\\nX\n"));
    assertThat(cypher, not(containsString("\nMATCH (n)")));
  }

  /** An event dated CURRENT happens today. */
  @Test void testEventCurrent() {
    final String cypher =
        cypher("EVENT e { type = \"merger\"; date = CURRENT; }");
    assertThat(cypher,
        containsString("CREATE (e:Event {name: 'e', event_type: 'merger', "
            + "date: date(), status: null});\n"));
  }
}

// End CypherGeneratorTest.java
