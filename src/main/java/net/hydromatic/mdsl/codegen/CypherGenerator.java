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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static net.hydromatic.mdsl.codegen.Generators.comment;
import static net.hydromatic.mdsl.codegen.Generators.cypherDate;
import static net.hydromatic.mdsl.codegen.Generators.cypherString;
import static net.hydromatic.mdsl.codegen.Generators.cypherValue;
import static net.hydromatic.mdsl.codegen.Generators.isCurrent;
import static net.hydromatic.mdsl.util.Static.formatNumber;

/** Generates a Cypher script that builds a property graph.
 *
 * <p>Each outlet is created exactly once, as an {@code Outlet} node
 * keyed by its id. Other statements attach nodes and edges to nodes
 * created earlier, by matching on a key that a constraint makes unique;
 * so the statements must run in order. {@code MarketData} and
 * {@code Event} nodes have no such key, so each is created in the same
 * statement as the nodes that hang off it. */
public class CypherGenerator implements Generator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(CypherGenerator.class);

  @Override public String generate(Ir.Program program) {
    final StringBuilder buf = new StringBuilder();
    buf.append("// Generated Cypher from MediaLanguage DSL\n")
        .append("// This file contains CREATE statements for a property "
            + "graph database\n")
        .append("// Represents media outlets, families, and relationships "
            + "as a graph\n\n");

    if (!program.imports.isEmpty()) {
      buf.append("// IMPORTS\n");
      program.imports.forEach(i ->
          buf.append("// IMPORT \"").append(comment(i.path)).append("\"\n"));
      buf.append("\n");
    }
    if (!program.variables.isEmpty()) {
      buf.append("// VARIABLES\n");
      program.variables.forEach(v ->
          buf.append("// LET ").append(v.name).append(" = ")
              .append(comment(v.value)).append("\n"));
      buf.append("\n");
    }

    constraints(buf);
    for (Ir.Vocabulary vocabulary : program.vocabularies) {
      vocabulary(buf, vocabulary);
      buf.append("\n");
    }
    for (Ir.Template template : program.templates) {
      template(buf, template);
      buf.append("\n");
    }
    for (Ir.Family family : program.families) {
      family(buf, family);
      buf.append("\n");
    }
    relationships(buf, program);
    data(buf, program);
    events(buf, program);
    LOGGER.debug("Generated Cypher for {} outlets, {} relationships",
        program.outlets().size(), program.relationships().size());
    return buf.toString();
  }

  private static void constraints(StringBuilder buf) {
    buf.append("// CONSTRAINTS AND INDEXES\n\n");
    constraint(buf, "outlet_id_unique", "o", "Outlet", "id");
    constraint(buf, "family_name_unique", "f", "Family", "name");
    constraint(buf, "template_name_unique", "t", "Template", "name");
    constraint(buf, "vocabulary_name_unique", "v", "Vocabulary", "name");
    buf.append("\n");
    index(buf, "outlet_name_index", "o", "Outlet", "name");
    index(buf, "family_name_index", "f", "Family", "name");
    index(buf, "market_data_year_index", "d", "MarketData", "year");
    index(buf, "metric_name_index", "m", "Metric", "name");
    buf.append("\n");
  }

  private static void constraint(StringBuilder buf, String name,
      String alias, String label, String property) {
    buf.append("CREATE CONSTRAINT ").append(name)
        .append(" IF NOT EXISTS FOR (").append(alias).append(':')
        .append(label).append(") REQUIRE ").append(alias).append('.')
        .append(property).append(" IS UNIQUE;\n");
  }

  private static void index(StringBuilder buf, String name, String alias,
      String label, String property) {
    buf.append("CREATE INDEX ").append(name)
        .append(" IF NOT EXISTS FOR (").append(alias).append(':')
        .append(label).append(") ON (").append(alias).append('.')
        .append(property).append(");\n");
  }

  /** Formats a property map; arguments are alternating keys and
   * values, the values already in Cypher syntax. */
  static String props(String... keyValues) {
    final StringBuilder b = new StringBuilder("{");
    for (int i = 0; i < keyValues.length; i += 2) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(keyValues[i]).append(": ").append(keyValues[i + 1]);
    }
    return b.append('}').toString();
  }

  private static String outletKey(int id) {
    return "(o:Outlet {id: " + id + "})";
  }

  /** Appends a statement that creates a node and links it to an existing
   * node. */
  private static void child(StringBuilder buf, String match,
      String alias, String edge, String label, String props) {
    buf.append("MATCH ").append(match).append(" CREATE (").append(alias)
        .append(")-[:").append(edge).append("]->(:").append(label)
        .append(' ').append(props).append(");\n");
  }

  /** Appends a clause, continuing the current statement, that creates a
   * node and links it to the node bound to {@code alias}. */
  private static void link(StringBuilder buf, String alias, String edge,
      String label, String props) {
    buf.append("\nCREATE (").append(alias).append(")-[:").append(edge)
        .append("]->(:").append(label).append(' ').append(props)
        .append(")");
  }

  private static void vocabulary(StringBuilder buf,
      Ir.Vocabulary vocabulary) {
    final String name = cypherString(vocabulary.name);
    buf.append("// Vocabulary: ").append(comment(vocabulary.name)).append("\n")
        .append("CREATE (v:Vocabulary ")
        .append(props("name", name,
            "body_name", cypherString(vocabulary.bodyName)))
        .append(");\n");
    for (Ir.VocabEntry entry : vocabulary.entries) {
      child(buf, "(v:Vocabulary {name: " + name + "})", "v", "HAS_ENTRY",
          "VocabularyEntry",
          props("key", cypherString(entry.keyString()),
              "value", cypherString(entry.value)));
    }
  }

  private static void template(StringBuilder buf, Ir.Template template) {
    final String name = cypherString(template.name);
    final String match = "(t:Template {name: " + name + "})";
    buf.append("// Template: ").append(comment(template.name)).append("\n")
        .append("CREATE (t:Template ")
        .append(props("name", name,
            "template_type", cypherString(template.templateType)))
        .append(");\n");
    for (Ir.FieldBlock block : template.blocks) {
      fields(buf, match, "t", block);
    }
  }

  /** Appends a child node for each field of a block. */
  private static void fields(StringBuilder buf, String match,
      String alias, Ir.FieldBlock block) {
    final String edge;
    final String label;
    switch (block.kind) {
    case IDENTITY:
      edge = "HAS_IDENTITY";
      label = "Identity";
      break;
    case CHARACTERISTICS:
      edge = "HAS_CHARACTERISTIC";
      label = "Characteristic";
      break;
    case METADATA:
      edge = "HAS_METADATA";
      label = "Metadata";
      break;
    default:
      throw new AssertionError(block.kind);
    }
    for (Ir.NamedValue field : block.fields) {
      child(buf, match, alias, edge, label,
          props("name", cypherString(field.name),
              "value", cypherValue(field.value)));
    }
  }

  private static void family(StringBuilder buf, Ir.Family family) {
    final String name = cypherString(family.name);
    buf.append("// Family: ").append(comment(family.name)).append("\n")
        .append("CREATE (f:Family ")
        .append(props("name", name, "comment", cypherString(family.comment)))
        .append(");\n");
    for (Ir.Outlet outlet : family.outlets) {
      outlet(buf, outlet, name);
    }
  }

  private static void outlet(StringBuilder buf, Ir.Outlet outlet,
      String familyName) {
    final int id = outlet.idOrZero();
    final String match = outletKey(id);
    buf.append("// Outlet: ").append(comment(outlet.name)).append("\n")
        .append("CREATE (o:Outlet ")
        .append(props("id", Integer.toString(id),
            "name", cypherString(outlet.name)))
        .append(");\n")
        .append("MATCH (f:Family {name: ").append(familyName)
        .append("}), ").append(match)
        .append(" CREATE (f)-[:HAS_OUTLET]->(o);\n");
    for (Ir.OutletBlock block : outlet.blocks) {
      if (block instanceof Ir.LifecycleBlock) {
        for (Ir.LifecycleStatus status
            : ((Ir.LifecycleBlock) block).statuses) {
          child(buf, match, "o", "HAS_LIFECYCLE", "Lifecycle",
              props("status", cypherString(status.status),
                  "start_date", cypherDate(status.startDate),
                  "end_date", cypherDate(status.endDate),
                  "precision_start", cypherString(status.precisionStart),
                  "precision_end", cypherString(status.precisionEnd),
                  "comment", cypherString(status.comment)));
        }
      } else {
        fields(buf, match, "o", (Ir.FieldBlock) block);
      }
    }
    if (outlet.templateRef != null) {
      buf.append("MATCH ").append(match).append(", (t:Template {name: ")
          .append(cypherString(outlet.templateRef))
          .append("}) CREATE (o)-[:EXTENDS_TEMPLATE]->(t);\n");
    }
    if (outlet.baseRef != null) {
      buf.append("MATCH ").append(match).append(", (b:Outlet {id: ")
          .append(outlet.baseRef)
          .append("}) CREATE (o)-[:BASED_ON]->(b);\n");
    }
  }

  private static void relationships(StringBuilder buf,
      Ir.Program program) {
    final List<Ir.Relationship> relationships = program.relationships();
    if (relationships.isEmpty()) {
      return;
    }
    buf.append("// RELATIONSHIPS\n");
    for (Ir.Relationship relationship : relationships) {
      if (relationship instanceof Ir.Diachronic) {
        final Ir.Diachronic d = (Ir.Diachronic) relationship;
        buf.append("MATCH (pred:Outlet {id: ").append(d.predecessor)
            .append("}), (succ:Outlet {id: ").append(d.successor)
            .append("}) CREATE (pred)-[:DIACHRONIC_LINK ")
            .append(
                props("name", cypherString(d.name),
                    "relationship_type", cypherString(d.relationshipType),
                    "event_start_date", cypherDate(d.eventStartDate),
                    "event_end_date", cypherDate(d.eventEndDate),
                    "comment", cypherString(d.comment),
                    "maps_to", cypherString(d.mapsTo)))
            .append("]->(succ);\n");
      } else {
        final Ir.Synchronous s = (Ir.Synchronous) relationship;
        buf.append("MATCH (o1:Outlet {id: ").append(s.outlet1.id)
            .append("}), (o2:Outlet {id: ").append(s.outlet2.id)
            .append("}) CREATE (o1)-[:SYNCHRONOUS_LINK ")
            .append(
                props("name", cypherString(s.name),
                    "relationship_type", cypherString(s.relationshipType),
                    "outlet_1_role", cypherString(s.outlet1.role),
                    "outlet_2_role", cypherString(s.outlet2.role),
                    "period_start", cypherDate(s.periodStart),
                    "period_end", cypherDate(s.periodEnd),
                    "details", cypherString(s.details),
                    "maps_to", cypherString(s.mapsTo)))
            .append("]->(o2);\n");
      }
    }
    buf.append("\n");
  }

  private static void data(StringBuilder buf, Ir.Program program) {
    final List<Ir.DataBlock> dataBlocks = program.dataBlocks();
    if (dataBlocks.isEmpty()) {
      return;
    }
    buf.append("// MARKET DATA\n");
    for (Ir.DataBlock data : dataBlocks) {
      final String match = outletKey(data.outletId);
      for (Ir.Aggregation aggregation : data.aggregations) {
        child(buf, match, "o", "HAS_AGGREGATION", "DataAggregation",
            props("name", cypherString(aggregation.name),
                "value", cypherString(aggregation.value)));
      }
      for (Ir.DataYear year : data.years) {
        buf.append("MATCH ").append(match)
            .append(" CREATE (o)-[:HAS_DATA]->(d:MarketData ")
            .append(
                props("year", Integer.toString(year.year),
                    "outlet_id", Integer.toString(data.outletId),
                    "comment", cypherString(year.comment),
                    "maps_to", cypherString(data.mapsTo)))
            .append(")");
        for (Ir.Metric metric : year.metrics) {
          link(buf, "d", "HAS_METRIC", "Metric",
              props("name", cypherString(metric.name),
                  "value", formatNumber(metric.value),
                  "unit", cypherString(metric.unit),
                  "source", cypherString(metric.source),
                  "comment", cypherString(metric.comment)));
        }
        buf.append(";\n");
      }
    }
    buf.append("\n");
  }

  private static void events(StringBuilder buf, Ir.Program program) {
    if (program.events.isEmpty()) {
      return;
    }
    buf.append("// EVENTS\n");
    for (Ir.Event event : program.events) {
      buf.append("CREATE (e:Event ")
          .append(
              props("name", cypherString(event.name),
                  "event_type", cypherString(event.eventType),
                  "date", isCurrent(event.date)
                      ? "date()" : cypherDate(event.date),
                  "status", cypherString(event.status)))
          .append(")");
      for (Ir.EventEntity entity : event.entities) {
        link(buf, "e", "HAS_ENTITY", "EventEntity",
            props("name", cypherString(entity.name),
                "id", Integer.toString(entity.id),
                "role", cypherString(entity.role),
                "stake_before", number(entity.stakeBefore),
                "stake_after", number(entity.stakeAfter)));
      }
      for (Ir.NamedValue impact : event.impact) {
        link(buf, "e", "HAS_IMPACT", "EventImpact",
            props("name", cypherString(impact.name),
                "value", cypherValue(impact.value)));
      }
      for (Ir.NamedValue metadata : event.metadata) {
        link(buf, "e", "HAS_METADATA", "EventMetadata",
            props("name", cypherString(metadata.name),
                "value", cypherValue(metadata.value)));
      }
      // A missing outlet must not stop the remaining links
      for (Ir.EventEntity entity : event.entities) {
        buf.append("\nCALL { WITH e MATCH ").append(outletKey(entity.id))
            .append(" CREATE (e)-[:INVOLVES ")
            .append(props("role", cypherString(entity.role)))
            .append("]->(o) }");
      }
      buf.append(";\n");
    }
    buf.append("\n");
  }

  private static String number(@Nullable Double d) {
    return d == null ? "null" : formatNumber(d);
  }
}

// End CypherGenerator.java
