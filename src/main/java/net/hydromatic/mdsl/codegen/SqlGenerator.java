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

import net.hydromatic.mdsl.ast.FieldType;
import net.hydromatic.mdsl.ast.Ir;

import com.google.common.base.Joiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static net.hydromatic.mdsl.codegen.Generators.comment;
import static net.hydromatic.mdsl.codegen.Generators.createTable;
import static net.hydromatic.mdsl.codegen.Generators.sqlDate;
import static net.hydromatic.mdsl.codegen.Generators.sqlNumber;
import static net.hydromatic.mdsl.codegen.Generators.sqlString;
import static net.hydromatic.mdsl.codegen.Generators.text;
import static net.hydromatic.mdsl.util.Static.formatNumber;

/** Generates SQL for a generic, self-describing schema.
 *
 * <p>The script first creates the core tables (outlets, families,
 * templates, their attribute tables, relationships, market data and
 * events), then one table per {@code UNIT} and per {@code VOCABULARY},
 * then inserts a row for each construct of the program.
 *
 * <p>Attribute values are stored as text in name/value tables such as
 * {@code outlet_characteristics}. Rows that refer to a family, template
 * or relationship look up its id by name. */
public class SqlGenerator implements Generator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(SqlGenerator.class);

  private static final Joiner COLUMN_JOINER = Joiner.on(",\n");

  @Override public String generate(Ir.Program program) {
    final StringBuilder buf = new StringBuilder();
    buf.append("-- Generated SQL from MediaLanguage DSL\n")
        .append("-- This file contains CREATE TABLE statements, "
            + "INSERT statements, and constraints\n")
        .append("-- Generated for comprehensive media outlet and "
            + "relationship management\n\n");

    if (!program.imports.isEmpty()) {
      buf.append("-- IMPORTS\n");
      program.imports.forEach(i ->
          buf.append("-- IMPORT \"").append(comment(i.path)).append("\"\n"));
      buf.append("\n");
    }
    if (!program.variables.isEmpty()) {
      buf.append("-- VARIABLES\n");
      program.variables.forEach(v ->
          buf.append("-- LET ").append(v.name).append(" = ")
              .append(comment(v.value)).append("\n"));
      buf.append("\n");
    }

    coreSchema(buf);
    for (Ir.Unit unit : program.units) {
      unit(buf, unit);
      buf.append("\n");
    }
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
    marketData(buf, program);
    events(buf, program);
    LOGGER.debug("Generated SQL for {} units, {} families, {} events",
        program.units.size(), program.families.size(),
        program.events.size());
    return buf.toString();
  }

  private static void coreSchema(StringBuilder buf) {
    buf.append("-- CORE SCHEMA TABLES\n")
        .append("-- These tables support the MediaLanguage DSL "
            + "structure\n\n");
    createTable(buf, "", "media_outlets",
        "id INTEGER PRIMARY KEY",
        "name VARCHAR(255) NOT NULL",
        "family_id INTEGER",
        "template_id INTEGER",
        "base_outlet_id INTEGER",
        "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP",
        "updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP",
        "FOREIGN KEY (family_id) REFERENCES families(id)",
        "FOREIGN KEY (template_id) REFERENCES templates(id)",
        "FOREIGN KEY (base_outlet_id) REFERENCES media_outlets(id)");
    createTable(buf, "", "families",
        "id INTEGER PRIMARY KEY",
        "name VARCHAR(255) NOT NULL",
        "comment TEXT",
        "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP");
    createTable(buf, "", "templates",
        "id INTEGER PRIMARY KEY",
        "name VARCHAR(255) NOT NULL",
        "template_type VARCHAR(100) NOT NULL",
        "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP");
    attributeTable(buf, "outlet_identity", "outlet_id", "field",
        "media_outlets");
    createTable(buf, "", "outlet_lifecycle",
        "id INTEGER PRIMARY KEY",
        "outlet_id INTEGER NOT NULL",
        "status VARCHAR(100) NOT NULL",
        "start_date DATE",
        "end_date DATE",
        "precision_start VARCHAR(50)",
        "precision_end VARCHAR(50)",
        "comment TEXT",
        "FOREIGN KEY (outlet_id) REFERENCES media_outlets(id)");
    attributeTable(buf, "outlet_characteristics", "outlet_id",
        "characteristic", "media_outlets");
    attributeTable(buf, "outlet_metadata", "outlet_id", "metadata",
        "media_outlets");
    createTable(buf, "", "relationships",
        "id INTEGER PRIMARY KEY",
        "relationship_name VARCHAR(255) NOT NULL",
        "relationship_type VARCHAR(50) NOT NULL",
        "family_id INTEGER",
        "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP",
        "FOREIGN KEY (family_id) REFERENCES families(id)");
    createTable(buf, "", "diachronic_relationships",
        "id INTEGER PRIMARY KEY",
        "relationship_id INTEGER NOT NULL",
        "predecessor_id INTEGER NOT NULL",
        "successor_id INTEGER NOT NULL",
        "event_start_date DATE",
        "event_end_date DATE",
        "relationship_subtype VARCHAR(100)",
        "comment TEXT",
        "maps_to VARCHAR(255)",
        "FOREIGN KEY (relationship_id) REFERENCES relationships(id)",
        "FOREIGN KEY (predecessor_id) REFERENCES media_outlets(id)",
        "FOREIGN KEY (successor_id) REFERENCES media_outlets(id)");
    createTable(buf, "", "synchronous_relationships",
        "id INTEGER PRIMARY KEY",
        "relationship_id INTEGER NOT NULL",
        "outlet_1_id INTEGER NOT NULL",
        "outlet_1_role VARCHAR(100)",
        "outlet_2_id INTEGER NOT NULL",
        "outlet_2_role VARCHAR(100)",
        "relationship_subtype VARCHAR(100)",
        "period_start DATE",
        "period_end DATE",
        "details TEXT",
        "maps_to VARCHAR(255)",
        "FOREIGN KEY (relationship_id) REFERENCES relationships(id)",
        "FOREIGN KEY (outlet_1_id) REFERENCES media_outlets(id)",
        "FOREIGN KEY (outlet_2_id) REFERENCES media_outlets(id)");
    createTable(buf, "", "market_data",
        "id INTEGER PRIMARY KEY",
        "outlet_id INTEGER NOT NULL",
        "data_year INTEGER NOT NULL",
        "metric_name VARCHAR(100) NOT NULL",
        "metric_value DECIMAL(15,2)",
        "metric_unit VARCHAR(50)",
        "data_source VARCHAR(100)",
        "comment TEXT",
        "maps_to VARCHAR(255)",
        "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP",
        "FOREIGN KEY (outlet_id) REFERENCES media_outlets(id)");
    createTable(buf, "", "data_aggregation",
        "id INTEGER PRIMARY KEY",
        "outlet_id INTEGER NOT NULL",
        "aggregation_name VARCHAR(100) NOT NULL",
        "aggregation_value VARCHAR(100) NOT NULL",
        "FOREIGN KEY (outlet_id) REFERENCES media_outlets(id)");
    createTable(buf, "", "events",
        "id INTEGER PRIMARY KEY",
        "name VARCHAR(255) NOT NULL",
        "event_type VARCHAR(100) NOT NULL",
        "event_date DATE",
        "status VARCHAR(100)",
        "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP");
    createTable(buf, "", "event_entities",
        "id INTEGER PRIMARY KEY",
        "event_id INTEGER NOT NULL",
        "entity_name VARCHAR(255) NOT NULL",
        "entity_id INTEGER NOT NULL",
        "entity_role VARCHAR(100)",
        "stake_before DECIMAL(10,2)",
        "stake_after DECIMAL(10,2)",
        "FOREIGN KEY (event_id) REFERENCES events(id)",
        "FOREIGN KEY (entity_id) REFERENCES media_outlets(id)");
    attributeTable(buf, "event_impact", "event_id", "impact", "events");
    attributeTable(buf, "event_metadata", "event_id", "metadata",
        "events");
  }

  /** Creates a name/value table such as {@code outlet_metadata}. */
  private static void attributeTable(StringBuilder buf, String table,
      String owner, String prefix, String ownerTable) {
    createTable(buf, "", table,
        "id INTEGER PRIMARY KEY",
        owner + " INTEGER NOT NULL",
        prefix + "_name VARCHAR(100) NOT NULL",
        prefix + "_value TEXT",
        prefix + "_type VARCHAR(50) DEFAULT 'string'",
        "FOREIGN KEY (" + owner + ") REFERENCES " + ownerTable + "(id)");
  }

  private static void unit(StringBuilder buf, Ir.Unit unit) {
    buf.append("-- Table for unit: ").append(comment(unit.name)).append("\n")
        .append("CREATE TABLE ").append(tableName(unit.name))
        .append(" (\n");
    final List<String> columns = new ArrayList<>();
    for (Ir.Field field : unit.fields) {
      columns.add("    " + field.name + " " + sqlType(field.type)
          + (field.primaryKey ? " PRIMARY KEY NOT NULL" : ""));
    }
    COLUMN_JOINER.appendTo(buf, columns);
    buf.append("\n);\n");
  }

  /** Returns the SQL type of a field. */
  static String sqlType(FieldType type) {
    switch (type.kind) {
    case ID:
      return "INTEGER";
    case TEXT:
      return type.length == null ? "TEXT" : "VARCHAR(" + type.length + ")";
    case NUMBER:
      return "DECIMAL(15,2)";
    case BOOLEAN:
      return "BOOLEAN";
    case CATEGORY:
      return "VARCHAR(100)";
    default:
      throw new AssertionError(type.kind);
    }
  }

  private static String tableName(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  private static void vocabulary(StringBuilder buf,
      Ir.Vocabulary vocabulary) {
    final String table = tableName(vocabulary.name);
    buf.append("-- Vocabulary table: ")
        .append(comment(vocabulary.name))
        .append("\n");
    createTable(buf, "", table,
        "id INTEGER PRIMARY KEY",
        "code VARCHAR(50) NOT NULL",
        "description TEXT NOT NULL",
        "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP");
    buf.append("-- Insert vocabulary data for ")
        .append(comment(vocabulary.name))
        .append("\n");
    int i = 0;
    for (Ir.VocabEntry entry : vocabulary.entries) {
      buf.append("INSERT INTO ").append(table)
          .append(" (id, code, description) VALUES (").append(++i)
          .append(", ").append(sqlString(entry.keyString()))
          .append(", ").append(sqlString(entry.value)).append(");\n");
    }
  }

  private static void template(StringBuilder buf, Ir.Template template) {
    buf.append("-- Template: ").append(comment(template.name)).append("\n")
        .append("INSERT INTO templates (name, template_type) VALUES (")
        .append(sqlString(template.name)).append(", ")
        .append(sqlString(template.templateType)).append(");\n");
    for (Ir.FieldBlock block : template.blocks) {
      buf.append("-- Template ").append(comment(template.name))
          .append(block.kind == Ir.BlockKind.METADATA
              ? " metadata:\n" : " characteristics:\n");
      for (Ir.NamedValue field : block.fields) {
        buf.append("--   ").append(comment(field.name)).append(": ")
            .append(comment(field.value)).append("\n");
      }
    }
  }

  private static void family(StringBuilder buf, Ir.Family family) {
    buf.append("-- Family: ").append(comment(family.name)).append("\n")
        .append("INSERT INTO families (name, comment) VALUES (")
        .append(sqlString(family.name)).append(", ")
        .append(sqlString(family.comment)).append(");\n");
    for (Ir.Outlet outlet : family.outlets) {
      outlet(buf, outlet, family.name);
    }
  }

  private static void outlet(StringBuilder buf, Ir.Outlet outlet,
      String familyName) {
    final int id = outlet.idOrZero();
    buf.append("-- Outlet: ").append(comment(outlet.name)).append("\n")
        .append("INSERT INTO media_outlets (id, name, family_id, "
            + "template_id, base_outlet_id) VALUES (")
        .append(id).append(", ")
        .append(sqlString(outlet.name)).append(", ")
        .append(familyId(familyName)).append(", ")
        .append(outlet.templateRef == null ? "NULL"
            : "(SELECT id FROM templates WHERE name = "
                + sqlString(outlet.templateRef) + ")")
        .append(", ")
        .append(outlet.baseRef == null ? "NULL" : outlet.baseRef.toString())
        .append(");\n");
    for (Ir.OutletBlock block : outlet.blocks) {
      switch (block.kind) {
      case IDENTITY:
        attributes(buf, "outlet_identity", "outlet_id", "field", id,
            (Ir.FieldBlock) block);
        break;
      case CHARACTERISTICS:
        attributes(buf, "outlet_characteristics", "outlet_id",
            "characteristic", id, (Ir.FieldBlock) block);
        break;
      case METADATA:
        attributes(buf, "outlet_metadata", "outlet_id", "metadata", id,
            (Ir.FieldBlock) block);
        break;
      case LIFECYCLE:
        for (Ir.LifecycleStatus status
            : ((Ir.LifecycleBlock) block).statuses) {
          buf.append("INSERT INTO outlet_lifecycle (outlet_id, status, "
                  + "start_date, end_date, precision_start, precision_end, "
                  + "comment) VALUES (")
              .append(id).append(", ")
              .append(sqlString(status.status)).append(", ")
              .append(sqlDate(status.startDate)).append(", ")
              .append(sqlDate(status.endDate)).append(", ")
              .append(sqlString(status.precisionStart)).append(", ")
              .append(sqlString(status.precisionEnd)).append(", ")
              .append(sqlString(status.comment)).append(");\n");
        }
        break;
      default:
        throw new AssertionError(block.kind);
      }
    }
  }

  private static void attributes(StringBuilder buf, String table,
      String owner, String prefix, int ownerId, Ir.FieldBlock block) {
    attributes(buf, table, owner, prefix, ownerId, block.fields);
  }

  private static void attributes(StringBuilder buf, String table,
      String owner, String prefix, int ownerId,
      List<Ir.NamedValue> fields) {
    for (Ir.NamedValue field : fields) {
      buf.append("INSERT INTO ").append(table).append(" (")
          .append(owner).append(", ")
          .append(prefix).append("_name, ")
          .append(prefix).append("_value) VALUES (")
          .append(ownerId).append(", ")
          .append(sqlString(field.name)).append(", ")
          .append(sqlString(text(field.value))).append(");\n");
    }
  }

  private static String familyId(String familyName) {
    return "(SELECT id FROM families WHERE name = "
        + sqlString(familyName) + ")";
  }

  private static void relationships(StringBuilder buf,
      Ir.Program program) {
    buf.append("-- RELATIONSHIPS\n");
    for (Ir.Family family : program.families) {
      for (Ir.Relationship relationship : family.relationships) {
        final boolean diachronic = relationship instanceof Ir.Diachronic;
        buf.append("INSERT INTO relationships (relationship_name, "
                + "relationship_type, family_id) VALUES (")
            .append(sqlString(relationship.name)).append(", ")
            .append(diachronic ? "'diachronic'" : "'synchronous'")
            .append(", ").append(familyId(family.name)).append(");\n");
        final String relationshipId =
            "(SELECT id FROM relationships WHERE relationship_name = "
                + sqlString(relationship.name) + ")";
        if (diachronic) {
          final Ir.Diachronic d = (Ir.Diachronic) relationship;
          buf.append("INSERT INTO diachronic_relationships "
                  + "(relationship_id, predecessor_id, successor_id, "
                  + "event_start_date, event_end_date, "
                  + "relationship_subtype, comment, maps_to) VALUES (")
              .append(relationshipId).append(", ")
              .append(d.predecessor).append(", ")
              .append(d.successor).append(", ")
              .append(sqlDate(d.eventStartDate)).append(", ")
              .append(sqlDate(d.eventEndDate)).append(", ")
              .append(sqlString(d.relationshipType)).append(", ")
              .append(sqlString(d.comment)).append(", ")
              .append(sqlString(d.mapsTo)).append(");\n");
        } else {
          final Ir.Synchronous s = (Ir.Synchronous) relationship;
          buf.append("INSERT INTO synchronous_relationships "
                  + "(relationship_id, outlet_1_id, outlet_1_role, "
                  + "outlet_2_id, outlet_2_role, relationship_subtype, "
                  + "period_start, period_end, details, maps_to) VALUES (")
              .append(relationshipId).append(", ")
              .append(s.outlet1.id).append(", ")
              .append(sqlString(s.outlet1.role)).append(", ")
              .append(s.outlet2.id).append(", ")
              .append(sqlString(s.outlet2.role)).append(", ")
              .append(sqlString(s.relationshipType)).append(", ")
              .append(sqlDate(s.periodStart)).append(", ")
              .append(sqlDate(s.periodEnd)).append(", ")
              .append(sqlString(s.details)).append(", ")
              .append(sqlString(s.mapsTo)).append(");\n");
        }
      }
    }
  }

  private static void marketData(StringBuilder buf, Ir.Program program) {
    buf.append("-- MARKET DATA\n");
    for (Ir.DataBlock data : program.dataBlocks()) {
      for (Ir.Aggregation aggregation : data.aggregations) {
        buf.append("INSERT INTO data_aggregation (outlet_id, "
                + "aggregation_name, aggregation_value) VALUES (")
            .append(data.outletId).append(", ")
            .append(sqlString(aggregation.name)).append(", ")
            .append(sqlString(aggregation.value)).append(");\n");
      }
      for (Ir.DataYear year : data.years) {
        for (Ir.Metric metric : year.metrics) {
          buf.append("INSERT INTO market_data (outlet_id, data_year, "
                  + "metric_name, metric_value, metric_unit, data_source, "
                  + "comment, maps_to) VALUES (")
              .append(data.outletId).append(", ")
              .append(year.year).append(", ")
              .append(sqlString(metric.name)).append(", ")
              .append(formatNumber(metric.value)).append(", ")
              .append(sqlString(metric.unit)).append(", ")
              .append(sqlString(metric.source)).append(", ")
              .append(sqlString(metric.comment)).append(", ")
              .append(sqlString(data.mapsTo)).append(");\n");
        }
      }
    }
  }

  private static void events(StringBuilder buf, Ir.Program program) {
    if (program.events.isEmpty()) {
      return;
    }
    buf.append("-- EVENTS\n");
    int eventId = 0;
    for (Ir.Event event : program.events) {
      ++eventId;
      buf.append("INSERT INTO events (id, name, event_type, event_date, "
              + "status) VALUES (")
          .append(eventId).append(", ")
          .append(sqlString(event.name)).append(", ")
          .append(sqlString(event.eventType)).append(", ")
          .append(sqlDate(event.date)).append(", ")
          .append(sqlString(event.status)).append(");\n");
      for (Ir.EventEntity entity : event.entities) {
        buf.append("INSERT INTO event_entities (event_id, entity_name, "
                + "entity_id, entity_role, stake_before, stake_after) "
                + "VALUES (")
            .append(eventId).append(", ")
            .append(sqlString(entity.name)).append(", ")
            .append(entity.id).append(", ")
            .append(sqlString(entity.role)).append(", ")
            .append(sqlNumber(entity.stakeBefore)).append(", ")
            .append(sqlNumber(entity.stakeAfter)).append(");\n");
      }
      attributes(buf, "event_impact", "event_id", "impact", eventId,
          event.impact);
      attributes(buf, "event_metadata", "event_id", "metadata", eventId,
          event.metadata);
    }
    buf.append("\n");
  }
}

// End SqlGenerator.java
