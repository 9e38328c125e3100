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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static net.hydromatic.mdsl.codegen.Generators.comment;
import static net.hydromatic.mdsl.codegen.Generators.createTable;
import static net.hydromatic.mdsl.codegen.Generators.sqlDate;
import static net.hydromatic.mdsl.codegen.Generators.sqlString;
import static net.hydromatic.mdsl.util.Static.formatNumber;

/** Generates SQL for the ANMI database schema.
 *
 * <p>The ANMI schema lives in the {@code graphv3} namespace. Each outlet
 * is one row of {@code mo_constant}; a closed set of attributes is
 * harvested from its blocks, and the others are ignored. Each metric
 * updates one column of {@code mo_year}. Relationships go to numbered
 * tables, one per kind; diachronic tables start with "1", synchronous
 * tables with "3".
 *
 * <p>Statements are idempotent, so the script can be re-run against a
 * populated database. */
public class AnmiSqlGenerator implements Generator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(AnmiSqlGenerator.class);

  static final String SCHEMA = "graphv3.";

  /** Tables of diachronic relationships, keyed by relationship type. */
  static final ImmutableMap<String, String> DIACHRONIC_TABLES =
      ImmutableMap.<String, String>builder()
          .put("succession", "11_succession")
          .put("amalgamation", "12_amalgamation")
          .put("new_distribution_area", "13_new_distribution_area")
          .put("new_sector", "14_new_sector")
          .put("interruption", "15_interruption")
          .put("split_off", "16_split_off")
          .put("merger", "17_merger")
          .put("offshoot", "18_offshoot")
          .build();

  /** Tables of synchronous relationships, keyed by relationship type. */
  static final ImmutableMap<String, String> SYNCHRONOUS_TABLES =
      ImmutableMap.of("main_media_outlet", "31_main_media_outlet",
          "umbrella", "33_umbrella",
          "collaboration", "34_collaboration");

  /** Columns of {@code mo_year}, keyed by metric name. */
  static final ImmutableMap<String, String> METRIC_COLUMNS =
      ImmutableMap.<String, String>builder()
          .put("circulation", "circulation")
          .put("unique_users", "unique_users")
          .put("reach_national", "reach_nat")
          .put("reach_regional", "reach_reg")
          .put("market_share", "market_share")
          .build();

  @Override public String generate(Ir.Program program) {
    final StringBuilder buf = new StringBuilder();
    buf.append("-- Generated ANMI-compatible SQL from MediaLanguage DSL\n")
        .append("-- This file recreates the original ANMI database "
            + "schema\n")
        .append("-- Compatible with graphv3 schema structure\n\n")
        .append("-- Create schema if not exists\n")
        .append("CREATE SCHEMA IF NOT EXISTS graphv3;\n\n");
    coreTables(buf);
    relationshipTables(buf);

    final Map<String, Integer> sources = internSources(program);
    outlets(buf, program, sources);
    marketData(buf, program, sources);
    relationships(buf, program);
    return buf.toString();
  }

  private static void coreTables(StringBuilder buf) {
    buf.append("-- ANMI Core Tables\n\n");
    createTable(buf, "IF NOT EXISTS " + SCHEMA, "mo_constant",
        "id_mo INTEGER PRIMARY KEY",
        "mo_title VARCHAR(120)",
        "id_sector INTEGER",
        "mandate INTEGER",
        "location VARCHAR(25)",
        "primary_distr_area INTEGER",
        "local INTEGER",
        "language VARCHAR(5)",
        "start_date DATE",
        "end_date DATE",
        "editorial_line_s TEXT",
        "comments TEXT");
    createTable(buf, "IF NOT EXISTS " + SCHEMA, "mo_year",
        "id_mo INTEGER",
        "year INTEGER",
        "mo_year INTEGER",
        "calc INTEGER",
        "circulation INTEGER",
        "circulation_source INTEGER",
        "unique_users INTEGER",
        "unique_users_source INTEGER",
        "reach_nat DECIMAL(5,2)",
        "reach_nat_source INTEGER",
        "reach_reg DECIMAL(5,2)",
        "reach_reg_source INTEGER",
        "market_share DECIMAL(5,2)",
        "market_share_source INTEGER",
        "comments TEXT",
        "PRIMARY KEY (id_mo, year, mo_year)",
        "FOREIGN KEY (id_mo) REFERENCES graphv3.mo_constant(id_mo)");
    createTable(buf, "IF NOT EXISTS " + SCHEMA, "sources_names",
        "id_source INTEGER PRIMARY KEY",
        "source_name VARCHAR(100)");
    createTable(buf, "IF NOT EXISTS " + SCHEMA, "sectors",
        "id_sector INTEGER PRIMARY KEY",
        "sector_name VARCHAR(100)");
    createTable(buf, "IF NOT EXISTS " + SCHEMA, "distribution_areas",
        "id_area INTEGER PRIMARY KEY",
        "area_name VARCHAR(100)");
  }

  private static void relationshipTables(StringBuilder buf) {
    buf.append("-- Relationship Tables\n\n");
    for (String table : DIACHRONIC_TABLES.values()) {
      buf.append("-- ").append(describe(table)).append("\n");
      createTable(buf, "IF NOT EXISTS " + SCHEMA, quote(table),
          "id_pred INTEGER",
          "id_succ INTEGER",
          "e_s DATE",
          "e_e DATE",
          "PRIMARY KEY (id_pred, id_succ)",
          "FOREIGN KEY (id_pred) REFERENCES graphv3.mo_constant(id_mo)",
          "FOREIGN KEY (id_succ) REFERENCES graphv3.mo_constant(id_mo)");
    }
    for (String table : SYNCHRONOUS_TABLES.values()) {
      buf.append("-- ").append(describe(table)).append("\n");
      createTable(buf, "IF NOT EXISTS " + SCHEMA, quote(table),
          "id_mo_1 INTEGER",
          "id_mo_2 INTEGER",
          "p_s DATE",
          "p_e DATE",
          "PRIMARY KEY (id_mo_1, id_mo_2)",
          "FOREIGN KEY (id_mo_1) REFERENCES graphv3.mo_constant(id_mo)",
          "FOREIGN KEY (id_mo_2) REFERENCES graphv3.mo_constant(id_mo)");
    }
  }

  /** Converts "17_merger" to "Merger relationships", and
   * "16_split_off" to "Split-off relationships". */
  static String describe(String table) {
    final String words = table.substring(table.indexOf('_') + 1)
        .replace("split_off", "split-off").replace('_', ' ');
    return Character.toUpperCase(words.charAt(0)) + words.substring(1)
        + " relationships";
  }

  /** Quotes a table name; names that start with a digit are not valid
   * identifiers. */
  static String quote(String table) {
    return "\"" + table + "\"";
  }

  /** Assigns ids to metric sources, starting at 1, in the order they are
   * first seen. */
  static Map<String, Integer> internSources(Ir.Program program) {
    final Map<String, Integer> sources = new LinkedHashMap<>();
    for (Ir.DataBlock data : program.dataBlocks()) {
      for (Ir.DataYear year : data.years) {
        for (Ir.Metric metric : year.metrics) {
          sources.putIfAbsent(metric.source, sources.size() + 1);
        }
      }
    }
    return sources;
  }

  private static void outlets(StringBuilder buf, Ir.Program program,
      Map<String, Integer> sources) {
    buf.append("-- Media Outlet Data\n\n");
    for (Ir.Vocabulary vocabulary : program.vocabularies) {
      switch (vocabulary.name) {
      case "SECTOR":
        buf.append("-- Populate sectors\n");
        vocabularyRows(buf, vocabulary, "sectors (id_sector, sector_name)");
        break;
      case "DISTRIBUTION_AREA":
        buf.append("-- Populate distribution areas\n");
        vocabularyRows(buf, vocabulary,
            "distribution_areas (id_area, area_name)");
        break;
      default:
        break;
      }
    }

    if (!sources.isEmpty()) {
      buf.append("-- Populate sources\n");
      sources.forEach((name, id) ->
          buf.append("INSERT INTO graphv3.sources_names "
                  + "(id_source, source_name) VALUES (")
              .append(id).append(", ").append(sqlString(name))
              .append(") ON CONFLICT DO NOTHING;\n"));
      buf.append("\n");
    }

    buf.append("-- Insert media outlets\n");
    for (Ir.Outlet outlet : program.outlets()) {
      new OutletRow(outlet).unparse(buf);
    }
  }

  /** Inserts the entries of a vocabulary that have numeric keys. */
  private static void vocabularyRows(StringBuilder buf,
      Ir.Vocabulary vocabulary, String tableAndColumns) {
    for (Ir.VocabEntry entry : vocabulary.entries) {
      if (entry.isNumericKey()) {
        buf.append("INSERT INTO graphv3.").append(tableAndColumns)
            .append(" VALUES (").append(entry.keyString()).append(", ")
            .append(sqlString(entry.value))
            .append(") ON CONFLICT DO NOTHING;\n");
      }
    }
    buf.append("\n");
  }

  private static void marketData(StringBuilder buf, Ir.Program program,
      Map<String, Integer> sources) {
    buf.append("\n-- Market Data\n\n");
    LOGGER.debug("Found {} data blocks across {} families",
        program.dataBlocks().size(), program.families.size());
    for (Ir.DataBlock data : program.dataBlocks()) {
      for (Ir.DataYear year : data.years) {
        final int moYear = moYear(data, year);
        for (Ir.Metric metric : year.metrics) {
          final String column = METRIC_COLUMNS.get(metric.name);
          if (column == null) {
            buf.append("-- Metric '").append(comment(metric.name))
                .append("' = ").append(formatNumber(metric.value))
                .append(" ").append(comment(metric.unit))
                .append(" (source: ").append(comment(metric.source))
                .append(")\n");
            continue;
          }
          final String value = column.startsWith("reach")
              || column.equals("market_share")
              ? formatNumber(metric.value)
              : Integer.toString((int) metric.value);
          final int source = sources.get(metric.source);
          buf.append("INSERT INTO graphv3.mo_year (id_mo, year, mo_year, "
                  + "calc, ").append(column).append(", ")
              .append(column).append("_source) VALUES (")
              .append(data.outletId).append(", ")
              .append(year.year).append(", ")
              .append(moYear).append(", 0, ")
              .append(value).append(", ")
              .append(source)
              .append(") ON CONFLICT (id_mo, year, mo_year) DO UPDATE SET ")
              .append(column).append(" = ").append(value).append(", ")
              .append(column).append("_source = ").append(source)
              .append(";\n");
        }
      }
    }
  }

  /** Returns the synthetic key of an outlet's year,
   * {@code outlet_id * 10000 + year}.
   *
   * @throws CodeGenException if the key does not fit in an INTEGER
   * column */
  static int moYear(Ir.DataBlock data, Ir.DataYear year) {
    try {
      return Math.addExact(Math.multiplyExact(data.outletId, 10000),
          year.year);
    } catch (ArithmeticException e) {
      throw CodeGenException.generationFailure("key of year " + year.year
          + " of outlet " + data.outletId + " does not fit in mo_year",
          year.pos);
    }
  }

  private static void relationships(StringBuilder buf,
      Ir.Program program) {
    buf.append("\n-- Relationships\n\n");
    for (Ir.Relationship relationship : program.relationships()) {
      if (relationship instanceof Ir.Diachronic) {
        final Ir.Diachronic d = (Ir.Diachronic) relationship;
        final String table = DIACHRONIC_TABLES.get(d.relationshipType);
        if (table == null) {
          skipped(buf, d);
          continue;
        }
        buf.append("INSERT INTO ").append(SCHEMA).append(quote(table))
            .append(" (id_pred, id_succ, e_s, e_e) VALUES (")
            .append(d.predecessor).append(", ")
            .append(d.successor).append(", ")
            .append(sqlDate(d.eventStartDate)).append(", ")
            .append(sqlDate(d.eventEndDate))
            .append(") ON CONFLICT DO NOTHING;\n");
      } else {
        final Ir.Synchronous s = (Ir.Synchronous) relationship;
        final String table = SYNCHRONOUS_TABLES.get(s.relationshipType);
        if (table == null) {
          skipped(buf, s);
          continue;
        }
        buf.append("INSERT INTO ").append(SCHEMA).append(quote(table))
            .append(" (id_mo_1, id_mo_2, p_s, p_e) VALUES (")
            .append(s.outlet1.id).append(", ")
            .append(s.outlet2.id).append(", ")
            .append(sqlDate(s.periodStart)).append(", ")
            .append(sqlDate(s.periodEnd))
            .append(") ON CONFLICT DO NOTHING;\n");
      }
    }
  }

  private static void skipped(StringBuilder buf,
      Ir.Relationship relationship) {
    LOGGER.debug("No ANMI table for relationship '{}' of type '{}'",
        relationship.name, relationship.relationshipType);
    buf.append("-- Skipped relationship '")
        .append(comment(relationship.name))
        .append("': unknown type '")
        .append(comment(relationship.relationshipType)).append("'\n");
  }

  /** Row of {@code mo_constant}, harvested from an outlet's blocks. */
  private static class OutletRow {
    int idMo;
    String title;
    @Nullable Integer sector;
    @Nullable Integer mandate;
    @Nullable String location;
    @Nullable Integer primaryDistributionArea;
    @Nullable Integer local;
    @Nullable String language;
    @Nullable String startDate;
    @Nullable String endDate;
    @Nullable String editorialLine;
    @Nullable String comments;

    OutletRow(Ir.Outlet outlet) {
      idMo = outlet.idOrZero();
      title = outlet.name;
      for (Ir.FieldBlock block
          : outlet.fieldBlocks(Ir.BlockKind.IDENTITY)) {
        for (Ir.NamedValue field : block.fields) {
          switch (field.name) {
          case "id":
            final Integer id = number(field.value);
            if (id != null) {
              idMo = id;
            }
            break;
          case "title":
          case "name":
            final String s = string(field.value);
            if (s != null) {
              title = s;
            }
            break;
          default:
            break;
          }
        }
      }
      for (Ir.FieldBlock block
          : outlet.fieldBlocks(Ir.BlockKind.CHARACTERISTICS)) {
        for (Ir.NamedValue field : block.fields) {
          switch (field.name) {
          case "sector":
            sector = number(field.value);
            break;
          case "mandate":
            mandate = number(field.value);
            break;
          case "location":
            location = string(field.value);
            break;
          case "primary_distribution_area":
            primaryDistributionArea = number(field.value);
            break;
          case "local":
            local = number(field.value);
            break;
          case "language":
            language = string(field.value);
            break;
          default:
            break;
          }
        }
      }
      final List<Ir.LifecycleStatus> statuses = outlet.statuses();
      if (!statuses.isEmpty()) {
        startDate = statuses.get(0).startDate;
        endDate = statuses.get(0).endDate;
      }
      for (Ir.FieldBlock block
          : outlet.fieldBlocks(Ir.BlockKind.METADATA)) {
        for (Ir.NamedValue field : block.fields) {
          switch (field.name) {
          case "editorial_line":
            editorialLine = string(field.value);
            break;
          case "comments":
            comments = string(field.value);
            break;
          default:
            break;
          }
        }
      }
    }

    private static @Nullable Integer number(Ir.Expr expr) {
      return expr.kind == Ir.ExprKind.NUMBER
          ? Integer.valueOf(((Double) ((Ir.Literal) expr).value).intValue())
          : null;
    }

    private static @Nullable String string(Ir.Expr expr) {
      return expr.kind == Ir.ExprKind.STRING
          ? (String) ((Ir.Literal) expr).value
          : null;
    }

    private static String sqlInt(@Nullable Integer i) {
      return i == null ? "NULL" : i.toString();
    }

    void unparse(StringBuilder buf) {
      buf.append("INSERT INTO graphv3.mo_constant (id_mo, mo_title, "
              + "id_sector, mandate, location, primary_distr_area, local, "
              + "language, start_date, end_date, editorial_line_s, "
              + "comments) VALUES (")
          .append(idMo).append(", ")
          .append(sqlString(title)).append(", ")
          .append(sqlInt(sector)).append(", ")
          .append(sqlInt(mandate)).append(", ")
          .append(sqlString(location)).append(", ")
          .append(sqlInt(primaryDistributionArea)).append(", ")
          .append(sqlInt(local)).append(", ")
          .append(sqlString(language)).append(", ")
          .append(sqlDate(startDate)).append(", ")
          .append(sqlDate(endDate)).append(", ")
          .append(sqlString(editorialLine)).append(", ")
          .append(sqlString(comments)).append(") ON CONFLICT DO NOTHING;\n");
    }
  }
}

// End AnmiSqlGenerator.java
