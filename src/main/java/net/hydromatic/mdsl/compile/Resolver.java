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
import net.hydromatic.mdsl.ast.Op;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static net.hydromatic.mdsl.util.Static.formatNumber;
import static net.hydromatic.mdsl.util.Static.toIntExact;

import static java.util.Objects.requireNonNull;

/** Converts an AST into IR.
 *
 * <p>Lowering extracts well-known keys from free-form blocks, records
 * inheritance clauses as references, and hoists top-level relationships
 * and data into a family. It never fails: fields that it does not
 * recognize are dropped, and missing fields take default values. Reporting
 * problems is the job of the {@link Validator}. */
public class Resolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(Resolver.class);

  /** Text that a {@code CURRENT} date lowers to. */
  public static final String CURRENT = "CURRENT";

  static final String GLOBAL_FAMILY_COMMENT =
      "Auto-generated family for top-level relationships";

  private final String globalFamilyName;

  private Resolver(String globalFamilyName) {
    this.globalFamilyName = requireNonNull(globalFamilyName);
  }

  /** Creates a Resolver with default properties. */
  public static Resolver create() {
    return of(ImmutableMap.of());
  }

  /** Creates a Resolver. */
  public static Resolver of(Map<Prop, Object> propMap) {
    return new Resolver(Prop.GLOBAL_FAMILY_NAME.stringValue(propMap));
  }

  /** Converts a program. */
  public Ir.Program toIr(Ast.Program program) {
    final List<Ir.Import> imports = new ArrayList<>();
    final List<Ir.Variable> variables = new ArrayList<>();
    final List<Ir.Template> templates = new ArrayList<>();
    final List<Ir.Unit> units = new ArrayList<>();
    final List<Ir.Vocabulary> vocabularies = new ArrayList<>();
    final List<Ir.Family> families = new ArrayList<>();
    final List<Ir.Event> events = new ArrayList<>();
    final List<Ir.Relationship> looseRelationships = new ArrayList<>();
    final List<Ir.DataBlock> looseDataBlocks = new ArrayList<>();
    for (Ast.Decl decl : program.decls) {
      switch (decl.op) {
      case IMPORT:
        imports.add(new Ir.Import(decl.pos, ((Ast.Import) decl).path));
        break;
      case LET:
        final Ast.VarDecl varDecl = (Ast.VarDecl) decl;
        variables.add(
            new Ir.Variable(decl.pos, varDecl.name, toIr(varDecl.exp)));
        break;
      case TEMPLATE:
        templates.add(toIr((Ast.TemplateDecl) decl));
        break;
      case UNIT:
        units.add(toIr((Ast.UnitDecl) decl));
        break;
      case VOCABULARY:
        vocabularies.add(toIr((Ast.VocabularyDecl) decl));
        break;
      case FAMILY:
        families.add(toIr((Ast.FamilyDecl) decl));
        break;
      case DIACHRONIC_LINK:
      case SYNCHRONOUS_LINK:
        looseRelationships.add(toIr((Ast.Relationship) decl));
        break;
      case DATA:
        looseDataBlocks.add(toIr((Ast.DataDecl) decl));
        break;
      case EVENT:
        events.add(toIr((Ast.EventDecl) decl));
        break;
      default:
        // Comments and catalogs have no IR.
        break;
      }
    }

    if (!looseRelationships.isEmpty() || !looseDataBlocks.isEmpty()) {
      if (families.isEmpty()) {
        LOGGER.debug("Creating family '{}' for {} top-level relationships",
            globalFamilyName, looseRelationships.size());
        families.add(
            new Ir.Family(program.pos, globalFamilyName,
                GLOBAL_FAMILY_COMMENT, ImmutableList.of(),
                looseRelationships, looseDataBlocks));
      } else {
        final Ir.Family first = families.get(0);
        families.set(0,
            new Ir.Family(first.pos, first.name, first.comment, first.outlets,
                concat(first.relationships, looseRelationships),
                concat(first.dataBlocks, looseDataBlocks)));
      }
    }
    return new Ir.Program(program.pos, imports, variables, templates, units,
        vocabularies, families, events);
  }

  private static <E> List<E> concat(List<E> list0, List<E> list1) {
    return ImmutableList.<E>builder().addAll(list0).addAll(list1).build();
  }

  Ir.Template toIr(Ast.TemplateDecl template) {
    final List<Ir.FieldBlock> blocks = new ArrayList<>();
    for (Ast.Field field : template.blocks) {
      if (field.op == Op.CHARACTERISTICS || field.op == Op.METADATA) {
        blocks.add(toFieldBlock((Ast.Block) field));
      }
    }
    final String templateType =
        template.kind == null
            ? "OUTLET"
            : template.kind.toUpperCase(Locale.ROOT);
    return new Ir.Template(template.pos, template.name, templateType, blocks);
  }

  Ir.Unit toIr(Ast.UnitDecl unit) {
    final List<Ir.Field> fields = new ArrayList<>();
    for (Ast.FieldDecl field : unit.fields) {
      fields.add(
          new Ir.Field(field.pos, field.name, field.type, field.primaryKey));
    }
    return new Ir.Unit(unit.pos, unit.name, fields);
  }

  Ir.Vocabulary toIr(Ast.VocabularyDecl vocabulary) {
    final List<Ir.VocabEntry> entries = new ArrayList<>();
    for (Ast.VocabBody body : vocabulary.bodies) {
      for (Ast.VocabEntry entry : body.entries) {
        entries.add(new Ir.VocabEntry(entry.pos, entry.key.value, entry.value));
      }
    }
    final String bodyName =
        vocabulary.bodies.isEmpty()
            ? vocabulary.name
            : vocabulary.bodies.get(0).name;
    return new Ir.Vocabulary(vocabulary.pos, vocabulary.name, bodyName,
        entries);
  }

  Ir.Family toIr(Ast.FamilyDecl family) {
    String comment = null;
    final List<Ir.Outlet> outlets = new ArrayList<>();
    final List<Ir.Relationship> relationships = new ArrayList<>();
    final List<Ir.DataBlock> dataBlocks = new ArrayList<>();
    for (Ast.Decl member : family.members) {
      switch (member.op) {
      case COMMENT:
        if (comment == null) {
          comment = ((Ast.Comment) member).text;
        }
        break;
      case OUTLET:
        outlets.add(toIr((Ast.OutletDecl) member));
        break;
      case DIACHRONIC_LINK:
      case SYNCHRONOUS_LINK:
        relationships.add(toIr((Ast.Relationship) member));
        break;
      case DATA:
        dataBlocks.add(toIr((Ast.DataDecl) member));
        break;
      default:
        // Outlet references are declared elsewhere.
        break;
      }
    }
    return new Ir.Family(family.pos, family.name, comment, outlets,
        relationships, dataBlocks);
  }

  Ir.Outlet toIr(Ast.OutletDecl outlet) {
    String templateRef = null;
    Integer baseRef = null;
    if (outlet.inheritance instanceof Ast.ExtendsTemplate) {
      templateRef = ((Ast.ExtendsTemplate) outlet.inheritance).templateName;
    } else if (outlet.inheritance instanceof Ast.BasedOn) {
      baseRef = ((Ast.BasedOn) outlet.inheritance).id;
    }
    Integer id = null;
    final List<Ir.OutletBlock> blocks = new ArrayList<>();
    for (Ast.Field field : outlet.blocks) {
      switch (field.op) {
      case IDENTITY:
        final Ir.FieldBlock identity = toFieldBlock((Ast.Block) field);
        if (id == null) {
          id = outletId(identity);
        }
        blocks.add(identity);
        break;
      case LIFECYCLE:
        blocks.add(toLifecycle((Ast.Block) field));
        break;
      case CHARACTERISTICS:
      case METADATA:
        blocks.add(toFieldBlock((Ast.Block) field));
        break;
      default:
        // Comments and annotations directly inside an outlet
        break;
      }
    }
    return new Ir.Outlet(outlet.pos, outlet.name, id, templateRef, baseRef,
        blocks);
  }

  /** Returns the value of the numeric {@code id} field of an identity
   * block, or null. */
  private static @Nullable Integer outletId(Ir.FieldBlock identity) {
    final Ir.Expr value = Ir.find(identity.fields, "id");
    if (value instanceof Ir.Literal
        && ((Ir.Literal) value).value instanceof Double) {
      return toIntExact((Double) ((Ir.Literal) value).value);
    }
    return null;
  }

  private Ir.FieldBlock toFieldBlock(Ast.Block block) {
    final Ir.BlockKind kind;
    switch (block.op) {
    case IDENTITY:
      kind = Ir.BlockKind.IDENTITY;
      break;
    case CHARACTERISTICS:
      kind = Ir.BlockKind.CHARACTERISTICS;
      break;
    case METADATA:
      kind = Ir.BlockKind.METADATA;
      break;
    default:
      throw new AssertionError(block.op);
    }
    return new Ir.FieldBlock(block.pos, kind, toNamedValues(block.fields));
  }

  private Ir.LifecycleBlock toLifecycle(Ast.Block block) {
    final List<Ir.LifecycleStatus> statuses = new ArrayList<>();
    for (Ast.Field field : block.fields) {
      if (field instanceof Ast.LifecycleEntry) {
        final Ast.LifecycleEntry entry = (Ast.LifecycleEntry) field;
        statuses.add(
            new Ir.LifecycleStatus(entry.pos, entry.status,
                toDate(entry.from), toDate(entry.to),
                string(entry.attributes, "precision_start"),
                string(entry.attributes, "precision_end"),
                string(entry.attributes, "comment")));
      }
    }
    return new Ir.LifecycleBlock(block.pos, statuses);
  }

  Ir.DataBlock toIr(Ast.DataDecl data) {
    final List<Ir.Aggregation> aggregations = new ArrayList<>();
    final List<Ir.DataYear> years = new ArrayList<>();
    for (Ast.Field item : data.items) {
      switch (item.op) {
      case AGGREGATION:
        for (Ast.Field field : ((Ast.Block) item).fields) {
          if (field instanceof Ast.Assign) {
            final Ast.Assign assign = (Ast.Assign) field;
            aggregations.add(
                new Ir.Aggregation(assign.pos, assign.name, text(assign.exp)));
          }
        }
        break;
      case YEAR:
        years.add(toIr((Ast.Year) item));
        break;
      default:
        break;
      }
    }
    return new Ir.DataBlock(data.pos, data.targetId, aggregations, years,
        annotation(data.items, "maps_to"));
  }

  private Ir.DataYear toIr(Ast.Year year) {
    final List<Ir.Metric> metrics = new ArrayList<>();
    for (Ast.Field field : year.fields) {
      if (field.op == Op.METRICS) {
        for (Ast.Field metric : ((Ast.Block) field).fields) {
          if (metric instanceof Ast.Assign) {
            metrics.add(toMetric((Ast.Assign) metric));
          }
        }
      }
    }
    return new Ir.DataYear(year.pos, year.year, metrics,
        string(year.fields, "comment"));
  }

  private Ir.Metric toMetric(Ast.Assign metric) {
    final List<Ast.Field> attributes =
        metric.exp instanceof Ast.ObjectExp
            ? ((Ast.ObjectExp) metric.exp).fields
            : ImmutableList.of();
    final Double value = number(attributes, "value");
    return new Ir.Metric(metric.pos, metric.name,
        value == null ? 0D : value,
        first(string(attributes, "unit"), ""),
        first(string(attributes, "source"), ""),
        string(attributes, "comment"));
  }

  Ir.Relationship toIr(Ast.Relationship relationship) {
    final List<Ast.Field> fields = relationship.fields;
    final String relationshipType =
        first(string(fields, "relationship_type"), "");
    final String mapsTo = annotation(fields, "maps_to");
    if (relationship instanceof Ast.DiachronicLink) {
      final Ast.DateAssign eventDate = Ast.dateAssign(fields, "event_date");
      return new Ir.Diachronic(relationship.pos, relationship.name,
          intValue(number(fields, "predecessor")),
          intValue(number(fields, "successor")),
          eventDate == null ? null : toDate(eventDate.from),
          eventDate == null ? null : toDate(eventDate.to),
          relationshipType, annotation(fields, "comment"), mapsTo);
    }
    String periodStart = null;
    String periodEnd = null;
    for (Ast.Field field : fields) {
      if (field instanceof Ast.DateAssign) {
        final Ast.DateAssign date = (Ast.DateAssign) field;
        switch (date.name) {
        case "period":
          periodStart = toDate(date.from);
          periodEnd = toDate(date.to);
          break;
        case "period_start":
          periodStart = toDate(date.from);
          break;
        case "period_end":
          periodEnd = toDate(date.from);
          break;
        default:
          break;
        }
      }
    }
    return new Ir.Synchronous(relationship.pos, relationship.name,
        syncOutlet(fields, "outlet_1"), syncOutlet(fields, "outlet_2"),
        relationshipType, periodStart, periodEnd, string(fields, "details"),
        mapsTo);
  }

  private static Ir.SyncOutlet syncOutlet(List<Ast.Field> fields,
      String name) {
    final Ast.Assign assign = Ast.assign(fields, name);
    if (assign == null || !(assign.exp instanceof Ast.ObjectExp)) {
      return new Ir.SyncOutlet(0, "");
    }
    final List<Ast.Field> outlet = ((Ast.ObjectExp) assign.exp).fields;
    return new Ir.SyncOutlet(intValue(number(outlet, "id")),
        first(string(outlet, "role"), ""));
  }

  Ir.Event toIr(Ast.EventDecl event) {
    final List<Ast.Field> fields = event.fields;
    final Ast.DateAssign dateAssign = Ast.dateAssign(fields, "date");
    final String date =
        dateAssign != null
            ? toDate(dateAssign.from)
            : string(fields, "date");
    final List<Ir.EventEntity> entities = new ArrayList<>();
    for (Ast.Field field : objectFields(fields, "entities")) {
      if (field instanceof Ast.Assign) {
        final Ast.Assign entity = (Ast.Assign) field;
        final List<Ast.Field> roles =
            entity.exp instanceof Ast.ObjectExp
                ? ((Ast.ObjectExp) entity.exp).fields
                : ImmutableList.of();
        entities.add(
            new Ir.EventEntity(entity.pos, entity.name,
                intValue(number(roles, "id")),
                first(string(roles, "role"), ""),
                number(roles, "stake_before"),
                number(roles, "stake_after")));
      }
    }
    return new Ir.Event(event.pos, event.name,
        first(string(fields, "type"), ""), date, entities,
        toNamedValues(objectFields(fields, "impact")),
        toNamedValues(objectFields(fields, "metadata")),
        string(fields, "status"));
  }

  /** Returns the fields of an object assigned to a given name; empty if
   * there is no such assignment. */
  private static List<Ast.Field> objectFields(List<Ast.Field> fields,
      String name) {
    final Ast.Assign assign = Ast.assign(fields, name);
    return assign != null && assign.exp instanceof Ast.ObjectExp
        ? ((Ast.ObjectExp) assign.exp).fields
        : ImmutableList.of();
  }

  private List<Ir.NamedValue> toNamedValues(List<Ast.Field> fields) {
    final List<Ir.NamedValue> values = new ArrayList<>();
    for (Ast.Field field : fields) {
      switch (field.op) {
      case ASSIGN:
        final Ast.Assign assign = (Ast.Assign) field;
        values.add(
            new Ir.NamedValue(assign.pos, assign.name, toIr(assign.exp)));
        break;
      case ARRAY_ASSIGN:
        final Ast.ArrayAssign array = (Ast.ArrayAssign) field;
        final List<Ir.Expr> elements = new ArrayList<>();
        for (Ast.ObjectExp element : array.elements) {
          elements.add(toIr(element));
        }
        values.add(
            new Ir.NamedValue(array.pos, array.name,
                new Ir.ArrayExpr(array.pos, elements)));
        break;
      case DATE_ASSIGN:
        values.add(toNamedValue((Ast.DateAssign) field));
        break;
      default:
        // Comments, annotations and nested groups
        break;
      }
    }
    return values;
  }

  /** Converts a date assignment. A single date becomes a string; a range
   * becomes an object with fields "from" and "to". */
  private static Ir.NamedValue toNamedValue(Ast.DateAssign date) {
    final Ir.Literal from =
        new Ir.Literal(date.from.pos, requireNonNull(toDate(date.from)));
    if (date.to == null) {
      return new Ir.NamedValue(date.pos, date.name, from);
    }
    final Ir.Literal to =
        new Ir.Literal(date.to.pos, requireNonNull(toDate(date.to)));
    return new Ir.NamedValue(date.pos, date.name,
        new Ir.ObjectExpr(date.pos,
            ImmutableList.of(new Ir.NamedValue(date.from.pos, "from", from),
                new Ir.NamedValue(date.to.pos, "to", to))));
  }

  Ir.Expr toIr(Ast.Exp exp) {
    switch (exp.op) {
    case STRING_LITERAL:
    case NUMBER_LITERAL:
    case BOOL_LITERAL:
      return new Ir.Literal(exp.pos, ((Ast.Literal) exp).value);
    case IDENTIFIER:
      return new Ir.Literal(exp.pos, ((Ast.Identifier) exp).name);
    case VARIABLE:
      return new Ir.VarRef(exp.pos, ((Ast.VarRef) exp).name);
    case OBJECT:
      return new Ir.ObjectExpr(exp.pos,
          toNamedValues(((Ast.ObjectExp) exp).fields));
    default:
      throw new AssertionError(exp.op);
    }
  }

  /** Converts a date; {@code CURRENT} becomes the string "CURRENT". */
  static @Nullable String toDate(Ast.@Nullable DateExp date) {
    if (date == null) {
      return null;
    }
    return date.isCurrent() ? CURRENT : date.literal;
  }

  /** Returns the text of an expression: a string's value, a number without
   * trailing zeros, an identifier's name. */
  private static String text(Ast.Exp exp) {
    if (exp instanceof Ast.Literal) {
      final Ast.Literal literal = (Ast.Literal) exp;
      return literal.value instanceof Double
          ? formatNumber((Double) literal.value)
          : literal.value.toString();
    }
    if (exp instanceof Ast.Identifier) {
      return ((Ast.Identifier) exp).name;
    }
    return exp.toString();
  }

  /** Returns the value of a string assignment, or null. */
  private static @Nullable String string(List<Ast.Field> fields,
      String name) {
    final Ast.Assign assign = Ast.assign(fields, name);
    if (assign != null && assign.exp.op == Op.STRING_LITERAL) {
      return (String) ((Ast.Literal) assign.exp).value;
    }
    return null;
  }

  /** Returns the value of a number assignment, or null. */
  private static @Nullable Double number(List<Ast.Field> fields,
      String name) {
    final Ast.Assign assign = Ast.assign(fields, name);
    if (assign != null && assign.exp.op == Op.NUMBER_LITERAL) {
      return ((Ast.Literal) assign.exp).doubleValue();
    }
    return null;
  }

  /** Returns the value of an annotation, or null. */
  private static @Nullable String annotation(List<Ast.Field> fields,
      String name) {
    final Ast.Annotation annotation = Ast.annotation(fields, name);
    return annotation == null ? null : annotation.value;
  }

  /** Converts a number to an outlet ID; a missing or invalid number
   * becomes 0. */
  private static int intValue(@Nullable Double d) {
    final Integer i = toIntExact(d);
    return i == null ? 0 : i;
  }

  private static String first(@Nullable String s, String defaultValue) {
    return s != null ? s : defaultValue;
  }
}

// End Resolver.java
