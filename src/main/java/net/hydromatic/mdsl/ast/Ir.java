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
package net.hydromatic.mdsl.ast;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static net.hydromatic.mdsl.util.Static.formatNumber;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/** Intermediate representation.
 *
 * <p>A flatter, semantically typed mirror of {@link Ast}. Well-known keys
 * have been extracted from free-form blocks (for example, the outlet id
 * from its identity block), inheritance clauses are recorded as references,
 * and top-level relationships have been hoisted into a family.
 *
 * <p>All nodes are immutable. Code generators read them and never modify
 * them. */
public class Ir {
  private Ir() {}

  /** Returns the value of the first field with a given name, or null. */
  public static @Nullable Expr find(List<NamedValue> fields, String name) {
    for (NamedValue field : fields) {
      if (field.name.equals(name)) {
        return field.value;
      }
    }
    return null;
  }

  /** Returns the value of the first field with a given name in any of a
   * list of blocks, as text; or null. */
  public static @Nullable String findText(List<FieldBlock> blocks,
      String name) {
    for (FieldBlock block : blocks) {
      final Expr value = find(block.fields, name);
      if (value instanceof Literal) {
        return ((Literal) value).asText();
      }
    }
    return null;
  }

  /** Base class of IR nodes. */
  public abstract static class Node {
    public final Pos pos;

    Node(Pos pos) {
      this.pos = requireNonNull(pos);
    }
  }

  /** Root of the IR of a source document. */
  public static class Program extends Node {
    public final List<Import> imports;
    public final List<Variable> variables;
    public final List<Template> templates;
    public final List<Unit> units;
    public final List<Vocabulary> vocabularies;
    public final List<Family> families;
    public final List<Event> events;

    public Program(Pos pos, Iterable<Import> imports,
        Iterable<Variable> variables, Iterable<Template> templates,
        Iterable<Unit> units, Iterable<Vocabulary> vocabularies,
        Iterable<Family> families, Iterable<Event> events) {
      super(pos);
      this.imports = ImmutableList.copyOf(imports);
      this.variables = ImmutableList.copyOf(variables);
      this.templates = ImmutableList.copyOf(templates);
      this.units = ImmutableList.copyOf(units);
      this.vocabularies = ImmutableList.copyOf(vocabularies);
      this.families = ImmutableList.copyOf(families);
      this.events = ImmutableList.copyOf(events);
    }

    /** Returns all outlets, family by family. */
    public List<Outlet> outlets() {
      final ImmutableList.Builder<Outlet> b = ImmutableList.builder();
      families.forEach(family -> b.addAll(family.outlets));
      return b.build();
    }

    /** Returns all relationships, family by family. */
    public List<Relationship> relationships() {
      final ImmutableList.Builder<Relationship> b = ImmutableList.builder();
      families.forEach(family -> b.addAll(family.relationships));
      return b.build();
    }

    /** Returns all data blocks, family by family. */
    public List<DataBlock> dataBlocks() {
      final ImmutableList.Builder<DataBlock> b = ImmutableList.builder();
      families.forEach(family -> b.addAll(family.dataBlocks));
      return b.build();
    }
  }

  /** Import; recorded, never resolved. */
  public static class Import extends Node {
    public final String path;

    public Import(Pos pos, String path) {
      super(pos);
      this.path = requireNonNull(path);
    }
  }

  /** Variable declared by {@code LET}. */
  public static class Variable extends Node {
    public final String name;
    public final Expr value;

    public Variable(Pos pos, String name, Expr value) {
      super(pos);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }
  }

  /** Template. Only its characteristics and metadata blocks survive
   * lowering. */
  public static class Template extends Node {
    public final String name;
    public final String templateType;
    public final List<FieldBlock> blocks;

    public Template(Pos pos, String name, String templateType,
        Iterable<FieldBlock> blocks) {
      super(pos);
      this.name = requireNonNull(name);
      this.templateType = requireNonNull(templateType);
      this.blocks = ImmutableList.copyOf(blocks);
    }
  }

  /** Table schema. */
  public static class Unit extends Node {
    public final String name;
    public final List<Field> fields;

    public Unit(Pos pos, String name, Iterable<Field> fields) {
      super(pos);
      this.name = requireNonNull(name);
      this.fields = ImmutableList.copyOf(fields);
    }
  }

  /** Column of a {@link Unit}. */
  public static class Field extends Node {
    public final String name;
    public final FieldType type;
    public final boolean primaryKey;

    public Field(Pos pos, String name, FieldType type, boolean primaryKey) {
      super(pos);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.primaryKey = primaryKey;
    }
  }

  /** Code list. Entries of all bodies are merged, in order. */
  public static class Vocabulary extends Node {
    public final String name;
    public final String bodyName;
    public final List<VocabEntry> entries;

    public Vocabulary(Pos pos, String name, String bodyName,
        Iterable<VocabEntry> entries) {
      super(pos);
      this.name = requireNonNull(name);
      this.bodyName = requireNonNull(bodyName);
      this.entries = ImmutableList.copyOf(entries);
    }
  }

  /** Entry of a {@link Vocabulary}; the key is a {@link Double} or a
   * {@link String}. */
  @SuppressWarnings("rawtypes")
  public static class VocabEntry extends Node {
    public final Comparable key;
    public final String value;

    public VocabEntry(Pos pos, Comparable key, String value) {
      super(pos);
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
      checkArgument(key instanceof Double || key instanceof String);
    }

    public boolean isNumericKey() {
      return key instanceof Double;
    }

    /** Returns the key as text; numbers have no trailing ".0". */
    public String keyString() {
      return key instanceof Double
          ? formatNumber((Double) key)
          : (String) key;
    }
  }

  /** Named group of outlets, relationships and data. */
  public static class Family extends Node {
    public final String name;
    public final @Nullable String comment;
    public final List<Outlet> outlets;
    public final List<Relationship> relationships;
    public final List<DataBlock> dataBlocks;

    public Family(Pos pos, String name, @Nullable String comment,
        Iterable<Outlet> outlets, Iterable<Relationship> relationships,
        Iterable<DataBlock> dataBlocks) {
      super(pos);
      this.name = requireNonNull(name);
      this.comment = comment;
      this.outlets = ImmutableList.copyOf(outlets);
      this.relationships = ImmutableList.copyOf(relationships);
      this.dataBlocks = ImmutableList.copyOf(dataBlocks);
    }
  }

  /** Media outlet. */
  public static class Outlet extends Node {
    public final String name;
    public final @Nullable Integer id;
    public final @Nullable String templateRef;
    public final @Nullable Integer baseRef;
    public final List<OutletBlock> blocks;

    public Outlet(Pos pos, String name, @Nullable Integer id,
        @Nullable String templateRef, @Nullable Integer baseRef,
        Iterable<OutletBlock> blocks) {
      super(pos);
      this.name = requireNonNull(name);
      this.id = id;
      this.templateRef = templateRef;
      this.baseRef = baseRef;
      this.blocks = ImmutableList.copyOf(blocks);
    }

    /** Returns the id, or 0 if the outlet has none. */
    public int idOrZero() {
      return id == null ? 0 : id;
    }

    /** Returns the blocks of a given kind other than lifecycle, in
     * declaration order. */
    public List<FieldBlock> fieldBlocks(BlockKind kind) {
      final ImmutableList.Builder<FieldBlock> b = ImmutableList.builder();
      for (OutletBlock block : blocks) {
        if (block.kind == kind && block instanceof FieldBlock) {
          b.add((FieldBlock) block);
        }
      }
      return b.build();
    }

    /** Returns the statuses of all lifecycle blocks, in declaration
     * order. */
    public List<LifecycleStatus> statuses() {
      final ImmutableList.Builder<LifecycleStatus> b = ImmutableList.builder();
      for (OutletBlock block : blocks) {
        if (block instanceof LifecycleBlock) {
          b.addAll(((LifecycleBlock) block).statuses);
        }
      }
      return b.build();
    }
  }

  /** Kind of {@link OutletBlock}. */
  public enum BlockKind {
    IDENTITY,
    LIFECYCLE,
    CHARACTERISTICS,
    METADATA
  }

  /** Block of an outlet or template. */
  public abstract static class OutletBlock extends Node {
    public final BlockKind kind;

    OutletBlock(Pos pos, BlockKind kind) {
      super(pos);
      this.kind = requireNonNull(kind);
    }
  }

  /** Identity, characteristics or metadata block; a list of named
   * values. */
  public static class FieldBlock extends OutletBlock {
    public final List<NamedValue> fields;

    public FieldBlock(Pos pos, BlockKind kind, Iterable<NamedValue> fields) {
      super(pos, kind);
      this.fields = ImmutableList.copyOf(fields);
      checkArgument(kind != BlockKind.LIFECYCLE);
    }
  }

  /** Lifecycle block. */
  public static class LifecycleBlock extends OutletBlock {
    public final List<LifecycleStatus> statuses;

    public LifecycleBlock(Pos pos, Iterable<LifecycleStatus> statuses) {
      super(pos, BlockKind.LIFECYCLE);
      this.statuses = ImmutableList.copyOf(statuses);
    }
  }

  /** Lifecycle status. Dates are verbatim strings, or "CURRENT". */
  public static class LifecycleStatus extends Node {
    public final String status;
    public final @Nullable String startDate;
    public final @Nullable String endDate;
    public final @Nullable String precisionStart;
    public final @Nullable String precisionEnd;
    public final @Nullable String comment;

    public LifecycleStatus(Pos pos, String status, @Nullable String startDate,
        @Nullable String endDate, @Nullable String precisionStart,
        @Nullable String precisionEnd, @Nullable String comment) {
      super(pos);
      this.status = requireNonNull(status);
      this.startDate = startDate;
      this.endDate = endDate;
      this.precisionStart = precisionStart;
      this.precisionEnd = precisionEnd;
      this.comment = comment;
    }
  }

  /** Name-value pair; a field of an identity, characteristics or metadata
   * block, of an object, or of an event's impact or metadata. */
  public static class NamedValue extends Node {
    public final String name;
    public final Expr value;

    public NamedValue(Pos pos, String name, Expr value) {
      super(pos);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }
  }

  /** Market data of an outlet. */
  public static class DataBlock extends Node {
    public final int outletId;
    public final List<Aggregation> aggregations;
    public final List<DataYear> years;
    public final @Nullable String mapsTo;

    public DataBlock(Pos pos, int outletId, Iterable<Aggregation> aggregations,
        Iterable<DataYear> years, @Nullable String mapsTo) {
      super(pos);
      this.outletId = outletId;
      this.aggregations = ImmutableList.copyOf(aggregations);
      this.years = ImmutableList.copyOf(years);
      this.mapsTo = mapsTo;
    }
  }

  /** Aggregation setting of a {@link DataBlock}. */
  public static class Aggregation extends Node {
    public final String name;
    public final String value;

    public Aggregation(Pos pos, String name, String value) {
      super(pos);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }
  }

  /** Metrics of one year. */
  public static class DataYear extends Node {
    public final int year;
    public final List<Metric> metrics;
    public final @Nullable String comment;

    public DataYear(Pos pos, int year, Iterable<Metric> metrics,
        @Nullable String comment) {
      super(pos);
      this.year = year;
      this.metrics = ImmutableList.copyOf(metrics);
      this.comment = comment;
    }
  }

  /** Metric, such as circulation or reach. */
  public static class Metric extends Node {
    public final String name;
    public final double value;
    public final String unit;
    public final String source;
    public final @Nullable String comment;

    public Metric(Pos pos, String name, double value, String unit,
        String source, @Nullable String comment) {
      super(pos);
      this.name = requireNonNull(name);
      this.value = value;
      this.unit = requireNonNull(unit);
      this.source = requireNonNull(source);
      this.comment = comment;
    }
  }

  /** Relationship between outlets. */
  public abstract static class Relationship extends Node {
    public final String name;
    public final String relationshipType;
    public final @Nullable String mapsTo;

    Relationship(Pos pos, String name, String relationshipType,
        @Nullable String mapsTo) {
      super(pos);
      this.name = requireNonNull(name);
      this.relationshipType = requireNonNull(relationshipType);
      this.mapsTo = mapsTo;
    }
  }

  /** Directed, temporal relationship from a predecessor to a successor. */
  public static class Diachronic extends Relationship {
    public final int predecessor;
    public final int successor;
    public final @Nullable String eventStartDate;
    public final @Nullable String eventEndDate;
    public final @Nullable String comment;

    public Diachronic(Pos pos, String name, int predecessor, int successor,
        @Nullable String eventStartDate, @Nullable String eventEndDate,
        String relationshipType, @Nullable String comment,
        @Nullable String mapsTo) {
      super(pos, name, relationshipType, mapsTo);
      this.predecessor = predecessor;
      this.successor = successor;
      this.eventStartDate = eventStartDate;
      this.eventEndDate = eventEndDate;
      this.comment = comment;
    }
  }

  /** Contemporaneous relationship between two outlets. */
  public static class Synchronous extends Relationship {
    public final SyncOutlet outlet1;
    public final SyncOutlet outlet2;
    public final @Nullable String periodStart;
    public final @Nullable String periodEnd;
    public final @Nullable String details;

    public Synchronous(Pos pos, String name, SyncOutlet outlet1,
        SyncOutlet outlet2, String relationshipType,
        @Nullable String periodStart, @Nullable String periodEnd,
        @Nullable String details, @Nullable String mapsTo) {
      super(pos, name, relationshipType, mapsTo);
      this.outlet1 = requireNonNull(outlet1);
      this.outlet2 = requireNonNull(outlet2);
      this.periodStart = periodStart;
      this.periodEnd = periodEnd;
      this.details = details;
    }
  }

  /** One side of a {@link Synchronous} relationship. */
  public static class SyncOutlet {
    public final int id;
    public final String role;

    public SyncOutlet(int id, String role) {
      this.id = id;
      this.role = requireNonNull(role);
    }
  }

  /** Event, such as a merger, that affects outlets. */
  public static class Event extends Node {
    public final String name;
    public final String eventType;
    public final @Nullable String date;
    public final List<EventEntity> entities;
    public final List<NamedValue> impact;
    public final List<NamedValue> metadata;
    public final @Nullable String status;

    public Event(Pos pos, String name, String eventType, @Nullable String date,
        Iterable<EventEntity> entities, Iterable<NamedValue> impact,
        Iterable<NamedValue> metadata, @Nullable String status) {
      super(pos);
      this.name = requireNonNull(name);
      this.eventType = requireNonNull(eventType);
      this.date = date;
      this.entities = ImmutableList.copyOf(entities);
      this.impact = ImmutableList.copyOf(impact);
      this.metadata = ImmutableList.copyOf(metadata);
      this.status = status;
    }
  }

  /** Participant of an {@link Event}. */
  public static class EventEntity extends Node {
    public final String name;
    public final int id;
    public final String role;
    public final @Nullable Double stakeBefore;
    public final @Nullable Double stakeAfter;

    public EventEntity(Pos pos, String name, int id, String role,
        @Nullable Double stakeBefore, @Nullable Double stakeAfter) {
      super(pos);
      this.name = requireNonNull(name);
      this.id = id;
      this.role = requireNonNull(role);
      this.stakeBefore = stakeBefore;
      this.stakeAfter = stakeAfter;
    }
  }

  /** Kind of {@link Expr}. */
  public enum ExprKind {
    STRING,
    NUMBER,
    BOOLEAN,
    VARIABLE,
    OBJECT,
    ARRAY
  }

  /** Expression. */
  public abstract static class Expr extends Node {
    public final ExprKind kind;

    Expr(Pos pos, ExprKind kind) {
      super(pos);
      this.kind = requireNonNull(kind);
    }
  }

  /** String, number or boolean literal. */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Expr {
    public final Comparable value;

    public Literal(Pos pos, Comparable value) {
      super(pos, kind(value));
      this.value = value;
    }

    private static ExprKind kind(Comparable value) {
      if (value instanceof String) {
        return ExprKind.STRING;
      } else if (value instanceof Double) {
        return ExprKind.NUMBER;
      } else if (value instanceof Boolean) {
        return ExprKind.BOOLEAN;
      } else {
        throw new IllegalArgumentException("not a literal: " + value);
      }
    }

    /** Returns the value as text; numbers have no trailing ".0". */
    public String asText() {
      return value instanceof Double
          ? formatNumber((Double) value)
          : value.toString();
    }
  }

  /** Reference to a variable. */
  public static class VarRef extends Expr {
    public final String name;

    public VarRef(Pos pos, String name) {
      super(pos, ExprKind.VARIABLE);
      this.name = requireNonNull(name);
    }
  }

  /** Object. */
  public static class ObjectExpr extends Expr {
    public final List<NamedValue> fields;

    public ObjectExpr(Pos pos, Iterable<NamedValue> fields) {
      super(pos, ExprKind.OBJECT);
      this.fields = ImmutableList.copyOf(fields);
    }
  }

  /** Array. */
  public static class ArrayExpr extends Expr {
    public final List<Expr> elements;

    public ArrayExpr(Pos pos, Iterable<? extends Expr> elements) {
      super(pos, ExprKind.ARRAY);
      this.elements = ImmutableList.copyOf(elements);
    }
  }
}

// End Ir.java
