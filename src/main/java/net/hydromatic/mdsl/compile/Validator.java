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
import net.hydromatic.mdsl.ast.FieldType;
import net.hydromatic.mdsl.ast.Op;
import net.hydromatic.mdsl.ast.Pos;
import net.hydromatic.mdsl.ast.Visitor;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static net.hydromatic.mdsl.util.Static.filterEager;
import static net.hydromatic.mdsl.util.Static.formatNumber;
import static net.hydromatic.mdsl.util.Static.toIntExact;

/** Checks a program for semantic errors.
 *
 * <p>Validation works on the AST, so that every issue has the position of
 * the construct that caused it. It runs in four phases:
 *
 * <ol>
 * <li>Collect declarations into a symbol table, reporting names and outlet
 *   IDs that are declared more than once;
 * <li>Check each construct in isolation;
 * <li>Check that variables, templates and outlets that are referenced
 *   have been declared;
 * <li>Check business rules.
 * </ol>
 *
 * <p>Because declarations are collected before anything is checked, a
 * reference may precede its declaration.
 *
 * <p>Each issue records the path of constructs that enclose it, for
 * example "Program &gt; Family(F) &gt; Outlet(O) &gt; Identity".
 *
 * <p>A Validator is not thread-safe; each call to {@link #validate} starts
 * afresh. */
public class Validator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Validator.class);

  private static final Joiner PATH_JOINER = Joiner.on(" > ");

  private final int maxTextLength;

  private final List<ValidationIssue> issues = new ArrayList<>();
  private final List<String> context = new ArrayList<>();

  // Symbol table
  private final Set<String> imports = new LinkedHashSet<>();
  private final Map<String, Pos> variables = new HashMap<>();
  private final Map<String, Pos> templates = new HashMap<>();
  private final Map<String, Pos> units = new HashMap<>();
  private final Map<String, Pos> vocabularies = new HashMap<>();
  private final Map<String, Pos> families = new HashMap<>();
  /** Outlets declared by {@code OUTLET}, by ID. */
  private final Map<Integer, Pos> outlets = new HashMap<>();
  /** IDs of outlets declared by {@code OUTLET_REF}. */
  private final Set<Integer> outletRefs = new HashSet<>();

  protected Validator(int maxTextLength) {
    this.maxTextLength = maxTextLength;
  }

  /** Creates a Validator with default properties. */
  public static Validator create() {
    return of(ImmutableMap.of());
  }

  /** Creates a Validator. */
  public static Validator of(Map<Prop, Object> propMap) {
    return new Validator(Prop.MAX_TEXT_LENGTH.intValue(propMap));
  }

  /** Validates a program. */
  public ValidationResult validate(Ast.Program program) {
    reset();
    push("Program");

    collectDeclarations(program);
    validateDecls(program.decls);
    validateReferences(program);
    validateBusinessRules(program);

    pop();
    final ValidationResult result =
        new ValidationResult(issues,
            templates.size() + units.size() + vocabularies.size()
                + families.size());
    LOGGER.debug("Validated program with {} imports: {} errors, "
            + "{} warnings, {} info",
        imports.size(), result.errors, result.warnings, result.info);
    return result;
  }

  private void reset() {
    issues.clear();
    context.clear();
    imports.clear();
    variables.clear();
    templates.clear();
    units.clear();
    vocabularies.clear();
    families.clear();
    outlets.clear();
    outletRefs.clear();
  }

  // Phase 1

  private void collectDeclarations(Ast.Program program) {
    for (Ast.Decl decl : program.decls) {
      switch (decl.op) {
      case IMPORT:
        imports.add(((Ast.Import) decl).path);
        break;
      case LET:
        declare(variables, ((Ast.VarDecl) decl).name, decl.pos,
            "VAR_REDECLARED", "Variable");
        break;
      case TEMPLATE:
        declare(templates, ((Ast.TemplateDecl) decl).name, decl.pos,
            "TEMPLATE_REDECLARED", "Template");
        break;
      case UNIT:
        declare(units, ((Ast.UnitDecl) decl).name, decl.pos,
            "UNIT_REDECLARED", "Unit");
        break;
      case VOCABULARY:
        declare(vocabularies, ((Ast.VocabularyDecl) decl).name, decl.pos,
            "VOCAB_REDECLARED", "Vocabulary");
        break;
      case FAMILY:
        final Ast.FamilyDecl family = (Ast.FamilyDecl) decl;
        declare(families, family.name, decl.pos, "FAMILY_REDECLARED",
            "Family");
        collectOutlets(family);
        break;
      default:
        break;
      }
    }
  }

  private void declare(Map<String, Pos> symbols, String name, Pos pos,
      String code, String description) {
    final Pos previous = symbols.putIfAbsent(name, pos);
    if (previous != null) {
      error(code,
          description + " '" + name + "' is already declared", pos,
          "Previous declaration at " + previous.lineCol());
    }
  }

  private void collectOutlets(Ast.FamilyDecl family) {
    for (Ast.Decl member : family.members) {
      if (member instanceof Ast.OutletDecl) {
        final Integer id = outletId((Ast.OutletDecl) member);
        if (id != null) {
          final Pos previous = outlets.putIfAbsent(id, member.pos);
          if (previous != null) {
            error("OUTLET_ID_DUPLICATE",
                "Outlet ID " + id + " is already used", member.pos,
                "Previous outlet at " + previous.lineCol());
          }
        }
      } else if (member instanceof Ast.OutletRef) {
        outletRefs.add(((Ast.OutletRef) member).id);
      }
    }
  }

  /** Returns the ID of an outlet: the value of the first numeric
   * {@code id} assignment in its identity blocks, or null. A number that
   * is not a valid ID counts as no ID. */
  static @Nullable Integer outletId(Ast.OutletDecl outlet) {
    for (Ast.Block identity : outlet.blocks(Op.IDENTITY)) {
      final Double id = number(identity.fields, "id");
      if (id != null) {
        return toIntExact(id);
      }
    }
    return null;
  }

  /** Returns whether an outlet ID has been declared, either by an outlet
   * or by an outlet reference. */
  private boolean isOutlet(int id) {
    return outlets.containsKey(id) || outletRefs.contains(id);
  }

  // Phase 2

  private void validateDecls(List<Ast.Decl> decls) {
    for (Ast.Decl decl : decls) {
      switch (decl.op) {
      case IMPORT:
        validateImport((Ast.Import) decl);
        break;
      case LET:
        validateVariable((Ast.VarDecl) decl);
        break;
      case TEMPLATE:
        validateTemplate((Ast.TemplateDecl) decl);
        break;
      case UNIT:
        validateUnit((Ast.UnitDecl) decl);
        break;
      case VOCABULARY:
        validateVocabulary((Ast.VocabularyDecl) decl);
        break;
      case FAMILY:
        validateFamily((Ast.FamilyDecl) decl);
        break;
      case DATA:
        validateData((Ast.DataDecl) decl);
        break;
      case DIACHRONIC_LINK:
        validateDiachronic((Ast.DiachronicLink) decl);
        break;
      case SYNCHRONOUS_LINK:
        validateSynchronous((Ast.SynchronousLink) decl);
        break;
      case EVENT:
        validateEvent((Ast.EventDecl) decl);
        break;
      case CATALOG:
        validateCatalog((Ast.CatalogDecl) decl);
        break;
      default:
        break;
      }
    }
  }

  private void validateImport(Ast.Import anImport) {
    push("Import(" + anImport.path + ")");
    if (!anImport.path.endsWith(".mdsl")) {
      warning("IMPORT_NO_EXTENSION",
          "Import path '" + anImport.path + "' should end with '.mdsl'",
          anImport.pos, "Add '.mdsl' extension to import path");
    }
    if (anImport.path.contains("..")) {
      info("IMPORT_RELATIVE_PATH",
          "Import uses relative path: '" + anImport.path + "'",
          anImport.pos,
          "Consider using absolute paths for better maintainability");
    }
    pop();
  }

  private void validateVariable(Ast.VarDecl varDecl) {
    push("Variable(" + varDecl.name + ")");
    if (!varDecl.name.chars()
        .allMatch(c -> Character.isLetterOrDigit(c) || c == '_')) {
      warning("VAR_NAMING",
          "Variable name '" + varDecl.name
              + "' contains non-alphanumeric characters",
          varDecl.pos,
          "Use only letters, numbers, and underscores in variable names");
    }
    pop();
  }

  private void validateTemplate(Ast.TemplateDecl template) {
    push("Template(" + template.name + ")");
    final List<Ast.Block> blocks =
        filterEager(template.blocks, Ast.Block.class);
    if (blocks.isEmpty()) {
      warning("TEMPLATE_EMPTY",
          "Template '" + template.name + "' has no blocks", template.pos,
          "Add characteristics or metadata blocks to make template useful");
    }
    blocks.forEach(this::validateBlock);
    pop();
  }

  private void validateUnit(Ast.UnitDecl unit) {
    push("Unit(" + unit.name + ")");
    if (unit.fields.isEmpty()) {
      error("UNIT_EMPTY", "Unit '" + unit.name + "' has no fields",
          unit.pos, "Add field declarations to unit");
    }
    if (unit.fields.stream().noneMatch(f -> f.primaryKey)) {
      warning("UNIT_NO_PRIMARY_KEY",
          "Unit '" + unit.name + "' has no primary key", unit.pos,
          "Consider adding a PRIMARY KEY field");
    }
    final Set<String> names = new HashSet<>();
    for (Ast.FieldDecl field : unit.fields) {
      if (!names.add(field.name)) {
        error("UNIT_FIELD_DUPLICATE",
            "Field '" + field.name + "' is declared multiple times in unit '"
                + unit.name + "'",
            field.pos, "Remove duplicate field declaration");
      }
      validateField(field);
    }
    pop();
  }

  private void validateField(Ast.FieldDecl field) {
    push("Field(" + field.name + ")");
    final FieldType type = field.type;
    switch (type.kind) {
    case TEXT:
      if (type.length != null && type.length == 0) {
        error("FIELD_TEXT_ZERO_LENGTH",
            "TEXT field '" + field.name + "' has zero length", field.pos,
            "Specify a positive length for TEXT fields");
      }
      if (type.length != null && type.length > maxTextLength) {
        warning("FIELD_TEXT_LARGE",
            "TEXT field '" + field.name + "' has very large length ("
                + type.length + ")",
            field.pos,
            "Consider using a smaller length or different field type");
      }
      break;
    case CATEGORY:
      if (type.values.isEmpty()) {
        error("FIELD_CATEGORY_EMPTY",
            "CATEGORY field '" + field.name + "' has no values", field.pos,
            "Add at least one value to CATEGORY field");
      }
      final Set<String> seen = new HashSet<>();
      for (String value : type.values) {
        if (!seen.add(value)) {
          error("FIELD_CATEGORY_DUPLICATE",
              "CATEGORY field '" + field.name + "' has duplicate value '"
                  + value + "'",
              field.pos, "Remove duplicate values from CATEGORY field");
        }
      }
      break;
    default:
      break;
    }
    pop();
  }

  private void validateVocabulary(Ast.VocabularyDecl vocabulary) {
    push("Vocabulary(" + vocabulary.name + ")");
    if (vocabulary.bodies.isEmpty()) {
      error("VOCAB_EMPTY",
          "Vocabulary '" + vocabulary.name + "' has no bodies",
          vocabulary.pos, "Add at least one vocabulary body");
    }
    for (Ast.VocabBody body : vocabulary.bodies) {
      push("VocabBody(" + body.name + ")");
      if (body.entries.isEmpty()) {
        warning("VOCAB_BODY_EMPTY",
            "Vocabulary body '" + body.name + "' has no entries", body.pos,
            "Add vocabulary entries");
      }
      final Set<String> keys = new HashSet<>();
      for (Ast.VocabEntry entry : body.entries) {
        final String key = keyString(entry.key);
        if (!keys.add(key)) {
          error("VOCAB_DUPLICATE_KEY",
              "Vocabulary body '" + body.name + "' has duplicate key '"
                  + key + "'",
              entry.pos, "Remove duplicate key or use different key");
        }
      }
      pop();
    }
    pop();
  }

  private static String keyString(Ast.Literal key) {
    return key.value instanceof Double
        ? formatNumber(key.doubleValue())
        : (String) key.value;
  }

  private void validateFamily(Ast.FamilyDecl family) {
    push("Family(" + family.name + ")");
    int outletCount = 0;
    int relationshipCount = 0;
    int memberCount = 0;
    for (Ast.Decl member : family.members) {
      switch (member.op) {
      case OUTLET:
        ++outletCount;
        validateOutlet((Ast.OutletDecl) member);
        break;
      case DIACHRONIC_LINK:
        ++relationshipCount;
        validateDiachronic((Ast.DiachronicLink) member);
        break;
      case SYNCHRONOUS_LINK:
        ++relationshipCount;
        validateSynchronous((Ast.SynchronousLink) member);
        break;
      case DATA:
        validateData((Ast.DataDecl) member);
        break;
      case COMMENT:
        continue;
      default:
        break;
      }
      ++memberCount;
    }
    if (memberCount == 0) {
      warning("FAMILY_EMPTY", "Family '" + family.name + "' has no members",
          family.pos, "Add outlets, relationships, or data declarations");
    }
    if (outletCount == 0) {
      warning("FAMILY_NO_OUTLETS",
          "Family '" + family.name + "' has no outlets", family.pos,
          "Add outlet declarations to family");
    }
    if (outletCount <= 1 && relationshipCount > 0) {
      warning("FAMILY_SINGLE_OUTLET_RELATIONSHIPS",
          "Family '" + family.name + "' has "
              + (outletCount == 0 ? "no outlets" : "only one outlet")
              + " but " + relationshipCount + " relationships",
          family.pos, "Relationships typically require multiple outlets");
    }
    pop();
  }

  private void validateOutlet(Ast.OutletDecl outlet) {
    push("Outlet(" + outlet.name + ")");
    if (outlet.blocks(Op.IDENTITY).isEmpty()) {
      error("OUTLET_NO_IDENTITY",
          "Outlet '" + outlet.name + "' has no identity block", outlet.pos,
          "Add an identity block with required fields");
    }
    if (outlet.blocks(Op.CHARACTERISTICS).isEmpty()) {
      warning("OUTLET_NO_CHARACTERISTICS",
          "Outlet '" + outlet.name + "' has no characteristics block",
          outlet.pos,
          "Consider adding characteristics to describe the outlet");
    }
    filterEager(outlet.blocks, Ast.Block.class)
        .forEach(this::validateBlock);
    pop();
  }

  private void validateBlock(Ast.Block block) {
    switch (block.op) {
    case IDENTITY:
      validateIdentity(block);
      break;
    case LIFECYCLE:
      validateLifecycle(block);
      break;
    case CHARACTERISTICS:
      validateCharacteristics(block);
      break;
    case METADATA:
      validateMetadata(block);
      break;
    default:
      break;
    }
  }

  private void validateIdentity(Ast.Block identity) {
    push("Identity");
    final Set<String> names = assignedNames(identity.fields);
    checkOutletId(identity.fields, "id");
    if (!names.contains("id")) {
      error("IDENTITY_NO_ID", "Identity block missing required 'id' field",
          identity.pos, "Add 'id = <number>' to identity block");
    }
    if (!names.contains("title")) {
      warning("IDENTITY_NO_TITLE", "Identity block missing 'title' field",
          identity.pos, "Add 'title = \"<name>\"' to identity block");
    }
    pop();
  }

  private void validateLifecycle(Ast.Block lifecycle) {
    push("Lifecycle");
    final List<Ast.LifecycleEntry> entries =
        filterEager(lifecycle.fields, Ast.LifecycleEntry.class);
    if (entries.isEmpty()) {
      warning("LIFECYCLE_EMPTY", "Lifecycle block has no entries",
          lifecycle.pos, "Add lifecycle status entries");
    }
    final Set<String> statuses = new HashSet<>();
    for (Ast.LifecycleEntry entry : entries) {
      if (!statuses.add(entry.status)) {
        warning("LIFECYCLE_DUPLICATE_STATUS",
            "Duplicate lifecycle status '" + entry.status + "'", entry.pos,
            "Each status should appear only once");
      }
    }
    pop();
  }

  private void validateCharacteristics(Ast.Block characteristics) {
    push("Characteristics");
    if (isEmpty(characteristics.fields)) {
      warning("CHARACTERISTICS_EMPTY", "Characteristics block has no fields",
          characteristics.pos, "Add characteristic assignments");
    }
    final Set<String> names = new HashSet<>();
    for (Ast.Assign assign
        : filterEager(characteristics.fields, Ast.Assign.class)) {
      if (!names.add(assign.name)) {
        warning("CHARACTERISTICS_DUPLICATE",
            "Duplicate characteristic '" + assign.name + "'", assign.pos,
            "Remove duplicate characteristic");
      }
    }
    pop();
  }

  private void validateMetadata(Ast.Block metadata) {
    push("Metadata");
    if (isEmpty(metadata.fields)) {
      info("METADATA_EMPTY", "Metadata block has no fields", metadata.pos,
          "Add metadata assignments");
    }
    pop();
  }

  private void validateData(Ast.DataDecl data) {
    push("Data(" + data.targetId + ")");
    if (!isOutlet(data.targetId)) {
      error("DATA_OUTLET_NOT_FOUND",
          "Data declaration references non-existent outlet ID "
              + data.targetId,
          data.pos, "Declare the outlet before adding data");
    }
    if (data.items.stream()
        .noneMatch(item -> item.op == Op.AGGREGATION
            || item.op == Op.YEAR)) {
      warning("DATA_EMPTY",
          "Data declaration for outlet " + data.targetId + " has no blocks",
          data.pos, "Add data blocks (aggregation, years, etc.)");
    }
    pop();
  }

  private void validateDiachronic(Ast.DiachronicLink link) {
    push("DiachronicRel(" + link.name + ")");
    checkOutletId(link.fields, "predecessor");
    checkOutletId(link.fields, "successor");
    final Integer predecessor = intValue(number(link.fields, "predecessor"));
    final Integer successor = intValue(number(link.fields, "successor"));
    if (predecessor != null && !isOutlet(predecessor)) {
      error("RELATIONSHIP_PREDECESSOR_NOT_FOUND",
          "Predecessor outlet " + predecessor + " not found", link.pos,
          "Declare the predecessor outlet before referencing it");
    }
    if (successor != null && !isOutlet(successor)) {
      error("RELATIONSHIP_SUCCESSOR_NOT_FOUND",
          "Successor outlet " + successor + " not found", link.pos,
          "Declare the successor outlet before referencing it");
    }
    if (predecessor != null && predecessor.equals(successor)) {
      warning("RELATIONSHIP_SELF_REFERENCE",
          "Diachronic relationship references the same outlet as both "
              + "predecessor and successor",
          link.pos, "Verify this self-relationship is intentional");
    }
    pop();
  }

  private void validateSynchronous(Ast.SynchronousLink link) {
    push("SynchronousRel(" + link.name + ")");
    for (String name : new String[] {"outlet_1", "outlet_2"}) {
      final Ast.Assign outlet = Ast.assign(link.fields, name);
      if (outlet != null && outlet.exp instanceof Ast.ObjectExp) {
        checkOutletId(((Ast.ObjectExp) outlet.exp).fields, "id");
      }
    }
    final Integer outlet1 = objectId(link.fields, "outlet_1");
    final Integer outlet2 = objectId(link.fields, "outlet_2");
    if (outlet1 != null && !isOutlet(outlet1)) {
      error("RELATIONSHIP_OUTLET1_NOT_FOUND",
          "Outlet 1 with ID " + outlet1 + " not found", link.pos,
          "Declare the outlet before referencing it");
    }
    if (outlet2 != null && !isOutlet(outlet2)) {
      error("RELATIONSHIP_OUTLET2_NOT_FOUND",
          "Outlet 2 with ID " + outlet2 + " not found", link.pos,
          "Declare the outlet before referencing it");
    }
    if (outlet1 != null && outlet1.equals(outlet2)) {
      warning("RELATIONSHIP_SELF_REFERENCE",
          "Synchronous relationship references the same outlet twice",
          link.pos, "Verify this self-relationship is intentional");
    }
    pop();
  }

  private void validateEvent(Ast.EventDecl event) {
    push("Event(" + event.name + ")");
    final Ast.Assign entities = Ast.assign(event.fields, "entities");
    if (entities != null && entities.exp instanceof Ast.ObjectExp) {
      for (Ast.Assign entity : filterEager(
          ((Ast.ObjectExp) entities.exp).fields, Ast.Assign.class)) {
        if (entity.exp instanceof Ast.ObjectExp) {
          checkOutletId(((Ast.ObjectExp) entity.exp).fields, "id");
        }
        final Integer id = objectId(entity.exp);
        if (id != null && !isOutlet(id)) {
          warning("EVENT_ENTITY_NOT_FOUND",
              "Event entity '" + entity.name + "' references unknown outlet "
                  + id,
              entity.pos, "Declare the outlet before referencing it");
        }
      }
    }
    pop();
  }

  private void validateCatalog(Ast.CatalogDecl catalog) {
    push("Catalog(" + catalog.name + ")");
    if (catalog.sources.isEmpty()) {
      warning("CATALOG_EMPTY",
          "Catalog '" + catalog.name + "' has no sources", catalog.pos,
          "Add source declarations to catalog");
    }
    pop();
  }

  // Phase 3

  private void validateReferences(Ast.Program program) {
    push("References");
    program.accept(new ReferenceChecker());
    checkCircularDependencies(program);
    pop();
  }

  /** Checks for cycles among templates and {@code BASED_ON} clauses.
   * Does nothing; sub-classes may override. */
  protected void checkCircularDependencies(Ast.Program program) {
  }

  // Phase 4

  private void validateBusinessRules(Ast.Program program) {
    push("BusinessRules");
    checkBusinessRules(program);
    pop();
  }

  /** Checks rules specific to the media domain, such as the range of IDs
   * allowed for each sector. No rules are currently defined; sub-classes
   * may override, and report issues by calling {@link #error},
   * {@link #warning} and {@link #info}. */
  protected void checkBusinessRules(Ast.Program program) {
  }

  // Utilities

  private void push(String scope) {
    context.add(scope);
  }

  private void pop() {
    context.remove(context.size() - 1);
  }

  protected void error(String code, String message, Pos pos,
      @Nullable String suggestion) {
    add(Severity.ERROR, code, message, pos, suggestion);
  }

  protected void warning(String code, String message, Pos pos,
      @Nullable String suggestion) {
    add(Severity.WARNING, code, message, pos, suggestion);
  }

  protected void info(String code, String message, Pos pos,
      @Nullable String suggestion) {
    add(Severity.INFO, code, message, pos, suggestion);
  }

  private void add(Severity severity, String code, String message, Pos pos,
      @Nullable String suggestion) {
    issues.add(
        new ValidationIssue(severity, code, message, pos, suggestion,
            PATH_JOINER.join(context)));
  }

  /** Returns whether a list of fields has nothing but comments. */
  private static boolean isEmpty(List<Ast.Field> fields) {
    return fields.stream().allMatch(f -> f.op == Op.FIELD_COMMENT);
  }

  /** Returns the names of the assignments in a list of fields. */
  private static Set<String> assignedNames(List<Ast.Field> fields) {
    final Set<String> names = new HashSet<>();
    for (Ast.Field field : fields) {
      switch (field.op) {
      case ASSIGN:
        names.add(((Ast.Assign) field).name);
        break;
      case ARRAY_ASSIGN:
        names.add(((Ast.ArrayAssign) field).name);
        break;
      case DATE_ASSIGN:
        names.add(((Ast.DateAssign) field).name);
        break;
      default:
        break;
      }
    }
    return names;
  }

  /** Returns the value of a numeric assignment, or null. */
  private static @Nullable Double number(List<Ast.Field> fields,
      String name) {
    final Ast.Assign assign = Ast.assign(fields, name);
    return assign != null && assign.exp.op == Op.NUMBER_LITERAL
        ? ((Ast.Literal) assign.exp).doubleValue()
        : null;
  }

  /** Returns the {@code id} field of an object assigned to a given name,
   * or null. */
  private static @Nullable Integer objectId(List<Ast.Field> fields,
      String name) {
    final Ast.Assign assign = Ast.assign(fields, name);
    return assign == null ? null : objectId(assign.exp);
  }

  /** Returns the {@code id} field of an object, or null. */
  private static @Nullable Integer objectId(Ast.Exp exp) {
    return exp instanceof Ast.ObjectExp
        ? intValue(number(((Ast.ObjectExp) exp).fields, "id"))
        : null;
  }

  private static @Nullable Integer intValue(@Nullable Double d) {
    return toIntExact(d);
  }

  /** Reports an error if a field that holds an outlet ID is a number but
   * not a whole number that fits in an INTEGER. */
  private void checkOutletId(List<Ast.Field> fields, String name) {
    final Ast.Assign assign = Ast.assign(fields, name);
    if (assign == null || assign.exp.op != Op.NUMBER_LITERAL) {
      return;
    }
    final double d = ((Ast.Literal) assign.exp).doubleValue();
    if (toIntExact(d) == null) {
      error("OUTLET_ID_INVALID",
          "Outlet ID " + formatNumber(d) + " in '" + name
              + "' is not a whole number in INTEGER range",
          assign.exp.pos,
          "Use a whole number between " + Integer.MIN_VALUE + " and "
              + Integer.MAX_VALUE);
    }
  }

  /** Visits every expression and inheritance clause, checking that the
   * variable, template or outlet it references has been declared. */
  private class ReferenceChecker extends Visitor {
    @Override protected void visit(Ast.VarDecl varDecl) {
      push("Variable(" + varDecl.name + ")");
      super.visit(varDecl);
      pop();
    }

    @Override protected void visit(Ast.TemplateDecl templateDecl) {
      push("Template(" + templateDecl.name + ")");
      super.visit(templateDecl);
      pop();
    }

    @Override protected void visit(Ast.FamilyDecl familyDecl) {
      push("Family(" + familyDecl.name + ")");
      super.visit(familyDecl);
      pop();
    }

    @Override protected void visit(Ast.OutletDecl outletDecl) {
      push("Outlet(" + outletDecl.name + ")");
      super.visit(outletDecl);
      pop();
    }

    @Override protected void visit(Ast.EventDecl eventDecl) {
      push("Event(" + eventDecl.name + ")");
      super.visit(eventDecl);
      pop();
    }

    @Override protected void visit(Ast.VarRef varRef) {
      if (!variables.containsKey(varRef.name)) {
        error("VARIABLE_NOT_FOUND",
            "Variable '" + varRef.name + "' not found", varRef.pos,
            "Declare the variable before using it");
      }
    }

    @Override protected void visit(Ast.ExtendsTemplate extendsTemplate) {
      if (!templates.containsKey(extendsTemplate.templateName)) {
        error("TEMPLATE_NOT_FOUND",
            "Template '" + extendsTemplate.templateName + "' not found",
            extendsTemplate.pos, "Declare the template before using it");
      }
    }

    @Override protected void visit(Ast.BasedOn basedOn) {
      if (!isOutlet(basedOn.id)) {
        error("OUTLET_NOT_FOUND",
            "Outlet with ID " + basedOn.id + " not found", basedOn.pos,
            "Declare the base outlet before referencing it");
      }
    }
  }
}

// End Validator.java
