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
package net.hydromatic.mdsl.parse;

import net.hydromatic.mdsl.ast.Ast;
import net.hydromatic.mdsl.ast.FieldType;
import net.hydromatic.mdsl.ast.Op;
import net.hydromatic.mdsl.ast.Pos;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static net.hydromatic.mdsl.ast.AstBuilder.ast;
import static net.hydromatic.mdsl.util.Static.toIntExact;

import static com.google.common.base.Preconditions.checkArgument;

/** Recursive-descent parser with one token of lookahead.
 *
 * <p>Newline tokens are discarded; declarations and fields are delimited by
 * braces, and separated by optional semicolons or commas.
 *
 * <p>After an error, the parser skips to the next semicolon or the next
 * keyword that can start a declaration, and carries on. {@link #parse()}
 * throws the first error; {@link #parseLenient()} returns all of them. */
public class MdslParser {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(MdslParser.class);

  /** Keywords at which error recovery resumes. */
  private static final ImmutableSet<Keyword> SYNC_KEYWORDS =
      ImmutableSet.of(Keyword.IMPORT, Keyword.LET, Keyword.UNIT,
          Keyword.VOCABULARY, Keyword.FAMILY, Keyword.TEMPLATE, Keyword.DATA);

  /** Keywords that may also be used as the name of a field or variable. */
  private static final ImmutableSet<Keyword> NAME_KEYWORDS =
      ImmutableSet.of(Keyword.ID, Keyword.PERIOD, Keyword.STATUS,
          Keyword.FROM, Keyword.TO, Keyword.CURRENT, Keyword.YEAR,
          Keyword.FOR, Keyword.DATA, Keyword.TEXT, Keyword.NUMBER,
          Keyword.BOOLEAN, Keyword.CATEGORY, Keyword.PRIMARY, Keyword.KEY,
          Keyword.UNIT, Keyword.ROLE, Keyword.DETAILS,
          Keyword.RELATIONSHIP_TYPE, Keyword.TYPE, Keyword.DATE,
          Keyword.ENTITIES, Keyword.IMPACT, Keyword.METADATA, Keyword.SOURCE,
          Keyword.PREDECESSOR, Keyword.SUCCESSOR, Keyword.EVENT_DATE,
          Keyword.OUTLET_1, Keyword.OUTLET_2, Keyword.STAKE_BEFORE,
          Keyword.STAKE_AFTER, Keyword.IDENTITY, Keyword.LIFECYCLE,
          Keyword.CHARACTERISTICS, Keyword.METRICS, Keyword.AGGREGATION);

  private static final String COMPLEX_OBJECT = "complex_object";

  private final ImmutableList<Token> tokens;
  private int i = 0;
  private final List<MdslParseException> errors = new ArrayList<>();

  /** Creates a parser over a list of tokens that ends with end-of-input. */
  public MdslParser(List<Token> tokens) {
    final ImmutableList.Builder<Token> b = ImmutableList.builder();
    for (Token token : tokens) {
      if (token.kind != TokenKind.NEWLINE) {
        b.add(token);
      }
    }
    this.tokens = b.build();
    checkArgument(!this.tokens.isEmpty()
        && this.tokens.get(this.tokens.size() - 1).kind == TokenKind.EOF,
        "token list must end with EOF");
  }

  /** Creates a parser over a source string. */
  public static MdslParser create(String source) {
    return new MdslParser(Lexer.tokenize(source));
  }

  /** Parses a program.
   *
   * @throws MdslParseException the first syntax error, if there are any
   */
  public Ast.Program parse() {
    final ParseResult result = parseLenient();
    if (!result.errors.isEmpty()) {
      throw result.errors.get(0);
    }
    return result.program;
  }

  /** Parses a program, recovering from errors. */
  public ParseResult parseLenient() {
    final Pos start = peek().pos;
    final List<Ast.Decl> decls = new ArrayList<>();
    for (;;) {
      if (accept(TokenKind.SEMICOLON)) {
        continue;
      }
      if (at(TokenKind.EOF)) {
        break;
      }
      try {
        decls.add(declaration());
      } catch (MdslParseException e) {
        LOGGER.debug("Recovering from parse error: {}", e.getMessage());
        errors.add(e);
        synchronize();
      }
    }
    return new ParseResult(ast.program(span(start), decls), errors);
  }

  /** Skips tokens after an error, until just after a semicolon or at a
   * keyword that starts a declaration. */
  private void synchronize() {
    advance();
    while (!at(TokenKind.EOF)) {
      if (previous().kind == TokenKind.SEMICOLON) {
        return;
      }
      final Token t = peek();
      if (t.kind == TokenKind.KEYWORD && SYNC_KEYWORDS.contains(t.keyword())) {
        return;
      }
      advance();
    }
  }

  // declarations

  private Ast.Decl declaration() {
    final Token t = peek();
    switch (t.kind) {
    case COMMENT:
    case MULTI_LINE_COMMENT:
      advance();
      return ast.comment(t.pos, t.stringValue(),
          t.kind == TokenKind.MULTI_LINE_COMMENT);
    case ANNOTATION:
      return annotationComment();
    case IDENTIFIER:
      if (peek(1).is(TokenKind.LEFT_BRACE)) {
        return standaloneVocabulary();
      }
      break;
    case KEYWORD:
      switch (t.keyword()) {
      case IMPORT:
        return importDecl();
      case LET:
        return varDecl();
      case UNIT:
        return unitDecl();
      case VOCABULARY:
        return vocabularyDecl();
      case FAMILY:
      case GROUP:
        return familyDecl();
      case TEMPLATE:
        return templateDecl();
      case DATA:
        return dataDecl();
      case EVENT:
        return eventDecl();
      case CATALOG:
        return catalogDecl();
      case DIACHRONIC_LINK:
        return diachronicLink();
      case SYNCHRONOUS_LINK:
      case SYNCHRONOUS_LINKS:
        return synchronousLink();
      default:
        break;
      }
      break;
    default:
      break;
    }
    throw unexpected("declaration");
  }

  /** Parses an annotation and records it as a comment "@name: value". */
  private Ast.Comment annotationComment() {
    final Ast.Annotation a = annotation();
    final String text =
        a.value == null ? "@" + a.name : "@" + a.name + ": " + a.value;
    return ast.comment(a.pos, text, false);
  }

  private Ast.Import importDecl() {
    final Pos start = expect(Keyword.IMPORT).pos;
    final String path = expect(TokenKind.STRING).stringValue();
    accept(TokenKind.SEMICOLON);
    return ast.importDecl(span(start), path);
  }

  private Ast.VarDecl varDecl() {
    final Pos start = expect(Keyword.LET).pos;
    final String name = name();
    expect(TokenKind.ASSIGN);
    final Ast.Exp exp = expression();
    accept(TokenKind.SEMICOLON);
    return ast.varDecl(span(start), name, exp);
  }

  private Ast.UnitDecl unitDecl() {
    final Pos start = expect(Keyword.UNIT).pos;
    final String name = name();
    final List<Ast.FieldDecl> fields = items(this::fieldDecl);
    return ast.unitDecl(span(start), name, fields);
  }

  /** Parses "name: type [PRIMARY KEY]". */
  private Ast.FieldDecl fieldDecl() {
    final Pos start = peek().pos;
    final String name = name();
    expect(TokenKind.COLON);
    final FieldType type = fieldType();
    boolean primaryKey = false;
    if (accept(Keyword.PRIMARY)) {
      expect(Keyword.KEY);
      primaryKey = true;
    }
    return ast.fieldDecl(span(start), name, type, primaryKey);
  }

  private FieldType fieldType() {
    final Token t = peek();
    if (t.kind == TokenKind.KEYWORD) {
      switch (t.keyword()) {
      case ID:
        advance();
        return FieldType.ID;
      case NUMBER:
        advance();
        return FieldType.NUMBER;
      case BOOLEAN:
        advance();
        return FieldType.BOOLEAN;
      case TEXT:
        advance();
        if (at(TokenKind.LEFT_PAREN)) {
          final Token open = advance();
          final int length = integer(expect(TokenKind.NUMBER));
          close(open, TokenKind.RIGHT_PAREN);
          return FieldType.text(length);
        }
        return FieldType.text(null);
      case CATEGORY:
        advance();
        final Token paren = expect(TokenKind.LEFT_PAREN);
        final List<String> values = new ArrayList<>();
        while (!at(TokenKind.RIGHT_PAREN) && !at(TokenKind.EOF)) {
          values.add(expect(TokenKind.STRING).stringValue());
          if (!accept(TokenKind.COMMA)) {
            break;
          }
        }
        close(paren, TokenKind.RIGHT_PAREN);
        return FieldType.category(values);
      default:
        break;
      }
    }
    throw unexpected("ID", "TEXT", "NUMBER", "BOOLEAN", "CATEGORY");
  }

  /** Parses "VOCABULARY name { body ... }". If the braces directly contain
   * entries, they form a single body named after the vocabulary. */
  private Ast.VocabularyDecl vocabularyDecl() {
    final Pos start = expect(Keyword.VOCABULARY).pos;
    final String name = name();
    final Token open = expect(TokenKind.LEFT_BRACE);
    skipTrivia();
    if (at(TokenKind.STRING) || at(TokenKind.NUMBER)) {
      final List<Ast.VocabEntry> entries = items(open, this::vocabEntry);
      final Ast.VocabBody body = ast.vocabBody(span(open.pos), name, entries);
      return ast.vocabularyDecl(span(start), name, ImmutableList.of(body));
    }
    final List<Ast.VocabBody> bodies =
        items(open, () -> {
          final Pos bodyStart = peek().pos;
          return vocabBody(name(), bodyStart);
        });
    return ast.vocabularyDecl(span(start), name, bodies);
  }

  /** Parses the bare form "name { entry, ... }". */
  private Ast.VocabularyDecl standaloneVocabulary() {
    final Pos start = peek().pos;
    final String name = expect(TokenKind.IDENTIFIER).stringValue();
    final Ast.VocabBody body = vocabBody(name, peek().pos);
    return ast.vocabularyDecl(span(start), name, ImmutableList.of(body));
  }

  private Ast.VocabBody vocabBody(String name, Pos start) {
    final List<Ast.VocabEntry> entries = items(this::vocabEntry);
    return ast.vocabBody(span(start), name, entries);
  }

  /** Parses "key: value", where the key is a number or a string. */
  private Ast.VocabEntry vocabEntry() {
    final Token t = peek();
    final Ast.Literal key;
    if (t.is(TokenKind.NUMBER)) {
      advance();
      key = ast.numberLiteral(t.pos, t.doubleValue());
    } else if (t.is(TokenKind.STRING)) {
      advance();
      key = ast.stringLiteral(t.pos, t.stringValue());
    } else {
      throw unexpected("number", "string");
    }
    expect(TokenKind.COLON);
    final String value = expect(TokenKind.STRING).stringValue();
    return ast.vocabEntry(span(t.pos), key, value);
  }

  /** Parses "TEMPLATE [kind] name { block ... }". */
  private Ast.TemplateDecl templateDecl() {
    final Pos start = expect(Keyword.TEMPLATE).pos;
    String kind = null;
    final Token t = peek();
    if ((t.is(TokenKind.KEYWORD) || t.is(TokenKind.IDENTIFIER))
        && (peek(1).is(TokenKind.STRING) || peek(1).is(TokenKind.IDENTIFIER))) {
      advance();
      kind = t.kind == TokenKind.KEYWORD ? t.keyword().spelling : t.text;
    }
    final String name = stringOrName();
    final List<Ast.Field> blocks = fields(this::outletBlock);
    return ast.templateDecl(span(start), kind, name, blocks);
  }

  /** Parses "FAMILY name { member ... }"; GROUP is a synonym. */
  private Ast.FamilyDecl familyDecl() {
    final Pos start = advance().pos;
    final String name = stringOrName();
    final Token open = expect(TokenKind.LEFT_BRACE);
    final List<Ast.Decl> members = new ArrayList<>();
    for (;;) {
      if (accept(TokenKind.SEMICOLON)) {
        continue;
      }
      if (at(TokenKind.RIGHT_BRACE) || at(TokenKind.EOF)) {
        break;
      }
      members.add(familyMember());
    }
    close(open, TokenKind.RIGHT_BRACE);
    return ast.familyDecl(span(start), name, members);
  }

  private Ast.Decl familyMember() {
    final Token t = peek();
    switch (t.kind) {
    case COMMENT:
    case MULTI_LINE_COMMENT:
      advance();
      return ast.comment(t.pos, t.stringValue(),
          t.kind == TokenKind.MULTI_LINE_COMMENT);
    case ANNOTATION:
      return annotationComment();
    case KEYWORD:
      switch (t.keyword()) {
      case OUTLET:
        return outletDecl();
      case OUTLET_REF:
        return outletRef();
      case DATA:
        return dataDecl();
      case DIACHRONIC_LINK:
        return diachronicLink();
      case SYNCHRONOUS_LINK:
      case SYNCHRONOUS_LINKS:
        return synchronousLink();
      default:
        break;
      }
      break;
    default:
      break;
    }
    throw unexpected("OUTLET", "OUTLET_REF", "DATA", "DIACHRONIC_LINK",
        "SYNCHRONOUS_LINK", "'}'");
  }

  /** Parses "OUTLET name [EXTENDS TEMPLATE name | BASED_ON id]
   * { block ... }". */
  private Ast.OutletDecl outletDecl() {
    final Pos start = expect(Keyword.OUTLET).pos;
    final String name = stringOrName();
    Ast.Inheritance inheritance = null;
    if (at(Keyword.EXTENDS)) {
      final Pos extendsStart = advance().pos;
      expect(Keyword.TEMPLATE);
      final String templateName = stringOrName();
      inheritance = ast.extendsTemplate(span(extendsStart), templateName);
    } else if (at(Keyword.BASED_ON)) {
      final Pos basedOnStart = advance().pos;
      final int id = integer(expect(TokenKind.NUMBER));
      inheritance = ast.basedOn(span(basedOnStart), id);
    }
    final List<Ast.Field> blocks = fields(this::outletBlock);
    return ast.outletDecl(span(start), name, inheritance, blocks);
  }

  /** Parses a block of an outlet or template. An assignment directly inside
   * the outlet becomes an identity block with one field. */
  private Ast.Field outletBlock() {
    final Token t = peek();
    if (t.kind == TokenKind.KEYWORD) {
      switch (t.keyword()) {
      case IDENTITY:
        return block(Op.IDENTITY, this::assignment);
      case LIFECYCLE:
        return block(Op.LIFECYCLE, this::lifecycleEntry);
      case CHARACTERISTICS:
        return block(Op.CHARACTERISTICS, this::characteristicField);
      case METADATA:
        return block(Op.METADATA, this::assignment);
      default:
        break;
      }
    }
    if (isName(t) && peek(1).is(TokenKind.ASSIGN)) {
      final Ast.Field field = assignment();
      return ast.block(field.pos, Op.IDENTITY, ImmutableList.of(field));
    }
    throw unexpected("IDENTITY", "LIFECYCLE", "CHARACTERISTICS", "METADATA",
        "'}'");
  }

  /** Parses a characteristic. The body that may follow a string value is
   * skipped, and an object value is recorded as the string
   * "complex_object". */
  private Ast.Field characteristicField() {
    final Pos start = peek().pos;
    final String name = name();
    expect(TokenKind.ASSIGN);
    final Token t = peek();
    if (t.is(TokenKind.STRING) && peek(1).is(TokenKind.LEFT_BRACE)) {
      advance();
      skipBraces();
      return ast.assign(span(start), name,
          ast.stringLiteral(t.pos, t.stringValue()));
    }
    if (t.is(TokenKind.LEFT_BRACE)) {
      skipBraces();
      return ast.assign(span(start), name,
          ast.stringLiteral(span(t.pos), COMPLEX_OBJECT));
    }
    return assignmentValue(start, name);
  }

  /** Parses "STATUS "s" FROM date [TO date] [{ attribute ... }]". */
  private Ast.Field lifecycleEntry() {
    final Pos start = expect(Keyword.STATUS).pos;
    final String status = expect(TokenKind.STRING).stringValue();
    expect(Keyword.FROM);
    final Ast.DateExp from = date();
    Ast.DateExp to = null;
    if (accept(Keyword.TO)) {
      to = date();
    }
    final List<Ast.Field> attributes =
        at(TokenKind.LEFT_BRACE)
            ? fields(this::assignment)
            : ImmutableList.of();
    return ast.lifecycleEntry(span(start), status, from, to, attributes);
  }

  /** Parses "OUTLET_REF id name [{ ... }]", where the name may be wrapped
   * in brackets. The body, if present, is skipped. */
  private Ast.OutletRef outletRef() {
    final Pos start = expect(Keyword.OUTLET_REF).pos;
    final int id = integer(expect(TokenKind.NUMBER));
    final String name;
    if (at(TokenKind.LEFT_BRACKET)) {
      final Token open = advance();
      name = expect(TokenKind.STRING).stringValue();
      close(open, TokenKind.RIGHT_BRACKET);
    } else {
      name = expect(TokenKind.STRING).stringValue();
    }
    if (at(TokenKind.LEFT_BRACE)) {
      skipBraces();
    }
    return ast.outletRef(span(start), id, name);
  }

  /** Parses "DATA FOR id { item ... }". */
  private Ast.DataDecl dataDecl() {
    final Pos start = expect(Keyword.DATA).pos;
    expect(Keyword.FOR);
    final int targetId = integer(expect(TokenKind.NUMBER));
    final List<Ast.Field> items = fields(this::dataItem);
    return ast.dataDecl(span(start), targetId, items);
  }

  private Ast.Field dataItem() {
    final Token t = peek();
    if (t.is(Keyword.AGGREGATION)) {
      return block(Op.AGGREGATION, this::assignment);
    }
    if (t.is(Keyword.YEAR)) {
      advance();
      final int year = integer(expect(TokenKind.NUMBER));
      final List<Ast.Field> fields = fields(this::yearField);
      return ast.year(span(t.pos), year, fields);
    }
    throw unexpected("AGGREGATION", "YEAR", "'}'");
  }

  private Ast.Field yearField() {
    final Token t = peek();
    if (t.is(Keyword.METRICS) && peek(1).is(TokenKind.LEFT_BRACE)) {
      return block(Op.METRICS, this::assignment);
    }
    return assignment();
  }

  /** Parses "DIACHRONIC_LINK name { field ... }". */
  private Ast.DiachronicLink diachronicLink() {
    final Pos start = expect(Keyword.DIACHRONIC_LINK).pos;
    final String name = stringOrName();
    final List<Ast.Field> fields = fields(this::diachronicField);
    return ast.diachronicLink(span(start), name, fields);
  }

  private Ast.Field diachronicField() {
    final Token t = peek();
    if (t.kind == TokenKind.KEYWORD) {
      switch (t.keyword()) {
      case PREDECESSOR:
      case SUCCESSOR:
        return numberField();
      case RELATIONSHIP_TYPE:
        return stringField();
      case EVENT_DATE:
        return dateField();
      case TRIGGERED_BY_EVENT:
        return identifierField();
      default:
        break;
      }
    }
    throw unexpected("PREDECESSOR", "SUCCESSOR", "EVENT_DATE",
        "RELATIONSHIP_TYPE", "TRIGGERED_BY_EVENT", "'}'");
  }

  /** Parses "SYNCHRONOUS_LINK name { field ... }"; SYNCHRONOUS_LINKS is a
   * synonym. */
  private Ast.SynchronousLink synchronousLink() {
    final Pos start = advance().pos;
    final String name = stringOrName();
    final List<Ast.Field> fields = fields(this::synchronousField);
    return ast.synchronousLink(span(start), name, fields);
  }

  private Ast.Field synchronousField() {
    final Token t = peek();
    if (t.kind == TokenKind.KEYWORD) {
      switch (t.keyword()) {
      case OUTLET_1:
      case OUTLET_2:
        final Pos start = advance().pos;
        expect(TokenKind.ASSIGN);
        final Ast.ObjectExp object = object();
        return ast.assign(span(start), t.keyword().spelling, object);
      case RELATIONSHIP_TYPE:
      case DETAILS:
        return stringField();
      case PERIOD:
        return dateField();
      case CREATED_BY_EVENT:
        return identifierField();
      default:
        break;
      }
    } else if (t.kind == TokenKind.IDENTIFIER
        && (t.text.equalsIgnoreCase("period_start")
            || t.text.equalsIgnoreCase("period_end"))) {
      return dateField();
    }
    throw unexpected("OUTLET_1", "OUTLET_2", "RELATIONSHIP_TYPE", "PERIOD",
        "DETAILS", "CREATED_BY_EVENT", "'}'");
  }

  /** Parses "EVENT name { field ... }". */
  private Ast.EventDecl eventDecl() {
    final Pos start = expect(Keyword.EVENT).pos;
    final String name = name();
    final List<Ast.Field> fields = fields(this::eventField);
    return ast.eventDecl(span(start), name, fields);
  }

  private Ast.Field eventField() {
    if (at(Keyword.DATE)) {
      return dateField();
    }
    return assignment();
  }

  /** Parses "CATALOG name { SOURCE name { field ... } ... }". */
  private Ast.CatalogDecl catalogDecl() {
    final Pos start = expect(Keyword.CATALOG).pos;
    final String name = name();
    final List<Ast.Source> sources = items(this::source);
    return ast.catalogDecl(span(start), name, sources);
  }

  private Ast.Source source() {
    final Pos start = expect(Keyword.SOURCE).pos;
    final String name = stringOrName();
    final List<Ast.Field> fields = fields(this::sourceField);
    return ast.source(span(start), name, fields);
  }

  /** Parses "name = exp" or "name { field ... }". */
  private Ast.Field sourceField() {
    if (isName(peek()) && peek(1).is(TokenKind.LEFT_BRACE)) {
      final Pos start = peek().pos;
      final String name = name();
      final List<Ast.Field> fields = fields(this::sourceField);
      return ast.nestedAssign(span(start), name, fields);
    }
    return assignment();
  }

  // fields

  /** Parses "@name", "@name "value"" or "@name = "value"". */
  private Ast.Annotation annotation() {
    final Token t = expect(TokenKind.ANNOTATION);
    String value = null;
    if (at(TokenKind.ASSIGN) && peek(1).is(TokenKind.STRING)) {
      advance();
      value = advance().stringValue();
    } else if (at(TokenKind.STRING)) {
      value = advance().stringValue();
    }
    return ast.annotation(span(t.pos), t.stringValue(), value);
  }

  /** Parses "name = value". A value may be an array of objects, or a date
   * range "date TO date". */
  private Ast.Field assignment() {
    final Pos start = peek().pos;
    final String name = name();
    expect(TokenKind.ASSIGN);
    return assignmentValue(start, name);
  }

  private Ast.Field assignmentValue(Pos start, String name) {
    final Token t = peek();
    if (t.is(TokenKind.LEFT_BRACKET)) {
      advance();
      final List<Ast.ObjectExp> elements = new ArrayList<>();
      while (!at(TokenKind.RIGHT_BRACKET) && !at(TokenKind.EOF)) {
        elements.add(object());
        if (!accept(TokenKind.COMMA)) {
          break;
        }
      }
      close(t, TokenKind.RIGHT_BRACKET);
      return ast.arrayAssign(span(start), name, elements);
    }
    if (t.is(Keyword.CURRENT)
        || t.is(TokenKind.STRING) && peek(1).is(Keyword.TO)) {
      final Ast.DateExp from = date();
      Ast.DateExp to = null;
      if (accept(Keyword.TO)) {
        to = date();
      }
      return ast.dateAssign(span(start), name, from, to);
    }
    final Ast.Exp exp = expression();
    return ast.assign(span(start), name, exp);
  }

  /** Parses "name = number". */
  private Ast.Field numberField() {
    final Token t = advance();
    expect(TokenKind.ASSIGN);
    final Token n = expect(TokenKind.NUMBER);
    return ast.assign(span(t.pos), fieldName(t),
        ast.numberLiteral(n.pos, n.doubleValue()));
  }

  /** Parses "name = string". */
  private Ast.Field stringField() {
    final Token t = advance();
    expect(TokenKind.ASSIGN);
    final Token s = expect(TokenKind.STRING);
    return ast.assign(span(t.pos), fieldName(t),
        ast.stringLiteral(s.pos, s.stringValue()));
  }

  /** Parses "name = date [TO date]". */
  private Ast.Field dateField() {
    final Token t = advance();
    expect(TokenKind.ASSIGN);
    final Ast.DateExp from = date();
    Ast.DateExp to = null;
    if (accept(Keyword.TO)) {
      to = date();
    }
    return ast.dateAssign(span(t.pos), fieldName(t), from, to);
  }

  /** Parses "name = identifier". */
  private Ast.Field identifierField() {
    final Token t = advance();
    expect(TokenKind.ASSIGN);
    final Token n = peek();
    final String value = name();
    return ast.assign(span(t.pos), fieldName(t),
        ast.identifier(span(n.pos), value));
  }

  // expressions

  /** Parses a string, number, boolean, variable reference, identifier or
   * object. */
  private Ast.Exp expression() {
    final Token t = peek();
    switch (t.kind) {
    case STRING:
      advance();
      return ast.stringLiteral(t.pos, t.stringValue());
    case NUMBER:
      advance();
      return ast.numberLiteral(t.pos, t.doubleValue());
    case BOOLEAN:
      advance();
      return ast.boolLiteral(t.pos, (Boolean) t.value);
    case DOLLAR:
      advance();
      final String name = name();
      return ast.varRef(span(t.pos), name);
    case LEFT_BRACE:
      return object();
    case IDENTIFIER:
      advance();
      return ast.identifier(t.pos, t.stringValue());
    case KEYWORD:
      if (t.is(Keyword.NOT_AVAILABLE) || t.is(Keyword.NOT_APPLICABLE)) {
        advance();
        return ast.identifier(t.pos, t.keyword().spelling);
      }
      break;
    default:
      break;
    }
    throw unexpected("string", "number", "boolean", "'$'", "'{'");
  }

  /** Parses "{ name = exp; ... }". */
  private Ast.ObjectExp object() {
    final Pos start = peek().pos;
    final List<Ast.Field> fields = fields(this::assignment);
    return ast.object(span(start), fields);
  }

  /** Parses a string literal or {@code CURRENT}. */
  private Ast.DateExp date() {
    final Token t = peek();
    if (t.is(TokenKind.STRING)) {
      advance();
      return ast.date(t.pos, t.stringValue());
    }
    if (t.is(Keyword.CURRENT)) {
      advance();
      return ast.current(t.pos);
    }
    throw unexpected("string", "CURRENT");
  }

  // bodies

  /** Parses a keyword followed by a brace-delimited list of fields. */
  private Ast.Block block(Op op, Supplier<Ast.Field> item) {
    final Pos start = advance().pos;
    final List<Ast.Field> fields = fields(item);
    return ast.block(span(start), op, fields);
  }

  /** Parses a brace-delimited list of fields. Comments and annotations may
   * occur between any two fields; semicolons and commas are optional. */
  private List<Ast.Field> fields(Supplier<Ast.Field> item) {
    final Token open = expect(TokenKind.LEFT_BRACE);
    final List<Ast.Field> list = new ArrayList<>();
    for (;;) {
      final Token t = peek();
      if (t.is(TokenKind.SEMICOLON) || t.is(TokenKind.COMMA)) {
        advance();
      } else if (t.is(TokenKind.RIGHT_BRACE) || t.is(TokenKind.EOF)) {
        break;
      } else if (t.isComment()) {
        advance();
        list.add(
            ast.fieldComment(t.pos, t.stringValue(),
                t.kind == TokenKind.MULTI_LINE_COMMENT));
      } else if (t.is(TokenKind.ANNOTATION)) {
        list.add(annotation());
      } else {
        list.add(item.get());
      }
    }
    close(open, TokenKind.RIGHT_BRACE);
    return list;
  }

  /** Parses a brace-delimited list of items, discarding comments and
   * annotations. */
  private <E> List<E> items(Supplier<E> item) {
    return items(expect(TokenKind.LEFT_BRACE), item);
  }

  /** Parses items up to the brace that closes {@code open}. */
  private <E> List<E> items(Token open, Supplier<E> item) {
    final List<E> list = new ArrayList<>();
    for (;;) {
      skipTrivia();
      if (at(TokenKind.RIGHT_BRACE) || at(TokenKind.EOF)) {
        break;
      }
      list.add(item.get());
    }
    close(open, TokenKind.RIGHT_BRACE);
    return list;
  }

  /** Skips separators, comments and annotations. */
  private void skipTrivia() {
    for (;;) {
      final Token t = peek();
      if (t.is(TokenKind.SEMICOLON) || t.is(TokenKind.COMMA)
          || t.isComment()) {
        advance();
      } else if (t.is(TokenKind.ANNOTATION)) {
        annotation();
      } else {
        return;
      }
    }
  }

  /** Skips a brace-delimited body, including nested braces. */
  private void skipBraces() {
    final Token open = expect(TokenKind.LEFT_BRACE);
    int depth = 1;
    while (depth > 0) {
      final Token t = advance();
      switch (t.kind) {
      case LEFT_BRACE:
        ++depth;
        break;
      case RIGHT_BRACE:
        --depth;
        break;
      case EOF:
        throw MdslParseException.missingClosingDelimiter("}", open.pos);
      default:
        break;
      }
    }
  }

  /** Consumes a closing delimiter. */
  private Token close(Token open, TokenKind kind) {
    if (at(kind)) {
      return advance();
    }
    if (at(TokenKind.EOF)) {
      throw MdslParseException.missingClosingDelimiter(
          requireSymbol(kind), open.pos);
    }
    throw unexpected("'" + requireSymbol(kind) + "'");
  }

  // names

  /** Whether a token can be used as a name. */
  private static boolean isName(Token t) {
    return t.kind == TokenKind.IDENTIFIER
        || t.kind == TokenKind.KEYWORD && NAME_KEYWORDS.contains(t.keyword());
  }

  /** Parses a name: an identifier, or a keyword that doubles as a name, in
   * which case the name is the keyword's lower-case spelling. */
  private String name() {
    final Token t = peek();
    if (!isName(t)) {
      throw unexpected("identifier");
    }
    advance();
    return fieldName(t);
  }

  private static String fieldName(Token t) {
    return t.kind == TokenKind.KEYWORD ? t.keyword().spelling : t.text;
  }

  /** Parses a string literal or a name. */
  private String stringOrName() {
    if (at(TokenKind.STRING)) {
      return advance().stringValue();
    }
    if (isName(peek())) {
      return name();
    }
    throw unexpected("string", "identifier");
  }

  /** Returns the value of a number token that must be an integer. */
  private static int integer(Token t) {
    final Integer i = toIntExact(t.doubleValue());
    if (i == null) {
      throw MdslParseException.invalidSyntax(
          "expected an integer, found '" + t.text + "'", t.pos);
    }
    return i;
  }

  // token stream

  private Token peek() {
    return tokens.get(i);
  }

  private Token peek(int n) {
    return tokens.get(Math.min(i + n, tokens.size() - 1));
  }

  private Token previous() {
    return tokens.get(Math.max(i - 1, 0));
  }

  /** Consumes the current token and returns it. Never moves past
   * end-of-input. */
  private Token advance() {
    final Token t = tokens.get(i);
    if (t.kind != TokenKind.EOF) {
      ++i;
    }
    return t;
  }

  private boolean at(TokenKind kind) {
    return peek().kind == kind;
  }

  private boolean at(Keyword keyword) {
    return peek().is(keyword);
  }

  private boolean accept(TokenKind kind) {
    if (at(kind)) {
      advance();
      return true;
    }
    return false;
  }

  private boolean accept(Keyword keyword) {
    if (at(keyword)) {
      advance();
      return true;
    }
    return false;
  }

  private Token expect(TokenKind kind) {
    if (at(kind)) {
      return advance();
    }
    throw unexpected(describe(kind));
  }

  private Token expect(Keyword keyword) {
    if (at(keyword)) {
      return advance();
    }
    throw unexpected(keyword.name());
  }

  /** Creates an exception for the current token. */
  private MdslParseException unexpected(String... expected) {
    final Token t = peek();
    if (t.kind == TokenKind.EOF) {
      return MdslParseException.unexpectedEof(ImmutableList.copyOf(expected),
          t.pos);
    }
    return MdslParseException.unexpectedToken(t.text,
        ImmutableList.copyOf(expected), t.pos);
  }

  private static String describe(TokenKind kind) {
    if (kind.symbol != null) {
      return "'" + kind.symbol + "'";
    }
    switch (kind) {
    case IDENTIFIER:
      return "identifier";
    case STRING:
      return "string";
    case NUMBER:
      return "number";
    default:
      return kind.name();
    }
  }

  private static String requireSymbol(TokenKind kind) {
    final @Nullable String symbol = kind.symbol;
    checkArgument(symbol != null, kind);
    return symbol;
  }

  /** Returns a position from {@code start} to the end of the most recently
   * consumed token. */
  private Pos span(Pos start) {
    return start.plus(previous().pos);
  }
}

// End MdslParser.java
