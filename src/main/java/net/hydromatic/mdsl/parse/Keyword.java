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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/** Reserved words of the language.
 *
 * <p>Matching is case-insensitive: "FAMILY", "Family" and "family" are all
 * {@link #FAMILY}. The set is closed; any other word is an identifier. */
public enum Keyword {
  IMPORT,
  LET,
  UNIT,
  VOCABULARY,
  FAMILY,
  /** Synonym for {@link #FAMILY}. */
  GROUP,
  OUTLET,
  TEMPLATE,
  EXTENDS,
  BASED_ON,
  OUTLET_REF,

  // field types
  ID,
  TEXT,
  NUMBER,
  BOOLEAN,
  CATEGORY,
  PRIMARY,
  KEY,

  // lifecycle
  STATUS,
  FROM,
  TO,
  CURRENT,

  // blocks
  IDENTITY,
  LIFECYCLE,
  CHARACTERISTICS,
  METADATA,
  METRICS,
  AGGREGATION,

  // data
  DATA,
  FOR,
  YEAR,

  // events
  EVENT,
  TYPE,
  DATE,
  ENTITIES,
  IMPACT,
  STAKE_BEFORE,
  STAKE_AFTER,
  TRIGGERED_BY_EVENT,
  CREATED_BY_EVENT,

  // relationships
  DIACHRONIC_LINK,
  SYNCHRONOUS_LINK,
  SYNCHRONOUS_LINKS,
  PREDECESSOR,
  SUCCESSOR,
  RELATIONSHIP_TYPE,
  EVENT_DATE,
  PERIOD,
  DETAILS,
  OUTLET_1,
  OUTLET_2,
  ROLE,

  // special values
  NOT_AVAILABLE("n.v."),
  NOT_APPLICABLE("n.a."),

  // reserved for overrides of inherited fields
  OVERRIDE,
  FOR_PERIOD,
  INHERITS_FROM,
  UNTIL,

  // catalogs
  CATALOG,
  SOURCE;

  /** Spelling of the keyword in lower case. */
  public final String spelling;

  private static final ImmutableMap<String, Keyword> BY_SPELLING;

  static {
    final ImmutableMap.Builder<String, Keyword> b = ImmutableMap.builder();
    for (Keyword keyword : values()) {
      b.put(keyword.spelling, keyword);
    }
    BY_SPELLING = b.build();
  }

  Keyword() {
    this.spelling = name().toLowerCase(Locale.ROOT);
  }

  Keyword(String spelling) {
    this.spelling = spelling;
  }

  /** Returns the keyword with a given spelling, ignoring case, or null if
   * the word is not reserved. */
  public static @Nullable Keyword lookup(String word) {
    return BY_SPELLING.get(word.toLowerCase(Locale.ROOT));
  }
}

// End Keyword.java
