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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Property that controls compilation.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is not
 * in the map has its default value. Every property has a default, so a
 * property cannot be set to null.
 *
 * @see Compiles#compile
 */
public enum Prop {
  /**
   * String property "file" is the name of the source document. It appears in
   * positions and in the header of validation reports. Default is the empty
   * string.
   */
  FILE("file", String.class, ""),

  /**
   * Property "reportFormat" is the format of {@link CompiledProgram#report()}.
   * Default is {@link ReportFormat#TEXT}.
   */
  REPORT_FORMAT("reportFormat", ReportFormat.class, ReportFormat.TEXT),

  /**
   * Property "target" is the code generator that {@link
   * CompiledProgram#generate()} uses. Default is {@link Target#SQL}.
   */
  TARGET("target", Target.class, Target.SQL),

  /**
   * Boolean property "validateBeforeGenerate" controls whether code
   * generation first checks that validation passed. Default is true.
   */
  VALIDATE_BEFORE_GENERATE(
      "validateBeforeGenerate", Boolean.class, true),

  /**
   * String property "globalFamilyName" is the name of the family that is
   * created to hold top-level relationships when the program declares no
   * family. Default is "Global Relationships".
   */
  GLOBAL_FAMILY_NAME(
      "globalFamilyName", String.class, "Global Relationships"),

  /**
   * Integer property "maxTextLength" is the length above which a {@code
   * TEXT(n)} field draws a warning. Default is 65,535.
   */
  MAX_TEXT_LENGTH("maxTextLength", Integer.class, 65_535);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final ImmutableList<Prop> BY_CAMEL_NAME;

  static {
    BY_CAMEL_NAME =
        Arrays.stream(values())
            .sorted(Comparator.comparing((Prop p) -> p.camelName))
            .collect(ImmutableList.toImmutableList());
    final ImmutableMap.Builder<String, Prop> b = ImmutableMap.builder();
    for (Prop prop : BY_CAMEL_NAME) {
      b.put(prop.name(), prop);
      b.put(prop.camelName, prop);
    }
    BY_NAME = b.build();
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = requireNonNull(defaultValue);
    checkArgument(
        CaseFormat.LOWER_CAMEL.to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()),
        "camel name %s does not match %s", camelName, name());
    checkArgument(type.isInstance(defaultValue),
        "default value of %s must have type %s", camelName, type);
  }

  /** Looks up a property by name or camel name. Throws if not found;
   * never returns null. */
  public static Prop lookup(String propName) {
    final Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property, or its default value. */
  public Object get(Map<Prop, Object> map) {
    return map.getOrDefault(this, defaultValue);
  }

  /** Returns the value of a property, having checked that the property has
   * the requested type. */
  private <T> T value(Map<Prop, Object> map, Class<T> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", requestedType, camelName);
    return requestedType.cast(get(map));
  }

  public boolean booleanValue(Map<Prop, Object> map) {
    return value(map, Boolean.class);
  }

  public int intValue(Map<Prop, Object> map) {
    return value(map, Integer.class);
  }

  public String stringValue(Map<Prop, Object> map) {
    return value(map, String.class);
  }

  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> enumClass) {
    return value(map, enumClass);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      throw new IllegalArgumentException("property is required");
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException(
          "value for property must have type " + type);
    }
    map.put(this, value);
  }

  /** Sets the value of a property, converting a string to a value of an
   * enum property. Case does not matter, and '-' may be used for '_';
   * so "sql-anmi" is a valid value of {@link #TARGET}. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (!type.isEnum() || !(value instanceof String)) {
      set(map, value);
      return;
    }
    final String name =
        ((String) value).toUpperCase(Locale.ROOT).replace('-', '_');
    final Object[] constants = type.getEnumConstants();
    for (Object constant : constants) {
      if (((Enum<?>) constant).name().equals(name)) {
        set(map, constant);
        return;
      }
    }
    throw new IllegalArgumentException("value must be one of: "
        + Arrays.stream(constants)
            .map(c -> "'" + ((Enum<?>) c).name() + "'")
            .collect(Collectors.joining(", ")));
  }

  /** Allowed values for {@link #REPORT_FORMAT} property. */
  public enum ReportFormat {
    /** Plain text, with a header, a summary and numbered issues. The
     * default. */
    TEXT,
    /** Text for a console, with ANSI colors by severity. */
    COLORED,
    /** JSON document. */
    JSON,
    /** Comma-separated values, one row per issue. */
    CSV
  }

  /** Allowed values for {@link #TARGET} property. */
  public enum Target {
    /** Generic relational schema with {@code INSERT} statements. The
     * default. */
    SQL,
    /** Fixed schema of the ANMI database, namespace {@code graphv3}. */
    SQL_ANMI,
    /** Property-graph script in Cypher. */
    CYPHER
  }
}

// End Prop.java
