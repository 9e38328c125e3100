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

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static net.hydromatic.mdsl.Matchers.throwsA;
import static net.hydromatic.mdsl.Mdsl.assertError;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("TARGET"), is(Prop.TARGET));
    assertThat(Prop.lookup("target"), is(Prop.TARGET));
    assertThat(Prop.lookup("validateBeforeGenerate"),
        is(Prop.VALIDATE_BEFORE_GENERATE));
    assertThat(Prop.lookup("MAX_TEXT_LENGTH"), is(Prop.MAX_TEXT_LENGTH));
    assertError(() -> Prop.lookup("noSuchProp"),
        throwsA("property noSuchProp not found"));
  }

  @Test void testSortedByCamelName() {
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.FILE));
    assertThat(Prop.BY_CAMEL_NAME.get(Prop.BY_CAMEL_NAME.size() - 1),
        is(Prop.VALIDATE_BEFORE_GENERATE));
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.FILE.stringValue(map), is(""));
    assertThat(Prop.REPORT_FORMAT.enumValue(map, Prop.ReportFormat.class),
        is(Prop.ReportFormat.TEXT));
    assertThat(Prop.TARGET.enumValue(map, Prop.Target.class),
        is(Prop.Target.SQL));
    assertThat(Prop.VALIDATE_BEFORE_GENERATE.booleanValue(map), is(true));
    assertThat(Prop.GLOBAL_FAMILY_NAME.stringValue(map),
        is("Global Relationships"));
    assertThat(Prop.MAX_TEXT_LENGTH.intValue(map), is(65_535));
    assertThat(Prop.TARGET.get(map), is((Object) Prop.Target.SQL));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.TARGET.set(map, Prop.Target.CYPHER);
    assertThat(Prop.TARGET.enumValue(map, Prop.Target.class),
        is(Prop.Target.CYPHER));
    Prop.MAX_TEXT_LENGTH.set(map, 10);
    assertThat(Prop.MAX_TEXT_LENGTH.intValue(map), is(10));

    assertError(() -> Prop.VALIDATE_BEFORE_GENERATE.set(map, "yes"),
        throwsA("value for property must have type class java.lang.Boolean"));
    assertError(() -> Prop.FILE.set(map, null),
        throwsA("property is required"));
    assertError(() -> Prop.FILE.booleanValue(map),
        throwsA("invalid type class java.lang.Boolean for property file"));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.TARGET.setLenient(map, "sql_anmi");
    assertThat(Prop.TARGET.enumValue(map, Prop.Target.class),
        is(Prop.Target.SQL_ANMI));
    Prop.REPORT_FORMAT.setLenient(map, "Json");
    assertThat(Prop.REPORT_FORMAT.enumValue(map, Prop.ReportFormat.class),
        is(Prop.ReportFormat.JSON));
    // non-enum properties are set as usual
    Prop.FILE.setLenient(map, "media.mdsl");
    assertThat(Prop.FILE.stringValue(map), is("media.mdsl"));

    assertError(() -> Prop.REPORT_FORMAT.setLenient(map, "xml"),
        throwsA("value must be one of: 'TEXT', 'COLORED', 'JSON', 'CSV'"));
  }
}

// End PropTest.java
