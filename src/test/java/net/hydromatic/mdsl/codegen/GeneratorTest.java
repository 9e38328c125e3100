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

import net.hydromatic.mdsl.compile.Prop;

import org.junit.jupiter.api.Test;

import static net.hydromatic.mdsl.Matchers.describedAs;
import static net.hydromatic.mdsl.Matchers.throwsA;
import static net.hydromatic.mdsl.Mdsl.assertError;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;

/** Tests {@link Generator}. */
public class GeneratorTest {
  @Test void testOf() {
    assertThat(Generator.of(Prop.Target.SQL), instanceOf(SqlGenerator.class));
    assertThat(Generator.of(Prop.Target.SQL_ANMI),
        instanceOf(AnmiSqlGenerator.class));
    assertThat(Generator.of(Prop.Target.CYPHER),
        instanceOf(CypherGenerator.class));
  }

  @Test void testLookup() {
    assertThat(Generator.lookup("sql"), instanceOf(SqlGenerator.class));
    assertThat(Generator.lookup("sql-anmi"),
        instanceOf(AnmiSqlGenerator.class));
    assertThat(Generator.lookup("Cypher"),
        instanceOf(CypherGenerator.class));
  }

  @Test void testLookupInvalid() {
    assertError(() -> Generator.lookup("graphql"),
        describedAs("Code generation error: Invalid target 'graphql': "
            + "expected one of sql, sql-anmi, cypher"));
    assertError(() -> Generator.lookup(""),
        throwsA("Invalid target '': target name is required"));
    assertError(() -> Generator.lookup(null),
        throwsA("Invalid target 'null': target name is required"));
  }
}

// End GeneratorTest.java
