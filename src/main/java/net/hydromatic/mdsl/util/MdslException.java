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
package net.hydromatic.mdsl.util;

import net.hydromatic.mdsl.ast.Pos;

/**
 * Exception that has a position in source text.
 *
 * <p>Each phase of the pipeline throws its own kind of exception, and each
 * describes itself with a prefix naming the phase, for example
 * "Parser error: ".
 */
public interface MdslException {
  /** Returns the position of the construct that caused the error. */
  Pos pos();

  /** Writes a description of this error, including the phase prefix. */
  StringBuilder describeTo(StringBuilder buf);
}

// End MdslException.java
