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
import net.hydromatic.mdsl.parse.MdslParseException;
import net.hydromatic.mdsl.parse.Token;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a list of tokens,
   * then calls the underlying tracer. */
  public static Tracer withOnTokens(Tracer tracer,
      Consumer<List<Token>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onTokens(List<Token> tokens) {
        consumer.accept(tokens);
        super.onTokens(tokens);
      }
    };
  }

  /** Returns a tracer that performs the given action on a parse tree,
   * then calls the underlying tracer. */
  public static Tracer withOnAst(Tracer tracer,
      Consumer<Ast.Program> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onAst(Ast.Program program) {
        consumer.accept(program);
        super.onAst(program);
      }
    };
  }

  /** Returns a tracer that performs the given action on IR,
   * then calls the underlying tracer. */
  public static Tracer withOnIr(Tracer tracer,
      Consumer<Ir.Program> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onIr(Ir.Program program) {
        consumer.accept(program);
        super.onIr(program);
      }
    };
  }

  public static Tracer withOnValidation(Tracer tracer,
      Consumer<ValidationResult> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onValidation(ValidationResult result) {
        consumer.accept(result);
        super.onValidation(result);
      }
    };
  }

  public static Tracer withOnOutput(Tracer tracer,
      BiConsumer<Prop.Target, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onOutput(Prop.Target target, String output) {
        consumer.accept(target, output);
        super.onOutput(target, output);
      }
    };
  }

  public static Tracer withOnParseException(Tracer tracer,
      Consumer<@Nullable MdslParseException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean handleParseException(
          @Nullable MdslParseException e) {
        consumer.accept(e);
        super.handleParseException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onTokens(List<Token> tokens) {
    }

    @Override public void onAst(Ast.Program program) {
    }

    @Override public void onIr(Ir.Program program) {
    }

    @Override public void onValidation(ValidationResult result) {
    }

    @Override public void onOutput(Prop.Target target, String output) {
    }

    @Override public boolean handleParseException(
        @Nullable MdslParseException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onTokens(List<Token> tokens) {
      tracer.onTokens(tokens);
    }

    @Override public void onAst(Ast.Program program) {
      tracer.onAst(program);
    }

    @Override public void onIr(Ir.Program program) {
      tracer.onIr(program);
    }

    @Override public void onValidation(ValidationResult result) {
      tracer.onValidation(result);
    }

    @Override public void onOutput(Prop.Target target, String output) {
      tracer.onOutput(target, output);
    }

    @Override public boolean handleParseException(
        @Nullable MdslParseException e) {
      return tracer.handleParseException(e);
    }
  }
}

// End Tracers.java
