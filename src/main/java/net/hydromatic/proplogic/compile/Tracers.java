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
package net.hydromatic.proplogic.compile;

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.SymbolTable;

/** Implementations of {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on the result of each
   * pass of the simplifier, then calls the underlying tracer.
   */
  public static Tracer withOnPass(Tracer tracer,
      BiConsumer<Integer, Formula> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPass(int pass, Formula formula) {
        consumer.accept(pass, formula);
        super.onPass(pass, formula);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action each time the simplifier
   * applies a rule, then calls the underlying tracer.
   */
  public static Tracer withOnRewrite(Tracer tracer,
      Consumer<Simplifier.Rule> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRewrite(Simplifier.Rule rule, Formula before,
          Formula after) {
        consumer.accept(rule);
        super.onRewrite(rule, before, after);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result of each
   * step of normal form conversion, then calls the underlying tracer.
   */
  public static Tracer withOnStep(Tracer tracer,
      BiConsumer<NormalForms.Step, Formula> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onStep(NormalForms.Step step, Formula formula) {
        consumer.accept(step, formula);
        super.onStep(step, formula);
      }
    };
  }

  /**
   * Returns a tracer that prints each event to a writer, writing formulas
   * with the given symbols.
   */
  public static Tracer printing(PrintWriter out, SymbolTable symbolTable) {
    return new PrintingTracer(out, symbolTable);
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onPass(int pass, Formula formula) {
    }

    @Override public void onRewrite(Simplifier.Rule rule, Formula before,
        Formula after) {
    }

    @Override public void onStep(NormalForms.Step step, Formula formula) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override public void onPass(int pass, Formula formula) {
      tracer.onPass(pass, formula);
    }

    @Override public void onRewrite(Simplifier.Rule rule, Formula before,
        Formula after) {
      tracer.onRewrite(rule, before, after);
    }

    @Override public void onStep(NormalForms.Step step, Formula formula) {
      tracer.onStep(step, formula);
    }
  }

  /** Tracer that prints events. */
  private static class PrintingTracer implements Tracer {
    private final PrintWriter out;
    private final SymbolTable symbolTable;

    PrintingTracer(PrintWriter out, SymbolTable symbolTable) {
      this.out = requireNonNull(out);
      this.symbolTable = requireNonNull(symbolTable);
    }

    @Override public void onPass(int pass, Formula formula) {
      out.println("[pass " + pass + "] " + formula.unparse(symbolTable));
    }

    @Override public void onRewrite(Simplifier.Rule rule, Formula before,
        Formula after) {
      out.println("[" + rule.camelName + "] " + before.unparse(symbolTable)
          + "  =>  " + after.unparse(symbolTable));
    }

    @Override public void onStep(NormalForms.Step step, Formula formula) {
      out.println("[" + step.camelName + "] " + formula.unparse(symbolTable));
    }
  }
}

// End Tracers.java
