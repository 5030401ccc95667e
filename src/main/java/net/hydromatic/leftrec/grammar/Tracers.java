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
package net.hydromatic.leftrec.grammar;

import static java.util.Objects.requireNonNull;

import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Implementations of {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that writes one line per event to a writer. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /**
   * Returns a tracer that performs the given action on each leftmost
   * expansion step, then calls the underlying tracer.
   */
  public static Tracer withOnStep(
      Tracer tracer, BiConsumer<Symbol, Symbol> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStep(Symbol from, Symbol to) {
        consumer.accept(from, to);
        super.onStep(from, to);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each left-recursive
   * non-terminal, then calls the underlying tracer.
   */
  public static Tracer withOnLeftRecursion(
      Tracer tracer, Consumer<Symbol> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onLeftRecursion(Symbol symbol) {
        consumer.accept(symbol);
        super.onLeftRecursion(symbol);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onStep(Symbol from, Symbol to) {}

    @Override
    public void onRevisit(Symbol symbol) {}

    @Override
    public void onDirectLeftRecursion(Rule rule, Production production) {}

    @Override
    public void onLeftRecursion(Symbol symbol) {}
  }

  /** Tracer that writes to a given {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void println(String s) {
      w.println(s);
      w.flush();
    }

    @Override
    public void onStep(Symbol from, Symbol to) {
      println("step " + from + " -> " + to);
    }

    @Override
    public void onRevisit(Symbol symbol) {
      println("revisit " + symbol);
    }

    @Override
    public void onDirectLeftRecursion(Rule rule, Production production) {
      println("direct " + rule.symbol() + " " + production);
    }

    @Override
    public void onLeftRecursion(Symbol symbol) {
      println("recursive " + symbol);
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onStep(Symbol from, Symbol to) {
      tracer.onStep(from, to);
    }

    @Override
    public void onRevisit(Symbol symbol) {
      tracer.onRevisit(symbol);
    }

    @Override
    public void onDirectLeftRecursion(Rule rule, Production production) {
      tracer.onDirectLeftRecursion(rule, production);
    }

    @Override
    public void onLeftRecursion(Symbol symbol) {
      tracer.onLeftRecursion(symbol);
    }
  }
}

// End Tracers.java
