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
package net.hydromatic.leftrec;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.leftrec.grammar.Grammar;
import net.hydromatic.leftrec.grammar.GrammarWriter;
import net.hydromatic.leftrec.grammar.Grammars;
import net.hydromatic.leftrec.grammar.Rule;
import net.hydromatic.leftrec.grammar.Symbol;
import net.hydromatic.leftrec.grammar.Tracer;
import net.hydromatic.leftrec.grammar.Tracers;
import net.hydromatic.leftrec.util.Prop;

/** Prints a grammar and whether it is left-recursive. */
public class Main {
  private final PrintWriter out;
  private final Grammar grammar;
  private final Map<Prop, Object> propMap;

  /**
   * Command-line entry point.
   *
   * <p>Analyzes the {@link Grammars#regex() regex grammar}. Arguments are
   * properties, in the form {@code --name=value}; {@code --trace} is short
   * for {@code --trace=true}.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Main main =
        new Main(argList, System.out, Grammars.regex(), new LinkedHashMap<>());
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(
      List<String> args,
      PrintStream out,
      Grammar grammar,
      Map<Prop, Object> propMap) {
    this(args, new OutputStreamWriter(out), grammar, propMap);
  }

  /** Creates a Main.
   *
   * @throws IllegalArgumentException if an argument is not a valid property
   */
  public Main(
      List<String> argList,
      Writer out,
      Grammar grammar,
      Map<Prop, Object> propMap) {
    this.out = buffer(out);
    this.grammar = requireNonNull(grammar);
    this.propMap = propMap;
    for (String arg : argList) {
      parseArg(arg);
    }
  }

  private void parseArg(String arg) {
    if (!arg.startsWith("--")) {
      throw new IllegalArgumentException("unknown argument: " + arg);
    }
    final int i = arg.indexOf('=');
    if (i < 0) {
      // A flag, such as "--trace", sets a boolean property to true
      Prop.lookup(arg.substring(2)).set(propMap, true);
    } else {
      final Prop prop = Prop.lookup(arg.substring(2, i));
      prop.setLenient(propMap, arg.substring(i + 1));
    }
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  /** Writes the grammar, then whether it is left-recursive.
   *
   * <p>If the grammar is left-recursive, also lists the culprits: the
   * directly left-recursive rules if there are any, otherwise every
   * non-terminal that derives itself in leftmost position.
   *
   * @throws net.hydromatic.leftrec.grammar.GrammarException if the grammar
   *     refers to an undefined non-terminal
   */
  public void run() {
    out.println(GrammarWriter.create(propMap).write(grammar));
    final Tracer tracer =
        Prop.TRACE.booleanValue(propMap)
            ? Tracers.printTracer(out)
            : Tracers.empty();
    final boolean leftRecursive = grammar.hasLeftRecursion(tracer);
    out.println("Has left recursion? " + leftRecursive);
    if (leftRecursive) {
      final List<Symbol> symbols = leftRecursiveSymbols();
      if (!symbols.isEmpty()) {
        out.println("Left-recursive: " + Joiner.on(", ").join(symbols));
      }
    }
    out.flush();
  }

  /** Returns the symbols to blame for left recursion. Walks leftmost
   * derivations only if no rule is directly left-recursive, the same
   * condition under which {@link Grammar#hasLeftRecursion()} walks them. */
  private List<Symbol> leftRecursiveSymbols() {
    final Set<Symbol> direct = new LinkedHashSet<>();
    for (Rule rule : grammar.rules()) {
      if (rule.hasDirectLeftRecursion()) {
        direct.add(rule.symbol());
      }
    }
    return direct.isEmpty()
        ? grammar.leftRecursiveSymbols()
        : ImmutableList.copyOf(direct);
  }
}

// End Main.java
