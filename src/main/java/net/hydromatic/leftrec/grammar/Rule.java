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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A non-terminal and the productions that define it.
 *
 * <p>The order of productions matters only when the rule is printed.
 */
public final class Rule {
  private final Symbol symbol;
  private final ImmutableList<Production> derivations;

  private Rule(Symbol symbol, ImmutableList<Production> derivations) {
    this.symbol = symbol;
    this.derivations = derivations;
  }

  /**
   * Creates a rule.
   *
   * @param symbol Text of the left-hand side, for example {@code <EXPR>}
   * @param productions Alternatives; must not be empty
   * @throws GrammarException if the left-hand side is empty or a terminal, or
   *     if there are no productions
   */
  public static Rule of(String symbol, List<Production> productions) {
    final Symbol lhs = Symbol.of(symbol);
    if (lhs.isTerminal()) {
      throw GrammarException.terminalLeftHandSide(symbol);
    }
    final ImmutableList<Production> list = ImmutableList.copyOf(productions);
    if (list.isEmpty()) {
      throw GrammarException.noProductions(symbol);
    }
    return new Rule(lhs, list);
  }

  public static Rule of(String symbol, Production... productions) {
    return of(symbol, ImmutableList.copyOf(productions));
  }

  public Symbol symbol() {
    return symbol;
  }

  public List<Production> derivations() {
    return derivations;
  }

  /**
   * Returns whether any production starts with this rule's own left-hand
   * side, as in {@code <A> := <A> x}.
   */
  public boolean hasDirectLeftRecursion() {
    return firstDirectlyRecursive() != null;
  }

  /** Returns the first production that starts with this rule's left-hand
   * side, or null. */
  @Nullable Production firstDirectlyRecursive() {
    for (Production production : derivations) {
      if (production.firstSymbol().equals(symbol)) {
        return production;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return symbol + " := " + derivations;
  }
}

// End Rule.java
