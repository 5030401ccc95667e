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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Context-free grammar, and the analysis that decides whether it is
 * left-recursive.
 *
 * <p>A grammar is left-recursive if some non-terminal can derive, by
 * repeatedly expanding the leftmost symbol, a sequence that starts with that
 * same non-terminal. A recursive-descent parser generated from such a grammar
 * would loop forever.
 *
 * <p>Rules are not linked to each other; whenever the analysis needs the
 * definition of a non-terminal it scans the list of rules for one whose
 * left-hand side has the same text. If several rules have the same left-hand
 * side, the first wins.
 *
 * <p>A grammar is immutable.
 */
public final class Grammar {
  private final ImmutableList<Rule> rules;

  private Grammar(ImmutableList<Rule> rules) {
    this.rules = rules;
  }

  /** Creates a grammar. Does not check that every non-terminal is
   * defined. */
  public static Grammar of(List<Rule> rules) {
    return new Grammar(ImmutableList.copyOf(rules));
  }

  public static Grammar of(Rule... rules) {
    return of(ImmutableList.copyOf(rules));
  }

  /** Returns the rules, in the order they were given. */
  public List<Rule> rules() {
    return rules;
  }

  /** Returns the rule that defines a given non-terminal, if any. */
  public Optional<Rule> findRule(Symbol symbol) {
    final int i = ruleIndex(symbol);
    return i < 0 ? Optional.empty() : Optional.of(rules.get(i));
  }

  /**
   * Returns the rule that defines a given non-terminal.
   *
   * @throws GrammarException if no rule defines {@code symbol}
   */
  public Rule getRule(Symbol symbol) {
    return rules.get(getRuleIndex(symbol));
  }

  private int ruleIndex(Symbol symbol) {
    requireNonNull(symbol, "symbol");
    return Iterables.indexOf(rules, rule -> rule.symbol().equals(symbol));
  }

  private int getRuleIndex(Symbol symbol) {
    final int i = ruleIndex(symbol);
    if (i < 0) {
      throw GrammarException.undefinedNonTerminal(symbol.text());
    }
    return i;
  }

  /** Returns whether the grammar is left-recursive, directly or indirectly. */
  public boolean hasLeftRecursion() {
    return hasLeftRecursion(Tracers.empty());
  }

  /**
   * Returns whether the grammar is left-recursive, notifying a tracer.
   *
   * <p>Checks each rule for direct left recursion first; only if none is
   * found does it walk the leftmost derivations.
   *
   * @throws GrammarException if the walk reaches an undefined non-terminal
   */
  public boolean hasLeftRecursion(Tracer tracer) {
    for (Rule rule : rules) {
      final Production production = rule.firstDirectlyRecursive();
      if (production != null) {
        tracer.onDirectLeftRecursion(rule, production);
        return true;
      }
    }
    return hasIndirectLeftRecursion(tracer);
  }

  /**
   * Returns whether any non-terminal derives itself in leftmost position, in
   * one or more steps. Direct left recursion is the one-step case, so it is
   * detected too.
   */
  public boolean hasIndirectLeftRecursion() {
    return hasIndirectLeftRecursion(Tracers.empty());
  }

  public boolean hasIndirectLeftRecursion(Tracer tracer) {
    for (Rule rule : rules) {
      if (derivesToSymbol(rule.symbol(), rule.symbol(), tracer)) {
        tracer.onLeftRecursion(rule.symbol());
        return true;
      }
    }
    return false;
  }

  /** Returns the left-hand side of every rule that derives itself in
   * leftmost position, in rule order. */
  public List<Symbol> leftRecursiveSymbols() {
    return leftRecursiveSymbols(Tracers.empty());
  }

  public List<Symbol> leftRecursiveSymbols(Tracer tracer) {
    final ImmutableList.Builder<Symbol> b = ImmutableList.builder();
    for (Rule rule : rules) {
      if (derivesToSymbol(rule.symbol(), rule.symbol(), tracer)) {
        tracer.onLeftRecursion(rule.symbol());
        b.add(rule.symbol());
      }
    }
    return b.build();
  }

  /**
   * Returns whether {@code target} can be reached from {@code start} by
   * repeatedly replacing a non-terminal with the leftmost symbol of one of its
   * productions. At least one step is taken, so a non-terminal reaches itself
   * only if it is left-recursive.
   *
   * <p>A terminal reaches nothing.
   *
   * @throws GrammarException if the walk reaches a non-terminal that no rule
   *     defines
   */
  public boolean derivesToSymbol(Symbol start, Symbol target) {
    return derivesToSymbol(start, target, Tracers.empty());
  }

  public boolean derivesToSymbol(Symbol start, Symbol target, Tracer tracer) {
    requireNonNull(target, "target");
    requireNonNull(tracer, "tracer");
    return derives(start, target, new HashSet<>(), tracer);
  }

  /** Depth-first walk of the leftmost-symbol graph. Each rule is expanded at
   * most once per query; {@code visited} holds the indexes of rules already
   * expanded. */
  private boolean derives(
      Symbol start, Symbol target, Set<Integer> visited, Tracer tracer) {
    if (start.isTerminal()) {
      return false;
    }
    final int i = getRuleIndex(start);
    if (!visited.add(i)) {
      tracer.onRevisit(start);
      return false;
    }
    for (Production production : rules.get(i).derivations()) {
      final Symbol first = production.firstSymbol();
      tracer.onStep(start, first);
      if (first.equals(target) || derives(first, target, visited, tracer)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return GrammarWriter.create().write(this);
  }
}

// End Grammar.java
