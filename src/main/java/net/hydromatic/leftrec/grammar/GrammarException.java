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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A grammar is malformed.
 *
 * <p>Thrown while constructing a {@link Symbol}, {@link Production} or {@link
 * Rule}, or while analyzing a {@link Grammar} that refers to a non-terminal it
 * does not define. The {@link #kind()} tells which.
 */
public class GrammarException extends RuntimeException {
  private final Kind kind;
  private final @Nullable String symbol;

  private GrammarException(Kind kind, String message, @Nullable String symbol) {
    super(message);
    this.kind = requireNonNull(kind);
    this.symbol = symbol;
  }

  static GrammarException invalidSymbol() {
    return new GrammarException(
        Kind.INVALID_SYMBOL, "Symbol text must be a non-empty string", null);
  }

  static GrammarException invalidProduction() {
    return new GrammarException(
        Kind.INVALID_PRODUCTION,
        "Production must have at least one symbol",
        null);
  }

  static GrammarException terminalLeftHandSide(String symbol) {
    return new GrammarException(
        Kind.INVALID_RULE,
        String.format(
            "Left-hand side of rule must be non-terminal, was '%s'", symbol),
        symbol);
  }

  static GrammarException noProductions(String symbol) {
    return new GrammarException(
        Kind.INVALID_RULE,
        String.format("Rule '%s' must have at least one production", symbol),
        symbol);
  }

  static GrammarException undefinedNonTerminal(String symbol) {
    return new GrammarException(
        Kind.UNDEFINED_NON_TERMINAL,
        String.format("No rule defines non-terminal '%s'", symbol),
        symbol);
  }

  /** Returns what kind of error this is. */
  public Kind kind() {
    return kind;
  }

  /**
   * Returns the text of the symbol that caused the error, or null if the
   * error is not about a particular symbol.
   */
  public @Nullable String symbol() {
    return symbol;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(kind).append(": ").append(getMessage());
  }

  /** Kinds of grammar error. */
  public enum Kind {
    /** Symbol text is empty. */
    INVALID_SYMBOL,
    /** Production has no symbols. */
    INVALID_PRODUCTION,
    /** Rule has a terminal left-hand side, or no productions. */
    INVALID_RULE,
    /** Analysis looked up a non-terminal that no rule defines. */
    UNDEFINED_NON_TERMINAL
  }
}

// End GrammarException.java
