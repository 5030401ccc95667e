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

/** One alternative right-hand side of a {@link Rule}. */
public final class Production {
  private final ImmutableList<Symbol> symbols;

  private Production(ImmutableList<Symbol> symbols) {
    this.symbols = symbols;
  }

  /**
   * Creates a production.
   *
   * @param symbols Symbols, in order; must not be empty
   * @throws GrammarException if {@code symbols} is empty
   */
  public static Production of(List<Symbol> symbols) {
    final ImmutableList<Symbol> list = ImmutableList.copyOf(symbols);
    if (list.isEmpty()) {
      throw GrammarException.invalidProduction();
    }
    return new Production(list);
  }

  /** Creates a production from the texts of its symbols. */
  public static Production of(String... texts) {
    final ImmutableList.Builder<Symbol> b = ImmutableList.builder();
    for (String text : texts) {
      b.add(Symbol.of(text));
    }
    return of(b.build());
  }

  public List<Symbol> symbols() {
    return symbols;
  }

  /** Returns the leftmost symbol. Never fails, because a production is never
   * empty. */
  public Symbol firstSymbol() {
    return symbols.get(0);
  }

  @Override
  public String toString() {
    return symbols.toString();
  }
}

// End Production.java
