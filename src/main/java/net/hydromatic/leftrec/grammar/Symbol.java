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

/**
 * Element of a grammar's vocabulary.
 *
 * <p>A symbol whose text starts with {@code <}, such as {@code <EXPR>}, is a
 * non-terminal; any other symbol is a terminal. Two symbols are equal if their
 * texts are equal.
 */
public final class Symbol {
  private final String text;

  private Symbol(String text) {
    this.text = text;
  }

  /**
   * Creates a symbol.
   *
   * @param text Text of the symbol
   * @throws GrammarException if {@code text} is empty
   */
  public static Symbol of(String text) {
    requireNonNull(text, "text");
    if (text.isEmpty()) {
      throw GrammarException.invalidSymbol();
    }
    return new Symbol(text);
  }

  public String text() {
    return text;
  }

  /** Returns whether this symbol is a terminal, i.e. cannot be expanded. */
  public boolean isTerminal() {
    return text.charAt(0) != '<';
  }

  public boolean isNonTerminal() {
    return !isTerminal();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Symbol && text.equals(((Symbol) o).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}

// End Symbol.java
