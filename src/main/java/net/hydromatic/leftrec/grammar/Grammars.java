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

/** Sample grammars. */
public abstract class Grammars {
  private Grammars() {}

  /**
   * Returns a grammar of regular expressions.
   *
   * <p>Operators are layered by precedence: alternation ({@code |}) binds
   * loosest, then concatenation, then Kleene star ({@code *}), then
   * parentheses. Each layer refers first to the layer below it, never above,
   * so the grammar is not left-recursive.
   */
  public static Grammar regex() {
    return Grammar.of(
        Rule.of("<REGEX>", Production.of("<LOW_PRECEDENCE>")),
        Rule.of(
            "<LOW_PRECEDENCE>",
            Production.of("<MED_PRECEDENCE>", "<ALTERNAT>")),
        Rule.of(
            "<ALTERNAT>",
            Production.of("|", "<LOW_PRECEDENCE>"),
            Production.of("EmptyString")),
        Rule.of(
            "<MED_PRECEDENCE>", Production.of("<HIGH_PRECEDENCE>", "<CONCAT>")),
        Rule.of(
            "<CONCAT>",
            Production.of("<MED_PRECEDENCE>"),
            Production.of("EmptyString")),
        Rule.of(
            "<HIGH_PRECEDENCE>",
            Production.of("<GIGA_PRECEDENCE>", "<KLEENE>")),
        Rule.of("<KLEENE>", Production.of("*"), Production.of("EmptyString")),
        Rule.of(
            "<GIGA_PRECEDENCE>",
            Production.of("(", "<LOW_PRECEDENCE>", ")"),
            Production.of("<TERMINAL>")),
        Rule.of(
            "<TERMINAL>",
            Production.of("EmptySet"),
            Production.of("EmptyString"),
            Production.of("C")));
  }
}

// End Grammars.java
