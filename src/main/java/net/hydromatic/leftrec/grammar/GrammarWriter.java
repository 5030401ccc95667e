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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.leftrec.util.Prop;

/**
 * Converts a {@link Grammar} to text.
 *
 * <p>Each rule occupies one line. Left-hand sides are padded so that the
 * definition separators line up:
 *
 * <pre>{@code
 * <EXPR>      := <TERM><EXPR_TAIL>
 * <EXPR_TAIL> := +<EXPR> or EmptyString
 * <TERM>      := x or (<EXPR>)
 * }</pre>
 *
 * <p>The symbols of a production are written without separators.
 */
public class GrammarWriter {
  private final String definitionSeparator;
  private final String alternativeSeparator;

  private GrammarWriter(String definitionSeparator,
      String alternativeSeparator) {
    this.definitionSeparator = requireNonNull(definitionSeparator);
    this.alternativeSeparator = requireNonNull(alternativeSeparator);
  }

  /** Creates a writer with default separators. */
  public static GrammarWriter create() {
    return create(ImmutableMap.of());
  }

  /** Creates a writer whose separators are given by properties
   * {@link Prop#DEFINITION_SEPARATOR} and
   * {@link Prop#ALTERNATIVE_SEPARATOR}. */
  public static GrammarWriter create(Map<Prop, Object> propMap) {
    return new GrammarWriter(
        Prop.DEFINITION_SEPARATOR.stringValue(propMap),
        Prop.ALTERNATIVE_SEPARATOR.stringValue(propMap));
  }

  /** Returns a copy of this writer with a given definition separator. */
  public GrammarWriter withDefinitionSeparator(String definitionSeparator) {
    return new GrammarWriter(definitionSeparator, alternativeSeparator);
  }

  /** Returns a copy of this writer with a given alternative separator. */
  public GrammarWriter withAlternativeSeparator(String alternativeSeparator) {
    return new GrammarWriter(definitionSeparator, alternativeSeparator);
  }

  public String write(Grammar grammar) {
    return describeTo(new StringBuilder(), grammar).toString();
  }

  public StringBuilder describeTo(StringBuilder buf, Grammar grammar) {
    int longest = 0;
    for (Rule rule : grammar.rules()) {
      longest = Math.max(longest, rule.symbol().text().length());
    }
    for (Rule rule : grammar.rules()) {
      describeTo(buf, rule, longest);
    }
    return buf;
  }

  /** Writes a rule, padding its left-hand side to {@code width} plus one
   * characters, followed by a line ending. */
  StringBuilder describeTo(StringBuilder buf, Rule rule, int width) {
    final String lhs = rule.symbol().text();
    buf.append(lhs)
        .append(Strings.repeat(" ", width - lhs.length() + 1))
        .append(definitionSeparator);
    for (int i = 0; i < rule.derivations().size(); i++) {
      if (i > 0) {
        buf.append(alternativeSeparator);
      }
      describeTo(buf, rule.derivations().get(i));
    }
    return buf.append('\n');
  }

  public StringBuilder describeTo(StringBuilder buf, Production production) {
    for (Symbol symbol : production.symbols()) {
      buf.append(symbol.text());
    }
    return buf;
  }
}

// End GrammarWriter.java
