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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import net.hydromatic.leftrec.grammar.Grammar;
import net.hydromatic.leftrec.grammar.GrammarException;
import net.hydromatic.leftrec.grammar.Grammars;
import net.hydromatic.leftrec.grammar.Production;
import net.hydromatic.leftrec.grammar.Rule;
import org.junit.jupiter.api.Test;

/** Kick the tires. */
public class MainTest {
  private static String run(List<String> args, Grammar grammar) {
    final StringWriter sw = new StringWriter();
    new Main(args, sw, grammar, new HashMap<>()).run();
    return sw.toString();
  }

  @Test
  void testRegex() {
    final String expected =
        GrammarTest.REGEX_TEXT + "\n" + "Has left recursion? false\n";
    assertThat(run(ImmutableList.of(), Grammars.regex()), is(expected));
  }

  @Test
  void testPrintStream() {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (PrintStream ps = new PrintStream(out)) {
      new Main(ImmutableList.of(), ps, Grammars.regex(), new HashMap<>())
          .run();
    }
    assertThat(out.toString(), startsWith("<REGEX>           := "));
    assertThat(out.toString(), containsString("Has left recursion? false"));
  }

  @Test
  void testLeftRecursive() {
    final Grammar g = GrammarTest.indirect();
    final String expected =
        "<A> := <B>x\n"
            + "<B> := <A>y\n"
            + "\n"
            + "Has left recursion? true\n"
            + "Left-recursive: <A>, <B>\n";
    assertThat(run(ImmutableList.of(), g), is(expected));
  }

  /** A directly left-recursive rule decides the verdict, so an undefined
   * non-terminal elsewhere in the grammar must not turn it into an error. */
  @Test
  void testDirectWithUndefinedNonTerminal() {
    // <A> := <A> x; <B> := <C>, and there is no rule for <C>
    final Grammar g =
        Grammar.of(
            Rule.of("<A>", Production.of("<A>", "x")),
            Rule.of("<B>", Production.of("<C>")));
    final String expected =
        "<A> := <A>x\n"
            + "<B> := <C>\n"
            + "\n"
            + "Has left recursion? true\n"
            + "Left-recursive: <A>\n";
    assertThat(run(ImmutableList.of(), g), is(expected));
  }

  /** Only the second of two rules for {@code <A>} is directly recursive; the
   * culprit is still listed. */
  @Test
  void testDuplicateRule() {
    final Grammar g =
        Grammar.of(
            Rule.of("<A>", Production.of("x")),
            Rule.of("<A>", Production.of("<A>")));
    final String expected =
        "<A> := x\n"
            + "<A> := <A>\n"
            + "\n"
            + "Has left recursion? true\n"
            + "Left-recursive: <A>\n";
    assertThat(run(ImmutableList.of(), g), is(expected));
  }

  @Test
  void testTrace() {
    final String expected =
        "<A> := <B>x\n"
            + "<B> := <A>y\n"
            + "\n"
            + "step <A> -> <B>\n"
            + "step <B> -> <A>\n"
            + "recursive <A>\n"
            + "Has left recursion? true\n"
            + "Left-recursive: <A>, <B>\n";
    assertThat(run(ImmutableList.of("--trace"), GrammarTest.indirect()),
        is(expected));
    assertThat(run(ImmutableList.of("--trace=true"), GrammarTest.indirect()),
        is(expected));

    final String s = run(ImmutableList.of("--trace"), Grammars.regex());
    assertThat(s, containsString("step <REGEX> -> <LOW_PRECEDENCE>\n"));
    assertThat(s, containsString("step <GIGA_PRECEDENCE> -> (\n"));
  }

  @Test
  void testSeparators() {
    final Grammar g =
        Grammar.of(
            Rule.of("<AB>", Production.of("a"), Production.of("b")),
            Rule.of("<C>", Production.of("c")));
    final String expected =
        "<AB> -> a | b\n"
            + "<C>  -> c\n"
            + "\n"
            + "Has left recursion? false\n";
    final List<String> args =
        ImmutableList.of("--definitionSeparator=-> ",
            "--ALTERNATIVE_SEPARATOR= | ");
    assertThat(run(args, g), is(expected));
  }

  @Test
  void testBadArgs() {
    assertThrows(IllegalArgumentException.class,
        () -> run(ImmutableList.of("trace"), Grammars.regex()));
    assertThrows(IllegalArgumentException.class,
        () -> run(ImmutableList.of("--noSuchProperty"), Grammars.regex()));
    assertThrows(IllegalArgumentException.class,
        () -> run(ImmutableList.of("--trace=maybe"), Grammars.regex()));
    // A string property is not a flag
    assertThrows(IllegalArgumentException.class,
        () -> run(ImmutableList.of("--definitionSeparator"),
            Grammars.regex()));
  }

  @Test
  void testUndefinedNonTerminal() {
    final Grammar g = Grammar.of(Rule.of("<A>", Production.of("<B>")));
    final GrammarException e =
        assertThrows(GrammarException.class,
            () -> run(ImmutableList.of(), g));
    assertThat(e.kind(), is(GrammarException.Kind.UNDEFINED_NON_TERMINAL));
  }
}

// End MainTest.java
