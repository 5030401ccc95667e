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

/** Called on various events during left-recursion analysis. */
public interface Tracer {
  /**
   * Called when the analysis expands non-terminal {@code from} and finds
   * {@code to} as the leftmost symbol of one of its productions.
   */
  void onStep(Symbol from, Symbol to);

  /**
   * Called when the walk reaches a rule it has already entered during the
   * current query, and therefore does not expand it again.
   */
  void onRevisit(Symbol symbol);

  /** Called when a rule is found to be directly left-recursive. */
  void onDirectLeftRecursion(Rule rule, Production production);

  /** Called when a non-terminal is found to derive itself in leftmost
   * position. */
  void onLeftRecursion(Symbol symbol);
}

// End Tracer.java
