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
package net.hydromatic.comprehend.compile;

/**
 * Rewrite rules applied by {@link Desugarer}.
 *
 * <p>In the descriptions, "P" is a pattern, "G" the source of a generator,
 * "E" an expression and "B" the yielded expression.
 */
public enum Rule {
  /**
   * Pure aliases at the start of a comprehension become a block of bindings
   * around the rest: "{@code for {P1 = E1; rest}}" becomes "{@code { val P1 =
   * E1; for {rest} }}".
   */
  LEADING_ALIASES,

  /** A comprehension with no clauses is its yield: "B". */
  EMPTY_YIELD,

  /**
   * An exec clause at the end of a comprehension without yield becomes a
   * generator whose fresh variable is yielded.
   */
  FINAL_EXEC,

  /** Any other exec clause becomes a generator with a wildcard pattern. */
  EXEC,

  /**
   * A generator followed by a yield of the value it binds becomes its
   * source: "{@code for {P <- G} yield P}" becomes "{@code G}".
   */
  REDUNDANT_MAP,

  /**
   * Pure aliases after a generator and before a guard become a generator of
   * tuples, so that the guard can see every bound value.
   *
   * <p>If {@link Prop#SIMPLIFY_ALIASES} is false, this rule applies to all
   * pure aliases that follow a generator.
   */
  ALIASES_THEN_GUARD,

  /**
   * Pure aliases after a generator, not followed by a guard, move into the
   * body of the generator's combinator.
   */
  ALIASES_IN_CONTINUATION,

  /**
   * Pure aliases at the start of the body of a combinator become a block of
   * bindings.
   */
  NESTED_ALIASES,

  /** "{@code for {P <- G} yield B}" becomes "{@code G.map(P => B)}". */
  GENERATOR_THEN_YIELD,

  /**
   * "{@code for {P <- G; rest}}" becomes "{@code G.flatMap(P => for
   * {rest})}".
   */
  GENERATOR_THEN_MORE,

  /**
   * "{@code for {P <- G; if E; rest}}" becomes "{@code for {P <-
   * G.withFilter(P => E); rest}}".
   */
  GUARD
}

// End Rule.java
