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

import static java.util.Objects.requireNonNull;

import net.hydromatic.comprehend.ast.Pos;

/**
 * An error occurred while desugaring a comprehension.
 *
 * <p>Every error is caused by an invalid input, and is detected before any
 * rewriting happens; there is never partial output.
 */
public class DesugarException extends RuntimeException {
  private final Kind kind;
  private final Pos pos;

  public DesugarException(Kind kind, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  public Kind kind() {
    return kind;
  }

  public Pos pos() {
    return pos;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }

  /** Category of error. */
  public enum Kind {
    /**
     * The clauses are not in a valid order: a guard that does not follow a
     * generator, or a comprehension without yield that does not end with an
     * exec clause.
     */
    MALFORMED_COMPREHENSION,

    /**
     * The comprehension has more clauses than allowed by {@link
     * Prop#MAX_CLAUSES}.
     */
    COMPREHENSION_TOO_LARGE,

    /** A pattern has a shape that is not supported, e.g. a 1-tuple. */
    UNSUPPORTED_PATTERN,

    /**
     * A {@link NameGenerator} returned a name that cannot be bound, such as
     * the wildcard "_".
     */
    INVALID_FRESH_NAME
  }
}

// End DesugarException.java
