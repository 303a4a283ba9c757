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
package net.hydromatic.comprehend.ast;

import com.google.common.collect.ImmutableMap;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  STRING_LITERAL(true),

  // patterns
  ID_PAT(true),
  WILDCARD_PAT(true),
  TUPLE_PAT(true),
  /** Layered pattern "x @ p"; created by the desugarer, never by a parser. */
  AS_PAT(" @ "),

  // value constructors
  TUPLE(true),
  /** Lambda "p => e", the argument of a combinator call. */
  FN(" => ", 0, false),

  // operators that may occur in host expressions
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  MOD(" % ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  LE(" <= ", 4),
  LT(" < ", 4),
  GE(" >= ", 4),
  GT(" > ", 4),
  EQ(" == ", 4),
  NE(" != ", 4),
  ANDALSO(" && ", 2),
  ORELSE(" || ", 1),
  APPLY(" ", 10),

  // combinator calls, the output of desugaring
  MAP(".map", 10),
  FLAT_MAP(".flatMap", 10),
  WITH_FILTER(".withFilter", 10),
  BLOCK(true),
  VAL_BIND(" = "),

  // clauses of a comprehension, the input of desugaring
  GENERATOR(" <- "),
  PURE_ALIAS(" = "),
  GUARD("if "),
  EXEC("exec "),
  YIELD(" yield "),
  COMPREHENSION;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;
  /** Operator name. Sometimes null, sometimes something like "op +". */
  public final String opName;

  /** Infix operators, keyed by {@link #opName}. */
  public static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.opName != null
          && op.padded.startsWith(" ")
          && op.padded.endsWith(" ")
          && !op.name().endsWith("_PAT")
          && op != FN
          && op != APPLY
          && op != VAL_BIND
          && op != PURE_ALIAS
          && op != GENERATOR
          && op != YIELD) {
        b.put(op.opName, op);
      }
    }
    BY_OP_NAME = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.opName =
        padded == null || padded.trim().isEmpty()
            ? null
            : "op " + padded.trim();
  }

  /** Returns whether this operator is a combinator call. */
  public boolean isCombinator() {
    return this == MAP || this == FLAT_MAP || this == WITH_FILTER;
  }
}

// End Op.java
