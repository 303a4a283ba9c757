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
import static net.hydromatic.comprehend.util.Static.last;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.Op;
import net.hydromatic.comprehend.ast.Pos;

/**
 * Classifies the clauses of a comprehension, so that the {@link Desugarer}
 * can decide which rule to apply.
 *
 * <p>The classifier works on a list of clauses by index, and never copies
 * sub-lists.
 */
public class ClauseClassifier {
  private final List<Ast.Clause> clauses;

  /** Creates a ClauseClassifier. */
  public ClauseClassifier(List<? extends Ast.Clause> clauses) {
    this.clauses = ImmutableList.copyOf(clauses);
  }

  /**
   * Checks that a comprehension is well-formed, and throws {@link
   * DesugarException} if it is not.
   *
   * <p>Checks that the comprehension has no more than {@code maxClauses}
   * clauses; that it has a yield, or that its last clause is an exec; that
   * every guard follows a generator (possibly via pure aliases); and that
   * every tuple pattern has at least two arguments.
   */
  public static void validate(Ast.Comprehension comprehension, int maxClauses) {
    final List<Ast.Clause> clauses = comprehension.clauses;
    if (clauses.size() > maxClauses) {
      throw new DesugarException(
          DesugarException.Kind.COMPREHENSION_TOO_LARGE,
          "comprehension has "
              + clauses.size()
              + " clauses; the maximum is "
              + maxClauses,
          comprehension.pos);
    }
    if (comprehension.yield_ == null) {
      if (clauses.isEmpty()) {
        throw new DesugarException(
            DesugarException.Kind.MALFORMED_COMPREHENSION,
            "comprehension has no clauses and no yield",
            comprehension.pos);
      }
      final Ast.Clause lastClause = last(clauses);
      if (lastClause.op != Op.EXEC) {
        throw new DesugarException(
            DesugarException.Kind.MALFORMED_COMPREHENSION,
            "comprehension without yield must end with an exec clause",
            lastClause.pos);
      }
    }
    boolean afterGenerator = false;
    for (Ast.Clause clause : clauses) {
      switch (clause.op) {
        case GENERATOR:
          validatePat(((Ast.Generator) clause).pat);
          afterGenerator = true;
          break;
        case EXEC:
          afterGenerator = true;
          break;
        case PURE_ALIAS:
          validatePat(((Ast.PureAlias) clause).pat);
          break;
        case GUARD:
          if (!afterGenerator) {
            throw guardWithoutGenerator(clause.pos);
          }
          break;
        default:
          throw new AssertionError("unknown clause " + clause.op);
      }
    }
  }

  private static void validatePat(Ast.Pat pat) {
    pat.visit(
        p -> {
          if (p.op == Op.TUPLE_PAT && ((Ast.TuplePat) p).args.size() < 2) {
            throw new DesugarException(
                DesugarException.Kind.UNSUPPORTED_PATTERN,
                "tuple pattern must have at least two arguments",
                p.pos);
          }
        });
  }

  /** Returns the number of clauses. */
  public int size() {
    return clauses.size();
  }

  /** Returns the clause at a given index. */
  public Ast.Clause get(int i) {
    return clauses.get(i);
  }

  /**
   * Returns the index after the last pure alias in the run of contiguous pure
   * aliases that starts at {@code i}; returns {@code i} if clause {@code i} is
   * not a pure alias.
   */
  public int aliasRunEnd(int i) {
    int j = i;
    while (j < clauses.size() && clauses.get(j).op == Op.PURE_ALIAS) {
      ++j;
    }
    return j;
  }

  /**
   * Classifies the clauses starting at {@code i}, where {@code i} is the start
   * of a frame: the start of the comprehension, or the clauses that remain
   * after the generator of an enclosing {@code flatMap}.
   *
   * <p>The result is one of {@link Kind#YIELD}, {@link Kind#LEADING_ALIASES},
   * {@link Kind#NESTED_ALIASES} or {@link Kind#GENERATOR}.
   */
  public Shape classifyFrame(int i) {
    if (i == clauses.size()) {
      return new Shape(Kind.YIELD, i, i);
    }
    final Ast.Clause clause = clauses.get(i);
    switch (clause.op) {
      case PURE_ALIAS:
        final int end = aliasRunEnd(i);
        if (end < clauses.size() && clauses.get(end).op == Op.GUARD) {
          throw guardWithoutGenerator(clauses.get(end).pos);
        }
        return new Shape(
            i == 0 ? Kind.LEADING_ALIASES : Kind.NESTED_ALIASES, i, end);
      case GENERATOR:
      case EXEC:
        return new Shape(Kind.GENERATOR, i, i + 1);
      case GUARD:
        throw guardWithoutGenerator(clause.pos);
      default:
        throw new AssertionError("unknown clause " + clause.op);
    }
  }

  /**
   * Classifies the clauses starting at {@code i}, where clause {@code i - 1}
   * is a generator (or a generator followed by guards that have already been
   * folded into its source).
   */
  public Shape classifyAfterGenerator(int i) {
    if (i == clauses.size()) {
      return new Shape(Kind.YIELD, i, i);
    }
    final Ast.Clause clause = clauses.get(i);
    switch (clause.op) {
      case GUARD:
        return new Shape(Kind.GUARD, i, i + 1);
      case GENERATOR:
      case EXEC:
        return new Shape(Kind.GENERATOR, i, i);
      case PURE_ALIAS:
        final int end = aliasRunEnd(i);
        if (end == clauses.size()) {
          return new Shape(Kind.ALIASES_THEN_YIELD, i, end);
        }
        if (clauses.get(end).op == Op.GUARD) {
          return new Shape(Kind.ALIASES_THEN_GUARD, i, end);
        }
        return new Shape(Kind.ALIASES_THEN_GENERATOR, i, end);
      default:
        throw new AssertionError("unknown clause " + clause.op);
    }
  }

  private static DesugarException guardWithoutGenerator(Pos pos) {
    return new DesugarException(
        DesugarException.Kind.MALFORMED_COMPREHENSION,
        "guard must follow a generator",
        pos);
  }

  /** Kind of {@link Shape}. */
  public enum Kind {
    /** No clauses remain; only the yield. */
    YIELD,
    /** A run of pure aliases at the start of the comprehension. */
    LEADING_ALIASES,
    /** A run of pure aliases at the start of a nested frame. */
    NESTED_ALIASES,
    /** A generator (or an exec, which behaves like one). */
    GENERATOR,
    /** A guard following a generator. */
    GUARD,
    /** A run of pure aliases following a generator, then the yield. */
    ALIASES_THEN_YIELD,
    /** A run of pure aliases following a generator, then a guard. */
    ALIASES_THEN_GUARD,
    /** A run of pure aliases following a generator, then a generator. */
    ALIASES_THEN_GENERATOR
  }

  /**
   * Result of classifying clauses.
   *
   * <p>{@link #start} and {@link #end} delimit the clauses that the shape
   * covers. For the alias kinds, they are the bounds of the run of pure
   * aliases; for {@link Kind#GUARD}, the guard; for {@link Kind#GENERATOR}
   * at the start of a frame, the generator. For {@link Kind#YIELD}, and for
   * {@link Kind#GENERATOR} after a generator, the range is empty.
   */
  public static final class Shape {
    public final Kind kind;
    public final int start;
    public final int end;

    public Shape(Kind kind, int start, int end) {
      this.kind = requireNonNull(kind);
      this.start = start;
      this.end = end;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, start, end);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Shape
              && kind == ((Shape) o).kind
              && start == ((Shape) o).start
              && end == ((Shape) o).end;
    }

    @Override
    public String toString() {
      return kind + "[" + start + ", " + end + ")";
    }
  }
}

// End ClauseClassifier.java
