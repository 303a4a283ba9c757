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
import static net.hydromatic.comprehend.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.Op;
import net.hydromatic.comprehend.ast.Pos;
import net.hydromatic.comprehend.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts comprehensions into calls to {@code map}, {@code flatMap} and
 * {@code withFilter}.
 *
 * <p>For example,
 *
 * <blockquote>
 *
 * <pre>{@code
 * for { a <- g; b <- h(a); if a > b } yield a + b
 * }</pre>
 *
 * </blockquote>
 *
 * <p>becomes
 *
 * <blockquote>
 *
 * <pre>{@code
 * g.flatMap(a => h(a).withFilter(b => a > b).map(b => a + b))
 * }</pre>
 *
 * </blockquote>
 *
 * <p>A Desugarer has no mutable state, and may be used by several threads at
 * once.
 */
public class Desugarer {
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;

  /** Creates a Desugarer. */
  public Desugarer(Map<Prop, Object> propMap, Tracer tracer) {
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a Desugarer with default properties and no tracing. */
  public static Desugarer create() {
    return new Desugarer(ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Desugars a comprehension.
   *
   * <p>Fresh variables are named so that they do not clash with any
   * identifier in the comprehension.
   *
   * @throws DesugarException if the comprehension is not valid
   */
  public Ast.Exp desugar(Ast.Comprehension comprehension) {
    final NameGenerator nameGenerator =
        NameGenerators.avoiding(NameGenerators.collectNames(comprehension));
    return desugar(comprehension, nameGenerator);
  }

  /**
   * Desugars a comprehension, using a given generator for the names of fresh
   * variables.
   *
   * @throws DesugarException if the comprehension is not valid
   */
  public Ast.Exp desugar(
      Ast.Comprehension comprehension, NameGenerator nameGenerator) {
    requireNonNull(comprehension);
    requireNonNull(nameGenerator);
    final Ast.Exp exp;
    try {
      ClauseClassifier.validate(
          comprehension, Prop.MAX_CLAUSES.intValue(propMap));
      exp = new Run(comprehension, nameGenerator).desugar();
    } catch (DesugarException e) {
      tracer.handleDesugarException(e);
      throw e;
    }
    tracer.onResult(exp);
    return exp;
  }

  /**
   * Desugars every comprehension in an expression, including comprehensions
   * nested inside other comprehensions. Inner comprehensions are desugared
   * before the comprehensions that contain them.
   *
   * <p>The tracer receives one result per comprehension.
   *
   * @throws DesugarException if any comprehension is not valid
   */
  public Ast.Exp desugarAll(Ast.Exp exp) {
    final NameGenerator nameGenerator =
        NameGenerators.avoiding(NameGenerators.collectNames(exp));
    return exp.accept(
        new Shuttle() {
          @Override
          protected Ast.Exp visit(Ast.Comprehension comprehension) {
            final Ast.Comprehension comprehension2 =
                (Ast.Comprehension) super.visit(comprehension);
            return desugar(comprehension2, nameGenerator);
          }
        });
  }

  /**
   * State of a call to {@link #desugar(Ast.Comprehension, NameGenerator)}.
   *
   * <p>Exec clauses are converted to generators before rewriting starts; the
   * other clauses are rewritten by index, and are never copied.
   */
  private class Run {
    private final NameGenerator nameGenerator;
    private final ClauseClassifier classifier;
    private final Ast.Exp yieldExp;
    private final MapEliminator mapEliminator;
    private final boolean simplifyAliases;

    Run(Ast.Comprehension comprehension, NameGenerator nameGenerator) {
      this.nameGenerator = nameGenerator;
      this.mapEliminator =
          new MapEliminator(
              Prop.ELIDE_REDUNDANT_MAP.booleanValue(propMap), tracer);
      this.simplifyAliases = Prop.SIMPLIFY_ALIASES.booleanValue(propMap);

      final List<Ast.Clause> clauses = comprehension.clauses;
      final List<Ast.Clause> normalized = new ArrayList<>(clauses.size());
      Ast.@Nullable Exp yieldExp =
          comprehension.yield_ == null ? null : comprehension.yield_.exp;
      for (int i = 0; i < clauses.size(); i++) {
        final Ast.Clause clause = clauses.get(i);
        if (clause.op != Op.EXEC) {
          normalized.add(clause);
        } else if (yieldExp == null && i == clauses.size() - 1) {
          // "for {...; exec E}" becomes "for {...; v <- E} yield v"
          tracer.onRule(Rule.FINAL_EXEC, i);
          final Ast.IdPat idPat = freshIdPat(clause.pos, "v");
          normalized.add(ast.generator(clause.pos, idPat, clause.exp()));
          yieldExp = ast.id(clause.pos, idPat.name);
        } else {
          tracer.onRule(Rule.EXEC, i);
          normalized.add(
              ast.generator(
                  clause.pos, ast.wildcardPat(clause.pos), clause.exp()));
        }
      }
      this.classifier = new ClauseClassifier(normalized);
      this.yieldExp = requireNonNull(yieldExp, "yieldExp");
    }

    Ast.Exp desugar() {
      return desugarFrame(0);
    }

    /** Desugars the clauses starting at {@code i}, and the yield. */
    private Ast.Exp desugarFrame(int i) {
      final ClauseClassifier.Shape shape = classifier.classifyFrame(i);
      switch (shape.kind) {
        case YIELD:
          if (i == 0) {
            tracer.onRule(Rule.EMPTY_YIELD, i);
          }
          return yieldExp;

        case LEADING_ALIASES:
          tracer.onRule(Rule.LEADING_ALIASES, i);
          return block(shape.start, shape.end, desugarFrame(shape.end));

        case NESTED_ALIASES:
          tracer.onRule(Rule.NESTED_ALIASES, i);
          return block(shape.start, shape.end, desugarFrame(shape.end));

        case GENERATOR:
          return desugarGenerator(i, (Ast.Generator) classifier.get(i));

        default:
          throw new AssertionError("unexpected shape " + shape);
      }
    }

    /**
     * Desugars the generator at {@code i} and the clauses that follow it.
     *
     * <p>Guards, and aliases that precede guards, are folded into the
     * generator's source, and we loop; any other shape ends the loop.
     */
    private Ast.Exp desugarGenerator(int i, Ast.Generator generator) {
      for (int j = i + 1; ; ) {
        final ClauseClassifier.Shape shape =
            classifier.classifyAfterGenerator(j);
        switch (shape.kind) {
          case YIELD:
            return mapEliminator.map(
                i, generator.pos, generator.exp, generator.pat, yieldExp);

          case GUARD:
            tracer.onRule(Rule.GUARD, j);
            final Ast.Guard guard = (Ast.Guard) classifier.get(j);
            generator =
                generator.copy(
                    generator.pat,
                    ast.withFilter(
                        guard.pos, generator.exp, generator.pat, guard.exp));
            j = shape.end;
            break;

          case ALIASES_THEN_GUARD:
            tracer.onRule(Rule.ALIASES_THEN_GUARD, j);
            generator = tupleAliases(generator, shape.start, shape.end);
            j = shape.end;
            break;

          case ALIASES_THEN_YIELD:
          case ALIASES_THEN_GENERATOR:
            if (!simplifyAliases) {
              tracer.onRule(Rule.ALIASES_THEN_GUARD, j);
              generator = tupleAliases(generator, shape.start, shape.end);
              j = shape.end;
              break;
            }
            tracer.onRule(Rule.ALIASES_IN_CONTINUATION, j);
            return ast.flatMap(
                generator.pos, generator.exp, generator.pat, desugarFrame(j));

          case GENERATOR:
            tracer.onRule(Rule.GENERATOR_THEN_MORE, i);
            return ast.flatMap(
                generator.pos, generator.exp, generator.pat, desugarFrame(j));

          default:
            throw new AssertionError("unexpected shape " + shape);
        }
      }
    }

    /**
     * Converts "{@code P <- G; P1 = E1; ...; PN = EN}" into a generator of
     * tuples,
     *
     * <blockquote>
     *
     * <pre>{@code
     * (P, P1, ..., PN) <-
     *     G.map(x => { val P1' = E1; ...; val PN' = EN; (x, x1, ..., xN) })
     * }</pre>
     *
     * </blockquote>
     *
     * <p>where each primed pattern names its value: an identifier pattern
     * names itself, and any other pattern is layered with a fresh name, as in
     * "{@code x @ (a, b)}".
     */
    private Ast.Generator tupleAliases(
        Ast.Generator generator, int start, int end) {
      final List<Ast.Exp> names = new ArrayList<>();
      final List<Ast.Pat> pats = new ArrayList<>();
      final List<Ast.ValBind> valBinds = new ArrayList<>();
      final Ast.Pat pat = nameValue(generator.pat, names);
      pats.add(generator.pat);
      for (int k = start; k < end; k++) {
        final Ast.PureAlias alias = (Ast.PureAlias) classifier.get(k);
        valBinds.add(
            ast.valBind(alias.pos, nameValue(alias.pat, names), alias.exp));
        pats.add(alias.pat);
      }
      final Ast.Exp body =
          ast.block(
              valBinds.get(0).pos, valBinds, ast.tuple(generator.pos, names));
      return ast.generator(
          generator.pos,
          ast.tuplePat(generator.pos, pats),
          ast.map(generator.pos, generator.exp, pat, body));
    }

    /**
     * Returns a pattern that binds a name to the value matched by {@code pat},
     * and adds a reference to that name to {@code names}.
     */
    private Ast.Pat nameValue(Ast.Pat pat, List<Ast.Exp> names) {
      if (pat.op == Op.ID_PAT) {
        names.add(ast.id(pat.pos, ((Ast.IdPat) pat).name));
        return pat;
      }
      final Ast.IdPat idPat = freshIdPat(pat.pos, "x");
      names.add(ast.id(pat.pos, idPat.name));
      return ast.asPat(pat.pos, idPat, pat);
    }

    /**
     * Creates a pattern that binds a fresh name. Throws if the name generator
     * returns a name that would not bind, such as "_".
     */
    private Ast.IdPat freshIdPat(Pos pos, String prefix) {
      final String name = nameGenerator.fresh(prefix);
      final Ast.Pat pat = ast.idPat(pos, name);
      if (pat.op != Op.ID_PAT) {
        throw new DesugarException(
            DesugarException.Kind.INVALID_FRESH_NAME,
            "name generator returned '" + name + "', which is not a variable",
            pos);
      }
      return (Ast.IdPat) pat;
    }

    /** Wraps an expression in the bindings of pure aliases in a range. */
    private Ast.Exp block(int start, int end, Ast.Exp exp) {
      final ImmutableList.Builder<Ast.ValBind> valBinds =
          ImmutableList.builder();
      for (int k = start; k < end; k++) {
        valBinds.add(((Ast.PureAlias) classifier.get(k)).toValBind());
      }
      return ast.block(classifier.get(start).pos, valBinds.build(), exp);
    }
  }
}

// End Desugarer.java
