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
package net.hydromatic.comprehend;

import static net.hydromatic.comprehend.Comp.alias;
import static net.hydromatic.comprehend.Comp.call;
import static net.hydromatic.comprehend.Comp.comp;
import static net.hydromatic.comprehend.Comp.exec;
import static net.hydromatic.comprehend.Comp.gen;
import static net.hydromatic.comprehend.Comp.gt;
import static net.hydromatic.comprehend.Comp.guard;
import static net.hydromatic.comprehend.Comp.id;
import static net.hydromatic.comprehend.Comp.intLiteral;
import static net.hydromatic.comprehend.Comp.lt;
import static net.hydromatic.comprehend.Comp.pat;
import static net.hydromatic.comprehend.Comp.plus;
import static net.hydromatic.comprehend.Comp.stringLiteral;
import static net.hydromatic.comprehend.Comp.times;
import static net.hydromatic.comprehend.Comp.tuple;
import static net.hydromatic.comprehend.Comp.tuplePat;
import static net.hydromatic.comprehend.Matchers.throwsA;
import static net.hydromatic.comprehend.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.Op;
import net.hydromatic.comprehend.ast.Pos;
import net.hydromatic.comprehend.compile.DesugarException;
import net.hydromatic.comprehend.compile.Desugarer;
import net.hydromatic.comprehend.compile.NameGenerator;
import net.hydromatic.comprehend.compile.Prop;
import net.hydromatic.comprehend.compile.Tracer;
import net.hydromatic.comprehend.compile.Tracers;
import org.junit.jupiter.api.Test;

/** Tests {@link Desugarer}. */
public class DesugarTest {
  private static final Ast.Id G = id("g");

  @Test
  void testTrivialYield() {
    // "for {a <- g} yield a" is "g"
    comp(gen("a", G))
        .yield_(id("a"))
        .assertComprehension("for { a <- g } yield a")
        .assertDesugar("g")
        .assertDesugarSame()
        .assertRules("[REDUNDANT_MAP@0]");
  }

  @Test
  void testYieldNotElided() {
    comp(gen("a", G))
        .yield_(plus(id("a"), intLiteral(1)))
        .assertDesugar("g.map(a => a + 1)")
        .assertRules("[GENERATOR_THEN_YIELD@0]");
    comp(gen("a", G))
        .yield_(tuple(id("a"), id("a")))
        .assertDesugar("g.map(a => (a, a))");
    comp(gen("a", G)).yield_(id("b")).assertDesugar("g.map(a => b)");

    // A wildcard binds nothing, so nothing is the same binding
    comp(gen(pat("_"), G)).yield_(id("_")).assertDesugar("g.map(_ => _)");
  }

  @Test
  void testRedundantMapDisabled() {
    comp(gen("a", G))
        .yield_(id("a"))
        .with(Prop.ELIDE_REDUNDANT_MAP, false)
        .assertDesugar("g.map(a => a)")
        .assertRules("[GENERATOR_THEN_YIELD@0]");
  }

  @Test
  void testTupleRedundancyIsOrderSensitive() {
    comp(gen(tuplePat("a", "b"), G))
        .yield_(tuple(id("a"), id("b")))
        .assertComprehension("for { (a, b) <- g } yield (a, b)")
        .assertDesugar("g");
    comp(gen(tuplePat("a", "b"), G))
        .yield_(tuple(id("b"), id("a")))
        .assertDesugar("g.map((a, b) => (b, a))");
    comp(gen(tuplePat(pat("a"), tuplePat("b", "c")), G))
        .yield_(tuple(id("a"), tuple(id("b"), id("c"))))
        .assertDesugar("g");
    comp(gen(tuplePat("a", "b"), G))
        .yield_(tuple(id("a"), id("b"), id("c")))
        .assertDesugar("g.map((a, b) => (a, b, c))");
  }

  @Test
  void testEmptyYield() {
    comp()
        .yield_(intLiteral(1))
        .assertComprehension("for {} yield 1")
        .assertDesugar("1")
        .assertRules("[EMPTY_YIELD@0]");
  }

  @Test
  void testLeadingAliases() {
    comp(alias("x", intLiteral(1)), gen("a", G))
        .yield_(plus(id("a"), id("x")))
        .assertComprehension("for { x = 1; a <- g } yield a + x")
        .assertDesugar("{ val x = 1; g.map(a => a + x) }")
        .assertRules("[LEADING_ALIASES@0, GENERATOR_THEN_YIELD@1]");

    // The alias block is hoisted, and the map inside it is still elided
    comp(alias("x", intLiteral(1)), alias("y", intLiteral(2)), gen("a", G))
        .yield_(id("a"))
        .assertDesugar("{ val x = 1; val y = 2; g }");

    // Aliases only
    comp(alias("x", intLiteral(1)))
        .yield_(id("x"))
        .assertDesugar("{ val x = 1; x }")
        .assertRules("[LEADING_ALIASES@0]");
  }

  @Test
  void testGuard() {
    comp(gen("a", G), guard(gt(id("a"), intLiteral(1))))
        .yield_(id("a"))
        .assertComprehension("for { a <- g; if a > 1 } yield a")
        .assertDesugar("g.withFilter(a => a > 1)")
        .assertRules("[GUARD@1, REDUNDANT_MAP@0]");
    comp(gen("a", G), guard(gt(id("a"), intLiteral(1))))
        .yield_(times(id("a"), intLiteral(2)))
        .assertDesugar("g.withFilter(a => a > 1).map(a => a * 2)");
  }

  @Test
  void testConsecutiveGuardsNest() {
    comp(
            gen("a", G),
            guard(gt(id("a"), intLiteral(1))),
            guard(lt(id("a"), intLiteral(5))))
        .yield_(id("a"))
        .assertDesugar("g.withFilter(a => a > 1).withFilter(a => a < 5)")
        .assertRules("[GUARD@1, GUARD@2, REDUNDANT_MAP@0]");
  }

  @Test
  void testGeneratorThenMore() {
    comp(gen("a", G), gen("b", call("h", id("a"))))
        .yield_(plus(id("a"), id("b")))
        .assertComprehension("for { a <- g; b <- h(a) } yield a + b")
        .assertDesugar("g.flatMap(a => h(a).map(b => a + b))")
        .assertRules("[GENERATOR_THEN_MORE@0, GENERATOR_THEN_YIELD@1]");
  }

  /** Clauses are desugared in order; none is moved. */
  @Test
  void testOrderPreserved() {
    comp(gen("a", G), gen("b", id("h")), gen("c", id("k")))
        .yield_(tuple(id("a"), id("b"), id("c")))
        .assertDesugar("g.flatMap(a => h.flatMap(b => k.map(c => (a, b, c))))");
    comp(
            gen("a", G),
            guard(gt(id("a"), intLiteral(0))),
            gen("b", call("h", id("a"))),
            guard(gt(id("b"), id("a"))))
        .yield_(tuple(id("a"), id("b")))
        .assertDesugar(
            "g.withFilter(a => a > 0)"
                + ".flatMap(a => h(a).withFilter(b => b > a)"
                + ".map(b => (a, b)))");
  }

  @Test
  void testAliasesThenGuard() {
    final Comp c =
        comp(
                gen("a", G),
                alias("b", plus(id("a"), intLiteral(1))),
                guard(gt(id("b"), intLiteral(2))))
            .assertComprehension("for { a <- g; b = a + 1; if b > 2 }");
    c.yield_(plus(id("a"), id("b")))
        .assertDesugar(
            "g.map(a => { val b = a + 1; (a, b) })"
                + ".withFilter((a, b) => b > 2)"
                + ".map((a, b) => a + b)")
        .assertRules("[ALIASES_THEN_GUARD@1, GUARD@2, GENERATOR_THEN_YIELD@0]");

    // The final map is elided if it yields the tuple; the inner map is not
    c.yield_(tuple(id("a"), id("b")))
        .assertDesugar(
            "g.map(a => { val b = a + 1; (a, b) })"
                + ".withFilter((a, b) => b > 2)");
  }

  @Test
  void testAliasesThenGuardWithPatterns() {
    // Alias with a tuple pattern is named by a layered pattern
    comp(
            gen("a", G),
            alias(tuplePat("b", "c"), call("f", id("a"))),
            guard(gt(id("b"), id("c"))))
        .yield_(plus(id("a"), id("b")))
        .assertDesugar(
            "g.map(a => { val x @ (b, c) = f(a); (a, x) })"
                + ".withFilter((a, (b, c)) => b > c)"
                + ".map((a, (b, c)) => a + b)");

    // Generator with a tuple pattern
    comp(
            gen(tuplePat("a", "b"), G),
            alias("c", plus(id("a"), id("b"))),
            guard(gt(id("c"), intLiteral(0))))
        .yield_(id("c"))
        .assertDesugar(
            "g.map((x @ (a, b)) => { val c = a + b; (x, c) })"
                + ".withFilter(((a, b), c) => c > 0)"
                + ".map(((a, b), c) => c)");
  }

  @Test
  void testFreshNamesAvoidUserNames() {
    comp(
            gen(tuplePat("x", "y"), G),
            alias("z", plus(id("x"), id("y"))),
            alias(tuplePat("x1", "w"), call("f", id("z"))),
            guard(gt(id("z"), intLiteral(0))))
        .yield_(id("z"))
        .assertDesugar(
            "g.map((x2 @ (x, y)) => "
                + "{ val z = x + y; val x3 @ (x1, w) = f(z); (x2, z, x3) })"
                + ".withFilter(((x, y), z, (x1, w)) => z > 0)"
                + ".map(((x, y), z, (x1, w)) => z)");
  }

  @Test
  void testAliasesThenYield() {
    comp(gen("a", G), alias("b", plus(id("a"), intLiteral(1))))
        .yield_(plus(id("a"), id("b")))
        .assertDesugar("g.flatMap(a => { val b = a + 1; a + b })")
        .assertRules("[ALIASES_IN_CONTINUATION@1, NESTED_ALIASES@1]");

    // The block is the body of a flatMap even though only the yield follows
    final Ast.Exp e =
        comp(gen("a", G), alias("b", plus(id("a"), intLiteral(1))))
            .yield_(plus(id("a"), id("b")))
            .desugar();
    assertThat(e.op, is(Op.FLAT_MAP));
  }

  @Test
  void testAliasesThenGenerator() {
    comp(
            gen("a", G),
            alias("b", plus(id("a"), intLiteral(1))),
            gen("c", call("h", id("b"))))
        .yield_(plus(id("a"), id("c")))
        .assertDesugar(
            "g.flatMap(a => { val b = a + 1; h(b).map(c => a + c) })")
        .assertRules(
            "[ALIASES_IN_CONTINUATION@1, NESTED_ALIASES@1, "
                + "GENERATOR_THEN_YIELD@2]");
  }

  /**
   * The same aliases desugar differently depending on whether a guard follows
   * them.
   */
  @Test
  void testGuardChangesAliasDesugaring() {
    final Ast.Generator a = gen("a", G);
    final Ast.PureAlias b = alias("b", times(id("a"), intLiteral(2)));
    final Ast.Exp yieldExp = plus(id("a"), id("b"));
    comp(a, b)
        .yield_(yieldExp)
        .assertDesugar("g.flatMap(a => { val b = a * 2; a + b })");
    comp(a, b, guard(gt(id("b"), intLiteral(4))))
        .yield_(yieldExp)
        .assertDesugar(
            "g.map(a => { val b = a * 2; (a, b) })"
                + ".withFilter((a, b) => b > 4)"
                + ".map((a, b) => a + b)");
  }

  @Test
  void testLegacyAliases() {
    comp(gen("a", G), alias("b", plus(id("a"), intLiteral(1))))
        .yield_(plus(id("a"), id("b")))
        .with(Prop.SIMPLIFY_ALIASES, false)
        .assertDesugar(
            "g.map(a => { val b = a + 1; (a, b) }).map((a, b) => a + b)")
        .assertRules("[ALIASES_THEN_GUARD@1, GENERATOR_THEN_YIELD@0]");
    comp(gen("a", G), alias("b", plus(id("a"), intLiteral(1))))
        .yield_(tuple(id("a"), id("b")))
        .with(Prop.SIMPLIFY_ALIASES, false)
        .assertDesugar("g.map(a => { val b = a + 1; (a, b) })");

    // Leading aliases are hoisted in both modes
    final Comp c =
        comp(
                alias("x", intLiteral(1)),
                gen("a", G),
                alias("b", plus(id("a"), id("x"))),
                gen("c", call("h", id("b"))))
            .yield_(id("c"));
    c.assertDesugar("{ val x = 1; g.flatMap(a => { val b = a + x; h(b) }) }");
    c.with(Prop.SIMPLIFY_ALIASES, false)
        .assertDesugar(
            "{ val x = 1; "
                + "g.map(a => { val b = a + x; (a, b) })"
                + ".flatMap((a, b) => h(b)) }");
  }

  @Test
  void testExec() {
    comp(gen("a", G), exec(call("log", id("a"))))
        .yield_(id("a"))
        .assertComprehension("for { a <- g; exec log(a) } yield a")
        .assertDesugar("g.flatMap(a => log(a).map(_ => a))")
        .assertRules(
            "[EXEC@1, GENERATOR_THEN_MORE@0, GENERATOR_THEN_YIELD@1]");
    comp(exec(call("log", stringLiteral("start"))), gen("a", G))
        .yield_(id("a"))
        .assertDesugar("log(\"start\").flatMap(_ => g)");

    // An exec desugars exactly as a generator with a wildcard pattern
    final Ast.Exp e1 = call("log", stringLiteral("start"));
    assertThat(
        comp(exec(e1), gen("b", G)).yield_(id("b")).desugar(),
        is(comp(gen(pat("_"), e1), gen("b", G)).yield_(id("b")).desugar()));
  }

  @Test
  void testFinalExecWithoutYield() {
    comp(gen("a", G), exec(call("log", id("a"))))
        .assertComprehension("for { a <- g; exec log(a) }")
        .assertDesugar("g.flatMap(a => log(a))")
        .assertRules("[FINAL_EXEC@1, GENERATOR_THEN_MORE@0, REDUNDANT_MAP@1]");
    comp(exec(call("log", stringLiteral("x"))))
        .assertDesugar("log(\"x\")")
        .with(Prop.ELIDE_REDUNDANT_MAP, false)
        .assertDesugar("log(\"x\").map(v => v)");

    // The fresh variable does not clash with "v"
    comp(gen("v", G), exec(call("log", id("v"))))
        .with(Prop.ELIDE_REDUNDANT_MAP, false)
        .assertDesugar("g.flatMap(v => log(v).map(v1 => v1))");

    // An exec that is not last is a wildcard generator even without yield
    comp(exec(call("open", intLiteral(1))), exec(call("close", intLiteral(1))))
        .assertDesugar("open(1).flatMap(_ => close(1))")
        .assertRules("[EXEC@0, FINAL_EXEC@1, GENERATOR_THEN_MORE@0, "
            + "REDUNDANT_MAP@1]");
  }

  @Test
  void testNameGenerator() {
    final AtomicInteger n = new AtomicInteger();
    final Ast.Comprehension c =
        comp(gen("a", G), exec(call("log", id("a")))).comprehension();
    final Desugarer desugarer =
        new Desugarer(
            ImmutableMap.of(Prop.ELIDE_REDUNDANT_MAP, false), Tracers.empty());
    final Ast.Exp e =
        desugarer.desugar(c, prefix -> "$" + prefix + n.getAndIncrement());
    assertThat(e, hasToString("g.flatMap(a => log(a).map($v0 => $v0))"));
    assertThat(n.get(), is(1));

    // A generator that returns "_" cannot bind a value
    final NameGenerator wildcard = prefix -> "_";
    final Ast.Comprehension c2 =
        comp(
                gen(tuplePat("a", "b"), G),
                alias("c", plus(id("a"), id("b"))),
                guard(gt(id("c"), intLiteral(0))))
            .yield_(id("c"))
            .comprehension();
    final DesugarException x =
        assertThrows(DesugarException.class,
            () -> desugarer.desugar(c2, wildcard));
    assertThat(x.kind(), is(DesugarException.Kind.INVALID_FRESH_NAME));
    assertThat(x.getMessage(),
        is("name generator returned '_', which is not a variable"));
    final DesugarException x2 =
        assertThrows(DesugarException.class,
            () -> desugarer.desugar(c, wildcard));
    assertThat(x2.kind(), is(DesugarException.Kind.INVALID_FRESH_NAME));
  }

  @Test
  void testMalformed() {
    comp(guard(id("b")), gen("a", G))
        .yield_(id("a"))
        .assertError(
            DesugarException.Kind.MALFORMED_COMPREHENSION,
            "guard must follow a generator");
    comp(alias("x", intLiteral(1)), guard(gt(id("x"), intLiteral(0))))
        .yield_(id("x"))
        .assertError(
            DesugarException.Kind.MALFORMED_COMPREHENSION,
            "guard must follow a generator");
    comp(gen("a", G))
        .assertError(
            DesugarException.Kind.MALFORMED_COMPREHENSION,
            "comprehension without yield must end with an exec clause");
    comp()
        .assertError(
            DesugarException.Kind.MALFORMED_COMPREHENSION,
            "comprehension has no clauses and no yield");
  }

  @Test
  void testUnsupportedPattern() {
    comp(gen(tuplePat(pat("a")), G))
        .yield_(id("a"))
        .assertError(
            DesugarException.Kind.UNSUPPORTED_PATTERN,
            "tuple pattern must have at least two arguments");
    comp(gen("a", G), alias(tuplePat(pat("b"), tuplePat(pat("c"))), id("a")))
        .yield_(id("a"))
        .assertError(
            DesugarException.Kind.UNSUPPORTED_PATTERN,
            "tuple pattern must have at least two arguments");
  }

  @Test
  void testErrorPosition() {
    final Pos pos = new Pos("f.scala", 2, 5, 2, 14);
    final Ast.Comprehension c =
        ast.comprehension(
            Pos.ZERO,
            ImmutableList.of(ast.guard(pos, id("b")), gen("a", G)),
            ast.yield_(Pos.ZERO, id("a")));
    final DesugarException e =
        assertThrows(
            DesugarException.class, () -> Desugarer.create().desugar(c));
    assertThat(e.pos(), is(pos));
    assertThat(
        e.describeTo(new StringBuilder()),
        hasToString("f.scala:2.5-2.14 Error: guard must follow a generator"));
  }

  @Test
  void testTooLarge() {
    final List<Ast.Clause> clauses = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      clauses.add(gen("a" + i, G));
    }
    comp(clauses.toArray(new Ast.Clause[0]))
        .yield_(id("a0"))
        .with(Prop.MAX_CLAUSES, 2)
        .assertError(
            DesugarException.Kind.COMPREHENSION_TOO_LARGE,
            "comprehension has 3 clauses; the maximum is 2")
        .with(Prop.MAX_CLAUSES, 3)
        .assertDesugar(
            "g.flatMap(a0 => g.flatMap(a1 => g.map(a2 => a0)))");
  }

  /** Desugars a comprehension with the maximum number of clauses. */
  @Test
  void testLargeComprehension() {
    final int max = (Integer) Prop.MAX_CLAUSES.get(ImmutableMap.of());
    final List<Ast.Clause> clauses = new ArrayList<>();
    for (int i = 0; i < max; i++) {
      clauses.add(gen("a" + i, G));
    }
    final Comp c = comp(clauses.toArray(new Ast.Clause[0])).yield_(id("a0"));
    assertThat(c.desugar(), hasToString(startsWith("g.flatMap(a0 => ")));

    clauses.add(guard(gt(id("a0"), intLiteral(0))));
    comp(clauses.toArray(new Ast.Clause[0]))
        .yield_(id("a0"))
        .assertError(
            DesugarException.Kind.COMPREHENSION_TOO_LARGE,
            "comprehension has 1001 clauses; the maximum is 1000");
  }

  @Test
  void testTracer() {
    final AtomicReference<Ast.Exp> result = new AtomicReference<>();
    final AtomicReference<DesugarException> error = new AtomicReference<>();
    final Tracer tracer =
        Tracers.withOnDesugarException(
            Tracers.withOnResult(Tracers.empty(), result::set), error::set);
    final Comp c = comp(gen("a", G)).yield_(id("a")).withTracer(tracer);
    final Ast.Exp e = c.desugar();
    assertThat(result.get(), sameInstance(e));
    assertThat(error.get(), nullValue());

    result.set(null);
    final List<String> rules = new ArrayList<>();
    comp(guard(id("b")))
        .yield_(id("a"))
        .withTracer(
            Tracers.withOnRule(tracer, (rule, i) -> rules.add(rule + "@" + i)))
        .assertError(
            DesugarException.Kind.MALFORMED_COMPREHENSION,
            "guard must follow a generator");
    assertThat(
        error.get(),
        throwsA(
            DesugarException.Kind.MALFORMED_COMPREHENSION,
            "guard must follow a generator"));
    assertThat(result.get(), nullValue());
    // Validation fails before any rule fires
    assertThat(rules, hasSize(0));
  }

  @Test
  void testDesugarIgnoresNestedComprehension() {
    final Ast.Comprehension inner =
        comp(gen("b", call("h", id("a"))))
            .yield_(plus(id("a"), id("b")))
            .comprehension();
    comp(gen("a", G))
        .yield_(inner)
        .assertComprehension(
            "for { a <- g } yield for { b <- h(a) } yield a + b")
        .assertDesugar("g.map(a => for { b <- h(a) } yield a + b)");
  }

  @Test
  void testDesugarAll() {
    final Desugarer desugarer = Desugarer.create();

    // In the yield
    final Ast.Comprehension inner =
        comp(gen("b", call("h", id("a"))))
            .yield_(plus(id("a"), id("b")))
            .comprehension();
    final Ast.Comprehension outer =
        comp(gen("a", G)).yield_(inner).comprehension();
    assertThat(
        desugarer.desugarAll(outer),
        hasToString("g.map(a => h(a).map(b => a + b))"));

    // In a generator
    final Ast.Comprehension source =
        comp(gen("b", G), guard(gt(id("b"), intLiteral(0))))
            .yield_(id("b"))
            .comprehension();
    final Ast.Comprehension outer2 =
        comp(gen("a", source))
            .yield_(plus(id("a"), intLiteral(1)))
            .comprehension();
    assertThat(
        desugarer.desugarAll(outer2),
        hasToString("g.withFilter(b => b > 0).map(a => a + 1)"));

    // Inside an ordinary expression
    final Ast.Exp e =
        call("f", comp(gen("a", G)).yield_(id("a")).comprehension(), id("c"));
    assertThat(e, hasToString("f(for { a <- g } yield a, c)"));
    assertThat(desugarer.desugarAll(e), hasToString("f(g, c)"));

    // No comprehensions, no change
    final Ast.Exp e2 = plus(id("a"), intLiteral(1));
    assertThat(desugarer.desugarAll(e2), sameInstance(e2));
  }

  /** Fresh names are unique across all comprehensions in an expression. */
  @Test
  void testDesugarAllSharesNames() {
    final Ast.Comprehension inner =
        comp(
                gen(tuplePat("p", "q"), id("h")),
                alias("r", plus(id("p"), id("q"))),
                guard(gt(id("r"), intLiteral(0))))
            .yield_(id("r"))
            .comprehension();
    final Ast.Comprehension outer =
        comp(
                gen(tuplePat("a", "b"), inner),
                alias("c", plus(id("a"), id("b"))),
                guard(gt(id("c"), intLiteral(0))))
            .yield_(id("c"))
            .comprehension();
    assertThat(
        Desugarer.create().desugarAll(outer),
        hasToString(
            "h.map((x @ (p, q)) => { val r = p + q; (x, r) })"
                + ".withFilter(((p, q), r) => r > 0)"
                + ".map(((p, q), r) => r)"
                + ".map((x1 @ (a, b)) => { val c = a + b; (x1, c) })"
                + ".withFilter(((a, b), c) => c > 0)"
                + ".map(((a, b), c) => c)"));
  }

  /** Desugaring is re-entrant; calls in parallel give the same result. */
  @Test
  void testConcurrent() throws Exception {
    final Desugarer desugarer = Desugarer.create();
    final Ast.Comprehension c =
        comp(
                gen(tuplePat("a", "b"), G),
                alias("c", plus(id("a"), id("b"))),
                guard(gt(id("c"), intLiteral(0))),
                exec(call("log", id("c"))))
            .comprehension();
    final String expected = desugarer.desugar(c).toString();
    assertThat(
        expected,
        is(
            "g.map((x @ (a, b)) => { val c = a + b; (x, c) })"
                + ".withFilter(((a, b), c) => c > 0)"
                + ".flatMap(((a, b), c) => log(c))"));

    final ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      final List<Callable<String>> tasks = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        tasks.add(() -> desugarer.desugar(c).toString());
      }
      for (Future<String> future : executor.invokeAll(tasks)) {
        assertThat(future.get(), is(expected));
      }
    } finally {
      executor.shutdown();
    }
  }
}

// End DesugarTest.java
