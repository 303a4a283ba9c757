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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.comprehend.ast.AstBuilder.ast;
import static net.hydromatic.comprehend.util.Static.forEachIndexed;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /**
   * Base class for a pattern.
   *
   * <p>For example, "a" in "{@code a <- g}" is an {@link IdPat}; the "(a, b)"
   * in "{@code (a, b) <- pairs}" is a {@link TuplePat}.
   */
  public abstract static class Pat extends AstNode {
    Pat(Pos pos, Op op) {
      super(pos, op);
    }

    public void forEachArg(ObjIntConsumer<Pat> action) {
      // no args
    }

    /** Calls a consumer for this pattern and each of its descendants. */
    public void visit(Consumer<Pat> consumer) {
      consumer.accept(this);
      forEachArg((arg, i) -> arg.visit(consumer));
    }
  }

  /**
   * Named pattern, the pattern analog of the {@link Id} expression.
   *
   * <p>For example, "a" in "{@code a <- g}".
   */
  public static class IdPat extends Pat {
    public final String name;

    IdPat(Pos pos, String name) {
      super(pos, Op.ID_PAT);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IdPat && this.name.equals(((IdPat) o).name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /**
   * Wildcard pattern.
   *
   * <p>For example, "{@code _}" in "{@code _ <- log(msg)}".
   */
  public static class WildcardPat extends Pat {
    WildcardPat(Pos pos) {
      super(pos, Op.WILDCARD_PAT);
    }

    @Override
    public int hashCode() {
      return "_".hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof WildcardPat;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }
  }

  /**
   * Tuple pattern, the pattern analog of the {@link Tuple} expression.
   *
   * <p>For example, "(a, b)" in "{@code (a, b) <- pairs}".
   *
   * <p>A well-formed tuple pattern has at least two arguments. The builder
   * does not enforce this; the desugarer rejects smaller tuples.
   */
  public static class TuplePat extends Pat {
    public final List<Pat> args;

    TuplePat(Pos pos, ImmutableList<Pat> args) {
      super(pos, Op.TUPLE_PAT);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TuplePat && this.args.equals(((TuplePat) o).args);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Pat> action) {
      forEachIndexed(args, action);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(args, "(", ", ", ")");
    }

    /**
     * Creates a copy of this {@code TuplePat} with given contents, or {@code
     * this} if the contents are the same.
     */
    public TuplePat copy(List<Pat> args) {
      return this.args.equals(args) ? this : ast.tuplePat(pos, args);
    }
  }

  /**
   * Layered pattern.
   *
   * <p>For example, in "{@code x @ (a, b)}", if the pattern matches, "x" is
   * assigned the whole tuple, and "a" and "b" are assigned its members.
   */
  public static class AsPat extends Pat {
    public final IdPat id;
    public final Pat pat;

    AsPat(Pos pos, IdPat id, Pat pat) {
      super(pos, Op.AS_PAT);
      this.id = requireNonNull(id);
      this.pat = requireNonNull(pat);
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, pat);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof AsPat
              && this.id.equals(((AsPat) o).id)
              && this.pat.equals(((AsPat) o).pat);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Pat> action) {
      action.accept(id, 0);
      action.accept(pat, 1);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, id, op, pat, right);
    }
  }

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    public void forEachArg(ObjIntConsumer<Exp> action) {
      // no args
    }

    /** Accepts a shuttle, returning the transformed expression. */
    public abstract Exp accept(Shuttle shuttle);

    /** Returns a list of all arguments. */
    public final List<Exp> args() {
      final ImmutableList.Builder<Exp> args = ImmutableList.builder();
      forEachArg((exp, value) -> args.add(exp));
      return args.build();
    }
  }

  /** Parse tree node of an identifier. */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && this.name.equals(((Id) o).name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Parse tree node of a literal (constant). */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final Comparable value;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
      checkArgument(
          op == Op.BOOL_LITERAL
              || op == Op.INT_LITERAL
              || op == Op.STRING_LITERAL);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && this.op == ((Literal) o).op
              && this.value.equals(((Literal) o).value);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }
  }

  /** Tuple. */
  public static class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(Pos pos, Iterable<? extends Exp> args) {
      super(pos, Op.TUPLE);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Tuple && this.args.equals(((Tuple) o).args);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(args, action);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(args, "(", ", ", ")");
    }

    public Tuple copy(List<Exp> args) {
      return this.args.equals(args) ? this : new Tuple(pos, args);
    }
  }

  /** Application of a function to its argument, e.g. "{@code f(a)}". */
  public static class Apply extends Exp {
    public final Exp fn;
    public final Exp arg;

    Apply(Pos pos, Exp fn, Exp arg) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
              && this.fn.equals(((Apply) o).fn)
              && this.arg.equals(((Apply) o).arg);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(fn, 0);
      action.accept(arg, 1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      fn.unparse(w, left, op.left);
      if (arg.op == Op.TUPLE) {
        // "f(a, b)" rather than "f((a, b))"
        return arg.unparse(w, 0, 0);
      }
      return w.append("(").append(arg, 0, 0).append(")");
    }

    public Apply copy(Exp fn, Exp arg) {
      return this.fn.equals(fn) && this.arg.equals(arg)
          ? this
          : new Apply(pos, fn, arg);
    }
  }

  /** Call to an infix operator. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof InfixCall
              && this.op == ((InfixCall) o).op
              && this.a0.equals(((InfixCall) o).a0)
              && this.a1.equals(((InfixCall) o).a1);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(a0, 0);
      action.accept(a1, 1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /**
     * Creates a copy of this {@code InfixCall} with given contents and same
     * operator, or {@code this} if the contents are the same.
     */
    public InfixCall copy(Exp a0, Exp a1) {
      return this.a0.equals(a0) && this.a1.equals(a1)
          ? this
          : new InfixCall(pos, op, a0, a1);
    }
  }

  /** Immutable value binding, "{@code val p = e}", within a {@link Block}. */
  public static class ValBind extends AstNode {
    public final Pat pat;
    public final Exp exp;

    ValBind(Pos pos, Pat pat, Exp exp) {
      super(pos, Op.VAL_BIND);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(pat, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ValBind
              && this.pat.equals(((ValBind) o).pat)
              && this.exp.equals(((ValBind) o).exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("val ").append(pat, 0, 0).append(" = ").append(exp, 0, 0);
    }

    /**
     * Creates a copy of this {@code ValBind} with given contents, or {@code
     * this} if the contents are the same.
     */
    public ValBind copy(Pat pat, Exp exp) {
      return this.pat.equals(pat) && this.exp.equals(exp)
          ? this
          : ast.valBind(pos, pat, exp);
    }
  }

  /**
   * Block of immutable bindings followed by an expression, e.g. "{@code { val
   * a = 1; val b = a + 1; f(a, b) }}".
   *
   * <p>Each binding is visible to the bindings after it and to the
   * expression.
   */
  public static class Block extends Exp {
    public final List<ValBind> valBinds;
    public final Exp exp;

    Block(Pos pos, ImmutableList<ValBind> valBinds, Exp exp) {
      super(pos, Op.BLOCK);
      this.valBinds = requireNonNull(valBinds);
      this.exp = requireNonNull(exp);
      checkArgument(!valBinds.isEmpty(), "block must have bindings");
    }

    @Override
    public int hashCode() {
      return Objects.hash(valBinds, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Block
              && this.valBinds.equals(((Block) o).valBinds)
              && this.exp.equals(((Block) o).exp);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(valBinds, (valBind, i) -> action.accept(valBind.exp, i));
      action.accept(exp, valBinds.size());
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(valBinds, "{ ", "; ", "; ")
          .append(exp, 0, 0)
          .append(" }");
    }

    /**
     * Creates a copy of this {@code Block} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Block copy(List<ValBind> valBinds, Exp exp) {
      return this.valBinds.equals(valBinds) && this.exp.equals(exp)
          ? this
          : ast.block(pos, valBinds, exp);
    }
  }

  /**
   * Call to one of the combinators {@code map}, {@code flatMap}, {@code
   * withFilter}.
   *
   * <p>Each call has a source (the receiver), and a lambda whose parameter is
   * {@link #pat} and whose body is {@link #body}.
   */
  public abstract static class CombinatorCall extends Exp {
    public final Exp source;
    public final Pat pat;
    public final Exp body;

    CombinatorCall(Pos pos, Op op, Exp source, Pat pat, Exp body) {
      super(pos, op);
      this.source = requireNonNull(source);
      this.pat = requireNonNull(pat);
      this.body = requireNonNull(body);
      checkArgument(op.isCombinator());
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, source, pat, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof CombinatorCall
              && this.op == ((CombinatorCall) o).op
              && this.source.equals(((CombinatorCall) o).source)
              && this.pat.equals(((CombinatorCall) o).pat)
              && this.body.equals(((CombinatorCall) o).body);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      action.accept(source, 0);
      action.accept(body, 1);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.call(left, source, op, pat, body, right);
    }

    /**
     * Creates a copy of this call with given contents and the same
     * combinator, or {@code this} if the contents are the same.
     */
    public abstract CombinatorCall copy(Exp source, Pat pat, Exp body);
  }

  /** Call to {@code map}, e.g. "{@code g.map(a => a + 1)}". */
  public static class MapCall extends CombinatorCall {
    MapCall(Pos pos, Exp source, Pat pat, Exp body) {
      super(pos, Op.MAP, source, pat, body);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public MapCall copy(Exp source, Pat pat, Exp body) {
      return this.source.equals(source)
              && this.pat.equals(pat)
              && this.body.equals(body)
          ? this
          : ast.map(pos, source, pat, body);
    }
  }

  /** Call to {@code flatMap}, e.g. "{@code g.flatMap(a => h(a))}". */
  public static class FlatMapCall extends CombinatorCall {
    FlatMapCall(Pos pos, Exp source, Pat pat, Exp body) {
      super(pos, Op.FLAT_MAP, source, pat, body);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public FlatMapCall copy(Exp source, Pat pat, Exp body) {
      return this.source.equals(source)
              && this.pat.equals(pat)
              && this.body.equals(body)
          ? this
          : ast.flatMap(pos, source, pat, body);
    }
  }

  /**
   * Call to {@code withFilter}, e.g. "{@code g.withFilter(a => a > 1)}". The
   * body is the predicate.
   */
  public static class WithFilterCall extends CombinatorCall {
    WithFilterCall(Pos pos, Exp source, Pat pat, Exp predicate) {
      super(pos, Op.WITH_FILTER, source, pat, predicate);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public WithFilterCall copy(Exp source, Pat pat, Exp body) {
      return this.source.equals(source)
              && this.pat.equals(pat)
              && this.body.equals(body)
          ? this
          : ast.withFilter(pos, source, pat, body);
    }
  }

  /** A clause in a comprehension. */
  public abstract static class Clause extends AstNode {
    Clause(Pos pos, Op op) {
      super(pos, op);
    }

    /** Returns the expression that this clause evaluates. */
    public abstract Exp exp();
  }

  /** Monadic binding, "{@code p <- e}". */
  public static class Generator extends Clause {
    public final Pat pat;
    public final Exp exp;

    Generator(Pos pos, Pat pat, Exp exp) {
      super(pos, Op.GENERATOR);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp exp() {
      return exp;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, pat, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Generator
              && this.pat.equals(((Generator) o).pat)
              && this.exp.equals(((Generator) o).exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pat, 0, 0).append(op.padded).append(exp, 0, 0);
    }

    public Generator copy(Pat pat, Exp exp) {
      return this.pat.equals(pat) && this.exp.equals(exp)
          ? this
          : ast.generator(pos, pat, exp);
    }
  }

  /** Non-monadic binding, "{@code p = e}". */
  public static class PureAlias extends Clause {
    public final Pat pat;
    public final Exp exp;

    PureAlias(Pos pos, Pat pat, Exp exp) {
      super(pos, Op.PURE_ALIAS);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp exp() {
      return exp;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, pat, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof PureAlias
              && this.pat.equals(((PureAlias) o).pat)
              && this.exp.equals(((PureAlias) o).exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pat, 0, 0).append(op.padded).append(exp, 0, 0);
    }

    /** Converts this alias to the binding of a {@link Block}. */
    public ValBind toValBind() {
      return ast.valBind(pos, pat, exp);
    }

    public PureAlias copy(Pat pat, Exp exp) {
      return this.pat.equals(pat) && this.exp.equals(exp)
          ? this
          : ast.pureAlias(pos, pat, exp);
    }
  }

  /** Filter condition, "{@code if e}". */
  public static class Guard extends Clause {
    public final Exp exp;

    Guard(Pos pos, Exp exp) {
      super(pos, Op.GUARD);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp exp() {
      return exp;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Guard && this.exp.equals(((Guard) o).exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.padded).append(exp, 0, 0);
    }

    public Guard copy(Exp exp) {
      return this.exp.equals(exp) ? this : ast.guard(pos, exp);
    }
  }

  /**
   * Monadic expression that is evaluated but whose value is not bound.
   *
   * <p>The surface syntax is not settled; this node prints as "{@code exec
   * e}".
   */
  public static class Exec extends Clause {
    public final Exp exp;

    Exec(Pos pos, Exp exp) {
      super(pos, Op.EXEC);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp exp() {
      return exp;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Exec && this.exp.equals(((Exec) o).exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.padded).append(exp, 0, 0);
    }

    public Exec copy(Exp exp) {
      return this.exp.equals(exp) ? this : ast.exec(pos, exp);
    }
  }

  /** The {@code yield} of a comprehension. */
  public static class Yield extends AstNode {
    public final Exp exp;

    Yield(Pos pos, Exp exp) {
      super(pos, Op.YIELD);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return exp.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Yield && this.exp.equals(((Yield) o).exp);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("yield ").append(exp, 0, 0);
    }

    public Yield copy(Exp exp) {
      return this.exp.equals(exp) ? this : ast.yield_(pos, exp);
    }
  }

  /**
   * Comprehension, e.g. "{@code for { a <- g; b = a; if b > 1 } yield a +
   * b}".
   *
   * <p>If {@link #yield_} is null, the last clause should be an {@link Exec};
   * this is checked when the comprehension is desugared, not when it is
   * created.
   */
  public static class Comprehension extends Exp {
    public final List<Clause> clauses;
    public final @Nullable Yield yield_;

    Comprehension(
        Pos pos, ImmutableList<Clause> clauses, @Nullable Yield yield_) {
      super(pos, Op.COMPREHENSION);
      this.clauses = requireNonNull(clauses);
      this.yield_ = yield_;
    }

    @Override
    public int hashCode() {
      return Objects.hash(clauses, yield_);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Comprehension
              && this.clauses.equals(((Comprehension) o).clauses)
              && Objects.equals(this.yield_, ((Comprehension) o).yield_);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp> action) {
      forEachIndexed(clauses, (clause, i) -> action.accept(clause.exp(), i));
      if (yield_ != null) {
        action.accept(yield_.exp, clauses.size());
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      if (clauses.isEmpty()) {
        w.append("for {}");
      } else {
        w.appendAll(clauses, "for { ", "; ", " }");
      }
      if (yield_ != null) {
        w.append(" ").append(yield_, 0, 0);
      }
      return w;
    }

    /**
     * Creates a copy of this {@code Comprehension} with given contents, or
     * {@code this} if the contents are the same.
     */
    public Comprehension copy(List<Clause> clauses, @Nullable Yield yield_) {
      return this.clauses.equals(clauses)
              && Objects.equals(this.yield_, yield_)
          ? this
          : ast.comprehension(pos, clauses, yield_);
    }
  }
}

// End Ast.java
