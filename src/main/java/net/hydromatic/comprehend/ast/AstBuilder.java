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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.Arrays;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /**
   * Returns whether an expression is syntactically the value bound by a
   * pattern.
   *
   * <p>True if the pattern is an identifier and the expression is the same
   * identifier, or if the pattern is a tuple and the expression is a tuple
   * literal of the same arity whose components, in order, are the values
   * bound by the pattern's components. For example, {@code (a, b)} is the
   * binding of pattern {@code (a, b)} but {@code (b, a)} is not.
   *
   * <p>No semantic equivalence is considered. A wildcard or layered pattern
   * is never matched.
   */
  public boolean sameBinding(Ast.Pat pat, Ast.Exp exp) {
    switch (pat.op) {
      case ID_PAT:
        return exp.op == Op.ID
            && ((Ast.IdPat) pat).name.equals(((Ast.Id) exp).name);
      case TUPLE_PAT:
        if (exp.op != Op.TUPLE) {
          return false;
        }
        final Ast.TuplePat tuplePat = (Ast.TuplePat) pat;
        final Ast.Tuple tuple = (Ast.Tuple) exp;
        if (tuplePat.args.size() != tuple.args.size()) {
          return false;
        }
        for (int i = 0; i < tuple.args.size(); i++) {
          if (!sameBinding(tuplePat.args.get(i), tuple.args.get(i))) {
            return false;
          }
        }
        return true;
      default:
        return false;
    }
  }

  /** Creates a {@code boolean} literal. */
  public Ast.Literal boolLiteral(Pos p, boolean b) {
    return new Ast.Literal(p, Op.BOOL_LITERAL, b);
  }

  /** Creates an {@code int} literal. */
  public Ast.Literal intLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  public Ast.Tuple tuple(Pos pos, Iterable<? extends Ast.Exp> list) {
    return new Ast.Tuple(pos, list);
  }

  public Ast.Apply apply(Ast.Exp fn, Ast.Exp arg) {
    return new Ast.Apply(fn.pos.plus(arg.pos), fn, arg);
  }

  /** Creates a call to an infix operator. */
  public Ast.InfixCall infixCall(Op op, Ast.Exp a0, Ast.Exp a1) {
    checkArgument(
        Op.BY_OP_NAME.containsValue(op), "not an infix operator: %s", op);
    return new Ast.InfixCall(a0.pos.plus(a1.pos), op, a0, a1);
  }

  public Ast.Pat idPat(Pos pos, String name) {
    // "_" is not an identifier; matching it would not bind a name.
    if (name.equals("_")) {
      return wildcardPat(pos);
    }
    return new Ast.IdPat(pos, name);
  }

  public Ast.WildcardPat wildcardPat(Pos pos) {
    return new Ast.WildcardPat(pos);
  }

  public Ast.TuplePat tuplePat(Pos pos, Iterable<? extends Ast.Pat> args) {
    return new Ast.TuplePat(pos, ImmutableList.copyOf(args));
  }

  public Ast.TuplePat tuplePat(Pos pos, Ast.Pat... args) {
    return tuplePat(pos, Arrays.asList(args));
  }

  public Ast.AsPat asPat(Pos pos, Ast.IdPat id, Ast.Pat pat) {
    return new Ast.AsPat(pos, id, pat);
  }

  public Ast.ValBind valBind(Pos pos, Ast.Pat pat, Ast.Exp exp) {
    return new Ast.ValBind(pos, pat, exp);
  }

  public Ast.Block block(
      Pos pos, Iterable<? extends Ast.ValBind> valBinds, Ast.Exp exp) {
    return new Ast.Block(pos, ImmutableList.copyOf(valBinds), exp);
  }

  /** Creates a call to {@code map}. */
  public Ast.MapCall map(Pos pos, Ast.Exp source, Ast.Pat pat, Ast.Exp body) {
    return new Ast.MapCall(pos, source, pat, body);
  }

  /** Creates a call to {@code flatMap}. */
  public Ast.FlatMapCall flatMap(
      Pos pos, Ast.Exp source, Ast.Pat pat, Ast.Exp body) {
    return new Ast.FlatMapCall(pos, source, pat, body);
  }

  /** Creates a call to {@code withFilter}. */
  public Ast.WithFilterCall withFilter(
      Pos pos, Ast.Exp source, Ast.Pat pat, Ast.Exp predicate) {
    return new Ast.WithFilterCall(pos, source, pat, predicate);
  }

  public Ast.Generator generator(Pos pos, Ast.Pat pat, Ast.Exp exp) {
    return new Ast.Generator(pos, pat, exp);
  }

  public Ast.PureAlias pureAlias(Pos pos, Ast.Pat pat, Ast.Exp exp) {
    return new Ast.PureAlias(pos, pat, exp);
  }

  public Ast.Guard guard(Pos pos, Ast.Exp exp) {
    return new Ast.Guard(pos, exp);
  }

  public Ast.Exec exec(Pos pos, Ast.Exp exp) {
    return new Ast.Exec(pos, exp);
  }

  public Ast.Yield yield_(Pos pos, Ast.Exp exp) {
    return new Ast.Yield(pos, exp);
  }

  public Ast.Comprehension comprehension(
      Pos pos,
      Iterable<? extends Ast.Clause> clauses,
      Ast.@Nullable Yield yield_) {
    return new Ast.Comprehension(pos, ImmutableList.copyOf(clauses), yield_);
  }
}

// End AstBuilder.java
