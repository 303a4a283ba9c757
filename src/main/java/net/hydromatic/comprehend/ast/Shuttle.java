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

import static net.hydromatic.comprehend.util.Static.transformEager;

import java.util.List;

/**
 * Visits and transforms expression trees.
 *
 * <p>Each method returns the node unchanged if none of its inputs changed.
 * Patterns contain no expressions, and are never transformed.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected List<Ast.Exp> visitList(List<Ast.Exp> nodes) {
    return transformEager(nodes, node -> node.accept(this));
  }

  // expressions

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Exp visit(Ast.Id id) {
    return id; // leaf
  }

  protected Ast.Exp visit(Ast.Tuple tuple) {
    return tuple.copy(visitList(tuple.args));
  }

  protected Ast.Exp visit(Ast.Apply apply) {
    return apply.copy(apply.fn.accept(this), apply.arg.accept(this));
  }

  protected Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(infixCall.a0.accept(this), infixCall.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.Block block) {
    return block.copy(
        transformEager(block.valBinds, this::visit), block.exp.accept(this));
  }

  protected Ast.ValBind visit(Ast.ValBind valBind) {
    return valBind.copy(valBind.pat, valBind.exp.accept(this));
  }

  // combinator calls

  protected Ast.Exp visit(Ast.MapCall map) {
    return map.copy(map.source.accept(this), map.pat, map.body.accept(this));
  }

  protected Ast.Exp visit(Ast.FlatMapCall flatMap) {
    return flatMap.copy(
        flatMap.source.accept(this), flatMap.pat, flatMap.body.accept(this));
  }

  protected Ast.Exp visit(Ast.WithFilterCall withFilter) {
    return withFilter.copy(
        withFilter.source.accept(this),
        withFilter.pat,
        withFilter.body.accept(this));
  }

  // comprehensions

  protected Ast.Exp visit(Ast.Comprehension comprehension) {
    return comprehension.copy(
        transformEager(comprehension.clauses, this::visitClause),
        comprehension.yield_ == null
            ? null
            : comprehension.yield_.copy(comprehension.yield_.exp.accept(this)));
  }

  /** Transforms the expression inside a clause. */
  protected Ast.Clause visitClause(Ast.Clause clause) {
    switch (clause.op) {
      case GENERATOR:
        final Ast.Generator generator = (Ast.Generator) clause;
        return generator.copy(generator.pat, generator.exp.accept(this));
      case PURE_ALIAS:
        final Ast.PureAlias pureAlias = (Ast.PureAlias) clause;
        return pureAlias.copy(pureAlias.pat, pureAlias.exp.accept(this));
      case GUARD:
        final Ast.Guard guard = (Ast.Guard) clause;
        return guard.copy(guard.exp.accept(this));
      case EXEC:
        final Ast.Exec exec = (Ast.Exec) clause;
        return exec.copy(exec.exp.accept(this));
      default:
        throw new AssertionError("unknown clause " + clause.op);
    }
  }
}

// End Shuttle.java
