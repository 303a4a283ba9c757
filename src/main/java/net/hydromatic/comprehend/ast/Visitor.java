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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.Tuple tuple) {
    tuple.args.forEach(this::accept);
  }

  protected void visit(Ast.Apply apply) {
    apply.fn.accept(this);
    apply.arg.accept(this);
  }

  protected void visit(Ast.InfixCall infixCall) {
    infixCall.a0.accept(this);
    infixCall.a1.accept(this);
  }

  protected void visit(Ast.Block block) {
    block.valBinds.forEach(this::accept);
    block.exp.accept(this);
  }

  protected void visit(Ast.ValBind valBind) {
    valBind.pat.accept(this);
    valBind.exp.accept(this);
  }

  // combinator calls

  protected void visit(Ast.MapCall map) {
    visitCombinator(map);
  }

  protected void visit(Ast.FlatMapCall flatMap) {
    visitCombinator(flatMap);
  }

  protected void visit(Ast.WithFilterCall withFilter) {
    visitCombinator(withFilter);
  }

  /** Common handling for {@code map}, {@code flatMap}, {@code withFilter}. */
  protected void visitCombinator(Ast.CombinatorCall call) {
    call.source.accept(this);
    call.pat.accept(this);
    call.body.accept(this);
  }

  // patterns

  protected void visit(Ast.IdPat idPat) {}

  protected void visit(Ast.WildcardPat wildcardPat) {}

  protected void visit(Ast.TuplePat tuplePat) {
    tuplePat.args.forEach(this::accept);
  }

  protected void visit(Ast.AsPat asPat) {
    asPat.id.accept(this);
    asPat.pat.accept(this);
  }

  // comprehensions

  protected void visit(Ast.Comprehension comprehension) {
    comprehension.clauses.forEach(this::accept);
    if (comprehension.yield_ != null) {
      comprehension.yield_.accept(this);
    }
  }

  protected void visit(Ast.Generator generator) {
    generator.pat.accept(this);
    generator.exp.accept(this);
  }

  protected void visit(Ast.PureAlias pureAlias) {
    pureAlias.pat.accept(this);
    pureAlias.exp.accept(this);
  }

  protected void visit(Ast.Guard guard) {
    guard.exp.accept(this);
  }

  protected void visit(Ast.Exec exec) {
    exec.exp.accept(this);
  }

  protected void visit(Ast.Yield yield) {
    yield.exp.accept(this);
  }
}

// End Visitor.java
