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

import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;
import net.hydromatic.comprehend.ast.Ast;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each rule, then calls
   * the underlying tracer.
   */
  public static Tracer withOnRule(
      Tracer tracer, ObjIntConsumer<Rule> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRule(Rule rule, int clauseIndex) {
        consumer.accept(rule, clauseIndex);
        super.onRule(rule, clauseIndex);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result of
   * desugaring, then calls the underlying tracer.
   */
  public static Tracer withOnResult(Tracer tracer, Consumer<Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(Ast.Exp exp) {
        consumer.accept(exp);
        super.onResult(exp);
      }
    };
  }

  public static Tracer withOnDesugarException(
      Tracer tracer, Consumer<DesugarException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleDesugarException(DesugarException e) {
        consumer.accept(e);
        super.handleDesugarException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onRule(Rule rule, int clauseIndex) {}

    @Override
    public void onResult(Ast.Exp exp) {}

    @Override
    public boolean handleDesugarException(DesugarException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onRule(Rule rule, int clauseIndex) {
      tracer.onRule(rule, clauseIndex);
    }

    @Override
    public void onResult(Ast.Exp exp) {
      tracer.onResult(exp);
    }

    @Override
    public boolean handleDesugarException(DesugarException e) {
      return tracer.handleDesugarException(e);
    }
  }
}

// End Tracers.java
