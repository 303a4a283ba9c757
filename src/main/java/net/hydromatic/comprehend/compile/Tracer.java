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

import net.hydromatic.comprehend.ast.Ast;

/** Called on various events during desugaring. */
public interface Tracer {
  /**
   * Called when a rewrite rule is applied.
   *
   * @param rule Rule
   * @param clauseIndex Index of the clause where the rule matched; equal to
   *     the number of clauses if the rule matched the yield
   */
  void onRule(Rule rule, int clauseIndex);

  /** Called with the result of desugaring a comprehension. */
  void onResult(Ast.Exp exp);

  /**
   * Called with the exception thrown during desugaring. Returns whether a
   * handler was found. The exception is thrown to the caller regardless.
   */
  boolean handleDesugarException(DesugarException e);
}

// End Tracer.java
