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

import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.Pos;

/**
 * Creates calls to {@code map}, removing those that would return their source
 * unchanged.
 *
 * <p>For example, "{@code g.map(a => a)}" becomes "{@code g}", and "{@code
 * g.map((a, b) => (a, b))}" becomes "{@code g}"; but "{@code g.map((a, b) =>
 * (b, a))}" is not changed.
 */
public class MapEliminator {
  private final boolean enabled;
  private final Tracer tracer;

  /**
   * Creates a MapEliminator.
   *
   * @param enabled Whether to remove redundant calls; if false, {@link #map}
   *     always creates a call
   * @param tracer Tracer, notified when a call is removed
   */
  public MapEliminator(boolean enabled, Tracer tracer) {
    this.enabled = enabled;
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Returns "{@code source.map(pat => body)}", or {@code source} if {@code
   * body} rebuilds exactly the value bound by {@code pat}.
   */
  public Ast.Exp map(
      int clauseIndex, Pos pos, Ast.Exp source, Ast.Pat pat, Ast.Exp body) {
    if (enabled && ast.sameBinding(pat, body)) {
      tracer.onRule(Rule.REDUNDANT_MAP, clauseIndex);
      return source;
    }
    tracer.onRule(Rule.GENERATOR_THEN_YIELD, clauseIndex);
    return ast.map(pos, source, pat, body);
  }
}

// End MapEliminator.java
