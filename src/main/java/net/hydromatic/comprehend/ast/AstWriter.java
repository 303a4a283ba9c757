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

import java.util.List;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier to the output. */
  public AstWriter id(String s) {
    b.append(s);
    return this;
  }

  /** Appends a literal value to the output, quoting strings. */
  public AstWriter appendLiteral(Object value) {
    if (value instanceof String) {
      b.append('"')
          .append(((String) value).replace("\\", "\\\\").replace("\"", "\\\""))
          .append('"');
    } else {
      b.append(value);
    }
    return this;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /**
   * Appends a call to a combinator method, e.g. "{@code g.map(p => e)}".
   *
   * <p>The source is the receiver of the call, and binds as tightly as a
   * function application.
   */
  public AstWriter call(
      int left, AstNode source, Op op, AstNode pat, AstNode body, int right) {
    if (left > op.left || op.right < right) {
      return append("(").call(0, source, op, pat, body, 0).append(")");
    }
    source.unparse(this, left, op.left);
    append(op.padded).append("(");
    pat.unparse(this, 0, Op.FN.left);
    append(Op.FN.padded);
    body.unparse(this, Op.FN.right, 0);
    return append(")");
  }

  /** Appends a list of nodes with a separator, a prefix and a suffix. */
  public AstWriter appendAll(
      List<? extends AstNode> list, String start, String sep, String end) {
    append(start);
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        append(sep);
      }
      list.get(i).unparse(this, 0, 0);
    }
    return append(end);
  }

  @Override
  public String toString() {
    return b.toString();
  }

  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }
}

// End AstWriter.java
