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

import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.comprehend.ast.Ast;
import net.hydromatic.comprehend.ast.AstNode;
import net.hydromatic.comprehend.ast.Visitor;

/** Utilities for {@link NameGenerator}. */
public abstract class NameGenerators {
  private NameGenerators() {}

  /**
   * Returns a name generator that never returns any of the given names.
   *
   * <p>For prefix "x" it returns "x", "x1", "x2", and so on, skipping names
   * that are in {@code usedNames} or that it has already returned.
   *
   * <p>The generator has mutable state, and is not thread-safe.
   */
  public static NameGenerator avoiding(Iterable<String> usedNames) {
    return new AvoidingNameGenerator(usedNames);
  }

  /**
   * Returns the names of all identifiers, and all identifiers bound by
   * patterns, in a tree.
   */
  public static Set<String> collectNames(AstNode node) {
    final Set<String> names = new HashSet<>();
    node.accept(
        new Visitor() {
          @Override
          protected void visit(Ast.Id id) {
            names.add(id.name);
          }

          @Override
          protected void visit(Ast.IdPat idPat) {
            names.add(idPat.name);
          }
        });
    return ImmutableSet.copyOf(names);
  }

  /** Name generator that avoids a set of names. */
  private static class AvoidingNameGenerator implements NameGenerator {
    private final Set<String> usedNames = new HashSet<>();
    private final Map<String, AtomicInteger> nameCounts = new HashMap<>();

    AvoidingNameGenerator(Iterable<String> usedNames) {
      usedNames.forEach(name -> this.usedNames.add(requireNonNull(name)));
    }

    @Override
    public String fresh(String prefix) {
      final AtomicInteger count =
          nameCounts.computeIfAbsent(prefix, p -> new AtomicInteger(0));
      for (;;) {
        final int i = count.getAndIncrement();
        final String name = i == 0 ? prefix : prefix + i;
        if (usedNames.add(name)) {
          return name;
        }
      }
    }
  }
}

// End NameGenerators.java
