/*
 * Copyright 2026 The Kythe Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.callsite.inference;

import com.google.devtools.callsite.syntax.Expression;
import com.google.devtools.callsite.syntax.Expressions;
import java.util.Optional;

/**
 * Finds the name an expression carries in its own syntax: the identifier it is, or the member it
 * accesses. Does not consult type information.
 */
public final class StructuralNameExtractor {
  private StructuralNameExtractor() {}

  /**
   * Returns the raw (not case-converted) intrinsic name of {@code expression}, or empty if its
   * shape has none.
   *
   * <p>Parentheses and casts are looked through, and a null-conditional chain is followed into its
   * when-not-null branch. Each step moves to a strict sub-expression, so the walk is bounded by the
   * nesting depth of {@code expression}.
   */
  public static Optional<String> extract(Expression expression) {
    Expression current = expression;
    while (true) {
      current = Expressions.walkDownParentheses(current);
      switch (current.getKind()) {
        case IDENTIFIER:
          return Optional.of(current.identifier());
        case MEMBER_ACCESS:
          return Optional.of(current.memberAccess().name());
        case MEMBER_BINDING:
          return Optional.of(current.memberBinding());
        case CONDITIONAL_ACCESS:
          current = current.conditionalAccess().whenNotNull();
          continue;
        case CAST:
          current = current.cast().expression();
          continue;
        case PARENTHESIZED:
          // Unreachable after walkDownParentheses.
          continue;
        case INVOCATION:
        case OPAQUE:
          return Optional.empty();
      }
      throw new AssertionError("unhandled expression kind: " + current.getKind());
    }
  }
}
