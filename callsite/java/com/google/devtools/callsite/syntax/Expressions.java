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

package com.google.devtools.callsite.syntax;

/** Utility methods for {@link Expression}s. */
public final class Expressions {
  private Expressions() {}

  /** Strips any number of enclosing parentheses from {@code expression}. */
  public static Expression walkDownParentheses(Expression expression) {
    while (expression.getKind() == Expression.Kind.PARENTHESIZED) {
      expression = expression.parenthesized();
    }
    return expression;
  }

  /** Returns a short, human-readable rendering of {@code expression}. */
  public static String toSource(Expression expression) {
    StringBuilder sb = new StringBuilder();
    appendSource(sb, expression);
    return sb.toString();
  }

  private static void appendSource(StringBuilder sb, Expression expression) {
    switch (expression.getKind()) {
      case IDENTIFIER:
        sb.append(expression.identifier());
        return;
      case MEMBER_ACCESS:
        appendSource(sb, expression.memberAccess().target());
        sb.append('.').append(expression.memberAccess().name());
        return;
      case MEMBER_BINDING:
        sb.append('.').append(expression.memberBinding());
        return;
      case CONDITIONAL_ACCESS:
        appendSource(sb, expression.conditionalAccess().target());
        sb.append('?');
        appendSource(sb, expression.conditionalAccess().whenNotNull());
        return;
      case CAST:
        sb.append('(').append(expression.cast().type()).append(") ");
        appendSource(sb, expression.cast().expression());
        return;
      case PARENTHESIZED:
        sb.append('(');
        appendSource(sb, expression.parenthesized());
        sb.append(')');
        return;
      case INVOCATION:
        Invocation invocation = expression.invocation();
        if (invocation.kind() == Invocation.InvocationKind.OBJECT_CREATION) {
          sb.append("new ");
        }
        invocation.target().ifPresent(target -> appendSource(sb, target));
        boolean element = invocation.kind() == Invocation.InvocationKind.ELEMENT_ACCESS;
        sb.append(element ? '[' : '(');
        boolean first = true;
        for (Argument argument : invocation.arguments().getArguments()) {
          if (!first) {
            sb.append(", ");
          }
          first = false;
          argument.getLabel().ifPresent(label -> sb.append(label.name()).append(": "));
          appendSource(sb, argument.getExpression());
        }
        sb.append(element ? ']' : ')');
        return;
      case OPAQUE:
        sb.append(expression.opaque());
        return;
    }
    throw new AssertionError("unhandled expression kind: " + expression.getKind());
  }
}
