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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link Expressions}. */
@RunWith(JUnit4.class)
public class ExpressionsTest {
  @Test
  public void testWalkDownParentheses() {
    Expression foo = Expression.ofIdentifier("foo");
    assertThat(Expressions.walkDownParentheses(foo)).isSameInstanceAs(foo);
    assertThat(
            Expressions.walkDownParentheses(
                Expression.ofParenthesized(Expression.ofParenthesized(foo))))
        .isSameInstanceAs(foo);
  }

  @Test
  public void testWalkDownParenthesesStopsAtCast() {
    Expression cast = Expression.ofCast("int", Expression.ofParenthesized(Expression.ofOpaque("1")));
    assertThat(Expressions.walkDownParentheses(Expression.ofParenthesized(cast)))
        .isSameInstanceAs(cast);
  }

  @Test
  public void testToSource() {
    Expression call =
        Expression.ofInvocation(
            Invocation.methodCall(
                Expression.ofMemberAccess(Expression.ofIdentifier("log"), "Information"),
                Argument.positional(Expression.ofOpaque("\"{Count}\"")),
                Argument.named(
                    "count",
                    Expression.ofCast(
                        "int",
                        Expression.ofConditionalAccess(
                            Expression.ofIdentifier("items"),
                            Expression.ofMemberBinding("Length"))))));
    assertThat(Expressions.toSource(call))
        .isEqualTo("log.Information(\"{Count}\", count: (int) items?.Length)");
  }

  @Test
  public void testToSourceOfCreationAndElementAccess() {
    Expression creation =
        Expression.ofInvocation(
            Invocation.objectCreation(
                Expression.ofIdentifier("Widget"),
                Argument.positional(Expression.ofParenthesized(Expression.ofIdentifier("a")))));
    Expression element =
        Expression.ofInvocation(
            Invocation.elementAccess(
                Expression.ofIdentifier("table"),
                Argument.positional(Expression.ofOpaque("1")),
                Argument.positional(Expression.ofOpaque("2"))));
    assertThat(Expressions.toSource(creation)).isEqualTo("new Widget((a))");
    assertThat(Expressions.toSource(element)).isEqualTo("table[1, 2]");
  }

  @Test
  public void testKindsMatchFactories() {
    assertThat(Expression.ofIdentifier("a").getKind()).isEqualTo(Expression.Kind.IDENTIFIER);
    assertThat(Expression.ofMemberBinding("a").getKind())
        .isEqualTo(Expression.Kind.MEMBER_BINDING);
    assertThat(Expression.ofOpaque("a").getKind()).isEqualTo(Expression.Kind.OPAQUE);
    assertThat(Expression.ofMemberAccess(Expression.ofIdentifier("a"), "b").memberAccess().name())
        .isEqualTo("b");
  }
}
