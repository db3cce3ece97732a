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

import com.google.auto.value.AutoOneOf;
import com.google.auto.value.AutoValue;

/**
 * An expression node as seen by the inference algorithms.
 *
 * <p>The set of shapes is closed: callers dispatch on {@link #getKind()} and every {@code switch}
 * names each {@link Kind}. Shapes the algorithms do not look into are carried as {@link
 * Kind#OPAQUE} with their source text.
 *
 * <p>Instances are immutable and therefore acyclic; any walk that only descends into
 * sub-expressions terminates.
 */
@AutoOneOf(Expression.Kind.class)
public abstract class Expression {
  /** Shape of an {@link Expression}. */
  public enum Kind {
    /** A simple name, e.g. {@code foo}. */
    IDENTIFIER,
    /** A qualified member reference, e.g. {@code foo.bar}. */
    MEMBER_ACCESS,
    /** The member part of a null-conditional access, e.g. the {@code .bar} in {@code foo?.bar}. */
    MEMBER_BINDING,
    /** A null-conditional chain, e.g. {@code foo?.bar}. */
    CONDITIONAL_ACCESS,
    /** A cast, e.g. {@code (Bar) foo}. */
    CAST,
    /** A parenthesized expression, e.g. {@code (foo)}. */
    PARENTHESIZED,
    /** A call-like expression owning an argument list. */
    INVOCATION,
    /** Any other expression. */
    OPAQUE
  }

  Expression() {}

  public abstract Kind getKind();

  public abstract String identifier();

  public abstract MemberAccess memberAccess();

  public abstract String memberBinding();

  public abstract ConditionalAccess conditionalAccess();

  public abstract Cast cast();

  public abstract Expression parenthesized();

  public abstract Invocation invocation();

  public abstract String opaque();

  public static Expression ofIdentifier(String name) {
    return AutoOneOf_Expression.identifier(name);
  }

  public static Expression ofMemberAccess(Expression target, String name) {
    return AutoOneOf_Expression.memberAccess(new AutoValue_Expression_MemberAccess(target, name));
  }

  public static Expression ofMemberBinding(String name) {
    return AutoOneOf_Expression.memberBinding(name);
  }

  public static Expression ofConditionalAccess(Expression target, Expression whenNotNull) {
    return AutoOneOf_Expression.conditionalAccess(
        new AutoValue_Expression_ConditionalAccess(target, whenNotNull));
  }

  public static Expression ofCast(String type, Expression expression) {
    return AutoOneOf_Expression.cast(new AutoValue_Expression_Cast(type, expression));
  }

  public static Expression ofParenthesized(Expression expression) {
    return AutoOneOf_Expression.parenthesized(expression);
  }

  public static Expression ofInvocation(Invocation invocation) {
    return AutoOneOf_Expression.invocation(invocation);
  }

  public static Expression ofOpaque(String text) {
    return AutoOneOf_Expression.opaque(text);
  }

  /** {@code target.name} */
  @AutoValue
  public abstract static class MemberAccess {
    public abstract Expression target();

    public abstract String name();
  }

  /** {@code target?.whenNotNull}, where {@code whenNotNull} is rooted at a member binding. */
  @AutoValue
  public abstract static class ConditionalAccess {
    public abstract Expression target();

    public abstract Expression whenNotNull();
  }

  /** {@code (type) expression} */
  @AutoValue
  public abstract static class Cast {
    /** Source text of the target type. */
    public abstract String type();

    public abstract Expression expression();
  }
}
