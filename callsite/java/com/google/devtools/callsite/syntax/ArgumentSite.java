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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * An {@link Argument} together with its enclosing nodes: the {@link ArgumentList} holding it and
 * the invocable expression owning that list.
 *
 * <p>The owner is absent when the list belongs to something that is not an expression (a
 * constructor initializer or an attribute, for instance).
 */
public final class ArgumentSite {
  private final Argument argument;
  private final ArgumentList argumentList;
  private final Optional<Expression> invocable;

  private ArgumentSite(
      Argument argument, ArgumentList argumentList, Optional<Expression> invocable) {
    this.argument = checkNotNull(argument);
    this.argumentList = checkNotNull(argumentList);
    this.invocable = checkNotNull(invocable);
  }

  public static ArgumentSite create(
      Argument argument, ArgumentList argumentList, Optional<Expression> invocable) {
    return new ArgumentSite(argument, argumentList, invocable);
  }

  /** Returns a site whose argument list has no owning expression. */
  public static ArgumentSite detached(Argument argument, ArgumentList argumentList) {
    return new ArgumentSite(argument, argumentList, Optional.empty());
  }

  /**
   * Returns one site per argument of {@code expression} if it is an {@link Expression.Kind#INVOCATION},
   * otherwise an empty list.
   */
  public static ImmutableList<ArgumentSite> allOf(Expression expression) {
    if (expression.getKind() != Expression.Kind.INVOCATION) {
      return ImmutableList.of();
    }
    ArgumentList list = expression.invocation().arguments();
    ImmutableList.Builder<ArgumentSite> sites = ImmutableList.builder();
    for (Argument argument : list.getArguments()) {
      sites.add(new ArgumentSite(argument, list, Optional.of(expression)));
    }
    return sites.build();
  }

  public Argument getArgument() {
    return argument;
  }

  public ArgumentList getArgumentList() {
    return argumentList;
  }

  public Optional<Expression> getInvocable() {
    return invocable;
  }

  @Override
  public String toString() {
    return "ArgumentSite{" + argument + " in " + invocable.map(String::valueOf).orElse("<none>")
        + "}";
  }
}
