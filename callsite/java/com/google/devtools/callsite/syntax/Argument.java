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

import java.util.Optional;

/**
 * One actual argument at a call site.
 *
 * <p>Arguments are syntax nodes: two arguments with the same text at different positions are
 * different nodes, so {@code Argument} keeps identity equality.
 */
public final class Argument {
  private final Optional<ArgumentLabel> label;
  private final Expression expression;

  private Argument(Optional<ArgumentLabel> label, Expression expression) {
    this.label = checkNotNull(label);
    this.expression = checkNotNull(expression);
  }

  /** Returns a positional argument. */
  public static Argument positional(Expression expression) {
    return new Argument(Optional.empty(), expression);
  }

  /** Returns an argument naming its parameter, e.g. {@code count: 5}. */
  public static Argument named(String name, Expression expression) {
    return new Argument(Optional.of(ArgumentLabel.of(name)), expression);
  }

  /** Returns an argument with the given (possibly missing) label. */
  public static Argument labeled(ArgumentLabel label, Expression expression) {
    return new Argument(Optional.of(label), expression);
  }

  /** The {@code name:} prefix of a named argument, if written. */
  public Optional<ArgumentLabel> getLabel() {
    return label;
  }

  public Expression getExpression() {
    return expression;
  }

  @Override
  public String toString() {
    return label.map(l -> l.name() + ": ").orElse("") + expression;
  }
}
