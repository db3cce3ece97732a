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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.callsite.semantics.CancellationSignal;
import com.google.devtools.callsite.semantics.ParameterSymbol;
import com.google.devtools.callsite.semantics.SemanticOracle;
import com.google.devtools.callsite.semantics.Symbol;
import com.google.devtools.callsite.syntax.Argument;
import com.google.devtools.callsite.syntax.ArgumentLabel;
import com.google.devtools.callsite.syntax.ArgumentSite;
import com.google.devtools.callsite.syntax.Expression;
import java.util.Optional;

/**
 * Determines the formal parameter an argument is passed to.
 *
 * <p>Named arguments bind by exact name; positional arguments bind by index. With variadic
 * matching, positional arguments past the end of the parameter list bind to a trailing variadic
 * parameter.
 */
public final class ParameterResolver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final SemanticOracle oracle;

  public ParameterResolver(SemanticOracle oracle) {
    this.oracle = checkNotNull(oracle);
  }

  /** Same as {@link #resolveParameter(ArgumentSite, boolean, CancellationSignal)}, uncancellable. */
  public Optional<ParameterSymbol> resolveParameter(ArgumentSite site, boolean allowVariadicMatch) {
    return resolveParameter(site, allowVariadicMatch, CancellationSignal.none());
  }

  /**
   * Returns the parameter to which the argument at {@code site} is passed, or empty if it cannot
   * be determined.
   *
   * @param allowVariadicMatch if true and the argument's index is past the last parameter, the
   *     last parameter is returned provided it is variadic
   * @param cancellation handed to each oracle query
   */
  public Optional<ParameterSymbol> resolveParameter(
      ArgumentSite site, boolean allowVariadicMatch, CancellationSignal cancellation) {
    Optional<Expression> invocable = site.getInvocable();
    if (!invocable.isPresent()) {
      logger.atFine().log("argument list of %s is not owned by an expression", site);
      return Optional.empty();
    }

    Optional<Symbol> symbol = oracle.resolveInvocationSymbol(invocable.get(), cancellation);
    if (!symbol.isPresent() || !symbol.get().kind().isInvocable()) {
      logger.atFine().log("no method or property symbol bound at %s", site);
      return Optional.empty();
    }

    ImmutableList<ParameterSymbol> parameters = oracle.getParameters(symbol.get());

    Argument argument = site.getArgument();
    Optional<ArgumentLabel> label = argument.getLabel();
    if (label.isPresent() && !label.get().isMissing()) {
      String name = label.get().name();
      return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    int index = site.getArgumentList().indexOf(argument);
    if (index < 0) {
      logger.atFine().log("%s is not an element of its own argument list", argument);
      return Optional.empty();
    }

    if (index < parameters.size()) {
      return Optional.of(parameters.get(index));
    }

    if (allowVariadicMatch && !parameters.isEmpty()) {
      ParameterSymbol last = parameters.get(parameters.size() - 1);
      if (last.isVariadic()) {
        return Optional.of(last);
      }
    }
    return Optional.empty();
  }
}
