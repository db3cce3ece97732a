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

package com.google.devtools.callsite.semantics;

import com.google.common.collect.ImmutableList;
import com.google.devtools.callsite.syntax.Expression;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Symbol and type information for the expressions of an attributed syntax tree.
 *
 * <p>Queries are read-only. Implementations shared between threads must tolerate concurrent
 * queries. Every query accepting a {@link CancellationSignal} may throw {@link
 * CancellationException}; callers in this library let it propagate.
 */
public interface SemanticOracle {
  /**
   * Returns the method, constructor, indexer or property symbol bound at the invocable {@code
   * expression}, or empty if it cannot be resolved.
   */
  Optional<Symbol> resolveInvocationSymbol(Expression expression, CancellationSignal cancellation);

  /** Returns the declared parameters of {@code symbol}; empty for symbols that have none. */
  default ImmutableList<ParameterSymbol> getParameters(Symbol symbol) {
    return symbol.parameters();
  }

  /** Returns the static type of {@code expression}, or empty if it is indeterminate. */
  Optional<TypeDescriptor> getExpressionType(Expression expression, CancellationSignal cancellation);

  /**
   * Returns the minimal unqualified spelling of {@code type}: keyword spellings for special types,
   * nullable wrappers written out rather than abbreviated.
   */
  String getShortDisplayName(TypeDescriptor type);
}
