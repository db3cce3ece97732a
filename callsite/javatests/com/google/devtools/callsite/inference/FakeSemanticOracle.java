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

import com.google.devtools.callsite.semantics.CancellationSignal;
import com.google.devtools.callsite.semantics.SemanticOracle;
import com.google.devtools.callsite.semantics.Symbol;
import com.google.devtools.callsite.semantics.TypeDescriptor;
import com.google.devtools.callsite.syntax.Expression;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/** {@link SemanticOracle} answering from scripted, identity-keyed tables. */
final class FakeSemanticOracle implements SemanticOracle {
  private final Map<Expression, Symbol> symbols = new IdentityHashMap<>();
  private final Map<Expression, TypeDescriptor> types = new IdentityHashMap<>();
  private int typeQueries;

  FakeSemanticOracle bindSymbol(Expression invocable, Symbol symbol) {
    symbols.put(invocable, symbol);
    return this;
  }

  FakeSemanticOracle bindType(Expression expression, TypeDescriptor type) {
    types.put(expression, type);
    return this;
  }

  int getTypeQueries() {
    return typeQueries;
  }

  @Override
  public Optional<Symbol> resolveInvocationSymbol(
      Expression expression, CancellationSignal cancellation) {
    cancellation.throwIfCancellationRequested();
    return Optional.ofNullable(symbols.get(expression));
  }

  @Override
  public Optional<TypeDescriptor> getExpressionType(
      Expression expression, CancellationSignal cancellation) {
    cancellation.throwIfCancellationRequested();
    typeQueries++;
    return Optional.ofNullable(types.get(expression));
  }

  @Override
  public String getShortDisplayName(TypeDescriptor type) {
    return type.name();
  }
}
