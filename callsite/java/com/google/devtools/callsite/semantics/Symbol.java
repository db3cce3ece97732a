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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A symbol resolved by a {@link SemanticOracle}. */
@AutoValue
public abstract class Symbol {
  public abstract SymbolKind kind();

  public abstract String name();

  /** Declared parameters in order; empty for symbols that have none. */
  public abstract ImmutableList<ParameterSymbol> parameters();

  public static Symbol create(SymbolKind kind, String name, List<ParameterSymbol> parameters) {
    ImmutableList<ParameterSymbol> params = ImmutableList.copyOf(parameters);
    for (int i = 0; i < params.size(); i++) {
      checkArgument(
          !params.get(i).isVariadic() || i == params.size() - 1,
          "only the last parameter of %s may be variadic",
          name);
    }
    return new AutoValue_Symbol(kind, name, params);
  }

  /** Returns a {@link SymbolKind#METHOD} symbol. */
  public static Symbol method(String name, ParameterSymbol... parameters) {
    return create(SymbolKind.METHOD, name, ImmutableList.copyOf(parameters));
  }

  /** Returns a parameterized {@link SymbolKind#PROPERTY} symbol (an indexer). */
  public static Symbol indexer(String name, ParameterSymbol... parameters) {
    return create(SymbolKind.PROPERTY, name, ImmutableList.copyOf(parameters));
  }
}
