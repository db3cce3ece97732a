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

import com.google.devtools.callsite.semantics.CancellationSignal;
import com.google.devtools.callsite.semantics.SemanticOracle;
import com.google.devtools.callsite.semantics.TypeDescriptor;
import com.google.devtools.callsite.syntax.Expression;
import java.util.Optional;

/**
 * Generates an identifier for an arbitrary expression, e.g. to name a parameter or property that
 * will receive its value.
 *
 * <p>A name found in the expression's syntax wins and is always Pascal-cased ({@code foo.bar} yields
 * {@code Bar}); otherwise a name is derived from the expression's static type.
 */
public final class NameSynthesizer {
  private final SemanticOracle oracle;

  public NameSynthesizer(SemanticOracle oracle) {
    this.oracle = checkNotNull(oracle);
  }

  /** Returns a name for {@code expression}, camel-cased if it is derived from the type. */
  public String synthesizeName(Expression expression) {
    return synthesizeName(expression, false, CancellationSignal.none());
  }

  public String synthesizeName(Expression expression, boolean capitalize) {
    return synthesizeName(expression, capitalize, CancellationSignal.none());
  }

  /**
   * Returns a name for {@code expression}.
   *
   * @param capitalize Pascal case for a type-derived name if true, camel case otherwise
   * @param cancellation handed to the type query
   */
  public String synthesizeName(
      Expression expression, boolean capitalize, CancellationSignal cancellation) {
    Optional<String> structuralName = StructuralNameExtractor.extract(expression);
    if (structuralName.isPresent()) {
      return CaseConverter.toPascalCase(structuralName.get());
    }

    Optional<TypeDescriptor> type = oracle.getExpressionType(expression, cancellation);
    return TypeNameFallback.createParameterName(type, capitalize, oracle);
  }
}
