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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.devtools.callsite.semantics.SemanticOracle;
import com.google.devtools.callsite.semantics.SpecialType;
import com.google.devtools.callsite.semantics.TypeDescriptor;
import java.util.Optional;

/** Derives a name for a value from its static type. */
public final class TypeNameFallback {
  private TypeNameFallback() {}

  /** Name used when the type is unknown, anonymous, or has no usable spelling. */
  public static final String DEFAULT_PARAMETER_NAME = "p";

  /** Name used for built-in types and nullable wrappers. */
  public static final String DEFAULT_BUILT_IN_PARAMETER_NAME = "v";

  /** Special types whose names make poor identifiers. */
  private static final ImmutableSet<SpecialType> BUILT_IN_TYPES =
      Sets.immutableEnumSet(
          SpecialType.OBJECT,
          SpecialType.VOID,
          SpecialType.BOOLEAN,
          SpecialType.SIGNED_BYTE,
          SpecialType.BYTE,
          SpecialType.DECIMAL,
          SpecialType.FLOAT,
          SpecialType.DOUBLE,
          SpecialType.SHORT,
          SpecialType.INT,
          SpecialType.LONG,
          SpecialType.CHAR,
          SpecialType.STRING,
          SpecialType.UNSIGNED_SHORT,
          SpecialType.UNSIGNED_INT,
          SpecialType.UNSIGNED_LONG);

  /** Returns whether {@code type} is one of the primitive, string, object or void types. */
  public static boolean isBuiltIn(TypeDescriptor type) {
    return BUILT_IN_TYPES.contains(type.specialType());
  }

  /** Strips array and pointer layers until a non-container type is reached. */
  public static TypeDescriptor unwrapContainers(TypeDescriptor type) {
    while (type.isContainer()) {
      type = type.elementType().get();
    }
    return type;
  }

  /**
   * Returns a camel- or Pascal-cased name for a value of {@code type}.
   *
   * @param type the static type, or empty if it could not be determined
   * @param capitalize Pascal case if true, camel case otherwise
   * @param oracle provides the display name of {@code type}
   */
  public static String createParameterName(
      Optional<TypeDescriptor> type, boolean capitalize, SemanticOracle oracle) {
    checkNotNull(oracle);
    String shortName = getParameterName(type.map(TypeNameFallback::unwrapContainers), oracle);
    return capitalize ? CaseConverter.toPascalCase(shortName) : CaseConverter.toCamelCase(shortName);
  }

  private static String getParameterName(Optional<TypeDescriptor> type, SemanticOracle oracle) {
    if (!type.isPresent() || type.get().isAnonymous()) {
      return DEFAULT_PARAMETER_NAME;
    }

    TypeDescriptor t = type.get();
    if (isBuiltIn(t) || t.originalDefinitionSpecialType() == SpecialType.NULLABLE_T) {
      return DEFAULT_BUILT_IN_PARAMETER_NAME;
    }

    String shortName = oracle.getShortDisplayName(t);
    return shortName.isEmpty() ? DEFAULT_PARAMETER_NAME : shortName;
  }
}
