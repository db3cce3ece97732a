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
import java.util.Optional;

/** Static type information for an expression, as reported by a {@link SemanticOracle}. */
@AutoValue
public abstract class TypeDescriptor {
  private static final String NULLABLE_NAME = "Nullable";

  public abstract TypeKind kind();

  /** Unqualified name for named types and type parameters; empty for arrays and pointers. */
  public abstract String name();

  /** The element type of an array or the target type of a pointer. */
  public abstract Optional<TypeDescriptor> elementType();

  public abstract SpecialType specialType();

  /** The special type of the unconstructed definition, e.g. {@code NULLABLE_T} for {@code int?}. */
  public abstract SpecialType originalDefinitionSpecialType();

  public abstract boolean isAnonymous();

  /** Whether this type is an array or pointer. */
  public boolean isContainer() {
    return kind() == TypeKind.ARRAY || kind() == TypeKind.POINTER;
  }

  public static Builder builder() {
    return new AutoValue_TypeDescriptor.Builder()
        .setKind(TypeKind.NAMED)
        .setName("")
        .setSpecialType(SpecialType.NONE)
        .setOriginalDefinitionSpecialType(SpecialType.NONE)
        .setIsAnonymous(false);
  }

  /** Returns a plain named type. */
  public static TypeDescriptor named(String name) {
    return builder().setName(name).build();
  }

  /** Returns the special type {@code specialType}, spelled {@code name}. */
  public static TypeDescriptor special(SpecialType specialType, String name) {
    return builder()
        .setName(name)
        .setSpecialType(specialType)
        .setOriginalDefinitionSpecialType(specialType)
        .build();
  }

  /** Returns the nullable wrapper constructed over {@code underlying}. */
  public static TypeDescriptor nullableOf(TypeDescriptor underlying) {
    return builder()
        .setName(NULLABLE_NAME + "<" + underlying.name() + ">")
        .setOriginalDefinitionSpecialType(SpecialType.NULLABLE_T)
        .build();
  }

  /** Returns an anonymous type; its name is compiler-generated. */
  public static TypeDescriptor anonymous(String generatedName) {
    return builder().setName(generatedName).setIsAnonymous(true).build();
  }

  public static TypeDescriptor typeParameter(String name) {
    return builder().setKind(TypeKind.TYPE_PARAMETER).setName(name).build();
  }

  public static TypeDescriptor arrayOf(TypeDescriptor elementType) {
    return builder().setKind(TypeKind.ARRAY).setElementType(elementType).build();
  }

  public static TypeDescriptor pointerTo(TypeDescriptor targetType) {
    return builder().setKind(TypeKind.POINTER).setElementType(targetType).build();
  }

  /** Builder for {@link TypeDescriptor}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setKind(TypeKind kind);

    public abstract Builder setName(String name);

    public abstract Builder setElementType(TypeDescriptor elementType);

    public abstract Builder setSpecialType(SpecialType specialType);

    public abstract Builder setOriginalDefinitionSpecialType(SpecialType specialType);

    public abstract Builder setIsAnonymous(boolean anonymous);

    abstract TypeDescriptor autoBuild();

    public TypeDescriptor build() {
      TypeDescriptor type = autoBuild();
      checkArgument(
          type.isContainer() == type.elementType().isPresent(),
          "arrays and pointers, and only they, have an element type: %s",
          type);
      return type;
    }
  }
}
