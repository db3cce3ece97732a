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

package com.google.devtools.callsite.javac;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.devtools.callsite.semantics.SpecialType;
import com.google.devtools.callsite.semantics.TypeDescriptor;
import java.util.Optional;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.ArrayType;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.type.TypeVariable;

/** Describes javac {@link TypeMirror}s as {@link TypeDescriptor}s. */
public final class JavacTypeDescriptors {
  private JavacTypeDescriptors() {}

  private static final ImmutableMap<TypeKind, SpecialType> PRIMITIVE_TYPES =
      Maps.immutableEnumMap(
          ImmutableMap.<TypeKind, SpecialType>builder()
              .put(TypeKind.BOOLEAN, SpecialType.BOOLEAN)
              .put(TypeKind.BYTE, SpecialType.SIGNED_BYTE)
              .put(TypeKind.SHORT, SpecialType.SHORT)
              .put(TypeKind.INT, SpecialType.INT)
              .put(TypeKind.LONG, SpecialType.LONG)
              .put(TypeKind.CHAR, SpecialType.CHAR)
              .put(TypeKind.FLOAT, SpecialType.FLOAT)
              .put(TypeKind.DOUBLE, SpecialType.DOUBLE)
              .put(TypeKind.VOID, SpecialType.VOID)
              .buildOrThrow());

  private static final ImmutableMap<String, SpecialType> SPECIAL_CLASSES =
      ImmutableMap.of(
          "java.lang.Object", SpecialType.OBJECT,
          "java.lang.String", SpecialType.STRING,
          "java.lang.Enum", SpecialType.ENUM);

  /** Boxed primitives are Java's nullable value types. */
  private static final ImmutableSet<String> BOXED_PRIMITIVES =
      ImmutableSet.of(
          "java.lang.Boolean",
          "java.lang.Byte",
          "java.lang.Short",
          "java.lang.Integer",
          "java.lang.Long",
          "java.lang.Character",
          "java.lang.Float",
          "java.lang.Double");

  /**
   * Returns a descriptor of {@code type}, or empty for types no value can be named after (the null
   * type, erroneous, executable, intersection and union types, and the like).
   */
  public static Optional<TypeDescriptor> describe(TypeMirror type) {
    SpecialType primitive = PRIMITIVE_TYPES.get(type.getKind());
    if (primitive != null) {
      return Optional.of(TypeDescriptor.special(primitive, type.toString()));
    }
    switch (type.getKind()) {
      case ARRAY:
        return describe(((ArrayType) type).getComponentType()).map(TypeDescriptor::arrayOf);
      case DECLARED:
        return Optional.of(describeDeclared((DeclaredType) type));
      case TYPEVAR:
        return Optional.of(
            TypeDescriptor.typeParameter(
                ((TypeVariable) type).asElement().getSimpleName().toString()));
      default:
        return Optional.empty();
    }
  }

  /** Returns the spelling of {@code type} as Java source would write it, without type arguments. */
  public static String displayName(TypeDescriptor type) {
    if (type.isContainer()) {
      return displayName(type.elementType().get()) + "[]";
    }
    return type.name();
  }

  private static TypeDescriptor describeDeclared(DeclaredType type) {
    TypeElement element = (TypeElement) type.asElement();
    if (element.getNestingKind() == NestingKind.ANONYMOUS) {
      return TypeDescriptor.anonymous(type.toString());
    }
    String simpleName = element.getSimpleName().toString();
    String qualifiedName = element.getQualifiedName().toString();
    SpecialType special = SPECIAL_CLASSES.get(qualifiedName);
    if (special != null) {
      return TypeDescriptor.special(special, simpleName);
    }
    if (BOXED_PRIMITIVES.contains(qualifiedName)) {
      return TypeDescriptor.builder()
          .setName(simpleName)
          .setOriginalDefinitionSpecialType(SpecialType.NULLABLE_T)
          .build();
    }
    return TypeDescriptor.named(simpleName);
  }
}
