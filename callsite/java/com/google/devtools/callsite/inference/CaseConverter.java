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

import com.google.common.base.Strings;
import java.util.function.IntUnaryOperator;

/**
 * Converts the first character of a name to upper (Pascal) or lower (camel) case.
 *
 * <p>Only the leading character is touched. Names that look like interfaces ({@code IFoo}) or type
 * parameters ({@code TValue}) lose their one-letter prefix first, unless trimming is disabled.
 */
public final class CaseConverter {
  private CaseConverter() {}

  public static String toPascalCase(String name) {
    return toPascalCase(name, true);
  }

  public static String toPascalCase(String name, boolean trimLeadingTypePrefix) {
    return convertCase(name, trimLeadingTypePrefix, Character::toUpperCase);
  }

  public static String toCamelCase(String name) {
    return toCamelCase(name, true);
  }

  public static String toCamelCase(String name, boolean trimLeadingTypePrefix) {
    return convertCase(name, trimLeadingTypePrefix, Character::toLowerCase);
  }

  /** Whether {@code name} reads like {@code IFoo}: {@code I}, an upper, then a lower letter. */
  public static boolean looksLikeInterfaceName(String name) {
    return looksLikePrefixedName(name, 'I');
  }

  /** Whether {@code name} reads like {@code TValue}: {@code T}, an upper, then a lower letter. */
  public static boolean looksLikeTypeParameterName(String name) {
    return looksLikePrefixedName(name, 'T');
  }

  private static boolean looksLikePrefixedName(String name, char prefix) {
    return name.length() >= 3
        && name.charAt(0) == prefix
        && Character.isUpperCase(name.charAt(1))
        && Character.isLowerCase(name.charAt(2));
  }

  private static String convertCase(
      String name, boolean trimLeadingTypePrefix, IntUnaryOperator convert) {
    if (Strings.isNullOrEmpty(name)) {
      return name;
    }

    if (trimLeadingTypePrefix
        && (looksLikeInterfaceName(name) || looksLikeTypeParameterName(name))) {
      return convertChar(name.charAt(1), convert) + name.substring(2);
    }

    char first = name.charAt(0);
    char converted = convertChar(first, convert);
    if (converted != first) {
      return converted + name.substring(1);
    }
    return name;
  }

  private static char convertChar(char c, IntUnaryOperator convert) {
    return (char) convert.applyAsInt(c);
  }
}
