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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link CaseConverter}. */
@RunWith(JUnit4.class)
public class CaseConverterTest {
  @Test
  public void testInterfaceName() {
    assertThat(CaseConverter.toCamelCase("IFooBar")).isEqualTo("fooBar");
    assertThat(CaseConverter.toPascalCase("IFooBar")).isEqualTo("FooBar");
  }

  @Test
  public void testTypeParameterName() {
    assertThat(CaseConverter.toCamelCase("TValue")).isEqualTo("value");
    assertThat(CaseConverter.toPascalCase("TValue")).isEqualTo("Value");
  }

  @Test
  public void testPlainName() {
    assertThat(CaseConverter.toPascalCase("name")).isEqualTo("Name");
    assertThat(CaseConverter.toCamelCase("name")).isEqualTo("name");
    assertThat(CaseConverter.toCamelCase("Name")).isEqualTo("name");
  }

  @Test
  public void testOnlyFirstCharacterChanges() {
    assertThat(CaseConverter.toCamelCase("HTTPClient")).isEqualTo("hTTPClient");
    assertThat(CaseConverter.toPascalCase("fooBAR_baz")).isEqualTo("FooBAR_baz");
  }

  @Test
  public void testEmpty() {
    assertThat(CaseConverter.toPascalCase("")).isEmpty();
    assertThat(CaseConverter.toCamelCase("")).isEmpty();
  }

  @Test
  public void testShortPrefixedNamesAreNotTrimmed() {
    assertThat(CaseConverter.toCamelCase("IO")).isEqualTo("iO");
    assertThat(CaseConverter.toCamelCase("T")).isEqualTo("t");
    assertThat(CaseConverter.toPascalCase("Id")).isEqualTo("Id");
  }

  @Test
  public void testPrefixRequiresUpperThenLower() {
    // Third character is not lower case.
    assertThat(CaseConverter.toCamelCase("IOStream")).isEqualTo("iOStream");
    assertThat(CaseConverter.toCamelCase("TCP")).isEqualTo("tCP");
    // Second character is not upper case.
    assertThat(CaseConverter.toCamelCase("Item")).isEqualTo("item");
    assertThat(CaseConverter.toCamelCase("Type")).isEqualTo("type");
    // Prefix is neither I nor T.
    assertThat(CaseConverter.toCamelCase("AFoo")).isEqualTo("aFoo");
  }

  @Test
  public void testTrimmingDisabled() {
    assertThat(CaseConverter.toCamelCase("IFooBar", false)).isEqualTo("iFooBar");
    assertThat(CaseConverter.toPascalCase("TValue", false)).isEqualTo("TValue");
  }

  @Test
  public void testIdempotent() {
    for (String name : new String[] {"fooBar", "value", "x", "count", "hTTPClient"}) {
      assertThat(CaseConverter.toCamelCase(CaseConverter.toCamelCase(name)))
          .isEqualTo(CaseConverter.toCamelCase(name));
      assertThat(CaseConverter.toCamelCase(name)).isEqualTo(name);
    }
    for (String name : new String[] {"FooBar", "Value", "X", "Count"}) {
      assertThat(CaseConverter.toPascalCase(CaseConverter.toPascalCase(name)))
          .isEqualTo(CaseConverter.toPascalCase(name));
      assertThat(CaseConverter.toPascalCase(name)).isEqualTo(name);
    }
  }

  @Test
  public void testLooksLikeInterfaceName() {
    assertThat(CaseConverter.looksLikeInterfaceName("IFoo")).isTrue();
    assertThat(CaseConverter.looksLikeInterfaceName("IFo")).isTrue();
    assertThat(CaseConverter.looksLikeInterfaceName("IF")).isFalse();
    assertThat(CaseConverter.looksLikeInterfaceName("TFoo")).isFalse();
    assertThat(CaseConverter.looksLikeInterfaceName("iFoo")).isFalse();
  }

  @Test
  public void testLooksLikeTypeParameterName() {
    assertThat(CaseConverter.looksLikeTypeParameterName("TKey")).isTrue();
    assertThat(CaseConverter.looksLikeTypeParameterName("TK")).isFalse();
    assertThat(CaseConverter.looksLikeTypeParameterName("IKey")).isFalse();
  }
}
