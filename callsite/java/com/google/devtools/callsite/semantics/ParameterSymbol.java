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

import com.google.auto.value.AutoValue;

/** A declared formal parameter. */
@AutoValue
public abstract class ParameterSymbol {
  public abstract String name();

  /** Zero-based declared position. */
  public abstract int ordinal();

  /**
   * Whether this parameter collects any number of trailing positional arguments. Only the last
   * parameter of a signature may be variadic.
   */
  public abstract boolean isVariadic();

  public static ParameterSymbol create(String name, int ordinal, boolean isVariadic) {
    return new AutoValue_ParameterSymbol(name, ordinal, isVariadic);
  }
}
