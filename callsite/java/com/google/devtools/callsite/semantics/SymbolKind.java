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

/** Kind of a {@link Symbol} bound at a call site. */
public enum SymbolKind {
  /** Methods, constructors, delegate invocations and operators. */
  METHOD,
  /** Properties, including parameterized properties (indexers). */
  PROPERTY,
  FIELD,
  LOCAL,
  PARAMETER,
  TYPE,
  NAMESPACE,
  EVENT;

  /** Whether symbols of this kind declare parameters that arguments can bind to. */
  public boolean isInvocable() {
    return this == METHOD || this == PROPERTY;
  }
}
