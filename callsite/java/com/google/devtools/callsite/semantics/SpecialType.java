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

/**
 * Well-known types a {@link TypeDescriptor} may denote. Only some of them count as built-in for
 * naming purposes; see {@code TypeNameFallback#isBuiltIn}.
 */
public enum SpecialType {
  /** Not a well-known type. */
  NONE,
  OBJECT,
  VOID,
  BOOLEAN,
  SIGNED_BYTE,
  BYTE,
  DECIMAL,
  FLOAT,
  DOUBLE,
  SHORT,
  INT,
  LONG,
  CHAR,
  STRING,
  UNSIGNED_SHORT,
  UNSIGNED_INT,
  UNSIGNED_LONG,
  NATIVE_INT,
  DATE_TIME,
  ENUM,
  /** The generic wrapper that makes a value type nullable. */
  NULLABLE_T
}
