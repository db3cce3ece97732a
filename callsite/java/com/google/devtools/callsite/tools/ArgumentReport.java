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

package com.google.devtools.callsite.tools;

import org.checkerframework.checker.nullness.qual.Nullable;

/** One line of a {@link CallSiteReport}, serialized with Gson. */
final class ArgumentReport {
  private final String file;
  private final long line;
  private final long column;
  private final String invocation;
  private final int argumentIndex;
  private final @Nullable String parameter;
  private final boolean variadic;
  private final String suggestedName;

  ArgumentReport(
      String file,
      long line,
      long column,
      String invocation,
      int argumentIndex,
      @Nullable String parameter,
      boolean variadic,
      String suggestedName) {
    this.file = file;
    this.line = line;
    this.column = column;
    this.invocation = invocation;
    this.argumentIndex = argumentIndex;
    this.parameter = parameter;
    this.variadic = variadic;
    this.suggestedName = suggestedName;
  }
}
