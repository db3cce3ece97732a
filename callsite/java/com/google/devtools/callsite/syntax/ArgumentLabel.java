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

package com.google.devtools.callsite.syntax;

import com.google.auto.value.AutoValue;

/**
 * The {@code name:} label of a named argument. A label produced by parser recovery (the colon was
 * written but the name was not) is <em>missing</em> and has an empty name.
 */
@AutoValue
public abstract class ArgumentLabel {
  public abstract String name();

  public abstract boolean isMissing();

  public static ArgumentLabel of(String name) {
    return new AutoValue_ArgumentLabel(name, false);
  }

  public static ArgumentLabel missing() {
    return new AutoValue_ArgumentLabel("", true);
  }
}
