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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** The ordered arguments of one call site. */
public final class ArgumentList {
  private final ImmutableList<Argument> arguments;

  private ArgumentList(ImmutableList<Argument> arguments) {
    this.arguments = arguments;
  }

  public static ArgumentList of(Argument... arguments) {
    return new ArgumentList(ImmutableList.copyOf(arguments));
  }

  public static ArgumentList of(List<Argument> arguments) {
    return new ArgumentList(ImmutableList.copyOf(arguments));
  }

  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  public int size() {
    return arguments.size();
  }

  /**
   * Returns the zero-based position of {@code argument} in this list, comparing by node identity,
   * or -1 if the argument does not belong to this list.
   */
  public int indexOf(Argument argument) {
    for (int i = 0; i < arguments.size(); i++) {
      if (arguments.get(i) == argument) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(", ").join(arguments) + ")";
  }
}
