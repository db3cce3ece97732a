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
import java.util.Optional;

/** A call-like expression: a method call, an object creation or an element (indexer) access. */
@AutoValue
public abstract class Invocation {
  /** Syntactic form of an {@link Invocation}. */
  public enum InvocationKind {
    METHOD_CALL,
    OBJECT_CREATION,
    ELEMENT_ACCESS
  }

  public abstract InvocationKind kind();

  /**
   * The called expression: the method or delegate for a call, the created type for an object
   * creation, the indexed expression for an element access. Absent for implicitly typed creations.
   */
  public abstract Optional<Expression> target();

  public abstract ArgumentList arguments();

  public static Invocation create(
      InvocationKind kind, Optional<Expression> target, ArgumentList arguments) {
    return new AutoValue_Invocation(kind, target, arguments);
  }

  public static Invocation methodCall(Expression method, Argument... arguments) {
    return create(InvocationKind.METHOD_CALL, Optional.of(method), ArgumentList.of(arguments));
  }

  public static Invocation objectCreation(Expression type, Argument... arguments) {
    return create(InvocationKind.OBJECT_CREATION, Optional.of(type), ArgumentList.of(arguments));
  }

  public static Invocation elementAccess(Expression indexed, Argument... arguments) {
    return create(InvocationKind.ELEMENT_ACCESS, Optional.of(indexed), ArgumentList.of(arguments));
  }
}
