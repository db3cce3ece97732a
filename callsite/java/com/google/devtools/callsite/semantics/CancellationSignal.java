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

import java.util.concurrent.CancellationException;

/**
 * Lets an enclosing analysis pass abort a long scan. Inference code only hands the signal to the
 * {@link SemanticOracle}; it is the oracle that polls it.
 */
public interface CancellationSignal {
  /** Returns a signal that is never cancelled. */
  static CancellationSignal none() {
    return () -> false;
  }

  boolean isCancellationRequested();

  /** Throws {@link CancellationException} if cancellation has been requested. */
  default void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new CancellationException("analysis cancelled");
    }
  }
}
