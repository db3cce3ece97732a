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

package com.google.devtools.callsite.javac;

/** Thrown when sources cannot be compiled for analysis at all. */
public class CallSiteAnalysisException extends Exception {
  public CallSiteAnalysisException(String message) {
    super(message);
  }

  public CallSiteAnalysisException(String message, Throwable cause) {
    super(message, cause);
  }
}
