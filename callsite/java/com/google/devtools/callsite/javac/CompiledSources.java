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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.util.Trees;
import java.io.IOException;
import javax.tools.Diagnostic;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;

/**
 * Attributed compilation units produced by {@link JavaSources}. Holds the compiler's file manager
 * open until closed.
 */
public final class CompiledSources implements AutoCloseable {
  private final Trees trees;
  private final ImmutableList<CompilationUnitTree> compilationUnits;
  private final ImmutableList<Diagnostic<? extends JavaFileObject>> errors;
  private final JavaFileManager fileManager;

  CompiledSources(
      Trees trees,
      ImmutableList<CompilationUnitTree> compilationUnits,
      ImmutableList<Diagnostic<? extends JavaFileObject>> errors,
      JavaFileManager fileManager) {
    this.trees = checkNotNull(trees);
    this.compilationUnits = checkNotNull(compilationUnits);
    this.errors = checkNotNull(errors);
    this.fileManager = checkNotNull(fileManager);
  }

  public Trees getTrees() {
    return trees;
  }

  public ImmutableList<CompilationUnitTree> getCompilationUnits() {
    return compilationUnits;
  }

  /** Compilation errors. Units with errors are still attributed as far as javac got. */
  public ImmutableList<Diagnostic<? extends JavaFileObject>> getErrors() {
    return errors;
  }

  /** Returns an oracle over {@code converter}'s compilation unit. */
  public JavacSemanticOracle newOracle(JavacSyntaxConverter converter) {
    return new JavacSemanticOracle(trees, converter);
  }

  @Override
  public void close() throws IOException {
    fileManager.close();
  }
}
