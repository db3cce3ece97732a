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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.util.JavacTask;
import com.sun.source.util.Trees;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

/** Parses and attributes Java sources with the system compiler. No class files are written. */
public final class JavaSources {
  private JavaSources() {}

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Compiles the given source files, resolving references against {@code classpath} if set. */
  public static CompiledSources compile(Collection<Path> files, Optional<String> classpath)
      throws CallSiteAnalysisException {
    JavaCompiler compiler = systemCompiler();
    DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
    StandardJavaFileManager fileManager =
        compiler.getStandardFileManager(diagnostics, null, UTF_8);
    List<String> options = new ArrayList<>();
    if (classpath.isPresent()) {
      options.add("-classpath");
      options.add(classpath.get());
    }
    return compile(
        compiler, fileManager, diagnostics, options, fileManager.getJavaFileObjectsFromPaths(files));
  }

  /** Compiles in-memory sources, e.g. ones created by {@link #fromString}. */
  public static CompiledSources compile(List<? extends JavaFileObject> sources)
      throws CallSiteAnalysisException {
    JavaCompiler compiler = systemCompiler();
    DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
    StandardJavaFileManager fileManager =
        compiler.getStandardFileManager(diagnostics, null, UTF_8);
    return compile(compiler, fileManager, diagnostics, ImmutableList.of(), sources);
  }

  /** Returns an in-memory source file {@code path} (e.g. {@code "pkg/Foo.java"}) with {@code code}. */
  public static JavaFileObject fromString(String path, String code) {
    return new SimpleJavaFileObject(URI.create("string:///" + path), JavaFileObject.Kind.SOURCE) {
      @Override
      public CharSequence getCharContent(boolean ignoreEncodingErrors) {
        return code;
      }
    };
  }

  private static JavaCompiler systemCompiler() throws CallSiteAnalysisException {
    JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    if (compiler == null) {
      throw new CallSiteAnalysisException("no system Java compiler; run with a JDK, not a JRE");
    }
    return compiler;
  }

  private static CompiledSources compile(
      JavaCompiler compiler,
      StandardJavaFileManager fileManager,
      DiagnosticCollector<JavaFileObject> diagnostics,
      List<String> options,
      Iterable<? extends JavaFileObject> sources)
      throws CallSiteAnalysisException {
    List<String> allOptions = new ArrayList<>(options);
    allOptions.add("-proc:none");
    JavacTask task =
        (JavacTask) compiler.getTask(null, fileManager, diagnostics, allOptions, null, sources);
    ImmutableList<CompilationUnitTree> units;
    try {
      units = ImmutableList.copyOf(task.parse());
      task.analyze();
    } catch (IOException | IllegalStateException e) {
      closeQuietly(fileManager, e);
      throw new CallSiteAnalysisException("failed to compile sources", e);
    }

    ImmutableList.Builder<Diagnostic<? extends JavaFileObject>> errors = ImmutableList.builder();
    for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
      if (d.getKind() == Diagnostic.Kind.ERROR) {
        logger.atWarning().log(
            "%s:%d: %s",
            d.getSource() == null ? "<unknown>" : d.getSource().getName(),
            d.getLineNumber(),
            d.getMessage(null));
        errors.add(d);
      }
    }
    return new CompiledSources(Trees.instance(task), units, errors.build(), fileManager);
  }

  private static void closeQuietly(StandardJavaFileManager fileManager, Exception cause) {
    try {
      fileManager.close();
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }
}
