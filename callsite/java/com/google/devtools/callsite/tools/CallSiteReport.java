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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.callsite.inference.NameSynthesizer;
import com.google.devtools.callsite.inference.ParameterResolver;
import com.google.devtools.callsite.javac.CallSiteAnalysisException;
import com.google.devtools.callsite.javac.CallSiteScanner;
import com.google.devtools.callsite.javac.CompiledSources;
import com.google.devtools.callsite.javac.JavaSources;
import com.google.devtools.callsite.javac.JavacSemanticOracle;
import com.google.devtools.callsite.javac.JavacSyntaxConverter;
import com.google.devtools.callsite.semantics.ParameterSymbol;
import com.google.devtools.callsite.syntax.ArgumentSite;
import com.google.devtools.callsite.syntax.Expressions;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.LineMap;
import com.sun.source.util.SourcePositions;
import com.sun.source.util.TreePath;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Binary that compiles Java sources and reports, for every argument of every call, the parameter it
 * binds to and a name suggested for its value. Emits one JSON object per argument per line.
 */
public class CallSiteReport {
  private CallSiteReport() {}

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Gson GSON =
      new GsonBuilder().setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES).create();

  public static void main(String[] args) throws CallSiteAnalysisException, IOException {
    CallSiteReportConfig config = new CallSiteReportConfig();
    config.parseCommandLine(args);
    if (config.getVerboseLogging()) {
      enableVerboseLogging();
    }

    report(config, System.out);
  }

  /** Writes the report to {@code config}'s output file, or else to {@code stdout}, left open. */
  static void report(CallSiteReportConfig config, OutputStream stdout)
      throws CallSiteAnalysisException, IOException {
    if (Strings.isNullOrEmpty(config.getOutputPath())) {
      run(config, new BufferedWriter(new OutputStreamWriter(stdout, UTF_8)));
      return;
    }
    try (Writer out = Files.newBufferedWriter(Paths.get(config.getOutputPath()), UTF_8)) {
      run(config, out);
    }
  }

  /** Writes the report for {@code config}'s sources to {@code out}. */
  static void run(CallSiteReportConfig config, Writer out)
      throws CallSiteAnalysisException, IOException {
    List<Path> sources = config.getSources().stream().map(Paths::get).collect(Collectors.toList());
    try (CompiledSources compiled =
        JavaSources.compile(sources, Optional.ofNullable(config.getClasspath()))) {
      if (!compiled.getErrors().isEmpty()) {
        logger.atWarning().log(
            "%d compilation error(s); reporting on partially attributed sources",
            compiled.getErrors().size());
      }
      for (CompilationUnitTree unit : compiled.getCompilationUnits()) {
        reportCompilationUnit(config, compiled, unit, out);
      }
    }
    out.flush();
  }

  private static void reportCompilationUnit(
      CallSiteReportConfig config, CompiledSources compiled, CompilationUnitTree unit, Writer out)
      throws IOException {
    JavacSyntaxConverter converter = new JavacSyntaxConverter(unit);
    JavacSemanticOracle oracle = compiled.newOracle(converter);
    ParameterResolver resolver = new ParameterResolver(oracle);
    NameSynthesizer synthesizer = new NameSynthesizer(oracle);
    SourcePositions positions = compiled.getTrees().getSourcePositions();
    LineMap lineMap = unit.getLineMap();
    String fileName = unit.getSourceFile().getName();

    for (ArgumentSite site : CallSiteScanner.scan(converter)) {
      Optional<ParameterSymbol> parameter =
          resolver.resolveParameter(site, config.getAllowVariadic());
      String name =
          synthesizer.synthesizeName(site.getArgument().getExpression(), config.getCapitalize());

      TreePath argumentPath = converter.getPath(site.getArgument());
      long start = positions.getStartPosition(unit, argumentPath.getLeaf());
      ArgumentReport report =
          new ArgumentReport(
              fileName,
              lineMap.getLineNumber(start),
              lineMap.getColumnNumber(start),
              site.getInvocable().map(Expressions::toSource).orElse(""),
              site.getArgumentList().indexOf(site.getArgument()),
              parameter.map(ParameterSymbol::name).orElse(null),
              parameter.map(ParameterSymbol::isVariadic).orElse(false),
              name);
      out.write(GSON.toJson(report));
      out.write('\n');
    }
  }

  private static void enableVerboseLogging() {
    Logger root = Logger.getLogger("");
    root.setLevel(Level.FINE);
    for (Handler handler : root.getHandlers()) {
      handler.setLevel(Level.FINE);
    }
  }
}
