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

import com.beust.jcommander.Parameter;
import java.util.ArrayList;
import java.util.List;

/** Configuration for {@link CallSiteReport}. */
public class CallSiteReportConfig extends CallSiteConfig {
  @Parameter(description = "<java source files to analyze>", required = true)
  private List<String> sources = new ArrayList<>();

  @Parameter(
      names = "--allow_variadic",
      description =
          "Bind positional arguments past the last parameter to a trailing varargs parameter.")
  private boolean allowVariadic;

  @Parameter(
      names = "--capitalize",
      description = "Generate PascalCase names instead of camelCase names.")
  private boolean capitalize;

  @Parameter(
      names = "--classpath",
      description = "Classpath used to resolve references from the analyzed sources.")
  private String classpath;

  @Parameter(
      names = {"--out", "-out"},
      description = "Write the report to this file (or stdout if unspecified)")
  private String outputPath;

  public CallSiteReportConfig() {
    super("callsite-report");
  }

  public final List<String> getSources() {
    return sources;
  }

  public final boolean getAllowVariadic() {
    return allowVariadic;
  }

  public final boolean getCapitalize() {
    return capitalize;
  }

  public final String getClasspath() {
    return classpath;
  }

  public final String getOutputPath() {
    return outputPath;
  }

  public CallSiteReportConfig setSources(List<String> sources) {
    this.sources = new ArrayList<>(sources);
    return this;
  }

  public CallSiteReportConfig setAllowVariadic(boolean allowVariadic) {
    this.allowVariadic = allowVariadic;
    return this;
  }

  public CallSiteReportConfig setCapitalize(boolean capitalize) {
    this.capitalize = capitalize;
    return this;
  }

  public CallSiteReportConfig setClasspath(String classpath) {
    this.classpath = classpath;
    return this;
  }

  public CallSiteReportConfig setOutputPath(String outputPath) {
    this.outputPath = outputPath;
    return this;
  }
}
