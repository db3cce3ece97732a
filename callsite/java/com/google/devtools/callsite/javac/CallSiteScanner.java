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

import com.google.common.collect.ImmutableList;
import com.google.devtools.callsite.syntax.ArgumentSite;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.MethodInvocationTree;
import com.sun.source.tree.NewClassTree;
import com.sun.source.util.TreePath;
import com.sun.source.util.TreePathScanner;

/** Collects the {@link ArgumentSite} of every argument of every call in a compilation unit. */
public final class CallSiteScanner extends TreePathScanner<Void, Void> {
  private final JavacSyntaxConverter converter;
  private final ImmutableList.Builder<ArgumentSite> sites = ImmutableList.builder();

  private CallSiteScanner(JavacSyntaxConverter converter) {
    this.converter = converter;
  }

  /** Returns the argument sites of {@code converter}'s compilation unit in source order. */
  public static ImmutableList<ArgumentSite> scan(JavacSyntaxConverter converter) {
    CompilationUnitTree unit = converter.getCompilationUnit();
    CallSiteScanner scanner = new CallSiteScanner(converter);
    scanner.scan(new TreePath(unit), null);
    return scanner.sites.build();
  }

  @Override
  public Void visitMethodInvocation(MethodInvocationTree tree, Void v) {
    sites.addAll(ArgumentSite.allOf(converter.convert(getCurrentPath())));
    return super.visitMethodInvocation(tree, v);
  }

  @Override
  public Void visitNewClass(NewClassTree tree, Void v) {
    sites.addAll(ArgumentSite.allOf(converter.convert(getCurrentPath())));
    return super.visitNewClass(tree, v);
  }
}
