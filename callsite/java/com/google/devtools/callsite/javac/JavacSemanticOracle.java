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
import com.google.common.flogger.FluentLogger;
import com.google.devtools.callsite.semantics.CancellationSignal;
import com.google.devtools.callsite.semantics.ParameterSymbol;
import com.google.devtools.callsite.semantics.SemanticOracle;
import com.google.devtools.callsite.semantics.Symbol;
import com.google.devtools.callsite.semantics.SymbolKind;
import com.google.devtools.callsite.semantics.TypeDescriptor;
import com.google.devtools.callsite.syntax.Expression;
import com.sun.source.tree.MethodInvocationTree;
import com.sun.source.tree.Tree;
import com.sun.source.util.TreePath;
import com.sun.source.util.Trees;
import java.util.List;
import java.util.Optional;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.TypeMirror;

/**
 * {@link SemanticOracle} backed by an attributed javac compilation unit. Answers queries about
 * expressions produced by the given {@link JavacSyntaxConverter}; any other expression is unknown.
 */
public final class JavacSemanticOracle implements SemanticOracle {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Trees trees;
  private final JavacSyntaxConverter converter;

  public JavacSemanticOracle(Trees trees, JavacSyntaxConverter converter) {
    this.trees = checkNotNull(trees);
    this.converter = checkNotNull(converter);
  }

  @Override
  public Optional<Symbol> resolveInvocationSymbol(
      Expression expression, CancellationSignal cancellation) {
    cancellation.throwIfCancellationRequested();
    TreePath path = converter.getPath(expression);
    if (path == null) {
      logger.atFine().log("expression was not converted from this compilation unit: %s", expression);
      return Optional.empty();
    }

    Tree leaf = path.getLeaf();
    Element element;
    switch (leaf.getKind()) {
      case METHOD_INVOCATION:
        element =
            trees.getElement(new TreePath(path, ((MethodInvocationTree) leaf).getMethodSelect()));
        break;
      case NEW_CLASS:
        element = trees.getElement(path);
        break;
      default:
        return Optional.empty();
    }
    if (!(element instanceof ExecutableElement)) {
      logger.atFine().log("no executable element for %s", leaf);
      return Optional.empty();
    }
    return Optional.of(toSymbol((ExecutableElement) element));
  }

  @Override
  public Optional<TypeDescriptor> getExpressionType(
      Expression expression, CancellationSignal cancellation) {
    cancellation.throwIfCancellationRequested();
    TreePath path = converter.getPath(expression);
    if (path == null) {
      return Optional.empty();
    }
    TypeMirror type = trees.getTypeMirror(path);
    if (type == null) {
      return Optional.empty();
    }
    return JavacTypeDescriptors.describe(type);
  }

  @Override
  public String getShortDisplayName(TypeDescriptor type) {
    return JavacTypeDescriptors.displayName(type);
  }

  private static Symbol toSymbol(ExecutableElement method) {
    String name =
        method.getKind() == ElementKind.CONSTRUCTOR
            ? method.getEnclosingElement().getSimpleName().toString()
            : method.getSimpleName().toString();
    List<? extends VariableElement> declared = method.getParameters();
    ImmutableList.Builder<ParameterSymbol> parameters = ImmutableList.builder();
    for (int i = 0; i < declared.size(); i++) {
      boolean variadic = method.isVarArgs() && i == declared.size() - 1;
      parameters.add(
          ParameterSymbol.create(declared.get(i).getSimpleName().toString(), i, variadic));
    }
    return Symbol.create(SymbolKind.METHOD, name, parameters.build());
  }
}
