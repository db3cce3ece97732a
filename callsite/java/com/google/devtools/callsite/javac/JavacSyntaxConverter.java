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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.callsite.syntax.Argument;
import com.google.devtools.callsite.syntax.ArgumentList;
import com.google.devtools.callsite.syntax.Expression;
import com.google.devtools.callsite.syntax.Invocation;
import com.google.devtools.callsite.syntax.Invocation.InvocationKind;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.IdentifierTree;
import com.sun.source.tree.MemberSelectTree;
import com.sun.source.tree.MethodInvocationTree;
import com.sun.source.tree.NewClassTree;
import com.sun.source.tree.ParenthesizedTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.TypeCastTree;
import com.sun.source.util.SimpleTreeVisitor;
import com.sun.source.util.TreePath;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts javac expression trees of one compilation unit into {@link Expression}s, remembering the
 * {@link TreePath} each converted node came from.
 *
 * <p>Each tree is converted once; converting it again returns the same {@link Expression}
 * instance, which is what {@link #getPath(Expression)} is keyed on.
 */
public final class JavacSyntaxConverter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Names javac models as identifiers or member selects that are keywords, not identifiers. */
  private static final ImmutableSet<String> KEYWORD_NAMES =
      ImmutableSet.of("this", "super", "class");

  private final CompilationUnitTree unit;
  private final Map<Tree, Expression> expressions = new IdentityHashMap<>();
  private final Map<Expression, TreePath> expressionPaths = new IdentityHashMap<>();
  private final Map<Argument, TreePath> argumentPaths = new IdentityHashMap<>();

  public JavacSyntaxConverter(CompilationUnitTree unit) {
    this.unit = checkNotNull(unit);
  }

  public CompilationUnitTree getCompilationUnit() {
    return unit;
  }

  /** Converts the expression at the leaf of {@code path}. */
  public Expression convert(TreePath path) {
    checkArgument(
        path.getCompilationUnit() == unit, "path belongs to another compilation unit: %s", path);
    checkArgument(
        path.getLeaf() instanceof ExpressionTree, "not an expression: %s", path.getLeaf());
    Expression converted = expressions.get(path.getLeaf());
    if (converted == null) {
      converted = path.getLeaf().accept(new ExpressionVisitor(), path);
      expressions.put(path.getLeaf(), converted);
      expressionPaths.put(converted, path);
    }
    return converted;
  }

  /** Returns the path of the tree {@code expression} was converted from. */
  public @Nullable TreePath getPath(Expression expression) {
    return expressionPaths.get(expression);
  }

  /** Returns the path of the argument tree {@code argument} was converted from. */
  public @Nullable TreePath getPath(Argument argument) {
    return argumentPaths.get(argument);
  }

  private Expression convertChild(TreePath parent, Tree child) {
    return convert(new TreePath(parent, child));
  }

  private ArgumentList convertArguments(TreePath parent, List<? extends ExpressionTree> trees) {
    List<Argument> arguments = new ArrayList<>();
    for (ExpressionTree tree : trees) {
      TreePath argumentPath = new TreePath(parent, tree);
      // Java has no named arguments.
      Argument argument = Argument.positional(convert(argumentPath));
      argumentPaths.put(argument, argumentPath);
      arguments.add(argument);
    }
    return ArgumentList.of(arguments);
  }

  private class ExpressionVisitor extends SimpleTreeVisitor<Expression, TreePath> {
    @Override
    protected Expression defaultAction(Tree tree, TreePath path) {
      logger.atFine().log("treating %s expression as opaque", tree.getKind());
      return Expression.ofOpaque(tree.toString());
    }

    @Override
    public Expression visitParenthesized(ParenthesizedTree tree, TreePath path) {
      return Expression.ofParenthesized(convertChild(path, tree.getExpression()));
    }

    @Override
    public Expression visitIdentifier(IdentifierTree tree, TreePath path) {
      String name = tree.getName().toString();
      if (KEYWORD_NAMES.contains(name)) {
        return Expression.ofOpaque(name);
      }
      return Expression.ofIdentifier(name);
    }

    @Override
    public Expression visitMemberSelect(MemberSelectTree tree, TreePath path) {
      // Foo.class, Outer.this and Outer.super name no member.
      if (KEYWORD_NAMES.contains(tree.getIdentifier().toString())) {
        return Expression.ofOpaque(tree.toString());
      }
      return Expression.ofMemberAccess(
          convertChild(path, tree.getExpression()), tree.getIdentifier().toString());
    }

    @Override
    public Expression visitTypeCast(TypeCastTree tree, TreePath path) {
      return Expression.ofCast(
          tree.getType().toString(), convertChild(path, tree.getExpression()));
    }

    @Override
    public Expression visitMethodInvocation(MethodInvocationTree tree, TreePath path) {
      return Expression.ofInvocation(
          Invocation.create(
              InvocationKind.METHOD_CALL,
              Optional.of(convertChild(path, tree.getMethodSelect())),
              convertArguments(path, tree.getArguments())));
    }

    @Override
    public Expression visitNewClass(NewClassTree tree, TreePath path) {
      return Expression.ofInvocation(
          Invocation.create(
              InvocationKind.OBJECT_CREATION,
              Optional.of(convertChild(path, tree.getIdentifier())),
              convertArguments(path, tree.getArguments())));
    }
  }
}
