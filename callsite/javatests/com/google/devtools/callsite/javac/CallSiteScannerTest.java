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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.devtools.callsite.semantics.CancellationSignal;
import com.google.devtools.callsite.syntax.ArgumentSite;
import com.google.devtools.callsite.syntax.Expression;
import com.google.devtools.callsite.syntax.Expressions;
import com.google.devtools.callsite.syntax.Invocation.InvocationKind;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CallSiteScanner} and {@link JavacSyntaxConverter}. */
@RunWith(JUnit4.class)
public class CallSiteScannerTest {

  private static ImmutableList<ArgumentSite> scan(String code) throws Exception {
    try (CompiledSources compiled =
        JavaSources.compile(ImmutableList.of(JavaSources.fromString("pkg/Test.java", code)))) {
      return CallSiteScanner.scan(new JavacSyntaxConverter(compiled.getCompilationUnits().get(0)));
    }
  }

  private static List<String> describe(List<ArgumentSite> sites) {
    List<String> described = new ArrayList<>();
    for (ArgumentSite site : sites) {
      described.add(
          Expressions.toSource(site.getInvocable().get())
              + "#"
              + site.getArgumentList().indexOf(site.getArgument()));
    }
    return described;
  }

  @Test
  public void testSourceOrder() throws Exception {
    ImmutableList<ArgumentSite> sites =
        scan(
            String.join(
                "\n",
                "package pkg;",
                "class Test {",
                "  static int f(int a) { return a; }",
                "  static int g(int b, int c) { return b; }",
                "  void run() {",
                "    g(f(1), 2);",
                "    new StringBuilder(\"x\");",
                "    run();",
                "  }",
                "}"));
    assertThat(describe(sites))
        .containsExactly("g(f(1), 2)#0", "g(f(1), 2)#1", "f(1)#0", "new StringBuilder(\"x\")#0")
        .inOrder();
  }

  @Test
  public void testArgumentsShareTheirInvocation() throws Exception {
    ImmutableList<ArgumentSite> sites =
        scan(
            String.join(
                "\n",
                "package pkg;",
                "class Test {",
                "  static void g(int b, int c) {}",
                "  void run(int x) {",
                "    g(x, (x));",
                "  }",
                "}"));
    assertThat(sites).hasSize(2);
    assertThat(sites.get(0).getArgumentList()).isSameInstanceAs(sites.get(1).getArgumentList());
    assertThat(sites.get(0).getInvocable().get())
        .isSameInstanceAs(sites.get(1).getInvocable().get());

    Expression invocable = sites.get(0).getInvocable().get();
    assertThat(invocable.getKind()).isEqualTo(Expression.Kind.INVOCATION);
    assertThat(invocable.invocation().kind()).isEqualTo(InvocationKind.METHOD_CALL);
    assertThat(sites.get(0).getArgument().getLabel()).isEmpty();
    assertThat(sites.get(1).getArgument().getExpression().getKind())
        .isEqualTo(Expression.Kind.PARENTHESIZED);
  }

  @Test
  public void testConvertedShapes() throws Exception {
    ImmutableList<ArgumentSite> sites =
        scan(
            String.join(
                "\n",
                "package pkg;",
                "class Test {",
                "  int width;",
                "  static void take(Object o) {}",
                "  void run(Test other, Object value) {",
                "    take(other.width);",
                "    take((String) value);",
                "    take(width + 1);",
                "    take(new Object());",
                "  }",
                "}"));
    List<Expression.Kind> kinds = new ArrayList<>();
    for (ArgumentSite site : sites) {
      kinds.add(site.getArgument().getExpression().getKind());
    }
    assertThat(kinds)
        .containsExactly(
            Expression.Kind.MEMBER_ACCESS,
            Expression.Kind.CAST,
            Expression.Kind.OPAQUE,
            Expression.Kind.INVOCATION)
        .inOrder();
    assertThat(sites.get(2).getArgument().getExpression().opaque()).isEqualTo("width + 1");
    assertThat(sites.get(3).getArgument().getExpression().invocation().kind())
        .isEqualTo(InvocationKind.OBJECT_CREATION);
  }

  @Test
  public void testNoArguments() throws Exception {
    assertThat(
            scan(
                String.join(
                    "\n",
                    "package pkg;",
                    "class Test {",
                    "  void run() {",
                    "    run();",
                    "    new Object();",
                    "  }",
                    "}")))
        .isEmpty();
  }

  @Test
  public void testCompilationErrorsAreCollected() throws Exception {
    try (CompiledSources compiled =
        JavaSources.compile(
            ImmutableList.of(
                JavaSources.fromString(
                    "pkg/Broken.java",
                    String.join(
                        "\n",
                        "package pkg;",
                        "class Broken {",
                        "  void run() {",
                        "    missing(1);",
                        "  }",
                        "}"))))) {
      assertThat(compiled.getErrors()).isNotEmpty();
      JavacSyntaxConverter converter =
          new JavacSyntaxConverter(compiled.getCompilationUnits().get(0));
      ImmutableList<ArgumentSite> sites = CallSiteScanner.scan(converter);
      assertThat(sites).hasSize(1);
      assertThat(
              compiled
                  .newOracle(converter)
                  .resolveInvocationSymbol(
                      sites.get(0).getInvocable().get(),
                      CancellationSignal.none()))
          .isEmpty();
    }
  }
}
