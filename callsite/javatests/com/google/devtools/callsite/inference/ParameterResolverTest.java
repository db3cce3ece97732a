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

package com.google.devtools.callsite.inference;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.devtools.callsite.semantics.CancellationSource;
import com.google.devtools.callsite.semantics.ParameterSymbol;
import com.google.devtools.callsite.semantics.Symbol;
import com.google.devtools.callsite.semantics.SymbolKind;
import com.google.devtools.callsite.syntax.Argument;
import com.google.devtools.callsite.syntax.ArgumentLabel;
import com.google.devtools.callsite.syntax.ArgumentList;
import com.google.devtools.callsite.syntax.ArgumentSite;
import com.google.devtools.callsite.syntax.Expression;
import com.google.devtools.callsite.syntax.Invocation;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link ParameterResolver}. */
@RunWith(JUnit4.class)
public class ParameterResolverTest {
  private static final ParameterSymbol X = ParameterSymbol.create("x", 0, false);
  private static final ParameterSymbol COUNT = ParameterSymbol.create("count", 1, false);
  private static final ParameterSymbol FORMAT = ParameterSymbol.create("format", 0, false);
  private static final ParameterSymbol ARGS = ParameterSymbol.create("args", 1, true);

  private final FakeSemanticOracle oracle = new FakeSemanticOracle();
  private final ParameterResolver resolver = new ParameterResolver(oracle);

  private static Expression call(Argument... arguments) {
    return Expression.ofInvocation(
        Invocation.methodCall(Expression.ofIdentifier("Foo"), arguments));
  }

  private static Argument positional(String name) {
    return Argument.positional(Expression.ofIdentifier(name));
  }

  @Test
  public void testPositionalAndNamed() {
    // Foo(bar.Baz, count: 5) against Foo(int x, int count)
    Expression call =
        call(
            Argument.positional(Expression.ofMemberAccess(Expression.ofIdentifier("bar"), "Baz")),
            Argument.named("count", Expression.ofOpaque("5")));
    oracle.bindSymbol(call, Symbol.method("Foo", X, COUNT));

    ImmutableList<ArgumentSite> sites = ArgumentSite.allOf(call);
    assertThat(resolver.resolveParameter(sites.get(0), false)).hasValue(X);
    assertThat(resolver.resolveParameter(sites.get(1), false)).hasValue(COUNT);
  }

  @Test
  public void testNamedArgumentIgnoresPosition() {
    Expression call =
        call(
            Argument.named("count", Expression.ofOpaque("5")),
            Argument.named("x", Expression.ofOpaque("1")));
    oracle.bindSymbol(call, Symbol.method("Foo", X, COUNT));

    ImmutableList<ArgumentSite> sites = ArgumentSite.allOf(call);
    assertThat(resolver.resolveParameter(sites.get(0), false)).hasValue(COUNT);
    assertThat(resolver.resolveParameter(sites.get(1), false)).hasValue(X);
  }

  @Test
  public void testUnmatchedNameDoesNotFallBackToPosition() {
    Expression call = call(Argument.named("y", Expression.ofOpaque("5")));
    oracle.bindSymbol(call, Symbol.method("Foo", X, COUNT));

    assertThat(resolver.resolveParameter(ArgumentSite.allOf(call).get(0), true)).isEmpty();
  }

  @Test
  public void testNameMatchIsExact() {
    Expression call = call(Argument.named("Count", Expression.ofOpaque("5")));
    oracle.bindSymbol(call, Symbol.method("Foo", X, COUNT));

    assertThat(resolver.resolveParameter(ArgumentSite.allOf(call).get(0), false)).isEmpty();
  }

  @Test
  public void testMissingLabelIsPositional() {
    Expression call =
        call(positional("a"), Argument.labeled(ArgumentLabel.missing(), Expression.ofOpaque("5")));
    oracle.bindSymbol(call, Symbol.method("Foo", X, COUNT));

    assertThat(resolver.resolveParameter(ArgumentSite.allOf(call).get(1), false)).hasValue(COUNT);
  }

  @Test
  public void testArgumentPastEndWithoutVariadic() {
    Expression call = call(positional("a"), positional("b"), positional("c"));
    oracle.bindSymbol(call, Symbol.method("Foo", X, COUNT));

    ArgumentSite third = ArgumentSite.allOf(call).get(2);
    assertThat(resolver.resolveParameter(third, false)).isEmpty();
    assertThat(resolver.resolveParameter(third, true)).isEmpty();
  }

  @Test
  public void testVariadicMatch() {
    Expression call = call(positional("fmt"), positional("a"), positional("b"), positional("c"));
    oracle.bindSymbol(call, Symbol.method("Format", FORMAT, ARGS));

    ImmutableList<ArgumentSite> sites = ArgumentSite.allOf(call);
    assertThat(resolver.resolveParameter(sites.get(0), true)).hasValue(FORMAT);
    assertThat(resolver.resolveParameter(sites.get(1), true)).hasValue(ARGS);
    assertThat(resolver.resolveParameter(sites.get(2), true)).hasValue(ARGS);
    assertThat(resolver.resolveParameter(sites.get(3), true)).hasValue(ARGS);

    // Within bounds the variadic parameter binds by position regardless of the flag.
    assertThat(resolver.resolveParameter(sites.get(1), false)).hasValue(ARGS);
    assertThat(resolver.resolveParameter(sites.get(2), false)).isEmpty();
  }

  @Test
  public void testVariadicMatchWithNoParameters() {
    Expression call = call(positional("a"));
    oracle.bindSymbol(call, Symbol.method("Foo"));

    assertThat(resolver.resolveParameter(ArgumentSite.allOf(call).get(0), true)).isEmpty();
  }

  @Test
  public void testIndexer() {
    Expression access =
        Expression.ofInvocation(
            Invocation.elementAccess(Expression.ofIdentifier("table"), positional("row")));
    oracle.bindSymbol(access, Symbol.indexer("this[]", ParameterSymbol.create("key", 0, false)));

    assertThat(resolver.resolveParameter(ArgumentSite.allOf(access).get(0), false))
        .hasValue(ParameterSymbol.create("key", 0, false));
  }

  @Test
  public void testUnresolvedInvocation() {
    Expression call = call(positional("a"));
    assertThat(resolver.resolveParameter(ArgumentSite.allOf(call).get(0), true)).isEmpty();
  }

  @Test
  public void testNonInvocableSymbol() {
    Expression call = call(positional("a"));
    oracle.bindSymbol(
        call,
        Symbol.create(
            SymbolKind.FIELD, "Foo", ImmutableList.of(ParameterSymbol.create("a", 0, false))));

    assertThat(resolver.resolveParameter(ArgumentSite.allOf(call).get(0), true)).isEmpty();
  }

  @Test
  public void testDetachedArgumentList() {
    Argument argument = positional("a");
    ArgumentSite site = ArgumentSite.detached(argument, ArgumentList.of(argument));
    assertThat(resolver.resolveParameter(site, true)).isEmpty();
  }

  @Test
  public void testArgumentNotInItsList() {
    Expression call = call(positional("a"));
    oracle.bindSymbol(call, Symbol.method("Foo", X, COUNT));
    ArgumentList list = call.invocation().arguments();

    // Same text as the listed argument, but a different node.
    ArgumentSite stray = ArgumentSite.create(positional("a"), list, Optional.of(call));
    assertThat(resolver.resolveParameter(stray, true)).isEmpty();
  }

  @Test
  public void testDuplicateArgumentsResolveByIdentity() {
    Expression call = call(positional("a"), positional("a"));
    oracle.bindSymbol(call, Symbol.method("Foo", X, COUNT));

    assertThat(resolver.resolveParameter(ArgumentSite.allOf(call).get(1), false)).hasValue(COUNT);
  }

  @Test
  public void testCancellationPropagates() {
    Expression call = call(positional("a"));
    oracle.bindSymbol(call, Symbol.method("Foo", X));
    CancellationSource cancellation = new CancellationSource();
    cancellation.cancel();

    assertThrows(
        CancellationException.class,
        () -> resolver.resolveParameter(ArgumentSite.allOf(call).get(0), false, cancellation));
  }
}
