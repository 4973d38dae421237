/*
 * Copyright 2025 The Funcform Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.funcform.surface;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FreeVariablesTest {
  private static final Symbol X = new Symbol("x", "ns");
  private static final Symbol Y = new Symbol("y", "ns");
  private static final Symbol Z = new Symbol("z", "ns");
  private static final Symbol ADD = new Symbol("add", Symbol.BUILTIN);
  private static final Symbol F = new Symbol("f", Symbol.GLOBAL);

  @Test
  public void parametersAreBound() {
    Lambda lambda = new Lambda("f", ImmutableList.of(X), new Apply(ADD, X, Y));
    assertThat(FreeVariables.of(lambda)).containsExactly(Y);
    assertThat(lambda.toString()).isEqualTo("(lambda f (x) (add x y))");
  }

  @Test
  public void letBindingsAreBound() {
    Let let =
        new Let(
            ImmutableList.of(new Let.Binding(X, new Apply(F, Z)), new Let.Binding(Y, X)),
            new Tuple(ImmutableList.of(X, Y, Z)));
    assertThat(FreeVariables.of(let)).containsExactly(Z);
  }

  @Test
  public void bindingOnlyCoversItsBody() {
    Lambda inner = new Lambda("g", ImmutableList.of(X), X);
    Expr expr = new Begin(ImmutableList.of(inner, new If(X, Y, Literal.TRUE)));
    assertThat(FreeVariables.of(expr)).containsExactly(X, Y).inOrder();
  }

  @Test
  public void shadowedBindingsStayBound() {
    // The inner lambda rebinds x; x is still bound after it.
    Lambda inner = new Lambda("g", ImmutableList.of(X), X);
    Lambda outer =
        new Lambda("f", ImmutableList.of(X), new Begin(ImmutableList.of(inner, X, Z)));
    assertThat(FreeVariables.of(outer)).containsExactly(Z);
  }
}
