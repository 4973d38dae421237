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


package org.funcform.compiler;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.antlr.v4.runtime.CharStreams;
import org.funcform.surface.FreeVariables;
import org.funcform.surface.Lambda;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LowererTest {

  private static GlobalEnv lower(String... lines) {
    GlobalEnv globals = new GlobalEnv();
    lower(globals, lines);
    return globals;
  }

  private static void lower(GlobalEnv globals, String... lines) {
    Compiler.lower(
        CharStreams.fromString(String.join("\n", lines)), new Locator("test", 1), globals);
  }

  @Test
  public void branchesMayAssignInAnyOrder() {
    GlobalEnv globals =
        lower(
            "def f(p):",
            "    if p:",
            "        a = 1",
            "        b = 2",
            "    else:",
            "        b = 3",
            "        a = 4",
            "    return a + b");
    assertThat(globals.get("f").toString())
        .isEqualTo(
            "(lambda f (p) (let ((#tmp (if p (let ((a 1) (b 2)) (tuple a b))"
                + " (let ((b#1 3) (a#1 4)) (tuple a#1 b#1))))"
                + " (a#2 (index #tmp 0)) (b#2 (index #tmp 1))) (add a#2 b#2)))");
  }

  @Test
  public void branchesMustAssignSameVariables() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () ->
                lower(
                    "def f(p):",
                    "    if p:",
                    "        a = 1",
                    "        b = 2",
                    "    else:",
                    "        c = 3",
                    "        a = 4",
                    "    return a"));
    assertThat(e.msg).contains("True branch sets: a b");
    assertThat(e.msg).contains("Else branch sets: a c");
    assertThat(e.location.line).isEqualTo(2);
  }

  @Test
  public void loopHelpersAreClosed() {
    GlobalEnv globals =
        lower(
            "def f(n):",
            "    i = 0",
            "    t = 0",
            "    j = 0",
            "    while i < n:",
            "        j = 0",
            "        while j < i:",
            "            t = t + j",
            "            j = j + 1",
            "        i = i + 1",
            "    return t");
    assertThat(globals.definitions().keySet()).containsExactly("f", "#while", "#while#1");
    for (Lambda definition : globals.definitions().values()) {
      assertThat(FreeVariables.of(definition)).isEmpty();
    }
    // Each helper passes the loop's variables to its recursive call.
    assertThat(globals.get("#while").params).hasSize(4);
    assertThat(globals.get("#while#1").params).hasSize(3);
  }

  @Test
  public void unresolvedNamesAreGlobal() {
    GlobalEnv globals = new GlobalEnv();
    lower(globals, "def f(x):", "    return g(x) + len(x)");
    lower(globals, "def g(y):", "    return y");
    assertThat(globals.definitions().keySet()).containsExactly("f", "g").inOrder();
    assertThat(globals.accessed()).containsExactly("g", "len").inOrder();
    assertThat(globals.toString())
        .isEqualTo("f = (lambda f (x) (add (g x) (len x)))\ng = (lambda g (y) y)");
  }

  @Test
  public void failedUnitRegistersNothing() {
    GlobalEnv globals = new GlobalEnv();
    assertThrows(
        CompileError.class, () -> lower(globals, "def f(x):", "    while x:", "        return x"));
    assertThat(globals.definitions()).isEmpty();
  }

  @Test
  public void loopHelperIsDiscardedWhenUnitFailsLater() {
    GlobalEnv globals = new GlobalEnv();
    CompileError e =
        assertThrows(
            CompileError.class,
            () ->
                lower(
                    globals,
                    "def f(n):",
                    "    i = 0",
                    "    while i < len(n):",
                    "        i = i + 1",
                    "    y = i"));
    assertThat(e.msg).isEqualTo("Missing return statement.");
    assertThat(globals.definitions()).isEmpty();
    assertThat(globals.accessed()).isEmpty();
    // The failed unit's helper name is not reserved.
    lower(globals, "def g(n):", "    while n:", "        n = n - 1", "    return n");
    assertThat(globals.definitions().keySet()).containsExactly("#while", "g").inOrder();
  }

  @Test
  public void recursiveNestedDefinitionIsRejected() {
    CompileError e =
        assertThrows(
            CompileError.class,
            () ->
                lower(
                    "def f(n):",
                    "    def fact(k):",
                    "        return 1 if k < 1 else k * fact(k - 1)",
                    "    return fact(n)"));
    assertThat(e.msg).isEqualTo("Functions cannot have free variables ('fact')");
    assertThat(e.location.line).isEqualTo(3);
  }

  @Test
  public void negatedComparisons() {
    GlobalEnv globals =
        lower("def f(a, b):", "    return (a is not b, not a < b, a not in b, not a and b)");
    assertThat(globals.get("f").toString())
        .isEqualTo(
            "(lambda f (a b) (tuple (is_not a b) (not_ (lt a b)) (not_contains b a)"
                + " (if (not_ a) b False)))");
  }

  @Test
  public void comparisonOperandCannotBeNegated() {
    assertThrows(CompileError.class, () -> lower("def f(a, b):", "    return a < not b"));
  }
}
