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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.funcform.surface.Location;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CompileResultTest {
  private static final String NL = System.lineSeparator();

  private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
  private final DiagnosticSink diagnostics =
      new DiagnosticSink(new PrintStream(bytes, true, UTF_8));

  private String output() {
    return bytes.toString(UTF_8);
  }

  @Test
  public void success() {
    CompileResult result =
        Compiler.compile("def f(x):\n    return x\n", new Locator("demo.fpy", 10), diagnostics);
    assertThat(result.succeeded()).isTrue();
    assertThat(result.definition().label).isEqualTo("f");
    assertThat(result.definition().isGlobal()).isTrue();
    assertThat(result.definition().location()).isEqualTo(new Location("demo.fpy", 10, 0));
    assertThat(result.globals.definitions().keySet()).containsExactly("f");
    assertThrows(IllegalStateException.class, result::error);
    assertThat(output()).isEmpty();
  }

  @Test
  public void failureIsReported() {
    CompileResult result =
        Compiler.compile("def f(x):\n    y = x\n", new Locator("demo.fpy", 10), diagnostics);
    assertThat(result.succeeded()).isFalse();
    assertThat(result.error().msg).isEqualTo("Missing return statement.");
    assertThat(result.error().location).isEqualTo(new Location("demo.fpy", 11, 4));
    assertThat(result.toString()).isEqualTo("Missing return statement. (demo.fpy:11:4)");
    assertThat(result.globals.definitions()).isEmpty();
    assertThrows(IllegalStateException.class, result::definition);
    assertThat(output())
        .isEqualTo(
            "CompileError: Missing return statement."
                + NL
                + "  File \"demo.fpy\", line 11, column 4"
                + NL);
  }

  @Test
  public void parseErrorsAreCompileErrors() {
    CompileResult result =
        Compiler.compile("def f(x) return x\n", new Locator("demo.fpy", 1), diagnostics);
    assertThat(result.succeeded()).isFalse();
    assertThat(result.error().location.line).isEqualTo(1);
    assertThat(output()).startsWith("CompileError: ");
  }
}
