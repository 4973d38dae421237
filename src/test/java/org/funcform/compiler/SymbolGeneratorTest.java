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

import org.funcform.surface.Symbol;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SymbolGeneratorTest {

  @Test
  public void repeatsAreNumbered() {
    SymbolGenerator generator = new SymbolGenerator("ns");
    assertThat(generator.name("x")).isEqualTo("x");
    assertThat(generator.name("y")).isEqualTo("y");
    assertThat(generator.name("x")).isEqualTo("x#1");
    assertThat(generator.name("x")).isEqualTo("x#2");
    assertThat(generator.symbol("y")).isEqualTo(new Symbol("y#1", "ns"));
  }

  @Test
  public void copiesAreIndependent() {
    SymbolGenerator generator = new SymbolGenerator("ns");
    generator.name("x");
    SymbolGenerator copy = generator.copy();
    assertThat(copy.name("x")).isEqualTo("x#1");
    assertThat(copy.name("x")).isEqualTo("x#2");
    assertThat(generator.name("x")).isEqualTo("x#1");
    assertThat(copy.namespace).isEqualTo("ns");
  }
}
