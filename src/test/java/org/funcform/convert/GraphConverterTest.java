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


package org.funcform.convert;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.funcform.compiler.Compiler;
import org.funcform.compiler.GlobalEnv;
import org.funcform.compiler.Locator;
import org.funcform.ir.Application;
import org.funcform.ir.Constant;
import org.funcform.ir.Graph;
import org.funcform.ir.Node;
import org.funcform.ir.Parameter;
import org.funcform.ir.Primitive;
import org.funcform.ir.Use;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GraphConverterTest {

  private static GraphConverter convert(String... lines) {
    GlobalEnv globals = new GlobalEnv();
    Compiler.lower(
        CharStreams.fromString(String.join("\n", lines)), new Locator("test", 1), globals);
    return GraphConverter.convert(globals.definitions());
  }

  private static Graph graphNamed(GraphConverter converter, String name) {
    return converter.graphs().stream().filter(g -> g.name().equals(name)).findFirst().get();
  }

  /** Returns the value of the Constant at the given input of {@code node}. */
  private static Object constantInput(Node node, int index) {
    Node input = node.inputs().get(index);
    assertThat(input).isInstanceOf(Constant.class);
    return input.value;
  }

  @Test
  public void letBindingsNameNodes() {
    GraphConverter converter = convert("def pair(x):", "    y = x + 1", "    return (x, y)");
    Graph pair = converter.globals().get("pair");
    assertThat(pair.toString()).isEqualTo("pair(x) → make_tuple(x, y)");
    Node y = pair.output().inputs().get(2);
    assertThat(y.toString()).isEqualTo("y = add(x, 1)");
    assertThat(y.inputs().get(1)).isSameInstanceAs(pair.parameters().get(0));
    assertThat(converter.graphs()).containsExactly(pair);
  }

  @Test
  public void conditionalsSwitchBetweenArmGraphs() {
    GraphConverter converter =
        convert("def fact(n):", "    return 1 if n <= 1 else n * fact(n - 1)");
    Graph fact = converter.globals().get("fact");
    Parameter n = fact.parameters().get(0);
    Node output = fact.output();
    assertThat(output.inputs()).hasSize(1);
    Node selected = output.inputs().get(0);
    assertThat(constantInput(selected, 0)).isEqualTo(Primitive.SWITCH);
    assertThat(selected.inputs().get(1).toString()).isEqualTo("le(n, 1)");
    Graph ifTrue = (Graph) constantInput(selected, 2);
    Graph ifFalse = (Graph) constantInput(selected, 3);
    assertThat(ifTrue.name()).isEqualTo("fact:then");
    assertThat(ifFalse.name()).isEqualTo("fact:else");
    assertThat(ifTrue.parameters()).isEmpty();
    assertThat(ifTrue.toString()).isEqualTo("fact:then() → 1");
    assertThat(ifFalse.toString()).isEqualTo("fact:else() → mul(n, fact(sub(n, 1)))");

    // The recursive call refers to the graph itself, and reads the parameter of the outer graph.
    Node call = ifFalse.output().inputs().get(2);
    assertThat(call.graph).isSameInstanceAs(ifFalse);
    assertThat(constantInput(call, 0)).isSameInstanceAs(fact);
    assertThat(n.outgoing().map(node -> node.graph).toList()).containsAtLeast(fact, ifFalse);
  }

  @Test
  public void closuresReadEnclosingNodes() {
    GraphConverter converter = convert("def scale(xs, k):", "    return [x * k for x in xs]");
    Graph scale = converter.globals().get("scale");
    Graph element = graphNamed(converter, "listcmp");
    assertThat(element.toString()).isEqualTo("listcmp(x) → mul(x, k)");
    Node k = element.output().inputs().get(2);
    assertThat(k).isSameInstanceAs(scale.parameters().get(1));
    assertThat(k.graph).isSameInstanceAs(scale);
    assertThat(constantInput(scale.output(), 1)).isSameInstanceAs(element);
  }

  @Test
  public void loopHelpersAreGlobalGraphs() {
    GraphConverter converter =
        convert(
            "def total(n):",
            "    i = 0",
            "    s = 0",
            "    while i < n:",
            "        s = s + i",
            "        i = i + 1",
            "    return s");
    assertThat(converter.globals().keySet()).containsExactly("#while", "total").inOrder();
    Graph helper = converter.globals().get("#while");
    assertThat(helper.toString())
        .isEqualTo("#while(i#1, s#1, n#1) → switch(lt(i#1, n#1), #while:then, #while:else)()");
    Graph total = converter.globals().get("total");
    assertThat(total.toString()).isEqualTo("total(n) → s#3");
    Node call = total.output().inputs().get(1);
    assertThat(constantInput(call, 0)).isSameInstanceAs(helper);
  }

  @Test
  public void usesMirrorInputs() {
    GraphConverter converter =
        convert(
            "def f(a, b):",
            "    if a < b:",
            "        c = a",
            "    else:",
            "        c = b",
            "    g = lambda x: x + c",
            "    return g(a) + g(b)");
    for (Graph graph : converter.graphs()) {
      for (Node node : graph.nodes()) {
        List<Node> inputs = node.inputs();
        for (int i = 0; i < inputs.size(); i++) {
          assertThat(inputs.get(i).uses()).contains(new Use(node, i));
        }
        for (Use use : node.uses()) {
          assertThat(use.consumer.inputs().get(use.index)).isSameInstanceAs(node);
        }
      }
      assertThat(graph.isValid()).isTrue();
    }
    assertThat(converter.graphs().stream().map(Graph::name).toList())
        .containsExactly("f", "f:then", "f:else", "lambda");
    assertThat(converter.globals().get("f").output()).isInstanceOf(Application.class);
  }
}
