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

package org.funcform.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The application of a function (the first input) to arguments (the remaining inputs). Always
 * belongs to a graph.
 */
public final class Application extends Node {

  public Application(List<? extends Node> inputs, Graph graph) {
    super(inputs, Marker.APPLICATION, graph);
  }

  /** Returns {@code f(x, y)}, or {@code z = f(x, y)} if this node has a debug name. */
  @Override
  public String toString() {
    List<Node> inputs = inputs();
    String call;
    if (inputs.isEmpty()) {
      call = "?()";
    } else {
      call =
          inputs.get(0).nameOrString()
              + inputs.subList(1, inputs.size()).stream()
                  .map(Node::nameOrString)
                  .collect(Collectors.joining(", ", "(", ")"));
    }
    String name = debugName();
    return (name == null) ? call : name + " = " + call;
  }
}
