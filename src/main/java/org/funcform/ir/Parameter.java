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

/**
 * A parameter of a graph. Parameters have no inputs and no value; they are entirely defined by the
 * graph they belong to and their position in {@link Graph#parameters}.
 */
public final class Parameter extends Node {

  /** Creates a Parameter owned by {@code graph}; use {@link Graph#addParameter} to create one. */
  Parameter(Graph graph) {
    super(List.of(), Marker.PARAMETER, graph);
  }

  /** Returns the debug name, or {@code arg<i>} where {@code i} is this parameter's position. */
  @Override
  public String toString() {
    String name = debugName();
    if (name != null) {
      return name;
    }
    int index = graph.parameters().indexOf(this);
    return (index >= 0) ? "arg" + index : "arg";
  }
}
