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
 * A leaf node defined entirely by its value: a literal, a {@link Primitive} or other primitive
 * identifier, or a {@link Graph} (which is how functions, and closures over the nodes of an
 * enclosing graph, become first-class values).
 *
 * <p>Constants are context-free and belong to no graph.
 */
public final class Constant extends Node {

  public Constant(Object value) {
    super(List.of(), value, null);
  }

  /**
   * Returns the string form of the value. A graph value is printed by name only, since a graph may
   * (directly or indirectly) refer to itself.
   */
  @Override
  public String toString() {
    return (value instanceof Graph graph) ? graph.name() : String.valueOf(value);
  }
}
