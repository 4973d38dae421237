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

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A function graph: an ordered list of {@link Parameter}s and an output node that applies {@link
 * Primitive#RETURN} to the function's result.
 *
 * <p>Parameters that cannot be reached from the output are simply unused arguments. A graph has no
 * output until {@link #setOutput} is called, and is not valid until then.
 */
public final class Graph {
  private final List<Parameter> parameters = new ArrayList<>();

  /** An Application of {@link Primitive#RETURN}; null until {@link #setOutput} is called. */
  private @Nullable Application returnNode;

  private @Nullable String debugName;

  public Graph() {}

  public Graph(@Nullable String debugName) {
    this.debugName = debugName;
  }

  /** The parameters of this graph, in call-argument order. */
  public List<Parameter> parameters() {
    return Collections.unmodifiableList(parameters);
  }

  /** Adds a new Parameter at the end of this graph's parameter list. */
  public Parameter addParameter(@Nullable String debugName) {
    Parameter result = new Parameter(this);
    result.setDebugName(debugName);
    parameters.add(result);
    return result;
  }

  /** The {@code return} Application, or null if the output has not been set. */
  public @Nullable Application returnNode() {
    return returnNode;
  }

  /**
   * Sets the result of this graph, creating its {@code return} node. May only be called once;
   * later changes should edit the inputs of {@link #returnNode} instead.
   */
  public Application setOutput(Node result) {
    Preconditions.checkState(returnNode == null, "Output already set");
    returnNode = new Application(List.of(new Constant(Primitive.RETURN), result), this);
    return returnNode;
  }

  /** Returns the node whose value this graph returns, or null if it is not known. */
  public @Nullable Node output() {
    if (returnNode == null || returnNode.inputs().size() < 2) {
      return null;
    }
    return returnNode.inputs().get(1);
  }

  /** True if the output has been set. */
  public boolean isValid() {
    return returnNode != null;
  }

  public @Nullable String debugName() {
    return debugName;
  }

  public void setDebugName(@Nullable String debugName) {
    this.debugName = debugName;
  }

  /** The debug name of this graph, or "func" if it has none. */
  public String name() {
    return (debugName != null) ? debugName : "func";
  }

  /**
   * Returns every node that can be reached from this graph's return node by following inputs,
   * without entering other graphs, in depth-first order (the return node first). Nodes of enclosing
   * graphs that this graph reads are included, but not their inputs.
   */
  public Set<Node> nodes() {
    Set<Node> result = new LinkedHashSet<>();
    if (returnNode == null) {
      return result;
    }
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(returnNode);
    while (!stack.isEmpty()) {
      Node node = stack.pop();
      if (!result.add(node) || node.graph != this) {
        continue;
      }
      List<Node> inputs = node.inputs();
      for (int i = inputs.size() - 1; i >= 0; i--) {
        stack.push(inputs.get(i));
      }
    }
    return result;
  }

  /** Returns {@code name(param, ...) → result}, with {@code ?} if the result is not known. */
  @Override
  public String toString() {
    String params =
        parameters.stream().map(Node::toString).collect(Collectors.joining(", ", "(", ")"));
    Node result = output();
    String resultString = (result == null) ? "?" : result.nameOrString();
    return name() + params + " → " + resultString;
  }
}
