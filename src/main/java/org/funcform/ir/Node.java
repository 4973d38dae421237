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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * A node in the graph IR. Every value in a compiled function is produced by exactly one node, which
 * is either an {@link Application}, a {@link Parameter}, or a {@link Constant}.
 *
 * <p>Edges are tracked in both directions:
 *
 * <ul>
 *   <li>{@link #inputs} is the ordered list of nodes this node reads (use-def edges); for an
 *       Application the first input is the function to apply and the rest are its arguments.
 *       Parameters and Constants have no inputs.
 *   <li>{@link #uses} is the set of (consumer, index) pairs for every node that reads this one
 *       (def-use edges).
 * </ul>
 *
 * Any mutation through {@link #inputs()} or {@link #setInputs} keeps the two in sync; the uses set
 * must never be modified directly.
 *
 * <p>Nodes are compared by identity.
 */
public abstract class Node {

  /** The payload of every Application and Parameter node (Constants carry their own value). */
  public enum Marker {
    APPLICATION,
    PARAMETER
  }

  private final Inputs inputs;

  /** {@link Marker#APPLICATION}, {@link Marker#PARAMETER}, or the value of a Constant. */
  public final Object value;

  /** The graph this node belongs to; always null for Constants, never null otherwise. */
  public final @Nullable Graph graph;

  /** Updated only by {@link Inputs}. */
  final Set<Use> uses = new HashSet<>();

  /** An optional human-readable name, used only for printing. */
  private @Nullable String debugName;

  Node(Iterable<? extends Node> inputs, Object value, @Nullable Graph graph) {
    this.value = value;
    this.graph = graph;
    this.inputs = new Inputs(this, inputs);
  }

  /**
   * The inputs of this node. The returned list is live; insertions, deletions, and replacements
   * update the uses of the affected nodes.
   */
  public Inputs inputs() {
    return inputs;
  }

  /**
   * Replaces the entire input list. The uses contributed by the old inputs are removed before the
   * new inputs are registered. The list returned by {@link #inputs()} stays the same (live) object.
   */
  public void setInputs(Iterable<? extends Node> newInputs) {
    // Copy first, since newInputs may be a view of the current inputs.
    List<Node> replacement = new ArrayList<>();
    newInputs.forEach(replacement::add);
    inputs.clear();
    inputs.addAll(replacement);
  }

  /** A read-only view of the (consumer, index) pairs that read this node, in any order. */
  public Set<Use> uses() {
    return Collections.unmodifiableSet(uses);
  }

  /** The nodes this node reads, in order. */
  public List<Node> incoming() {
    return Collections.unmodifiableList(inputs);
  }

  /** The nodes that read this node, in no particular order; may repeat a node that reads twice. */
  public Stream<Node> outgoing() {
    return uses.stream().map(u -> u.consumer);
  }

  public @Nullable String debugName() {
    return debugName;
  }

  public void setDebugName(@Nullable String debugName) {
    this.debugName = debugName;
  }

  /** Returns this node's debug name if it has one, or its full string representation if not. */
  String nameOrString() {
    return (debugName != null) ? debugName : toString();
  }
}
