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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * The input list of a {@link Node}. Every insertion, deletion, or replacement is mirrored in the
 * {@link Node#uses} of the nodes involved, so that for each index {@code i} the node at {@code i}
 * has a {@code Use(owner, i)} and no other node does.
 *
 * <p>Operations that shift elements (insertion and deletion) rewrite the uses of every shifted
 * node. Equality follows the {@link List} contract: an Inputs is equal to any list with the same
 * elements in the same order, regardless of which node owns it.
 */
public final class Inputs extends AbstractList<Node> implements RandomAccess {
  private final Node owner;
  private final List<Node> data = new ArrayList<>();

  Inputs(Node owner, Iterable<? extends Node> initial) {
    this.owner = owner;
    for (Node node : initial) {
      add(node);
    }
  }

  /** The node whose inputs these are. */
  public Node owner() {
    return owner;
  }

  @Override
  public Node get(int index) {
    return data.get(index);
  }

  @Override
  public int size() {
    return data.size();
  }

  @Override
  @CanIgnoreReturnValue
  public Node set(int index, Node node) {
    Preconditions.checkElementIndex(index, data.size());
    Preconditions.checkNotNull(node);
    Node prev = data.get(index);
    boolean removed = prev.uses.remove(new Use(owner, index));
    assert removed;
    node.uses.add(new Use(owner, index));
    data.set(index, node);
    return prev;
  }

  @Override
  public void add(int index, Node node) {
    Preconditions.checkPositionIndex(index, data.size());
    Preconditions.checkNotNull(node);
    // Work from the end so that a node appearing more than once never sees its new index
    // collide with an entry that hasn't moved yet.
    for (int i = data.size() - 1; i >= index; i--) {
      moveUse(data.get(i), i, i + 1);
    }
    node.uses.add(new Use(owner, index));
    data.add(index, node);
    modCount++;
  }

  @Override
  @CanIgnoreReturnValue
  public Node remove(int index) {
    Preconditions.checkElementIndex(index, data.size());
    Node node = data.get(index);
    boolean removed = node.uses.remove(new Use(owner, index));
    assert removed;
    for (int i = index + 1; i < data.size(); i++) {
      moveUse(data.get(i), i, i - 1);
    }
    data.remove(index);
    modCount++;
    return node;
  }

  @Override
  public void clear() {
    for (int i = 0; i < data.size(); i++) {
      data.get(i).uses.remove(new Use(owner, i));
    }
    data.clear();
    modCount++;
  }

  private void moveUse(Node node, int from, int to) {
    boolean removed = node.uses.remove(new Use(owner, from));
    assert removed;
    node.uses.add(new Use(owner, to));
  }

  @Override
  public String toString() {
    return "Inputs" + data;
  }
}
