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

import java.util.Objects;

/**
 * A def-use edge: {@code consumer.inputs().get(index)} is the node whose {@link Node#uses} contains
 * this Use.
 */
public final class Use {
  public final Node consumer;
  public final int index;

  public Use(Node consumer, int index) {
    this.consumer = consumer;
    this.index = index;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Use other)) {
      return false;
    }
    // Consumers are compared by identity; two distinct nodes with equal inputs are distinct uses.
    return consumer == other.consumer && index == other.index;
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(consumer), index);
  }

  @Override
  public String toString() {
    return String.format("(%s, %s)", consumer, index);
  }
}
