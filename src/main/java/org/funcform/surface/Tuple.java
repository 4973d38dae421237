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

package org.funcform.surface;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Constructs a tuple; the empty tuple is the value of statements that produce nothing. */
public final class Tuple extends Expr {
  public static final Tuple EMPTY = new Tuple(ImmutableList.of());

  public final ImmutableList<Expr> values;

  public Tuple(ImmutableList<Expr> values) {
    this(values, null);
  }

  public Tuple(ImmutableList<Expr> values, @Nullable Location location) {
    super(location);
    this.values = values;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitTuple(this);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(tuple");
    values.forEach(v -> sb.append(' ').append(v));
    return sb.append(')').toString();
  }
}
