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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Evaluates each expression in order; the value is that of the last one. */
public final class Begin extends Expr {
  public final ImmutableList<Expr> exprs;

  public Begin(ImmutableList<Expr> exprs) {
    this(exprs, null);
  }

  public Begin(ImmutableList<Expr> exprs, @Nullable Location location) {
    super(location);
    Preconditions.checkArgument(!exprs.isEmpty());
    this.exprs = exprs;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitBegin(this);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(begin");
    exprs.forEach(e -> sb.append(' ').append(e));
    return sb.append(')').toString();
  }
}
