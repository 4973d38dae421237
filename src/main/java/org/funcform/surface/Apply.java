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

/** The application of a function to arguments. */
public final class Apply extends Expr {
  public final Expr function;
  public final ImmutableList<Expr> args;

  public Apply(Expr function, Expr... args) {
    this(function, ImmutableList.copyOf(args), null);
  }

  public Apply(Expr function, ImmutableList<Expr> args, @Nullable Location location) {
    super(location);
    this.function = function;
    this.args = args;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitApply(this);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(").append(function);
    args.forEach(arg -> sb.append(' ').append(arg));
    return sb.append(')').toString();
  }
}
