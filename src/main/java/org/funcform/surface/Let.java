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
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A simultaneous binding: every binding's symbol is in scope in every binding's value and in the
 * body.
 */
public final class Let extends Expr {

  /** A single (symbol, value) pair. */
  public static final class Binding {
    public final Symbol symbol;
    public final Expr value;

    public Binding(Symbol symbol, Expr value) {
      this.symbol = symbol;
      this.value = value;
    }

    @Override
    public String toString() {
      return String.format("(%s %s)", symbol, value);
    }
  }

  public final ImmutableList<Binding> bindings;
  public final Expr body;

  public Let(ImmutableList<Binding> bindings, Expr body) {
    this(bindings, body, null);
  }

  public Let(ImmutableList<Binding> bindings, Expr body, @Nullable Location location) {
    super(location);
    Preconditions.checkArgument(!bindings.isEmpty());
    this.bindings = bindings;
    this.body = body;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitLet(this);
  }

  @Override
  public String toString() {
    return bindings.stream().map(Binding::toString).collect(Collectors.joining(" ", "(let (", ") "))
        + body
        + ")";
  }
}
