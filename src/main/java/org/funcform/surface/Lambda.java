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
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/** A function literal. Its body may refer to symbols bound outside it (a closure). */
public final class Lambda extends Expr {
  /** Used only for printing and debugging. */
  public final String name;

  public final ImmutableList<Symbol> params;
  public final Expr body;

  public Lambda(String name, ImmutableList<Symbol> params, Expr body) {
    this(name, params, body, null);
  }

  public Lambda(
      String name, ImmutableList<Symbol> params, Expr body, @Nullable Location location) {
    super(location);
    this.name = name;
    this.params = params;
    this.body = body;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitLambda(this);
  }

  @Override
  public String toString() {
    return String.format(
        "(lambda %s %s %s)",
        name,
        params.stream().map(Symbol::toString).collect(Collectors.joining(" ", "(", ")")),
        body);
  }
}
