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

import org.jspecify.annotations.Nullable;

/**
 * A closed functional surface expression. Instances are immutable; {@link #location} records the
 * host syntax that produced the expression, if known.
 *
 * <p>{@link #toString} renders the expression as an s-expression, e.g. {@code (let ((x 1)) (add x
 * 2))}.
 */
public abstract class Expr {
  private final @Nullable Location location;

  Expr(@Nullable Location location) {
    this.location = location;
  }

  public @Nullable Location location() {
    return location;
  }

  public abstract <T> T accept(Visitor<T> visitor);

  /** One method for each concrete Expr subclass. */
  public interface Visitor<T> {
    T visitSymbol(Symbol symbol);

    T visitLiteral(Literal literal);

    T visitIf(If ifExpr);

    T visitLet(Let let);

    T visitLambda(Lambda lambda);

    T visitApply(Apply apply);

    T visitBegin(Begin begin);

    T visitTuple(Tuple tuple);
  }
}
