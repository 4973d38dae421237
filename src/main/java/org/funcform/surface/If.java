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

/** A conditional expression: {@code ifTrue} if {@code condition} holds, else {@code ifFalse}. */
public final class If extends Expr {
  public final Expr condition;
  public final Expr ifTrue;
  public final Expr ifFalse;

  public If(Expr condition, Expr ifTrue, Expr ifFalse) {
    this(condition, ifTrue, ifFalse, null);
  }

  public If(Expr condition, Expr ifTrue, Expr ifFalse, @Nullable Location location) {
    super(location);
    this.condition = condition;
    this.ifTrue = ifTrue;
    this.ifFalse = ifFalse;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitIf(this);
  }

  @Override
  public String toString() {
    return String.format("(if %s %s %s)", condition, ifTrue, ifFalse);
  }
}
