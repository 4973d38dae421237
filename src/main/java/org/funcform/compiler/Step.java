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


package org.funcform.compiler;

import org.funcform.surface.Expr;
import org.funcform.surface.Let;
import org.funcform.surface.Location;
import org.funcform.surface.Symbol;

/**
 * The result of lowering one statement is a list of Steps. Consecutive {@link Assign} steps are
 * grouped into a single {@link Let} by {@link Body}.
 */
abstract class Step {
  private Step() {}

  /** Binds a newly-generated symbol. */
  static final class Assign extends Step {
    final Symbol symbol;
    final Expr value;

    /** The location of the statement that produced this binding. */
    final Location location;

    Assign(Symbol symbol, Expr value, Location location) {
      this.symbol = symbol;
      this.value = value;
      this.location = location;
    }

    Let.Binding binding() {
      return new Let.Binding(symbol, value);
    }

    @Override
    public String toString() {
      return symbol + " = " + value;
    }
  }

  /** Evaluates an expression (a call made for its effect, a conditional, or a returned value). */
  static final class Eval extends Step {
    final Expr expr;

    Eval(Expr expr) {
      this.expr = expr;
    }

    @Override
    public String toString() {
      return expr.toString();
    }
  }
}
