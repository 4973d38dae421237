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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.funcform.surface.Begin;
import org.funcform.surface.Expr;
import org.funcform.surface.Let;
import org.funcform.surface.Location;
import org.funcform.surface.Tuple;
import org.jspecify.annotations.Nullable;

/**
 * The lowered statements of a block, not yet combined into a single expression.
 *
 * <p>{@link #build} partitions the steps into maximal runs of assignments and of evaluations. A run
 * of assignments becomes a {@link Let} whose body is everything after it; a run of evaluations
 * becomes a {@link Begin} (or just the expression, if the run has only one). The value of the block
 * is supplied by the caller; if it is null the block's final step must provide it.
 */
final class Body {
  static final Body EMPTY = new Body(ImmutableList.of());

  final ImmutableList<Step> steps;

  Body(List<Step> steps) {
    this.steps = ImmutableList.copyOf(steps);
  }

  /**
   * Returns an expression that executes the steps of this block and then evaluates {@code result}.
   * If {@code result} is null, the final step determines the value; an empty block then evaluates
   * to the empty tuple.
   *
   * @throws CompileError if {@code result} is null and the block ends with an assignment
   */
  Expr build(@Nullable Expr result) {
    if (steps.isEmpty()) {
      return (result != null) ? result : Tuple.EMPTY;
    }
    return build(0, result);
  }

  private Expr build(int start, @Nullable Expr result) {
    boolean isAssign = steps.get(start) instanceof Step.Assign;
    int end = start + 1;
    while (end < steps.size() && (steps.get(end) instanceof Step.Assign) == isAssign) {
      end++;
    }
    List<Step> run = steps.subList(start, end);
    if (isAssign) {
      ImmutableList<Let.Binding> bindings =
          run.stream().map(s -> ((Step.Assign) s).binding()).collect(toImmutableList());
      Expr body;
      if (end < steps.size()) {
        body = build(end, result);
      } else if (result != null) {
        body = result;
      } else {
        Location location = ((Step.Assign) run.get(run.size() - 1)).location;
        throw new CompileError(location, "Missing return statement.");
      }
      return new Let(bindings, body);
    }
    ImmutableList.Builder<Expr> exprs = ImmutableList.builder();
    run.forEach(s -> exprs.add(((Step.Eval) s).expr));
    if (end < steps.size()) {
      exprs.add(build(end, result));
    } else if (result != null) {
      exprs.add(result);
    }
    ImmutableList<Expr> list = exprs.build();
    return (list.size() == 1) ? list.get(0) : new Begin(list);
  }
}
