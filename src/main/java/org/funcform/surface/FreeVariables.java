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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Finds the free variables of a surface expression: the non-global, non-builtin symbols it refers
 * to without binding them (as a {@link Lambda} parameter or a {@link Let} binding).
 */
public final class FreeVariables implements Expr.Visitor<Void> {

  /** Returns the free variables of {@code expr}, in the order they are first referenced. */
  public static Set<Symbol> of(Expr expr) {
    FreeVariables visitor = new FreeVariables();
    expr.accept(visitor);
    return visitor.free;
  }

  /** A multiset, since an inner binding may shadow an outer binding of the same symbol. */
  private final Multiset<Symbol> bound = HashMultiset.create();

  private final Set<Symbol> free = new LinkedHashSet<>();

  private FreeVariables() {}

  @Override
  public Void visitSymbol(Symbol symbol) {
    if (!symbol.isGlobal() && !symbol.isBuiltin() && !bound.contains(symbol)) {
      free.add(symbol);
    }
    return null;
  }

  @Override
  public Void visitLiteral(Literal literal) {
    return null;
  }

  @Override
  public Void visitIf(If ifExpr) {
    ifExpr.condition.accept(this);
    ifExpr.ifTrue.accept(this);
    ifExpr.ifFalse.accept(this);
    return null;
  }

  @Override
  public Void visitLet(Let let) {
    let.bindings.forEach(b -> bound.add(b.symbol));
    let.bindings.forEach(b -> b.value.accept(this));
    let.body.accept(this);
    let.bindings.forEach(b -> bound.remove(b.symbol));
    return null;
  }

  @Override
  public Void visitLambda(Lambda lambda) {
    bound.addAll(lambda.params);
    lambda.body.accept(this);
    lambda.params.forEach(bound::remove);
    return null;
  }

  @Override
  public Void visitApply(Apply apply) {
    apply.function.accept(this);
    apply.args.forEach(a -> a.accept(this));
    return null;
  }

  @Override
  public Void visitBegin(Begin begin) {
    begin.exprs.forEach(e -> e.accept(this));
    return null;
  }

  @Override
  public Void visitTuple(Tuple tuple) {
    tuple.values.forEach(v -> v.accept(this));
    return null;
  }
}
