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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.Map;
import org.funcform.surface.Symbol;
import org.jspecify.annotations.Nullable;

/**
 * A Scope maps the variable names visible in one lexical block (a function body, a lambda, a branch
 * of an if statement, or a loop body) to the symbols that hold their current values.
 *
 * <p>Assigning to a variable never changes an existing symbol; instead {@link #newVariable}
 * generates a fresh symbol, binds it under its own label, and redirects the variable name to that
 * label. Each symbol is therefore assigned exactly once, and a closure that captured a variable
 * before it was reassigned still refers to the earlier value.
 *
 * <p>All Scopes of a compilation unit share a single {@link SymbolGenerator}, except those of a
 * block that is only lowered to be examined and then discarded.
 */
final class Scope {

  /** A Binding is either {@link Direct} or {@link Redirect}. */
  abstract static class Binding {
    private Binding() {}
  }

  /** The name is bound to the given symbol. */
  static final class Direct extends Binding {
    final Symbol symbol;

    Direct(Symbol symbol) {
      this.symbol = symbol;
    }
  }

  /** The name has been superseded; its current value is bound under {@code target}. */
  static final class Redirect extends Binding {
    final String target;

    Redirect(String target) {
      this.target = target;
    }
  }

  /**
   * The result of resolving a name: the symbol holding its value, and the Scope in which it was
   * found. The name is <i>free</i> in the resolving Scope if {@code owner} is an ancestor of it.
   */
  static final class Resolution {
    final Symbol symbol;
    final Scope owner;
    final boolean free;

    Resolution(Symbol symbol, Scope owner, boolean free) {
      this.symbol = symbol;
      this.owner = owner;
      this.free = free;
    }
  }

  final @Nullable Scope parent;
  final SymbolGenerator generator;
  private final Map<String, Binding> bindings = new HashMap<>();

  /** Creates a root Scope. */
  Scope(SymbolGenerator generator) {
    this.parent = null;
    this.generator = generator;
  }

  /** Creates a child Scope that shares its parent's generator. */
  Scope(Scope parent) {
    this(parent, parent.generator);
  }

  /** Creates a child Scope with its own generator. */
  Scope(Scope parent, SymbolGenerator generator) {
    this.parent = parent;
    this.generator = generator;
  }

  /** Binds {@code name} directly to {@code symbol}, replacing any previous binding. */
  void bind(String name, Symbol symbol) {
    bindings.put(name, new Direct(symbol));
  }

  /**
   * Creates a new symbol for a variable being assigned in this Scope, and redirects the variable
   * name to it.
   */
  @CanIgnoreReturnValue
  Symbol newVariable(String name) {
    Symbol symbol = generator.symbol(name);
    bindings.put(name, new Redirect(symbol.label));
    // If the generated label is the name itself this replaces the redirect, which is what we want.
    bindings.put(symbol.label, new Direct(symbol));
    return symbol;
  }

  /**
   * Looks up {@code name} in this Scope and then its ancestors, following redirects. Returns null
   * if no Scope in the chain binds the name.
   */
  @Nullable Resolution resolve(String name) {
    Scope scope = this;
    while (scope != null) {
      Binding binding = scope.bindings.get(name);
      if (binding == null) {
        scope = scope.parent;
      } else if (binding instanceof Redirect redirect) {
        // A redirect always refers to a name bound in the same Scope.
        name = redirect.target;
      } else {
        return new Resolution(((Direct) binding).symbol, scope, scope != this);
      }
    }
    return null;
  }

  /** Returns the symbol currently bound to {@code name}, or null if it is not bound. */
  @Nullable Symbol get(String name) {
    Resolution resolution = resolve(name);
    return (resolution == null) ? null : resolution.symbol;
  }
}
