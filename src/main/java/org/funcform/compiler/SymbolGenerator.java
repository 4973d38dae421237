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

import java.util.HashMap;
import java.util.Map;
import org.funcform.surface.Symbol;

/**
 * Generates names that are unique within a compilation unit. The first request for a given base
 * name returns it unchanged; the k-th repeated request returns {@code base#k}. Since names in the
 * source text never contain "#", generated names cannot collide with them except by being equal
 * to the base name itself.
 */
public final class SymbolGenerator {
  /** The namespace of the symbols returned by {@link #symbol}. */
  public final String namespace;

  /** For each base name that has been requested, the number of times it has been repeated. */
  private final Map<String, Integer> counts;

  public SymbolGenerator(String namespace) {
    this(namespace, new HashMap<>());
  }

  private SymbolGenerator(String namespace, Map<String, Integer> counts) {
    this.namespace = namespace;
    this.counts = counts;
  }

  /** Returns a name that has not been returned before by this generator. */
  public String name(String base) {
    Integer count = counts.get(base);
    if (count == null) {
      counts.put(base, 0);
      return base;
    }
    counts.put(base, count + 1);
    return base + "#" + (count + 1);
  }

  /** Returns a symbol in this generator's namespace, with a label from {@link #name}. */
  public Symbol symbol(String base) {
    return new Symbol(name(base), namespace);
  }

  /**
   * Returns a new generator that starts from this one's current state; names requested from the
   * copy do not affect this generator.
   */
  public SymbolGenerator copy() {
    return new SymbolGenerator(namespace, new HashMap<>(counts));
  }
}
