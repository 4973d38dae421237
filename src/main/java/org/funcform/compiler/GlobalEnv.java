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

import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.funcform.surface.Lambda;
import org.funcform.surface.Symbol;
import org.jspecify.annotations.Nullable;

/**
 * The global state of a compilation: a table of every function definition registered so far
 * (including the helper functions generated for while loops), in registration order, and the set of
 * global names that lowered code refers to.
 */
public final class GlobalEnv {
  private SymbolGenerator generator;
  private final Map<String, Lambda> definitions = new LinkedHashMap<>();
  private final Set<String> accessed = new LinkedHashSet<>();

  public GlobalEnv() {
    this(new SymbolGenerator(Symbol.GLOBAL));
  }

  private GlobalEnv(SymbolGenerator generator) {
    this.generator = generator;
  }

  /**
   * Returns a throwaway GlobalEnv that starts with this one's generator state but has no
   * definitions; nothing done to it affects this GlobalEnv.
   */
  GlobalEnv scratch() {
    return new GlobalEnv(generator.copy());
  }

  /**
   * Adds everything that was registered in {@code staging} (which must have been returned by
   * {@link #scratch} on this GlobalEnv, with no other changes in between) to this GlobalEnv.
   */
  void commit(GlobalEnv staging) {
    generator = staging.generator;
    definitions.putAll(staging.definitions);
    accessed.addAll(staging.accessed);
  }

  /** Returns a new global symbol with a name that is not otherwise used by this compilation. */
  Symbol newSymbol(String base) {
    return generator.symbol(base);
  }

  void define(String name, Lambda definition) {
    definitions.put(name, definition);
  }

  void noteAccess(String name) {
    accessed.add(name);
  }

  public @Nullable Lambda get(String name) {
    return definitions.get(name);
  }

  /** All definitions, in the order they were registered. */
  public ImmutableMap<String, Lambda> definitions() {
    return ImmutableMap.copyOf(definitions);
  }

  /** The names of the global symbols referenced by lowered code, in order of first reference. */
  public Set<String> accessed() {
    return Collections.unmodifiableSet(accessed);
  }

  /** Returns one {@code name = definition} line for each definition. */
  @Override
  public String toString() {
    return definitions.entrySet().stream()
        .map(e -> e.getKey() + " = " + e.getValue())
        .collect(Collectors.joining("\n"));
  }
}
