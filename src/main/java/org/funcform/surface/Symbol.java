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

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A reference to a named value. Symbols are equal if they have the same label and namespace; the
 * location is ignored.
 *
 * <p>Symbols generated while lowering one compilation unit share that unit's namespace, and their
 * labels are unique within it. References to top-level definitions use {@link #GLOBAL}, and
 * primitive operations use {@link #BUILTIN}.
 */
public final class Symbol extends Expr {
  public static final String GLOBAL = "global";
  public static final String BUILTIN = "builtin";

  public final String label;
  public final String namespace;

  public Symbol(String label, String namespace) {
    this(label, namespace, null);
  }

  public Symbol(String label, String namespace, @Nullable Location location) {
    super(location);
    this.label = label;
    this.namespace = namespace;
  }

  /** Returns a Symbol with the same label and namespace, but a different location. */
  public Symbol at(@Nullable Location location) {
    return new Symbol(label, namespace, location);
  }

  public boolean isGlobal() {
    return namespace.equals(GLOBAL);
  }

  public boolean isBuiltin() {
    return namespace.equals(BUILTIN);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitSymbol(this);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Symbol other
        && label.equals(other.label)
        && namespace.equals(other.namespace);
  }

  @Override
  public int hashCode() {
    return Objects.hash(label, namespace);
  }

  @Override
  public String toString() {
    return label;
  }
}
