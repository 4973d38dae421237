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

/** A position in the host source: an origin (e.g. a file path), a line, and a column. */
public final class Location {
  public final String origin;

  /** One-based. */
  public final int line;

  /** Zero-based. */
  public final int column;

  public Location(String origin, int line, int column) {
    this.origin = origin;
    this.line = line;
    this.column = column;
  }

  /** Returns a one-line trace in the style of a host stack frame. */
  public String traceback() {
    return String.format("  File \"%s\", line %s, column %s", origin, line, column);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Location other
        && origin.equals(other.origin)
        && line == other.line
        && column == other.column;
  }

  @Override
  public int hashCode() {
    return Objects.hash(origin, line, column);
  }

  @Override
  public String toString() {
    return origin + ":" + line + ":" + column;
  }
}
