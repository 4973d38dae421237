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

import org.antlr.v4.runtime.Token;
import org.funcform.surface.Location;

/**
 * Converts positions in the source text of a compilation unit into {@link Location}s. The unit's
 * source may have been extracted from a larger file, so line numbers are offset by the line on
 * which the unit starts.
 */
public final class Locator {
  public final String origin;

  /** The line number (in the origin) of the first line of the unit's source text. */
  public final int lineOffset;

  public Locator(String origin, int lineOffset) {
    this.origin = origin;
    this.lineOffset = lineOffset;
  }

  /** Returns the location of the given line (1-based, relative to the unit) and column. */
  public Location locate(int line, int column) {
    return new Location(origin, line + lineOffset - 1, column);
  }

  /** Returns the location of the first character of the given token. */
  public Location locate(Token token) {
    return locate(token.getLine(), token.getCharPositionInLine());
  }
}
