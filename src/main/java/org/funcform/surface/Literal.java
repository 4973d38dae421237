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
import org.funcform.util.StringUtil;
import org.jspecify.annotations.Nullable;

/** A constant value: a number, string, boolean, or {@link #NONE}. */
public final class Literal extends Expr {

  /** The value of the host's {@code None}. */
  public static final Object NONE =
      new Object() {
        @Override
        public String toString() {
          return "None";
        }
      };

  public static final Literal TRUE = new Literal(true, null);
  public static final Literal FALSE = new Literal(false, null);

  public final Object value;

  public Literal(Object value) {
    this(value, null);
  }

  public Literal(Object value, @Nullable Location location) {
    super(location);
    this.value = value;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitLiteral(this);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Literal other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public String toString() {
    if (value instanceof String s) {
      return StringUtil.quote(s);
    } else if (value instanceof Boolean b) {
      return b ? "True" : "False";
    }
    return String.valueOf(value);
  }
}
