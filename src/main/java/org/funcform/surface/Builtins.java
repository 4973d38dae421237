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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/** Symbols for the primitive operations that lowered code may apply. */
public final class Builtins {

  // Statics only
  private Builtins() {}

  /** {@code index(x, i)} is {@code x[i]}. */
  public static final Symbol INDEX = builtin("index");

  /** {@code map(f, xs)} applies {@code f} to each element of {@code xs}. */
  public static final Symbol MAP = builtin("map");

  /** {@code filter(f, xs)} keeps the elements of {@code xs} for which {@code f} is true. */
  public static final Symbol FILTER = builtin("filter");

  /** {@code contains(xs, x)} is {@code x in xs}; note the order of the arguments. */
  public static final Symbol CONTAINS = builtin("contains");

  /** {@code not_contains(xs, x)} is {@code x not in xs}. */
  public static final Symbol NOT_CONTAINS = builtin("not_contains");

  public static final Symbol NOT = builtin("not_");

  /** A map from binary operator (e.g. "+") to the corresponding builtin (e.g. "add"). */
  private static final ImmutableMap<String, Symbol> BINARY_OPERATORS =
      ImmutableMap.<String, Symbol>builder()
          .put("+", builtin("add"))
          .put("-", builtin("sub"))
          .put("*", builtin("mul"))
          .put("/", builtin("truediv"))
          .put("//", builtin("floordiv"))
          .put("%", builtin("mod"))
          .put("**", builtin("pow"))
          .put("@", builtin("matmul"))
          .put("<<", builtin("lshift"))
          .put(">>", builtin("rshift"))
          .put("&", builtin("and_"))
          .put("^", builtin("xor"))
          .put("|", builtin("or_"))
          .buildOrThrow();

  /**
   * A map from comparison operator to builtin. Multi-word operators are keyed by their tokens
   * concatenated without spaces ("notin", "isnot"), which is how ANTLR reports their text. The
   * membership operators are not included, since their operands must be swapped.
   */
  private static final ImmutableMap<String, Symbol> COMPARISON_OPERATORS =
      ImmutableMap.<String, Symbol>builder()
          .put("==", builtin("eq"))
          .put("!=", builtin("ne"))
          .put("<", builtin("lt"))
          .put("<=", builtin("le"))
          .put(">", builtin("gt"))
          .put(">=", builtin("ge"))
          .put("is", builtin("is_"))
          .put("isnot", builtin("is_not"))
          .buildOrThrow();

  private static final ImmutableMap<String, Symbol> UNARY_OPERATORS =
      ImmutableMap.of(
          "-", builtin("neg"),
          "+", builtin("pos"),
          "~", builtin("invert"),
          "not", NOT);

  /** Returns the builtin for a binary operator, or null if there is none. */
  public static @Nullable Symbol binaryOperator(String op) {
    return BINARY_OPERATORS.get(op);
  }

  /** Returns the builtin for a comparison other than "in" and "not in", or null. */
  public static @Nullable Symbol comparisonOperator(String op) {
    return COMPARISON_OPERATORS.get(op);
  }

  /** Returns the builtin for a unary operator, or null if there is none. */
  public static @Nullable Symbol unaryOperator(String op) {
    return UNARY_OPERATORS.get(op);
  }

  private static Symbol builtin(String label) {
    return new Symbol(label, Symbol.BUILTIN);
  }
}
