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

package org.funcform.ir;

/** Primitive operations that the graph IR itself relies on. */
public enum Primitive {
  /** {@code return(x)} is the output node of every graph; its single argument is the result. */
  RETURN("return"),
  /** {@code switch(cond, a, b)} selects {@code a} if {@code cond} is true, {@code b} otherwise. */
  SWITCH("switch"),
  /** {@code make_tuple(x, ...)} constructs a tuple of its arguments. */
  MAKE_TUPLE("make_tuple");

  public final String label;

  Primitive(String label) {
    this.label = label;
  }

  @Override
  public String toString() {
    return label;
  }
}
