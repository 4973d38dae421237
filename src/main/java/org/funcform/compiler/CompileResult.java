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

import com.google.common.base.Preconditions;
import org.funcform.surface.Symbol;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of {@link Compiler#compile}: either the global symbol naming the lowered definition,
 * or the error that aborted lowering. After a failure {@link #globals} is empty, since a unit that
 * fails to lower registers nothing.
 */
public final class CompileResult {
  private final @Nullable Symbol definition;
  private final @Nullable CompileError error;
  public final GlobalEnv globals;

  private CompileResult(
      @Nullable Symbol definition, @Nullable CompileError error, GlobalEnv globals) {
    this.definition = definition;
    this.error = error;
    this.globals = globals;
  }

  static CompileResult success(Symbol definition, GlobalEnv globals) {
    return new CompileResult(definition, null, globals);
  }

  static CompileResult failure(CompileError error, GlobalEnv globals) {
    return new CompileResult(null, error, globals);
  }

  public boolean succeeded() {
    return error == null;
  }

  /** The global symbol of the lowered definition; only valid if {@link #succeeded}. */
  public Symbol definition() {
    Preconditions.checkState(definition != null, "Compilation failed");
    return definition;
  }

  /** The error that aborted compilation; only valid if {@link #succeeded} is false. */
  public CompileError error() {
    Preconditions.checkState(error != null, "Compilation succeeded");
    return error;
  }

  @Override
  public String toString() {
    return succeeded() ? definition.toString() : error.getMessage();
  }
}
