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

import com.google.errorprone.annotations.FormatMethod;
import org.funcform.surface.Location;

/**
 * All errors detected while lowering a function definition throw a CompileError. Lowering does not
 * attempt to recover: the first error aborts the compilation unit.
 */
public class CompileError extends RuntimeException {
  public final String msg;
  public final Location location;

  public CompileError(Location location, String msg) {
    super(msg);
    this.msg = msg;
    this.location = location;
  }

  @FormatMethod
  static CompileError at(Location location, String fmt, Object... fmtArgs) {
    return new CompileError(location, String.format(fmt, fmtArgs));
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s)", msg, location);
  }
}
