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

import java.io.PrintStream;

/**
 * Reports errors to a PrintStream. A {@link CompileError} is rendered as two lines: the error kind
 * and message, followed by its location in the format used for stack traces. Any other error is
 * passed to the default uncaught exception handler, if there is one.
 */
public class DiagnosticSink {
  private final PrintStream out;

  public DiagnosticSink(PrintStream out) {
    this.out = out;
  }

  /** Returns a DiagnosticSink that writes to {@code System.err}. */
  public static DiagnosticSink toStandardError() {
    return new DiagnosticSink(System.err);
  }

  public void report(Throwable error) {
    if (error instanceof CompileError compileError) {
      out.println(CompileError.class.getSimpleName() + ": " + compileError.msg);
      out.println(compileError.location.traceback());
      return;
    }
    Thread.UncaughtExceptionHandler handler = Thread.getDefaultUncaughtExceptionHandler();
    if (handler != null) {
      handler.uncaughtException(Thread.currentThread(), error);
    } else {
      error.printStackTrace(out);
    }
  }
}
