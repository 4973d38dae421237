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

import java.util.UUID;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.funcform.compiler.HostParser.UnitContext;
import org.funcform.surface.Symbol;

/**
 * Lowers a procedural function definition to a closed functional surface expression.
 *
 * <p>A compilation unit is the source text of a single (optionally decorated) function definition.
 * Lowering registers the definition in a {@link GlobalEnv}, along with a helper function for each
 * while loop it contains.
 */
public final class Compiler {

  // Static methods only
  private Compiler() {}

  /**
   * Lowers one function definition into a new GlobalEnv. Returns the result rather than throwing
   * if there is a {@link CompileError}, after reporting it to {@code diagnostics}; any other
   * exception is propagated unchanged.
   *
   * @param source the text of the definition
   * @param locator identifies the origin of {@code source} (e.g. a filename) and the line on which
   *     it starts, for error locations
   * @param diagnostics where any CompileError is reported
   */
  public static CompileResult compile(String source, Locator locator, DiagnosticSink diagnostics) {
    GlobalEnv globals = new GlobalEnv();
    try {
      Symbol definition = lower(CharStreams.fromString(source, locator.origin), locator, globals);
      return CompileResult.success(definition, globals);
    } catch (CompileError e) {
      diagnostics.report(e);
      return CompileResult.failure(e, globals);
    }
  }

  /**
   * Lowers one function definition, registering it (and any functions generated for its while
   * loops) in {@code globals}, and returns the global symbol that names it. If lowering fails
   * {@code globals} is left unchanged.
   *
   * @throws CompileError if the input can't be parsed or uses an unsupported construct
   */
  public static Symbol lower(CharStream input, Locator locator, GlobalEnv globals) {
    UnitContext unit = parse(input, locator);
    // Local variables get a namespace that is unique to this unit.
    SymbolGenerator generator = new SymbolGenerator(UUID.randomUUID().toString());
    GlobalEnv staging = globals.scratch();
    Lowerer lowerer = new Lowerer(locator, staging, generator);
    Symbol result = lowerer.statementLowerer.lowerEntryPoint(unit.definition());
    globals.commit(staging);
    return result;
  }

  /** Parses a compilation unit. */
  public static UnitContext parse(CharStream input, Locator locator) {
    // Throw CompileErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new CompileError(locator.locate(lineNum, charPositionInLine), msg);
          }
        };
    HostLexer lexer = new HostLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    HostParser parser = new HostParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser.unit();
  }
}
