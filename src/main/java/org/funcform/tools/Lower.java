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


package org.funcform.tools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.funcform.compiler.CompileResult;
import org.funcform.compiler.Compiler;
import org.funcform.compiler.DiagnosticSink;
import org.funcform.compiler.Locator;
import org.funcform.convert.GraphConverter;
import org.funcform.ir.Application;
import org.funcform.ir.Graph;
import org.funcform.ir.Node;

/**
 * A simple command-line tool that lowers the function definition in a file and prints every
 * resulting definition.
 *
 * <p>System properties: {@code lineOffset} (default 1) is the line number reported for the first
 * line of the file; if {@code graphs} is true the definitions are also converted to graphs, and
 * each graph is printed with its applications.
 */
public class Lower {
  private Lower() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: lower <fileName>");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    int lineOffset = Integer.parseInt(System.getProperty("lineOffset", "1"));
    boolean graphs = Boolean.parseBoolean(System.getProperty("graphs", "false"));
    checkUsage(args.length == 1);
    Path file = Path.of(args[0]);
    String source = Files.readString(file);
    Locator locator = new Locator(file.getFileName().toString(), lineOffset);
    CompileResult result = Compiler.compile(source, locator, DiagnosticSink.toStandardError());
    if (!result.succeeded()) {
      System.exit(1);
    }
    System.out.println(result.globals);
    if (graphs) {
      System.out.println("---");
      for (Graph graph : GraphConverter.convert(result.globals.definitions()).graphs()) {
        System.out.println(graph);
        for (Node node : graph.nodes()) {
          if (node instanceof Application && node.graph == graph && node != graph.returnNode()) {
            System.out.println("  " + node);
          }
        }
      }
    }
  }
}
