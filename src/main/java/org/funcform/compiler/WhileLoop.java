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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.antlr.v4.runtime.ParserRuleContext;
import org.funcform.compiler.HostParser.WhileStatementContext;
import org.funcform.surface.Apply;
import org.funcform.surface.Expr;
import org.funcform.surface.If;
import org.funcform.surface.Lambda;
import org.funcform.surface.Location;
import org.funcform.surface.Symbol;
import org.funcform.surface.Tuple;

/**
 * Lowers a while loop to a call to a new, globally-registered, tail-recursive function.
 *
 * <p>The loop body is lowered twice. The first pass (in a throwaway block, with throwaway copies of
 * the global table and the symbol generator) only determines which variables the loop reads from
 * the enclosing block and which it assigns. The second pass lowers the test and body in a block where exactly those variables are
 * bound to the new function's parameters, so the resulting function has no free variables.
 *
 * <p>The function's body is {@code if test then f(<inputs after one iteration>) else
 * (<outputs>)}, where the outputs are the loop-assigned variables' values on entry. The loop itself
 * becomes a call to the function with the inputs' current values, whose result is unpacked into
 * the outputs.
 */
final class WhileLoop {

  static final String RETURN_ERROR = "While loops cannot contain return statements.";

  private WhileLoop() {}

  static List<Step> lower(Lowerer lowerer, WhileStatementContext ctx) {
    Location location = lowerer.locate(ctx);
    if (ctx.elseClause() != null) {
      throw new CompileError(location, "While loops cannot have an else clause.");
    }
    Symbol function = lowerer.globals.newSymbol("#while");
    List<ParserRuleContext> statements = Lowerer.statements(ctx.suite());

    // Pass one: find the loop's inputs and outputs.
    Lowerer discovery =
        new Lowerer(lowerer, lowerer.globals.scratch(), lowerer.scope.generator.copy());
    discovery.returnError = RETURN_ERROR;
    discovery.lowerExpression(ctx.expression());
    discovery.lowerBody(statements);
    List<String> inputs = inputs(discovery.freeVariables.keySet(), discovery.localAssignments);
    List<String> outputs =
        inputs.stream().filter(discovery.localAssignments::contains).collect(toImmutableList());
    for (String output : outputs) {
      if (lowerer.scope.resolve(output) == null) {
        throw CompileError.at(
            location,
            "Variable '%s' is assigned in a while loop but has no value before it.",
            output);
      }
    }

    // Pass two: lower the loop again with its inputs bound to parameters.
    Lowerer loop = new Lowerer(lowerer);
    loop.returnError = RETURN_ERROR;
    ImmutableList<Symbol> params =
        inputs.stream()
            .map(name -> ExpressionLowerer.bindParameter(loop, name))
            .collect(toImmutableList());
    Expr test = loop.lowerExpression(ctx.expression());
    Tuple initial = StatementLowerer.currentValues(loop, outputs);
    Body body = loop.lowerBody(statements);
    Expr recur = new Apply(function, currentValues(loop, inputs, location), location);
    Expr helperBody = new If(test, body.build(recur), initial, location);
    Lambda helper = new Lambda(function.label, params, helperBody, location);
    lowerer.globals.define(function.label, helper);
    lowerer.globals.noteAccess(function.label);

    Apply call = new Apply(function, currentValues(lowerer, inputs, location), location);
    if (outputs.isEmpty()) {
      return List.of(new Step.Eval(call));
    }
    return StatementLowerer.unpack(lowerer, lowerer.newTemporary("#tmp"), call, outputs, location);
  }

  /**
   * Orders the loop's inputs: first the variables it both reads and assigns, in order of first
   * reference; then those it assigns without reading first, in order of assignment; then those it
   * only reads, in order of first reference. The outputs are the first two groups.
   */
  static List<String> inputs(Set<String> free, Set<String> assigned) {
    List<String> result = new ArrayList<>();
    free.stream().filter(assigned::contains).forEach(result::add);
    assigned.stream().filter(name -> !free.contains(name)).forEach(result::add);
    free.stream().filter(name -> !assigned.contains(name)).forEach(result::add);
    return result;
  }

  /** Looks up each of the given variables in {@code lowerer}'s block. */
  private static ImmutableList<Expr> currentValues(
      Lowerer lowerer, List<String> names, Location location) {
    return names.stream()
        .<Expr>map(name -> lowerer.lookup(name, location))
        .collect(toImmutableList());
  }
}
