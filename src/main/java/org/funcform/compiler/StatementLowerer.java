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
import java.util.stream.Collectors;
import org.antlr.v4.runtime.ParserRuleContext;
import org.funcform.compiler.HostParser.AssignmentStatementContext;
import org.funcform.compiler.HostParser.AtomContext;
import org.funcform.compiler.HostParser.AtomOperationContext;
import org.funcform.compiler.HostParser.ComparisonLogicalContext;
import org.funcform.compiler.HostParser.DefinitionContext;
import org.funcform.compiler.HostParser.DefinitionStatementContext;
import org.funcform.compiler.HostParser.DoubleStarParameterContext;
import org.funcform.compiler.HostParser.ElifClauseContext;
import org.funcform.compiler.HostParser.ElseClauseContext;
import org.funcform.compiler.HostParser.ExprListContext;
import org.funcform.compiler.HostParser.ExpressionContext;
import org.funcform.compiler.HostParser.ExpressionStatementContext;
import org.funcform.compiler.HostParser.IfStatementContext;
import org.funcform.compiler.HostParser.NameAtomContext;
import org.funcform.compiler.HostParser.NamedParameterContext;
import org.funcform.compiler.HostParser.ParameterContext;
import org.funcform.compiler.HostParser.PassStatementContext;
import org.funcform.compiler.HostParser.PlainExpressionContext;
import org.funcform.compiler.HostParser.ReturnStatementContext;
import org.funcform.compiler.HostParser.StarParameterContext;
import org.funcform.compiler.HostParser.SuiteContext;
import org.funcform.compiler.HostParser.TupleAtomContext;
import org.funcform.compiler.HostParser.WhileStatementContext;
import org.funcform.surface.Apply;
import org.funcform.surface.Builtins;
import org.funcform.surface.Expr;
import org.funcform.surface.If;
import org.funcform.surface.Lambda;
import org.funcform.surface.Literal;
import org.funcform.surface.Location;
import org.funcform.surface.Symbol;
import org.funcform.surface.Tuple;
import org.jspecify.annotations.Nullable;

/**
 * A visitor that lowers each statement to a list of {@link Step}s, updating the state of its {@link
 * Lowerer} (assigned variables, whether the block has returned) as it goes.
 */
class StatementLowerer extends VisitorBase<List<Step>> {
  final Lowerer lowerer;

  StatementLowerer(Lowerer lowerer) {
    this.lowerer = lowerer;
  }

  @Override
  Locator locator() {
    return lowerer.locator;
  }

  /**
   * Lowers the definition that makes up a compilation unit, registers it in the global table under
   * its own name, and returns the corresponding global symbol. Only this definition may have
   * decorators (which are ignored).
   */
  Symbol lowerEntryPoint(DefinitionContext ctx) {
    Lambda function = lowerDefinition(ctx, true);
    lowerer.globals.define(function.name, function);
    return new Symbol(function.name, Symbol.GLOBAL, lowerer.locate(ctx));
  }

  /** Lowers a function definition to a function literal. */
  Lambda lowerDefinition(DefinitionContext ctx, boolean allowDecorators) {
    String name = ctx.NAME().getText();
    List<ParameterContext> params =
        (ctx.parameters() == null) ? List.of() : ctx.parameters().parameter();
    for (ParameterContext param : params) {
      if ((param instanceof StarParameterContext star && star.NAME() != null)
          || param instanceof DoubleStarParameterContext) {
        throw error(ctx, "Varargs are not allowed.");
      }
    }
    for (ParameterContext param : params) {
      // Only a bare "*" is left, which makes the parameters after it keyword-only.
      if (param instanceof StarParameterContext) {
        throw error(ctx, "Keyword-only arguments are not allowed.");
      } else if (((NamedParameterContext) param).expression() != null) {
        throw error(ctx, "Default arguments are not allowed.");
      }
    }
    if (!allowDecorators && !ctx.decorator().isEmpty()) {
      throw error(ctx, "Functions should not have decorators.");
    }
    Lowerer body = new Lowerer(lowerer);
    // Return statements in a function are allowed even if they aren't in the enclosing block.
    body.returnError = null;
    ImmutableList<Symbol> symbols =
        params.stream()
            .map(p -> ((NamedParameterContext) p).NAME().getText())
            .map(n -> ExpressionLowerer.bindParameter(body, n))
            .collect(toImmutableList());
    Expr result = body.lowerBody(Lowerer.statements(ctx.suite())).build(null);
    if (!body.freeVariables.isEmpty()) {
      String free = body.freeVariables.keySet().iterator().next();
      throw CompileError.at(
          body.freeVariables.get(free).location,
          "Functions cannot have free variables ('%s')",
          free);
    }
    if (!body.returns) {
      throw error(ctx, "Function does not return a value.");
    }
    return new Lambda(name, symbols, result, lowerer.locate(ctx));
  }

  /**
   * A nested definition assigns a function literal to a local variable. The variable is bound
   * before the body is lowered, so a recursive reference is a free variable of the function.
   */
  @Override
  public List<Step> visitDefinitionStatement(DefinitionStatementContext ctx) {
    Symbol symbol = lowerer.assign(ctx.definition().NAME().getText());
    Lambda function = lowerDefinition(ctx.definition(), false);
    return List.of(new Step.Assign(symbol, function, lowerer.locate(ctx)));
  }

  @Override
  public List<Step> visitReturnStatement(ReturnStatementContext ctx) {
    if (lowerer.returnError != null) {
      throw error(lowerer.returnError);
    }
    lowerer.returns = true;
    Expr value =
        (ctx.exprList() == null)
            ? new Literal(Literal.NONE, lowerer.locate(ctx))
            : lowerer.expressionLowerer.lowerList(ctx.exprList());
    return List.of(new Step.Eval(value));
  }

  @Override
  public List<Step> visitExpressionStatement(ExpressionStatementContext ctx) {
    return List.of(new Step.Eval(lowerer.expressionLowerer.lowerList(ctx.exprList())));
  }

  @Override
  public List<Step> visitPassStatement(PassStatementContext ctx) {
    return List.of();
  }

  @Override
  public List<Step> visitAssignmentStatement(AssignmentStatementContext ctx) {
    List<ExprListContext> parts = ctx.exprList();
    if (parts.size() > 2) {
      throw error("Multi-target assignment is not supported.");
    }
    String name = targetName(parts.get(0));
    Expr value = lowerer.expressionLowerer.lowerList(parts.get(1));
    return List.of(new Step.Assign(lowerer.assign(name), value, lowerer.locate(ctx)));
  }

  /** Returns the variable name on the left hand side of an assignment. */
  private String targetName(ExprListContext target) {
    if (target.expression().size() != 1 || target.trailing != null) {
      throw error("Deconstructing assignment is not supported.");
    }
    ExpressionContext expression = target.expression(0);
    if (expression instanceof PlainExpressionContext plain
        && plain.logical() instanceof ComparisonLogicalContext logical
        && logical.comparison().compareOp().isEmpty()
        && logical.comparison().operation(0) instanceof AtomOperationContext atomOperation) {
      AtomContext atom = atomOperation.atom();
      if (atom instanceof NameAtomContext name) {
        return name.NAME().getText();
      } else if (atom instanceof TupleAtomContext) {
        throw error("Deconstructing assignment is not supported.");
      }
    }
    throw error("Only variables can be assigned to.");
  }

  @Override
  public List<Step> visitIfStatement(IfStatementContext ctx) {
    return lowerIf(ctx, ctx.expression(), ctx.suite(), ctx.elifClause(), ctx.elseClause());
  }

  /**
   * Lowers an if statement; an {@code elif} is treated as an if statement nested in the else
   * branch.
   *
   * <p>Both branches must return, or neither; if neither does they must assign the same set of
   * variables, and the conditional's value is bound to them (via a temporary tuple if there is more
   * than one).
   */
  private List<Step> lowerIf(
      ParserRuleContext ctx,
      ExpressionContext test,
      SuiteContext thenSuite,
      List<ElifClauseContext> elifs,
      @Nullable ElseClauseContext orElse) {
    Location location = lowerer.locate(ctx);
    Expr condition = lowerer.lowerExpression(test);
    Lowerer thenBranch = new Lowerer(lowerer);
    Body thenBody = thenBranch.lowerBody(Lowerer.statements(thenSuite));
    Lowerer elseBranch = new Lowerer(lowerer);
    Body elseBody;
    if (!elifs.isEmpty()) {
      ElifClauseContext elif = elifs.get(0);
      elseBody =
          new Body(
              elseBranch.statementLowerer.lowerIf(
                  elif, elif.expression(), elif.suite(), elifs.subList(1, elifs.size()), orElse));
    } else if (orElse != null) {
      elseBody = elseBranch.lowerBody(Lowerer.statements(orElse.suite()));
    } else {
      elseBody = Body.EMPTY;
    }
    if (thenBranch.returns != elseBranch.returns) {
      throw error(ctx, "Either none or all branches of an if statement must return a value.");
    }
    if (!thenBranch.localAssignments.equals(elseBranch.localAssignments)) {
      throw error(
          ctx,
          "All branches of an if statement must assign to the same set of variables.\n"
              + "True branch sets: %s\nElse branch sets: %s",
          sorted(thenBranch.localAssignments),
          sorted(elseBranch.localAssignments));
    }
    List<String> assigned = new ArrayList<>(thenBranch.localAssignments);
    if (thenBranch.returns || assigned.isEmpty()) {
      lowerer.returns |= thenBranch.returns;
      Expr result = new If(condition, thenBody.build(null), elseBody.build(null), location);
      return List.of(new Step.Eval(result));
    } else if (assigned.size() == 1) {
      String name = assigned.get(0);
      Expr result =
          new If(
              condition,
              thenBody.build(thenBranch.scope.get(name)),
              elseBody.build(elseBranch.scope.get(name)),
              location);
      return List.of(new Step.Assign(lowerer.assign(name), result, location));
    }
    Expr result =
        new If(
            condition,
            thenBody.build(currentValues(thenBranch, assigned)),
            elseBody.build(currentValues(elseBranch, assigned)),
            location);
    return unpack(lowerer, lowerer.newTemporary("#tmp"), result, assigned, location);
  }

  private static String sorted(Iterable<String> names) {
    List<String> list = new ArrayList<>();
    names.forEach(list::add);
    return list.stream().sorted().collect(Collectors.joining(" "));
  }

  /** Returns a tuple of the current values of the given variables in {@code lowerer}'s block. */
  static Tuple currentValues(Lowerer lowerer, List<String> names) {
    return new Tuple(names.stream().<Expr>map(lowerer.scope::get).collect(toImmutableList()));
  }

  /**
   * Returns steps that bind {@code tmp} to {@code tuple}, and then assign each of {@code names} to
   * the corresponding element of it.
   */
  static List<Step> unpack(
      Lowerer lowerer, Symbol tmp, Expr tuple, List<String> names, Location location) {
    List<Step> steps = new ArrayList<>();
    steps.add(new Step.Assign(tmp, tuple, location));
    for (int i = 0; i < names.size(); i++) {
      Expr element = new Apply(Builtins.INDEX, tmp, new Literal((long) i));
      steps.add(new Step.Assign(lowerer.assign(names.get(i)), element, location));
    }
    return steps;
  }

  @Override
  public List<Step> visitWhileStatement(WhileStatementContext ctx) {
    return WhileLoop.lower(lowerer, ctx);
  }
}
