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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.antlr.v4.runtime.ParserRuleContext;
import org.funcform.compiler.HostParser.ExpressionContext;
import org.funcform.compiler.HostParser.StatementContext;
import org.funcform.compiler.HostParser.SuiteContext;
import org.funcform.surface.Expr;
import org.funcform.surface.Location;
import org.funcform.surface.Symbol;
import org.jspecify.annotations.Nullable;

/**
 * A Lowerer holds the state associated with lowering one lexical block: a function body, a lambda
 * body, a branch of an if statement, or a while loop body. Each Lowerer has its own {@link Scope},
 * whose parent is the Scope of the enclosing block's Lowerer.
 */
class Lowerer {
  final Locator locator;
  final GlobalEnv globals;

  /** The Lowerer for the enclosing block, or null for the outermost block of a compilation unit. */
  final @Nullable Lowerer parent;

  final Scope scope;

  /**
   * Variables referenced in this block (or a block nested in it) that are bound in an enclosing
   * block, in the order they were first referenced.
   */
  final Map<String, FreeVariable> freeVariables = new LinkedHashMap<>();

  /** Variables assigned in this block, in the order they were first assigned. */
  final Set<String> localAssignments = new LinkedHashSet<>();

  /** True once a return statement has been lowered in this block. */
  boolean returns;

  /** If non-null, return statements are not allowed in this block and this is the error message. */
  @Nullable String returnError;

  final ExpressionLowerer expressionLowerer = new ExpressionLowerer(this);
  final StatementLowerer statementLowerer = new StatementLowerer(this);

  /** A variable bound in an enclosing block, and the location of its first reference here. */
  static final class FreeVariable {
    final Symbol symbol;
    final Location location;

    FreeVariable(Symbol symbol, Location location) {
      this.symbol = symbol;
      this.location = location;
    }
  }

  /** Creates the outermost Lowerer for a compilation unit. */
  Lowerer(Locator locator, GlobalEnv globals, SymbolGenerator generator) {
    this.locator = locator;
    this.globals = globals;
    this.parent = null;
    this.scope = new Scope(generator);
  }

  /** Creates a Lowerer for a block nested in {@code parent}'s block. */
  Lowerer(Lowerer parent) {
    this(parent, parent.globals, parent.scope.generator);
  }

  /**
   * Creates a Lowerer for a block nested in {@code parent}'s block, that registers any generated
   * functions in the given GlobalEnv and names its variables (and those of blocks nested in it)
   * with the given generator.
   */
  Lowerer(Lowerer parent, GlobalEnv globals, SymbolGenerator generator) {
    this.locator = parent.locator;
    this.globals = globals;
    this.parent = parent;
    this.scope = new Scope(parent.scope, generator);
    this.returnError = parent.returnError;
  }

  Location locate(ParserRuleContext ctx) {
    return locator.locate(ctx.start);
  }

  /**
   * Returns the symbol that holds the current value of the named variable. If it is bound in an
   * enclosing block, it is recorded as a free variable of this block and of each block in between;
   * if it isn't bound at all it is a reference to a global.
   */
  Symbol lookup(String name, Location location) {
    Scope.Resolution resolution = scope.resolve(name);
    if (resolution == null) {
      globals.noteAccess(name);
      return new Symbol(name, Symbol.GLOBAL, location);
    }
    if (resolution.free) {
      for (Lowerer lowerer = this;
          lowerer != null && lowerer.scope != resolution.owner;
          lowerer = lowerer.parent) {
        lowerer.freeVariables.putIfAbsent(name, new FreeVariable(resolution.symbol, location));
      }
    }
    return resolution.symbol.at(location);
  }

  /** Returns a new symbol for the named variable, which is being assigned in this block. */
  Symbol assign(String name) {
    localAssignments.add(name);
    return scope.newVariable(name);
  }

  /** Returns a new symbol for an intermediate value; it is not bound to any variable name. */
  Symbol newTemporary(String base) {
    return scope.generator.symbol(base);
  }

  Expr lowerExpression(ExpressionContext ctx) {
    return expressionLowerer.visit(ctx);
  }

  /** Lowers a sequence of statements (as returned by {@link #statements}) in this block. */
  Body lowerBody(List<ParserRuleContext> statements) {
    List<Step> steps = new ArrayList<>();
    for (ParserRuleContext statement : statements) {
      if (returns) {
        throw new CompileError(locate(statement), "There should be no statements after return.");
      }
      steps.addAll(statementLowerer.visit(statement));
    }
    return new Body(steps);
  }

  /**
   * Returns the statements of a suite, flattening each line of semicolon-separated simple
   * statements.
   */
  static List<ParserRuleContext> statements(SuiteContext suite) {
    List<ParserRuleContext> result = new ArrayList<>();
    if (suite.simpleStatements() != null) {
      result.addAll(suite.simpleStatements().smallStatement());
    } else {
      for (StatementContext statement : suite.statement()) {
        if (statement.simpleStatements() != null) {
          result.addAll(statement.simpleStatements().smallStatement());
        } else {
          result.add(statement.compoundStatement());
        }
      }
    }
    return result;
  }
}
