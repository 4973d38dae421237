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
import java.math.BigInteger;
import java.util.List;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.funcform.compiler.HostParser.AndOperationContext;
import org.funcform.compiler.HostParser.ArgumentContext;
import org.funcform.compiler.HostParser.AtomOperationContext;
import org.funcform.compiler.HostParser.BinaryOperationContext;
import org.funcform.compiler.HostParser.CallOperationContext;
import org.funcform.compiler.HostParser.ComparisonContext;
import org.funcform.compiler.HostParser.ComparisonLogicalContext;
import org.funcform.compiler.HostParser.ComprehensionForContext;
import org.funcform.compiler.HostParser.ComprehensionIfContext;
import org.funcform.compiler.HostParser.ConditionalExpressionContext;
import org.funcform.compiler.HostParser.DoubleStarArgumentContext;
import org.funcform.compiler.HostParser.ExprListContext;
import org.funcform.compiler.HostParser.ExpressionContext;
import org.funcform.compiler.HostParser.FalseAtomContext;
import org.funcform.compiler.HostParser.KeywordArgumentContext;
import org.funcform.compiler.HostParser.LambdaExpressionContext;
import org.funcform.compiler.HostParser.ListComprehensionAtomContext;
import org.funcform.compiler.HostParser.NameAtomContext;
import org.funcform.compiler.HostParser.NoneAtomContext;
import org.funcform.compiler.HostParser.NotOperationContext;
import org.funcform.compiler.HostParser.NumberAtomContext;
import org.funcform.compiler.HostParser.OrOperationContext;
import org.funcform.compiler.HostParser.PlainExpressionContext;
import org.funcform.compiler.HostParser.PositionalArgumentContext;
import org.funcform.compiler.HostParser.StringAtomContext;
import org.funcform.compiler.HostParser.SubscriptOperationContext;
import org.funcform.compiler.HostParser.TrueAtomContext;
import org.funcform.compiler.HostParser.TupleAtomContext;
import org.funcform.compiler.HostParser.UnaryOperationContext;
import org.funcform.surface.Apply;
import org.funcform.surface.Builtins;
import org.funcform.surface.Expr;
import org.funcform.surface.If;
import org.funcform.surface.Lambda;
import org.funcform.surface.Literal;
import org.funcform.surface.Location;
import org.funcform.surface.Symbol;
import org.funcform.surface.Tuple;
import org.funcform.util.StringUtil;

/** A visitor that lowers each expression to the corresponding surface expression. */
class ExpressionLowerer extends VisitorBase<Expr> {
  final Lowerer lowerer;

  ExpressionLowerer(Lowerer lowerer) {
    this.lowerer = lowerer;
  }

  @Override
  Locator locator() {
    return lowerer.locator;
  }

  private Location locate(ParserRuleContext ctx) {
    return lowerer.locate(ctx);
  }

  /** Lowers a comma-separated list; more than one element (or a trailing comma) is a tuple. */
  Expr lowerList(ExprListContext ctx) {
    List<ExpressionContext> exprs = ctx.expression();
    if (exprs.size() == 1 && ctx.trailing == null) {
      return visit(exprs.get(0));
    }
    return new Tuple(lowerAll(exprs), locate(ctx));
  }

  private ImmutableList<Expr> lowerAll(List<? extends ParserRuleContext> ctxs) {
    return ctxs.stream().map(this::visit).collect(toImmutableList());
  }

  @Override
  public Expr visitPlainExpression(PlainExpressionContext ctx) {
    return visit(ctx.logical());
  }

  @Override
  public Expr visitConditionalExpression(ConditionalExpressionContext ctx) {
    Expr condition = visit(ctx.condition);
    Expr ifTrue = visit(ctx.ifTrue);
    Expr ifFalse = visit(ctx.ifFalse);
    return new If(condition, ifTrue, ifFalse, locate(ctx));
  }

  @Override
  public Expr visitLambdaExpression(LambdaExpressionContext ctx) {
    List<TerminalNode> names =
        (ctx.lambdaParameters() == null) ? List.of() : ctx.lambdaParameters().NAME();
    Lowerer body = new Lowerer(lowerer);
    ImmutableList<Symbol> params =
        names.stream().map(n -> bindParameter(body, n.getText())).collect(toImmutableList());
    return new Lambda("lambda", params, body.lowerExpression(ctx.expression()), locate(ctx));
  }

  /** Binds a fresh symbol for a parameter in the given (new) block and returns it. */
  static Symbol bindParameter(Lowerer lowerer, String name) {
    Symbol symbol = lowerer.newTemporary(name);
    lowerer.scope.bind(name, symbol);
    return symbol;
  }

  @Override
  public Expr visitAtomOperation(AtomOperationContext ctx) {
    return visit(ctx.atom());
  }

  @Override
  public Expr visitCallOperation(CallOperationContext ctx) {
    Expr function = visit(ctx.operation());
    List<ArgumentContext> arguments =
        (ctx.arguments() == null) ? List.of() : ctx.arguments().argument();
    ImmutableList.Builder<Expr> args = ImmutableList.builder();
    for (ArgumentContext arg : arguments) {
      if (arg instanceof KeywordArgumentContext || arg instanceof DoubleStarArgumentContext) {
        throw error("Keyword arguments are not allowed.");
      } else if (arg instanceof PositionalArgumentContext positional) {
        args.add(visit(positional.expression()));
      } else {
        // Reports the argument as unrecognized.
        visit(arg);
      }
    }
    return new Apply(function, args.build(), locate(ctx));
  }

  @Override
  public Expr visitSubscriptOperation(SubscriptOperationContext ctx) {
    Expr value = visit(ctx.operation());
    Expr index = visit(ctx.expression());
    return new Apply(Builtins.INDEX, ImmutableList.of(value, index), locate(ctx));
  }

  @Override
  public Expr visitBinaryOperation(BinaryOperationContext ctx) {
    Symbol op = Builtins.binaryOperator(ctx.op.getText());
    if (op == null) {
      throw error("Unknown operator: %s", ctx.op.getText());
    }
    Expr left = visit(ctx.operation(0));
    Expr right = visit(ctx.operation(1));
    return new Apply(op, ImmutableList.of(left, right), locate(ctx));
  }

  @Override
  public Expr visitUnaryOperation(UnaryOperationContext ctx) {
    Symbol op = Builtins.unaryOperator(ctx.op.getText());
    if (op == null) {
      throw error("Unknown operator: %s", ctx.op.getText());
    }
    return new Apply(op, ImmutableList.of(visit(ctx.operation())), locate(ctx));
  }

  @Override
  public Expr visitComparisonLogical(ComparisonLogicalContext ctx) {
    return visit(ctx.comparison());
  }

  @Override
  public Expr visitComparison(ComparisonContext ctx) {
    if (ctx.compareOp().isEmpty()) {
      return visit(ctx.operation(0));
    } else if (ctx.compareOp().size() > 1) {
      // e.g. "a < b < c"; parenthesized comparisons are not affected.
      throw error("Comparisons must have a maximum of two operands");
    }
    // The text of a multi-token operator has no spaces, e.g. "notin".
    String opText = ctx.compareOp(0).getText();
    Expr left = visit(ctx.operation(0));
    Expr right = visit(ctx.operation(1));
    Location location = locate(ctx);
    switch (opText) {
      case "in":
        return new Apply(Builtins.CONTAINS, ImmutableList.of(right, left), location);
      case "notin":
        return new Apply(Builtins.NOT_CONTAINS, ImmutableList.of(right, left), location);
      default:
        Symbol op = Builtins.comparisonOperator(opText);
        if (op == null) {
          throw error("Unknown operator: %s", opText);
        }
        return new Apply(op, ImmutableList.of(left, right), location);
    }
  }

  @Override
  public Expr visitNotOperation(NotOperationContext ctx) {
    return new Apply(Builtins.NOT, ImmutableList.of(visit(ctx.logical())), locate(ctx));
  }

  @Override
  public Expr visitAndOperation(AndOperationContext ctx) {
    Expr left = visit(ctx.logical(0));
    Expr right = visit(ctx.logical(1));
    return new If(left, right, Literal.FALSE, locate(ctx));
  }

  @Override
  public Expr visitOrOperation(OrOperationContext ctx) {
    Expr left = visit(ctx.logical(0));
    Expr right = visit(ctx.logical(1));
    return new If(left, Literal.TRUE, right, locate(ctx));
  }

  @Override
  public Expr visitTupleAtom(TupleAtomContext ctx) {
    return new Tuple(lowerAll(ctx.expression()), locate(ctx));
  }

  /**
   * {@code [e for x in xs if c1 if c2]} is lowered to {@code map(lambda x: e, filter(lambda x: c1
   * and c2, xs))}; each function literal binds its own symbol for the target.
   */
  @Override
  public Expr visitListComprehensionAtom(ListComprehensionAtomContext ctx) {
    if (ctx.comprehensionFor().size() != 1) {
      throw error("List comprehensions can only iterate over a single target");
    }
    ComprehensionForContext generator = ctx.comprehensionFor(0);
    if (generator.targets.size() != 1 || generator.trailing != null) {
      throw error("List comprehensions can only iterate over a single target");
    }
    String target = generator.targets.get(0).getText();
    Expr arg = visit(generator.logical());
    List<ComprehensionIfContext> ifs = generator.comprehensionIf();
    if (!ifs.isEmpty()) {
      Lowerer filter = new Lowerer(lowerer);
      Symbol param = bindParameter(filter, target);
      List<Expr> conditions =
          ifs.stream().map(c -> filter.expressionLowerer.visit(c.logical())).toList();
      // Fold right to left, so that each condition is only tested if the previous ones held.
      Expr condition = conditions.get(conditions.size() - 1);
      for (int i = conditions.size() - 2; i >= 0; i--) {
        condition = new If(conditions.get(i), condition, Literal.FALSE);
      }
      Lambda predicate = new Lambda("filtercmp", ImmutableList.of(param), condition);
      arg = new Apply(Builtins.FILTER, predicate, arg);
    }
    Lowerer map = new Lowerer(lowerer);
    Symbol param = bindParameter(map, target);
    Lambda element =
        new Lambda("listcmp", ImmutableList.of(param), map.lowerExpression(ctx.expression()));
    return new Apply(Builtins.MAP, ImmutableList.of(element, arg), locate(ctx));
  }

  @Override
  public Expr visitNameAtom(NameAtomContext ctx) {
    return lowerer.lookup(ctx.NAME().getText(), locate(ctx));
  }

  @Override
  public Expr visitNumberAtom(NumberAtomContext ctx) {
    String text = ctx.NUMBER().getText();
    Object value;
    if (text.contains(".") || text.contains("e") || text.contains("E")) {
      value = Double.parseDouble(text);
    } else {
      BigInteger big = new BigInteger(text);
      value = (big.bitLength() < 64) ? (Object) big.longValue() : big;
    }
    return new Literal(value, locate(ctx));
  }

  @Override
  public Expr visitStringAtom(StringAtomContext ctx) {
    // Adjacent string literals are concatenated.
    StringBuilder sb = new StringBuilder();
    for (TerminalNode s : ctx.STRING()) {
      try {
        sb.append(StringUtil.unescape(s.getText()));
      } catch (IllegalArgumentException e) {
        throw error("Invalid escape sequence in %s", s.getText());
      }
    }
    return new Literal(sb.toString(), locate(ctx));
  }

  @Override
  public Expr visitTrueAtom(TrueAtomContext ctx) {
    return new Literal(true, locate(ctx));
  }

  @Override
  public Expr visitFalseAtom(FalseAtomContext ctx) {
    return new Literal(false, locate(ctx));
  }

  @Override
  public Expr visitNoneAtom(NoneAtomContext ctx) {
    return new Literal(Literal.NONE, locate(ctx));
  }
}
