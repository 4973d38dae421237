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


package org.funcform.convert;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.funcform.ir.Application;
import org.funcform.ir.Constant;
import org.funcform.ir.Graph;
import org.funcform.ir.Node;
import org.funcform.ir.Parameter;
import org.funcform.ir.Primitive;
import org.funcform.surface.Apply;
import org.funcform.surface.Begin;
import org.funcform.surface.Expr;
import org.funcform.surface.If;
import org.funcform.surface.Lambda;
import org.funcform.surface.Let;
import org.funcform.surface.Literal;
import org.funcform.surface.Symbol;
import org.funcform.surface.Tuple;

/**
 * Converts lowered function definitions into {@link Graph}s.
 *
 * <ul>
 *   <li>Each global definition becomes a Graph named after it; references to it (including
 *       recursive ones) become a {@link Constant} holding the Graph.
 *   <li>Each nested function literal becomes a Graph too, and a Constant where it appears. Its
 *       body may use nodes of the enclosing graphs directly; that is how a closure is represented.
 *   <li>Each arm of a conditional becomes a Graph with no parameters, so that only the selected
 *       arm is evaluated: {@code (if c a b)} is {@code switch(c, a, b)()}.
 *   <li>Let-bound values are named after the symbol they were bound to.
 * </ul>
 *
 * <p>Symbols are unique within a compilation, so a single map from symbol to node serves for every
 * scope.
 */
public final class GraphConverter {
  private final Map<String, Graph> globals = new LinkedHashMap<>();
  private final List<Graph> graphs = new ArrayList<>();
  private final Map<Symbol, Node> bindings = new HashMap<>();

  private GraphConverter() {}

  /** Converts each of the given definitions, which may refer to each other. */
  public static GraphConverter convert(Map<String, Lambda> definitions) {
    GraphConverter converter = new GraphConverter();
    // Create all the graphs first, so that references between definitions can be resolved.
    definitions.keySet().forEach(name -> converter.globals.put(name, converter.newGraph(name)));
    definitions.forEach(
        (name, definition) -> converter.convertFunction(definition, converter.globals.get(name)));
    return converter;
  }

  /** The Graph for each global definition. */
  public ImmutableMap<String, Graph> globals() {
    return ImmutableMap.copyOf(globals);
  }

  /** Every Graph created, including those for function literals and conditional arms. */
  public ImmutableList<Graph> graphs() {
    return ImmutableList.copyOf(graphs);
  }

  private Graph newGraph(String name) {
    Graph graph = new Graph(name);
    graphs.add(graph);
    return graph;
  }

  private void convertFunction(Lambda lambda, Graph graph) {
    for (Symbol param : lambda.params) {
      Parameter node = graph.addParameter(param.label);
      bindings.put(param, node);
    }
    graph.setOutput(lambda.body.accept(new NodeBuilder(graph)));
  }

  /** Converts an expression to nodes in a single graph, returning the node for its value. */
  private class NodeBuilder implements Expr.Visitor<Node> {
    final Graph graph;

    NodeBuilder(Graph graph) {
      this.graph = graph;
    }

    private Application apply(Node... inputs) {
      return new Application(List.of(inputs), graph);
    }

    @Override
    public Node visitSymbol(Symbol symbol) {
      if (symbol.isGlobal()) {
        Graph global = globals.get(symbol.label);
        return new Constant((global != null) ? global : symbol);
      } else if (symbol.isBuiltin()) {
        return new Constant(symbol);
      }
      Node node = bindings.get(symbol);
      Preconditions.checkState(node != null, "Unbound symbol %s", symbol);
      return node;
    }

    @Override
    public Node visitLiteral(Literal literal) {
      return new Constant(literal.value);
    }

    @Override
    public Node visitIf(If ifExpr) {
      Node condition = ifExpr.condition.accept(this);
      Graph ifTrue = newGraph(graph.name() + ":then");
      ifTrue.setOutput(ifExpr.ifTrue.accept(new NodeBuilder(ifTrue)));
      Graph ifFalse = newGraph(graph.name() + ":else");
      ifFalse.setOutput(ifExpr.ifFalse.accept(new NodeBuilder(ifFalse)));
      Node selected =
          apply(
              new Constant(Primitive.SWITCH),
              condition,
              new Constant(ifTrue),
              new Constant(ifFalse));
      return apply(selected);
    }

    @Override
    public Node visitLet(Let let) {
      for (Let.Binding binding : let.bindings) {
        Node node = binding.value.accept(this);
        if (node instanceof Application && node.debugName() == null) {
          node.setDebugName(binding.symbol.label);
        }
        bindings.put(binding.symbol, node);
      }
      return let.body.accept(this);
    }

    @Override
    public Node visitLambda(Lambda lambda) {
      Graph nested = newGraph(lambda.name);
      convertFunction(lambda, nested);
      return new Constant(nested);
    }

    @Override
    public Node visitApply(Apply apply) {
      List<Node> inputs = new ArrayList<>();
      inputs.add(apply.function.accept(this));
      apply.args.forEach(arg -> inputs.add(arg.accept(this)));
      return new Application(inputs, graph);
    }

    @Override
    public Node visitBegin(Begin begin) {
      Node last = null;
      for (Expr expr : begin.exprs) {
        last = expr.accept(this);
      }
      return last;
    }

    @Override
    public Node visitTuple(Tuple tuple) {
      List<Node> inputs = new ArrayList<>();
      inputs.add(new Constant(Primitive.MAKE_TUPLE));
      tuple.values.forEach(value -> inputs.add(value.accept(this)));
      return new Application(inputs, graph);
    }
  }
}
