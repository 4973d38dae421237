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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.function.Function;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.RuleNode;
import org.funcform.compiler.HostParser.ParenAtomContext;

/**
 * A base class for ANTLR visitors that provides two useful functions:
 *
 * <ul>
 *   <li>It replaces the default "visit the children" behavior for node types that haven't been
 *       overridden with a CompileError naming the node type, so every construct that the grammar
 *       accepts but lowering doesn't handle is reported as unrecognized.
 *   <li>It provides error() methods that automatically fill in the node currently being visited as
 *       the location of the error.
 * </ul>
 */
abstract class VisitorBase<T> extends HostBaseVisitor<T> {

  /** The node currently being visited. */
  private ParseTree currentNode;

  /** Converts token positions into the locations reported by errors. */
  abstract Locator locator();

  @Override
  protected final T defaultResult() {
    // Only reached from visitTerminal() and friends, which we never call.
    throw new AssertionError();
  }

  @Override
  public final T visit(ParseTree tree) {
    return visitWithCurrentNode(tree, super::visit);
  }

  @Override
  public final T visitChildren(RuleNode node) {
    String kind = node.getClass().getSimpleName();
    if (kind.endsWith("Context")) {
      kind = kind.substring(0, kind.length() - "Context".length());
    }
    throw error((ParserRuleContext) node, "Unrecognized syntax construct: %s", kind);
  }

  /**
   * Calls {@code visitor} with the given node, binding {@link #currentNode} for the duration of the
   * call.
   *
   * <p>Assumes that if the function throws an exception, this Visitor will not be used again (no
   * attempt is made to restore the correct currentNode state).
   */
  @CanIgnoreReturnValue
  T visitWithCurrentNode(ParseTree node, Function<ParseTree, T> visitor) {
    ParseTree prevNode = currentNode;
    currentNode = node;
    T result = visitor.apply(node);
    currentNode = prevNode;
    return result;
  }

  @Override
  public final T visitParenAtom(ParenAtomContext ctx) {
    // Parentheses don't change the interpretation of the parenthesized expression.
    return visit(ctx.expression());
  }

  /** Returns a {@link CompileError} pointing at the current node. */
  CompileError error(String msg) {
    return new CompileError(locator().locate(((ParserRuleContext) currentNode).start), msg);
  }

  /** Returns a {@link CompileError} pointing at the current node. */
  @FormatMethod
  CompileError error(String fmt, Object... fmtArgs) {
    return error(String.format(fmt, fmtArgs));
  }

  /** Returns a {@link CompileError} pointing at the given node. */
  @FormatMethod
  CompileError error(ParserRuleContext node, String fmt, Object... fmtArgs) {
    return CompileError.at(locator().locate(node.start), fmt, fmtArgs);
  }
}
