/*
 * Copyright 2026 The Pyinfer Authors.
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

package com.google.pyinfer.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import org.jspecify.nullness.Nullable;

/** NodeUtil contains generally useful structural queries over the program tree. */
public final class NodeUtil {

  private NodeUtil() {}

  /** The node kinds that start a new function-like body. */
  public static final ImmutableSet<Token> NESTED_BODIES =
      ImmutableSet.of(Token.FUNCTION, Token.CLASS, Token.LAMBDA);

  /** The kind of a function, following the host language's method kinds. */
  public enum FunctionKind {
    FUNCTION("function"),
    METHOD("method"),
    CLASSMETHOD("classmethod"),
    STATICMETHOD("staticmethod");

    private final String pyName;

    FunctionKind(String pyName) {
      this.pyName = pyName;
    }

    @Override
    public String toString() {
      return pyName;
    }
  }

  /**
   * Gets the trailing clause of a compound statement: the {@code else} block of an if chain, a
   * loop or a try/except, and the {@code finally} block of a try/finally.
   */
  public static @Nullable Node getElseBlock(Node n) {
    switch (n.getToken()) {
      case IF:
      case TRY_EXCEPT:
        {
          Node last = n.getLastChild();
          return last != n.getFirstChild() && last.isBlock() ? last : null;
        }
      case WHILE:
        return n.getChildAtIndex(2);
      case FOR:
        return n.getChildAtIndex(3);
      case TRY_FINALLY:
        return n.getSecondChild();
      default:
        return null;
    }
  }

  public static Node getFunctionDecorators(Node fn) {
    checkArgument(fn.isFunction(), fn);
    return fn.getFirstChild();
  }

  public static Node getFunctionParameters(Node fn) {
    checkArgument(fn.isFunction() || fn.isLambda(), fn);
    return fn.isFunction() ? fn.getSecondChild() : fn.getFirstChild();
  }

  /** The body of a function or class (a block), or the expression of a lambda. */
  public static Node getFunctionBody(Node fn) {
    checkArgument(fn.isFunction() || fn.isLambda() || fn.isClass(), fn);
    return fn.getLastChild();
  }

  public static Node getClassBases(Node cls) {
    checkArgument(cls.isClass(), cls);
    return cls.getFirstChild();
  }

  /** The default value of a parameter, or null. */
  public static @Nullable Node getDefaultValue(Node param) {
    checkArgument(param.isAssignName() && param.getParent().getToken() == Token.PARAM_LIST);
    return param.getFirstChild();
  }

  /** Returns how a function is bound when read through a class or an instance. */
  public static FunctionKind getFunctionKind(Node fn) {
    checkArgument(fn.isFunction(), fn);
    Node parent = fn.getParent();
    checkState(parent != null, "Detached function %s", fn);
    if (!parent.frame().isClass()) {
      return FunctionKind.FUNCTION;
    }
    for (Node decorator : getFunctionDecorators(fn).children()) {
      if (decorator.isName()) {
        switch (decorator.getString()) {
          case "classmethod":
            return FunctionKind.CLASSMETHOD;
          case "staticmethod":
            return FunctionKind.STATICMETHOD;
          default:
            break;
        }
      }
    }
    return FunctionKind.METHOD;
  }

  /** Whether the body of a function contains a yield outside any nested definition. */
  public static boolean isGenerator(Node fn) {
    checkArgument(fn.isFunction(), fn);
    return !Iterables.isEmpty(
        getFunctionBody(fn).nodesOfClass(ImmutableSet.of(Token.YIELD), NESTED_BODIES));
  }

  /** The return statements of a function, outside any nested definition. */
  public static Iterable<Node> getReturns(Node fn) {
    checkArgument(fn.isFunction(), fn);
    return getFunctionBody(fn).nodesOfClass(ImmutableSet.of(Token.RETURN), NESTED_BODIES);
  }

  /** The positional index of a parameter within its parameter list. */
  public static int getParameterIndex(Node param) {
    Node params = param.getParent();
    checkArgument(params != null && params.getToken() == Token.PARAM_LIST, param);
    return params.getIndexOfChild(param);
  }
}
