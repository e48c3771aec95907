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

import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.jspecify.nullness.Nullable;

/**
 * A tree construction helper class.
 *
 * <p>Line numbers are not assigned here; callers set them with {@link Node#setLineno}.
 */
public class IR {

  private IR() {}

  /** Names that denote constants and the node kinds they are built as. */
  private static final ImmutableMap<String, Token> CONST_NAME_TRANSFORMS =
      ImmutableMap.of("None", Token.NONE, "True", Token.TRUE, "False", Token.FALSE);

  /** Runtime values that are built as dedicated nodes rather than generic constants. */
  private static final ImmutableMap<Object, Token> CONST_VALUE_TRANSFORMS =
      ImmutableMap.of(Boolean.TRUE, Token.TRUE, Boolean.FALSE, Token.FALSE);

  private static final ImmutableMap<Token, Boolean> BOOLEAN_VALUES =
      ImmutableMap.of(Token.TRUE, Boolean.TRUE, Token.FALSE, Boolean.FALSE);

  public static Node module(String name, Node... stmts) {
    Node module = Node.newString(Token.MODULE, name, block(stmts));
    module.setLineno(0);
    return module;
  }

  public static Node classNode(String name, Node bases, Node body) {
    checkState(bases.getToken() == Token.BASES, bases);
    checkState(body.isBlock(), body);
    return Node.newString(Token.CLASS, name, bases, body);
  }

  public static Node bases(Node... exprs) {
    Node bases = new Node(Token.BASES);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr), expr);
      bases.addChildToBack(expr);
    }
    return bases;
  }

  public static Node function(String name, Node params, Node body) {
    return function(name, decorators(), params, body);
  }

  public static Node function(String name, Node decorators, Node params, Node body) {
    checkState(decorators.getToken() == Token.DECORATORS, decorators);
    checkState(params.getToken() == Token.PARAM_LIST, params);
    checkState(body.isBlock(), body);
    return Node.newString(Token.FUNCTION, name, decorators, params, body);
  }

  public static Node decorators(Node... exprs) {
    Node decorators = new Node(Token.DECORATORS);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr), expr);
      decorators.addChildToBack(expr);
    }
    return decorators;
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.isAssignName(), param);
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node param(String name) {
    return assignName(name);
  }

  public static Node param(String name, Node defaultValue) {
    checkState(mayBeExpression(defaultValue), defaultValue);
    return Node.newString(Token.ASSIGN_NAME, name, defaultValue);
  }

  public static Node lambda(Node params, Node body) {
    checkState(params.getToken() == Token.PARAM_LIST, params);
    checkState(mayBeExpression(body), body);
    return new Node(Token.LAMBDA, params, body);
  }

  public static Node genexpr(Node elt, Node... compFors) {
    checkState(mayBeExpression(elt), elt);
    checkArgument(compFors.length > 0);
    Node genexpr = new Node(Token.GENEXPR, elt);
    for (Node compFor : compFors) {
      checkState(compFor.getToken() == Token.COMP_FOR, compFor);
      genexpr.addChildToBack(compFor);
    }
    return genexpr;
  }

  public static Node compFor(Node target, Node iter) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(iter), iter);
    return new Node(Token.COMP_FOR, target, iter);
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(stmt.isStatement(), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node assign(Node target, Node value) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.ASSIGN, target, value);
  }

  /** An assignment to several targets at once, as in {@code a = b = value}. */
  public static Node assign(List<Node> targets, Node value) {
    checkArgument(!targets.isEmpty());
    Node assign = new Node(Token.ASSIGN);
    for (Node target : targets) {
      checkState(isAssignmentTarget(target), target);
      assign.addChildToBack(target);
    }
    checkState(mayBeExpression(value), value);
    assign.addChildToBack(value);
    return assign;
  }

  public static Node augAssign(Node target, String op, Node value) {
    checkState(target.isAssignName() || target.getToken() == Token.ASSIGN_ATTR, target);
    checkState(mayBeExpression(value), value);
    return Node.newString(Token.AUG_ASSIGN, op, target, value);
  }

  public static Node exprStmt(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_STMT, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    return ifNode(List.of(branch(cond, then)), null);
  }

  public static Node ifNode(Node cond, Node then, Node elseBlock) {
    return ifNode(List.of(branch(cond, then)), elseBlock);
  }

  /** An if statement with {@code elif} branches after the first one. */
  public static Node ifNode(List<Node> branches, @Nullable Node elseBlock) {
    checkArgument(!branches.isEmpty());
    Node ifNode = new Node(Token.IF);
    for (Node branch : branches) {
      checkState(branch.getToken() == Token.IF_BRANCH, branch);
      ifNode.addChildToBack(branch);
    }
    if (elseBlock != null) {
      checkState(elseBlock.isBlock(), elseBlock);
      ifNode.addChildToBack(elseBlock);
    }
    return ifNode;
  }

  public static Node branch(Node cond, Node body) {
    checkState(mayBeExpression(cond), cond);
    checkState(body.isBlock(), body);
    return new Node(Token.IF_BRANCH, cond, body);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond), cond);
    checkState(body.isBlock(), body);
    return new Node(Token.WHILE, cond, body);
  }

  public static Node whileNode(Node cond, Node body, Node elseBlock) {
    Node whileNode = whileNode(cond, body);
    checkState(elseBlock.isBlock(), elseBlock);
    whileNode.addChildToBack(elseBlock);
    return whileNode;
  }

  public static Node forNode(Node target, Node iter, Node body) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(iter), iter);
    checkState(body.isBlock(), body);
    return new Node(Token.FOR, target, iter, body);
  }

  public static Node forNode(Node target, Node iter, Node body, Node elseBlock) {
    Node forNode = forNode(target, iter, body);
    checkState(elseBlock.isBlock(), elseBlock);
    forNode.addChildToBack(elseBlock);
    return forNode;
  }

  public static Node tryExcept(Node body, List<Node> handlers, @Nullable Node elseBlock) {
    checkState(body.isBlock(), body);
    checkArgument(!handlers.isEmpty());
    Node tryExcept = new Node(Token.TRY_EXCEPT, body);
    for (Node handler : handlers) {
      checkState(handler.getToken() == Token.EXCEPT_HANDLER, handler);
      tryExcept.addChildToBack(handler);
    }
    if (elseBlock != null) {
      checkState(elseBlock.isBlock(), elseBlock);
      tryExcept.addChildToBack(elseBlock);
    }
    return tryExcept;
  }

  /**
   * An {@code except} clause. {@code type} is null for a bare {@code except:}, {@code name} is
   * null when the exception is not bound.
   */
  public static Node exceptHandler(@Nullable Node type, @Nullable Node name, Node body) {
    checkState(type == null || mayBeExpression(type), type);
    checkState(name == null || name.isAssignName(), name);
    checkState(body.isBlock(), body);
    return new Node(
        Token.EXCEPT_HANDLER,
        type == null ? empty() : type,
        name == null ? empty() : name,
        body);
  }

  public static Node tryFinally(Node body, Node finallyBody) {
    checkState(body.isBlock(), body);
    checkState(finallyBody.isBlock(), finallyBody);
    return new Node(Token.TRY_FINALLY, body, finallyBody);
  }

  public static Node with(Node expr, @Nullable Node target, Node body) {
    checkState(mayBeExpression(expr), expr);
    checkState(target == null || isAssignmentTarget(target), target);
    checkState(body.isBlock(), body);
    return new Node(Token.WITH, expr, target == null ? empty() : target, body);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node raise(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RAISE, expr);
  }

  public static Node assertNode(Node test) {
    checkState(mayBeExpression(test), test);
    return new Node(Token.ASSERT, test);
  }

  public static Node pass() {
    return new Node(Token.PASS);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node delete(Node... targets) {
    Node delete = new Node(Token.DELETE);
    for (Node target : targets) {
      checkState(isAssignmentTarget(target), target);
      delete.addChildToBack(target);
    }
    return delete;
  }

  public static Node global(String... names) {
    checkArgument(names.length > 0);
    Node global = new Node(Token.GLOBAL);
    for (String name : names) {
      global.addChildToBack(Node.newString(Token.NAME, name));
    }
    return global;
  }

  public static Node importNode(Node... specs) {
    Node importNode = new Node(Token.IMPORT);
    addImportSpecs(importNode, specs);
    return importNode;
  }

  public static Node fromImport(String moduleName, Node... specs) {
    Node from = new Node(Token.FROM);
    from.setModuleName(moduleName);
    addImportSpecs(from, specs);
    return from;
  }

  private static void addImportSpecs(Node n, Node... specs) {
    checkArgument(specs.length > 0);
    for (Node spec : specs) {
      checkState(spec.getToken() == Token.IMPORT_SPEC, spec);
      n.addChildToBack(spec);
    }
  }

  public static Node importSpec(String name) {
    return importSpec(name, null);
  }

  public static Node importSpec(String name, @Nullable String alias) {
    Node spec = Node.newString(Token.IMPORT_SPEC, name);
    spec.setAlias(alias);
    return spec;
  }

  /** A name reference. {@code None}, {@code True} and {@code False} become constants. */
  public static Node name(String name) {
    Token constant = CONST_NAME_TRANSFORMS.get(name);
    if (constant != null) {
      return Node.newConst(constant, BOOLEAN_VALUES.get(constant));
    }
    return Node.newString(Token.NAME, name);
  }

  public static Node assignName(String name) {
    return Node.newString(Token.ASSIGN_NAME, name);
  }

  public static Node getattr(Node expr, String attr) {
    checkState(mayBeExpression(expr), expr);
    return Node.newString(Token.GETATTR, attr, expr);
  }

  public static Node assignAttr(Node expr, String attr) {
    checkState(mayBeExpression(expr), expr);
    return Node.newString(Token.ASSIGN_ATTR, attr, expr);
  }

  public static Node call(Node callee, Node... args) {
    checkState(mayBeExpression(callee), callee);
    Node call = new Node(Token.CALL, callee);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node subscript(Node value, Node index) {
    checkState(mayBeExpression(value), value);
    checkState(mayBeExpression(index), index);
    return new Node(Token.SUBSCRIPT, value, index);
  }

  /**
   * A constant. {@code null} and booleans become their dedicated node kinds, anything else must
   * be a number or a string.
   */
  public static Node constant(@Nullable Object value) {
    if (value == null) {
      return Node.newConst(Token.NONE, null);
    }
    Token constant = CONST_VALUE_TRANSFORMS.get(value);
    if (constant != null) {
      return Node.newConst(constant, value);
    }
    checkArgument(value instanceof Number || value instanceof String, value);
    return Node.newConst(Token.CONST, value);
  }

  public static Node tuple(Node... elements) {
    return container(Token.TUPLE, elements);
  }

  public static Node list(Node... elements) {
    return container(Token.LIST, elements);
  }

  /** A dict display; {@code keysAndValues} alternates keys and values. */
  public static Node dict(Node... keysAndValues) {
    checkArgument(keysAndValues.length % 2 == 0);
    return container(Token.DICT, keysAndValues);
  }

  private static Node container(Token token, Node... elements) {
    Node n = new Node(token);
    for (Node element : elements) {
      checkState(mayBeExpression(element) || isAssignmentTarget(element), element);
      n.addChildToBack(element);
    }
    return n;
  }

  public static Node binaryOp(Node left, String op, Node right) {
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return Node.newString(Token.BINARY_OP, op, left, right);
  }

  /** An {@code and} / {@code or} chain. */
  public static Node boolOp(String op, Node... operands) {
    checkArgument(op.equals("and") || op.equals("or"), op);
    checkArgument(operands.length >= 2);
    Node boolOp = Node.newString(Token.BOOL_OP, op);
    for (Node operand : operands) {
      checkState(mayBeExpression(operand), operand);
      boolOp.addChildToBack(operand);
    }
    return boolOp;
  }

  public static Node unaryOp(String op, Node operand) {
    checkState(mayBeExpression(operand), operand);
    return Node.newString(Token.UNARY_OP, op, operand);
  }

  public static Node not(Node operand) {
    checkState(mayBeExpression(operand), operand);
    return new Node(Token.NOT, operand);
  }

  public static Node compare(Node left, String op, Node right) {
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return Node.newString(Token.COMPARE, op, left, right);
  }

  public static Node yield() {
    return new Node(Token.YIELD);
  }

  public static Node yield(Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.YIELD, value);
  }

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  private static boolean isAssignmentTarget(Node n) {
    switch (n.getToken()) {
      case ASSIGN_NAME:
      case ASSIGN_ATTR:
      case SUBSCRIPT:
        return true;
      case TUPLE:
      case LIST:
        for (Node child : n.children()) {
          if (!isAssignmentTarget(child)) {
            return false;
          }
        }
        return true;
      default:
        return false;
    }
  }

  // It isn't possible to always determine if a detached node is an expression, so just check for
  // the known statements and structural nodes.
  private static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case MODULE:
      case BLOCK:
      case DECORATORS:
      case BASES:
      case PARAM_LIST:
      case IF_BRANCH:
      case EXCEPT_HANDLER:
      case IMPORT_SPEC:
      case COMP_FOR:
      case EMPTY:
      case ASSIGN_NAME:
      case ASSIGN_ATTR:
        return false;
      default:
        return !n.isStatement();
    }
  }
}
