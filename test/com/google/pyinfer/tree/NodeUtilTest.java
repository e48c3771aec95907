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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.pyinfer.tree.NodeUtil.FunctionKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeUtilTest {

  private static Node method(String name, Node decorators) {
    return IR.function(name, decorators, IR.paramList(IR.param("self")), IR.block(IR.pass()));
  }

  @Test
  public void testFunctionKind() {
    Node function = IR.function("f", IR.paramList(), IR.block(IR.pass()));
    Node method = method("m", IR.decorators());
    Node staticMethod = method("s", IR.decorators(IR.name("staticmethod")));
    Node classMethod = method("c", IR.decorators(IR.name("classmethod")));
    Node nested = IR.function("inner", IR.paramList(), IR.block(IR.pass()));
    Node withNested = IR.function("outer", IR.paramList(), IR.block(nested));
    IR.module(
        "m",
        function,
        IR.classNode(
            "C", IR.bases(), IR.block(method, staticMethod, classMethod, withNested)));

    assertThat(NodeUtil.getFunctionKind(function)).isEqualTo(FunctionKind.FUNCTION);
    assertThat(NodeUtil.getFunctionKind(method)).isEqualTo(FunctionKind.METHOD);
    assertThat(NodeUtil.getFunctionKind(staticMethod)).isEqualTo(FunctionKind.STATICMETHOD);
    assertThat(NodeUtil.getFunctionKind(classMethod)).isEqualTo(FunctionKind.CLASSMETHOD);
    assertThat(NodeUtil.getFunctionKind(nested)).isEqualTo(FunctionKind.FUNCTION);
    assertThat(FunctionKind.STATICMETHOD.toString()).isEqualTo("staticmethod");
  }

  @Test
  public void testIsGenerator() {
    Node generator =
        IR.function("g", IR.paramList(), IR.block(IR.exprStmt(IR.yield(IR.constant(1)))));
    Node nestedYield =
        IR.function(
            "f",
            IR.paramList(),
            IR.block(
                IR.function("inner", IR.paramList(), IR.block(IR.exprStmt(IR.yield()))),
                IR.exprStmt(IR.lambda(IR.paramList(), IR.yield()))));

    assertThat(NodeUtil.isGenerator(generator)).isTrue();
    assertThat(NodeUtil.isGenerator(nestedYield)).isFalse();
  }

  @Test
  public void testGetReturns() {
    Node outer = IR.returnNode(IR.constant(1));
    Node bare = IR.returnNode();
    Node fn =
        IR.function(
            "f",
            IR.paramList(),
            IR.block(
                IR.ifNode(IR.name("a"), IR.block(outer)),
                IR.function(
                    "inner", IR.paramList(), IR.block(IR.returnNode(IR.constant(2)))),
                bare));

    assertThat(NodeUtil.getReturns(fn)).containsExactly(outer, bare).inOrder();
  }

  @Test
  public void testGetElseBlock() {
    Node ifElse = IR.block(IR.pass());
    Node ifNode = IR.ifNode(IR.name("a"), IR.block(IR.pass()), ifElse);
    Node whileElse = IR.block(IR.pass());
    Node whileNode = IR.whileNode(IR.name("a"), IR.block(IR.pass()), whileElse);
    Node forElse = IR.block(IR.pass());
    Node forNode =
        IR.forNode(IR.assignName("i"), IR.name("a"), IR.block(IR.pass()), forElse);
    Node finallyBlock = IR.block(IR.pass());
    Node tryFinally = IR.tryFinally(IR.block(IR.pass()), finallyBlock);
    Node tryExcept =
        IR.tryExcept(
            IR.block(IR.pass()),
            ImmutableList.of(IR.exceptHandler(null, null, IR.block(IR.pass()))),
            null);

    assertThat(NodeUtil.getElseBlock(ifNode)).isSameInstanceAs(ifElse);
    assertThat(NodeUtil.getElseBlock(whileNode)).isSameInstanceAs(whileElse);
    assertThat(NodeUtil.getElseBlock(forNode)).isSameInstanceAs(forElse);
    assertThat(NodeUtil.getElseBlock(tryFinally)).isSameInstanceAs(finallyBlock);
    assertThat(NodeUtil.getElseBlock(tryExcept)).isNull();
    assertThat(NodeUtil.getElseBlock(IR.ifNode(IR.name("a"), IR.block()))).isNull();
  }

  @Test
  public void testParameterIndex() {
    Node b = IR.param("b");
    IR.paramList(IR.param("a"), b);
    assertThat(NodeUtil.getParameterIndex(b)).isEqualTo(1);
  }
}
