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

package com.google.pyinfer.infer;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.pyinfer.tree.BindingCollector;
import com.google.pyinfer.tree.IR;
import com.google.pyinfer.tree.InferredValue;
import com.google.pyinfer.tree.Node;
import com.google.pyinfer.tree.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Inference}. */
@RunWith(JUnit4.class)
public final class InferenceTest {

  private final MapModuleResolver resolver = new MapModuleResolver();
  private final InferenceOptions options = new InferenceOptions();
  private final Inference inference = new Inference(resolver, options);

  private Node module(String name, Node... stmts) {
    Node module = IR.module(name, stmts);
    new BindingCollector().process(module);
    resolver.register(module);
    return module;
  }

  private ImmutableList<InferredValue> infer(Node n) {
    return inference.infer(n).toList();
  }

  private static Node onlyNode(ImmutableList<InferredValue> values) {
    return (Node) Iterables.getOnlyElement(values);
  }

  private static Node assign(String name, Node value) {
    return IR.assign(IR.assignName(name), value);
  }

  private static Node function(String name, Node params, Node... body) {
    return IR.function(name, params, IR.block(body));
  }

  private static Node classNode(String name, Node... body) {
    return IR.classNode(name, IR.bases(), IR.block(body));
  }

  @Test
  public void testTerminalsInferToThemselves() {
    Node one = IR.constant(1);
    Node fn = function("f", IR.paramList(), IR.pass());
    module("m", IR.exprStmt(one), fn);

    assertThat(infer(one)).containsExactly(one);
    assertThat(infer(fn)).containsExactly(fn);
  }

  @Test
  public void testAllAssignmentsInSourceOrder() {
    Node one = IR.constant(1);
    Node two = IR.constant(2);
    Node three = IR.constant(3);
    Node x = IR.name("x");
    module("m", assign("x", one), assign("x", two), assign("x", three), IR.exprStmt(x));

    assertThat(infer(x)).containsExactly(one, two, three).inOrder();
  }

  @Test
  public void testMutuallyReferentialAssignmentsTerminate() {
    Node a = IR.name("a");
    module("m", assign("a", IR.name("b")), assign("b", IR.name("a")), IR.exprStmt(a));

    assertThat(infer(a)).containsExactly(Unknown.INSTANCE);
  }

  @Test
  public void testSelfReferentialAssignmentTerminates() {
    Node x = IR.name("x");
    Node one = IR.constant(1);
    module("m", assign("x", one), assign("x", IR.name("x")), IR.exprStmt(x));

    assertThat(infer(x)).contains(one);
  }

  @Test
  public void testUnresolvableName() {
    Node missing = IR.name("missing");
    module("m", IR.exprStmt(missing));

    assertThrows(UnresolvableNameException.class, () -> infer(missing));
  }

  @Test
  public void testUnresolvableCandidateIsSkipped() {
    Node one = IR.constant(1);
    Node x = IR.name("x");
    module("m", assign("x", one), assign("x", IR.name("missing")), IR.exprStmt(x));

    assertThat(infer(x)).containsExactly(one);
  }

  @Test
  public void testFailingCandidateBecomesUnknown() {
    Node one = IR.constant(1);
    Node x = IR.name("x");
    module("lib", assign("value", IR.constant(42)));
    module(
        "m",
        IR.importNode(IR.importSpec("lib")),
        assign("x", one),
        assign("x", IR.getattr(IR.name("lib"), "missing")),
        IR.exprStmt(x));

    assertThat(infer(x)).containsExactly(one, Unknown.INSTANCE).inOrder();
  }

  @Test
  public void testTupleUnpacking() {
    Node one = IR.constant(1);
    Node two = IR.constant(2);
    Node b = IR.name("b");
    module(
        "m",
        IR.assign(IR.tuple(IR.assignName("a"), IR.assignName("b")), IR.tuple(one, two)),
        IR.exprStmt(b));

    assertThat(infer(b)).containsExactly(two);
  }

  @Test
  public void testLoopTarget() {
    Node one = IR.constant(1);
    Node two = IR.constant(2);
    Node i = IR.name("i");
    module(
        "m",
        IR.forNode(IR.assignName("i"), IR.list(one, two), IR.block(IR.pass())),
        IR.exprStmt(i));

    assertThat(infer(i)).containsExactly(one, two).inOrder();
  }

  @Test
  public void testLoopOverUnknownSequence() {
    Node i = IR.name("i");
    module(
        "m",
        IR.forNode(
            IR.assignName("i"), IR.binaryOp(IR.name("a"), "+", IR.name("b")), IR.block()),
        IR.exprStmt(i));

    assertThat(infer(i)).containsExactly(Unknown.INSTANCE);
  }

  @Test
  public void testUnknownAbsorbsAttributesAndCalls() {
    Node attr = IR.getattr(IR.binaryOp(IR.name("a"), "+", IR.name("b")), "attr");
    Node call = IR.call(IR.binaryOp(IR.name("a"), "+", IR.name("b")));
    module("m", IR.exprStmt(attr), IR.exprStmt(call));

    assertThat(infer(attr)).containsExactly(Unknown.INSTANCE);
    assertThat(infer(call)).containsExactly(Unknown.INSTANCE);
  }

  @Test
  public void testStoppingEarlyLeavesContextUntouched() {
    Node one = IR.constant(1);
    Node two = IR.constant(2);
    Node x = IR.name("x");
    module("m", assign("x", one), assign("x", two), IR.exprStmt(x));
    InferenceContext context = new InferenceContext(x);

    assertThat(inference.infer(x, context).next()).isSameInstanceAs(one);
    assertThat(context.getPathDepth()).isEqualTo(0);
    assertThat(inference.infer(x, context).toList()).containsExactly(one, two).inOrder();
  }

  @Test
  public void testFailedQueryLeavesContextUntouched() {
    Node five = IR.constant(5);
    Node first = IR.subscript(IR.name("y"), IR.constant(0));
    module(
        "m",
        assign("y", IR.tuple(five)),
        assign("y", IR.tuple(IR.call(IR.constant(1)))),
        IR.exprStmt(first));
    InferenceContext context = new InferenceContext(first);

    assertThrows(InferenceException.class, () -> inference.infer(first, context).toList());
    assertThat(context.getPathDepth()).isEqualTo(0);
    assertThrows(InferenceException.class, () -> inference.infer(first, context).toList());
  }

  @Test
  public void testFunctionCall() {
    Node one = IR.constant(1);
    Node call = IR.call(IR.name("f"));
    module("m", function("f", IR.paramList(), IR.returnNode(one)), IR.exprStmt(call));

    assertThat(infer(call)).containsExactly(one);
  }

  @Test
  public void testCallArgumentsBindParameters() {
    Node two = IR.constant(2);
    Node call = IR.call(IR.name("f"), two);
    module(
        "m",
        function("f", IR.paramList(IR.param("a")), IR.returnNode(IR.name("a"))),
        IR.exprStmt(call));

    assertThat(infer(call)).containsExactly(two);
  }

  @Test
  public void testDefaultParameterValue() {
    Node three = IR.constant(3);
    Node call = IR.call(IR.name("f"));
    module(
        "m",
        function("f", IR.paramList(IR.param("a", three)), IR.returnNode(IR.name("a"))),
        IR.exprStmt(call));

    assertThat(infer(call)).containsExactly(three);
  }

  @Test
  public void testMissingArgumentIsUnknown() {
    Node call = IR.call(IR.name("f"));
    module(
        "m",
        function("f", IR.paramList(IR.param("a")), IR.returnNode(IR.name("a"))),
        IR.exprStmt(call));

    assertThat(infer(call)).containsExactly(Unknown.INSTANCE);
  }

  @Test
  public void testFunctionWithoutReturnValueReturnsNone() {
    Node call = IR.call(IR.name("f"));
    Node bare = IR.call(IR.name("g"));
    module(
        "m",
        function("f", IR.paramList(), IR.pass()),
        function("g", IR.paramList(), IR.returnNode()),
        IR.exprStmt(call),
        IR.exprStmt(bare));

    assertThat(onlyNode(infer(call)).getToken()).isEqualTo(Token.NONE);
    assertThat(onlyNode(infer(bare)).getToken()).isEqualTo(Token.NONE);
  }

  @Test
  public void testRecursiveFunctionTerminates() {
    Node call = IR.call(IR.name("f"), IR.constant(1));
    module(
        "m",
        function(
            "f",
            IR.paramList(IR.param("n")),
            IR.returnNode(IR.call(IR.name("f"), IR.name("n")))),
        IR.exprStmt(call));

    assertThat(infer(call)).containsExactly(Unknown.INSTANCE);
  }

  @Test
  public void testGeneratorCall() {
    Node call = IR.call(IR.name("g"));
    Node g = function("g", IR.paramList(), IR.exprStmt(IR.yield(IR.constant(1))));
    module("m", g, IR.exprStmt(call));

    Generator generator = (Generator) Iterables.getOnlyElement(infer(call));
    assertThat(generator.getFunction()).isSameInstanceAs(g);
    assertThat(generator.pytype()).isEqualTo("__builtin__.generator");
    assertThat(generator.isCallable()).isTrue();
    assertThat(generator.toString()).isEqualTo("Generator g");
  }

  @Test
  public void testLambdaCall() {
    Node seven = IR.constant(7);
    Node call = IR.call(IR.lambda(IR.paramList(), seven));
    module("m", IR.exprStmt(call));

    assertThat(infer(call)).containsExactly(seven);
  }

  @Test
  public void testClassCallYieldsInstance() {
    Node cls = classNode("C", IR.pass());
    Node call = IR.call(IR.name("C"));
    module("m", cls, IR.exprStmt(call));

    Instance instance = (Instance) Iterables.getOnlyElement(infer(call));
    assertThat(instance.getProxied()).isSameInstanceAs(cls);
  }

  @Test
  public void testInstancesOfOneClassAreReportedOnce() {
    Node x = IR.name("x");
    module(
        "m",
        classNode("C", IR.pass()),
        assign("x", IR.call(IR.name("C"))),
        assign("x", IR.call(IR.name("C"))),
        IR.exprStmt(x));

    assertThat(infer(x)).hasSize(1);
  }

  @Test
  public void testMethodCallBindsReceiver() {
    Node one = IR.constant(1);
    Node init =
        function(
            "__init__",
            IR.paramList(IR.param("self")),
            IR.assign(IR.assignAttr(IR.name("self"), "v"), one));
    Node get =
        function(
            "get",
            IR.paramList(IR.param("self")),
            IR.returnNode(IR.getattr(IR.name("self"), "v")));
    Node call = IR.call(IR.getattr(IR.call(IR.name("C")), "get"));
    module("m", classNode("C", init, get), IR.exprStmt(call));

    assertThat(infer(call)).containsExactly(one);
  }

  @Test
  public void testMethodArgumentsSkipTheReceiver() {
    Node five = IR.constant(5);
    Node echo =
        function(
            "echo",
            IR.paramList(IR.param("self"), IR.param("value")),
            IR.returnNode(IR.name("value")));
    Node call = IR.call(IR.getattr(IR.call(IR.name("C")), "echo"), five);
    module("m", classNode("C", echo), IR.exprStmt(call));

    assertThat(infer(call)).containsExactly(five);
  }

  @Test
  public void testClassAttribute() {
    Node five = IR.constant(5);
    Node classAttr = IR.getattr(IR.name("C"), "x");
    Node instanceAttr = IR.getattr(IR.call(IR.name("C")), "x");
    module(
        "m",
        classNode("C", assign("x", five)),
        IR.exprStmt(classAttr),
        IR.exprStmt(instanceAttr));

    assertThat(infer(classAttr)).containsExactly(five);
    assertThat(infer(instanceAttr)).containsExactly(five);
  }

  @Test
  public void testInheritedAttributes() {
    Node one = IR.constant(1);
    Node two = IR.constant(2);
    Node a =
        classNode(
            "A",
            assign("x", one),
            function(
                "__init__",
                IR.paramList(IR.param("self")),
                IR.assign(IR.assignAttr(IR.name("self"), "y"), two)));
    Node b = IR.classNode("B", IR.bases(IR.name("A")), IR.block(IR.pass()));
    Node classAttr = IR.getattr(IR.name("B"), "x");
    Node instanceAttr = IR.getattr(IR.call(IR.name("B")), "y");
    module("m", a, b, IR.exprStmt(classAttr), IR.exprStmt(instanceAttr));

    assertThat(infer(classAttr)).containsExactly(one);
    assertThat(infer(instanceAttr)).containsExactly(two);
  }

  @Test
  public void testCyclicBasesTerminate() {
    Node attr = IR.getattr(IR.name("A"), "missing");
    module(
        "m",
        IR.classNode("A", IR.bases(IR.name("B")), IR.block(IR.pass())),
        IR.classNode("B", IR.bases(IR.name("A")), IR.block(IR.pass())),
        IR.exprStmt(attr));

    assertThrows(InferenceException.class, () -> infer(attr));
  }

  @Test
  public void testSpecialClassAttributes() {
    Node name = IR.getattr(IR.name("C"), "__name__");
    Node module = IR.getattr(IR.name("C"), "__module__");
    module("pkg", classNode("C", IR.pass()), IR.exprStmt(name), IR.exprStmt(module));

    assertThat(onlyNode(infer(name)).eq("C")).isTrue();
    assertThat(onlyNode(infer(module)).eq("pkg")).isTrue();
  }

  @Test
  public void testDescriptorReadThroughClassIsUnknown() {
    Node descriptor =
        classNode(
            "D",
            function(
                "__get__",
                IR.paramList(IR.param("self"), IR.param("obj"), IR.param("type")),
                IR.pass()));
    Node attr = IR.getattr(IR.name("C"), "attr");
    module(
        "m",
        descriptor,
        classNode("C", assign("attr", IR.call(IR.name("D")))),
        IR.exprStmt(attr));

    assertThat(infer(attr)).containsExactly(Unknown.INSTANCE);

    options.setResolveDescriptors(false);
    Instance instance = (Instance) Iterables.getOnlyElement(infer(attr));
    assertThat(instance.getProxied()).isSameInstanceAs(descriptor);
  }

  @Test
  public void testSubscript() {
    Node one = IR.constant(1);
    Node two = IR.constant(2);
    Node three = IR.constant(3);
    Node index = IR.subscript(IR.name("t"), IR.constant(1));
    Node negative = IR.subscript(IR.name("t"), IR.constant(-2));
    Node outOfRange = IR.subscript(IR.name("t"), IR.constant(5));
    Node key = IR.subscript(IR.name("d"), IR.constant("k"));
    module(
        "m",
        assign("t", IR.tuple(one, two)),
        assign("d", IR.dict(IR.constant("k"), three)),
        IR.exprStmt(index),
        IR.exprStmt(negative),
        IR.exprStmt(outOfRange),
        IR.exprStmt(key));

    assertThat(infer(index)).containsExactly(two);
    assertThat(infer(negative)).containsExactly(one);
    assertThat(infer(outOfRange)).containsExactly(Unknown.INSTANCE);
    assertThat(infer(key)).containsExactly(three);
  }

  @Test
  public void testBoolOpYieldsEveryOperand() {
    Node one = IR.constant(1);
    Node two = IR.constant(2);
    Node or = IR.boolOp("or", one, two);
    module("m", IR.exprStmt(or));

    assertThat(infer(or)).containsExactly(one, two).inOrder();
  }

  @Test
  public void testOperatorsAreUnknown() {
    Node sum = IR.binaryOp(IR.constant(1), "+", IR.constant(2));
    module("m", IR.exprStmt(sum));

    assertThat(infer(sum)).containsExactly(Unknown.INSTANCE);
  }

  @Test
  public void testImport() {
    Node os = module("os");
    Node ref = IR.name("os");
    module("m", IR.importNode(IR.importSpec("os")), IR.exprStmt(ref));

    assertThat(infer(ref)).containsExactly(os);
  }

  @Test
  public void testImportAlias() {
    Node path = module("os.path");
    Node importNode = IR.importNode(IR.importSpec("os.path", "p"));
    Node ref = IR.name("p");
    module("m", importNode, IR.exprStmt(ref));

    assertThat(infer(ref)).containsExactly(path);
    assertThat(Inference.realName(importNode, "p")).isEqualTo("os.path");
    assertThat(inference.inferNameModule(importNode, "os.path").toList()).containsExactly(path);
    assertThrows(NotFoundException.class, () -> Inference.realName(importNode, "os"));
  }

  @Test
  public void testDottedImportBindsFirstComponent() {
    Node importNode = IR.importNode(IR.importSpec("os.path"));
    module("m", importNode);

    assertThat(Inference.realName(importNode, "os")).isEqualTo("os");
  }

  @Test
  public void testImportOfUnknownModuleFails() {
    Node ref = IR.name("nowhere");
    module("m", IR.importNode(IR.importSpec("nowhere")), IR.exprStmt(ref));

    assertThat(infer(ref)).containsExactly(Unknown.INSTANCE);
  }

  @Test
  public void testFromImport() {
    Node value = IR.constant(42);
    module("lib", assign("value", value));
    Node ref = IR.name("v");
    module("m", IR.fromImport("lib", IR.importSpec("value", "v")), IR.exprStmt(ref));

    assertThat(infer(ref)).containsExactly(value);
  }

  @Test
  public void testCircularFromImportsTerminate() {
    Node ref = IR.name("x");
    module("a", IR.fromImport("b", IR.importSpec("x")), IR.exprStmt(ref));
    module("b", IR.fromImport("a", IR.importSpec("x")));

    assertThat(infer(ref)).containsExactly(Unknown.INSTANCE);
  }

  @Test
  public void testModuleAttribute() {
    Node value = IR.constant(42);
    module("lib", assign("value", value));
    Node attr = IR.getattr(IR.name("lib"), "value");
    Node name = IR.getattr(IR.name("lib"), "__name__");
    module("m", IR.importNode(IR.importSpec("lib")), IR.exprStmt(attr), IR.exprStmt(name));

    assertThat(infer(attr)).containsExactly(value);
    assertThat(onlyNode(infer(name)).eq("lib")).isTrue();
  }

  @Test
  public void testGlobalDeclaration() {
    Node two = IR.constant(2);
    Node call = IR.call(IR.name("f"));
    module(
        "m",
        function(
            "f",
            IR.paramList(),
            IR.global("x"),
            assign("x", two),
            IR.returnNode(IR.name("x"))),
        IR.exprStmt(call));

    assertThat(infer(call)).containsExactly(two);
  }

  @Test
  public void testExceptHandlerName() {
    Node error = classNode("Error", IR.pass());
    Node ref = IR.name("e");
    module(
        "m",
        error,
        IR.tryExcept(
            IR.block(IR.pass()),
            ImmutableList.of(
                IR.exceptHandler(IR.name("Error"), IR.assignName("e"), IR.block(IR.pass()))),
            null),
        IR.exprStmt(ref));

    Instance instance = (Instance) Iterables.getOnlyElement(infer(ref));
    assertThat(instance.getProxied()).isSameInstanceAs(error);
  }

  @Test
  public void testBuiltins() {
    Node len = function("len", IR.paramList(IR.param("obj")), IR.returnNode(IR.constant(0)));
    Node intClass =
        classNode(
            "int",
            function(
                "bit_length",
                IR.paramList(IR.param("self")),
                IR.returnNode(IR.name("self"))));
    module("__builtin__", len, intClass);
    Node ref = IR.name("len");
    Node call = IR.call(IR.getattr(IR.constant(5), "bit_length"));
    module("m", IR.exprStmt(ref), IR.exprStmt(call));

    assertThat(infer(ref)).containsExactly(len);
    Instance instance = (Instance) Iterables.getOnlyElement(infer(call));
    assertThat(instance.getProxied()).isSameInstanceAs(intClass);
    assertThat(instance.pytype()).isEqualTo("__builtin__.int");

    options.setLookupBuiltins(false);
    assertThrows(UnresolvableNameException.class, () -> infer(ref));
  }

  @Test
  public void testClassBodyIsNotVisibleFromMethods() {
    Node ref = IR.name("x");
    Node call = IR.call(IR.getattr(IR.call(IR.name("C")), "m"));
    module(
        "m",
        assign("x", IR.constant("global")),
        classNode(
            "C",
            assign("x", IR.constant("class")),
            function("m", IR.paramList(IR.param("self")), IR.returnNode(ref))),
        IR.exprStmt(call));

    assertThat(onlyNode(infer(call)).eq("global")).isTrue();
  }

  @Test
  public void testDefaultValuesAreEvaluatedInEnclosingScope() {
    Node ref = IR.name("a");
    Node call = IR.call(IR.name("f"));
    module(
        "m",
        assign("a", IR.constant("outer")),
        function("f", IR.paramList(IR.param("a", ref)), IR.returnNode(IR.name("a"))),
        IR.exprStmt(call));

    assertThat(onlyNode(infer(ref)).eq("outer")).isTrue();
    assertThat(onlyNode(infer(call)).eq("outer")).isTrue();
  }

  @Test
  public void testStructuralNodesCannotBeInferred() {
    Node pass = IR.pass();
    module("m", pass);

    assertThrows(InferenceException.class, () -> infer(pass));
  }

  @Test
  public void testInferStatements() {
    Node one = IR.constant(1);
    Node two = IR.constant(2);

    assertThat(
            inference
                .inferStatements(ImmutableList.of(one, Unknown.INSTANCE, two), null, null)
                .toList())
        .containsExactly(one, Unknown.INSTANCE, two)
        .inOrder();
    assertThrows(
        InferenceException.class,
        () -> inference.inferStatements(ImmutableList.of(), null, null).toList());
  }
}
