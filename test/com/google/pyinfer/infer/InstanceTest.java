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

import com.google.common.collect.Iterables;
import com.google.pyinfer.tree.BindingCollector;
import com.google.pyinfer.tree.IR;
import com.google.pyinfer.tree.InferredValue;
import com.google.pyinfer.tree.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Instance} and {@link InstanceMethod}. */
@RunWith(JUnit4.class)
public final class InstanceTest {

  private final MapModuleResolver resolver = new MapModuleResolver();
  private final Inference inference = new Inference(resolver);

  private Node cls;
  private Node init;
  private Node get;
  private Node helper;
  private Instance instance;

  @Before
  public void setUp() {
    init =
        IR.function(
            "__init__",
            IR.paramList(IR.param("self")),
            IR.block(IR.assign(IR.assignAttr(IR.name("self"), "v"), IR.constant(1))));
    get =
        IR.function(
            "get",
            IR.paramList(IR.param("self")),
            IR.block(IR.returnNode(IR.getattr(IR.name("self"), "v"))));
    helper =
        IR.function(
            "helper",
            IR.decorators(IR.name("staticmethod")),
            IR.paramList(),
            IR.block(IR.returnNode(IR.constant(2))));
    cls =
        IR.classNode(
            "C",
            IR.bases(),
            IR.block(
                IR.assign(IR.assignName("__name__"), IR.constant("other")),
                IR.assign(IR.assignName("x"), IR.constant(5)),
                init,
                get,
                helper));
    Node module = IR.module("m", cls);
    new BindingCollector().process(module);
    resolver.register(module);
    instance = inference.instanceOf(cls);
  }

  @Test
  public void testInstanceAttribute() {
    Node assignAttr = Iterables.getOnlyElement(cls.getInstanceAttribute("v"));

    assertThat(instance.getAttr("v", false)).containsExactly(assignAttr);
    assertThat(instance.getAttr("v")).containsExactly(assignAttr);
  }

  @Test
  public void testClassAttributeOnlyWhenLookingUpTheClass() {
    assertThat(instance.getAttr("x")).containsExactlyElementsIn(cls.getLocal("x"));
    assertThrows(NotFoundException.class, () -> instance.getAttr("x", false));
  }

  @Test
  public void testNameIsNotAnInstanceAttribute() {
    NotFoundException e =
        assertThrows(NotFoundException.class, () -> instance.getAttr("__name__"));
    assertThat(e.getName()).isEqualTo("__name__");
  }

  @Test
  public void testClassOfInstance() {
    assertThat(instance.getAttr("__class__")).containsExactly(cls);
    assertThat(instance.getAttr("__class__", false)).containsExactly(cls);
  }

  @Test
  public void testMissingAttribute() {
    assertThrows(NotFoundException.class, () -> instance.getAttr("missing"));
  }

  @Test
  public void testMethodsAreBound() {
    InferredValue value = Iterables.getOnlyElement(instance.inferredGetAttr("get", null).toList());

    InstanceMethod method = (InstanceMethod) value;
    assertThat(method.getFunction()).isSameInstanceAs(get);
    assertThat(method.getReceiver()).isSameInstanceAs(instance);
    assertThat(method.isBound()).isTrue();
    assertThat(method.isCallable()).isTrue();
    assertThat(method.pytype()).isEqualTo("__builtin__.instancemethod");
    assertThat(method.toString()).isEqualTo("Bound method get of m.C");
  }

  @Test
  public void testStaticMethodsAreNotBound() {
    assertThat(instance.inferredGetAttr("helper", null).toList()).containsExactly(helper);
  }

  @Test
  public void testInferredInstanceAttribute() {
    Node value = Iterables.getOnlyElement(cls.getInstanceAttribute("v")).getNext();

    assertThat(instance.inferredGetAttr("v", null).toList()).containsExactly(value);
  }

  @Test
  public void testCallable() {
    Node callable =
        IR.classNode(
            "Callable",
            IR.bases(),
            IR.block(
                IR.function(
                    "__call__",
                    IR.paramList(IR.param("self")),
                    IR.block(IR.returnNode(IR.constant(3))))));
    Node derived = IR.classNode("Derived", IR.bases(IR.name("Callable")), IR.block(IR.pass()));
    Node three = IR.call(IR.call(IR.name("Derived")));
    Node notCallable = IR.call(IR.call(IR.name("C")));
    Node module =
        IR.module(
            "n",
            IR.importNode(IR.importSpec("m")),
            callable,
            derived,
            IR.exprStmt(three),
            IR.assign(IR.assignName("C"), IR.getattr(IR.name("m"), "C")),
            IR.exprStmt(notCallable));
    new BindingCollector().process(module);

    assertThat(instance.isCallable()).isFalse();
    assertThat(inference.instanceOf(callable).isCallable()).isTrue();
    assertThat(inference.instanceOf(derived).isCallable()).isTrue();

    Node result = (Node) Iterables.getOnlyElement(inference.infer(three).toList());
    assertThat(result.eq(3)).isTrue();
    assertThrows(InferenceException.class, () -> inference.infer(notCallable).toList());
  }

  @Test
  public void testTypeNames() {
    assertThat(instance.pytype()).isEqualTo("m.C");
    assertThat(instance.toString()).isEqualTo("Instance of m.C");
    assertThat(instance.getProxied()).isSameInstanceAs(cls);
  }
}
