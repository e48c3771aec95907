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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.pyinfer.tree.InferredValue;
import com.google.pyinfer.tree.Node;
import com.google.pyinfer.tree.NodeUtil;
import org.jspecify.nullness.Nullable;

/** An instance of a class. */
public final class Instance extends Proxy {

  Instance(Inference inference, Node cls) {
    super(inference, cls);
    checkArgument(cls.isClass(), cls);
  }

  /**
   * Looks up the bindings of attribute {@code name}: the attributes assigned on instances of the
   * class or its ancestors, then {@code __class__}, then, if {@code lookupClass} is set, the
   * attributes of the class itself. Instances have no {@code __name__} even though their class
   * does.
   *
   * @throws NotFoundException if nothing binds {@code name}
   */
  public ImmutableList<Node> getAttr(String name, boolean lookupClass) {
    Node cls = getProxied();
    ImmutableList<Node> attrs = inference.attributes().instanceAttr(cls, name);
    if (!attrs.isEmpty()) {
      return attrs;
    }
    if (name.equals("__class__")) {
      return ImmutableList.of(cls);
    }
    if (name.equals("__name__") || !lookupClass) {
      throw new NotFoundException(name);
    }
    return inference.attributes().classGetAttr(cls, name, null);
  }

  public ImmutableList<Node> getAttr(String name) {
    return getAttr(name, true);
  }

  /**
   * Infers the values of attribute {@code name}, seeing the methods of the class as bound to this
   * instance. Falls back to inferring the attribute on the class.
   */
  @Override
  public ValueStream inferredGetAttr(String name, @Nullable InferenceContext context) {
    ImmutableList<Node> attrs;
    try {
      attrs = getAttr(name, false);
    } catch (NotFoundException e) {
      return ValueStream.map(
          inference.attributes().classInferredAttr(getProxied(), name, context), this::bind);
    }
    return inference.inferStatements(Lists.transform(attrs, this::bind), context, this);
  }

  private InferredValue bind(InferredValue value) {
    if (value instanceof Node) {
      Node n = (Node) value;
      if (n.isFunction() && NodeUtil.getFunctionKind(n) == NodeUtil.FunctionKind.METHOD) {
        return new InstanceMethod(inference, n, this);
      }
    }
    return value;
  }

  /** Infers the results of calling this instance, through its class's {@code __call__}. */
  public ValueStream inferCallResult(Node caller, InferenceContext context) {
    InferenceContext callContext = context.cloneContext();
    callContext.setBoundNode(this);
    ValueStream results =
        ValueStream.flatMap(
            inference.attributes().classInferredAttr(getProxied(), "__call__", context),
            callee -> inference.inferCallResult(callee, caller, callContext));
    return ValueStream.failIfEmpty(
        results, () -> new InferenceException("cannot infer result of calling " + this));
  }

  @Override
  public boolean isCallable() {
    return inference.attributes().classDefines(getProxied(), "__call__");
  }

  @Override
  public String pytype() {
    return getProxied().getQualifiedName();
  }

  @Override
  public String toString() {
    Node cls = getProxied();
    return "Instance of " + cls.root().getString() + "." + cls.getString();
  }
}
