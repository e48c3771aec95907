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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.pyinfer.tree.IR;
import com.google.pyinfer.tree.InferredValue;
import com.google.pyinfer.tree.Node;
import com.google.pyinfer.tree.NodeUtil;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.nullness.Nullable;

/**
 * Attribute lookup on modules, classes and functions: which statements bind an attribute, and
 * what values those statements infer to.
 */
final class Attributes {

  private static final Logger logger = Logger.getLogger(Attributes.class.getName());

  private final Inference inference;
  private final InferenceOptions options;

  // Classes whose ancestors are being computed, so that bases referring back to their own class
  // terminate.
  private final Set<Node> ancestorsInProgress = Sets.newIdentityHashSet();

  Attributes(Inference inference, InferenceOptions options) {
    this.inference = inference;
    this.options = options;
  }

  /**
   * The base classes of {@code cls}, depth first, each listed once. Bases that do not infer to a
   * class are left out.
   */
  ImmutableList<Node> ancestors(Node cls, @Nullable InferenceContext context) {
    if (!ancestorsInProgress.add(cls)) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Ancestors of " + cls + " depend on themselves");
      }
      return ImmutableList.of();
    }
    try {
      Set<Node> seen = Sets.newIdentityHashSet();
      seen.add(cls);
      ImmutableList.Builder<Node> ancestors = ImmutableList.builder();
      collectAncestors(cls, context, seen, ancestors);
      return ancestors.build();
    } finally {
      ancestorsInProgress.remove(cls);
    }
  }

  private void collectAncestors(
      Node cls,
      @Nullable InferenceContext context,
      Set<Node> seen,
      ImmutableList.Builder<Node> ancestors) {
    for (Node base : NodeUtil.getClassBases(cls).children()) {
      InferenceContext baseContext =
          context != null ? context.cloneContext() : new InferenceContext(base);
      ValueStream values = inference.infer(base, baseContext);
      while (values.hasNext()) {
        InferredValue value = values.next();
        if (value instanceof Node && ((Node) value).isClass() && seen.add((Node) value)) {
          Node ancestor = (Node) value;
          ancestors.add(ancestor);
          collectAncestors(ancestor, context, seen, ancestors);
        }
      }
      if (values.getFailure() != null) {
        logger.log(Level.FINE, "Cannot infer base " + base + " of " + cls, values.getFailure());
      }
    }
  }

  /**
   * Looks up attribute {@code name} of class {@code cls}: its own bindings, the special
   * attributes {@code __name__}, {@code __doc__} and {@code __module__}, then the bindings of the
   * first ancestor defining it.
   *
   * @throws NotFoundException if neither the class nor its ancestors bind {@code name}
   */
  ImmutableList<Node> classGetAttr(Node cls, String name, @Nullable InferenceContext context) {
    ImmutableList<Node> values = cls.getLocal(name);
    Node special = null;
    switch (name) {
      case "__name__":
        special = IR.constant(cls.getString());
        break;
      case "__doc__":
        special = IR.constant(cls.getDocString());
        break;
      case "__module__":
        special = IR.constant(cls.root().getString());
        break;
      default:
        break;
    }
    if (special != null) {
      return prepend(special, values);
    }
    if (!values.isEmpty()) {
      return values;
    }
    for (Node ancestor : ancestors(cls, context)) {
      if (ancestor.hasLocal(name)) {
        return ancestor.getLocal(name);
      }
    }
    throw new NotFoundException(name);
  }

  /** Whether {@code cls} or one of its ancestors binds {@code name}. */
  boolean classDefines(Node cls, String name) {
    if (cls.hasLocal(name)) {
      return true;
    }
    for (Node ancestor : ancestors(cls, null)) {
      if (ancestor.hasLocal(name)) {
        return true;
      }
    }
    return false;
  }

  /**
   * The assignments of attribute {@code name} on instances of {@code cls} and of its ancestors,
   * possibly none.
   */
  ImmutableList<Node> instanceAttr(Node cls, String name) {
    ImmutableList.Builder<Node> values = ImmutableList.builder();
    values.addAll(cls.getInstanceAttribute(name));
    for (Node ancestor : ancestors(cls, null)) {
      values.addAll(ancestor.getInstanceAttribute(name));
    }
    return values.build();
  }

  ValueStream classInferredAttr(Node cls, String name, @Nullable InferenceContext context) {
    InferenceContext attrContext = attrContext(cls, name, context);
    ImmutableList<Node> bindings;
    try {
      bindings = classGetAttr(cls, name, attrContext);
    } catch (NotFoundException e) {
      return ValueStream.failed(new InferenceException(name));
    }
    ValueStream values = inference.inferStatements(bindings, attrContext, cls);
    return options.isResolveDescriptors() ? ValueStream.map(values, this::resolveDescriptor) : values;
  }

  // The value read through the class is whatever __get__ returns, which is not inferred.
  private InferredValue resolveDescriptor(InferredValue value) {
    if (value instanceof Instance && classDefines(((Instance) value).getProxied(), "__get__")) {
      return Unknown.INSTANCE;
    }
    return value;
  }

  /**
   * Looks up attribute {@code name} of a module: its global bindings and the special attributes
   * {@code __name__} and {@code __doc__}.
   *
   * @throws NotFoundException if the module does not bind {@code name}
   */
  ImmutableList<Node> moduleGetAttr(Node module, String name) {
    ImmutableList<Node> values = module.getLocal(name);
    switch (name) {
      case "__name__":
        return prepend(IR.constant(module.getString()), values);
      case "__doc__":
        return prepend(IR.constant(module.getDocString()), values);
      default:
        if (values.isEmpty()) {
          throw new NotFoundException(name);
        }
        return values;
    }
  }

  ValueStream moduleInferredAttr(Node module, String name, @Nullable InferenceContext context) {
    InferenceContext attrContext = attrContext(module, name, context);
    ImmutableList<Node> bindings;
    try {
      bindings = moduleGetAttr(module, name);
    } catch (NotFoundException e) {
      return ValueStream.failed(new InferenceException(name));
    }
    return inference.inferStatements(bindings, attrContext, module);
  }

  /**
   * Looks up attribute {@code name} of a function or lambda. Only {@code __name__}, {@code
   * __doc__} and {@code __module__} are known.
   *
   * @throws NotFoundException for any other name
   */
  ImmutableList<Node> functionGetAttr(Node fn, String name) {
    switch (name) {
      case "__name__":
        return ImmutableList.of(IR.constant(fn.isLambda() ? "<lambda>" : fn.getString()));
      case "__doc__":
        return ImmutableList.of(IR.constant(fn.getDocString()));
      case "__module__":
        return ImmutableList.of(IR.constant(fn.root().getString()));
      default:
        throw new NotFoundException(name);
    }
  }

  ValueStream functionInferredAttr(Node fn, String name, @Nullable InferenceContext context) {
    InferenceContext attrContext = attrContext(fn, name, context);
    ImmutableList<Node> bindings;
    try {
      bindings = functionGetAttr(fn, name);
    } catch (NotFoundException e) {
      return ValueStream.failed(new InferenceException(name));
    }
    return inference.inferStatements(bindings, attrContext, fn);
  }

  private static InferenceContext attrContext(
      Node owner, String name, @Nullable InferenceContext context) {
    InferenceContext attrContext =
        context != null ? context.cloneContext() : new InferenceContext(owner);
    attrContext.setLookupName(name);
    return attrContext;
  }

  private static ImmutableList<Node> prepend(Node first, ImmutableList<Node> rest) {
    return ImmutableList.<Node>builder().add(first).addAll(rest).build();
  }
}
