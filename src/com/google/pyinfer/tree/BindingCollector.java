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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scans a freshly built tree and registers every name binding in the local binding table of the
 * scope it belongs to, and every {@code self.attr = value} assignment of a method as an instance
 * attribute of its class.
 *
 * <p>This is part of building a tree; it must run exactly once per tree, before any inference.
 * This implementation is not thread-safe.
 */
public final class BindingCollector {

  private static final Logger logger = Logger.getLogger(BindingCollector.class.getName());

  private static final Splitter DOT = Splitter.on('.');

  // Names declared "global" by each function.
  private final Map<Node, Set<String>> globalNames = new HashMap<>();

  public void process(Node root) {
    checkArgument(root.isModule() && !root.hasParent(), "Expected a root module, got %s", root);
    scan(root);
  }

  private void scan(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
        collectGlobalNames(n);
        declare(n.getParent(), n.getString(), n);
        break;
      case CLASS:
        declare(n.getParent(), n.getString(), n);
        break;
      case ASSIGN_NAME:
        declareAssignedName(n);
        break;
      case ASSIGN_ATTR:
        declareInstanceAttribute(n);
        break;
      case GLOBAL:
        for (Node name : n.children()) {
          declare(n, name.getString(), n);
        }
        return;
      case IMPORT:
        for (Node spec : n.children()) {
          String alias = spec.getAlias();
          declare(n, alias != null ? alias : DOT.split(spec.getString()).iterator().next(), n);
        }
        return;
      case FROM:
        for (Node spec : n.children()) {
          if (spec.getString().equals("*")) {
            // Names pulled in by a star import are only known once the module is loaded.
            continue;
          }
          String alias = spec.getAlias();
          declare(n, alias != null ? alias : spec.getString(), n);
        }
        return;
      case EXCEPT_HANDLER:
        {
          Node type = n.getFirstChild();
          Node name = type.getNext();
          Node body = name.getNext();
          scan(type);
          if (name.isAssignName()) {
            // The handler name is bound by the whole try statement, once.
            Node tryExcept = n.getParent();
            Node owner = tryExcept.scope();
            if (!owner.getLocal(name.getString()).contains(tryExcept)) {
              declare(tryExcept, name.getString(), tryExcept);
            }
          } else {
            scan(name);
          }
          scan(body);
          return;
        }
      default:
        break;
    }

    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      scan(child);
    }
  }

  private void collectGlobalNames(Node fn) {
    Set<String> names = new LinkedHashSet<>();
    for (Node global :
        NodeUtil.getFunctionBody(fn)
            .nodesOfClass(ImmutableSet.of(Token.GLOBAL), NodeUtil.NESTED_BODIES)) {
      for (Node name : global.children()) {
        names.add(name.getString());
      }
    }
    if (!names.isEmpty()) {
      globalNames.put(fn, names);
    }
  }

  private void declareAssignedName(Node n) {
    String name = n.getString();
    Node owner = n.scope();
    Set<String> globals = globalNames.get(owner);
    if (globals != null && globals.contains(name)) {
      declare(n.root(), name, n);
    } else {
      declare(n, name, n);
    }
  }

  private void declareInstanceAttribute(Node n) {
    Node receiver = n.getFirstChild();
    if (!receiver.isName()) {
      return;
    }
    Node fn = n.scope();
    if (!fn.isFunction() || NodeUtil.getFunctionKind(fn) != NodeUtil.FunctionKind.METHOD) {
      return;
    }
    Node self = Iterables.getFirst(NodeUtil.getFunctionParameters(fn).children(), null);
    if (self == null || !self.getString().equals(receiver.getString())) {
      return;
    }
    Node cls = fn.getParent().frame();
    checkState(cls.isClass(), cls);
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("instance attribute " + cls.getString() + "." + n.getString() + " @ " + n);
    }
    cls.setInstanceAttribute(n.getString(), n);
  }

  private static void declare(Node from, String name, Node binding) {
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("binding " + name + " -> " + binding);
    }
    from.setLocal(name, binding);
  }
}
