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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.pyinfer.tree.IR;
import com.google.pyinfer.tree.InferredValue;
import com.google.pyinfer.tree.Node;
import com.google.pyinfer.tree.NodeUtil;
import com.google.pyinfer.tree.Token;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.nullness.Nullable;

/**
 * Infers the values an expression or a name binding may have at runtime, without running the
 * program.
 *
 * <p>Every query returns a lazy {@link ValueStream}. Nodes that reference other nodes (names,
 * assignment targets, attribute reads, calls, imports) record themselves in the {@link
 * InferenceContext} path while they are being inferred, and produce nothing when they are
 * reached again for the same name, so recursive definitions and import cycles terminate.
 * Candidates that cannot be inferred are reported as {@link Unknown} rather than failing the
 * whole query.
 */
public final class Inference {

  private static final Logger logger = Logger.getLogger(Inference.class.getName());

  private static final Splitter DOT = Splitter.on('.');

  private final ModuleResolver moduleResolver;
  private final InferenceOptions options;
  private final Attributes attributes;

  // The value of calls to functions that do not return anything.
  private final Node noneValue = IR.constant(null);

  public Inference(ModuleResolver moduleResolver) {
    this(moduleResolver, new InferenceOptions());
  }

  public Inference(ModuleResolver moduleResolver, InferenceOptions options) {
    this.moduleResolver = checkNotNull(moduleResolver);
    this.options = checkNotNull(options);
    this.attributes = new Attributes(this, options);
  }

  public InferenceOptions getOptions() {
    return options;
  }

  Attributes attributes() {
    return attributes;
  }

  /** Returns an instance of class {@code cls}. */
  public Instance instanceOf(Node cls) {
    return new Instance(this, cls);
  }

  public ValueStream infer(InferredValue value) {
    return infer(value, null);
  }

  /**
   * Infers the values of {@code value}. Proxies and {@link Unknown} are their own value.
   *
   * @param context the context of the enclosing query, or null to start a new one
   */
  public ValueStream infer(InferredValue value, @Nullable InferenceContext context) {
    if (!(value instanceof Node)) {
      return ValueStream.of(value);
    }
    Node n = (Node) value;
    InferenceContext ctx = context != null ? context : new InferenceContext(n);
    switch (n.getToken()) {
      case MODULE:
      case CLASS:
      case FUNCTION:
      case LAMBDA:
      case GENEXPR:
      case CONST:
      case NONE:
      case TRUE:
      case FALSE:
      case TUPLE:
      case LIST:
      case DICT:
        return ValueStream.of(n);
      case NAME:
        return guarded(n, ctx, c -> inferName(n, c));
      case ASSIGN_NAME:
      case ASSIGN_ATTR:
        return guarded(n, ctx, c -> inferAssigned(n, c));
      case GETATTR:
        return guarded(n, ctx, c -> inferGetAttr(n, c));
      case CALL:
        return guarded(n, ctx, c -> inferCall(n, c));
      case SUBSCRIPT:
        return guarded(n, ctx, c -> inferSubscript(n, c));
      case BOOL_OP:
        return ValueStream.concat(
            Iterators.transform(n.children().iterator(), operand -> infer(operand, ctx)));
      case BINARY_OP:
      case UNARY_OP:
      case NOT:
      case COMPARE:
      case YIELD:
        return ValueStream.of(Unknown.INSTANCE);
      case IMPORT:
        return guarded(n, ctx, c -> inferImport(n, c));
      case FROM:
        return guarded(n, ctx, c -> inferFrom(n, c));
      case GLOBAL:
        return guarded(n, ctx, c -> inferGlobal(n, c));
      case TRY_EXCEPT:
        return guarded(n, ctx, c -> inferTryExcept(n, c));
      default:
        return ValueStream.failed(new InferenceException("cannot infer " + n));
    }
  }

  /**
   * Infers the values of a name bound by several statements. Each candidate is inferred in turn:
   * candidates whose name cannot be resolved are skipped, candidates that cannot be inferred
   * contribute {@link Unknown}. The result fails if no candidate produced anything.
   *
   * @param statements the binding statements, in source order
   * @param context the context carrying the name being resolved; it is cloned, not modified
   * @param frame the frame the statements were found in
   */
  public ValueStream inferStatements(
      Iterable<? extends InferredValue> statements,
      @Nullable InferenceContext context,
      @Nullable InferredValue frame) {
    String name = context != null ? context.getLookupName() : null;
    InferenceContext statementContext =
        context != null ? context.cloneContext() : new InferenceContext();
    return new StatementsStream(statements.iterator(), statementContext, name, frame);
  }

  private final class StatementsStream extends ValueStream {
    private final Iterator<? extends InferredValue> statements;
    private final InferenceContext context;
    private final @Nullable String name;
    private final @Nullable InferredValue frame;

    private @Nullable InferredValue statement;
    private @Nullable ValueStream values;
    private boolean inferred;

    StatementsStream(
        Iterator<? extends InferredValue> statements,
        InferenceContext context,
        @Nullable String name,
        @Nullable InferredValue frame) {
      this.statements = statements;
      this.context = context;
      this.name = name;
      this.frame = frame;
    }

    @Override
    protected @Nullable InferredValue advance() {
      while (true) {
        if (values != null) {
          if (values.hasNext()) {
            inferred = true;
            return values.next();
          }
          AnalysisException failure = values.getFailure();
          values = null;
          if (failure instanceof UnresolvableNameException
              || failure instanceof NotFoundException) {
            if (logger.isLoggable(Level.FINER)) {
              logger.finer("Skipping " + statement + ": " + failure.getMessage());
            }
          } else if (failure != null) {
            logger.log(Level.FINE, "Cannot infer " + statement, failure);
            inferred = true;
            return Unknown.INSTANCE;
          }
        }
        if (!statements.hasNext()) {
          if (inferred) {
            return null;
          }
          return fail(
              new InferenceException(
                  "cannot infer " + (name != null ? name : String.valueOf(statement))));
        }
        statement = statements.next();
        if (statement == Unknown.INSTANCE) {
          inferred = true;
          return statement;
        }
        context.setLookupName(lookupNameFor(statement, frame, name));
        values = infer(statement, context);
      }
    }
  }

  // Import-like statements need to know which of their names is being resolved.
  private static @Nullable String lookupNameFor(
      InferredValue statement, @Nullable InferredValue frame, @Nullable String name) {
    if (statement instanceof Node) {
      Node n = (Node) statement;
      switch (n.getToken()) {
        case FROM:
        case IMPORT:
        case GLOBAL:
        case TRY_EXCEPT:
          return name;
        case FUNCTION:
        case LAMBDA:
          return n == frame ? name : null;
        default:
          break;
      }
    }
    return null;
  }

  private record InstanceKey(Node cls) {}

  /**
   * Infers {@code n} through {@code body} unless {@code n} is already being inferred for the
   * current lookup name. Values are de-duplicated, instances by their class.
   *
   * <p>The body runs on a copy of {@code context} that records {@code n}, so the caller's path is
   * the same whether the result is drained, abandoned or fails.
   */
  private ValueStream guarded(
      Node n, InferenceContext context, Function<InferenceContext, ValueStream> body) {
    return new ValueStream() {
      private final Set<Object> seen = new HashSet<>();
      private @Nullable ValueStream values;

      @Override
      protected @Nullable InferredValue advance() {
        if (values == null) {
          InferenceContext guardContext = context.cloneContext();
          guardContext.setLookupName(context.getLookupName());
          if (!guardContext.push(n)) {
            if (logger.isLoggable(Level.FINE)) {
              logger.fine("Inference cycle on " + n + " for " + context.getLookupName());
            }
            return null;
          }
          values = body.apply(guardContext);
        }
        while (values.hasNext()) {
          InferredValue value = values.next();
          Object key =
              value instanceof Instance ? new InstanceKey(((Instance) value).getProxied()) : value;
          if (seen.add(key)) {
            return value;
          }
        }
        return values.getFailure() != null ? fail(values.getFailure()) : null;
      }
    };
  }

  // ==========================================================================
  // Names

  private record Lookup(Node scope, ImmutableList<Node> bindings) {}

  private ValueStream inferName(Node n, InferenceContext context) {
    String name = n.getString();
    Lookup lookup = lookup(n, name);
    if (lookup == null) {
      return ValueStream.failed(new UnresolvableNameException(name));
    }
    InferenceContext nameContext = context.cloneContext();
    nameContext.setLookupName(name);
    return inferStatements(lookup.bindings(), nameContext, lookup.scope());
  }

  /**
   * Finds the bindings of {@code name} visible from {@code n}: the enclosing scopes from the
   * innermost out, then the builtins module. The body of a class is only visible from the class
   * body itself.
   */
  private @Nullable Lookup lookup(Node n, String name) {
    Node start = lookupScope(n);
    for (Node scope = start; scope != null; scope = enclosingScope(scope)) {
      if (scope.isClass() && scope != start) {
        continue;
      }
      if (scope.hasLocal(name)) {
        return new Lookup(scope, scope.getLocal(name));
      }
    }
    if (options.isLookupBuiltins()) {
      Node builtins = builtinsModule();
      if (builtins != null && builtins != n.root() && builtins.hasLocal(name)) {
        return new Lookup(builtins, builtins.getLocal(name));
      }
    }
    return null;
  }

  // Decorators, default values and base classes are evaluated in the scope enclosing the
  // definition.
  private static @Nullable Node lookupScope(Node n) {
    Node scope = n.scope();
    if (((scope.isFunction() || scope.isLambda())
            && !isWithin(n, NodeUtil.getFunctionBody(scope)))
        || (scope.isClass() && isWithin(n, NodeUtil.getClassBases(scope)))) {
      return enclosingScope(scope);
    }
    return scope;
  }

  private static @Nullable Node enclosingScope(Node scope) {
    Node parent = scope.getParent();
    return parent != null ? parent.scope() : null;
  }

  private static boolean isWithin(Node n, Node ancestor) {
    return n == ancestor || ancestor.parentOf(n);
  }

  private @Nullable Node builtinsModule() {
    return moduleResolver.resolveModule(options.getBuiltinsModuleName()).orElse(null);
  }

  // ==========================================================================
  // Assignment targets

  private ValueStream inferAssigned(Node target, InferenceContext context) {
    Node parent = target.getParent();
    checkState(parent != null, "Detached assignment target %s", target);
    switch (parent.getToken()) {
      case ASSIGN:
        checkState(parent.getLastChild() != target, "%s is not a target", target);
        return infer(parent.getLastChild(), context);
      case TUPLE:
      case LIST:
        return inferUnpacked(target, context);
      case FOR:
      case COMP_FOR:
        return inferLoopTarget(parent, ImmutableList.of(), context);
      case PARAM_LIST:
        return inferParameter(target, context);
      case EXCEPT_HANDLER:
        return inferHandlerValues(parent, context);
      case AUG_ASSIGN:
      case WITH:
        return ValueStream.of(Unknown.INSTANCE);
      default:
        return ValueStream.failed(
            new InferenceException("cannot infer the value assigned to " + target));
    }
  }

  /** Infers a target nested in a tuple or list target, by its position in the unpacked value. */
  private ValueStream inferUnpacked(Node target, InferenceContext context) {
    List<Integer> indices = new ArrayList<>();
    Node n = target;
    while (n.getParent().isTupleOrList()) {
      indices.add(0, n.getParent().getIndexOfChild(n));
      n = n.getParent();
    }
    Node owner = n.getParent();
    ImmutableList<Integer> path = ImmutableList.copyOf(indices);
    switch (owner.getToken()) {
      case ASSIGN:
        return ValueStream.flatMap(
            infer(owner.getLastChild(), context), value -> select(value, path, context));
      case FOR:
      case COMP_FOR:
        return inferLoopTarget(owner, path, context);
      default:
        return ValueStream.failed(new InferenceException("cannot unpack into " + target));
    }
  }

  // Each element of a literal sequence is a value of the loop target.
  private ValueStream inferLoopTarget(Node loop, List<Integer> path, InferenceContext context) {
    return ValueStream.flatMap(
        infer(loop.getSecondChild(), context),
        sequence -> {
          if (sequence instanceof Node && ((Node) sequence).isTupleOrList()) {
            return ValueStream.concat(
                Iterators.transform(
                    ((Node) sequence).children().iterator(),
                    element ->
                        ValueStream.flatMap(
                            infer(element, context), value -> select(value, path, context))));
          }
          return ValueStream.of(Unknown.INSTANCE);
        });
  }

  private ValueStream select(InferredValue value, List<Integer> path, InferenceContext context) {
    if (path.isEmpty()) {
      return ValueStream.of(value);
    }
    if (value instanceof Node && ((Node) value).isTupleOrList()) {
      Node element = ((Node) value).getChildAtIndex(path.get(0));
      if (element != null) {
        List<Integer> rest = path.subList(1, path.size());
        return ValueStream.flatMap(infer(element, context), v -> select(v, rest, context));
      }
    }
    return ValueStream.of(Unknown.INSTANCE);
  }

  /**
   * Infers a parameter: the receiver of a method, the argument of the call being inferred, or the
   * default value.
   */
  private ValueStream inferParameter(Node param, InferenceContext context) {
    Node fn = param.getParent().getParent();
    int index = NodeUtil.getParameterIndex(param);
    int receivers = 0;
    if (fn.isFunction()) {
      switch (NodeUtil.getFunctionKind(fn)) {
        case METHOD:
          if (index == 0) {
            InferredValue bound = context.getBoundNode();
            return ValueStream.of(
                bound instanceof Instance ? bound : instanceOf(fn.getParent().frame()));
          }
          receivers = 1;
          break;
        case CLASSMETHOD:
          if (index == 0) {
            return ValueStream.of(fn.getParent().frame());
          }
          receivers = 1;
          break;
        default:
          break;
      }
    }
    CallContext call = context.getCallContext();
    int argIndex = index - receivers;
    if (call != null && argIndex < call.getArgs().size()) {
      // Arguments are evaluated where the call is, not in the callee.
      InferenceContext argContext = context.cloneContext();
      argContext.setCallContext(null);
      argContext.setBoundNode(null);
      return infer(call.getArgs().get(argIndex), argContext);
    }
    Node defaultValue = NodeUtil.getDefaultValue(param);
    if (defaultValue != null) {
      return infer(defaultValue, context);
    }
    return ValueStream.failed(
        new InferenceException("cannot infer parameter " + param.getString()));
  }

  // The name of an except clause is bound to an instance of the caught class.
  private ValueStream inferHandlerValues(Node handler, InferenceContext context) {
    Node type = handler.getFirstChild();
    if (type.isEmpty()) {
      return ValueStream.of(Unknown.INSTANCE);
    }
    return ValueStream.flatMap(
        infer(type, context), value -> exceptionInstances(value, context));
  }

  private ValueStream exceptionInstances(InferredValue value, InferenceContext context) {
    if (value instanceof Node) {
      Node n = (Node) value;
      if (n.isClass()) {
        return ValueStream.of(instanceOf(n));
      } else if (n.isTupleOrList()) {
        return ValueStream.concat(
            Iterators.transform(
                n.children().iterator(),
                element ->
                    ValueStream.flatMap(
                        infer(element, context), v -> exceptionInstances(v, context))));
      }
    }
    return ValueStream.of(Unknown.INSTANCE);
  }

  // ==========================================================================
  // Attributes, calls and subscripts

  private ValueStream inferGetAttr(Node n, InferenceContext context) {
    String attr = n.getString();
    return ValueStream.flatMapLenient(
        infer(n.getFirstChild(), context),
        owner -> {
          InferenceContext ownerContext = context.cloneContext();
          ownerContext.setBoundNode(owner);
          return inferAttribute(owner, attr, ownerContext);
        },
        () -> new InferenceException("cannot infer " + n.getFirstChild() + "." + attr));
  }

  /**
   * Infers the values of attribute {@code name} of {@code owner}. Constants and literal
   * containers answer as instances of their builtin class.
   */
  public ValueStream inferAttribute(
      InferredValue owner, String name, @Nullable InferenceContext context) {
    if (owner instanceof Proxy) {
      return ((Proxy) owner).inferredGetAttr(name, context);
    } else if (!(owner instanceof Node)) {
      return ValueStream.of(Unknown.INSTANCE);
    }
    Node n = (Node) owner;
    switch (n.getToken()) {
      case MODULE:
        return attributes.moduleInferredAttr(n, name, context);
      case CLASS:
        return attributes.classInferredAttr(n, name, context);
      case FUNCTION:
      case LAMBDA:
        return attributes.functionInferredAttr(n, name, context);
      default:
        Node cls = builtinClass(n);
        if (cls == null) {
          return ValueStream.failed(new InferenceException("cannot infer " + n + "." + name));
        }
        return instanceOf(cls).inferredGetAttr(name, context);
    }
  }

  /** The class of a constant or literal container, from the builtins module. */
  @Nullable Node builtinClass(Node n) {
    String className = builtinClassName(n);
    Node builtins = builtinsModule();
    if (className == null || builtins == null) {
      return null;
    }
    return Iterables.find(builtins.getLocal(className), Node::isClass, null);
  }

  private static @Nullable String builtinClassName(Node n) {
    switch (n.getToken()) {
      case NONE:
        return "NoneType";
      case TRUE:
      case FALSE:
        return "bool";
      case TUPLE:
        return "tuple";
      case LIST:
        return "list";
      case DICT:
        return "dict";
      case CONST:
        {
          Object value = n.getConstValue();
          if (value instanceof String) {
            return "str";
          }
          return value instanceof Double || value instanceof Float ? "float" : "int";
        }
      default:
        return null;
    }
  }

  private ValueStream inferCall(Node n, InferenceContext context) {
    InferenceContext callContext = context.cloneContext();
    callContext.setCallContext(
        CallContext.create(ImmutableList.copyOf(Iterables.skip(n.children(), 1))));
    callContext.setBoundNode(null);
    return ValueStream.flatMapLenient(
        infer(n.getFirstChild(), context),
        callee -> inferCallResult(callee, n, callContext),
        () -> new InferenceException("cannot infer result of " + n));
  }

  /**
   * Infers the results of calling {@code callee}. Classes produce instances, functions their
   * return values, bound methods the return values with the receiver bound.
   *
   * @param caller the call expression
   * @param context a context whose call context holds the arguments
   */
  public ValueStream inferCallResult(
      InferredValue callee, Node caller, InferenceContext context) {
    if (callee == Unknown.INSTANCE) {
      return ValueStream.of(Unknown.INSTANCE);
    } else if (callee instanceof Instance) {
      return ((Instance) callee).inferCallResult(caller, context);
    } else if (callee instanceof InstanceMethod) {
      InstanceMethod method = (InstanceMethod) callee;
      InferenceContext methodContext = context.cloneContext();
      methodContext.setBoundNode(method.getReceiver());
      return functionCallResult(method.getFunction(), methodContext);
    } else if (callee instanceof Node) {
      Node n = (Node) callee;
      switch (n.getToken()) {
        case CLASS:
          return ValueStream.of(instanceOf(n));
        case FUNCTION:
          return functionCallResult(n, context);
        case LAMBDA:
          return infer(NodeUtil.getFunctionBody(n), context);
        default:
          break;
      }
    }
    return ValueStream.failed(new InferenceException(callee + " is not callable"));
  }

  @CheckReturnValue
  private ValueStream functionCallResult(Node fn, InferenceContext context) {
    if (NodeUtil.isGenerator(fn)) {
      return ValueStream.of(new Generator(this, fn));
    }
    ImmutableList<Node> returns = ImmutableList.copyOf(NodeUtil.getReturns(fn));
    if (returns.isEmpty()) {
      return ValueStream.of(noneValue);
    }
    return ValueStream.concat(
        Iterators.transform(
            returns.iterator(),
            ret ->
                ret.hasChildren()
                    ? ValueStream.recover(infer(ret.getFirstChild(), context), Unknown.INSTANCE)
                    : ValueStream.of(noneValue)));
  }

  private ValueStream inferSubscript(Node n, InferenceContext context) {
    Node index = n.getSecondChild();
    return ValueStream.flatMap(
        infer(n.getFirstChild(), context),
        container ->
            ValueStream.flatMap(
                infer(index, context), key -> subscriptValue(container, key, context)));
  }

  private ValueStream subscriptValue(
      InferredValue container, InferredValue key, InferenceContext context) {
    if (container instanceof Node && key instanceof Node) {
      Node c = (Node) container;
      Node k = (Node) key;
      if (c.isTupleOrList() && k.getToken() == Token.CONST) {
        Object value = k.getConstValue();
        if (value instanceof Integer || value instanceof Long) {
          long i = ((Number) value).longValue();
          if (i < 0) {
            i += c.getChildCount();
          }
          if (i >= 0 && i < c.getChildCount()) {
            return infer(c.getChildAtIndex((int) i), context);
          }
        }
      } else if (c.getToken() == Token.DICT && isConstant(k)) {
        for (Node entry = c.getFirstChild(); entry != null; entry = entry.getNext().getNext()) {
          if (isConstant(entry) && entry.eq(k.getConstValue())) {
            return infer(entry.getNext(), context);
          }
        }
      }
    }
    return ValueStream.of(Unknown.INSTANCE);
  }

  private static boolean isConstant(Node n) {
    switch (n.getToken()) {
      case CONST:
      case NONE:
      case TRUE:
      case FALSE:
        return true;
      default:
        return false;
    }
  }

  // ==========================================================================
  // Imports, globals and exception handlers

  private ValueStream inferImport(Node n, InferenceContext context) {
    String name = context.getLookupName();
    if (name == null) {
      return ValueStream.failed(new InferenceException("no name to infer for " + n));
    }
    String realName;
    try {
      realName = realName(n, name);
    } catch (NotFoundException e) {
      return ValueStream.failed(e);
    }
    return importModule(n, realName);
  }

  /** Infers the module imported by {@code importNode} under its real dotted name. */
  public ValueStream inferNameModule(Node importNode, String name) {
    checkArgument(importNode.isImport(), importNode);
    return importModule(importNode, name);
  }

  private ValueStream importModule(Node importNode, String moduleName) {
    Node root = importNode.root();
    if (root.isModule() && root.getString().equals(moduleName)) {
      return ValueStream.of(root);
    }
    Optional<Node> module = moduleResolver.resolveModule(moduleName);
    if (!module.isPresent()) {
      return ValueStream.failed(new InferenceException("cannot import " + moduleName));
    }
    return ValueStream.of(module.get());
  }

  /**
   * Maps a name bound by an import statement back to the imported name: the alias of an {@code
   * as} clause to the imported name, the first component of a dotted import to itself.
   *
   * @throws NotFoundException if {@code importNode} does not bind {@code asName}
   */
  public static String realName(Node importNode, String asName) {
    checkArgument(importNode.isImport() || importNode.isFrom(), importNode);
    for (Node spec : importNode.children()) {
      String name = spec.getString();
      if (name.equals("*")) {
        return asName;
      }
      String alias = spec.getAlias();
      if (alias == null) {
        name = DOT.split(name).iterator().next();
        alias = name;
      }
      if (alias.equals(asName)) {
        return name;
      }
    }
    throw new NotFoundException(asName);
  }

  private ValueStream inferFrom(Node n, InferenceContext context) {
    String name = context.getLookupName();
    if (name == null) {
      return ValueStream.failed(new InferenceException("no name to infer for " + n));
    }
    String realName;
    try {
      realName = realName(n, name);
    } catch (NotFoundException e) {
      return ValueStream.failed(e);
    }
    return ValueStream.flatMap(
        importModule(n, n.getModuleName()),
        module -> {
          ImmutableList<Node> bindings;
          try {
            bindings = attributes.moduleGetAttr((Node) module, realName);
          } catch (NotFoundException e) {
            return ValueStream.failed(new InferenceException(name));
          }
          InferenceContext fromContext = context.cloneContext();
          fromContext.setLookupName(realName);
          return inferStatements(bindings, fromContext, module);
        });
  }

  private ValueStream inferGlobal(Node n, InferenceContext context) {
    String name = context.getLookupName();
    if (name == null) {
      return ValueStream.failed(new InferenceException("no name to infer for " + n));
    }
    Node root = n.root();
    ImmutableList<Node> bindings;
    try {
      bindings = attributes.moduleGetAttr(root, name);
    } catch (NotFoundException e) {
      return ValueStream.failed(new InferenceException(name));
    }
    return inferStatements(bindings, context, root);
  }

  private ValueStream inferTryExcept(Node n, InferenceContext context) {
    String name = context.getLookupName();
    if (name == null) {
      return ValueStream.failed(new InferenceException("no name to infer for " + n));
    }
    List<Node> handlers = new ArrayList<>();
    for (Node child : n.children()) {
      if (child.getToken() == Token.EXCEPT_HANDLER) {
        Node handlerName = child.getSecondChild();
        if (handlerName.isAssignName() && handlerName.getString().equals(name)) {
          handlers.add(child);
        }
      }
    }
    return ValueStream.failIfEmpty(
        ValueStream.concat(
            Iterators.transform(
                handlers.iterator(), handler -> inferHandlerValues(handler, context))),
        () -> new InferenceException(name));
  }
}
