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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import org.jspecify.nullness.Nullable;

/**
 * This class implements the root of the program tree.
 *
 * <p>A node exclusively owns its children, which are kept as a first-child / next-sibling chain.
 * The parent is a plain back-reference; the root of a tree is a {@link Token#MODULE} node and is
 * the only node without a parent.
 *
 * <p>Nodes of the scope kinds ({@link Token#MODULE}, {@link Token#CLASS}, {@link
 * Token#FUNCTION}, {@link Token#LAMBDA} and {@link Token#GENEXPR}) additionally own a table of
 * local bindings, populated by the tree builder through {@link #setLocal}.
 */
public class Node implements InferredValue {

  enum Prop {
    // Docstring of a module, class or function
    DOC,
    // The "as" name of an IMPORT_SPEC
    ALIAS,
    // The module a FROM statement imports from
    MODULE_NAME,
  }

  private static final Set<Token> STATEMENT_TOKENS =
      Sets.immutableEnumSet(
          Token.CLASS,
          Token.FUNCTION,
          Token.ASSIGN,
          Token.AUG_ASSIGN,
          Token.EXPR_STMT,
          Token.IF,
          Token.WHILE,
          Token.FOR,
          Token.TRY_EXCEPT,
          Token.TRY_FINALLY,
          Token.WITH,
          Token.RETURN,
          Token.RAISE,
          Token.ASSERT,
          Token.PASS,
          Token.BREAK,
          Token.CONTINUE,
          Token.DELETE,
          Token.GLOBAL,
          Token.IMPORT,
          Token.FROM);

  private static final Set<Token> FRAME_TOKENS =
      Sets.immutableEnumSet(Token.MODULE, Token.FUNCTION, Token.CLASS);

  private static final Set<Token> SCOPE_TOKENS =
      Sets.immutableEnumSet(
          Token.MODULE, Token.FUNCTION, Token.CLASS, Token.LAMBDA, Token.GENEXPR);

  private static final int UNCOMPUTED = Integer.MIN_VALUE;

  private final Token token;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  // The previous sibling; for the first child this is the last child.
  private @Nullable Node previous;

  private int lineno = -1;
  private int toLineno = -1;

  private int cachedSourceLine = UNCOMPUTED;
  private int cachedLastSourceLine = UNCOMPUTED;

  private @Nullable EnumMap<Prop, Object> props;

  private final @Nullable Map<String, List<Node>> locals;
  private final @Nullable Map<String, List<Node>> instanceAttributes;

  private static final class StringNode extends Node {

    private final String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str);
    }

    @Override
    public String getString() {
      return str;
    }
  }

  private static final class ConstNode extends Node {

    private final @Nullable Object value;

    ConstNode(Token token, @Nullable Object value) {
      super(token);
      this.value = value;
    }

    @Override
    public @Nullable Object getConstValue() {
      return value;
    }

    @Override
    public boolean eq(@Nullable Object other) {
      return Objects.equals(value, other);
    }
  }

  public Node(Token token) {
    this.token = checkNotNull(token);
    this.locals = SCOPE_TOKENS.contains(token) ? new LinkedHashMap<>() : null;
    this.instanceAttributes = token == Token.CLASS ? new LinkedHashMap<>() : null;
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  public static Node newString(Token token, String str, Node... children) {
    Node n = new StringNode(token, str);
    for (Node child : children) {
      n.addChildToBack(child);
    }
    return n;
  }

  /**
   * Creates a constant node. {@code value} is null for {@link Token#NONE}, a {@link Boolean} for
   * {@link Token#TRUE} and {@link Token#FALSE}, and a number or string for {@link Token#CONST}.
   */
  public static Node newConst(Token token, @Nullable Object value) {
    checkArgument(
        token == Token.CONST || token == Token.NONE || token == Token.TRUE || token == Token.FALSE,
        token);
    return new ConstNode(token, value);
  }

  public final Token getToken() {
    return token;
  }

  public String getString() {
    throw new UnsupportedOperationException(this + " is not a string node");
  }

  public @Nullable Object getConstValue() {
    throw new UnsupportedOperationException(this + " is not a constant node");
  }

  /** Whether this node is a constant whose value equals {@code value}. */
  public boolean eq(@Nullable Object value) {
    return false;
  }

  // ==========================================================================
  // Children

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @return The ith child, or null if there are not that many children
   */
  public final @Nullable Node getChildAtIndex(int i) {
    Node n = first;
    while (n != null && i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getIndexOfChild(Node child) {
    int i = 0;
    for (Node n = first; n != null; n = n.next) {
      if (n == child) {
        return i;
      }
      i++;
    }
    return -1;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child != this && !child.parentOf(this), "Cannot add %s below itself", child);

    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
    child.invalidateSourceLines();
  }

  /**
   * Return an iterable object that iterates over this node's children, in source order. The
   * iterator does not support the optional operation {@link Iterator#remove()}.
   */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    }
    Node start = first;
    return () -> new SiblingNodeIterator(start);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.next;
      return n;
    }
  }

  /**
   * Returns a lazy, depth-first, pre-order sequence of this node and its descendants whose token
   * is in {@code tokens}. A descendant whose token is in {@code skip} is reported if it matches,
   * but its own children are not visited. Each call to {@code iterator()} starts an independent
   * traversal.
   */
  public final Iterable<Node> nodesOfClass(Set<Token> tokens, Set<Token> skip) {
    checkNotNull(tokens);
    checkNotNull(skip);
    return () -> new PreOrderIterator(this, tokens, skip);
  }

  public final Iterable<Node> nodesOfClass(Set<Token> tokens) {
    return nodesOfClass(tokens, EnumSet.noneOf(Token.class));
  }

  private static final class PreOrderIterator extends AbstractIterator<Node> {
    private final Node root;
    private final Set<Token> tokens;
    private final Set<Token> skip;
    private final Deque<Node> stack = new ArrayDeque<>();

    PreOrderIterator(Node root, Set<Token> tokens, Set<Token> skip) {
      this.root = root;
      this.tokens = tokens;
      this.skip = skip;
      stack.push(root);
    }

    @Override
    protected Node computeNext() {
      while (!stack.isEmpty()) {
        Node n = stack.pop();
        if (n == root || !skip.contains(n.token)) {
          for (Node c = n.getLastChild(); c != null; c = c.getPrevious()) {
            stack.push(c);
          }
        }
        if (tokens.contains(n.token)) {
          return n;
        }
      }
      return endOfData();
    }
  }

  // ==========================================================================
  // Parents, statements, frames and scopes

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  /** Whether this node appears in the parent chain of {@code node}. */
  public final boolean parentOf(Node node) {
    for (Node p = node.parent; p != null; p = p.parent) {
      if (p == this) {
        return true;
      }
    }
    return false;
  }

  public final boolean isStatement() {
    return STATEMENT_TOKENS.contains(token);
  }

  /** Whether this node owns a local binding table used for name binding targets. */
  public final boolean isFrame() {
    return FRAME_TOKENS.contains(token);
  }

  /** Whether this node owns a local binding table. */
  public final boolean isScope() {
    return SCOPE_TOKENS.contains(token);
  }

  /** Returns this node if it is a statement, otherwise the nearest enclosing statement. */
  public final Node statement() {
    Node n = this;
    while (!n.isStatement()) {
      checkState(n.parent != null, "No statement encloses %s", this);
      n = n.parent;
    }
    return n;
  }

  /** Returns the nearest module, function or class, starting with this node. */
  public final Node frame() {
    Node n = this;
    while (!n.isFrame()) {
      checkState(n.parent != null, "No frame encloses %s", this);
      n = n.parent;
    }
    return n;
  }

  /** Returns the nearest module, function, class, lambda or generator expression. */
  public final Node scope() {
    Node n = this;
    while (!n.isScope()) {
      checkState(n.parent != null, "No scope encloses %s", this);
      n = n.parent;
    }
    return n;
  }

  public final Node root() {
    Node n = this;
    while (n.parent != null) {
      n = n.parent;
    }
    return n;
  }

  /** Returns the statement following the statement enclosing this node, or null. */
  public final @Nullable Node getNextSibling() {
    Node stmt = statement();
    checkState(stmt.parent != null, "Statement %s has no parent", stmt);
    return stmt.next;
  }

  /** Returns the statement preceding the statement enclosing this node, or null. */
  public final @Nullable Node getPreviousSibling() {
    Node stmt = statement();
    checkState(stmt.parent != null, "Statement %s has no parent", stmt);
    return stmt.getPrevious();
  }

  /**
   * Registers {@code binding} as a binding of {@code name} in the nearest local binding table,
   * starting with this node. Only the tree builder calls this.
   */
  public final void setLocal(String name, Node binding) {
    checkArgument(!name.isEmpty());
    Node owner = this;
    while (owner.locals == null) {
      checkState(owner.parent != null, "No scope encloses %s", this);
      owner = owner.parent;
    }
    owner.locals.computeIfAbsent(name, k -> new ArrayList<>()).add(binding);
  }

  /** Returns the statements binding {@code name} in this scope node, in registration order. */
  public final ImmutableList<Node> getLocal(String name) {
    checkState(locals != null, "%s has no local bindings", this);
    List<Node> bindings = locals.get(name);
    return bindings == null ? ImmutableList.of() : ImmutableList.copyOf(bindings);
  }

  public final boolean hasLocal(String name) {
    checkState(locals != null, "%s has no local bindings", this);
    return locals.containsKey(name);
  }

  public final Set<String> getLocalNames() {
    checkState(locals != null, "%s has no local bindings", this);
    return Collections.unmodifiableSet(locals.keySet());
  }

  /** Registers an attribute assigned on instances of this class, e.g. {@code self.x = 1}. */
  public final void setInstanceAttribute(String name, Node binding) {
    checkState(instanceAttributes != null, "%s is not a class", this);
    instanceAttributes.computeIfAbsent(name, k -> new ArrayList<>()).add(binding);
  }

  public final ImmutableList<Node> getInstanceAttribute(String name) {
    checkState(instanceAttributes != null, "%s is not a class", this);
    List<Node> bindings = instanceAttributes.get(name);
    return bindings == null ? ImmutableList.of() : ImmutableList.copyOf(bindings);
  }

  /**
   * Returns the candidate with the greatest source line not after this node's line, or null.
   * Candidates must come from this node's tree in non-decreasing line order.
   */
  public final @Nullable Node nearest(Iterable<Node> candidates) {
    Node myRoot = root();
    int myLine = getSourceLine();
    Node nearest = null;
    int nearestLine = 0;
    for (Node candidate : candidates) {
      checkArgument(candidate.root() == myRoot, "not from the same module %s %s", this, candidate);
      int line = candidate.getSourceLine();
      if (line > myLine) {
        break;
      }
      if (line > nearestLine) {
        nearest = candidate;
        nearestLine = line;
      }
    }
    return nearest;
  }

  // ==========================================================================
  // Line numbers

  public final int getLineno() {
    return lineno;
  }

  /** Sets the line of this node; a negative line means the node has none. */
  @CanIgnoreReturnValue
  public final Node setLineno(int lineno) {
    this.lineno = lineno < 0 ? -1 : lineno;
    invalidateSourceLines();
    return this;
  }

  /** The last line of this node as reported by the parser, or -1. */
  public final int getToLineno() {
    return toLineno;
  }

  @CanIgnoreReturnValue
  public final Node setToLineno(int toLineno) {
    this.toLineno = toLineno;
    invalidateLastSourceLine();
    return this;
  }

  /**
   * Returns the line where this node appears. Not every node carries a line number: such nodes
   * take the line of their first descendant that has one, or else of their nearest ancestor
   * that has one.
   */
  public final int getSourceLine() {
    if (cachedSourceLine != UNCOMPUTED) {
      return cachedSourceLine;
    }
    int line = getLineno();
    for (Node n = first; line < 0 && n != null; n = n.first) {
      line = n.getLineno();
    }
    for (Node n = parent; line < 0 && n != null; n = n.parent) {
      line = n.getLineno();
    }
    if (line < 0) {
      line = 0;
    }
    cachedSourceLine = line;
    return line;
  }

  /** Returns the last line of this node including its children. Computed once, then cached. */
  public final int getLastSourceLine() {
    if (cachedLastSourceLine != UNCOMPUTED) {
      return cachedLastSourceLine;
    }
    int line = Math.max(getSourceLine(), toLineno);
    for (Node n = first; n != null; n = n.next) {
      line = Math.max(line, n.getLastSourceLine());
    }
    cachedLastSourceLine = line;
    return line;
  }

  // The line of a node feeds the source lines of its ancestors, through the first-descendant
  // fallback, and of its descendants, through the ancestor fallback.
  private void invalidateSourceLines() {
    invalidateSubtree();
    for (Node n = parent; n != null; n = n.parent) {
      n.cachedSourceLine = UNCOMPUTED;
      n.cachedLastSourceLine = UNCOMPUTED;
    }
  }

  private void invalidateSubtree() {
    cachedSourceLine = UNCOMPUTED;
    cachedLastSourceLine = UNCOMPUTED;
    for (Node c = first; c != null; c = c.next) {
      c.invalidateSubtree();
    }
  }

  // A to-line can only raise the last line of the node and its ancestors.
  private void invalidateLastSourceLine() {
    for (Node n = this; n != null && n.cachedLastSourceLine != UNCOMPUTED; n = n.parent) {
      n.cachedLastSourceLine = UNCOMPUTED;
    }
  }

  /** Returns the line span of the block of this statement which contains {@code lineno}. */
  public final BlockRange getBlockRange(int lineno) {
    return BlockRanges.blockRange(this, lineno);
  }

  // ==========================================================================
  // Properties

  private @Nullable Object getProp(Prop prop) {
    return props == null ? null : props.get(prop);
  }

  private void putProp(Prop prop, @Nullable Object value) {
    if (value == null) {
      if (props != null) {
        props.remove(prop);
      }
      return;
    }
    if (props == null) {
      props = new EnumMap<>(Prop.class);
    }
    props.put(prop, value);
  }

  public final @Nullable String getDocString() {
    return (String) getProp(Prop.DOC);
  }

  @CanIgnoreReturnValue
  public final Node setDocString(@Nullable String doc) {
    checkState(isScope(), "%s cannot carry a docstring", this);
    putProp(Prop.DOC, doc);
    return this;
  }

  public final @Nullable String getAlias() {
    return (String) getProp(Prop.ALIAS);
  }

  final void setAlias(@Nullable String alias) {
    checkState(token == Token.IMPORT_SPEC, this);
    putProp(Prop.ALIAS, alias);
  }

  public final String getModuleName() {
    checkState(token == Token.FROM, this);
    return (String) checkNotNull(getProp(Prop.MODULE_NAME));
  }

  final void setModuleName(String moduleName) {
    checkState(token == Token.FROM, this);
    putProp(Prop.MODULE_NAME, moduleName);
  }

  /**
   * Returns the dotted name of a module, class or function, made of the names of the frames
   * enclosing it.
   */
  public final String getQualifiedName() {
    checkState(isFrame(), "%s has no qualified name", this);
    if (parent == null) {
      return getString();
    }
    return parent.frame().getQualifiedName() + "." + getString();
  }

  // ==========================================================================
  // Token predicates

  public final boolean isModule() {
    return token == Token.MODULE;
  }

  public final boolean isClass() {
    return token == Token.CLASS;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isLambda() {
    return token == Token.LAMBDA;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isAssignName() {
    return token == Token.ASSIGN_NAME;
  }

  public final boolean isTupleOrList() {
    return token == Token.TUPLE || token == Token.LIST;
  }

  public final boolean isImport() {
    return token == Token.IMPORT;
  }

  public final boolean isFrom() {
    return token == Token.FROM;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (this instanceof StringNode) {
      sb.append(' ').append(getString());
    } else if (this instanceof ConstNode && token == Token.CONST) {
      sb.append(' ').append(getConstValue());
    }
    int lineno = getLineno();
    if (lineno != -1) {
      sb.append(' ').append(lineno);
    }
    return sb.toString();
  }
}
