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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.pyinfer.tree.InferredValue;
import com.google.pyinfer.tree.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.nullness.Nullable;

/**
 * The state carried along one inference request: the name being resolved, the arguments and
 * receiver of the call being evaluated, and the path of (node, name) pairs currently being
 * inferred, which is what stops inference from looping on recursive definitions.
 *
 * <p>This class is not thread-safe.
 */
public final class InferenceContext {

  private record PathEntry(Node node, @Nullable String lookupName) {}

  private final @Nullable Node startingNode;
  private final List<PathEntry> path;
  private @Nullable String lookupName;
  private @Nullable CallContext callContext;
  private @Nullable InferredValue boundNode;

  public InferenceContext() {
    this(null);
  }

  public InferenceContext(@Nullable Node startingNode) {
    this(startingNode, new ArrayList<>());
  }

  private InferenceContext(@Nullable Node startingNode, List<PathEntry> path) {
    this.startingNode = startingNode;
    this.path = path;
  }

  /** The node the request started from, for diagnostics. */
  public @Nullable Node getStartingNode() {
    return startingNode;
  }

  /**
   * Records that {@code node} is being inferred for the current lookup name.
   *
   * @return false if that pair is already being inferred, in which case the caller must not
   *     recurse and produces no further values
   */
  public boolean push(Node node) {
    PathEntry entry = new PathEntry(checkNotNull(node), lookupName);
    if (path.contains(entry)) {
      return false;
    }
    path.add(entry);
    return true;
  }

  /** Removes the most recently pushed pair. */
  public void pop() {
    checkState(!path.isEmpty(), "pop() without push()");
    path.remove(path.size() - 1);
  }

  /** Whether {@code node} is being inferred for the current lookup name. */
  public boolean isInferring(Node node) {
    return path.contains(new PathEntry(node, lookupName));
  }

  public int getPathDepth() {
    return path.size();
  }

  /**
   * Returns a context for a sub-resolution. The path, call context and bound node are copied, so
   * pairs already being inferred are still detected while pairs the copy pushes stay out of this
   * context. The lookup name is not copied.
   */
  public InferenceContext cloneContext() {
    InferenceContext clone = new InferenceContext(startingNode, new ArrayList<>(path));
    clone.callContext = callContext;
    clone.boundNode = boundNode;
    return clone;
  }

  public @Nullable String getLookupName() {
    return lookupName;
  }

  public void setLookupName(@Nullable String lookupName) {
    this.lookupName = lookupName;
  }

  public @Nullable CallContext getCallContext() {
    return callContext;
  }

  public void setCallContext(@Nullable CallContext callContext) {
    this.callContext = callContext;
  }

  /** The receiver of the bound method whose call is being inferred, if any. */
  public @Nullable InferredValue getBoundNode() {
    return boundNode;
  }

  public void setBoundNode(@Nullable InferredValue boundNode) {
    this.boundNode = boundNode;
  }
}
