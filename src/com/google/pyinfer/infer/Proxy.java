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

import com.google.pyinfer.tree.InferredValue;
import com.google.pyinfer.tree.Node;
import org.jspecify.nullness.Nullable;

/**
 * A runtime value standing for a tree node seen from a different angle: an instance of a class,
 * a function bound to a receiver, or the result of calling a generator function. Attribute reads
 * that the proxy does not answer itself are forwarded to the wrapped node.
 */
public abstract class Proxy implements InferredValue {

  final Inference inference;
  private final Node proxied;

  Proxy(Inference inference, Node proxied) {
    this.inference = checkNotNull(inference);
    this.proxied = checkNotNull(proxied);
  }

  /** The node this proxy wraps. */
  public final Node getProxied() {
    return proxied;
  }

  /** Infers the values of attribute {@code name} of this value. */
  public ValueStream inferredGetAttr(String name, @Nullable InferenceContext context) {
    return inference.inferAttribute(proxied, name, context);
  }

  /** Whether calling this value can produce a result. */
  public abstract boolean isCallable();

  /** The qualified name of the runtime type of this value. */
  public abstract String pytype();
}
