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

import com.google.pyinfer.tree.Node;

/** A method read through an instance, bound to that instance as its receiver. */
public final class InstanceMethod extends Proxy {

  private final Instance receiver;

  InstanceMethod(Inference inference, Node function, Instance receiver) {
    super(inference, function);
    checkArgument(function.isFunction(), function);
    this.receiver = checkNotNull(receiver);
  }

  public Node getFunction() {
    return getProxied();
  }

  public Instance getReceiver() {
    return receiver;
  }

  public boolean isBound() {
    return true;
  }

  @Override
  public boolean isCallable() {
    return true;
  }

  @Override
  public String pytype() {
    return inference.getOptions().getBuiltinsModuleName() + ".instancemethod";
  }

  @Override
  public String toString() {
    Node cls = receiver.getProxied();
    return "Bound method "
        + getFunction().getString()
        + " of "
        + cls.root().getString()
        + "."
        + cls.getString();
  }
}
