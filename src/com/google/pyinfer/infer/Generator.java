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

import com.google.pyinfer.tree.Node;

/** The result of calling a generator function. */
public final class Generator extends Proxy {

  Generator(Inference inference, Node function) {
    super(inference, function);
    checkArgument(function.isFunction(), function);
  }

  public Node getFunction() {
    return getProxied();
  }

  @Override
  public boolean isCallable() {
    return true;
  }

  @Override
  public String pytype() {
    return inference.getOptions().getBuiltinsModuleName() + ".generator";
  }

  @Override
  public String toString() {
    return "Generator " + getFunction().getString();
  }
}
