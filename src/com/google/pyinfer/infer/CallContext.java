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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.pyinfer.tree.Node;
import java.util.List;

/** The arguments of the call whose result is being inferred. */
@AutoValue
public abstract class CallContext {

  public static CallContext create(List<Node> args) {
    return new AutoValue_CallContext(ImmutableList.copyOf(args));
  }

  /** The positional argument expressions, in source order. */
  public abstract ImmutableList<Node> getArgs();
}
