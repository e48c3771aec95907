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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pyinfer.tree.Node;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** A {@link ModuleResolver} over a fixed set of module trees, keyed by module name. */
public final class MapModuleResolver implements ModuleResolver {

  private final Map<String, Node> modules = new LinkedHashMap<>();

  @CanIgnoreReturnValue
  public MapModuleResolver register(Node module) {
    checkArgument(module.isModule() && !module.hasParent(), "Not a root module: %s", module);
    modules.put(module.getString(), module);
    return this;
  }

  @Override
  public Optional<Node> resolveModule(String name) {
    return Optional.ofNullable(modules.get(name));
  }
}
