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

import java.io.Serializable;

/** Knobs of the inference engine. */
public class InferenceOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  private String builtinsModuleName = "__builtin__";

  /** Whether names missing from every enclosing scope are looked up in the builtins module. */
  private boolean lookupBuiltins = true;

  /**
   * Whether an instance read as a class attribute is replaced by the unknown value when its class
   * defines {@code __get__}.
   */
  private boolean resolveDescriptors = true;

  public String getBuiltinsModuleName() {
    return builtinsModuleName;
  }

  public void setBuiltinsModuleName(String builtinsModuleName) {
    this.builtinsModuleName = checkNotNull(builtinsModuleName);
  }

  public boolean isLookupBuiltins() {
    return lookupBuiltins;
  }

  public void setLookupBuiltins(boolean lookupBuiltins) {
    this.lookupBuiltins = lookupBuiltins;
  }

  public boolean isResolveDescriptors() {
    return resolveDescriptors;
  }

  public void setResolveDescriptors(boolean resolveDescriptors) {
    this.resolveDescriptors = resolveDescriptors;
  }
}
