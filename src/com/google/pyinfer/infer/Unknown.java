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

import com.google.pyinfer.tree.InferredValue;

/**
 * The value of something inference cannot determine. It absorbs every operation: its attributes,
 * its call results and its elements are all unknown.
 */
public final class Unknown implements InferredValue {

  public static final Unknown INSTANCE = new Unknown();

  private Unknown() {}

  @Override
  public String toString() {
    return "Unknown";
  }
}
