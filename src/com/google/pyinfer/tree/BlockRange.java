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

import com.google.auto.value.AutoValue;

/** An inclusive span of source lines. */
@AutoValue
public abstract class BlockRange {

  public static BlockRange create(int start, int end) {
    return new AutoValue_BlockRange(start, end);
  }

  /** The first line of the span. */
  public abstract int getStart();

  /** The last line of the span. */
  public abstract int getEnd();
}
