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

/** A name or attribute has no binding reachable from where it was looked up. */
public class NotFoundException extends AnalysisException {

  private static final long serialVersionUID = 1L;

  private final String name;

  public NotFoundException(String name) {
    super(name);
    this.name = name;
  }

  /** The name that could not be found. */
  public String getName() {
    return name;
  }
}
