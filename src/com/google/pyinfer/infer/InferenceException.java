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

/**
 * Inference could not determine any value. Raised by a single candidate, it is folded into the
 * unknown value; raised when no candidate produced anything, it means the query has no answer.
 */
public class InferenceException extends AnalysisException {

  private static final long serialVersionUID = 1L;

  public InferenceException(String message) {
    super(message);
  }
}
