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
 * The base class of the failures reported while looking names and attributes up or inferring
 * their values. None of them means that the analyzed program is invalid.
 */
public class AnalysisException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  AnalysisException(String message) {
    super(message);
  }
}
