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

/**
 * The kinds of nodes in a parsed Python program tree.
 *
 * <p>The set is closed: every capability that depends on the kind of a node (statement
 * classification, block ranges, inference) switches over this enum.
 */
public enum Token {
  // Definitions and scopes
  MODULE,
  CLASS,
  FUNCTION,
  LAMBDA,
  GENEXPR,
  COMP_FOR,

  // Structural children
  BLOCK,
  DECORATORS,
  BASES,
  PARAM_LIST,
  IF_BRANCH,
  EXCEPT_HANDLER,
  IMPORT_SPEC,
  EMPTY,

  // Statements
  ASSIGN,
  AUG_ASSIGN,
  EXPR_STMT,
  IF,
  WHILE,
  FOR,
  TRY_EXCEPT,
  TRY_FINALLY,
  WITH,
  RETURN,
  RAISE,
  ASSERT,
  PASS,
  BREAK,
  CONTINUE,
  DELETE,
  GLOBAL,
  IMPORT,
  FROM,

  // Expressions
  NAME,
  ASSIGN_NAME,
  GETATTR,
  ASSIGN_ATTR,
  CALL,
  SUBSCRIPT,
  CONST,
  NONE,
  TRUE,
  FALSE,
  TUPLE,
  LIST,
  DICT,
  BINARY_OP,
  BOOL_OP,
  UNARY_OP,
  NOT,
  COMPARE,
  YIELD;
}
