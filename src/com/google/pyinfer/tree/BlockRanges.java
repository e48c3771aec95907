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
 * Maps a line inside a compound statement to the line span of the sub-block containing it.
 *
 * <p>Raw line numbers are not enough to answer "which block does this line belong to" once
 * {@code elif}, {@code except}, {@code else} and {@code finally} clauses are involved; the rules
 * here pick the clause that owns the line and report the range from that line to the end of the
 * clause.
 */
final class BlockRanges {

  private BlockRanges() {}

  static BlockRange blockRange(Node n, int lineno) {
    switch (n.getToken()) {
      case MODULE:
      case CLASS:
      case FUNCTION:
        // The whole body is one block anchored at the "def" or "class" line.
        return BlockRange.create(n.getSourceLine(), n.getLastSourceLine());
      case IF:
        return ifBlockRange(n, lineno);
      case TRY_EXCEPT:
        return tryExceptBlockRange(n, lineno);
      case TRY_FINALLY:
      case WHILE:
      case FOR:
        return elsedBlockRange(n, lineno, -1);
      default:
        return BlockRange.create(lineno, n.getLastSourceLine());
    }
  }

  private static BlockRange ifBlockRange(Node n, int lineno) {
    int last = -1;
    // The first branch is covered by the header test of the default rule.
    for (Node branch = n.getSecondChild();
        branch != null && branch.getToken() == Token.IF_BRANCH;
        branch = branch.getNext()) {
      if (lineno == branch.getSourceLine()) {
        return BlockRange.create(lineno, lineno);
      }
      Node body = branch.getLastChild();
      if (body.getSourceLine() <= lineno && lineno <= body.getLastSourceLine()) {
        return BlockRange.create(lineno, body.getLastSourceLine());
      }
      if (last == -1) {
        last = branch.getSourceLine() - 1;
      }
    }
    return elsedBlockRange(n, lineno, last);
  }

  private static BlockRange tryExceptBlockRange(Node n, int lineno) {
    int last = -1;
    for (Node handler = n.getSecondChild();
        handler != null && handler.getToken() == Token.EXCEPT_HANDLER;
        handler = handler.getNext()) {
      Node type = handler.getFirstChild();
      if (!type.isEmpty() && lineno == type.getSourceLine()) {
        return BlockRange.create(lineno, lineno);
      }
      Node body = handler.getLastChild();
      if (body.getSourceLine() <= lineno && lineno <= body.getLastSourceLine()) {
        return BlockRange.create(lineno, body.getLastSourceLine());
      }
      if (last == -1) {
        last = body.getSourceLine() - 1;
      }
    }
    return elsedBlockRange(n, lineno, last);
  }

  /**
   * The rule for statements with an optional trailing clause. {@code last} is the end of the
   * range when the statement has no trailing clause, or -1 for the statement's own last line.
   */
  private static BlockRange elsedBlockRange(Node n, int lineno, int last) {
    if (lineno == n.getSourceLine()) {
      return BlockRange.create(lineno, lineno);
    }
    Node orElse = NodeUtil.getElseBlock(n);
    if (orElse != null) {
      if (lineno >= orElse.getSourceLine()) {
        return BlockRange.create(lineno, orElse.getLastSourceLine());
      }
      return BlockRange.create(lineno, orElse.getSourceLine() - 1);
    }
    return BlockRange.create(lineno, last > 0 ? last : n.getLastSourceLine());
  }
}
