// Copyright 2026 The pyformat Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pyformat.java.format;

import net.pyformat.java.syntax.Leaf;
import net.pyformat.java.syntax.Node;
import net.pyformat.java.syntax.Symbol;
import net.pyformat.java.syntax.TokenKind;
import net.pyformat.java.syntax.Trees;

/** The kinds of node the blank-line rules distinguish. */
enum StatementKind {
  /** A {@code @decorator} line. */
  DECORATOR,
  /** A class definition, including its leading comments. */
  CLASS_DEFINITION,
  /** A function definition, including its leading comments. */
  FUNCTION_DEFINITION,
  /** An {@code async} marker wrapping a function definition. */
  ASYNC_DEFINITION,
  /** A statement consisting of a standalone comment. */
  COMMENT_STATEMENT,
  /** Any other statement. */
  STATEMENT,
  /** Structure with no spacing of its own, such as a suite or an expression. */
  OTHER;

  static StatementKind of(Node node) {
    switch (node.getSymbol()) {
      case DECORATOR:
        return DECORATOR;
      case CLASSDEF:
        return CLASS_DEFINITION;
      case FUNCDEF:
        return FUNCTION_DEFINITION;
      case ASYNC_FUNCDEF:
      case ASYNC_STMT:
        // async for and async with are plain statements.
        return wrapsFunction(node) ? ASYNC_DEFINITION : kindOfSymbol(node.getSymbol());
      case SIMPLE_STMT:
        return Trees.isCommentStatement(node) ? COMMENT_STATEMENT : STATEMENT;
      default:
        return kindOfSymbol(node.getSymbol());
    }
  }

  private static StatementKind kindOfSymbol(Symbol symbol) {
    return symbol.isStatement() ? STATEMENT : OTHER;
  }

  private static boolean wrapsFunction(Node node) {
    int marker = asyncMarkerIndex(node);
    return marker >= 0
        && marker + 1 < node.getChildren().size()
        && node.getChild(marker + 1) instanceof Node def
        && def.is(Symbol.FUNCDEF);
  }

  /** Returns the position of the {@code async} leaf among the children of a wrapper, or -1. */
  static int asyncMarkerIndex(Node wrapper) {
    for (int i = 0; i < wrapper.getChildren().size(); i++) {
      if (!Trees.isCommentStatement(wrapper.getChild(i))) {
        return wrapper.getChild(i) instanceof Leaf leaf && leaf.is(TokenKind.ASYNC) ? i : -1;
      }
    }
    return -1;
  }
}
