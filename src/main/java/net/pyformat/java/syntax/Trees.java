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
package net.pyformat.java.syntax;

import javax.annotation.Nullable;

/** Predicates over syntax trees shared by the blank-line passes. */
public final class Trees {

  private Trees() {}

  /**
   * Reports whether the element is a standalone comment statement. The comment splicer wraps such
   * comments in a {@code simple_stmt} whose first child is the comment.
   */
  public static boolean isCommentStatement(TreeElement element) {
    return element instanceof Node node
        && node.is(Symbol.SIMPLE_STMT)
        && node.getChild(0) instanceof Leaf leaf
        && leaf.is(TokenKind.COMMENT);
  }

  /** Reports whether the element is a function definition preceded by an {@code async} marker. */
  public static boolean isAsyncFunction(TreeElement element) {
    return element instanceof Node node
        && node.is(Symbol.FUNCDEF)
        && asyncMarker(node) != null;
  }

  /** Returns the {@code async} marker immediately before the element, or null. */
  @Nullable
  public static Leaf asyncMarker(TreeElement element) {
    TreeElement prev = element.getPrevSibling();
    return prev instanceof Leaf leaf && leaf.is(TokenKind.ASYNC) ? leaf : null;
  }

  /**
   * Reports whether the element starts at the left margin. An async function starts where its
   * {@code async} marker does.
   */
  public static boolean startsInZerothColumn(TreeElement element) {
    if (element.getFirstLeaf().getColumn() == 0) {
      return true;
    }
    Leaf marker = isAsyncFunction(element) ? asyncMarker(element) : null;
    return marker != null && marker.getColumn() == 0;
  }

  /** Reports whether the leftmost leaf of the element is a comment. */
  public static boolean firstLeafIsComment(TreeElement element) {
    return element.getFirstLeaf().is(TokenKind.COMMENT);
  }
}
