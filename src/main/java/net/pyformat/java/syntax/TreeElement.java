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

import static com.google.common.base.Preconditions.checkState;

import javax.annotation.Nullable;

/**
 * An element of a concrete syntax tree: either a {@link Leaf} (a token) or a composite {@link
 * Node}.
 *
 * <p>An element is owned by at most one parent, which is fixed when the parent is constructed. The
 * parent and sibling accessors are for navigation only.
 */
public abstract class TreeElement {

  @Nullable private Node parent;
  private int indexInParent = -1;

  TreeElement() {}

  final void attachTo(Node parent, int indexInParent) {
    checkState(this.parent == null, "%s is already a child of %s", this, this.parent);
    this.parent = parent;
    this.indexInParent = indexInParent;
  }

  /** Returns the node that owns this element, or null for the root. */
  @Nullable
  public final Node getParent() {
    return parent;
  }

  /** Returns the sibling immediately before this element, or null if there is none. */
  @Nullable
  public final TreeElement getPrevSibling() {
    if (parent == null || indexInParent == 0) {
      return null;
    }
    return parent.getChildren().get(indexInParent - 1);
  }

  /** Returns the sibling immediately after this element, or null if there is none. */
  @Nullable
  public final TreeElement getNextSibling() {
    if (parent == null || indexInParent == parent.getChildren().size() - 1) {
      return null;
    }
    return parent.getChildren().get(indexInParent + 1);
  }

  /** Returns the leftmost leaf of this element, which is the element itself for a leaf. */
  public abstract Leaf getFirstLeaf();

  /** Returns the line of the element, which is the line of its leftmost leaf. */
  public abstract int getLine();

  public abstract void accept(TreeVisitor visitor);
}
