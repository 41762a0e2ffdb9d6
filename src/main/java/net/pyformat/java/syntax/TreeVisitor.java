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

import java.util.List;

/**
 * A visitor for visiting the elements of a syntax tree in lexical order, depth first.
 *
 * <p>Typical usage is for a subclass to override {@link #visit(Leaf)} and, where it cares about
 * structure, {@link #visit(Node)}. Overriding implementations of {@code visit(Node)} should remember
 * to traverse the children, either with {@code super.visit(node)} or with {@link #visitAll}.
 */
public class TreeVisitor {

  /** Entrypoint for visiting an element. Clients should avoid calling the overloads directly. */
  public void visit(TreeElement element) {
    // Double-dispatch pattern.
    element.accept(this);
  }

  public void visit(Node node) {
    visitAll(node.getChildren());
  }

  public void visit(Leaf leaf) {}

  /** Visits a sequence of elements, such as the children of a node. */
  // Final because visit(Node) is the extension point for composite elements.
  public final void visitAll(List<? extends TreeElement> elements) {
    for (TreeElement element : elements) {
      visit(element);
    }
  }
}
