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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A composite syntax node: a grammar {@link Symbol} and its ordered children. */
public final class Node extends TreeElement {

  private final Symbol symbol;
  private final ImmutableList<TreeElement> children;

  /**
   * Constructs a node that takes ownership of the given children.
   *
   * @throws IllegalArgumentException if {@code children} is empty
   * @throws IllegalStateException if one of the children already has a parent
   */
  public Node(Symbol symbol, List<? extends TreeElement> children) {
    checkArgument(!children.isEmpty(), "%s node without children", symbol);
    this.symbol = checkNotNull(symbol);
    this.children = ImmutableList.copyOf(children);
    for (int i = 0; i < this.children.size(); i++) {
      this.children.get(i).attachTo(this, i);
    }
  }

  /** Convenience overload of the constructor. */
  public static Node of(Symbol symbol, TreeElement... children) {
    return new Node(symbol, ImmutableList.copyOf(children));
  }

  public Symbol getSymbol() {
    return symbol;
  }

  /** Reports whether this node is of the given symbol. */
  public boolean is(Symbol symbol) {
    return this.symbol == symbol;
  }

  public ImmutableList<TreeElement> getChildren() {
    return children;
  }

  /** Returns the child at position {@code i}. */
  public TreeElement getChild(int i) {
    return children.get(i);
  }

  @Override
  public Leaf getFirstLeaf() {
    return children.get(0).getFirstLeaf();
  }

  @Override
  public int getLine() {
    return getFirstLeaf().getLine();
  }

  @Override
  public void accept(TreeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return symbol.getName() + "@" + getLine();
  }
}
