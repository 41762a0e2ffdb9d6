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

import com.google.common.base.CharMatcher;

/**
 * A terminal token of the syntax tree.
 *
 * <p>A leaf is identified by its index, assigned by the parser and unique within a tree. Results
 * computed about a leaf are kept in side tables keyed by that index; the leaf itself never changes.
 */
public final class Leaf extends TreeElement {

  private final int index;
  private final TokenKind kind;
  private final String text;
  private final int line;
  private final int column;

  /**
   * Constructs a leaf.
   *
   * @param index the identity of the leaf within its tree
   * @param kind the token kind
   * @param text the raw text of the token, which may span several lines
   * @param line the 1-based line of the token. For a comment this is the line of its last line.
   * @param column the 0-based column of the token
   */
  public Leaf(int index, TokenKind kind, String text, int line, int column) {
    checkArgument(index >= 0, "negative leaf index %s", index);
    checkArgument(line >= 1, "leaf '%s' has no line (got %s)", text, line);
    checkArgument(column >= 0, "leaf '%s' has no column (got %s)", text, column);
    this.index = index;
    this.kind = checkNotNull(kind);
    this.text = checkNotNull(text);
    this.line = line;
    this.column = column;
  }

  public int getIndex() {
    return index;
  }

  public TokenKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  @Override
  public Leaf getFirstLeaf() {
    return this;
  }

  @Override
  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  /** Returns the number of line breaks embedded in the text of this leaf. */
  public int getEmbeddedLineBreaks() {
    return CharMatcher.is('\n').countIn(text);
  }

  /** Reports whether this leaf is of the given kind. */
  public boolean is(TokenKind kind) {
    return this.kind == kind;
  }

  @Override
  public void accept(TreeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return kind.name() + "(" + text + ")@" + line + ":" + column;
  }
}
