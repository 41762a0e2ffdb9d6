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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import net.pyformat.java.syntax.Leaf;
import net.pyformat.java.syntax.Node;
import net.pyformat.java.syntax.TokenKind;
import net.pyformat.java.syntax.TreeElement;
import net.pyformat.java.syntax.Trees;

/**
 * Decides how many line breaks the formatted output needs before class and function definitions,
 * their leading comments and decorators, and the statements that follow a definition body.
 *
 * <p>The traversal threads a {@link SpacingContext} through the tree in lexical order: every visit
 * takes the context holding before an element and returns the one holding after it. Each governed
 * leaf is decided exactly once.
 */
final class RequiredSpacingCalculator {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final int NO_BLANK_LINES = 1;
  static final int ONE_BLANK_LINE = 2;

  private final FormatStyle style;
  private final SpacingAnnotations.Builder annotations;

  private RequiredSpacingCalculator(FormatStyle style, SpacingAnnotations.Builder annotations) {
    this.style = style;
    this.annotations = annotations;
  }

  /** Decides the required newlines of the leaves under {@code root}. */
  static void calculate(Node root, FormatStyle style, SpacingAnnotations.Builder annotations) {
    new RequiredSpacingCalculator(style, annotations).visit(root, SpacingContext.initial());
  }

  private SpacingContext visit(TreeElement element, SpacingContext context) {
    if (!(element instanceof Node node)) {
      // Leaves are governed by the statement they begin.
      return context;
    }
    switch (StatementKind.of(node)) {
      case DECORATOR:
        return visitDecorator(node, context);
      case CLASS_DEFINITION:
        return visitDefinition(node, /* isClass= */ true, context);
      case FUNCTION_DEFINITION:
        return visitDefinition(node, /* isClass= */ false, context);
      case ASYNC_DEFINITION:
        return visitAsyncDefinition(node, context);
      case COMMENT_STATEMENT:
        return visitStatement(node, context).withLastCommentLine(node.getLine());
      case STATEMENT:
        return visitStatement(node, context);
      case OTHER:
        return visitChildren(node, 0, context.withLastWasDefinition(false));
    }
    throw new IllegalStateException("unhandled node " + node);
  }

  private SpacingContext visitChildren(Node node, int from, SpacingContext context) {
    ImmutableList<TreeElement> children = node.getChildren();
    for (int i = from; i < children.size(); i++) {
      context = visit(children.get(i), context);
    }
    return context;
  }

  /** A statement right after a definition body is spaced like a definition. */
  private SpacingContext visitStatement(Node statement, SpacingContext context) {
    if (context.lastWasDefinition()) {
      Leaf first = statement.getFirstLeaf();
      govern(first, requiredSpacing(first, context));
    }
    return visitChildren(statement, 0, context.withLastWasDefinition(false));
  }

  private SpacingContext visitDecorator(Node decorator, SpacingContext context) {
    checkState(decorator.getChild(0) instanceof Leaf, "decorator without '@': %s", decorator);
    Leaf at = decorator.getFirstLeaf();
    if (context.lastCommentLine() > 0 && followsComment(at, context)) {
      govern(at, NO_BLANK_LINES);
    } else {
      govern(at, requiredSpacing(decorator, context));
    }
    return visitChildren(decorator, 0, context).withLastWasDecorator(true);
  }

  private SpacingContext visitDefinition(Node definition, boolean isClass, SpacingContext context) {
    context = context.withLastWasDefinition(false);
    int index = attachLeading(definition, context);
    context = context.withLastWasDecorator(false);
    SpacingContext after = visitChildren(definition, index, context.enterBody(isClass));
    return after.exitBody(context);
  }

  /**
   * Visits {@code async def}. The {@code async} marker is the first token of the statement, so it
   * carries the spacing; the {@code def} keyword is never governed.
   */
  private SpacingContext visitAsyncDefinition(Node wrapper, SpacingContext context) {
    context = context.withLastWasDefinition(false);
    int marker = attachLeading(wrapper, context);
    Node function = (Node) wrapper.getChild(marker + 1);
    context = context.withLastWasDecorator(false);
    SpacingContext after = visitChildren(function, 0, context.enterBody(/* isClass= */ false));
    after = visitChildren(wrapper, marker + 2, after);
    return after.exitBody(context);
  }

  /**
   * Sets the spacing of the leading comments of a definition and of its first real token.
   *
   * <p>The parser attaches standalone comments directly above a definition to the definition node
   * itself. A comment gets one blank line before it unless it follows a decorator. The definition
   * hugs a comment that ends on the line right above it.
   *
   * @return the index of the first child that is not a leading comment
   */
  private int attachLeading(Node definition, SpacingContext context) {
    ImmutableList<TreeElement> children = definition.getChildren();
    int index = 0;
    while (index < children.size() && Trees.isCommentStatement(children.get(index))) {
      if (!context.lastWasDecorator()) {
        govern(children.get(index).getFirstLeaf(), ONE_BLANK_LINE);
      }
      index++;
    }
    checkState(
        index < children.size() && children.get(index) instanceof Leaf,
        "definition without keyword: %s",
        definition);

    Leaf keyword = (Leaf) children.get(index);
    if (index > 0 && children.get(index - 1).getLine() == keyword.getLine() - 1) {
      govern(keyword, NO_BLANK_LINES);
    } else if (followsComment(keyword, context)) {
      govern(keyword, NO_BLANK_LINES);
    } else {
      // An async definition is placed by its function, which starts at the marker.
      TreeElement placed = keyword.is(TokenKind.ASYNC) ? children.get(index + 1) : definition;
      govern(keyword, requiredSpacing(placed, context));
    }
    return index;
  }

  /** Returns the newlines before a definition or a statement that needs separating. */
  private int requiredSpacing(TreeElement element, SpacingContext context) {
    if (context.lastWasDecorator()) {
      return NO_BLANK_LINES;
    }
    if (isTopLevel(element, context)) {
      return 1 + style.blankLinesAroundTopLevelDefinition();
    }
    return ONE_BLANK_LINE;
  }

  // Outside any body, only elements at the left margin (or led by a comment) are top-level.
  private static boolean isTopLevel(TreeElement element, SpacingContext context) {
    return !context.isNested()
        && (Trees.startsInZerothColumn(element) || Trees.firstLeafIsComment(element));
  }

  /** Reports whether the last standalone comment ended on the line just above {@code leaf}. */
  private static boolean followsComment(Leaf leaf, SpacingContext context) {
    return context.lastCommentLine() + 1 == leaf.getLine();
  }

  private void govern(Leaf leaf, int newlines) {
    logger.atFinest().log("%s: %d newlines", leaf, newlines);
    annotations.setRequiredNewlines(leaf, newlines);
  }
}
