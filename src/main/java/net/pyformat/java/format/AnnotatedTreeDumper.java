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

import com.google.common.base.Strings;
import net.pyformat.java.syntax.Leaf;
import net.pyformat.java.syntax.Node;
import net.pyformat.java.syntax.TreeVisitor;

/**
 * Renders a syntax tree with its line-break annotations, one element per line.
 *
 * <p>For example:
 *
 * <pre>
 * file_input
 *   funcdef
 *     NAME("def") 1:0 original=0 required=3
 *     NAME("f") 1:4
 * </pre>
 */
public final class AnnotatedTreeDumper extends TreeVisitor {

  private final SpacingAnnotations annotations;
  private final StringBuilder out = new StringBuilder();
  private int depth = 0;

  private AnnotatedTreeDumper(SpacingAnnotations annotations) {
    this.annotations = annotations;
  }

  /** Returns the rendering of the tree rooted at {@code root}. */
  public static String dump(Node root, SpacingAnnotations annotations) {
    AnnotatedTreeDumper dumper = new AnnotatedTreeDumper(annotations);
    dumper.visit(root);
    return dumper.out.toString();
  }

  @Override
  public void visit(Node node) {
    indent().append(node.getSymbol().getName()).append('\n');
    depth++;
    super.visit(node);
    depth--;
  }

  @Override
  public void visit(Leaf leaf) {
    indent()
        .append(leaf.getKind().name())
        .append("(\"")
        .append(leaf.getText().replace("\n", "\\n"))
        .append("\") ")
        .append(leaf.getLine())
        .append(':')
        .append(leaf.getColumn());
    Integer original = annotations.getOriginalNewlines(leaf);
    if (original != null) {
      out.append(" original=").append(original);
    }
    Integer required = annotations.getRequiredNewlines(leaf);
    if (required != null) {
      out.append(" required=").append(required);
    }
    out.append('\n');
  }

  private StringBuilder indent() {
    return out.append(Strings.repeat("  ", depth));
  }
}
