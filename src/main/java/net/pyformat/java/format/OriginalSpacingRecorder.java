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

import static com.google.common.base.Verify.verify;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.pyformat.java.syntax.Leaf;
import net.pyformat.java.syntax.Node;
import net.pyformat.java.syntax.TokenKind;
import net.pyformat.java.syntax.TreeVisitor;

/**
 * Records how many line breaks preceded each line in the original source.
 *
 * <p>Only the first token of a source line is annotated. The recorder knows nothing about classes,
 * functions or decorators; it only accounts for lines in the token stream.
 */
final class OriginalSpacingRecorder extends TreeVisitor {

  private final List<Leaf> tokens = new ArrayList<>();

  private OriginalSpacingRecorder() {}

  /** Records the original newlines of every line-leading leaf under {@code root}. */
  static void record(Node root, SpacingAnnotations.Builder annotations) {
    OriginalSpacingRecorder recorder = new OriginalSpacingRecorder();
    recorder.visit(root);
    recorder.computeNewlines(annotations);
  }

  // Indents, dedents and newlines never begin a line.
  @Override
  public void visit(Leaf leaf) {
    if (!leaf.getKind().isLayout()) {
      tokens.add(leaf);
    }
  }

  private void computeNewlines(SpacingAnnotations.Builder annotations) {
    // Stable, so leaves reported on the same line keep their lexical order.
    ImmutableList<Leaf> leaves =
        ImmutableList.sortedCopyOf(Comparator.comparingInt(Leaf::getLine), tokens);

    int prev = 1;
    int lastLine = 0;
    for (Leaf leaf : leaves) {
      if (leaf.getLine() != lastLine) {
        int offset = 0;
        if (leaf.is(TokenKind.COMMENT)) {
          // The line of a comment is its last line.
          offset = leaf.getEmbeddedLineBreaks();
        }
        int newlines = leaf.getLine() - prev - offset;
        verify(newlines >= 0, "%s overlaps the line before it (%s newlines)", leaf, newlines);
        annotations.setOriginalNewlines(leaf, newlines);
        lastLine = leaf.getLine();
      }

      // Every token moves the cursor, wherever it sits on its line. A multi-line string ends below
      // the line it starts on.
      prev = Math.max(prev, leaf.getLine());
      if (leaf.is(TokenKind.STRING)) {
        prev = leaf.getLine() + leaf.getEmbeddedLineBreaks();
      }
    }
  }
}
