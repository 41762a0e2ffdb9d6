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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TreeVisitor}. */
@RunWith(JUnit4.class)
public final class TreeVisitorTest {

  /** Records nodes and non-layout leaves in the order they were seen. */
  private static class Gatherer extends TreeVisitor {
    final List<String> seen = new ArrayList<>();

    @Override
    public void visit(Node node) {
      seen.add(node.getSymbol().getName());
      super.visit(node);
    }

    @Override
    public void visit(Leaf leaf) {
      if (!leaf.getKind().isLayout() && !leaf.is(TokenKind.ENDMARKER)) {
        seen.add(leaf.getText());
      }
    }
  }

  private static List<String> gather(String source) {
    Gatherer gatherer = new Gatherer();
    gatherer.visit(SourceTrees.parse(source));
    return gatherer.seen;
  }

  @Test
  public void visitsInLexicalOrder() {
    assertThat(
            gather(
                """
                x = 1
                pass
                """))
        .containsExactly("file_input", "simple_stmt", "expr_stmt", "x", "=", "1", "simple_stmt",
            "pass")
        .inOrder();
  }

  @Test
  public void visitsDefinitionsAndTheirBodies() {
    assertThat(
            gather(
                """
                # lead
                def f(a):
                    return a
                """))
        .containsExactly(
            "file_input",
            "funcdef",
            "simple_stmt",
            "# lead",
            "def",
            "f",
            "parameters",
            "(",
            "a",
            ")",
            ":",
            "suite",
            "simple_stmt",
            "return_stmt",
            "return",
            "a")
        .inOrder();
  }
}
