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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Trees}. */
@RunWith(JUnit4.class)
public final class TreesTest {

  @Test
  public void commentStatement() {
    Node root =
        SourceTrees.parse(
            """
            # standalone
            x = 1  # trailing
            """);
    assertThat(Trees.isCommentStatement(root.getChild(0))).isTrue();
    assertThat(Trees.isCommentStatement(root.getChild(1))).isFalse();
    assertThat(Trees.isCommentStatement(root.getChild(0).getFirstLeaf())).isFalse();
  }

  @Test
  public void asyncFunctionAtMargin() {
    Node root =
        SourceTrees.parse(
            """
            async def f():
                pass
            """);
    Node wrapper = (Node) root.getChild(0);
    Node function = (Node) wrapper.getChild(1);

    assertThat(wrapper.getSymbol()).isEqualTo(Symbol.ASYNC_STMT);
    assertThat(Trees.isAsyncFunction(function)).isTrue();
    assertThat(Trees.asyncMarker(function)).isSameInstanceAs(wrapper.getChild(0));
    assertThat(function.getFirstLeaf().getColumn()).isEqualTo(6);
    assertThat(Trees.startsInZerothColumn(function)).isTrue();
  }

  @Test
  public void nestedAsyncFunction() {
    Node root =
        SourceTrees.parse(
            """
            class A:
                async def f(self):
                    pass
            """);
    Leaf marker = SourceTrees.findLeaf(root, 2, "async");
    Node function = (Node) marker.getNextSibling();

    assertThat(Trees.isAsyncFunction(function)).isTrue();
    assertThat(Trees.startsInZerothColumn(function)).isFalse();
  }

  @Test
  public void plainFunctionIsNotAsync() {
    Node root =
        SourceTrees.parse(
            """
            def f():
                pass
            """);
    assertThat(Trees.isAsyncFunction(root.getChild(0))).isFalse();
    assertThat(Trees.asyncMarker(root.getChild(0))).isNull();
    assertThat(Trees.startsInZerothColumn(root.getChild(0))).isTrue();
  }

  @Test
  public void firstLeafIsComment() {
    Node root =
        SourceTrees.parse(
            """
            # about A
            class A:
                pass
            """);
    Node classdef = (Node) root.getChild(0);
    assertThat(classdef.getSymbol()).isEqualTo(Symbol.CLASSDEF);
    assertThat(Trees.firstLeafIsComment(classdef)).isTrue();
    assertThat(Trees.firstLeafIsComment(classdef.getChild(1))).isFalse();
  }
}
