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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.flogger.GoogleLogger;
import com.google.common.flogger.LazyArgs;
import net.pyformat.java.syntax.Node;

/**
 * Computes the line-break annotations of a syntax tree: how many line breaks preceded each source
 * line originally, and how many the formatted output requires before definitions, decorators,
 * comments attached to definitions, and statements that follow a definition body.
 *
 * <p>The calculation keeps no state between calls. Distinct trees may be annotated concurrently.
 */
public final class BlankLineCalculator {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private BlankLineCalculator() {}

  /**
   * Annotates the tree rooted at {@code root}.
   *
   * @throws IllegalArgumentException if {@code root} has a parent
   * @throws IllegalStateException if the tree is malformed
   */
  public static SpacingAnnotations calculate(Node root, FormatStyle style) {
    checkArgument(root.getParent() == null, "%s is not the root of its tree", root);
    SpacingAnnotations.Builder builder = SpacingAnnotations.builder();

    // The passes write to the same annotations and must not overlap.
    OriginalSpacingRecorder.record(root, builder);
    RequiredSpacingCalculator.calculate(root, style, builder);

    SpacingAnnotations annotations = builder.build();
    logger.atFine().log(
        "%d line-leading leaves, %d governed leaves",
        annotations.originalNewlines().size(), annotations.requiredNewlines().size());
    logger.atFinest().log(
        "annotated tree:\n%s", LazyArgs.lazy(() -> AnnotatedTreeDumper.dump(root, annotations)));
    return annotations;
  }

  /** Annotates the tree rooted at {@code root} using {@link FormatStyle#DEFAULT}. */
  public static SpacingAnnotations calculate(Node root) {
    return calculate(root, FormatStyle.DEFAULT);
  }
}
