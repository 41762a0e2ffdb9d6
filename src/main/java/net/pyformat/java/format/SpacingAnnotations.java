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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import net.pyformat.java.syntax.Leaf;

/**
 * The line-break annotations computed for the leaves of one syntax tree.
 *
 * <p>Annotations are kept out of band, keyed by {@link Leaf#getIndex}. Two are recorded:
 *
 * <ul>
 *   <li><i>original newlines</i>: the number of line breaks before the leaf in the source, for
 *       every leaf that begins a source line;
 *   <li><i>required newlines</i>: the number of line breaks the formatted output must have before
 *       the leaf. {@code k} newlines means {@code k - 1} blank lines. Leaves without a value are
 *       not governed and default to a single line break.
 * </ul>
 */
public final class SpacingAnnotations {

  private final ImmutableMap<Integer, Integer> originalNewlines;
  private final ImmutableMap<Integer, Integer> requiredNewlines;

  private SpacingAnnotations(
      ImmutableMap<Integer, Integer> originalNewlines,
      ImmutableMap<Integer, Integer> requiredNewlines) {
    this.originalNewlines = originalNewlines;
    this.requiredNewlines = requiredNewlines;
  }

  /** Returns the number of line breaks before the leaf in the source, or null if not recorded. */
  @Nullable
  public Integer getOriginalNewlines(Leaf leaf) {
    return originalNewlines.get(leaf.getIndex());
  }

  /** Returns the number of line breaks required before the leaf, or null if it is not governed. */
  @Nullable
  public Integer getRequiredNewlines(Leaf leaf) {
    return requiredNewlines.get(leaf.getIndex());
  }

  /**
   * Returns the number of blank lines a printer must emit before the leaf, or null if the leaf is
   * not governed.
   */
  @Nullable
  public Integer getRequiredBlankLines(Leaf leaf) {
    Integer newlines = getRequiredNewlines(leaf);
    return newlines == null ? null : newlines - 1;
  }

  /** Returns all original newline counts, keyed by leaf index, in the order they were recorded. */
  public ImmutableMap<Integer, Integer> originalNewlines() {
    return originalNewlines;
  }

  /** Returns all required newline counts, keyed by leaf index, in the order they were decided. */
  public ImmutableMap<Integer, Integer> requiredNewlines() {
    return requiredNewlines;
  }

  static Builder builder() {
    return new Builder();
  }

  /**
   * Collects the annotations of one formatting run. Every value is written at most once; a second
   * write for the same leaf is a programming error.
   */
  static final class Builder {
    private final Map<Integer, Integer> originalNewlines = new LinkedHashMap<>();
    private final Map<Integer, Integer> requiredNewlines = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    Builder setOriginalNewlines(Leaf leaf, int newlines) {
      checkArgument(newlines >= 0, "negative original newlines %s before %s", newlines, leaf);
      Integer previous = originalNewlines.putIfAbsent(leaf.getIndex(), newlines);
      checkState(previous == null, "original newlines before %s already recorded", leaf);
      return this;
    }

    @CanIgnoreReturnValue
    Builder setRequiredNewlines(Leaf leaf, int newlines) {
      checkArgument(newlines >= 1, "required newlines before %s must be positive", leaf);
      Integer previous = requiredNewlines.putIfAbsent(leaf.getIndex(), newlines);
      checkState(
          previous == null,
          "required newlines before %s already decided (%s, now %s)",
          leaf,
          previous,
          newlines);
      return this;
    }

    SpacingAnnotations build() {
      return new SpacingAnnotations(
          ImmutableMap.copyOf(originalNewlines), ImmutableMap.copyOf(requiredNewlines));
    }
  }
}
