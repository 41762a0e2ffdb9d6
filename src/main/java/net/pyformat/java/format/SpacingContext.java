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

import com.google.auto.value.AutoValue;

/**
 * The state of a {@link RequiredSpacingCalculator} traversal at one point of the tree.
 *
 * <p>A context is immutable. Visiting an element consumes the context that holds before the
 * element and yields the one that holds after it; the depths are scoped to the body of a
 * definition, while the trackers flow on in lexical order.
 */
@AutoValue
abstract class SpacingContext {

  /** Number of enclosing class bodies. */
  abstract int classDepth();

  /** Number of enclosing function bodies. */
  abstract int functionDepth();

  /** Line of the most recent standalone comment statement, or 0 if none was seen. */
  abstract int lastCommentLine();

  /** Whether a decorator line was just finished and its definition is not yet handled. */
  abstract boolean lastWasDecorator();

  /** Whether a class or function body was just finished. */
  abstract boolean lastWasDefinition();

  static SpacingContext initial() {
    return new AutoValue_SpacingContext.Builder()
        .classDepth(0)
        .functionDepth(0)
        .lastCommentLine(0)
        .lastWasDecorator(false)
        .lastWasDefinition(false)
        .build();
  }

  abstract Builder toBuilder();

  boolean isNested() {
    return classDepth() > 0 || functionDepth() > 0;
  }

  SpacingContext withLastCommentLine(int line) {
    return toBuilder().lastCommentLine(line).build();
  }

  SpacingContext withLastWasDecorator(boolean value) {
    return lastWasDecorator() == value ? this : toBuilder().lastWasDecorator(value).build();
  }

  SpacingContext withLastWasDefinition(boolean value) {
    return lastWasDefinition() == value ? this : toBuilder().lastWasDefinition(value).build();
  }

  /** Returns the context for the body of a class or function definition. */
  SpacingContext enterBody(boolean isClass) {
    return isClass
        ? toBuilder().classDepth(classDepth() + 1).build()
        : toBuilder().functionDepth(functionDepth() + 1).build();
  }

  /**
   * Returns the context after a definition: the depths of {@code outer} with the trackers left by
   * the body.
   */
  SpacingContext exitBody(SpacingContext outer) {
    return toBuilder()
        .classDepth(outer.classDepth())
        .functionDepth(outer.functionDepth())
        .lastWasDefinition(true)
        .build();
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder classDepth(int value);

    abstract Builder functionDepth(int value);

    abstract Builder lastCommentLine(int value);

    abstract Builder lastWasDecorator(boolean value);

    abstract Builder lastWasDefinition(boolean value);

    abstract SpacingContext build();
  }
}
