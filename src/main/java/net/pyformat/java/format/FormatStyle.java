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

import com.google.auto.value.AutoValue;
import com.google.common.base.Ascii;
import com.google.common.flogger.GoogleLogger;
import com.google.common.primitives.Ints;
import java.util.Map;

/**
 * FormatStyle is the set of style options consulted when computing the blank lines of a file.
 *
 * <p>The {@link #DEFAULT} style puts two blank lines around top-level definitions, as PEP 8 asks.
 * Styles are immutable and may be shared between concurrent formatting runs.
 */
@AutoValue
public abstract class FormatStyle {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Name of the option behind {@link #blankLinesAroundTopLevelDefinition}. */
  public static final String BLANK_LINES_AROUND_TOP_LEVEL_DEFINITION =
      "BLANK_LINES_AROUND_TOP_LEVEL_DEFINITION";

  /** The default style. */
  public static final FormatStyle DEFAULT = builder().build();

  /**
   * Number of blank lines around top-level class and function definitions, and between the end of
   * a top-level definition and the statement that follows it.
   */
  public abstract int blankLinesAroundTopLevelDefinition();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_FormatStyle.Builder().blankLinesAroundTopLevelDefinition(2);
  }

  public abstract Builder toBuilder();

  /**
   * Returns the default style with the given options applied. Option names are matched without
   * regard to case, and {@code -} may stand for {@code _}; values are decimal integers.
   *
   * @throws StyleException if an option is unknown or its value is invalid
   */
  public static FormatStyle fromOptions(Map<String, String> options) throws StyleException {
    Builder builder = DEFAULT.toBuilder();
    for (Map.Entry<String, String> option : options.entrySet()) {
      String name = canonicalName(option.getKey());
      if (!name.equals(BLANK_LINES_AROUND_TOP_LEVEL_DEFINITION)) {
        throw new StyleException(
            String.format("unknown style option '%s'", option.getKey()), option.getKey());
      }
      builder.blankLinesAroundTopLevelDefinition(
          parseNonNegative(option.getKey(), option.getValue()));
      logger.atFine().log("style option %s = %s", name, option.getValue());
    }
    return builder.build();
  }

  private static String canonicalName(String name) {
    return Ascii.toUpperCase(name.trim()).replace('-', '_');
  }

  private static int parseNonNegative(String option, String value) throws StyleException {
    Integer n = Ints.tryParse(value.trim());
    if (n == null || n < 0) {
      throw new StyleException(
          String.format(
              "style option '%s' wants a non-negative integer, got '%s'", option, value),
          option);
    }
    return n;
  }

  /** Builder for {@link FormatStyle}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder blankLinesAroundTopLevelDefinition(int value);

    abstract FormatStyle autoBuild();

    /**
     * Builds the style.
     *
     * @throws IllegalArgumentException if a count is negative
     */
    public FormatStyle build() {
      FormatStyle style = autoBuild();
      checkArgument(
          style.blankLinesAroundTopLevelDefinition() >= 0,
          "negative blank lines around top-level definitions: %s",
          style.blankLinesAroundTopLevelDefinition());
      return style;
    }
  }
}
