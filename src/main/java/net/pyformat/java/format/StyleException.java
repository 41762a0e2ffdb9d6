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

/** An exception that's thrown when a {@link FormatStyle} cannot be built from textual options. */
public class StyleException extends Exception {
  private final String invalidOption;

  public StyleException(String message, String option) {
    super(message);
    this.invalidOption = option;
  }

  /** Returns the name of the option that was rejected, as given by the caller. */
  public String getInvalidOption() {
    return invalidOption;
  }
}
