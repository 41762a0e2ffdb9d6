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

/** A TokenKind is the kind of a {@link Leaf}, as reported by the tokenizer. */
public enum TokenKind {
  ASYNC("async"),
  AWAIT("await"),
  COMMENT("comment"),
  DEDENT("dedent"),
  ENDMARKER("end of file"),
  INDENT("indent"),
  NAME("name"),
  NEWLINE("newline"),
  NUMBER("number"),
  OP("operator"),
  STRING("string");

  private final String name;

  private TokenKind(String name) {
    this.name = name;
  }

  /**
   * Reports whether leaves of this kind only shape the layout of the token stream. Such leaves
   * never begin a logical line.
   */
  public boolean isLayout() {
    return this == NEWLINE || this == INDENT || this == DEDENT;
  }

  @Override
  public String toString() {
    return name;
  }
}
