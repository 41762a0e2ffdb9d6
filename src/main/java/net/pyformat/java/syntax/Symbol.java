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

/**
 * A Symbol is the grammar kind of a composite {@link Node}. Its name is the name of the
 * corresponding production of the Python grammar.
 */
public enum Symbol {
  // Module and block structure.
  FILE_INPUT("file_input", false),
  SUITE("suite", false),

  // Definitions.
  ASYNC_FUNCDEF("async_funcdef", false),
  CLASSDEF("classdef", false),
  DECORATED("decorated", false),
  DECORATOR("decorator", false),
  DECORATORS("decorators", false),
  FUNCDEF("funcdef", false),
  PARAMETERS("parameters", false),
  TYPEDARGSLIST("typedargslist", false),

  // Statements, in the sense of the blank-line rules: a statement directly following a class or
  // function body is separated from it like a definition would be.
  ASSERT_STMT("assert_stmt", true),
  ASYNC_STMT("async_stmt", true),
  BREAK_STMT("break_stmt", true),
  CONTINUE_STMT("continue_stmt", true),
  DEL_STMT("del_stmt", true),
  EXEC_STMT("exec_stmt", true),
  EXPR_STMT("expr_stmt", true),
  FOR_STMT("for_stmt", true),
  GLOBAL_STMT("global_stmt", true),
  IF_STMT("if_stmt", true),
  IMPORT_STMT("import_stmt", true),
  NONLOCAL_STMT("nonlocal_stmt", true),
  PASS_STMT("pass_stmt", true),
  PRINT_STMT("print_stmt", true),
  RAISE_STMT("raise_stmt", true),
  RETURN_STMT("return_stmt", true),
  SIMPLE_STMT("simple_stmt", true),
  SMALL_STMT("small_stmt", true),
  TRY_STMT("try_stmt", true),
  WHILE_STMT("while_stmt", true),
  WITH_STMT("with_stmt", true),
  YIELD_STMT("yield_stmt", true),

  // Statement parts that are not statements themselves.
  DOTTED_NAME("dotted_name", false),
  EXCEPT_CLAUSE("except_clause", false),
  IMPORT_FROM("import_from", false),
  IMPORT_NAME("import_name", false),

  // Expressions.
  ARGLIST("arglist", false),
  ARITH_EXPR("arith_expr", false),
  ATOM("atom", false),
  COMPARISON("comparison", false),
  POWER("power", false),
  TERM("term", false),
  TRAILER("trailer", false);

  private final String name;
  private final boolean statement;

  private Symbol(String name, boolean statement) {
    this.name = name;
    this.statement = statement;
  }

  /** Returns the grammar name of the symbol, e.g. {@code funcdef}. */
  public String getName() {
    return name;
  }

  /** Reports whether nodes of this symbol are statements. */
  public boolean isStatement() {
    return statement;
  }

  @Override
  public String toString() {
    return name;
  }
}
