/*
 * Copyright 2025 The Vlang Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.vlang.graph;

import com.google.common.base.Strings;

/**
 * Renders a program graph as an indented tree, one entity per line, for debugging. Each line has
 * the form {@code <kind>:<name-or-attribute>} and children are indented two spaces more than their
 * parent. For example:
 *
 * <pre>
 * Package:default
 *   Class:int
 *   Function:id
 *     Returns:value
 *       Class:int
 *     Object:x
 *       Class:int
 *     ReturnStatement
 *       ObjectExpression:x
 * </pre>
 */
public final class GraphPrinter {

  private static final int INDENT = 2;

  private final StringBuilder sb = new StringBuilder();
  private int depth;

  private GraphPrinter() {}

  /** Returns the tree rendering of the given package. */
  public static String print(PackageEntity pkg) {
    GraphPrinter printer = new GraphPrinter();
    printer.printPackage(pkg);
    return printer.sb.toString();
  }

  /** Returns the tree rendering of a single statement (and its sub-expressions). */
  public static String print(Statement statement) {
    GraphPrinter printer = new GraphPrinter();
    statement.accept(printer.statementPrinter);
    return printer.sb.toString();
  }

  private void line(String kind, String attribute) {
    sb.append(Strings.repeat(" ", depth * INDENT)).append(kind);
    if (!attribute.isEmpty()) {
      sb.append(':').append(attribute);
    }
    sb.append('\n');
  }

  private void printPackage(PackageEntity pkg) {
    line(pkg.kind(), pkg.name());
    depth++;
    pkg.classes().entities().forEach(this::printClass);
    pkg.functions().entities().forEach(this::printFunction);
    depth--;
  }

  private void printClass(ClassEntity cls) {
    line(cls.kind(), cls.name());
  }

  private void printFunction(FunctionEntity function) {
    line(function.kind(), function.name());
    depth++;
    line("Returns", function.returnMode().printName());
    if (function.returnMode() == ReturnMode.VALUE) {
      depth++;
      printClass(function.returnClass());
      depth--;
    }
    function.objects().entities().forEach(this::printObject);
    function.statements().entities().forEach(s -> s.accept(statementPrinter));
    depth--;
  }

  private void printObject(ObjectEntity object) {
    line(object.kind(), object.name());
    depth++;
    printClass(object.cls());
    depth--;
  }

  private final Statement.Visitor<Void> statementPrinter =
      new Statement.Visitor<>() {
        @Override
        public Void visitReturnStatement(ReturnStatement statement) {
          line(statement.kind(), "");
          Expression expression = statement.expression();
          if (expression != null) {
            depth++;
            expression.accept(this);
            depth--;
          }
          return null;
        }

        @Override
        public Void visitObjectExpression(ObjectExpression expression) {
          line(expression.kind(), expression.object().name());
          return null;
        }

        @Override
        public Void visitOperatorExpression(OperatorExpression expression) {
          line(expression.kind(), expression.operatorType().printName);
          depth++;
          expression.operands().entities().forEach(e -> e.accept(this));
          depth--;
          return null;
        }
      };
}
