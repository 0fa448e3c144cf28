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

package org.vlang.codegen;

import java.util.stream.Collectors;
import org.vlang.graph.Expression;
import org.vlang.graph.FunctionEntity;
import org.vlang.graph.ObjectEntity;
import org.vlang.graph.ObjectExpression;
import org.vlang.graph.OperatorExpression;
import org.vlang.graph.PackageEntity;
import org.vlang.graph.ReturnStatement;
import org.vlang.graph.Statement;

/**
 * Translates a program graph into C source text.
 *
 * <p>The graph must be complete, as built by the parser; no re-validation is done here. The
 * translation has no side effects and keeps no state between calls, so translating the same graph
 * twice gives the same text.
 */
public final class Translator {

  /** Prepended to each statement in a function body. */
  static final String INDENT = "  ";

  // Static methods only
  private Translator() {}

  /** Returns the C definitions of every function in the package, in declaration order. */
  public static String translate(PackageEntity pkg) {
    return pkg.functions().entities().stream()
        .map(Translator::translate)
        .collect(Collectors.joining());
  }

  /**
   * Returns the C definition of a function, e.g.
   *
   * <pre>
   * int add(int a, int b) {
   *   return (a+b);
   * }
   * </pre>
   */
  public static String translate(FunctionEntity function) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        switch (function.returnMode()) {
          case NONE -> "void";
          case VALUE -> function.returnClass().name();
        });
    sb.append(' ').append(function.name()).append('(');
    sb.append(
        function.objects().entities().stream()
            .map(Translator::declaration)
            .collect(Collectors.joining(", ")));
    sb.append(") {\n");
    for (Statement statement : function.statements().entities()) {
      sb.append(INDENT).append(statement.accept(STATEMENTS)).append(";\n");
    }
    sb.append("}\n");
    return sb.toString();
  }

  /** Returns the C text of an expression. */
  public static String translate(Expression expression) {
    return expression.accept(STATEMENTS);
  }

  private static String declaration(ObjectEntity object) {
    return object.cls().name() + " " + object.name();
  }

  /** Translates a statement, without its terminating semicolon. */
  private static final Statement.Visitor<String> STATEMENTS =
      new Statement.Visitor<>() {
        @Override
        public String visitReturnStatement(ReturnStatement statement) {
          Expression expression = statement.expression();
          return (expression == null) ? "return" : "return " + expression.accept(this);
        }

        @Override
        public String visitObjectExpression(ObjectExpression expression) {
          return expression.object().name();
        }

        @Override
        public String visitOperatorExpression(OperatorExpression expression) {
          return expression.operands().entities().stream()
              .map(e -> e.accept(this))
              .collect(Collectors.joining(expression.operatorType().symbol, "(", ")"));
        }
      };
}
