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

/**
 * Combines two or more operand expressions with a single kind of operator, e.g. {@code a+b}.
 *
 * <p>Operands are kept in source order. The parser nests operators to the left, so {@code a+b+c}
 * is {@code plus(plus(a, b), c)} rather than a single three-operand node.
 */
public final class OperatorExpression extends Expression {
  private final EntityList<Expression> operands = new EntityList<>(this);
  private final OperatorType operatorType;

  public OperatorExpression(OperatorType operatorType) {
    this.operatorType = operatorType;
  }

  public OperatorType operatorType() {
    return operatorType;
  }

  public EntityList<Expression> operands() {
    return operands;
  }

  @Override
  public <T> T accept(Expression.Visitor<T> visitor) {
    return visitor.visitOperatorExpression(this);
  }

  @Override
  public String kind() {
    return "OperatorExpression";
  }
}
