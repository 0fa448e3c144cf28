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

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * Exits the function, returning control to the caller. In a function that returns a value the
 * statement carries the expression that computes it.
 */
public final class ReturnStatement extends Statement {
  private @Nullable Expression expression;

  public ReturnStatement() {}

  /** Returns the expression whose value is returned, or null for a bare {@code return}. */
  public @Nullable Expression expression() {
    return expression;
  }

  /** Sets the returned expression; this statement becomes its parent. */
  public void setExpression(@Nullable Expression expression) {
    Preconditions.checkArgument(
        expression == null || expression.parent() == null || expression == this.expression,
        "%s is already contained in %s",
        expression,
        expression == null ? null : expression.parent());
    if (this.expression != null) {
      this.expression.setParent(null);
    }
    if (expression != null) {
      expression.setParent(this);
    }
    this.expression = expression;
  }

  @Override
  public <T> T accept(Statement.Visitor<T> visitor) {
    return visitor.visitReturnStatement(this);
  }

  @Override
  public String kind() {
    return "ReturnStatement";
  }
}
