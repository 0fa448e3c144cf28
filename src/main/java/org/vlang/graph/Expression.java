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
 * Expressions evaluate to an object. They are recursive: an {@link OperatorExpression} combines
 * sub-expressions, while an {@link ObjectExpression} is a leaf.
 */
public abstract class Expression extends Statement {

  Expression() {}

  /** Calls the method of {@code visitor} that corresponds to this expression's kind. */
  public abstract <T> T accept(Visitor<T> visitor);

  @Override
  public final <T> T accept(Statement.Visitor<T> visitor) {
    return accept((Visitor<T>) visitor);
  }

  /** Operations over every kind of expression. */
  public interface Visitor<T> {
    T visitObjectExpression(ObjectExpression expression);

    T visitOperatorExpression(OperatorExpression expression);
  }
}
