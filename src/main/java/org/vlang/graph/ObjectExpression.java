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

/** Evaluates to the value of a single object, e.g. {@code a}. */
public final class ObjectExpression extends Expression {
  private final ObjectEntity object;

  public ObjectExpression(ObjectEntity object) {
    this.object = object;
  }

  /** The object this expression reads. This is a reference, not a child. */
  public ObjectEntity object() {
    return object;
  }

  @Override
  public <T> T accept(Expression.Visitor<T> visitor) {
    return visitor.visitObjectExpression(this);
  }

  @Override
  public String kind() {
    return "ObjectExpression";
  }
}
