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
 * An executable unit in a function body.
 *
 * <p>The concrete kinds of statement are fixed ({@link ReturnStatement} and the {@link Expression}
 * subclasses); code that needs to distinguish them should use a {@link Visitor}, which forces every
 * kind to be handled.
 */
public abstract class Statement extends Entity {

  Statement() {}

  /** Calls the method of {@code visitor} that corresponds to this statement's kind. */
  public abstract <T> T accept(Visitor<T> visitor);

  /** Operations over every kind of statement, including expressions. */
  public interface Visitor<T> extends Expression.Visitor<T> {
    T visitReturnStatement(ReturnStatement statement);
  }
}
