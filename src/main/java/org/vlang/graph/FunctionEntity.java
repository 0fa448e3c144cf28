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
 * A callable unit of program logic. A function has an ordered list of parameter objects, an
 * ordered list of body statements, and a {@link ReturnMode}. If the return mode is {@link
 * ReturnMode#VALUE} the function also has a return class.
 */
public final class FunctionEntity extends Entity {
  private final EntityList<ObjectEntity> objects = new EntityList<>(this);
  private final EntityList<Statement> statements = new EntityList<>(this);
  private ReturnMode returnMode = ReturnMode.NONE;
  private @Nullable ClassEntity returnClass;

  /** Creates an unnamed function that returns nothing. */
  public FunctionEntity() {}

  public FunctionEntity(String name) {
    setName(name);
  }

  /** The function's parameters, in declaration order. */
  public EntityList<ObjectEntity> objects() {
    return objects;
  }

  /** The function's body. */
  public EntityList<Statement> statements() {
    return statements;
  }

  public @Nullable ObjectEntity lookupObject(String name) {
    return objects.lookup(name);
  }

  public ReturnMode returnMode() {
    return returnMode;
  }

  /**
   * Returns the class of the returned value. Should only be called if the return mode is {@link
   * ReturnMode#VALUE}.
   */
  public ClassEntity returnClass() {
    Preconditions.checkState(returnMode == ReturnMode.VALUE, "%s returns nothing", this);
    return returnClass;
  }

  /** Makes this function return a value of the given class. */
  public void setReturnValue(ClassEntity cls) {
    returnMode = ReturnMode.VALUE;
    returnClass = Preconditions.checkNotNull(cls);
  }

  /** Makes this function return nothing. */
  public void setReturnNone() {
    returnMode = ReturnMode.NONE;
    returnClass = null;
  }

  @Override
  public String kind() {
    return "Function";
  }
}
