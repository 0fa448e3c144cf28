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

import org.jspecify.annotations.Nullable;

/**
 * The root of a program graph: one compilation unit. Holds the classes and functions declared in
 * it, each in declaration order.
 */
public final class PackageEntity extends Entity {
  private final EntityList<ClassEntity> classes = new EntityList<>(this);
  private final EntityList<FunctionEntity> functions = new EntityList<>(this);

  public PackageEntity(String name) {
    setName(name);
  }

  public EntityList<ClassEntity> classes() {
    return classes;
  }

  public EntityList<FunctionEntity> functions() {
    return functions;
  }

  public @Nullable ClassEntity lookupClass(String name) {
    return classes.lookup(name);
  }

  public @Nullable FunctionEntity lookupFunction(String name) {
    return functions.lookup(name);
  }

  @Override
  public String kind() {
    return "Package";
  }
}
