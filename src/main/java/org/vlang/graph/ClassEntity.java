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
 * A named type. Every object has a class; for now a class carries nothing beyond its identity, and
 * two classes are the same only if they are the same ClassEntity.
 */
public final class ClassEntity extends Entity {

  public ClassEntity(String name) {
    setName(name);
  }

  @Override
  public String kind() {
    return "Class";
  }
}
