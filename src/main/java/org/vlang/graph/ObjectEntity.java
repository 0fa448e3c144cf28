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

/** A named, typed storage slot: a function parameter or local. */
public final class ObjectEntity extends Entity {
  private ClassEntity cls;

  public ObjectEntity(ClassEntity cls) {
    this.cls = cls;
  }

  /** The class of this object. This is a reference to a class owned by the package. */
  public ClassEntity cls() {
    return cls;
  }

  public void setCls(ClassEntity cls) {
    this.cls = cls;
  }

  @Override
  public String kind() {
    return "Object";
  }
}
