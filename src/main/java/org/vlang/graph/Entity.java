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
 * The base class of every node in the program graph.
 *
 * <p>Every entity has a name, which need only be unique within the entity that contains it (and
 * may be empty, e.g. for statements). An entity is contained in at most one {@link EntityList} at a
 * time; {@link #parent} is the owner of that list. The parent link is only for traversal, never
 * for lookup.
 *
 * <p>Subclasses are all defined in this package, so the set of entity kinds is closed.
 */
public abstract class Entity {
  private String name = "";
  private @Nullable Entity parent;

  Entity() {}

  public String name() {
    return name;
  }

  public void setName(String name) {
    this.name = Preconditions.checkNotNull(name);
  }

  /** Returns the entity that contains this one, or null if it is a root or not yet attached. */
  public @Nullable Entity parent() {
    return parent;
  }

  void setParent(@Nullable Entity parent) {
    assert parent == null || this.parent == null;
    this.parent = parent;
  }

  /** The name of this kind of entity, e.g. {@code "Function"}. */
  public abstract String kind();

  @Override
  public String toString() {
    return name.isEmpty() ? kind() : kind() + ":" + name;
  }
}
