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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * An ordered collection of the entities of one kind that are owned by a containing entity, e.g.
 * the parameters of a function.
 *
 * <p>Adding an entity sets its parent to the owner of this list, and removing it clears the parent.
 * Lookup by name is a linear scan in insertion order.
 */
public final class EntityList<T extends Entity> {
  private final Entity owner;
  private final List<T> entities = new ArrayList<>();

  EntityList(Entity owner) {
    this.owner = owner;
  }

  /**
   * Returns the first entity with the given name, or null if there is none. Never throws for a
   * missing name; callers must handle the null.
   */
  public @Nullable T lookup(String name) {
    for (T entity : entities) {
      if (entity.name().equals(name)) {
        return entity;
      }
    }
    return null;
  }

  /** Appends an entity, which must not currently be in any other list. */
  public void add(T entity) {
    Preconditions.checkArgument(
        entity.parent() == null, "%s is already contained in %s", entity, entity.parent());
    entities.add(entity);
    entity.setParent(owner);
  }

  /**
   * Removes an entity (compared by identity) from this list. Returns false if it was not present.
   */
  @CanIgnoreReturnValue
  public boolean remove(T entity) {
    for (int i = 0; i < entities.size(); i++) {
      if (entities.get(i) == entity) {
        entities.remove(i);
        entity.setParent(null);
        return true;
      }
    }
    return false;
  }

  /** An unmodifiable view of the entities, in the order they were added. */
  public List<T> entities() {
    return Collections.unmodifiableList(entities);
  }

  public T get(int i) {
    return entities.get(i);
  }

  public int size() {
    return entities.size();
  }

  public boolean isEmpty() {
    return entities.isEmpty();
  }

  @Override
  public String toString() {
    return entities.toString();
  }
}
