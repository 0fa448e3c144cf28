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

/** Whether a function returns a result. */
public enum ReturnMode {
  /** The function returns nothing; its return statements carry no expression. */
  NONE,
  /** The function returns a copy of an object of its return class. */
  VALUE;

  /** The name used by {@link GraphPrinter}. */
  public String printName() {
    return switch (this) {
      case NONE -> "none";
      case VALUE -> "value";
    };
  }
}
