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

/** The operators that may appear in an {@link OperatorExpression}. */
public enum OperatorType {
  PLUS("plus", "+");

  /** The name used by {@link GraphPrinter}. */
  public final String printName;

  /** The operator's C spelling. */
  public final String symbol;

  OperatorType(String printName, String symbol) {
    this.printName = printName;
    this.symbol = symbol;
  }
}
