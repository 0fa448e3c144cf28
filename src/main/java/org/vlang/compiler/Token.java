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

package org.vlang.compiler;

/**
 * A classified unit of source text.
 *
 * @param type the kind of token
 * @param lexeme the source text that makes up this token; empty for {@link TokenType#END}
 * @param line the 1-based line on which the token starts
 * @param column the 1-based column at which the token starts, with tabs expanded
 */
public record Token(TokenType type, String lexeme, int line, int column) {

  /** Returns true if this token has the given type. */
  public boolean is(TokenType t) {
    return type == t;
  }

  /** Formats this token as {@code <kind> "<lexeme>" <line> <column>}. */
  @Override
  public String toString() {
    return String.format("%s \"%s\" %s %s", type, lexeme, line, column);
  }
}
