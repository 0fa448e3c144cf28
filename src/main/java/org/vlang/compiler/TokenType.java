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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of token produced by the {@link Lexer}.
 *
 * <p>The tables at the bottom of this class drive the lexer's classification of keywords and
 * punctuation, so that adding a new keyword or a new single-character token only requires a new
 * enum constant and a new table entry.
 */
public enum TokenType {
  ARROW,
  COMMA,
  DIVIDE,
  END,
  FUNC_KEYWORD,
  IDENTIFIER,
  LEFT_CURLY,
  LEFT_PAREN,
  MINUS,
  MODULO,
  MULTIPLY,
  PLUS,
  RETURN_KEYWORD,
  RIGHT_CURLY,
  RIGHT_PAREN,
  SEMICOLON;

  /** The name used in token dumps and diagnostics, e.g. {@code left_paren}. */
  public final String debugName = Ascii.toLowerCase(name());

  @Override
  public String toString() {
    return debugName;
  }

  /** Maps each keyword's text to its token type. */
  static final ImmutableMap<String, TokenType> KEYWORDS =
      ImmutableMap.of(
          "func", FUNC_KEYWORD,
          "return", RETURN_KEYWORD);

  /** Characters that always form a token by themselves. */
  static final ImmutableMap<Character, TokenType> SINGLE_CHAR =
      ImmutableMap.<Character, TokenType>builder()
          .put('+', PLUS)
          .put('*', MULTIPLY)
          .put('%', MODULO)
          .put(',', COMMA)
          .put(';', SEMICOLON)
          .put('{', LEFT_CURLY)
          .put('}', RIGHT_CURLY)
          .put('(', LEFT_PAREN)
          .put(')', RIGHT_PAREN)
          .buildOrThrow();

  /**
   * Characters that form a token by themselves unless they are followed by one of a small set of
   * characters, in which case the pair forms a different token (e.g. {@code -} and {@code ->}).
   */
  static final ImmutableMap<Character, Prefix> PREFIXES =
      ImmutableMap.of('-', new Prefix(MINUS, ImmutableMap.of('>', ARROW)));

  /**
   * One row of the {@link #PREFIXES} table.
   *
   * @param alone the token type if the prefix character is not followed by one of the keys of
   *     {@code pairs}
   * @param pairs maps each possible second character to the token type of the pair
   */
  record Prefix(TokenType alone, ImmutableMap<Character, TokenType> pairs) {}

  /** Returns the keyword token type for the given text, or {@link #IDENTIFIER}. */
  static TokenType keywordOrIdentifier(String lexeme) {
    return KEYWORDS.getOrDefault(lexeme, IDENTIFIER);
  }

  /** Returns the token type of a single-character token, or null if {@code c} isn't one. */
  static @Nullable TokenType singleChar(char c) {
    return SINGLE_CHAR.get(c);
  }
}
