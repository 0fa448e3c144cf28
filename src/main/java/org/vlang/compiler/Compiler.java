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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import org.vlang.codegen.Translator;
import org.vlang.graph.PackageEntity;

/**
 * Runs the stages of the compiler. Each stage consumes only the output of the previous one:
 *
 * <ul>
 *   <li>{@link Lexer}: source text to tokens;
 *   <li>{@link Parser}: tokens to program graph; and
 *   <li>{@link Translator}: program graph to C source text.
 * </ul>
 */
public final class Compiler {

  // Static methods only
  private Compiler() {}

  /** Converts source text into tokens, expanding tabs to the given width. */
  public static ImmutableList<Token> lex(String source, int columnsPerTab) {
    Lexer lexer = new Lexer(source);
    lexer.setColumnsPerTab(columnsPerTab);
    return lexer.run();
  }

  /** Converts source text into tokens, using the default tab width. */
  public static ImmutableList<Token> lex(String source) {
    return lex(source, Lexer.DEFAULT_COLUMNS_PER_TAB);
  }

  /**
   * Builds the program graph for the given tokens.
   *
   * @throws ParseError if the tokens are not a valid program
   */
  public static PackageEntity parse(ImmutableList<Token> tokens) {
    return new Parser(tokens).run();
  }

  /**
   * Compiles source text to C.
   *
   * @throws ParseError if the source is not a valid program
   */
  public static String compile(String source) {
    return Translator.translate(parse(lex(source)));
  }

  /** Formats tokens one per line, as {@code <kind> "<lexeme>" <line> <column>}. */
  public static String formatTokens(List<Token> tokens) {
    return tokens.stream().map(t -> t + "\n").collect(Collectors.joining());
  }
}
