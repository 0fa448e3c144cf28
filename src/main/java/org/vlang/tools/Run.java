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

package org.vlang.tools;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vlang.codegen.Translator;
import org.vlang.compiler.Compiler;
import org.vlang.compiler.Lexer;
import org.vlang.compiler.ParseError;
import org.vlang.compiler.Token;
import org.vlang.graph.GraphPrinter;
import org.vlang.graph.PackageEntity;

/**
 * A simple command-line tool that compiles a single V source file and prints the source, its
 * tokens, its program graph and the resulting C code.
 *
 * <p>System properties: {@code tabWidth} (default 2) sets the columns per tab used for token
 * positions, and {@code quiet=true} prints only the C code.
 */
public class Run {
  private static final Logger logger = LoggerFactory.getLogger(Run.class);

  private static final String DEFAULT_FILE = "input.v";

  private Run() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: run [<fileName>]");
      System.exit(1);
    }
  }

  private static void section(boolean quiet, String title, String text) {
    if (!quiet) {
      System.out.println("----------" + title + "----------");
      System.out.print(text.endsWith("\n") ? text : text + "\n");
    }
  }

  /**
   * Returns the tab width given by {@code value}, the default if it is null, or null if it is not
   * a positive integer.
   */
  static @Nullable Integer parseTabWidth(@Nullable String value) {
    if (value == null) {
      return Lexer.DEFAULT_COLUMNS_PER_TAB;
    }
    Integer tabWidth = Ints.tryParse(value.trim());
    return (tabWidth != null && tabWidth > 0) ? tabWidth : null;
  }

  public static void main(String[] args) throws IOException {
    checkUsage(args.length <= 1);
    Integer tabWidth = parseTabWidth(System.getProperty("tabWidth"));
    checkUsage(tabWidth != null);
    boolean quiet = Boolean.parseBoolean(System.getProperty("quiet", "false"));
    Path file = Path.of(args.length == 0 ? DEFAULT_FILE : args[0]);
    logger.info("Compiling {}", file);
    String source = Files.readString(file, StandardCharsets.UTF_8);
    section(quiet, "V Code", source);

    ImmutableList<Token> tokens = Compiler.lex(source, tabWidth);
    section(quiet, "Tokens", Compiler.formatTokens(tokens));

    PackageEntity pkg;
    try {
      pkg = Compiler.parse(tokens);
    } catch (ParseError e) {
      System.err.println("error: " + e.getMessage());
      System.exit(1);
      return;
    }
    section(quiet, "Graph ", GraphPrinter.print(pkg));

    String code = Translator.translate(pkg);
    if (quiet) {
      System.out.print(code);
    } else {
      section(false, "C Code", code);
    }
  }
}
