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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts source text into a list of tokens.
 *
 * <p>The lexer is a state machine that reads each character of the source once, from left to
 * right; the only lookahead is the single character needed to tell {@code /} from a comment
 * start, {@code -} from {@code ->}, and CR from CRLF. As it goes it tracks the line and column of
 * the current character, and each token records the position of its first character.
 *
 * <p>Spaces, tabs, line breaks and comments never produce tokens. Characters that can't start any
 * token are skipped with a warning.
 *
 * <p>A Lexer may only be {@link #run} once.
 */
public class Lexer {

  private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

  /**
   * Marks the end of the source. Reaching either this character or the end of the string stops
   * the lexer.
   */
  public static final char END_OF_INPUT = '\0';

  /** The tab width used if {@link #setColumnsPerTab} is never called. */
  public static final int DEFAULT_COLUMNS_PER_TAB = 2;

  private static final CharMatcher IDENTIFIER_START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.is('_'));

  private static final CharMatcher IDENTIFIER_PART =
      IDENTIFIER_START.or(CharMatcher.inRange('0', '9'));

  private enum State {
    /** Between tokens; the next character starts a new lexeme. */
    START,
    /** Inside a run of identifier characters, which may turn out to be a keyword. */
    IDENTIFIER_OR_KEYWORD,
    /** After a character from {@link TokenType#PREFIXES}; the next character picks the token. */
    OPERATOR_PREFIX,
    /** After {@code /}: a divide token or the start of a comment. */
    DIVIDE_OR_COMMENT,
    /** Inside a {@code //} comment, which ends at the next line break. */
    SINGLE_LINE_COMMENT,
    /** Inside a {@code /*} comment. */
    MULTI_LINE_COMMENT,
    /** After a CR inside a multi-line comment. */
    MULTI_LINE_COMMENT_CR_OR_CRLF,
    /** After a {@code *} inside a multi-line comment; a {@code /} ends the comment. */
    MULTI_LINE_COMMENT_MAYBE_END,
    /** After a CR, which may be followed by the LF of a CRLF. */
    CR_OR_CRLF,
    /** The end token has been emitted. */
    DONE
  }

  private final String source;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private int columnsPerTab = DEFAULT_COLUMNS_PER_TAB;
  private State state = State.START;

  /** Set while in {@link State#OPERATOR_PREFIX}. */
  private TokenType.@Nullable Prefix prefix;

  private int index;
  private int line = 1;
  private int column = 1;

  // The position of the first character of the current lexeme.
  private int startIndex;
  private int startLine;
  private int startColumn;

  /**
   * Creates a Lexer for the given source. The source may, but need not, end with {@link
   * #END_OF_INPUT}; anything after an embedded {@link #END_OF_INPUT} is ignored.
   */
  public Lexer(String source) {
    this.source = source;
  }

  /**
   * Sets the number of columns per tab, which affects the column numbers recorded in tokens.
   * Defaults to {@link #DEFAULT_COLUMNS_PER_TAB}.
   */
  public void setColumnsPerTab(int columnsPerTab) {
    Preconditions.checkArgument(columnsPerTab > 0, "Tab width must be positive: %s", columnsPerTab);
    this.columnsPerTab = columnsPerTab;
  }

  /**
   * Returns the column following a tab, given the column counter after the tab character itself
   * has been consumed.
   */
  static int nextTabColumn(int column, int columnsPerTab) {
    return (column + columnsPerTab) / columnsPerTab * columnsPerTab;
  }

  /**
   * Runs the lexer to completion and returns the tokens. The last token is always the only one of
   * type {@link TokenType#END}.
   */
  public ImmutableList<Token> run() {
    Preconditions.checkState(state == State.START && index == 0, "Lexer has already been run");
    while (state != State.DONE) {
      step(currentChar());
    }
    ImmutableList<Token> result = tokens.build();
    logger.debug("Lexed {} tokens from {} lines", result.size(), line);
    return result;
  }

  private char currentChar() {
    return (index < source.length()) ? source.charAt(index) : END_OF_INPUT;
  }

  /** Performs one transition of the state machine, given the current character. */
  private void step(char c) {
    switch (state) {
      case START -> startToken(c);
      case IDENTIFIER_OR_KEYWORD -> {
        if (IDENTIFIER_PART.matches(c)) {
          advanceChar();
        } else {
          addToken(TokenType.keywordOrIdentifier(lexeme()));
          state = State.START;
        }
      }
      case OPERATOR_PREFIX -> {
        TokenType pair = prefix.pairs().get(c);
        if (pair != null) {
          advanceChar();
          addToken(pair);
        } else {
          addToken(prefix.alone());
        }
        prefix = null;
        state = State.START;
      }
      case DIVIDE_OR_COMMENT -> {
        if (c == '/') {
          advanceChar();
          state = State.SINGLE_LINE_COMMENT;
        } else if (c == '*') {
          advanceChar();
          state = State.MULTI_LINE_COMMENT;
        } else {
          addToken(TokenType.DIVIDE);
          state = State.START;
        }
      }
      case SINGLE_LINE_COMMENT -> {
        switch (c) {
          case '\n' -> {
            advanceChar();
            advanceLine();
            state = State.START;
          }
          case '\r' -> {
            advanceChar();
            state = State.CR_OR_CRLF;
          }
          case END_OF_INPUT -> state = State.START;
          default -> advanceChar();
        }
      }
      case MULTI_LINE_COMMENT -> {
        switch (c) {
          case '\n' -> {
            advanceChar();
            advanceLine();
          }
          case '\r' -> {
            advanceChar();
            state = State.MULTI_LINE_COMMENT_CR_OR_CRLF;
          }
          case '*' -> {
            advanceChar();
            state = State.MULTI_LINE_COMMENT_MAYBE_END;
          }
          case END_OF_INPUT -> {
            logger.warn("Unterminated comment at {}:{}", startLine, startColumn);
            state = State.START;
          }
          default -> advanceChar();
        }
      }
      case MULTI_LINE_COMMENT_CR_OR_CRLF -> {
        if (c == '\n') {
          advanceChar();
        }
        advanceLine();
        state = State.MULTI_LINE_COMMENT;
      }
      case MULTI_LINE_COMMENT_MAYBE_END -> {
        if (c == '/') {
          advanceChar();
          state = State.START;
        } else {
          // Reconsider c in the body of the comment; it may be another '*' or a line break.
          state = State.MULTI_LINE_COMMENT;
        }
      }
      case CR_OR_CRLF -> {
        if (c == '\n') {
          advanceChar();
        }
        advanceLine();
        state = State.START;
      }
      case DONE -> throw new AssertionError();
    }
  }

  /** Handles the first character of a new lexeme. */
  private void startToken(char c) {
    startIndex = index;
    startLine = line;
    startColumn = column;
    if (IDENTIFIER_START.matches(c)) {
      advanceChar();
      state = State.IDENTIFIER_OR_KEYWORD;
      return;
    }
    TokenType single = TokenType.singleChar(c);
    if (single != null) {
      advanceChar();
      addToken(single);
      return;
    }
    TokenType.Prefix p = TokenType.PREFIXES.get(c);
    if (p != null) {
      advanceChar();
      prefix = p;
      state = State.OPERATOR_PREFIX;
      return;
    }
    switch (c) {
      case '\n' -> {
        advanceChar();
        advanceLine();
      }
      case '\r' -> {
        advanceChar();
        state = State.CR_OR_CRLF;
      }
      case '\t' -> {
        advanceChar();
        column = nextTabColumn(column, columnsPerTab);
      }
      case ' ' -> advanceChar();
      case '/' -> {
        advanceChar();
        state = State.DIVIDE_OR_COMMENT;
      }
      case END_OF_INPUT -> {
        addToken(TokenType.END);
        state = State.DONE;
      }
      default -> {
        logger.warn("Skipping unrecognized character '{}' at {}:{}", c, line, column);
        advanceChar();
      }
    }
  }

  private void advanceChar() {
    if (index < source.length()) {
      ++index;
      ++column;
    }
  }

  private void advanceLine() {
    ++line;
    column = 1;
  }

  private String lexeme() {
    return source.substring(startIndex, index);
  }

  private void addToken(TokenType type) {
    tokens.add(new Token(type, lexeme(), startLine, startColumn));
  }
}
