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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vlang.graph.ClassEntity;
import org.vlang.graph.Expression;
import org.vlang.graph.FunctionEntity;
import org.vlang.graph.ObjectEntity;
import org.vlang.graph.ObjectExpression;
import org.vlang.graph.OperatorExpression;
import org.vlang.graph.OperatorType;
import org.vlang.graph.PackageEntity;
import org.vlang.graph.ReturnMode;
import org.vlang.graph.ReturnStatement;

/**
 * Converts a list of tokens into a program graph.
 *
 * <p>The parser is a predictive state machine with one token of lookahead. It builds the graph as
 * it goes, attaching each entity to its container as soon as the entity is recognized and
 * resolving names against the entities already declared: parameter and return classes must be
 * classes of the package, and identifiers in expressions must be objects of the current function.
 * There are no forward references.
 *
 * <p>The first token that can't continue the program throws a {@link ParseError}; no partial graph
 * is returned and no further tokens are read.
 *
 * <p>A Parser may only be {@link #run} once.
 */
public class Parser {

  private static final Logger logger = LoggerFactory.getLogger(Parser.class);

  /** The name of the package built by the parser. */
  public static final String PACKAGE_NAME = "default";

  /** Classes that are declared in every package before any user code is parsed. */
  public static final ImmutableList<String> BUILTIN_CLASSES = ImmutableList.of("int");

  /** Maps each token that may join two operands to the corresponding operator. */
  private static final ImmutableMap<TokenType, OperatorType> BINARY_OPERATORS =
      ImmutableMap.of(TokenType.PLUS, OperatorType.PLUS);

  private enum State {
    /** Expecting a function declaration or the end of the input. */
    START,
    /** After {@code func}; expecting the function name. */
    FUNC_NAME,
    /** Expecting the {@code (} that starts the parameter list. */
    FUNC_PARAMS_START,
    /** After {@code (}; expecting a parameter or {@code )}. */
    FUNC_PARAM_OR_END,
    /** Expecting a parameter, starting with its class. */
    FUNC_PARAM,
    /** Expecting a parameter name. */
    FUNC_PARAM_NAME,
    /** After a parameter; expecting {@code ,} or {@code )}. */
    FUNC_PARAMS_NEXT_OR_END,
    /** After the parameter list; expecting {@code ->} or the function body. */
    FUNC_RETURN_CLAUSE,
    /** After {@code ->}; expecting the return class. */
    FUNC_RETURN_TYPE,
    /** Expecting the {@code {} that starts the function body. */
    FUNC_BODY,
    /** Inside a function body; expecting a statement or {@code }}. */
    STATEMENT,
    /** After {@code return}; expecting a value or {@code ;}. */
    RETURN_VALUE_OR_END,
    /** Inside an expression; expecting a value. */
    EXPRESSION_VALUE,
    /** Inside an expression, after a value; expecting an operator or {@code ;}. */
    EXPRESSION_OPERATOR,
    /** The end token has been reached. */
    DONE
  }

  private final ImmutableList<Token> tokens;
  private int index;
  private State state = State.START;

  // The entities currently being built.
  private final PackageEntity pkg = new PackageEntity(PACKAGE_NAME);
  private FunctionEntity function;
  private ObjectEntity object;
  private ReturnStatement returnStatement;

  /** The operand most recently parsed in the current expression. */
  private @Nullable ObjectExpression operand;

  /** The operator expression still waiting for its right-hand operand, if any. */
  private @Nullable OperatorExpression pendingOperator;

  /** The tokens must end with a single {@link TokenType#END} token. */
  public Parser(ImmutableList<Token> tokens) {
    Preconditions.checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenType.END),
        "Token list must end with an end token");
    this.tokens = tokens;
  }

  /** Runs the parser, returning the package that holds the whole program. */
  public PackageEntity run() {
    Preconditions.checkState(state == State.START && index == 0, "Parser has already been run");
    for (String name : BUILTIN_CLASSES) {
      pkg.classes().add(new ClassEntity(name));
    }
    while (state != State.DONE) {
      step(currentToken());
    }
    logger.debug("Parsed {} functions", pkg.functions().size());
    return pkg;
  }

  private Token currentToken() {
    return tokens.get(index);
  }

  /** Moves to the next token; never moves past the end token. */
  private void advanceToken() {
    if (!currentToken().is(TokenType.END)) {
      ++index;
    }
  }

  /** Performs one transition of the state machine, given the current token. */
  private void step(Token token) {
    switch (state) {
      case START -> {
        if (token.is(TokenType.END)) {
          state = State.DONE;
          return;
        }
        expect(token, TokenType.FUNC_KEYWORD);
        function = new FunctionEntity();
        pkg.functions().add(function);
        state = State.FUNC_NAME;
        advanceToken();
      }
      case FUNC_NAME -> {
        expect(token, TokenType.IDENTIFIER);
        if (pkg.lookupFunction(token.lexeme()) != null) {
          throw ParseError.at(token, "Duplicate function '%s'", token.lexeme());
        }
        function.setName(token.lexeme());
        state = State.FUNC_PARAMS_START;
        advanceToken();
      }
      case FUNC_PARAMS_START -> {
        expect(token, TokenType.LEFT_PAREN);
        state = State.FUNC_PARAM_OR_END;
        advanceToken();
      }
      case FUNC_PARAM_OR_END -> {
        if (token.is(TokenType.RIGHT_PAREN)) {
          state = State.FUNC_RETURN_CLAUSE;
          advanceToken();
        } else {
          state = State.FUNC_PARAM;
        }
      }
      case FUNC_PARAM -> {
        object = new ObjectEntity(resolveClass(token));
        function.objects().add(object);
        state = State.FUNC_PARAM_NAME;
        advanceToken();
      }
      case FUNC_PARAM_NAME -> {
        expect(token, TokenType.IDENTIFIER);
        if (function.lookupObject(token.lexeme()) != null) {
          throw ParseError.at(token, "Duplicate parameter '%s'", token.lexeme());
        }
        object.setName(token.lexeme());
        state = State.FUNC_PARAMS_NEXT_OR_END;
        advanceToken();
      }
      case FUNC_PARAMS_NEXT_OR_END -> {
        if (token.is(TokenType.COMMA)) {
          state = State.FUNC_PARAM;
        } else {
          expect(token, TokenType.RIGHT_PAREN);
          state = State.FUNC_RETURN_CLAUSE;
        }
        advanceToken();
      }
      case FUNC_RETURN_CLAUSE -> {
        if (token.is(TokenType.ARROW)) {
          state = State.FUNC_RETURN_TYPE;
          advanceToken();
        } else {
          state = State.FUNC_BODY;
        }
      }
      case FUNC_RETURN_TYPE -> {
        function.setReturnValue(resolveClass(token));
        state = State.FUNC_BODY;
        advanceToken();
      }
      case FUNC_BODY -> {
        expect(token, TokenType.LEFT_CURLY);
        state = State.STATEMENT;
        advanceToken();
      }
      case STATEMENT -> {
        if (token.is(TokenType.RIGHT_CURLY)) {
          logger.debug("Parsed function '{}'", function.name());
          state = State.START;
        } else {
          expect(token, TokenType.RETURN_KEYWORD);
          returnStatement = new ReturnStatement();
          function.statements().add(returnStatement);
          state = State.RETURN_VALUE_OR_END;
        }
        advanceToken();
      }
      case RETURN_VALUE_OR_END -> {
        if (token.is(TokenType.SEMICOLON)) {
          if (function.returnMode() == ReturnMode.VALUE) {
            throw ParseError.at(token, "Missing return value");
          }
          state = State.STATEMENT;
          advanceToken();
        } else {
          if (function.returnMode() == ReturnMode.NONE) {
            throw ParseError.at(token, "Function '%s' does not return a value", function.name());
          }
          state = State.EXPRESSION_VALUE;
        }
      }
      case EXPRESSION_VALUE -> {
        expect(token, TokenType.IDENTIFIER);
        ObjectEntity value = function.lookupObject(token.lexeme());
        if (value == null) {
          throw ParseError.at(token, "Unknown object '%s'", token.lexeme());
        }
        operand = new ObjectExpression(value);
        state = State.EXPRESSION_OPERATOR;
        advanceToken();
      }
      case EXPRESSION_OPERATOR -> {
        if (token.is(TokenType.SEMICOLON)) {
          returnStatement.setExpression(finishExpression());
          state = State.STATEMENT;
          advanceToken();
          return;
        }
        OperatorType operatorType = BINARY_OPERATORS.get(token.type());
        if (operatorType == null) {
          throw ParseError.unexpected(token);
        }
        // Everything parsed so far becomes the left operand of the new operator.
        OperatorExpression next = new OperatorExpression(operatorType);
        next.operands().add(finishExpression());
        pendingOperator = next;
        state = State.EXPRESSION_VALUE;
        advanceToken();
      }
      case DONE -> throw new AssertionError();
    }
  }

  /**
   * Completes the expression parsed so far by giving the pending operator (if any) its last
   * operand, and returns it.
   */
  private Expression finishExpression() {
    ObjectExpression last = operand;
    operand = null;
    if (pendingOperator == null) {
      return last;
    }
    OperatorExpression result = pendingOperator;
    pendingOperator = null;
    result.operands().add(last);
    return result;
  }

  /** Returns the package class named by the given token, which must be an identifier. */
  private ClassEntity resolveClass(Token token) {
    expect(token, TokenType.IDENTIFIER);
    ClassEntity cls = pkg.lookupClass(token.lexeme());
    if (cls == null) {
      throw ParseError.at(token, "Unknown class '%s'", token.lexeme());
    }
    return cls;
  }

  private static void expect(Token token, TokenType type) {
    if (!token.is(type)) {
      throw ParseError.unexpected(token);
    }
  }
}
