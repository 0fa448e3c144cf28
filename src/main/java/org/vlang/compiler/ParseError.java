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

import com.google.errorprone.annotations.FormatMethod;

/**
 * All errors detected while building the program graph throw a ParseError. Parsing stops at the
 * first one; no partial graph is returned.
 */
public class ParseError extends RuntimeException {
  public final String msg;

  /** The token at which parsing could not continue. */
  public final Token token;

  public ParseError(String msg, Token token) {
    super(msg);
    this.msg = msg;
    this.token = token;
  }

  /** Returns a new ParseError referring to the given token. */
  @FormatMethod
  static ParseError at(Token token, String fmt, Object... fmtArgs) {
    return new ParseError(String.format(fmt, fmtArgs), token);
  }

  /** Returns a new "Unexpected token" ParseError. */
  static ParseError unexpected(Token token) {
    return new ParseError("Unexpected token", token);
  }

  public int lineNum() {
    return token.line();
  }

  public int columnNum() {
    return token.column();
  }

  @Override
  public String getMessage() {
    return String.format("%s: %s", msg, token);
  }
}
