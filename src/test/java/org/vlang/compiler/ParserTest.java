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

import static com.google.common.truth.Truth.assertThat;
import static java.util.stream.Collectors.toList;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
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

@RunWith(JUnit4.class)
public class ParserTest {

  private static PackageEntity parse(String source) {
    return new Parser(new Lexer(source).run()).run();
  }

  private static ParseError parseError(String source) {
    return assertThrows(ParseError.class, () -> parse(source));
  }

  /** Returns the expression of the only statement of the only function. */
  private static Expression returnedExpression(PackageEntity pkg) {
    FunctionEntity function = pkg.functions().get(0);
    assertThat(function.statements().size()).isEqualTo(1);
    return ((ReturnStatement) function.statements().get(0)).expression();
  }

  private static ObjectEntity objectOf(Expression expression) {
    assertThat(expression).isInstanceOf(ObjectExpression.class);
    return ((ObjectExpression) expression).object();
  }

  @Test
  public void emptyProgram() {
    PackageEntity pkg = parse("  // nothing here\n");
    assertThat(pkg.name()).isEqualTo("default");
    assertThat(pkg.parent()).isNull();
    assertThat(pkg.functions().isEmpty()).isTrue();
    assertThat(pkg.classes().size()).isEqualTo(1);
    ClassEntity intClass = pkg.lookupClass("int");
    assertThat(intClass).isNotNull();
    assertThat(intClass.parent()).isSameInstanceAs(pkg);
  }

  @Test
  public void add() {
    PackageEntity pkg = parse("func add(int a, int b) -> int { return a+b; }");
    ClassEntity intClass = pkg.lookupClass("int");
    assertThat(pkg.functions().size()).isEqualTo(1);
    FunctionEntity add = pkg.lookupFunction("add");
    assertThat(add).isNotNull();
    assertThat(add.parent()).isSameInstanceAs(pkg);
    assertThat(add.returnMode()).isEqualTo(ReturnMode.VALUE);
    assertThat(add.returnClass()).isSameInstanceAs(intClass);

    assertThat(add.objects().size()).isEqualTo(2);
    ObjectEntity a = add.objects().get(0);
    ObjectEntity b = add.objects().get(1);
    assertThat(a.name()).isEqualTo("a");
    assertThat(b.name()).isEqualTo("b");
    assertThat(a.cls()).isSameInstanceAs(intClass);
    assertThat(b.cls()).isSameInstanceAs(intClass);
    assertThat(a.parent()).isSameInstanceAs(add);

    Expression expression = returnedExpression(pkg);
    assertThat(expression).isInstanceOf(OperatorExpression.class);
    OperatorExpression plus = (OperatorExpression) expression;
    assertThat(plus.operatorType()).isEqualTo(OperatorType.PLUS);
    assertThat(plus.parent()).isSameInstanceAs(add.statements().get(0));
    assertThat(plus.operands().size()).isEqualTo(2);
    assertThat(objectOf(plus.operands().get(0))).isSameInstanceAs(a);
    assertThat(objectOf(plus.operands().get(1))).isSameInstanceAs(b);
    assertThat(plus.operands().get(1).parent()).isSameInstanceAs(plus);
  }

  @Test
  public void noReturnClause() {
    PackageEntity pkg = parse("func noop() { }");
    FunctionEntity noop = pkg.functions().get(0);
    assertThat(noop.name()).isEqualTo("noop");
    assertThat(noop.returnMode()).isEqualTo(ReturnMode.NONE);
    assertThat(noop.objects().isEmpty()).isTrue();
    assertThat(noop.statements().isEmpty()).isTrue();
    assertThrows(IllegalStateException.class, noop::returnClass);
  }

  @Test
  public void plusIsLeftAssociative() {
    PackageEntity pkg = parse("func f(int a, int b, int c) -> int { return a+b+c; }");
    FunctionEntity f = pkg.functions().get(0);
    OperatorExpression outer = (OperatorExpression) returnedExpression(pkg);
    assertThat(outer.operands().size()).isEqualTo(2);
    assertThat(outer.operands().get(0)).isInstanceOf(OperatorExpression.class);
    OperatorExpression inner = (OperatorExpression) outer.operands().get(0);
    assertThat(inner.parent()).isSameInstanceAs(outer);
    assertThat(objectOf(inner.operands().get(0))).isSameInstanceAs(f.lookupObject("a"));
    assertThat(objectOf(inner.operands().get(1))).isSameInstanceAs(f.lookupObject("b"));
    assertThat(objectOf(outer.operands().get(1))).isSameInstanceAs(f.lookupObject("c"));
  }

  @Test
  public void singleObjectReturn() {
    PackageEntity pkg = parse("func id(int x) -> int { return x; }");
    assertThat(objectOf(returnedExpression(pkg)).name()).isEqualTo("x");
  }

  @Test
  public void bareReturn() {
    PackageEntity pkg = parse("func f(int x) { return; return; }");
    FunctionEntity f = pkg.functions().get(0);
    assertThat(f.statements().size()).isEqualTo(2);
    assertThat(((ReturnStatement) f.statements().get(0)).expression()).isNull();
  }

  @Test
  public void sameObjectUsedTwice() {
    PackageEntity pkg = parse("func twice(int x) -> int { return x+x; }");
    OperatorExpression plus = (OperatorExpression) returnedExpression(pkg);
    assertThat(objectOf(plus.operands().get(0)))
        .isSameInstanceAs(objectOf(plus.operands().get(1)));
  }

  @Test
  public void multipleFunctions() {
    PackageEntity pkg =
        parse("func a() { }\nfunc b(int x) -> int { return x; }\n/* trailing */ func c() { }");
    assertThat(pkg.functions().entities().stream().map(FunctionEntity::name).collect(toList()))
        .containsExactly("a", "b", "c")
        .inOrder();
  }

  @Test
  public void objectsAreScopedToTheirFunction() {
    ParseError e = parseError("func f(int x) { }\nfunc g(int y) -> int { return x; }");
    assertThat(e.msg).isEqualTo("Unknown object 'x'");
    assertThat(e.token.lexeme()).isEqualTo("x");
    assertThat(e.lineNum()).isEqualTo(2);
  }

  @Test
  public void unknownParameterClass() {
    ParseError e = parseError("func f(flt a) { }");
    assertThat(e.msg).isEqualTo("Unknown class 'flt'");
    assertThat(e.token).isEqualTo(new Token(TokenType.IDENTIFIER, "flt", 1, 8));
    assertThat(e.getMessage()).isEqualTo("Unknown class 'flt': identifier \"flt\" 1 8");
  }

  @Test
  public void unknownReturnClass() {
    ParseError e = parseError("func f() -> flt { }");
    assertThat(e.msg).isEqualTo("Unknown class 'flt'");
    assertThat(e.columnNum()).isEqualTo(13);
  }

  @Test
  public void unknownObject() {
    ParseError e = parseError("func f(int a) -> int {\n  return a+b;\n}");
    assertThat(e.msg).isEqualTo("Unknown object 'b'");
    assertThat(e.lineNum()).isEqualTo(2);
    assertThat(e.columnNum()).isEqualTo(12);
  }

  @Test
  public void functionIsNotAnObject() {
    assertThat(parseError("func f() -> int { return f; }").msg).isEqualTo("Unknown object 'f'");
  }

  @Test
  public void unexpectedTokens() {
    assertThat(parseError("func (").token.type()).isEqualTo(TokenType.LEFT_PAREN);
    assertThat(parseError("return").token.type()).isEqualTo(TokenType.RETURN_KEYWORD);
    assertThat(parseError("func f int").token.lexeme()).isEqualTo("int");
    assertThat(parseError("func f(int a int b) { }").token.column()).isEqualTo(14);
    assertThat(parseError("func f(int a,) { }").token.type()).isEqualTo(TokenType.RIGHT_PAREN);
    assertThat(parseError("func f() -> { }").token.type()).isEqualTo(TokenType.LEFT_CURLY);
    assertThat(parseError("func f() ;").token.type()).isEqualTo(TokenType.SEMICOLON);
    assertThat(parseError("func f() { f }").token.lexeme()).isEqualTo("f");
    assertThat(parseError("func f() { }  junk").token.lexeme()).isEqualTo("junk");
  }

  @Test
  public void unexpectedTokenInExpression() {
    String prefix = "func f(int a, int b) -> int { return ";
    assertThat(parseError(prefix + "a+; }").token.type()).isEqualTo(TokenType.SEMICOLON);
    assertThat(parseError(prefix + "a b; }").token.lexeme()).isEqualTo("b");
    assertThat(parseError(prefix + "a-b; }").token.type()).isEqualTo(TokenType.MINUS);
    assertThat(parseError(prefix + "a*b; }").token.type()).isEqualTo(TokenType.MULTIPLY);
    assertThat(parseError(prefix + "+a; }").token.type()).isEqualTo(TokenType.PLUS);
    ParseError e = parseError(prefix + "a");
    assertThat(e.msg).isEqualTo("Unexpected token");
    assertThat(e.token.type()).isEqualTo(TokenType.END);
  }

  @Test
  public void missingClosingBrace() {
    assertThat(parseError("func f() {").token.type()).isEqualTo(TokenType.END);
  }

  @Test
  public void returnValueFromFunctionWithoutResult() {
    ParseError e = parseError("func f(int a) { return a; }");
    assertThat(e.msg).isEqualTo("Function 'f' does not return a value");
    assertThat(e.token.lexeme()).isEqualTo("a");
  }

  @Test
  public void missingReturnValue() {
    ParseError e = parseError("func f(int a) -> int { return; }");
    assertThat(e.msg).isEqualTo("Missing return value");
    assertThat(e.token.type()).isEqualTo(TokenType.SEMICOLON);
  }

  @Test
  public void duplicateNames() {
    assertThat(parseError("func f(int a, int a) { }").msg).isEqualTo("Duplicate parameter 'a'");
    assertThat(parseError("func f() { } func f() { }").msg).isEqualTo("Duplicate function 'f'");
  }

  @Test
  public void tokensMustEndWithEndToken() {
    assertThrows(IllegalArgumentException.class, () -> new Parser(ImmutableList.of()));
    Token ident = new Token(TokenType.IDENTIFIER, "x", 1, 1);
    assertThrows(IllegalArgumentException.class, () -> new Parser(ImmutableList.of(ident)));
  }

  @Test
  public void cannotRunTwice() {
    Parser parser = new Parser(new Lexer("").run());
    PackageEntity unused = parser.run();
    assertThrows(IllegalStateException.class, parser::run);
  }
}
