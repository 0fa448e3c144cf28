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

package org.vlang.codegen;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.vlang.compiler.Compiler;
import org.vlang.graph.ClassEntity;
import org.vlang.graph.FunctionEntity;
import org.vlang.graph.ObjectEntity;
import org.vlang.graph.ObjectExpression;
import org.vlang.graph.OperatorExpression;
import org.vlang.graph.OperatorType;
import org.vlang.graph.PackageEntity;
import org.vlang.graph.ReturnStatement;

@RunWith(JUnit4.class)
public class TranslatorTest {
  PackageEntity pkg;
  ClassEntity intClass;

  @Before
  public void setup() {
    pkg = new PackageEntity("test");
    intClass = new ClassEntity("int");
    pkg.classes().add(intClass);
  }

  private ObjectEntity addParam(FunctionEntity function, String name) {
    ObjectEntity object = new ObjectEntity(intClass);
    object.setName(name);
    function.objects().add(object);
    return object;
  }

  @Test
  public void add() {
    String source = "func add(int a, int b) -> int { return a+b; }";
    assertThat(Compiler.compile(source)).isEqualTo("int add(int a, int b) {\n  return (a+b);\n}\n");
  }

  @Test
  public void noop() {
    assertThat(Compiler.compile("func noop() { }")).isEqualTo("void noop() {\n}\n");
  }

  @Test
  public void idempotent() {
    PackageEntity parsed =
        Compiler.parse(Compiler.lex("func f(int a, int b, int c) -> int { return a+b+c; }"));
    String first = Translator.translate(parsed);
    assertThat(first).isEqualTo("int f(int a, int b, int c) {\n  return ((a+b)+c);\n}\n");
    assertThat(Translator.translate(parsed)).isEqualTo(first);
  }

  @Test
  public void emptyPackage() {
    assertThat(Translator.translate(pkg)).isEmpty();
  }

  @Test
  public void flatOperatorExpression() {
    // The parser only builds binary operators, but the graph allows more operands.
    FunctionEntity f = new FunctionEntity("f");
    pkg.functions().add(f);
    f.setReturnValue(intClass);
    OperatorExpression sum = new OperatorExpression(OperatorType.PLUS);
    for (String name : new String[] {"x", "y", "z"}) {
      sum.operands().add(new ObjectExpression(addParam(f, name)));
    }
    ReturnStatement ret = new ReturnStatement();
    ret.setExpression(sum);
    f.statements().add(ret);
    assertThat(Translator.translate(sum)).isEqualTo("(x+y+z)");
    assertThat(Translator.translate(pkg))
        .isEqualTo("int f(int x, int y, int z) {\n  return (x+y+z);\n}\n");
  }

  @Test
  public void expressionStatementAndBareReturn() {
    FunctionEntity f = new FunctionEntity("f");
    pkg.functions().add(f);
    ObjectEntity x = addParam(f, "x");
    f.statements().add(new ObjectExpression(x));
    f.statements().add(new ReturnStatement());
    assertThat(Translator.translate(f)).isEqualTo("void f(int x) {\n  x;\n  return;\n}\n");
  }

  @Test
  public void usesClassAndObjectNamesVerbatim() {
    ClassEntity counter = new ClassEntity("counter_t");
    pkg.classes().add(counter);
    FunctionEntity f = new FunctionEntity("next_count");
    pkg.functions().add(f);
    f.setReturnValue(counter);
    ObjectEntity c = new ObjectEntity(counter);
    c.setName("c_1");
    f.objects().add(c);
    ReturnStatement ret = new ReturnStatement();
    ret.setExpression(new ObjectExpression(c));
    f.statements().add(ret);
    assertThat(Translator.translate(pkg))
        .isEqualTo("counter_t next_count(counter_t c_1) {\n  return c_1;\n}\n");
  }

  @Test
  public void functionsInDeclarationOrder() {
    assertThat(Compiler.compile("func b() { }\nfunc a() { }"))
        .isEqualTo("void b() {\n}\nvoid a() {\n}\n");
  }
}
