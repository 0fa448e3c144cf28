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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.vlang.compiler.Lexer;

@RunWith(JUnit4.class)
public class RunTest {

  @Test
  public void tabWidthDefault() {
    assertThat(Run.parseTabWidth(null)).isEqualTo(Lexer.DEFAULT_COLUMNS_PER_TAB);
  }

  @Test
  public void tabWidthValid() {
    assertThat(Run.parseTabWidth("4")).isEqualTo(4);
    assertThat(Run.parseTabWidth(" 8 ")).isEqualTo(8);
  }

  @Test
  public void tabWidthInvalid() {
    assertThat(Run.parseTabWidth("four")).isNull();
    assertThat(Run.parseTabWidth("")).isNull();
    assertThat(Run.parseTabWidth("0")).isNull();
    assertThat(Run.parseTabWidth("-2")).isNull();
    assertThat(Run.parseTabWidth("99999999999")).isNull();
  }
}
