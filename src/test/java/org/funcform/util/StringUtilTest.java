/*
 * Copyright 2025 The Funcform Authors
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


package org.funcform.util;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StringUtilTest {

  @Test
  public void unescape() {
    assertThat(StringUtil.unescape("'a\\tb'")).isEqualTo("a\tb");
    assertThat(StringUtil.unescape("\"\\'\\q\"")).isEqualTo("'q");
    assertThat(StringUtil.unescape("'\\u0041\\u00e9'")).isEqualTo("A\u00e9");
  }

  @Test
  public void truncatedUnicodeEscape() {
    assertThrows(IllegalArgumentException.class, () -> StringUtil.unescape("'\\u'"));
    assertThrows(IllegalArgumentException.class, () -> StringUtil.unescape("'\\u12'"));
    assertThrows(IllegalArgumentException.class, () -> StringUtil.unescape("'\\uZZZZ'"));
  }

  @Test
  public void quoteEscapes() {
    assertThat(StringUtil.quote("a\"b\n")).isEqualTo("\"a\\\"b\\n\"");
  }
}
