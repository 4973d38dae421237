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

import com.google.common.base.Preconditions;

/** Static methods for converting between string values and string literals. */
public class StringUtil {

  /**
   * Given the text of a string literal (including its enclosing single or double quotes), returns
   * the string it represents. Supports the escapes {@code \n}, {@code \t}, {@code \r}, {@code \0},
   * {@code \\}, {@code \'}, {@code \"}, and {@code \}{@code uXXXX}; any other escaped character
   * stands for itself.
   *
   * @throws IllegalArgumentException if a {@code \}{@code u} escape is not followed by four hex
   *     digits
   */
  public static String unescape(String literal) {
    int length = literal.length();
    Preconditions.checkArgument(
        length >= 2 && literal.charAt(length - 1) == literal.charAt(0), "Not a string literal");
    StringBuilder sb = new StringBuilder(length - 2);
    for (int i = 1; i < length - 1; i++) {
      char c = literal.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      char next = literal.charAt(++i);
      switch (next) {
        case 'n':
          sb.append('\n');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'r':
          sb.append('\r');
          break;
        case '0':
          sb.append('\0');
          break;
        case 'u':
          sb.append(hexChar(literal, i + 1, length - 1));
          i += 4;
          break;
        default:
          sb.append(next);
      }
    }
    return sb.toString();
  }

  /** Returns the char whose four hex digits begin at {@code start} and end by {@code end}. */
  private static char hexChar(String literal, int start, int end) {
    if (start + 4 > end) {
      throw new IllegalArgumentException("Invalid escape sequence");
    }
    int value = 0;
    for (int i = start; i < start + 4; i++) {
      int digit = Character.digit(literal.charAt(i), 16);
      if (digit < 0) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      value = value * 16 + digit;
    }
    return (char) value;
  }

  /** Returns a double-quoted literal for the given string, escaping as necessary. */
  public static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
        case '\\':
          sb.append('\\').append(c);
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\r':
          sb.append("\\r");
          break;
        default:
          if (c < ' ') {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.append('"').toString();
  }

  private StringUtil() {}
}
