/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.hydromatic.gams.expressions;

/**
 * Utilities for checking parentheses in generated GAMS text.
 *
 * <p>Characters inside quoted element labels are ignored.
 */
public class Parentheses {
  private Parentheses() {}

  /** Returns whether every opening parenthesis in {@code s} is matched by
   * a later closing parenthesis, and vice versa. */
  public static boolean isBalanced(CharSequence s) {
    int depth = 0;
    char quote = 0;
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
        continue;
      }
      switch (c) {
      case '"':
      case '\'':
        quote = c;
        break;
      case '(':
        ++depth;
        break;
      case ')':
        if (--depth < 0) {
          return false;
        }
        break;
      default:
        break;
      }
    }
    return depth == 0 && quote == 0;
  }
}
