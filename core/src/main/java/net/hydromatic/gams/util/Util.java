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
package net.hydromatic.gams.util;

/**
 * Miscellaneous utility functions.
 */
public class Util {
  private Util() {}

  /** Returns whether a label or description can be written in quotes;
   * GAMS has no escape, so it must not contain both kinds of quote. */
  public static boolean isQuotable(String label) {
    return label.indexOf('"') < 0 || label.indexOf('\'') < 0;
  }

  /** Returns a GAMS element label in double quotes, or in single quotes if
   * the label itself contains a double quote.
   *
   * @see #isQuotable(String) */
  public static String quoteLabel(String label) {
    assert isQuotable(label) : label;
    return label.indexOf('"') >= 0
        ? "'" + label + "'"
        : "\"" + label + "\"";
  }
}
