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
 * Builders for calls to GAMS built-in functions.
 *
 * <p>For example, {@code Functions.ifThen(d.at(i).ge(0.5), 1, 0)} renders
 * as {@code (ifthen(d(i) >= 0.5, 1, 0)  )}.
 */
public abstract class Functions {
  private Functions() {}

  public static CallExpression abs(Object x) {
    return Expressions.call(GmsFunction.ABS, x);
  }

  public static CallExpression ceil(Object x) {
    return Expressions.call(GmsFunction.CEIL, x);
  }

  public static CallExpression floor(Object x) {
    return Expressions.call(GmsFunction.FLOOR, x);
  }

  public static CallExpression exp(Object x) {
    return Expressions.call(GmsFunction.EXP, x);
  }

  /** Natural logarithm. */
  public static CallExpression log(Object x) {
    return Expressions.call(GmsFunction.LOG, x);
  }

  public static CallExpression log10(Object x) {
    return Expressions.call(GmsFunction.LOG10, x);
  }

  /** Square, {@code sqr(x)}. */
  public static CallExpression sqr(Object x) {
    return Expressions.call(GmsFunction.SQR, x);
  }

  public static CallExpression sqrt(Object x) {
    return Expressions.call(GmsFunction.SQRT, x);
  }

  /** Integer power, {@code power(x,n)}. */
  public static CallExpression power(Object x, Object n) {
    return Expressions.call(GmsFunction.POWER, x, n);
  }

  /** Real power, {@code rPower(x,y)}; x must be positive. */
  public static CallExpression rPower(Object x, Object y) {
    return Expressions.call(GmsFunction.RPOWER, x, y);
  }

  public static CallExpression round(Object x) {
    return Expressions.call(GmsFunction.ROUND, x);
  }

  /** Rounds to a number of decimal places. */
  public static CallExpression round(Object x, Object decimals) {
    return Expressions.call(GmsFunction.ROUND, x, decimals);
  }

  public static CallExpression mod(Object x, Object y) {
    return Expressions.call(GmsFunction.MOD, x, y);
  }

  public static CallExpression min(Object... args) {
    return Expressions.call(GmsFunction.MIN, args);
  }

  public static CallExpression max(Object... args) {
    return Expressions.call(GmsFunction.MAX, args);
  }

  public static CallExpression sin(Object x) {
    return Expressions.call(GmsFunction.SIN, x);
  }

  public static CallExpression cos(Object x) {
    return Expressions.call(GmsFunction.COS, x);
  }

  public static CallExpression tan(Object x) {
    return Expressions.call(GmsFunction.TAN, x);
  }

  public static CallExpression sign(Object x) {
    return Expressions.call(GmsFunction.SIGN, x);
  }

  /** Cumulative standard normal distribution. */
  public static CallExpression errorf(Object x) {
    return Expressions.call(GmsFunction.ERRORF, x);
  }

  /** Position of the current element of a set, {@code ord(t)}. */
  public static CallExpression ord(Object set) {
    return Expressions.call(GmsFunction.ORD, set);
  }

  /** Number of elements of a symbol, {@code card(t)}. */
  public static CallExpression card(Object symbol) {
    return Expressions.call(GmsFunction.CARD, symbol);
  }

  /** Whether two elements are the same; each argument is a set, an alias
   * or an element label. */
  public static CallExpression sameAs(Object a, Object b) {
    return Expressions.call(GmsFunction.SAME_AS, a, b);
  }

  /** Conditional value: {@code yes} if {@code condition} holds, otherwise
   * {@code no}. A relation in {@code condition} is written as a
   * comparison. */
  public static CallExpression ifThen(Object condition, Object yes,
      Object no) {
    return Expressions.call(GmsFunction.IFTHEN, condition, yes, no);
  }
}
