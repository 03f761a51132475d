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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;

import static net.hydromatic.gams.util.Static.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Numeric constant.
 *
 * <p>The value is written the way the caller supplied it: {@code 2} as
 * "2", {@code 2.0} as "2.0". Infinite and NaN values are written as the
 * GAMS special values {@code inf}, {@code -inf} and {@code na}.
 */
public class Literal extends Expression {
  /** Positive infinity. */
  public static final Literal INF =
      new Literal(Double.POSITIVE_INFINITY, "inf");

  /** Negative infinity. */
  public static final Literal MINUS_INF =
      new Literal(Double.NEGATIVE_INFINITY, "-inf");

  /** Not available. */
  public static final Literal NA = new Literal(Double.NaN, "na");

  /** A value that is numerically zero but distinct from zero. */
  public static final Literal EPS = new Literal(0D, "eps");

  /** Undefined. */
  public static final Literal UNDF = new Literal(Double.NaN, "undf");

  public final Number value;
  private final String text;

  private Literal(Number value, String text) {
    super(ExpressionType.Constant);
    this.value = value;
    this.text = text;
  }

  /** Creates a literal.
   *
   * @param value A {@link Number}
   * @throws net.hydromatic.gams.runtime.GamsException if value is not
   * numeric
   */
  public static Literal of(@Nullable Object value) {
    if (value instanceof Literal) {
      return (Literal) value;
    }
    if (!(value instanceof Number)) {
      throw RESOURCE.literalNotNumeric(String.valueOf(value),
          value == null ? "null" : value.getClass().getSimpleName()).ex();
    }
    final Number number = (Number) value;
    if (number instanceof Double || number instanceof Float) {
      final double d = number.doubleValue();
      if (Double.isNaN(d)) {
        return NA;
      }
      if (Double.isInfinite(d)) {
        return d > 0 ? INF : MINUS_INF;
      }
    }
    if (number instanceof BigDecimal) {
      return new Literal(number, ((BigDecimal) number).toPlainString());
    }
    return new Literal(number, number.toString());
  }

  @Override void accept(ExpressionWriter writer, int lprec, int rprec) {
    if (isSigned() && writer.requireSignParentheses(this, lprec, rprec)) {
      return;
    }
    writer.append(text);
  }

  @Override boolean isSigned() {
    return text.startsWith("-");
  }

  /** Returns the text of this literal. */
  public String text() {
    return text;
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof Literal
        && text.equals(((Literal) obj).text);
  }

  @Override public int hashCode() {
    return text.hashCode();
  }

  /** Returns the literal for a special value keyword, such as "inf". */
  public static Literal special(String keyword) {
    switch (requireNonNull(keyword, "keyword")) {
    case "inf":
      return INF;
    case "-inf":
      return MINUS_INF;
    case "na":
      return NA;
    case "eps":
      return EPS;
    case "undf":
      return UNDF;
    default:
      throw new IllegalArgumentException("unknown special value " + keyword);
    }
  }
}
