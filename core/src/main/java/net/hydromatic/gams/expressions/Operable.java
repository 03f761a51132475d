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
 * Operand that supports the GAMS operators.
 *
 * <p>Each method returns a new {@link Expression} and leaves the receiver
 * unchanged. Arguments may be other operands or {@link Number} values,
 * which become {@link Literal}s.
 *
 * <p>Method names stand in for Java's missing operator overloading:
 * {@code x.times(2).plus(y)} builds {@code x * 2 + y}.
 */
public interface Operable {
  /** Returns the expression that this operand stands for. */
  Expression toExpression();

  /** Returns {@code -this}. */
  default Expression negate() {
    return Expressions.negate(this);
  }

  /** Returns {@code this + o}. */
  default Expression plus(Object o) {
    return Expressions.makeBinary(ExpressionType.Add, this, o);
  }

  /** Returns {@code this - o}. */
  default Expression minus(Object o) {
    return Expressions.makeBinary(ExpressionType.Subtract, this, o);
  }

  /** Returns {@code this * o}. */
  default Expression times(Object o) {
    return Expressions.makeBinary(ExpressionType.Multiply, this, o);
  }

  /** Returns {@code this / o}. */
  default Expression divide(Object o) {
    return Expressions.makeBinary(ExpressionType.Divide, this, o);
  }

  /** Returns {@code this ** o}. */
  default Expression power(Object o) {
    return Expressions.makeBinary(ExpressionType.Power, this, o);
  }

  /** Returns the relation {@code this =e= o}. */
  default Expression eq(Object o) {
    return Expressions.makeBinary(ExpressionType.Equal, this, o);
  }

  /** Returns {@code this ne o}. */
  default Expression ne(Object o) {
    return Expressions.makeBinary(ExpressionType.NotEqual, this, o);
  }

  /** Returns the relation {@code this =l= o}. */
  default Expression le(Object o) {
    return Expressions.makeBinary(ExpressionType.LessThanOrEqual, this, o);
  }

  /** Returns the relation {@code this =g= o}. */
  default Expression ge(Object o) {
    return Expressions.makeBinary(ExpressionType.GreaterThanOrEqual, this,
        o);
  }

  /** Returns {@code this < o}. */
  default Expression lt(Object o) {
    return Expressions.makeBinary(ExpressionType.LessThan, this, o);
  }

  /** Returns {@code this > o}. */
  default Expression gt(Object o) {
    return Expressions.makeBinary(ExpressionType.GreaterThan, this, o);
  }

  /** Returns {@code this and o}. */
  default Expression and(Object o) {
    return Expressions.makeBinary(ExpressionType.And, this, o);
  }

  /** Returns {@code this or o}. */
  default Expression or(Object o) {
    return Expressions.makeBinary(ExpressionType.Or, this, o);
  }

  /** Returns {@code this xor o}. */
  default Expression xor(Object o) {
    return Expressions.makeBinary(ExpressionType.Xor, this, o);
  }

  /** Returns {@code not this}. */
  default Expression not() {
    return Expressions.not(this);
  }

  /** Returns a condition bound to this operand. */
  default Condition where() {
    return new Condition(toExpression());
  }

  /** Returns {@code this$(filter)}. */
  default ConditionExpression where(Object filter) {
    return where().filter(filter);
  }
}
