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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Represents an expression that has a binary operator, such as
 * {@code a(i) + b(i)} or {@code x(i) =l= c(i)}.
 */
public class BinaryExpression extends Expression {
  public final Expression expression0;
  public final Expression expression1;

  BinaryExpression(ExpressionType nodeType, Expression expression0,
      Expression expression1) {
    super(nodeType);
    this.expression0 = requireNonNull(expression0, "expression0");
    this.expression1 = requireNonNull(expression1, "expression1");
  }

  @Override void accept(ExpressionWriter writer, int lprec, int rprec) {
    if (writer.requireParentheses(this, lprec, rprec)) {
      return;
    }
    expression0.accept(writer, lprec, nodeType.lprec);
    writer.operator(nodeType);
    expression1.accept(writer, nodeType.rprec, rprec);
  }

  @Override public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (obj instanceof BinaryExpression) {
      final BinaryExpression that = (BinaryExpression) obj;
      return nodeType == that.nodeType
          && expression0.equals(that.expression0)
          && expression1.equals(that.expression1);
    }
    return false;
  }

  @Override public int hashCode() {
    return Objects.hash(nodeType, expression0, expression1);
  }
}
