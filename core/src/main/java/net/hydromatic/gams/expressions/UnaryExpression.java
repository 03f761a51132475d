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
 * Represents an expression that has a prefix operator, such as
 * {@code -x(i)} or {@code not b(i)}.
 */
public class UnaryExpression extends Expression {
  public final Expression expression;

  UnaryExpression(ExpressionType nodeType, Expression expression) {
    super(nodeType);
    this.expression = requireNonNull(expression, "expression");
  }

  @Override void accept(ExpressionWriter writer, int lprec, int rprec) {
    if (isSigned()
        ? writer.requireSignParentheses(this, lprec, rprec)
        : writer.requireParentheses(this, lprec, rprec)) {
      return;
    }
    writer.operator(nodeType);
    expression.accept(writer, nodeType.lprec, rprec);
  }

  @Override boolean isSigned() {
    return nodeType == ExpressionType.Negate;
  }

  @Override public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (obj instanceof UnaryExpression) {
      final UnaryExpression unaryExpression = (UnaryExpression) obj;
      return nodeType == unaryExpression.nodeType
          && expression.equals(unaryExpression.expression);
    }
    return false;
  }

  @Override public int hashCode() {
    return Objects.hash(nodeType, expression);
  }
}
