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
 * Expression masked by a dollar condition, such as {@code x(i)$(c(i))}.
 *
 * <p>The filter is always parenthesized and written in call-safe context.
 * Applying a further condition nests it: {@code x$(c1)$(c2)}.
 */
public class ConditionExpression extends Expression {
  /** Expression, {@link Domain} or {@link IndexMember} being masked. */
  public final Object owner;
  public final Expression filter;

  ConditionExpression(Object owner, Expression filter) {
    super(ExpressionType.Condition);
    this.owner = requireNonNull(owner, "owner");
    this.filter = requireNonNull(filter, "filter");
  }

  @Override void accept(ExpressionWriter writer, int lprec, int rprec) {
    if (writer.requireParentheses(this, lprec, rprec)) {
      return;
    }
    if (owner instanceof AbstractNode) {
      ((AbstractNode) owner).accept(writer, lprec, nodeType.lprec);
    } else {
      writer.append(Domain.memberToString(owner));
    }
    writer.operator(nodeType).callSafe(filter);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof ConditionExpression
        && owner.equals(((ConditionExpression) obj).owner)
        && filter.equals(((ConditionExpression) obj).filter);
  }

  @Override public int hashCode() {
    return Objects.hash(nodeType, owner, filter);
  }
}
