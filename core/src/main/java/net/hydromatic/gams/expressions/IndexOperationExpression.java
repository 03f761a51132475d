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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Operation over the elements of an index, such as
 * {@code sum((i,j),c(i,j) * x(i,j))} or {@code smax(t$(d(t)),x(t))}.
 */
public class IndexOperationExpression extends Expression {
  /** A set-like {@link IndexMember}, a {@link Domain}, a reference to a
   * set, or a {@link ConditionExpression} masking one of those. */
  public final Object index;
  public final Expression body;

  IndexOperationExpression(ExpressionType nodeType, Object index,
      Expression body) {
    super(nodeType);
    assert ExpressionType.INDEX_OPERATIONS.contains(nodeType) : nodeType;
    this.index = requireNonNull(index, "index");
    this.body = requireNonNull(body, "body");
  }

  @Override void accept(ExpressionWriter writer, int lprec, int rprec) {
    writer.append(nodeType.op(false))
        .list("(", ",", ")", ImmutableList.of(index, body));
  }

  @Override public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (obj instanceof IndexOperationExpression) {
      final IndexOperationExpression that = (IndexOperationExpression) obj;
      return nodeType == that.nodeType
          && index.equals(that.index)
          && body.equals(that.body);
    }
    return false;
  }

  @Override public int hashCode() {
    return Objects.hash(nodeType, index, body);
  }
}
