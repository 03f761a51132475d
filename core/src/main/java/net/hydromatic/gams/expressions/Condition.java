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

import static java.util.Objects.requireNonNull;

/**
 * Dollar condition bound to an owner, waiting for its filter.
 *
 * <p>{@code owner.where().filter(f)} renders as {@code owner$(f)}.
 * The owner is an expression, a {@link Domain}, or a set used as the
 * index of an indexed operation.
 */
public class Condition {
  private final Object owner;

  Condition(Object owner) {
    this.owner = requireNonNull(owner, "owner");
  }

  /** Returns the owner of this condition. */
  public Object owner() {
    return owner;
  }

  /** Masks the owner with a filter. */
  public ConditionExpression filter(Object filter) {
    return new ConditionExpression(owner, Expressions.operand(filter));
  }
}
