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
package net.hydromatic.gams.symbol;

import net.hydromatic.gams.expressions.ConditionExpression;
import net.hydromatic.gams.expressions.Expressions;
import net.hydromatic.gams.expressions.IndexMember;
import net.hydromatic.gams.expressions.Operable;
import net.hydromatic.gams.expressions.SetAttributeReference;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Symbol whose elements can index other symbols: a set or an alias.
 */
public abstract class SetLike extends Symbol implements IndexMember {
  SetLike(String name, List<?> domain, @Nullable String description) {
    super(name, domain, description);
  }

  @Override public String toGms() {
    return name();
  }

  /** Returns {@code this - n}, the element {@code n} positions before. */
  public SetOffset lag(int n) {
    return lag(n, false);
  }

  /** Returns {@code this - n}, or {@code this -- n} if circular. */
  public SetOffset lag(int n, boolean circular) {
    return SetOffset.of(this, SetOffset.Direction.LAG, circular, n);
  }

  /** Returns {@code this - n} for a computed offset, such as
   * {@code t - card(t)}. */
  public SetOffset lag(Operable n) {
    return lag(n, false);
  }

  /** Returns {@code this - n}, or {@code this -- n} if circular. */
  public SetOffset lag(Operable n, boolean circular) {
    return SetOffset.of(this, SetOffset.Direction.LAG, circular, n);
  }

  /** Returns {@code this + n}, the element {@code n} positions after. */
  public SetOffset lead(int n) {
    return lead(n, false);
  }

  /** Returns {@code this + n}, or {@code this ++ n} if circular. */
  public SetOffset lead(int n, boolean circular) {
    return SetOffset.of(this, SetOffset.Direction.LEAD, circular, n);
  }

  /** Returns {@code this + n} for a computed offset. */
  public SetOffset lead(Operable n) {
    return lead(n, false);
  }

  /** Returns {@code this + n}, or {@code this ++ n} if circular. */
  public SetOffset lead(Operable n, boolean circular) {
    return SetOffset.of(this, SetOffset.Direction.LEAD, circular, n);
  }

  /** Returns an attribute of the current element, such as
   * {@code t.val}. */
  public SetAttributeReference attr(SetAttribute attribute) {
    return SetAttributeReference.of(this, attribute);
  }

  /** Returns {@code this.ord}, the position of the current element. */
  public SetAttributeReference ord() {
    return attr(SetAttribute.ORD);
  }

  /** Returns {@code this.pos}. */
  public SetAttributeReference pos() {
    return attr(SetAttribute.POS);
  }

  /** Returns {@code this.first}, which is 1 for the first element. */
  public SetAttributeReference first() {
    return attr(SetAttribute.FIRST);
  }

  /** Returns {@code this.last}, which is 1 for the last element. */
  public SetAttributeReference last() {
    return attr(SetAttribute.LAST);
  }

  /** Returns {@code this$(filter)}, for use as the index of an indexed
   * operation such as {@code sum(i$(c(i)),x(i))}. */
  public ConditionExpression where(Object filter) {
    return Expressions.condition(this, filter);
  }
}
