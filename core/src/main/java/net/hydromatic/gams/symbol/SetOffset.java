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

import net.hydromatic.gams.expressions.Expression;
import net.hydromatic.gams.expressions.ExpressionType;
import net.hydromatic.gams.expressions.Expressions;
import net.hydromatic.gams.expressions.IndexMember;
import net.hydromatic.gams.expressions.Literal;
import net.hydromatic.gams.expressions.Operable;
import net.hydromatic.gams.expressions.WriterConfig;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Set index shifted by a number of positions, such as {@code t - 1}
 * (lag), {@code t ++ 1} (circular lead) or {@code t - card(t)}.
 */
public class SetOffset implements IndexMember {
  public final SetLike base;
  public final Direction direction;
  public final boolean circular;
  /** Number of positions; a {@link Literal} or a computed expression. */
  public final Expression offset;

  private SetOffset(SetLike base, Direction direction, boolean circular,
      Expression offset) {
    this.base = requireNonNull(base, "base");
    this.direction = requireNonNull(direction, "direction");
    this.circular = circular;
    this.offset = requireNonNull(offset, "offset");
  }

  static SetOffset of(SetLike base, Direction direction, boolean circular,
      int n) {
    Preconditions.checkArgument(n >= 0, "offset must not be negative: %s", n);
    return new SetOffset(base, direction, circular, Literal.of(n));
  }

  static SetOffset of(SetLike base, Direction direction, boolean circular,
      Operable n) {
    return new SetOffset(base, direction, circular, Expressions.operand(n));
  }

  @Override public String toGms() {
    final String n = offset.toGms(WriterConfig.DEFAULT.withCallSafe(true));
    return base.name() + " "
        + (circular ? direction.sign + direction.sign : direction.sign)
        + " " + (isAtom(offset) ? n : "(" + n + ")");
  }

  /** Returns whether an offset can follow the sign without parentheses. */
  private static boolean isAtom(Expression e) {
    return e.nodeType == ExpressionType.Reference
        || e.nodeType == ExpressionType.Call
        || e.nodeType == ExpressionType.Constant
        && !((Literal) e).text().startsWith("-");
  }

  @Override public @Nullable GamsSet set() {
    return base.set();
  }

  @Override public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (obj instanceof SetOffset) {
      final SetOffset that = (SetOffset) obj;
      return base.equals(that.base)
          && direction == that.direction
          && circular == that.circular
          && offset.equals(that.offset);
    }
    return false;
  }

  @Override public int hashCode() {
    return Objects.hash(base, direction, circular, offset);
  }

  @Override public String toString() {
    return toGms();
  }

  /** Direction of an offset. */
  public enum Direction {
    LAG("-"),
    LEAD("+");

    final String sign;

    Direction(String sign) {
      this.sign = sign;
    }
  }
}
