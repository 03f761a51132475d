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
package net.hydromatic.gams.statement;

import net.hydromatic.gams.expressions.Expression;
import net.hydromatic.gams.expressions.IndexedReference;
import net.hydromatic.gams.expressions.WriterConfig;
import net.hydromatic.gams.symbol.GamsSet;
import net.hydromatic.gams.symbol.Parameter;

import org.checkerframework.checker.nullness.qual.Nullable;

import static net.hydromatic.gams.util.Static.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Assignment of data: {@code name(dom)[$(cond)] = rhs;}.
 *
 * <p>The right-hand side is written in call-safe context, since an
 * equation relation cannot appear there. A set assignment may have
 * {@code yes} or {@code no} as its right-hand side.
 */
public class Assignment extends Statement {
  /** Target reference, possibly masked by a condition. */
  public final Expression target;
  /** Right-hand side; null if {@link #flag} is used. */
  public final @Nullable Expression value;
  /** For set membership, {@code yes} or {@code no}; null otherwise. */
  public final @Nullable Boolean flag;

  Assignment(Expression target, @Nullable Expression value,
      @Nullable Boolean flag) {
    this.target = requireNonNull(target, "target");
    final IndexedReference ref = Statements.target(target);
    if (ref == null || !isAssignable(ref)) {
      throw RESOURCE.assignmentTargetInvalid(target.toGms()).ex();
    }
    this.value = value;
    this.flag = flag;
  }

  private static boolean isAssignable(IndexedReference ref) {
    if (ref.attribute != null) {
      return true;
    }
    return ref.parent instanceof Parameter || ref.parent instanceof GamsSet;
  }

  @Override protected String unparse(WriterConfig config) {
    final String rhs = value != null
        ? render(value, config.withCallSafe(true))
        : Boolean.TRUE.equals(flag) ? "yes" : "no";
    return render(target, config) + " = " + rhs + ";";
  }
}
