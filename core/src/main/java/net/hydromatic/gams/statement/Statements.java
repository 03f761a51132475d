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

import net.hydromatic.gams.expressions.ConditionExpression;
import net.hydromatic.gams.expressions.Expression;
import net.hydromatic.gams.expressions.Expressions;
import net.hydromatic.gams.expressions.IndexedReference;
import net.hydromatic.gams.symbol.Symbol;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factory for statements.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * Statements.define(defopLS.at(o, p),
 *     op.at(o, p).eq(Functions.ifThen(sumc.at(o, p).ge(0.5), 1, 0)))
 * </pre></blockquote>
 *
 * <p>renders as
 * {@code defopLS(o,p) .. op(o,p) =e= (ifthen(sumc(o,p) >= 0.5, 1, 0)  );}.
 */
public abstract class Statements {
  private Statements() {}

  /** Creates an equation definition.
   *
   * @param head Reference to an equation, optionally masked by
   *             {@code where}
   * @param relation Relation such as {@code lhs.eq(rhs)}
   * @throws net.hydromatic.gams.runtime.GamsException if the head is not an
   * equation reference or the relation is not an equation relation
   */
  public static EquationDefinition define(Expression head,
      Expression relation) {
    return new EquationDefinition(head, relation);
  }

  /** Creates an assignment.
   *
   * @param target Reference to a parameter, set or attribute, optionally
   *               masked by {@code where}
   * @param value  Operand, number, or {@code Boolean} for set membership
   */
  public static Assignment assign(Expression target, Object value) {
    if (value instanceof Boolean) {
      return new Assignment(target, null, (Boolean) value);
    }
    return new Assignment(target, Expressions.operand(value), null);
  }

  /** Creates a declaration. */
  public static Declaration declare(Symbol symbol) {
    return new Declaration(symbol);
  }

  /** Returns the reference under any conditions, or null if there is
   * none. */
  static @Nullable IndexedReference target(Expression e) {
    Object o = e;
    while (o instanceof ConditionExpression) {
      o = ((ConditionExpression) o).owner;
    }
    return o instanceof IndexedReference ? (IndexedReference) o : null;
  }
}
