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

import net.hydromatic.gams.expressions.BinaryExpression;
import net.hydromatic.gams.expressions.ConditionExpression;
import net.hydromatic.gams.expressions.Expression;
import net.hydromatic.gams.expressions.IndexedReference;
import net.hydromatic.gams.expressions.WriterConfig;
import net.hydromatic.gams.symbol.Equation;

import static net.hydromatic.gams.util.Static.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Definition of an equation's algebra:
 * {@code name(dom)[$(cond)] .. lhs =e= rhs;}.
 */
public class EquationDefinition extends Statement {
  /** Equation reference, possibly masked by a condition. */
  public final Expression head;
  public final BinaryExpression relation;

  EquationDefinition(Expression head, Expression relation) {
    this.head = requireNonNull(head, "head");
    final IndexedReference ref = Statements.target(head);
    if (ref == null || !(ref.parent instanceof Equation)
        || ref.attribute != null) {
      throw RESOURCE.definitionHeadNotEquation(head.toGms()).ex();
    }
    if (!(relation instanceof BinaryExpression)
        || !relation.nodeType.isRelation()) {
      throw RESOURCE.definitionNotRelation(relation.toGms()).ex();
    }
    this.relation = (BinaryExpression) relation;
  }

  /** Returns the equation being defined. */
  public Equation equation() {
    return (Equation) requireNonNull(Statements.target(head)).parent;
  }

  /** Returns whether the head carries a condition. */
  public boolean isConditional() {
    return head instanceof ConditionExpression;
  }

  @Override protected String unparse(WriterConfig config) {
    return render(head, config) + " .. " + render(relation, config) + ";";
  }
}
