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

import net.hydromatic.gams.runtime.GamsException;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ExpressionType}.
 */
class ExpressionTypeTest {
  @Test void testEquationTokens() {
    assertThat(ExpressionType.Equal.op(false), is(" =e= "));
    assertThat(ExpressionType.LessThanOrEqual.op(false), is(" =l= "));
    assertThat(ExpressionType.GreaterThanOrEqual.op(false), is(" =g= "));
  }

  @Test void testCallSafeTokens() {
    assertThat(ExpressionType.Equal.op(true), is(" eq "));
    assertThat(ExpressionType.LessThanOrEqual.op(true), is(" <= "));
    assertThat(ExpressionType.GreaterThanOrEqual.op(true), is(" >= "));
    assertThat(ExpressionType.NotEqual.op(true), is(" ne "));
    assertThat(ExpressionType.Add.op(true), is(" + "));
  }

  @Test void testRelationWithoutComparison() {
    for (ExpressionType type
        : new ExpressionType[] {ExpressionType.NonBinding,
            ExpressionType.External, ExpressionType.Conic,
            ExpressionType.Logic}) {
      final GamsException e =
          assertThrows(GamsException.class, () -> type.op(true));
      assertThat(e.getMessage(),
          is("Relation " + type.op(false).trim()
              + " cannot appear inside a function argument or condition"));
    }
  }

  @Test void testRelations() {
    for (ExpressionType type : ExpressionType.values()) {
      assertThat(type.isRelation(),
          is(ExpressionType.RELATIONS.contains(type)));
      if (type.isRelation()) {
        assertThat(ExpressionType.COMPARISONS.contains(type), is(true));
      }
    }
    assertThat(ExpressionType.COMPARISONS.contains(ExpressionType.LessThan),
        is(true));
    assertThat(ExpressionType.LessThan.isRelation(), is(false));
  }

  /** Operators that bind more tightly have greater precedence values. */
  @Test void testPrecedenceOrder() {
    final ExpressionType[] order = {
        ExpressionType.Condition, ExpressionType.Power,
        ExpressionType.Multiply, ExpressionType.Negate, ExpressionType.Add,
        ExpressionType.Equal, ExpressionType.Not, ExpressionType.And,
        ExpressionType.Or,
    };
    for (int i = 1; i < order.length; i++) {
      assertThat(order[i - 1] + " binds tighter than " + order[i],
          order[i - 1].lprec > order[i].lprec, is(true));
    }
    assertThat(ExpressionType.Or.lprec, is(ExpressionType.Xor.lprec));
    // Left-associative operators bind their right operand more tightly.
    assertThat(ExpressionType.Subtract.rprec,
        is(ExpressionType.Subtract.lprec + 1));
    assertThat(ExpressionType.Negate.lprec,
        is(ExpressionType.Negate.rprec + 1));
  }

  @Test void testAtomsHaveNoOperator() {
    assertThrows(AssertionError.class,
        () -> ExpressionType.Reference.op(false));
    assertThat(ExpressionType.Sum.op, is("sum"));
  }
}
