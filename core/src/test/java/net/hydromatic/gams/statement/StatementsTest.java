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
import net.hydromatic.gams.expressions.ExpressionType;
import net.hydromatic.gams.expressions.Expressions;
import net.hydromatic.gams.expressions.Functions;
import net.hydromatic.gams.expressions.Literal;
import net.hydromatic.gams.expressions.WriterConfig;
import net.hydromatic.gams.runtime.GamsException;
import net.hydromatic.gams.symbol.Alias;
import net.hydromatic.gams.symbol.Attribute;
import net.hydromatic.gams.symbol.Equation;
import net.hydromatic.gams.symbol.GamsSet;
import net.hydromatic.gams.symbol.Parameter;
import net.hydromatic.gams.symbol.Variable;
import net.hydromatic.gams.symbol.VariableType;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for rendering complete statements.
 */
class StatementsTest {
  private final GamsSet o = GamsSet.of("o");
  private final GamsSet p = GamsSet.of("p");
  private final Variable op = Variable.of("op", VariableType.BINARY, o, p);
  private final Parameter sumc = Parameter.of("sumc", o, p);
  private final Equation defopLS = Equation.of("defopLS", o, p);

  @Test void testDefinitionWithConditionalValue() {
    final EquationDefinition d =
        Statements.define(defopLS.at(o, p),
            op.at(o, p).eq(Functions.ifThen(sumc.at(o, p).ge(0.5), 1, 0)));
    assertThat(d.toGms(),
        is("defopLS(o,p) .. op(o,p) =e= (ifthen(sumc(o,p) >= 0.5, 1, 0)  );"));
    assertThat(d.equation(), is(defopLS));
    assertThat(d.isConditional(), is(false));
  }

  @Test void testConditionalDefinition() {
    final EquationDefinition d =
        Statements.define(defopLS.at(o, p).where(sumc.at(o, p).le(0.5)),
            op.at(o, p).eq(1));
    assertThat(d.toGms(),
        is("defopLS(o,p)$(sumc(o,p) <= 0.5) .. op(o,p) =e= 1;"));
    assertThat(d.isConditional(), is(true));
  }

  @Test void testDefinitionWithIndexedSum() {
    final GamsSet w = GamsSet.of("w");
    final GamsSet t = GamsSet.of("t");
    final Parameter tm = Parameter.of("tm", t);
    final Parameter td = Parameter.of("td", w, t);
    final Variable x = Variable.of("x", VariableType.POSITIVE, w, t);
    final Equation minw = Equation.of("minw", t);
    final EquationDefinition d =
        Statements.define(minw.at(t).where(tm.at(t)),
            Expressions.sum(w.where(td.at(w, t)), x.at(w, t)).ge(tm.at(t)));
    assertThat(d.toGms(),
        is("minw(t)$(tm(t)) .. sum(w$(td(w,t)),x(w,t)) =g= tm(t);"));
  }

  @Test void testNonBindingDefinition() {
    final Equation obj = Equation.of("obj");
    final Variable z = Variable.of("z");
    final EquationDefinition d =
        Statements.define(obj.ref(),
            Expressions.relation(ExpressionType.NonBinding, z.ref(), 0));
    assertThat(d.toGms(), is("obj .. z =n= 0;"));
  }

  @Test void testDefinitionRequiresEquation() {
    final GamsException e =
        assertThrows(GamsException.class,
            () -> Statements.define(sumc.at(o, p), op.at(o, p).eq(1)));
    assertThat(e.getMessage(),
        is("Definition head sumc(o,p) does not reference an equation"));
    assertThrows(GamsException.class,
        () -> Statements.define(
            Equation.of("e").attr(Attribute.M),
            op.at(o, p).eq(1)));
  }

  @Test void testDefinitionRequiresRelation() {
    final GamsException e =
        assertThrows(GamsException.class,
            () -> Statements.define(defopLS.at(o, p), op.at(o, p).plus(1)));
    assertThat(e.getMessage(),
        is("Equation definition requires a relation, got op(o,p) + 1"));
    // A comparison is not an equation relation.
    assertThrows(GamsException.class,
        () -> Statements.define(defopLS.at(o, p), op.at(o, p).lt(1)));
  }

  @Test void testAssignmentWithMaskedValue() {
    final GamsSet i = GamsSet.of("i");
    final GamsSet j = GamsSet.of("j");
    final Parameter muf = Parameter.of("muf", i, j);
    final Parameter rd = Parameter.of("rd", i, j);
    final Expression value =
        Literal.of(2.48).plus(Literal.of(new BigDecimal("0.0084"))
            .times(rd.ref()))
            .where(rd.ref());
    assertThat(Statements.assign(muf.ref(), value).toGms(),
        is("muf(i,j) = (2.48 + 0.0084 * rd(i,j))$(rd(i,j));"));
  }

  @Test void testSetMembership() {
    final GamsSet i = GamsSet.of("i");
    assertThat(Statements.assign(i.at("ahmsa"), true).toGms(),
        is("i(\"ahmsa\") = yes;"));
    assertThat(Statements.assign(i.at("ahmsa"), false).toGms(),
        is("i(\"ahmsa\") = no;"));
  }

  @Test void testConditionalAssignment() {
    final GamsSet s = GamsSet.of("s");
    final Parameter c = Parameter.of("c", s);
    final Assignment a =
        Statements.assign(
            c.at(s).where(Functions.ord(s).le(Functions.ord(s))), 1);
    assertThat(a.toGms(), is("c(s)$(ord(s) <= ord(s)) = 1;"));
  }

  @Test void testAssignmentValueIsCallSafe() {
    final Parameter flag = Parameter.of("flag", o, p);
    assertThat(Statements.assign(flag.ref(), sumc.ref().eq(0)).toGms(),
        is("flag(o,p) = sumc(o,p) eq 0;"));
    final Assignment bad =
        Statements.assign(flag.ref(),
            Expressions.relation(ExpressionType.NonBinding, sumc.ref(), 0));
    assertThrows(GamsException.class, bad::toGms);
  }

  @Test void testAttributeAssignment() {
    final GamsSet i = GamsSet.of("i");
    final Variable x = Variable.of("x", i);
    assertThat(Statements.assign(x.lo(i), 0).toGms(), is("x.lo(i) = 0;"));
    assertThat(Statements.assign(x.up("a"), Literal.INF).toGms(),
        is("x.up(\"a\") = inf;"));
    assertThat(Statements.assign(x.fx(i), Literal.of(-1)).toGms(),
        is("x.fx(i) = -1;"));
  }

  @Test void testAssignmentMaskedBySetAttribute() {
    final GamsSet t = GamsSet.of("t");
    final Variable x = Variable.of("x", VariableType.POSITIVE, t);
    final Parameter init = Parameter.of("init");
    assertThat(Statements.assign(x.fx(t).where(t.first()), init.ref())
            .toGms(),
        is("x.fx(t)$(t.first) = init;"));
    final Equation balance = Equation.of("balance", t);
    assertThat(
        Statements.define(balance.at(t).where(t.first().not()),
            x.at(t).eq(x.at(t.lag(1)).plus(1))).toGms(),
        is("balance(t)$(not t.first) .. x(t) =e= x(t - 1) + 1;"));
  }

  @Test void testInvalidAssignmentTarget() {
    final GamsSet i = GamsSet.of("i");
    final Variable x = Variable.of("x", i);
    final GamsException e =
        assertThrows(GamsException.class,
            () -> Statements.assign(x.at(i), 1));
    assertThat(e.getMessage(),
        is("Cannot assign to x(i); expected a parameter, a set or a "
            + "variable attribute"));
    assertThrows(GamsException.class,
        () -> Statements.assign(x.at(i).plus(1), 1));
    assertThrows(GamsException.class,
        () -> Statements.assign(Parameter.of("q").ref(), "abc"));
  }

  @Test void testDeclarations() {
    final GamsSet i = GamsSet.of("i");
    final GamsSet j = GamsSet.of("j", ImmutableList.of(i), "subset of i");
    final Alias ip = Alias.of("ip", i);
    final Variable x =
        Variable.of("x", VariableType.POSITIVE, ImmutableList.of(i, j),
            "flow");
    assertThat(Statements.declare(i).toGms(), is("Set i(*);"));
    assertThat(Statements.declare(j).toGms(),
        is("Set j(i) \"subset of i\";"));
    assertThat(Statements.declare(ip).toGms(), is("Alias (i,ip);"));
    assertThat(Statements.declare(x).toGms(),
        is("positive Variable x(i,j) \"flow\";"));
    assertThat(Statements.declare(Parameter.of("s")).toGms(),
        is("Parameter s;"));
    assertThat(Statements.declare(defopLS).toGms(),
        is("Equation defopLS(o,p);"));
  }

  @Test void testFolding() {
    final GamsSet i = GamsSet.of("i");
    final Parameter a = Parameter.of("a", i);
    final Parameter total = Parameter.of("total");
    Expression e = a.at("e0");
    for (int k = 1; k < 40; k++) {
      e = e.plus(a.at("e" + k));
    }
    final Assignment assignment = Statements.assign(total.ref(), e);
    final String unfolded = assignment.toGms();
    assertThat(unfolded, not(containsString("\n")));

    final String folded =
        assignment.toGms(WriterConfig.DEFAULT.withFoldLength(80));
    assertThat(folded, containsString("\n "));
    assertThat(folded.replace("\n", ""), is(unfolded));
    for (String line : folded.split("\n")) {
      assertThat(line.length() < 110, is(true));
    }
  }
}
