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

import net.hydromatic.gams.expressions.DomainException;
import net.hydromatic.gams.expressions.Functions;
import net.hydromatic.gams.expressions.IndexedReference;
import net.hydromatic.gams.expressions.Literal;
import net.hydromatic.gams.runtime.GamsException;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for symbols and the references they create.
 */
class SymbolTest {
  private final GamsSet i = GamsSet.of("i");
  private final GamsSet j = GamsSet.of("j");
  private final GamsSet k = GamsSet.of("k", i);
  private final GamsSet t = GamsSet.of("t");
  private final Alias ip = Alias.of("ip", i);
  private final Parameter p = Parameter.of("p", i);
  private final Parameter scalar = Parameter.of("s");
  private final Variable x = Variable.of("x", i, j);

  @Test void testSet() {
    assertThat(i.dimension(), is(1));
    assertThat(i.domain().get(0), is(UniverseAlias.INSTANCE));
    assertThat(i.parentSet(), nullValue());
    assertThat(k.parentSet(), is(i));
    assertThat(i.ref().toGms(), is("i(*)"));
  }

  @Test void testScalarReference() {
    assertThat(scalar.ref().toGms(), is("s"));
    assertThat(scalar.at().toGms(), is("s"));
  }

  @Test void testReference() {
    assertThat(x.at(i, j).toGms(), is("x(i,j)"));
    assertThat(x.ref().toGms(), is("x(i,j)"));
    assertThat(x.at("seattle", j).toGms(), is("x(\"seattle\",j)"));
    assertThat(x.at("it's", j).toGms(), is("x(\"it's\",j)"));
    assertThat(p.at("say \"hi\"").toGms(), is("p('say \"hi\"')"));
  }

  @Test void testNegateReference() {
    assertThat(p.at(i).negate().toGms(), is("-p(i)"));
  }

  @Test void testAliasAndSubset() {
    assertThat(p.at(ip).toGms(), is("p(ip)"));
    assertThat(p.at(k).toGms(), is("p(k)"));
    assertThat(ip.set(), is(i));
    assertThat(ip.dimension(), is(1));
  }

  @Test void testDomainViolation() {
    final DomainException e =
        assertThrows(DomainException.class, () -> p.at(j));
    assertThat(e.getKind(), is(DomainException.Kind.DOMAIN_VIOLATION));
    assertThat(e.getMessage(), is("Index j at position 0 of p is not in domain i"));
    // A subset of a set is not a superset of it.
    final Parameter q = Parameter.of("q", k);
    assertThrows(DomainException.class, () -> q.at(i));
  }

  @Test void testUniverseAcceptsAnySet() {
    final Parameter u = Parameter.of("u", "*");
    assertThat(u.at(j).toGms(), is("u(j)"));
    assertThat(u.at("a").toGms(), is("u(\"a\")"));
  }

  @Test void testDimensionMismatch() {
    final DomainException e =
        assertThrows(DomainException.class, () -> x.at(i));
    assertThat(e.getKind(), is(DomainException.Kind.DIMENSION_MISMATCH));
    assertThat(e.getMessage(),
        is("Symbol x has dimension 2 but was indexed with 1 indices"));
  }

  @Test void testInvalidIndex() {
    final DomainException e =
        assertThrows(DomainException.class, () -> p.at(1));
    assertThat(e.getKind(), is(DomainException.Kind.INVALID_MEMBER));
  }

  @Test void testInvalidDeclaredDomain() {
    final DomainException e =
        assertThrows(DomainException.class, () -> Parameter.of("r", p));
    assertThat(e.getKind(), is(DomainException.Kind.INVALID_MEMBER));
  }

  @Test void testInvalidName() {
    assertThrows(IllegalArgumentException.class, () -> GamsSet.of("1abc"));
    assertThrows(IllegalArgumentException.class,
        () -> Parameter.of("a b"));
  }

  @Test void testLagAndLead() {
    final Parameter d = Parameter.of("d", t);
    assertThat(d.at(t.lag(1)).toGms(), is("d(t - 1)"));
    assertThat(d.at(t.lead(2)).toGms(), is("d(t + 2)"));
    assertThat(d.at(t.lag(1, true)).toGms(), is("d(t -- 1)"));
    assertThat(d.at(t.lead(1, true)).toGms(), is("d(t ++ 1)"));
    assertThat(d.at(t).minus(d.at(t.lag(1))).toGms(), is("d(t) - d(t - 1)"));
    assertThrows(IllegalArgumentException.class, () -> t.lag(-1));
    assertThrows(DomainException.class, () -> p.at(t.lag(1)));
  }

  @Test void testComputedOffset() {
    final Parameter d = Parameter.of("d", t);
    assertThat(d.at(t.lag(Functions.card(t))).toGms(),
        is("d(t - card(t))"));
    assertThat(d.at(t.lead(Functions.card(t), true)).toGms(),
        is("d(t ++ card(t))"));
    assertThat(d.at(t.lag(scalar.ref().plus(1))).toGms(),
        is("d(t - (s + 1))"));
    assertThat(d.at(t.lead(t.ord())).toGms(), is("d(t + t.ord)"));
    assertThat(t.lag(1), is(t.lag(Literal.of(1))));
  }

  @Test void testVariableAttributes() {
    assertThat(x.lo(i, j).toGms(), is("x.lo(i,j)"));
    assertThat(x.l(i, "b").toGms(), is("x.l(i,\"b\")"));
    assertThat(x.up(i, j).toGms(), is("x.up(i,j)"));
    assertThat(x.m(i, j).toGms(), is("x.m(i,j)"));
    assertThat(x.fx(i, j).toGms(), is("x.fx(i,j)"));
    assertThat(x.scale(i, j).toGms(), is("x.scale(i,j)"));
    assertThat(x.attr(Attribute.STAGE, i, j).toGms(), is("x.stage(i,j)"));
    final IndexedReference level = x.l(i, j);
    assertThat(level.attribute, is(Attribute.L));
  }

  @Test void testEquationOnlyAttributesOnVariable() {
    for (Attribute attribute
        : new Attribute[] {Attribute.RANGE, Attribute.SLACKLO,
            Attribute.SLACKUP, Attribute.SLACK, Attribute.INFEAS}) {
      final GamsException e =
          assertThrows(GamsException.class, () -> x.attr(attribute, i, j));
      assertThat(e.getMessage(),
          is("Attribute " + attribute.suffix
              + " does not apply to free variable x"));
    }
  }

  @Test void testAttributeOfParameter() {
    final GamsException e =
        assertThrows(GamsException.class,
            () -> IndexedReference.of(p, Attribute.LO, ImmutableList.of(i)));
    assertThat(e.getMessage(), is("Attribute lo does not apply to parameter p"));
    // The factory applies the same checks as Variable.attr.
    assertThrows(GamsException.class,
        () -> IndexedReference.of(x, Attribute.SLACK,
            ImmutableList.of(i, j)));
    assertThat(IndexedReference.of(x, Attribute.UP, ImmutableList.of(i, j))
        .toGms(), is("x.up(i,j)"));
  }

  @Test void testPriority() {
    final Variable y = Variable.of("y", VariableType.BINARY, i);
    assertThat(y.prior(i).toGms(), is("y.prior(i)"));
    final GamsException e =
        assertThrows(GamsException.class, () -> x.prior(i, j));
    assertThat(e.getMessage(),
        is("Attribute prior does not apply to free variable x"));
  }

  @Test void testEquationAttributes() {
    final Equation e = Equation.of("e", i);
    assertThat(e.attr(Attribute.M, i).toGms(), is("e.m(i)"));
    final GamsException ex =
        assertThrows(GamsException.class, () -> e.attr(Attribute.FX, i));
    assertThat(ex.getMessage(), is("Attribute fx does not apply to equation e"));
    assertThrows(GamsException.class, () -> e.attr(Attribute.PRIOR, i));
  }

  @Test void testEquationOnlyAttributes() {
    final Equation e = Equation.of("e", i);
    assertThat(e.attr(Attribute.STAGE, i).toGms(), is("e.stage(i)"));
    assertThat(e.attr(Attribute.RANGE, i).toGms(), is("e.range(i)"));
    assertThat(e.attr(Attribute.SLACKLO, i).toGms(), is("e.slacklo(i)"));
    assertThat(e.attr(Attribute.SLACKUP, "a").toGms(),
        is("e.slackup(\"a\")"));
    assertThat(e.attr(Attribute.SLACK, i).toGms(), is("e.slack(i)"));
    assertThat(e.attr(Attribute.INFEAS, i).toGms(), is("e.infeas(i)"));
  }

  @Test void testSetAttributes() {
    final Parameter d = Parameter.of("d", t);
    assertThat(t.first().toGms(), is("t.first"));
    assertThat(t.last().toGms(), is("t.last"));
    assertThat(t.ord().plus(1).toGms(), is("t.ord + 1"));
    assertThat(t.pos().toGms(), is("t.pos"));
    assertThat(ip.attr(SetAttribute.VAL).toGms(), is("ip.val"));
    assertThat(t.attr(SetAttribute.UEL).toGms(), is("t.uel"));
    assertThat(d.at(t).where(t.first()).toGms(), is("d(t)$(t.first)"));
    assertThat(d.at(t).where(t.last().not()).toGms(),
        is("d(t)$(not t.last)"));
    assertThat(t.first(), is(t.attr(SetAttribute.FIRST)));
  }

  @Test void testUnquotableLabel() {
    final DomainException e =
        assertThrows(DomainException.class, () -> p.at("a\"b'c"));
    assertThat(e.getKind(), is(DomainException.Kind.INVALID_MEMBER));
    assertThat(e.getMessage(),
        is("Label a\"b'c at position 0 contains both single and double "
            + "quotes and cannot be quoted"));
    assertThrows(DomainException.class,
        () -> Functions.sameAs(i, "a\"b'c"));
  }

  @Test void testUnquotableDescription() {
    final GamsException e =
        assertThrows(GamsException.class,
            () -> Parameter.of("r", ImmutableList.of(i), "6\" pipe's cost"));
    assertThat(e.getMessage(),
        is("Description 6\" pipe's cost of r contains both single and "
            + "double quotes and cannot be quoted"));
    assertThat(Parameter.of("r", ImmutableList.of(i), "6\" pipe")
        .description(), is("6\" pipe"));
  }

  @Test void testEquality() {
    assertThat(GamsSet.of("I").equals(i), is(true));
    assertThat(GamsSet.of("I").hashCode(), is(i.hashCode()));
    assertThat(Parameter.of("i").equals(i), is(false));
  }
}
