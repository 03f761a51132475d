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

import net.hydromatic.gams.symbol.GamsSet;
import net.hydromatic.gams.symbol.Parameter;
import net.hydromatic.gams.symbol.UniverseAlias;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link Domain}.
 */
class DomainTest {
  private final GamsSet i = GamsSet.of("i");
  private final GamsSet j = GamsSet.of("j");
  private final GamsSet ij = GamsSet.of("ij", i, j);

  @Test void testTwoSets() {
    assertThat(Domain.of(i, j).toGms(), is("(i,j)"));
    assertThat(Domain.of(i, j).size(), is(2));
  }

  @Test void testThreeMembersWithLagAndUniverse() {
    assertThat(Domain.of(i, j.lag(1), "*").toGms(), is("(i,j - 1,*)"));
    assertThat(Domain.of(UniverseAlias.INSTANCE, i).toGms(), is("(*,i)"));
  }

  @Test void testReferenceToSetIsMember() {
    assertThat(Domain.of(ij.at(i, j), i).toGms(), is("(ij(i,j),i)"));
  }

  @Test void testSingleEntity() {
    final DomainException e =
        assertThrows(DomainException.class, () -> Domain.of(i));
    assertThat(e.getKind(), is(DomainException.Kind.TOO_FEW_ENTITIES));
    assertThat(e.getMessage(),
        startsWith("at least two indices required"));
  }

  @Test void testNoEntities() {
    final DomainException e =
        assertThrows(DomainException.class, () -> Domain.of());
    assertThat(e.getKind(), is(DomainException.Kind.TOO_FEW_ENTITIES));
  }

  @Test void testPlainStrings() {
    final DomainException e =
        assertThrows(DomainException.class, () -> Domain.of("i", "j"));
    assertThat(e.getKind(), is(DomainException.Kind.INVALID_MEMBER));
    assertThat(e.getMessage(),
        is("entity is not a valid domain member: i at position 0; "
            + "expected a set, an alias or the universe"));
  }

  @Test void testNonSetReference() {
    final Parameter p = Parameter.of("p", i);
    final DomainException e =
        assertThrows(DomainException.class, () -> Domain.of(i, p.at(i)));
    assertThat(e.getKind(), is(DomainException.Kind.INVALID_MEMBER));
    assertThat(e.getMessage(), containsString("position 1"));
  }

  @Test void testNumberIsNotMember() {
    final DomainException e =
        assertThrows(DomainException.class, () -> Domain.of(i, 3));
    assertThat(e.getKind(), is(DomainException.Kind.INVALID_MEMBER));
  }

  @Test void testWhere() {
    final Parameter c = Parameter.of("c", i, j);
    assertThat(Domain.of(i, j).where(c.at(i, j).gt(0)).toGms(),
        is("(i,j)$(c(i,j) > 0)"));
  }

  @Test void testEquality() {
    assertThat(Domain.of(i, j).equals(Domain.of(GamsSet.of("I"), j)),
        is(true));
    assertThat(Domain.of(i, j).equals(Domain.of(j, i)), is(false));
  }
}
