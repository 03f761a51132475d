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
package net.hydromatic.gams.runtime;

import net.hydromatic.gams.expressions.DomainException;
import net.hydromatic.gams.util.Static;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests for {@link Resources} and {@link GamsResource}.
 */
class ResourcesTest {
  /** Every message has a matching entry in the properties file, and its
   * arguments match the method's parameters. */
  @Test void testValidate() {
    Resources.validate(Static.RESOURCE);
  }

  @Test void testSubstitution() {
    assertThat(Static.RESOURCE.dimensionMismatch("x", 2, 1).str(),
        is("Symbol x has dimension 2 but was indexed with 1 indices"));
    assertThat(Static.RESOURCE.domainTooFewEntities(1000).str(),
        is("at least two indices required; got 1000, "
            + "use the set itself for a single index"));
    assertThat(Static.RESOURCE.relationNotCallSafe("=n=").raw(),
        is("Relation {0} cannot appear inside a function argument or "
            + "condition"));
  }

  @Test void testException() {
    final GamsException e =
        Static.RESOURCE.definitionNotRelation("x + 1").ex();
    assertThat(e.getMessage(),
        is("Equation definition requires a relation, got x + 1"));
    final IllegalStateException cause = new IllegalStateException("boom");
    final GamsException e2 =
        Static.RESOURCE.assignmentTargetInvalid("x(i)").ex(cause);
    assertThat(e2.getCause(), sameInstance(cause));
  }

  @Test void testDomainException() {
    final DomainException e =
        new DomainException(DomainException.Kind.TOO_FEW_ENTITIES, "m");
    assertThat(e.getKind(), is(DomainException.Kind.TOO_FEW_ENTITIES));
    assertThat(e.getMessage(), is("m"));
  }
}
