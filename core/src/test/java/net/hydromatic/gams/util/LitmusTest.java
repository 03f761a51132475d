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
package net.hydromatic.gams.util;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Litmus} and {@link Util}.
 */
class LitmusTest {
  @Test void testThrow() {
    assertThat(Litmus.THROW.check(true, "never"), is(true));
    final AssertionError e =
        assertThrows(AssertionError.class,
            () -> Litmus.THROW.check(false, "bad fragment [{}] at {}",
                "x(", 3));
    assertThat(e.getMessage(), is("bad fragment [x(] at 3"));
  }

  @Test void testIgnore() {
    assertThat(Litmus.IGNORE.check(true, "ok"), is(true));
    assertThat(Litmus.IGNORE.check(false, "bad"), is(false));
    assertThat(Litmus.IGNORE.fail("bad"), is(false));
  }

  @Test void testQuoteLabel() {
    assertThat(Util.quoteLabel("seattle"), is("\"seattle\""));
    assertThat(Util.quoteLabel("it's"), is("\"it's\""));
    assertThat(Util.quoteLabel("6\" pipe"), is("'6\" pipe'"));
  }
}
