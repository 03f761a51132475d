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
package net.hydromatic.gams.config;

import net.hydromatic.gams.expressions.WriterConfig;

import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests for {@link GamsSystemProperty}.
 */
class GamsSystemPropertyTest {
  @Test void testKeys() {
    assertThat(GamsSystemProperty.DEBUG.key(), is("gams.debug"));
    assertThat(GamsSystemProperty.FOLD_LENGTH.key(),
        is("gams.render.foldLength"));
  }

  @Test void testDefaults() {
    // Test resources do not override either property.
    assertThat(GamsSystemProperty.DEBUG.value(), is(false));
    assertThat(GamsSystemProperty.FOLD_LENGTH.value(), is(1000));
  }

  @Test void testDefaultWriterConfig() {
    assertThat(WriterConfig.DEFAULT.foldLength(),
        is(GamsSystemProperty.FOLD_LENGTH.value()));
    assertThat(WriterConfig.DEFAULT.callSafe(), is(false));
  }
}
