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

import net.hydromatic.gams.expressions.IndexedReference;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * GAMS equation. Its algebra is given by an
 * {@link net.hydromatic.gams.statement.EquationDefinition}.
 */
public class Equation extends Symbol {
  private Equation(String name, List<?> domain,
      @Nullable String description) {
    super(name, domain, description);
  }

  /** Creates an equation. */
  public static Equation of(String name, Object... domain) {
    return of(name, Arrays.asList(domain), null);
  }

  /** Creates an equation with a description. */
  public static Equation of(String name, List<?> domain,
      @Nullable String description) {
    return new Equation(name, domain, description);
  }

  @Override public String keyword() {
    return "Equation";
  }

  /** Returns a reference to an attribute, such as {@code e.m(i)}.
   *
   * @throws net.hydromatic.gams.runtime.GamsException if equations do not
   * have the attribute */
  public IndexedReference attr(Attribute attribute, Object... indices) {
    return IndexedReference.of(this, attribute, Arrays.asList(indices));
  }
}
