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

import static java.util.Objects.requireNonNull;

/**
 * GAMS variable.
 *
 * <p>{@link #at} refers to the variable itself, as in an equation;
 * {@link #attr} and its shorthands refer to an attribute, as in an
 * assignment {@code x.lo(i) = 0;}.
 */
public class Variable extends Symbol {
  private final VariableType type;

  private Variable(String name, VariableType type, List<?> domain,
      @Nullable String description) {
    super(name, domain, description);
    this.type = requireNonNull(type, "type");
  }

  /** Creates a free variable. */
  public static Variable of(String name, Object... domain) {
    return of(name, VariableType.FREE, Arrays.asList(domain), null);
  }

  /** Creates a variable of a given type. */
  public static Variable of(String name, VariableType type,
      Object... domain) {
    return of(name, type, Arrays.asList(domain), null);
  }

  /** Creates a variable with a description. */
  public static Variable of(String name, VariableType type, List<?> domain,
      @Nullable String description) {
    return new Variable(name, type, domain, description);
  }

  /** Returns the type. */
  public VariableType type() {
    return type;
  }

  @Override public String keyword() {
    return "Variable";
  }

  /** Returns a reference to an attribute, such as {@code x.up(i)}.
   *
   * @throws net.hydromatic.gams.runtime.GamsException if the attribute
   * does not apply to this type of variable
   * @see Attribute#checkApplicable */
  public IndexedReference attr(Attribute attribute, Object... indices) {
    return IndexedReference.of(this, attribute, Arrays.asList(indices));
  }

  /** Returns the level, {@code x.l(...)}. */
  public IndexedReference l(Object... indices) {
    return attr(Attribute.L, indices);
  }

  /** Returns the marginal, {@code x.m(...)}. */
  public IndexedReference m(Object... indices) {
    return attr(Attribute.M, indices);
  }

  /** Returns the lower bound, {@code x.lo(...)}. */
  public IndexedReference lo(Object... indices) {
    return attr(Attribute.LO, indices);
  }

  /** Returns the upper bound, {@code x.up(...)}. */
  public IndexedReference up(Object... indices) {
    return attr(Attribute.UP, indices);
  }

  /** Returns the fixed value, {@code x.fx(...)}. */
  public IndexedReference fx(Object... indices) {
    return attr(Attribute.FX, indices);
  }

  /** Returns the scale factor, {@code x.scale(...)}. */
  public IndexedReference scale(Object... indices) {
    return attr(Attribute.SCALE, indices);
  }

  /** Returns the branching priority, {@code x.prior(...)}. */
  public IndexedReference prior(Object... indices) {
    return attr(Attribute.PRIOR, indices);
  }
}
