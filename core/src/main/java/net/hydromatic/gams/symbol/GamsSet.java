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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * GAMS set.
 *
 * <p>A set declared without a domain is one-dimensional over the
 * universe, {@code i(*)}. A one-dimensional set declared over another set
 * is a subset of it.
 */
public class GamsSet extends SetLike {
  private GamsSet(String name, List<?> domain, @Nullable String description) {
    super(name, domain, description);
  }

  /** Creates a set. With no domain, the set ranges over the universe. */
  public static GamsSet of(String name, Object... domain) {
    return of(name, Arrays.asList(domain), null);
  }

  /** Creates a set with a description. */
  public static GamsSet of(String name, List<?> domain,
      @Nullable String description) {
    return new GamsSet(name,
        domain.isEmpty() ? ImmutableList.of(UniverseAlias.INSTANCE) : domain,
        description);
  }

  @Override public String keyword() {
    return "Set";
  }

  @Override public GamsSet set() {
    return this;
  }

  /** Returns the set that this set is a subset of, or null if it is
   * multi-dimensional or ranges over the universe. */
  public @Nullable GamsSet parentSet() {
    return dimension() == 1 ? domain().get(0).set() : null;
  }
}
