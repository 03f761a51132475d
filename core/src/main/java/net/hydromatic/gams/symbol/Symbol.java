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
import net.hydromatic.gams.expressions.IndexMember;
import net.hydromatic.gams.expressions.IndexedReference;
import net.hydromatic.gams.util.Util;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static net.hydromatic.gams.util.Static.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Named GAMS symbol with a declared domain.
 *
 * <p>Symbols are immutable descriptors; the data they hold lives elsewhere.
 * Names are case-insensitive, as in GAMS.
 */
public abstract class Symbol {
  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z][A-Za-z0-9_]{0,62}");

  private final String name;
  private final ImmutableList<IndexMember> domain;
  private final @Nullable String description;

  protected Symbol(String name, List<?> domain,
      @Nullable String description) {
    requireNonNull(name, "name");
    Preconditions.checkArgument(IDENTIFIER.matcher(name).matches(),
        "invalid GAMS identifier: %s", name);
    this.name = name;
    this.domain = toDomain(domain);
    if (description != null && !Util.isQuotable(description)) {
      throw RESOURCE.descriptionNotQuotable(description, name).ex();
    }
    this.description = description;
  }

  private static ImmutableList<IndexMember> toDomain(List<?> domain) {
    final ImmutableList.Builder<IndexMember> builder = ImmutableList.builder();
    for (int i = 0; i < domain.size(); i++) {
      final Object o = domain.get(i);
      if ("*".equals(o)) {
        builder.add(UniverseAlias.INSTANCE);
      } else if (o instanceof SetLike || o instanceof UniverseAlias) {
        builder.add((IndexMember) o);
      } else {
        throw new DomainException(DomainException.Kind.INVALID_MEMBER,
            RESOURCE.domainInvalidMember(String.valueOf(o), i).str());
      }
    }
    return builder.build();
  }

  /** Returns the name. */
  public String name() {
    return name;
  }

  /** Returns the declared domain; empty for a scalar. */
  public List<IndexMember> domain() {
    return domain;
  }

  /** Returns the number of indices. */
  public int dimension() {
    return domain.size();
  }

  /** Returns the description, or null. */
  public @Nullable String description() {
    return description;
  }

  /** Returns the keyword that declares this kind of symbol, such as
   * "Set". */
  public abstract String keyword();

  /** Returns a reference to this symbol with the given indices.
   *
   * @throws DomainException if the indices do not fit the declared
   * domain */
  public IndexedReference at(Object... indices) {
    return IndexedReference.of(this, null, Arrays.asList(indices));
  }

  /** Returns a reference to this symbol over its declared domain, or the
   * bare name for a scalar. */
  public IndexedReference ref() {
    return IndexedReference.of(this, null, domain);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj != null
        && obj.getClass() == getClass()
        && name.equalsIgnoreCase(((Symbol) obj).name);
  }

  @Override public int hashCode() {
    return name.toLowerCase(Locale.ROOT).hashCode();
  }

  @Override public String toString() {
    return name;
  }
}
