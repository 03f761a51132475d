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
import net.hydromatic.gams.symbol.Symbol;
import net.hydromatic.gams.symbol.UniverseAlias;
import net.hydromatic.gams.util.Util;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;

import static net.hydromatic.gams.util.Static.RESOURCE;

/**
 * Ordered tuple of index entities, rendered as {@code (i,j)}.
 *
 * <p>A domain has at least two members; a single set is used directly
 * wherever a one-dimensional index is needed.
 */
public class Domain extends AbstractNode {
  private final ImmutableList<Object> members;

  private Domain(ImmutableList<Object> members) {
    super(ExpressionType.Domain);
    this.members = members;
  }

  /**
   * Creates a domain.
   *
   * <p>Each entity must be set-like: a {@link GamsSet}, an
   * {@link net.hydromatic.gams.symbol.Alias}, a lagged or led set, an
   * {@link IndexedReference} to a set, or the universe
   * ({@link UniverseAlias#INSTANCE} or the string "*").
   *
   * @throws DomainException if there are fewer than two entities, or if
   * an entity is not set-like
   */
  public static Domain of(Object... entities) {
    return of(Arrays.asList(entities));
  }

  /** Creates a domain from a list of entities.
   *
   * @see #of(Object...) */
  public static Domain of(List<?> entities) {
    if (entities.size() < 2) {
      throw new DomainException(DomainException.Kind.TOO_FEW_ENTITIES,
          RESOURCE.domainTooFewEntities(entities.size()).str());
    }
    final ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (int i = 0; i < entities.size(); i++) {
      builder.add(toMember(entities.get(i), i));
    }
    return new Domain(builder.build());
  }

  /** Validates an entity and converts it to a domain member. */
  static Object toMember(@Nullable Object entity, int position) {
    if ("*".equals(entity)) {
      return UniverseAlias.INSTANCE;
    }
    if (entity instanceof IndexMember) {
      return entity;
    }
    if (entity instanceof IndexedReference
        && ((IndexedReference) entity).parent instanceof IndexMember) {
      return entity;
    }
    throw new DomainException(DomainException.Kind.INVALID_MEMBER,
        RESOURCE.domainInvalidMember(String.valueOf(entity), position).str());
  }

  /** Returns the members of this domain. */
  public List<Object> members() {
    return members;
  }

  /** Returns the number of members. */
  public int size() {
    return members.size();
  }

  /** Returns {@code (i,j)$(filter)}, for use as the index of an indexed
   * operation. */
  public ConditionExpression where(Object filter) {
    return new Condition(this).filter(filter);
  }

  @Override void accept(ExpressionWriter writer, int lprec, int rprec) {
    writer.list("(", ",", ")", members);
  }

  /** Returns the text of a member of an index or argument list. */
  static String memberToString(Object o) {
    if (o instanceof IndexMember) {
      return ((IndexMember) o).toGms();
    }
    if (o instanceof AbstractNode) {
      return ((AbstractNode) o).toGms();
    }
    if (o instanceof Symbol) {
      return ((Symbol) o).name();
    }
    if (o instanceof String) {
      return Util.quoteLabel((String) o);
    }
    throw new AssertionError("not an index member: " + o);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof Domain
        && members.equals(((Domain) obj).members);
  }

  @Override public int hashCode() {
    return members.hashCode();
  }
}
