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

import net.hydromatic.gams.symbol.Attribute;
import net.hydromatic.gams.symbol.GamsSet;
import net.hydromatic.gams.symbol.Symbol;
import net.hydromatic.gams.util.Util;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static net.hydromatic.gams.util.Static.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Reference to a symbol with a concrete index list, such as
 * {@code x(i,"b")}, or to an attribute of a variable, such as
 * {@code x.lo(i)}.
 *
 * <p>A reference with no indices renders as the bare name.
 */
public class IndexedReference extends Expression {
  public final Symbol parent;
  /** Attribute, such as {@link Attribute#LO}, or null. */
  public final @Nullable Attribute attribute;
  private final ImmutableList<Object> indices;

  private IndexedReference(Symbol parent, @Nullable Attribute attribute,
      ImmutableList<Object> indices) {
    super(ExpressionType.Reference);
    this.parent = parent;
    this.attribute = attribute;
    this.indices = indices;
  }

  /**
   * Creates a reference, checking the indices against the symbol's
   * declared domain.
   *
   * <p>Each index is a set-like {@link IndexMember} or a {@code String}
   * element label. A label must not contain both kinds of quote. A set
   * index must be the declared set, an alias of it, or a subset of it,
   * unless the declared entry is the universe.
   *
   * @param parent Symbol
   * @param attribute Attribute, or null
   * @param indices Indices
   * @throws DomainException if the indices do not fit the domain
   * @throws net.hydromatic.gams.runtime.GamsException if the symbol does
   * not have the attribute
   */
  public static IndexedReference of(Symbol parent,
      @Nullable Attribute attribute, List<?> indices) {
    requireNonNull(parent, "parent");
    if (attribute != null) {
      attribute.checkApplicable(parent);
    }
    if (indices.size() != parent.dimension()) {
      throw new DomainException(DomainException.Kind.DIMENSION_MISMATCH,
          RESOURCE.dimensionMismatch(parent.name(), parent.dimension(),
              indices.size()).str());
    }
    final ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (int i = 0; i < indices.size(); i++) {
      final Object index = indices.get(i);
      if (index instanceof String) {
        if (!Util.isQuotable((String) index)) {
          throw new DomainException(DomainException.Kind.INVALID_MEMBER,
              RESOURCE.labelNotQuotable((String) index, i).str());
        }
        builder.add(index);
      } else if (index instanceof IndexMember) {
        final IndexMember member = (IndexMember) index;
        final IndexMember declared = parent.domain().get(i);
        if (!isWithin(member.set(), declared.set())) {
          throw new DomainException(DomainException.Kind.DOMAIN_VIOLATION,
              RESOURCE.domainViolation(member.toGms(), i, parent.name(),
                  declared.toGms()).str());
        }
        builder.add(member);
      } else {
        throw new DomainException(DomainException.Kind.INVALID_MEMBER,
            RESOURCE.indexInvalid(String.valueOf(index), i).str());
      }
    }
    return new IndexedReference(parent, attribute, builder.build());
  }

  /** Returns whether elements of {@code set} are elements of
   * {@code declared}. A null set stands for the universe. */
  static boolean isWithin(@Nullable GamsSet set, @Nullable GamsSet declared) {
    if (set == null || declared == null) {
      return true;
    }
    for (GamsSet s = set; s != null; s = s.parentSet()) {
      if (s.equals(declared)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the indices; each is an {@link IndexMember} or a
   * {@code String} element label. */
  public List<Object> indices() {
    return indices;
  }

  @Override void accept(ExpressionWriter writer, int lprec, int rprec) {
    writer.append(parent.name());
    if (attribute != null) {
      writer.append('.').append(attribute.suffix);
    }
    if (!indices.isEmpty()) {
      writer.list("(", ",", ")", indices);
    }
  }

  @Override public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (obj instanceof IndexedReference) {
      final IndexedReference that = (IndexedReference) obj;
      return parent.equals(that.parent)
          && Objects.equals(attribute, that.attribute)
          && indices.equals(that.indices);
    }
    return false;
  }

  @Override public int hashCode() {
    return Objects.hash(parent, attribute, indices);
  }
}
