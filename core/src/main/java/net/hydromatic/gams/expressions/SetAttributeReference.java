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

import net.hydromatic.gams.symbol.SetAttribute;
import net.hydromatic.gams.symbol.SetLike;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Attribute of the current element of a set, such as {@code t.first} in
 * {@code x(t)$(t.first)}.
 */
public class SetAttributeReference extends Expression {
  public final SetLike set;
  public final SetAttribute attribute;

  private SetAttributeReference(SetLike set, SetAttribute attribute) {
    super(ExpressionType.Reference);
    this.set = requireNonNull(set, "set");
    this.attribute = requireNonNull(attribute, "attribute");
  }

  /** Creates a reference to a set attribute. */
  public static SetAttributeReference of(SetLike set,
      SetAttribute attribute) {
    return new SetAttributeReference(set, attribute);
  }

  @Override void accept(ExpressionWriter writer, int lprec, int rprec) {
    writer.append(set.name()).append('.').append(attribute.suffix);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof SetAttributeReference
        && set.equals(((SetAttributeReference) obj).set)
        && attribute == ((SetAttributeReference) obj).attribute;
  }

  @Override public int hashCode() {
    return Objects.hash(set, attribute);
  }
}
