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

import static java.util.Objects.requireNonNull;

/**
 * Another name for a set, as declared by {@code Alias (i,ip);}.
 *
 * <p>An alias ranges over the same elements as its set, so it can index
 * any symbol declared over that set.
 */
public class Alias extends SetLike {
  private final GamsSet aliasOf;

  private Alias(String name, GamsSet aliasOf) {
    super(name, aliasOf.domain(), aliasOf.description());
    this.aliasOf = aliasOf;
  }

  /** Creates an alias for a set. */
  public static Alias of(String name, GamsSet set) {
    return new Alias(name, requireNonNull(set, "set"));
  }

  @Override public String keyword() {
    return "Alias";
  }

  /** Returns the aliased set. */
  @Override public GamsSet set() {
    return aliasOf;
  }
}
