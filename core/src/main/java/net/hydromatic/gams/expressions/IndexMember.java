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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entity that can appear in an index list: a set, an alias, a lagged or
 * led set, or the universe {@code *}.
 */
public interface IndexMember {
  /** Returns the text of this member inside an index list, such as
   * "i" or "t - 1". */
  String toGms();

  /** Returns the set whose elements this member ranges over, or null if
   * it ranges over the universe. For an alias, the aliased set. */
  @Nullable GamsSet set();
}
