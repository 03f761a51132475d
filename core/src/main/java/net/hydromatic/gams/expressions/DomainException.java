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

import net.hydromatic.gams.runtime.GamsException;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a domain or an index list is invalid.
 *
 * <p>The {@link Kind} says what was wrong, so callers can react without
 * parsing the message.
 */
public class DomainException extends GamsException {
  private static final long serialVersionUID = -2861466183206371952L;

  private final Kind kind;

  public DomainException(Kind kind, String message) {
    super(message);
    this.kind = requireNonNull(kind, "kind");
  }

  /** Returns what was wrong. */
  public Kind getKind() {
    return kind;
  }

  /** Kind of domain error. */
  public enum Kind {
    /** Fewer than two entities were given to {@link Domain#of}. */
    TOO_FEW_ENTITIES,

    /** An entity is not a set, an alias, or the universe. */
    INVALID_MEMBER,

    /** A symbol was indexed with the wrong number of indices. */
    DIMENSION_MISMATCH,

    /** An index is a set that is not within the symbol's declared
     * domain. */
    DOMAIN_VIOLATION
  }
}
