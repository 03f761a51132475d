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
package net.hydromatic.gams.runtime;

import net.hydromatic.gams.config.GamsSystemProperty;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all exceptions raised when a caller builds an expression
 * or statement that cannot be rendered as valid GAMS.
 *
 * <p>Internal invariant violations are not reported this way; they throw
 * {@link AssertionError}.
 */
public class GamsException extends RuntimeException {
  //~ Static fields/initializers ---------------------------------------------

  private static final long serialVersionUID = 4207353196042357361L;

  private static final Logger LOGGER =
      LoggerFactory.getLogger(GamsException.class);

  //~ Constructors -----------------------------------------------------------

  /**
   * Creates a GamsException.
   *
   * @param message error message
   * @param cause   underlying cause, or null
   */
  public GamsException(String message, @Nullable Throwable cause) {
    super(message, cause);
    LOGGER.trace("GamsException", this);
    if (GamsSystemProperty.DEBUG.value()) {
      LOGGER.error(toString());
    }
  }

  /** Creates a GamsException with no cause. */
  public GamsException(String message) {
    this(message, null);
  }
}
