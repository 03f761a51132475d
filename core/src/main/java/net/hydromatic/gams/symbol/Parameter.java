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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * GAMS parameter: numeric data indexed by a domain, or a scalar if the
 * domain is empty.
 */
public class Parameter extends Symbol {
  private Parameter(String name, List<?> domain,
      @Nullable String description) {
    super(name, domain, description);
  }

  /** Creates a parameter. */
  public static Parameter of(String name, Object... domain) {
    return of(name, Arrays.asList(domain), null);
  }

  /** Creates a parameter with a description. */
  public static Parameter of(String name, List<?> domain,
      @Nullable String description) {
    return new Parameter(name, domain, description);
  }

  @Override public String keyword() {
    return "Parameter";
  }
}
