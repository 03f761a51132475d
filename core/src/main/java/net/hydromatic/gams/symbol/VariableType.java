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

/**
 * Type of a GAMS variable, which determines its default bounds.
 */
public enum VariableType {
  FREE("free", false),
  POSITIVE("positive", false),
  NEGATIVE("negative", false),
  BINARY("binary", true),
  INTEGER("integer", true),
  SOS1("sos1", true),
  SOS2("sos2", true),
  SEMICONT("semicont", true),
  SEMIINT("semiint", true);

  /** Keyword that precedes "Variable" in a declaration. */
  public final String keyword;

  /** Whether branching applies, so that the variable has a priority. */
  public final boolean discrete;

  VariableType(String keyword, boolean discrete) {
    this.keyword = keyword;
    this.discrete = discrete;
  }
}
