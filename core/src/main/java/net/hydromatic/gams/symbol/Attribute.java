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

import java.util.Locale;

import static net.hydromatic.gams.util.Static.RESOURCE;

import static java.util.Objects.requireNonNull;

/**
 * Attribute of a variable or equation, written as a suffix:
 * {@code x.lo(i)}.
 *
 * @see SetAttribute
 */
public enum Attribute {
  /** Level. */
  L("l", true, true),
  /** Marginal. */
  M("m", true, true),
  /** Lower bound. */
  LO("lo", true, true),
  /** Upper bound. */
  UP("up", true, true),
  /** Fixed value; variables only. */
  FX("fx", true, false),
  /** Scale factor. */
  SCALE("scale", true, true),
  /** Branching priority; discrete variables only. */
  PRIOR("prior", true, false),
  /** Stage, for decomposition methods. */
  STAGE("stage", true, true),
  /** Difference between the bounds; equations only. */
  RANGE("range", false, true),
  /** Slack from the lower bound; equations only. */
  SLACKLO("slacklo", false, true),
  /** Slack from the upper bound; equations only. */
  SLACKUP("slackup", false, true),
  /** Minimum of the two slacks; equations only. */
  SLACK("slack", false, true),
  /** Infeasibility; equations only. */
  INFEAS("infeas", false, true);

  /** Suffix, such as "lo". */
  public final String suffix;

  /** Whether variables have this attribute. */
  public final boolean forVariables;

  /** Whether equations have this attribute. */
  public final boolean forEquations;

  Attribute(String suffix, boolean forVariables, boolean forEquations) {
    this.suffix = suffix;
    this.forVariables = forVariables;
    this.forEquations = forEquations;
  }

  /** Checks that a symbol has this attribute.
   *
   * @throws net.hydromatic.gams.runtime.GamsException if it does not */
  public void checkApplicable(Symbol symbol) {
    requireNonNull(symbol, "symbol");
    if (symbol instanceof Variable) {
      final VariableType type = ((Variable) symbol).type();
      if (forVariables && (this != PRIOR || type.discrete)) {
        return;
      }
      throw RESOURCE.attributeNotApplicable(suffix,
          type.keyword + " variable " + symbol.name()).ex();
    }
    if (symbol instanceof Equation) {
      if (forEquations) {
        return;
      }
      throw RESOURCE.attributeNotApplicable(suffix,
          "equation " + symbol.name()).ex();
    }
    throw RESOURCE.attributeNotApplicable(suffix,
        symbol.keyword().toLowerCase(Locale.ROOT) + " "
            + symbol.name()).ex();
  }
}
