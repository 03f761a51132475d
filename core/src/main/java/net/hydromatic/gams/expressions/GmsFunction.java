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

import org.checkerframework.checker.nullness.qual.Nullable;

import static net.hydromatic.gams.util.Static.RESOURCE;

/**
 * Built-in GAMS function, with the number of arguments it accepts and how
 * a call to it is written.
 */
public enum GmsFunction {
  ABS("abs", 1),
  CEIL("ceil", 1),
  FLOOR("floor", 1),
  EXP("exp", 1),
  LOG("log", 1),
  LOG10("log10", 1),
  SQR("sqr", 1),
  SQRT("sqrt", 1),
  POWER("power", 2),
  RPOWER("rPower", 2),
  ROUND("round", 1, 2),
  MOD("mod", 2),
  MIN("min", 2, Integer.MAX_VALUE),
  MAX("max", 2, Integer.MAX_VALUE),
  SIN("sin", 1),
  COS("cos", 1),
  TAN("tan", 1),
  SIGN("sign", 1),
  ERRORF("errorf", 1),
  /** Position of an element in a set. */
  ORD("ord", 1),
  /** Number of elements in a symbol. */
  CARD("card", 1),
  /** Whether two set elements, or an element and a label, are the same. */
  SAME_AS("sameAs", 2),
  /** Conditional value; written in the grouped form
   * {@code (ifthen(c, a, b)  )}. */
  IFTHEN("ifthen", 3, 3, Syntax.GROUPED);

  public final String gmsName;
  public final int minArgs;
  public final int maxArgs;
  public final Syntax syntax;

  GmsFunction(String name, int argCount) {
    this(name, argCount, argCount);
  }

  GmsFunction(String name, int minArgs, int maxArgs) {
    this(name, minArgs, maxArgs, Syntax.FUNCTION);
  }

  GmsFunction(String name, int minArgs, int maxArgs, Syntax syntax) {
    this.gmsName = name;
    this.minArgs = minArgs;
    this.maxArgs = maxArgs;
    this.syntax = syntax;
  }

  /** Checks an argument count.
   *
   * @throws net.hydromatic.gams.runtime.GamsException if the count is out
   * of range */
  void checkArgCount(int count) {
    if (count < minArgs || count > maxArgs) {
      throw RESOURCE.wrongNumberOfArguments(gmsName, count,
          minArgs == maxArgs ? Integer.toString(minArgs)
              : maxArgs == Integer.MAX_VALUE ? "at least " + minArgs
              : minArgs + " to " + maxArgs).ex();
    }
  }

  /** Returns whether the arguments name symbols rather than being
   * expressions. */
  boolean takesSymbols() {
    return this == ORD || this == CARD;
  }

  /** How a call is written. */
  public enum Syntax {
    /** {@code name(a,b)}. */
    FUNCTION {
      @Override void unparse(ExpressionWriter writer, GmsFunction function,
          Iterable<?> args) {
        writer.append(function.gmsName).list("(", ",", ")", args);
      }
    },

    /** {@code (name(a, b)  )}, a call wrapped in a group, as generated for
     * conditional values. */
    GROUPED {
      @Override void unparse(ExpressionWriter writer, GmsFunction function,
          Iterable<?> args) {
        writer.append("(").append(function.gmsName)
            .list("(", ", ", ")", args)
            .append("  )");
      }
    };

    abstract void unparse(ExpressionWriter writer, GmsFunction function,
        Iterable<?> args);
  }

  /** Looks up a function by name, ignoring case; returns null if there is
   * none. */
  public static @Nullable GmsFunction lookup(String name) {
    for (GmsFunction function : values()) {
      if (function.gmsName.equalsIgnoreCase(name)) {
        return function;
      }
    }
    return null;
  }
}
