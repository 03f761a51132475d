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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Call to a built-in function, such as {@code sqr(x(i))} or
 * {@code ord(t)}.
 *
 * <p>Arguments are written in call-safe context.
 */
public class CallExpression extends Expression {
  public final GmsFunction function;
  private final ImmutableList<Object> args;

  CallExpression(GmsFunction function, ImmutableList<Object> args) {
    super(ExpressionType.Call);
    this.function = requireNonNull(function, "function");
    this.args = requireNonNull(args, "args");
  }

  /** Returns the arguments. Each is an {@link Expression}, or, for
   * functions such as {@code ord} and {@code sameAs}, a symbol, an index
   * member or an element label. */
  public List<Object> args() {
    return args;
  }

  @Override void accept(ExpressionWriter writer, int lprec, int rprec) {
    function.syntax.unparse(writer, function, args);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return obj == this
        || obj instanceof CallExpression
        && function == ((CallExpression) obj).function
        && args.equals(((CallExpression) obj).args);
  }

  @Override public int hashCode() {
    return Objects.hash(function, args);
  }
}
