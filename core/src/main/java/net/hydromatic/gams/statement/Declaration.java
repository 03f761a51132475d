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
package net.hydromatic.gams.statement;

import net.hydromatic.gams.expressions.WriterConfig;
import net.hydromatic.gams.symbol.Alias;
import net.hydromatic.gams.symbol.Symbol;
import net.hydromatic.gams.symbol.Variable;
import net.hydromatic.gams.util.Util;

import static java.util.Objects.requireNonNull;

/**
 * Declaration of a symbol, such as {@code Set i(*);},
 * {@code Alias (i,ip);} or {@code positive Variable x(i,j) "flow";}.
 */
public class Declaration extends Statement {
  public final Symbol symbol;

  Declaration(Symbol symbol) {
    this.symbol = requireNonNull(symbol, "symbol");
  }

  @Override protected String unparse(WriterConfig config) {
    if (symbol instanceof Alias) {
      return "Alias (" + ((Alias) symbol).set().name() + ","
          + symbol.name() + ");";
    }
    final StringBuilder buf = new StringBuilder();
    if (symbol instanceof Variable) {
      buf.append(((Variable) symbol).type().keyword).append(' ');
    }
    buf.append(symbol.keyword()).append(' ')
        .append(render(symbol.ref(), config));
    final String description = symbol.description();
    if (description != null) {
      buf.append(' ').append(Util.quoteLabel(description));
    }
    return buf.append(';').toString();
  }
}
