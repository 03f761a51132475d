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

import net.hydromatic.gams.expressions.AbstractNode;
import net.hydromatic.gams.expressions.ExpressionWriter;
import net.hydromatic.gams.expressions.WriterConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Complete GAMS statement, terminated by a semicolon.
 *
 * <p>Statements are immutable; {@link #toGms()} renders the same text each
 * time it is called.
 */
public abstract class Statement {
  private static final Logger LOGGER = LoggerFactory.getLogger(Statement.class);

  /** Renders this statement using the default configuration. */
  public String toGms() {
    return toGms(WriterConfig.DEFAULT);
  }

  /** Renders this statement. */
  public String toGms(WriterConfig config) {
    final String s = unparse(config);
    LOGGER.debug("Rendered {}", s);
    return s;
  }

  /** Returns the text of this statement. */
  protected abstract String unparse(WriterConfig config);

  /** Renders a node with the given configuration. */
  protected static String render(AbstractNode node, WriterConfig config) {
    return new ExpressionWriter(config).write(node).toString();
  }

  @Override public String toString() {
    return toGms();
  }
}
