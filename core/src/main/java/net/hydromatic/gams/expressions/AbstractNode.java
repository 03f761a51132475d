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

import static java.util.Objects.requireNonNull;

/**
 * Abstract base class for every node that can be rendered as GAMS text.
 *
 * <p>The set of node classes is closed: each is in this package and is
 * identified by its {@link #nodeType}.
 */
public abstract class AbstractNode {
  public final ExpressionType nodeType;

  AbstractNode(ExpressionType nodeType) {
    this.nodeType = requireNonNull(nodeType, "nodeType");
  }

  /**
   * Gets the node type of this node.
   */
  public ExpressionType getNodeType() {
    return nodeType;
  }

  /** Renders this node as GAMS text using the default configuration. */
  public String toGms() {
    return toGms(WriterConfig.DEFAULT);
  }

  /** Renders this node as GAMS text. */
  public String toGms(WriterConfig config) {
    return new ExpressionWriter(config).write(this).toString();
  }

  @Override public String toString() {
    return toGms();
  }

  /** Writes this node.
   *
   * @param writer Writer
   * @param lprec Binding strength of the operator to the left
   * @param rprec Binding strength of the operator to the right
   */
  abstract void accept(ExpressionWriter writer, int lprec, int rprec);

  /** Returns whether the rendered text of this node starts with a sign. */
  boolean isSigned() {
    return false;
  }
}
