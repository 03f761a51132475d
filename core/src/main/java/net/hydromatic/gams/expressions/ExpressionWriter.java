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

import net.hydromatic.gams.util.Litmus;

import static java.util.Objects.requireNonNull;

/**
 * Converts an expression to GAMS text.
 *
 * <p>Each node writes itself by calling
 * {@code accept(writer, lprec, rprec)}, where {@code lprec} and
 * {@code rprec} are the binding strengths of the operators to its left
 * and right. A node whose own operator binds less tightly wraps itself in
 * parentheses; see {@link #requireParentheses}.
 *
 * <p>The writer tracks whether it is inside a function argument or a
 * condition ("call-safe" context), where equation relations such as
 * {@code =e=} are written as comparisons such as {@code eq}.
 *
 * <p>A writer is a mutable buffer; use one per rendering.
 */
public class ExpressionWriter {
  private final StringBuilder buf = new StringBuilder();
  private final WriterConfig config;
  private int callSafeDepth;
  private int lineStart;

  public ExpressionWriter() {
    this(WriterConfig.DEFAULT);
  }

  public ExpressionWriter(WriterConfig config) {
    this.config = requireNonNull(config, "config");
  }

  /** Writes a node at the top level. */
  public ExpressionWriter write(AbstractNode node) {
    node.accept(this, 0, 0);
    return this;
  }

  @Override public String toString() {
    return buf.toString();
  }

  /** Returns whether the writer is inside a function argument or
   * condition. */
  public boolean isCallSafe() {
    return callSafeDepth > 0 || config.callSafe();
  }

  /** If a node of type {@code node.nodeType} would bind less tightly than
   * the operators either side of it, writes the node in parentheses and
   * returns true; otherwise writes nothing and returns false. */
  public boolean requireParentheses(AbstractNode node, int lprec, int rprec) {
    return requireParentheses(node, node.nodeType, lprec, rprec);
  }

  /** As {@link #requireParentheses(AbstractNode, int, int)}, but treats the
   * node as if it had the given type. */
  boolean requireParentheses(AbstractNode node, ExpressionType type,
      int lprec, int rprec) {
    if (lprec < type.lprec && type.rprec >= rprec) {
      return false;
    }
    parenthesize(node);
    return true;
  }

  /** Parenthesizes a node that starts with a sign, such as {@code -x} or
   * {@code -1}, unless it is the first thing in its context. GAMS does
   * not accept a sign directly after an operator, as in {@code x * -1}. */
  boolean requireSignParentheses(AbstractNode node, int lprec, int rprec) {
    if (lprec <= 0 && ExpressionType.Negate.rprec >= rprec) {
      return false;
    }
    parenthesize(node);
    return true;
  }

  private void parenthesize(AbstractNode node) {
    buf.append("(");
    node.accept(this, 0, 0);
    buf.append(")");
  }

  /** Writes the token of an operator, breaking the line after it if the
   * current line is longer than the configured fold length. */
  public ExpressionWriter operator(ExpressionType type) {
    final String token = type.op(isCallSafe());
    if (buf.length() - lineStart >= config.foldLength()
        && token.endsWith(" ")) {
      buf.append(token.stripTrailing()).append('\n');
      lineStart = buf.length();
      buf.append(' ');
    } else {
      buf.append(token);
    }
    return this;
  }

  /** Writes a node inside parentheses in call-safe context, as for the
   * filter of a condition. */
  public ExpressionWriter callSafe(AbstractNode node) {
    buf.append('(');
    final int start = buf.length();
    ++callSafeDepth;
    try {
      node.accept(this, 0, 0);
    } finally {
      --callSafeDepth;
    }
    checkBalanced(start);
    buf.append(')');
    return this;
  }

  /** Writes a list of arguments in call-safe context. Elements that are
   * not nodes are written as index members or element labels. */
  public ExpressionWriter list(String begin, String sep, String end,
      Iterable<?> list) {
    buf.append(begin);
    final int start = buf.length();
    ++callSafeDepth;
    try {
      int k = 0;
      for (Object o : list) {
        if (k++ > 0) {
          buf.append(sep);
        }
        if (o instanceof AbstractNode) {
          ((AbstractNode) o).accept(this, 0, 0);
        } else {
          buf.append(Domain.memberToString(o));
        }
      }
    } finally {
      --callSafeDepth;
    }
    checkBalanced(start);
    buf.append(end);
    return this;
  }

  private void checkBalanced(int start) {
    final CharSequence fragment = buf.subSequence(start, buf.length());
    Litmus.THROW.check(Parentheses.isBalanced(fragment),
        "unbalanced parentheses in call-safe fragment [{}]", fragment);
  }

  public ExpressionWriter append(char c) {
    buf.append(c);
    return this;
  }

  public ExpressionWriter append(String s) {
    buf.append(s);
    return this;
  }
}
