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

import org.apiguardian.api.API;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.EnumSet;
import java.util.Set;

import static net.hydromatic.gams.util.Static.RESOURCE;

/**
 * Kind of a node in a GAMS expression tree, with the operator token and
 * precedence used to render it.
 */
public enum ExpressionType {

  // Operator precedence and associativity is as follows.
  //
  //  Priority Operators  Operation
  //  ======== ========== ========================================
  //  1        x(i)       reference
  //           f(a,b)     function call
  //           sum(i,e)   indexed operation
  //  2 left   $          condition
  //  3 left   **         power
  //  4 left   * /        multiplication, division
  //  5 right  -          unary minus
  //  6 left   + -        addition, subtraction
  //  7 left   =e= =l= =g= =n= =x= =c= =b=
  //           eq ne < <= > >=   relations
  //  8 right  not        logical NOT
  //  9 left   and        logical AND
  //  10 left  or xor     logical OR, exclusive OR
  //
  // Inside a function argument or a condition, equation relations are
  // written in their comparison form: =e= as eq, =l= as <=, =g= as >=.

  /** A numeric constant, such as {@code 2.5} or {@code inf}. */
  Constant,

  /** A reference to a symbol, such as {@code x(i,j)} or {@code x.lo(i)}. */
  Reference,

  /** A function call, such as {@code sqr(x(i))}. */
  Call,

  /** A domain, such as {@code (i,j)}. */
  Domain,

  /** Sum over an index, such as {@code sum(i,x(i))}. */
  Sum("sum"),

  /** Product over an index. */
  Product("prod"),

  /** Minimum over an index. */
  SMin("smin"),

  /** Maximum over an index. */
  SMax("smax"),

  /** Logical AND over an index. */
  SAnd("sand"),

  /** Logical OR over an index. */
  SOr("sor"),

  /** A dollar condition, such as {@code x(i)$(c(i))}. */
  Condition("$", 2, false),

  /** Exponentiation, such as {@code x ** 2}. */
  Power(" ** ", 3, false),

  Multiply(" * ", 4, false),

  Divide(" / ", 4, false),

  /** Arithmetic negation, such as {@code -x(i)}. */
  Negate("-", 5, true),

  Add(" + ", 6, false),

  Subtract(" - ", 6, false),

  /** Equality relation; {@code eq} inside a function argument. */
  Equal(" =e= ", " eq ", 7, false),

  /** Less-than-or-equal relation; {@code <=} inside a function argument. */
  LessThanOrEqual(" =l= ", " <= ", 7, false),

  /** Greater-than-or-equal relation; {@code >=} inside a function
   * argument. */
  GreaterThanOrEqual(" =g= ", " >= ", 7, false),

  /** Non-binding relation. Not allowed inside a function argument. */
  NonBinding(" =n= ", null, 7, false),

  /** External relation. */
  External(" =x= ", null, 7, false),

  /** Conic relation. */
  Conic(" =c= ", null, 7, false),

  /** Logic (boolean) relation. */
  Logic(" =b= ", null, 7, false),

  NotEqual(" ne ", " ne ", 7, false),

  LessThan(" < ", " < ", 7, false),

  GreaterThan(" > ", " > ", 7, false),

  Not("not ", 8, true),

  And(" and ", 9, false),

  Or(" or ", 10, false),

  Xor(" xor ", 10, false);

  /** Relations that may be the root of an equation definition. */
  public static final Set<ExpressionType> RELATIONS =
      EnumSet.of(Equal, LessThanOrEqual, GreaterThanOrEqual, NonBinding,
          External, Conic, Logic);

  /** All relational operators. */
  @API(since = "1.0", status = API.Status.EXPERIMENTAL)
  public static final Set<ExpressionType> COMPARISONS =
      EnumSet.of(Equal, LessThanOrEqual, GreaterThanOrEqual, NonBinding,
          External, Conic, Logic, NotEqual, LessThan, GreaterThan);

  /** Indexed operations. */
  @API(since = "1.0", status = API.Status.EXPERIMENTAL)
  public static final Set<ExpressionType> INDEX_OPERATIONS =
      EnumSet.of(Sum, Product, SMin, SMax, SAnd, SOr);

  /** Token, or function name for an indexed operation; null for other
   * atoms. */
  public final @Nullable String op;
  private final @Nullable String callSafeOp;
  public final int lprec;
  public final int rprec;

  ExpressionType() {
    this(null, null, 0, false);
  }

  ExpressionType(String name) {
    this(name, name, 0, false);
  }

  ExpressionType(String op, int prec, boolean right) {
    this(op, op, prec, right);
  }

  ExpressionType(@Nullable String op, @Nullable String callSafeOp, int prec,
      boolean right) {
    this.op = op;
    this.callSafeOp = callSafeOp;
    this.lprec = (20 - prec) * 2 + (right ? 1 : 0);
    this.rprec = (20 - prec) * 2 + (right ? 0 : 1);
  }

  /** Returns the token for this operator.
   *
   * @param callSafe Whether the token appears inside a function argument
   * or a condition
   * @throws net.hydromatic.gams.runtime.GamsException if this relation has
   * no form that is valid inside a function argument */
  public String op(boolean callSafe) {
    if (op == null) {
      throw new AssertionError("no operator for " + this);
    }
    if (!callSafe) {
      return op;
    }
    if (callSafeOp == null) {
      throw RESOURCE.relationNotCallSafe(op.trim()).ex();
    }
    return callSafeOp;
  }

  /** Returns whether this is an equation relation, such as {@code =e=}. */
  public boolean isRelation() {
    return RELATIONS.contains(this);
  }
}
