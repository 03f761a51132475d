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

import net.hydromatic.gams.symbol.Symbol;
import net.hydromatic.gams.util.Util;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static net.hydromatic.gams.util.Static.RESOURCE;

/**
 * Utility methods for building and rendering expression trees.
 */
public abstract class Expressions {
  private Expressions() {}

  /** Renders a node as GAMS text. */
  public static String render(AbstractNode node) {
    return node.toGms();
  }

  /** Renders a node as GAMS text, using a given configuration. */
  public static String render(AbstractNode node, WriterConfig config) {
    return node.toGms(config);
  }

  /** Converts a value to an operand.
   *
   * @param o An {@link Operable} or a {@link Number}
   * @throws net.hydromatic.gams.runtime.GamsException if o is neither */
  public static Expression operand(@Nullable Object o) {
    if (o instanceof Operable) {
      return ((Operable) o).toExpression();
    }
    if (o instanceof Number) {
      return Literal.of(o);
    }
    throw RESOURCE.operandNotSupported(String.valueOf(o),
        o == null ? "null" : o.getClass().getSimpleName()).ex();
  }

  /** Creates a binary expression. */
  public static BinaryExpression makeBinary(ExpressionType binaryType,
      Object left, Object right) {
    if (binaryType.op == null
        || binaryType == ExpressionType.Negate
        || binaryType == ExpressionType.Not
        || binaryType == ExpressionType.Condition
        || ExpressionType.INDEX_OPERATIONS.contains(binaryType)) {
      throw new IllegalArgumentException("not a binary operator: "
          + binaryType);
    }
    return new BinaryExpression(binaryType, operand(left), operand(right));
  }

  /** Creates a relation, such as {@code a =n= b}, for use as the body of
   * an equation definition. */
  public static BinaryExpression relation(ExpressionType relationType,
      Object left, Object right) {
    if (!relationType.isRelation()) {
      throw new IllegalArgumentException("not a relation: " + relationType);
    }
    return makeBinary(relationType, left, right);
  }

  /** Creates an arithmetic negation, {@code -e}. */
  public static UnaryExpression negate(Object expression) {
    return new UnaryExpression(ExpressionType.Negate, operand(expression));
  }

  /** Creates a logical negation, {@code not e}. */
  public static UnaryExpression not(Object expression) {
    return new UnaryExpression(ExpressionType.Not, operand(expression));
  }

  /** Creates {@code owner$(filter)}.
   *
   * <p>The owner may be an operand, a {@link Domain} or a set-like
   * {@link IndexMember}. */
  public static ConditionExpression condition(Object owner, Object filter) {
    final Object o = owner instanceof AbstractNode
        || owner instanceof IndexMember ? owner : operand(owner);
    return new Condition(o).filter(filter);
  }

  /** Creates a call to a built-in function.
   *
   * @throws net.hydromatic.gams.runtime.GamsException if the number of
   * arguments is wrong, or if {@code ord} or {@code card} is not given a
   * symbol */
  public static CallExpression call(GmsFunction function, Object... args) {
    function.checkArgCount(args.length);
    final ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (int i = 0; i < args.length; i++) {
      final Object arg = args[i];
      if (function.takesSymbols()) {
        if (!(arg instanceof Symbol)) {
          throw RESOURCE.functionArgumentNotSymbol(function.gmsName,
              String.valueOf(arg)).ex();
        }
        builder.add(arg);
      } else if (function == GmsFunction.SAME_AS && arg instanceof String) {
        if (!Util.isQuotable((String) arg)) {
          throw new DomainException(DomainException.Kind.INVALID_MEMBER,
              RESOURCE.labelNotQuotable((String) arg, i).str());
        }
        builder.add(arg);
      } else if (function == GmsFunction.SAME_AS
          && arg instanceof IndexMember) {
        builder.add(arg);
      } else {
        builder.add(operand(arg));
      }
    }
    return new CallExpression(function, builder.build());
  }

  /** Creates {@code sum(index,body)}.
   *
   * @param index A set, an alias, a {@link Domain}, a list of sets, or any
   * of those masked by a condition
   * @param body Expression to sum
   */
  public static IndexOperationExpression sum(Object index, Object body) {
    return indexOperation(ExpressionType.Sum, index, body);
  }

  /** Creates {@code prod(index,body)}. */
  public static IndexOperationExpression product(Object index, Object body) {
    return indexOperation(ExpressionType.Product, index, body);
  }

  /** Creates {@code smin(index,body)}. */
  public static IndexOperationExpression sMin(Object index, Object body) {
    return indexOperation(ExpressionType.SMin, index, body);
  }

  /** Creates {@code smax(index,body)}. */
  public static IndexOperationExpression sMax(Object index, Object body) {
    return indexOperation(ExpressionType.SMax, index, body);
  }

  /** Creates {@code sand(index,body)}. */
  public static IndexOperationExpression sAnd(Object index, Object body) {
    return indexOperation(ExpressionType.SAnd, index, body);
  }

  /** Creates {@code sor(index,body)}. */
  public static IndexOperationExpression sOr(Object index, Object body) {
    return indexOperation(ExpressionType.SOr, index, body);
  }

  /** Creates an indexed operation. */
  public static IndexOperationExpression indexOperation(
      ExpressionType operationType, Object index, Object body) {
    if (!ExpressionType.INDEX_OPERATIONS.contains(operationType)) {
      throw new IllegalArgumentException("not an indexed operation: "
          + operationType);
    }
    return new IndexOperationExpression(operationType, toIndex(index),
        operand(body));
  }

  private static Object toIndex(Object index) {
    if (index instanceof List) {
      final List<?> list = (List<?>) index;
      return list.size() == 1
          ? Domain.toMember(list.get(0), 0)
          : Domain.of(list);
    }
    if (index instanceof Domain) {
      return index;
    }
    if (index instanceof ConditionExpression) {
      final Object owner = ((ConditionExpression) index).owner;
      if (!(owner instanceof Domain)) {
        toIndex(owner);
      }
      return index;
    }
    return Domain.toMember(index, 0);
  }
}
