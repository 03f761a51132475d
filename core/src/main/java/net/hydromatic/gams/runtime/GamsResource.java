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
package net.hydromatic.gams.runtime;

import net.hydromatic.gams.runtime.Resources.BaseMessage;
import net.hydromatic.gams.runtime.Resources.ExInst;
import net.hydromatic.gams.runtime.Resources.Inst;

/**
 * Compiler-checked resources for the GAMS algebra library.
 *
 * <p>Every message here has a matching line in
 * {@code GamsResource.properties}.
 */
public interface GamsResource {
  @BaseMessage("Cannot use {0} of type {1} as an operand")
  ExInst<GamsException> operandNotSupported(String value, String type);

  @BaseMessage("Literal value {0} of type {1} is not numeric")
  ExInst<GamsException> literalNotNumeric(String value, String type);

  @BaseMessage("at least two indices required; got {0,number,#}, use the set itself for a single index")
  Inst domainTooFewEntities(int count);

  @BaseMessage("entity is not a valid domain member: {0} at position {1,number,#}; expected a set, an alias or the universe")
  Inst domainInvalidMember(String value, int position);

  @BaseMessage("Index {0} at position {1,number,#} is neither a set nor an element label")
  Inst indexInvalid(String value, int position);

  @BaseMessage("Symbol {0} has dimension {1,number,#} but was indexed with {2,number,#} indices")
  Inst dimensionMismatch(String symbol, int expected, int actual);

  @BaseMessage("Index {0} at position {1,number,#} of {2} is not in domain {3}")
  Inst domainViolation(String index, int position, String symbol,
      String declared);

  @BaseMessage("Function {0} called with {1,number,#} arguments; expected {2}")
  ExInst<GamsException> wrongNumberOfArguments(String function, int actual,
      String expected);

  @BaseMessage("Function {0} expects a symbol argument, got {1}")
  ExInst<GamsException> functionArgumentNotSymbol(String function,
      String value);

  @BaseMessage("Relation {0} cannot appear inside a function argument or condition")
  ExInst<GamsException> relationNotCallSafe(String op);

  @BaseMessage("Equation definition requires a relation, got {0}")
  ExInst<GamsException> definitionNotRelation(String expression);

  @BaseMessage("Definition head {0} does not reference an equation")
  ExInst<GamsException> definitionHeadNotEquation(String head);

  @BaseMessage("Cannot assign to {0}; expected a parameter, a set or a variable attribute")
  ExInst<GamsException> assignmentTargetInvalid(String target);

  @BaseMessage("Attribute {0} does not apply to {1}")
  ExInst<GamsException> attributeNotApplicable(String attribute,
      String symbol);

  @BaseMessage("Label {0} at position {1,number,#} contains both single and double quotes and cannot be quoted")
  Inst labelNotQuotable(String label, int position);

  @BaseMessage("Description {0} of {1} contains both single and double quotes and cannot be quoted")
  ExInst<GamsException> descriptionNotQuotable(String description,
      String symbol);
}
