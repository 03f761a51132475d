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

/**
 * Attribute of a set element, written as a suffix: {@code t.ord},
 * {@code t.first}.
 *
 * @see SetLike#attr(SetAttribute)
 */
public enum SetAttribute {
  /** Position in the set, counting from 1. */
  POS("pos"),
  /** Position, for ordered sets. */
  ORD("ord"),
  /** Position, counting from 0. */
  OFF("off"),
  /** Position counted from the end, from 0. */
  REV("rev"),
  /** Position in the universe. */
  UEL("uel"),
  /** Length of the label. */
  LEN("len"),
  /** Length of the explanatory text. */
  TLEN("tlen"),
  /** Numeric value of the label. */
  VAL("val"),
  /** Numeric value of the explanatory text. */
  TVAL("tval"),
  /** 1 for the first element, else 0. */
  FIRST("first"),
  /** 1 for the last element, else 0. */
  LAST("last");

  /** Suffix, such as "first". */
  public final String suffix;

  SetAttribute(String suffix) {
    this.suffix = suffix;
  }
}
