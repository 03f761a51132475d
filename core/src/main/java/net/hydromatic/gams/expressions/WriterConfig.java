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

import net.hydromatic.gams.config.GamsSystemProperty;

import com.google.common.base.Preconditions;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Configuration for an {@link ExpressionWriter}.
 *
 * <p>Instances are immutable; each {@code withXxx} method returns a copy
 * with one property changed.
 */
public final class WriterConfig {
  /** Default configuration, with fold length taken from
   * {@link GamsSystemProperty#FOLD_LENGTH}. */
  public static final WriterConfig DEFAULT =
      new WriterConfig(GamsSystemProperty.FOLD_LENGTH.value(), false);

  private final int foldLength;
  private final boolean callSafe;

  private WriterConfig(int foldLength, boolean callSafe) {
    this.foldLength = foldLength;
    this.callSafe = callSafe;
  }

  /** Returns the line length after which the writer breaks the line after
   * the next binary operator. */
  public int foldLength() {
    return foldLength;
  }

  /** Sets {@link #foldLength()}. */
  public WriterConfig withFoldLength(int foldLength) {
    Preconditions.checkArgument(foldLength > 0,
        "foldLength must be positive: %s", foldLength);
    return foldLength == this.foldLength ? this
        : new WriterConfig(foldLength, callSafe);
  }

  /** Returns whether the whole output is a function-argument context, as
   * on the right-hand side of an assignment. */
  public boolean callSafe() {
    return callSafe;
  }

  /** Sets {@link #callSafe()}. */
  public WriterConfig withCallSafe(boolean callSafe) {
    return callSafe == this.callSafe ? this
        : new WriterConfig(foldLength, callSafe);
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof WriterConfig
        && foldLength == ((WriterConfig) o).foldLength
        && callSafe == ((WriterConfig) o).callSafe;
  }

  @Override public int hashCode() {
    return foldLength * 31 + (callSafe ? 1 : 0);
  }

  @Override public String toString() {
    return "WriterConfig{foldLength=" + foldLength
        + ", callSafe=" + callSafe + "}";
  }
}
