/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.laws.parse;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Error in the text of a law, such as a reference to an operation whose name
 * is not properly delimited.
 *
 * <p>An error is a value, not an exception, so that a tool can collect the
 * errors of many laws in one pass. Call {@link #toException()} to abort
 * instead.
 */
public final class FormatError {
  /** What is wrong. */
  public final String description;
  /** The text in which the error was found. */
  public final String context;
  /** Character offset of the error in {@link #context}. */
  public final int position;
  /** The offending text. */
  public final String focus;

  private FormatError(
      String description, String context, int position, String focus) {
    this.description = requireNonNull(description, "description");
    this.context = requireNonNull(context, "context");
    this.focus = requireNonNull(focus, "focus");
    checkArgument(position >= 0, "position must be non-negative: %s",
        position);
    this.position = position;
  }

  /** Creates a FormatError. */
  public static FormatError of(
      String description, String context, int position, String focus) {
    return new FormatError(description, context, position, focus);
  }

  /** Wraps this error in an exception. */
  public LawFormatException toException() {
    return new LawFormatException(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(description, context, position, focus);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FormatError
            && description.equals(((FormatError) o).description)
            && context.equals(((FormatError) o).context)
            && position == ((FormatError) o).position
            && focus.equals(((FormatError) o).focus);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /**
   * Writes a description such as "Unclosed method name.  At 4 found `map.
   * In xs.`map".
   */
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(description)
        .append(".  At ")
        .append(position)
        .append(" found ")
        .append(focus)
        .append(".  In ")
        .append(context);
  }
}

// End FormatError.java
