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
package net.hydromatic.laws.op;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Function with an explicit name.
 *
 * <p>Two operations are equal if and only if they have the same name. The
 * function value is never compared: two operations with identical behavior
 * but different names are distinct, and two operations with the same name are
 * the same operation.
 *
 * <p>Subclasses are {@link NamedOperation} (a total function of one
 * argument), {@link BinaryOperation} and {@link PartialOperation}.
 */
public abstract class Operation {
  public final String name;

  /** Where the operation was defined; for display only. */
  public final @Nullable SourceLocation location;

  protected Operation(String name, @Nullable SourceLocation location) {
    this.name = requireNonNull(name, "name");
    checkArgument(!name.isEmpty(), "operation name must not be empty");
    this.location = location;
  }

  @Override
  public final int hashCode() {
    return name.hashCode();
  }

  @Override
  public final boolean equals(Object o) {
    return o == this
        || o instanceof Operation && name.equals(((Operation) o).name);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /**
   * Writes the name of this operation and, if known, where it was defined,
   * for example "plusOne @ StandardOperations.java, line 57".
   */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(name);
    if (location != null) {
      location.describeTo(buf.append(" @ "));
    }
    return buf;
  }
}

// End Operation.java
