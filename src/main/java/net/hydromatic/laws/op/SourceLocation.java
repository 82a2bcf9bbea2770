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

import java.util.Objects;

/**
 * Place in a source file where an operation was defined.
 *
 * <p>Debugging metadata only; it never takes part in the identity of an
 * {@link Operation}.
 */
public class SourceLocation {
  public final String file;
  public final int line;

  private SourceLocation(String file, int line) {
    this.file = requireNonNull(file, "file");
    checkArgument(line >= 0, "line must be non-negative: %s", line);
    this.line = line;
  }

  /** Creates a SourceLocation. */
  public static SourceLocation of(String file, int line) {
    return new SourceLocation(file, line);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SourceLocation
            && file.equals(((SourceLocation) o).file)
            && line == ((SourceLocation) o).line;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(file).append(", line ").append(line);
  }
}

// End SourceLocation.java
