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
package net.hydromatic.laws.tag;

import static java.util.Objects.requireNonNull;

/** Outcome of a {@link Selector} saying that a test should not be run. */
public final class Skip {
  public final String reason;

  private Skip(String reason) {
    this.reason = requireNonNull(reason, "reason");
  }

  public static Skip of(String reason) {
    return new Skip(reason);
  }

  @Override
  public int hashCode() {
    return reason.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Skip && reason.equals(((Skip) o).reason);
  }

  @Override
  public String toString() {
    return "Skip(" + reason + ")";
  }
}

// End Skip.java
