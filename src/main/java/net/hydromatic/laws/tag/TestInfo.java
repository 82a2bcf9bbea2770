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

import java.util.Objects;
import net.hydromatic.laws.explore.OperationBundle;
import net.hydromatic.laws.explore.Selection;

/**
 * Concrete parameters of one test, as seen by a {@link Selector}.
 *
 * <p>Holds the {@link Selection} rather than the {@link OperationBundle}, so
 * that inspecting the operations does not mark them as used.
 */
public final class TestInfo {
  public final Selection<?, ?> selection;
  /** Name of the collection type under test, for example "ArrayList". */
  public final String collectionType;
  /** Name of the element type, for example "Int". */
  public final String elementType;

  private TestInfo(
      Selection<?, ?> selection, String collectionType, String elementType) {
    this.selection = requireNonNull(selection, "selection");
    this.collectionType = requireNonNull(collectionType, "collectionType");
    this.elementType = requireNonNull(elementType, "elementType");
  }

  public static TestInfo of(
      Selection<?, ?> selection, String collectionType, String elementType) {
    return new TestInfo(selection, collectionType, elementType);
  }

  public static TestInfo of(
      OperationBundle<?, ?> bundle, String collectionType, String elementType) {
    return new TestInfo(bundle.selection(), collectionType, elementType);
  }

  /** Returns whether the selected binary operation has an identity element. */
  public boolean hasIdentity() {
    return selection.binaryOp.hasIdentity();
  }

  @Override
  public int hashCode() {
    return Objects.hash(selection, collectionType, elementType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TestInfo
            && selection.equals(((TestInfo) o).selection)
            && collectionType.equals(((TestInfo) o).collectionType)
            && elementType.equals(((TestInfo) o).elementType);
  }

  @Override
  public String toString() {
    return "TestInfo(" + collectionType + ", " + elementType + ", "
        + selection.operations() + ")";
  }
}

// End TestInfo.java
