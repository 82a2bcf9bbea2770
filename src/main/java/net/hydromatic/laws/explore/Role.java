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
package net.hydromatic.laws.explore;

/**
 * Role that an operation plays in an {@link OperationBundle}.
 *
 * <p>The ordinal of each role is its position in an index vector passed to
 * {@link Explorer#lookup(int[])}, and its slot among the bundle's usage
 * flags.
 */
public enum Role {
  /** Function from an element to another element of the same type. */
  ENDO_TRANSFORM,
  /** Function from an element to a value of a different type. */
  HETERO_TRANSFORM,
  /** Function that combines two elements into one. */
  BINARY_OP,
  /** Function from an element to a boolean. */
  PREDICATE,
  /**
   * Function from an element to another element of the same type, defined
   * only on part of its domain.
   *
   * <p>{@link OperationBundle#identityElement()} also records its usage in
   * this slot.
   */
  PARTIAL_TRANSFORM;

  /** Number of roles; the length of an index vector. */
  public static final int COUNT = values().length;
}

// End Role.java
