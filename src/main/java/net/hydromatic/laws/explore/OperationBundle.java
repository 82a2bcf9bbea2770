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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import net.hydromatic.laws.op.BinaryOperation;
import net.hydromatic.laws.op.MissingIdentityException;
import net.hydromatic.laws.op.NamedOperation;
import net.hydromatic.laws.op.PartialOperation;

/**
 * The operations that a law uses in one evaluation, instrumented to record
 * which of them the law actually used.
 *
 * <p>Each accessor sets the usage flag of its {@link Role} every time it is
 * called. After evaluating a law, a test harness can check {@link #touched()}
 * or {@link #used(Role)} to see whether the law exercised the operations it
 * claims to use.
 *
 * <p>A bundle is mutable and must not be shared between concurrent
 * evaluations. Get a new bundle from {@link Explorer#lookup(int[])} for each
 * evaluation, or call {@link #reset()} before reusing one.
 *
 * <p>Two bundles are equal if they select the same operations, regardless
 * of which operations have been used.
 *
 * @param <A> Element type
 * @param <B> Result type of the hetero-transform
 */
public final class OperationBundle<A, B> {
  private final Selection<A, B> selection;
  private final boolean[] used = new boolean[Role.COUNT];

  private OperationBundle(Selection<A, B> selection) {
    this.selection = requireNonNull(selection, "selection");
  }

  /** Creates a bundle, with no operations used, for a selection. */
  public static <A, B> OperationBundle<A, B> of(Selection<A, B> selection) {
    return new OperationBundle<>(selection);
  }

  /** Creates a bundle, with no operations used. */
  public static <A, B> OperationBundle<A, B> of(
      NamedOperation<A, A> endoTransform,
      NamedOperation<A, B> heteroTransform,
      BinaryOperation<A> binaryOp,
      NamedOperation<A, Boolean> predicate,
      PartialOperation<A> partialTransform) {
    return new OperationBundle<>(
        Selection.of(endoTransform, heteroTransform, binaryOp, predicate,
            partialTransform));
  }

  /** Returns the selected operations, without recording usage. */
  public Selection<A, B> selection() {
    return selection;
  }

  /** Returns a function that maps an element to another of the same type. */
  public Function<A, A> endoTransform() {
    used[Role.ENDO_TRANSFORM.ordinal()] = true;
    return selection.endoTransform.fn;
  }

  /** Returns a function that maps an element to a value of another type. */
  public Function<A, B> heteroTransform() {
    used[Role.HETERO_TRANSFORM.ordinal()] = true;
    return selection.heteroTransform.fn;
  }

  /** Returns a function that combines two elements into one. */
  public BinaryOperator<A> binaryOp() {
    used[Role.BINARY_OP.ordinal()] = true;
    return selection.binaryOp.fn;
  }

  /** Returns a predicate on elements. */
  public Predicate<A> predicate() {
    used[Role.PREDICATE.ordinal()] = true;
    final Function<A, Boolean> fn = selection.predicate.fn;
    return a -> fn.apply(a);
  }

  /** Returns a function defined on some elements. */
  public PartialOperation<A> partialTransform() {
    used[Role.PARTIAL_TRANSFORM.ordinal()] = true;
    return selection.partialTransform;
  }

  /**
   * Returns the identity element of the binary operation.
   *
   * <p>Records usage in the {@link Role#PARTIAL_TRANSFORM} slot; there is no
   * slot of its own.
   *
   * <p>Laws that call this method must be filtered, using a selector that
   * checks {@link BinaryOperation#hasIdentity()}, so that they only run with
   * operations that have an identity.
   *
   * @throws MissingIdentityException if the binary operation declares no
   *     identity element
   */
  public A identityElement() {
    used[Role.PARTIAL_TRANSFORM.ordinal()] = true;
    return selection.binaryOp.identity();
  }

  /** Returns whether the operation in a given role has been used. */
  public boolean used(Role role) {
    return used[role.ordinal()];
  }

  /** Returns the roles whose operations have been used. */
  public Set<Role> usedRoles() {
    final EnumSet<Role> roles = EnumSet.noneOf(Role.class);
    for (Role role : Role.values()) {
      if (used[role.ordinal()]) {
        roles.add(role);
      }
    }
    return Sets.immutableEnumSet(roles);
  }

  /** Returns whether any operation has been used. */
  public boolean touched() {
    for (boolean b : used) {
      if (b) {
        return true;
      }
    }
    return false;
  }

  /** Clears all usage flags, so that this bundle can be reused. */
  @CanIgnoreReturnValue
  public OperationBundle<A, B> reset() {
    Arrays.fill(used, false);
    return this;
  }

  @Override
  public int hashCode() {
    return selection.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof OperationBundle
            && selection.equals(((OperationBundle<?, ?>) o).selection);
  }

  @Override
  public String toString() {
    return selection.describeTo(new StringBuilder(), "OperationBundle")
        .toString();
  }
}

// End OperationBundle.java
