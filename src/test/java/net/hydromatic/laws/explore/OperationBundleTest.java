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

import static net.hydromatic.laws.explore.StandardOperations.CAST;
import static net.hydromatic.laws.explore.StandardOperations.HALF_EVEN;
import static net.hydromatic.laws.explore.StandardOperations.MOD3;
import static net.hydromatic.laws.explore.StandardOperations.MULTIPLY;
import static net.hydromatic.laws.explore.StandardOperations.PLUS_ONE;
import static net.hydromatic.laws.explore.StandardOperations.SUMMATION;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableSet;
import net.hydromatic.laws.op.MissingIdentityException;
import net.hydromatic.laws.op.NamedOperation;
import net.hydromatic.laws.op.SourceLocation;
import org.junit.jupiter.api.Test;

/** Tests {@link OperationBundle}. */
public class OperationBundleTest {
  private static OperationBundle<Integer, Long> bundle() {
    return OperationBundle.of(PLUS_ONE, CAST, SUMMATION, MOD3, HALF_EVEN);
  }

  /** Tests that a new bundle is untouched, and that each accessor sets the
   * flag of its own role. */
  @Test void testTouched() {
    final OperationBundle<Integer, Long> b = bundle();
    assertThat(b.touched(), is(false));
    assertThat(b.usedRoles(), empty());

    assertThat(b.endoTransform().apply(3), is(4));
    assertThat(b.touched(), is(true));
    assertThat(b.used(Role.ENDO_TRANSFORM), is(true));
    assertThat(b.used(Role.HETERO_TRANSFORM), is(false));

    assertThat(b.heteroTransform().apply(3), is(3L));
    assertThat(b.binaryOp().apply(3, 4), is(7));
    assertThat(b.predicate().test(6), is(true));
    assertThat(b.partialTransform().lift(6).get(), is(3));
    assertThat(b.usedRoles(),
        is(ImmutableSet.copyOf(Role.values())));
  }

  /** Tests {@link OperationBundle#reset()}. */
  @Test void testReset() {
    final OperationBundle<Integer, Long> b = bundle();
    b.binaryOp();
    b.predicate();
    assertThat(b.touched(), is(true));
    assertThat(b.reset().touched(), is(false));
    assertThat(b.used(Role.BINARY_OP), is(false));
    b.reset();
    assertThat(b.touched(), is(false));
  }

  /** Tests that asking for the identity element marks the partial transform
   * as used, and no other role. The two share a flag. */
  @Test void testIdentityElementSharesPartialFlag() {
    final OperationBundle<Integer, Long> b = bundle();
    assertThat(b.identityElement(), is(0));
    assertThat(b.used(Role.PARTIAL_TRANSFORM), is(true));
    assertThat(b.used(Role.BINARY_OP), is(false));
    assertThat(b.usedRoles(), is(ImmutableSet.of(Role.PARTIAL_TRANSFORM)));
  }

  /** Tests that asking for a missing identity element throws, and still
   * marks the bundle as touched. */
  @Test void testMissingIdentityElement() {
    final OperationBundle<Integer, Long> b =
        OperationBundle.of(PLUS_ONE, CAST, MULTIPLY, MOD3, HALF_EVEN);
    assertThrows(MissingIdentityException.class, b::identityElement);
    assertThat(b.used(Role.PARTIAL_TRANSFORM), is(true));
  }

  /** Tests that reading the selection does not set any flags. */
  @Test void testSelection() {
    final OperationBundle<Integer, Long> b = bundle();
    assertThat(b.selection().binaryOp.hasIdentity(), is(true));
    assertThat(b.selection().get(Role.PREDICATE), is(MOD3));
    assertThat(b.touched(), is(false));
  }

  /** Tests that equality depends on the operations, not the usage flags. */
  @Test void testEquals() {
    final OperationBundle<Integer, Long> b1 = bundle();
    final OperationBundle<Integer, Long> b2 = bundle();
    b1.endoTransform();
    assertThat(b1.equals(b2), is(true));
    assertThat(b1.hashCode(), is(b2.hashCode()));
    final OperationBundle<Integer, Long> b3 =
        OperationBundle.of(PLUS_ONE, CAST, MULTIPLY, MOD3, HALF_EVEN);
    assertThat(b1.equals(b3), is(false));
  }

  /** Tests {@link OperationBundle#toString()}, including the alignment of
   * locations. */
  @Test void testToString() {
    assertThat(bundle(),
        hasToString("OperationBundle\n"
            + "  plusOne\n"
            + "  cast\n"
            + "  summation\n"
            + "  mod3\n"
            + "  halfEven"));

    final NamedOperation<Integer, Integer> inc =
        NamedOperation.of("inc", SourceLocation.of("A.java", 1), i -> i + 1);
    final NamedOperation<Integer, Boolean> positive =
        NamedOperation.of("positive", SourceLocation.of("A.java", 2),
            i -> i > 0);
    final OperationBundle<Integer, Long> b =
        OperationBundle.of(inc, CAST, SUMMATION, positive, HALF_EVEN);
    assertThat(b,
        hasToString("OperationBundle\n"
            + "  inc      @ A.java, line 1\n"
            + "  cast\n"
            + "  summation\n"
            + "  positive @ A.java, line 2\n"
            + "  halfEven"));
  }
}

// End OperationBundleTest.java
