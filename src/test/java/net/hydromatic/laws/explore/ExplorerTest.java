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

import static net.hydromatic.laws.explore.StandardOperations.INT_EXPLORER;
import static net.hydromatic.laws.explore.StandardOperations.INT_FNS;
import static net.hydromatic.laws.explore.StandardOperations.INT_OP_FNS;
import static net.hydromatic.laws.explore.StandardOperations.INT_PARTS;
import static net.hydromatic.laws.explore.StandardOperations.INT_PREDS;
import static net.hydromatic.laws.explore.StandardOperations.INT_TO_LONGS;
import static net.hydromatic.laws.explore.StandardOperations.LONG_STR_EXPLORER;
import static net.hydromatic.laws.explore.StandardOperations.STR_EXPLORER;
import static net.hydromatic.laws.explore.StandardOperations.STR_LONG_EXPLORER;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import com.google.common.primitives.Ints;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import net.hydromatic.laws.util.Prop;
import org.junit.jupiter.api.Test;

/** Tests {@link Explorer} and {@link StandardOperations}. */
public class ExplorerTest {
  /** Tests that the standard explorers have the expected sizes. */
  @Test void testSizes() {
    assertThat(Ints.asList(INT_EXPLORER.sizes()),
        is(ImmutableList.of(2, 2, 2, 3, 3)));
    assertThat(INT_EXPLORER.combinationCount(), is(72L));
    assertThat(STR_EXPLORER.combinationCount(), is(72L));
    assertThat(LONG_STR_EXPLORER.combinationCount(), is(1L));
    assertThat(STR_LONG_EXPLORER.combinationCount(), is(1L));
  }

  /** Tests that the bundle at an index vector holds the operations at those
   * positions of the registries. */
  @Test void testLookup() {
    final OperationBundle<Integer, Long> b =
        INT_EXPLORER.lookup(new int[] {1, 0, 1, 2, 0}).get();
    assertThat(b.selection().endoTransform, is(INT_FNS.index(1)));
    assertThat(b.selection().heteroTransform, is(INT_TO_LONGS.index(0)));
    assertThat(b.selection().binaryOp, is(INT_OP_FNS.index(1)));
    assertThat(b.selection().predicate, is(INT_PREDS.index(2)));
    assertThat(b.selection().partialTransform, is(INT_PARTS.index(0)));
    assertThat(b.touched(), is(false));
  }

  /** Tests that an invalid index vector gives no bundle. */
  @Test void testLookupInvalid() {
    assertThat(INT_EXPLORER.lookup(new int[] {2, 0, 0, 0, 0}),
        is(Optional.empty()));
    assertThat(INT_EXPLORER.lookup(new int[] {0, 0, 0, 0, -1}),
        is(Optional.empty()));
    assertThat(INT_EXPLORER.lookup(new int[] {0, 0, 0, 0}),
        is(Optional.empty()));
    assertThat(INT_EXPLORER.lookup(new int[] {0, 0, 0, 0, 0, 0}),
        is(Optional.empty()));
    assertThat(INT_EXPLORER.validate(new int[] {1, 1, 1, 2, 2}), is(true));
  }

  /** Tests that each lookup returns a fresh bundle. */
  @Test void testLookupFresh() {
    final int[] ixs = {0, 0, 0, 0, 0};
    final OperationBundle<Integer, Long> b1 = INT_EXPLORER.lookup(ixs).get();
    b1.endoTransform();
    final OperationBundle<Integer, Long> b2 = INT_EXPLORER.lookup(ixs).get();
    assertThat(b2.touched(), is(false));
    assertThat(b1.equals(b2), is(true));
  }

  /** Tests that the index vectors are in lexicographic order and that
   * enumerating them yields every combination exactly once. */
  @Test void testIndexVectors() {
    final List<int[]> vectors =
        ImmutableList.copyOf(INT_EXPLORER.indexVectors());
    assertThat(vectors, hasSize(72));
    assertThat(Ints.asList(vectors.get(0)),
        is(ImmutableList.of(0, 0, 0, 0, 0)));
    assertThat(Ints.asList(vectors.get(1)),
        is(ImmutableList.of(0, 0, 0, 0, 1)));
    assertThat(Ints.asList(vectors.get(3)),
        is(ImmutableList.of(0, 0, 0, 1, 0)));
    assertThat(Ints.asList(vectors.get(71)),
        is(ImmutableList.of(1, 1, 1, 2, 2)));

    final Set<OperationBundle<Integer, Long>> intBundles = new HashSet<>();
    Iterables.addAll(intBundles, INT_EXPLORER.bundles());
    assertThat(intBundles, hasSize(72));

    final Set<OperationBundle<String, Optional<String>>> strBundles =
        new HashSet<>();
    Iterables.addAll(strBundles, STR_EXPLORER.bundles());
    assertThat(strBundles, hasSize(72));
  }

  /** Tests {@link Exploratory#sample}. */
  @Test void testSample() {
    final List<int[]> sample = INT_EXPLORER.sample(10, new Random(1));
    assertThat(sample, hasSize(10));
    final Set<List<Integer>> distinct = new HashSet<>();
    for (int[] ixs : sample) {
      assertThat(INT_EXPLORER.validate(ixs), is(true));
      distinct.add(Ints.asList(ixs));
    }
    assertThat(distinct, hasSize(10));

    // Same seed, same sample
    final List<int[]> sample2 = INT_EXPLORER.sample(10, new Random(1));
    for (int i = 0; i < sample.size(); i++) {
      assertThat(Ints.asList(sample2.get(i)), is(Ints.asList(sample.get(i))));
    }

    assertThat(INT_EXPLORER.sample(100, new Random(1)), hasSize(72));
    assertThat(INT_EXPLORER.sample(0, new Random(1)), hasSize(0));
  }

  /** Tests that a configuration limits the number of combinations. */
  @Test void testIndexVectorsWithProps() {
    final Map<Prop, Object> props = Prop.emptyMap();
    assertThat(Iterables.size(INT_EXPLORER.indexVectors(props)), is(72));
    assertThat(Iterables.size(INT_EXPLORER.bundles(props)), is(72));

    Prop.MAX_COMBINATIONS.set(props, 20);
    assertThat(Iterables.size(INT_EXPLORER.indexVectors(props)), is(20));
    assertThat(Iterables.size(INT_EXPLORER.bundles(props)), is(20));
  }

  /** Tests that a negative limit on combinations is rejected when it is
   * read. */
  @Test void testNegativeMaxCombinations() {
    final Map<Prop, Object> props = Prop.emptyMap();
    Prop.MAX_COMBINATIONS.set(props, -1);
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> INT_EXPLORER.indexVectors(props));
    assertThat(e.getMessage(),
        is("property maxCombinations must be non-negative: -1"));
  }

  /** Tests the operations of the standard explorers. */
  @Test void testStandardOperations() {
    final OperationBundle<Integer, Long> b =
        INT_EXPLORER.lookup(new int[] {1, 0, 0, 0, 0}).get();
    assertThat(b.endoTransform().apply(4), is(5));
    assertThat(b.heteroTransform().apply(1), is(0x200000001L));
    assertThat(b.predicate().test(9), is(true));

    final OperationBundle<String, Optional<String>> s =
        STR_EXPLORER.lookup(new int[] {1, 1, 1, 0, 0}).get();
    assertThat(s.endoTransform().apply("a"), is("<a-<"));
    assertThat(s.heteroTransform().apply("a1b2"), is(Optional.of("ab")));
    assertThat(s.heteroTransform().apply("12"), is(Optional.empty()));
    assertThat(s.binaryOp().apply("abc", "xy"), is("axby"));
    assertThat(s.predicate().test("abc"), is(true));
    assertThat(s.predicate().test("cba"), is(false));
    assertThat(s.partialTransform().lift("abc"), is(Optional.of("cba")));
    assertThat(s.partialTransform().lift("ab"), is(Optional.empty()));

    final OperationBundle<Map.Entry<Long, String>, Map.Entry<String, Long>> m =
        LONG_STR_EXPLORER.lookup(new int[] {0, 0, 0, 0, 0}).get();
    assertThat(m.heteroTransform().apply(Maps.immutableEntry(1L, "a")),
        is(Maps.immutableEntry("a", 1L)));
  }
}

// End ExplorerTest.java
