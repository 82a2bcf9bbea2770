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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Range;
import com.google.common.primitives.Ints;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import net.hydromatic.laws.util.Prop;

/**
 * Space of configurations that can be enumerated by index vectors.
 *
 * <p>Each component {@code i} of an index vector is in the range [0, {@code
 * sizes()[i]}); the space contains one configuration for each such vector.
 *
 * @param <T> Configuration type
 */
public interface Exploratory<T> {
  /** Returns the number of choices in each dimension. */
  int[] sizes();

  /**
   * Returns the configuration at a given index vector, or empty if the
   * vector is not {@link #validate valid}.
   */
  Optional<T> lookup(int[] indices);

  /**
   * Returns whether an index vector has the right length and each of its
   * components is within range.
   */
  default boolean validate(int[] indices) {
    final int[] sizes = sizes();
    if (indices.length != sizes.length) {
      return false;
    }
    for (int i = 0; i < sizes.length; i++) {
      if (indices[i] < 0 || indices[i] >= sizes[i]) {
        return false;
      }
    }
    return true;
  }

  /** Returns the number of configurations; the product of the sizes. */
  default long combinationCount() {
    long n = 1;
    for (int size : sizes()) {
      n *= size;
    }
    return n;
  }

  /**
   * Returns every valid index vector, in lexicographic order. Each vector is
   * returned exactly once.
   */
  default Iterable<int[]> indexVectors() {
    final ImmutableList.Builder<List<Integer>> ranges = ImmutableList.builder();
    for (int size : sizes()) {
      ranges.add(
          ContiguousSet.create(Range.closedOpen(0, size),
                  DiscreteDomain.integers())
              .asList());
    }
    return Iterables.transform(Lists.cartesianProduct(ranges.build()),
        Ints::toArray);
  }

  /**
   * Returns a random sample of distinct valid index vectors.
   *
   * <p>If {@code count} is at least {@link #combinationCount()}, returns all
   * vectors.
   */
  default List<int[]> sample(int count, Random random) {
    checkArgument(count >= 0, "count must be non-negative: %s", count);
    if (count >= combinationCount()) {
      return ImmutableList.copyOf(indexVectors());
    }
    final int[] sizes = sizes();
    final Set<List<Integer>> vectors = new LinkedHashSet<>();
    while (vectors.size() < count) {
      final int[] indices = new int[sizes.length];
      for (int i = 0; i < sizes.length; i++) {
        indices[i] = random.nextInt(sizes[i]);
      }
      vectors.add(Ints.asList(indices));
    }
    return ImmutableList.copyOf(Iterables.transform(vectors, Ints::toArray));
  }

  /**
   * Returns the index vectors to explore under a given configuration: all of
   * them if there are no more than {@link Prop#MAX_COMBINATIONS}, otherwise
   * a sample of that many, drawn using {@link Prop#SEED}.
   *
   * @throws IllegalArgumentException if {@link Prop#MAX_COMBINATIONS} is
   *     negative
   */
  default Iterable<int[]> indexVectors(Map<Prop, Object> props) {
    final int max = Prop.MAX_COMBINATIONS.intValue(props);
    checkArgument(max >= 0, "property %s must be non-negative: %s",
        Prop.MAX_COMBINATIONS.camelName, max);
    if (combinationCount() <= max) {
      return indexVectors();
    }
    return sample(max, new Random(Prop.SEED.intValue(props)));
  }
}

// End Exploratory.java
