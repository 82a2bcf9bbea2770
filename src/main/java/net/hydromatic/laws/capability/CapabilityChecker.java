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
package net.hydromatic.laws.capability;

import static java.util.Objects.requireNonNull;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Set of operation names that a target type supports.
 *
 * <p>A law that mentions operations can be generated for a type only if the
 * type's checker {@link #passes} the set of names that the law uses.
 * Checking never fails; a missing operation makes {@code passes} return
 * false, and the caller should skip generating the law.
 */
public final class CapabilityChecker {
  private static final Logger LOG =
      LoggerFactory.getLogger(CapabilityChecker.class);

  /** Checker that supports no operations. */
  public static final CapabilityChecker EMPTY =
      new CapabilityChecker(ImmutableSet.of());

  /** Names of the public methods that every object inherits. */
  public static final ImmutableSet<String> OBJECT_METHODS =
      Arrays.stream(Object.class.getMethods())
          .map(Method::getName)
          .collect(ImmutableSet.toImmutableSet());

  /**
   * Names that are never regarded as capabilities, even if a type has them.
   */
  public static final ImmutableSet<String> IGNORED =
      ImmutableSet.of("clone", "parallel", "parallelStream", "sequential");

  /**
   * Names that every target is assumed to support, through a common
   * contract, even if introspection does not find them.
   */
  public static final ImmutableSet<String> ASSUMED =
      ImmutableSet.of("filter", "flatMap", "map");

  public final ImmutableSet<String> names;

  private CapabilityChecker(ImmutableSet<String> names) {
    this.names = requireNonNull(names, "names");
  }

  /** Creates a checker with a given set of names. */
  public static CapabilityChecker of(Iterable<String> names) {
    return new CapabilityChecker(ImmutableSet.copyOf(names));
  }

  /** Creates a checker with a given set of names. */
  public static CapabilityChecker of(String... names) {
    return new CapabilityChecker(ImmutableSet.copyOf(names));
  }

  /**
   * Creates a checker for a type: the names that {@code introspector}
   * lists, minus {@link #OBJECT_METHODS} and {@link #IGNORED}, plus {@link
   * #ASSUMED}.
   */
  public static CapabilityChecker from(Class<?> type,
      Introspector introspector) {
    final Set<String> raw = introspector.operationNames(type);
    final ImmutableSet<String> names =
        Sets.union(
                Sets.difference(Sets.difference(raw, OBJECT_METHODS), IGNORED),
                ASSUMED)
            .immutableCopy();
    LOG.debug("capabilities of {}: {}", type.getName(), names);
    return new CapabilityChecker(names);
  }

  /**
   * Returns a function that creates a checker for a type, calling {@link
   * #from} at most once per type.
   */
  public static Function<Class<?>, CapabilityChecker> memoize(
      Introspector introspector) {
    requireNonNull(introspector, "introspector");
    final LoadingCache<Class<?>, CapabilityChecker> cache =
        CacheBuilder.newBuilder()
            .build(
                CacheLoader.from((Class<?> type) -> from(type, introspector)));
    return cache::getUnchecked;
  }

  /** Returns whether this checker supports every name in a set. */
  public boolean passes(Set<String> required) {
    return names.containsAll(required);
  }

  /** Returns whether this checker supports every name in another checker. */
  public boolean passes(CapabilityChecker required) {
    return passes(required.names);
  }

  /** Returns a checker whose names are those of this and another checker. */
  public CapabilityChecker union(CapabilityChecker other) {
    if (other.names.isEmpty()) {
      return this;
    }
    return new CapabilityChecker(
        Sets.union(names, other.names).immutableCopy());
  }

  @Override
  public int hashCode() {
    return names.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof CapabilityChecker
            && names.equals(((CapabilityChecker) o).names);
  }

  @Override
  public String toString() {
    return "CapabilityChecker" + names;
  }
}

// End CapabilityChecker.java
