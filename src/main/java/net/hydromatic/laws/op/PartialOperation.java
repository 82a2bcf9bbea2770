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

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Named function that is defined on only part of its domain, and maps an
 * element to another element of the same type.
 *
 * @param <X> Element type
 */
public class PartialOperation<X> extends Operation {
  private final Predicate<? super X> domain;
  private final Function<? super X, Optional<X>> lifted;

  private PartialOperation(
      String name,
      @Nullable SourceLocation location,
      Predicate<? super X> domain,
      Function<? super X, Optional<X>> lifted) {
    super(name, location);
    this.domain = requireNonNull(domain, "domain");
    this.lifted = requireNonNull(lifted, "lifted");
  }

  /**
   * Creates a PartialOperation that is defined where {@code domain} is true,
   * and there has value {@code fn(x)}.
   */
  public static <X> PartialOperation<X> of(
      String name,
      Predicate<? super X> domain,
      Function<? super X, ? extends X> fn) {
    return new PartialOperation<X>(name, null, domain, toLifted(domain, fn));
  }

  /** Creates a PartialOperation with a source location. */
  public static <X> PartialOperation<X> of(
      String name,
      SourceLocation location,
      Predicate<? super X> domain,
      Function<? super X, ? extends X> fn) {
    return new PartialOperation<X>(name, requireNonNull(location), domain,
        toLifted(domain, fn));
  }

  /**
   * Creates a PartialOperation from a function that returns empty where the
   * operation is undefined.
   *
   * <p>{@link #apply} and {@link #lift} call {@code fn} once per
   * invocation.
   */
  public static <X> PartialOperation<X> unlift(
      String name, Function<? super X, Optional<X>> fn) {
    requireNonNull(fn, "fn");
    return new PartialOperation<X>(
        name, null, x -> fn.apply(x).isPresent(), fn);
  }

  private static <X> Function<? super X, Optional<X>> toLifted(
      Predicate<? super X> domain, Function<? super X, ? extends X> fn) {
    requireNonNull(domain, "domain");
    requireNonNull(fn, "fn");
    return x -> {
      if (!domain.test(x)) {
        return Optional.empty();
      }
      return Optional.<X>of(fn.apply(x));
    };
  }

  /** Returns whether this operation is defined for a given value. */
  public boolean isDefinedAt(X x) {
    return domain.test(x);
  }

  /**
   * Applies this operation.
   *
   * @throws IllegalArgumentException if the operation is not defined for
   *     {@code x}
   */
  public X apply(X x) {
    final Optional<X> y = lifted.apply(x);
    checkArgument(y.isPresent(), "%s is not defined at %s", name, x);
    return y.get();
  }

  /**
   * Applies this operation if it is defined for {@code x}, otherwise returns
   * empty.
   */
  public Optional<X> lift(X x) {
    return lifted.apply(x);
  }
}

// End PartialOperation.java
