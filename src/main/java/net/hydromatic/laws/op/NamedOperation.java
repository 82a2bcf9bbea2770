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

import static java.util.Objects.requireNonNull;

import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Named function of one argument.
 *
 * <p>Used for the transformations of an element to another element of the
 * same type or of a different type, and (with {@code Y} = {@link Boolean}) for
 * predicates.
 *
 * @param <X> Argument type
 * @param <Y> Result type
 */
public class NamedOperation<X, Y> extends Operation {
  public final Function<X, Y> fn;

  private NamedOperation(
      String name, @Nullable SourceLocation location, Function<X, Y> fn) {
    super(name, location);
    this.fn = requireNonNull(fn, "fn");
  }

  /** Creates a NamedOperation. */
  public static <X, Y> NamedOperation<X, Y> of(String name, Function<X, Y> fn) {
    return new NamedOperation<>(name, null, fn);
  }

  /** Creates a NamedOperation with a source location. */
  public static <X, Y> NamedOperation<X, Y> of(
      String name, SourceLocation location, Function<X, Y> fn) {
    return new NamedOperation<>(name, requireNonNull(location), fn);
  }

  /** Applies the function. */
  public Y apply(X x) {
    return fn.apply(x);
  }
}

// End NamedOperation.java
