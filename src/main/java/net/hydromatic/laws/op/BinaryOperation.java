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

import java.util.function.BinaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Named operation that combines two values of a type into one value of the
 * same type.
 *
 * <p>An operation may declare an identity element (a "zero"), and whether
 * it is associative and symmetric (commutative). These are hints that the
 * caller asserts; no attempt is made to check that they are true.
 *
 * @param <X> Element type
 */
public class BinaryOperation<X> extends Operation {
  public final BinaryOperator<X> fn;
  private final @Nullable X identity;
  public final Associativity associativity;
  public final Symmetry symmetry;

  private BinaryOperation(
      String name,
      @Nullable SourceLocation location,
      BinaryOperator<X> fn,
      @Nullable X identity,
      Associativity associativity,
      Symmetry symmetry) {
    super(name, location);
    this.fn = requireNonNull(fn, "fn");
    this.identity = identity;
    this.associativity = requireNonNull(associativity, "associativity");
    this.symmetry = requireNonNull(symmetry, "symmetry");
  }

  /**
   * Creates a BinaryOperation.
   *
   * @param name Name
   * @param fn Function
   * @param identity Identity element, or null if the operation has none
   * @param associativity Whether the operation is associative
   * @param symmetry Whether the operation is symmetric
   */
  public static <X> BinaryOperation<X> of(
      String name,
      BinaryOperator<X> fn,
      @Nullable X identity,
      Associativity associativity,
      Symmetry symmetry) {
    return new BinaryOperation<>(
        name, null, fn, identity, associativity, symmetry);
  }

  /** Creates a BinaryOperation with a source location. */
  public static <X> BinaryOperation<X> of(
      String name,
      SourceLocation location,
      BinaryOperator<X> fn,
      @Nullable X identity,
      Associativity associativity,
      Symmetry symmetry) {
    return new BinaryOperation<>(
        name, requireNonNull(location), fn, identity, associativity, symmetry);
  }

  /** Applies the operation. */
  public X apply(X x, X y) {
    return fn.apply(x, y);
  }

  /** Returns whether this operation declares an identity element. */
  public boolean hasIdentity() {
    return identity != null;
  }

  /**
   * Returns the identity element.
   *
   * @throws MissingIdentityException if this operation declares none
   */
  public X identity() {
    if (identity == null) {
      throw new MissingIdentityException(name);
    }
    return identity;
  }

  public boolean isAssociative() {
    return associativity == Associativity.ASSOCIATIVE;
  }

  public boolean isSymmetric() {
    return symmetry == Symmetry.SYMMETRIC;
  }

  /** Whether {@code op(op(x, y), z) = op(x, op(y, z))}. */
  public enum Associativity {
    ASSOCIATIVE,
    NONASSOCIATIVE
  }

  /** Whether {@code op(x, y) = op(y, x)}. */
  public enum Symmetry {
    SYMMETRIC,
    ASYMMETRIC
  }
}

// End BinaryOperation.java
