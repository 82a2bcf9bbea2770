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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.laws.op.BinaryOperation;
import net.hydromatic.laws.op.NamedOperation;
import net.hydromatic.laws.op.Operation;
import net.hydromatic.laws.op.PartialOperation;

/**
 * Choice of one operation for each {@link Role}.
 *
 * <p>Unlike {@link OperationBundle}, reading a selection does not record
 * usage. Selectors and diagnostics should use a selection so that they do
 * not count as exercising an operation.
 *
 * @param <A> Element type
 * @param <B> Result type of the hetero-transform
 */
public final class Selection<A, B> {
  public final NamedOperation<A, A> endoTransform;
  public final NamedOperation<A, B> heteroTransform;
  public final BinaryOperation<A> binaryOp;
  public final NamedOperation<A, Boolean> predicate;
  public final PartialOperation<A> partialTransform;

  private Selection(
      NamedOperation<A, A> endoTransform,
      NamedOperation<A, B> heteroTransform,
      BinaryOperation<A> binaryOp,
      NamedOperation<A, Boolean> predicate,
      PartialOperation<A> partialTransform) {
    this.endoTransform = requireNonNull(endoTransform, "endoTransform");
    this.heteroTransform = requireNonNull(heteroTransform, "heteroTransform");
    this.binaryOp = requireNonNull(binaryOp, "binaryOp");
    this.predicate = requireNonNull(predicate, "predicate");
    this.partialTransform =
        requireNonNull(partialTransform, "partialTransform");
  }

  /** Creates a Selection. */
  public static <A, B> Selection<A, B> of(
      NamedOperation<A, A> endoTransform,
      NamedOperation<A, B> heteroTransform,
      BinaryOperation<A> binaryOp,
      NamedOperation<A, Boolean> predicate,
      PartialOperation<A> partialTransform) {
    return new Selection<>(
        endoTransform, heteroTransform, binaryOp, predicate, partialTransform);
  }

  /** Returns the operation that plays a given role. */
  public Operation get(Role role) {
    switch (role) {
    case ENDO_TRANSFORM:
      return endoTransform;
    case HETERO_TRANSFORM:
      return heteroTransform;
    case BINARY_OP:
      return binaryOp;
    case PREDICATE:
      return predicate;
    case PARTIAL_TRANSFORM:
      return partialTransform;
    default:
      throw new AssertionError(role);
    }
  }

  /** Returns the operations, in {@link Role} order. */
  public ImmutableList<Operation> operations() {
    return ImmutableList.of(
        endoTransform, heteroTransform, binaryOp, predicate, partialTransform);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        endoTransform, heteroTransform, binaryOp, predicate, partialTransform);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Selection
            && endoTransform.equals(((Selection<?, ?>) o).endoTransform)
            && heteroTransform.equals(((Selection<?, ?>) o).heteroTransform)
            && binaryOp.equals(((Selection<?, ?>) o).binaryOp)
            && predicate.equals(((Selection<?, ?>) o).predicate)
            && partialTransform.equals(((Selection<?, ?>) o).partialTransform);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder(), "Selection").toString();
  }

  /**
   * Writes a title followed by the five operations, one per line, with the
   * "@" of each operation's location aligned.
   */
  StringBuilder describeTo(StringBuilder buf, String title) {
    final List<String> parts =
        ImmutableList.copyOf(
            operations().stream().map(Operation::toString).iterator());
    int pad = -1;
    for (String part : parts) {
      pad = Math.max(pad, part.indexOf('@'));
    }
    buf.append(title);
    for (String part : parts) {
      buf.append("\n  ");
      final int i = part.indexOf('@');
      if (i <= 0 || i >= pad) {
        buf.append(part);
      } else {
        buf.append(part, 0, i - 1)
            .append(Strings.repeat(" ", pad - i))
            .append(part, i - 1, part.length());
      }
    }
    return buf;
  }
}

// End Selection.java
