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

import com.google.common.collect.Iterables;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.laws.op.BinaryOperation;
import net.hydromatic.laws.op.NamedOperation;
import net.hydromatic.laws.op.PartialOperation;
import net.hydromatic.laws.util.Prop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Steps through the combinations of operations that can be applied to
 * collections of a given element type.
 *
 * <p>An explorer has one {@link VariantRegistry} per {@link Role}. An index
 * vector has one component per role, and picks the variant at that index in
 * the role's registry.
 *
 * @param <A> Element type
 * @param <B> Result type of the hetero-transform
 */
public class Explorer<A, B> implements Exploratory<OperationBundle<A, B>> {
  private static final Logger LOG = LoggerFactory.getLogger(Explorer.class);

  public final VariantRegistry<NamedOperation<A, A>> endoTransforms;
  public final VariantRegistry<NamedOperation<A, B>> heteroTransforms;
  public final VariantRegistry<BinaryOperation<A>> binaryOps;
  public final VariantRegistry<NamedOperation<A, Boolean>> predicates;
  public final VariantRegistry<PartialOperation<A>> partialTransforms;
  private final int[] sizes;

  /** Creates an Explorer. Seals each of the registries. */
  public Explorer(
      VariantRegistry<NamedOperation<A, A>> endoTransforms,
      VariantRegistry<NamedOperation<A, B>> heteroTransforms,
      VariantRegistry<BinaryOperation<A>> binaryOps,
      VariantRegistry<NamedOperation<A, Boolean>> predicates,
      VariantRegistry<PartialOperation<A>> partialTransforms) {
    this.endoTransforms = requireNonNull(endoTransforms, "endoTransforms");
    this.heteroTransforms =
        requireNonNull(heteroTransforms, "heteroTransforms");
    this.binaryOps = requireNonNull(binaryOps, "binaryOps");
    this.predicates = requireNonNull(predicates, "predicates");
    this.partialTransforms =
        requireNonNull(partialTransforms, "partialTransforms");
    this.sizes =
        new int[] {
          endoTransforms.size(),
          heteroTransforms.size(),
          binaryOps.size(),
          predicates.size(),
          partialTransforms.size()
        };
    LOG.debug("explorer over {}, {}, {}, {}, {} has {} combinations",
        endoTransforms.name, heteroTransforms.name, binaryOps.name,
        predicates.name, partialTransforms.name, combinationCount());
  }

  @Override
  public int[] sizes() {
    return sizes.clone();
  }

  @Override
  public Optional<OperationBundle<A, B>> lookup(int[] indices) {
    if (!validate(indices)) {
      return Optional.empty();
    }
    return Optional.of(
        OperationBundle.of(
            endoTransforms.index(indices[Role.ENDO_TRANSFORM.ordinal()]),
            heteroTransforms.index(indices[Role.HETERO_TRANSFORM.ordinal()]),
            binaryOps.index(indices[Role.BINARY_OP.ordinal()]),
            predicates.index(indices[Role.PREDICATE.ordinal()]),
            partialTransforms.index(
                indices[Role.PARTIAL_TRANSFORM.ordinal()])));
  }

  /**
   * Returns a fresh bundle for every combination, in the order of {@link
   * #indexVectors()}.
   */
  public Iterable<OperationBundle<A, B>> bundles() {
    return Iterables.transform(indexVectors(), ixs -> lookup(ixs).get());
  }

  /**
   * Returns a fresh bundle for each combination that should be explored under
   * a given configuration.
   *
   * @see #indexVectors(Map)
   */
  public Iterable<OperationBundle<A, B>> bundles(Map<Prop, Object> props) {
    return Iterables.transform(indexVectors(props), ixs -> lookup(ixs).get());
  }
}

// End Explorer.java
