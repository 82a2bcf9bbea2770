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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.laws.op.Operation;
import net.hydromatic.laws.util.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered collection of interchangeable operations that can play one role.
 *
 * <p>A registry is populated by calls to {@link #register}, typically in a
 * static initializer, and is sealed the first time it is read. After that it
 * is immutable, and any number of threads may read it concurrently.
 *
 * <p>Names are not required to be unique. Registering a second variant with
 * the same name is allowed (and logged); both variants occupy a slot, and
 * {@link #find} returns the one registered last.
 *
 * @param <T> Variant type
 */
public class VariantRegistry<T extends Operation> {
  private static final Logger LOG =
      LoggerFactory.getLogger(VariantRegistry.class);

  public final String name;
  private final boolean warnOnDuplicate;
  private final List<T> items = new ArrayList<>();
  private volatile @Nullable ImmutableList<T> sealed;

  /** Creates an empty registry, configured from system properties. */
  public VariantRegistry(String name) {
    this(name, Prop.fromSystemProperties());
  }

  /** Creates an empty registry. */
  public VariantRegistry(String name, Map<Prop, Object> props) {
    this.name = requireNonNull(name, "name");
    this.warnOnDuplicate = Prop.WARN_ON_DUPLICATE_VARIANT.booleanValue(props);
  }

  /**
   * Adds a variant to the end of this registry, and returns it.
   *
   * @throws IllegalStateException if the registry has already been read
   */
  @CanIgnoreReturnValue
  public synchronized T register(T item) {
    requireNonNull(item, "item");
    checkState(sealed == null,
        "cannot register %s: registry %s has been sealed", item.name, name);
    if (find_(item.name) != null) {
      if (warnOnDuplicate) {
        LOG.warn("registry {} already contains a variant named {}",
            name, item.name);
      } else {
        LOG.debug("registry {} already contains a variant named {}",
            name, item.name);
      }
    }
    items.add(item);
    return item;
  }

  /** Returns the variants, sealing this registry if it is not sealed. */
  public ImmutableList<T> all() {
    ImmutableList<T> list = sealed;
    if (list == null) {
      synchronized (this) {
        list = sealed;
        if (list == null) {
          list = ImmutableList.copyOf(items);
          sealed = list;
          LOG.debug("sealed registry {} with {} variants", name, list.size());
        }
      }
    }
    return list;
  }

  /** Returns the number of variants. */
  public int size() {
    return all().size();
  }

  /**
   * Returns the {@code i}th variant.
   *
   * <p>Indexes are generated by an {@link Explorer} from known bounds, so an
   * index out of range is a programming error.
   *
   * @throws IndexOutOfBoundsException if {@code i} is not in the range
   *     [0, {@link #size()})
   */
  public T index(int i) {
    final ImmutableList<T> list = all();
    checkElementIndex(i, list.size(), name);
    return list.get(i);
  }

  /** Returns the last variant registered with a given name, if any. */
  public Optional<T> find(String name) {
    final ImmutableList<T> list = all();
    for (int i = list.size() - 1; i >= 0; i--) {
      if (list.get(i).name.equals(name)) {
        return Optional.of(list.get(i));
      }
    }
    return Optional.empty();
  }

  private @Nullable T find_(String name) {
    for (T item : items) {
      if (item.name.equals(name)) {
        return item;
      }
    }
    return null;
  }

  @Override
  public synchronized String toString() {
    return name + items;
  }
}

// End VariantRegistry.java
