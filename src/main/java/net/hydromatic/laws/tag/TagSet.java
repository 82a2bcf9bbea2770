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
package net.hydromatic.laws.tag;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Set of tags and selectors that decides which laws apply in a given run.
 *
 * <p>Filtering happens in two phases. {@link #compatible} is a structural
 * check of the tags present in a run; it needs no test data, so it can prune
 * configurations before any code is generated. {@link #validate} runs the
 * selectors against the concrete parameters of one test, and can make
 * decisions that are only possible at run time, such as whether the chosen
 * binary operation has an identity element.
 *
 * <p>A tag is never both required and excluded. Instances are immutable.
 */
public final class TagSet {
  /** Tag set with no tags and no selectors. */
  public static final TagSet EMPTY =
      new TagSet(ImmutableSet.of(), ImmutableSet.of(), ImmutableList.of());

  public final ImmutableSet<Tag> required;
  public final ImmutableSet<Tag> excluded;
  public final ImmutableList<Selector> selectors;

  private TagSet(
      ImmutableSet<Tag> required,
      ImmutableSet<Tag> excluded,
      ImmutableList<Selector> selectors) {
    this.required = requireNonNull(required, "required");
    this.excluded = requireNonNull(excluded, "excluded");
    this.selectors = requireNonNull(selectors, "selectors");
    checkArgument(Collections.disjoint(required, excluded),
        "tags both required and excluded: %s",
        Sets.intersection(required, excluded));
  }

  /**
   * Creates a tag set from a list of expressions.
   *
   * <p>If a tag is both required and excluded, it is required, regardless
   * of the order of the expressions. If a tag occurs more than once with
   * the same effect, the last occurrence decides whether it is disabled.
   * Selectors keep their order.
   */
  public static TagSet of(TagExpr expr, TagExpr... exprs) {
    return of(Lists.asList(expr, exprs));
  }

  /** Creates a tag set from a list of expressions. */
  public static TagSet of(Iterable<? extends TagExpr> exprs) {
    final Set<Tag> required = new LinkedHashSet<>();
    final Set<Tag> excluded = new LinkedHashSet<>();
    final ImmutableList.Builder<Selector> selectors = ImmutableList.builder();
    for (TagExpr expr : exprs) {
      if (expr instanceof TagExpr.Require) {
        replace(required, ((TagExpr.Require) expr).tag);
      } else if (expr instanceof TagExpr.Exclude) {
        replace(excluded, ((TagExpr.Exclude) expr).tag);
      } else {
        selectors.add(((TagExpr.Select) expr).selector);
      }
    }
    return new TagSet(ImmutableSet.copyOf(required),
        ImmutableSet.copyOf(Sets.difference(excluded, required)),
        selectors.build());
  }

  /** Returns whether there are no tags and no selectors. */
  public boolean isEmpty() {
    return required.isEmpty() && excluded.isEmpty() && selectors.isEmpty();
  }

  /**
   * Returns a tag set in which a tag must be present. If the tag was
   * excluded, it no longer is. If the tag was required with a different
   * disabled state, {@code tag} replaces it.
   */
  public TagSet require(Tag tag) {
    if (sameState(find(required, tag), tag)) {
      return this;
    }
    return new TagSet(plus(required, tag), minus(excluded, tag), selectors);
  }

  /**
   * Returns a tag set in which a tag must be absent. If the tag was
   * required, it no longer is. If the tag was excluded with a different
   * disabled state, {@code tag} replaces it.
   */
  public TagSet exclude(Tag tag) {
    if (sameState(find(excluded, tag), tag)) {
      return this;
    }
    return new TagSet(minus(required, tag), plus(excluded, tag), selectors);
  }

  /** Returns a tag set with an extra selector, run after existing ones. */
  public TagSet withSelector(Selector selector) {
    requireNonNull(selector, "selector");
    return new TagSet(required, excluded,
        ImmutableList.<Selector>builder().addAll(selectors).add(selector)
            .build());
  }

  /**
   * Returns a tag set with one more expression applied. Unlike {@link
   * #of(Iterable)}, a later expression overrides an earlier one.
   */
  public TagSet plus(TagExpr expr) {
    return expr.applyTo(this);
  }

  /**
   * Returns whether a set of tags that are present in a run satisfies this
   * tag set: every required tag is present, and no excluded tag is present.
   *
   * <p>Disabled tags are ignored. A tag is disabled if either the instance
   * in this set or the instance in {@code presentTags} is disabled.
   */
  public boolean compatible(Set<Tag> presentTags) {
    for (Tag tag : required) {
      if (!isDisabled(tag, presentTags) && !presentTags.contains(tag)) {
        return false;
      }
    }
    for (Tag tag : excluded) {
      if (!isDisabled(tag, presentTags) && presentTags.contains(tag)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isDisabled(Tag tag, Set<Tag> presentTags) {
    if (tag.disabled) {
      return true;
    }
    final Tag present = find(presentTags, tag);
    return present != null && present.disabled;
  }

  /**
   * Runs the selectors, in order, against the parameters of a test, and
   * returns the first skip outcome. Selectors after that are not run.
   * Returns empty if no selector skips.
   */
  public Optional<Skip> validate(TestInfo info) {
    for (Selector selector : selectors) {
      final Optional<Skip> skip = selector.check(info);
      if (skip.isPresent()) {
        return skip;
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the effect of a tag in this set, or empty if the tag is neither
   * required nor excluded (and is not disabled).
   */
  public Optional<TagEffect> effectOf(Tag tag) {
    if (tag.disabled) {
      return Optional.of(TagEffect.DISABLED);
    }
    for (Tag t : required) {
      if (t.equals(tag)) {
        return Optional.of(
            t.disabled ? TagEffect.DISABLED : TagEffect.REQUIRED);
      }
    }
    for (Tag t : excluded) {
      if (t.equals(tag)) {
        return Optional.of(
            t.disabled ? TagEffect.DISABLED : TagEffect.EXCLUDED);
      }
    }
    return Optional.empty();
  }

  /** Returns the member of a set that has the same name as a tag. */
  private static @Nullable Tag find(Set<Tag> set, Tag tag) {
    if (!set.contains(tag)) {
      return null;
    }
    for (Tag t : set) {
      if (t.equals(tag)) {
        return t;
      }
    }
    return null;
  }

  private static boolean sameState(@Nullable Tag stored, Tag tag) {
    return stored != null && stored.disabled == tag.disabled;
  }

  /** Adds a tag to a mutable set, replacing any tag with the same name. */
  private static void replace(Set<Tag> set, Tag tag) {
    set.remove(tag);
    set.add(tag);
  }

  /**
   * Returns a set with a tag added; if the set has a tag of the same name,
   * {@code tag} takes its place.
   */
  private static ImmutableSet<Tag> plus(ImmutableSet<Tag> set, Tag tag) {
    final ImmutableSet.Builder<Tag> builder = ImmutableSet.builder();
    for (Tag t : set) {
      builder.add(t.equals(tag) ? tag : t);
    }
    return builder.add(tag).build();
  }

  private static ImmutableSet<Tag> minus(ImmutableSet<Tag> set, Tag tag) {
    if (!set.contains(tag)) {
      return set;
    }
    return ImmutableSet.copyOf(Sets.difference(set, ImmutableSet.of(tag)));
  }

  @Override
  public int hashCode() {
    return Objects.hash(required, excluded, selectors);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TagSet
            && required.equals(((TagSet) o).required)
            && excluded.equals(((TagSet) o).excluded)
            && selectors.equals(((TagSet) o).selectors);
  }

  /**
   * Returns a description such as "Int seq !set (2 filters)": the required
   * tags, sorted, then the excluded tags, sorted and prefixed with "!", then
   * the number of selectors.
   */
  @Override
  public String toString() {
    final List<String> parts = Lists.newArrayList();
    for (Tag tag : Ordering.<Tag>natural().sortedCopy(required)) {
      parts.add(tag.name);
    }
    for (Tag tag : Ordering.<Tag>natural().sortedCopy(excluded)) {
      parts.add("!" + tag.name);
    }
    switch (selectors.size()) {
    case 0:
      break;
    case 1:
      parts.add("(1 filter)");
      break;
    default:
      parts.add("(" + selectors.size() + " filters)");
    }
    return String.join(" ", parts);
  }
}

// End TagSet.java
