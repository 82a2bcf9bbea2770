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

import static java.util.Objects.requireNonNull;

import java.util.Map;
import net.hydromatic.laws.util.Prop;

/**
 * Element of a {@link TagSet} definition: a required tag, an excluded tag,
 * or a selector.
 *
 * @see TagSet#of(TagExpr, TagExpr...)
 */
public abstract class TagExpr {
  private TagExpr() {}

  /** Returns an expression that requires a tag to be present. */
  public static Require require(Tag tag) {
    return new Require(tag);
  }

  /**
   * Returns an expression that requires a tag to be present. The tag is
   * disabled if system property {@code laws.disabledTags} names it.
   */
  public static Require require(String name) {
    return require(name, Prop.fromSystemProperties());
  }

  /**
   * Returns an expression that requires a tag to be present. The tag is
   * disabled if {@link Prop#DISABLED_TAGS} names it.
   */
  public static Require require(String name, Map<Prop, Object> props) {
    return new Require(Tag.of(name, props));
  }

  /** Returns an expression that requires a tag to be absent. */
  public static Exclude exclude(Tag tag) {
    return new Exclude(tag);
  }

  /**
   * Returns an expression that requires a tag to be absent. The tag is
   * disabled if system property {@code laws.disabledTags} names it.
   */
  public static Exclude exclude(String name) {
    return exclude(name, Prop.fromSystemProperties());
  }

  /**
   * Returns an expression that requires a tag to be absent. The tag is
   * disabled if {@link Prop#DISABLED_TAGS} names it.
   */
  public static Exclude exclude(String name, Map<Prop, Object> props) {
    return new Exclude(Tag.of(name, props));
  }

  /** Returns an expression that adds a dynamic selector. */
  public static Select select(Selector selector) {
    return new Select(selector);
  }

  /** Applies this expression to a tag set. */
  abstract TagSet applyTo(TagSet tagSet);

  /** Expression that requires a tag. */
  public static final class Require extends TagExpr {
    public final Tag tag;

    Require(Tag tag) {
      this.tag = requireNonNull(tag, "tag");
    }

    @Override
    TagSet applyTo(TagSet tagSet) {
      return tagSet.require(tag);
    }

    @Override
    public String toString() {
      return tag.name;
    }
  }

  /** Expression that excludes a tag. */
  public static final class Exclude extends TagExpr {
    public final Tag tag;

    Exclude(Tag tag) {
      this.tag = requireNonNull(tag, "tag");
    }

    @Override
    TagSet applyTo(TagSet tagSet) {
      return tagSet.exclude(tag);
    }

    @Override
    public String toString() {
      return "!" + tag.name;
    }
  }

  /** Expression that adds a selector. */
  public static final class Select extends TagExpr {
    public final Selector selector;

    Select(Selector selector) {
      this.selector = requireNonNull(selector, "selector");
    }

    @Override
    TagSet applyTo(TagSet tagSet) {
      return tagSet.withSelector(selector);
    }

    @Override
    public String toString() {
      return "select";
    }
  }
}

// End TagExpr.java
