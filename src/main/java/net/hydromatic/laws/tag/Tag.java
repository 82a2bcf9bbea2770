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

import java.util.Map;
import net.hydromatic.laws.util.Prop;

/**
 * Label that says whether a law applies in a given run.
 *
 * <p>For instance, if you are testing collections of {@code int} and of
 * {@code String}, laws that only make sense for {@code int} can require the
 * tag "Int".
 *
 * <p>A disabled tag never blocks compatibility, whether a {@link TagSet}
 * requires or excludes it. Tags are equal if their names are equal.
 */
public final class Tag implements Comparable<Tag> {
  public final String name;
  public final boolean disabled;

  private Tag(String name, boolean disabled) {
    this.name = requireNonNull(name, "name");
    checkArgument(!name.isEmpty(), "tag name must not be empty");
    checkArgument(!name.startsWith("!"), "tag name must not start with '!'");
    this.disabled = disabled;
  }

  /** Creates an enabled tag. */
  public static Tag of(String name) {
    return new Tag(name, false);
  }

  /** Creates a globally disabled tag. */
  public static Tag disabled(String name) {
    return new Tag(name, true);
  }

  /**
   * Creates a tag that is disabled if its name is listed in the {@link
   * Prop#DISABLED_TAGS} property.
   */
  public static Tag of(String name, Map<Prop, Object> props) {
    final boolean disabled =
        Prop.DISABLED_TAGS.stringListValue(props).contains(name);
    return new Tag(name, disabled);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Tag && name.equals(((Tag) o).name);
  }

  @Override
  public int compareTo(Tag o) {
    return name.compareTo(o.name);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Tag.java
