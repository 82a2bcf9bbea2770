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
package net.hydromatic.laws.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}. */
class PropTest {
  /** Tests default values. */
  @Test void testDefaults() {
    final Map<Prop, Object> map = Prop.emptyMap();
    assertThat(Prop.MAX_COMBINATIONS.intValue(map), is(1_000));
    assertThat(Prop.SEED.intValue(map), is(0));
    assertThat(Prop.DISABLED_TAGS.stringValue(map), is(""));
    assertThat(Prop.DISABLED_TAGS.stringListValue(map).isEmpty(), is(true));
    assertThat(Prop.WARN_ON_DUPLICATE_VARIANT.booleanValue(map), is(true));
  }

  /** Tests looking up properties by name. */
  @Test void testLookup() {
    assertThat(Prop.lookup("maxCombinations"), is(Prop.MAX_COMBINATIONS));
    assertThat(Prop.lookup("MAX_COMBINATIONS"), is(Prop.MAX_COMBINATIONS));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.lookup("maxCombos"));
  }

  /** Tests reading properties, with the "laws." prefix. */
  @Test void testFromProperties() {
    final Properties properties = new Properties();
    properties.setProperty("laws.maxCombinations", " 50 ");
    properties.setProperty("laws.warnOnDuplicateVariant", "FALSE");
    properties.setProperty("laws.disabledTags", "Int,,Seq ");
    properties.setProperty("seed", "7");
    final Map<Prop, Object> map = Prop.fromProperties(properties);
    assertThat(Prop.MAX_COMBINATIONS.intValue(map), is(50));
    assertThat(Prop.WARN_ON_DUPLICATE_VARIANT.booleanValue(map), is(false));
    assertThat(Prop.DISABLED_TAGS.stringListValue(map),
        is(ImmutableList.of("Int", "Seq")));
    assertThat(Prop.SEED.intValue(map), is(0));
  }

  /** Tests that invalid values are rejected. */
  @Test void testInvalid() {
    final Map<Prop, Object> map = Prop.emptyMap();
    assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_COMBINATIONS.setLenient(map, "lots"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.WARN_ON_DUPLICATE_VARIANT.setLenient(map, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.SEED.set(map, "7"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.SEED.set(map, null));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.SEED.booleanValue(map));
    assertThat(map.isEmpty(), is(true));
  }
}

// End PropTest.java
