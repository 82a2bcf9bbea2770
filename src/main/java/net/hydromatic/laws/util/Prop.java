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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that configures how operation spaces are explored and filtered.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that is
 * absent from the map has its default value.
 */
public enum Prop {
  /**
   * Integer property "maxCombinations" is the largest number of operation
   * combinations that are enumerated exhaustively. If an explorer has more
   * combinations than this, a sample of this size is drawn instead. Default
   * is 1,000.
   */
  MAX_COMBINATIONS("maxCombinations", Integer.class, true, 1_000),

  /**
   * Integer property "seed" is the seed of the random number generator used
   * when sampling combinations. Default is 0.
   */
  SEED("seed", Integer.class, true, 0),

  /**
   * String property "disabledTags" is a comma-separated list of tag names
   * that are globally disabled. A disabled tag never blocks compatibility,
   * whether a tag set requires it or excludes it. Default is the empty
   * string.
   */
  DISABLED_TAGS("disabledTags", String.class, true, ""),

  /**
   * Boolean property "warnOnDuplicateVariant" controls whether registering a
   * variant whose name is already present in a registry logs a warning. If
   * false, the duplicate is logged at debug level. Default is true.
   */
  WARN_ON_DUPLICATE_VARIANT(
      "warnOnDuplicateVariant", Boolean.class, true, true);

  /** Prefix of system properties that override defaults. */
  public static final String SYSTEM_PREFIX = "laws.";

  private static final Splitter COMMA_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Creates an empty, mutable property map. */
  public static Map<Prop, Object> emptyMap() {
    return new LinkedHashMap<>();
  }

  /**
   * Creates a property map from the current system properties. Each property
   * is read from the system property whose name is {@link #SYSTEM_PREFIX}
   * followed by its {@link #camelName}, for example {@code
   * -Dlaws.maxCombinations=500}.
   */
  public static Map<Prop, Object> fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  /** Creates a property map from a {@link Properties}. */
  public static Map<Prop, Object> fromProperties(Properties properties) {
    final Map<Prop, Object> map = emptyMap();
    for (Prop prop : BY_CAMEL_NAME) {
      final String value =
          properties.getProperty(SYSTEM_PREFIX + prop.camelName);
      if (value != null) {
        prop.setLenient(map, value);
      }
    }
    return map;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /** Returns the value of a string property as a comma-separated list. */
  public ImmutableList<String> stringListValue(Map<Prop, Object> map) {
    return ImmutableList.copyOf(COMMA_SPLITTER.split(stringValue(map)));
  }

  /** Sets the value of a property, converting from a string if necessary. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = ((String) value).trim();
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be an integer", e);
        }
        return;
      }
      if (type == Boolean.class) {
        switch (s.toLowerCase(Locale.ROOT)) {
        case "true":
          set(map, true);
          return;
        case "false":
          set(map, false);
          return;
        default:
          throw new IllegalArgumentException(
              "value for property " + camelName + " must be 'true' or 'false'");
        }
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException(
            "property " + camelName + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
