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
package net.hydromatic.laws.capability;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Set;

/**
 * Lists the names of the public operations of a type.
 *
 * <p>The host environment supplies the mechanism. {@link #manifest} uses a
 * table declared in advance; {@link #reflective()} uses Java reflection.
 */
@FunctionalInterface
public interface Introspector {
  /** Returns the names of the public operations of a type. */
  Set<String> operationNames(Class<?> type);

  /**
   * Returns an introspector that looks up each type in a fixed manifest. A
   * type that is not in the manifest has no operations.
   */
  static Introspector manifest(
      Map<Class<?>, ? extends Set<String>> manifest) {
    final ImmutableMap.Builder<Class<?>, ImmutableSet<String>> builder =
        ImmutableMap.builder();
    manifest.forEach((type, names) ->
        builder.put(type, ImmutableSet.copyOf(names)));
    final ImmutableMap<Class<?>, ImmutableSet<String>> map = builder.build();
    return type -> {
      final ImmutableSet<String> names = map.get(type);
      return names == null ? ImmutableSet.of() : names;
    };
  }

  /**
   * Returns an introspector that lists the public instance methods of a
   * type, including inherited methods.
   */
  static Introspector reflective() {
    return type -> {
      final ImmutableSet.Builder<String> names = ImmutableSet.builder();
      for (Method method : type.getMethods()) {
        if (!Modifier.isStatic(method.getModifiers())) {
          names.add(method.getName());
        }
      }
      return names.build();
    };
  }
}

// End Introspector.java
