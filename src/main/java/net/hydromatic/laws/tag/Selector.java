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

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Dynamic filter that decides, given the concrete parameters of a test,
 * whether to skip it.
 */
@FunctionalInterface
public interface Selector {
  /** Returns a skip outcome if the test should be skipped, else empty. */
  Optional<Skip> check(TestInfo info);

  /**
   * Returns a selector that skips, with a given reason, every test for which
   * {@code predicate} is false.
   */
  static Selector skipUnless(Predicate<TestInfo> predicate, String reason) {
    requireNonNull(predicate, "predicate");
    final Skip skip = Skip.of(reason);
    return info -> predicate.test(info) ? Optional.empty() : Optional.of(skip);
  }

  /** Returns a selector that skips tests whose operation has no identity. */
  static Selector hasIdentity() {
    return skipUnless(TestInfo::hasIdentity,
        "binary operation has no identity element");
  }
}

// End Selector.java
