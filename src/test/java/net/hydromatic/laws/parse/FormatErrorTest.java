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
package net.hydromatic.laws.parse;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link FormatError} and {@link LawFormatException}. */
class FormatErrorTest {
  /** Tests the description of an error. */
  @Test void testToString() {
    final FormatError e =
        FormatError.of("Unclosed method name", "xs.`map", 3, "`map");
    assertThat(e,
        hasToString("Unclosed method name.  At 3 found `map.  In xs.`map"));
    assertThat(e.position, is(3));
    assertThat(e, is(FormatError.of("Unclosed method name", "xs.`map", 3,
        "`map")));
    assertThat(e.equals(FormatError.of("Unclosed method name", "xs.`map", 4,
        "`map")), is(false));
    assertThrows(IllegalArgumentException.class,
        () -> FormatError.of("x", "y", -1, "z"));
  }

  /** Tests converting an error to an exception. */
  @Test void testException() {
    final FormatError e = FormatError.of("Bad", "a b", 2, "b");
    final LawFormatException x =
        assertThrows(LawFormatException.class, () -> {
          throw e.toException();
        });
    assertThat(x.error(), sameInstance(e));
    assertThat(x.getMessage(), is("Bad.  At 2 found b.  In a b"));
    assertThat(x.describeTo(new StringBuilder()).toString(),
        is(x.getMessage()));
  }
}

// End FormatErrorTest.java
