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
package net.hydromatic.laws.op;

/**
 * Thrown when code asks for the identity element of a binary operation that
 * does not declare one.
 *
 * <p>This is a programming error. Laws that use the identity element must be
 * filtered out, with a selector that checks {@link
 * BinaryOperation#hasIdentity()}, before they are evaluated.
 */
public class MissingIdentityException extends IllegalStateException {
  public final String operationName;

  public MissingIdentityException(String operationName) {
    super("binary operation '" + operationName
        + "' does not declare an identity element");
    this.operationName = operationName;
  }
}

// End MissingIdentityException.java
