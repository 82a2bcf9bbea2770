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

/**
 * Enumeration of the operations that laws are parameterized by.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.laws.explore.VariantRegistry} - Ordered,
 *       append-only collection of the variants that can play one role.
 *   <li>{@link net.hydromatic.laws.explore.Explorer} - Combines five
 *       registries, one per {@link net.hydromatic.laws.explore.Role}, into a
 *       space that is enumerated by index vectors.
 *   <li>{@link net.hydromatic.laws.explore.OperationBundle} - One point in
 *       that space, instrumented to record which roles a law used.
 *   <li>{@link net.hydromatic.laws.explore.StandardOperations} - Stock
 *       registries and explorers.
 * </ul>
 *
 * <p>A suite builder typically iterates over {@link
 * net.hydromatic.laws.explore.Exploratory#indexVectors()}, calls {@link
 * net.hydromatic.laws.explore.Explorer#lookup(int[])} for each vector,
 * evaluates a law against the bundle, then checks {@link
 * net.hydromatic.laws.explore.OperationBundle#touched()}.
 */
package net.hydromatic.laws.explore;

// End package-info.java
