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
package net.hydromatic.laws.explore;

import static com.google.common.collect.Maps.immutableEntry;
import static net.hydromatic.laws.op.BinaryOperation.Associativity.ASSOCIATIVE;
import static net.hydromatic.laws.op.BinaryOperation.Associativity.NONASSOCIATIVE;
import static net.hydromatic.laws.op.BinaryOperation.Symmetry.ASYMMETRIC;
import static net.hydromatic.laws.op.BinaryOperation.Symmetry.SYMMETRIC;

import com.google.common.base.CharMatcher;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.laws.op.BinaryOperation;
import net.hydromatic.laws.op.NamedOperation;
import net.hydromatic.laws.op.PartialOperation;

/**
 * Stock operations for testing collections of {@code int}, {@code String},
 * and map entries.
 */
public final class StandardOperations {
  private StandardOperations() {}

  private static final CharMatcher LETTERS =
      CharMatcher.forPredicate(c -> Character.isLetter(c));

  // int

  public static final VariantRegistry<NamedOperation<Integer, Integer>>
      INT_FNS = new VariantRegistry<>("IntFns");
  public static final NamedOperation<Integer, Integer> PLUS_ONE =
      INT_FNS.register(NamedOperation.of("plusOne", i -> i + 1));
  public static final NamedOperation<Integer, Integer> QUADRATIC =
      INT_FNS.register(NamedOperation.of("quadratic", i -> i * i - 3 * i + 1));

  public static final VariantRegistry<NamedOperation<Integer, Long>>
      INT_TO_LONGS = new VariantRegistry<>("IntToLongs");
  public static final NamedOperation<Integer, Long> BIT33 =
      INT_TO_LONGS.register(NamedOperation.of("bit33", i -> 0x200000000L | i));
  public static final NamedOperation<Integer, Long> CAST =
      INT_TO_LONGS.register(NamedOperation.of("cast", Integer::longValue));

  public static final VariantRegistry<BinaryOperation<Integer>> INT_OP_FNS =
      new VariantRegistry<>("IntOpFns");
  public static final BinaryOperation<Integer> SUMMATION =
      INT_OP_FNS.register(
          BinaryOperation.of("summation", Integer::sum, 0, ASSOCIATIVE,
              SYMMETRIC));
  public static final BinaryOperation<Integer> MULTIPLY =
      INT_OP_FNS.register(
          BinaryOperation.of("multiply", (i, j) -> i * j - 2 * i - 3 * j + 4,
              null, NONASSOCIATIVE, ASYMMETRIC));

  public static final VariantRegistry<NamedOperation<Integer, Boolean>>
      INT_PREDS = new VariantRegistry<>("IntPreds");
  public static final NamedOperation<Integer, Boolean> MOD3 =
      INT_PREDS.register(NamedOperation.of("mod3", i -> i % 3 == 0));
  public static final NamedOperation<Integer, Boolean> INT_ALWAYS =
      INT_PREDS.register(NamedOperation.of("always", i -> true));
  public static final NamedOperation<Integer, Boolean> INT_NEVER =
      INT_PREDS.register(NamedOperation.of("never", i -> false));

  public static final VariantRegistry<PartialOperation<Integer>> INT_PARTS =
      new VariantRegistry<>("IntParts");
  public static final PartialOperation<Integer> HALF_EVEN =
      INT_PARTS.register(
          PartialOperation.of("halfEven", i -> i % 2 == 0, i -> i / 2));
  public static final PartialOperation<Integer> INT_IDENTICAL =
      INT_PARTS.register(PartialOperation.of("identical", i -> true, i -> i));
  public static final PartialOperation<Integer> INT_UNINHABITED =
      INT_PARTS.register(
          PartialOperation.unlift("uninhabited", i -> Optional.empty()));

  /** Explorer for collections of {@code int}; 72 combinations. */
  public static final Explorer<Integer, Long> INT_EXPLORER =
      new Explorer<>(INT_FNS, INT_TO_LONGS, INT_OP_FNS, INT_PREDS, INT_PARTS);

  // String

  public static final VariantRegistry<NamedOperation<String, String>>
      STR_FNS = new VariantRegistry<>("StrFns");
  public static final NamedOperation<String, String> UPPER =
      STR_FNS.register(NamedOperation.of("upper", String::toUpperCase));
  public static final NamedOperation<String, String> FISHY =
      STR_FNS.register(NamedOperation.of("fishy", s -> "<" + s + "-<"));

  public static final VariantRegistry<NamedOperation<String, Optional<String>>>
      STR_TO_OPTS = new VariantRegistry<>("StrToOpts");
  public static final NamedOperation<String, Optional<String>> NATURAL =
      STR_TO_OPTS.register(
          NamedOperation.of("natural",
              s -> Optional.ofNullable(s).filter(t -> !t.isEmpty())));
  public static final NamedOperation<String, Optional<String>> LETTER =
      STR_TO_OPTS.register(
          NamedOperation.of("letter",
              s ->
                  Optional.of(LETTERS.retainFrom(s))
                      .filter(t -> !t.isEmpty())));

  public static final VariantRegistry<BinaryOperation<String>> STR_OP_FNS =
      new VariantRegistry<>("StrOpFns");
  public static final BinaryOperation<String> CONCAT =
      STR_OP_FNS.register(
          BinaryOperation.of("concat", String::concat, "", ASSOCIATIVE,
              ASYMMETRIC));
  public static final BinaryOperation<String> INTERLEAVE =
      STR_OP_FNS.register(
          BinaryOperation.of("interleave", StandardOperations::interleave,
              null, NONASSOCIATIVE, ASYMMETRIC));

  public static final VariantRegistry<NamedOperation<String, Boolean>>
      STR_PREDS = new VariantRegistry<>("StrPreds");
  public static final NamedOperation<String, Boolean> INCREASING =
      STR_PREDS.register(
          NamedOperation.of("increasing",
              s -> s.length() < 2 || s.charAt(0) <= s.charAt(s.length() - 1)));
  public static final NamedOperation<String, Boolean> STR_ALWAYS =
      STR_PREDS.register(NamedOperation.of("always", s -> true));
  public static final NamedOperation<String, Boolean> STR_NEVER =
      STR_PREDS.register(NamedOperation.of("never", s -> false));

  public static final VariantRegistry<PartialOperation<String>> STR_PARTS =
      new VariantRegistry<>("StrParts");
  public static final PartialOperation<String> ODD_MIRROR =
      STR_PARTS.register(
          PartialOperation.of("oddMirror", s -> s.length() % 2 == 1,
              s -> new StringBuilder(s).reverse().toString()));
  public static final PartialOperation<String> STR_IDENTICAL =
      STR_PARTS.register(PartialOperation.of("identical", s -> true, s -> s));
  public static final PartialOperation<String> STR_UNINHABITED =
      STR_PARTS.register(
          PartialOperation.unlift("uninhabited", s -> Optional.empty()));

  /** Explorer for collections of {@code String}; 72 combinations. */
  public static final Explorer<String, Optional<String>> STR_EXPLORER =
      new Explorer<>(STR_FNS, STR_TO_OPTS, STR_OP_FNS, STR_PREDS, STR_PARTS);

  // Map entries. Each registry has a single variant. The operations must not
  // make distinct keys collide; laws over maps assume that they don't.

  /** Explorer for maps with {@code long} keys and {@code String} values. */
  public static final Explorer<Map.Entry<Long, String>, Map.Entry<String, Long>>
      LONG_STR_EXPLORER = longStrExplorer();

  /** Explorer for maps with {@code String} keys and {@code long} values. */
  public static final Explorer<Map.Entry<String, Long>, Map.Entry<Long, String>>
      STR_LONG_EXPLORER = strLongExplorer();

  /**
   * Pairs the characters of two strings, stopping at the end of the shorter.
   * For example, {@code interleave("abc", "xy")} returns "axby".
   */
  static String interleave(String s, String t) {
    final int n = Math.min(s.length(), t.length());
    final StringBuilder buf = new StringBuilder(n * 2);
    for (int i = 0; i < n; i++) {
      buf.append(s.charAt(i)).append(t.charAt(i));
    }
    return buf.toString();
  }

  private static Explorer<Map.Entry<Long, String>, Map.Entry<String, Long>>
      longStrExplorer() {
    final VariantRegistry<NamedOperation<Map.Entry<Long, String>,
            Map.Entry<Long, String>>> fns =
        new VariantRegistry<>("LongStrFns");
    fns.register(
        NamedOperation.of("inc1",
            kv -> immutableEntry(kv.getKey() + 1, kv.getValue())));
    final VariantRegistry<NamedOperation<Map.Entry<Long, String>,
            Map.Entry<String, Long>>> toBs =
        new VariantRegistry<>("LongStrToStrLongs");
    toBs.register(
        NamedOperation.of("swap",
            kv -> immutableEntry(kv.getValue(), kv.getKey())));
    final VariantRegistry<BinaryOperation<Map.Entry<Long, String>>> opFns =
        new VariantRegistry<>("LongStrOpFns");
    opFns.register(
        BinaryOperation.of("sums",
            (kv, cu) ->
                immutableEntry(kv.getKey() + cu.getKey(),
                    kv.getValue() + cu.getValue()),
            null, NONASSOCIATIVE, ASYMMETRIC));
    final VariantRegistry<NamedOperation<Map.Entry<Long, String>, Boolean>>
        preds = new VariantRegistry<>("LongStrPreds");
    preds.register(
        NamedOperation.of("high",
            kv -> kv.getKey() > kv.getValue().length()));
    final VariantRegistry<PartialOperation<Map.Entry<Long, String>>> parts =
        new VariantRegistry<>("LongStrParts");
    parts.register(
        PartialOperation.of("akin",
            kv -> ((kv.getKey() ^ kv.getValue().length()) & 1) == 0,
            kv -> immutableEntry(kv.getKey() - 2, kv.getValue())));
    return new Explorer<>(fns, toBs, opFns, preds, parts);
  }

  private static Explorer<Map.Entry<String, Long>, Map.Entry<Long, String>>
      strLongExplorer() {
    final VariantRegistry<NamedOperation<Map.Entry<String, Long>,
            Map.Entry<String, Long>>> fns =
        new VariantRegistry<>("StrLongFns");
    fns.register(
        NamedOperation.of("dots",
            kv -> immutableEntry(kv.getKey() + "..", kv.getValue())));
    final VariantRegistry<NamedOperation<Map.Entry<String, Long>,
            Map.Entry<Long, String>>> toBs =
        new VariantRegistry<>("StrLongToLongStrs");
    toBs.register(
        NamedOperation.of("swap",
            kv -> immutableEntry(kv.getValue(), kv.getKey())));
    final VariantRegistry<BinaryOperation<Map.Entry<String, Long>>> opFns =
        new VariantRegistry<>("StrLongOpFns");
    opFns.register(
        BinaryOperation.of("sums",
            (kv, cu) ->
                immutableEntry(kv.getKey() + cu.getKey(),
                    kv.getValue() + cu.getValue()),
            null, NONASSOCIATIVE, ASYMMETRIC));
    final VariantRegistry<NamedOperation<Map.Entry<String, Long>, Boolean>>
        preds = new VariantRegistry<>("StrLongPreds");
    preds.register(
        NamedOperation.of("high",
            kv -> kv.getKey().length() < kv.getValue()));
    final VariantRegistry<PartialOperation<Map.Entry<String, Long>>> parts =
        new VariantRegistry<>("StrLongParts");
    parts.register(
        PartialOperation.of("akin",
            kv -> ((kv.getKey().length() ^ kv.getValue()) & 1) == 0,
            kv -> immutableEntry(kv.getKey() + "!", kv.getValue())));
    return new Explorer<>(fns, toBs, opFns, preds, parts);
  }
}

// End StandardOperations.java
