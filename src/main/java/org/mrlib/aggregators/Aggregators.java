// Copyright 2014 Google Inc. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.mrlib.aggregators;

import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Factory methods for the built-in aggregators.
 */
public final class Aggregators {

  private Aggregators() {}

  public static <K> SumAggregator<K, Long> longSum() {
    return new SumAggregator<>(Arithmetic.LONGS);
  }

  public static <K> SumAggregator<K, Integer> intSum() {
    return new SumAggregator<>(Arithmetic.INTEGERS);
  }

  public static <K> SumAggregator<K, Double> doubleSum() {
    return new SumAggregator<>(Arithmetic.DOUBLES);
  }

  /**
   * Position-wise sums of {@code long} tuples whose arity is taken from the data.
   */
  public static <K> VectorSumAggregator<K, Long> longVectorSum() {
    return VectorSumAggregator.create(Arithmetic.LONGS);
  }

  /**
   * Position-wise sums of {@code double} tuples with a known arity.
   */
  public static <K> VectorSumAggregator<K, Double> doubleVectorSum(int arity) {
    return VectorSumAggregator.withArity(Arithmetic.DOUBLES, arity);
  }

  public static <K, V extends Comparable<? super V>> SelectionAggregator<K, V> top(int k) {
    return SelectionAggregator.top(k);
  }

  public static <K, V extends Comparable<? super V>> SelectionAggregator<K, V> bottom(int k) {
    return SelectionAggregator.bottom(k);
  }

  /**
   * Keeps the {@code k} values with the largest comparison keys.
   */
  public static <K, V> SelectionAggregator<K, V> top(
      int k, Function<? super V, ? extends Comparable<?>> comparisonKey) {
    return new SelectionAggregator.Builder<K, V>()
        .setLimit(k)
        .setOrder(SelectionAggregator.Order.MAX_FIRST)
        .setComparisonKey(comparisonKey)
        .build();
  }

  /**
   * Keeps the {@code k} values with the smallest comparison keys.
   */
  public static <K, V> SelectionAggregator<K, V> bottom(
      int k, Function<? super V, ? extends Comparable<?>> comparisonKey) {
    return new SelectionAggregator.Builder<K, V>()
        .setLimit(k)
        .setOrder(SelectionAggregator.Order.MIN_FIRST)
        .setComparisonKey(comparisonKey)
        .build();
  }

  public static <K> MeanAggregator<K> mean() {
    return new MeanAggregator<>();
  }

  public static <K> MomentAggregator<K> moments() {
    return new MomentAggregator<>();
  }

  public static <K, V> ReservoirSampleAggregator<K, V> sample(int capacity, long seed) {
    return new ReservoirSampleAggregator<>(capacity, seed);
  }

  public static <K, V> FrequencyAggregator<K, V> frequencies() {
    return new FrequencyAggregator<>();
  }

  /**
   * Builds an input tuple for the vector sums, e.g. {@code vector(1L, 2L)}.
   */
  @SafeVarargs
  public static <N extends Number> List<N> vector(N... components) {
    return ImmutableList.copyOf(components);
  }
}
