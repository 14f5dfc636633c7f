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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

import org.mrlib.AggregationException;
import org.mrlib.Aggregator;
import org.mrlib.ArityMismatchException;
import org.mrlib.EmptyGroupException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Sums each position of the tuples for a key.
 *
 * <p>Example Input: key, ((1, 2), (1, 3), (1, 4))<br>
 * Example Output: key, (3, 9)
 *
 * <p>Partial states are tuples of the same shape as the input, so this aggregator can be its
 * own combiner. All tuples of a key must have the same arity; a mismatch fails the key with
 * {@link ArityMismatchException}. When the arity is known up front (see
 * {@link #withArity}) an empty group sums to a zero tuple, otherwise it is an
 * {@link EmptyGroupException}. A null tuple or component fails the key with
 * {@link AggregationException}.
 *
 * @param <K> type of the key
 * @param <N> the number type
 */
public class VectorSumAggregator<K, N extends Number>
    extends Aggregator<K, List<N>, List<N>, List<N>> {

  private static final long serialVersionUID = -6471873650251090345L;

  private static final int UNKNOWN_ARITY = -1;

  private final Arithmetic<N> arithmetic;
  private final int arity;

  private VectorSumAggregator(Arithmetic<N> arithmetic, int arity) {
    this.arithmetic = checkNotNull(arithmetic, "Null arithmetic");
    this.arity = arity;
  }

  /**
   * Returns an aggregator that learns the arity from the first tuple of each group.
   */
  public static <K, N extends Number> VectorSumAggregator<K, N> create(Arithmetic<N> arithmetic) {
    return new VectorSumAggregator<>(arithmetic, UNKNOWN_ARITY);
  }

  /**
   * Returns an aggregator for tuples of exactly {@code arity} components.
   */
  public static <K, N extends Number> VectorSumAggregator<K, N> withArity(
      Arithmetic<N> arithmetic, int arity) {
    checkArgument(arity >= 0, "Negative arity: %s", arity);
    return new VectorSumAggregator<>(arithmetic, arity);
  }

  @Override
  public List<N> combine(K key, Iterator<? extends List<N>> values) {
    return sum(key, values);
  }

  @Override
  public List<N> merge(K key, Iterator<? extends List<N>> states) {
    return sum(key, states);
  }

  @Override
  public List<N> finish(K key, List<N> state) {
    return state;
  }

  private List<N> sum(K key, Iterator<? extends List<N>> tuples) {
    List<N> totals = null;
    if (arity != UNKNOWN_ARITY) {
      totals = new ArrayList<>(Collections.nCopies(arity, arithmetic.zero()));
    }
    while (tuples.hasNext()) {
      List<N> tuple = checkComponents(key, tuples.next());
      if (totals == null) {
        totals = new ArrayList<>(tuple);
        continue;
      }
      if (tuple.size() != totals.size()) {
        throw new ArityMismatchException(key, totals.size(), tuple.size());
      }
      for (int i = 0; i < tuple.size(); i++) {
        totals.set(i, arithmetic.add(totals.get(i), tuple.get(i)));
      }
    }
    if (totals == null) {
      throw new EmptyGroupException(key, "no tuples to sum and no known arity");
    }
    return ImmutableList.copyOf(totals);
  }

  private List<N> checkComponents(K key, List<N> tuple) {
    if (tuple == null) {
      throw new AggregationException(key, "missing tuple");
    }
    for (int i = 0; i < tuple.size(); i++) {
      if (tuple.get(i) == null) {
        throw new AggregationException(key, "missing component " + i + " in " + tuple);
      }
    }
    return tuple;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + arithmetic
        + (arity == UNKNOWN_ARITY ? "" : ", arity=" + arity) + ")";
  }
}
