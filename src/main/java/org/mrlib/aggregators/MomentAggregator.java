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

import org.mrlib.Aggregator;
import org.mrlib.EmptyGroupException;

import java.util.Iterator;

/**
 * Computes a small statistics package per key: sample size, mean, sample standard
 * deviation, minimum and maximum.
 *
 * <p>Example Input: key, (4, 9, 2, 3, 4, 1, 0, 3)<br>
 * Combined: key, (8, 26, 136, 0, 9)<br>
 * Example Output: key, (n=8, mean=3.25, stddev=2.7124, min=0, max=9)
 *
 * <p>Every value contributes {@code (1, v, v*v, v, v)} to the partial state. Merging adds
 * the first three components and takes the minimum of minimums and maximum of maximums.
 * The standard deviation is {@code sqrt((s2 - s1*s1/n) / (n - 1))} and exactly 0 when
 * {@code n == 1}. This form cancels badly when the mean is large compared with the spread;
 * a variance made negative by rounding is reported as 0. An empty group fails with
 * {@link EmptyGroupException}.
 *
 * @param <K> type of the key
 */
public class MomentAggregator<K> extends Aggregator<K, Number, MomentState, Moments> {

  private static final long serialVersionUID = 7795447260953213604L;

  @Override
  public MomentState combine(K key, Iterator<? extends Number> values) {
    long count = 0;
    double sum = 0;
    double sumOfSquares = 0;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    while (values.hasNext()) {
      double value = values.next().doubleValue();
      count++;
      sum += value;
      sumOfSquares += value * value;
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    if (count == 0) {
      throw new EmptyGroupException(key, "moments of no values");
    }
    return new MomentState(count, sum, sumOfSquares, min, max);
  }

  @Override
  public MomentState merge(K key, Iterator<? extends MomentState> states) {
    long count = 0;
    double sum = 0;
    double sumOfSquares = 0;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    while (states.hasNext()) {
      MomentState state = states.next();
      count += state.getCount();
      sum += state.getSum();
      sumOfSquares += state.getSumOfSquares();
      min = Math.min(min, state.getMin());
      max = Math.max(max, state.getMax());
    }
    if (count == 0) {
      throw new EmptyGroupException(key, "no partial moments to merge");
    }
    return new MomentState(count, sum, sumOfSquares, min, max);
  }

  @Override
  public Moments finish(K key, MomentState state) {
    long n = state.getCount();
    double s1 = state.getSum();
    double mean = s1 / n;
    double standardDeviation = 0;
    if (n > 1) {
      double variance = (state.getSumOfSquares() - s1 * s1 / n) / (n - 1);
      standardDeviation = Math.sqrt(Math.max(0, variance));
    }
    return new Moments(n, mean, standardDeviation, state.getMin(), state.getMax());
  }
}
