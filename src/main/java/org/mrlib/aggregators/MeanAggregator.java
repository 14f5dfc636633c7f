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
 * Computes the arithmetic mean for each key.
 *
 * <p>Example Input: key, (1.2, 2.3, 4.8, 4.6, 1.2)<br>
 * Combined: key, (14.1, 5)<br>
 * Example Output: key, 2.82
 *
 * <p>The combine step only sums and counts; it never computes an intermediate mean, which
 * would lose precision or weight the partial means wrongly. An empty group has no mean and
 * fails with {@link EmptyGroupException}.
 *
 * @param <K> type of the key
 */
public class MeanAggregator<K> extends Aggregator<K, Number, MeanState, Double> {

  private static final long serialVersionUID = -1958366370414427025L;

  @Override
  public MeanState combine(K key, Iterator<? extends Number> values) {
    double sum = 0;
    long count = 0;
    while (values.hasNext()) {
      sum += values.next().doubleValue();
      count++;
    }
    if (count == 0) {
      throw new EmptyGroupException(key, "mean of no values");
    }
    return new MeanState(sum, count);
  }

  @Override
  public MeanState merge(K key, Iterator<? extends MeanState> states) {
    double sum = 0;
    long count = 0;
    while (states.hasNext()) {
      MeanState state = states.next();
      sum += state.getSum();
      count += state.getCount();
    }
    if (count == 0) {
      throw new EmptyGroupException(key, "no partial means to merge");
    }
    return new MeanState(sum, count);
  }

  @Override
  public Double finish(K key, MeanState state) {
    return state.getSum() / state.getCount();
  }
}
