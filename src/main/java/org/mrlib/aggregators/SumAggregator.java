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

import static com.google.common.base.Preconditions.checkNotNull;

import org.mrlib.AggregationException;
import org.mrlib.Aggregator;

import java.util.Iterator;

/**
 * Sums the values for a key.
 *
 * <p>Example Input: key, (1, 3, 7, 15)<br>
 * Example Output: key, 26
 *
 * <p>The partial state is the running sum itself, so the same aggregator serves as combiner
 * and reducer, and can be applied any number of times in between. An empty group sums to
 * zero.
 *
 * @param <K> type of the key
 * @param <N> the number type
 */
public class SumAggregator<K, N extends Number> extends Aggregator<K, N, N, N> {

  private static final long serialVersionUID = 2954408219547315032L;

  private final Arithmetic<N> arithmetic;

  public SumAggregator(Arithmetic<N> arithmetic) {
    this.arithmetic = checkNotNull(arithmetic, "Null arithmetic");
  }

  @Override
  public N combine(K key, Iterator<? extends N> values) {
    return sum(key, values);
  }

  @Override
  public N merge(K key, Iterator<? extends N> states) {
    return sum(key, states);
  }

  @Override
  public N finish(K key, N state) {
    return state;
  }

  private N sum(K key, Iterator<? extends N> values) {
    N total = arithmetic.zero();
    while (values.hasNext()) {
      N value = values.next();
      if (value == null) {
        throw new AggregationException(key, "missing number");
      }
      total = arithmetic.add(total, value);
    }
    return total;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + arithmetic + ")";
  }
}
