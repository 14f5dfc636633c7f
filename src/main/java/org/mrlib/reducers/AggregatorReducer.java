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

package org.mrlib.reducers;

import static com.google.common.base.Preconditions.checkNotNull;

import org.mrlib.Aggregator;
import org.mrlib.CounterNames;
import org.mrlib.KeyValue;
import org.mrlib.Reducer;
import org.mrlib.ReducerInput;

import java.util.logging.Logger;

/**
 * The final stage of an aggregation: merges every partial state of a key and emits the
 * finished result. Expects the output of an {@link AggregatorCombiner} or
 * {@link AggregatorMerger}; for aggregators whose partial state is the raw value type, such
 * as sums, the raw values can be fed directly.
 *
 * @param <K> type of the key
 * @param <P> type of the partial state
 * @param <R> type of the result
 */
public class AggregatorReducer<K, P, R> extends Reducer<K, P, KeyValue<K, R>> {

  private static final long serialVersionUID = 4517934212300956377L;

  private static final Logger log = Logger.getLogger(AggregatorReducer.class.getName());

  private final Aggregator<K, ?, P, R> aggregator;

  public AggregatorReducer(Aggregator<K, ?, P, R> aggregator) {
    this.aggregator = checkNotNull(aggregator, "Null aggregator");
  }

  @Override
  public void reduce(K key, ReducerInput<P> states) {
    R result = aggregator.finish(key, aggregator.merge(key, states));
    log.fine(aggregator + " finished key " + key + " with " + result);
    getContext().incrementCounter(CounterNames.AGGREGATOR_RESULTS);
    emit(KeyValue.of(key, result));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + aggregator + ")";
  }
}
