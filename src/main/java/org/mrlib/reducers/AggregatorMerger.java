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
 * An intermediate stage that collapses the partial states of a key with
 * {@link Aggregator#merge} and passes the merged state on. Any number of these can sit
 * between an {@link AggregatorCombiner} and an {@link AggregatorReducer}.
 *
 * @param <K> type of the key
 * @param <P> type of the partial state
 */
public class AggregatorMerger<K, P> extends Reducer<K, P, KeyValue<K, P>> {

  private static final long serialVersionUID = -1788466327043911020L;

  private static final Logger log = Logger.getLogger(AggregatorMerger.class.getName());

  private final Aggregator<K, ?, P, ?> aggregator;

  public AggregatorMerger(Aggregator<K, ?, P, ?> aggregator) {
    this.aggregator = checkNotNull(aggregator, "Null aggregator");
  }

  @Override
  public void reduce(K key, ReducerInput<P> states) {
    P state = aggregator.merge(key, states);
    log.fine(aggregator + " merged key " + key + " into " + state);
    getContext().incrementCounter(CounterNames.AGGREGATOR_MERGES);
    emit(KeyValue.of(key, state));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + aggregator + ")";
  }
}
