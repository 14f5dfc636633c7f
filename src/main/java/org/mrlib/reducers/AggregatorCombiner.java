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
 * Runs {@link Aggregator#combine} over the raw values of a key on the node that produced
 * them and emits the partial state for the next stage.
 *
 * @param <K> type of the key
 * @param <V> type of the raw values
 * @param <P> type of the partial state
 */
public class AggregatorCombiner<K, V, P> extends Reducer<K, V, KeyValue<K, P>> {

  private static final long serialVersionUID = 6393880367195728021L;

  private static final Logger log = Logger.getLogger(AggregatorCombiner.class.getName());

  private final Aggregator<K, V, P, ?> aggregator;

  public AggregatorCombiner(Aggregator<K, V, P, ?> aggregator) {
    this.aggregator = checkNotNull(aggregator, "Null aggregator");
  }

  @Override
  public void reduce(K key, ReducerInput<V> values) {
    P state = aggregator.combine(key, values);
    log.fine(aggregator + " combined key " + key + " into " + state);
    getContext().incrementCounter(CounterNames.AGGREGATOR_COMBINES);
    emit(KeyValue.of(key, state));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + aggregator + ")";
  }
}
