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

import org.mrlib.KeyValue;
import org.mrlib.Reducer;
import org.mrlib.ReducerInput;

/**
 * A passthrough reducer that re-emits every value under its key, in the order received.
 * Nothing is deduplicated: a value that arrives twice is emitted twice.
 *
 * <p>Use it when a job needs a shuffle and sort boundary but no reduce computation, or in
 * the combiner slot of a pipeline to skip pre-aggregation.
 *
 * @param <K> the type of the key
 * @param <V> the type of the value
 */
public class IdentityReducer<K, V> extends Reducer<K, V, KeyValue<K, V>> {

  private static final long serialVersionUID = 2710482906035166471L;

  @Override
  public void reduce(K key, ReducerInput<V> values) {
    while (values.hasNext()) {
      emit(KeyValue.of(key, values.next()));
    }
  }
}
