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

package org.mrlib;

/**
 * Reduce function. Called once for each key, together with the sequence of all values for
 * that key. Can emit output values through the context.
 *
 * <p>The same abstraction is used for combiners: a combiner is a reducer that runs on the
 * node holding the map output and emits key-value pairs for the next stage.
 *
 * <p>This class is really an interface that might be evolving. In order to avoid breaking
 * users when we change the interface, we made it an abstract class.
 *
 * @param <K> type of intermediate keys received
 * @param <V> type of intermediate values received
 * @param <O> type of output values produced
 */
public abstract class Reducer<K, V, O> extends Worker<ReducerContext<O>> {

  private static final long serialVersionUID = -4415870291560215383L;

  /**
   * Processes the values for a given key. {@code values} enumerates all values the previous
   * stage produced for {@code key} on this shard. It will always contain at least one value.
   */
  public abstract void reduce(K key, ReducerInput<V> values);

  /**
   * Syntactic sugar for {@code getContext().emit(value)}
   */
  protected void emit(O value) {
    getContext().emit(value);
  }
}
