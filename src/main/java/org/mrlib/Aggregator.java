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

import com.google.common.collect.ImmutableList;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Iterator;

/**
 * A statistic split into a local pre-aggregation step and a global merge step.
 *
 * <p>Raw values for a key are turned into a partial state by {@link #combine} on whatever
 * node holds them. Partial states travel towards a single node and are collapsed by zero or
 * more calls to {@link #merge}, arranged in a tree of any depth and fan-in. The root of that
 * tree calls {@link #finish} exactly once per key.
 *
 * <p>Implementations must keep these properties:
 * <ul>
 *   <li>{@code combine} is insensitive to the order of its input.</li>
 *   <li>{@code merge} is associative and commutative over the multiset of states, so that
 *       {@code finish(merge(combine(a), combine(b)))} equals {@code finish(combine(a ++ b))}
 *       for every split of the input.</li>
 *   <li>All three operations are pure functions of their arguments. Aggregators hold
 *       configuration only and can be called concurrently for different keys.</li>
 * </ul>
 *
 * <p>Keys are only used to describe failures.
 *
 * <p>This class is really an interface that might be evolving. In order to avoid breaking
 * users when we change the interface, we made it an abstract class.
 *
 * @param <K> type of the key
 * @param <V> type of raw values
 * @param <P> type of partial state
 * @param <R> type of the finished result
 */
public abstract class Aggregator<K, V, P, R> implements Serializable {

  private static final long serialVersionUID = 5209361836547738108L;

  /**
   * Aggregates a batch of raw values sharing {@code key} into a partial state.
   */
  public abstract P combine(K key, Iterator<? extends V> values);

  /**
   * Merges partial states produced by {@link #combine} or {@link #merge} into one.
   */
  public abstract P merge(K key, Iterator<? extends P> states);

  /**
   * Turns the single, fully merged partial state of {@code key} into the result.
   */
  public abstract R finish(K key, P state);

  public final P combine(K key, Iterable<? extends V> values) {
    return combine(key, values.iterator());
  }

  @SafeVarargs
  public final P combineValues(K key, V... values) {
    return combine(key, Arrays.asList(values).iterator());
  }

  public final P merge(K key, Iterable<? extends P> states) {
    return merge(key, states.iterator());
  }

  @SafeVarargs
  public final P mergeStates(K key, P... states) {
    return merge(key, ImmutableList.copyOf(states).iterator());
  }

  /**
   * Combines and finishes in one step, for groups that are never split.
   */
  public final R aggregate(K key, Iterable<? extends V> values) {
    return finish(key, combine(key, values.iterator()));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName();
  }
}
