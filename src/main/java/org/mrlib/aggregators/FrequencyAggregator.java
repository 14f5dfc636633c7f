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

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;

import org.mrlib.Aggregator;

import java.util.Iterator;

/**
 * Counts how often each distinct value occurs for a key.
 *
 * <p>Example Input: key, (a, b, a, c, a)<br>
 * Example Output: key, {a x 3, b, c}
 *
 * <p>The partial state is the multiset of values; merging adds the counts. An empty group
 * yields an empty multiset.
 *
 * @param <K> type of the key
 * @param <V> type of the counted values
 */
public class FrequencyAggregator<K, V>
    extends Aggregator<K, V, ImmutableMultiset<V>, ImmutableMultiset<V>> {

  private static final long serialVersionUID = 4152794683016532907L;

  @Override
  public ImmutableMultiset<V> combine(K key, Iterator<? extends V> values) {
    ImmutableMultiset.Builder<V> counts = ImmutableMultiset.builder();
    while (values.hasNext()) {
      counts.add(values.next());
    }
    return counts.build();
  }

  @Override
  public ImmutableMultiset<V> merge(K key, Iterator<? extends ImmutableMultiset<V>> states) {
    ImmutableMultiset.Builder<V> counts = ImmutableMultiset.builder();
    while (states.hasNext()) {
      for (Multiset.Entry<V> entry : states.next().entrySet()) {
        counts.addCopies(entry.getElement(), entry.getCount());
      }
    }
    return counts.build();
  }

  @Override
  public ImmutableMultiset<V> finish(K key, ImmutableMultiset<V> state) {
    return state;
  }
}
