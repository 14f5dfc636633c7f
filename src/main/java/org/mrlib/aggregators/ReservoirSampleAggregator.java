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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import org.mrlib.Aggregator;
import org.mrlib.CorruptDataException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Draws a uniform random sample of at most {@code capacity} values per key, without
 * replacement.
 *
 * <p>{@link #combine} runs reservoir sampling over its batch. {@link #merge} draws from the
 * partial reservoirs with probability proportional to the number of values each one stands
 * for, which keeps the merged sample uniform over the union. The random source is seeded
 * from the configured seed, the key and the sizes involved, so every call is a pure function
 * of its arguments and a retried batch yields the same sample.
 *
 * <p>An empty group yields an empty sample.
 *
 * @param <K> type of the key
 * @param <V> type of the values
 */
public class ReservoirSampleAggregator<K, V>
    extends Aggregator<K, V, Reservoir<V>, ImmutableList<V>> {

  private static final long serialVersionUID = -2398105553734049817L;

  private static final HashFunction SEED_HASH = Hashing.murmur3_128();

  private final int capacity;
  private final long seed;

  public ReservoirSampleAggregator(int capacity, long seed) {
    checkArgument(capacity > 0, "Capacity must be positive: %s", capacity);
    this.capacity = capacity;
    this.seed = seed;
  }

  public int getCapacity() {
    return capacity;
  }

  @Override
  public Reservoir<V> combine(K key, Iterator<? extends V> values) {
    Random random = randomFor(key, 0);
    List<V> sample = new ArrayList<>(capacity);
    long seen = 0;
    while (values.hasNext()) {
      V value = values.next();
      if (sample.size() < capacity) {
        sample.add(value);
      } else {
        long slot = (long) (random.nextDouble() * (seen + 1));
        if (slot < capacity) {
          sample.set((int) slot, value);
        }
      }
      seen++;
    }
    return new Reservoir<>(seen, sample);
  }

  @Override
  public Reservoir<V> merge(K key, Iterator<? extends Reservoir<V>> states) {
    Reservoir<V> merged = new Reservoir<>(0, ImmutableList.<V>of());
    while (states.hasNext()) {
      Reservoir<V> next = checkShape(key, states.next());
      merged = mergePair(merged, next, randomFor(key, merged.getSeen() + next.getSeen()));
    }
    return merged;
  }

  @Override
  public ImmutableList<V> finish(K key, Reservoir<V> state) {
    return state.getSample();
  }

  private Reservoir<V> mergePair(Reservoir<V> a, Reservoir<V> b, Random random) {
    List<V> fromA = new ArrayList<>(a.getSample());
    List<V> fromB = new ArrayList<>(b.getSample());
    long remainingA = a.getSeen();
    long remainingB = b.getSeen();
    int size = Math.min(capacity, fromA.size() + fromB.size());
    List<V> sample = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      boolean pickA = fromB.isEmpty()
          || (!fromA.isEmpty()
              && random.nextDouble() * (remainingA + remainingB) < remainingA);
      if (pickA) {
        sample.add(removeRandom(fromA, random));
        remainingA--;
      } else {
        sample.add(removeRandom(fromB, random));
        remainingB--;
      }
    }
    return new Reservoir<>(a.getSeen() + b.getSeen(), sample);
  }

  private static <V> V removeRandom(List<V> values, Random random) {
    int index = random.nextInt(values.size());
    V value = values.get(index);
    values.set(index, values.get(values.size() - 1));
    values.remove(values.size() - 1);
    return value;
  }

  private Reservoir<V> checkShape(K key, Reservoir<V> state) {
    if (state.getSample().size() != Math.min(capacity, state.getSeen())) {
      throw new CorruptDataException("Reservoir for key " + key + " holds "
          + state.getSample().size() + " values for " + state.getSeen() + " seen, capacity "
          + capacity);
    }
    return state;
  }

  private Random randomFor(K key, long salt) {
    return new Random(SEED_HASH.newHasher()
        .putLong(seed)
        .putInt(Objects.hashCode(key))
        .putLong(salt)
        .hash()
        .asLong());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(capacity=" + capacity + ", seed=" + seed + ")";
  }
}
