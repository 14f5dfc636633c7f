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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Function;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.mrlib.Aggregator;
import org.mrlib.CorruptDataException;
import org.mrlib.InvalidComparisonException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the {@code limit} best values for a key: the largest ones for {@link Order#MAX_FIRST}
 * (top-k), the smallest ones for {@link Order#MIN_FIRST} (bottom-k). Values are ranked by
 * their natural ordering or by a comparison key extracted from each value.
 *
 * <p>For limit 3 and {@code MAX_FIRST}:<br>
 * Example Input: key, ((10, 3, 5), (1, 11, 2), (4)) as three combined batches<br>
 * Example Output: key, (11, 10, 5)
 *
 * <p>{@link #combine} ranks raw values. {@link #merge} treats every partial state as an
 * already ranked list and does a k-way merge of those lists, so the result is the same no
 * matter how often partial states are merged again. Ties keep input order: among values with
 * equal comparison keys, the one seen first (earlier in the batch, or in an earlier state)
 * ranks first. Fewer than {@code limit} values are returned as they are, never padded. Both
 * steps hold at most {@code limit} candidates per input, however long the input is.
 *
 * <p>Null values, null comparison keys and keys that cannot be compared with each other fail
 * the key with {@link InvalidComparisonException}. The comparison key function must be
 * serializable for the aggregator to be shipped to other nodes.
 *
 * @param <K> type of the key
 * @param <V> type of the values
 */
public class SelectionAggregator<K, V>
    extends Aggregator<K, V, RankedList<V>, ImmutableList<V>> {

  private static final long serialVersionUID = -8850549779124106233L;

  /**
   * Which end of the ordering is kept.
   */
  public enum Order {
    /** Largest first; top-k. */
    MAX_FIRST,
    /** Smallest first; bottom-k. */
    MIN_FIRST
  }

  /**
   * Builder for {@link SelectionAggregator}.
   *
   * @param <K> type of the key
   * @param <V> type of the values
   */
  public static class Builder<K, V> {

    private int limit = 1;
    private Order order = Order.MAX_FIRST;
    private Function<? super V, ? extends Comparable<?>> comparisonKey;

    /**
     * Sets the maximum number of values kept. Defaults to 1.
     */
    public Builder<K, V> setLimit(int limit) {
      checkArgument(limit > 0, "Limit must be positive: %s", limit);
      this.limit = limit;
      return this;
    }

    /**
     * Sets which end of the ordering is kept. Defaults to {@link Order#MAX_FIRST}.
     */
    public Builder<K, V> setOrder(Order order) {
      this.order = checkNotNull(order, "Null order");
      return this;
    }

    /**
     * Sets the function extracting the value each element is ranked by, e.g. a field of a
     * record or a lower-cased string. {@code null} ranks values by their natural ordering.
     */
    public Builder<K, V> setComparisonKey(Function<? super V, ? extends Comparable<?>> key) {
      this.comparisonKey = key;
      return this;
    }

    public SelectionAggregator<K, V> build() {
      return new SelectionAggregator<>(this);
    }
  }

  private final int limit;
  private final Order order;
  private final Function<? super V, ? extends Comparable<?>> comparisonKey;

  private SelectionAggregator(Builder<K, V> builder) {
    this.limit = builder.limit;
    this.order = builder.order;
    this.comparisonKey = builder.comparisonKey;
  }

  /**
   * Returns an aggregator keeping the {@code limit} largest values.
   */
  public static <K, V extends Comparable<? super V>> SelectionAggregator<K, V> top(int limit) {
    return new Builder<K, V>().setLimit(limit).setOrder(Order.MAX_FIRST).build();
  }

  /**
   * Returns an aggregator keeping the {@code limit} smallest values.
   */
  public static <K, V extends Comparable<? super V>> SelectionAggregator<K, V> bottom(
      int limit) {
    return new Builder<K, V>().setLimit(limit).setOrder(Order.MIN_FIRST).build();
  }

  public int getLimit() {
    return limit;
  }

  public Order getOrder() {
    return order;
  }

  @Override
  public RankedList<V> combine(K key, Iterator<? extends V> values) {
    Comparator<Entry<V>> comparator = entryComparator(key);
    // Worst candidate at the head, so it is the one evicted.
    PriorityQueue<Entry<V>> candidates =
        new PriorityQueue<>(limit + 1, Collections.reverseOrder(comparator));
    long position = 0;
    while (values.hasNext()) {
      V value = values.next();
      Entry<V> entry = new Entry<>(value, rankingKey(key, value), position++);
      if (candidates.size() < limit) {
        candidates.add(entry);
      } else if (comparator.compare(entry, candidates.peek()) < 0) {
        candidates.poll();
        candidates.add(entry);
      }
    }
    List<V> worstFirst = new ArrayList<>(candidates.size());
    while (!candidates.isEmpty()) {
      worstFirst.add(candidates.poll().value);
    }
    return RankedList.of(Lists.reverse(worstFirst));
  }

  @Override
  public RankedList<V> merge(K key, Iterator<? extends RankedList<V>> states) {
    Comparator<Entry<V>> comparator = entryComparator(key);
    PriorityQueue<Entry<V>> heads = new PriorityQueue<>(11, comparator);
    List<Iterator<V>> cursors = new ArrayList<>();
    while (states.hasNext()) {
      Iterator<V> cursor = states.next().iterator();
      cursors.add(cursor);
      if (cursor.hasNext()) {
        V value = cursor.next();
        heads.add(new Entry<>(value, rankingKey(key, value), cursors.size() - 1));
      }
    }
    ImmutableList.Builder<V> best = ImmutableList.builder();
    int taken = 0;
    while (taken < limit && !heads.isEmpty()) {
      Entry<V> head = heads.poll();
      best.add(head.value);
      taken++;
      Iterator<V> cursor = cursors.get((int) head.source);
      if (cursor.hasNext()) {
        V value = cursor.next();
        Entry<V> next = new Entry<>(value, rankingKey(key, value), head.source);
        if (compareKeys(key, next.rankingKey, head.rankingKey) < 0) {
          throw new CorruptDataException("Partial state #" + head.source + " for key " + key
              + " is not in rank order: " + next.value + " follows " + head.value);
        }
        heads.add(next);
      }
    }
    return RankedList.of(best.build());
  }

  @Override
  public ImmutableList<V> finish(K key, RankedList<V> state) {
    return state.getElements();
  }

  private Comparable<?> rankingKey(K key, V value) {
    if (value == null) {
      throw new InvalidComparisonException(key, "missing value");
    }
    Object result = comparisonKey == null ? value : comparisonKey.apply(value);
    if (result == null) {
      throw new InvalidComparisonException(key, "missing comparison key for " + value);
    }
    if (!(result instanceof Comparable)) {
      throw new InvalidComparisonException(key,
          result.getClass().getName() + " is not comparable: " + result);
    }
    return (Comparable<?>) result;
  }

  /**
   * Returns a negative number if {@code a} ranks before {@code b}.
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  private int compareKeys(K key, Comparable a, Comparable b) {
    try {
      return order == Order.MAX_FIRST ? b.compareTo(a) : a.compareTo(b);
    } catch (ClassCastException e) {
      throw new InvalidComparisonException(key, "cannot compare " + a + " with " + b, e);
    }
  }

  private Comparator<Entry<V>> entryComparator(final K key) {
    return new Comparator<Entry<V>>() {
      @Override
      public int compare(Entry<V> a, Entry<V> b) {
        int result = compareKeys(key, a.rankingKey, b.rankingKey);
        return result != 0 ? result : Long.compare(a.source, b.source);
      }
    };
  }

  /**
   * A value with its ranking key. {@code source} is the input position in combine and the
   * index of the partial state in merge; it breaks ties.
   */
  private static class Entry<V> {
    final V value;
    final Comparable<?> rankingKey;
    final long source;

    Entry(V value, Comparable<?> rankingKey, long source) {
      this.value = value;
      this.rankingKey = rankingKey;
      this.source = source;
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + order + ", limit=" + limit
        + (comparisonKey == null ? "" : ", key=" + comparisonKey) + ")";
  }
}
