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

import com.google.common.collect.ImmutableList;

import java.io.Serializable;
import java.util.Iterator;

/**
 * Partial state of a {@link SelectionAggregator}: the best elements seen so far, best first,
 * never more than the aggregator's limit. The order of the elements is part of the state and
 * must survive any transfer between nodes.
 *
 * @param <V> type of the elements
 */
public final class RankedList<V> implements Iterable<V>, Serializable {

  private static final long serialVersionUID = -4580305718632717391L;

  private static final RankedList<Object> EMPTY = new RankedList<>(ImmutableList.of());

  private final ImmutableList<V> elements;

  private RankedList(ImmutableList<V> elements) {
    this.elements = elements;
  }

  /**
   * Wraps elements that are already in rank order.
   */
  public static <V> RankedList<V> of(Iterable<? extends V> elements) {
    return new RankedList<>(ImmutableList.<V>copyOf(checkNotNull(elements, "Null elements")));
  }

  @SafeVarargs
  public static <V> RankedList<V> of(V... elements) {
    return new RankedList<>(ImmutableList.copyOf(elements));
  }

  @SuppressWarnings("unchecked")
  public static <V> RankedList<V> empty() {
    return (RankedList<V>) EMPTY;
  }

  public ImmutableList<V> getElements() {
    return elements;
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  @Override
  public Iterator<V> iterator() {
    return elements.iterator();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || (o instanceof RankedList && elements.equals(((RankedList<?>) o).elements));
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    return "RankedList" + elements;
  }
}
