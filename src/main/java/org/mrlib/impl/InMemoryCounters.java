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

package org.mrlib.impl;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

import org.mrlib.Counter;
import org.mrlib.Counters;

import java.io.Serializable;
import java.util.Collections;
import java.util.SortedMap;

/**
 * Counters of one shard, or of a whole run once every shard's counters have been added in
 * with {@link #addAll}. Counters are listed by name. Overflowing a counter is an
 * {@link ArithmeticException}.
 */
public class InMemoryCounters implements Counters {

  private static final long serialVersionUID = -2187640095913385524L;

  private final SortedMap<String, RunningCount> byName = Maps.newTreeMap();

  @Override
  public Counter getCounter(String name) {
    checkNotNull(name, "Null counter name");
    RunningCount count = byName.get(name);
    if (count == null) {
      count = new RunningCount(name);
      byName.put(name, count);
    }
    return count;
  }

  @Override
  public Iterable<? extends Counter> getCounters() {
    return Collections.unmodifiableCollection(byName.values());
  }

  @Override
  public void addAll(Counters other) {
    checkArgument(other != this, "Counters added to themselves");
    for (Counter counter : other.getCounters()) {
      getCounter(counter.getName()).increment(counter.getValue());
    }
  }

  /**
   * Returns the current value of every counter, by name.
   */
  public ImmutableSortedMap<String, Long> snapshot() {
    ImmutableSortedMap.Builder<String, Long> values = ImmutableSortedMap.naturalOrder();
    for (RunningCount count : byName.values()) {
      values.put(count.name, count.value);
    }
    return values.build();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "("
        + Joiner.on(',').withKeyValueSeparator("=").join(snapshot()) + ")";
  }

  private static class RunningCount implements Counter, Serializable {
    private static final long serialVersionUID = 5120374993651781196L;

    private final String name;
    private long value;

    RunningCount(String name) {
      this.name = name;
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public long getValue() {
      return value;
    }

    @Override
    public void increment(long delta) {
      value = Math.addExact(value, delta);
    }

    @Override
    public String toString() {
      return name + "=" + value;
    }
  }
}
