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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Iterables;

import org.mrlib.Counter;
import org.mrlib.Counters;
import org.mrlib.ReducerInput;

import junit.framework.TestCase;

/**
 * Tests for {@link InMemoryCounters} and the counting {@link ReducerInputs}.
 */
public class InMemoryCountersTest extends TestCase {

  public void testCountersAreCreatedOnFirstUse() {
    Counters counters = new InMemoryCounters();
    assertEquals(0, counters.getCounter("b").getValue());
    counters.getCounter("b").increment(3);
    counters.getCounter("a").increment(-1);
    assertEquals(3, counters.getCounter("b").getValue());
    assertEquals("InMemoryCounters(a=-1,b=3)", counters.toString());
  }

  public void testAddAll() {
    Counters total = new InMemoryCounters();
    total.getCounter("a").increment(1);
    Counters shard = new InMemoryCounters();
    shard.getCounter("a").increment(2);
    shard.getCounter("c").increment(5);
    total.addAll(shard);
    total.addAll(shard);
    assertEquals(5, total.getCounter("a").getValue());
    assertEquals(10, total.getCounter("c").getValue());
    assertEquals(2, Iterables.size(total.getCounters()));
  }

  public void testSnapshot() {
    InMemoryCounters counters = new InMemoryCounters();
    counters.getCounter("reduce").increment(4);
    counters.getCounter("map").increment(7);
    counters.getCounter("combine");
    ImmutableSortedMap<String, Long> before = counters.snapshot();
    assertEquals(ImmutableSortedMap.of("combine", 0L, "map", 7L, "reduce", 4L), before);
    counters.getCounter("map").increment(1);
    assertEquals(7L, (long) before.get("map"));
    assertEquals(8L, (long) counters.snapshot().get("map"));
  }

  public void testOverflowIsNotSilent() {
    Counter counter = new InMemoryCounters().getCounter("big");
    counter.increment(Long.MAX_VALUE);
    try {
      counter.increment(1);
      fail("Expected ArithmeticException");
    } catch (ArithmeticException expected) {
      // expected
    }
    assertEquals(Long.MAX_VALUE, counter.getValue());
  }

  public void testAddingToItselfIsRejected() {
    Counters counters = new InMemoryCounters();
    counters.getCounter("a").increment(1);
    try {
      counters.addAll(counters);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException expected) {
      // expected
    }
    assertEquals(1, counters.getCounter("a").getValue());
  }

  public void testCountersCannotBeRemoved() {
    Counters counters = new InMemoryCounters();
    counters.getCounter("a");
    try {
      counters.getCounters().iterator().remove();
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException expected) {
      // expected
    }
    assertEquals(1, Iterables.size(counters.getCounters()));
  }

  public void testCountingReducerInput() {
    Counter consumed = new InMemoryCounters().getCounter("read");
    ReducerInput<String> input =
        ReducerInputs.counting(ImmutableList.of("x", "y", "z"), consumed);
    assertEquals("x", input.next());
    assertEquals("y", input.next());
    assertEquals(2, consumed.getValue());
    try {
      input.remove();
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException expected) {
      // expected
    }
  }
}
