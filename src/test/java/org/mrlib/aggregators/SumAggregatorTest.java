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

import com.google.common.collect.ImmutableList;

import org.mrlib.AggregationException;

import junit.framework.TestCase;

import java.util.Arrays;

/**
 * Tests for {@link SumAggregator}.
 */
public class SumAggregatorTest extends TestCase {

  private final SumAggregator<String, Long> sum = Aggregators.longSum();

  public void testCombineAndFinish() {
    assertEquals(26L, (long) sum.finish("k", sum.combineValues("k", 1L, 3L, 7L, 15L)));
  }

  public void testSplitBatchesMergeToSameSum() {
    Long left = sum.combineValues("k", 1L, 3L);
    Long right = sum.combineValues("k", 7L, 15L);
    assertEquals(26L, (long) sum.finish("k", sum.mergeStates("k", left, right)));
  }

  public void testUsableAsItsOwnCombiner() {
    // A reducer fed a mix of combined partial sums and raw values gets the same answer.
    Long combined = sum.combineValues("k", 1L, 3L);
    assertEquals(26L, (long) sum.merge("k", ImmutableList.of(combined, 7L, 15L)));
  }

  public void testEmptyGroupIsZero() {
    assertEquals(0L, (long) sum.combine("k", ImmutableList.<Long>of()));
    assertEquals(0L, (long) sum.merge("k", ImmutableList.<Long>of()));
    assertEquals(0.0, Aggregators.<String>doubleSum().combine("k", ImmutableList.<Double>of()),
        0.0);
  }

  public void testDoubles() {
    SumAggregator<String, Double> doubles = Aggregators.doubleSum();
    assertEquals(4.0, doubles.aggregate("k", ImmutableList.of(1.5, 2.5)), 0.0);
  }

  public void testMissingNumber() {
    try {
      sum.combine("k", Arrays.asList(1L, null, 3L));
      fail("Expected AggregationException");
    } catch (AggregationException e) {
      assertEquals("k", e.getKey());
    }
  }

  public void testIntegerOverflowIsNotSilent() {
    SumAggregator<String, Integer> ints = Aggregators.intSum();
    try {
      ints.combineValues("k", Integer.MAX_VALUE, 1);
      fail("Expected ArithmeticException");
    } catch (ArithmeticException expected) {
      // expected
    }
  }
}
