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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mrlib.EmptyGroupException;

import java.util.Collections;

@RunWith(JUnit4.class)
public class MomentAggregatorTest {

  private static final double EPSILON = 1e-9;

  private final MomentAggregator<String> moments = Aggregators.moments();

  @Test
  public void testCombine() {
    MomentState state = moments.combineValues("k", 4, 9, 2, 3, 4, 1, 0, 3);
    assertEquals(new MomentState(8, 26, 136, 0, 9), state);
  }

  @Test
  public void testFinish() {
    Moments result = moments.finish("k", new MomentState(8, 26, 136, 0, 9));
    assertEquals(8, result.getCount());
    assertEquals(3.25, result.getMean(), EPSILON);
    // (136 - 26 * 26 / 8) / 7 = 51.5 / 7
    assertEquals(Math.sqrt(51.5 / 7), result.getStandardDeviation(), EPSILON);
    assertEquals(2.7124, result.getStandardDeviation(), 1e-4);
    assertEquals(0, result.getMin(), 0);
    assertEquals(9, result.getMax(), 0);
  }

  @Test
  public void testSplitAndMerge() {
    MomentState merged = moments.mergeStates("k",
        moments.combineValues("k", 4, 9, 2),
        moments.combineValues("k", 3),
        moments.combineValues("k", 4, 1, 0, 3));
    assertEquals(new MomentState(8, 26, 136, 0, 9), merged);
    assertEquals(moments.aggregate("k", ImmutableList.<Number>of(4, 9, 2, 3, 4, 1, 0, 3)),
        moments.finish("k", merged));
  }

  @Test
  public void testSingleValueHasZeroDeviation() {
    Moments result = moments.aggregate("k", ImmutableList.<Number>of(5));
    assertEquals(1, result.getCount());
    assertEquals(5.0, result.getMean(), 0);
    assertEquals(0.0, result.getStandardDeviation(), 0);
    assertEquals(5.0, result.getMin(), 0);
    assertEquals(5.0, result.getMax(), 0);
  }

  @Test
  public void testConstantValuesHaveNoDeviation() {
    Moments result = moments.aggregate("k",
        ImmutableList.<Number>of(0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1));
    assertEquals(0.0, result.getStandardDeviation(), 1e-6);
    assertEquals(0.1, result.getMin(), 0);
  }

  @Test
  public void testNegativeValues() {
    Moments result = moments.aggregate("k", ImmutableList.<Number>of(-2, -4));
    assertEquals(-3.0, result.getMean(), EPSILON);
    assertEquals(Math.sqrt(2), result.getStandardDeviation(), EPSILON);
    assertEquals(-4.0, result.getMin(), 0);
    assertEquals(-2.0, result.getMax(), 0);
  }

  @Test
  public void testEmptyGroup() {
    try {
      moments.combine("k", Collections.<Number>emptyList());
      fail("Expected EmptyGroupException");
    } catch (EmptyGroupException e) {
      assertEquals("k", e.getKey());
    }
  }

  @Test(expected = EmptyGroupException.class)
  public void testMergeOfNothing() {
    moments.merge("k", Collections.<MomentState>emptyList());
  }
}
