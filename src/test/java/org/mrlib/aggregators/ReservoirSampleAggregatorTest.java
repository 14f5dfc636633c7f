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
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Range;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mrlib.CorruptDataException;

import java.util.List;

@RunWith(JUnit4.class)
public class ReservoirSampleAggregatorTest {

  private static List<Integer> range(int from, int to) {
    return ImmutableList.copyOf(ContiguousSet.create(Range.closedOpen(from, to),
        DiscreteDomain.integers()));
  }

  @Test
  public void testSmallGroupIsKeptWhole() {
    ReservoirSampleAggregator<String, Integer> sample = Aggregators.sample(10, 42);
    Reservoir<Integer> state = sample.combine("k", range(0, 4));
    assertEquals(4, state.getSeen());
    assertEquals(range(0, 4), state.getSample());
  }

  @Test
  public void testSampleIsASubsetOfTheInput() {
    ReservoirSampleAggregator<String, Integer> sample = Aggregators.sample(5, 7);
    Reservoir<Integer> merged = sample.mergeStates("k",
        sample.combine("k", range(0, 100)),
        sample.combine("k", range(100, 103)),
        sample.combine("k", range(103, 250)));
    assertEquals(250, merged.getSeen());
    List<Integer> result = sample.finish("k", merged);
    assertEquals(5, result.size());
    assertEquals(5, ImmutableSet.copyOf(result).size());
    for (int value : result) {
      assertTrue(value >= 0 && value < 250);
    }
  }

  @Test
  public void testSameSeedSameSample() {
    ReservoirSampleAggregator<String, Integer> a = Aggregators.sample(3, 99);
    ReservoirSampleAggregator<String, Integer> b = Aggregators.sample(3, 99);
    assertEquals(a.combine("k", range(0, 50)), b.combine("k", range(0, 50)));
    assertEquals(
        a.mergeStates("k", a.combine("k", range(0, 50)), a.combine("k", range(50, 60))),
        b.mergeStates("k", b.combine("k", range(0, 50)), b.combine("k", range(50, 60))));
  }

  @Test
  public void testEmptyGroup() {
    ReservoirSampleAggregator<String, Integer> sample = Aggregators.sample(3, 1);
    Reservoir<Integer> empty = sample.combine("k", ImmutableList.<Integer>of());
    assertEquals(0, empty.getSeen());
    assertTrue(empty.getSample().isEmpty());
    Reservoir<Integer> merged = sample.mergeStates("k", empty, sample.combine("k", range(0, 2)));
    assertEquals(2, merged.getSeen());
    assertEquals(ImmutableSet.of(0, 1), ImmutableSet.copyOf(sample.finish("k", merged)));
  }

  /**
   * Samples 2 of the values 0..9, combined in the uneven batches 0..5 and 6..9, and checks
   * that every value is drawn about equally often.
   */
  @Test
  public void testMergedSampleIsUniform() {
    int runs = 20000;
    int[] hits = new int[10];
    for (int run = 0; run < runs; run++) {
      ReservoirSampleAggregator<String, Integer> sample = Aggregators.sample(2, run);
      Reservoir<Integer> merged = sample.mergeStates("k",
          sample.combine("k", range(0, 6)), sample.combine("k", range(6, 10)));
      for (int value : sample.finish("k", merged)) {
        hits[value]++;
      }
    }
    // Each value is expected in 2/10 of the runs.
    for (int value = 0; value < 10; value++) {
      assertEquals("hits of " + value, 4000, hits[value], 400);
    }
  }

  @Test(expected = CorruptDataException.class)
  public void testUnderfilledReservoirIsRejected() {
    ReservoirSampleAggregator<String, Integer> sample = Aggregators.sample(3, 1);
    sample.mergeStates("k", new Reservoir<Integer>(10, ImmutableList.of(1, 2)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCapacityMustBePositive() {
    Aggregators.sample(0, 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSampleLargerThanSeen() {
    new Reservoir<Integer>(1, ImmutableList.of(1, 2));
  }
}
