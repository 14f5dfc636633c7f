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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mrlib.Aggregator;
import org.mrlib.impl.util.SplitUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Checks that every built-in aggregator gives the same result for a group no matter how its
 * values are cut into batches and how the partial states are merged.
 */
@RunWith(JUnit4.class)
public class MergeTreeTest {

  private static final String KEY = "key";
  private static final int TRIALS = 50;

  private final Random random = new Random(20140317);

  /**
   * Combines random batches of {@code values}, then merges random groups of one to four
   * shuffled states until one is left, and finishes it.
   */
  private <V, P, R> R mergeTree(Aggregator<String, V, P, R> aggregator, List<V> values) {
    List<P> states = new ArrayList<>();
    for (List<V> batch : SplitUtil.randomBatches(values, random)) {
      states.add(aggregator.combine(KEY, batch));
    }
    while (states.size() > 1 || random.nextBoolean()) {
      Collections.shuffle(states, random);
      int fanIn = Math.min(states.size(), 1 + random.nextInt(4));
      List<P> group = new ArrayList<>(states.subList(0, fanIn));
      states.subList(0, fanIn).clear();
      states.add(aggregator.merge(KEY, group));
    }
    return aggregator.finish(KEY, states.get(0));
  }

  private List<Long> randomLongs() {
    int size = 1 + random.nextInt(40);
    List<Long> values = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      values.add((long) random.nextInt(2001) - 1000);
    }
    return values;
  }

  private List<Long> distinctLongs() {
    List<Long> values = new ArrayList<>(ImmutableSet.copyOf(randomLongs()));
    Collections.shuffle(values, random);
    return values;
  }

  @Test
  public void testSums() {
    SumAggregator<String, Long> sum = Aggregators.longSum();
    for (int trial = 0; trial < TRIALS; trial++) {
      List<Long> values = randomLongs();
      assertEquals(sum.aggregate(KEY, values), mergeTree(sum, values));
    }
  }

  @Test
  public void testVectorSums() {
    VectorSumAggregator<String, Long> sum = Aggregators.longVectorSum();
    for (int trial = 0; trial < TRIALS; trial++) {
      List<List<Long>> values = new ArrayList<>();
      for (Long value : randomLongs()) {
        values.add(Aggregators.vector(value, 1L, -value));
      }
      List<Long> expected = sum.aggregate(KEY, values);
      assertEquals(expected, mergeTree(sum, values));
      assertEquals(Long.valueOf(values.size()), expected.get(1));
    }
  }

  @Test
  public void testSelection() {
    SelectionAggregator<String, Long> top = Aggregators.top(5);
    SelectionAggregator<String, Long> bottom = Aggregators.bottom(3);
    for (int trial = 0; trial < TRIALS; trial++) {
      List<Long> values = distinctLongs();
      List<Long> expectedTop =
          Ordering.natural().reverse().sortedCopy(values).subList(0, Math.min(5, values.size()));
      assertEquals(expectedTop, mergeTree(top, values));
      List<Long> expectedBottom =
          Ordering.natural().sortedCopy(values).subList(0, Math.min(3, values.size()));
      assertEquals(expectedBottom, mergeTree(bottom, values));
    }
  }

  @Test
  public void testMean() {
    MeanAggregator<String> mean = Aggregators.mean();
    for (int trial = 0; trial < TRIALS; trial++) {
      List<Number> values = ImmutableList.<Number>copyOf(randomLongs());
      assertEquals(mean.aggregate(KEY, values), mergeTree(mean, values), 1e-9);
    }
  }

  @Test
  public void testMoments() {
    MomentAggregator<String> moments = Aggregators.moments();
    for (int trial = 0; trial < TRIALS; trial++) {
      List<Number> values = ImmutableList.<Number>copyOf(randomLongs());
      Moments expected = moments.aggregate(KEY, values);
      Moments actual = mergeTree(moments, values);
      assertEquals(expected.getCount(), actual.getCount());
      assertEquals(expected.getMean(), actual.getMean(), 1e-9);
      assertEquals(expected.getStandardDeviation(), actual.getStandardDeviation(), 1e-6);
      assertEquals(expected.getMin(), actual.getMin(), 0);
      assertEquals(expected.getMax(), actual.getMax(), 0);
    }
  }

  @Test
  public void testFrequencies() {
    FrequencyAggregator<String, Long> frequencies = Aggregators.frequencies();
    for (int trial = 0; trial < TRIALS; trial++) {
      List<Long> values = new ArrayList<>();
      for (Long value : randomLongs()) {
        values.add(value % 4);
      }
      assertEquals(ImmutableMultiset.copyOf(values), mergeTree(frequencies, values));
    }
  }

  @Test
  public void testSamples() {
    for (int trial = 0; trial < TRIALS; trial++) {
      ReservoirSampleAggregator<String, Long> sample = Aggregators.sample(4, trial);
      List<Long> values = distinctLongs();
      List<Long> result = mergeTree(sample, values);
      assertEquals(Math.min(4, values.size()), result.size());
      assertEquals(result.size(), ImmutableSet.copyOf(result).size());
      assertTrue(values.containsAll(result));
    }
  }
}
