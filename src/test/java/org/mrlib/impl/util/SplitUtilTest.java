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

package org.mrlib.impl.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.BlockJUnit4ClassRunner;

import java.util.Collections;
import java.util.List;
import java.util.Random;

@RunWith(BlockJUnit4ClassRunner.class)
public class SplitUtilTest {

  @Test
  public void testSplitEven() {
    List<List<Integer>> list = SplitUtil.split(ImmutableList.of(1, 2, 3, 4, 5, 6), 3);
    assertEquals(3, list.size());
    assertEquals(ImmutableList.of(1, 2), list.get(0));
    assertEquals(ImmutableList.of(3, 4), list.get(1));
    assertEquals(ImmutableList.of(5, 6), list.get(2));
  }

  @Test
  public void testSplitUneven() {
    List<List<Integer>> list = SplitUtil.split(ImmutableList.of(1, 2, 3, 4, 5, 6), 4);
    assertEquals(4, list.size());
    assertEquals(2, list.get(0).size());
    assertEquals(2, list.get(1).size());
    assertEquals(1, list.get(2).size());
    assertEquals(1, list.get(3).size());
  }

  @Test
  public void testSplitSparse() {
    List<List<Object>> list = SplitUtil.split(Collections.singletonList(new Object()), 3);
    assertEquals(1, list.size());
    assertEquals(1, list.get(0).size());
  }

  @Test
  public void testSplitEmpty() {
    List<List<Object>> list = SplitUtil.split(Collections.emptyList(), 3);
    assertEquals(0, list.size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSplitIntoNothing() {
    SplitUtil.split(ImmutableList.of(1), 0);
  }

  @Test
  public void testRandomBatchesKeepEveryItemInOrder() {
    Random random = new Random(0);
    ImmutableList<Integer> input = ImmutableList.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    for (int i = 0; i < 100; i++) {
      List<List<Integer>> batches = SplitUtil.randomBatches(input, random);
      for (List<Integer> batch : batches) {
        assertFalse(batch.isEmpty());
      }
      assertEquals(input, ImmutableList.copyOf(Iterables.concat(batches)));
    }
  }

  @Test
  public void testRandomBatchesOfNothing() {
    assertEquals(0, SplitUtil.randomBatches(ImmutableList.of(), new Random(0)).size());
  }
}
