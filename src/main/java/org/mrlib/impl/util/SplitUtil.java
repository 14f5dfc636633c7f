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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Random;

/**
 * Convenience methods for cutting a list of records into shards or batches.
 */
public class SplitUtil {

  private SplitUtil() {}

  /**
   * Splits {@code input} into at most {@code numSplits} contiguous, non-empty parts whose sizes
   * differ by at most one. Earlier parts get the extra items.
   */
  public static <X> List<List<X>> split(List<X> input, int numSplits) {
    Preconditions.checkArgument(numSplits > 0, "numSplits must be positive: %s", numSplits);
    int minItemsPerShard = input.size() / numSplits;
    int remainder = input.size() % numSplits;
    ImmutableList.Builder<List<X>> result = ImmutableList.builder();
    int posInList = 0;
    for (int shard = 0; shard < numSplits; shard++) {
      int numItems = shard < remainder ? minItemsPerShard + 1 : minItemsPerShard;
      if (numItems > 0) {
        result.add(ImmutableList.copyOf(input.subList(posInList, posInList + numItems)));
        posInList += numItems;
      }
    }
    return result.build();
  }

  /**
   * Cuts {@code input} into contiguous, non-empty batches of random sizes. Every item lands
   * in exactly one batch and the batches keep the input order, so concatenating them gives
   * back {@code input}.
   */
  public static <X> List<List<X>> randomBatches(List<X> input, Random random) {
    ImmutableList.Builder<List<X>> result = ImmutableList.builder();
    int posInList = 0;
    while (posInList < input.size()) {
      int numItems = 1 + random.nextInt(input.size() - posInList);
      result.add(ImmutableList.copyOf(input.subList(posInList, posInList + numItems)));
      posInList += numItems;
    }
    return result.build();
  }
}
