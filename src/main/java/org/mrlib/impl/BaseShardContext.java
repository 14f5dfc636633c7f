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

import org.mrlib.Counters;
import org.mrlib.WorkerContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shard context of the in-process pipeline. Emitted values are buffered in memory and
 * counted under {@code outputCounterName}.
 *
 * @param <O> type of output values produced by the worker
 */
abstract class BaseShardContext<O> implements WorkerContext<O> {

  private final String stageName;
  private final int shardNumber;
  private final int shardCount;
  private final String outputCounterName;
  private final Counters counters = new InMemoryCounters();
  private final List<O> output = new ArrayList<>();

  BaseShardContext(String stageName, int shardNumber, int shardCount, String outputCounterName) {
    checkArgument(shardNumber >= 0 && shardNumber < shardCount, "Shard %s of %s", shardNumber,
        shardCount);
    this.stageName = checkNotNull(stageName, "Null stageName");
    this.shardNumber = shardNumber;
    this.shardCount = shardCount;
    this.outputCounterName = checkNotNull(outputCounterName, "Null outputCounterName");
  }

  @Override
  public void emit(O value) {
    output.add(value);
    incrementCounter(outputCounterName);
  }

  /**
   * Returns everything emitted so far, in emit order.
   */
  List<O> getOutput() {
    return Collections.unmodifiableList(new ArrayList<>(output));
  }

  @Override
  public String getStageName() {
    return stageName;
  }

  @Override
  public int getShardNumber() {
    return shardNumber;
  }

  @Override
  public int getShardCount() {
    return shardCount;
  }

  @Override
  public Counters getCounters() {
    return counters;
  }

  @Override
  public void incrementCounter(String name, long delta) {
    counters.getCounter(name).increment(delta);
  }

  @Override
  public void incrementCounter(String name) {
    incrementCounter(name, 1);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + stageName + ", " + shardNumber + "/" + shardCount
        + ")";
  }
}
