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

package org.mrlib;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import java.util.List;

/**
 * Output and counters of a finished in-process pipeline.
 *
 * @param <O> type of output values
 */
public final class PipelineResult<O> {

  private final List<List<O>> outputs;
  private final Counters counters;

  public PipelineResult(List<List<O>> outputs, Counters counters) {
    this.outputs = checkNotNull(outputs, "Null outputs");
    this.counters = checkNotNull(counters, "Null counters");
  }

  /**
   * Returns the output of each reduce shard.
   */
  public List<List<O>> getOutputs() {
    return outputs;
  }

  /**
   * Returns the output of all reduce shards, shard by shard.
   */
  public List<O> getOutput() {
    return ImmutableList.copyOf(Iterables.concat(outputs));
  }

  public Counters getCounters() {
    return counters;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + outputs + ", " + counters + ")";
  }
}
