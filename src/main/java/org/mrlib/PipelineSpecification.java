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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

import org.mrlib.impl.util.SplitUtil;

import java.util.List;

/**
 * Specification of a map, combine, reduce pipeline run by
 * {@link org.mrlib.impl.InProcessPipeline}.
 *
 * <p>The combiner runs once per key and map shard and turns the mapper's values into the
 * values the reducer receives. Use {@link org.mrlib.reducers.IdentityReducer} as combiner
 * to skip pre-aggregation.
 *
 * @param <I> type of input values
 * @param <K> type of intermediate keys
 * @param <V> type of values emitted by the mapper
 * @param <C> type of values emitted by the combiner
 * @param <O> type of output values
 */
public final class PipelineSpecification<I, K, V, C, O> {

  /**
   * Builder for {@link PipelineSpecification}.
   */
  public static class Builder<I, K, V, C, O> {

    private String jobName = "pipeline";
    private List<List<I>> input;
    private Mapper<I, K, V> mapper;
    private Reducer<K, V, KeyValue<K, C>> combiner;
    private Reducer<K, C, O> reducer;
    private Marshaller<K> keyMarshaller;
    private Marshaller<C> intermediateValueMarshaller;
    private int reduceShardCount = 1;

    public Builder<I, K, V, C, O> setJobName(String jobName) {
      this.jobName = checkNotNull(jobName, "Null jobName");
      return this;
    }

    /**
     * Sets the input, one list per map shard.
     */
    public Builder<I, K, V, C, O> setInput(List<? extends List<I>> input) {
      checkNotNull(input, "Null input");
      ImmutableList.Builder<List<I>> shards = ImmutableList.builder();
      for (List<I> shard : input) {
        shards.add(ImmutableList.copyOf(shard));
      }
      this.input = shards.build();
      return this;
    }

    /**
     * Sets the input, cut into {@code mapShardCount} contiguous shards of about equal size.
     */
    public Builder<I, K, V, C, O> setInput(List<I> records, int mapShardCount) {
      return setInput(SplitUtil.split(checkNotNull(records, "Null records"), mapShardCount));
    }

    public Builder<I, K, V, C, O> setMapper(Mapper<I, K, V> mapper) {
      this.mapper = checkNotNull(mapper, "Null mapper");
      return this;
    }

    public Builder<I, K, V, C, O> setCombiner(Reducer<K, V, KeyValue<K, C>> combiner) {
      this.combiner = checkNotNull(combiner, "Null combiner");
      return this;
    }

    public Builder<I, K, V, C, O> setReducer(Reducer<K, C, O> reducer) {
      this.reducer = checkNotNull(reducer, "Null reducer");
      return this;
    }

    /**
     * Sets the marshaller that defines key identity and order during the shuffle.
     */
    public Builder<I, K, V, C, O> setKeyMarshaller(Marshaller<K> keyMarshaller) {
      this.keyMarshaller = checkNotNull(keyMarshaller, "Null keyMarshaller");
      return this;
    }

    /**
     * Sets a marshaller every combiner output value is written with and read back from
     * before it reaches the reducer, as it would be when crossing the network. Optional.
     */
    public Builder<I, K, V, C, O> setIntermediateValueMarshaller(Marshaller<C> marshaller) {
      this.intermediateValueMarshaller = marshaller;
      return this;
    }

    public Builder<I, K, V, C, O> setReduceShardCount(int reduceShardCount) {
      checkArgument(reduceShardCount > 0, "reduceShardCount must be positive: %s",
          reduceShardCount);
      this.reduceShardCount = reduceShardCount;
      return this;
    }

    public PipelineSpecification<I, K, V, C, O> build() {
      return new PipelineSpecification<>(this);
    }
  }

  private final String jobName;
  private final List<List<I>> input;
  private final Mapper<I, K, V> mapper;
  private final Reducer<K, V, KeyValue<K, C>> combiner;
  private final Reducer<K, C, O> reducer;
  private final Marshaller<K> keyMarshaller;
  private final Marshaller<C> intermediateValueMarshaller;
  private final int reduceShardCount;

  private PipelineSpecification(Builder<I, K, V, C, O> builder) {
    jobName = builder.jobName;
    input = checkNotNull(builder.input, "Input not set");
    mapper = checkNotNull(builder.mapper, "Mapper not set");
    combiner = checkNotNull(builder.combiner, "Combiner not set");
    reducer = checkNotNull(builder.reducer, "Reducer not set");
    keyMarshaller = checkNotNull(builder.keyMarshaller, "Key marshaller not set");
    intermediateValueMarshaller = builder.intermediateValueMarshaller;
    reduceShardCount = builder.reduceShardCount;
  }

  public String getJobName() {
    return jobName;
  }

  public List<List<I>> getInput() {
    return input;
  }

  public Mapper<I, K, V> getMapper() {
    return mapper;
  }

  public Reducer<K, V, KeyValue<K, C>> getCombiner() {
    return combiner;
  }

  public Reducer<K, C, O> getReducer() {
    return reducer;
  }

  public Marshaller<K> getKeyMarshaller() {
    return keyMarshaller;
  }

  /**
   * Returns the marshaller for combiner output values, or null if values are handed to the
   * reducer as they are.
   */
  public Marshaller<C> getIntermediateValueMarshaller() {
    return intermediateValueMarshaller;
  }

  public int getReduceShardCount() {
    return reduceShardCount;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + jobName + ", " + input.size() + " map shards, "
        + mapper + ", " + combiner + ", " + reducer + ", " + reduceShardCount
        + " reduce shards)";
  }
}
