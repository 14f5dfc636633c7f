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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.mrlib.CorruptDataException;
import org.mrlib.CounterNames;
import org.mrlib.Counters;
import org.mrlib.KeyValue;
import org.mrlib.Mapper;
import org.mrlib.Marshaller;
import org.mrlib.PipelineException;
import org.mrlib.PipelineResult;
import org.mrlib.PipelineSpecification;
import org.mrlib.Reducer;
import org.mrlib.Worker;
import org.mrlib.impl.util.SerializationUtil;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a pipeline in the current process, shard after shard. Only for small datasets; it is
 * meant for tests and local runs and is easier to debug than a distributed run.
 *
 * <p>Every shard gets its own copy of the mapper, combiner or reducer, made by serializing
 * the worker from the specification, as a distributed runner would.
 *
 * @param <I> type of input values
 * @param <K> type of intermediate keys
 * @param <V> type of values emitted by the mapper
 * @param <C> type of values emitted by the combiner
 * @param <O> type of output values
 */
public class InProcessPipeline<I, K, V, C, O> {

  private static final Logger log = Logger.getLogger(InProcessPipeline.class.getName());

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormat.forPattern("yyyy-MM-dd'T'HH:mm:ss");

  private final String id;
  private final PipelineSpecification<I, K, V, C, O> spec;

  public InProcessPipeline(String id, PipelineSpecification<I, K, V, C, O> spec) {
    this.id = checkNotNull(id, "Null id");
    this.spec = checkNotNull(spec, "Null spec");
  }

  @Override
  public String toString() {
    return "InProcessPipeline(" + id + ")";
  }

  @SuppressWarnings("unchecked")
  private static <W extends Worker<?>> W copyOf(W worker) {
    return (W) SerializationUtil.deserializeFromByteBuffer(
        ByteBuffer.wrap(SerializationUtil.serializeToByteArray(worker)));
  }

  private PipelineException failure(String stage, int shard, RuntimeException e) {
    log.log(Level.SEVERE, this + ": stage " + stage + " failed on shard " + shard, e);
    return new PipelineException(stage, shard, e);
  }

  List<List<KeyValue<K, V>>> map(Counters counters) {
    log.info("Map phase started");
    String stage = spec.getJobName() + "-map";
    List<List<I>> input = spec.getInput();
    ImmutableList.Builder<List<KeyValue<K, V>>> out = ImmutableList.builder();
    for (int shard = 0; shard < input.size(); shard++) {
      Mapper<I, K, V> mapper = copyOf(spec.getMapper());
      MapperContextImpl<K, V> context = new MapperContextImpl<>(stage, shard, input.size());
      try {
        mapper.setContext(context);
        mapper.beginShard();
        for (I value : input.get(shard)) {
          context.incrementCounter(CounterNames.MAPPER_CALLS);
          mapper.map(value);
        }
        mapper.endShard();
      } catch (RuntimeException e) {
        throw failure(stage, shard, e);
      }
      counters.addAll(context.getCounters());
      out.add(context.getOutput());
    }
    log.info("Map phase completed");
    return out.build();
  }

  List<List<KeyValue<K, C>>> combine(List<List<KeyValue<K, V>>> mapOutputs,
      Counters counters) {
    log.info("Combine phase started");
    String stage = spec.getJobName() + "-combine";
    ImmutableList.Builder<List<KeyValue<K, C>>> out = ImmutableList.builder();
    for (int shard = 0; shard < mapOutputs.size(); shard++) {
      List<KeyValue<K, List<V>>> groups =
          Shuffling.group(mapOutputs.get(shard), spec.getKeyMarshaller());
      ReducerContextImpl<KeyValue<K, C>> context = new ReducerContextImpl<>(
          stage, shard, mapOutputs.size(), CounterNames.COMBINER_OUTPUT_RECORDS);
      runReducer(stage, shard, copyOf(spec.getCombiner()), context, groups,
          CounterNames.COMBINER_CALLS, CounterNames.COMBINER_INPUT_RECORDS);
      counters.addAll(context.getCounters());
      out.add(context.getOutput());
    }
    log.info("Combine phase completed");
    return out.build();
  }

  /**
   * Writes every combiner output value with the intermediate value marshaller and reads it
   * back, as moving it to another node would.
   */
  List<List<KeyValue<K, C>>> transfer(List<List<KeyValue<K, C>>> combineOutputs,
      Counters counters) {
    Marshaller<C> marshaller = spec.getIntermediateValueMarshaller();
    if (marshaller == null) {
      return combineOutputs;
    }
    String stage = spec.getJobName() + "-transfer";
    ImmutableList.Builder<List<KeyValue<K, C>>> out = ImmutableList.builder();
    for (int shard = 0; shard < combineOutputs.size(); shard++) {
      ImmutableList.Builder<KeyValue<K, C>> transferred = ImmutableList.builder();
      for (KeyValue<K, C> pair : combineOutputs.get(shard)) {
        ByteBuffer bytes = marshaller.toBytes(pair.getValue());
        counters.getCounter(CounterNames.TRANSFER_BYTES).increment(bytes.remaining());
        try {
          transferred.add(KeyValue.of(pair.getKey(), marshaller.fromBytes(bytes)));
        } catch (IOException e) {
          throw failure(stage, shard, new CorruptDataException(
              marshaller + " could not read back the value for key " + pair.getKey(), e));
        }
      }
      out.add(transferred.build());
    }
    return out.build();
  }

  List<List<KeyValue<K, List<C>>>> shuffle(List<List<KeyValue<K, C>>> combineOutputs) {
    log.info("Shuffle phase started");
    List<List<KeyValue<K, List<C>>>> out = Shuffling.shuffle(
        combineOutputs, spec.getKeyMarshaller(), spec.getReduceShardCount());
    log.info("Shuffle phase completed");
    return out;
  }

  List<List<O>> reduce(List<List<KeyValue<K, List<C>>>> inputs, Counters counters) {
    log.info("Reduce phase started");
    String stage = spec.getJobName() + "-reduce";
    ImmutableList.Builder<List<O>> out = ImmutableList.builder();
    for (int shard = 0; shard < inputs.size(); shard++) {
      ReducerContextImpl<O> context = new ReducerContextImpl<>(
          stage, shard, inputs.size(), CounterNames.REDUCER_OUTPUT_RECORDS);
      runReducer(stage, shard, copyOf(spec.getReducer()), context, inputs.get(shard),
          CounterNames.REDUCER_CALLS, CounterNames.REDUCER_INPUT_RECORDS);
      counters.addAll(context.getCounters());
      out.add(context.getOutput());
    }
    log.info("Reduce phase completed, counters=" + counters);
    return out.build();
  }

  private <X, Y> void runReducer(String stage, int shard, Reducer<K, X, Y> reducer,
      ReducerContextImpl<Y> context, List<KeyValue<K, List<X>>> groups, String callCounter,
      String inputCounter) {
    try {
      reducer.setContext(context);
      reducer.beginShard();
      for (KeyValue<K, List<X>> group : groups) {
        context.incrementCounter(callCounter);
        reducer.reduce(group.getKey(), ReducerInputs.counting(group.getValue(),
            context.getCounters().getCounter(inputCounter)));
      }
      reducer.endShard();
    } catch (RuntimeException e) {
      throw failure(stage, shard, e);
    }
  }

  private static String getPipelineId() {
    DateTime dt = new DateTime();
    return "in-process-pipeline-" + DATE_FORMAT.print(dt) + "-" + new Random().nextInt(1000000);
  }

  public static <I, K, V, C, O> PipelineResult<O> run(
      PipelineSpecification<I, K, V, C, O> spec) {
    InProcessPipeline<I, K, V, C, O> pipeline = new InProcessPipeline<>(getPipelineId(), spec);
    log.info(pipeline + " started: " + spec);

    Counters counters = new InMemoryCounters();
    List<List<KeyValue<K, V>>> mapOutputs = pipeline.map(counters);
    List<List<KeyValue<K, C>>> combineOutputs =
        pipeline.transfer(pipeline.combine(mapOutputs, counters), counters);
    List<List<O>> outputs = pipeline.reduce(pipeline.shuffle(combineOutputs), counters);

    log.info(pipeline + " finished");
    return new PipelineResult<>(outputs, counters);
  }
}
