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

/**
 * Built-in counter names.
 */
public final class CounterNames {

  /**
   * Number of times map function was called.
   */
  public static final String MAPPER_CALLS = "mapper-calls";

  /**
   * Number of key-value pairs emitted by mappers.
   */
  public static final String MAPPER_OUTPUT_RECORDS = "mapper-output-records";

  /**
   * Number of times the combiner was called, once per key and map shard.
   */
  public static final String COMBINER_CALLS = "combiner-calls";

  /**
   * Number of values read by combiners.
   */
  public static final String COMBINER_INPUT_RECORDS = "combiner-input-records";

  /**
   * Number of values emitted by combiners.
   */
  public static final String COMBINER_OUTPUT_RECORDS = "combiner-output-records";

  /**
   * Number of times reduce function was called.
   */
  public static final String REDUCER_CALLS = "reducer-calls";

  /**
   * Number of values read by reducers.
   */
  public static final String REDUCER_INPUT_RECORDS = "reducer-input-records";

  /**
   * Number of values emitted by reducers.
   */
  public static final String REDUCER_OUTPUT_RECORDS = "reducer-output-records";

  /**
   * Number of aggregator combine calls made by aggregator-backed stages.
   */
  public static final String AGGREGATOR_COMBINES = "aggregator-combines";

  /**
   * Number of aggregator merge calls made by aggregator-backed stages.
   */
  public static final String AGGREGATOR_MERGES = "aggregator-merges";

  /**
   * Number of results finished by aggregator-backed stages.
   */
  public static final String AGGREGATOR_RESULTS = "aggregator-results";

  /**
   * Total number of bytes of partial state transferred between combine and reduce.
   */
  public static final String TRANSFER_BYTES = "transfer-bytes";

  private CounterNames() {}
}
