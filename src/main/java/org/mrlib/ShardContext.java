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
 * Context for each shard.
 */
public interface ShardContext {

  /**
   * Returns the name of the pipeline stage this shard belongs to.
   */
  String getStageName();

  /**
   * Returns the total number of shards.
   */
  int getShardCount();

  /**
   * Returns the number of this shard (zero-based).
   */
  int getShardNumber();

  /**
   * Returns a {@link Counters} object for doing simple aggregate calculations.
   */
  Counters getCounters();

  /**
   * Increments the {@link Counter} with the given name by {@code delta}.
   */
  void incrementCounter(String name, long delta);

  /**
   * Increments the {@link Counter} with the given name by 1.
   */
  void incrementCounter(String name);
}
