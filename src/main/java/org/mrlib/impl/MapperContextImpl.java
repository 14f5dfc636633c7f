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

import org.mrlib.CounterNames;
import org.mrlib.KeyValue;
import org.mrlib.MapperContext;

/**
 * @param <K> type of intermediate keys produced by the mapper
 * @param <V> type of intermediate values produced by the mapper
 */
class MapperContextImpl<K, V> extends BaseShardContext<KeyValue<K, V>>
    implements MapperContext<K, V> {

  MapperContextImpl(String stageName, int shardNumber, int shardCount) {
    super(stageName, shardNumber, shardCount, CounterNames.MAPPER_OUTPUT_RECORDS);
  }

  @Override
  public void emit(K key, V value) {
    emit(KeyValue.of(key, value));
  }
}
