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
 * A context for mapper execution.
 *
 * @param <K> type of keys produced by the mapper
 * @param <V> type of values produced by the mapper
 */
public interface MapperContext<K, V> extends WorkerContext<KeyValue<K, V>> {

  /**
   * Emits a key and a value to the output.
   */
  void emit(K key, V value);
}
