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
 * Map function. A map function processes input values one at a time and generates zero or
 * more output key-value pairs for each. It emits the generated pairs through the
 * {@link MapperContext}.
 *
 * <p>This class is really an interface that might be evolving. In order to avoid breaking
 * users when we change the interface, we made it an abstract class.
 *
 * @param <I> type of input received
 * @param <K> type of intermediate keys produced
 * @param <V> type of intermediate values produced
 */
public abstract class Mapper<I, K, V> extends Worker<MapperContext<K, V>> {

  private static final long serialVersionUID = 2371519104376583419L;

  /**
   * Processes a single input value, emitting output through {@link #emit}.
   */
  public abstract void map(I value);

  /**
   * Syntactic sugar for {@code getContext().emit(key, value)}
   */
  protected void emit(K key, V value) {
    getContext().emit(key, value);
  }
}
