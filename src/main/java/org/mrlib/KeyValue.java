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

import com.google.common.base.Objects;

import java.io.Serializable;

/**
 * Key-value pair, the unit of data moving between pipeline stages.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class KeyValue<K, V> implements Serializable {

  private static final long serialVersionUID = 6021407744213586124L;

  private final K key;
  private final V value;

  public KeyValue(K key, V value) {
    this.key = key;
    this.value = value;
  }

  public K getKey() {
    return key;
  }

  public V getValue() {
    return value;
  }

  @Override
  public String toString() {
    return "KeyValue(" + key + ", " + value + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof KeyValue)) {
      return false;
    }
    KeyValue<?, ?> other = (KeyValue<?, ?>) o;
    return Objects.equal(key, other.key) && Objects.equal(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(key, value);
  }

  public static <K, V> KeyValue<K, V> of(K k, V v) {
    return new KeyValue<>(k, v);
  }
}
