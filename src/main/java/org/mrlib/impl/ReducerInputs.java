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

import org.mrlib.Counter;
import org.mrlib.ReducerInput;

import java.util.Iterator;

/**
 * Utilities related to {@link ReducerInput}.
 */
public class ReducerInputs {

  private ReducerInputs() {}

  private static class IteratorReducerInput<V> extends ReducerInput<V> {
    private final Iterator<V> i;
    private final Counter consumed;

    IteratorReducerInput(Iterator<V> i, Counter consumed) {
      this.i = checkNotNull(i, "Null iterator");
      this.consumed = consumed;
    }

    @Override
    public boolean hasNext() {
      return i.hasNext();
    }

    @Override
    public V next() {
      V value = i.next();
      if (consumed != null) {
        consumed.increment(1);
      }
      return value;
    }

    @Override
    public String toString() {
      return "ReducerInputs(" + i + ")";
    }
  }

  public static <V> ReducerInput<V> fromIterable(Iterable<V> x) {
    return new IteratorReducerInput<>(x.iterator(), null);
  }

  /**
   * Like {@link #fromIterable}, but increments {@code consumed} for every value the reducer
   * actually reads.
   */
  public static <V> ReducerInput<V> counting(Iterable<V> x, Counter consumed) {
    return new IteratorReducerInput<>(x.iterator(), checkNotNull(consumed, "Null counter"));
  }
}
