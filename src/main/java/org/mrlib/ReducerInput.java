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

import java.util.Iterator;

/**
 * Enumerates the reducer's input values for a given key.
 *
 * @param <V> type of values provided by this input
 */
public abstract class ReducerInput<V> implements Iterator<V> {

  @Override
  public void remove() {
    throw new UnsupportedOperationException("Can't remove() on ReducerInput: " + this);
  }
}
