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

import java.io.Serializable;

/**
 * Collection of all counters.
 */
public interface Counters extends Serializable {

  /**
   * @param name counter name
   * @return counter with a given name. Creates new counter with 0 value if it doesn't exist.
   */
  Counter getCounter(String name);

  /**
   * @return iterable over all created counters.
   */
  Iterable<? extends Counter> getCounters();

  /**
   * @param other Another counter object who's counters should all be added to this one.
   */
  void addAll(Counters other);
}
