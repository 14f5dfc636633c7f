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
 * Base class of the errors an {@link Aggregator} raises while processing one key. These are
 * local to the key and must reach the execution environment's failure handling; they are
 * never replaced by a default result.
 */
public class AggregationException extends RuntimeException {

  private static final long serialVersionUID = 7388103611245079504L;

  private final String key;

  public AggregationException(Object key, String message) {
    super("Aggregation failed for key " + key + ": " + message);
    this.key = String.valueOf(key);
  }

  public AggregationException(Object key, String message, Throwable cause) {
    super("Aggregation failed for key " + key + ": " + message, cause);
    this.key = String.valueOf(key);
  }

  /**
   * Returns the string form of the key whose processing failed.
   */
  public String getKey() {
    return key;
  }
}
