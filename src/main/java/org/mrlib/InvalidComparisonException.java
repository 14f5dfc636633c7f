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
 * Thrown when a value (or its comparison key) cannot be ranked: it is missing or it is not
 * comparable with the other values of the group.
 */
public class InvalidComparisonException extends AggregationException {

  private static final long serialVersionUID = -2035573093327040231L;

  public InvalidComparisonException(Object key, String message) {
    super(key, message);
  }

  public InvalidComparisonException(Object key, String message, Throwable cause) {
    super(key, message, cause);
  }
}
