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
 * Thrown when the tuples summed for one key do not all have the same length.
 */
public class ArityMismatchException extends AggregationException {

  private static final long serialVersionUID = 1836512094702347110L;

  private final int expectedArity;
  private final int actualArity;

  public ArityMismatchException(Object key, int expectedArity, int actualArity) {
    super(key, "expected a tuple of arity " + expectedArity + " but got " + actualArity);
    this.expectedArity = expectedArity;
    this.actualArity = actualArity;
  }

  public int getExpectedArity() {
    return expectedArity;
  }

  public int getActualArity() {
    return actualArity;
  }
}
