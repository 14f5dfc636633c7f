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

package org.mrlib.aggregators;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Objects;

import java.io.Serializable;

/**
 * Partial state of a {@link MomentAggregator}: count, sum, sum of squares, minimum and
 * maximum of the values seen.
 */
public final class MomentState implements Serializable {

  private static final long serialVersionUID = -8317262030176145935L;

  private final long count;
  private final double sum;
  private final double sumOfSquares;
  private final double min;
  private final double max;

  public MomentState(long count, double sum, double sumOfSquares, double min, double max) {
    checkArgument(count > 0, "Moments need at least one value, count=%s", count);
    this.count = count;
    this.sum = sum;
    this.sumOfSquares = sumOfSquares;
    this.min = min;
    this.max = max;
  }

  public long getCount() {
    return count;
  }

  public double getSum() {
    return sum;
  }

  public double getSumOfSquares() {
    return sumOfSquares;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof MomentState)) {
      return false;
    }
    MomentState other = (MomentState) o;
    return count == other.count
        && Double.compare(sum, other.sum) == 0
        && Double.compare(sumOfSquares, other.sumOfSquares) == 0
        && Double.compare(min, other.min) == 0
        && Double.compare(max, other.max) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(count, sum, sumOfSquares, min, max);
  }

  @Override
  public String toString() {
    return "MomentState(" + count + ", " + sum + ", " + sumOfSquares + ", " + min + ", " + max
        + ")";
  }
}
