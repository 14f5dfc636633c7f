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

import com.google.common.base.Objects;

import java.io.Serializable;

/**
 * Result of a {@link MomentAggregator}: sample size, mean, sample standard deviation,
 * minimum and maximum.
 */
public final class Moments implements Serializable {

  private static final long serialVersionUID = 2218440337207406188L;

  private final long count;
  private final double mean;
  private final double standardDeviation;
  private final double min;
  private final double max;

  public Moments(long count, double mean, double standardDeviation, double min, double max) {
    this.count = count;
    this.mean = mean;
    this.standardDeviation = standardDeviation;
    this.min = min;
    this.max = max;
  }

  public long getCount() {
    return count;
  }

  public double getMean() {
    return mean;
  }

  /**
   * The Bessel-corrected sample standard deviation; 0 for a single value.
   */
  public double getStandardDeviation() {
    return standardDeviation;
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
    if (!(o instanceof Moments)) {
      return false;
    }
    Moments other = (Moments) o;
    return count == other.count
        && Double.compare(mean, other.mean) == 0
        && Double.compare(standardDeviation, other.standardDeviation) == 0
        && Double.compare(min, other.min) == 0
        && Double.compare(max, other.max) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(count, mean, standardDeviation, min, max);
  }

  @Override
  public String toString() {
    return "Moments(n=" + count + ", mean=" + mean + ", stddev=" + standardDeviation
        + ", min=" + min + ", max=" + max + ")";
  }
}
