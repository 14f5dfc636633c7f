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
 * Partial state of a {@link MeanAggregator}: the plain sum and count of the values seen.
 */
public final class MeanState implements Serializable {

  private static final long serialVersionUID = 3012837960921476603L;

  private final double sum;
  private final long count;

  public MeanState(double sum, long count) {
    checkArgument(count > 0, "A mean needs at least one value, count=%s", count);
    this.sum = sum;
    this.count = count;
  }

  public double getSum() {
    return sum;
  }

  public long getCount() {
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof MeanState)) {
      return false;
    }
    MeanState other = (MeanState) o;
    return Double.compare(sum, other.sum) == 0 && count == other.count;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(sum, count);
  }

  @Override
  public String toString() {
    return "MeanState(" + sum + ", " + count + ")";
  }
}
