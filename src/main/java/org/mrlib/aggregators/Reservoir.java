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
import com.google.common.collect.ImmutableList;

import java.io.Serializable;

/**
 * Partial state of a {@link ReservoirSampleAggregator}: a uniform sample of the values seen
 * and the number of values it was drawn from.
 *
 * @param <V> type of the sampled values
 */
public final class Reservoir<V> implements Serializable {

  private static final long serialVersionUID = 5563713330961592113L;

  private final long seen;
  private final ImmutableList<V> sample;

  public Reservoir(long seen, Iterable<? extends V> sample) {
    this.seen = seen;
    this.sample = ImmutableList.copyOf(sample);
    checkArgument(this.sample.size() <= seen, "Sample of %s drawn from only %s values",
        this.sample.size(), seen);
  }

  /**
   * Number of values this sample represents.
   */
  public long getSeen() {
    return seen;
  }

  public ImmutableList<V> getSample() {
    return sample;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Reservoir)) {
      return false;
    }
    Reservoir<?> other = (Reservoir<?>) o;
    return seen == other.seen && sample.equals(other.sample);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(seen, sample);
  }

  @Override
  public String toString() {
    return "Reservoir(" + seen + ", " + sample + ")";
  }
}
