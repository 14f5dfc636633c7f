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

import java.io.Serializable;

/**
 * Addition over one boxed number type, so that sums keep the type (and exactness) of their
 * input instead of going through {@code double}.
 *
 * @param <N> the number type
 */
public abstract class Arithmetic<N extends Number> implements Serializable {

  private static final long serialVersionUID = -1183927716066287543L;

  public static final Arithmetic<Long> LONGS = new Arithmetic<Long>("long") {
    private static final long serialVersionUID = 4427203811390618311L;

    @Override
    public Long zero() {
      return 0L;
    }

    @Override
    public Long add(Long a, Long b) {
      return Math.addExact(a, b);
    }
  };

  public static final Arithmetic<Integer> INTEGERS = new Arithmetic<Integer>("int") {
    private static final long serialVersionUID = -2704561326924335108L;

    @Override
    public Integer zero() {
      return 0;
    }

    @Override
    public Integer add(Integer a, Integer b) {
      return Math.addExact(a, b);
    }
  };

  public static final Arithmetic<Double> DOUBLES = new Arithmetic<Double>("double") {
    private static final long serialVersionUID = 6660713926412542186L;

    @Override
    public Double zero() {
      return 0.0;
    }

    @Override
    public Double add(Double a, Double b) {
      return a + b;
    }
  };

  private final String name;

  private Arithmetic(String name) {
    this.name = name;
  }

  /**
   * The additive identity.
   */
  public abstract N zero();

  /**
   * Returns {@code a + b}. Integral types throw {@link ArithmeticException} on overflow
   * rather than wrap.
   */
  public abstract N add(N a, N b);

  @Override
  public String toString() {
    return "Arithmetic(" + name + ")";
  }
}
