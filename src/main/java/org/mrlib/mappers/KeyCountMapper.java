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

package org.mrlib.mappers;

import org.mrlib.Mapper;

/**
 * Emits every input as a key with a count of one. Paired with a long sum as combiner and
 * reducer, this counts the occurrences of each distinct input.
 *
 * @param <T> type of input that is passed on as the key
 */
public class KeyCountMapper<T> extends Mapper<T, T, Long> {

  private static final long serialVersionUID = -5526411209932750113L;

  private static final Long ONE = 1L;

  @Override
  public void map(T value) {
    emit(value, ONE);
  }
}
