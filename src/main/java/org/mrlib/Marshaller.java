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

import java.io.IOException;
import java.io.Serializable;
import java.nio.ByteBuffer;

/**
 * Turns objects of type {@code T} into bytes and back. Used to hash and order keys during
 * the shuffle and to move partial aggregation state between nodes.
 *
 * <p>Implementations must round-trip values exactly; numeric accumulators must not be
 * rounded on the way.
 *
 * @param <T> type to be marshalled or unmarshalled
 */
public abstract class Marshaller<T> implements Serializable {

  private static final long serialVersionUID = 4089212618337406357L;

  /**
   * Returns a new {@code ByteBuffer} {@code b} with a serialized representation of
   * {@code object} between {@code b.position()} and {@code b.limit()}.
   */
  public abstract ByteBuffer toBytes(T object);

  /**
   * Returns the object whose serialized representation is in {@code b} between
   * {@code b.position()} and {@code b.limit()}. The value of {@code b.position()} upon return
   * is not defined.
   *
   * @throws IOException if the bytes are not a valid representation
   */
  public abstract T fromBytes(ByteBuffer b) throws IOException;
}
