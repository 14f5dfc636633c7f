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

package org.mrlib.impl.util;

import com.google.common.io.BaseEncoding;

import org.mrlib.CorruptDataException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.nio.ByteBuffer;

/**
 * A serialization utility class.
 */
public class SerializationUtil {

  private static final int MAX_PRETTY_BYTES = 64;

  private SerializationUtil() {}

  public static byte[] serializeToByteArray(Serializable o) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(o);
    } catch (IOException e) {
      throw new RuntimeException("Can't serialize object: " + o, e);
    }
    return bytes.toByteArray();
  }

  @SuppressWarnings("unchecked")
  public static <T> T deserializeFromByteBuffer(ByteBuffer bytes) {
    try (ObjectInputStream in =
        new ObjectInputStream(new ByteArrayInputStream(getBytes(bytes)))) {
      return (T) in.readObject();
    } catch (IOException | ClassNotFoundException e) {
      throw new CorruptDataException("Deserialization error: " + e.getMessage(), e);
    }
  }

  /**
   * Returns the bytes between {@code in.position()} and {@code in.limit()} without moving the
   * position of {@code in}.
   */
  public static byte[] getBytes(ByteBuffer in) {
    if (in.hasArray() && in.position() == 0
        && in.arrayOffset() == 0 && in.array().length == in.limit()) {
      return in.array();
    } else {
      byte[] buf = new byte[in.remaining()];
      int position = in.position();
      in.get(buf);
      in.position(position);
      return buf;
    }
  }

  /**
   * Hex form of {@code bytes} for log and error messages, truncated for long input.
   */
  public static String prettyBytes(byte[] bytes) {
    if (bytes.length <= MAX_PRETTY_BYTES) {
      return BaseEncoding.base16().lowerCase().encode(bytes);
    }
    return BaseEncoding.base16().lowerCase().encode(bytes, 0, MAX_PRETTY_BYTES) + "...("
        + bytes.length + " bytes)";
  }
}
