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

import static java.nio.charset.StandardCharsets.UTF_8;

import org.mrlib.impl.util.SerializationUtil;

import java.io.IOException;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;

/**
 * Some {@link Marshaller}s and related utilities.
 */
public class Marshallers {

  private Marshallers() {}

  private static class SerializationMarshaller<T extends Serializable> extends Marshaller<T> {
    private static final long serialVersionUID = -8270615734398618893L;

    @Override
    public ByteBuffer toBytes(T object) {
      return ByteBuffer.wrap(SerializationUtil.serializeToByteArray(object));
    }

    @Override
    public T fromBytes(ByteBuffer in) {
      return SerializationUtil.deserializeFromByteBuffer(in);
    }
  }

  /**
   * Returns a {@code Marshaller} that uses Java Serialization. Works for any type that
   * implements {@link Serializable}, but is not space-efficient for boxed primitives like
   * {@link Long} or {@link Double}.
   */
  public static <T extends Serializable> Marshaller<T> getSerializationMarshaller() {
    return new SerializationMarshaller<>();
  }

  private static class StringMarshaller extends Marshaller<String> {
    private static final long serialVersionUID = 2946282180540329391L;

    @Override
    public ByteBuffer toBytes(String x) {
      return ByteBuffer.wrap(x.getBytes(UTF_8));
    }

    @Override
    public String fromBytes(ByteBuffer in) throws IOException {
      try {
        return UTF_8.newDecoder().decode(in).toString();
      } catch (CharacterCodingException e) {
        throw new IOException("Not valid UTF-8", e);
      }
    }
  }

  /**
   * Returns a {@code Marshaller} for {@code String}s using UTF-8.
   */
  public static Marshaller<String> getStringMarshaller() {
    return new StringMarshaller();
  }

  private static class LongMarshaller extends Marshaller<Long> {
    private static final long serialVersionUID = -7415064371287614096L;

    @Override
    public ByteBuffer toBytes(Long x) {
      ByteBuffer out = ByteBuffer.allocate(8).putLong(x ^ Long.MIN_VALUE);
      out.rewind();
      return out;
    }

    @Override
    public Long fromBytes(ByteBuffer in) throws IOException {
      if (in.remaining() != 8) {
        throw new IOException("Expected 8 bytes, not " + in.remaining());
      }
      in.order(ByteOrder.BIG_ENDIAN);
      return in.getLong() ^ Long.MIN_VALUE;
    }
  }

  /**
   * Returns a {@code Marshaller} for {@code Long}s that uses a more efficient representation
   * than {@link #getSerializationMarshaller}. The sign bit is flipped so that the encoded
   * bytes compare, unsigned, in numeric order.
   */
  public static Marshaller<Long> getLongMarshaller() {
    return new LongMarshaller();
  }

  private static class IntegerMarshaller extends Marshaller<Integer> {
    private static final long serialVersionUID = 3407795104532650391L;

    @Override
    public ByteBuffer toBytes(Integer x) {
      ByteBuffer out = ByteBuffer.allocate(4).putInt(x ^ Integer.MIN_VALUE);
      out.rewind();
      return out;
    }

    @Override
    public Integer fromBytes(ByteBuffer in) throws IOException {
      if (in.remaining() != 4) {
        throw new IOException("Expected 4 bytes, not " + in.remaining());
      }
      in.order(ByteOrder.BIG_ENDIAN);
      return in.getInt() ^ Integer.MIN_VALUE;
    }
  }

  /**
   * Returns a {@code Marshaller} for {@code Integer}s that uses a more efficient
   * representation than {@link #getSerializationMarshaller}. Encoded bytes sort in numeric
   * order.
   */
  public static Marshaller<Integer> getIntegerMarshaller() {
    return new IntegerMarshaller();
  }

  private static class DoubleMarshaller extends Marshaller<Double> {
    private static final long serialVersionUID = 8804512876180741733L;

    @Override
    public ByteBuffer toBytes(Double x) {
      ByteBuffer out = ByteBuffer.allocate(8).putLong(Double.doubleToRawLongBits(x));
      out.rewind();
      return out;
    }

    @Override
    public Double fromBytes(ByteBuffer in) throws IOException {
      if (in.remaining() != 8) {
        throw new IOException("Expected 8 bytes, not " + in.remaining());
      }
      in.order(ByteOrder.BIG_ENDIAN);
      return Double.longBitsToDouble(in.getLong());
    }
  }

  /**
   * Returns a {@code Marshaller} for {@code Double}s. The IEEE bits are written as they are,
   * so every value, including NaN payloads and negative zero, round-trips exactly.
   */
  public static Marshaller<Double> getDoubleMarshaller() {
    return new DoubleMarshaller();
  }

  private static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

  private static class VoidMarshaller extends Marshaller<Void> {
    private static final long serialVersionUID = -1403216416437092452L;

    @Override
    public ByteBuffer toBytes(Void x) {
      return ByteBuffer.wrap(EMPTY_BYTE_ARRAY);
    }

    @Override
    public Void fromBytes(ByteBuffer in) throws IOException {
      if (in.remaining() != 0) {
        throw new IOException("Expected 0 bytes, not " + in.remaining());
      }
      return null;
    }
  }

  /**
   * Returns a {@code Marshaller} for {@code Void}.
   */
  public static Marshaller<Void> getVoidMarshaller() {
    return new VoidMarshaller();
  }

  private static class KeyValueMarshaller<K, V> extends Marshaller<KeyValue<K, V>> {
    private static final long serialVersionUID = 1620953390587431022L;

    private final Marshaller<K> keyMarshaller;
    private final Marshaller<V> valueMarshaller;

    private KeyValueMarshaller(Marshaller<K> keyMarshaller, Marshaller<V> valueMarshaller) {
      this.keyMarshaller = keyMarshaller;
      this.valueMarshaller = valueMarshaller;
    }

    @Override
    public ByteBuffer toBytes(KeyValue<K, V> pair) {
      ByteBuffer key = keyMarshaller.toBytes(pair.getKey());
      ByteBuffer value = valueMarshaller.toBytes(pair.getValue());
      ByteBuffer out = ByteBuffer.allocate(4 + key.remaining() + value.remaining());
      out.putInt(key.remaining());
      out.put(key);
      out.put(value);
      out.rewind();
      return out;
    }

    @Override
    public KeyValue<K, V> fromBytes(ByteBuffer in) throws IOException {
      in.order(ByteOrder.BIG_ENDIAN);
      if (in.remaining() < 4) {
        throw new IOException("Missing key length, only " + in.remaining() + " bytes");
      }
      int keyLength = in.getInt();
      if (keyLength < 0 || keyLength > in.remaining()) {
        throw new IOException("Bad key length " + keyLength + ", " + in.remaining() + " bytes");
      }
      int oldLimit = in.limit();
      K key;
      try {
        in.limit(in.position() + keyLength);
        key = keyMarshaller.fromBytes(in.slice());
      } finally {
        in.limit(oldLimit);
      }
      in.position(in.position() + keyLength);
      V value = valueMarshaller.fromBytes(in.slice());
      return KeyValue.of(key, value);
    }
  }

  /**
   * Returns a {@code Marshaller} for key-value pairs based on {@code keyMarshaller} and
   * {@code valueMarshaller}.
   */
  public static <K, V> Marshaller<KeyValue<K, V>> getKeyValueMarshaller(
      Marshaller<K> keyMarshaller, Marshaller<V> valueMarshaller) {
    return new KeyValueMarshaller<>(keyMarshaller, valueMarshaller);
  }
}
