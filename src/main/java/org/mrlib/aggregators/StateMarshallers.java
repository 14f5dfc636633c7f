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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

import org.mrlib.Marshaller;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link Marshaller}s for the partial states of the built-in aggregators, for moving them
 * between the nodes of a pipeline. Doubles are written as their IEEE bits, so accumulators
 * come back exactly as they were; ranked lists keep their order.
 */
public class StateMarshallers {

  private StateMarshallers() {}

  private static void checkRemaining(ByteBuffer in, int expected) throws IOException {
    if (in.remaining() != expected) {
      throw new IOException("Expected " + expected + " bytes, not " + in.remaining());
    }
  }

  private static class MeanStateMarshaller extends Marshaller<MeanState> {
    private static final long serialVersionUID = -6968123301549447265L;

    @Override
    public ByteBuffer toBytes(MeanState state) {
      ByteBuffer out = ByteBuffer.allocate(16);
      out.putDouble(state.getSum());
      out.putLong(state.getCount());
      out.rewind();
      return out;
    }

    @Override
    public MeanState fromBytes(ByteBuffer in) throws IOException {
      checkRemaining(in, 16);
      in.order(ByteOrder.BIG_ENDIAN);
      double sum = in.getDouble();
      long count = in.getLong();
      if (count <= 0) {
        throw new IOException("Bad count in mean state: " + count);
      }
      return new MeanState(sum, count);
    }
  }

  public static Marshaller<MeanState> getMeanStateMarshaller() {
    return new MeanStateMarshaller();
  }

  private static class MomentStateMarshaller extends Marshaller<MomentState> {
    private static final long serialVersionUID = 4794000946133860725L;

    @Override
    public ByteBuffer toBytes(MomentState state) {
      ByteBuffer out = ByteBuffer.allocate(40);
      out.putLong(state.getCount());
      out.putDouble(state.getSum());
      out.putDouble(state.getSumOfSquares());
      out.putDouble(state.getMin());
      out.putDouble(state.getMax());
      out.rewind();
      return out;
    }

    @Override
    public MomentState fromBytes(ByteBuffer in) throws IOException {
      checkRemaining(in, 40);
      in.order(ByteOrder.BIG_ENDIAN);
      long count = in.getLong();
      if (count <= 0) {
        throw new IOException("Bad count in moment state: " + count);
      }
      return new MomentState(count, in.getDouble(), in.getDouble(), in.getDouble(),
          in.getDouble());
    }
  }

  public static Marshaller<MomentState> getMomentStateMarshaller() {
    return new MomentStateMarshaller();
  }

  private static class RankedListMarshaller<V> extends Marshaller<RankedList<V>> {
    private static final long serialVersionUID = -1247209873105513287L;

    private final Marshaller<V> elementMarshaller;

    RankedListMarshaller(Marshaller<V> elementMarshaller) {
      this.elementMarshaller = checkNotNull(elementMarshaller, "Null elementMarshaller");
    }

    @Override
    public ByteBuffer toBytes(RankedList<V> state) {
      List<ByteBuffer> elements = new ArrayList<>(state.size());
      int size = 4;
      for (V element : state) {
        ByteBuffer bytes = elementMarshaller.toBytes(element);
        elements.add(bytes);
        size += 4 + bytes.remaining();
      }
      ByteBuffer out = ByteBuffer.allocate(size);
      out.putInt(elements.size());
      for (ByteBuffer bytes : elements) {
        out.putInt(bytes.remaining());
        out.put(bytes);
      }
      out.rewind();
      return out;
    }

    @Override
    public RankedList<V> fromBytes(ByteBuffer in) throws IOException {
      in.order(ByteOrder.BIG_ENDIAN);
      if (in.remaining() < 4) {
        throw new IOException("Missing element count, only " + in.remaining() + " bytes");
      }
      int count = in.getInt();
      if (count < 0) {
        throw new IOException("Negative element count " + count);
      }
      ImmutableList.Builder<V> elements = ImmutableList.builder();
      for (int i = 0; i < count; i++) {
        if (in.remaining() < 4) {
          throw new IOException("Truncated ranked list at element " + i + " of " + count);
        }
        int length = in.getInt();
        if (length < 0 || length > in.remaining()) {
          throw new IOException("Bad element length " + length + " at element " + i);
        }
        int oldLimit = in.limit();
        try {
          in.limit(in.position() + length);
          elements.add(elementMarshaller.fromBytes(in.slice()));
        } finally {
          in.limit(oldLimit);
        }
        in.position(in.position() + length);
      }
      if (in.hasRemaining()) {
        throw new IOException(in.remaining() + " trailing bytes after ranked list");
      }
      return RankedList.of(elements.build());
    }
  }

  /**
   * Returns a marshaller for ranked lists whose elements are written with
   * {@code elementMarshaller}.
   */
  public static <V> Marshaller<RankedList<V>> getRankedListMarshaller(
      Marshaller<V> elementMarshaller) {
    return new RankedListMarshaller<>(elementMarshaller);
  }

  private static class LongVectorMarshaller extends Marshaller<List<Long>> {
    private static final long serialVersionUID = 7300950925410369806L;

    @Override
    public ByteBuffer toBytes(List<Long> vector) {
      ByteBuffer out = ByteBuffer.allocate(8 * vector.size());
      for (Long component : vector) {
        out.putLong(component);
      }
      out.rewind();
      return out;
    }

    @Override
    public List<Long> fromBytes(ByteBuffer in) throws IOException {
      if (in.remaining() % 8 != 0) {
        throw new IOException("Vector length " + in.remaining() + " is not a multiple of 8");
      }
      in.order(ByteOrder.BIG_ENDIAN);
      ImmutableList.Builder<Long> out = ImmutableList.builder();
      while (in.hasRemaining()) {
        out.add(in.getLong());
      }
      return out.build();
    }
  }

  /**
   * Returns a marshaller for vector-sum states over {@code long}s.
   */
  public static Marshaller<List<Long>> getLongVectorMarshaller() {
    return new LongVectorMarshaller();
  }

  private static class DoubleVectorMarshaller extends Marshaller<List<Double>> {
    private static final long serialVersionUID = -3409816047393305212L;

    @Override
    public ByteBuffer toBytes(List<Double> vector) {
      ByteBuffer out = ByteBuffer.allocate(8 * vector.size());
      for (Double component : vector) {
        out.putLong(Double.doubleToRawLongBits(component));
      }
      out.rewind();
      return out;
    }

    @Override
    public List<Double> fromBytes(ByteBuffer in) throws IOException {
      if (in.remaining() % 8 != 0) {
        throw new IOException("Vector length " + in.remaining() + " is not a multiple of 8");
      }
      in.order(ByteOrder.BIG_ENDIAN);
      ImmutableList.Builder<Double> out = ImmutableList.builder();
      while (in.hasRemaining()) {
        out.add(Double.longBitsToDouble(in.getLong()));
      }
      return out.build();
    }
  }

  /**
   * Returns a marshaller for vector-sum states over {@code double}s.
   */
  public static Marshaller<List<Double>> getDoubleVectorMarshaller() {
    return new DoubleVectorMarshaller();
  }
}
