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

import com.google.common.collect.ImmutableList;

import org.mrlib.Marshaller;
import org.mrlib.Marshallers;

import junit.framework.TestCase;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * Tests for {@link StateMarshallers}.
 */
public class StateMarshallersTest extends TestCase {

  private static <T> T roundTrip(Marshaller<T> marshaller, T value) throws IOException {
    return marshaller.fromBytes(marshaller.toBytes(value));
  }

  private static void assertCorrupt(Marshaller<?> marshaller, ByteBuffer bytes) {
    try {
      marshaller.fromBytes(bytes);
      fail("Expected IOException");
    } catch (IOException expected) {
      // expected
    }
  }

  public void testMeanState() throws IOException {
    Marshaller<MeanState> marshaller = StateMarshallers.getMeanStateMarshaller();
    MeanState state = new MeanState(0.1 + 0.2, 3);
    assertEquals(16, marshaller.toBytes(state).remaining());
    MeanState copy = roundTrip(marshaller, state);
    assertEquals(state, copy);
    assertEquals(Double.doubleToRawLongBits(0.1 + 0.2), Double.doubleToRawLongBits(copy.getSum()));
    assertCorrupt(marshaller, ByteBuffer.allocate(15));
    assertCorrupt(marshaller, ByteBuffer.allocate(16));
  }

  public void testMomentState() throws IOException {
    Marshaller<MomentState> marshaller = StateMarshallers.getMomentStateMarshaller();
    MomentState state = new MomentState(8, 26, 136, -0.5, Double.MAX_VALUE);
    assertEquals(40, marshaller.toBytes(state).remaining());
    assertEquals(state, roundTrip(marshaller, state));
    assertCorrupt(marshaller, ByteBuffer.allocate(41));
    ByteBuffer zeroCount = ByteBuffer.allocate(40);
    assertCorrupt(marshaller, zeroCount);
  }

  public void testRankedList() throws IOException {
    Marshaller<RankedList<String>> marshaller =
        StateMarshallers.getRankedListMarshaller(Marshallers.getStringMarshaller());
    RankedList<String> state = RankedList.of("zebra", "", "apple");
    RankedList<String> copy = roundTrip(marshaller, state);
    assertEquals(state, copy);
    assertEquals(ImmutableList.of("zebra", "", "apple"), copy.getElements());
    assertEquals(RankedList.<String>empty(), roundTrip(marshaller, RankedList.<String>empty()));
  }

  public void testCorruptRankedList() {
    Marshaller<RankedList<Long>> marshaller =
        StateMarshallers.getRankedListMarshaller(Marshallers.getLongMarshaller());
    assertCorrupt(marshaller, ByteBuffer.allocate(3));
    ByteBuffer negative = ByteBuffer.allocate(4);
    negative.putInt(-1).rewind();
    assertCorrupt(marshaller, negative);
    ByteBuffer truncated = ByteBuffer.allocate(8);
    truncated.putInt(2).putInt(8).rewind();
    assertCorrupt(marshaller, truncated);
    ByteBuffer trailing = marshaller.toBytes(RankedList.of(1L, 2L));
    ByteBuffer padded = ByteBuffer.allocate(trailing.remaining() + 1);
    padded.put(trailing).rewind();
    assertCorrupt(marshaller, padded);
  }

  public void testVectors() throws IOException {
    Marshaller<List<Long>> longs = StateMarshallers.getLongVectorMarshaller();
    assertEquals(ImmutableList.of(3L, -9L, Long.MAX_VALUE),
        roundTrip(longs, ImmutableList.of(3L, -9L, Long.MAX_VALUE)));
    assertEquals(ImmutableList.<Long>of(), roundTrip(longs, ImmutableList.<Long>of()));
    assertCorrupt(longs, ByteBuffer.allocate(12));

    Marshaller<List<Double>> doubles = StateMarshallers.getDoubleVectorMarshaller();
    assertEquals(ImmutableList.of(0.1, -0.0, Double.NaN),
        roundTrip(doubles, ImmutableList.of(0.1, -0.0, Double.NaN)));
    assertCorrupt(doubles, ByteBuffer.allocate(7));
  }
}
