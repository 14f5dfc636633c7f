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

import com.google.common.collect.ImmutableList;

import org.mrlib.CorruptDataException;
import org.mrlib.KeyValue;

import junit.framework.TestCase;

import java.nio.ByteBuffer;

/**
 * Tests for {@link SerializationUtil}.
 */
public class SerializationUtilTest extends TestCase {

  public void testRoundTrip() {
    KeyValue<String, ImmutableList<Long>> value = KeyValue.of("k", ImmutableList.of(1L, 2L));
    byte[] bytes = SerializationUtil.serializeToByteArray(value);
    KeyValue<String, ImmutableList<Long>> copy =
        SerializationUtil.deserializeFromByteBuffer(ByteBuffer.wrap(bytes));
    assertEquals(value, copy);
  }

  public void testGarbage() {
    try {
      SerializationUtil.deserializeFromByteBuffer(ByteBuffer.wrap(new byte[] {1, 2, 3}));
      fail("Expected CorruptDataException");
    } catch (CorruptDataException expected) {
      // expected
    }
  }

  public void testGetBytesKeepsPosition() {
    ByteBuffer buffer = ByteBuffer.wrap(new byte[] {1, 2, 3, 4});
    buffer.position(1);
    byte[] bytes = SerializationUtil.getBytes(buffer);
    assertEquals(3, bytes.length);
    assertEquals(2, bytes[0]);
    assertEquals(1, buffer.position());
  }

  public void testPrettyBytes() {
    assertEquals("00ff10", SerializationUtil.prettyBytes(new byte[] {0, (byte) 0xff, 0x10}));
    String pretty = SerializationUtil.prettyBytes(new byte[100]);
    assertTrue(pretty, pretty.endsWith("...(100 bytes)"));
    assertEquals(128 + "...(100 bytes)".length(), pretty.length());
  }
}
