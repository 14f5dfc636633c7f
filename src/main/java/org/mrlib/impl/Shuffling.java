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

package org.mrlib.impl;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.primitives.UnsignedBytes;

import org.mrlib.CorruptDataException;
import org.mrlib.KeyValue;
import org.mrlib.Marshaller;
import org.mrlib.impl.util.SerializationUtil;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

/**
 * Groups key-value pairs by key the way the shuffle of a distributed pipeline does. Keys are
 * compared by their marshalled bytes, so two keys are the same key exactly when their
 * marshaller produces the same bytes. Within a key, values keep the order in which they
 * arrived.
 */
public class Shuffling {

  private Shuffling() {}

  public static final Ordering<byte[]> KEY_ORDERING =
      Ordering.from(UnsignedBytes.lexicographicalComparator());

  public static int reduceShardFor(byte[] key, int reduceShardCount) {
    int targetShard = Arrays.hashCode(key) % reduceShardCount;
    if (targetShard < 0) {
      targetShard += reduceShardCount;
    }
    return targetShard;
  }

  // Wrapper around byte[] that implements hashCode and equals the way we
  // need, for use as Multimap keys etc.
  private static class Bytes implements Comparable<Bytes> {
    private final byte[] bytes;
    private final int hashCode;

    Bytes(byte[] bytes) {
      this.bytes = checkNotNull(bytes, "Null bytes");
      hashCode = Arrays.hashCode(bytes);
    }

    @Override
    public int hashCode() {
      return hashCode;
    }

    @Override
    public boolean equals(Object o) {
      if (o == this) {
        return true;
      }
      if (!(o instanceof Bytes)) {
        return false;
      }
      Bytes other = (Bytes) o;
      return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int compareTo(Bytes other) {
      return KEY_ORDERING.compare(bytes, other.bytes);
    }
  }

  private static <K, V> ListMultimap<Bytes, V> groupByKey(Marshaller<K> keyMarshaller,
      Iterable<KeyValue<K, V>> in) {
    ListMultimap<Bytes, V> out = LinkedListMultimap.create();
    for (KeyValue<K, V> pair : in) {
      Bytes key = new Bytes(SerializationUtil.getBytes(keyMarshaller.toBytes(pair.getKey())));
      out.put(key, pair.getValue());
    }
    return out;
  }

  // Also turns the keys back from Bytes into K.
  private static <K, V> List<KeyValue<K, List<V>>> toSortedGroups(
      Marshaller<K> keyMarshaller, ListMultimap<Bytes, V> in, Iterable<Bytes> keys) {
    ImmutableList.Builder<KeyValue<K, List<V>>> out = ImmutableList.builder();
    for (Bytes keyBytes : Ordering.natural().sortedCopy(keys)) {
      K key;
      try {
        key = keyMarshaller.fromBytes(ByteBuffer.wrap(keyBytes.bytes));
      } catch (IOException e) {
        throw new CorruptDataException(keyMarshaller + ".fromBytes() threw IOException on "
            + SerializationUtil.prettyBytes(keyBytes.bytes), e);
      }
      List<V> values = Lists.newArrayList(in.get(keyBytes));
      out.add(KeyValue.of(key, values));
    }
    return out.build();
  }

  /**
   * Groups the output of one shard by key, keys in byte order. This is what a combiner sees.
   */
  public static <K, V> List<KeyValue<K, List<V>>> group(List<KeyValue<K, V>> shardOutput,
      Marshaller<K> keyMarshaller) {
    ListMultimap<Bytes, V> groups = groupByKey(keyMarshaller, shardOutput);
    return toSortedGroups(keyMarshaller, groups, groups.keySet());
  }

  /**
   * Moves the output of all shards to {@code reduceShardCount} reduce shards. Every key goes
   * to exactly one shard, chosen by the hash of its bytes; each shard gets its keys in byte
   * order with all the values of the key.
   */
  public static <K, V> List<List<KeyValue<K, List<V>>>> shuffle(
      List<List<KeyValue<K, V>>> shardOutputs, Marshaller<K> keyMarshaller,
      int reduceShardCount) {
    checkArgument(reduceShardCount > 0, "reduceShardCount must be positive: %s",
        reduceShardCount);
    ListMultimap<Bytes, V> groups = groupByKey(keyMarshaller, Iterables.concat(shardOutputs));
    List<List<Bytes>> keysByShard = Lists.newArrayListWithCapacity(reduceShardCount);
    for (int i = 0; i < reduceShardCount; i++) {
      keysByShard.add(Lists.<Bytes>newArrayList());
    }
    for (Bytes key : groups.keySet()) {
      keysByShard.get(reduceShardFor(key.bytes, reduceShardCount)).add(key);
    }
    ImmutableList.Builder<List<KeyValue<K, List<V>>>> out = ImmutableList.builder();
    for (int i = 0; i < reduceShardCount; i++) {
      out.add(toSortedGroups(keyMarshaller, groups, keysByShard.get(i)));
    }
    return out.build();
  }
}
