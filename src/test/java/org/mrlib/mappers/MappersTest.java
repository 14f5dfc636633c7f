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

import static org.easymock.EasyMock.createStrictMock;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;

import org.mrlib.KeyValue;
import org.mrlib.MapperContext;

import junit.framework.TestCase;

/**
 * Tests for {@link IdentityMapper} and {@link KeyCountMapper}.
 */
public class MappersTest extends TestCase {

  @SuppressWarnings("unchecked")
  public void testIdentityMapper() {
    MapperContext<String, Long> context = createStrictMock(MapperContext.class);
    context.emit("a", 1L);
    context.emit("b", null);
    context.emit("a", 1L);
    replay(context);

    IdentityMapper<String, Long> mapper = new IdentityMapper<>();
    mapper.setContext(context);
    mapper.map(KeyValue.of("a", 1L));
    mapper.map(KeyValue.of("b", (Long) null));
    mapper.map(KeyValue.of("a", 1L));
    verify(context);
  }

  @SuppressWarnings("unchecked")
  public void testKeyCountMapper() {
    MapperContext<String, Long> context = createStrictMock(MapperContext.class);
    context.emit("apple", 1L);
    context.emit("pear", 1L);
    context.emit("apple", 1L);
    replay(context);

    KeyCountMapper<String> mapper = new KeyCountMapper<>();
    mapper.setContext(context);
    mapper.map("apple");
    mapper.map("pear");
    mapper.map("apple");
    verify(context);
  }
}
