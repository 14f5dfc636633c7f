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

import java.io.Serializable;

/**
 * Base class for {@link Mapper} and {@link Reducer}.
 *
 * <p>A worker processes the data of one shard. Each shard starts with a call to
 * {@link #beginShard}, then performs zero or more calls to {@link Mapper#map} or
 * {@link Reducer#reduce}, then finishes with {@link #endShard}. A worker is serializable so
 * that the execution environment can ship one copy to every node that runs a shard; copies
 * never share state with each other.
 *
 * <p>This class is really an interface that might be evolving. In order to avoid breaking
 * users when we change the interface, we made it an abstract class.
 *
 * @param <C> type of context required by this worker
 */
public abstract class Worker<C extends WorkerContext<?>> implements Serializable {

  private static final long serialVersionUID = -3270834522471207512L;

  private transient C context;

  /**
   * Sets the context to be used for the processing that follows. Called before
   * {@link #beginShard}.
   */
  public void setContext(C context) {
    this.context = context;
  }

  /**
   * Returns the current context, or null if none.
   */
  protected C getContext() {
    return context;
  }

  /**
   * Prepares the worker for processing a new shard.
   */
  public void beginShard() {}

  /**
   * Notifies the worker that there is no more data to process in the current shard.
   */
  public void endShard() {}
}
