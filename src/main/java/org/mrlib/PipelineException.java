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

/**
 * An exception that is thrown when a stage of an in-process pipeline fails. The exception
 * raised by the stage can be fetched by {@link #getCause()}.
 */
public class PipelineException extends RuntimeException {

  private static final long serialVersionUID = -5340979310624178419L;

  private final String stage;

  public PipelineException(String stage, int shard, Throwable cause) {
    super("Stage " + stage + " failed on shard " + shard + " (" + cause.getMessage() + ")",
        cause);
    this.stage = stage;
  }

  /**
   * Returns the name of the stage that failed.
   */
  public String getFailedStage() {
    return stage;
  }
}
