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
 * The exception generated if any of the data appears to be corrupt, for example a partial
 * state whose shape no longer satisfies its invariants. This should fail the key.
 */
public class CorruptDataException extends RuntimeException {

  private static final long serialVersionUID = -2318826503845672218L;

  public CorruptDataException(String message) {
    super(message);
  }

  public CorruptDataException(String message, Throwable cause) {
    super(message, cause);
  }

  public CorruptDataException(Throwable cause) {
    super(cause);
  }
}
