package io.ptychotools.patterns.processor;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import java.util.Arrays;

/// Thrown when a batch of frames does not have the shape a processor was built for.
public class PatternDimensionException extends RuntimeException {

  public PatternDimensionException(String message) {
    super(message);
  }

  public PatternDimensionException(String message, int[] shape) {
    super(message + " (shape=" + Arrays.toString(shape) + ")");
  }
}
