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


/// Thrown when crop, binning or padding parameters cannot be applied to a detector frame, or
/// when a processor does not fit the buffer it should fill.
public class PatternConfigurationException extends RuntimeException {

  public PatternConfigurationException(String message) {
    super(message);
  }
}
