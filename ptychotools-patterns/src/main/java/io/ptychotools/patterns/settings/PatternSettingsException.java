package io.ptychotools.patterns.settings;

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


/// Thrown when a settings file cannot be parsed or holds a value of the wrong type.
public class PatternSettingsException extends RuntimeException {

  public PatternSettingsException(String message) {
    super(message);
  }

  public PatternSettingsException(String message, Throwable cause) {
    super(message, cause);
  }
}
