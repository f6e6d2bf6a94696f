package io.ptychotools.api.services;

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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Names a [DiffractionFileReader] or [DiffractionFileWriter] implementation so it can be
/// looked up through [DiffractionFileIO].
///
/// ```
/// @FileFormat(simpleName = "NPZ", displayName = "NumPy Zipped Archive (*.npz)", extensions = {".npz"})
/// public class NpzDiffractionFileReader implements DiffractionFileReader { ... }
/// ```
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface FileFormat {

  /// @return the short name used in settings files and on the command line
  String simpleName();

  /// @return the name shown in file dialogs and listings
  String displayName();

  /// @return file name extensions including the dot
  String[] extensions() default {};
}
