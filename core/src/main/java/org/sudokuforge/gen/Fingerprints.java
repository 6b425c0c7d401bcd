/*
Copyright 2026 The Sudokuforge Authors

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package org.sudokuforge.gen;

import static com.google.common.base.Preconditions.checkArgument;

import org.sudokuforge.core.Grid;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Computes solution fingerprints: the lowercase hex SHA-256 digest of a
 * completed grid's 81 digits, concatenated in row-major order.  Callers
 * persist and compare these, so the algorithm must not change.
 */
public final class Fingerprints {
  private Fingerprints() {}

  public static String of(Grid grid) {
    checkArgument(grid.isComplete(), "only completed grids have fingerprints");
    return Hashing.sha256().hashString(grid.toFlatString(), StandardCharsets.UTF_8).toString();
  }
}
