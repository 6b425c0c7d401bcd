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

import static org.junit.Assert.assertEquals;

import org.sudokuforge.core.Grid;

import org.junit.Test;

public class FingerprintsTest {

  @Test public void sha256OfDigits() {
    Grid grid = Grid.fromString(
        "123456789456789123789123456214365897365897214897214365531642978642978531978531642");
    assertEquals("e46b6f4b27f05a939da67d26a5c0c5f6b4b6fb5f980091ee39a3d24212f7f090",
                 Fingerprints.of(grid));
  }

  @Test(expected = IllegalArgumentException.class) public void incompleteGrid() {
    Fingerprints.of(Grid.BLANK);
  }
}
