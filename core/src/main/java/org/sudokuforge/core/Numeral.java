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
package org.sudokuforge.core;

import static com.google.common.base.Preconditions.checkArgument;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The contents of a filled cell, 1 through 9.  Interned: there is one instance
 * per digit, so identity comparison is enough.
 */
@Immutable
public final class Numeral {
  /** How many digits there are. */
  public static final int COUNT = 9;

  /** The digit itself. */
  public final int number;

  private static final Numeral[] DIGITS = new Numeral[COUNT + 1];
  static {
    for (int n = 1; n <= COUNT; ++n)
      DIGITS[n] = new Numeral(n);
  }

  private Numeral(int number) {
    this.number = number;
  }

  /**
   * Returns the numeral for the given digit.
   *
   * @throws IllegalArgumentException if the digit isn't in 1..9
   */
  public static Numeral of(int number) {
    checkArgument(number >= 1 && number <= COUNT, "numeral out of range: %s", number);
    return DIGITS[number];
  }

  /** Maps an empty cell's 0 to null, anything else through {@link #of}. */
  @Nullable static Numeral numeral(int number) {
    return number == 0 ? null : of(number);
  }

  @Override public String toString() {
    return Integer.toString(number);
  }
}
