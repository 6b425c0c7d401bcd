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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;

/**
 * The difficulty tiers a puzzle can be generated at.  Each one sets the number
 * of given cells the generator aims for: fewer givens, harder puzzle.
 */
public enum Difficulty {
  EASY(40),
  MEDIUM(32),
  HARD(26),
  EXPERT(22);

  private final int givens;

  private Difficulty(int givens) {
    this.givens = givens;
  }

  /**
   * The target number of givens.  Generation never goes below it, and may stop
   * above it when no further cell can be removed while keeping the solution
   * unique.
   */
  public int givens() {
    return givens;
  }

  /**
   * Returns the difficulty whose name is given, ignoring case.
   *
   * @throws IllegalArgumentException   if the name doesn't match a Difficulty
   */
  public static Difficulty fromName(String name) {
    String key = checkNotNull(name).toUpperCase(Locale.ROOT);
    checkArgument(names.containsKey(key), "No difficulty named %s", name);
    return names.get(key);
  }

  private static final ImmutableMap<String, Difficulty> names;
  static {
    ImmutableMap.Builder<String, Difficulty> builder = ImmutableMap.builder();
    for (Difficulty d : values())
      builder.put(d.name(), d);
    names = builder.build();
  }
}
