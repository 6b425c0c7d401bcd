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

import java.util.Random;

/**
 * A small, fast, deterministic random source: the "mulberry32" generator,
 * whose whole state is one 32-bit integer.  The same seed always yields the
 * same sequence, and nothing outside the state influences it.
 *
 * <p> This extends {@link Random} so it can be handed to anything that takes
 * one, such as {@link java.util.Collections#shuffle(java.util.List, Random)}.
 * {@link #nextDouble} and {@link #nextInt(int)} each consume exactly one draw.
 * Instances are not thread-safe and must not be shared between generations.
 */
public final class Mulberry32 extends Random {
  private static final long serialVersionUID = 1L;

  private int state;

  public Mulberry32(int seed) {
    super(0L);
    this.state = seed;
  }

  /**
   * Returns a generator for the given seed text.  The text is hashed with the
   * rolling "31 * h + c" hash over its UTF-16 chars, wrapped to 32 bits, which
   * is exactly {@link String#hashCode}.
   */
  public static Mulberry32 forSeed(String seed) {
    return new Mulberry32(checkNotNull(seed).hashCode());
  }

  /** Returns the next draw as an unsigned value held in an int. */
  private int nextBits() {
    int t = state += 0x6D2B79F5;
    t = (t ^ (t >>> 15)) * (t | 1);
    t ^= t + (t ^ (t >>> 7)) * (t | 61);
    return t ^ (t >>> 14);
  }

  /** Returns a value in [0, 1). */
  @Override public double nextDouble() {
    return (nextBits() & 0xFFFFFFFFL) / 4294967296.0;
  }

  /** Returns a value in [0, bound), scaled from a single draw. */
  @Override public int nextInt(int bound) {
    checkArgument(bound > 0, "bound must be positive: %s", bound);
    return (int) (nextDouble() * bound);
  }

  @Override protected int next(int bits) {
    return nextBits() >>> (32 - bits);
  }

  /** Sets the state to the low 32 bits of the given seed. */
  @Override public synchronized void setSeed(long seed) {
    // Also called by Random's constructor, before our own runs.
    this.state = (int) seed;
  }
}
