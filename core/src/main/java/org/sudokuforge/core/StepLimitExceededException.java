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

/**
 * Thrown by a solver built with {@link Solver#withMaxSteps} when its search
 * uses up the step budget before finishing.
 */
public class StepLimitExceededException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final long numSteps;

  public StepLimitExceededException(long numSteps) {
    super("Search abandoned after " + numSteps + " steps");
    this.numSteps = numSteps;
  }

  public long getNumSteps() {
    return numSteps;
  }
}
