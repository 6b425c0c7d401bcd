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
package org.sudokuforge.json;

import org.sudokuforge.core.Grid;
import org.sudokuforge.core.Location;
import org.sudokuforge.gen.Fingerprints;
import org.sudokuforge.gen.PuzzleResult;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/**
 * Converts grids and puzzle results to and from json.
 *
 * <p> A grid is an array of nine rows, row 0 first, each an array of nine
 * cells, column 0 first; a cell is a number from 1 to 9 or null.  A puzzle
 * result is an object with "seed", "puzzle", "solution" and "solutionHash"
 * members.  Reading a result checks that the solution is solved, that the
 * puzzle's givens agree with it, and that the hash is its fingerprint.
 */
public class GridJson {

  /**
   * Registers type adapters in the given builder so that grids and puzzle
   * results can be serialized and deserialized.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    builder.registerTypeAdapter(Grid.class, GRID_ADAPTER.nullSafe());
    builder.registerTypeAdapter(PuzzleResult.class, RESULT_ADAPTER.nullSafe());
    return builder;
  }

  public static String toJson(Grid grid) {
    return GSON.toJson(grid, Grid.class);
  }

  public static Grid toGrid(String json) {
    return GSON.fromJson(json, Grid.class);
  }

  public static String toJson(PuzzleResult result) {
    return GSON.toJson(result, PuzzleResult.class);
  }

  public static PuzzleResult toPuzzleResult(String json) {
    return GSON.fromJson(json, PuzzleResult.class);
  }

  private static final TypeAdapter<Grid> GRID_ADAPTER = new TypeAdapter<Grid>() {
    @Override public void write(JsonWriter out, Grid grid) throws IOException {
      Integer[][] rows = grid.toRows();
      out.beginArray();
      for (Integer[] row : rows) {
        out.beginArray();
        for (Integer cell : row)
          out.value(cell);
        out.endArray();
      }
      out.endArray();
    }

    @Override public Grid read(JsonReader in) throws IOException {
      int[] cells = new int[Location.COUNT];
      int r = 0;
      in.beginArray();
      while (in.hasNext()) {
        if (r == 9) throw new JsonSyntaxException("More than 9 rows at " + in.getPath());
        int c = 0;
        in.beginArray();
        while (in.hasNext()) {
          if (c == 9) throw new JsonSyntaxException("More than 9 cells at " + in.getPath());
          cells[r * 9 + c++] = readCell(in);
        }
        in.endArray();
        if (c != 9) throw new JsonSyntaxException("Expected 9 cells in row " + r + ", got " + c);
        ++r;
      }
      in.endArray();
      if (r != 9) throw new JsonSyntaxException("Expected 9 rows, got " + r);
      return Grid.fromArray(cells);
    }

    private int readCell(JsonReader in) throws IOException {
      JsonToken token = in.peek();
      if (token == JsonToken.NULL) {
        in.nextNull();
        return 0;
      }
      if (token != JsonToken.NUMBER)
        throw new JsonSyntaxException("Expected a number or null at " + in.getPath());
      String path = in.getPath();
      double value = in.nextDouble();
      if (value != Math.rint(value) || value < 1 || value > 9)
        throw new JsonSyntaxException("Cell value out of range at " + path + ": " + value);
      return (int) value;
    }
  };

  private static final TypeAdapter<PuzzleResult> RESULT_ADAPTER = new TypeAdapter<PuzzleResult>() {
    @Override public void write(JsonWriter out, PuzzleResult value) throws IOException {
      out.beginObject();
      out.name("seed").value(value.seed);
      out.name("puzzle");
      GRID_ADAPTER.write(out, value.puzzle);
      out.name("solution");
      GRID_ADAPTER.write(out, value.solution);
      out.name("solutionHash").value(value.solutionHash);
      out.endObject();
    }

    @Override public PuzzleResult read(JsonReader in) throws IOException {
      String seed = null, solutionHash = null;
      Grid puzzle = null, solution = null;
      in.beginObject();
      while (in.hasNext()) {
        String name = in.nextName();
        if (name.equals("seed")) {
          seed = in.nextString();
        } else if (name.equals("puzzle")) {
          puzzle = GRID_ADAPTER.read(in);
        } else if (name.equals("solution")) {
          solution = GRID_ADAPTER.read(in);
        } else if (name.equals("solutionHash")) {
          solutionHash = in.nextString();
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      if (seed == null || puzzle == null || solution == null || solutionHash == null)
        throw new JsonSyntaxException("Incomplete puzzle result at " + in.getPath());
      checkConsistent(puzzle, solution, solutionHash);
      return new PuzzleResult(seed, puzzle, solution, solutionHash);
    }

    private void checkConsistent(Grid puzzle, Grid solution, String solutionHash) {
      if (!solution.isSolved())
        throw new JsonSyntaxException("Solution is not a solved grid");
      for (Location loc : Location.all()) {
        if (puzzle.containsKey(loc) && puzzle.get(loc) != solution.get(loc))
          throw new JsonSyntaxException("Puzzle disagrees with its solution at " + loc);
      }
      if (!Fingerprints.of(solution).equals(solutionHash))
        throw new JsonSyntaxException("solutionHash does not match the solution");
    }
  };

  /** A Gson instance with the adapters registered.  Must follow them. */
  public static final Gson GSON = register(new GsonBuilder()).create();
}
