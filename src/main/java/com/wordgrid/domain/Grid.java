package com.wordgrid.domain;

import java.util.List;

/** Immutable rectangular grid of letters. */
public final class Grid {
  private final char[][] cells;
  private final int rows;
  private final int cols;

  private Grid(char[][] cells) {
    this.cells = cells;
    this.rows = cells.length;
    this.cols = cells[0].length;
  }

  /**
   * Build a grid from its rows, one string per row.
   *
   * @throws IllegalArgumentException if there are no rows, a row is empty, or rows differ in length
   */
  public static Grid of(List<String> rows) {
    if (rows == null || rows.isEmpty()) {
      throw new IllegalArgumentException("Grid needs at least one row");
    }
    int width = rows.get(0).length();
    if (width == 0) {
      throw new IllegalArgumentException("Grid rows must not be empty");
    }
    char[][] cells = new char[rows.size()][];
    for (int r = 0; r < rows.size(); r++) {
      String row = rows.get(r);
      if (row.length() != width) {
        throw new IllegalArgumentException(
            "Row " + (r + 1) + " has " + row.length() + " letters, expected " + width);
      }
      cells[r] = row.toCharArray();
    }
    return new Grid(cells);
  }

  public int rows() {
    return rows;
  }

  public int cols() {
    return cols;
  }

  public boolean contains(int r, int c) {
    return r >= 0 && r < rows && c >= 0 && c < cols;
  }

  public char letterAt(int r, int c) {
    return cells[r][c];
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (char[] row : cells) {
      if (sb.length() > 0) sb.append('/');
      sb.append(row);
    }
    return sb.toString();
  }
}
