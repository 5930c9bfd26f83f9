package com.wordgrid.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds every indexed word that can be traced on a {@link Grid} through 8-way adjacent cells,
 * using each cell at most once per word.
 *
 * <p>A depth-first walk starts from every cell in row-major order and descends the
 * {@link PrefixIndex} in step with the path, so a path is abandoned as soon as no indexed word
 * begins with it. The walk shares one visited mask and one path buffer; both are restored on the
 * way back out of every cell.
 */
public final class GridSearch {
  public static final int DEFAULT_LIMIT = 6;

  /** Longer words first, then alphabetical. */
  public static final Comparator<String> RANKING =
      Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

  private final Grid grid;
  private final PrefixIndex index;

  public GridSearch(Grid grid, PrefixIndex index) {
    this.grid = grid;
    this.index = index;
  }

  public SolveResult solve() {
    return solve(DEFAULT_LIMIT);
  }

  /**
   * Run the search and rank what it found.
   *
   * @param limit maximum number of words in {@link SolveResult#longest()}
   * @return distinct word count and the {@code limit} longest words
   */
  public SolveResult solve(int limit) {
    Set<String> found = findWords();
    List<String> ranked = new ArrayList<>(found);
    ranked.sort(RANKING);
    return new SolveResult(found.size(), ranked.subList(0, Math.min(limit, ranked.size())));
  }

  /** @return every distinct word on the grid, unordered */
  public Set<String> findWords() {
    Walk walk = new Walk();
    for (int r = 0; r < grid.rows(); r++) {
      for (int c = 0; c < grid.cols(); c++) {
        walk.step(r, c, index.root());
      }
    }
    return walk.found;
  }

  /** Mutable state of one search: visited mask, current path and results. */
  private final class Walk {
    private final boolean[][] visited = new boolean[grid.rows()][grid.cols()];
    private final StringBuilder path = new StringBuilder();
    private final Set<String> found = new HashSet<>();

    void step(int r, int c, PrefixIndex.Node node) {
      if (!grid.contains(r, c) || visited[r][c]) return;

      char ch = grid.letterAt(r, c);
      PrefixIndex.Node next = index.childFor(node, ch);
      if (next == null) return;

      visited[r][c] = true;
      path.append(ch);
      try {
        if (index.isTerminal(next)) {
          found.add(path.toString());
        }
        for (int dr = -1; dr <= 1; dr++) {
          for (int dc = -1; dc <= 1; dc++) {
            if (dr != 0 || dc != 0) {
              step(r + dr, c + dc, next);
            }
          }
        }
      } finally {
        path.setLength(path.length() - 1);
        visited[r][c] = false;
      }
    }
  }
}
