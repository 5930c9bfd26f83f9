package com.wordgrid.application;

import com.wordgrid.application.port.WordSource;
import com.wordgrid.domain.Grid;
import com.wordgrid.domain.GridSearch;
import com.wordgrid.domain.PrefixIndex;
import com.wordgrid.domain.SolveResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Solves letter grids against the configured dictionary.
 *
 * <p>The {@link PrefixIndex} is built once, on first use, from the {@link WordSource}. Candidates
 * are trimmed, dropped unless their length lies within [minWordLength, maxWordLength], and
 * upper-cased (Locale.ROOT) before insertion. After that the index is only read, so concurrent
 * solves share it without locking; each solve gets its own {@link GridSearch}.
 */
@Service
public class SolverService {
  private static final Logger log = LoggerFactory.getLogger(SolverService.class);

  private final WordSource source;
  private final int minWordLength;
  private final int maxWordLength;
  private final int resultLimit;
  private final Object lock = new Object();

  private volatile PrefixIndex index;

  public SolverService(
      WordSource source,
      @Value("${wordgrid.min-word-length:3}") int minWordLength,
      @Value("${wordgrid.max-word-length:16}") int maxWordLength,
      @Value("${wordgrid.result-limit:6}") int resultLimit) {
    if (minWordLength < 1 || maxWordLength < minWordLength) {
      throw new IllegalArgumentException(
          "Invalid word length bounds [" + minWordLength + ", " + maxWordLength + "]");
    }
    if (resultLimit < 0) {
      throw new IllegalArgumentException("Result limit must not be negative");
    }
    this.source = source;
    this.minWordLength = minWordLength;
    this.maxWordLength = maxWordLength;
    this.resultLimit = resultLimit;
  }

  /**
   * Find all dictionary words on the grid spelled by {@code rows}.
   *
   * <p>Rows are trimmed and upper-cased; every cell must be a letter and all rows must have the
   * same length.
   *
   * @param rows grid rows, top to bottom
   * @return distinct word count and the longest words, at most {@link #resultLimit()}
   * @throws IllegalArgumentException if the grid is empty, ragged or contains a non-letter
   * @throws DictionaryLoadException if the dictionary cannot be loaded
   */
  public SolveResult solve(List<String> rows) {
    Grid grid = Grid.of(normalizeRows(rows));
    PrefixIndex idx = index();
    long t0 = System.nanoTime();
    SolveResult result = new GridSearch(grid, idx).solve(resultLimit);
    log.debug(
        "Solved {}x{} grid {}: {} words ({} us)",
        grid.rows(),
        grid.cols(),
        grid,
        result.totalCount(),
        (System.nanoTime() - t0) / 1_000);
    return result;
  }

  /**
   * Return the dictionary index, building it on first call.
   *
   * @throws DictionaryLoadException if the word source fails
   */
  PrefixIndex index() {
    PrefixIndex idx = index;
    if (idx == null) {
      synchronized (lock) {
        idx = index;
        if (idx == null) {
          idx = buildIndex();
          index = idx;
        }
      }
    }
    return idx;
  }

  public int resultLimit() {
    return resultLimit;
  }

  public int minWordLength() {
    return minWordLength;
  }

  public int maxWordLength() {
    return maxWordLength;
  }

  private PrefixIndex buildIndex() {
    long t0 = System.nanoTime();
    List<String> candidates = source.words();
    PrefixIndex idx = new PrefixIndex();
    int skipped = 0;
    for (String line : candidates) {
      String w = line == null ? "" : line.trim();
      if (w.length() < minWordLength || w.length() > maxWordLength) {
        skipped++;
        continue;
      }
      idx.insert(w.toUpperCase(Locale.ROOT));
    }
    long ms = (System.nanoTime() - t0) / 1_000_000;
    log.info(
        "Dictionary ready from {}: {} words indexed, {} skipped ({} ms).",
        source.describe(),
        idx.size(),
        skipped,
        ms);
    return idx;
  }

  private static List<String> normalizeRows(List<String> rows) {
    if (rows == null || rows.isEmpty()) {
      throw new IllegalArgumentException("Grid needs at least one row");
    }
    List<String> out = new ArrayList<>(rows.size());
    for (String row : rows) {
      String r = row == null ? "" : row.trim().toUpperCase(Locale.ROOT);
      for (int i = 0; i < r.length(); i++) {
        if (!Character.isLetter(r.charAt(i))) {
          throw new IllegalArgumentException("Invalid grid cell '" + r.charAt(i) + "' in " + row);
        }
      }
      out.add(r);
    }
    return out;
  }
}
