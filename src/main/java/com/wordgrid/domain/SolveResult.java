package com.wordgrid.domain;

import java.util.List;

/**
 * Outcome of one grid search.
 *
 * @param totalCount number of distinct words found, independent of the cap on {@code longest}
 * @param longest longest words first, ties in ascending alphabetical order
 */
public record SolveResult(int totalCount, List<String> longest) {
  public SolveResult {
    longest = List.copyOf(longest);
  }
}
