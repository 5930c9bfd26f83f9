package com.wordgrid.dto;

import com.wordgrid.domain.SolveResult;
import java.util.List;

public record SolveResponse(String type, int totalCount, List<String> longest) {
  public static SolveResponse of(SolveResult r) {
    return new SolveResponse("solve_result", r.totalCount(), r.longest());
  }
}
