package com.wordgrid.interfaces.rest;

import com.wordgrid.application.SolverService;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final SolverService solver;
  private final int boardRows;
  private final int boardCols;

  public ConfigController(
      SolverService solver,
      @Value("${wordgrid.board-rows:4}") int boardRows,
      @Value("${wordgrid.board-cols:4}") int boardCols) {
    this.solver = solver;
    this.boardRows = boardRows;
    this.boardCols = boardCols;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    return Map.of(
        "minWordLength", solver.minWordLength(),
        "maxWordLength", solver.maxWordLength(),
        "resultLimit", solver.resultLimit(),
        "boardRows", boardRows,
        "boardCols", boardCols,
        "protocolVersion", 1);
  }
}
