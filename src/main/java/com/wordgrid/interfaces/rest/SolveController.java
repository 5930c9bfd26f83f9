package com.wordgrid.interfaces.rest;

import com.wordgrid.application.DictionaryLoadException;
import com.wordgrid.application.SolverService;
import com.wordgrid.dto.ErrorMessage;
import com.wordgrid.dto.SolveRequest;
import com.wordgrid.dto.SolveResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SolveController {
  private static final Logger log = LoggerFactory.getLogger(SolveController.class);

  private final SolverService solver;

  public SolveController(SolverService solver) {
    this.solver = solver;
  }

  @PostMapping("/solve")
  public SolveResponse solve(@Valid @RequestBody SolveRequest req) {
    return SolveResponse.of(solver.solve(req.rows()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onBadGrid(IllegalArgumentException e) {
    return new ErrorMessage(e.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onInvalid(MethodArgumentNotValidException e) {
    return new ErrorMessage("Request must contain at least one non-blank row");
  }

  @ExceptionHandler(DictionaryLoadException.class)
  @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
  public ErrorMessage onDictionary(DictionaryLoadException e) {
    log.error("Dictionary unavailable: {}", e.getMessage());
    return new ErrorMessage("Dictionary unavailable");
  }
}
