package com.wordgrid.interfaces.cli;

import com.wordgrid.application.DictionaryLoadException;
import com.wordgrid.application.SolverService;
import com.wordgrid.domain.SolveResult;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnNotWebApplication;
import org.springframework.stereotype.Component;

/**
 * Command-line entry: solves the board given as positional arguments, one row per argument.
 *
 * <p>Exit codes: 0 on success, 1 if the dictionary cannot be loaded, 2 on malformed arguments. In
 * both failure cases nothing is searched and only stderr is written.
 */
@Component
@ConditionalOnNotWebApplication
public class SolveCommandRunner implements ApplicationRunner, ExitCodeGenerator {
  static final int EXIT_DICTIONARY = 1;
  static final int EXIT_USAGE = 2;

  private final SolverService solver;
  private final int boardRows;
  private final int boardCols;
  private final PrintStream out;
  private final PrintStream err;

  private int exitCode;

  @Autowired
  public SolveCommandRunner(
      SolverService solver,
      @Value("${wordgrid.board-rows:4}") int boardRows,
      @Value("${wordgrid.board-cols:4}") int boardCols) {
    this(solver, boardRows, boardCols, System.out, System.err);
  }

  SolveCommandRunner(
      SolverService solver, int boardRows, int boardCols, PrintStream out, PrintStream err) {
    this.solver = solver;
    this.boardRows = boardRows;
    this.boardCols = boardCols;
    this.out = out;
    this.err = err;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    if (positional.size() != boardRows) {
      printUsage();
      exitCode = EXIT_USAGE;
      return;
    }
    // Upper-casing can lengthen a row (ß -> SS), so check the shape afterwards
    List<String> rows = new ArrayList<>(positional.size());
    for (String arg : positional) {
      String row = arg.toUpperCase(Locale.ROOT);
      if (row.length() != boardCols || !row.chars().allMatch(Character::isLetter)) {
        rejectRow();
        return;
      }
      rows.add(row);
    }

    SolveResult result;
    try {
      result = solver.solve(rows);
    } catch (IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      exitCode = EXIT_USAGE;
      return;
    } catch (DictionaryLoadException e) {
      err.println("Error loading dictionary: " + e.getMessage());
      exitCode = EXIT_DICTIONARY;
      return;
    }
    out.println("Total words found: " + result.totalCount());
    out.println("Longest " + solver.resultLimit() + " words: " + result.longest());
    exitCode = 0;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private void rejectRow() {
    err.println("Error: Each argument must be exactly " + boardCols + " letters long.");
    exitCode = EXIT_USAGE;
  }

  private void printUsage() {
    StringBuilder rowsHint = new StringBuilder();
    for (int i = 1; i <= boardRows; i++) {
      rowsHint.append(" <row").append(i).append('>');
    }
    err.println("Usage: wordgrid" + rowsHint);
    err.println("Each row is exactly " + boardCols + " letters, case-insensitive.");
    err.println("Example: wordgrid srps euim eahw wdzr");
  }
}
