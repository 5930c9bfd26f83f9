package com.wordgrid;

import static org.assertj.core.api.Assertions.assertThat;

import com.wordgrid.application.SolverService;
import com.wordgrid.application.port.WordSource;
import com.wordgrid.infrastructure.FileWordSource;
import com.wordgrid.interfaces.cli.SolveCommandRunner;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.NONE,
    args = {"srps", "euim", "eahw", "wdzr"},
    properties = "wordgrid.dictionary.path=src/test/resources/test-words.txt")
class WordGridApplicationTests {
  @Autowired SolverService solver;
  @Autowired WordSource source;
  @Autowired SolveCommandRunner runner;

  @Test
  void wiresFileDictionaryAndCommandRunner() {
    assertThat(source).isInstanceOf(FileWordSource.class);
    assertThat(runner.getExitCode()).isZero();
    assertThat(solver.resultLimit()).isEqualTo(6);
  }

  @Test
  void solvesWithConfiguredDictionary() {
    assertThat(solver.solve(List.of("srps", "euim", "eahw", "wdzr")).longest())
        .containsExactly("SPUR", "SEA", "SUE", "USE");
  }
}
