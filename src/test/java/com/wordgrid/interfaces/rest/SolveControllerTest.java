package com.wordgrid.interfaces.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.wordgrid.application.DictionaryLoadException;
import com.wordgrid.application.SolverService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class SolveControllerTest {
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    SolverService solver = new SolverService(() -> List.of("sea", "spur", "sue", "use"), 3, 16, 6);
    mvc =
        MockMvcBuilders.standaloneSetup(new SolveController(solver), new ConfigController(solver, 4, 4))
            .build();
  }

  @Test
  void solvesGrid() throws Exception {
    mvc.perform(
            post("/solve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rows\":[\"srps\",\"euim\",\"eahw\",\"wdzr\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.type").value("solve_result"))
        .andExpect(jsonPath("$.totalCount").value(4))
        .andExpect(jsonPath("$.longest[0]").value("SPUR"))
        .andExpect(jsonPath("$.longest.length()").value(4));
  }

  @Test
  void acceptsNonSquareGrids() throws Exception {
    mvc.perform(
            post("/solve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rows\":[\"sea\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalCount").value(1));
  }

  @Test
  void raggedGridIsBadRequest() throws Exception {
    mvc.perform(
            post("/solve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rows\":[\"srps\",\"eui\"]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("error"));
  }

  @Test
  void emptyRowListIsBadRequest() throws Exception {
    mvc.perform(post("/solve").contentType(MediaType.APPLICATION_JSON).content("{\"rows\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("error"));
  }

  @Test
  void blankRowIsBadRequest() throws Exception {
    mvc.perform(post("/solve").contentType(MediaType.APPLICATION_JSON).content("{\"rows\":[\" \"]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("error"));
  }

  @Test
  void dictionaryFailureIsUnavailable() throws Exception {
    SolverService broken =
        new SolverService(
            () -> {
              throw new DictionaryLoadException("Dictionary file not found: words.txt");
            },
            3,
            16,
            6);
    MockMvc brokenMvc = MockMvcBuilders.standaloneSetup(new SolveController(broken)).build();

    brokenMvc
        .perform(
            post("/solve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rows\":[\"abcd\"]}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.message").value("Dictionary unavailable"));
  }

  @Test
  void reportsConfig() throws Exception {
    mvc.perform(get("/config"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.minWordLength").value(3))
        .andExpect(jsonPath("$.maxWordLength").value(16))
        .andExpect(jsonPath("$.resultLimit").value(6))
        .andExpect(jsonPath("$.boardRows").value(4));
  }
}
