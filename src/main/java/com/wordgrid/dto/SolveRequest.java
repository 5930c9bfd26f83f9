package com.wordgrid.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record SolveRequest(@NotEmpty List<@NotBlank String> rows) {}
